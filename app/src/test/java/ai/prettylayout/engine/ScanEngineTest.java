package ai.prettylayout.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ai.prettylayout.document.Breaks;
import ai.prettylayout.document.MalformedDocumentException;
import ai.prettylayout.token.BeginToken;
import ai.prettylayout.token.BreakToken;
import ai.prettylayout.token.IndentToken;
import ai.prettylayout.token.StringToken;
import org.junit.jupiter.api.Test;

class ScanEngineTest {

    private static final BreakToken SPACE = new BreakToken(0, 1, "", false, false, false);

    @Test
    void streamsTokensFedOneByOne() {
        ScanEngine engine = new ScanEngine(LayoutOptions.ofWidth(10).withTrailingNewline(false));
        engine.scanBegin(new BeginToken(2, Breaks.INCONSISTENT));
        engine.scanString(new StringToken("alpha"));
        engine.scanBreak(SPACE);
        engine.scanString(new StringToken("beta"));
        engine.scanBreak(SPACE);
        engine.scanString(new StringToken("gamma"));
        engine.scanEnd();

        LayoutResult result = engine.finish();

        assertThat(result.text()).isEqualTo("alpha beta\n  gamma");
        assertThat(result.tokens()).isEqualTo(7);
        assertThat(result.lineCount()).isEqualTo(2);
    }

    @Test
    void endWithoutBeginIsMalformed() {
        ScanEngine engine = new ScanEngine(LayoutOptions.defaults());

        assertThatThrownBy(engine::scanEnd)
                .isInstanceOf(MalformedDocumentException.class)
                .hasMessageContaining("without a matching group begin");
    }

    @Test
    void dedentWithoutIndentIsMalformed() {
        ScanEngine engine = new ScanEngine(LayoutOptions.defaults());

        assertThatThrownBy(engine::scanDedent).isInstanceOf(MalformedDocumentException.class);
    }

    @Test
    void unclosedGroupOrScopeIsMalformed() {
        ScanEngine openGroup = new ScanEngine(LayoutOptions.defaults());
        openGroup.scanBegin(new BeginToken(0, Breaks.CONSISTENT));
        openGroup.scanString(new StringToken("x"));

        ScanEngine openScope = new ScanEngine(LayoutOptions.defaults());
        openScope.scanIndent(new IndentToken(4));

        assertThatThrownBy(openGroup::finish)
                .isInstanceOf(MalformedDocumentException.class)
                .hasMessageContaining("group(s) still open");
        assertThatThrownBy(openScope::finish)
                .isInstanceOf(MalformedDocumentException.class)
                .hasMessageContaining("indent scope(s) still open");
    }

    @Test
    void finishedEngineRejectsFurtherTokens() {
        ScanEngine engine = new ScanEngine(LayoutOptions.defaults());
        engine.scanString(new StringToken("done"));
        engine.finish();

        assertThatThrownBy(() -> engine.scanString(new StringToken("more")))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(engine::finish).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void bufferUsageDoesNotGrowWithDocumentLength() {
        LayoutResult small = streamWords(200, 40);
        LayoutResult large = streamWords(20_000, 40);

        assertThat(large.tokens()).isGreaterThan(small.tokens() * 50);
        assertThat(large.peakBufferedTokens()).isLessThanOrEqualTo(120);
        assertThat(small.peakBufferedTokens()).isLessThanOrEqualTo(120);
        assertThat(large.peakScanDepth()).isLessThanOrEqualTo(120);
    }

    private static LayoutResult streamWords(int groups, int width) {
        ScanEngine engine = new ScanEngine(LayoutOptions.ofWidth(width));
        engine.scanBegin(new BeginToken(0, Breaks.INCONSISTENT));
        for (int i = 0; i < groups; i++) {
            engine.scanBegin(new BeginToken(4, Breaks.INCONSISTENT));
            engine.scanString(new StringToken("aa"));
            engine.scanBreak(SPACE);
            engine.scanString(new StringToken("bb"));
            engine.scanBreak(SPACE);
            engine.scanString(new StringToken("cc"));
            engine.scanEnd();
            engine.scanBreak(SPACE);
        }
        engine.scanEnd();
        return engine.finish();
    }
}
