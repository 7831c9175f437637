package ai.prettylayout.engine;

import ai.prettylayout.document.Document;
import ai.prettylayout.token.TokenLowering;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Renders documents to text within a target line width.
 *
 * <p>The engine holds only its immutable options; every call runs a fresh print job, so one instance can
 * be shared between threads.
 */
public class LayoutEngine {

    private static final Logger LOGGER = LoggerFactory.getLogger(LayoutEngine.class);

    private final LayoutOptions options;
    private final TokenLowering lowering;

    public LayoutEngine() {
        this(LayoutOptions.defaults());
    }

    public LayoutEngine(LayoutOptions options) {
        this.options = Objects.requireNonNull(options, "options");
        this.lowering = new TokenLowering(options.indentUnit());
    }

    public LayoutOptions options() {
        return options;
    }

    public String render(Document document) {
        return layout(document).text();
    }

    /**
     * Renders {@code document} and writes the text to {@code sink} once the whole job succeeded.
     */
    public void render(Document document, Appendable sink) {
        Objects.requireNonNull(sink, "sink");
        String text = render(document);
        try {
            sink.append(text);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to write rendered document", ex);
        }
    }

    public LayoutResult layout(Document document) {
        Objects.requireNonNull(document, "document");
        ScanEngine engine = new ScanEngine(options);
        lowering.lower(document, engine);
        LayoutResult result = engine.finish();
        if (options.trailingNewline() && !result.text().isEmpty() && !result.text().endsWith("\n")) {
            result = result.withText(result.text() + "\n");
        }
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("Laid out {} tokens into {} lines at width {} (peak buffer {}, peak scan depth {})",
                    result.tokens(), result.lineCount(), options.maxWidth(), result.peakBufferedTokens(),
                    result.peakScanDepth());
        }
        return result;
    }
}
