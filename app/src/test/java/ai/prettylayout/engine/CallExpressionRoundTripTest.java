package ai.prettylayout.engine;

import static org.assertj.core.api.Assertions.assertThat;

import ai.prettylayout.document.Document;
import ai.prettylayout.document.DocumentBuilder;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

/**
 * Lays out call expressions the way a source formatter would, then parses the output back and checks that
 * the tree survived and that a second pass changes nothing.
 */
class CallExpressionRoundTripTest {

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "f()|10",
            "f(a, b)|10",
            "compute(first, second(x, y), third)|20",
            "outer(inner(deep(one, two, three), four), five, six(seven))|24",
            "outer(inner(deep(one, two, three), four), five, six(seven))|80",
            "builder(alpha(beta(gamma(delta(epsilon)))))|16"
    })
    void formattedOutputParsesBackToTheSameCall(String source, int width) {
        Call call = new CallParser(source).parse();
        LayoutEngine engine = new LayoutEngine(LayoutOptions.ofWidth(width));

        String first = engine.render(toDocument(call));
        Call reparsed = new CallParser(first).parse();
        String second = engine.render(toDocument(reparsed));

        assertThat(reparsed).isEqualTo(call);
        assertThat(second).isEqualTo(first);
    }

    private static Document toDocument(Call call) {
        DocumentBuilder builder = new DocumentBuilder();
        print(builder, call);
        return builder.build();
    }

    private static void print(DocumentBuilder builder, Call call) {
        if (call.bare()) {
            builder.word(call.name());
            return;
        }
        if (call.arguments().isEmpty()) {
            builder.word(call.name() + "()");
            return;
        }
        builder.word(call.name() + "(").cbox().zerobreak();
        for (int i = 0; i < call.arguments().size(); i++) {
            print(builder, call.arguments().get(i));
            builder.trailingComma(i == call.arguments().size() - 1);
        }
        builder.offset(-builder.indentUnit()).end().word(")");
    }

    /**
     * A call without arguments doubles as a plain identifier when written without parentheses.
     */
    private record Call(String name, List<Call> arguments, boolean bare) {
    }

    private static final class CallParser {
        private final String source;
        private int position;

        private CallParser(String source) {
            this.source = source;
        }

        Call parse() {
            Call call = call();
            skipWhitespace();
            if (position != source.length()) {
                throw new IllegalArgumentException("Trailing input at " + position + ": " + source);
            }
            return call;
        }

        private Call call() {
            skipWhitespace();
            int start = position;
            while (position < source.length() && Character.isLetterOrDigit(source.charAt(position))) {
                position++;
            }
            String name = source.substring(start, position);
            if (name.isEmpty()) {
                throw new IllegalArgumentException("Expected a name at " + position + ": " + source);
            }
            skipWhitespace();
            if (position >= source.length() || source.charAt(position) != '(') {
                return new Call(name, List.of(), true);
            }
            position++;
            List<Call> arguments = new ArrayList<>();
            skipWhitespace();
            while (source.charAt(position) != ')') {
                arguments.add(call());
                skipWhitespace();
                if (source.charAt(position) == ',') {
                    position++;
                    skipWhitespace();
                }
            }
            position++;
            return new Call(name, arguments, false);
        }

        private void skipWhitespace() {
            while (position < source.length() && Character.isWhitespace(source.charAt(position))) {
                position++;
            }
        }
    }
}
