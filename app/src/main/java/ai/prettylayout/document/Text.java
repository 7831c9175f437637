package ai.prettylayout.document;

import java.util.Objects;

/**
 * Opaque fragment emitted verbatim. Never contains a line terminator.
 */
public record Text(String value) implements Doc {

    public Text {
        Objects.requireNonNull(value, "value");
        if (value.indexOf('\n') >= 0 || value.indexOf('\r') >= 0) {
            throw new IllegalArgumentException("Text must not contain line terminators: " + value.strip());
        }
    }

    /**
     * Columns occupied by this fragment, counted in code points.
     */
    public int width() {
        return value.codePointCount(0, value.length());
    }
}
