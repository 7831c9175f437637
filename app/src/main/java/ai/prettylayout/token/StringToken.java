package ai.prettylayout.token;

import java.util.Objects;

public record StringToken(String text) implements Token {

    public StringToken {
        Objects.requireNonNull(text, "text");
    }

    public int width() {
        return text.codePointCount(0, text.length());
    }
}
