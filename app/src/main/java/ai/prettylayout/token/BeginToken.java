package ai.prettylayout.token;

import ai.prettylayout.document.Breaks;
import java.util.Objects;

public record BeginToken(int offset, Breaks breaks) implements Token {

    public BeginToken {
        Objects.requireNonNull(breaks, "breaks");
    }
}
