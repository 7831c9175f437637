package ai.prettylayout.token;

public enum EndToken implements Token {
    INSTANCE
}
