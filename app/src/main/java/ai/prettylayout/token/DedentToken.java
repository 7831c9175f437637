package ai.prettylayout.token;

public enum DedentToken implements Token {
    INSTANCE
}
