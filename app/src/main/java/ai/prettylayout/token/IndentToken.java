package ai.prettylayout.token;

/**
 * Opens an indentation scope of {@code columns} columns, closed by {@link DedentToken}.
 */
public record IndentToken(int columns) implements Token {
}
