package ai.prettylayout.notation;

/**
 * Syntax error in document notation, positioned at a 1-based line and column.
 */
public class NotationException extends RuntimeException {

    private final int line;
    private final int column;

    public NotationException(String message, int line, int column) {
        super(message + " at " + line + ":" + column);
        this.line = line;
        this.column = column;
    }

    public int line() {
        return line;
    }

    public int column() {
        return column;
    }
}
