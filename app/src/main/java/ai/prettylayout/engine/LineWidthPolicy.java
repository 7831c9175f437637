package ai.prettylayout.engine;

/**
 * Tracks the columns left on the line being written.
 */
final class LineWidthPolicy {

    private final int maxWidth;
    private final int minSpace;
    private long space;

    LineWidthPolicy(int maxWidth, int minSpace) {
        this.maxWidth = maxWidth;
        this.minSpace = minSpace;
        this.space = maxWidth;
    }

    long remaining() {
        return space;
    }

    void consume(long columns) {
        space -= columns;
    }

    /**
     * Resets the budget for a new line starting at {@code indentation}.
     */
    void startLine(int indentation) {
        space = Math.max((long) maxWidth - indentation, minSpace);
    }
}
