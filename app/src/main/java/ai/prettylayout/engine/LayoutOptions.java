package ai.prettylayout.engine;

import ai.prettylayout.token.Token;

/**
 * Immutable settings of a print job.
 *
 * @param maxWidth target line width in columns
 * @param indentUnit columns per indent level of an indent scope
 * @param minSpace columns every line is granted regardless of its indentation, 0 to always honor {@code maxWidth}
 * @param debugMarkers annotate group boundaries and breaks in the output
 * @param trailingNewline terminate non-empty output with a newline
 */
public record LayoutOptions(int maxWidth, int indentUnit, int minSpace, boolean debugMarkers,
                            boolean trailingNewline) {

    public static final int DEFAULT_MAX_WIDTH = 80;
    public static final int DEFAULT_INDENT_UNIT = 4;

    public LayoutOptions {
        if (maxWidth < 1 || maxWidth >= Token.SIZE_INFINITY) {
            throw new IllegalArgumentException("maxWidth must be between 1 and " + (Token.SIZE_INFINITY - 1));
        }
        if (indentUnit < 0) {
            throw new IllegalArgumentException("indentUnit must be zero or greater");
        }
        if (minSpace < 0 || minSpace > maxWidth) {
            throw new IllegalArgumentException("minSpace must be between 0 and maxWidth");
        }
    }

    public static LayoutOptions defaults() {
        return new LayoutOptions(DEFAULT_MAX_WIDTH, DEFAULT_INDENT_UNIT, 0, false, true);
    }

    public static LayoutOptions ofWidth(int maxWidth) {
        return defaults().withMaxWidth(maxWidth);
    }

    public LayoutOptions withMaxWidth(int value) {
        return new LayoutOptions(value, indentUnit, Math.min(minSpace, value), debugMarkers, trailingNewline);
    }

    public LayoutOptions withIndentUnit(int value) {
        return new LayoutOptions(maxWidth, value, minSpace, debugMarkers, trailingNewline);
    }

    public LayoutOptions withMinSpace(int value) {
        return new LayoutOptions(maxWidth, indentUnit, value, debugMarkers, trailingNewline);
    }

    public LayoutOptions withDebugMarkers(boolean value) {
        return new LayoutOptions(maxWidth, indentUnit, minSpace, value, trailingNewline);
    }

    public LayoutOptions withTrailingNewline(boolean value) {
        return new LayoutOptions(maxWidth, indentUnit, minSpace, debugMarkers, value);
    }
}
