package ai.prettylayout.document;

/**
 * Rendering variants of a {@link Break}.
 */
public enum BreakKind {
    /** One space when flat. */
    SPACE(1),
    /** Nothing when flat. */
    NONE_IF_FLAT(0),
    /** Nothing when flat; leaves an empty line behind when taken. */
    BLANK(0),
    /** Always a newline. */
    HARD(0);

    private final int flatWidth;

    BreakKind(int flatWidth) {
        this.flatWidth = flatWidth;
    }

    public int flatWidth() {
        return flatWidth;
    }

    public static BreakKind from(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Break kind must be provided");
        }
        return switch (raw.trim().toLowerCase()) {
            case "space" -> SPACE;
            case "zero", "none-if-flat" -> NONE_IF_FLAT;
            case "blank" -> BLANK;
            case "hard" -> HARD;
            default -> throw new IllegalArgumentException("Unsupported break kind: " + raw);
        };
    }
}
