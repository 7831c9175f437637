package ai.prettylayout.document;

import java.util.List;
import java.util.Objects;

/**
 * Nodes laid out together under one breaking discipline. {@code offset} is added to the indentation of lines
 * started inside the group when, and only when, the group does not fit on the current line.
 */
public record Group(Breaks breaks, int offset, List<Doc> children) implements Doc {

    public Group {
        Objects.requireNonNull(breaks, "breaks");
        children = List.copyOf(Objects.requireNonNull(children, "children"));
    }

    /**
     * A group without any break can never be split and is measured as a single unit.
     */
    public boolean isBreakable() {
        for (Doc child : children) {
            if (child instanceof Break) {
                return true;
            }
        }
        return false;
    }
}
