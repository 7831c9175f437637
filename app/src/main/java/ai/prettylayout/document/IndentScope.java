package ai.prettylayout.document;

import java.util.List;
import java.util.Objects;

/**
 * Indents every line started inside {@code body} by {@code levels} indent units, whether or not the
 * enclosing groups break. Levels may be negative; the rendered indentation never drops below zero.
 */
public record IndentScope(int levels, List<Doc> body) implements Doc {

    public IndentScope {
        body = List.copyOf(Objects.requireNonNull(body, "body"));
    }
}
