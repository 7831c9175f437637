package ai.prettylayout.document;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Top-level node sequence of one print job. Immutable once built.
 */
public record Document(List<Doc> nodes) {

    public Document {
        nodes = List.copyOf(Objects.requireNonNull(nodes, "nodes"));
    }

    public static Document of(Doc... nodes) {
        return new Document(Arrays.asList(nodes));
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }
}
