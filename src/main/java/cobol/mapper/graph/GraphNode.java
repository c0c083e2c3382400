package cobol.mapper.graph;

import java.util.Objects;

public record GraphNode(
        String id,
        String label,
        NodeStyle style
) {
    public GraphNode {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(label, "label");
        Objects.requireNonNull(style, "style");
    }
}
