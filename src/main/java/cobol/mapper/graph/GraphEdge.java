package cobol.mapper.graph;

import java.util.Objects;

public record GraphEdge(
        String from,
        String to,
        String label,
        EdgeStyle style
) {
    public GraphEdge {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
        Objects.requireNonNull(label, "label");
        Objects.requireNonNull(style, "style");
    }
}
