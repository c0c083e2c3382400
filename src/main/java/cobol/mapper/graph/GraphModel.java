package cobol.mapper.graph;

import java.util.List;
import java.util.Objects;

/**
 * Fully built graph of one unit, ready for serialization.
 * - nodes: paragraphs in table order, then exit nodes in first-seen order
 * - edges: discovery order
 */
public record GraphModel(
        String name,
        List<GraphNode> nodes,
        List<GraphEdge> edges
) {
    public GraphModel {
        Objects.requireNonNull(name, "name");
        nodes = List.copyOf(nodes);
        edges = List.copyOf(edges);
    }

    public GraphNode node(String id) {
        for (GraphNode n : nodes) {
            if (n.id().equals(id)) return n;
        }
        return null;
    }
}
