package cobol.mapper.graph;

import java.util.Objects;

/**
 * Writes a graph model as Graphviz DOT.
 * <p>
 * Only three statement forms are produced: the {@code digraph} header, node statements and
 * edge statements. Every attribute is set on its own statement, so the output carries no
 * graph-level defaults.
 */
public final class DotSerializer {

    private static final String FONT = "Arial";

    private DotSerializer() {
    }

    public static String serialize(GraphModel graph) {
        Objects.requireNonNull(graph, "graph");

        final StringBuilder sb = new StringBuilder(256 + 96 * (graph.nodes().size() + graph.edges().size()));
        sb.append("digraph ").append(quote(graph.name())).append(" {\n");

        for (GraphNode n : graph.nodes()) {
            final NodeStyle s = n.style();
            sb.append("  ").append(quote(n.id())).append(" [")
                    .append("label=").append(quote(n.label()))
                    .append(", shape=").append(s.shape())
                    .append(", style=").append(quote(s.style()))
                    .append(", fillcolor=").append(quote(s.fillColor()));
            if (s.color() != null) {
                sb.append(", color=").append(quote(s.color()));
            }
            if (s.penWidth() != null) {
                sb.append(", penwidth=").append(s.penWidth());
            }
            sb.append(", fontname=").append(quote(FONT)).append("];\n");
        }

        for (GraphEdge e : graph.edges()) {
            final EdgeStyle s = e.style();
            sb.append("  ").append(quote(e.from())).append(" -> ").append(quote(e.to())).append(" [")
                    .append("label=").append(quote(e.label()))
                    .append(", style=").append(quote(s.style()))
                    .append(", color=").append(quote(s.color()));
            if (s.penWidth() != null) {
                sb.append(", penwidth=").append(s.penWidth());
            }
            sb.append(", fontname=").append(quote(FONT)).append("];\n");
        }

        sb.append("}\n");
        return sb.toString();
    }

    static String quote(String s) {
        final StringBuilder sb = new StringBuilder(s.length() + 2).append('"');
        for (int i = 0; i < s.length(); i++) {
            final char c = s.charAt(i);
            if (c == '"' || c == '\\') {
                sb.append('\\');
            }
            if (c == '\n' || c == '\r') {
                sb.append(' ');
                continue;
            }
            sb.append(c);
        }
        return sb.append('"').toString();
    }
}
