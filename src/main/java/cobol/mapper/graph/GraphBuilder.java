package cobol.mapper.graph;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import cobol.mapper.analysis.AnalysisResult;
import cobol.mapper.config.AnalyzerConfig;
import cobol.mapper.config.NamingRules;
import cobol.mapper.model.CallEdge;
import cobol.mapper.model.EdgeKind;
import cobol.mapper.model.ExitRecord;
import cobol.mapper.model.Paragraph;

/**
 * Maps an analysis result to a styled graph model.
 * <p>
 * Node category, first match wins: entry point, anomaly, shared routine, function key, default.
 */
public final class GraphBuilder {

    private final NamingRules rules;

    public GraphBuilder(AnalyzerConfig config) {
        this.rules = Objects.requireNonNull(config, "config").namingRules();
    }

    public GraphModel build(AnalysisResult result) {
        Objects.requireNonNull(result, "result");

        final List<GraphNode> nodes = new ArrayList<>();
        for (Paragraph p : result.structure().paragraphs()) {
            nodes.add(new GraphNode(p.name(), p.name(), categorize(p.name(), result.isEntryPoint(p.name()))));
        }

        // One exit node per (kind, identifier), first-seen order
        final Map<String, GraphNode> exitNodes = new LinkedHashMap<>();
        for (ExitRecord x : result.exits()) {
            exitNodes.computeIfAbsent(x.exitNodeId(), id -> new GraphNode(id, exitLabel(x), NodeStyle.EXIT));
        }
        nodes.addAll(exitNodes.values());

        final List<GraphEdge> edges = new ArrayList<>();
        for (Paragraph p : result.structure().paragraphs()) {
            final List<CallEdge> calls = result.edgesFrom(p.name());
            final List<ExitRecord> exits = result.exitsOf(p.name());

            // Merge by statement position in the paragraph body
            int c = 0;
            int x = 0;
            while (c < calls.size() || x < exits.size()) {
                final boolean takeCall = x >= exits.size()
                        || (c < calls.size() && calls.get(c).position() < exits.get(x).position());
                if (takeCall) {
                    edges.add(toEdge(calls.get(c++)));
                } else {
                    final ExitRecord exit = exits.get(x++);
                    edges.add(new GraphEdge(exit.paragraph(), exit.exitNodeId(), exit.form(), EdgeStyle.HEAVY_COLORED));
                }
            }
        }

        return new GraphModel(result.structure().programId(), nodes, edges);
    }

    NodeStyle categorize(String name, boolean entryPoint) {
        if (entryPoint) return NodeStyle.ENTRY;
        if (rules.isAnomaly(name)) return NodeStyle.ANOMALY;
        if (rules.isShared(name)) return NodeStyle.SHARED;
        if (rules.isKeyed(name)) return NodeStyle.KEYED;
        return NodeStyle.DEFAULT;
    }

    private static GraphEdge toEdge(CallEdge e) {
        if (e.kind() == EdgeKind.PERFORM_THRU) {
            return new GraphEdge(e.source(), e.target(), e.kind().label() + " " + e.terminal(), EdgeStyle.SOLID_HEAVY);
        }
        final EdgeStyle style = e.kind() == EdgeKind.GO_TO ? EdgeStyle.DASHED : EdgeStyle.SOLID;
        return new GraphEdge(e.source(), e.target(), e.kind().label(), style);
    }

    private static String exitLabel(ExitRecord x) {
        return x.identifier() == null ? x.kind().label() : x.kind().label() + " " + x.identifier();
    }
}
