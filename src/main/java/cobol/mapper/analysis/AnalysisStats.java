package cobol.mapper.analysis;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

import cobol.mapper.model.EdgeKind;
import cobol.mapper.model.ExitKind;

/**
 * Aggregate counters of one unit. Every edge and exit kind has an entry, zero when absent.
 */
public record AnalysisStats(
        int paragraphs,
        Map<EdgeKind, Integer> edges,
        Map<ExitKind, Integer> exits,
        int suppressedPerforms,
        int unresolvedEdges,
        int interactions
) {
    public AnalysisStats {
        edges = complete(EdgeKind.class, edges);
        exits = complete(ExitKind.class, exits);
    }

    public int edgeCount(EdgeKind kind) {
        return edges.get(kind);
    }

    public int exitCount(ExitKind kind) {
        return exits.get(kind);
    }

    public int totalEdges() {
        int sum = 0;
        for (int c : edges.values()) sum += c;
        return sum;
    }

    public int totalExits() {
        int sum = 0;
        for (int c : exits.values()) sum += c;
        return sum;
    }

    private static <K extends Enum<K>> Map<K, Integer> complete(Class<K> type, Map<K, Integer> counts) {
        final EnumMap<K, Integer> out = new EnumMap<>(type);
        for (K k : type.getEnumConstants()) {
            final Integer c = counts == null ? null : counts.get(k);
            out.put(k, c == null ? 0 : c);
        }
        return Collections.unmodifiableMap(out);
    }
}
