package cobol.mapper.analysis;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import cobol.mapper.model.CallEdge;
import cobol.mapper.model.ExitRecord;
import cobol.mapper.model.InteractionPoint;
import cobol.mapper.structure.ProgramStructure;

/**
 * Everything the analysis found in one unit. Edges, exits and interactions are in discovery
 * order; entry points follow the paragraph table.
 */
public record AnalysisResult(
        ProgramStructure structure,
        List<CallEdge> edges,
        List<ExitRecord> exits,
        List<InteractionPoint> interactions,
        List<String> entryPoints,
        AnalysisStats stats
) {
    public AnalysisResult {
        Objects.requireNonNull(structure, "structure");
        edges = List.copyOf(edges);
        exits = List.copyOf(exits);
        interactions = List.copyOf(interactions);
        entryPoints = List.copyOf(entryPoints);
        Objects.requireNonNull(stats, "stats");
    }

    public String unit() {
        return structure.unit();
    }

    public boolean isEntryPoint(String paragraph) {
        return entryPoints.contains(paragraph);
    }

    public List<CallEdge> edgesFrom(String paragraph) {
        final List<CallEdge> out = new ArrayList<>();
        for (CallEdge e : edges) {
            if (e.source().equals(paragraph)) out.add(e);
        }
        return out;
    }

    /**
     * Resolved edges with the paragraph as either bound.
     */
    public List<CallEdge> edgesTo(String paragraph) {
        final List<CallEdge> out = new ArrayList<>();
        for (CallEdge e : edges) {
            if ((e.targetResolved() && e.target().equals(paragraph))
                    || (e.terminalResolved() && paragraph.equals(e.terminal()))) {
                out.add(e);
            }
        }
        return out;
    }

    public List<ExitRecord> exitsOf(String paragraph) {
        final List<ExitRecord> out = new ArrayList<>();
        for (ExitRecord x : exits) {
            if (x.paragraph().equals(paragraph)) out.add(x);
        }
        return out;
    }
}
