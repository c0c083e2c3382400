package cobol.mapper.io;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonInclude;

import cobol.mapper.analysis.AnalysisResult;
import cobol.mapper.analysis.AnalysisStats;
import cobol.mapper.model.CallEdge;
import cobol.mapper.model.EdgeKind;
import cobol.mapper.model.ExitKind;
import cobol.mapper.model.ExitRecord;
import cobol.mapper.model.InteractionPoint;
import cobol.mapper.model.Paragraph;

/**
 * JSON shape of {@code <unit>.analysis.json}, read by report generators.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AnalysisDocument(
        String schema,
        String unit,
        String program,
        List<ParagraphLine> paragraphs,
        List<EdgeLine> edges,
        List<ExitLine> exits,
        List<InteractionLine> interactions,
        List<String> entryPoints,
        Stats stats
) {
    public static final String SCHEMA_VERSION = "cobol-mapper/analysis/v1";

    public static AnalysisDocument from(AnalysisResult result) {
        final List<ParagraphLine> paragraphs = new ArrayList<>();
        for (Paragraph p : result.structure().paragraphs()) {
            paragraphs.add(new ParagraphLine(p.name(), p.order(), p.firstSequence(), p.lastSequence()));
        }

        final List<EdgeLine> edges = new ArrayList<>(result.edges().size());
        for (CallEdge e : result.edges()) {
            edges.add(new EdgeLine(e.kind().name(), e.source(), e.target(), e.terminal(),
                    e.resolved(), e.targetResolved(), e.isRange() ? e.terminalResolved() : null, e.sequence()));
        }

        final List<ExitLine> exits = new ArrayList<>(result.exits().size());
        for (ExitRecord x : result.exits()) {
            exits.add(new ExitLine(x.kind().name(), x.paragraph(), x.identifier(), x.form(), x.sequence()));
        }

        final List<InteractionLine> interactions = new ArrayList<>(result.interactions().size());
        for (InteractionPoint ip : result.interactions()) {
            interactions.add(new InteractionLine(ip.kind().name(), ip.paragraph(), ip.target(), ip.mapset(), ip.sequence()));
        }

        final AnalysisStats s = result.stats();
        final Map<String, Integer> edgeCounts = new LinkedHashMap<>();
        for (EdgeKind k : EdgeKind.values()) {
            edgeCounts.put(k.name(), s.edgeCount(k));
        }
        final Map<String, Integer> exitCounts = new LinkedHashMap<>();
        for (ExitKind k : ExitKind.values()) {
            exitCounts.put(k.name(), s.exitCount(k));
        }

        return new AnalysisDocument(
                SCHEMA_VERSION,
                result.unit(),
                result.structure().programId(),
                paragraphs,
                edges,
                exits,
                interactions,
                result.entryPoints(),
                new Stats(s.paragraphs(), edgeCounts, exitCounts, s.suppressedPerforms(), s.unresolvedEdges(), s.interactions()));
    }

    public record ParagraphLine(
            String name,
            int order,
            int firstSequence,
            int lastSequence
    ) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record EdgeLine(
            String kind,
            String source,
            String target,
            String terminal,
            boolean resolved,
            boolean targetResolved,
            Boolean terminalResolved,   // PERFORM_THRU only
            int sequence
    ) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ExitLine(
            String kind,
            String paragraph,
            String identifier,
            String form,
            int sequence
    ) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record InteractionLine(
            String kind,
            String paragraph,
            String target,
            String mapset,
            int sequence
    ) {
    }

    public record Stats(
            int paragraphs,
            Map<String, Integer> edges,
            Map<String, Integer> exits,
            int suppressedPerforms,
            int unresolvedEdges,
            int interactions
    ) {
    }
}
