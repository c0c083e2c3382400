package cobol.mapper.pipeline;

import java.util.List;
import java.util.Objects;

import cobol.mapper.analysis.AnalysisResult;
import cobol.mapper.graph.GraphModel;
import cobol.mapper.model.CanonicalRecord;

/**
 * In-memory output of the four stages for one unit, before anything is written.
 */
public record UnitReport(
        List<CanonicalRecord> records,
        String canonicalText,
        AnalysisResult result,
        GraphModel graph,
        String dot
) {
    public UnitReport {
        records = List.copyOf(records);
        Objects.requireNonNull(canonicalText, "canonicalText");
        Objects.requireNonNull(result, "result");
        Objects.requireNonNull(graph, "graph");
        Objects.requireNonNull(dot, "dot");
    }
}
