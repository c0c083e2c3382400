package cobol.mapper.pipeline;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

import cobol.mapper.analysis.AnalysisStats;
import cobol.mapper.model.ErrorKind;
import cobol.mapper.scan.SourceUnit;

/**
 * Result of one unit in a batch: its artifacts and stats, or why it failed.
 */
public record UnitOutcome(
        SourceUnit unit,
        List<Path> artifacts,   // empty on failure
        AnalysisStats stats,    // null on failure
        ErrorKind errorKind,    // null on success
        String message          // null on success
) {
    public UnitOutcome {
        Objects.requireNonNull(unit, "unit");
        artifacts = List.copyOf(artifacts);
        if ((stats == null) == (errorKind == null)) {
            throw new IllegalArgumentException("outcome needs either stats or an error kind");
        }
    }

    public static UnitOutcome success(SourceUnit unit, List<Path> artifacts, AnalysisStats stats) {
        return new UnitOutcome(unit, artifacts, Objects.requireNonNull(stats, "stats"), null, null);
    }

    public static UnitOutcome failure(SourceUnit unit, ErrorKind kind, String message) {
        return new UnitOutcome(unit, List.of(), null, Objects.requireNonNull(kind, "kind"), message);
    }

    public boolean succeeded() {
        return errorKind == null;
    }
}
