package cobol.mapper.model;

import java.util.Objects;

/**
 * Caller/callee relation found in a paragraph body. Target names that match no paragraph are
 * kept as unresolved; for PERFORM THRU each bound is resolved on its own.
 */
public record CallEdge(
        String source,           // calling paragraph
        String target,           // normalized target, or the matching paragraph name once resolved
        EdgeKind kind,
        String terminal,         // PERFORM THRU end bound, null otherwise
        boolean targetResolved,
        boolean terminalResolved,
        int sequence,
        int position             // token index of the statement within the paragraph body
) {
    public CallEdge {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(kind, "kind");
        if (kind == EdgeKind.PERFORM_THRU) {
            Objects.requireNonNull(terminal, "terminal");
        } else if (terminal != null) {
            throw new IllegalArgumentException(kind + " edge cannot carry a terminal target");
        }
    }

    public static CallEdge single(String source, EdgeKind kind, String target, boolean resolved,
                                  int sequence, int position) {
        return new CallEdge(source, target, kind, null, resolved, false, sequence, position);
    }

    public static CallEdge range(String source, String target, boolean targetResolved,
                                 String terminal, boolean terminalResolved, int sequence, int position) {
        return new CallEdge(source, target, EdgeKind.PERFORM_THRU, terminal, targetResolved, terminalResolved,
                sequence, position);
    }

    public boolean isRange() {
        return kind == EdgeKind.PERFORM_THRU;
    }

    public boolean resolved() {
        return targetResolved && (!isRange() || terminalResolved);
    }
}
