package cobol.mapper.model;

import java.util.Objects;

public record ExitRecord(
        String paragraph,   // owning paragraph name
        ExitKind kind,
        String identifier,  // program, transaction or abend code; null when absent
        String form,        // literal statement form: XCTL | RETURN | STOP RUN | GOBACK | ABEND
        int sequence,
        int position        // token index of the statement within the paragraph body
) {
    public ExitRecord {
        Objects.requireNonNull(paragraph, "paragraph");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(form, "form");
    }

    public String exitNodeId() {
        return Names.exitNodeId(kind, identifier);
    }
}
