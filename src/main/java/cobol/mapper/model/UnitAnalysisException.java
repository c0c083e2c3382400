package cobol.mapper.model;

import java.util.Objects;

/**
 * A unit-fatal analysis failure. Aborts the offending unit only.
 */
public abstract class UnitAnalysisException extends Exception {

    private final String unit;
    private final ErrorKind kind;

    protected UnitAnalysisException(String unit, ErrorKind kind, String message, Throwable cause) {
        super(unit + ": " + message, cause);
        this.unit = Objects.requireNonNull(unit, "unit");
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public String unit() {
        return unit;
    }

    public ErrorKind kind() {
        return kind;
    }
}
