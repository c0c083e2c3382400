package cobol.mapper.model;

public enum ExitKind {
    /** EXEC CICS XCTL PROGRAM(...) */
    EXTERNAL_TRANSFER("XCTL"),
    /** EXEC CICS RETURN, with or without TRANSID(...) */
    RETURN("RETURN"),
    /** STOP RUN or GOBACK */
    PROGRAM_END("PROGRAM END"),
    /** EXEC CICS ABEND, with or without ABCODE(...) */
    FORCED_STOP("ABEND");

    private final String label;

    ExitKind(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
