package cobol.mapper.model;

/**
 * Code after the division marker but before the first paragraph label.
 */
public final class OrphanCodeException extends UnitAnalysisException {

    private final int sequence;

    public OrphanCodeException(String unit, int sequence, String code) {
        super(unit, ErrorKind.ORPHAN_CODE, "code outside any paragraph at sequence " + sequence + ": " + code, null);
        this.sequence = sequence;
    }

    public int sequence() {
        return sequence;
    }
}
