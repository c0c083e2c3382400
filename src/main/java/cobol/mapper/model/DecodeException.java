package cobol.mapper.model;

/**
 * A raw line holds bytes that are not valid in the declared input encoding.
 */
public final class DecodeException extends UnitAnalysisException {

    private final int lineNumber;

    public DecodeException(String unit, int lineNumber, String encoding, Throwable cause) {
        super(unit, ErrorKind.DECODE, "line " + lineNumber + " is not valid " + encoding, cause);
        this.lineNumber = lineNumber;
    }

    public int lineNumber() {
        return lineNumber;
    }
}
