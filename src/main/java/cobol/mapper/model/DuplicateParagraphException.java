package cobol.mapper.model;

/**
 * The same paragraph label is defined twice in one unit.
 */
public final class DuplicateParagraphException extends UnitAnalysisException {

    private final String name;
    private final int firstSequence;
    private final int secondSequence;

    public DuplicateParagraphException(String unit, String name, int firstSequence, int secondSequence) {
        super(unit, ErrorKind.DUPLICATE_PARAGRAPH,
                "paragraph " + name + " defined at sequence " + firstSequence + " and again at " + secondSequence,
                null);
        this.name = name;
        this.firstSequence = firstSequence;
        this.secondSequence = secondSequence;
    }

    public String name() {
        return name;
    }

    public int firstSequence() {
        return firstSequence;
    }

    public int secondSequence() {
        return secondSequence;
    }
}
