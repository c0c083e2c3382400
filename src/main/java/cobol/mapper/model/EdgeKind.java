package cobol.mapper.model;

/**
 * Internal control transfer between paragraphs.
 */
public enum EdgeKind {
    GO_TO("GO TO"),
    PERFORM("PERFORM"),
    PERFORM_THRU("PERFORM THRU");

    private final String label;

    EdgeKind(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
