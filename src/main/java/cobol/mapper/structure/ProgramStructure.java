package cobol.mapper.structure;

import java.util.List;
import java.util.Objects;

import cobol.mapper.model.CanonicalRecord;
import cobol.mapper.model.Paragraph;

/**
 * Procedure division layout of one unit: the ordered paragraph table and its name index.
 * Records before the division marker are kept as the preamble.
 */
public final class ProgramStructure {

    private final String unit;
    private final String programId;
    private final List<CanonicalRecord> preamble;
    private final List<Paragraph> paragraphs;
    private final ParagraphIndex index;

    ProgramStructure(String unit, String programId, List<CanonicalRecord> preamble,
                     List<Paragraph> paragraphs, ParagraphIndex index) {
        this.unit = Objects.requireNonNull(unit, "unit");
        this.programId = Objects.requireNonNull(programId, "programId");
        this.preamble = List.copyOf(preamble);
        this.paragraphs = List.copyOf(paragraphs);
        this.index = Objects.requireNonNull(index, "index");
    }

    public String unit() {
        return unit;
    }

    public String programId() {
        return programId;
    }

    public List<CanonicalRecord> preamble() {
        return preamble;
    }

    public List<Paragraph> paragraphs() {
        return paragraphs;
    }

    public ParagraphIndex index() {
        return index;
    }

    public Paragraph first() {
        return paragraphs.isEmpty() ? null : paragraphs.get(0);
    }

    public boolean isEmpty() {
        return paragraphs.isEmpty();
    }
}
