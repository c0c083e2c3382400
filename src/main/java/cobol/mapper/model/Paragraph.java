package cobol.mapper.model;

import java.util.List;
import java.util.Objects;

/**
 * A labeled block of the procedure division: the label record followed by every record
 * up to the next label or the end of the unit.
 */
public record Paragraph(
        String name,                    // normalized label name
        int order,                      // 1-based position in the paragraph table
        int position,                   // 0-based index of the label record among all canonical records
        List<CanonicalRecord> records   // label record first
) {
    public Paragraph {
        Objects.requireNonNull(name, "name");
        records = List.copyOf(records);
        if (records.isEmpty()) {
            throw new IllegalArgumentException("paragraph " + name + " has no label record");
        }
    }

    public CanonicalRecord label() {
        return records.get(0);
    }

    public List<CanonicalRecord> body() {
        return records.subList(1, records.size());
    }

    public int firstSequence() {
        return records.get(0).sequence();
    }

    public int lastSequence() {
        return records.get(records.size() - 1).sequence();
    }
}
