package cobol.mapper.model;

/**
 * One decoded line of a source unit, before normalization.
 */
public record SourceLine(
        String text,
        int lineNumber,   // 1-based
        String unit       // unit id the line was read from
) {
}
