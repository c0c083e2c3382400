package cobol.mapper.model;

/**
 * Why a unit failed. Reported in the batch index next to the unit id.
 */
public enum ErrorKind {
    DECODE,
    ORPHAN_CODE,
    DUPLICATE_PARAGRAPH,
    IO,
    INTERNAL    // unexpected runtime failure while processing the unit
}
