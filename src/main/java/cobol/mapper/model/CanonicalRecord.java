package cobol.mapper.model;

import java.util.Objects;

/**
 * One surviving source line in canonical layout.
 * <p>
 * Text form: {@code <zero-padded sequence><indicator><code field>}, the code field
 * always holding exactly the configured column window.
 */
public record CanonicalRecord(
        int sequence,
        char indicator,
        String code,      // fixed-width code field, right-padded with blanks
        int sourceLine    // 1-based line in the original unit
) {
    public CanonicalRecord {
        Objects.requireNonNull(code, "code");
    }

    public String trimmedCode() {
        return code.strip();
    }

    public boolean isBlank() {
        return code.isBlank();
    }

    public String toText(int sequenceWidth) {
        final String seq = String.valueOf(sequence);
        if (seq.length() > sequenceWidth) {
            throw new IllegalArgumentException("sequence " + sequence + " exceeds width " + sequenceWidth);
        }
        final StringBuilder sb = new StringBuilder(sequenceWidth + 1 + code.length());
        for (int i = seq.length(); i < sequenceWidth; i++) {
            sb.append('0');
        }
        return sb.append(seq).append(indicator).append(code).toString();
    }

    public static String padRight(String s, int width) {
        if (s.length() >= width) {
            return s;
        }
        final StringBuilder sb = new StringBuilder(width).append(s);
        while (sb.length() < width) {
            sb.append(' ');
        }
        return sb.toString();
    }
}
