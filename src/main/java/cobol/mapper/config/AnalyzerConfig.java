package cobol.mapper.config;

import java.nio.charset.Charset;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Static configuration threaded through the four analysis stages.
 * <p>
 * Columns are 1-based, as printed on a coding sheet.
 */
public record AnalyzerConfig(
        int indicatorColumn,
        int codeStartColumn,
        int codeEndColumn,
        String inputEncoding,
        String outputEncoding,
        List<String> commentIndicators,
        List<String> ignoredPrefixes,
        int sequenceStart,
        int sequenceWidth,
        String divisionMarker,
        String tracePattern,
        String anomalyPattern,
        String sharedPattern,
        String keyedPattern,
        String targetFallbackSuffix
) {
    public AnalyzerConfig {
        commentIndicators = List.copyOf(Objects.requireNonNull(commentIndicators, "commentIndicators"));
        ignoredPrefixes = List.copyOf(Objects.requireNonNull(ignoredPrefixes, "ignoredPrefixes"));
        Objects.requireNonNull(divisionMarker, "divisionMarker");
        targetFallbackSuffix = targetFallbackSuffix == null ? "" : targetFallbackSuffix;

        if (indicatorColumn < 1) {
            throw new IllegalArgumentException("indicatorColumn must be >= 1: " + indicatorColumn);
        }
        if (codeStartColumn <= indicatorColumn) {
            throw new IllegalArgumentException("codeStartColumn must follow indicatorColumn: "
                    + codeStartColumn + " <= " + indicatorColumn);
        }
        if (codeEndColumn < codeStartColumn) {
            throw new IllegalArgumentException("codeEndColumn must be >= codeStartColumn: "
                    + codeEndColumn + " < " + codeStartColumn);
        }
        if (sequenceWidth < 1 || sequenceWidth > 9) {
            throw new IllegalArgumentException("sequenceWidth must be between 1 and 9: " + sequenceWidth);
        }
        if (sequenceStart < 0 || String.valueOf(sequenceStart).length() > sequenceWidth) {
            throw new IllegalArgumentException("sequenceStart " + sequenceStart
                    + " does not fit in " + sequenceWidth + " digits");
        }
        for (String indicator : commentIndicators) {
            if (indicator == null || indicator.length() != 1) {
                throw new IllegalArgumentException("comment indicator must be a single character: " + indicator);
            }
        }
        if (divisionMarker.isBlank()) {
            throw new IllegalArgumentException("divisionMarker must not be blank");
        }
        requireCharset("inputEncoding", inputEncoding);
        requireCharset("outputEncoding", outputEncoding);
        requirePattern("tracePattern", tracePattern);
        requirePattern("anomalyPattern", anomalyPattern);
        requirePattern("sharedPattern", sharedPattern);
        requirePattern("keyedPattern", keyedPattern);
    }

    public static AnalyzerConfig defaults() {
        return new AnalyzerConfig(
                7, 8, 72,
                "ISO-8859-1", "UTF-8",
                List.of("*", "/"),
                List.of("SMASH", "//"),
                1, 6,
                "PROCEDURE DIVISION",
                "^SMAD-",
                "ANO|ZZ",
                "^SRHP-",
                "PF",
                "-F");
    }

    public int codeWidth() {
        return codeEndColumn - codeStartColumn + 1;
    }

    public Charset inputCharset() {
        return Charset.forName(inputEncoding);
    }

    public Charset outputCharset() {
        return Charset.forName(outputEncoding);
    }

    public NamingRules namingRules() {
        return new NamingRules(
                compile(tracePattern),
                compile(anomalyPattern),
                compile(sharedPattern),
                compile(keyedPattern));
    }

    private static Pattern compile(String regex) {
        return Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
    }

    private static void requireCharset(String key, String name) {
        Objects.requireNonNull(name, key);
        try {
            Charset.forName(name);
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException(key + ": unsupported encoding " + name, ex);
        }
    }

    private static void requirePattern(String key, String regex) {
        Objects.requireNonNull(regex, key);
        try {
            Pattern.compile(regex);
        } catch (PatternSyntaxException ex) {
            throw new IllegalArgumentException(key + ": invalid pattern " + regex, ex);
        }
    }
}
