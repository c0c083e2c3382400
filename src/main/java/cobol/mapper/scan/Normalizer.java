package cobol.mapper.scan;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import cobol.mapper.config.AnalyzerConfig;
import cobol.mapper.model.CanonicalRecord;
import cobol.mapper.model.DecodeException;
import cobol.mapper.model.SourceLine;

/**
 * Turns raw 80-column source lines into canonical records.
 * <p>
 * Dropped: comment lines (indicator column), lines starting with an ignored prefix and
 * lines whose code field is blank. Survivors are renumbered from the configured start.
 */
public final class Normalizer {

    private static final Logger log = LoggerFactory.getLogger(Normalizer.class);

    private final AnalyzerConfig config;
    private final int maxSequence;

    public Normalizer(AnalyzerConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        this.maxSequence = (int) Math.pow(10, config.sequenceWidth()) - 1;
    }

    public List<CanonicalRecord> normalize(String unit, byte[] raw) throws DecodeException {
        return normalize(decode(unit, raw));
    }

    /**
     * Splits on LF and decodes each line strictly. A trailing CR is part of the line ending.
     *
     * @throws DecodeException on the first line that is not valid in the input encoding
     */
    public List<SourceLine> decode(String unit, byte[] raw) throws DecodeException {
        Objects.requireNonNull(unit, "unit");
        Objects.requireNonNull(raw, "raw");

        final Charset charset = config.inputCharset();
        final CharsetDecoder decoder = charset.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);

        final List<SourceLine> lines = new ArrayList<>();
        int start = 0;
        int lineNumber = 1;
        while (start < raw.length) {
            int end = start;
            while (end < raw.length && raw[end] != '\n') {
                end++;
            }
            int len = end - start;
            if (len > 0 && raw[start + len - 1] == '\r') {
                len--;
            }
            final String text;
            try {
                decoder.reset();
                final CharBuffer chars = decoder.decode(ByteBuffer.wrap(raw, start, len));
                text = chars.toString();
            } catch (CharacterCodingException ex) {
                throw new DecodeException(unit, lineNumber, charset.name(), ex);
            }
            lines.add(new SourceLine(text, lineNumber, unit));
            lineNumber++;
            start = end + 1;
        }
        return lines;
    }

    public List<CanonicalRecord> normalize(List<SourceLine> lines) {
        Objects.requireNonNull(lines, "lines");

        final List<CanonicalRecord> out = new ArrayList<>(lines.size());
        int next = config.sequenceStart();
        int dropped = 0;

        for (SourceLine line : lines) {
            final String text = line.text();
            if (isIgnored(text) || isComment(text)) {
                dropped++;
                continue;
            }
            final String code = codeField(text);
            if (code.isBlank()) {
                dropped++;
                continue;
            }
            if (next > maxSequence) {
                log.warn("{}: sequence numbers exhausted at line {}, remaining lines dropped",
                        line.unit(), line.lineNumber());
                break;
            }
            out.add(new CanonicalRecord(next++, indicator(text), code, line.lineNumber()));
        }

        if (log.isDebugEnabled() && !lines.isEmpty()) {
            log.debug("{}: {} record(s) kept, {} dropped", lines.get(0).unit(), out.size(), dropped);
        }
        return out;
    }

    /**
     * Canonical text of a record set, one record per line.
     */
    public String toText(List<CanonicalRecord> records) {
        final StringBuilder sb = new StringBuilder();
        for (CanonicalRecord r : records) {
            sb.append(r.toText(config.sequenceWidth())).append('\n');
        }
        return sb.toString();
    }

    private boolean isIgnored(String text) {
        for (String prefix : config.ignoredPrefixes()) {
            if (!prefix.isEmpty() && text.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }

    private boolean isComment(String text) {
        final char c = indicator(text);
        for (String indicator : config.commentIndicators()) {
            if (indicator.charAt(0) == c) {
                return true;
            }
        }
        return false;
    }

    private char indicator(String text) {
        final int i = config.indicatorColumn() - 1;
        return i < text.length() ? text.charAt(i) : ' ';
    }

    private String codeField(String text) {
        final int from = config.codeStartColumn() - 1;
        final int width = config.codeWidth();
        final String selected = from < text.length()
                ? text.substring(from, Math.min(text.length(), from + width))
                : "";
        return CanonicalRecord.padRight(selected, width);
    }
}
