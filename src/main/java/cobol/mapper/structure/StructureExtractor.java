package cobol.mapper.structure;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import cobol.mapper.config.AnalyzerConfig;
import cobol.mapper.model.CanonicalRecord;
import cobol.mapper.model.DuplicateParagraphException;
import cobol.mapper.model.Names;
import cobol.mapper.model.OrphanCodeException;
import cobol.mapper.model.Paragraph;
import cobol.mapper.model.ReservedWords;

/**
 * Splits the procedure division into paragraphs.
 * <p>
 * A label is an identifier written from the first column of the code field and closed by a
 * period, with nothing else on the record. Statement words such as {@code GOBACK.} or
 * {@code END-IF.} are never labels. Every record after the marker header belongs to
 * exactly one paragraph.
 */
public final class StructureExtractor {

    private static final Logger log = LoggerFactory.getLogger(StructureExtractor.class);

    private static final Pattern PROGRAM_ID =
            Pattern.compile("PROGRAM-ID\\s*\\.?\\s*['\"]?([A-Za-z0-9][A-Za-z0-9-]*)", Pattern.CASE_INSENSITIVE);

    private final Pattern marker;

    public StructureExtractor(AnalyzerConfig config) {
        Objects.requireNonNull(config, "config");
        this.marker = markerPattern(config.divisionMarker());
    }

    public ProgramStructure extract(String unit, List<CanonicalRecord> records)
            throws OrphanCodeException, DuplicateParagraphException {
        Objects.requireNonNull(unit, "unit");
        Objects.requireNonNull(records, "records");

        final int markerAt = findMarker(records);
        if (markerAt < 0) {
            log.debug("{}: no procedure division marker, no paragraphs", unit);
            return new ProgramStructure(unit, programId(unit, records), records, List.of(), new ParagraphIndex());
        }

        final List<CanonicalRecord> preamble = records.subList(0, markerAt);
        final int bodyStart = endOfHeader(records, markerAt) + 1;

        final ParagraphIndex index = new ParagraphIndex();
        final List<Paragraph> paragraphs = new ArrayList<>();

        String currentName = null;
        int currentPosition = -1;
        List<CanonicalRecord> current = null;

        for (int i = bodyStart; i < records.size(); i++) {
            final CanonicalRecord r = records.get(i);
            final String label = labelOf(r);

            if (label != null) {
                if (current != null) {
                    add(unit, index, paragraphs, new Paragraph(currentName, paragraphs.size() + 1, currentPosition, current));
                }
                currentName = label;
                currentPosition = i;
                current = new ArrayList<>();
                current.add(r);
                continue;
            }

            if (current == null) {
                if (!r.isBlank()) {
                    throw new OrphanCodeException(unit, r.sequence(), r.trimmedCode());
                }
                continue;
            }
            current.add(r);
        }
        if (current != null) {
            add(unit, index, paragraphs, new Paragraph(currentName, paragraphs.size() + 1, currentPosition, current));
        }

        log.debug("{}: {} paragraph(s) after marker at record {}", unit, paragraphs.size(), markerAt);
        return new ProgramStructure(unit, programId(unit, preamble), preamble, paragraphs, index);
    }

    /**
     * @return the normalized label name when the record opens a paragraph, null otherwise
     */
    static String labelOf(CanonicalRecord record) {
        final String code = record.code();
        if (code.isEmpty() || Character.isWhitespace(code.charAt(0))) return null;

        final String token = code.strip();
        if (token.length() < 2 || token.charAt(token.length() - 1) != '.') return null;

        final String name = token.substring(0, token.length() - 1);
        if (!Names.isIdentifier(name) || ReservedWords.isStatementWord(name)) return null;
        return Names.normalize(name);
    }

    private static void add(String unit, ParagraphIndex index, List<Paragraph> paragraphs, Paragraph p)
            throws DuplicateParagraphException {
        final Paragraph previous = index.register(p);
        if (previous != null) {
            throw new DuplicateParagraphException(unit, p.name(), previous.firstSequence(), p.firstSequence());
        }
        paragraphs.add(p);
    }

    private int findMarker(List<CanonicalRecord> records) {
        for (int i = 0; i < records.size(); i++) {
            if (marker.matcher(records.get(i).trimmedCode()).lookingAt()) {
                return i;
            }
        }
        return -1;
    }

    // The header may carry a USING list over several records; it closes with a period.
    private static int endOfHeader(List<CanonicalRecord> records, int markerAt) {
        for (int i = markerAt; i < records.size(); i++) {
            if (records.get(i).trimmedCode().endsWith(".")) {
                return i;
            }
        }
        return records.size() - 1;
    }

    private static String programId(String unit, List<CanonicalRecord> preamble) {
        for (CanonicalRecord r : preamble) {
            final Matcher m = PROGRAM_ID.matcher(r.code());
            if (m.find()) {
                return Names.normalize(m.group(1));
            }
        }
        return unit;
    }

    private static Pattern markerPattern(String literal) {
        final String[] words = literal.trim().split("\\s+");
        final StringBuilder sb = new StringBuilder();
        for (String w : words) {
            if (sb.length() > 0) sb.append("\\s+");
            sb.append(Pattern.quote(w));
        }
        sb.append("(?![A-Za-z0-9-])");
        return Pattern.compile(sb.toString(), Pattern.CASE_INSENSITIVE);
    }
}
