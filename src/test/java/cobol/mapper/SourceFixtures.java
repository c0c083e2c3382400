package cobol.mapper;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import cobol.mapper.analysis.AnalysisResult;
import cobol.mapper.analysis.InteractionAnalyzer;
import cobol.mapper.config.AnalyzerConfig;
import cobol.mapper.model.CanonicalRecord;
import cobol.mapper.model.UnitAnalysisException;
import cobol.mapper.scan.Normalizer;
import cobol.mapper.structure.ProgramStructure;
import cobol.mapper.structure.StructureExtractor;

/**
 * Builds raw fixed-format source text for tests.
 */
public final class SourceFixtures {

    public static final String UNIT = "TEST.cbl";

    private SourceFixtures() {
    }

    /** A source line whose code field (column 8 on) holds the given text. */
    public static String code(String text) {
        return "000000 " + text;
    }

    /** A source line with a comment indicator in column 7. */
    public static String comment(String text) {
        return "000000*" + text;
    }

    /** Lines of a procedure division: marker, then each text as a code line. */
    public static String[] procedure(String... codeLines) {
        final List<String> out = new ArrayList<>();
        out.add(code("PROCEDURE DIVISION."));
        for (String c : codeLines) {
            out.add(code(c));
        }
        return out.toArray(new String[0]);
    }

    public static byte[] bytes(String... lines) {
        return (String.join("\n", lines) + "\n").getBytes(StandardCharsets.ISO_8859_1);
    }

    public static List<CanonicalRecord> normalize(String... lines) throws UnitAnalysisException {
        return new Normalizer(AnalyzerConfig.defaults()).normalize(UNIT, bytes(lines));
    }

    public static ProgramStructure structure(String... lines) throws UnitAnalysisException {
        return new StructureExtractor(AnalyzerConfig.defaults()).extract(UNIT, normalize(lines));
    }

    public static AnalysisResult analyze(String... lines) throws UnitAnalysisException {
        return new InteractionAnalyzer(AnalyzerConfig.defaults()).analyze(structure(lines));
    }

    /** Default configuration with another input encoding and sequence layout. */
    public static AnalyzerConfig config(String inputEncoding, int sequenceStart, int sequenceWidth) {
        final AnalyzerConfig d = AnalyzerConfig.defaults();
        return new AnalyzerConfig(
                d.indicatorColumn(), d.codeStartColumn(), d.codeEndColumn(),
                inputEncoding, d.outputEncoding(),
                d.commentIndicators(), d.ignoredPrefixes(),
                sequenceStart, sequenceWidth,
                d.divisionMarker(),
                d.tracePattern(), d.anomalyPattern(), d.sharedPattern(), d.keyedPattern(),
                d.targetFallbackSuffix());
    }
}
