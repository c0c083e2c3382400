package cobol.mapper.structure;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

import cobol.mapper.config.AnalyzerConfig;
import cobol.mapper.model.CanonicalRecord;
import cobol.mapper.model.DuplicateParagraphException;
import cobol.mapper.model.ErrorKind;
import cobol.mapper.model.OrphanCodeException;
import cobol.mapper.model.Paragraph;

import static cobol.mapper.SourceFixtures.UNIT;
import static cobol.mapper.SourceFixtures.code;
import static cobol.mapper.SourceFixtures.normalize;
import static cobol.mapper.SourceFixtures.procedure;
import static cobol.mapper.SourceFixtures.structure;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StructureExtractorTest {

    // -- paragraph table ---------------------------------------------------

    @Test
    void whenExtracting_givenTwoLabels_shouldBuildOrderedTable() throws Exception {
        final ProgramStructure s = structure(procedure(
                "000100-INIT.",
                "    PERFORM 000200-PROC.",
                "000200-PROC.",
                "    GOBACK."));

        assertEquals(2, s.paragraphs().size());

        final Paragraph init = s.paragraphs().get(0);
        assertEquals("000100-INIT", init.name());
        assertEquals(1, init.order());
        assertEquals(1, init.position());
        assertEquals(2, init.records().size());
        assertEquals("PERFORM 000200-PROC.", init.body().get(0).trimmedCode());

        final Paragraph proc = s.paragraphs().get(1);
        assertEquals("000200-PROC", proc.name());
        assertEquals(2, proc.order());
        assertEquals(3, proc.position());
        assertEquals(4, proc.firstSequence());
        assertEquals(5, proc.lastSequence());
    }

    @Test
    void whenExtracting_givenMixedCaseLabel_shouldIndexCaseInsensitively() throws Exception {
        final ProgramStructure s = structure(procedure("Main-Para.", "    GOBACK."));

        assertEquals("MAIN-PARA", s.paragraphs().get(0).name());
        assertSame(s.paragraphs().get(0), s.index().find("main-para"));
        assertEquals("MAIN-PARA", s.index().resolve("Main-Para", "-F"));
    }

    @Test
    void whenExtracting_givenPostMarkerRecords_shouldPartitionThemExactly() throws Exception {
        final List<CanonicalRecord> records = normalize(procedure(
                "A.",
                "    MOVE 1 TO X.",
                "    PERFORM B.",
                "B.",
                "C.",
                "    GO TO A.",
                "    GOBACK."));
        final ProgramStructure s = new StructureExtractor(AnalyzerConfig.defaults()).extract(UNIT, records);

        final List<CanonicalRecord> covered = new ArrayList<>();
        for (Paragraph p : s.paragraphs()) {
            covered.addAll(p.records());
        }

        assertEquals(records.subList(1, records.size()), covered);
        assertEquals(1, s.paragraphs().get(1).records().size());
    }

    // -- marker ------------------------------------------------------------

    @Test
    void whenExtracting_givenPreamble_shouldReadProgramId() throws Exception {
        final ProgramStructure s = structure(
                code("IDENTIFICATION DIVISION."),
                code("PROGRAM-ID. PGMA01."),
                code("PROCEDURE DIVISION."),
                code("MAIN."),
                code("    GOBACK."));

        assertEquals("PGMA01", s.programId());
        assertEquals(2, s.preamble().size());
    }

    @Test
    void whenExtracting_givenNoProgramId_shouldFallBackToUnitName() throws Exception {
        final ProgramStructure s = structure(procedure("MAIN.", "    GOBACK."));

        assertEquals(UNIT, s.programId());
    }

    @Test
    void whenExtracting_givenHeaderSpanningRecords_shouldStartAfterItsPeriod() throws Exception {
        final ProgramStructure s = structure(
                code("procedure division using WS-A"),
                code("                         WS-B."),
                code("MAIN."),
                code("    GOBACK."));

        assertEquals(1, s.paragraphs().size());
        assertEquals("MAIN", s.first().name());
    }

    @Test
    void whenExtracting_givenNoMarker_shouldReturnNoParagraphs() throws Exception {
        final ProgramStructure s = structure(
                code("01  WS-RECORD."),
                code("    05 WS-A PIC X."));

        assertTrue(s.isEmpty());
        assertNull(s.first());
        assertEquals(2, s.preamble().size());
    }

    // -- errors ------------------------------------------------------------

    @Test
    void whenExtracting_givenCodeBeforeFirstLabel_shouldRaiseOrphanCode() {
        final OrphanCodeException ex = assertThrows(OrphanCodeException.class,
                () -> structure(procedure("    MOVE A TO B.", "MAIN.", "    GOBACK.")));

        assertEquals(2, ex.sequence());
        assertEquals(ErrorKind.ORPHAN_CODE, ex.kind());
    }

    @Test
    void whenExtracting_givenRepeatedLabel_shouldNameBothPositions() {
        final DuplicateParagraphException ex = assertThrows(DuplicateParagraphException.class,
                () -> structure(procedure(
                        "P1.",
                        "    MOVE 1 TO X.",
                        "p1.",
                        "    GOBACK.")));

        assertEquals("P1", ex.name());
        assertEquals(2, ex.firstSequence());
        assertEquals(4, ex.secondSequence());
        assertEquals(ErrorKind.DUPLICATE_PARAGRAPH, ex.kind());
    }

    // -- label grammar -----------------------------------------------------

    @Test
    void whenMatchingLabel_givenVariousRecords_shouldAcceptOnlyBareIdentifierAndPeriod() {
        assertEquals("PARA-1", StructureExtractor.labelOf(record("PARA-1.")));
        assertEquals("PARA-1", StructureExtractor.labelOf(record("para-1.   ")));
        assertNull(StructureExtractor.labelOf(record("    PARA-1.")));
        assertNull(StructureExtractor.labelOf(record("PARA-1 .")));
        assertNull(StructureExtractor.labelOf(record("PARA-1")));
        assertNull(StructureExtractor.labelOf(record("PARA-1. EXIT.")));
        assertNull(StructureExtractor.labelOf(record("MOVE A TO B.")));
        assertNull(StructureExtractor.labelOf(record("A234567890123456789012345678901.")));
    }

    @Test
    void whenMatchingLabel_givenStatementWordsInFirstColumn_shouldNotOpenParagraph() {
        for (String word : List.of("GOBACK.", "EXIT.", "CONTINUE.", "STOP.", "end-if.", "END-PERFORM.", "END-EXEC.")) {
            assertNull(StructureExtractor.labelOf(record(word)), word);
        }
        assertEquals("EXIT-PARA", StructureExtractor.labelOf(record("EXIT-PARA.")));
    }

    @Test
    void whenExtracting_givenUnindentedStatements_shouldKeepThemInTheirParagraph() throws Exception {
        final ProgramStructure s = structure(procedure(
                "000100-INIT.",
                "PERFORM 000200-PROC.",
                "000200-PROC.",
                "GOBACK."));

        assertEquals(2, s.paragraphs().size());
        assertEquals("000200-PROC", s.paragraphs().get(1).name());
        assertEquals(2, s.paragraphs().get(1).records().size());
        assertEquals("GOBACK.", s.paragraphs().get(1).body().get(0).trimmedCode());
    }

    private static CanonicalRecord record(String code) {
        return new CanonicalRecord(1, ' ', CanonicalRecord.padRight(code, 65), 1);
    }
}
