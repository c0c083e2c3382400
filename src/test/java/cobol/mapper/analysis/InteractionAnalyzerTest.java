package cobol.mapper.analysis;

import java.util.List;

import org.junit.jupiter.api.Test;

import cobol.mapper.model.CallEdge;
import cobol.mapper.model.EdgeKind;
import cobol.mapper.model.ExitKind;
import cobol.mapper.model.ExitRecord;
import cobol.mapper.model.InteractionKind;
import cobol.mapper.model.InteractionPoint;

import static cobol.mapper.SourceFixtures.analyze;
import static cobol.mapper.SourceFixtures.code;
import static cobol.mapper.SourceFixtures.procedure;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InteractionAnalyzerTest {

    // -- reference scenario ------------------------------------------------

    @Test
    void whenAnalyzing_givenTwoParagraphProgram_shouldFindPerformExitAndEntry() throws Exception {
        final AnalysisResult r = analyze(procedure(
                "000100-INIT.",
                "    PERFORM 000200-PROC.",
                "000200-PROC.",
                "    GOBACK."));

        assertEquals(1, r.edges().size());
        final CallEdge e = r.edges().get(0);
        assertEquals("000100-INIT", e.source());
        assertEquals("000200-PROC", e.target());
        assertEquals(EdgeKind.PERFORM, e.kind());
        assertTrue(e.resolved());

        assertEquals(1, r.exits().size());
        final ExitRecord x = r.exits().get(0);
        assertEquals("000200-PROC", x.paragraph());
        assertEquals(ExitKind.PROGRAM_END, x.kind());
        assertEquals("GOBACK", x.form());

        assertEquals(List.of("000100-INIT"), r.entryPoints());
        assertEquals(2, r.stats().paragraphs());
        assertEquals(1, r.stats().edgeCount(EdgeKind.PERFORM));
        assertEquals(0, r.stats().edgeCount(EdgeKind.GO_TO));
        assertEquals(1, r.stats().exitCount(ExitKind.PROGRAM_END));
    }

    @Test
    void whenAnalyzing_givenReferenceScenarioWrittenFromCodeColumn_shouldFindPerformExitAndEntry() throws Exception {
        final AnalysisResult r = analyze(procedure(
                "000100-INIT.",
                "PERFORM 000200-PROC.",
                "000200-PROC.",
                "GOBACK."));

        assertEquals(2, r.stats().paragraphs());
        assertEquals(1, r.edges().size());
        assertEquals("000200-PROC", r.edges().get(0).target());
        assertTrue(r.edges().get(0).resolved());
        assertEquals(1, r.exits().size());
        assertEquals("000200-PROC", r.exits().get(0).paragraph());
        assertEquals(ExitKind.PROGRAM_END, r.exits().get(0).kind());
        assertEquals(List.of("000100-INIT"), r.entryPoints());
    }

    // -- GO TO -------------------------------------------------------------

    @Test
    void whenAnalyzing_givenGoToForms_shouldRecordJumps() throws Exception {
        final AnalysisResult r = analyze(procedure(
                "P1.",
                "    IF A = 1 GO TO P2 ELSE GO P3 END-IF.",
                "P2.",
                "    GO TO P1 P3",
                "        DEPENDING ON WS-IDX.",
                "P3.",
                "    EXIT."));

        assertEquals(4, r.edges().size());
        assertEquals("P2", r.edges().get(0).target());
        assertEquals("P3", r.edges().get(1).target());
        assertEquals("P1", r.edges().get(2).target());
        assertEquals("P3", r.edges().get(3).target());
        for (CallEdge e : r.edges()) {
            assertEquals(EdgeKind.GO_TO, e.kind());
            assertTrue(e.resolved());
        }
        assertEquals(4, r.stats().edgeCount(EdgeKind.GO_TO));
    }

    // -- PERFORM -----------------------------------------------------------

    @Test
    void whenAnalyzing_givenPerformRange_shouldResolveEachBoundIndependently() throws Exception {
        final AnalysisResult r = analyze(procedure(
                "P1.",
                "    PERFORM P2 THRU P9.",
                "    PERFORM P2 THROUGH P3.",
                "P2.",
                "    EXIT.",
                "P3.",
                "    EXIT."));

        final CallEdge open = r.edges().get(0);
        assertEquals(EdgeKind.PERFORM_THRU, open.kind());
        assertEquals("P9", open.terminal());
        assertTrue(open.targetResolved());
        assertFalse(open.terminalResolved());
        assertFalse(open.resolved());

        final CallEdge closed = r.edges().get(1);
        assertTrue(closed.resolved());

        assertEquals(1, r.stats().unresolvedEdges());
        assertEquals(List.of("P1"), r.entryPoints());
    }

    @Test
    void whenAnalyzing_givenTraceRoutinePerform_shouldSuppressAndCount() throws Exception {
        final AnalysisResult r = analyze(procedure(
                "P1.",
                "    PERFORM SMAD-TRACE.",
                "    PERFORM P2.",
                "P2.",
                "    EXIT.",
                "SMAD-TRACE.",
                "    EXIT."));

        assertEquals(1, r.edges().size());
        assertEquals("P2", r.edges().get(0).target());
        assertEquals(1, r.stats().suppressedPerforms());
        assertTrue(r.entryPoints().contains("SMAD-TRACE"));
    }

    @Test
    void whenAnalyzing_givenInlinePerforms_shouldOnlyRecordNamedTargets() throws Exception {
        final AnalysisResult r = analyze(procedure(
                "P1.",
                "    PERFORM UNTIL WS-I > 5",
                "        PERFORM P2",
                "    END-PERFORM.",
                "    PERFORM VARYING WS-I FROM 1 BY 1 UNTIL WS-I > 9",
                "        ADD 1 TO WS-N",
                "    END-PERFORM.",
                "    PERFORM 3 TIMES",
                "        ADD 1 TO WS-N",
                "    END-PERFORM.",
                "    PERFORM WITH TEST AFTER UNTIL WS-EOF",
                "        READ F",
                "    END-PERFORM.",
                "    PERFORM P2 WS-N TIMES.",
                "P2.",
                "    EXIT."));

        assertEquals(2, r.edges().size());
        assertEquals("P2", r.edges().get(0).target());
        assertEquals("P2", r.edges().get(1).target());
    }

    @Test
    void whenAnalyzing_givenBarePerformBlock_shouldRecordNoEdgeForItsFirstStatement() throws Exception {
        final AnalysisResult r = analyze(procedure(
                "P1.",
                "    PERFORM",
                "        MOVE 1 TO WS-A",
                "        PERFORM P2",
                "    END-PERFORM.",
                "P2.",
                "    EXIT."));

        assertEquals(1, r.edges().size());
        assertEquals("P2", r.edges().get(0).target());
        assertTrue(r.edges().get(0).resolved());
        assertEquals(0, r.stats().unresolvedEdges());
    }

    @Test
    void whenAnalyzing_givenSuffixedTarget_shouldFallBackToBaseName() throws Exception {
        final AnalysisResult r = analyze(procedure(
                "P1.",
                "    PERFORM P2-F.",
                "P2.",
                "    EXIT."));

        assertEquals("P2", r.edges().get(0).target());
        assertTrue(r.edges().get(0).resolved());
    }

    @Test
    void whenAnalyzing_givenLowerCaseTarget_shouldMatchCaseInsensitively() throws Exception {
        final AnalysisResult r = analyze(procedure(
                "P1.",
                "    perform p2.",
                "P2.",
                "    EXIT."));

        assertEquals("P2", r.edges().get(0).target());
        assertTrue(r.edges().get(0).resolved());
    }

    @Test
    void whenAnalyzing_givenUnknownTarget_shouldKeepUnresolvedEdge() throws Exception {
        final AnalysisResult r = analyze(procedure(
                "P1.",
                "    PERFORM NOWHERE.",
                "    GO TO ELSEWHERE."));

        assertEquals(2, r.edges().size());
        assertEquals("NOWHERE", r.edges().get(0).target());
        assertFalse(r.edges().get(0).resolved());
        assertEquals(2, r.stats().unresolvedEdges());
    }

    @Test
    void whenAnalyzing_givenRepeatedStatements_shouldNotDeduplicate() throws Exception {
        final AnalysisResult r = analyze(procedure(
                "P1.",
                "    PERFORM P2.",
                "    PERFORM P2.",
                "    GOBACK.",
                "P2.",
                "    GOBACK."));

        assertEquals(2, r.edges().size());
        assertEquals(2, r.exits().size());
        assertEquals(2, r.edgesTo("P2").size());
    }

    @Test
    void whenAnalyzing_givenKeywordsInLiterals_shouldIgnoreThem() throws Exception {
        final AnalysisResult r = analyze(procedure(
                "P1.",
                "    DISPLAY 'GO TO P2'.",
                "    MOVE 'GOBACK' TO WS-A.",
                "P2.",
                "    EXIT."));

        assertTrue(r.edges().isEmpty());
        assertTrue(r.exits().isEmpty());
        assertEquals(List.of("P1", "P2"), r.entryPoints());
    }

    // -- exits -------------------------------------------------------------

    @Test
    void whenAnalyzing_givenExitStatements_shouldRecordKindAndIdentifier() throws Exception {
        final AnalysisResult r = analyze(procedure(
                "P1.",
                "    EXEC CICS XCTL PROGRAM('PGM01') END-EXEC.",
                "    EXEC CICS XCTL PROGRAM(WS-NEXT-PGM) COMMAREA(WS-CA) END-EXEC.",
                "    EXEC CICS RETURN TRANSID('TR01') END-EXEC.",
                "    EXEC CICS RETURN END-EXEC.",
                "    EXEC CICS ABEND ABCODE('AB01') END-EXEC.",
                "    STOP RUN."));

        final List<ExitRecord> exits = r.exits();
        assertEquals(6, exits.size());

        assertEquals(ExitKind.EXTERNAL_TRANSFER, exits.get(0).kind());
        assertEquals("PGM01", exits.get(0).identifier());
        assertEquals("WS-NEXT-PGM", exits.get(1).identifier());
        assertEquals(ExitKind.RETURN, exits.get(2).kind());
        assertEquals("TR01", exits.get(2).identifier());
        assertNull(exits.get(3).identifier());
        assertEquals(ExitKind.FORCED_STOP, exits.get(4).kind());
        assertEquals("AB01", exits.get(4).identifier());
        assertEquals(ExitKind.PROGRAM_END, exits.get(5).kind());
        assertEquals("STOP RUN", exits.get(5).form());

        assertEquals(2, r.stats().exitCount(ExitKind.EXTERNAL_TRANSFER));
        assertEquals(2, r.stats().exitCount(ExitKind.RETURN));
        assertEquals(6, r.stats().totalExits());
    }

    @Test
    void whenAnalyzing_givenExecOverSeveralRecords_shouldAttributeToExecRecord() throws Exception {
        final AnalysisResult r = analyze(procedure(
                "P1.",
                "    EXEC CICS",
                "         XCTL PROGRAM('PGM02')",
                "    END-EXEC.",
                "    GOBACK."));

        assertEquals(2, r.exits().size());
        assertEquals("PGM02", r.exits().get(0).identifier());
        assertEquals(3, r.exits().get(0).sequence());
    }

    @Test
    void whenAnalyzing_givenSqlBlock_shouldSkipItsContent() throws Exception {
        final AnalysisResult r = analyze(procedure(
                "P1.",
                "    EXEC SQL",
                "      SELECT A INTO :B FROM T WHERE GOBACK = 1",
                "    END-EXEC.",
                "    PERFORM P2.",
                "P2.",
                "    EXIT."));

        assertTrue(r.exits().isEmpty());
        assertEquals(1, r.edges().size());
    }

    // -- interactions ------------------------------------------------------

    @Test
    void whenAnalyzing_givenCicsInteractions_shouldRecordThemWithoutExits() throws Exception {
        final AnalysisResult r = analyze(procedure(
                "P1.",
                "    EXEC CICS LINK PROGRAM('SUB01') COMMAREA(WS-CA) END-EXEC.",
                "    EXEC CICS START TRANSID('T001') END-EXEC.",
                "    EXEC CICS SEND MAP('MAP1') MAPSET('SET1') ERASE END-EXEC.",
                "    EXEC CICS RECEIVE MAP('MAP1') END-EXEC.",
                "    EXEC CICS SEND TEXT FROM(WS-MSG) END-EXEC.",
                "    CALL 'UTIL01' USING WS-A.",
                "    CALL WS-DYNAMIC."));

        final List<InteractionPoint> ips = r.interactions();
        assertEquals(5, ips.size());
        assertEquals(InteractionKind.LINK, ips.get(0).kind());
        assertEquals("SUB01", ips.get(0).target());
        assertEquals(InteractionKind.START, ips.get(1).kind());
        assertEquals("T001", ips.get(1).target());
        assertEquals(InteractionKind.SEND_MAP, ips.get(2).kind());
        assertEquals("SET1", ips.get(2).mapset());
        assertEquals(InteractionKind.RECEIVE_MAP, ips.get(3).kind());
        assertNull(ips.get(3).mapset());
        assertEquals(InteractionKind.CALL, ips.get(4).kind());
        assertEquals("UTIL01", ips.get(4).target());

        assertTrue(r.exits().isEmpty());
        assertEquals(5, r.stats().interactions());
    }

    // -- entry points ------------------------------------------------------

    @Test
    void whenAnalyzing_givenInboundEdges_shouldKeepFirstAndUnreferencedParagraphs() throws Exception {
        final AnalysisResult r = analyze(procedure(
                "P1.",
                "    PERFORM P2.",
                "P2.",
                "    GO TO P1.",
                "P3.",
                "    GOBACK."));

        assertEquals(List.of("P1", "P3"), r.entryPoints());
        assertTrue(r.isEntryPoint("P1"));
        assertFalse(r.isEntryPoint("P2"));
    }

    @Test
    void whenAnalyzing_givenNoProcedureDivision_shouldReturnEmptyResult() throws Exception {
        final AnalysisResult r = analyze(code("01  WS-A PIC X."));

        assertTrue(r.entryPoints().isEmpty());
        assertTrue(r.edges().isEmpty());
        assertEquals(0, r.stats().paragraphs());
    }
}
