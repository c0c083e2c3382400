package cobol.mapper.model;

import java.util.Locale;
import java.util.Set;

/**
 * COBOL words that can begin a statement or close a scope. None of them may name a paragraph.
 */
public final class ReservedWords {

    private static final Set<String> STATEMENT_WORDS = Set.of(
            // verbs
            "ACCEPT", "ADD", "ALTER", "CALL", "CANCEL", "CLOSE", "COMPUTE", "CONTINUE", "DELETE",
            "DISPLAY", "DIVIDE", "ENTRY", "EVALUATE", "EXEC", "EXECUTE", "EXIT", "GENERATE", "GO",
            "GOBACK", "IF", "INITIALIZE", "INITIATE", "INSPECT", "INVOKE", "MERGE", "MOVE", "MULTIPLY",
            "OPEN", "PERFORM", "READ", "RELEASE", "RETURN", "REWRITE", "SEARCH", "SET", "SORT",
            "START", "STOP", "STRING", "SUBTRACT", "SUPPRESS", "TERMINATE", "UNSTRING", "USE", "WRITE",
            // clauses that lead a record inside a statement
            "ELSE", "WHEN", "THEN", "NEXT", "NOT", "OTHER", "AT", "INVALID", "ON", "UNTIL", "VARYING",
            "WITH", "TEST", "TIMES", "FOREVER",
            // scope terminators
            "END-ACCEPT", "END-ADD", "END-CALL", "END-COMPUTE", "END-DELETE", "END-DISPLAY",
            "END-DIVIDE", "END-EVALUATE", "END-EXEC", "END-IF", "END-MULTIPLY", "END-PERFORM",
            "END-READ", "END-RETURN", "END-REWRITE", "END-SEARCH", "END-START", "END-STRING",
            "END-SUBTRACT", "END-UNSTRING", "END-WRITE");

    private ReservedWords() {
    }

    public static boolean isStatementWord(String word) {
        return word != null && STATEMENT_WORDS.contains(word.toUpperCase(Locale.ROOT));
    }
}
