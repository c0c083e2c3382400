package cobol.mapper.analysis;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import cobol.mapper.model.CanonicalRecord;

/**
 * Splits code fields into words, literals, parentheses and statement periods.
 * <p>
 * A literal left open at the end of a record ends there; continuation lines are not joined.
 * Commas and semicolons followed by a blank are separators and produce no token.
 */
final class Tokenizer {

    private Tokenizer() {
    }

    static List<Token> tokenize(List<CanonicalRecord> records) {
        final List<Token> out = new ArrayList<>();
        for (CanonicalRecord r : records) {
            tokenize(r.code(), r.sequence(), out);
        }
        return out;
    }

    static void tokenize(String code, int sequence, List<Token> out) {
        final int n = code.length();
        int i = 0;
        while (i < n) {
            final char c = code.charAt(i);

            if (Character.isWhitespace(c)) {
                i++;
                continue;
            }
            if (c == '\'' || c == '"') {
                final int end = endOfLiteral(code, i);
                out.add(new Token(Token.Kind.LITERAL, code.substring(i, end), sequence));
                i = end;
                continue;
            }
            if (c == '(') {
                out.add(new Token(Token.Kind.LPAREN, "(", sequence));
                i++;
                continue;
            }
            if (c == ')') {
                out.add(new Token(Token.Kind.RPAREN, ")", sequence));
                i++;
                continue;
            }
            if (isSeparator(code, i)) {
                if (c == '.') {
                    out.add(new Token(Token.Kind.PERIOD, ".", sequence));
                }
                i++;
                continue;
            }

            int end = i;
            while (end < n && !endsWord(code, end)) {
                end++;
            }
            out.add(new Token(Token.Kind.WORD, code.substring(i, end).toUpperCase(Locale.ROOT), sequence));
            i = end;
        }
    }

    private static boolean endsWord(String code, int i) {
        final char c = code.charAt(i);
        return Character.isWhitespace(c) || c == '\'' || c == '"' || c == '(' || c == ')' || isSeparator(code, i);
    }

    private static boolean isSeparator(String code, int i) {
        final char c = code.charAt(i);
        if (c != '.' && c != ',' && c != ';') return false;
        return i + 1 >= code.length() || Character.isWhitespace(code.charAt(i + 1));
    }

    // Doubled quotes stand for one quote character inside the literal.
    private static int endOfLiteral(String code, int start) {
        final char quote = code.charAt(start);
        int i = start + 1;
        while (i < code.length()) {
            if (code.charAt(i) == quote) {
                if (i + 1 < code.length() && code.charAt(i + 1) == quote) {
                    i += 2;
                    continue;
                }
                return i + 1;
            }
            i++;
        }
        return code.length();
    }
}
