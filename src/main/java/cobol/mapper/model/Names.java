package cobol.mapper.model;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

public final class Names {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z0-9][A-Za-z0-9-]*");

    public static final int MAX_IDENTIFIER_LENGTH = 30;

    private Names() {
    }

    /**
     * Canonical form of a paragraph or target name: trimmed, inner blanks removed, upper case.
     */
    public static String normalize(String name) {
        if (name == null) {
            return "";
        }
        final String raw = name.trim();
        if (raw.isEmpty()) {
            return raw;
        }
        final StringBuilder sb = new StringBuilder(raw.length());
        for (int i = 0; i < raw.length(); i++) {
            final char c = raw.charAt(i);
            if (!Character.isWhitespace(c)) {
                sb.append(c);
            }
        }
        return sb.toString().toUpperCase(Locale.ROOT);
    }

    public static boolean isIdentifier(String token) {
        return token != null
                && token.length() <= MAX_IDENTIFIER_LENGTH
                && IDENTIFIER.matcher(token).matches();
    }

    public static String exitNodeId(ExitKind kind, String identifier) {
        Objects.requireNonNull(kind, "kind");
        return identifier == null ? "exit:" + kind.name() : "exit:" + kind.name() + ":" + identifier;
    }

    /**
     * Unit id of a source path relative to the source root, e.g. {@code sub/PROG.cbl -> sub__PROG.cbl}.
     */
    public static String unitId(String relativePath) {
        Objects.requireNonNull(relativePath, "relativePath");
        return relativePath.replace('\\', '/').replace("/", "__");
    }

    public static String stripQuotes(String literal) {
        if (literal == null || literal.length() < 2) {
            return literal;
        }
        final char first = literal.charAt(0);
        final char last = literal.charAt(literal.length() - 1);
        if ((first == '\'' || first == '"') && last == first) {
            return literal.substring(1, literal.length() - 1);
        }
        return literal;
    }
}
