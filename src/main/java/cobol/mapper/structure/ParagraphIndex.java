package cobol.mapper.structure;

import java.util.LinkedHashMap;
import java.util.Map;

import cobol.mapper.model.Names;
import cobol.mapper.model.Paragraph;

/**
 * Unit-wide paragraph lookup for light resolution:
 * - normalized name -> paragraph
 * - name with the fallback suffix removed -> paragraph, when the full name is unknown
 */
public final class ParagraphIndex {

    private final Map<String, Paragraph> byName = new LinkedHashMap<>();

    /**
     * @return the paragraph already registered under the same normalized name, or null
     */
    Paragraph register(Paragraph paragraph) {
        return byName.putIfAbsent(Names.normalize(paragraph.name()), paragraph);
    }

    public Paragraph find(String name) {
        final String key = Names.normalize(name);
        if (key.isEmpty()) return null;
        return byName.get(key);
    }

    /**
     * Resolves a target name as written in a statement.
     *
     * @return the matching paragraph name, or null when the target is unknown
     */
    public String resolve(String target, String fallbackSuffix) {
        final String key = Names.normalize(target);
        if (key.isEmpty()) return null;

        final Paragraph exact = byName.get(key);
        if (exact != null) return exact.name();

        // PARA-F is often written for a paragraph labeled PARA
        if (fallbackSuffix != null && !fallbackSuffix.isEmpty()) {
            final String suffix = Names.normalize(fallbackSuffix);
            if (key.length() > suffix.length() && key.endsWith(suffix)) {
                final Paragraph stripped = byName.get(key.substring(0, key.length() - suffix.length()));
                if (stripped != null) return stripped.name();
            }
        }
        return null;
    }
}
