package cobol.mapper.scan;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import cobol.mapper.model.Names;

/**
 * Lists the source units under a root directory:
 * - regular files whose name ends with one of the configured extensions (case-insensitive)
 * - below the root only when recursion is on
 * Units come back sorted by relative path. Unit ids are unique: when two paths flatten to
 * the same id, the later one gets a {@code ~N} suffix.
 */
public final class SourceFinder {

    private static final Logger log = LoggerFactory.getLogger(SourceFinder.class);

    private final Path root;
    private final List<String> extensions;
    private final boolean recurse;

    public SourceFinder(Path root, List<String> extensions, boolean recurse) {
        this.root = Objects.requireNonNull(root, "root").toAbsolutePath().normalize();
        this.extensions = new ArrayList<>();
        for (String ext : Objects.requireNonNull(extensions, "extensions")) {
            this.extensions.add(ext.toLowerCase(Locale.ROOT));
        }
        this.recurse = recurse;
    }

    public List<SourceUnit> findUnits() throws IOException {
        if (!Files.isDirectory(root)) {
            throw new IOException("source directory does not exist: " + root);
        }

        final List<SourceUnit> units = new ArrayList<>();
        Files.walkFileTree(root, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                if (dir.equals(root)) return FileVisitResult.CONTINUE;
                if (!recurse) return FileVisitResult.SKIP_SUBTREE;

                // Skip typical tool dirs
                final String name = dir.getFileName() != null ? dir.getFileName().toString() : "";
                if (".git".equals(name) || ".svn".equals(name) || ".idea".equals(name)) {
                    return FileVisitResult.SKIP_SUBTREE;
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                if (attrs.isRegularFile() && hasSourceExtension(file)) {
                    units.add(toUnit(file));
                }
                return FileVisitResult.CONTINUE;
            }
        });

        units.sort(Comparator.comparing(SourceUnit::relativePath));
        return uniqueIds(units);
    }

    static List<SourceUnit> uniqueIds(List<SourceUnit> units) {
        final Set<String> taken = new HashSet<>();
        for (SourceUnit u : units) {
            taken.add(u.id());
        }
        final Set<String> seen = new HashSet<>();
        final List<SourceUnit> out = new ArrayList<>(units.size());
        for (SourceUnit u : units) {
            if (seen.add(u.id())) {
                out.add(u);
                continue;
            }
            int n = 2;
            String id = u.id() + "~" + n;
            while (taken.contains(id)) {
                id = u.id() + "~" + (++n);
            }
            taken.add(id);
            seen.add(id);
            log.warn("{}: unit id {} already taken, using {}", u.relativePath(), u.id(), id);
            out.add(new SourceUnit(id, u.path(), u.relativePath()));
        }
        return out;
    }

    SourceUnit toUnit(Path file) {
        final Path rel = root.relativize(file.toAbsolutePath().normalize());
        final StringBuilder sb = new StringBuilder();
        for (int i = 0; i < rel.getNameCount(); i++) {
            if (i > 0) sb.append('/');
            sb.append(rel.getName(i));
        }
        final String relative = sb.toString();
        return new SourceUnit(Names.unitId(relative), file, relative);
    }

    private boolean hasSourceExtension(Path file) {
        final String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        for (String ext : extensions) {
            if (name.endsWith(ext)) {
                return true;
            }
        }
        return false;
    }
}
