package cobol.mapper.scan;

import java.nio.file.Path;
import java.util.Objects;

/**
 * One source file to analyze, with the id that prefixes all of its artifacts.
 */
public record SourceUnit(
        String id,          // relative path with separators replaced by "__", suffixed "~N" on a clash
        Path path,
        String relativePath // '/'-separated, relative to the source root
) {
    public SourceUnit {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(relativePath, "relativePath");
    }
}
