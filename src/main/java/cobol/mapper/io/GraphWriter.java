package cobol.mapper.io;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import cobol.mapper.analysis.AnalysisResult;
import cobol.mapper.pipeline.UnitOutcome;

/**
 * Writes the durable artifacts of a batch:
 * - {@code <workDir>/<unit>.etude}: canonical records, in the output encoding
 * - {@code <outputDir>/<unit>.dot} and {@code <outputDir>/<unit>.analysis.json}
 * - {@code <outputDir>/index.json}: one entry per unit
 * Each file goes through a temporary sibling moved into place, so a reader never sees half a file.
 */
public final class GraphWriter {

    public static final String SCHEMA_VERSION = "cobol-mapper/index/v1";

    private static final Logger log = LoggerFactory.getLogger(GraphWriter.class);

    private final Path workDir;
    private final Path outDir;
    private final Charset outputEncoding;
    private final ObjectMapper jsonMapper;

    public GraphWriter(Path workDir, Path outDir, Charset outputEncoding) {
        this.workDir = Objects.requireNonNull(workDir, "workDir");
        this.outDir = Objects.requireNonNull(outDir, "outDir");
        this.outputEncoding = Objects.requireNonNull(outputEncoding, "outputEncoding");
        this.jsonMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    public Path etudeFile(String unitId) {
        return workDir.resolve(unitId + ".etude");
    }

    public Path dotFile(String unitId) {
        return outDir.resolve(unitId + ".dot");
    }

    public Path analysisFile(String unitId) {
        return outDir.resolve(unitId + ".analysis.json");
    }

    public Path pngFile(String unitId) {
        return outDir.resolve(unitId + ".png");
    }

    /**
     * Writes all artifacts of one unit. On failure the files already written for the unit are removed.
     *
     * @return the written files, in write order
     */
    public List<Path> writeUnit(String unitId, String canonicalText, String dot, AnalysisResult result) throws IOException {
        Objects.requireNonNull(unitId, "unitId");
        Objects.requireNonNull(canonicalText, "canonicalText");
        Objects.requireNonNull(dot, "dot");
        Objects.requireNonNull(result, "result");

        final List<Path> written = new ArrayList<>(3);
        try {
            Files.createDirectories(workDir);
            Files.createDirectories(outDir);

            writeAtomically(etudeFile(unitId), canonicalText.getBytes(outputEncoding));
            written.add(etudeFile(unitId));

            writeAtomically(dotFile(unitId), dot.getBytes(StandardCharsets.UTF_8));
            written.add(dotFile(unitId));

            writeAtomically(analysisFile(unitId), jsonMapper.writeValueAsBytes(AnalysisDocument.from(result)));
            written.add(analysisFile(unitId));
        } catch (IOException ex) {
            discard(written);
            throw ex;
        }
        return written;
    }

    public Path writeIndex(List<UnitOutcome> outcomes, String generatedAt) throws IOException {
        Objects.requireNonNull(outcomes, "outcomes");
        Objects.requireNonNull(generatedAt, "generatedAt");

        Files.createDirectories(outDir);

        final List<UnitEntry> units = new ArrayList<>(outcomes.size());
        int ok = 0;
        int failed = 0;
        int paragraphs = 0;
        int edges = 0;
        int exits = 0;
        int unresolved = 0;
        int suppressed = 0;

        for (UnitOutcome o : outcomes) {
            if (o.succeeded()) {
                ok++;
                paragraphs += o.stats().paragraphs();
                edges += o.stats().totalEdges();
                exits += o.stats().totalExits();
                unresolved += o.stats().unresolvedEdges();
                suppressed += o.stats().suppressedPerforms();
                units.add(new UnitEntry(o.unit().id(), o.unit().relativePath(), "OK", fileNames(o.artifacts()),
                        null, null));
            } else {
                failed++;
                units.add(new UnitEntry(o.unit().id(), o.unit().relativePath(), "FAILED", List.of(),
                        o.errorKind().name(), o.message()));
            }
        }

        final MasterIndex idx = new MasterIndex(
                SCHEMA_VERSION,
                generatedAt,
                units,
                new Summary(outcomes.size(), ok, failed, paragraphs, edges, exits, unresolved, suppressed));

        final Path file = outDir.resolve("index.json");
        writeAtomically(file, jsonMapper.writeValueAsBytes(idx));
        return file;
    }

    private static List<String> fileNames(List<Path> files) {
        final List<String> out = new ArrayList<>(files.size());
        for (Path p : files) {
            out.add(p.getFileName().toString());
        }
        return out;
    }

    static void writeAtomically(Path file, byte[] bytes) throws IOException {
        final Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
        try {
            Files.write(tmp, bytes);
            try {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException ex) {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    private static void discard(List<Path> written) {
        for (Path p : written) {
            try {
                Files.deleteIfExists(p);
            } catch (IOException ex) {
                log.warn("could not remove partial artifact {}: {}", p, ex.getMessage());
            }
        }
    }

    // --- index records ---

    public record MasterIndex(
            String schema,
            String generatedAt,
            List<UnitEntry> units,
            Summary summary
    ) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record UnitEntry(
            String id,
            String source,
            String status,      // OK | FAILED
            List<String> artifacts,
            String errorKind,
            String message
    ) {
    }

    public record Summary(
            int units,
            int succeeded,
            int failed,
            int paragraphs,
            int edges,
            int exits,
            int unresolvedEdges,
            int suppressedPerforms
    ) {
    }
}
