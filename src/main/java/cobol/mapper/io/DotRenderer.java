package cobol.mapper.io;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rasterizes a DOT file through the external Graphviz {@code dot} program.
 * A failure is logged and reported as {@code false}; it never fails the unit.
 */
public final class DotRenderer {

    private static final Logger log = LoggerFactory.getLogger(DotRenderer.class);

    private static final long TIMEOUT_SECONDS = 120;

    private final String command;

    public DotRenderer(String command) {
        this.command = Objects.requireNonNull(command, "command");
    }

    public boolean renderPng(Path dotFile, Path pngFile) {
        final List<String> cmd = List.of(command, "-Tpng", dotFile.toString(), "-o", pngFile.toString());
        try {
            final Process process = new ProcessBuilder(cmd)
                    .redirectErrorStream(true)
                    .redirectOutput(ProcessBuilder.Redirect.DISCARD)
                    .start();
            if (!process.waitFor(TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                process.destroyForcibly();
                log.warn("{} timed out rendering {}", command, dotFile.getFileName());
                return false;
            }
            if (process.exitValue() != 0) {
                log.warn("{} exited with {} rendering {}", command, process.exitValue(), dotFile.getFileName());
                return false;
            }
            log.debug("rendered {}", pngFile.getFileName());
            return true;
        } catch (IOException ex) {
            log.warn("cannot run {}: {}", command, ex.getMessage());
            return false;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            log.warn("interrupted while rendering {}", dotFile.getFileName());
            return false;
        }
    }
}
