package cobol.mapper.config;

import java.util.List;
import java.util.Objects;

/**
 * Batch-level settings: where units come from and where artifacts go.
 */
public record PipelineSettings(
        String sourceDir,
        List<String> sourceExtensions,
        boolean recurse,
        String workDir,
        String outputDir,
        int threads,
        boolean renderPng,
        String dotCommand
) {
    public PipelineSettings {
        Objects.requireNonNull(sourceDir, "sourceDir");
        sourceExtensions = List.copyOf(Objects.requireNonNull(sourceExtensions, "sourceExtensions"));
        Objects.requireNonNull(workDir, "workDir");
        Objects.requireNonNull(outputDir, "outputDir");
        dotCommand = dotCommand == null || dotCommand.isBlank() ? "dot" : dotCommand;
        if (threads < 1) {
            throw new IllegalArgumentException("threads must be >= 1: " + threads);
        }
        if (sourceExtensions.isEmpty()) {
            throw new IllegalArgumentException("sourceExtensions must not be empty");
        }
    }

    public static PipelineSettings defaults() {
        return new PipelineSettings(
                "./sources",
                List.of(".cbl", ".cob"),
                true,
                "./work",
                "./output",
                1,
                false,
                "dot");
    }

    public PipelineSettings withSourceDir(String dir) {
        return new PipelineSettings(dir, sourceExtensions, recurse, workDir, outputDir, threads, renderPng, dotCommand);
    }

    public PipelineSettings withWorkDir(String dir) {
        return new PipelineSettings(sourceDir, sourceExtensions, recurse, dir, outputDir, threads, renderPng, dotCommand);
    }

    public PipelineSettings withOutputDir(String dir) {
        return new PipelineSettings(sourceDir, sourceExtensions, recurse, workDir, dir, threads, renderPng, dotCommand);
    }

    public PipelineSettings withThreads(int n) {
        return new PipelineSettings(sourceDir, sourceExtensions, recurse, workDir, outputDir, n, renderPng, dotCommand);
    }

    public PipelineSettings withRenderPng(boolean render) {
        return new PipelineSettings(sourceDir, sourceExtensions, recurse, workDir, outputDir, threads, render, dotCommand);
    }
}
