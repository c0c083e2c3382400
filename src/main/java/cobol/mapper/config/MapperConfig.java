package cobol.mapper.config;

import java.util.Objects;

/**
 * Root of the YAML configuration: {@code analysis:} and {@code pipeline:} sections.
 */
public record MapperConfig(
        AnalyzerConfig analysis,
        PipelineSettings pipeline
) {
    public MapperConfig {
        Objects.requireNonNull(analysis, "analysis");
        Objects.requireNonNull(pipeline, "pipeline");
    }

    public static MapperConfig defaults() {
        return new MapperConfig(AnalyzerConfig.defaults(), PipelineSettings.defaults());
    }

    public MapperConfig withPipeline(PipelineSettings settings) {
        return new MapperConfig(analysis, settings);
    }
}
