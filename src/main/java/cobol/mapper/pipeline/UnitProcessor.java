package cobol.mapper.pipeline;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import cobol.mapper.analysis.AnalysisResult;
import cobol.mapper.analysis.InteractionAnalyzer;
import cobol.mapper.config.AnalyzerConfig;
import cobol.mapper.graph.DotSerializer;
import cobol.mapper.graph.GraphBuilder;
import cobol.mapper.graph.GraphModel;
import cobol.mapper.io.DotRenderer;
import cobol.mapper.io.GraphWriter;
import cobol.mapper.model.CanonicalRecord;
import cobol.mapper.model.ErrorKind;
import cobol.mapper.model.UnitAnalysisException;
import cobol.mapper.scan.Normalizer;
import cobol.mapper.scan.SourceUnit;
import cobol.mapper.structure.ProgramStructure;
import cobol.mapper.structure.StructureExtractor;

/**
 * Runs the four stages on one unit and writes its artifacts.
 * <p>
 * Stages share no state between units, so one instance serves every worker thread.
 * Nothing is written unless all stages succeed.
 */
public final class UnitProcessor {

    private static final Logger log = LoggerFactory.getLogger(UnitProcessor.class);

    private final Normalizer normalizer;
    private final StructureExtractor extractor;
    private final InteractionAnalyzer analyzer;
    private final GraphBuilder graphBuilder;
    private final GraphWriter writer;
    private final DotRenderer renderer;   // null when PNG rendering is off

    public UnitProcessor(AnalyzerConfig config, GraphWriter writer, DotRenderer renderer) {
        Objects.requireNonNull(config, "config");
        this.normalizer = new Normalizer(config);
        this.extractor = new StructureExtractor(config);
        this.analyzer = new InteractionAnalyzer(config);
        this.graphBuilder = new GraphBuilder(config);
        this.writer = Objects.requireNonNull(writer, "writer");
        this.renderer = renderer;
    }

    public UnitOutcome process(SourceUnit unit) {
        final byte[] raw;
        try {
            raw = Files.readAllBytes(unit.path());
        } catch (IOException ex) {
            return failed(unit, ErrorKind.IO, "cannot read " + unit.relativePath() + ": " + ex.getMessage());
        }

        final UnitReport report;
        try {
            report = analyze(unit.id(), raw);
        } catch (UnitAnalysisException ex) {
            return failed(unit, ex.kind(), ex.getMessage());
        }

        final List<Path> artifacts;
        try {
            artifacts = new ArrayList<>(writer.writeUnit(unit.id(), report.canonicalText(), report.dot(), report.result()));
        } catch (IOException ex) {
            return failed(unit, ErrorKind.IO, "cannot write artifacts: " + ex.getMessage());
        }

        if (renderer != null) {
            final Path png = writer.pngFile(unit.id());
            if (renderer.renderPng(writer.dotFile(unit.id()), png)) {
                artifacts.add(png);
            }
        }

        log.info("{}: {} paragraph(s), {} edge(s), {} exit(s)", unit.id(),
                report.result().stats().paragraphs(), report.result().stats().totalEdges(),
                report.result().stats().totalExits());
        return UnitOutcome.success(unit, artifacts, report.result().stats());
    }

    /**
     * Runs Normalizer, StructureExtractor, InteractionAnalyzer and GraphBuilder in order.
     */
    public UnitReport analyze(String unitId, byte[] raw) throws UnitAnalysisException {
        final List<CanonicalRecord> records = normalizer.normalize(unitId, raw);
        final ProgramStructure structure = extractor.extract(unitId, records);
        final AnalysisResult result = analyzer.analyze(structure);
        final GraphModel graph = graphBuilder.build(result);
        return new UnitReport(records, normalizer.toText(records), result, graph, DotSerializer.serialize(graph));
    }

    private static UnitOutcome failed(SourceUnit unit, ErrorKind kind, String message) {
        log.warn("{}: {} {}", unit.id(), kind, message);
        return UnitOutcome.failure(unit, kind, message);
    }
}
