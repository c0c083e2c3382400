package cobol.mapper;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.util.List;

import cobol.mapper.config.ConfigLoader;
import cobol.mapper.config.MapperConfig;
import cobol.mapper.config.PipelineSettings;
import cobol.mapper.io.DotRenderer;
import cobol.mapper.io.GraphWriter;
import cobol.mapper.pipeline.BatchRunner;
import cobol.mapper.pipeline.UnitOutcome;
import cobol.mapper.pipeline.UnitProcessor;
import cobol.mapper.scan.SourceFinder;
import cobol.mapper.scan.SourceUnit;

public final class Main {

    public static void main(String[] args) {
        final int code = run(args);
        if (code != 0) {
            System.exit(code);
        }
    }

    /**
     * @return 0 when every unit succeeded, 1 when a unit failed, 2 on usage, configuration or IO errors
     */
    static int run(String[] args) {
        String sourceDir = null;
        Path configFile = null;
        String outDir = null;
        String workDir = null;
        Integer threads = null;
        Boolean renderPng = null;

        try {
            for (String arg : args) {
                if ("--help".equals(arg) || "-h".equals(arg)) {
                    printUsage();
                    return 0;
                }
                if (arg.startsWith("--config=")) {
                    configFile = Paths.get(arg.substring("--config=".length()));
                    continue;
                }
                if (arg.startsWith("--outDir=")) {
                    outDir = arg.substring("--outDir=".length());
                    continue;
                }
                if (arg.startsWith("--workDir=")) {
                    workDir = arg.substring("--workDir=".length());
                    continue;
                }
                if (arg.startsWith("--threads=")) {
                    threads = Integer.parseInt(arg.substring("--threads=".length()).trim());
                    continue;
                }
                if (arg.startsWith("--renderPng=")) {
                    renderPng = Boolean.parseBoolean(arg.substring("--renderPng=".length()));
                    continue;
                }
                if (arg.startsWith("--")) {
                    System.err.println("ERROR: unknown argument: " + arg);
                    printUsage();
                    return 2;
                }
                if (sourceDir == null) {
                    sourceDir = arg;
                    continue;
                }
                System.err.println("ERROR: unexpected argument: " + arg);
                printUsage();
                return 2;
            }

            MapperConfig config = configFile != null ? new ConfigLoader().load(configFile) : MapperConfig.defaults();

            // Flags override the file
            PipelineSettings settings = config.pipeline();
            if (sourceDir != null) settings = settings.withSourceDir(sourceDir);
            if (outDir != null) settings = settings.withOutputDir(outDir);
            if (workDir != null) settings = settings.withWorkDir(workDir);
            if (threads != null) settings = settings.withThreads(threads);
            if (renderPng != null) settings = settings.withRenderPng(renderPng);
            config = config.withPipeline(settings);

            final Path sourceRoot = Paths.get(settings.sourceDir()).toAbsolutePath().normalize();
            final Path outputRoot = Paths.get(settings.outputDir()).toAbsolutePath().normalize();
            final Path workRoot = Paths.get(settings.workDir()).toAbsolutePath().normalize();

            final List<SourceUnit> units =
                    new SourceFinder(sourceRoot, settings.sourceExtensions(), settings.recurse()).findUnits();

            final GraphWriter writer = new GraphWriter(workRoot, outputRoot, config.analysis().outputCharset());
            final DotRenderer renderer = settings.renderPng() ? new DotRenderer(settings.dotCommand()) : null;
            final UnitProcessor processor = new UnitProcessor(config.analysis(), writer, renderer);

            final List<UnitOutcome> outcomes = new BatchRunner(processor, settings.threads()).run(units);
            writer.writeIndex(outcomes, Instant.now().toString());

            int failed = 0;
            for (UnitOutcome o : outcomes) {
                if (!o.succeeded()) {
                    failed++;
                    System.out.println("FAILED " + o.unit().relativePath() + " [" + o.errorKind() + "] " + safeMsg(o.message()));
                }
            }
            System.out.println("Graphs written to: " + outputRoot);
            System.out.println("Canonical files written to: " + workRoot);
            System.out.println("Units: " + outcomes.size() + ", succeeded: " + (outcomes.size() - failed) + ", failed: " + failed);
            return failed == 0 ? 0 : 1;
        } catch (NumberFormatException ex) {
            System.err.println("ERROR: invalid number: " + safeMsg(ex.getMessage()));
            printUsage();
            return 2;
        } catch (IllegalArgumentException ex) {
            System.err.println("ERROR: invalid configuration: " + safeMsg(ex.getMessage()));
            return 2;
        } catch (IOException ex) {
            System.err.println("ERROR: IO failure: " + safeMsg(ex.getMessage()));
            return 2;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            System.err.println("ERROR: interrupted");
            return 2;
        }
    }

    private static void printUsage() {
        System.out.println("Usage: cobol-mapper [sourceDir] [options]");
        System.out.println("Options:");
        System.out.println("  --config=<path>       YAML configuration file (default: built-in settings)");
        System.out.println("  --outDir=<path>       Output directory for .dot, .analysis.json and index.json (default: ./output)");
        System.out.println("  --workDir=<path>      Directory for canonical .etude files (default: ./work)");
        System.out.println("  --threads=<n>         Units analyzed in parallel (default: 1)");
        System.out.println("  --renderPng=<bool>    Render each graph to PNG with Graphviz dot (default: false)");
        System.out.println("  --help, -h            Show this help");
    }

    private static String safeMsg(String msg) {
        if (msg == null) {
            return "";
        }
        return msg.length() > 200 ? msg.substring(0, 200) + "..." : msg;
    }
}
