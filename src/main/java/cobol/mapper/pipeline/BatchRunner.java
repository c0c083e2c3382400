package cobol.mapper.pipeline;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import cobol.mapper.model.ErrorKind;
import cobol.mapper.scan.SourceUnit;

/**
 * Runs one task per unit on a fixed pool. Outcomes come back in source order;
 * a failed unit never stops the others.
 */
public final class BatchRunner {

    private static final Logger log = LoggerFactory.getLogger(BatchRunner.class);

    private final UnitProcessor processor;
    private final int threads;

    public BatchRunner(UnitProcessor processor, int threads) {
        this.processor = Objects.requireNonNull(processor, "processor");
        if (threads < 1) {
            throw new IllegalArgumentException("threads must be >= 1: " + threads);
        }
        this.threads = threads;
    }

    public List<UnitOutcome> run(List<SourceUnit> units) throws InterruptedException {
        Objects.requireNonNull(units, "units");
        if (units.isEmpty()) return List.of();

        final int poolSize = Math.min(threads, units.size());
        log.info("processing {} unit(s) on {} thread(s)", units.size(), poolSize);

        final ExecutorService pool = Executors.newFixedThreadPool(poolSize);
        try {
            final List<Future<UnitOutcome>> futures = new ArrayList<>(units.size());
            for (SourceUnit unit : units) {
                futures.add(pool.submit(() -> processor.process(unit)));
            }

            final List<UnitOutcome> outcomes = new ArrayList<>(units.size());
            for (int i = 0; i < futures.size(); i++) {
                try {
                    outcomes.add(futures.get(i).get());
                } catch (ExecutionException ex) {
                    final Throwable cause = ex.getCause();
                    if (cause instanceof Error) {
                        throw (Error) cause;
                    }
                    final SourceUnit unit = units.get(i);
                    log.error("{}: unexpected failure", unit.id(), cause);
                    outcomes.add(UnitOutcome.failure(unit, ErrorKind.INTERNAL, String.valueOf(cause)));
                }
            }
            return outcomes;
        } finally {
            pool.shutdownNow();
        }
    }
}
