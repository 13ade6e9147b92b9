package info.isaksson.erland.constructtiers.core;

import info.isaksson.erland.constructtiers.classify.ClassificationException;
import info.isaksson.erland.constructtiers.classify.ClassifierEngine;
import info.isaksson.erland.constructtiers.ir.NodeArena;
import info.isaksson.erland.constructtiers.report.FileReport;
import info.isaksson.erland.constructtiers.report.ReportEmitter;
import info.isaksson.erland.constructtiers.rules.RuleTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

/**
 * Core API for classifying source files against one rule table.
 *
 * <p>Each file is classified independently. A file that fails yields a
 * {@link ClassificationError}; the other files of the run are unaffected.</p>
 */
public final class ClassificationService {

    private static final Logger LOG = LoggerFactory.getLogger(ClassificationService.class);

    private final ClassifierEngine engine;
    private final ReportEmitter emitter = new ReportEmitter();

    public ClassificationService(RuleTable table) {
        if (table == null) throw new IllegalArgumentException("table must not be null");
        this.engine = new ClassifierEngine(table);
    }

    public RuleTable table() {
        return engine.table();
    }

    /** Classify one file and report on it. Never throws for per-file failures. */
    public FileOutcome classifyFile(NodeArena arena) {
        if (arena == null) throw new IllegalArgumentException("arena must not be null");
        try {
            FileReport report = emitter.emit(engine.classify(arena));
            return FileOutcome.success(report);
        } catch (ClassificationException e) {
            LOG.warn("{}: classification failed ({}): {}", arena.file, e.code, e.getMessage());
            return FileOutcome.failure(ClassificationError.of(e));
        }
    }

    public ClassificationRun classifyAll(List<NodeArena> arenas, int parallelism) throws InterruptedException {
        return classifyAll(arenas, parallelism, () -> false);
    }

    /**
     * Classify many files on a fixed pool of {@code parallelism} workers.
     *
     * <p>{@code cancel} is checked before each file starts. Once it returns true, files not yet
     * started are skipped and listed as cancelled; files already running finish normally.</p>
     */
    public ClassificationRun classifyAll(List<NodeArena> arenas, int parallelism, BooleanSupplier cancel)
            throws InterruptedException {
        if (arenas == null) throw new IllegalArgumentException("arenas must not be null");
        if (cancel == null) throw new IllegalArgumentException("cancel must not be null");
        if (parallelism < 1) throw new IllegalArgumentException("parallelism must be at least 1, got " + parallelism);
        for (NodeArena a : arenas) {
            if (a == null) throw new IllegalArgumentException("arenas must not contain null");
        }
        if (arenas.isEmpty()) return new ClassificationRun(List.of(), List.of());

        int workers = Math.min(parallelism, arenas.size());
        ExecutorService pool = Executors.newFixedThreadPool(workers, new WorkerThreadFactory());
        List<FileOutcome> outcomes = new ArrayList<>(arenas.size());
        List<String> cancelled = new ArrayList<>();
        try {
            List<Future<FileOutcome>> futures = new ArrayList<>(arenas.size());
            for (NodeArena arena : arenas) {
                futures.add(pool.submit(() -> cancel.getAsBoolean() ? null : classifyFile(arena)));
            }
            for (int i = 0; i < futures.size(); i++) {
                FileOutcome o = await(futures.get(i));
                if (o == null) {
                    cancelled.add(arenas.get(i).file);
                } else {
                    outcomes.add(o);
                }
            }
        } finally {
            pool.shutdownNow();
        }

        ClassificationRun run = new ClassificationRun(outcomes, cancelled);
        LOG.info("Classified {} file(s) with {} worker(s): {} report(s), {} failure(s), {} cancelled",
                arenas.size(), workers, run.reports().size(), run.failures().size(), cancelled.size());
        return run;
    }

    private static FileOutcome await(Future<FileOutcome> future) throws InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) throw (RuntimeException) cause;
            if (cause instanceof Error) throw (Error) cause;
            throw new IllegalStateException("classification worker failed", cause);
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger next = new AtomicInteger(1);

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "construct-tiers-worker-" + next.getAndIncrement());
            t.setDaemon(true);
            return t;
        }
    }
}
