package io.laminar.core.pipeline;

import io.laminar.core.exception.LaminarException;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Processes the sheets of a workbook concurrently on a bounded worker pool.
///
/// Each sheet is independent: a failure is recorded in the {@link BatchSummary} and the
/// remaining sheets continue. {@link #cancel()} stops dispatching sheets that have not
/// started yet; sheets already running finish and keep their output.
///
/// @implNote The pool is created per {@link #run} call and shut down before it returns.
/// Each run starts uncancelled; a {@link #cancel()} issued before or during a run affects
/// that run only.
public final class BatchProcessor {

    private static final Logger logger = Logger.getLogger(BatchProcessor.class.getName());

    private final SheetPipeline pipeline;
    private final int workers;
    private final AtomicBoolean cancelled = new AtomicBoolean();

    /// @param pipeline shared pipeline, not null
    /// @param workers maximum number of sheets processed at once, positive
    public BatchProcessor(SheetPipeline pipeline, int workers) {
        if (workers < 1) {
            throw new IllegalArgumentException("workers must be positive: " + workers);
        }
        this.pipeline = pipeline;
        this.workers = workers;
    }

    /// Processes every task and waits for all of them.
    ///
    /// @param tasks sheets to process, not null
    /// @param sink receiver of successful results, not null
    /// @return one outcome per task in submission order, never null
    public BatchSummary run(List<SheetTask> tasks, SheetResultSink sink) {
        if (cancelled.getAndSet(false)) {
            logger.fine("Cancellation requested before start; dispatching nothing");
            return finish(cancelledAll(tasks));
        }

        AtomicInteger threadCounter = new AtomicInteger();
        ExecutorService pool =
                Executors.newFixedThreadPool(
                        Math.min(workers, Math.max(1, tasks.size())),
                        runnable -> {
                            Thread thread =
                                    new Thread(
                                            runnable,
                                            "laminar-worker-" + threadCounter.incrementAndGet());
                            thread.setDaemon(true);
                            return thread;
                        });

        List<SheetOutcome> outcomes = new ArrayList<>();
        try {
            List<Future<SheetOutcome>> futures = new ArrayList<>();
            for (SheetTask task : tasks) {
                futures.add(pool.submit(() -> execute(task, sink)));
            }
            for (int i = 0; i < futures.size(); i++) {
                outcomes.add(await(futures.get(i), tasks.get(i)));
            }
        } finally {
            pool.shutdown();
        }

        cancelled.set(false);
        return finish(outcomes);
    }

    private static List<SheetOutcome> cancelledAll(List<SheetTask> tasks) {
        List<SheetOutcome> outcomes = new ArrayList<>();
        for (SheetTask task : tasks) {
            outcomes.add(SheetOutcome.cancelled(task.sheetName()));
        }
        return outcomes;
    }

    private static BatchSummary finish(List<SheetOutcome> outcomes) {
        BatchSummary summary = new BatchSummary(outcomes);
        logger.info(
                "Batch finished: "
                        + summary.succeeded().size()
                        + " succeeded, "
                        + summary.failed().size()
                        + " failed, "
                        + summary.cancelled().size()
                        + " cancelled");
        return summary;
    }

    /// Stops dispatching sheets that have not started yet.
    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    private SheetOutcome execute(SheetTask task, SheetResultSink sink) {
        if (cancelled.get()) {
            return SheetOutcome.cancelled(task.sheetName());
        }
        try {
            SheetResult result = task.run(pipeline);
            sink.accept(result);
            return SheetOutcome.succeeded(result);
        } catch (LaminarException e) {
            logger.severe("Sheet '" + task.sheetName() + "' failed: " + e.getMessage());
            return SheetOutcome.failed(task.sheetName(), e.getMessage());
        } catch (IOException e) {
            logger.log(Level.SEVERE, "Cannot write output of sheet '" + task.sheetName() + "'", e);
            return SheetOutcome.failed(task.sheetName(), "Cannot write output: " + e.getMessage());
        } catch (RuntimeException e) {
            logger.log(Level.SEVERE, "Unexpected error in sheet '" + task.sheetName() + "'", e);
            return SheetOutcome.failed(task.sheetName(), "Unexpected error: " + e);
        }
    }

    private SheetOutcome await(Future<SheetOutcome> future, SheetTask task) {
        try {
            return future.get();
        } catch (CancellationException e) {
            return SheetOutcome.cancelled(task.sheetName());
        } catch (ExecutionException e) {
            return SheetOutcome.failed(task.sheetName(), "Unexpected error: " + e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancel();
            return SheetOutcome.cancelled(task.sheetName());
        }
    }
}
