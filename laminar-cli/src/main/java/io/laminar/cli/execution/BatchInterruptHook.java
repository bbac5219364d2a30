package io.laminar.cli.execution;

import io.laminar.core.pipeline.BatchProcessor;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

/// Cancels a running batch when the JVM is asked to stop, e.g. on Ctrl+C.
///
/// The hook stops the processor from dispatching further sheets and then holds the
/// shutdown for up to the grace period, so sheets already running can finish writing
/// and the caller can print its summary. Closing the hook marks the batch as finished
/// and unregisters it.
///
/// ```java
/// try (BatchInterruptHook hook = BatchInterruptHook.install(processor, GRACE)) {
///     summary = processor.run(tasks, writer);
///     printSummary(summary);
/// }
/// ```
public final class BatchInterruptHook implements AutoCloseable {

    private static final Logger logger = Logger.getLogger(BatchInterruptHook.class.getName());

    private final BatchProcessor processor;
    private final Duration grace;
    private final CountDownLatch finished = new CountDownLatch(1);
    private final Thread thread;

    BatchInterruptHook(BatchProcessor processor, Duration grace) {
        this.processor = processor;
        this.grace = grace;
        this.thread = new Thread(this::interrupt, "laminar-interrupt");
    }

    /// Registers a hook for the given processor.
    ///
    /// @param processor batch to cancel on shutdown, not null
    /// @param grace maximum time shutdown waits for the batch, not null
    /// @return registered hook, never null
    public static BatchInterruptHook install(BatchProcessor processor, Duration grace) {
        BatchInterruptHook hook = new BatchInterruptHook(processor, grace);
        Runtime.getRuntime().addShutdownHook(hook.thread);
        return hook;
    }

    /// Cancels the batch and waits until it is closed or the grace period ends.
    void interrupt() {
        logger.warning("Shutdown requested; cancelling sheets that have not started");
        processor.cancel();
        try {
            if (!finished.await(grace.toMillis(), TimeUnit.MILLISECONDS)) {
                logger.warning("Batch did not finish within " + grace + "; exiting");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    boolean isFinished() {
        return finished.getCount() == 0;
    }

    @Override
    public void close() {
        finished.countDown();
        try {
            Runtime.getRuntime().removeShutdownHook(thread);
        } catch (IllegalStateException e) {
            logger.fine("Shutdown in progress; hook stays registered: " + e.getMessage());
        }
    }
}
