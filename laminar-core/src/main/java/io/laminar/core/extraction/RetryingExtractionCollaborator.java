package io.laminar.core.extraction;

import io.laminar.core.LaminarConfig;
import io.laminar.core.document.ProcessDocument;
import io.laminar.core.exception.CollaboratorException;
import io.laminar.core.template.SheetTable;
import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Logger;

/// Decorates a collaborator with a per-call timeout and bounded retries.
///
/// Each attempt runs on a private daemon thread and is abandoned after the configured
/// timeout. Transient failures are retried with exponential backoff (the initial delay
/// doubles after every failed attempt); permanent failures are rethrown at once.
/// Runtime exceptions escaping the delegate count as transient.
///
/// @implNote Thread-safe. Concurrent calls from several sheets run independently and
/// never block one another.
public final class RetryingExtractionCollaborator implements ExtractionCollaborator, AutoCloseable {

    private static final Logger logger =
            Logger.getLogger(RetryingExtractionCollaborator.class.getName());

    private static final AtomicInteger THREAD_COUNTER = new AtomicInteger();

    private final ExtractionCollaborator delegate;
    private final Duration timeout;
    private final int maxAttempts;
    private final Duration backoff;
    private final ExecutorService executor;

    /// Creates a decorator with explicit limits.
    ///
    /// @param delegate collaborator to call, not null
    /// @param timeout limit per attempt, positive
    /// @param maxAttempts total attempts including the first, at least 1
    /// @param backoff delay before the first retry, not negative
    public RetryingExtractionCollaborator(
            ExtractionCollaborator delegate, Duration timeout, int maxAttempts, Duration backoff) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be positive: " + maxAttempts);
        }
        this.delegate = delegate;
        this.timeout = timeout;
        this.maxAttempts = maxAttempts;
        this.backoff = backoff;
        this.executor =
                Executors.newCachedThreadPool(
                        runnable -> {
                            Thread thread =
                                    new Thread(
                                            runnable,
                                            "laminar-collaborator-"
                                                    + THREAD_COUNTER.incrementAndGet());
                            thread.setDaemon(true);
                            return thread;
                        });
    }

    /// Creates a decorator with the limits of a configuration.
    public RetryingExtractionCollaborator(ExtractionCollaborator delegate, LaminarConfig config) {
        this(
                delegate,
                config.getCollaboratorTimeout(),
                config.getCollaboratorMaxAttempts(),
                config.getCollaboratorBackoff());
    }

    @Override
    public ProcessDocument extract(SheetTable sheet) throws CollaboratorException {
        CollaboratorException last = null;
        Duration delay = backoff;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return callWithTimeout(sheet);
            } catch (CollaboratorException e) {
                if (!e.isTransient()) {
                    throw e;
                }
                last = e;
                if (attempt < maxAttempts) {
                    logger.warning(
                            "AI extraction of sheet '"
                                    + sheet.name()
                                    + "' failed (attempt "
                                    + attempt
                                    + "/"
                                    + maxAttempts
                                    + "): "
                                    + e.getMessage()
                                    + "; retrying in "
                                    + delay.toMillis()
                                    + " ms");
                    pause(delay);
                    delay = delay.multipliedBy(2);
                }
            }
        }

        throw new CollaboratorException(
                "AI extraction failed after " + maxAttempts + " attempt(s): " + last.getMessage(),
                last,
                true);
    }

    private ProcessDocument callWithTimeout(SheetTable sheet) throws CollaboratorException {
        Future<ProcessDocument> future = executor.submit(() -> delegate.extract(sheet));
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new CollaboratorException(
                    "AI extraction timed out after " + timeout.toSeconds() + " s", e, true);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof CollaboratorException collaboratorException) {
                throw collaboratorException;
            }
            throw new CollaboratorException("AI extraction failed: " + cause, cause, true);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new CollaboratorException("AI extraction interrupted", e, false);
        }
    }

    private void pause(Duration delay) throws CollaboratorException {
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CollaboratorException("AI extraction interrupted during backoff", e, false);
        }
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
