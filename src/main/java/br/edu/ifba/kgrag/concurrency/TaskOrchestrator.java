package br.edu.ifba.kgrag.concurrency;

import br.edu.ifba.kgrag.utils.RetryEventLogger;
import io.smallrye.faulttolerance.api.FaultTolerance;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Long-lived, fixed-size worker pool for section builds and retrieval
 * channels.
 *
 * <p>Every task runs on one worker under a SmallRye Fault Tolerance guard:
 * a per-attempt {@code @Timeout} that interrupts the worker, and a retry for
 * failures the transient predicate accepts, up to {@code retryCount} times
 * with exponential backoff ({@code backoff * 2^(attempt-1)}). Anything else
 * fails the task at once. Attempts of one task never overlap, so a hung unit
 * holds a single worker. Batches submit at most {@code maxWorkers} tasks at a
 * time, collect results in completion order and report failures per input.</p>
 */
public class TaskOrchestrator implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(TaskOrchestrator.class);

    private static final int MAX_BACKOFF_SHIFT = 16;
    private static final long SCHEDULING_SLACK_MS = 1_000;

    private final ExecutorService executor;
    private final int maxWorkers;
    private final long timeoutMs;
    private final int retryCount;
    private final long backoffMs;
    private final Predicate<Throwable> transientFailure;
    private final RetryEventLogger retryLogger;
    private final FaultTolerance<Object> timeoutGuard;

    public TaskOrchestrator(int maxWorkers, @NotNull Duration timeout, int retryCount, @NotNull Duration backoff,
                            @NotNull Predicate<Throwable> transientFailure, @NotNull RetryEventLogger retryLogger) {
        if (maxWorkers < 1) {
            throw new IllegalArgumentException("maxWorkers must be >= 1, got " + maxWorkers);
        }
        if (retryCount < 0) {
            throw new IllegalArgumentException("retryCount must be >= 0, got " + retryCount);
        }
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive, got " + timeout);
        }
        if (backoff.isNegative()) {
            throw new IllegalArgumentException("backoff must be >= 0, got " + backoff);
        }
        this.maxWorkers = maxWorkers;
        this.timeoutMs = timeout.toMillis();
        this.retryCount = retryCount;
        this.backoffMs = backoff.toMillis();
        this.transientFailure = transientFailure;
        this.retryLogger = retryLogger;
        this.timeoutGuard = FaultTolerance.<Object>create()
            .withDescription("kgrag-task")
            .withTimeout().duration(timeoutMs, ChronoUnit.MILLIS).done()
            .build();
        this.executor = Executors.newFixedThreadPool(maxWorkers, new WorkerThreadFactory());
        logger.info("TaskOrchestrator started: {} workers, timeout {} ms, {} retries, backoff {} ms",
            maxWorkers, timeoutMs, retryCount, backoffMs);
    }

    /**
     * Runs a task on the pool with timeout and retries.
     *
     * @param operation operation name for logs
     * @param unit      unit key for logs, may be null
     * @param task      the work
     * @return future completing with the first successful attempt, or
     *         exceptionally with the last failure
     */
    @NotNull
    public <T> CompletableFuture<T> submit(@NotNull String operation, @Nullable String unit,
                                           @NotNull Supplier<T> task) {
        return CompletableFuture.supplyAsync(() -> callWithRetry(operation, unit, task), executor);
    }

    /**
     * Runs a task once on the pool with the timeout but no retries.
     */
    @NotNull
    public <T> CompletableFuture<T> supply(@NotNull Supplier<T> task) {
        return CompletableFuture.supplyAsync(() -> callWithTimeout(task), executor);
    }

    /**
     * Submits one task per input and waits for all of them.
     *
     * @param operation operation name for logs
     * @param inputs    units of work
     * @param unitKey   key reported for each unit
     * @param task      work per unit; throwing marks the unit failed
     * @param token     cancellation token, may be null
     * @return successes, failures per unit, and the count of units skipped by cancellation
     */
    @NotNull
    public <I, T> BatchResult<T> runBatch(@NotNull String operation, @NotNull List<I> inputs,
                                          @NotNull Function<I, String> unitKey, @NotNull Function<I, T> task,
                                          @Nullable CancellationToken token) {
        Semaphore permits = new Semaphore(maxWorkers);
        List<T> successes = Collections.synchronizedList(new ArrayList<>());
        List<BatchResult.UnitFailure> failures = Collections.synchronizedList(new ArrayList<>());
        List<CompletableFuture<Void>> inFlight = new ArrayList<>(inputs.size());

        int submitted = 0;
        for (I input : inputs) {
            if (token != null && token.isCancelled()) {
                break;
            }
            try {
                permits.acquire();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                logger.warn("Interrupted while submitting {} batch after {} units", operation, submitted);
                break;
            }
            if (token != null && token.isCancelled()) {
                permits.release();
                break;
            }
            String unit = unitKey.apply(input);
            inFlight.add(submit(operation, unit, () -> task.apply(input))
                .handle((value, failure) -> {
                    try {
                        if (failure == null) {
                            successes.add(value);
                        } else {
                            Throwable cause = unwrap(failure);
                            failures.add(new BatchResult.UnitFailure(unit,
                                cause.getClass().getSimpleName() + ": " + cause.getMessage()));
                        }
                    } finally {
                        permits.release();
                    }
                    return null;
                }));
            submitted++;
        }

        CompletableFuture.allOf(inFlight.toArray(CompletableFuture[]::new)).join();

        int cancelled = inputs.size() - submitted;
        if (cancelled > 0) {
            logger.info("Batch {} cancelled: {} of {} units not submitted", operation, cancelled, inputs.size());
        }
        BatchResult<T> result;
        synchronized (successes) {
            synchronized (failures) {
                result = new BatchResult<>(successes, failures, cancelled);
            }
        }
        logger.info("Batch {} finished: {} succeeded, {} failed, {} cancelled",
            operation, result.successCount(), result.failureCount(), cancelled);
        return result;
    }

    private <T> T callWithRetry(String operation, String unit, Supplier<T> task) {
        int maxAttempts = retryCount + 1;
        Attempts attempts = new Attempts();
        FaultTolerance<T> guard = FaultTolerance.<T>create()
            .withDescription(operation)
            .withRetry()
                .maxRetries(retryCount)
                .delay(backoffMs, ChronoUnit.MILLIS)
                .jitter(0, ChronoUnit.MILLIS)
                .maxDuration(maxDurationMs(), ChronoUnit.MILLIS)
                .whenException(failure -> {
                    attempts.lastFailure = failure;
                    return transientFailure.test(failure);
                })
                .withExponentialBackoff().factor(2).done()
                .onRetry(() -> retryLogger.logRetryAttempt(operation, unit, attempts.count, maxAttempts,
                    delayAfter(attempts.count), attempts.lastFailure))
                .done()
            .withTimeout().duration(timeoutMs, ChronoUnit.MILLIS).done()
            .build();

        try {
            T value = guard.call(() -> {
                attempts.count++;
                return task.get();
            });
            retryLogger.logRetrySuccess(operation, unit, attempts.count);
            return value;
        } catch (Exception e) {
            if (transientFailure.test(e)) {
                retryLogger.logRetryExhausted(operation, unit, attempts.count, e);
            } else {
                retryLogger.logPermanentFailure(operation, unit, attempts.count, e);
            }
            throw propagate(e);
        }
    }

    @SuppressWarnings("unchecked")
    private <T> T callWithTimeout(Supplier<T> task) {
        Callable<Object> call = task::get;
        try {
            return (T) timeoutGuard.call(call);
        } catch (Exception e) {
            throw propagate(e);
        }
    }

    private long delayAfter(int attempt) {
        return backoffMs << Math.min(Math.max(attempt - 1, 0), MAX_BACKOFF_SHIFT);
    }

    // Upper bound on the whole retry loop; per-attempt limits are the timeout
    private long maxDurationMs() {
        return (timeoutMs + delayAfter(retryCount) + SCHEDULING_SLACK_MS) * (retryCount + 1);
    }

    private static RuntimeException propagate(Exception e) {
        return e instanceof RuntimeException runtime ? runtime : new CompletionException(e);
    }

    public int getMaxWorkers() {
        return maxWorkers;
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
                logger.warn("Worker pool did not stop within 30 s, forcing shutdown");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        logger.info("TaskOrchestrator stopped");
    }

    static Throwable unwrap(Throwable throwable) {
        Throwable current = throwable;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    /**
     * Attempt bookkeeping for one guarded call. Attempts run on one thread.
     */
    private static final class Attempts {
        private volatile int count;
        private volatile Throwable lastFailure;
    }

    private static final class WorkerThreadFactory implements ThreadFactory {

        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(@NotNull Runnable runnable) {
            Thread thread = new Thread(runnable, "kgrag-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
