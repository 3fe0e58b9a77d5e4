package br.edu.ifba.kgrag.utils;

import jakarta.enterprise.context.ApplicationScoped;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Structured logging for task retries in the worker pool.
 *
 * <h2>MDC Context:</h2>
 * <ul>
 *   <li><code>retry.operation</code> - operation name, e.g. {@code buildSectionGraph}</li>
 *   <li><code>retry.unit</code> - unit key (section id, query hash), when known</li>
 *   <li><code>retry.attempt</code> - attempt number (1-based)</li>
 *   <li><code>retry.exception</code> - exception class that triggered the retry</li>
 * </ul>
 *
 * <h2>Log Format Example:</h2>
 * <pre>
 * INFO  [RetryEventLogger] Retry 2/4 for buildSectionGraph[3f2a9c1d0b7e] in 1000 ms: SQLException - database is locked
 * WARN  [RetryEventLogger] Retry exhausted for buildSectionGraph[3f2a9c1d0b7e] after 4 attempts: ...
 * WARN  [RetryEventLogger] Not retrying buildSectionGraph[3f2a9c1d0b7e]: ExtractionException - LLM returned empty content
 * </pre>
 */
@ApplicationScoped
public class RetryEventLogger {

    private static final Logger logger = LoggerFactory.getLogger(RetryEventLogger.class);

    private static final String MDC_RETRY_OPERATION = "retry.operation";
    private static final String MDC_RETRY_UNIT = "retry.unit";
    private static final String MDC_RETRY_ATTEMPT = "retry.attempt";
    private static final String MDC_RETRY_EXCEPTION = "retry.exception";

    private static final int MAX_MESSAGE_LENGTH = 200;

    /**
     * Logs that a failed attempt will be retried after {@code delayMs}.
     *
     * @param operation   operation name
     * @param unit        unit key, may be null
     * @param attempt     the attempt that failed (1-based)
     * @param maxAttempts total attempts allowed
     * @param delayMs     backoff before the next attempt
     * @param failure     the failure, may be null
     */
    public void logRetryAttempt(final String operation, final String unit, final int attempt,
                                final int maxAttempts, final long delayMs, final Throwable failure) {
        final String exceptionName = exceptionName(failure);
        try {
            putContext(operation, unit, attempt, exceptionName);
            logger.info("Retry {}/{} for {} in {} ms: {} - {}",
                attempt + 1, maxAttempts, label(operation, unit), delayMs, exceptionName, message(failure));
        } finally {
            clearMDC();
        }
    }

    /**
     * Logs that all attempts failed.
     */
    public void logRetryExhausted(final String operation, final String unit, final int totalAttempts,
                                  final Throwable failure) {
        final String exceptionName = exceptionName(failure);
        try {
            putContext(operation, unit, totalAttempts, exceptionName);
            logger.warn("Retry exhausted for {} after {} attempts: {} - {}",
                label(operation, unit), totalAttempts, exceptionName, message(failure));
        } finally {
            clearMDC();
        }
    }

    /**
     * Logs a failure that is not eligible for retry (validation, extraction,
     * constraint violations).
     */
    public void logPermanentFailure(final String operation, final String unit, final int attempt,
                                    final Throwable failure) {
        final String exceptionName = exceptionName(failure);
        try {
            putContext(operation, unit, attempt, exceptionName);
            logger.warn("Not retrying {}: {} - {}", label(operation, unit), exceptionName, message(failure));
        } finally {
            clearMDC();
        }
    }

    /**
     * Logs recovery; silent when the first attempt succeeded.
     */
    public void logRetrySuccess(final String operation, final String unit, final int totalAttempts) {
        if (totalAttempts <= 1) {
            return;
        }
        try {
            putContext(operation, unit, totalAttempts, null);
            logger.info("Retry succeeded for {} on attempt {}", label(operation, unit), totalAttempts);
        } finally {
            clearMDC();
        }
    }

    private void putContext(String operation, String unit, int attempt, String exceptionName) {
        MDC.put(MDC_RETRY_OPERATION, operation);
        if (unit != null) {
            MDC.put(MDC_RETRY_UNIT, unit);
        }
        MDC.put(MDC_RETRY_ATTEMPT, String.valueOf(attempt));
        if (exceptionName != null) {
            MDC.put(MDC_RETRY_EXCEPTION, exceptionName);
        }
    }

    private void clearMDC() {
        MDC.remove(MDC_RETRY_OPERATION);
        MDC.remove(MDC_RETRY_UNIT);
        MDC.remove(MDC_RETRY_ATTEMPT);
        MDC.remove(MDC_RETRY_EXCEPTION);
    }

    private static String label(String operation, String unit) {
        return unit == null ? operation : operation + "[" + unit + "]";
    }

    private static String exceptionName(Throwable failure) {
        return failure != null ? failure.getClass().getSimpleName() : "unknown";
    }

    private static String message(Throwable failure) {
        String message = failure != null ? failure.getMessage() : "no message";
        if (message == null) {
            return "null";
        }
        if (message.length() <= MAX_MESSAGE_LENGTH) {
            return message;
        }
        return message.substring(0, MAX_MESSAGE_LENGTH) + "...";
    }
}
