package br.edu.ifba.kgrag.utils;

import br.edu.ifba.kgrag.llm.LlmCallException;
import jakarta.ws.rs.WebApplicationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.InterruptedIOException;
import java.net.ConnectException;
import java.net.SocketException;
import java.sql.SQLException;
import java.sql.SQLTransientException;
import java.util.Set;
import java.util.concurrent.TimeoutException;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Decides whether a failure is transient and worth retrying.
 *
 * <p>Only network, timeout and store-availability errors are retried.
 * Validation errors ({@link IllegalArgumentException}), extraction failures
 * and constraint violations are permanent.</p>
 *
 * <h2>Transient (will retry):</h2>
 * <ul>
 *   <li>{@link TimeoutException}, fault tolerance timeouts, {@link SQLTransientException},
 *       socket and connect errors</li>
 *   <li>SQLSTATE classes <b>08</b> (connection), <b>40</b> (rollback/deadlock),
 *       <b>53</b> (resources), <b>57</b> (operator intervention)</li>
 *   <li>SQLite {@code SQLITE_BUSY} (5) and {@code SQLITE_LOCKED} (6)</li>
 *   <li>HTTP 408, 429 and 5xx responses</li>
 *   <li>{@link LlmCallException} flagged as retryable</li>
 *   <li>messages such as "connection reset", "database is locked", "try again"</li>
 * </ul>
 */
public final class TransientFailurePredicate implements Predicate<Throwable> {

    private static final Logger logger = LoggerFactory.getLogger(TransientFailurePredicate.class);

    private static final Set<String> TRANSIENT_SQLSTATE_PREFIXES = Set.of("08", "40", "53", "57");

    private static final int SQLITE_BUSY = 5;
    private static final int SQLITE_LOCKED = 6;

    private static final int MAX_CAUSE_DEPTH = 10;

    private static final Pattern TRANSIENT_MESSAGE_PATTERN = Pattern.compile(
        "(?i)(" +
        "connection\\s+(refused|reset|closed|timed\\s*out|lost|terminated|broken)" +
        "|unable\\s+to\\s+(connect|acquire\\s+connection)" +
        "|too\\s+many\\s+(connections|clients|requests)" +
        "|rate\\s+limit" +
        "|network\\s+(is\\s+unreachable|error|timeout)" +
        "|socket\\s+(timeout|closed|reset|error)" +
        "|i/o\\s+error" +
        "|read\\s+timed\\s*out" +
        "|connect\\s+timed\\s*out" +
        "|server\\s+(closed|shutdown|restarting|not\\s+available|overloaded)" +
        "|service\\s+unavailable" +
        "|database\\s+(is\\s+locked|unavailable|busy)" +
        "|deadlock\\s+detected" +
        "|lock\\s+wait\\s+timeout" +
        "|try\\s+(again|later)" +
        "|temporarily\\s+unavailable" +
        ")"
    );

    @Override
    public boolean test(final Throwable throwable) {
        Throwable current = throwable;
        int depth = 0;
        while (current != null && depth++ < MAX_CAUSE_DEPTH) {
            Boolean verdict = classify(current);
            if (verdict != null) {
                return verdict;
            }
            Throwable cause = current.getCause();
            if (cause == current) {
                break;
            }
            current = cause;
        }
        return false;
    }

    /**
     * @return TRUE or FALSE when the throwable decides the question, null to keep
     *         looking at the cause chain
     */
    private Boolean classify(final Throwable throwable) {
        if (throwable instanceof IllegalArgumentException) {
            return Boolean.FALSE;
        }
        if (throwable instanceof LlmCallException llmFailure) {
            return llmFailure.isRetryable();
        }
        if (throwable instanceof TimeoutException
                || throwable instanceof org.eclipse.microprofile.faulttolerance.exceptions.TimeoutException
                || throwable instanceof SQLTransientException
                || throwable instanceof ConnectException
                || throwable instanceof SocketException
                || throwable instanceof InterruptedIOException) {
            logger.debug("Transient failure by type: {}", throwable.getClass().getSimpleName());
            return Boolean.TRUE;
        }
        if (throwable instanceof WebApplicationException web && web.getResponse() != null) {
            int status = web.getResponse().getStatus();
            return status == 408 || status == 429 || status >= 500;
        }
        if (throwable instanceof SQLException sqlException) {
            SQLException next = sqlException;
            while (next != null) {
                if (isTransientSql(next) || isTransientByMessage(next.getMessage())) {
                    return Boolean.TRUE;
                }
                next = next.getNextException();
            }
            return null;
        }
        if (isTransientByMessage(throwable.getMessage())) {
            return Boolean.TRUE;
        }
        return null;
    }

    private boolean isTransientSql(final SQLException sqlException) {
        int code = sqlException.getErrorCode();
        if (code == SQLITE_BUSY || code == SQLITE_LOCKED) {
            logger.debug("SQLite busy/locked: {}", sqlException.getMessage());
            return true;
        }
        String sqlState = sqlException.getSQLState();
        if (sqlState == null || sqlState.length() < 2) {
            return false;
        }
        boolean transientState = TRANSIENT_SQLSTATE_PREFIXES.contains(sqlState.substring(0, 2));
        logger.debug("SQLSTATE {} classified as {}", sqlState, transientState ? "transient" : "permanent");
        return transientState;
    }

    private boolean isTransientByMessage(final String message) {
        if (message == null || message.isEmpty()) {
            return false;
        }
        return TRANSIENT_MESSAGE_PATTERN.matcher(message).find();
    }
}
