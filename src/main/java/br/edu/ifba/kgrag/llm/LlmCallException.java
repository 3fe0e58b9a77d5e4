package br.edu.ifba.kgrag.llm;

/**
 * Failure of an LLM or embedding call.
 *
 * <p>Network, server and rate-limit failures are retryable; invalid requests
 * are not.</p>
 */
public class LlmCallException extends RuntimeException {

    private final boolean retryable;
    private final int status;

    public LlmCallException(String message, boolean retryable) {
        this(message, retryable, -1, null);
    }

    public LlmCallException(String message, boolean retryable, Throwable cause) {
        this(message, retryable, -1, cause);
    }

    public LlmCallException(String message, boolean retryable, int status, Throwable cause) {
        super(message, cause);
        this.retryable = retryable;
        this.status = status;
    }

    /**
     * Builds the exception for an HTTP error status: 408, 429 and 5xx are retryable.
     */
    public static LlmCallException forStatus(int status, String message) {
        boolean retryable = status == 408 || status == 429 || status >= 500;
        return new LlmCallException(message, retryable, status, null);
    }

    public boolean isRetryable() {
        return retryable;
    }

    /**
     * @return HTTP status, or -1 when the failure happened before a response
     */
    public int getStatus() {
        return status;
    }
}
