package br.edu.ifba.kgrag.llm;

import jakarta.ws.rs.ProcessingException;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.rest.client.ext.ResponseExceptionMapper;
import org.jboss.logging.Logger;

/**
 * Turns error responses of the LLM and embedding endpoints into
 * {@link LlmCallException}, flagged retryable for 408, 429 and 5xx.
 */
public class LlmClientExceptionMapper implements ResponseExceptionMapper<LlmCallException> {

    private static final Logger LOG = Logger.getLogger(LlmClientExceptionMapper.class);

    private static final int MAX_BODY_LENGTH = 500;

    @Override
    public LlmCallException toThrowable(Response response) {
        if (response.getStatus() < 400) {
            return null;
        }

        String responseBody = null;
        try {
            if (response.hasEntity()) {
                responseBody = response.readEntity(String.class);
            }
        } catch (ProcessingException | IllegalStateException e) {
            LOG.warn("Failed to read error response body", e);
        }

        int status = response.getStatus();
        String statusInfo = response.getStatusInfo().getReasonPhrase();
        if (responseBody != null && responseBody.length() > MAX_BODY_LENGTH) {
            responseBody = responseBody.substring(0, MAX_BODY_LENGTH) + "...";
        }

        LOG.errorf("LLM API error %d %s: %s", status, statusInfo,
            responseBody != null && !responseBody.isEmpty() ? responseBody : "(empty)");

        String errorMessage = String.format(
            "LLM API returned %d %s%s",
            status,
            statusInfo,
            responseBody != null ? " - " + responseBody : ""
        );
        return LlmCallException.forStatus(status, errorMessage);
    }

    @Override
    public int getPriority() {
        return 4000;
    }
}
