package br.edu.ifba.kgrag.rerank;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import org.eclipse.microprofile.config.ConfigProvider;
import org.eclipse.microprofile.rest.client.annotation.ClientHeaderParam;
import org.eclipse.microprofile.rest.client.inject.RegisterRestClient;

import java.util.List;

/**
 * REST client for a cross-encoder served behind a {@code /rerank} endpoint
 * (text-embeddings-inference, infinity and similar servers).
 *
 * <pre>
 * quarkus.rest-client.rerank.url=http://localhost:8081
 * quarkus.rest-client.rerank.read-timeout=5000
 * rerank.api-key=
 * </pre>
 */
@RegisterRestClient(configKey = "rerank")
@ClientHeaderParam(name = "Authorization", value = "{lookupAuth}")
public interface RerankClient {

    @POST
    @Path("/rerank")
    @Consumes(MediaType.APPLICATION_JSON)
    @Produces(MediaType.APPLICATION_JSON)
    RerankResponse rerank(RerankRequest request);

    default String lookupAuth() {
        return ConfigProvider.getConfig()
            .getOptionalValue("rerank.api-key", String.class)
            .filter(key -> !key.isBlank())
            .map(key -> "Bearer " + key)
            .orElse(null);
    }

    /**
     * @param model     cross-encoder model name
     * @param query     the query to compare documents against
     * @param documents document texts to rerank
     * @param topN      maximum number of results to return
     */
    record RerankRequest(
        String model,
        String query,
        List<String> documents,
        @JsonProperty("top_n") int topN
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record RerankResponse(String model, List<RerankResult> results) {}

    /**
     * @param index          original index of the document
     * @param relevanceScore relevance score, usually in [0, 1]
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    record RerankResult(int index, @JsonProperty("relevance_score") double relevanceScore) {}
}
