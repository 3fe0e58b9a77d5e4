package br.edu.ifba.kgrag.rerank;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;
import jakarta.validation.constraints.Min;

/**
 * Configuration for reranker providers.
 *
 * <p>Example configuration:
 * <pre>
 * kgrag.rerank.enabled=true
 * kgrag.rerank.provider=http
 * kgrag.rerank.top-n=20
 * kgrag.rerank.model=bge-reranker-base
 * quarkus.rest-client.rerank.url=http://localhost:8081
 * </pre>
 */
@ConfigMapping(prefix = "kgrag.rerank")
public interface RerankerConfig {

    @WithDefault("false")
    boolean enabled();

    /**
     * The reranker provider to use.
     *
     * @return provider name (http or none)
     */
    @WithDefault("none")
    String provider();

    /**
     * How many leading evidence items are sent to the reranker.
     */
    @WithName("top-n")
    @WithDefault("20")
    @Min(1)
    int topN();

    /**
     * Cross-encoder model name forwarded to the rerank endpoint.
     */
    @WithDefault("bge-reranker-base")
    String model();

    /**
     * Gets a human-readable description of the current configuration.
     *
     * @return configuration description
     */
    default String describe() {
        if (!enabled()) {
            return "Reranking disabled";
        }
        return switch (provider().toLowerCase()) {
            case "none" -> "No-op reranker (passthrough)";
            case "http" -> "HTTP cross-encoder reranker (model: " + model() + ")";
            default -> "Unknown provider: " + provider();
        };
    }
}
