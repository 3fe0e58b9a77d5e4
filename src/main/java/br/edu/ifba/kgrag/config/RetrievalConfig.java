package br.edu.ifba.kgrag.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;

/**
 * Retrieval settings: channel weights, chunking and the vector collection.
 */
@ConfigMapping(prefix = "kgrag.retrieval")
public interface RetrievalConfig {

    /**
     * Weight of the vector channel. Renormalized together with {@link #beta()}.
     */
    @WithDefault("0.7")
    @DecimalMin("0.0")
    double alpha();

    /**
     * Weight of the graph channel.
     */
    @WithDefault("0.3")
    @DecimalMin("0.0")
    double beta();

    @WithName("max-results")
    @WithDefault("10")
    @Min(1)
    int maxResults();

    /**
     * Subgraph expansion depth.
     */
    @WithDefault("2")
    @Min(1)
    int hop();

    Chunk chunk();

    Vector vector();

    interface Chunk {

        @WithDefault("800")
        @Min(1)
        int size();

        @WithDefault("120")
        @Min(0)
        int overlap();
    }

    interface Vector {

        @WithDefault("chunks")
        String collection();

        @WithDefault("768")
        @Min(1)
        int dimension();

        /**
         * COSINE, DOT or EUCLID.
         */
        @WithDefault("COSINE")
        String distance();

        @WithName("embed-batch-size")
        @WithDefault("32")
        @Min(1)
        int embedBatchSize();
    }

    default void validate() {
        if (alpha() + beta() <= 0.0) {
            throw new IllegalArgumentException(String.format(
                "Channel weights must not both be zero, got alpha=%.2f, beta=%.2f", alpha(), beta()));
        }
        if (chunk().overlap() >= chunk().size()) {
            throw new IllegalArgumentException(String.format(
                "Chunk overlap must be smaller than chunk size, got overlap=%d, size=%d",
                chunk().overlap(), chunk().size()));
        }
    }
}
