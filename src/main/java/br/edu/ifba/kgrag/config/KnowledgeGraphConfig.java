package br.edu.ifba.kgrag.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;

/**
 * Knowledge graph pipeline settings.
 *
 * <pre>
 * kgrag.graph.theta-add=0.55
 * kgrag.graph.theta-show=0.60
 * kgrag.graph.min-evidence-count=2
 * kgrag.graph.max-id-length=64
 * kgrag.graph.prune-orphans=false
 * kgrag.graph.extraction.max-tokens=4000
 * </pre>
 */
@ConfigMapping(prefix = "kgrag.graph")
public interface KnowledgeGraphConfig {

    /**
     * Minimum confidence for an edge to be stored.
     */
    @WithName("theta-add")
    @WithDefault("0.55")
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    double thetaAdd();

    /**
     * Minimum confidence for an edge to be shown to consumers.
     */
    @WithName("theta-show")
    @WithDefault("0.60")
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    double thetaShow();

    @WithName("min-evidence-count")
    @WithDefault("2")
    @Min(1)
    int minEvidenceCount();

    @WithName("max-id-length")
    @WithDefault("64")
    @Min(60)
    int maxIdLength();

    /**
     * Whether re-indexing a scope removes its nodes left without edges.
     */
    @WithName("prune-orphans")
    @WithDefault("false")
    boolean pruneOrphans();

    Extraction extraction();

    interface Extraction {

        @WithName("max-tokens")
        @WithDefault("4000")
        @Min(1)
        int maxTokens();
    }

    default void validate() {
        if (thetaShow() < thetaAdd()) {
            throw new IllegalArgumentException(String.format(
                "Display threshold must not be below the storage threshold, got theta-show=%.2f, theta-add=%.2f",
                thetaShow(), thetaAdd()));
        }
    }
}
