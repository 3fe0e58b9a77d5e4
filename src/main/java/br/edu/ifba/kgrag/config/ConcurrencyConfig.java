package br.edu.ifba.kgrag.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;
import jakarta.validation.constraints.Min;

/**
 * Worker pool settings shared by section builds and retrieval.
 */
@ConfigMapping(prefix = "kgrag.concurrency")
public interface ConcurrencyConfig {

    @WithName("max-workers")
    @WithDefault("20")
    @Min(1)
    int maxWorkers();

    /**
     * Per-task timeout. A timed-out attempt counts as a transient failure.
     */
    @WithName("timeout-ms")
    @WithDefault("120000")
    @Min(1)
    long timeoutMs();

    /**
     * Extra attempts after the first one, for transient failures only.
     */
    @WithName("retry-count")
    @WithDefault("3")
    @Min(0)
    int retryCount();

    /**
     * Base backoff, doubled after every failed attempt.
     */
    @WithName("backoff-ms")
    @WithDefault("500")
    @Min(0)
    long backoffMs();
}
