package br.edu.ifba.kgrag.rerank;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import org.jboss.logging.Logger;

/**
 * Selects the Reranker implementation from configuration.
 *
 * <pre>
 * kgrag.rerank.enabled=true
 * kgrag.rerank.provider=http   # or "none"
 * </pre>
 *
 * <p>If reranking is disabled, the provider is unknown or unavailable,
 * a {@link NoOpReranker} is returned.</p>
 */
@ApplicationScoped
public class RerankerFactory {

    private static final Logger logger = Logger.getLogger(RerankerFactory.class);

    @Inject
    RerankerConfig config;

    @Inject
    @Named("noOpReranker")
    Reranker noOpReranker;

    @Inject
    @Named("httpReranker")
    Reranker httpReranker;

    public Reranker getReranker() {
        if (!config.enabled()) {
            logger.debug("Reranking disabled, using NoOpReranker");
            return noOpReranker;
        }
        return getReranker(config.provider());
    }

    /**
     * Gets a reranker by explicit provider name, ignoring the enabled flag.
     *
     * @param providerName provider name (http, none)
     * @return the requested Reranker, or NoOpReranker if not found/available
     */
    public Reranker getReranker(String providerName) {
        if (providerName == null || providerName.isBlank()) {
            return noOpReranker;
        }
        String provider = providerName.toLowerCase();
        Reranker selected = switch (provider) {
            case "http" -> httpReranker;
            case "none" -> noOpReranker;
            default -> {
                logger.warnf("Unknown reranker provider '%s', using NoOpReranker", provider);
                yield noOpReranker;
            }
        };
        if (!selected.isAvailable()) {
            logger.warnf("Reranker provider '%s' is not available, using NoOpReranker", provider);
            return noOpReranker;
        }
        logger.debugf("Using reranker: %s", selected.getProviderName());
        return selected;
    }

    /**
     * @return true if reranking is enabled with a real provider
     */
    public boolean isRerankingAvailable() {
        return config.enabled()
            && !"none".equalsIgnoreCase(config.provider())
            && getReranker() != noOpReranker;
    }

    public String describe() {
        return config.describe();
    }
}
