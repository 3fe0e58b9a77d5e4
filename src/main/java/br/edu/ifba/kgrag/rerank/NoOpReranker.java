package br.edu.ifba.kgrag.rerank;

import br.edu.ifba.kgrag.core.Evidence;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Named;
import org.jboss.logging.Logger;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A reranker that keeps the original order.
 *
 * <p>Used when reranking is disabled and as the fallback of
 * {@link HttpCrossEncoderReranker}. Items get synthetic scores
 * 1.0, 0.95, 0.90, ... with a floor of 0.1.</p>
 */
@ApplicationScoped
@Named("noOpReranker")
public class NoOpReranker implements Reranker {

    private static final Logger logger = Logger.getLogger(NoOpReranker.class);
    private static final String PROVIDER_NAME = "none";

    @Override
    @NotNull
    public List<RerankedEvidence> rerank(@NotNull String query, @NotNull List<Evidence> evidence, int topK) {
        Objects.requireNonNull(query, "query must not be null");
        Objects.requireNonNull(evidence, "evidence must not be null");
        if (evidence.isEmpty()) {
            throw new IllegalArgumentException("evidence must not be empty");
        }
        if (topK <= 0) {
            throw new IllegalArgumentException("topK must be > 0, got: " + topK);
        }

        int limit = Math.min(topK, evidence.size());
        logger.debugf("NoOpReranker: returning %d items (of %d) in original order", limit, evidence.size());

        List<RerankedEvidence> results = new ArrayList<>(limit);
        for (int i = 0; i < limit; i++) {
            double score = Math.max(0.1, 1.0 - (i * 0.05));
            results.add(RerankedEvidence.passthrough(evidence.get(i), i, score));
        }
        return results;
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    @NotNull
    public String getProviderName() {
        return PROVIDER_NAME;
    }
}
