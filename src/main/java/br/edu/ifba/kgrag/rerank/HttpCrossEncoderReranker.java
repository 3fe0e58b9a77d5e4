package br.edu.ifba.kgrag.rerank;

import br.edu.ifba.kgrag.core.Evidence;
import br.edu.ifba.kgrag.rerank.RerankClient.RerankRequest;
import br.edu.ifba.kgrag.rerank.RerankClient.RerankResponse;
import br.edu.ifba.kgrag.rerank.RerankClient.RerankResult;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import org.eclipse.microprofile.faulttolerance.CircuitBreaker;
import org.eclipse.microprofile.faulttolerance.Fallback;
import org.eclipse.microprofile.faulttolerance.Timeout;
import org.eclipse.microprofile.rest.client.inject.RestClient;
import org.jboss.logging.Logger;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Reranker backed by an HTTP cross-encoder.
 *
 * <p>Features:
 * <ul>
 *   <li>Circuit breaker that opens after repeated failures</li>
 *   <li>Timeout with automatic fallback to the original order</li>
 * </ul>
 *
 * <p>Items the server leaves out of its answer keep their relative order
 * and are appended after the scored ones, so nothing is lost.</p>
 */
@ApplicationScoped
@Named("httpReranker")
public class HttpCrossEncoderReranker implements Reranker {

    private static final Logger logger = Logger.getLogger(HttpCrossEncoderReranker.class);
    private static final String PROVIDER_NAME = "http";

    @Inject
    @RestClient
    RerankClient client;

    @Inject
    RerankerConfig config;

    @Inject
    @Named("noOpReranker")
    Reranker fallbackReranker;

    @Override
    @NotNull
    @CircuitBreaker(
        requestVolumeThreshold = 4,
        failureRatio = 0.5,
        delay = 10000,
        successThreshold = 2
    )
    @Timeout(value = 5000)
    @Fallback(fallbackMethod = "fallbackRerank")
    public List<RerankedEvidence> rerank(@NotNull String query, @NotNull List<Evidence> evidence, int topK) {
        Objects.requireNonNull(query, "query must not be null");
        Objects.requireNonNull(evidence, "evidence must not be null");
        if (evidence.isEmpty()) {
            throw new IllegalArgumentException("evidence must not be empty");
        }
        if (topK <= 0) {
            throw new IllegalArgumentException("topK must be > 0, got: " + topK);
        }

        logger.debugf("HttpCrossEncoderReranker: reranking %d items with query length %d",
            evidence.size(), query.length());

        List<String> documents = evidence.stream().map(Evidence::content).toList();
        RerankResponse response = client.rerank(
            new RerankRequest(config.model(), query, documents, documents.size()));
        if (response == null || response.results() == null) {
            throw new IllegalStateException("Rerank endpoint returned no results");
        }
        return toReranked(response.results(), evidence, topK);
    }

    @SuppressWarnings("unused")
    @NotNull
    List<RerankedEvidence> fallbackRerank(@NotNull String query, @NotNull List<Evidence> evidence, int topK) {
        logger.warnf("HttpCrossEncoderReranker fallback: returning %d items in original order",
            Math.min(topK, evidence.size()));
        return fallbackReranker.rerank(query, evidence, topK);
    }

    List<RerankedEvidence> toReranked(List<RerankResult> results, List<Evidence> original, int topK) {
        List<RerankResult> sorted = new ArrayList<>(results);
        sorted.sort(Comparator.comparingDouble(RerankResult::relevanceScore).reversed()
            .thenComparingInt(RerankResult::index));

        List<RerankedEvidence> reranked = new ArrayList<>();
        BitSet seen = new BitSet(original.size());
        int newRank = 0;
        for (RerankResult result : sorted) {
            int index = result.index();
            if (index < 0 || index >= original.size() || seen.get(index)) {
                continue;
            }
            seen.set(index);
            double score = Math.max(0.0, Math.min(1.0, result.relevanceScore()));
            reranked.add(RerankedEvidence.reranked(original.get(index), index, newRank++, score));
        }
        for (int index = seen.nextClearBit(0); index < original.size(); index = seen.nextClearBit(index + 1)) {
            reranked.add(RerankedEvidence.reranked(original.get(index), index, newRank++, 0.0));
        }
        return reranked.size() > topK ? List.copyOf(reranked.subList(0, topK)) : reranked;
    }

    @Override
    public boolean isAvailable() {
        return config.enabled();
    }

    @Override
    @NotNull
    public String getProviderName() {
        return PROVIDER_NAME;
    }
}
