package br.edu.ifba.kgrag.rerank;

import br.edu.ifba.kgrag.core.Evidence;
import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * Reorders evidence by relevance to a query.
 *
 * <p>Contract:
 * <ul>
 *   <li>MUST return evidence in descending relevance order</li>
 *   <li>MUST fall back to the original order on provider failure</li>
 *   <li>MUST NOT invent evidence; every returned item comes from the input</li>
 * </ul>
 */
public interface Reranker {

    /**
     * Reranks evidence by relevance to query.
     *
     * @param query    the user's query string
     * @param evidence evidence to rerank, non-empty
     * @param topK     maximum number of items to return
     * @return reranked evidence with scores, or original order on failure
     * @throws IllegalArgumentException if evidence is empty or topK <= 0
     */
    @NotNull
    List<RerankedEvidence> rerank(@NotNull String query, @NotNull List<Evidence> evidence, int topK);

    /**
     * Checks if the reranker provider can accept requests.
     */
    boolean isAvailable();

    /**
     * @return provider identifier ("http", "none")
     */
    @NotNull
    String getProviderName();
}
