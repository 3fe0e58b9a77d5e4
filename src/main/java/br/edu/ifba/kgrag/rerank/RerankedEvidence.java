package br.edu.ifba.kgrag.rerank;

import br.edu.ifba.kgrag.core.Evidence;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * An evidence item with its reranker relevance score.
 *
 * @param evidence       the original evidence
 * @param relevanceScore the reranker score (0.0 - 1.0)
 * @param originalRank   position before reranking (0-based)
 * @param newRank        position after reranking (0-based)
 */
public record RerankedEvidence(
    @NotNull Evidence evidence,
    double relevanceScore,
    int originalRank,
    int newRank
) {

    public RerankedEvidence {
        Objects.requireNonNull(evidence, "evidence must not be null");
        if (relevanceScore < 0.0 || relevanceScore > 1.0) {
            throw new IllegalArgumentException("relevanceScore must be between 0.0 and 1.0, got: " + relevanceScore);
        }
        if (originalRank < 0 || newRank < 0) {
            throw new IllegalArgumentException("ranks must be >= 0, got: " + originalRank + ", " + newRank);
        }
    }

    public static RerankedEvidence passthrough(@NotNull Evidence evidence, int rank, double score) {
        return new RerankedEvidence(evidence, score, rank, rank);
    }

    public static RerankedEvidence reranked(@NotNull Evidence evidence, int originalRank, int newRank, double score) {
        return new RerankedEvidence(evidence, score, originalRank, newRank);
    }

    /**
     * @return positive when the item moved up
     */
    public int rankChange() {
        return originalRank - newRank;
    }
}
