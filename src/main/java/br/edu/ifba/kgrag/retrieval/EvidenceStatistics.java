package br.edu.ifba.kgrag.retrieval;

import org.jetbrains.annotations.NotNull;

import java.util.Map;

/**
 * Counts and score range of a merged evidence list.
 *
 * @param total              number of items
 * @param typeDistribution   items per evidence type
 * @param sourceDistribution items per contributing channel
 * @param multiSourceCount   items backed by both channels
 * @param minScore           lowest final score, 0 for an empty list
 * @param maxScore           highest final score, 0 for an empty list
 * @param meanScore          mean final score, 0 for an empty list
 * @param alpha              normalized vector weight
 * @param beta               normalized graph weight
 */
public record EvidenceStatistics(
    int total,
    @NotNull Map<String, Integer> typeDistribution,
    @NotNull Map<String, Integer> sourceDistribution,
    int multiSourceCount,
    double minScore,
    double maxScore,
    double meanScore,
    double alpha,
    double beta
) {

    public EvidenceStatistics {
        typeDistribution = Map.copyOf(typeDistribution);
        sourceDistribution = Map.copyOf(sourceDistribution);
    }
}
