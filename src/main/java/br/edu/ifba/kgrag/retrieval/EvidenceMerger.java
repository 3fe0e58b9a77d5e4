package br.edu.ifba.kgrag.retrieval;

import br.edu.ifba.kgrag.core.Evidence;
import br.edu.ifba.kgrag.core.EvidenceType;
import br.edu.ifba.kgrag.rerank.RerankedEvidence;
import br.edu.ifba.kgrag.rerank.Reranker;
import br.edu.ifba.kgrag.utils.IdentityUtil;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.DoubleSummaryStatistics;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.ToDoubleFunction;

/**
 * Fuses vector and graph hits into one ranked evidence list.
 *
 * <h2>Algorithm:</h2>
 * <ol>
 *   <li>Graph hits are re-scored by kind: paths get {@code 1/(length+1)},
 *       subgraphs a node-count bonus (capped at +0.3) times mean edge confidence</li>
 *   <li>Each channel is min-max normalized on its own; a channel whose scores
 *       are all equal keeps them as they are</li>
 *   <li>Normalized scores are weighted by alpha (vector) and beta (graph),
 *       renormalized so that {@code alpha + beta = 1}</li>
 *   <li>Items whose alphanumeric, case-folded content is identical collapse into
 *       one; the higher-scoring item is primary and the score becomes
 *       {@code (primary + secondary * 0.5) / 1.5}</li>
 *   <li>+0.1 for multi-source items, plus up to +0.1 for content length</li>
 *   <li>Sort descending, optionally rerank the top N, truncate</li>
 * </ol>
 */
public class EvidenceMerger {

    private static final Logger logger = LoggerFactory.getLogger(EvidenceMerger.class);

    static final double MULTI_SOURCE_BONUS = 0.1;
    static final double MAX_LENGTH_BONUS = 0.1;
    static final double SECONDARY_WEIGHT = 0.5;
    static final double MAX_NODE_BONUS = 0.3;
    static final double NODE_BONUS_STEP = 0.1;

    private static final String SECONDARY_PREFIX = "secondary_";

    private final double alpha;
    private final double beta;
    private final int maxResults;
    @Nullable
    private final Reranker reranker;
    private final int rerankTopN;

    public EvidenceMerger(double alpha, double beta, int maxResults) {
        this(alpha, beta, maxResults, null, 0);
    }

    /**
     * @param alpha      vector channel weight
     * @param beta       graph channel weight
     * @param maxResults default cap on returned evidence
     * @param reranker   reranker for the top of the list, null to disable
     * @param rerankTopN how many leading items the reranker sees
     */
    public EvidenceMerger(double alpha, double beta, int maxResults, @Nullable Reranker reranker, int rerankTopN) {
        if (alpha < 0 || beta < 0) {
            throw new IllegalArgumentException(String.format(
                "Channel weights must not be negative, got alpha=%.3f beta=%.3f", alpha, beta));
        }
        double total = alpha + beta;
        if (total <= 0) {
            throw new IllegalArgumentException("alpha + beta must be positive");
        }
        if (maxResults <= 0) {
            throw new IllegalArgumentException("maxResults must be positive, got " + maxResults);
        }
        this.alpha = alpha / total;
        this.beta = beta / total;
        this.maxResults = maxResults;
        this.reranker = reranker;
        this.rerankTopN = rerankTopN;
    }

    @NotNull
    public List<Evidence> merge(@NotNull String query, @NotNull List<VectorHit> vectorHits,
                                @NotNull List<GraphHit> graphHits) {
        return merge(query, vectorHits, graphHits, maxResults);
    }

    /**
     * Merges both channels into at most {@code limit} evidence items, score descending.
     */
    @NotNull
    public List<Evidence> merge(@NotNull String query, @NotNull List<VectorHit> vectorHits,
                                @NotNull List<GraphHit> graphHits, int limit) {
        logger.debug("Merging evidence: vector={}, graph={}", vectorHits.size(), graphHits.size());

        List<GraphHit> rescored = graphHits.stream()
            .map(hit -> hit.withScore(graphScore(hit)))
            .toList();
        List<VectorHit> normalizedVector = normalize(vectorHits, VectorHit::score, VectorHit::withScore);
        List<GraphHit> normalizedGraph = normalize(rescored, GraphHit::score, GraphHit::withScore);

        List<Evidence> all = new ArrayList<>(normalizedVector.size() + normalizedGraph.size());
        normalizedVector.forEach(hit -> all.add(toEvidence(hit)));
        normalizedGraph.forEach(hit -> all.add(toEvidence(hit)));

        List<Evidence> ranked = deduplicate(all).stream()
            .map(evidence -> evidence.withScore(evidence.score() + bonus(evidence)))
            .sorted(byScore())
            .toList();

        List<Evidence> ordered = rerank(query, ranked);
        List<Evidence> results = ordered.subList(0, Math.min(Math.max(limit, 0), ordered.size()));

        logger.info("Evidence merge: input({}+{}) -> output({})", vectorHits.size(), graphHits.size(), results.size());
        return List.copyOf(results);
    }

    /**
     * Kind-specific graph score applied before normalization.
     */
    static double graphScore(@NotNull GraphHit hit) {
        return switch (hit.kind()) {
            case ENTITY -> hit.score();
            case PATH -> hit.score() / (hit.pathLength() + 1);
            case SUBGRAPH -> {
                double nodeBonus = Math.min(hit.nodes().size() * NODE_BONUS_STEP, MAX_NODE_BONUS);
                yield hit.score() * (1 + nodeBonus) * hit.meanConfidence();
            }
        };
    }

    /**
     * Min-max normalization. Lists whose scores span no range are returned unchanged.
     */
    static <T> List<T> normalize(List<T> hits, ToDoubleFunction<T> score, Rescorer<T> rescorer) {
        if (hits.size() < 2) {
            return hits;
        }
        DoubleSummaryStatistics stats = hits.stream().mapToDouble(score).summaryStatistics();
        double range = stats.getMax() - stats.getMin();
        if (range == 0) {
            return hits;
        }
        return hits.stream()
            .map(hit -> rescorer.withScore(hit, (score.applyAsDouble(hit) - stats.getMin()) / range))
            .toList();
    }

    /**
     * Dedup key: MD5 of the content reduced to lowercase letters and digits.
     */
    @NotNull
    static String contentKey(@NotNull String content) {
        StringBuilder simplified = new StringBuilder(content.length());
        content.codePoints()
            .filter(Character::isLetterOrDigit)
            .map(Character::toLowerCase)
            .forEach(simplified::appendCodePoint);
        return IdentityUtil.md5Hex(simplified.toString()).substring(0, 16);
    }

    /**
     * Summary of a merged list.
     */
    @NotNull
    public EvidenceStatistics statistics(@NotNull List<Evidence> evidence) {
        Map<String, Integer> types = new TreeMap<>();
        Map<String, Integer> sources = new TreeMap<>();
        for (Evidence item : evidence) {
            types.merge(item.type().wireName(), 1, Integer::sum);
            item.sources().forEach(source -> sources.merge(source, 1, Integer::sum));
        }
        DoubleSummaryStatistics scores = evidence.stream().mapToDouble(Evidence::score).summaryStatistics();
        int multiSource = (int) evidence.stream().filter(Evidence::isMultiSource).count();
        return new EvidenceStatistics(
            evidence.size(),
            types,
            sources,
            multiSource,
            evidence.isEmpty() ? 0.0 : scores.getMin(),
            evidence.isEmpty() ? 0.0 : scores.getMax(),
            evidence.isEmpty() ? 0.0 : scores.getAverage(),
            alpha,
            beta);
    }

    public double getAlpha() {
        return alpha;
    }

    public double getBeta() {
        return beta;
    }

    public int getMaxResults() {
        return maxResults;
    }

    private Evidence toEvidence(VectorHit hit) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("chunk_id", hit.chunkId());
        metadata.put("doc_id", hit.docId());
        metadata.put("vector_score", hit.score());
        hit.metadata().forEach(metadata::putIfAbsent);
        return new Evidence(
            "vector_" + IdentityUtil.md5Hex(hit.chunkId()).substring(0, 8),
            EvidenceType.VECTOR,
            hit.text(),
            hit.score() * alpha,
            List.of(Evidence.SOURCE_VECTOR),
            metadata);
    }

    private Evidence toEvidence(GraphHit hit) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("kg_type", hit.kind().name().toLowerCase(Locale.ROOT));
        metadata.put("kg_score", hit.score());
        metadata.put("explanation", hit.explanation());
        metadata.put("node_ids", hit.nodeIds());
        metadata.put("relation_ids", hit.relationIds());
        metadata.put("path_length", hit.pathLength());
        String key = hit.kind() + "|" + String.join(",", hit.nodeIds()) + "|" + String.join(",", hit.relationIds());
        return new Evidence(
            "graph_" + IdentityUtil.md5Hex(key).substring(0, 8),
            EvidenceType.GRAPH,
            hit.content(),
            hit.score() * beta,
            List.of(Evidence.SOURCE_GRAPH),
            metadata);
    }

    private List<Evidence> deduplicate(List<Evidence> evidence) {
        Map<String, Evidence> merged = new LinkedHashMap<>();
        for (Evidence item : evidence) {
            merged.merge(contentKey(item.content()), item, EvidenceMerger::combine);
        }
        if (merged.size() < evidence.size()) {
            logger.debug("Collapsed {} duplicate evidence items", evidence.size() - merged.size());
        }
        return new ArrayList<>(merged.values());
    }

    static Evidence combine(Evidence existing, Evidence incoming) {
        Evidence primary = existing.score() >= incoming.score() ? existing : incoming;
        Evidence secondary = primary == existing ? incoming : existing;

        Set<String> sources = new LinkedHashSet<>(primary.sources());
        sources.addAll(secondary.sources());

        Map<String, Object> metadata = new LinkedHashMap<>(primary.metadata());
        secondary.metadata().forEach((key, value) -> {
            if (!primary.metadata().containsKey(key)) {
                metadata.put(SECONDARY_PREFIX + key, value);
            }
        });

        double score = (primary.score() + secondary.score() * SECONDARY_WEIGHT) / (1 + SECONDARY_WEIGHT);
        EvidenceType type = sources.size() > 1 ? EvidenceType.HYBRID : primary.type();
        return new Evidence(primary.id(), type, primary.content(), score, new ArrayList<>(sources), metadata);
    }

    private static double bonus(Evidence evidence) {
        double sourceBonus = evidence.isMultiSource() ? MULTI_SOURCE_BONUS : 0.0;
        double lengthBonus = Math.min(evidence.content().length() / 1000.0, MAX_LENGTH_BONUS);
        return sourceBonus + lengthBonus;
    }

    private List<Evidence> rerank(String query, List<Evidence> ranked) {
        if (reranker == null || rerankTopN <= 0 || ranked.isEmpty() || query.isBlank()) {
            return ranked;
        }
        List<Evidence> head = ranked.subList(0, Math.min(rerankTopN, ranked.size()));
        try {
            List<RerankedEvidence> reordered = reranker.rerank(query, head, head.size());
            List<Evidence> result = new ArrayList<>(ranked.size());
            Set<String> seen = new HashSet<>();
            for (RerankedEvidence item : reordered) {
                Evidence evidence = item.evidence();
                if (seen.add(evidence.id())) {
                    Map<String, Object> metadata = new LinkedHashMap<>(evidence.metadata());
                    metadata.put("rerank_score", item.relevanceScore());
                    metadata.put("original_rank", item.originalRank());
                    result.add(new Evidence(evidence.id(), evidence.type(), evidence.content(), evidence.score(),
                        evidence.sources(), metadata));
                }
            }
            for (Evidence evidence : ranked) {
                if (seen.add(evidence.id())) {
                    result.add(evidence);
                }
            }
            logger.debug("Reranked top {} evidence items with {}", head.size(), reranker.getProviderName());
            return result;
        } catch (RuntimeException e) {
            logger.warn("Reranking failed, keeping merged order: {}", e.getMessage());
            return ranked;
        }
    }

    private static Comparator<Evidence> byScore() {
        return Comparator.comparingDouble(Evidence::score).reversed().thenComparing(Evidence::id);
    }

    @FunctionalInterface
    interface Rescorer<T> {
        T withScore(T hit, double score);
    }
}
