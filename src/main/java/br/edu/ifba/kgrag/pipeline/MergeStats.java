package br.edu.ifba.kgrag.pipeline;

import java.util.List;

/**
 * Figures of one book merge.
 *
 * @param bookId          book id
 * @param scope           {@code book:<bookId>}
 * @param sections        member section scopes the book was computed from
 * @param originalNodes   nodes across all member sections
 * @param originalEdges   edges across all member sections
 * @param mergedNodes     nodes after merging
 * @param mergedEdges     edges after merging
 * @param nodeDedupRatio  {@code (original - merged) / original}, 3 decimals
 * @param edgeDedupRatio  same for edges
 * @param chapters        chapters covered, sorted
 * @param hierarchy       book outline summary
 * @param storeStats      write figures of the book scope
 */
public record MergeStats(
    String bookId,
    String scope,
    List<String> sections,
    int originalNodes,
    int originalEdges,
    int mergedNodes,
    int mergedEdges,
    double nodeDedupRatio,
    double edgeDedupRatio,
    List<String> chapters,
    String hierarchy,
    StoreStats storeStats
) {

    public MergeStats {
        sections = List.copyOf(sections);
        chapters = List.copyOf(chapters);
    }

    public static MergeStats failed(String bookId, String scope, String error) {
        return new MergeStats(bookId, scope, List.of(), 0, 0, 0, 0, 0.0, 0.0, List.of(), "",
            StoreStats.failed(scope, error));
    }

    public boolean success() {
        return storeStats != null && storeStats.success();
    }

    static double dedupRatio(int original, int merged) {
        if (original <= 0) {
            return 0.0;
        }
        return Math.round((original - merged) * 1000.0 / original) / 1000.0;
    }
}
