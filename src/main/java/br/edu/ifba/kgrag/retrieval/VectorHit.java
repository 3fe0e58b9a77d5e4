package br.edu.ifba.kgrag.retrieval;

import br.edu.ifba.kgrag.storage.VectorStorage;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Map;

/**
 * A chunk returned by vector search.
 *
 * @param chunkId  chunk id
 * @param docId    owning document
 * @param text     chunk text
 * @param score    similarity, higher is better
 * @param metadata chunk payload
 */
public record VectorHit(
    @NotNull String chunkId,
    @Nullable String docId,
    @NotNull String text,
    double score,
    @NotNull Map<String, Object> metadata
) {

    public VectorHit {
        metadata = metadata != null ? metadata : Map.of();
    }

    public static VectorHit fromSearchResult(@NotNull VectorStorage.VectorSearchResult result) {
        return new VectorHit(result.id(), result.docId(), result.text(), result.score(), result.metadata());
    }

    public VectorHit withScore(double newScore) {
        return new VectorHit(chunkId, docId, text, newScore, metadata);
    }
}
