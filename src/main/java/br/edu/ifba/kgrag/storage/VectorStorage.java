package br.edu.ifba.kgrag.storage;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Interface for vector collection storage.
 *
 * <p>A collection is created once with a fixed dimension and distance metric.
 * {@link #ensureCollection} is idempotent and fails with
 * {@link VectorDimensionMismatchException} when an existing collection
 * disagrees with the requested dimension; {@link #recreateCollection} is the
 * explicit, destructive way to change it.</p>
 *
 * Implementations: SQLiteVectorStorage, InMemoryVectorStorage
 */
public interface VectorStorage extends AutoCloseable {

    /**
     * Initializes the vector storage backend.
     */
    CompletableFuture<Void> initialize();

    /**
     * Creates the collection if missing, otherwise checks its dimension.
     *
     * @throws VectorDimensionMismatchException (through the future) on a dimension mismatch
     */
    CompletableFuture<CollectionInfo> ensureCollection(@NotNull String collection, int dimension,
                                                       @NotNull DistanceMetric metric);

    /**
     * Drops the collection with all its points and creates it again.
     */
    CompletableFuture<CollectionInfo> recreateCollection(@NotNull String collection, int dimension,
                                                         @NotNull DistanceMetric metric);

    /**
     * @return collection settings, or null when it does not exist
     */
    CompletableFuture<CollectionInfo> getCollection(@NotNull String collection);

    /**
     * Inserts or replaces points by id.
     *
     * @return number of points written
     */
    CompletableFuture<Integer> upsertBatch(@NotNull String collection, @NotNull List<VectorPoint> points);

    /**
     * Top-K similarity search, score descending.
     *
     * @param collection  collection name
     * @param queryVector query vector, same dimension as the collection
     * @param topK        maximum results
     * @param filter      payload filter, may be null
     */
    CompletableFuture<List<VectorSearchResult>> query(@NotNull String collection, @NotNull float[] queryVector,
                                                      int topK, @Nullable VectorFilter filter);

    /**
     * @return the point, or null if not found
     */
    CompletableFuture<VectorPoint> get(@NotNull String collection, @NotNull String id);

    /**
     * Deletes all points of one document.
     *
     * @return number of deleted points
     */
    CompletableFuture<Integer> deleteByDocument(@NotNull String collection, @NotNull String docId);

    CompletableFuture<Long> size(@NotNull String collection);

    /**
     * Collection settings.
     */
    record CollectionInfo(
        @NotNull String name,
        int dimension,
        @NotNull DistanceMetric metric
    ) {}

    /**
     * A stored vector with its payload.
     */
    record VectorPoint(
        @NotNull String id,
        @NotNull float[] vector,
        @Nullable String docId,
        @Nullable String scope,
        @NotNull String text,
        @NotNull Map<String, Object> metadata
    ) {
        public VectorPoint {
            metadata = metadata != null ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata)) : Map.of();
        }
    }

    /**
     * A search hit.
     */
    record VectorSearchResult(
        @NotNull String id,
        double score,
        @Nullable String docId,
        @Nullable String scope,
        @NotNull String text,
        @NotNull Map<String, Object> metadata
    ) {
        public static VectorSearchResult of(@NotNull VectorPoint point, double score) {
            return new VectorSearchResult(point.id(), score, point.docId(), point.scope(), point.text(),
                point.metadata());
        }
    }
}
