package br.edu.ifba.kgrag.retrieval;

import br.edu.ifba.kgrag.core.Chunk;
import br.edu.ifba.kgrag.embedding.EmbeddingFunction;
import br.edu.ifba.kgrag.storage.DistanceMetric;
import br.edu.ifba.kgrag.storage.VectorDimensionMismatchException;
import br.edu.ifba.kgrag.storage.VectorFilter;
import br.edu.ifba.kgrag.storage.VectorStorage;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionException;

/**
 * Vector channel: chunk embedding, collection writes and similarity search.
 *
 * <p>The collection is bound to one dimension and distance metric. Call
 * {@link #ensureCollection()} once at startup; a dimension mismatch between
 * the stored collection and the embedding model is fatal there and never
 * surfaces per query.</p>
 */
public class VectorIndexService {

    private static final Logger logger = LoggerFactory.getLogger(VectorIndexService.class);

    static final String SCOPE_KEY = "scope";

    private final VectorStorage vectorStorage;
    private final EmbeddingFunction embeddingFunction;
    private final TextChunker chunker;
    private final String collection;
    private final DistanceMetric metric;
    private final int embedBatchSize;

    public VectorIndexService(@NotNull VectorStorage vectorStorage,
                              @NotNull EmbeddingFunction embeddingFunction,
                              @NotNull TextChunker chunker,
                              @NotNull String collection,
                              @NotNull DistanceMetric metric,
                              int embedBatchSize) {
        if (embedBatchSize <= 0) {
            throw new IllegalArgumentException("Embedding batch size must be positive, got " + embedBatchSize);
        }
        this.vectorStorage = vectorStorage;
        this.embeddingFunction = embeddingFunction;
        this.chunker = chunker;
        this.collection = collection;
        this.metric = metric;
        this.embedBatchSize = embedBatchSize;
    }

    /**
     * Creates the collection on first use or verifies the existing one.
     *
     * @throws VectorDimensionMismatchException when the stored collection has another dimension
     */
    @NotNull
    public VectorStorage.CollectionInfo ensureCollection() {
        int dimension = embeddingFunction.dimension();
        try {
            VectorStorage.CollectionInfo info = vectorStorage.ensureCollection(collection, dimension, metric).join();
            logger.info("Vector collection {} ready (dimension {}, {})", info.name(), info.dimension(), info.metric());
            return info;
        } catch (CompletionException e) {
            throw propagate(e);
        }
    }

    /**
     * Drops every stored vector and recreates the collection for the current model.
     */
    @NotNull
    public VectorStorage.CollectionInfo recreateCollection() {
        logger.warn("Recreating vector collection {}", collection);
        try {
            return vectorStorage.recreateCollection(collection, embeddingFunction.dimension(), metric).join();
        } catch (CompletionException e) {
            throw propagate(e);
        }
    }

    /**
     * Embeds and upserts chunks in batches. A failing batch is counted and
     * skipped; a dimension mismatch aborts.
     */
    @NotNull
    public IndexStats index(@NotNull List<Chunk> chunks) {
        if (chunks.isEmpty()) {
            return IndexStats.empty();
        }
        int indexed = 0;
        int failed = 0;
        List<String> errors = new ArrayList<>();

        for (int from = 0; from < chunks.size(); from += embedBatchSize) {
            List<Chunk> batch = chunks.subList(from, Math.min(from + embedBatchSize, chunks.size()));
            try {
                indexed += indexBatch(batch);
            } catch (CompletionException | IllegalStateException e) {
                RuntimeException cause = propagate(e);
                if (cause instanceof VectorDimensionMismatchException mismatch) {
                    throw mismatch;
                }
                failed += batch.size();
                errors.add(String.format("batch %d-%d: %s", from, from + batch.size() - 1, cause.getMessage()));
                logger.warn("Failed to index chunks {}..{} of {}: {}",
                    from, from + batch.size() - 1, chunks.size(), cause.getMessage());
            }
        }

        logger.info("Indexed {} of {} chunks into {}", indexed, chunks.size(), collection);
        return new IndexStats(indexed, failed, errors);
    }

    /**
     * Replaces the stored chunks of one document.
     *
     * @param docId    document id
     * @param text     full document text
     * @param metadata document metadata copied onto each chunk, may be null
     */
    @NotNull
    public IndexStats indexDocument(@NotNull String docId, @NotNull String text,
                                    @Nullable Map<String, Object> metadata) {
        return replaceDocument(docId, chunkDocument(docId, text, metadata));
    }

    @NotNull
    public List<Chunk> chunkDocument(@NotNull String docId, @NotNull String text,
                                     @Nullable Map<String, Object> metadata) {
        return chunker.chunk(text, docId, metadata);
    }

    /**
     * Drops the document's stored chunks, then indexes {@code chunks} in their place.
     */
    @NotNull
    public IndexStats replaceDocument(@NotNull String docId, @NotNull List<Chunk> chunks) {
        try {
            int removed = vectorStorage.deleteByDocument(collection, docId).join();
            if (removed > 0) {
                logger.debug("Removed {} previous chunks of document {}", removed, docId);
            }
        } catch (CompletionException e) {
            throw propagate(e);
        }
        return index(chunks);
    }

    /**
     * Embeds the query and returns the nearest chunks, score descending.
     */
    @NotNull
    public List<VectorHit> search(@NotNull String query, int topK, @Nullable VectorFilter filter) {
        if (query.isBlank() || topK <= 0) {
            return List.of();
        }
        try {
            float[] vector = embeddingFunction.embedSingle(query).join();
            return searchByVector(vector, topK, filter);
        } catch (CompletionException e) {
            throw propagate(e);
        }
    }

    @NotNull
    public List<VectorHit> searchByVector(@NotNull float[] vector, int topK, @Nullable VectorFilter filter) {
        if (topK <= 0) {
            return List.of();
        }
        try {
            List<VectorHit> hits = vectorStorage.query(collection, vector, topK, filter).join().stream()
                .map(VectorHit::fromSearchResult)
                .toList();
            logger.debug("Vector search returned {} hits", hits.size());
            return hits;
        } catch (CompletionException e) {
            throw propagate(e);
        }
    }

    @NotNull
    public List<VectorHit> searchInDocument(@NotNull String query, @NotNull String docId, int topK) {
        return search(query, topK, VectorFilter.byDocument(docId));
    }

    /**
     * Chunks closest to a stored chunk, excluding the chunk itself.
     *
     * @return empty when the chunk is not indexed
     */
    @NotNull
    public List<VectorHit> similarChunks(@NotNull String chunkId, int topK) {
        VectorStorage.VectorPoint point;
        try {
            point = vectorStorage.get(collection, chunkId).join();
        } catch (CompletionException e) {
            throw propagate(e);
        }
        if (point == null) {
            logger.debug("Chunk {} is not indexed", chunkId);
            return List.of();
        }
        return searchByVector(point.vector(), topK + 1, null).stream()
            .filter(hit -> !hit.chunkId().equals(chunkId))
            .limit(Math.max(topK, 0))
            .toList();
    }

    public long size() {
        return vectorStorage.size(collection).join();
    }

    @NotNull
    public String getCollection() {
        return collection;
    }

    private int indexBatch(List<Chunk> batch) {
        List<float[]> vectors = embeddingFunction.embed(batch.stream().map(Chunk::text).toList()).join();
        if (vectors.size() != batch.size()) {
            throw new IllegalStateException(String.format(
                "Embedding returned %d vectors for %d chunks", vectors.size(), batch.size()));
        }
        List<VectorStorage.VectorPoint> points = new ArrayList<>(batch.size());
        for (int i = 0; i < batch.size(); i++) {
            Chunk chunk = batch.get(i);
            Object scope = chunk.metadata().get(SCOPE_KEY);
            points.add(new VectorStorage.VectorPoint(chunk.chunkId(), vectors.get(i), chunk.docId(),
                scope != null ? scope.toString() : null, chunk.text(), chunk.metadata()));
        }
        return vectorStorage.upsertBatch(collection, points).join();
    }

    private static RuntimeException propagate(RuntimeException e) {
        Throwable current = e;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        if (current instanceof RuntimeException runtime) {
            return runtime;
        }
        return e;
    }
}
