package br.edu.ifba.kgrag.storage.impl;

import br.edu.ifba.kgrag.storage.DistanceMetric;
import br.edu.ifba.kgrag.storage.VectorDimensionMismatchException;
import br.edu.ifba.kgrag.storage.VectorFilter;
import br.edu.ifba.kgrag.storage.VectorStorage;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory vector storage with brute-force search.
 * Suitable for development, tests and small corpora.
 */
public class InMemoryVectorStorage implements VectorStorage {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryVectorStorage.class);

    private final ConcurrentHashMap<String, CollectionInfo> collections = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, ConcurrentHashMap<String, VectorPoint>> points = new ConcurrentHashMap<>();
    private volatile boolean initialized = false;

    @Override
    public CompletableFuture<Void> initialize() {
        return CompletableFuture.runAsync(() -> {
            if (!initialized) {
                initialized = true;
                logger.info("InMemoryVectorStorage initialized");
            }
        });
    }

    @Override
    public CompletableFuture<CollectionInfo> ensureCollection(@NotNull String collection, int dimension,
                                                              @NotNull DistanceMetric metric) {
        ensureInitialized();
        return CompletableFuture.supplyAsync(() -> {
            if (dimension <= 0) {
                throw new IllegalArgumentException("Vector dimension must be positive, got " + dimension);
            }
            CollectionInfo info = collections.computeIfAbsent(collection, name -> {
                points.put(name, new ConcurrentHashMap<>());
                logger.info("Created vector collection {} (dimension {}, {})", name, dimension, metric);
                return new CollectionInfo(name, dimension, metric);
            });
            if (info.dimension() != dimension) {
                throw new VectorDimensionMismatchException("collection '" + collection + "'", info.dimension(), dimension);
            }
            return info;
        });
    }

    @Override
    public CompletableFuture<CollectionInfo> recreateCollection(@NotNull String collection, int dimension,
                                                                @NotNull DistanceMetric metric) {
        ensureInitialized();
        return CompletableFuture.supplyAsync(() -> {
            CollectionInfo info = new CollectionInfo(collection, dimension, metric);
            collections.put(collection, info);
            ConcurrentHashMap<String, VectorPoint> previous = points.put(collection, new ConcurrentHashMap<>());
            logger.warn("Recreated vector collection {}, dropped {} points",
                collection, previous != null ? previous.size() : 0);
            return info;
        });
    }

    @Override
    public CompletableFuture<CollectionInfo> getCollection(@NotNull String collection) {
        ensureInitialized();
        return CompletableFuture.completedFuture(collections.get(collection));
    }

    @Override
    public CompletableFuture<Integer> upsertBatch(@NotNull String collection, @NotNull List<VectorPoint> batch) {
        ensureInitialized();
        return CompletableFuture.supplyAsync(() -> {
            CollectionInfo info = requireCollection(collection);
            for (VectorPoint point : batch) {
                if (point.vector().length != info.dimension()) {
                    throw new VectorDimensionMismatchException("point '" + point.id() + "'",
                        info.dimension(), point.vector().length);
                }
            }
            Map<String, VectorPoint> target = points.get(collection);
            for (VectorPoint point : batch) {
                target.put(point.id(), point);
            }
            logger.debug("Upserted {} vectors into {}", batch.size(), collection);
            return batch.size();
        });
    }

    @Override
    public CompletableFuture<List<VectorSearchResult>> query(@NotNull String collection, @NotNull float[] queryVector,
                                                             int topK, @Nullable VectorFilter filter) {
        ensureInitialized();
        return CompletableFuture.supplyAsync(() -> {
            CollectionInfo info = requireCollection(collection);
            if (queryVector.length != info.dimension()) {
                throw new IllegalArgumentException(String.format(
                    "Query vector has dimension %d, collection %s expects %d",
                    queryVector.length, collection, info.dimension()));
            }
            return points.get(collection).values().stream()
                .filter(point -> filter == null || filter.matches(point.docId(), point.scope(), point.metadata()))
                .map(point -> VectorSearchResult.of(point, info.metric().similarity(queryVector, point.vector())))
                .sorted(Comparator.comparingDouble(VectorSearchResult::score).reversed()
                    .thenComparing(VectorSearchResult::id))
                .limit(Math.max(topK, 0))
                .toList();
        });
    }

    @Override
    public CompletableFuture<VectorPoint> get(@NotNull String collection, @NotNull String id) {
        ensureInitialized();
        Map<String, VectorPoint> stored = points.get(collection);
        return CompletableFuture.completedFuture(stored != null ? stored.get(id) : null);
    }

    @Override
    public CompletableFuture<Integer> deleteByDocument(@NotNull String collection, @NotNull String docId) {
        ensureInitialized();
        return CompletableFuture.supplyAsync(() -> {
            Map<String, VectorPoint> stored = points.get(collection);
            if (stored == null) {
                return 0;
            }
            List<String> doomed = stored.values().stream()
                .filter(point -> docId.equals(point.docId()))
                .map(VectorPoint::id)
                .toList();
            doomed.forEach(stored::remove);
            logger.debug("Deleted {} vectors of document {}", doomed.size(), docId);
            return doomed.size();
        });
    }

    @Override
    public CompletableFuture<Long> size(@NotNull String collection) {
        ensureInitialized();
        Map<String, VectorPoint> stored = points.get(collection);
        return CompletableFuture.completedFuture(stored != null ? (long) stored.size() : 0L);
    }

    @Override
    public void close() {
        if (initialized) {
            points.clear();
            collections.clear();
            initialized = false;
            logger.info("InMemoryVectorStorage closed");
        }
    }

    private CollectionInfo requireCollection(String collection) {
        CollectionInfo info = collections.get(collection);
        if (info == null) {
            throw new IllegalStateException("Vector collection does not exist: " + collection);
        }
        return info;
    }

    private void ensureInitialized() {
        if (!initialized) {
            throw new IllegalStateException("Storage not initialized. Call initialize() first.");
        }
    }
}
