package br.edu.ifba.kgrag.storage.impl;

import br.edu.ifba.kgrag.storage.DistanceMetric;
import br.edu.ifba.kgrag.storage.GraphStoreException;
import br.edu.ifba.kgrag.storage.VectorDimensionMismatchException;
import br.edu.ifba.kgrag.storage.VectorFilter;
import br.edu.ifba.kgrag.storage.VectorStorage;
import br.edu.ifba.kgrag.utils.VectorUtil;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.jboss.logging.Logger;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.concurrent.CompletableFuture;

/**
 * SQLite-based implementation of VectorStorage.
 *
 * <p>Vectors are stored as little-endian float32 BLOBs in
 * {@code vector_points}; collection settings live in
 * {@code vector_collections}. Search is a brute-force scan over the rows that
 * pass the document/scope filter, scored with the collection's metric.</p>
 */
public final class SQLiteVectorStorage implements VectorStorage {

    private static final Logger LOG = Logger.getLogger(SQLiteVectorStorage.class);
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> METADATA_TYPE = new TypeReference<>() {};

    private final SQLiteConnectionManager connectionManager;

    /**
     * Creates a new SQLiteVectorStorage.
     *
     * @param connectionManager the SQLite connection manager
     */
    public SQLiteVectorStorage(SQLiteConnectionManager connectionManager) {
        this.connectionManager = connectionManager;
    }

    @Override
    public CompletableFuture<Void> initialize() {
        return CompletableFuture.runAsync(() -> LOG.info("Initialized SQLiteVectorStorage"));
    }

    @Override
    public CompletableFuture<CollectionInfo> ensureCollection(@NotNull String collection, int dimension,
                                                              @NotNull DistanceMetric metric) {
        return CompletableFuture.supplyAsync(() -> {
            requirePositive(dimension);
            CollectionInfo existing = readCollection(collection);
            if (existing != null) {
                if (existing.dimension() != dimension) {
                    throw new VectorDimensionMismatchException("collection '" + collection + "'",
                        existing.dimension(), dimension);
                }
                if (existing.metric() != metric) {
                    LOG.warnf("Collection %s uses %s, ignoring requested %s", collection, existing.metric(), metric);
                }
                return existing;
            }

            Connection conn = connectionManager.getWriteConnection();
            try (PreparedStatement stmt = conn.prepareStatement(
                    "INSERT OR IGNORE INTO vector_collections (name, dimension, distance) VALUES (?, ?, ?)")) {
                stmt.setString(1, collection);
                stmt.setInt(2, dimension);
                stmt.setString(3, metric.name());
                stmt.executeUpdate();
                LOG.infof("Created vector collection %s (dimension %d, %s)", collection, dimension, metric);
            } catch (SQLException e) {
                throw new GraphStoreException("Failed to create vector collection", collection, e);
            } finally {
                connectionManager.releaseWriteConnection(conn);
            }
            return new CollectionInfo(collection, dimension, metric);
        });
    }

    @Override
    public CompletableFuture<CollectionInfo> recreateCollection(@NotNull String collection, int dimension,
                                                                @NotNull DistanceMetric metric) {
        return CompletableFuture.supplyAsync(() -> {
            requirePositive(dimension);
            Connection conn = connectionManager.getWriteConnection();
            try {
                conn.setAutoCommit(false);
                try (PreparedStatement points = conn.prepareStatement("DELETE FROM vector_points WHERE collection = ?");
                     PreparedStatement drop = conn.prepareStatement("DELETE FROM vector_collections WHERE name = ?");
                     PreparedStatement create = conn.prepareStatement(
                         "INSERT INTO vector_collections (name, dimension, distance) VALUES (?, ?, ?)")) {
                    points.setString(1, collection);
                    int removed = points.executeUpdate();
                    drop.setString(1, collection);
                    drop.executeUpdate();
                    create.setString(1, collection);
                    create.setInt(2, dimension);
                    create.setString(3, metric.name());
                    create.executeUpdate();
                    LOG.warnf("Recreated vector collection %s (dimension %d, %s), dropped %d points",
                        collection, dimension, metric, removed);
                }
                conn.commit();
            } catch (SQLException e) {
                try {
                    conn.rollback();
                } catch (SQLException rollbackEx) {
                    LOG.warn("Failed to rollback", rollbackEx);
                }
                throw new GraphStoreException("Failed to recreate vector collection", collection, e);
            } finally {
                try {
                    conn.setAutoCommit(true);
                } catch (SQLException ex) {
                    LOG.warn("Failed to reset auto-commit", ex);
                }
                connectionManager.releaseWriteConnection(conn);
            }
            return new CollectionInfo(collection, dimension, metric);
        });
    }

    @Override
    public CompletableFuture<CollectionInfo> getCollection(@NotNull String collection) {
        return CompletableFuture.supplyAsync(() -> readCollection(collection));
    }

    @Override
    public CompletableFuture<Integer> upsertBatch(@NotNull String collection, @NotNull List<VectorPoint> points) {
        return CompletableFuture.supplyAsync(() -> {
            if (points.isEmpty()) {
                return 0;
            }
            CollectionInfo info = requireCollection(collection);
            for (VectorPoint point : points) {
                if (point.vector().length != info.dimension()) {
                    throw new VectorDimensionMismatchException("point '" + point.id() + "'",
                        info.dimension(), point.vector().length);
                }
            }

            String sql = """
                INSERT INTO vector_points (collection, id, doc_id, scope, text, vector, metadata)
                VALUES (?, ?, ?, ?, ?, ?, ?)
                ON CONFLICT(collection, id) DO UPDATE SET
                    doc_id = excluded.doc_id,
                    scope = excluded.scope,
                    text = excluded.text,
                    vector = excluded.vector,
                    metadata = excluded.metadata
                """;

            Connection conn = connectionManager.getWriteConnection();
            try {
                conn.setAutoCommit(false);
                try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                    for (VectorPoint point : points) {
                        stmt.setString(1, collection);
                        stmt.setString(2, point.id());
                        stmt.setString(3, point.docId());
                        stmt.setString(4, point.scope());
                        stmt.setString(5, point.text());
                        stmt.setBytes(6, VectorUtil.toBytes(point.vector()));
                        stmt.setString(7, toJson(point.metadata()));
                        stmt.addBatch();
                    }
                    stmt.executeBatch();
                }
                conn.commit();
                LOG.debugf("Upserted %d vectors into %s", points.size(), collection);
                return points.size();
            } catch (SQLException e) {
                try {
                    conn.rollback();
                } catch (SQLException rollbackEx) {
                    LOG.warn("Failed to rollback", rollbackEx);
                }
                throw new GraphStoreException("Failed to upsert vectors", collection, e);
            } finally {
                try {
                    conn.setAutoCommit(true);
                } catch (SQLException ex) {
                    LOG.warn("Failed to reset auto-commit", ex);
                }
                connectionManager.releaseWriteConnection(conn);
            }
        });
    }

    @Override
    public CompletableFuture<List<VectorSearchResult>> query(@NotNull String collection, @NotNull float[] queryVector,
                                                             int topK, @Nullable VectorFilter filter) {
        return CompletableFuture.supplyAsync(() -> {
            if (topK <= 0) {
                return List.<VectorSearchResult>of();
            }
            CollectionInfo info = requireCollection(collection);
            if (queryVector.length != info.dimension()) {
                throw new IllegalArgumentException(String.format(
                    "Query vector has dimension %d, collection %s expects %d",
                    queryVector.length, collection, info.dimension()));
            }

            StringBuilder sql = new StringBuilder(
                "SELECT id, doc_id, scope, text, vector, metadata FROM vector_points WHERE collection = ?");
            List<String> params = new ArrayList<>(List.of(collection));
            if (filter != null && filter.docId() != null) {
                sql.append(" AND doc_id = ?");
                params.add(filter.docId());
            }
            if (filter != null && filter.scope() != null) {
                sql.append(" AND scope = ?");
                params.add(filter.scope());
            }

            PriorityQueue<VectorSearchResult> best = new PriorityQueue<>(
                Comparator.comparingDouble(VectorSearchResult::score));
            Connection conn = connectionManager.getReadConnection();
            try (PreparedStatement stmt = conn.prepareStatement(sql.toString())) {
                for (int i = 0; i < params.size(); i++) {
                    stmt.setString(i + 1, params.get(i));
                }
                try (ResultSet rs = stmt.executeQuery()) {
                    while (rs.next()) {
                        VectorPoint point = pointFromResultSet(rs);
                        if (filter != null && !filter.metadata().isEmpty()
                                && !filter.matches(point.docId(), point.scope(), point.metadata())) {
                            continue;
                        }
                        best.add(VectorSearchResult.of(point, info.metric().similarity(queryVector, point.vector())));
                        if (best.size() > topK) {
                            best.poll();
                        }
                    }
                }
            } catch (SQLException e) {
                throw new GraphStoreException("Failed to query vectors", collection, e);
            } finally {
                connectionManager.releaseReadConnection(conn);
            }

            List<VectorSearchResult> results = new ArrayList<>(best);
            results.sort(Comparator.comparingDouble(VectorSearchResult::score).reversed()
                .thenComparing(VectorSearchResult::id));
            return results;
        });
    }

    @Override
    public CompletableFuture<VectorPoint> get(@NotNull String collection, @NotNull String id) {
        return CompletableFuture.supplyAsync(() -> {
            Connection conn = connectionManager.getReadConnection();
            try (PreparedStatement stmt = conn.prepareStatement(
                    "SELECT id, doc_id, scope, text, vector, metadata FROM vector_points WHERE collection = ? AND id = ?")) {
                stmt.setString(1, collection);
                stmt.setString(2, id);
                try (ResultSet rs = stmt.executeQuery()) {
                    return rs.next() ? pointFromResultSet(rs) : null;
                }
            } catch (SQLException e) {
                throw new GraphStoreException("Failed to get vector", id, e);
            } finally {
                connectionManager.releaseReadConnection(conn);
            }
        });
    }

    @Override
    public CompletableFuture<Integer> deleteByDocument(@NotNull String collection, @NotNull String docId) {
        return CompletableFuture.supplyAsync(() -> {
            Connection conn = connectionManager.getWriteConnection();
            try (PreparedStatement stmt = conn.prepareStatement(
                    "DELETE FROM vector_points WHERE collection = ? AND doc_id = ?")) {
                stmt.setString(1, collection);
                stmt.setString(2, docId);
                int deleted = stmt.executeUpdate();
                LOG.debugf("Deleted %d vectors of document %s", deleted, docId);
                return deleted;
            } catch (SQLException e) {
                throw new GraphStoreException("Failed to delete document vectors", docId, e);
            } finally {
                connectionManager.releaseWriteConnection(conn);
            }
        });
    }

    @Override
    public CompletableFuture<Long> size(@NotNull String collection) {
        return CompletableFuture.supplyAsync(() -> {
            Connection conn = connectionManager.getReadConnection();
            try (PreparedStatement stmt = conn.prepareStatement(
                    "SELECT COUNT(*) FROM vector_points WHERE collection = ?")) {
                stmt.setString(1, collection);
                try (ResultSet rs = stmt.executeQuery()) {
                    return rs.next() ? rs.getLong(1) : 0L;
                }
            } catch (SQLException e) {
                throw new GraphStoreException("Failed to count vectors", collection, e);
            } finally {
                connectionManager.releaseReadConnection(conn);
            }
        });
    }

    @Override
    public void close() {
        LOG.info("Closed SQLiteVectorStorage");
    }

    // ========== Helper Methods ==========

    private CollectionInfo readCollection(String collection) {
        Connection conn = connectionManager.getReadConnection();
        try (PreparedStatement stmt = conn.prepareStatement(
                "SELECT name, dimension, distance FROM vector_collections WHERE name = ?")) {
            stmt.setString(1, collection);
            try (ResultSet rs = stmt.executeQuery()) {
                if (!rs.next()) {
                    return null;
                }
                return new CollectionInfo(rs.getString("name"), rs.getInt("dimension"),
                    DistanceMetric.parse(rs.getString("distance")));
            }
        } catch (SQLException e) {
            throw new GraphStoreException("Failed to read vector collection", collection, e);
        } finally {
            connectionManager.releaseReadConnection(conn);
        }
    }

    private CollectionInfo requireCollection(String collection) {
        CollectionInfo info = readCollection(collection);
        if (info == null) {
            throw new IllegalStateException("Vector collection does not exist: " + collection);
        }
        return info;
    }

    private VectorPoint pointFromResultSet(ResultSet rs) throws SQLException {
        return new VectorPoint(
            rs.getString("id"),
            VectorUtil.fromBytes(rs.getBytes("vector")),
            rs.getString("doc_id"),
            rs.getString("scope"),
            rs.getString("text"),
            fromJson(rs.getString("metadata"))
        );
    }

    private static void requirePositive(int dimension) {
        if (dimension <= 0) {
            throw new IllegalArgumentException("Vector dimension must be positive, got " + dimension);
        }
    }

    private String toJson(Map<String, Object> metadata) {
        try {
            return OBJECT_MAPPER.writeValueAsString(metadata);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Vector metadata is not serializable", e);
        }
    }

    private Map<String, Object> fromJson(String json) {
        if (json == null || json.isEmpty()) {
            return Map.of();
        }
        try {
            return OBJECT_MAPPER.readValue(json, METADATA_TYPE);
        } catch (JsonProcessingException e) {
            LOG.warnf("Corrupt vector metadata, ignoring: %s", e.getOriginalMessage());
            return Map.of();
        }
    }
}
