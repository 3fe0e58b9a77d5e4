package br.edu.ifba.kgrag.storage.impl;

import br.edu.ifba.kgrag.core.ChunkMention;
import br.edu.ifba.kgrag.core.Edge;
import br.edu.ifba.kgrag.core.Node;
import br.edu.ifba.kgrag.core.RelationType;
import br.edu.ifba.kgrag.storage.GraphStorage;
import br.edu.ifba.kgrag.storage.GraphStoreException;
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
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * SQLite-based implementation of GraphStorage.
 *
 * <p>Nodes live in {@code kg_nodes} keyed by id and edges in {@code kg_edges}
 * keyed by rid. Upserts use {@code INSERT ... ON CONFLICT DO UPDATE} and never
 * touch {@code created_at} of an existing row. Relation types are stored as
 * the enum name and only ever bound as parameters.</p>
 */
public final class SQLiteGraphStorage implements GraphStorage {

    private static final Logger LOG = Logger.getLogger(SQLiteGraphStorage.class);
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();
    private static final TypeReference<List<String>> STRING_LIST_TYPE = new TypeReference<>() {};

    private static final String NODE_COLUMNS =
        "id, name, node_type, description, aliases, scope, score, chapter, subchapter, created_at, updated_at";

    // Mirrors MatchRank.score
    private static final String MATCH_RANK = """
        CASE
            WHEN lower(name) = lower(?) THEN 1.0
            WHEN EXISTS (SELECT 1 FROM json_each(kg_nodes.aliases) a WHERE lower(a.value) = lower(?)) THEN 0.9
            WHEN instr(lower(name), lower(?)) = 1 THEN 0.8
            WHEN instr(lower(name), lower(?)) > 0 OR (name <> '' AND instr(lower(?), lower(name)) > 0) THEN 0.7
            WHEN instr(lower(description), lower(?)) > 0 THEN 0.6
            ELSE 0.5
        END AS match_rank""";

    private static final int MATCH_RANK_PARAMS = 6;

    private static final String EDGE_COLUMNS =
        "rid, rel_type, type_label, source_id, target_id, description, evidence, confidence, weight, "
            + "scope, src_section, created_at, updated_at";

    private final SQLiteConnectionManager connectionManager;

    /**
     * Creates a new SQLiteGraphStorage.
     *
     * @param connectionManager the SQLite connection manager
     */
    public SQLiteGraphStorage(SQLiteConnectionManager connectionManager) {
        this.connectionManager = connectionManager;
    }

    @Override
    public CompletableFuture<Void> initialize() {
        return CompletableFuture.runAsync(() -> LOG.info("Initialized SQLiteGraphStorage"));
    }

    // ========== Writes ==========

    @Override
    public CompletableFuture<Boolean> upsertNode(@NotNull Node node) {
        return CompletableFuture.supplyAsync(() -> {
            String id = node.requireId();
            if (node.getScope() == null) {
                throw new IllegalArgumentException("Node " + id + " has no scope");
            }
            String sql = """
                INSERT INTO kg_nodes (id, name, node_type, description, aliases, scope, score, chapter, subchapter, created_at, updated_at)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                ON CONFLICT(id) DO UPDATE SET
                    name = excluded.name,
                    node_type = excluded.node_type,
                    description = excluded.description,
                    aliases = excluded.aliases,
                    scope = excluded.scope,
                    score = excluded.score,
                    chapter = excluded.chapter,
                    subchapter = excluded.subchapter,
                    updated_at = excluded.updated_at
                """;

            Instant now = Instant.now();
            Connection conn = connectionManager.getWriteConnection();
            try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                stmt.setString(1, id);
                stmt.setString(2, node.getName());
                stmt.setString(3, node.getType());
                stmt.setString(4, node.getDescription());
                stmt.setString(5, toJson(node.getAliases()));
                stmt.setString(6, node.getScope());
                stmt.setDouble(7, node.getScore());
                stmt.setString(8, node.getChapter());
                stmt.setString(9, node.getSubchapter());
                stmt.setString(10, (node.getCreatedAt() != null ? node.getCreatedAt() : now).toString());
                stmt.setString(11, now.toString());

                boolean written = stmt.executeUpdate() > 0;
                LOG.debugf("Upserted node %s in scope %s", id, node.getScope());
                return written;
            } catch (SQLException e) {
                throw new GraphStoreException("Failed to upsert node", id, e);
            } finally {
                connectionManager.releaseWriteConnection(conn);
            }
        });
    }

    @Override
    public CompletableFuture<Boolean> upsertEdge(@NotNull Edge edge) {
        return CompletableFuture.supplyAsync(() -> {
            if (edge.getRid() == null || !edge.isResolved() || edge.getScope() == null) {
                throw new IllegalArgumentException("Edge is not resolved: " + edge);
            }
            String sql = """
                INSERT INTO kg_edges (rid, rel_type, type_label, source_id, target_id, description, evidence, confidence, weight, scope, src_section, created_at, updated_at)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                ON CONFLICT(rid) DO UPDATE SET
                    type_label = excluded.type_label,
                    description = excluded.description,
                    evidence = excluded.evidence,
                    confidence = excluded.confidence,
                    weight = excluded.weight,
                    src_section = excluded.src_section,
                    updated_at = excluded.updated_at
                """;

            Instant now = Instant.now();
            Connection conn = connectionManager.getWriteConnection();
            try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                stmt.setString(1, edge.getRid());
                stmt.setString(2, edge.getType().name());
                stmt.setString(3, edge.getTypeLabel());
                stmt.setString(4, edge.getSourceId());
                stmt.setString(5, edge.getTargetId());
                stmt.setString(6, edge.getDescription());
                stmt.setString(7, edge.getEvidence());
                stmt.setDouble(8, edge.getConfidence());
                stmt.setDouble(9, edge.getWeight());
                stmt.setString(10, edge.getScope());
                stmt.setString(11, edge.getSrcSection());
                stmt.setString(12, (edge.getCreatedAt() != null ? edge.getCreatedAt() : now).toString());
                stmt.setString(13, now.toString());

                boolean written = stmt.executeUpdate() > 0;
                LOG.debugf("Upserted edge %s (%s -> %s) in scope %s",
                    edge.getRid(), edge.getSourceId(), edge.getTargetId(), edge.getScope());
                return written;
            } catch (SQLException e) {
                throw new GraphStoreException("Failed to upsert edge", edge.getRid(), e);
            } finally {
                connectionManager.releaseWriteConnection(conn);
            }
        });
    }

    @Override
    public CompletableFuture<Integer> deleteByScope(@NotNull String scope) {
        return CompletableFuture.supplyAsync(() -> {
            Connection conn = connectionManager.getWriteConnection();
            try (PreparedStatement stmt = conn.prepareStatement("DELETE FROM kg_edges WHERE scope = ?")) {
                stmt.setString(1, scope);
                int deleted = stmt.executeUpdate();
                LOG.debugf("Deleted %d edges of scope %s", deleted, scope);
                return deleted;
            } catch (SQLException e) {
                throw new GraphStoreException("Failed to delete scope", scope, e);
            } finally {
                connectionManager.releaseWriteConnection(conn);
            }
        });
    }

    @Override
    public CompletableFuture<Integer> pruneOrphans(@NotNull String scope) {
        return CompletableFuture.supplyAsync(() -> {
            String sql = """
                DELETE FROM kg_nodes
                WHERE scope = ?
                  AND NOT EXISTS (
                      SELECT 1 FROM kg_edges e
                      WHERE e.source_id = kg_nodes.id OR e.target_id = kg_nodes.id
                  )
                """;
            Connection conn = connectionManager.getWriteConnection();
            try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                stmt.setString(1, scope);
                int deleted = stmt.executeUpdate();
                if (deleted > 0) {
                    LOG.infof("Pruned %d orphan nodes of scope %s", deleted, scope);
                }
                return deleted;
            } catch (SQLException e) {
                throw new GraphStoreException("Failed to prune orphans", scope, e);
            } finally {
                connectionManager.releaseWriteConnection(conn);
            }
        });
    }

    @Override
    public CompletableFuture<Integer> retainNodes(@NotNull String scope, @NotNull Collection<String> keepIds) {
        return CompletableFuture.supplyAsync(() -> {
            String stale = "SELECT id FROM kg_nodes WHERE scope = ? AND id NOT IN (SELECT value FROM json_each(?))";
            String keep = toJson(List.copyOf(keepIds));

            Connection conn = connectionManager.getWriteConnection();
            try {
                conn.setAutoCommit(false);
                try (PreparedStatement edgeStmt = conn.prepareStatement(
                        "DELETE FROM kg_edges WHERE source_id IN (" + stale + ") OR target_id IN (" + stale + ")");
                     PreparedStatement mentionStmt = conn.prepareStatement(
                        "DELETE FROM kg_chunk_mentions WHERE node_id IN (" + stale + ")");
                     PreparedStatement nodeStmt = conn.prepareStatement(
                        "DELETE FROM kg_nodes WHERE id IN (" + stale + ")")) {
                    edgeStmt.setString(1, scope);
                    edgeStmt.setString(2, keep);
                    edgeStmt.setString(3, scope);
                    edgeStmt.setString(4, keep);
                    int edgesDeleted = edgeStmt.executeUpdate();
                    mentionStmt.setString(1, scope);
                    mentionStmt.setString(2, keep);
                    mentionStmt.executeUpdate();
                    nodeStmt.setString(1, scope);
                    nodeStmt.setString(2, keep);
                    int nodesDeleted = nodeStmt.executeUpdate();
                    conn.commit();
                    if (nodesDeleted > 0) {
                        LOG.infof("Removed %d stale nodes (%d edges) of scope %s", nodesDeleted, edgesDeleted, scope);
                    }
                    return nodesDeleted;
                }
            } catch (SQLException e) {
                try {
                    conn.rollback();
                } catch (SQLException rollbackEx) {
                    LOG.warn("Failed to rollback", rollbackEx);
                }
                throw new GraphStoreException("Failed to remove stale nodes", scope, e);
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
    public CompletableFuture<Integer> replaceMentions(@NotNull String docId,
                                                      @NotNull Collection<ChunkMention> mentions) {
        return CompletableFuture.supplyAsync(() -> {
            Connection conn = connectionManager.getWriteConnection();
            try {
                conn.setAutoCommit(false);
                try (PreparedStatement deleteStmt = conn.prepareStatement(
                        "DELETE FROM kg_chunk_mentions WHERE doc_id = ?");
                     PreparedStatement insertStmt = conn.prepareStatement("""
                        INSERT INTO kg_chunk_mentions (chunk_id, doc_id, node_id, confidence)
                        VALUES (?, ?, ?, ?)
                        ON CONFLICT(chunk_id, node_id) DO UPDATE SET
                            doc_id = excluded.doc_id,
                            confidence = max(confidence, excluded.confidence)
                        """)) {
                    deleteStmt.setString(1, docId);
                    int removed = deleteStmt.executeUpdate();
                    for (ChunkMention mention : mentions) {
                        insertStmt.setString(1, mention.chunkId());
                        insertStmt.setString(2, docId);
                        insertStmt.setString(3, mention.nodeId());
                        insertStmt.setDouble(4, mention.confidence());
                        insertStmt.addBatch();
                    }
                    int written = mentions.isEmpty() ? 0 : insertStmt.executeBatch().length;
                    conn.commit();
                    LOG.debugf("Replaced %d mentions of document %s with %d", (Object) removed, docId, written);
                    return written;
                }
            } catch (SQLException e) {
                try {
                    conn.rollback();
                } catch (SQLException rollbackEx) {
                    LOG.warn("Failed to rollback", rollbackEx);
                }
                throw new GraphStoreException("Failed to write chunk mentions of document " + docId, e);
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
    public CompletableFuture<Void> addScopeMembers(@NotNull String parentScope,
                                                   @NotNull Collection<String> memberScopes) {
        return CompletableFuture.runAsync(() -> {
            if (memberScopes.isEmpty()) {
                return;
            }
            String sql = "INSERT OR IGNORE INTO kg_scope_members (parent_scope, member_scope) VALUES (?, ?)";

            Connection conn = connectionManager.getWriteConnection();
            try {
                conn.setAutoCommit(false);
                try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                    for (String member : memberScopes) {
                        stmt.setString(1, parentScope);
                        stmt.setString(2, member);
                        stmt.addBatch();
                    }
                    stmt.executeBatch();
                }
                conn.commit();
                LOG.debugf("Recorded %d member scopes of %s", memberScopes.size(), parentScope);
            } catch (SQLException e) {
                try {
                    conn.rollback();
                } catch (SQLException rollbackEx) {
                    LOG.warn("Failed to rollback", rollbackEx);
                }
                throw new GraphStoreException("Failed to record scope members", parentScope, e);
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

    // ========== Reads ==========

    @Override
    public CompletableFuture<List<String>> getScopeMembers(@NotNull String parentScope) {
        return CompletableFuture.supplyAsync(() -> queryList(
            "SELECT member_scope FROM kg_scope_members WHERE parent_scope = ? ORDER BY member_scope",
            List.of(parentScope),
            rs -> rs.getString(1)));
    }

    @Override
    public CompletableFuture<Node> getNode(@NotNull String id) {
        return CompletableFuture.supplyAsync(() -> {
            List<Node> nodes = queryList(
                "SELECT " + NODE_COLUMNS + " FROM kg_nodes WHERE id = ?", List.of(id), this::nodeFromResultSet);
            return nodes.isEmpty() ? null : nodes.get(0);
        });
    }

    @Override
    public CompletableFuture<List<Node>> getNodes(@NotNull Collection<String> ids) {
        return CompletableFuture.supplyAsync(() -> {
            if (ids.isEmpty()) {
                return Collections.<Node>emptyList();
            }
            String sql = "SELECT " + NODE_COLUMNS + " FROM kg_nodes WHERE id IN (" + placeholders(ids.size())
                + ") ORDER BY id";
            return queryList(sql, new ArrayList<Object>(ids), this::nodeFromResultSet);
        });
    }

    @Override
    public CompletableFuture<List<ChunkMention>> getMentionsByChunks(@NotNull Collection<String> chunkIds) {
        return CompletableFuture.supplyAsync(() -> queryMentions("chunk_id", chunkIds));
    }

    @Override
    public CompletableFuture<List<ChunkMention>> getMentionsByNodes(@NotNull Collection<String> nodeIds) {
        return CompletableFuture.supplyAsync(() -> queryMentions("node_id", nodeIds));
    }

    private List<ChunkMention> queryMentions(String column, Collection<String> ids) {
        if (ids.isEmpty()) {
            return Collections.emptyList();
        }
        String sql = "SELECT chunk_id, doc_id, node_id, confidence FROM kg_chunk_mentions WHERE " + column
            + " IN (" + placeholders(ids.size()) + ") ORDER BY confidence DESC, chunk_id, node_id";
        return queryList(sql, new ArrayList<Object>(ids), rs -> new ChunkMention(
            rs.getString("chunk_id"), rs.getString("doc_id"), rs.getString("node_id"), rs.getDouble("confidence")));
    }

    @Override
    public CompletableFuture<List<Node>> getNodesByScope(@NotNull String scope) {
        return CompletableFuture.supplyAsync(() -> queryList(
            "SELECT " + NODE_COLUMNS + " FROM kg_nodes WHERE scope = ? ORDER BY id",
            List.of(scope),
            this::nodeFromResultSet));
    }

    @Override
    public CompletableFuture<List<Edge>> getEdgesByScope(@NotNull String scope) {
        return CompletableFuture.supplyAsync(() -> queryList(
            "SELECT " + EDGE_COLUMNS + " FROM kg_edges WHERE scope = ? ORDER BY rid",
            List.of(scope),
            this::edgeFromResultSet));
    }

    @Override
    public CompletableFuture<List<Edge>> getEdgesForNode(@NotNull String nodeId, @Nullable String scope,
                                                         @Nullable Set<RelationType> relTypes) {
        return CompletableFuture.supplyAsync(() -> {
            StringBuilder sql = new StringBuilder("SELECT " + EDGE_COLUMNS
                + " FROM kg_edges WHERE (source_id = ? OR target_id = ?)");
            List<Object> params = new ArrayList<>(List.of(nodeId, nodeId));
            if (scope != null) {
                sql.append(" AND scope = ?");
                params.add(scope);
            }
            if (relTypes != null && !relTypes.isEmpty()) {
                sql.append(" AND rel_type IN (").append(placeholders(relTypes.size())).append(')');
                relTypes.stream().map(RelationType::name).sorted().forEach(params::add);
            }
            sql.append(" ORDER BY rid");
            return queryList(sql.toString(), params, this::edgeFromResultSet);
        });
    }

    @Override
    public CompletableFuture<List<Node>> findCandidates(@NotNull String text, @Nullable Set<String> types,
                                                        @Nullable String scope, int limit) {
        return CompletableFuture.supplyAsync(() -> {
            String needle = text.trim();
            if (needle.isEmpty() || limit <= 0) {
                return Collections.<Node>emptyList();
            }
            StringBuilder sql = new StringBuilder("SELECT " + NODE_COLUMNS + ", " + MATCH_RANK + """
                 FROM kg_nodes
                WHERE (instr(lower(name), lower(?)) > 0
                    OR instr(lower(aliases), lower(?)) > 0
                    OR instr(lower(description), lower(?)) > 0
                    OR instr(lower(?), lower(name)) > 0)
                """);
            List<Object> params = new ArrayList<>(Collections.nCopies(MATCH_RANK_PARAMS + 4, needle));
            if (scope != null) {
                sql.append(" AND scope = ?");
                params.add(scope);
            }
            if (types != null && !types.isEmpty()) {
                sql.append(" AND node_type IN (").append(placeholders(types.size())).append(')');
                types.stream().sorted().forEach(params::add);
            }
            sql.append(" ORDER BY match_rank DESC, id LIMIT ?");
            params.add(limit);
            return queryList(sql.toString(), params, this::nodeFromResultSet);
        });
    }

    @Override
    public CompletableFuture<GraphStats> getStats() {
        return CompletableFuture.supplyAsync(() -> new GraphStats(
            count("SELECT COUNT(*) FROM kg_nodes", null),
            count("SELECT COUNT(*) FROM kg_edges", null)));
    }

    @Override
    public CompletableFuture<GraphStats> getStats(@NotNull String scope) {
        return CompletableFuture.supplyAsync(() -> new GraphStats(
            count("SELECT COUNT(*) FROM kg_nodes WHERE scope = ?", scope),
            count("SELECT COUNT(*) FROM kg_edges WHERE scope = ?", scope)));
    }

    @Override
    public void close() {
        LOG.info("Closed SQLiteGraphStorage");
    }

    // ========== Helper Methods ==========

    @FunctionalInterface
    private interface RowMapper<T> {
        T map(ResultSet rs) throws SQLException;
    }

    private <T> List<T> queryList(String sql, List<?> params, RowMapper<T> mapper) {
        Connection conn = connectionManager.getReadConnection();
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            for (int i = 0; i < params.size(); i++) {
                stmt.setObject(i + 1, params.get(i));
            }
            List<T> results = new ArrayList<>();
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    results.add(mapper.map(rs));
                }
            }
            return results;
        } catch (SQLException e) {
            throw new GraphStoreException("Graph query failed", e);
        } finally {
            connectionManager.releaseReadConnection(conn);
        }
    }

    private long count(String sql, @Nullable String scope) {
        Connection conn = connectionManager.getReadConnection();
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            if (scope != null) {
                stmt.setString(1, scope);
            }
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? rs.getLong(1) : 0L;
            }
        } catch (SQLException e) {
            throw new GraphStoreException("Failed to get graph stats", scope, e);
        } finally {
            connectionManager.releaseReadConnection(conn);
        }
    }

    private Node nodeFromResultSet(ResultSet rs) throws SQLException {
        return Node.builder()
            .id(rs.getString("id"))
            .name(rs.getString("name"))
            .type(rs.getString("node_type"))
            .description(rs.getString("description"))
            .aliases(fromJson(rs.getString("aliases")))
            .scope(rs.getString("scope"))
            .score(rs.getDouble("score"))
            .chapter(rs.getString("chapter"))
            .subchapter(rs.getString("subchapter"))
            .createdAt(parseInstant(rs.getString("created_at")))
            .updatedAt(parseInstant(rs.getString("updated_at")))
            .build();
    }

    private Edge edgeFromResultSet(ResultSet rs) throws SQLException {
        return Edge.builder()
            .rid(rs.getString("rid"))
            .type(RelationType.fromStored(rs.getString("rel_type")))
            .typeLabel(rs.getString("type_label"))
            .sourceId(rs.getString("source_id"))
            .targetId(rs.getString("target_id"))
            .description(rs.getString("description"))
            .evidence(rs.getString("evidence"))
            .confidence(rs.getDouble("confidence"))
            .weight(rs.getDouble("weight"))
            .scope(rs.getString("scope"))
            .srcSection(rs.getString("src_section"))
            .createdAt(parseInstant(rs.getString("created_at")))
            .updatedAt(parseInstant(rs.getString("updated_at")))
            .build();
    }

    private static String placeholders(int count) {
        return String.join(", ", Collections.nCopies(count, "?"));
    }

    private static Instant parseInstant(String value) {
        if (value == null || value.isEmpty()) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            LOG.debugf("Unparseable timestamp '%s'", value);
            return null;
        }
    }

    private String toJson(List<String> list) {
        try {
            return OBJECT_MAPPER.writeValueAsString(list != null ? list : Collections.emptyList());
        } catch (JsonProcessingException e) {
            throw new GraphStoreException("Failed to serialize aliases", e);
        }
    }

    private List<String> fromJson(String json) {
        if (json == null || json.isEmpty()) {
            return Collections.emptyList();
        }
        try {
            return OBJECT_MAPPER.readValue(json, STRING_LIST_TYPE);
        } catch (JsonProcessingException e) {
            LOG.warnf("Corrupt aliases column, ignoring: %s", e.getOriginalMessage());
            return Collections.emptyList();
        }
    }
}
