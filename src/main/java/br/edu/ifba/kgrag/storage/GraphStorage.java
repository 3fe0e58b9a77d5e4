package br.edu.ifba.kgrag.storage;

import br.edu.ifba.kgrag.core.ChunkMention;
import br.edu.ifba.kgrag.core.Edge;
import br.edu.ifba.kgrag.core.Node;
import br.edu.ifba.kgrag.core.RelationType;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Scope-partitioned knowledge graph persistence.
 *
 * <p>Nodes are keyed by their deterministic {@code id} and edges by their
 * {@code rid}; upserts match on that key, update properties and keep
 * {@code created_at} from the first insert. Scopes ({@code section:<id>},
 * {@code book:<id>}) partition the graph: {@link #deleteByScope(String)}
 * removes edges of one scope only, and nodes are never deleted by scope
 * except through {@link #pruneOrphans(String)}.</p>
 *
 * <p>Write failures complete the returned future exceptionally with a
 * {@link GraphStoreException}.</p>
 *
 * Implementations: SQLiteGraphStorage, InMemoryGraphStorage
 */
public interface GraphStorage extends AutoCloseable {

    /**
     * Initializes the graph storage backend.
     */
    CompletableFuture<Void> initialize();

    // ===== Writes =====

    /**
     * Inserts or updates a node by id.
     *
     * @param node resolved node carrying id and scope
     * @return true when a row was written
     */
    CompletableFuture<Boolean> upsertNode(@NotNull Node node);

    /**
     * Inserts or updates an edge by rid.
     *
     * @param edge resolved edge carrying rid and scope
     * @return true when a row was written
     */
    CompletableFuture<Boolean> upsertEdge(@NotNull Edge edge);

    /**
     * Deletes all edges whose scope equals {@code scope}. Nodes stay.
     *
     * @return number of deleted edges
     */
    CompletableFuture<Integer> deleteByScope(@NotNull String scope);

    /**
     * Deletes nodes tagged with {@code scope} that no edge references.
     *
     * @return number of deleted nodes
     */
    CompletableFuture<Integer> pruneOrphans(@NotNull String scope);

    /**
     * Deletes nodes tagged with {@code scope} whose id is not in
     * {@code keepIds}, together with any edge or chunk mention that still
     * references them.
     * A re-indexed scope then holds only its latest node set.
     *
     * @return number of deleted nodes
     */
    CompletableFuture<Integer> retainNodes(@NotNull String scope, @NotNull Collection<String> keepIds);

    /**
     * Records that {@code memberScopes} were folded into {@code parentScope}.
     */
    CompletableFuture<Void> addScopeMembers(@NotNull String parentScope, @NotNull Collection<String> memberScopes);

    /**
     * Replaces the mention links of one document's chunks.
     *
     * @param docId    document whose previous links are dropped
     * @param mentions links of the document's current chunks
     * @return number of links written
     */
    CompletableFuture<Integer> replaceMentions(@NotNull String docId, @NotNull Collection<ChunkMention> mentions);

    // ===== Reads =====

    /**
     * Member scopes recorded for {@code parentScope}, sorted.
     */
    CompletableFuture<List<String>> getScopeMembers(@NotNull String parentScope);

    CompletableFuture<Node> getNode(@NotNull String id);

    CompletableFuture<List<Node>> getNodes(@NotNull Collection<String> ids);

    /**
     * Nodes tagged with {@code scope}, ordered by id.
     */
    CompletableFuture<List<Node>> getNodesByScope(@NotNull String scope);

    /**
     * Edges of {@code scope}, ordered by rid.
     */
    CompletableFuture<List<Edge>> getEdgesByScope(@NotNull String scope);

    /**
     * Edges touching {@code nodeId} in either direction.
     *
     * @param nodeId   node id
     * @param scope    only edges of this scope, or any scope when null
     * @param relTypes only these relation types, or any when null/empty
     */
    CompletableFuture<List<Edge>> getEdgesForNode(@NotNull String nodeId, @Nullable String scope,
                                                  @Nullable Set<RelationType> relTypes);

    /**
     * Candidate nodes for entity search: the text occurs in the name, an alias
     * or the description, or the node name occurs in the text. Matching is
     * case-insensitive. Rows come ordered by {@link MatchRank} (strongest
     * first, then id) before {@code limit} applies, so an exact name match is
     * never cut in favour of description matches.
     *
     * @param text  query text
     * @param types node types to keep, or any when null/empty
     * @param scope only nodes of this scope, or any when null
     * @param limit maximum rows
     */
    CompletableFuture<List<Node>> findCandidates(@NotNull String text, @Nullable Set<String> types,
                                                 @Nullable String scope, int limit);

    /**
     * Mention links of the given chunks, strongest first.
     */
    CompletableFuture<List<ChunkMention>> getMentionsByChunks(@NotNull Collection<String> chunkIds);

    /**
     * Mention links pointing at the given nodes, strongest first.
     */
    CompletableFuture<List<ChunkMention>> getMentionsByNodes(@NotNull Collection<String> nodeIds);

    /**
     * Global node and edge counts.
     */
    CompletableFuture<GraphStats> getStats();

    /**
     * Counts for one scope: nodes tagged with it and edges of it.
     */
    CompletableFuture<GraphStats> getStats(@NotNull String scope);

    /**
     * Node and edge counts.
     */
    record GraphStats(
        long nodeCount,
        long edgeCount
    ) {}
}
