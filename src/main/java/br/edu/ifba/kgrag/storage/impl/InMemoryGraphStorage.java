package br.edu.ifba.kgrag.storage.impl;

import br.edu.ifba.kgrag.core.ChunkMention;
import br.edu.ifba.kgrag.core.Edge;
import br.edu.ifba.kgrag.core.Node;
import br.edu.ifba.kgrag.core.RelationType;
import br.edu.ifba.kgrag.storage.GraphStorage;
import br.edu.ifba.kgrag.storage.MatchRank;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;

/**
 * In-memory graph storage. Thread-safe with ConcurrentHashMap backing;
 * used for tests and the {@code memory} backend.
 */
public class InMemoryGraphStorage implements GraphStorage {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryGraphStorage.class);

    // id -> node
    private final ConcurrentHashMap<String, Node> nodes = new ConcurrentHashMap<>();

    // rid -> edge
    private final ConcurrentHashMap<String, Edge> edges = new ConcurrentHashMap<>();

    // parent scope -> member scopes
    private final ConcurrentHashMap<String, Set<String>> scopeMembers = new ConcurrentHashMap<>();

    // chunk id + node id -> mention
    private final ConcurrentHashMap<String, ChunkMention> mentions = new ConcurrentHashMap<>();

    private volatile boolean initialized = false;

    @Override
    public CompletableFuture<Void> initialize() {
        return CompletableFuture.runAsync(() -> {
            if (!initialized) {
                initialized = true;
                logger.info("InMemoryGraphStorage initialized");
            }
        });
    }

    @Override
    public CompletableFuture<Boolean> upsertNode(@NotNull Node node) {
        ensureInitialized();
        return CompletableFuture.supplyAsync(() -> {
            String id = node.requireId();
            if (node.getScope() == null) {
                throw new IllegalArgumentException("Node " + id + " has no scope");
            }
            Instant now = Instant.now();
            nodes.compute(id, (key, existing) -> {
                Instant created = existing != null && existing.getCreatedAt() != null
                    ? existing.getCreatedAt()
                    : (node.getCreatedAt() != null ? node.getCreatedAt() : now);
                return node.withTimestamps(created, now);
            });
            logger.debug("Upserted node: {} in scope: {}", id, node.getScope());
            return Boolean.TRUE;
        });
    }

    @Override
    public CompletableFuture<Boolean> upsertEdge(@NotNull Edge edge) {
        ensureInitialized();
        return CompletableFuture.supplyAsync(() -> {
            if (edge.getRid() == null || !edge.isResolved() || edge.getScope() == null) {
                throw new IllegalArgumentException("Edge is not resolved: " + edge);
            }
            Instant now = Instant.now();
            edges.compute(edge.getRid(), (key, existing) -> {
                Instant created = existing != null && existing.getCreatedAt() != null
                    ? existing.getCreatedAt()
                    : (edge.getCreatedAt() != null ? edge.getCreatedAt() : now);
                return edge.withTimestamps(created, now);
            });
            logger.debug("Upserted edge: {} -> {} in scope: {}", edge.getSourceId(), edge.getTargetId(), edge.getScope());
            return Boolean.TRUE;
        });
    }

    @Override
    public CompletableFuture<Integer> deleteByScope(@NotNull String scope) {
        ensureInitialized();
        return CompletableFuture.supplyAsync(() -> {
            List<String> doomed = edges.values().stream()
                .filter(edge -> scope.equals(edge.getScope()))
                .map(Edge::getRid)
                .toList();
            int deleted = 0;
            for (String rid : doomed) {
                if (edges.remove(rid) != null) {
                    deleted++;
                }
            }
            logger.debug("Deleted {} edges of scope {}", deleted, scope);
            return deleted;
        });
    }

    @Override
    public CompletableFuture<Integer> pruneOrphans(@NotNull String scope) {
        ensureInitialized();
        return CompletableFuture.supplyAsync(() -> {
            Set<String> referenced = new HashSet<>();
            for (Edge edge : edges.values()) {
                referenced.add(edge.getSourceId());
                referenced.add(edge.getTargetId());
            }
            List<String> orphans = nodes.values().stream()
                .filter(node -> scope.equals(node.getScope()) && !referenced.contains(node.getId()))
                .map(Node::getId)
                .toList();
            orphans.forEach(nodes::remove);
            if (!orphans.isEmpty()) {
                logger.info("Pruned {} orphan nodes of scope {}", orphans.size(), scope);
            }
            return orphans.size();
        });
    }

    @Override
    public CompletableFuture<Integer> retainNodes(@NotNull String scope, @NotNull Collection<String> keepIds) {
        ensureInitialized();
        return CompletableFuture.supplyAsync(() -> {
            Set<String> keep = new HashSet<>(keepIds);
            Set<String> stale = new HashSet<>();
            for (Node node : nodes.values()) {
                if (scope.equals(node.getScope()) && !keep.contains(node.getId())) {
                    stale.add(node.getId());
                }
            }
            edges.values().removeIf(edge -> stale.contains(edge.getSourceId()) || stale.contains(edge.getTargetId()));
            mentions.values().removeIf(mention -> stale.contains(mention.nodeId()));
            stale.forEach(nodes::remove);
            if (!stale.isEmpty()) {
                logger.info("Removed {} stale nodes of scope {}", stale.size(), scope);
            }
            return stale.size();
        });
    }

    @Override
    public CompletableFuture<Integer> replaceMentions(@NotNull String docId,
                                                      @NotNull Collection<ChunkMention> docMentions) {
        ensureInitialized();
        return CompletableFuture.supplyAsync(() -> {
            synchronized (mentions) {
                mentions.values().removeIf(mention -> docId.equals(mention.docId()));
                for (ChunkMention mention : docMentions) {
                    ChunkMention stored = new ChunkMention(mention.chunkId(), docId, mention.nodeId(),
                        mention.confidence());
                    mentions.merge(mention.chunkId() + '|' + mention.nodeId(), stored,
                        (existing, added) -> existing.confidence() >= added.confidence() ? existing : added);
                }
            }
            logger.debug("Stored {} mentions of document {}", docMentions.size(), docId);
            return docMentions.size();
        });
    }

    @Override
    public CompletableFuture<Void> addScopeMembers(@NotNull String parentScope,
                                                   @NotNull Collection<String> memberScopes) {
        ensureInitialized();
        return CompletableFuture.runAsync(() ->
            scopeMembers.computeIfAbsent(parentScope, key -> ConcurrentHashMap.newKeySet()).addAll(memberScopes));
    }

    @Override
    public CompletableFuture<List<String>> getScopeMembers(@NotNull String parentScope) {
        ensureInitialized();
        return CompletableFuture.supplyAsync(() ->
            List.copyOf(new TreeSet<>(scopeMembers.getOrDefault(parentScope, Set.of()))));
    }

    @Override
    public CompletableFuture<Node> getNode(@NotNull String id) {
        ensureInitialized();
        return CompletableFuture.completedFuture(nodes.get(id));
    }

    @Override
    public CompletableFuture<List<Node>> getNodes(@NotNull Collection<String> ids) {
        ensureInitialized();
        return CompletableFuture.supplyAsync(() -> ids.stream()
            .distinct()
            .map(nodes::get)
            .filter(Objects::nonNull)
            .sorted(Comparator.comparing(Node::getId))
            .toList());
    }

    @Override
    public CompletableFuture<List<Node>> getNodesByScope(@NotNull String scope) {
        ensureInitialized();
        return CompletableFuture.supplyAsync(() -> nodes.values().stream()
            .filter(node -> scope.equals(node.getScope()))
            .sorted(Comparator.comparing(Node::getId))
            .toList());
    }

    @Override
    public CompletableFuture<List<Edge>> getEdgesByScope(@NotNull String scope) {
        ensureInitialized();
        return CompletableFuture.supplyAsync(() -> edges.values().stream()
            .filter(edge -> scope.equals(edge.getScope()))
            .sorted(Comparator.comparing(Edge::getRid))
            .toList());
    }

    @Override
    public CompletableFuture<List<Edge>> getEdgesForNode(@NotNull String nodeId, @Nullable String scope,
                                                         @Nullable Set<RelationType> relTypes) {
        ensureInitialized();
        return CompletableFuture.supplyAsync(() -> edges.values().stream()
            .filter(edge -> nodeId.equals(edge.getSourceId()) || nodeId.equals(edge.getTargetId()))
            .filter(edge -> scope == null || scope.equals(edge.getScope()))
            .filter(edge -> relTypes == null || relTypes.isEmpty() || relTypes.contains(edge.getType()))
            .sorted(Comparator.comparing(Edge::getRid))
            .toList());
    }

    @Override
    public CompletableFuture<List<Node>> findCandidates(@NotNull String text, @Nullable Set<String> types,
                                                        @Nullable String scope, int limit) {
        ensureInitialized();
        return CompletableFuture.supplyAsync(() -> {
            String needle = text.trim().toLowerCase(Locale.ROOT);
            if (needle.isEmpty() || limit <= 0) {
                return List.<Node>of();
            }
            List<Node> matches = new ArrayList<>();
            for (Node node : nodes.values()) {
                if (scope != null && !scope.equals(node.getScope())) {
                    continue;
                }
                if (types != null && !types.isEmpty() && !types.contains(node.getType())) {
                    continue;
                }
                if (matches(node, needle)) {
                    matches.add(node);
                }
            }
            return matches.stream()
                .sorted(Comparator.comparingDouble((Node node) -> MatchRank.score(node, needle)).reversed()
                    .thenComparing(Node::getId))
                .limit(limit)
                .toList();
        });
    }

    @Override
    public CompletableFuture<List<ChunkMention>> getMentionsByChunks(@NotNull Collection<String> chunkIds) {
        ensureInitialized();
        Set<String> wanted = new HashSet<>(chunkIds);
        return CompletableFuture.supplyAsync(() -> sortedMentions(mention -> wanted.contains(mention.chunkId())));
    }

    @Override
    public CompletableFuture<List<ChunkMention>> getMentionsByNodes(@NotNull Collection<String> nodeIds) {
        ensureInitialized();
        Set<String> wanted = new HashSet<>(nodeIds);
        return CompletableFuture.supplyAsync(() -> sortedMentions(mention -> wanted.contains(mention.nodeId())));
    }

    private List<ChunkMention> sortedMentions(Predicate<ChunkMention> filter) {
        return mentions.values().stream()
            .filter(filter)
            .sorted(Comparator.comparingDouble(ChunkMention::confidence).reversed()
                .thenComparing(ChunkMention::chunkId)
                .thenComparing(ChunkMention::nodeId))
            .toList();
    }

    @Override
    public CompletableFuture<GraphStats> getStats() {
        ensureInitialized();
        return CompletableFuture.completedFuture(new GraphStats(nodes.size(), edges.size()));
    }

    @Override
    public CompletableFuture<GraphStats> getStats(@NotNull String scope) {
        ensureInitialized();
        return CompletableFuture.supplyAsync(() -> new GraphStats(
            nodes.values().stream().filter(node -> scope.equals(node.getScope())).count(),
            edges.values().stream().filter(edge -> scope.equals(edge.getScope())).count()));
    }

    @Override
    public void close() {
        if (initialized) {
            nodes.clear();
            edges.clear();
            scopeMembers.clear();
            mentions.clear();
            initialized = false;
            logger.info("InMemoryGraphStorage closed");
        }
    }

    private static boolean matches(Node node, String needle) {
        String name = node.getName().toLowerCase(Locale.ROOT);
        if (name.contains(needle) || needle.contains(name)) {
            return true;
        }
        for (String alias : node.getAliases()) {
            if (alias.toLowerCase(Locale.ROOT).contains(needle)) {
                return true;
            }
        }
        return node.getDescription().toLowerCase(Locale.ROOT).contains(needle);
    }

    private void ensureInitialized() {
        if (!initialized) {
            throw new IllegalStateException("Storage not initialized. Call initialize() first.");
        }
    }
}
