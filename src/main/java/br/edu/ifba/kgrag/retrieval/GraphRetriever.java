package br.edu.ifba.kgrag.retrieval;

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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Graph channel: entity lookup, bounded traversal and shortest paths over
 * the graph store.
 *
 * <p>Every operation takes an optional scope. With a scope set, nodes and
 * edges of other scopes are invisible, so a book view and its section views
 * never mix.</p>
 */
public class GraphRetriever {

    private static final Logger logger = LoggerFactory.getLogger(GraphRetriever.class);

    /** Score factor applied to subgraphs found by expanding an entity hit. */
    static final double EXPANSION_FACTOR = 0.8;

    /** Entities expanded by {@link #search}. */
    static final int EXPANDED_ENTITIES = 3;

    private static final int CANDIDATE_POOL_FACTOR = 5;
    private static final int MIN_CANDIDATE_POOL = 50;

    private final GraphStorage graphStorage;

    public GraphRetriever(@NotNull GraphStorage graphStorage) {
        this.graphStorage = graphStorage;
    }

    /**
     * Entity search followed by subgraph expansion of the best entities.
     *
     * @param query    free text
     * @param topK     maximum hits
     * @param hop      traversal depth, 0 disables expansion
     * @param relTypes relation types to follow, null for all
     * @param scope    scope filter, null for all scopes
     * @return hits, score descending
     */
    @NotNull
    public List<GraphHit> search(@NotNull String query, int topK, int hop,
                                 @Nullable Set<RelationType> relTypes, @Nullable String scope) {
        if (query.isBlank() || topK <= 0) {
            return List.of();
        }
        int half = Math.max(1, topK / 2);
        List<GraphHit> entities = searchEntities(query, null, scope, half);
        List<GraphHit> hits = new ArrayList<>(entities);

        if (!entities.isEmpty() && hop > 0) {
            for (GraphHit entity : entities.subList(0, Math.min(EXPANDED_ENTITIES, entities.size()))) {
                for (GraphHit path : subgraph(entity.nodes().get(0).getId(), hop, relTypes, scope, half)) {
                    hits.add(path.withScore(path.score() * EXPANSION_FACTOR));
                }
            }
        }

        List<GraphHit> ranked = hits.stream()
            .sorted(Comparator.comparingDouble(GraphHit::score).reversed())
            .limit(topK)
            .toList();
        logger.debug("Graph search for '{}' returned {} hits ({} entities)", abbreviate(query), ranked.size(),
            entities.size());
        return ranked;
    }

    /**
     * Ranks nodes matching {@code query} by name, alias and description.
     */
    @NotNull
    public List<GraphHit> searchEntities(@NotNull String query, @Nullable Set<String> types,
                                         @Nullable String scope, int limit) {
        String needle = query.trim();
        if (needle.isEmpty() || limit <= 0) {
            return List.of();
        }
        int pool = Math.max(limit * CANDIDATE_POOL_FACTOR, MIN_CANDIDATE_POOL);
        List<Node> candidates = join(graphStorage.findCandidates(needle, types, scope, pool));
        String lowered = needle.toLowerCase(Locale.ROOT);

        return candidates.stream()
            .map(node -> {
                double score = matchScore(node, lowered);
                return new GraphHit(GraphHit.Kind.ENTITY, score, formatEntity(node), List.of(node), List.of(),
                    0, "entity match " + String.format(Locale.ROOT, "%.1f", score));
            })
            .sorted(Comparator.comparingDouble(GraphHit::score).reversed()
                .thenComparing(hit -> hit.nodes().get(0).getId()))
            .limit(limit)
            .toList();
    }

    /**
     * Entities mentioned by the given chunks, scored by the share of those
     * chunks that mention each one.
     */
    @NotNull
    public List<GraphHit> entitiesByChunks(@NotNull Collection<String> chunkIds, int topK) {
        Set<String> chunks = new LinkedHashSet<>(chunkIds);
        if (chunks.isEmpty() || topK <= 0) {
            return List.of();
        }
        Map<String, Set<String>> chunksByNode = new HashMap<>();
        for (ChunkMention mention : join(graphStorage.getMentionsByChunks(chunks))) {
            chunksByNode.computeIfAbsent(mention.nodeId(), key -> new TreeSet<>()).add(mention.chunkId());
        }
        if (chunksByNode.isEmpty()) {
            return List.of();
        }
        Map<String, Node> nodes = new HashMap<>();
        for (Node node : join(graphStorage.getNodes(chunksByNode.keySet()))) {
            nodes.put(node.getId(), node);
        }

        List<GraphHit> hits = new ArrayList<>();
        chunksByNode.forEach((nodeId, mentioning) -> {
            Node node = nodes.get(nodeId);
            if (node == null) {
                return;
            }
            double score = (double) mentioning.size() / chunks.size();
            hits.add(new GraphHit(GraphHit.Kind.ENTITY, score, formatEntity(node), List.of(node), List.of(), 0,
                "mentioned in " + mentioning.size() + " of " + chunks.size() + " chunks"));
        });
        return hits.stream()
            .sorted(Comparator.comparingDouble(GraphHit::score).reversed()
                .thenComparing(hit -> hit.nodes().get(0).getId()))
            .limit(topK)
            .toList();
    }

    /**
     * Chunks that mention any of the given entities, those naming the most
     * entities first.
     */
    @NotNull
    public List<MentionedChunk> chunksByEntities(@NotNull Collection<String> nodeIds, int limit) {
        if (nodeIds.isEmpty() || limit <= 0) {
            return List.of();
        }
        Map<String, List<ChunkMention>> byChunk = new LinkedHashMap<>();
        for (ChunkMention mention : join(graphStorage.getMentionsByNodes(new LinkedHashSet<>(nodeIds)))) {
            byChunk.computeIfAbsent(mention.chunkId(), key -> new ArrayList<>()).add(mention);
        }
        return byChunk.values().stream()
            .map(GraphRetriever::toMentionedChunk)
            .sorted(Comparator.comparingInt(MentionedChunk::entityCount).reversed()
                .thenComparing(Comparator.comparingDouble(MentionedChunk::confidence).reversed())
                .thenComparing(MentionedChunk::chunkId))
            .limit(limit)
            .toList();
    }

    private static MentionedChunk toMentionedChunk(List<ChunkMention> mentions) {
        Set<String> nodeIds = new TreeSet<>();
        double confidence = 0;
        for (ChunkMention mention : mentions) {
            nodeIds.add(mention.nodeId());
            confidence = Math.max(confidence, mention.confidence());
        }
        ChunkMention first = mentions.get(0);
        return new MentionedChunk(first.chunkId(), first.docId(), new ArrayList<>(nodeIds), confidence);
    }

    /**
     * Enumerates simple paths of 1..{@code hop} edges starting at a node.
     * Each path scores {@code Π(confidence × weight)}.
     *
     * @return up to {@code limit} paths, score descending
     */
    @NotNull
    public List<GraphHit> subgraph(@NotNull String entityId, int hop, @Nullable Set<RelationType> relTypes,
                                   @Nullable String scope, int limit) {
        if (hop <= 0 || limit <= 0) {
            return List.of();
        }
        Map<String, List<Edge>> adjacency = new HashMap<>();
        List<PathState> found = new ArrayList<>();
        Deque<PathState> frontier = new ArrayDeque<>();
        frontier.add(PathState.start(entityId));

        while (!frontier.isEmpty()) {
            PathState current = frontier.poll();
            if (current.edges.size() >= hop) {
                continue;
            }
            for (Edge edge : neighbours(current.last(), scope, relTypes, adjacency)) {
                String next = edge.otherEnd(current.last());
                if (next == null || current.nodeIds.contains(next)) {
                    continue;
                }
                PathState extended = current.extend(edge, next);
                found.add(extended);
                frontier.add(extended);
            }
        }

        Map<String, Node> nodes = loadNodes(found);
        return found.stream()
            .filter(path -> path.nodeIds.stream().allMatch(nodes::containsKey))
            .map(path -> toSubgraphHit(path, nodes))
            .sorted(Comparator.comparingDouble(GraphHit::score).reversed()
                .thenComparing(GraphHit::content))
            .limit(limit)
            .toList();
    }

    /**
     * Breadth-first shortest path between two entities given by id or name.
     * Scores {@code 1 / (length + 1)}.
     *
     * @return the path, or empty when either end is unknown or no path
     *         within {@code maxHop} edges exists
     */
    @NotNull
    public Optional<GraphHit> shortestPath(@NotNull String startEntity, @NotNull String endEntity, int maxHop,
                                           @Nullable Set<RelationType> relTypes, @Nullable String scope) {
        Optional<String> start = resolveEntity(startEntity, scope);
        Optional<String> end = resolveEntity(endEntity, scope);
        if (start.isEmpty() || end.isEmpty() || maxHop <= 0) {
            logger.debug("No path: unresolved endpoint '{}' or '{}'", startEntity, endEntity);
            return Optional.empty();
        }
        if (start.get().equals(end.get())) {
            return Optional.empty();
        }

        Map<String, List<Edge>> adjacency = new HashMap<>();
        Map<String, Edge> reachedBy = new HashMap<>();
        Map<String, Integer> depth = new HashMap<>();
        Deque<String> queue = new ArrayDeque<>();
        depth.put(start.get(), 0);
        queue.add(start.get());

        while (!queue.isEmpty() && !depth.containsKey(end.get())) {
            String current = queue.poll();
            int d = depth.get(current);
            if (d >= maxHop) {
                continue;
            }
            for (Edge edge : neighbours(current, scope, relTypes, adjacency)) {
                String next = edge.otherEnd(current);
                if (next != null && !depth.containsKey(next)) {
                    depth.put(next, d + 1);
                    reachedBy.put(next, edge);
                    queue.add(next);
                }
            }
        }
        if (!depth.containsKey(end.get())) {
            return Optional.empty();
        }

        List<Edge> edges = new ArrayList<>();
        List<String> ids = new ArrayList<>();
        String cursor = end.get();
        ids.add(cursor);
        while (!cursor.equals(start.get())) {
            Edge edge = reachedBy.get(cursor);
            edges.add(0, edge);
            cursor = edge.otherEnd(cursor);
            ids.add(0, cursor);
        }

        Map<String, Node> byId = new HashMap<>();
        join(graphStorage.getNodes(ids)).forEach(node -> byId.put(node.getId(), node));
        if (!ids.stream().allMatch(byId::containsKey)) {
            return Optional.empty();
        }
        List<Node> nodes = ids.stream().map(byId::get).toList();
        int length = edges.size();
        return Optional.of(new GraphHit(GraphHit.Kind.PATH, 1.0 / (length + 1), formatPath(nodes, edges),
            nodes, edges, length, "shortest path of " + length + " hops"));
    }

    static double matchScore(@NotNull Node node, @NotNull String loweredQuery) {
        return MatchRank.score(node, loweredQuery);
    }

    @NotNull
    static String formatEntity(@NotNull Node node) {
        StringBuilder content = new StringBuilder(node.getType()).append(": ").append(node.getName());
        if (!node.getDescription().isBlank()) {
            content.append(" | Description: ").append(node.getDescription());
        }
        return content.toString();
    }

    @NotNull
    static String formatPath(@NotNull List<Node> nodes, @NotNull List<Edge> edges) {
        if (nodes.size() < 2) {
            return "Empty path";
        }
        StringBuilder content = new StringBuilder(nodes.get(0).getName());
        for (int i = 0; i < edges.size() && i + 1 < nodes.size(); i++) {
            content.append(" -").append(relationName(edges.get(i))).append("-> ").append(nodes.get(i + 1).getName());
        }
        return content.toString();
    }

    @NotNull
    static String formatSubgraph(@NotNull List<Node> nodes, @NotNull List<Edge> edges, int pathLength) {
        if (nodes.isEmpty()) {
            return "Empty subgraph";
        }
        List<String> names = nodes.stream().limit(3).map(Node::getName).toList();
        Set<String> relations = new LinkedHashSet<>();
        edges.stream().limit(3).map(GraphRetriever::relationName).forEach(relations::add);

        StringBuilder content = new StringBuilder("Subgraph (").append(pathLength).append(" hops): ")
            .append(String.join(", ", names));
        if (!relations.isEmpty()) {
            content.append(" | Relations: ").append(String.join(", ", relations));
        }
        content.append(" | ").append(formatPath(nodes, edges));
        return content.toString();
    }

    static String relationName(Edge edge) {
        String label = edge.getTypeLabel();
        return label != null && !label.isBlank() ? label : edge.getType().name();
    }

    private GraphHit toSubgraphHit(PathState path, Map<String, Node> nodes) {
        List<Node> pathNodes = path.nodeIds.stream().map(nodes::get).toList();
        double score = 1.0;
        for (Edge edge : path.edges) {
            score *= edge.getConfidence() * edge.getWeight();
        }
        return new GraphHit(GraphHit.Kind.SUBGRAPH, score, formatSubgraph(pathNodes, path.edges, path.edges.size()),
            pathNodes, path.edges, path.edges.size(), "expanded from " + path.nodeIds.get(0));
    }

    private Optional<String> resolveEntity(String entity, @Nullable String scope) {
        Node byId = join(graphStorage.getNode(entity));
        if (byId != null && (scope == null || scope.equals(byId.getScope()))) {
            return Optional.of(byId.getId());
        }
        List<GraphHit> matches = searchEntities(entity, null, scope, 1);
        return matches.isEmpty() ? Optional.empty() : Optional.of(matches.get(0).nodes().get(0).getId());
    }

    private List<Edge> neighbours(String nodeId, @Nullable String scope, @Nullable Set<RelationType> relTypes,
                                  Map<String, List<Edge>> adjacency) {
        return adjacency.computeIfAbsent(nodeId, id -> join(graphStorage.getEdgesForNode(id, scope, relTypes)));
    }

    private Map<String, Node> loadNodes(List<PathState> paths) {
        Set<String> ids = new LinkedHashSet<>();
        paths.forEach(path -> ids.addAll(path.nodeIds));
        Map<String, Node> nodes = new HashMap<>();
        if (!ids.isEmpty()) {
            join(graphStorage.getNodes(ids)).forEach(node -> nodes.put(node.getId(), node));
        }
        return nodes;
    }

    private static <T> T join(CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }
    }

    private static String abbreviate(String text) {
        return text.length() <= 50 ? text : text.substring(0, 50) + "...";
    }

    private static final class PathState {

        private final List<String> nodeIds;
        private final List<Edge> edges;

        private PathState(List<String> nodeIds, List<Edge> edges) {
            this.nodeIds = nodeIds;
            this.edges = edges;
        }

        static PathState start(String nodeId) {
            return new PathState(List.of(nodeId), List.of());
        }

        String last() {
            return nodeIds.get(nodeIds.size() - 1);
        }

        PathState extend(Edge edge, String next) {
            List<String> ids = new ArrayList<>(nodeIds);
            ids.add(next);
            List<Edge> path = new ArrayList<>(edges);
            path.add(edge);
            return new PathState(List.copyOf(ids), List.copyOf(path));
        }
    }
}
