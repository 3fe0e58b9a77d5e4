package br.edu.ifba.kgrag.pipeline;

import br.edu.ifba.kgrag.core.Edge;
import br.edu.ifba.kgrag.core.KnowledgeGraph;
import br.edu.ifba.kgrag.core.Node;
import br.edu.ifba.kgrag.utils.IdentityUtil;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Assigns deterministic ids and removes duplicates inside one batch.
 *
 * <ul>
 *   <li>Node id: {@link IdentityUtil#nodeId(String, String, String, int)} over
 *       canonical name, type and scope. Nodes that land on the same id collapse
 *       into the first one; later duplicates only contribute aliases and a
 *       missing description.</li>
 *   <li>Edge endpoints resolve by node id first, then by canonical name or
 *       alias (case-insensitive) within the batch. Edges whose endpoint is not
 *       in the batch are dropped with a warning.</li>
 *   <li>Edge rid: {@link IdentityUtil#relationId} over type, endpoints and
 *       scope. The first edge per rid wins; confidences are not averaged here.</li>
 * </ul>
 */
public class IdempotentProcessor {

    private static final Logger logger = LoggerFactory.getLogger(IdempotentProcessor.class);

    private final int maxIdLength;

    public IdempotentProcessor() {
        this(IdentityUtil.DEFAULT_MAX_ID_LENGTH);
    }

    public IdempotentProcessor(int maxIdLength) {
        if (maxIdLength < 60) {
            throw new IllegalArgumentException("maxIdLength must be at least 60, got " + maxIdLength);
        }
        this.maxIdLength = maxIdLength;
    }

    /**
     * @param graph      normalized graph
     * @param scope      scope every node and edge is written under
     * @param srcSection section id recorded on edges, may be null for book scopes
     * @return graph with ids assigned and duplicates removed
     */
    @NotNull
    public KnowledgeGraph process(@NotNull KnowledgeGraph graph, @NotNull String scope, @Nullable String srcSection) {
        Map<String, Node> nodesById = new LinkedHashMap<>();
        Map<String, String> idsByName = new HashMap<>();

        for (Node node : graph.nodes()) {
            String canonical = IdentityUtil.canonicalize(node.getName());
            String id = nodeId(canonical, node.getType(), scope);
            Node assigned = node.toBuilder()
                .id(id)
                .name(canonical)
                .aliases(GraphNormalizer.normalizeAliases(node.getAliases(), canonical))
                .scope(scope)
                .build();
            Node existing = nodesById.get(id);
            if (existing == null) {
                nodesById.put(id, assigned);
            } else {
                nodesById.put(id, absorb(existing, assigned));
                logger.debug("Collapsed duplicate node {} into {}", node.getName(), id);
            }
            idsByName.putIfAbsent(nameKey(canonical), id);
            for (String alias : assigned.getAliases()) {
                idsByName.putIfAbsent(nameKey(alias), id);
            }
        }

        Map<String, Edge> edgesByRid = new LinkedHashMap<>();
        int dangling = 0;
        int duplicates = 0;
        for (Edge edge : graph.edges()) {
            String sourceId = resolve(edge.getSourceId(), edge.getSourceName(), nodesById, idsByName);
            String targetId = resolve(edge.getTargetId(), edge.getTargetName(), nodesById, idsByName);
            if (sourceId == null || targetId == null) {
                dangling++;
                logger.warn("Skipping edge with an endpoint outside the batch: {} -> {}",
                    edge.sourceKey(), edge.targetKey());
                continue;
            }
            String rid = IdentityUtil.relationId(edge.getType().name(), sourceId, targetId, scope);
            if (edgesByRid.containsKey(rid)) {
                duplicates++;
                logger.debug("Skipping duplicate edge {}|{}|{}|{}", sourceId, targetId, edge.getType(), scope);
                continue;
            }
            edgesByRid.put(rid, edge.toBuilder()
                .rid(rid)
                .sourceId(sourceId)
                .targetId(targetId)
                .scope(scope)
                .srcSection(srcSection != null ? srcSection : edge.getSrcSection())
                .build());
        }

        if (dangling > 0 || duplicates > 0) {
            logger.info("Idempotent pass for {}: dropped {} dangling and {} duplicate edges", scope, dangling, duplicates);
        }
        return new KnowledgeGraph(new ArrayList<>(nodesById.values()), new ArrayList<>(edgesByRid.values()),
            graph.hierarchy());
    }

    @NotNull
    public String nodeId(@NotNull String canonicalName, @Nullable String type, @NotNull String scope) {
        return IdentityUtil.nodeId(canonicalName, type, scope, maxIdLength);
    }

    private static Node absorb(Node first, Node duplicate) {
        Node.Builder merged = first.toBuilder();
        if (first.getDescription().isEmpty() && !duplicate.getDescription().isEmpty()) {
            merged.description(duplicate.getDescription());
        }
        List<String> aliases = new ArrayList<>(first.getAliases());
        aliases.addAll(duplicate.getAliases());
        if (!duplicate.getName().equals(first.getName())) {
            aliases.add(duplicate.getName());
        }
        return merged.aliases(GraphNormalizer.normalizeAliases(aliases, first.getName())).build();
    }

    @Nullable
    private static String resolve(@Nullable String id, @Nullable String name,
                                  Map<String, Node> nodesById, Map<String, String> idsByName) {
        if (id != null && nodesById.containsKey(id)) {
            return id;
        }
        if (name != null) {
            return idsByName.get(nameKey(IdentityUtil.canonicalize(name)));
        }
        return null;
    }

    private static String nameKey(String name) {
        return name.toLowerCase(Locale.ROOT);
    }
}
