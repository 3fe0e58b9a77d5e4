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
import java.util.List;
import java.util.TreeSet;

/**
 * Cleans draft nodes and edges into canonical form.
 *
 * <p>Names and descriptions are trimmed with internal whitespace collapsed;
 * aliases are canonicalized, deduplicated, sorted, and the alias equal to the
 * name is removed. Entries without a usable name are dropped and counted.
 * Never throws on malformed entries.</p>
 */
public class GraphNormalizer {

    private static final Logger logger = LoggerFactory.getLogger(GraphNormalizer.class);

    @NotNull
    public KnowledgeGraph normalize(@NotNull KnowledgeGraph raw) {
        List<Node> nodes = new ArrayList<>(raw.nodes().size());
        int droppedNodes = 0;
        for (Node node : raw.nodes()) {
            Node normalized = normalizeNode(node);
            if (normalized != null) {
                nodes.add(normalized);
            } else {
                droppedNodes++;
            }
        }

        List<Edge> edges = new ArrayList<>(raw.edges().size());
        int droppedEdges = 0;
        for (Edge edge : raw.edges()) {
            Edge normalized = normalizeEdge(edge);
            if (normalized != null) {
                edges.add(normalized);
            } else {
                droppedEdges++;
            }
        }

        if (droppedNodes > 0 || droppedEdges > 0) {
            logger.warn("Normalizer dropped {} malformed nodes and {} malformed edges", droppedNodes, droppedEdges);
        }
        return new KnowledgeGraph(nodes, edges, raw.hierarchy().strip());
    }

    /**
     * @return the normalized node, or null when its name is blank
     */
    @Nullable
    public Node normalizeNode(@NotNull Node node) {
        String name = IdentityUtil.canonicalize(node.getName());
        if (name.isEmpty() || IdentityUtil.slug(name).isEmpty()) {
            logger.debug("Dropping node without a usable name: {}", node);
            return null;
        }
        return node.toBuilder()
            .name(name)
            .type(IdentityUtil.canonicalize(node.getType()))
            .description(IdentityUtil.canonicalize(node.getDescription()))
            .aliases(normalizeAliases(node.getAliases(), name))
            .build();
    }

    /**
     * @return the normalized edge, or null when an endpoint is blank
     */
    @Nullable
    public Edge normalizeEdge(@NotNull Edge edge) {
        String sourceName = edge.getSourceName() != null ? IdentityUtil.canonicalize(edge.getSourceName()) : null;
        String targetName = edge.getTargetName() != null ? IdentityUtil.canonicalize(edge.getTargetName()) : null;
        if (blankEndpoint(edge.getSourceId(), sourceName) || blankEndpoint(edge.getTargetId(), targetName)) {
            logger.debug("Dropping edge with a blank endpoint: {}", edge);
            return null;
        }
        return edge.toBuilder()
            .sourceName(sourceName)
            .targetName(targetName)
            .description(IdentityUtil.canonicalize(edge.getDescription()))
            .evidence(edge.getEvidence() != null ? IdentityUtil.canonicalize(edge.getEvidence()) : null)
            .build();
    }

    /**
     * Canonical, deduplicated and sorted aliases without {@code canonicalName}.
     */
    @NotNull
    public static List<String> normalizeAliases(@Nullable List<String> aliases, @NotNull String canonicalName) {
        if (aliases == null || aliases.isEmpty()) {
            return List.of();
        }
        TreeSet<String> unique = new TreeSet<>();
        for (String alias : aliases) {
            String normalized = IdentityUtil.canonicalize(alias);
            if (!normalized.isEmpty() && !normalized.equals(canonicalName)) {
                unique.add(normalized);
            }
        }
        return List.copyOf(unique);
    }

    private static boolean blankEndpoint(@Nullable String id, @Nullable String name) {
        return (id == null || id.isBlank()) && (name == null || name.isEmpty());
    }
}
