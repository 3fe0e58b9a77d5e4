package br.edu.ifba.kgrag.retrieval;

import br.edu.ifba.kgrag.core.Edge;
import br.edu.ifba.kgrag.core.Node;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * A result of the graph channel.
 *
 * @param kind        entity, path or subgraph
 * @param score       channel score before normalization
 * @param content     human-readable rendering
 * @param nodes       nodes in traversal order
 * @param edges       edges in traversal order, empty for entity hits
 * @param pathLength  number of edges traversed
 * @param explanation how the hit was found, may be null
 */
public record GraphHit(
    @NotNull Kind kind,
    double score,
    @NotNull String content,
    @NotNull List<Node> nodes,
    @NotNull List<Edge> edges,
    int pathLength,
    @Nullable String explanation
) {

    public enum Kind {
        ENTITY,
        PATH,
        SUBGRAPH
    }

    public GraphHit {
        nodes = nodes != null ? List.copyOf(nodes) : List.of();
        edges = edges != null ? List.copyOf(edges) : List.of();
    }

    public GraphHit withScore(double newScore) {
        return new GraphHit(kind, newScore, content, nodes, edges, pathLength, explanation);
    }

    /**
     * Mean edge confidence, {@link Edge#DEFAULT_CONFIDENCE} when there are no edges.
     */
    public double meanConfidence() {
        return edges.stream().mapToDouble(Edge::getConfidence).average().orElse(Edge.DEFAULT_CONFIDENCE);
    }

    public List<String> nodeIds() {
        return nodes.stream().map(Node::getId).toList();
    }

    public List<String> relationIds() {
        return edges.stream().map(Edge::getRid).toList();
    }
}
