package br.edu.ifba.kgrag.core;

import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Objects;

/**
 * In-memory graph produced by extraction and carried through the pipeline.
 *
 * @param nodes     nodes, drafts or resolved
 * @param edges     edges, drafts or resolved
 * @param hierarchy free-form outline text from the extraction answer, may be empty
 */
public record KnowledgeGraph(
    @NotNull List<Node> nodes,
    @NotNull List<Edge> edges,
    @NotNull String hierarchy
) {

    public KnowledgeGraph {
        nodes = List.copyOf(Objects.requireNonNull(nodes, "nodes must not be null"));
        edges = List.copyOf(Objects.requireNonNull(edges, "edges must not be null"));
        hierarchy = hierarchy != null ? hierarchy : "";
    }

    public static KnowledgeGraph empty() {
        return new KnowledgeGraph(List.of(), List.of(), "");
    }

    public boolean isEmpty() {
        return nodes.isEmpty() && edges.isEmpty();
    }

    public KnowledgeGraph withNodes(@NotNull List<Node> newNodes) {
        return new KnowledgeGraph(newNodes, edges, hierarchy);
    }

    public KnowledgeGraph withEdges(@NotNull List<Edge> newEdges) {
        return new KnowledgeGraph(nodes, newEdges, hierarchy);
    }
}
