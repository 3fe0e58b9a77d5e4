package br.edu.ifba.kgrag.pipeline;

import br.edu.ifba.kgrag.core.Edge;
import br.edu.ifba.kgrag.core.KnowledgeGraph;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * Outcome of building one section graph. Failures are reported here instead
 * of being thrown to the caller.
 *
 * @param sectionId    deterministic section id
 * @param contentHash  hash of the section text
 * @param scope        {@code section:<sectionId>}
 * @param success      whether the graph was extracted and stored
 * @param storeStats   write figures, null when storage was not reached
 * @param insights     quality figures, null on failure
 * @param graph        the stored graph (storage-gated edges)
 * @param displayEdges edges that also pass the display gate
 * @param error        failure message, null on success
 */
public record SectionBuildResult(
    String sectionId,
    String contentHash,
    String scope,
    boolean success,
    @Nullable StoreStats storeStats,
    @Nullable SectionInsights insights,
    KnowledgeGraph graph,
    List<Edge> displayEdges,
    @Nullable String error
) {

    public SectionBuildResult {
        graph = graph != null ? graph : KnowledgeGraph.empty();
        displayEdges = displayEdges != null ? List.copyOf(displayEdges) : List.of();
    }

    public static SectionBuildResult failure(String sectionId, String contentHash, String scope, String error) {
        return new SectionBuildResult(sectionId, contentHash, scope, false, null, null,
            KnowledgeGraph.empty(), List.of(), error);
    }
}
