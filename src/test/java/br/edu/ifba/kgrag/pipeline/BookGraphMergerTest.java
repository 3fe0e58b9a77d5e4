package br.edu.ifba.kgrag.pipeline;

import br.edu.ifba.kgrag.core.BookContext;
import br.edu.ifba.kgrag.core.Edge;
import br.edu.ifba.kgrag.core.Node;
import br.edu.ifba.kgrag.storage.GraphStorage.GraphStats;
import br.edu.ifba.kgrag.storage.impl.InMemoryGraphStorage;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static br.edu.ifba.kgrag.pipeline.PipelineFixtures.BALANCED;
import static br.edu.ifba.kgrag.pipeline.PipelineFixtures.TREES;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Book merge over stored section graphs.
 */
class BookGraphMergerTest {

    private static final BookContext BOOK = new BookContext("Data Structures", "run-2024-01");

    private static InMemoryGraphStorage buildSections() {
        InMemoryGraphStorage storage = PipelineFixtures.newGraphStorage();
        SectionGraphPipeline pipeline = PipelineFixtures.pipeline(storage, PipelineFixtures.defaultLlm());
        pipeline.run(TREES);
        pipeline.run(BALANCED);
        return storage;
    }

    private static List<String> nodeView(InMemoryGraphStorage storage) {
        return storage.getNodesByScope(BOOK.scope()).join().stream()
            .map(node -> node.getId() + "|" + node.getName() + "|" + node.getDescription() + "|" + node.getAliases())
            .toList();
    }

    private static List<String> edgeView(InMemoryGraphStorage storage) {
        return storage.getEdgesByScope(BOOK.scope()).join().stream()
            .map(edge -> edge.getRid() + "|" + edge.getConfidence() + "|" + edge.getWeight() + "|" + edge.getEvidence())
            .toList();
    }

    @Test
    @DisplayName("should deduplicate shared concepts into the book scope")
    void testMergeDeduplicates() {
        InMemoryGraphStorage storage = buildSections();

        MergeStats stats = PipelineFixtures.merger(storage).merge(
            List.of(TREES.sectionId(), BALANCED.sectionId()), BOOK);

        assertTrue(stats.success());
        assertEquals(BOOK.bookId(), stats.bookId());
        assertEquals(5, stats.originalNodes());
        assertEquals(3, stats.mergedNodes());
        assertEquals(3, stats.originalEdges());
        assertEquals(2, stats.mergedEdges());
        assertEquals(0.4, stats.nodeDedupRatio(), 1e-9);
        assertEquals(List.of("Trees"), stats.chapters());
        assertTrue(stats.hierarchy().contains("Total Chapters: 1"));

        List<Node> bookNodes = storage.getNodesByScope(BOOK.scope()).join();
        assertTrue(bookNodes.stream().allMatch(node -> BOOK.scope().equals(node.getScope())));
        Node tree = bookNodes.stream().filter(node -> node.getName().equals("Binary Tree")).findFirst().orElseThrow();
        assertEquals("each node has at most two children", tree.getDescription());
    }

    @Test
    @DisplayName("an edge found by two sections carries evidence from both")
    void testSharedEdgeEvidence() {
        InMemoryGraphStorage storage = buildSections();

        PipelineFixtures.merger(storage).merge(List.of(TREES.sectionId(), BALANCED.sectionId()), BOOK);

        List<Edge> edges = storage.getEdgesByScope(BOOK.scope()).join();
        Edge shared = edges.stream().filter(edge -> edge.evidenceCount() == 2).findFirst().orElseThrow();
        assertTrue(shared.getEvidence().contains(TREES.sectionId() + ": "));
        assertTrue(shared.getEvidence().contains(BALANCED.sectionId() + ": "));
        assertTrue(new ThresholdFilter().passesDisplay(shared));
    }

    @Test
    @DisplayName("merging in two steps equals merging at once")
    void testMergeIsCommutative() {
        InMemoryGraphStorage atOnce = buildSections();
        PipelineFixtures.merger(atOnce).merge(List.of(TREES.sectionId(), BALANCED.sectionId()), BOOK);

        InMemoryGraphStorage stepwise = buildSections();
        BookGraphMerger merger = PipelineFixtures.merger(stepwise);
        merger.merge(List.of(BALANCED.sectionId()), BOOK);
        MergeStats last = merger.merge(List.of(TREES.sectionId()), BOOK);

        assertEquals(2, last.sections().size());
        assertEquals(nodeView(atOnce), nodeView(stepwise));
        assertEquals(edgeView(atOnce), edgeView(stepwise));
    }

    @Test
    @DisplayName("section scopes are untouched by a merge")
    void testSectionsUntouched() {
        InMemoryGraphStorage storage = buildSections();
        GraphStats before = storage.getStats(TREES.scope()).join();

        PipelineFixtures.merger(storage).merge(List.of(TREES.sectionId(), BALANCED.sectionId()), BOOK);

        assertEquals(before, storage.getStats(TREES.scope()).join());
    }

    @Test
    @DisplayName("concepts dropped by a section re-index do not reach the book")
    void testReindexedSectionReplacesConcepts() {
        InMemoryGraphStorage storage = buildSections();
        String retried = """
            ### Nodes
            - Trie: prefix tree over characters
            - Suffix Tree: compressed trie of all suffixes

            ### Relations
            - Suffix Tree -> Trie: IS_A
            """;
        SectionBuildResult rebuilt = PipelineFixtures.pipeline(storage,
            PipelineFixtures.scriptedLlm(Map.of(TREES.subchapterTitle(), retried))).run(TREES);

        assertTrue(rebuilt.success());
        assertEquals(2, rebuilt.storeStats().nodesRemoved());
        assertEquals(List.of("Suffix Tree", "Trie"), names(storage.getNodesByScope(TREES.scope()).join()));

        PipelineFixtures.merger(storage).merge(List.of(TREES.sectionId()), BOOK);

        assertEquals(List.of("Suffix Tree", "Trie"), names(storage.getNodesByScope(BOOK.scope()).join()));
        assertEquals(1, storage.getEdgesByScope(BOOK.scope()).join().size());
    }

    private static List<String> names(List<Node> nodes) {
        return nodes.stream().map(Node::getName).sorted().toList();
    }

    @Test
    void testBookIdFromRunId() {
        assertEquals("data_structures_run_2024", BOOK.bookId());
        assertEquals("book:data_structures_run_2024", BOOK.scope());
    }
}
