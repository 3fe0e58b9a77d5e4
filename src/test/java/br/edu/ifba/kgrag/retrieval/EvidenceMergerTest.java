package br.edu.ifba.kgrag.retrieval;

import br.edu.ifba.kgrag.core.Edge;
import br.edu.ifba.kgrag.core.Evidence;
import br.edu.ifba.kgrag.core.EvidenceType;
import br.edu.ifba.kgrag.core.Node;
import br.edu.ifba.kgrag.rerank.RerankedEvidence;
import br.edu.ifba.kgrag.rerank.Reranker;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link EvidenceMerger}.
 */
class EvidenceMergerTest {

    private final EvidenceMerger merger = new EvidenceMerger(0.7, 0.3, 10);

    private static VectorHit vector(String id, String text, double score) {
        return new VectorHit(id, "doc", text, score, Map.of());
    }

    private static GraphHit entity(String id, String content, double score) {
        Node node = Node.builder().id(id).name(id).scope("book:ds").build();
        return new GraphHit(GraphHit.Kind.ENTITY, score, content, List.of(node), List.of(), 0, "entity match");
    }

    @Nested
    @DisplayName("Scoring")
    class Scoring {

        @Test
        @DisplayName("the heavier channel wins after per-channel normalization")
        void testWeightedChannels() {
            List<Evidence> merged = merger.merge("heap",
                List.of(vector("c1", "vector low", 0.2), vector("c2", "vector high", 0.8)),
                List.of(entity("n1", "graph low", 0.1), entity("n2", "graph high", 0.9)));

            assertEquals(4, merged.size());
            assertEquals("vector high", merged.get(0).content());
            assertEquals(EvidenceType.VECTOR, merged.get(0).type());
            assertEquals(0.7 + "vector high".length() / 1000.0, merged.get(0).score(), 1e-9);
            assertEquals("graph high", merged.get(1).content());
            assertEquals(0.3 + "graph high".length() / 1000.0, merged.get(1).score(), 1e-9);
        }

        @Test
        void testGraphScoreByKind() {
            GraphHit path = new GraphHit(GraphHit.Kind.PATH, 1.0, "a -IS_A-> b", List.of(), List.of(), 2, null);
            assertEquals(1.0 / 3, EvidenceMerger.graphScore(path), 1e-9);

            Edge edge = Edge.builder().rid("e").sourceId("a").targetId("b").confidence(0.5).build();
            List<Node> nodes = List.of(
                Node.builder().id("a").name("A").build(),
                Node.builder().id("b").name("B").build(),
                Node.builder().id("c").name("C").build());
            GraphHit subgraph = new GraphHit(GraphHit.Kind.SUBGRAPH, 1.0, "s", nodes, List.of(edge), 1, null);
            assertEquals(1.3 * 0.5, EvidenceMerger.graphScore(subgraph), 1e-9);
        }

        @Test
        void testFlatChannelKeepsScores() {
            List<VectorHit> hits = List.of(vector("a", "x", 0.4), vector("b", "y", 0.4));

            assertEquals(hits, EvidenceMerger.normalize(hits, VectorHit::score, VectorHit::withScore));
        }

        @Test
        void testWeightsAreRenormalized() {
            EvidenceMerger equal = new EvidenceMerger(2, 2, 5);

            assertEquals(0.5, equal.getAlpha(), 1e-9);
            assertEquals(0.5, equal.getBeta(), 1e-9);
            assertThrows(IllegalArgumentException.class, () -> new EvidenceMerger(-1, 1, 5));
            assertThrows(IllegalArgumentException.class, () -> new EvidenceMerger(0, 0, 5));
            assertThrows(IllegalArgumentException.class, () -> new EvidenceMerger(1, 1, 0));
        }
    }

    @Test
    @DisplayName("identical content from both channels collapses into one hybrid item")
    void testContentDeduplication() {
        List<Evidence> merged = merger.merge("heap",
            List.of(vector("c1", "Heap property holds", 0.9)),
            List.of(entity("n1", "heap property, holds!", 1.0)));

        assertEquals(1, merged.size());
        Evidence hybrid = merged.get(0);
        assertEquals(EvidenceType.HYBRID, hybrid.type());
        assertEquals(List.of(Evidence.SOURCE_VECTOR, Evidence.SOURCE_GRAPH), hybrid.sources());
        assertTrue(hybrid.id().startsWith("vector_"));
        assertEquals("Heap property holds", hybrid.content());
        assertEquals("entity", hybrid.metadata().get("secondary_kg_type"));

        double combined = (0.9 * 0.7 + 1.0 * 0.3 * 0.5) / 1.5;
        assertEquals(combined + 0.1 + "Heap property holds".length() / 1000.0, hybrid.score(), 1e-9);
    }

    @Test
    void testContentKeyIgnoresCaseAndPunctuation() {
        assertEquals(EvidenceMerger.contentKey("AVL Tree."), EvidenceMerger.contentKey("avl-tree"));
        assertEquals(16, EvidenceMerger.contentKey("二叉树").length());
    }

    @Test
    void testLimit() {
        List<Evidence> merged = merger.merge("heap",
            List.of(vector("c1", "one", 0.1), vector("c2", "two", 0.5), vector("c3", "three", 0.9)),
            List.of(), 2);

        assertEquals(2, merged.size());
        assertEquals("three", merged.get(0).content());
    }

    @Nested
    @DisplayName("Reranking")
    class Reranking {

        private final List<VectorHit> hits =
            List.of(vector("c1", "first", 0.9), vector("c2", "second", 0.5), vector("c3", "third", 0.1));

        @Test
        void testRerankReordersHead() {
            Reranker reranker = mock(Reranker.class);
            when(reranker.getProviderName()).thenReturn("mock");
            when(reranker.rerank(anyString(), anyList(), anyInt())).thenAnswer(invocation -> {
                List<Evidence> head = invocation.getArgument(1);
                List<RerankedEvidence> reversed = new ArrayList<>();
                for (int i = head.size() - 1; i >= 0; i--) {
                    reversed.add(RerankedEvidence.reranked(head.get(i), i, reversed.size(), 0.9));
                }
                return reversed;
            });
            EvidenceMerger reranking = new EvidenceMerger(0.7, 0.3, 10, reranker, 2);

            List<Evidence> merged = reranking.merge("heap", hits, List.of());

            assertEquals(List.of("second", "first", "third"),
                merged.stream().map(Evidence::content).toList());
            assertEquals(0.9, merged.get(0).metadata().get("rerank_score"));
            assertEquals(1, merged.get(0).metadata().get("original_rank"));
        }

        @Test
        @DisplayName("a failing reranker leaves the merged order in place")
        void testRerankFailureFallsBack() {
            Reranker reranker = mock(Reranker.class);
            when(reranker.rerank(anyString(), anyList(), anyInt())).thenThrow(new IllegalStateException("down"));
            EvidenceMerger reranking = new EvidenceMerger(0.7, 0.3, 10, reranker, 3);

            List<Evidence> merged = reranking.merge("heap", hits, List.of());

            assertEquals(List.of("first", "second", "third"),
                merged.stream().map(Evidence::content).toList());
        }
    }

    @Test
    void testStatistics() {
        List<Evidence> merged = merger.merge("heap",
            List.of(vector("c1", "Heap property holds", 0.9), vector("c2", "Arrays store heaps", 0.3)),
            List.of(entity("n1", "heap property holds", 1.0)));

        EvidenceStatistics stats = merger.statistics(merged);

        assertEquals(2, stats.total());
        assertEquals(Map.of("hybrid", 1, "vector", 1), stats.typeDistribution());
        assertEquals(Map.of("vector", 2, "graph", 1), stats.sourceDistribution());
        assertEquals(1, stats.multiSourceCount());
        assertTrue(stats.maxScore() >= stats.meanScore());
        assertEquals(0.7, stats.alpha(), 1e-9);

        EvidenceStatistics empty = merger.statistics(List.of());
        assertEquals(0, empty.total());
        assertEquals(0.0, empty.maxScore());
    }
}
