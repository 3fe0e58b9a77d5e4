package br.edu.ifba.kgrag.rerank;

import br.edu.ifba.kgrag.core.Evidence;
import br.edu.ifba.kgrag.core.EvidenceType;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class NoOpRerankerTest {

    private final NoOpReranker reranker = new NoOpReranker();

    static List<Evidence> evidence(int count) {
        return IntStream.range(0, count)
            .mapToObj(i -> new Evidence("vector_" + i, EvidenceType.VECTOR, "content " + i, 1.0 - i * 0.01,
                List.of(Evidence.SOURCE_VECTOR), null))
            .toList();
    }

    @Test
    void testKeepsOrderWithDecayingScores() {
        List<RerankedEvidence> results = reranker.rerank("heap", evidence(3), 10);

        assertEquals(3, results.size());
        assertEquals("vector_0", results.get(0).evidence().id());
        assertEquals(1.0, results.get(0).relevanceScore(), 1e-9);
        assertEquals(0.95, results.get(1).relevanceScore(), 1e-9);
        assertEquals(0, results.get(2).rankChange());
    }

    @Test
    void testScoreFloorAndTopK() {
        List<RerankedEvidence> results = reranker.rerank("heap", evidence(25), 25);

        assertEquals(0.1, results.get(24).relevanceScore(), 1e-9);
        assertEquals(5, reranker.rerank("heap", evidence(25), 5).size());
    }

    @Test
    void testRejectsInvalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> reranker.rerank("heap", List.of(), 5));
        assertThrows(IllegalArgumentException.class, () -> reranker.rerank("heap", evidence(2), 0));
        assertTrue(reranker.isAvailable());
        assertEquals("none", reranker.getProviderName());
    }
}
