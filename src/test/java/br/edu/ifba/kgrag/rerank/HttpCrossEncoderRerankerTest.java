package br.edu.ifba.kgrag.rerank;

import br.edu.ifba.kgrag.core.Evidence;
import br.edu.ifba.kgrag.rerank.RerankClient.RerankRequest;
import br.edu.ifba.kgrag.rerank.RerankClient.RerankResponse;
import br.edu.ifba.kgrag.rerank.RerankClient.RerankResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Exercises the reranker without the fault-tolerance interceptors.
 */
class HttpCrossEncoderRerankerTest {

    private RerankClient client;
    private HttpCrossEncoderReranker reranker;

    @BeforeEach
    void setUp() {
        client = mock(RerankClient.class);
        RerankerConfig config = mock(RerankerConfig.class);
        when(config.model()).thenReturn("bge-reranker-base");
        when(config.enabled()).thenReturn(true);

        reranker = new HttpCrossEncoderReranker();
        reranker.client = client;
        reranker.config = config;
        reranker.fallbackReranker = new NoOpReranker();
    }

    @Test
    void testReordersByRelevance() {
        when(client.rerank(any())).thenReturn(new RerankResponse("bge-reranker-base",
            List.of(new RerankResult(0, 0.2), new RerankResult(2, 0.95), new RerankResult(1, 0.5))));

        List<RerankedEvidence> results = reranker.rerank("heap", NoOpRerankerTest.evidence(3), 3);

        assertEquals(List.of("vector_2", "vector_1", "vector_0"),
            results.stream().map(result -> result.evidence().id()).toList());
        assertEquals(2, results.get(0).originalRank());
        assertEquals(2, results.get(0).rankChange());

        ArgumentCaptor<RerankRequest> request = ArgumentCaptor.forClass(RerankRequest.class);
        verify(client).rerank(request.capture());
        assertEquals("heap", request.getValue().query());
        assertEquals(List.of("content 0", "content 1", "content 2"), request.getValue().documents());
    }

    @Test
    @DisplayName("items the server leaves out are appended in their original order")
    void testMissingItemsAppended() {
        List<Evidence> evidence = NoOpRerankerTest.evidence(4);

        List<RerankedEvidence> results = reranker.toReranked(
            List.of(new RerankResult(3, 1.7), new RerankResult(9, 0.9), new RerankResult(3, 0.1)), evidence, 10);

        assertEquals(List.of("vector_3", "vector_0", "vector_1", "vector_2"),
            results.stream().map(result -> result.evidence().id()).toList());
        assertEquals(1.0, results.get(0).relevanceScore(), 1e-9);
        assertEquals(0.0, results.get(3).relevanceScore(), 1e-9);
        assertEquals(2, reranker.toReranked(List.of(), evidence, 2).size());
    }

    @Test
    void testEmptyResponseFails() {
        when(client.rerank(any())).thenReturn(new RerankResponse("m", null));

        assertThrows(IllegalStateException.class, () -> reranker.rerank("heap", NoOpRerankerTest.evidence(2), 2));
    }

    @Test
    void testFallbackKeepsOrder() {
        List<RerankedEvidence> results = reranker.fallbackRerank("heap", NoOpRerankerTest.evidence(3), 2);

        assertEquals(2, results.size());
        assertEquals("vector_0", results.get(0).evidence().id());
    }
}
