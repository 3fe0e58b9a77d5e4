package br.edu.ifba.kgrag.adapters;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.concurrent.CompletionException;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import br.edu.ifba.kgrag.embedding.EmbeddingResponse;
import br.edu.ifba.kgrag.embedding.EmbeddingResponse.Embedding;
import br.edu.ifba.kgrag.embedding.LlmEmbeddingClient;
import br.edu.ifba.kgrag.llm.LlmCallException;
import br.edu.ifba.kgrag.storage.VectorDimensionMismatchException;
import jakarta.ws.rs.ProcessingException;

class QuarkusEmbeddingAdapterTest {

    private LlmEmbeddingClient client;
    private QuarkusEmbeddingAdapter adapter;

    @BeforeEach
    void setUp() {
        client = mock(LlmEmbeddingClient.class);
        adapter = new QuarkusEmbeddingAdapter();
        adapter.embeddingClient = client;
        adapter.embeddingModel = "nomic-embed-text";
        adapter.vectorDimension = 3;
    }

    @Test
    void testVectorsFollowResponseIndex() {
        EmbeddingResponse response = new EmbeddingResponse("m", List.of(
            new Embedding(List.of(0.0, 1.0, 0.0), 1),
            new Embedding(List.of(1.0, 0.0, 0.0), 0)));

        List<float[]> vectors = QuarkusEmbeddingAdapter.toVectors(response, 2, 3);

        assertArrayEquals(new float[] {1f, 0f, 0f}, vectors.get(0));
        assertArrayEquals(new float[] {0f, 1f, 0f}, vectors.get(1));
    }

    @Test
    void testWrongDimensionIsNeverTruncated() {
        EmbeddingResponse response = new EmbeddingResponse("m", List.of(new Embedding(List.of(1.0, 2.0, 3.0, 4.0), 0)));

        VectorDimensionMismatchException failure = assertThrows(VectorDimensionMismatchException.class,
            () -> QuarkusEmbeddingAdapter.toVectors(response, 1, 3));

        assertEquals(3, failure.getExpected());
        assertEquals(4, failure.getActual());
    }

    @Test
    void testMalformedResponses() {
        assertThrows(LlmCallException.class, () -> QuarkusEmbeddingAdapter.toVectors(null, 1, 3));
        assertThrows(LlmCallException.class, () -> QuarkusEmbeddingAdapter.toVectors(
            new EmbeddingResponse("m", List.of(new Embedding(List.of(1.0, 2.0, 3.0), 0))), 2, 3));
        assertThrows(LlmCallException.class, () -> QuarkusEmbeddingAdapter.toVectors(
            new EmbeddingResponse("m", List.of(new Embedding(List.of(), 0))), 1, 3));
    }

    @Test
    void testEmbedFailsFutureOnTransportError() {
        when(client.embed(any())).thenThrow(new ProcessingException("timeout"));

        CompletionException failure = assertThrows(CompletionException.class,
            () -> adapter.embed(List.of("heap")).join());

        LlmCallException cause = assertInstanceOf(LlmCallException.class, failure.getCause());
        assertTrue(cause.isRetryable());
    }

    @Test
    void testEmptyInput() {
        assertTrue(adapter.embed(List.of()).join().isEmpty());
        assertEquals(3, adapter.dimension());
    }
}
