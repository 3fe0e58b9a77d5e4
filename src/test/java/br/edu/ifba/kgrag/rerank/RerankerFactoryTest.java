package br.edu.ifba.kgrag.rerank;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class RerankerFactoryTest {

    private RerankerConfig config;
    private Reranker http;
    private RerankerFactory factory;

    @BeforeEach
    void setUp() {
        config = mock(RerankerConfig.class);
        http = mock(Reranker.class);
        when(http.isAvailable()).thenReturn(true);
        when(http.getProviderName()).thenReturn("http");

        factory = new RerankerFactory();
        factory.config = config;
        factory.noOpReranker = new NoOpReranker();
        factory.httpReranker = http;
    }

    @Test
    void testDisabledUsesNoOp() {
        when(config.enabled()).thenReturn(false);
        when(config.provider()).thenReturn("http");

        assertSame(factory.noOpReranker, factory.getReranker());
        assertFalse(factory.isRerankingAvailable());
    }

    @Test
    void testHttpProviderSelected() {
        when(config.enabled()).thenReturn(true);
        when(config.provider()).thenReturn("HTTP");

        assertSame(http, factory.getReranker());
        assertTrue(factory.isRerankingAvailable());
    }

    @Test
    void testUnknownOrUnavailableFallsBack() {
        assertSame(factory.noOpReranker, factory.getReranker("cohere"));
        assertSame(factory.noOpReranker, factory.getReranker(" "));

        when(http.isAvailable()).thenReturn(false);
        assertSame(factory.noOpReranker, factory.getReranker("http"));
    }
}
