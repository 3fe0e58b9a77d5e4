package br.edu.ifba.kgrag;

import br.edu.ifba.kgrag.concurrency.BatchResult;
import br.edu.ifba.kgrag.concurrency.TaskOrchestrator;
import br.edu.ifba.kgrag.core.BookContext;
import br.edu.ifba.kgrag.core.Evidence;
import br.edu.ifba.kgrag.core.Node;
import br.edu.ifba.kgrag.llm.LLMFunction;
import br.edu.ifba.kgrag.llm.LlmCallException;
import br.edu.ifba.kgrag.pipeline.MergeStats;
import br.edu.ifba.kgrag.pipeline.PipelineFixtures;
import br.edu.ifba.kgrag.pipeline.SectionBuildResult;
import br.edu.ifba.kgrag.retrieval.ChunkMentionLinker;
import br.edu.ifba.kgrag.retrieval.EvidenceMerger;
import br.edu.ifba.kgrag.retrieval.GraphRetriever;
import br.edu.ifba.kgrag.retrieval.HashingEmbedding;
import br.edu.ifba.kgrag.retrieval.IndexStats;
import br.edu.ifba.kgrag.retrieval.MentionedChunk;
import br.edu.ifba.kgrag.retrieval.RetrievalResult;
import br.edu.ifba.kgrag.retrieval.TextChunker;
import br.edu.ifba.kgrag.retrieval.VectorIndexService;
import br.edu.ifba.kgrag.storage.DistanceMetric;
import br.edu.ifba.kgrag.storage.GraphStorage;
import br.edu.ifba.kgrag.storage.impl.InMemoryGraphStorage;
import br.edu.ifba.kgrag.storage.impl.InMemoryVectorStorage;
import br.edu.ifba.kgrag.utils.RetryEventLogger;
import br.edu.ifba.kgrag.utils.TransientFailurePredicate;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static br.edu.ifba.kgrag.pipeline.PipelineFixtures.BALANCED;
import static br.edu.ifba.kgrag.pipeline.PipelineFixtures.TREES;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * End-to-end behaviour over in-memory stores.
 */
class KnowledgeGraphRagTest {

    private static final BookContext BOOK = new BookContext("Data Structures", "run-2024-01");

    private static final String NOTES = String.join("\n",
        "A heap is a complete binary tree stored in an array.",
        "Every heap keeps its smallest key at the root.",
        "An AVL tree is a self-balancing binary search tree.");

    private InMemoryGraphStorage graphStorage;
    private InMemoryVectorStorage vectorStorage;
    private KnowledgeGraphRag rag;

    @BeforeEach
    void setUp() {
        graphStorage = PipelineFixtures.newGraphStorage();
        vectorStorage = new InMemoryVectorStorage();
        vectorStorage.initialize().join();
        rag = newRag(PipelineFixtures.defaultLlm(), new GraphRetriever(graphStorage));
    }

    @AfterEach
    void tearDown() {
        rag.close();
        graphStorage.close();
        vectorStorage.close();
    }

    private KnowledgeGraphRag newRag(LLMFunction llm, GraphRetriever retriever) {
        VectorIndexService vectorIndex = new VectorIndexService(vectorStorage, new HashingEmbedding(64),
            new TextChunker(120, 20), "chunks", DistanceMetric.COSINE, 16);
        vectorIndex.ensureCollection();
        TaskOrchestrator orchestrator = new TaskOrchestrator(2, Duration.ofSeconds(5), 1, Duration.ofMillis(5),
            new TransientFailurePredicate(), new RetryEventLogger());
        return new KnowledgeGraphRag(
            PipelineFixtures.pipeline(graphStorage, llm),
            PipelineFixtures.merger(graphStorage),
            vectorIndex,
            retriever,
            new EvidenceMerger(0.7, 0.3, 10),
            orchestrator,
            graphStorage,
            new ChunkMentionLinker(graphStorage),
            2);
    }

    @Nested
    @DisplayName("Construction")
    class Construction {

        @Test
        void testBuildSectionGraph() {
            SectionBuildResult result = rag.buildSectionGraph(TREES);

            assertTrue(result.success(), result.error());
            GraphStorage.GraphStats stats = rag.getStats(TREES.scope());
            assertEquals(2, stats.nodeCount());
            assertEquals(1, stats.edgeCount());
        }

        @Test
        @DisplayName("a failed section comes back as a result, not an exception")
        void testBuildSectionGraphFailure() {
            rag.close();
            rag = newRag((prompt, system, maxTokens) -> {
                throw new LlmCallException("model offline", false);
            }, new GraphRetriever(graphStorage));

            SectionBuildResult result = rag.buildSectionGraph(TREES);

            assertFalse(result.success());
            assertEquals(TREES.sectionId(), result.sectionId());
            assertEquals("model offline", result.error());
            assertEquals(0, rag.getStats().nodeCount());
        }

        @Test
        void testBuildSectionGraphs() {
            BatchResult<SectionBuildResult> batch = rag.buildSectionGraphs(List.of(TREES, BALANCED), null);

            assertTrue(batch.isComplete());
            assertEquals(2, batch.successCount());
        }

        @Test
        void testMergeBookGraph() {
            rag.buildSectionGraphs(List.of(TREES, BALANCED), null);

            MergeStats stats = rag.mergeBookGraph(List.of(TREES.sectionId(), BALANCED.sectionId()), BOOK);

            assertTrue(stats.success());
            assertEquals(3, stats.mergedNodes());
            assertEquals(2, stats.mergedEdges());
            assertEquals(3, rag.getStats(BOOK.scope()).nodeCount());
        }

        @Test
        void testIndexDocument() {
            IndexStats stats = rag.indexDocument("notes", NOTES, Map.of("scope", BOOK.scope()));

            assertTrue(stats.isComplete());
            assertEquals(stats.indexed(), rag.getVectorIndex().size());
        }

        @Test
        @DisplayName("indexed chunks are linked to the book concepts they mention")
        void testIndexDocumentLinksMentions() {
            rag.buildSectionGraphs(List.of(TREES, BALANCED), null);
            rag.mergeBookGraph(List.of(TREES.sectionId(), BALANCED.sectionId()), BOOK);

            IndexStats stats = rag.indexDocument("notes", NOTES, Map.of("scope", BOOK.scope()));

            assertTrue(stats.mentions() >= 3, "mentions: " + stats.mentions());
            assertTrue(stats.errors().isEmpty());
            String heapId = graphStorage.getNodesByScope(BOOK.scope()).join().stream()
                .filter(node -> node.getName().equals("Heap"))
                .map(Node::getId)
                .findFirst()
                .orElseThrow();
            GraphRetriever retriever = rag.getGraphRetriever();
            List<MentionedChunk> heapChunks = retriever.chunksByEntities(List.of(heapId), 10);
            assertFalse(heapChunks.isEmpty());
            assertTrue(heapChunks.stream().allMatch(chunk -> chunk.docId().equals("notes")));

            List<String> chunkIds = heapChunks.stream().map(MentionedChunk::chunkId).toList();
            assertTrue(retriever.entitiesByChunks(chunkIds, 5).stream()
                .anyMatch(hit -> hit.nodes().get(0).getId().equals(heapId)));

            IndexStats again = rag.indexDocument("notes", NOTES, Map.of("scope", BOOK.scope()));
            assertEquals(stats.mentions(), again.mentions());
            assertEquals(heapChunks, retriever.chunksByEntities(List.of(heapId), 10));
        }
    }

    @Nested
    @DisplayName("Retrieval")
    class Retrieval {

        @BeforeEach
        void populate() {
            rag.buildSectionGraphs(List.of(TREES, BALANCED), null);
            rag.mergeBookGraph(List.of(TREES.sectionId(), BALANCED.sectionId()), BOOK);
            rag.indexDocument("notes", NOTES, null);
        }

        @Test
        void testBothChannelsContribute() {
            RetrievalResult result = rag.retrieve("Heap", 5, true, BOOK.scope());

            assertFalse(result.isDegraded());
            assertTrue(result.vectorHits() > 0);
            assertTrue(result.graphHits() > 0);
            assertEquals(List.of(Evidence.SOURCE_VECTOR, Evidence.SOURCE_GRAPH), result.contributingChannels());
            assertTrue(result.evidence().size() <= 5);
            assertEquals(BOOK.scope(), result.scope());
        }

        @Test
        void testGraphChannelCanBeSkipped() {
            RetrievalResult result = rag.retrieve("Heap", 5, false, BOOK.scope());

            assertEquals(0, result.graphHits());
            assertFalse(result.isDegraded());
            assertFalse(result.evidence().isEmpty());
        }

        @Test
        @DisplayName("a failing graph channel degrades to vector-only evidence")
        void testGraphChannelFailure() {
            GraphRetriever broken = mock(GraphRetriever.class);
            when(broken.search(anyString(), anyInt(), anyInt(), any(), any()))
                .thenThrow(new IllegalStateException("graph store offline"));
            rag.close();
            rag = newRag(PipelineFixtures.defaultLlm(), broken);

            RetrievalResult result = rag.retrieve("Heap", 5, true, BOOK.scope());

            assertEquals(0, result.graphHits());
            assertEquals("graph store offline", result.errors().get(Evidence.SOURCE_GRAPH));
            assertTrue(result.vectorHits() > 0);
            assertFalse(result.evidence().isEmpty());
        }

        @Test
        void testBlankQuery() {
            RetrievalResult result = rag.retrieve("  ", 5, true, null);

            assertTrue(result.evidence().isEmpty());
            assertFalse(result.isDegraded());
        }
    }
}
