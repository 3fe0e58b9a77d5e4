package br.edu.ifba.kgrag.pipeline;

import br.edu.ifba.kgrag.core.Edge;
import br.edu.ifba.kgrag.core.Node;
import br.edu.ifba.kgrag.llm.LlmCallException;
import br.edu.ifba.kgrag.storage.GraphStorage.GraphStats;
import br.edu.ifba.kgrag.storage.impl.InMemoryGraphStorage;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static br.edu.ifba.kgrag.pipeline.PipelineFixtures.BALANCED;
import static br.edu.ifba.kgrag.pipeline.PipelineFixtures.TREES;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Section build against the in-memory store.
 */
class SectionGraphPipelineTest {

    private InMemoryGraphStorage storage;
    private SectionGraphPipeline pipeline;

    @BeforeEach
    void setUp() {
        storage = PipelineFixtures.newGraphStorage();
        pipeline = PipelineFixtures.pipeline(storage, PipelineFixtures.defaultLlm());
    }

    @AfterEach
    void tearDown() {
        storage.close();
    }

    @Test
    @DisplayName("should store the section graph under its own scope")
    void testBuildSection() {
        SectionBuildResult result = pipeline.run(TREES);

        assertTrue(result.success());
        assertNull(result.error());
        assertEquals(TREES.sectionId(), result.sectionId());
        assertEquals(TREES.scope(), result.scope());
        assertEquals(2, result.storeStats().nodesWritten());
        assertEquals(1, result.storeStats().edgesWritten());
        assertEquals(new GraphStats(2, 1), storage.getStats(TREES.scope()).join());

        Edge stored = storage.getEdgesByScope(TREES.scope()).join().get(0);
        assertTrue(stored.isResolved());
        assertEquals(TREES.sectionId(), stored.getSrcSection());
    }

    @Test
    @DisplayName("re-indexing the same section leaves the store unchanged")
    void testReindexIsIdempotent() {
        SectionBuildResult first = pipeline.run(TREES);
        List<String> nodeIds = storage.getNodesByScope(TREES.scope()).join().stream().map(Node::getId).toList();
        List<String> rids = storage.getEdgesByScope(TREES.scope()).join().stream().map(Edge::getRid).toList();

        SectionBuildResult second = pipeline.run(TREES);

        assertEquals(0, first.storeStats().edgesDeleted());
        assertEquals(1, second.storeStats().edgesDeleted());
        assertEquals(storage.getStats().join(), new GraphStats(2, 1));
        assertEquals(nodeIds, storage.getNodesByScope(TREES.scope()).join().stream().map(Node::getId).toList());
        assertEquals(rids, storage.getEdgesByScope(TREES.scope()).join().stream().map(Edge::getRid).toList());
    }

    @Test
    @DisplayName("sections never overwrite each other")
    void testScopeIsolation() {
        pipeline.run(TREES);
        pipeline.run(BALANCED);
        GraphStats treesBefore = storage.getStats(TREES.scope()).join();

        pipeline.run(BALANCED);

        assertEquals(treesBefore, storage.getStats(TREES.scope()).join());
        assertEquals(new GraphStats(3, 2), storage.getStats(BALANCED.scope()).join());
        assertEquals(new GraphStats(5, 3), storage.getStats().join());
    }

    @Test
    @DisplayName("single-evidence edges are stored but not displayed")
    void testDisplayGate() {
        SectionBuildResult result = pipeline.run(TREES);

        assertEquals(1, result.graph().edges().size());
        assertTrue(result.displayEdges().isEmpty());
    }

    @Test
    void testInsightsComputed() {
        SectionInsights insights = pipeline.run(TREES).insights();

        assertNotNull(insights);
        assertEquals(1.0, insights.connectivityScore(), 1e-9);
        assertEquals(1, insights.components());
        assertEquals(1.0, insights.subchapterCoverage(), 1e-9);
        assertEquals(1, insights.relationTypes().get("IS_A"));
    }

    @Test
    @DisplayName("LLM failures reach the caller for retry")
    void testLlmFailurePropagates() {
        SectionGraphPipeline failing = PipelineFixtures.pipeline(storage, (prompt, system, max) -> {
            throw new LlmCallException("upstream 503", true);
        });

        assertThrows(LlmCallException.class, () -> failing.run(TREES));
        assertEquals(new GraphStats(0, 0), storage.getStats().join());
    }
}
