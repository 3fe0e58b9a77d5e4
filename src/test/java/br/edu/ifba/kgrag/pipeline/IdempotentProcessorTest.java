package br.edu.ifba.kgrag.pipeline;

import br.edu.ifba.kgrag.core.Edge;
import br.edu.ifba.kgrag.core.KnowledgeGraph;
import br.edu.ifba.kgrag.core.Node;
import br.edu.ifba.kgrag.core.RelationType;
import br.edu.ifba.kgrag.utils.IdentityUtil;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link IdempotentProcessor}.
 */
class IdempotentProcessorTest {

    private static final String SCOPE = "section:abc";

    private IdempotentProcessor processor;

    @BeforeEach
    void setUp() {
        processor = new IdempotentProcessor();
    }

    private static KnowledgeGraph draft() {
        return new KnowledgeGraph(
            List.of(
                Node.builder().name("Binary Tree").description("").build(),
                Node.builder().name("Binary Tree").description("two children per node").addAlias("BT").build(),
                Node.builder().name("Heap").description("ordered tree").build()),
            List.of(
                Edge.builder().sourceName("heap").targetName("BT").type(RelationType.IS_A).build(),
                Edge.builder().sourceName("Heap").targetName("Binary Tree").type(RelationType.IS_A).build(),
                Edge.builder().sourceName("Heap").targetName("Trie").type(RelationType.RELATED).build()),
            "");
    }

    @Test
    void testAssignsDeterministicIds() {
        KnowledgeGraph first = processor.process(draft(), SCOPE, "abc");
        KnowledgeGraph second = processor.process(draft(), SCOPE, "abc");

        assertEquals(first.nodes().stream().map(Node::getId).toList(),
            second.nodes().stream().map(Node::getId).toList());
        assertEquals(first.edges().get(0).getRid(), second.edges().get(0).getRid());
        assertEquals(IdentityUtil.nodeId("Heap", "Concept", SCOPE), first.nodes().get(1).getId());
    }

    @Test
    void testCollapsesDuplicateNodes() {
        KnowledgeGraph processed = processor.process(draft(), SCOPE, "abc");

        assertEquals(2, processed.nodes().size());
        Node tree = processed.nodes().get(0);
        assertEquals("two children per node", tree.getDescription());
        assertEquals(List.of("BT"), tree.getAliases());
        assertTrue(processed.nodes().stream().allMatch(node -> SCOPE.equals(node.getScope())));
    }

    @Test
    void testResolvesAliasesAndDropsDanglingAndDuplicateEdges() {
        KnowledgeGraph processed = processor.process(draft(), SCOPE, "abc");

        assertEquals(1, processed.edges().size());
        Edge edge = processed.edges().get(0);
        String heapId = processed.nodes().get(1).getId();
        String treeId = processed.nodes().get(0).getId();
        assertEquals(heapId, edge.getSourceId());
        assertEquals(treeId, edge.getTargetId());
        assertEquals(IdentityUtil.relationId("IS_A", heapId, treeId, SCOPE), edge.getRid());
        assertEquals("abc", edge.getSrcSection());
        assertEquals(SCOPE, edge.getScope());
    }

    @Test
    void testRelationIdIgnoresPropertyChanges() {
        KnowledgeGraph weak = new KnowledgeGraph(
            List.of(Node.builder().name("A").build(), Node.builder().name("B").build()),
            List.of(Edge.builder().sourceName("A").targetName("B").confidence(0.56).description("x").build()),
            "");
        KnowledgeGraph strong = new KnowledgeGraph(
            weak.nodes(),
            List.of(Edge.builder().sourceName("A").targetName("B").confidence(0.95).description("y").build()),
            "");

        assertEquals(processor.process(weak, SCOPE, null).edges().get(0).getRid(),
            processor.process(strong, SCOPE, null).edges().get(0).getRid());
    }

    @Test
    void testMaxIdLengthBelowSixtyRejected() {
        assertThrows(IllegalArgumentException.class, () -> new IdempotentProcessor(40));
    }
}
