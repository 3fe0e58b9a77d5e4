package br.edu.ifba.kgrag.extraction;

import br.edu.ifba.kgrag.core.Edge;
import br.edu.ifba.kgrag.core.KnowledgeGraph;
import br.edu.ifba.kgrag.core.RelationType;
import br.edu.ifba.kgrag.core.SectionInput;
import br.edu.ifba.kgrag.llm.LLMFunction;
import br.edu.ifba.kgrag.llm.LlmCallException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class KnowledgeGraphExtractorTest {

    private static final String ANSWER = """
        ### Nodes
        - Binary Tree: each node has at most two children
        - Heap: complete binary tree with ordered keys

        ### Relations
        - Heap -> Binary Tree: IS_A

        ### Hierarchy
        Binary Tree
          Heap
        """;

    private static final SectionInput SECTION = new SectionInput(
        "Data Structures", "Trees", "Binary Trees", "A binary tree is a tree where every node has two children.",
        List.of("heap"), "English");

    @Test
    void testBuildsDraftGraphInSectionScope() {
        KnowledgeGraphExtractor extractor = new KnowledgeGraphExtractor(
            (prompt, system, maxTokens) -> ANSWER, new ExtractionPrompts(), new ExtractionParser(), 4000);

        KnowledgeGraph graph = extractor.extract(SECTION);

        assertEquals(2, graph.nodes().size());
        assertTrue(graph.nodes().stream().allMatch(node -> SECTION.scope().equals(node.getScope())));
        assertEquals("Trees", graph.nodes().get(0).getChapter());
        assertEquals("Binary Trees", graph.nodes().get(0).getSubchapter());

        Edge edge = graph.edges().get(0);
        assertEquals("Heap", edge.getSourceName());
        assertEquals("Binary Tree", edge.getTargetName());
        assertEquals(RelationType.IS_A, edge.getType());
        assertEquals(Edge.DEFAULT_CONFIDENCE, edge.getConfidence());
        assertEquals(SECTION.sectionId(), edge.getSrcSection());
        assertFalse(edge.isResolved());
        assertTrue(graph.hierarchy().startsWith("Binary Tree"));
    }

    @Test
    void testPromptsCarrySectionFields() {
        AtomicReference<String> userPrompt = new AtomicReference<>();
        AtomicReference<String> systemPrompt = new AtomicReference<>();
        LLMFunction llm = (prompt, system, maxTokens) -> {
            userPrompt.set(prompt);
            systemPrompt.set(system);
            return ANSWER;
        };

        new KnowledgeGraphExtractor(llm, new ExtractionPrompts(), new ExtractionParser(), 4000).extract(SECTION);

        assertTrue(userPrompt.get().contains("Chapter: Trees"));
        assertTrue(userPrompt.get().contains("Keywords: heap"));
        assertTrue(systemPrompt.get().contains("Answer in English"));
        assertTrue(systemPrompt.get().contains("PREREQUISITE_OF"));
    }

    @Test
    void testEmptyAnswerFails() {
        KnowledgeGraphExtractor extractor = new KnowledgeGraphExtractor(
            (prompt, system, maxTokens) -> "  ", new ExtractionPrompts(), new ExtractionParser(), 4000);

        ExtractionException failure = assertThrows(ExtractionException.class, () -> extractor.extract(SECTION));
        assertEquals(SECTION.sectionId(), failure.getSectionId());
    }

    @Test
    void testUnreadableAnswerGivesEmptyGraph() {
        KnowledgeGraphExtractor extractor = new KnowledgeGraphExtractor(
            (prompt, system, maxTokens) -> "Sorry, nothing to extract.",
            new ExtractionPrompts(), new ExtractionParser(), 4000);

        assertTrue(extractor.extract(SECTION).isEmpty());
    }

    @Test
    void testLlmFailurePropagates() {
        KnowledgeGraphExtractor extractor = new KnowledgeGraphExtractor(
            (prompt, system, maxTokens) -> {
                throw new LlmCallException("upstream 503", true);
            },
            new ExtractionPrompts(), new ExtractionParser(), 4000);

        assertThrows(LlmCallException.class, () -> extractor.extract(SECTION));
    }
}
