package br.edu.ifba.kgrag.extraction;

import br.edu.ifba.kgrag.extraction.ExtractionParser.ParseResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link ExtractionParser}.
 */
class ExtractionParserTest {

    private ExtractionParser parser;

    @BeforeEach
    void setUp() {
        parser = new ExtractionParser();
    }

    @Test
    @DisplayName("should read nodes, relations and hierarchy")
    void testParseEnglishAnswer() {
        String answer = """
            Here is the graph.

            ## Nodes
            - **Binary Tree**: a tree where each node has at most two children
            - Heap: a complete binary tree with the heap property

            ## Relations
            - Heap -> Binary Tree: is a
            - Binary Tree -> Node

            ## Hierarchy
            Trees
              - Binary Tree
            """;

        ParseResult result = parser.parse(answer);

        assertTrue(result.isOk());
        assertEquals(2, result.nodes().size());
        assertEquals("Binary Tree", result.nodes().get(0).name());
        assertEquals("a tree where each node has at most two children", result.nodes().get(0).description());
        assertEquals(2, result.relations().size());
        assertEquals("Heap", result.relations().get(0).source());
        assertEquals("Binary Tree", result.relations().get(0).target());
        assertEquals("is a", result.relations().get(0).label());
        assertNull(result.relations().get(1).label());
        assertTrue(result.hierarchy().startsWith("Trees"));
        assertEquals(0, result.skippedLines());
    }

    @Test
    @DisplayName("should accept Chinese headings, full-width colons and unicode arrows")
    void testParseChineseAnswer() {
        String answer = """
            ### 节点：
            - 二叉树：每个节点最多有两个子节点
            ### 关系
            - 堆 → 二叉树：属于
            """;

        ParseResult result = parser.parse(answer);

        assertTrue(result.isOk());
        assertEquals("二叉树", result.nodes().get(0).name());
        assertEquals("每个节点最多有两个子节点", result.nodes().get(0).description());
        assertEquals("堆", result.relations().get(0).source());
        assertEquals("属于", result.relations().get(0).label());
    }

    @Test
    @DisplayName("should skip and count malformed lines")
    void testMalformedLinesSkipped() {
        String answer = """
            ## Nodes
            - Valid: ok
            - no colon here
            plain text line
            ## Relations
            - missing arrow
            """;

        ParseResult result = parser.parse(answer);

        assertTrue(result.isOk());
        assertEquals(1, result.nodes().size());
        assertEquals(0, result.relations().size());
        assertEquals(3, result.skippedLines());
    }

    @Test
    @DisplayName("should report an answer without any known section")
    void testNoSections() {
        assertFalse(parser.parse("I could not find any concepts.").isOk());
        assertFalse(parser.parse("").isOk());
        assertFalse(parser.parse(null).isOk());
    }
}
