package br.edu.ifba.kgrag.retrieval;

import br.edu.ifba.kgrag.core.Chunk;
import br.edu.ifba.kgrag.core.ChunkMention;
import br.edu.ifba.kgrag.core.Node;
import br.edu.ifba.kgrag.storage.GraphStorage;
import br.edu.ifba.kgrag.storage.GraphStoreException;
import br.edu.ifba.kgrag.storage.impl.InMemoryGraphStorage;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ChunkMentionLinkerTest {

    private static final String BOOK = "book:ds";

    private InMemoryGraphStorage storage;
    private ChunkMentionLinker linker;

    @BeforeEach
    void setUp() {
        storage = new InMemoryGraphStorage();
        storage.initialize().join();
        storage.upsertNode(Node.builder().id("heap").name("Heap").scope(BOOK).build()).join();
        storage.upsertNode(Node.builder().id("bst").name("Binary Search Tree").aliases(List.of("BST"))
            .scope(BOOK).build()).join();
        storage.upsertNode(Node.builder().id("tree").name("二叉树").scope(BOOK).build()).join();
        storage.upsertNode(Node.builder().id("other").name("Heap").scope("book:other").build()).join();
        linker = new ChunkMentionLinker(storage);
    }

    @AfterEach
    void tearDown() {
        storage.close();
    }

    private static Chunk chunk(String id, String text, String scope) {
        Map<String, Object> metadata = scope != null ? Map.of("scope", scope) : Map.of();
        return new Chunk(id, "notes", text, 0, text.length(), null, metadata);
    }

    @Nested
    @DisplayName("Term matching")
    class TermMatching {

        @Test
        void testWordBoundaries() {
            assertTrue(ChunkMentionLinker.occurs("Heap", "a heap keeps order"));
            assertTrue(ChunkMentionLinker.occurs("Heap", "heap."));
            assertFalse(ChunkMentionLinker.occurs("Heap", "heapsort is fast"));
            assertFalse(ChunkMentionLinker.occurs("Heap", "a minheap"));
            assertTrue(ChunkMentionLinker.occurs("Heap", "a minheap and a heap"));
        }

        @Test
        @DisplayName("ideographic terms match inside running text")
        void testIdeographicTerms() {
            assertTrue(ChunkMentionLinker.occurs("二叉树", "堆是一种完全二叉树结构"));
        }

        @Test
        void testShortTermsIgnored() {
            assertFalse(ChunkMentionLinker.occurs("A", "a heap"));
            assertFalse(ChunkMentionLinker.occurs(" ", "a heap"));
        }

        @Test
        void testNameBeatsAlias() {
            Node bst = Node.builder().id("bst").name("Binary Search Tree").aliases(List.of("BST")).build();

            assertEquals(1.0, ChunkMentionLinker.confidence(bst, "a binary search tree, or bst"));
            assertEquals(0.9, ChunkMentionLinker.confidence(bst, "every bst is ordered"));
            assertEquals(0.0, ChunkMentionLinker.confidence(bst, "a bstree"));
        }
    }

    @Test
    @DisplayName("a scoped document links only nodes of its scope")
    void testLinkWithinScope() {
        List<Chunk> chunks = List.of(
            chunk("c0", "A heap is stored in an array.", BOOK),
            chunk("c1", "Each BST keeps keys ordered. 堆是一种完全二叉树。", BOOK));

        int linked = linker.link("notes", chunks);

        assertEquals(3, linked);
        List<ChunkMention> heap = storage.getMentionsByNodes(List.of("heap", "other")).join();
        assertEquals(List.of(new ChunkMention("c0", "notes", "heap", 1.0)), heap);
        assertEquals(List.of(new ChunkMention("c1", "notes", "tree", 1.0), new ChunkMention("c1", "notes", "bst", 0.9)),
            storage.getMentionsByChunks(List.of("c1")).join());
    }

    @Test
    @DisplayName("an unscoped document links names found anywhere in the graph")
    void testLinkWithoutScope() {
        linker.link("notes", List.of(chunk("c0", "Heaps aside, a heap is a tree.", null)));

        List<String> nodes = storage.getMentionsByChunks(List.of("c0")).join().stream()
            .map(ChunkMention::nodeId)
            .toList();
        assertEquals(List.of("heap", "other"), nodes);
    }

    @Test
    @DisplayName("re-linking a document replaces its previous links")
    void testRelinkReplaces() {
        linker.link("notes", List.of(chunk("c0", "A heap.", BOOK), chunk("c1", "A BST.", BOOK)));
        linker.link("notes", List.of(chunk("c0", "A heap.", BOOK)));

        assertTrue(storage.getMentionsByChunks(List.of("c1")).join().isEmpty());
        assertEquals(1, storage.getMentionsByNodes(List.of("heap")).join().size());
    }

    @Test
    void testStoreFailurePropagates() {
        GraphStorage failing = mock(GraphStorage.class);
        when(failing.getNodesByScope(anyString())).thenReturn(CompletableFuture.completedFuture(List.of()));
        when(failing.replaceMentions(anyString(), any()))
            .thenReturn(CompletableFuture.failedFuture(new GraphStoreException("disk full", null)));

        assertThrows(GraphStoreException.class,
            () -> new ChunkMentionLinker(failing).link("notes", List.of(chunk("c0", "A heap.", BOOK))));
    }
}
