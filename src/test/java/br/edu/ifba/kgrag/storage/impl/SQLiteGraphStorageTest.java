package br.edu.ifba.kgrag.storage.impl;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletionException;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import br.edu.ifba.kgrag.core.ChunkMention;
import br.edu.ifba.kgrag.core.Edge;
import br.edu.ifba.kgrag.core.Node;
import br.edu.ifba.kgrag.core.RelationType;
import br.edu.ifba.kgrag.storage.GraphStorage.GraphStats;

/**
 * Unit tests for SQLiteGraphStorage.
 *
 * Tests verify:
 * 1. Node and edge upserts keyed by id and rid
 * 2. Scope-partitioned deletes and orphan pruning
 * 3. Neighbour and candidate lookups
 * 4. Book scope membership
 */
class SQLiteGraphStorageTest {

    private static final String SECTION_A = "section:trees_heaps";
    private static final String SECTION_B = "section:trees_balanced";

    @TempDir
    Path tempDir;

    private SQLiteConnectionManager connectionManager;
    private SQLiteGraphStorage graphStorage;

    @BeforeEach
    void setUp() throws Exception {
        connectionManager = new SQLiteConnectionManager(tempDir.resolve("test.db").toString());
        try (Connection conn = connectionManager.createConnection()) {
            new SQLiteSchemaMigrator().migrateToLatest(conn);
        }
        graphStorage = new SQLiteGraphStorage(connectionManager);
        graphStorage.initialize().join();
    }

    @AfterEach
    void tearDown() {
        graphStorage.close();
        connectionManager.close();
    }

    private static Node node(String id, String name, String scope) {
        return Node.builder().id(id).name(name).description(name + " notes").scope(scope)
            .aliases(List.of(name.toUpperCase())).chapter("Trees").subchapter("Heaps").build();
    }

    private static Edge edge(String rid, String source, String target, RelationType type, String scope) {
        return Edge.builder().rid(rid).sourceId(source).targetId(target).type(type).scope(scope)
            .evidence("first;second").confidence(0.9).srcSection(scope).build();
    }

    @Test
    void testUpsertNodeKeepsCreatedAt() {
        Instant created = Instant.parse("2024-01-01T00:00:00Z");
        graphStorage.upsertNode(node("heap", "Heap", SECTION_A).withTimestamps(created, created)).join();
        graphStorage.upsertNode(Node.builder().id("heap").name("Heap").description("updated")
            .scope(SECTION_A).build()).join();

        Node stored = graphStorage.getNode("heap").join();

        assertNotNull(stored);
        assertEquals("updated", stored.getDescription());
        assertEquals(created, stored.getCreatedAt());
        assertTrue(stored.getUpdatedAt().isAfter(created));
        assertEquals(new GraphStats(1, 0), graphStorage.getStats().join());
    }

    @Test
    void testNodeRoundTripsFields() {
        graphStorage.upsertNode(node("avl", "AVL Tree", SECTION_B)).join();

        Node stored = graphStorage.getNode("avl").join();

        assertEquals("AVL Tree", stored.getName());
        assertEquals(Node.DEFAULT_TYPE, stored.getType());
        assertEquals(List.of("AVL TREE"), stored.getAliases());
        assertEquals("Trees", stored.getChapter());
        assertEquals(SECTION_B, stored.getScope());
        assertNull(graphStorage.getNode("missing").join());
    }

    @Test
    void testEdgeRoundTripsFields() {
        graphStorage.upsertEdge(Edge.builder().rid("r1").sourceId("heap").targetId("tree").label("implements")
            .scope(SECTION_A).evidence("a;b;c").confidence(0.7).weight(2.0).build()).join();

        Edge stored = graphStorage.getEdgesByScope(SECTION_A).join().get(0);

        assertEquals(RelationType.RELATED, stored.getType());
        assertEquals("implements", stored.getTypeLabel());
        assertEquals(3, stored.evidenceCount());
        assertEquals(0.7, stored.getConfidence(), 1e-9);
        assertEquals(2.0, stored.getWeight(), 1e-9);
    }

    @Test
    void testUnresolvedEdgeRejected() {
        Edge draft = Edge.builder().sourceName("Heap").targetName("Tree").build();

        CompletionException failure = assertThrows(CompletionException.class,
            () -> graphStorage.upsertEdge(draft).join());
        assertInstanceOf(IllegalArgumentException.class, failure.getCause());
    }

    @Test
    void testDeleteByScopeRemovesOnlyThatScopesEdges() {
        graphStorage.upsertNode(node("heap", "Heap", SECTION_A)).join();
        graphStorage.upsertNode(node("tree", "Binary Tree", SECTION_A)).join();
        graphStorage.upsertEdge(edge("ra", "heap", "tree", RelationType.IS_A, SECTION_A)).join();
        graphStorage.upsertEdge(edge("rb", "heap", "tree", RelationType.IS_A, SECTION_B)).join();

        int deleted = graphStorage.deleteByScope(SECTION_A).join();

        assertEquals(1, deleted);
        assertEquals(new GraphStats(2, 0), graphStorage.getStats(SECTION_A).join());
        assertEquals(1, graphStorage.getEdgesByScope(SECTION_B).join().size());
    }

    @Test
    void testPruneOrphans() {
        graphStorage.upsertNode(node("heap", "Heap", SECTION_A)).join();
        graphStorage.upsertNode(node("tree", "Binary Tree", SECTION_A)).join();
        graphStorage.upsertNode(node("lonely", "Trie", SECTION_A)).join();
        graphStorage.upsertEdge(edge("ra", "heap", "tree", RelationType.IS_A, SECTION_A)).join();

        assertEquals(1, graphStorage.pruneOrphans(SECTION_A).join());
        assertNull(graphStorage.getNode("lonely").join());
        assertEquals(0, graphStorage.pruneOrphans(SECTION_B).join());
    }

    @Test
    void testEdgesForNodeFilters() {
        graphStorage.upsertEdge(edge("r1", "heap", "tree", RelationType.IS_A, SECTION_A)).join();
        graphStorage.upsertEdge(edge("r2", "array", "heap", RelationType.USES, SECTION_A)).join();
        graphStorage.upsertEdge(edge("r3", "heap", "queue", RelationType.IS_A, SECTION_B)).join();

        assertEquals(3, graphStorage.getEdgesForNode("heap", null, null).join().size());
        assertEquals(2, graphStorage.getEdgesForNode("heap", SECTION_A, null).join().size());
        List<Edge> isA = graphStorage.getEdgesForNode("heap", SECTION_A, Set.of(RelationType.IS_A)).join();
        assertEquals(List.of("r1"), isA.stream().map(Edge::getRid).toList());
    }

    @Test
    void testFindCandidates() {
        graphStorage.upsertNode(node("heap", "Heap", SECTION_A)).join();
        graphStorage.upsertNode(node("bheap", "Binary Heap", SECTION_B)).join();
        graphStorage.upsertNode(Node.builder().id("pq").name("Priority Queue").description("often a heap")
            .scope(SECTION_A).build()).join();

        List<Node> all = graphStorage.findCandidates("heap", null, null, 10).join();
        List<Node> scoped = graphStorage.findCandidates("HEAP", null, SECTION_A, 10).join();

        assertEquals(List.of("heap", "bheap", "pq"), all.stream().map(Node::getId).toList());
        assertEquals(List.of("heap", "pq"), scoped.stream().map(Node::getId).toList());
        assertEquals(1, graphStorage.findCandidates("heap", null, null, 1).join().size());
        assertTrue(graphStorage.findCandidates("heap", Set.of("Algorithm"), null, 10).join().isEmpty());
        assertTrue(graphStorage.findCandidates(" ", null, null, 10).join().isEmpty());
    }

    @Test
    @DisplayName("candidates are ordered by match strength before the limit applies")
    void testFindCandidatesRanksBeforeLimit() {
        for (int i = 0; i < 60; i++) {
            graphStorage.upsertNode(Node.builder().id(String.format("a_%02d", i)).name("Traversal " + i)
                .description("walks a graph").scope(SECTION_A).build()).join();
        }
        graphStorage.upsertNode(Node.builder().id("zz_graph").name("Graph").scope(SECTION_A).build()).join();
        graphStorage.upsertNode(Node.builder().id("zz_dag").name("DAG").aliases(List.of("graph"))
            .scope(SECTION_A).build()).join();
        graphStorage.upsertNode(Node.builder().id("zz_graphs").name("Graph Theory").scope(SECTION_A).build())
            .join();

        List<Node> top = graphStorage.findCandidates("graph", null, SECTION_A, 5).join();

        assertEquals(List.of("zz_graph", "zz_dag", "zz_graphs", "a_00", "a_01"),
            top.stream().map(Node::getId).toList());
    }

    @Test
    @DisplayName("retainNodes drops the scope's other nodes and their edges")
    void testRetainNodes() {
        graphStorage.upsertNode(node("heap", "Heap", SECTION_A)).join();
        graphStorage.upsertNode(node("tree", "Binary Tree", SECTION_A)).join();
        graphStorage.upsertNode(node("old", "Treap", SECTION_A)).join();
        graphStorage.upsertNode(node("other", "AVL Tree", SECTION_B)).join();
        graphStorage.upsertEdge(edge("keep", "heap", "tree", RelationType.IS_A, SECTION_A)).join();
        graphStorage.upsertEdge(edge("stale", "old", "tree", RelationType.IS_A, SECTION_A)).join();

        int removed = graphStorage.retainNodes(SECTION_A, List.of("heap", "tree")).join();

        assertEquals(1, removed);
        assertNull(graphStorage.getNode("old").join());
        assertNotNull(graphStorage.getNode("other").join());
        assertEquals(List.of("keep"), graphStorage.getEdgesByScope(SECTION_A).join().stream()
            .map(Edge::getRid).toList());
        assertEquals(0, graphStorage.retainNodes(SECTION_A, List.of("heap", "tree")).join());
        assertEquals(2, graphStorage.retainNodes(SECTION_A, List.of()).join());
    }

    @Test
    @DisplayName("mentions are replaced per document and read strongest first")
    void testChunkMentions() {
        graphStorage.replaceMentions("notes", List.of(
            new ChunkMention("notes_c0", "notes", "heap", 1.0),
            new ChunkMention("notes_c1", "notes", "heap", 0.9),
            new ChunkMention("notes_c1", "notes", "tree", 1.0))).join();
        graphStorage.replaceMentions("slides", List.of(new ChunkMention("slides_c0", "slides", "heap", 1.0))).join();

        assertEquals(List.of("notes_c0", "slides_c0", "notes_c1"),
            graphStorage.getMentionsByNodes(List.of("heap")).join().stream().map(ChunkMention::chunkId).toList());
        assertEquals(List.of(new ChunkMention("notes_c1", "notes", "tree", 1.0),
                new ChunkMention("notes_c1", "notes", "heap", 0.9)),
            graphStorage.getMentionsByChunks(List.of("notes_c1")).join());

        assertEquals(1, graphStorage.replaceMentions("notes",
            List.of(new ChunkMention("notes_c0", "notes", "tree", 1.0))).join());
        assertEquals(List.of("slides_c0"),
            graphStorage.getMentionsByNodes(List.of("heap")).join().stream().map(ChunkMention::chunkId).toList());
        assertTrue(graphStorage.getMentionsByChunks(List.of()).join().isEmpty());
    }

    @Test
    void testRetainNodesDropsTheirMentions() {
        graphStorage.upsertNode(node("heap", "Heap", SECTION_A)).join();
        graphStorage.upsertNode(node("old", "Treap", SECTION_A)).join();
        graphStorage.replaceMentions("notes", List.of(
            new ChunkMention("notes_c0", "notes", "heap", 1.0),
            new ChunkMention("notes_c0", "notes", "old", 1.0))).join();

        graphStorage.retainNodes(SECTION_A, List.of("heap")).join();

        assertEquals(List.of("heap"), graphStorage.getMentionsByChunks(List.of("notes_c0")).join().stream()
            .map(ChunkMention::nodeId).toList());
    }

    @Test
    void testScopeMembers() {
        graphStorage.addScopeMembers("book:ds", List.of(SECTION_B, SECTION_A)).join();
        graphStorage.addScopeMembers("book:ds", List.of(SECTION_A)).join();

        assertEquals(List.of(SECTION_B, SECTION_A).stream().sorted().toList(),
            graphStorage.getScopeMembers("book:ds").join());
        assertTrue(graphStorage.getScopeMembers("book:other").join().isEmpty());
    }
}
