package br.edu.ifba.kgrag.utils;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link IdentityUtil}.
 */
class IdentityUtilTest {

    @Nested
    @DisplayName("slug")
    class Slug {

        @Test
        @DisplayName("should lowercase and collapse punctuation into single underscores")
        void testAsciiSlug() {
            assertEquals("hello_world", IdentityUtil.slug("  Hello,   World! "));
        }

        @Test
        @DisplayName("should keep CJK ideographs")
        void testCjkSlug() {
            assertEquals("二叉树_遍历", IdentityUtil.slug("二叉树 遍历"));
        }

        @Test
        @DisplayName("should return empty for null or symbols only")
        void testEmptySlug() {
            assertEquals("", IdentityUtil.slug(null));
            assertEquals("", IdentityUtil.slug("!!!"));
        }
    }

    @Test
    void testCanonicalizeCollapsesWhitespace() {
        assertEquals("Binary Search Tree", IdentityUtil.canonicalize("  Binary \t Search\nTree "));
        assertEquals("", IdentityUtil.canonicalize(null));
    }

    @Test
    void testContentHashIgnoresWhitespaceLayout() {
        String hash = IdentityUtil.contentHash("a  b\nc");
        assertEquals(12, hash.length());
        assertEquals(hash, IdentityUtil.contentHash(" a b c "));
        assertEquals("", IdentityUtil.contentHash("   "));
    }

    @Test
    void testSectionIdIsDeterministic() {
        String first = IdentityUtil.sectionId("Algorithms", "Trees", "Traversal");
        assertEquals(12, first.length());
        assertEquals(first, IdentityUtil.sectionId("Algorithms", "Trees", "Traversal"));
        assertNotEquals(first, IdentityUtil.sectionId("Algorithms", "Trees", "Balancing"));
    }

    @Test
    void testBookIdUsesRunIdPrefix() {
        assertEquals("data_structures_a1b2c3d4", IdentityUtil.bookId("Data Structures", "a1b2c3d4e5f6"));
        assertEquals("data_structures", IdentityUtil.bookId("Data Structures", null));
        assertEquals("data_structures", IdentityUtil.bookId("Data Structures", "  "));
    }

    @Nested
    @DisplayName("nodeId")
    class NodeId {

        @Test
        @DisplayName("should omit the default Concept type")
        void testDefaultTypeOmitted() {
            String id = IdentityUtil.nodeId("Binary Tree", "Concept", "section:abc");
            String hash = IdentityUtil.md5Hex("section:abc").substring(0, 8);
            assertEquals("binary_tree_" + hash, id);
        }

        @Test
        @DisplayName("should include other types")
        void testTypeIncluded() {
            String id = IdentityUtil.nodeId("Binary Tree", "Data Structure", "section:abc");
            assertTrue(id.startsWith("binary_tree_data_structure_"), id);
        }

        @Test
        @DisplayName("should differ between scopes")
        void testScopeChangesId() {
            assertNotEquals(
                IdentityUtil.nodeId("Heap", null, "section:a"),
                IdentityUtil.nodeId("Heap", null, "section:b"));
        }

        @Test
        @DisplayName("should cap long ids with a hash suffix")
        void testLongIdCapped() {
            String longName = "a very long concept name that keeps going well past any sensible identifier size";
            String id = IdentityUtil.nodeId(longName, null, "book:x");
            assertEquals(59, id.length());
            assertEquals(id, IdentityUtil.nodeId(longName, null, "book:x"));
        }
    }

    @Test
    void testRelationIdDependsOnlyOnTypeEndpointsAndScope() {
        String rid = IdentityUtil.relationId("IS_A", "a", "b", "section:s");
        assertEquals(16, rid.length());
        assertEquals(rid, IdentityUtil.relationId("IS_A", "a", "b", "section:s"));
        assertNotEquals(rid, IdentityUtil.relationId("IS_A", "b", "a", "section:s"));
        assertNotEquals(rid, IdentityUtil.relationId("IS_A", "a", "b", "book:s"));
    }
}
