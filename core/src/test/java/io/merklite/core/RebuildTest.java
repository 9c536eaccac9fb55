// file: core/src/test/java/io/merklite/core/RebuildTest.java
package io.merklite.core;

import org.junit.jupiter.api.Test;

import java.util.List;

import static io.merklite.core.ContentFixtures.texts;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for rebuild: heals corruption, follows mutated content,
 * replaces datasets, and keeps the old tree when it fails.
 */
class RebuildTest {

    @Test
    void rebuild_heals_corrupted_digests() {
        var tree = MerkleTree.build(texts("Hello", "Hi", "Hey", "Hola"));
        String before = tree.rootHex();
        tree.leaves().get(2).digest()[0] ^= 0x01;
        assertFalse(tree.verifyTree());

        tree.rebuild();

        assertTrue(tree.verifyTree());
        assertEquals(before, tree.rootHex());
    }

    @Test
    void rebuild_picks_up_mutated_content() {
        var a = new ContentFixtures.MutableContent("a", "alpha");
        var b = new ContentFixtures.MutableContent("b", "beta");
        var tree = MerkleTree.build(List.of(a, b));
        String before = tree.rootHex();

        a.payload = "ALPHA";
        assertFalse(tree.verifyContent(a));

        tree.rebuild();

        assertNotEquals(before, tree.rootHex());
        assertTrue(tree.verifyContent(a));
        assertTrue(tree.verifyTree());
    }

    @Test
    void rebuild_with_replaces_dataset() {
        var tree = MerkleTree.build(texts("a", "b"));

        tree.rebuildWith(texts("x", "y", "z"));

        assertEquals(3, tree.leafCount());
        assertEquals(MerkleTree.build(texts("x", "y", "z")).rootHex(), tree.rootHex());
        assertFalse(tree.verifyContent(TextContent.of("a")));
        assertTrue(tree.verifyContent(TextContent.of("z")));
    }

    @Test
    void failed_rebuild_keeps_previous_tree() {
        var tree = MerkleTree.build(texts("a", "b", "c"));
        String before = tree.rootHex();

        assertThrows(EmptyContentException.class, () -> tree.rebuildWith(List.of()));
        assertEquals(before, tree.rootHex());
        assertEquals(3, tree.leafCount());
        assertTrue(tree.verifyTree());
    }

    @Test
    void failed_in_place_rebuild_keeps_previous_tree() {
        var a = new ContentFixtures.FlakyContent("a", false);
        var b = new ContentFixtures.FlakyContent("b", false);
        var tree = MerkleTree.build(List.of(a, b));
        String before = tree.rootHex();

        b.failing = true;

        assertThrows(HashingException.class, tree::rebuild);
        assertEquals(before, tree.rootHex());
        assertTrue(tree.verifyTree());
    }
}
