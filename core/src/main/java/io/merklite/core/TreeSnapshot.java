// file: core/src/main/java/io/merklite/core/TreeSnapshot.java
package io.merklite.core;

import java.util.List;

/**
 * Everything a single build produced. Never modified after construction;
 * a rebuild produces a new snapshot.
 *
 * @param contents  the input list, in input order
 * @param leaves    one leaf per content item, plus a trailing duplicate when the count is odd
 * @param levels    levels.get(0) are the leaves, the last level holds only the root
 */
record TreeSnapshot<C extends Content>(
        List<C> contents,
        List<LeafNode<C>> leaves,
        List<List<MerkleNode>> levels
) {

    MerkleNode rootNode() {
        return levels.get(levels.size() - 1).get(0);
    }

    /** Number of leaves that wrap a real content item. */
    int realLeafCount() {
        return contents.size();
    }
}
