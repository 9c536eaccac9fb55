// file: core/src/main/java/io/merklite/core/MerkleNode.java
package io.merklite.core;

/**
 * A node at any level of the tree.
 * <p>
 * Level 0 holds {@link LeafNode}s, every level above holds {@link InternalNode}s.
 * Relationships are positional: node {@code i} at level {@code k} has its parent at
 * {@code i >> 1} on level {@code k + 1} and its sibling at {@code i ^ 1} on level {@code k}.
 * <p>
 * {@code digest()} returns the tree's own storage, not a copy. Do not modify it.
 */
public sealed interface MerkleNode permits LeafNode, InternalNode {

    byte[] digest();

    /**
     * True for the synthetic node appended to pad an odd level.
     * Its digest still takes part in hashing like any other.
     */
    boolean duplicate();
}
