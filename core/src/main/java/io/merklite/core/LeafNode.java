// file: core/src/main/java/io/merklite/core/LeafNode.java
package io.merklite.core;

/**
 * Leaf wrapping one content item.
 * A duplicate leaf repeats the last real leaf's digest and points at the same content.
 */
public record LeafNode<C extends Content>(byte[] digest, C content, boolean duplicate) implements MerkleNode {
}
