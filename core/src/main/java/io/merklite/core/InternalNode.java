// file: core/src/main/java/io/merklite/core/InternalNode.java
package io.merklite.core;

/**
 * Internal node: digest = H(below[left].digest || below[right].digest).
 * {@code left} and {@code right} index into the level directly below.
 * A duplicate internal node is a clone of its level's last node and shares its children.
 */
public record InternalNode(byte[] digest, int left, int right, boolean duplicate) implements MerkleNode {
}
