// file: core/src/main/java/io/merklite/core/TreeBuilder.java
package io.merklite.core;

import io.merklite.core.hash.HashStrategy;

import java.util.ArrayList;
import java.util.List;

/**
 * Bottom-up construction of a binary Merkle tree over an ordered content list.
 * <p>
 * Rules:
 *  - leaves are created one per item, in input order, never sorted,
 *  - an odd level (leaves included) gets one duplicate of its last node appended,
 *  - internal node = H(left || right), fixed order,
 *  - a single item is its own root: no padding, no hashing above the leaf.
 * <p>
 * Any hashing failure aborts the build; nothing partial is returned.
 */
final class TreeBuilder {

    private TreeBuilder() {
        // utility
    }

    static <C extends Content> TreeSnapshot<C> build(List<C> contents, HashStrategy hash) {
        if (contents == null || contents.isEmpty()) {
            throw new EmptyContentException();
        }
        List<C> items = List.copyOf(contents); // rejects null items

        // 1) leaves
        List<LeafNode<C>> leaves = new ArrayList<>(items.size() + 1);
        for (int i = 0; i < items.size(); i++) {
            C item = items.get(i);
            leaves.add(new LeafNode<>(leafDigest(item, hash, i), item, false));
        }
        if (leaves.size() > 1 && (leaves.size() & 1) == 1) {
            LeafNode<C> last = leaves.get(leaves.size() - 1);
            leaves.add(new LeafNode<>(last.digest().clone(), last.content(), true));
        }

        // 2) internal levels until a single node remains
        List<List<MerkleNode>> levels = new ArrayList<>();
        List<MerkleNode> current = new ArrayList<>(leaves);
        levels.add(List.copyOf(current));

        while (current.size() > 1) {
            List<MerkleNode> next = new ArrayList<>((current.size() >> 1) + 1);
            for (int i = 0; i < current.size(); i += 2) {
                byte[] digest = hashPair(hash, current.get(i).digest(), current.get(i + 1).digest());
                next.add(new InternalNode(digest, i, i + 1, false));
            }
            if (next.size() > 1 && (next.size() & 1) == 1) {
                InternalNode last = (InternalNode) next.get(next.size() - 1);
                next.add(new InternalNode(last.digest().clone(), last.left(), last.right(), true));
            }
            levels.add(List.copyOf(next));
            current = next;
        }

        return new TreeSnapshot<>(items, List.copyOf(leaves), List.copyOf(levels));
    }

    /** Fresh digest of one item, with any failure reported as a HashingException. */
    static byte[] leafDigest(Content item, HashStrategy hash, int index) {
        byte[] digest;
        try {
            digest = item.digest(hash);
        } catch (MerkleException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new HashingException("digest failed for item " + index, e);
        }
        if (digest == null) {
            throw new HashingException("item " + index + " produced a null digest");
        }
        return digest;
    }

    /** H(left || right). */
    static byte[] hashPair(HashStrategy hash, byte[] left, byte[] right) {
        byte[] digest;
        try {
            digest = hash.hash(left, right);
        } catch (MerkleException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new HashingException("internal node hashing failed (" + hash.name() + ")", e);
        }
        if (digest == null) {
            throw new HashingException(hash.name() + " produced a null digest");
        }
        return digest;
    }
}
