// file: core/src/main/java/io/merklite/core/AuditPath.java
package io.merklite.core;

import io.merklite.core.hash.HashStrategy;
import org.bouncycastle.util.encoders.Hex;

import java.security.MessageDigest;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Inclusion proof for one leaf: the sibling digests met on the way from the
 * leaf up to (but excluding) the root, lowest level first.
 * <p>
 * Together with the leaf's own digest this is enough to recompute the root
 * without the rest of the tree. Size and verification cost are O(log n).
 *
 * @param leafIndex position of the proven leaf in input order
 * @param steps     one step per level below the root; empty for a single-leaf tree
 */
public record AuditPath(int leafIndex, List<Step> steps) {

    /** Which operand the sibling is in the next hash step. */
    public enum Side {
        /** next = H(sibling || current) */
        LEFT,
        /** next = H(current || sibling) */
        RIGHT
    }

    /** One level of the path. The sibling digest is copied in and out, never shared. */
    public record Step(byte[] sibling, Side side) {
        public Step {
            Objects.requireNonNull(sibling, "sibling");
            Objects.requireNonNull(side, "side");
            sibling = sibling.clone();
        }

        @Override
        public byte[] sibling() {
            return sibling.clone();
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Step s && side == s.side && Arrays.equals(sibling, s.sibling);
        }

        @Override
        public int hashCode() {
            return 31 * Arrays.hashCode(sibling) + side.hashCode();
        }

        @Override
        public String toString() {
            return side + ":" + Hex.toHexString(sibling);
        }
    }

    public AuditPath {
        if (leafIndex < 0) throw new IllegalArgumentException("leafIndex must be >= 0");
        steps = List.copyOf(steps);
    }

    /** Fold the steps starting from {@code leafDigest} and return the resulting root. */
    public byte[] computeRoot(byte[] leafDigest, HashStrategy hash) {
        Objects.requireNonNull(leafDigest, "leafDigest");
        byte[] running = leafDigest;
        for (Step step : steps) {
            running = step.side() == Side.LEFT
                    ? TreeBuilder.hashPair(hash, step.sibling(), running)
                    : TreeBuilder.hashPair(hash, running, step.sibling());
        }
        return running;
    }

    /** True iff folding from {@code leafDigest} reproduces {@code expectedRoot} exactly. */
    public boolean verify(byte[] leafDigest, byte[] expectedRoot, HashStrategy hash) {
        Objects.requireNonNull(expectedRoot, "expectedRoot");
        return MessageDigest.isEqual(computeRoot(leafDigest, hash), expectedRoot);
    }

    /** Same as {@link #verify(byte[], byte[], HashStrategy)} with the leaf digest computed from content. */
    public boolean verify(Content content, byte[] expectedRoot, HashStrategy hash) {
        Objects.requireNonNull(content, "content");
        return verify(TreeBuilder.leafDigest(content, hash, leafIndex), expectedRoot, hash);
    }

    public int length() {
        return steps.size();
    }
}
