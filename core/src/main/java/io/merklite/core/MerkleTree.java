// file: core/src/main/java/io/merklite/core/MerkleTree.java
package io.merklite.core;

import io.merklite.core.hash.HashStrategies;
import io.merklite.core.hash.HashStrategy;
import org.bouncycastle.util.encoders.Hex;

import java.security.MessageDigest;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Binary Merkle tree over an ordered list of content items.
 * <p>
 * At a high level:
 *  - each item becomes a leaf holding H(item bytes), in input order,
 *  - odd levels are padded with one duplicate of their last node,
 *  - internal nodes hash their two children: H(left || right),
 *  - the single top node is the root and commits to the whole list.
 * <p>
 * Verification comes in two flavors:
 *  - verifyTree():    recompute every level from the stored leaf digests,
 *  - verifyContent(): re-hash one item and fold it up to the root.
 * merklePath() extracts an {@link AuditPath} an outside party can check
 * against the root alone.
 * <p>
 * Concurrency contract: reads (root, verification, proofs, display) may run on
 * several threads at once. rebuild()/rebuildWith() must be serialized by the
 * caller against each other; each read operation works on one consistent
 * build, either the one before or the one after a concurrent rebuild.
 * <p>
 * Root stability: a one-item tree's root is that item's digest, unhashed.
 * Appending a second item therefore changes the root's derivation, not just its value.
 */
public final class MerkleTree<C extends Content> {
    private static final Logger log = Logger.getLogger(MerkleTree.class.getName());

    private final HashStrategy hash;
    private volatile TreeSnapshot<C> snapshot;

    private MerkleTree(HashStrategy hash, TreeSnapshot<C> snapshot) {
        this.hash = hash;
        this.snapshot = snapshot;
    }

    /** Build with SHA-256. */
    public static <C extends Content> MerkleTree<C> build(List<C> contents) {
        return build(contents, HashStrategies.sha256());
    }

    /**
     * Build a tree over {@code contents}, in order.
     * O(n) hashing.
     *
     * @throws EmptyContentException if {@code contents} is null or empty
     * @throws HashingException      if any leaf or internal digest cannot be computed
     */
    public static <C extends Content> MerkleTree<C> build(List<C> contents, HashStrategy hash) {
        Objects.requireNonNull(hash, "hash");
        TreeSnapshot<C> built = TreeBuilder.build(contents, hash);
        log.log(Level.FINE, () -> "built Merkle tree: " + summary(hash, built));
        return new MerkleTree<>(hash, built);
    }

    // ---------------- accessors ----------------

    /**
     * Root digest. Pure accessor, no recomputation.
     * Time: O(1)
     */
    public byte[] root() {
        return snapshot.rootNode().digest();
    }

    public String rootHex() {
        return Hex.toHexString(root());
    }

    public HashStrategy hashStrategy() {
        return hash;
    }

    /** The items the current build was made from, in input order. */
    public List<C> contents() {
        return snapshot.contents();
    }

    /** Leaves in input order, including a trailing duplicate when the item count is odd. */
    public List<LeafNode<C>> leaves() {
        return snapshot.leaves();
    }

    /** All levels, leaves first, root last. */
    public List<List<MerkleNode>> levels() {
        return snapshot.levels();
    }

    /** Number of real (non-duplicate) leaves. */
    public int leafCount() {
        return snapshot.realLeafCount();
    }

    /** Number of levels, leaves and root included. A one-item tree has height 1. */
    public int height() {
        return snapshot.levels().size();
    }

    // ---------------- verification ----------------

    /**
     * Recompute every internal digest bottom-up from the stored leaf digests and
     * compare each one, root included, with what is stored.
     * Leaves are not re-hashed from their content; use {@link #verifyContent} or
     * {@link #rebuild()} for that.
     *
     * @return true if the structure is internally consistent, false if tampering was detected
     * @throws HashingException if the hash strategy fails during recomputation
     */
    public boolean verifyTree() {
        TreeSnapshot<C> s = snapshot;
        List<List<MerkleNode>> levels = s.levels();

        List<MerkleNode> leafLevel = levels.get(0);
        byte[][] below = new byte[leafLevel.size()][];
        for (int i = 0; i < below.length; i++) {
            below[i] = leafLevel.get(i).digest();
        }

        for (int k = 1; k < levels.size(); k++) {
            List<MerkleNode> level = levels.get(k);
            byte[][] recomputed = new byte[level.size()][];
            for (int i = 0; i < level.size(); i++) {
                InternalNode node = (InternalNode) level.get(i);
                byte[] digest = TreeBuilder.hashPair(hash, below[node.left()], below[node.right()]);
                if (!MessageDigest.isEqual(digest, node.digest())) {
                    log.log(Level.WARNING, "Merkle tree inconsistent at level {0}, node {1}", new Object[]{k, i});
                    return false;
                }
                recomputed[i] = digest;
            }
            below = recomputed;
        }
        return true;
    }

    /**
     * Check that {@code content} is in the tree and that its current bytes still
     * hash up to the stored root.
     * <p>
     * Lookup is a linear scan by {@link Content#contentEquals}; the first matching
     * leaf wins, later equal entries are never examined.
     *
     * @return false if the content is absent, its fresh digest differs from the stored
     *         leaf digest, or the folded root differs from the stored root
     * @throws HashingException             on hashing failure
     * @throws ContentTypeMismatchException if {@code content} cannot be compared with stored items
     */
    public boolean verifyContent(Content content) {
        Objects.requireNonNull(content, "content");
        TreeSnapshot<C> s = snapshot;
        int index = indexOf(s, content);
        if (index < 0) {
            log.log(Level.FINE, "verifyContent: not found: {0}", content);
            return false;
        }

        LeafNode<C> leaf = s.leaves().get(index);
        byte[] running = TreeBuilder.leafDigest(leaf.content(), hash, index);
        if (!MessageDigest.isEqual(running, leaf.digest())) {
            log.log(Level.WARNING, "leaf {0} digest does not match its content", index);
            return false;
        }

        List<List<MerkleNode>> levels = s.levels();
        int i = index;
        for (int k = 0; k < levels.size() - 1; k++) {
            byte[] sibling = levels.get(k).get(i ^ 1).digest();
            running = (i & 1) == 0
                    ? TreeBuilder.hashPair(hash, running, sibling)
                    : TreeBuilder.hashPair(hash, sibling, running);
            i >>= 1;
        }

        boolean ok = MessageDigest.isEqual(running, s.rootNode().digest());
        if (!ok) {
            log.log(Level.WARNING, "leaf {0} does not fold up to the stored root", index);
        }
        return ok;
    }

    // ---------------- proofs ----------------

    /**
     * Audit path for the first leaf holding content equal to {@code content}.
     *
     * @throws ContentNotFoundException     if no leaf matches
     * @throws ContentTypeMismatchException if {@code content} cannot be compared with stored items
     */
    public AuditPath merklePath(Content content) {
        Objects.requireNonNull(content, "content");
        TreeSnapshot<C> s = snapshot;
        int index = indexOf(s, content);
        if (index < 0) {
            throw new ContentNotFoundException(content);
        }
        return pathFor(s, index);
    }

    /**
     * Audit path for the leaf at {@code leafIndex} (input order).
     *
     * @throws ContentNotFoundException if the index does not name a real leaf
     */
    public AuditPath merklePath(int leafIndex) {
        TreeSnapshot<C> s = snapshot;
        if (leafIndex < 0 || leafIndex >= s.realLeafCount()) {
            throw new ContentNotFoundException(leafIndex, s.realLeafCount());
        }
        return pathFor(s, leafIndex);
    }

    private static AuditPath pathFor(TreeSnapshot<?> s, int leafIndex) {
        List<List<MerkleNode>> levels = s.levels();
        List<AuditPath.Step> steps = new ArrayList<>(levels.size() - 1);
        int i = leafIndex;
        for (int k = 0; k < levels.size() - 1; k++) {
            byte[] sibling = levels.get(k).get(i ^ 1).digest();
            // current is a left child => sibling is the right operand
            AuditPath.Side side = (i & 1) == 0 ? AuditPath.Side.RIGHT : AuditPath.Side.LEFT;
            steps.add(new AuditPath.Step(sibling, side));
            i >>= 1;
        }
        return new AuditPath(leafIndex, steps);
    }

    // ---------------- rebuild ----------------

    /**
     * Re-hash the current items from scratch. Picks up in-place mutation of
     * content and repairs corrupted digests.
     * <p>
     * Atomic: on failure the previous build stays in place.
     *
     * @throws HashingException if any digest cannot be computed
     */
    public void rebuild() {
        replaceWith(snapshot.contents(), "rebuild");
    }

    /**
     * Replace the dataset with {@code contents} and rebuild.
     * <p>
     * Atomic: on failure the previous build stays in place.
     *
     * @throws EmptyContentException if {@code contents} is null or empty
     * @throws HashingException      if any digest cannot be computed
     */
    public void rebuildWith(List<C> contents) {
        replaceWith(contents, "rebuildWith");
    }

    private void replaceWith(List<C> contents, String op) {
        TreeSnapshot<C> next;
        try {
            next = TreeBuilder.build(contents, hash);
        } catch (MerkleException e) {
            log.log(Level.WARNING, op + " failed, previous tree retained: " + e.getMessage());
            throw e;
        }
        snapshot = next;
        log.log(Level.FINE, () -> op + ": " + summary(hash, next));
    }

    // ---------------- display ----------------

    /** Every digest, level by level from the root down, duplicates tagged. */
    public String toDisplayString() {
        return toDisplayString(false);
    }

    /**
     * Diagnostic dump of all digests by level.
     *
     * @param elideDuplicates leave out padding nodes
     */
    public String toDisplayString(boolean elideDuplicates) {
        TreeSnapshot<C> s = snapshot;
        List<List<MerkleNode>> levels = s.levels();
        StringBuilder sb = new StringBuilder();
        sb.append(summary(hash, s)).append('\n');
        for (int k = levels.size() - 1; k >= 0; k--) {
            sb.append("level ").append(k);
            if (k == levels.size() - 1) sb.append(" (root)");
            else if (k == 0) sb.append(" (leaves)");
            sb.append('\n');

            List<MerkleNode> level = levels.get(k);
            for (int i = 0; i < level.size(); i++) {
                MerkleNode node = level.get(i);
                if (elideDuplicates && node.duplicate()) continue;
                sb.append(String.format("  %4d  %s", i, Hex.toHexString(node.digest())));
                if (node.duplicate()) sb.append(" (dup)");
                if (node instanceof LeafNode<?> leaf && !leaf.duplicate()) {
                    sb.append("  ").append(leaf.content());
                }
                sb.append('\n');
            }
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return "MerkleTree{" + summary(hash, snapshot) + "}";
    }

    // ---------------- helpers ----------------

    /**
     * First real leaf whose content equals {@code content}, or -1.
     * Leaves of a type that cannot be compared with {@code content} are skipped;
     * the mismatch is only raised when no stored item was comparable at all.
     */
    private static int indexOf(TreeSnapshot<?> s, Content content) {
        List<? extends LeafNode<?>> leaves = s.leaves();
        ContentTypeMismatchException mismatch = null;
        boolean compared = false;
        for (int i = 0; i < s.realLeafCount(); i++) {
            try {
                if (leaves.get(i).content().contentEquals(content)) {
                    return i;
                }
                compared = true;
            } catch (ContentTypeMismatchException e) {
                mismatch = e;
            }
        }
        if (!compared && mismatch != null) {
            throw mismatch;
        }
        return -1;
    }

    private static String summary(HashStrategy hash, TreeSnapshot<?> s) {
        return "hash=%s, leaves=%d, height=%d, root=%s".formatted(
                hash.name(),
                s.realLeafCount(),
                s.levels().size(),
                Hex.toHexString(s.rootNode().digest())
        );
    }
}
