// file: core/src/main/java/io/merklite/core/Content.java
package io.merklite.core;

import io.merklite.core.hash.HashStrategy;

/**
 * Capability every item stored in a {@link MerkleTree} must offer.
 * <p>
 * Only two operations are required:
 *  - digest():        hash of the item's own bytes under the tree's strategy,
 *  - contentEquals(): equality used to locate an item's leaf.
 * <p>
 * Two items are the same entry iff {@code contentEquals} says so, regardless of
 * whether their digests happen to collide.
 */
public interface Content {

    /**
     * Digest of this item's bytes.
     *
     * @throws HashingException if the digest cannot be computed
     */
    byte[] digest(HashStrategy hash);

    /**
     * @throws ContentTypeMismatchException if {@code other} is of a type this item
     *         cannot be compared with
     */
    boolean contentEquals(Content other);
}
