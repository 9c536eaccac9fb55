// file: core/src/main/java/io/merklite/core/hash/HashStrategy.java
package io.merklite.core.hash;

/**
 * Pluggable digest primitive used for leaves and internal nodes alike.
 * <p>
 * Implementations must be stateless and safe to call from several threads:
 * every call to {@link #hash(byte[]...)} works on its own digest instance.
 */
public interface HashStrategy {

    /** Stable, lower-case name, e.g. "sha-256". */
    String name();

    /** Length of every digest produced, in bytes. */
    int digestLength();

    /**
     * H(part1 || part2 || ...).
     *
     * @throws HashAlgorithmException if the primitive is unavailable
     */
    byte[] hash(byte[]... parts);
}
