// file: core/src/main/java/io/merklite/core/MerkleException.java
package io.merklite.core;

/**
 * Base type for every failure raised by the tree.
 * <p>
 * Failures are kept apart from verification outcomes:
 *  - "not found" and "digest mismatch" during verification are {@code false} results,
 *  - exceptions mean the tree could not determine an answer at all.
 */
public class MerkleException extends RuntimeException {

    public MerkleException(String message) {
        super(message);
    }

    public MerkleException(String message, Throwable cause) {
        super(message, cause);
    }
}
