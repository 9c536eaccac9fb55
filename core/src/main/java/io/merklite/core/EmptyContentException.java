// file: core/src/main/java/io/merklite/core/EmptyContentException.java
package io.merklite.core;

/** Raised when a tree is built (or rebuilt) from zero content items. */
public final class EmptyContentException extends MerkleException {

    public EmptyContentException() {
        super("cannot build a Merkle tree from an empty content list");
    }
}
