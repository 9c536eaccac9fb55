// file: core/src/main/java/io/merklite/core/ContentNotFoundException.java
package io.merklite.core;

/** No leaf holds content equal to the requested value. */
public final class ContentNotFoundException extends MerkleException {

    public ContentNotFoundException(Content content) {
        super("content not found in tree: " + content);
    }

    public ContentNotFoundException(int leafIndex, int leafCount) {
        super("leaf index %d out of range [0, %d)".formatted(leafIndex, leafCount));
    }
}
