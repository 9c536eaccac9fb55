// file: core/src/main/java/io/merklite/core/ContentTypeMismatchException.java
package io.merklite.core;

/**
 * A content value was compared against stored content of a type
 * it cannot be compared with.
 */
public final class ContentTypeMismatchException extends MerkleException {

    public ContentTypeMismatchException(Class<? extends Content> expected, Content actual) {
        super("cannot compare %s with %s".formatted(
                expected.getSimpleName(),
                actual == null ? "null" : actual.getClass().getSimpleName()
        ));
    }
}
