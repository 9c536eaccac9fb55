// file: core/src/main/java/io/merklite/core/HashingException.java
package io.merklite.core;

/**
 * The hash strategy or a content item's digest capability failed.
 * The underlying failure, if any, is available as the cause.
 */
public final class HashingException extends MerkleException {

    public HashingException(String message) {
        super(message);
    }

    public HashingException(String message, Throwable cause) {
        super(message, cause);
    }
}
