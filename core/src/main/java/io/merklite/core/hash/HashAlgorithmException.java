// file: core/src/main/java/io/merklite/core/hash/HashAlgorithmException.java
package io.merklite.core.hash;

/**
 * The requested digest primitive is not available in this JVM.
 * A tree that hits this while hashing reports it as a HashingException.
 */
public final class HashAlgorithmException extends RuntimeException {

    public HashAlgorithmException(String message, Throwable cause) {
        super(message, cause);
    }
}
