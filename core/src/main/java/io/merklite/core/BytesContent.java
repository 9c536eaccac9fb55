// file: core/src/main/java/io/merklite/core/BytesContent.java
package io.merklite.core;

import io.merklite.core.hash.HashStrategy;
import org.bouncycastle.util.encoders.Hex;

import java.util.Arrays;
import java.util.Objects;

/**
 * Raw byte payload. The array is copied on the way in and on the way out,
 * so a stored item cannot change behind the tree's back.
 */
public final class BytesContent implements Content {
    private final byte[] bytes;

    public BytesContent(byte[] bytes) {
        this.bytes = Objects.requireNonNull(bytes, "bytes").clone();
    }

    public byte[] bytes() {
        return bytes.clone();
    }

    public int length() {
        return bytes.length;
    }

    @Override
    public byte[] digest(HashStrategy hash) {
        return hash.hash(bytes);
    }

    @Override
    public boolean contentEquals(Content other) {
        if (other instanceof BytesContent b) {
            return Arrays.equals(bytes, b.bytes);
        }
        throw new ContentTypeMismatchException(BytesContent.class, other);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof BytesContent b && Arrays.equals(bytes, b.bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        // long payloads only show their prefix
        return bytes.length <= 16
                ? "0x" + Hex.toHexString(bytes)
                : "0x" + Hex.toHexString(bytes, 0, 16) + "...(" + bytes.length + " bytes)";
    }
}
