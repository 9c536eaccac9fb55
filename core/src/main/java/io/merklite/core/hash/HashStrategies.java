// file: core/src/main/java/io/merklite/core/hash/HashStrategies.java
package io.merklite.core.hash;

import org.bouncycastle.crypto.digests.KeccakDigest;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Locale;
import java.util.Objects;

/**
 * Stock hash strategies and a name-based selector.
 * <p>
 * Supported:
 *  - sha-256     (default, JCA)
 *  - keccak-256  (Ethereum-style Keccak, original padding, via Bouncy Castle)
 *  - any other JCA MessageDigest algorithm by its JCA name (SHA-512, SHA3-256, ...)
 */
public final class HashStrategies {

    public static final String SHA_256 = "sha-256";
    public static final String KECCAK_256 = "keccak-256";

    private static final HashStrategy SHA256 = new JcaStrategy("SHA-256");
    private static final HashStrategy KECCAK256 = new KeccakStrategy(256);

    private HashStrategies() {
        // utility
    }

    public static HashStrategy sha256() {
        return SHA256;
    }

    public static HashStrategy keccak256() {
        return KECCAK256;
    }

    /**
     * Strategy backed by a JCA MessageDigest.
     *
     * @throws HashAlgorithmException if the running JVM has no provider for the algorithm
     */
    public static HashStrategy jca(String algorithm) {
        Objects.requireNonNull(algorithm, "algorithm");
        return new JcaStrategy(algorithm);
    }

    /** Select by name, case-insensitive. Unknown names fall through to JCA. */
    public static HashStrategy forName(String name) {
        if (name == null || name.isBlank()) {
            return SHA256;
        }
        return switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "sha-256", "sha256" -> SHA256;
            case "keccak-256", "keccak256" -> KECCAK256;
            default -> jca(name.trim());
        };
    }

    // ---------------- implementations ----------------

    static final class JcaStrategy implements HashStrategy {
        private final String algorithm;
        private final String name;
        private final int digestLength;

        JcaStrategy(String algorithm) {
            this.algorithm = algorithm;
            this.name = algorithm.toLowerCase(Locale.ROOT);
            // resolve once up front so a missing algorithm fails at selection time
            this.digestLength = newDigest().getDigestLength();
        }

        @Override public String name() { return name; }

        @Override public int digestLength() { return digestLength; }

        @Override
        public byte[] hash(byte[]... parts) {
            MessageDigest md = newDigest();
            for (byte[] p : parts) {
                md.update(Objects.requireNonNull(p, "part"));
            }
            return md.digest();
        }

        private MessageDigest newDigest() {
            try {
                return MessageDigest.getInstance(algorithm);
            } catch (NoSuchAlgorithmException e) {
                throw new HashAlgorithmException("hash algorithm not available: " + algorithm, e);
            }
        }

        @Override
        public String toString() {
            return name;
        }
    }

    static final class KeccakStrategy implements HashStrategy {
        private final int bits;

        KeccakStrategy(int bits) {
            this.bits = bits;
        }

        @Override public String name() { return "keccak-" + bits; }

        @Override public int digestLength() { return bits / 8; }

        @Override
        public byte[] hash(byte[]... parts) {
            KeccakDigest digest = new KeccakDigest(bits);
            for (byte[] p : parts) {
                Objects.requireNonNull(p, "part");
                digest.update(p, 0, p.length);
            }
            byte[] out = new byte[digest.getDigestSize()];
            digest.doFinal(out, 0);
            return out;
        }

        @Override
        public String toString() {
            return name();
        }
    }
}
