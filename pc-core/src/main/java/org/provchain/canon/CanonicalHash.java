package org.provchain.canon;

import java.io.Serializable;
import java.nio.charset.StandardCharsets;

import com.google.common.base.Preconditions;
import com.google.common.hash.HashCode;
import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;

/**
 * A SHA-256 digest identifying a graph up to blank node relabeling, rendered as 64 lowercase hex
 * characters.
 */
public final class CanonicalHash implements Comparable<CanonicalHash>, Serializable {

    private static final long serialVersionUID = 1L;

    private static final HashFunction SHA256 = Hashing.sha256();

    private final HashCode code;

    private CanonicalHash(final HashCode code) {
        this.code = code;
    }

    /**
     * Returns the canonical hash with the hex representation specified.
     *
     * @param hex
     *            64 hex characters
     * @return the corresponding hash
     */
    public static CanonicalHash fromHex(final String hex) {
        Preconditions.checkArgument(hex.length() == 64, "Not a SHA-256 hex string: %s", hex);
        return new CanonicalHash(HashCode.fromString(hex.toLowerCase()));
    }

    static CanonicalHash of(final HashCode code) {
        Preconditions.checkArgument(code.bits() == 256, "Not a SHA-256 digest: %s", code);
        return new CanonicalHash(code);
    }

    /**
     * Returns the SHA-256 digest of the UTF-8 encoding of the string specified.
     *
     * @param string
     *            the string to hash
     * @return the digest
     */
    public static CanonicalHash sha256(final CharSequence string) {
        return new CanonicalHash(SHA256.hashString(string, StandardCharsets.UTF_8));
    }

    /**
     * Returns the lowercase hex SHA-256 digest of the UTF-8 encoding of the string specified.
     *
     * @param string
     *            the string to hash
     * @return 64 lowercase hex characters
     */
    public static String sha256Hex(final CharSequence string) {
        return SHA256.hashString(string, StandardCharsets.UTF_8).toString();
    }

    public byte[] toBytes() {
        return this.code.asBytes();
    }

    public String toHex() {
        return this.code.toString();
    }

    @Override
    public int compareTo(final CanonicalHash other) {
        return toHex().compareTo(other.toHex());
    }

    @Override
    public boolean equals(final Object object) {
        if (object == this) {
            return true;
        }
        if (!(object instanceof CanonicalHash)) {
            return false;
        }
        return this.code.equals(((CanonicalHash) object).code);
    }

    @Override
    public int hashCode() {
        return this.code.hashCode();
    }

    @Override
    public String toString() {
        return this.code.toString();
    }

}
