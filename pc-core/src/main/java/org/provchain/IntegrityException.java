package org.provchain;

import com.google.common.base.Preconditions;

/**
 * Signals that a hash recomputed during validation differs from the stored one.
 */
public class IntegrityException extends LedgerException {

    private static final long serialVersionUID = 1L;

    /** The hash found to diverge. */
    public enum Kind {

        /** The canonical hash of the block graph. */
        CANONICAL_HASH,

        /** The hash of the block itself. */
        BLOCK_HASH

    }

    private final long index;

    private final Kind kind;

    private final String expectedHash;

    private final String actualHash;

    /**
     * Creates a new instance.
     *
     * @param index
     *            the index of the offending block
     * @param kind
     *            which hash diverged
     * @param expectedHash
     *            the hash stored in the block
     * @param actualHash
     *            the hash recomputed from the store
     */
    public IntegrityException(final long index, final Kind kind, final String expectedHash,
            final String actualHash) {
        super("Block " + index + ": " + Preconditions.checkNotNull(kind) + " mismatch, stored "
                + expectedHash + ", recomputed " + actualHash);
        this.index = index;
        this.kind = kind;
        this.expectedHash = expectedHash;
        this.actualHash = actualHash;
    }

    public long getIndex() {
        return this.index;
    }

    public Kind getKind() {
        return this.kind;
    }

    public String getExpectedHash() {
        return this.expectedHash;
    }

    public String getActualHash() {
        return this.actualHash;
    }

}
