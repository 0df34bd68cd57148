package org.provchain;

import javax.annotation.Nullable;

/**
 * Signals a broken link between a block and its predecessor.
 * <p>
 * Thrown at append time when the block does not extend the current tail of the chain, and
 * reported at validation time when the stored previous hash of a block differs from the hash of
 * the block before it. The chain is never repaired automatically.
 * </p>
 */
public class ChainLinkException extends LedgerException {

    private static final long serialVersionUID = 1L;

    private final long index;

    @Nullable
    private final String expectedHash;

    @Nullable
    private final String actualHash;

    /**
     * Creates a new instance.
     *
     * @param index
     *            the index of the offending block
     * @param expectedHash
     *            the previous hash the block should carry, if any
     * @param actualHash
     *            the previous hash the block actually carries
     * @param message
     *            a message describing the failure
     */
    public ChainLinkException(final long index, @Nullable final String expectedHash,
            @Nullable final String actualHash, final String message) {
        super("Block " + index + ": " + message);
        this.index = index;
        this.expectedHash = expectedHash;
        this.actualHash = actualHash;
    }

    public long getIndex() {
        return this.index;
    }

    @Nullable
    public String getExpectedHash() {
        return this.expectedHash;
    }

    @Nullable
    public String getActualHash() {
        return this.actualHash;
    }

}
