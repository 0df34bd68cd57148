package org.provchain.chain;

import java.io.Serializable;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.base.Strings;

import org.openrdf.model.URI;

import org.provchain.canon.CanonicalHash;
import org.provchain.canon.CanonicalizationAlgorithm;

/**
 * An immutable ledger block.
 * <p>
 * A block references the named graph holding its data and records the canonical hash of that
 * graph, together with the algorithm that computed it. The block hash is the SHA-256 of the
 * decimal index, the timestamp, the canonical hash hex and the previous block hash,
 * concatenated in this order (see {@link #computeHash(long, String, CanonicalHash, String)}).
 * </p>
 */
public final class Block implements Serializable {

    private static final long serialVersionUID = 1L;

    /** The previous hash of the genesis block: 64 zeros. */
    public static final String GENESIS_PREVIOUS_HASH = Strings.repeat("0", 64);

    private final long index;

    private final String timestamp;

    private final URI graphRef;

    private final String previousHash;

    private final CanonicalHash canonicalHash;

    private final CanonicalizationAlgorithm algorithm;

    private final String blockHash;

    private Block(final long index, final String timestamp, final URI graphRef,
            final String previousHash, final CanonicalHash canonicalHash,
            final CanonicalizationAlgorithm algorithm, final String blockHash) {
        Preconditions.checkArgument(index >= 0, "Invalid block index %s", index);
        this.index = index;
        this.timestamp = Preconditions.checkNotNull(timestamp);
        this.graphRef = Preconditions.checkNotNull(graphRef);
        this.previousHash = Preconditions.checkNotNull(previousHash);
        this.canonicalHash = Preconditions.checkNotNull(canonicalHash);
        this.algorithm = Preconditions.checkNotNull(algorithm);
        this.blockHash = Preconditions.checkNotNull(blockHash);
    }

    /**
     * Creates a new block, computing its hash.
     *
     * @param index
     *            the block index, zero for the genesis block
     * @param timestamp
     *            the {@code xsd:dateTime} lexical form of the creation time
     * @param graphRef
     *            the URI of the named graph holding the block data
     * @param previousHash
     *            the hash of the previous block, or {@link #GENESIS_PREVIOUS_HASH}
     * @param canonicalHash
     *            the canonical hash of the block graph
     * @param algorithm
     *            the algorithm that produced the canonical hash
     * @return the created block
     */
    public static Block create(final long index, final String timestamp, final URI graphRef,
            final String previousHash, final CanonicalHash canonicalHash,
            final CanonicalizationAlgorithm algorithm) {
        return new Block(index, timestamp, graphRef, previousHash, canonicalHash, algorithm,
                computeHash(index, timestamp, canonicalHash, previousHash));
    }

    /**
     * Recreates a block from stored fields, keeping the stored block hash as is. Whether the
     * stored hash matches the other fields is checked by chain validation, not here.
     */
    static Block restore(final long index, final String timestamp, final URI graphRef,
            final String previousHash, final CanonicalHash canonicalHash,
            final CanonicalizationAlgorithm algorithm, final String blockHash) {
        return new Block(index, timestamp, graphRef, previousHash, canonicalHash, algorithm,
                blockHash);
    }

    /**
     * Computes a block hash.
     *
     * @param index
     *            the block index
     * @param timestamp
     *            the block timestamp
     * @param canonicalHash
     *            the canonical hash of the block graph
     * @param previousHash
     *            the hash of the previous block
     * @return 64 lowercase hex characters
     */
    public static String computeHash(final long index, final String timestamp,
            final CanonicalHash canonicalHash, final String previousHash) {
        return CanonicalHash.sha256Hex(index + timestamp + canonicalHash.toHex() + previousHash);
    }

    public long getIndex() {
        return this.index;
    }

    public String getTimestamp() {
        return this.timestamp;
    }

    public URI getGraphRef() {
        return this.graphRef;
    }

    public String getPreviousHash() {
        return this.previousHash;
    }

    public CanonicalHash getCanonicalHash() {
        return this.canonicalHash;
    }

    public CanonicalizationAlgorithm getAlgorithm() {
        return this.algorithm;
    }

    public String getBlockHash() {
        return this.blockHash;
    }

    public boolean isGenesis() {
        return this.index == 0;
    }

    @Override
    public boolean equals(final Object object) {
        if (object == this) {
            return true;
        }
        if (!(object instanceof Block)) {
            return false;
        }
        final Block other = (Block) object;
        return this.index == other.index && this.blockHash.equals(other.blockHash)
                && this.timestamp.equals(other.timestamp)
                && this.graphRef.equals(other.graphRef)
                && this.previousHash.equals(other.previousHash)
                && this.canonicalHash.equals(other.canonicalHash)
                && this.algorithm == other.algorithm;
    }

    @Override
    public int hashCode() {
        return this.blockHash.hashCode();
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).add("index", this.index)
                .add("timestamp", this.timestamp).add("graph", this.graphRef)
                .add("algorithm", this.algorithm).add("hash", this.blockHash).toString();
    }

}
