package org.provchain.chain;

import java.util.Iterator;
import java.util.concurrent.locks.ReentrantLock;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;

import org.provchain.ChainLinkException;

/**
 * The ordered sequence of blocks of a ledger.
 * <p>
 * Readers access an immutable snapshot published through a volatile field and never block.
 * Mutation is serialized by an append lock: {@link #append(Block)} must be called by the thread
 * holding it, which allows the ledger to check linkage, persist the block and publish it as one
 * atomic step.
 * </p>
 */
public final class Chain implements Iterable<Block> {

    private final ReentrantLock lock;

    private volatile ImmutableList<Block> blocks;

    Chain() {
        this.lock = new ReentrantLock();
        this.blocks = ImmutableList.of();
    }

    /**
     * Returns a snapshot of the chain, unaffected by later appends.
     *
     * @return the blocks in index order
     */
    public ImmutableList<Block> getBlocks() {
        return this.blocks;
    }

    public int size() {
        return this.blocks.size();
    }

    public boolean isEmpty() {
        return this.blocks.isEmpty();
    }

    public Block get(final long index) {
        final ImmutableList<Block> snapshot = this.blocks;
        Preconditions.checkElementIndex((int) index, snapshot.size());
        return snapshot.get((int) index);
    }

    @Nullable
    public Block getLast() {
        return Iterables.getLast(this.blocks, null);
    }

    @Override
    public Iterator<Block> iterator() {
        return this.blocks.iterator();
    }

    ReentrantLock getLock() {
        return this.lock;
    }

    /**
     * Checks that a block can be appended to the chain, i.e., that its index follows the last
     * index and its previous hash is the last block hash (or 64 zeros for the genesis block).
     */
    void checkNext(final Block block) throws ChainLinkException {
        final Block last = getLast();
        final long expectedIndex = last == null ? 0 : last.getIndex() + 1;
        final String expectedHash = last == null ? Block.GENESIS_PREVIOUS_HASH : last
                .getBlockHash();
        if (block.getIndex() != expectedIndex) {
            throw new ChainLinkException(block.getIndex(), expectedHash,
                    block.getPreviousHash(), "expected index " + expectedIndex);
        }
        if (!expectedHash.equals(block.getPreviousHash())) {
            throw new ChainLinkException(block.getIndex(), expectedHash,
                    block.getPreviousHash(), "previous hash " + block.getPreviousHash()
                            + " does not match " + expectedHash);
        }
    }

    /**
     * Appends a block, checking its linkage. Must be called holding the append lock.
     */
    void append(final Block block) throws ChainLinkException {
        Preconditions.checkState(this.lock.isHeldByCurrentThread(), "Append lock not held");
        checkNext(block);
        this.blocks = ImmutableList.<Block>builder().addAll(this.blocks).add(block).build();
    }

    /**
     * Replaces the whole chain with blocks loaded from storage, without checking linkage (this
     * is left to validation). Must be called holding the append lock.
     */
    void load(final Iterable<Block> loaded) {
        Preconditions.checkState(this.lock.isHeldByCurrentThread(), "Append lock not held");
        this.blocks = ImmutableList.copyOf(loaded);
    }

    @Override
    public String toString() {
        final Block last = getLast();
        return "Chain[" + size() + " blocks" + (last == null ? "" : ", head " + last.getBlockHash())
                + "]";
    }

}
