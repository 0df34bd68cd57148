package org.provchain.chain;

import java.util.List;

import org.junit.Assert;
import org.junit.Test;

import org.provchain.ChainLinkException;
import org.provchain.canon.CanonicalHash;
import org.provchain.canon.CanonicalizationAlgorithm;
import org.provchain.vocabulary.PC;

public class ChainTest {

    private static final String TIMESTAMP = "2026-01-01T00:00:00Z";

    private static final CanonicalHash GENESIS_CANONICAL_HASH = CanonicalHash
            .fromHex("7dd296acc1fbaa4b4eca2b29d112965604e5d6a7969a5eb992178c2873766e10");

    static Block block(final long index, final String previousHash) {
        return Block.create(index, TIMESTAMP, PC.blockGraph(index), previousHash,
                CanonicalHash.sha256("graph " + index), CanonicalizationAlgorithm.CUSTOM);
    }

    private static void append(final Chain chain, final Block block) throws ChainLinkException {
        chain.getLock().lock();
        try {
            chain.append(block);
        } finally {
            chain.getLock().unlock();
        }
    }

    @Test
    public void testBlockHash() {
        final Block genesis = Block.create(0, TIMESTAMP, PC.blockGraph(0),
                Block.GENESIS_PREVIOUS_HASH, GENESIS_CANONICAL_HASH,
                CanonicalizationAlgorithm.CUSTOM);
        Assert.assertEquals("1ec1070fb54c6f314740d984e0afc99af9bf0e5a8493d872283d8bf7066aed31",
                genesis.getBlockHash());
        Assert.assertEquals(64, Block.GENESIS_PREVIOUS_HASH.length());
        Assert.assertTrue(genesis.isGenesis());
    }

    @Test
    public void testBlockHashCoversFields() {
        final Block block = block(1, Block.GENESIS_PREVIOUS_HASH);
        Assert.assertNotEquals(block.getBlockHash(), Block.create(1, "2026-01-01T00:00:01Z",
                PC.blockGraph(1), Block.GENESIS_PREVIOUS_HASH, block.getCanonicalHash(),
                CanonicalizationAlgorithm.CUSTOM).getBlockHash());
        Assert.assertNotEquals(block.getBlockHash(), Block.create(1, TIMESTAMP,
                PC.blockGraph(1), Block.GENESIS_PREVIOUS_HASH, CanonicalHash.sha256("other"),
                CanonicalizationAlgorithm.CUSTOM).getBlockHash());
    }

    @Test
    public void testAppend() throws Exception {
        final Chain chain = new Chain();
        Assert.assertNull(chain.getLast());
        final Block genesis = block(0, Block.GENESIS_PREVIOUS_HASH);
        append(chain, genesis);
        final List<Block> snapshot = chain.getBlocks();
        final Block next = block(1, genesis.getBlockHash());
        append(chain, next);

        Assert.assertEquals(1, snapshot.size());
        Assert.assertEquals(2, chain.size());
        Assert.assertSame(next, chain.getLast());
        Assert.assertSame(genesis, chain.get(0));
    }

    @Test
    public void testRejectsWrongIndex() throws Exception {
        final Chain chain = new Chain();
        final Block genesis = block(0, Block.GENESIS_PREVIOUS_HASH);
        append(chain, genesis);
        try {
            append(chain, block(2, genesis.getBlockHash()));
            Assert.fail();
        } catch (final ChainLinkException ex) {
            Assert.assertEquals(2, ex.getIndex());
        }
        Assert.assertEquals(1, chain.size());
    }

    @Test
    public void testRejectsWrongPreviousHash() throws Exception {
        final Chain chain = new Chain();
        final Block genesis = block(0, Block.GENESIS_PREVIOUS_HASH);
        append(chain, genesis);
        final String wrongHash = CanonicalHash.sha256Hex("wrong");
        try {
            append(chain, block(1, wrongHash));
            Assert.fail();
        } catch (final ChainLinkException ex) {
            Assert.assertEquals(1, ex.getIndex());
            Assert.assertEquals(genesis.getBlockHash(), ex.getExpectedHash());
            Assert.assertEquals(wrongHash, ex.getActualHash());
        }
    }

    @Test(expected = ChainLinkException.class)
    public void testRejectsGenesisWithPreviousHash() throws Exception {
        append(new Chain(), block(0, CanonicalHash.sha256Hex("x")));
    }

    @Test(expected = IllegalStateException.class)
    public void testAppendRequiresLock() throws Exception {
        new Chain().append(block(0, Block.GENESIS_PREVIOUS_HASH));
    }

}
