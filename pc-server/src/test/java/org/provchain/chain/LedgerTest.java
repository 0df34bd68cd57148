package org.provchain.chain;

import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;
import org.openrdf.model.BNode;
import org.openrdf.model.Literal;
import org.openrdf.model.Resource;
import org.openrdf.model.Statement;
import org.openrdf.model.Value;
import org.openrdf.model.ValueFactory;

import org.provchain.CanonicalizationTimeoutException;
import org.provchain.ChainLinkException;
import org.provchain.IntegrityException;
import org.provchain.SerializationException;
import org.provchain.canon.CanonicalizationAlgorithm;
import org.provchain.data.Data;
import org.provchain.data.NamedGraph;
import org.provchain.internal.rdf.RDFUtil;
import org.provchain.triplestore.RepositoryTripleStore;
import org.provchain.vocabulary.PC;

public class LedgerTest {

    static final String PREFIX = "@prefix ex: <http://example.org/> .\n";

    static final String HARVEST = PREFIX //
            + "ex:batch1 ex:producedBy _:farm ; ex:weight 12 .\n" //
            + "_:farm ex:name \"Green Acres\" .";

    static final String SHIPMENT = PREFIX //
            + "_:x ex:handsOver _:y .\n" //
            + "_:y ex:handsOver _:x .\n" //
            + "_:x ex:name \"Carrier\" .";

    private ExecutorService executor;

    private Ledger ledger;

    @Before
    public void setUp() throws Exception {
        this.executor = Executors.newFixedThreadPool(4);
        this.ledger = Ledger.builder(new RepositoryTripleStore()).executor(this.executor).build();
        this.ledger.init();
    }

    @After
    public void tearDown() {
        this.ledger.close();
        this.executor.shutdownNow();
    }

    static void corrupt(final Ledger ledger, final long index) throws Exception {
        final ValueFactory vf = Data.getValueFactory();
        final List<Statement> statements = Lists.newArrayList();
        boolean changed = false;
        for (final Statement statement : ledger.getGraphStore().getGraph(PC.blockGraph(index))) {
            if (!changed && statement.getObject() instanceof Literal) {
                final String label = ((Literal) statement.getObject()).getLabel();
                statements.add(vf.createStatement(statement.getSubject(),
                        statement.getPredicate(), vf.createLiteral(label + " (altered)")));
                changed = true;
            } else {
                statements.add(statement);
            }
        }
        Assert.assertTrue(changed);
        ledger.getGraphStore().storeGraph(PC.blockGraph(index), statements);
    }

    @Test
    public void testGenesis() throws Exception {
        Assert.assertEquals(1, this.ledger.getChain().size());
        final Block genesis = this.ledger.getChain().get(0);
        Assert.assertEquals(0, genesis.getIndex());
        Assert.assertEquals(Block.GENESIS_PREVIOUS_HASH, genesis.getPreviousHash());
        Assert.assertEquals(CanonicalizationAlgorithm.CUSTOM, genesis.getAlgorithm());
        Assert.assertEquals("7dd296acc1fbaa4b4eca2b29d112965604e5d6a7969a5eb992178c2873766e10",
                genesis.getCanonicalHash().toHex());
        Assert.assertEquals(PC.blockGraph(0), genesis.getGraphRef());
        Assert.assertTrue(this.ledger.validateChain().isValid());
    }

    @Test
    public void testChainIntegrity() throws Exception {
        final Block first = this.ledger.addBlock(HARVEST);
        final Block second = this.ledger.addBlock(SHIPMENT);

        Assert.assertEquals(1, first.getIndex());
        Assert.assertEquals(CanonicalizationAlgorithm.CUSTOM, first.getAlgorithm());
        Assert.assertEquals(CanonicalizationAlgorithm.STANDARD, second.getAlgorithm());
        final List<Block> blocks = this.ledger.getChain().getBlocks();
        for (int i = 1; i < blocks.size(); ++i) {
            Assert.assertEquals(blocks.get(i - 1).getBlockHash(), blocks.get(i)
                    .getPreviousHash());
            Assert.assertEquals(Block.computeHash(i, blocks.get(i).getTimestamp(), blocks.get(i)
                    .getCanonicalHash(), blocks.get(i).getPreviousHash()), blocks.get(i)
                    .getBlockHash());
        }

        final ValidationReport report = this.ledger.validateChain(ValidationMode.COLLECT_ALL);
        Assert.assertTrue(report.toString(), report.isValid());
        Assert.assertEquals(3, report.getCheckedBlocks());
    }

    @Test
    public void testCorruptedGraphDetected() throws Exception {
        this.ledger.addBlock(HARVEST);
        this.ledger.addBlock(SHIPMENT);
        corrupt(this.ledger, 1);

        final ValidationReport report = this.ledger.validateChain(ValidationMode.COLLECT_ALL);
        Assert.assertFalse(report.isValid());
        Assert.assertEquals(3, report.getCheckedBlocks());
        Assert.assertEquals(1, report.getFindings().size());
        final ValidationReport.Finding finding = report.getFindings().get(0);
        Assert.assertEquals(1, finding.getIndex());
        Assert.assertTrue(finding.getException() instanceof IntegrityException);
        Assert.assertEquals(IntegrityException.Kind.CANONICAL_HASH,
                ((IntegrityException) finding.getException()).getKind());
    }

    @Test
    public void testFailFast() throws Exception {
        this.ledger.addBlock(HARVEST);
        this.ledger.addBlock(SHIPMENT);
        corrupt(this.ledger, 1);
        corrupt(this.ledger, 2);

        final ValidationReport all = this.ledger.validateChain(ValidationMode.COLLECT_ALL);
        Assert.assertEquals(2, all.getFindings().size());
        Assert.assertEquals(1, all.getFindings().get(0).getIndex());
        Assert.assertEquals(2, all.getFindings().get(1).getIndex());

        final ValidationReport first = this.ledger.validateChain(ValidationMode.FAIL_FAST);
        Assert.assertEquals(1, first.getFindings().size());
        Assert.assertEquals(1, first.getFindings().get(0).getIndex());
        Assert.assertEquals(2, first.getCheckedBlocks());
    }

    @Test
    public void testRelabeledGraphStillValid() throws Exception {
        final Block block = this.ledger.addBlock(SHIPMENT);
        final ValueFactory vf = Data.getValueFactory();
        final Map<BNode, BNode> renaming = Maps.newHashMap();
        final List<Statement> relabeled = Lists.newArrayList();
        final NamedGraph graph = this.ledger.getGraphStore().getGraph(block.getGraphRef());
        for (final Statement statement : graph) {
            relabeled.add(vf.createStatement(
                    (Resource) rename(statement.getSubject(), renaming),
                    statement.getPredicate(), rename(statement.getObject(), renaming)));
        }
        this.ledger.getGraphStore().storeGraph(block.getGraphRef(), relabeled);
        Assert.assertTrue(this.ledger.validateChain().isValid());
    }

    private static Value rename(final Value value, final Map<BNode, BNode> renaming) {
        if (!(value instanceof BNode)) {
            return value;
        }
        BNode renamed = renaming.get(value);
        if (renamed == null) {
            renamed = Data.getValueFactory().createBNode("renamed" + renaming.size());
            renaming.put((BNode) value, renamed);
        }
        return renamed;
    }

    @Test
    public void testAppendRejectsBrokenLink() throws Exception {
        final Block last = this.ledger.getChain().getLast();
        final Block skipping = this.ledger.createBlock(2, HARVEST, last.getBlockHash());
        try {
            this.ledger.appendBlock(skipping);
            Assert.fail();
        } catch (final ChainLinkException ex) {
            Assert.assertEquals(2, ex.getIndex());
        }
        Assert.assertTrue(this.ledger.getGraphStore().getGraph(PC.blockGraph(2)).isEmpty());

        final Block unlinked = this.ledger.createBlock(1, HARVEST, Block.GENESIS_PREVIOUS_HASH);
        try {
            this.ledger.appendBlock(unlinked);
            Assert.fail();
        } catch (final ChainLinkException ex) {
            Assert.assertEquals(last.getBlockHash(), ex.getExpectedHash());
        }
        Assert.assertEquals(1, this.ledger.getChain().size());

        this.ledger.appendBlock(this.ledger.createBlock(1, HARVEST, last.getBlockHash()));
        Assert.assertEquals(2, this.ledger.getChain().size());
    }

    @Test
    public void testCreateBlockLeavesAppendedBlocksUntouched() throws Exception {
        final Block first = this.ledger.addBlock(HARVEST);
        this.ledger.addBlock(SHIPMENT);
        final NamedGraph stored = this.ledger.getGraphStore().getGraph(first.getGraphRef());

        final Block stale = this.ledger.createBlock(1, PREFIX + "ex:a ex:p ex:b .", "deadbeef");
        Assert.assertEquals(first.getGraphRef(), stale.getGraphRef());
        Assert.assertEquals(stored, this.ledger.getGraphStore().getGraph(first.getGraphRef()));
        Assert.assertTrue(this.ledger.validateChain().isValid());

        try {
            this.ledger.appendBlock(stale);
            Assert.fail();
        } catch (final ChainLinkException ex) {
            Assert.assertEquals(1, ex.getIndex());
        }
        Assert.assertTrue(this.ledger.validateChain().isValid());
    }

    @Test
    public void testCompetingCandidatesForSameIndex() throws Exception {
        final String head = this.ledger.getChain().getLast().getBlockHash();
        final Block mine = this.ledger.createBlock(1, HARVEST, head);
        final Block other = this.ledger.createBlock(1, PREFIX + "ex:a ex:p ex:b .", head);

        this.ledger.appendBlock(mine);
        try {
            this.ledger.appendBlock(other);
            Assert.fail();
        } catch (final ChainLinkException ex) {
            Assert.assertEquals(1, ex.getIndex());
        }

        Assert.assertEquals(2, this.ledger.getChain().size());
        Assert.assertEquals(mine, this.ledger.getChain().getLast());
        Assert.assertEquals(mine.getCanonicalHash(),
                this.ledger.canonicalHashOf(mine.getGraphRef()));
        Assert.assertTrue(this.ledger.validateChain().isValid());
    }

    @Test
    public void testAppendRejectsForeignBlock() throws Exception {
        final Block last = this.ledger.getChain().getLast();
        final Block foreign = Block.create(1, Data.newTimestamp(), PC.blockGraph(1),
                last.getBlockHash(), last.getCanonicalHash(), last.getAlgorithm());
        try {
            this.ledger.appendBlock(foreign);
            Assert.fail();
        } catch (final IllegalArgumentException ex) {
            // expected
        }
        Assert.assertEquals(1, this.ledger.getChain().size());
        Assert.assertTrue(this.ledger.getGraphStore().getGraph(PC.blockGraph(1)).isEmpty());
    }

    @Test
    public void testLiteralSwapUnderCustomAlgorithmGoesUndetected() throws Exception {
        final Block block = this.ledger.addBlock(PREFIX //
                + "_:a ex:p \"1\" ; ex:q \"2\" .\n" //
                + "_:b ex:p \"2\" ; ex:q \"1\" .");
        Assert.assertEquals(CanonicalizationAlgorithm.CUSTOM, block.getAlgorithm());
        this.ledger.getGraphStore().storeGraph(block.getGraphRef(), RDFUtil.parseTurtle(PREFIX //
                + "_:a ex:p \"1\" ; ex:q \"1\" .\n" //
                + "_:b ex:p \"2\" ; ex:q \"2\" ."));
        Assert.assertTrue(this.ledger.validateChain().isValid());
    }

    @Test(expected = SerializationException.class)
    public void testMalformedPayload() throws Exception {
        this.ledger.addBlock(PREFIX + "ex:batch1 ex:weight .");
    }

    @Test
    public void testCanonicalHashOf() throws Exception {
        final Block block = this.ledger.addBlock(SHIPMENT);
        Assert.assertEquals(block.getCanonicalHash(),
                this.ledger.canonicalHashOf(block.getGraphRef()));
    }

    @Test
    public void testTimeoutAbortsBlockCreation() throws Exception {
        final Ledger limited = Ledger.builder(new RepositoryTripleStore()).maxIterations(2L)
                .build();
        try {
            limited.init();
            try {
                limited.addBlock(PREFIX //
                        + "_:a ex:p _:b .\n" //
                        + "_:b ex:p _:c .\n" //
                        + "_:c ex:p _:d .\n" //
                        + "_:d ex:p _:a .");
                Assert.fail();
            } catch (final CanonicalizationTimeoutException ex) {
                Assert.assertEquals(PC.blockGraph(1), ex.getGraphID());
            }
            Assert.assertEquals(1, limited.getChain().size());
            Assert.assertTrue(limited.getGraphStore().getGraph(PC.blockGraph(1)).isEmpty());
            Assert.assertNotNull(limited.addBlock(HARVEST));
        } finally {
            limited.close();
        }
    }

    @Test
    public void testConcurrentAppends() throws Exception {
        final List<Future<Block>> futures = Lists.newArrayList();
        for (int i = 0; i < 8; ++i) {
            final int batch = i;
            futures.add(this.executor.submit(new Callable<Block>() {

                @Override
                public Block call() throws Exception {
                    return LedgerTest.this.ledger.addBlock(PREFIX + "ex:batch" + batch
                            + " ex:producedBy _:farm .\n_:farm ex:name \"Farm " + batch + "\" .");
                }

            }));
        }
        for (final Future<Block> future : futures) {
            Assert.assertNotNull(future.get());
        }
        Assert.assertEquals(9, this.ledger.getChain().size());
        Assert.assertTrue(this.ledger.validateChain().isValid());
    }

    @Test(expected = IllegalStateException.class)
    public void testClosed() throws Exception {
        this.ledger.close();
        this.ledger.addBlock(HARVEST);
    }

}
