package org.provchain.canon;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import org.provchain.CanonicalizationTimeoutException;
import org.provchain.data.NamedGraph;

public class CanonicalizerTest {

    private ExecutorService executor;

    private Canonicalizer canonicalizer;

    @Before
    public void setUp() {
        this.executor = Executors.newFixedThreadPool(2);
        this.canonicalizer = Canonicalizer.builder().executor(this.executor).build();
    }

    @After
    public void tearDown() {
        this.executor.shutdownNow();
    }

    @Test
    public void testGroundGraphIsSimpleAndStable() throws Exception {
        final NamedGraph graph = GraphClassifierTest.graph("ex:a ex:p ex:b .");
        Assert.assertEquals(ComplexityTier.SIMPLE, GraphClassifier.classify(graph));
        final CanonicalizationResult first = this.canonicalizer.canonicalize(graph);
        final CanonicalizationResult second = Canonicalizer.builder().cacheSize(0).build()
                .canonicalize(graph);
        Assert.assertEquals(first.getHash(), second.getHash());
        Assert.assertEquals(CanonicalizationAlgorithm.CUSTOM, first.getAlgorithm());
        Assert.assertEquals(ComplexityTier.SIMPLE, first.getTier());
    }

    @Test
    public void testRenamedBlankNodeKeepsHash() throws Exception {
        final CanonicalizationResult x = this.canonicalizer.canonicalize(GraphClassifierTest
                .graph("_:x ex:p \"v\" ."));
        final CanonicalizationResult y = this.canonicalizer.canonicalize(GraphClassifierTest
                .graph("_:y ex:p \"v\" ."));
        Assert.assertEquals(x.getHash(), y.getHash());
        Assert.assertEquals(ComplexityTier.MODERATE, x.getTier());
    }

    @Test
    public void testMutualLinksUseStandardAlgorithm() throws Exception {
        final NamedGraph graph = GraphClassifierTest.graph("" //
                + "_:x ex:knows _:y .\n" //
                + "_:y ex:knows _:x .");
        final NamedGraph swapped = GraphClassifierTest.graph("" //
                + "_:y ex:knows _:x .\n" //
                + "_:x ex:knows _:y .");
        Assert.assertEquals(ComplexityTier.PATHOLOGICAL, GraphClassifier.classify(graph));
        final CanonicalizationResult first = this.canonicalizer.canonicalize(graph);
        final CanonicalizationResult second = this.canonicalizer.canonicalize(swapped);
        Assert.assertEquals(CanonicalizationAlgorithm.STANDARD, first.getAlgorithm());
        Assert.assertEquals(first.getHash(), second.getHash());
    }

    @Test
    public void testForcedAlgorithm() throws Exception {
        final NamedGraph graph = GraphClassifierTest.graph("_:x ex:p \"v\" .");
        final CanonicalizationResult standard = this.canonicalizer.canonicalize(graph,
                CanonicalizationAlgorithm.STANDARD);
        Assert.assertEquals(CanonicalizationAlgorithm.STANDARD, standard.getAlgorithm());
        Assert.assertEquals(ComplexityTier.MODERATE, standard.getTier());
        Assert.assertNotEquals(this.canonicalizer.canonicalize(graph).getHash(),
                standard.getHash());
    }

    @Test
    public void testNoFallbackOnTimeout() throws Exception {
        final Canonicalizer bounded = Canonicalizer.builder().maxIterations(2L).build();
        try {
            bounded.canonicalize(GraphClassifierTest.graph("" //
                    + "_:a ex:p _:b .\n" //
                    + "_:b ex:p _:c .\n" //
                    + "_:c ex:p _:a ."));
            Assert.fail("Expected timeout");
        } catch (final CanonicalizationTimeoutException ex) {
            Assert.assertNotNull(ex.getGraphID());
        }
    }

    @Test
    public void testCache() throws Exception {
        final NamedGraph graph = GraphClassifierTest.graph("_:x ex:p \"v\" .");
        this.canonicalizer.canonicalize(graph);
        this.canonicalizer.canonicalize(graph);
        this.canonicalizer.canonicalize(graph, CanonicalizationAlgorithm.STANDARD);
        Assert.assertEquals(1, this.canonicalizer.getCacheStats().hitCount());
        Assert.assertEquals(2, this.canonicalizer.getCacheStats().missCount());
        this.canonicalizer.invalidateCache();
        this.canonicalizer.canonicalize(graph);
        Assert.assertEquals(3, this.canonicalizer.getCacheStats().missCount());
    }

    @Test
    public void testAsync() throws Exception {
        final NamedGraph graph = GraphClassifierTest.graph("" //
                + "_:x ex:knows _:y .\n" //
                + "_:y ex:knows _:x .");
        Assert.assertEquals(this.canonicalizer.canonicalize(graph),
                this.canonicalizer.canonicalizeAsync(graph).get());
        Assert.assertEquals(CanonicalizationAlgorithm.CUSTOM, this.canonicalizer
                .canonicalizeAsync(graph, CanonicalizationAlgorithm.CUSTOM).get().getAlgorithm());
    }

    @Test
    public void testAsyncTimeout() throws Exception {
        final Canonicalizer bounded = Canonicalizer.builder().maxIterations(1L)
                .executor(this.executor).build();
        try {
            bounded.canonicalizeAsync(GraphClassifierTest.graph("" //
                    + "_:x ex:knows _:y .\n" //
                    + "_:y ex:knows _:x .")).get();
            Assert.fail("Expected timeout");
        } catch (final ExecutionException ex) {
            Assert.assertTrue(ex.getCause() instanceof CanonicalizationTimeoutException);
        }
    }

    @Test
    public void testConsistency() throws Exception {
        Assert.assertEquals(1, this.canonicalizer.checkConsistency(GraphClassifierTest.graph("" //
                + "_:a ex:p _:b .\n" //
                + "_:b ex:p _:c .\n" //
                + "_:c ex:p _:d .\n" //
                + "_:d ex:p _:a ."), 5));
        Assert.assertEquals(1, this.canonicalizer.checkConsistency(
                GraphClassifierTest.graph("_:x ex:p \"v\" ."), 3));
    }

}
