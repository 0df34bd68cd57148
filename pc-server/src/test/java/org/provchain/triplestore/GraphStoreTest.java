package org.provchain.triplestore;

import java.io.IOException;
import java.util.NoSuchElementException;

import com.google.common.collect.ImmutableList;

import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;
import org.openrdf.model.Resource;
import org.openrdf.model.Statement;
import org.openrdf.model.URI;
import org.openrdf.model.Value;

import info.aduna.iteration.CloseableIteration;
import info.aduna.iteration.CloseableIterationBase;

import org.provchain.StoreException;

import org.provchain.canon.Canonicalizer;
import org.provchain.data.NamedGraph;
import org.provchain.internal.rdf.RDFUtil;
import org.provchain.vocabulary.PC;

public class GraphStoreTest {

    private static final String PAYLOAD = "" //
            + "@prefix ex: <http://example.org/> .\n" //
            + "ex:batch1 ex:producedBy _:farm ; ex:weight 12 .\n" //
            + "_:farm ex:name \"Green Acres\"@en ; ex:certifiedBy _:body .\n" //
            + "_:body ex:name \"Organic Board\" .";

    private TripleStore tripleStore;

    private GraphStore graphStore;

    @Before
    public void setUp() throws Exception {
        this.tripleStore = new RepositoryTripleStore();
        this.tripleStore.init();
        this.graphStore = new GraphStore(this.tripleStore);
    }

    @After
    public void tearDown() {
        this.tripleStore.close();
    }

    @Test
    public void testMissingGraphIsEmpty() throws Exception {
        final NamedGraph graph = this.graphStore.getGraph(PC.blockGraph(7));
        Assert.assertTrue(graph.isEmpty());
        Assert.assertEquals(PC.blockGraph(7), graph.getID());
    }

    @Test
    public void testStoreReplacesContent() throws Exception {
        this.graphStore.storeGraph(PC.blockGraph(1), RDFUtil.parseTurtle(PAYLOAD));
        this.graphStore.storeGraph(PC.blockGraph(2), RDFUtil.parseTurtle(PAYLOAD));
        Assert.assertEquals(5, this.graphStore.getGraph(PC.blockGraph(1)).size());

        this.graphStore.storeGraph(PC.blockGraph(1), RDFUtil
                .parseTurtle("<http://example.org/a> <http://example.org/p> \"v\" ."));
        final NamedGraph replaced = this.graphStore.getGraph(PC.blockGraph(1));
        Assert.assertEquals(1, replaced.size());
        Assert.assertNull(replaced.iterator().next().getContext());
        Assert.assertEquals(5, this.graphStore.getGraph(PC.blockGraph(2)).size());

        this.graphStore.storeGraph(PC.blockGraph(1), ImmutableList.<Statement>of());
        Assert.assertTrue(this.graphStore.getGraph(PC.blockGraph(1)).isEmpty());
    }

    @Test
    public void testAddToGraph() throws Exception {
        this.graphStore.addToGraph(PC.BLOCKCHAIN, RDFUtil
                .parseTurtle("<http://example.org/a> <http://example.org/p> \"1\" ."));
        this.graphStore.addToGraph(PC.BLOCKCHAIN, RDFUtil
                .parseTurtle("<http://example.org/a> <http://example.org/p> \"2\" ."));
        Assert.assertEquals(2, this.graphStore.getGraph(PC.BLOCKCHAIN).size());
    }

    @Test
    public void testStoredGraphKeepsCanonicalHash() throws Exception {
        final NamedGraph original = NamedGraph.create(PC.blockGraph(1),
                RDFUtil.parseTurtle(PAYLOAD));
        this.graphStore.storeGraph(original.getID(), original);
        final Canonicalizer canonicalizer = Canonicalizer.builder().cacheSize(0).build();
        Assert.assertEquals(canonicalizer.canonicalize(original),
                canonicalizer.canonicalize(this.graphStore.getGraph(original.getID())));
    }

    @Test
    public void testIterationFailureReported() throws Exception {
        this.graphStore.storeGraph(PC.blockGraph(1), RDFUtil.parseTurtle(PAYLOAD));
        final GraphStore failing = new GraphStore(new FailingTripleStore(this.tripleStore));
        try {
            failing.getGraph(PC.blockGraph(1));
            Assert.fail();
        } catch (final StoreException ex) {
            Assert.assertTrue(ex.getCause() instanceof IOException);
            Assert.assertEquals("Disk gone", ex.getCause().getCause().getMessage());
        }
        Assert.assertEquals(5, this.graphStore.getGraph(PC.blockGraph(1)).size());
    }

    private static final class FailingTripleStore implements TripleStore {

        private final TripleStore delegate;

        FailingTripleStore(final TripleStore delegate) {
            this.delegate = delegate;
        }

        @Override
        public void init() {
        }

        @Override
        public TripleTransaction begin(final boolean readOnly) throws IOException {
            final TripleTransaction transaction = this.delegate.begin(readOnly);
            return new ForwardingTripleTransaction() {

                @Override
                protected TripleTransaction delegate() {
                    return transaction;
                }

                @Override
                public CloseableIteration<? extends Statement, ? extends Exception> get(
                        final Resource subject, final URI predicate, final Value object,
                        final Resource context) {
                    return new CloseableIterationBase<Statement, Exception>() {

                        @Override
                        public boolean hasNext() throws Exception {
                            throw new Exception("Disk gone");
                        }

                        @Override
                        public Statement next() {
                            throw new NoSuchElementException();
                        }

                        @Override
                        public void remove() {
                            throw new UnsupportedOperationException();
                        }

                    };
                }

            };
        }

        @Override
        public void reset() throws IOException {
            this.delegate.reset();
        }

        @Override
        public void close() {
        }

    }

}
