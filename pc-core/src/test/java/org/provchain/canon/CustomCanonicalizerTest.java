package org.provchain.canon;

import java.util.List;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

import org.junit.Assert;
import org.junit.Test;
import org.openrdf.model.Statement;

import org.provchain.SerializationException;
import org.provchain.data.Data;
import org.provchain.data.NamedGraph;
import org.provchain.vocabulary.PC;

public class CustomCanonicalizerTest {

    private final CustomCanonicalizer canonicalizer = new CustomCanonicalizer();

    @Test
    public void testEmptyGraph() throws Exception {
        Assert.assertEquals("e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855",
                this.canonicalizer.canonicalize(NamedGraph.create(PC.blockGraph(0))).toHex());
    }

    @Test
    public void testRelabelingInvariance() throws Exception {
        final NamedGraph first = GraphClassifierTest.graph("" //
                + "ex:batch1 ex:producedBy _:farm .\n" //
                + "_:farm ex:name \"Green Acres\" .\n" //
                + "_:farm ex:location _:loc .\n" //
                + "_:loc ex:city \"Springfield\" .");
        final NamedGraph second = GraphClassifierTest.graph("" //
                + "ex:batch1 ex:producedBy _:n1 .\n" //
                + "_:n1 ex:name \"Green Acres\" .\n" //
                + "_:n1 ex:location _:n2 .\n" //
                + "_:n2 ex:city \"Springfield\" .");
        Assert.assertEquals(this.canonicalizer.canonicalize(first),
                this.canonicalizer.canonicalize(second));
    }

    @Test
    public void testStatementOrderInvariance() throws Exception {
        final NamedGraph graph = GraphClassifierTest.graph("" //
                + "_:b ex:name \"Alice\" .\n" //
                + "_:b ex:age 42 .\n" //
                + "ex:doc ex:author _:b .");
        final List<Statement> reversed = Lists.reverse(ImmutableList.copyOf(graph));
        Assert.assertEquals(this.canonicalizer.canonicalize(graph),
                this.canonicalizer.canonicalize(NamedGraph.create(graph.getID(), reversed)));
    }

    @Test
    public void testDiscrimination() throws Exception {
        final CanonicalHash alice = this.canonicalizer.canonicalize(GraphClassifierTest
                .graph("_:b ex:name \"Alice\" ."));
        final CanonicalHash bob = this.canonicalizer.canonicalize(GraphClassifierTest
                .graph("_:b ex:name \"Bob\" ."));
        final CanonicalHash iri = this.canonicalizer.canonicalize(GraphClassifierTest
                .graph("ex:b ex:name \"Alice\" ."));
        Assert.assertNotEquals(alice, bob);
        Assert.assertNotEquals(alice, iri);
    }

    @Test
    public void testNeighborsAreFolded() throws Exception {
        final CanonicalHash first = this.canonicalizer.canonicalize(GraphClassifierTest.graph("" //
                + "ex:doc ex:author _:b .\n" //
                + "_:b ex:name \"Alice\" .\n" //
                + "ex:doc2 ex:author _:c .\n" //
                + "_:c ex:name \"Bob\" ."));
        final CanonicalHash second = this.canonicalizer.canonicalize(GraphClassifierTest.graph("" //
                + "ex:doc ex:author _:b .\n" //
                + "_:b ex:name \"Bob\" .\n" //
                + "ex:doc2 ex:author _:c .\n" //
                + "_:c ex:name \"Alice\" ."));
        Assert.assertNotEquals(first, second);
    }

    @Test
    public void testLiteralSwapBetweenUnlinkedBlankNodesIsNotDetected() throws Exception {
        // blank nodes reachable only as subjects carry no context from other statements
        final CanonicalHash first = this.canonicalizer.canonicalize(GraphClassifierTest.graph("" //
                + "_:x ex:name \"A\" .\n" //
                + "_:x ex:age 1 .\n" //
                + "_:y ex:name \"B\" .\n" //
                + "_:y ex:age 2 ."));
        final CanonicalHash second = this.canonicalizer.canonicalize(GraphClassifierTest.graph("" //
                + "_:x ex:name \"A\" .\n" //
                + "_:x ex:age 2 .\n" //
                + "_:y ex:name \"B\" .\n" //
                + "_:y ex:age 1 ."));
        Assert.assertEquals(first, second);
    }

    @Test
    public void testFoldKeepsDuplicateNeighbors() {
        final String own = CanonicalHash.sha256Hex("own");
        final String neighbor = CanonicalHash.sha256Hex("neighbor");
        Assert.assertEquals(own, CustomCanonicalizer.fold(own, ImmutableList.<String>of()));
        Assert.assertNotEquals(CustomCanonicalizer.fold(own, ImmutableList.of(neighbor)),
                CustomCanonicalizer.fold(own, ImmutableList.of(neighbor, neighbor)));
        Assert.assertEquals(
                CustomCanonicalizer.fold(own, ImmutableList.of(neighbor, own)),
                CustomCanonicalizer.fold(own, ImmutableList.of(own, neighbor)));
    }

    @Test(expected = SerializationException.class)
    public void testMalformedIRI() throws Exception {
        final Statement statement = Data.getValueFactory().createStatement(
                Data.getValueFactory().createURI("http://example.org/a b"),
                Data.getValueFactory().createURI("http://example.org/p"),
                Data.getValueFactory().createLiteral("v"));
        this.canonicalizer.canonicalize(NamedGraph.create(PC.blockGraph(1), statement));
    }

}
