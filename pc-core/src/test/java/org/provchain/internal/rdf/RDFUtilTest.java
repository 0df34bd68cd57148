package org.provchain.internal.rdf;

import java.util.List;

import org.junit.Assert;
import org.junit.Test;
import org.openrdf.model.BNode;
import org.openrdf.model.Literal;
import org.openrdf.model.Statement;
import org.openrdf.rio.RDFFormat;

import org.provchain.SerializationException;

public class RDFUtilTest {

    @Test
    public void testParseTurtle() throws Exception {
        final List<Statement> statements = RDFUtil.parseTurtle("" //
                + "@prefix ex: <http://example.org/> .\n" //
                + "ex:batch1 ex:producedBy _:farm ; ex:weight 12 .\n" //
                + "_:farm ex:name \"Green Acres\"@en .");
        Assert.assertEquals(3, statements.size());
        Assert.assertEquals("http://example.org/batch1", statements.get(0).getSubject()
                .stringValue());
        Assert.assertTrue(statements.get(0).getObject() instanceof BNode);
        Assert.assertEquals("farm", ((BNode) statements.get(2).getSubject()).getID());
        Assert.assertEquals("en", ((Literal) statements.get(2).getObject()).getLanguage());
    }

    @Test
    public void testParseNTriples() throws Exception {
        final List<Statement> statements = RDFUtil.parse(
                "<http://example.org/a> <http://example.org/p> \"v\" .\n", RDFFormat.NTRIPLES,
                null);
        Assert.assertEquals(1, statements.size());
    }

    @Test
    public void testEmptyPayload() throws Exception {
        Assert.assertTrue(RDFUtil.parseTurtle("").isEmpty());
    }

    @Test(expected = SerializationException.class)
    public void testSyntaxError() throws Exception {
        RDFUtil.parseTurtle("<http://example.org/a> <http://example.org/p> .");
    }

    @Test(expected = SerializationException.class)
    public void testUndefinedPrefix() throws Exception {
        RDFUtil.parseTurtle("ex:a ex:p ex:b .");
    }

}
