package org.provchain.internal.rdf;

import java.io.IOException;
import java.io.StringReader;
import java.util.List;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

import org.openrdf.model.Statement;
import org.openrdf.rio.ParserConfig;
import org.openrdf.rio.RDFFormat;
import org.openrdf.rio.RDFHandlerException;
import org.openrdf.rio.RDFParseException;
import org.openrdf.rio.RDFParser;
import org.openrdf.rio.Rio;
import org.openrdf.rio.UnsupportedRDFormatException;
import org.openrdf.rio.helpers.BasicParserSettings;
import org.openrdf.rio.helpers.NTriplesParserSettings;
import org.openrdf.rio.helpers.StatementCollector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.provchain.SerializationException;
import org.provchain.data.Data;

public final class RDFUtil {

    private static final Logger LOGGER = LoggerFactory.getLogger(RDFUtil.class);

    /**
     * Parses a Turtle document into a list of context-free statements.
     *
     * @param text
     *            the Turtle text
     * @return the parsed statements, in document order
     * @throws SerializationException
     *             if the text is not valid Turtle
     */
    public static List<Statement> parseTurtle(final String text) throws SerializationException {
        return parse(text, RDFFormat.TURTLE, null);
    }

    /**
     * Parses an RDF document in the format specified into a list of statements. Blank node
     * identifiers of the document are preserved. Relative IRIs are resolved against the base
     * specified, if any, and rejected otherwise.
     *
     * @param text
     *            the document text
     * @param format
     *            the RDF format, a triple format such as Turtle or N-Triples
     * @param base
     *            the base IRI, possibly null
     * @return the parsed statements, in document order
     * @throws SerializationException
     *             if the document cannot be parsed
     */
    public static List<Statement> parse(final String text, final RDFFormat format,
            @Nullable final String base) throws SerializationException {

        Preconditions.checkNotNull(text);
        Preconditions.checkNotNull(format);

        final RDFParser parser;
        try {
            parser = Rio.createParser(format);
        } catch (final UnsupportedRDFormatException ex) {
            throw new IllegalArgumentException("No parser available for " + format, ex);
        }
        parser.setValueFactory(Data.getValueFactory());

        final ParserConfig config = parser.getParserConfig();
        config.set(BasicParserSettings.FAIL_ON_UNKNOWN_DATATYPES, false);
        config.set(BasicParserSettings.FAIL_ON_UNKNOWN_LANGUAGES, false);
        config.set(BasicParserSettings.VERIFY_DATATYPE_VALUES, false);
        config.set(BasicParserSettings.VERIFY_LANGUAGE_TAGS, true);
        config.set(BasicParserSettings.VERIFY_RELATIVE_URIS, true);
        config.set(BasicParserSettings.NORMALIZE_DATATYPE_VALUES, false);
        config.set(BasicParserSettings.PRESERVE_BNODE_IDS, true);
        if (format.equals(RDFFormat.NTRIPLES)) {
            config.set(NTriplesParserSettings.FAIL_ON_NTRIPLES_INVALID_LINES, true);
        }

        final List<Statement> statements = Lists.newArrayList();
        parser.setRDFHandler(new StatementCollector(statements));

        try {
            parser.parse(new StringReader(text), Strings.nullToEmpty(base));
        } catch (final RDFParseException ex) {
            throw new SerializationException("Invalid " + format.getName() + " payload: "
                    + ex.getMessage(), ex);
        } catch (final RDFHandlerException | IOException ex) {
            // reading from a string and collecting into a list should never fail
            throw new SerializationException("Could not read " + format.getName()
                    + " payload: " + ex.getMessage(), ex);
        } catch (final RuntimeException ex) {
            // Sesame parsers may report malformed IRIs as IllegalArgumentException
            throw new SerializationException("Invalid " + format.getName() + " payload: "
                    + ex.getMessage(), ex);
        }

        LOGGER.debug("Parsed {} statements from {} payload", statements.size(),
                format.getName());
        return ImmutableList.copyOf(statements);
    }

    private RDFUtil() {
    }

}
