package org.provchain.canon;

import java.util.regex.Pattern;

import javax.annotation.Nullable;

import com.google.common.base.Function;

import org.openrdf.model.BNode;
import org.openrdf.model.Literal;
import org.openrdf.model.Statement;
import org.openrdf.model.URI;
import org.openrdf.model.Value;
import org.openrdf.model.vocabulary.XMLSchema;

import org.provchain.SerializationException;

/**
 * Canonical N-Triples rendering of RDF terms and statements.
 * <p>
 * IRIs are rendered as {@code <iri>} and must be absolute and free of characters not allowed in
 * an N-Triples IRIREF. Literals are rendered between double quotes, escaping only {@code "},
 * {@code \}, line feed and carriage return; the language tag (lowercased) or the datatype follow,
 * with {@code xsd:string} never written. Blank nodes are rendered as {@code _:id}, unless a
 * labeling function is supplied, whose result is written verbatim in their place.
 * </p>
 */
public final class CanonicalForm {

    private static final Pattern SCHEME_PATTERN = Pattern.compile("^[A-Za-z][A-Za-z0-9+.\\-]*:");

    private static final Pattern LANGUAGE_PATTERN = Pattern
            .compile("^[A-Za-z]{1,8}(-[A-Za-z0-9]{1,8})*$");

    /**
     * Renders an RDF term in canonical form, writing blank nodes with their own identifiers.
     *
     * @param value
     *            the term
     * @return the rendered term
     * @throws SerializationException
     *             if the term is malformed
     */
    public static String format(final Value value) throws SerializationException {
        return format(value, null);
    }

    /**
     * Renders an RDF term in canonical form, writing blank nodes as returned by the labeling
     * function supplied.
     *
     * @param value
     *            the term
     * @param labeler
     *            the blank node labeling function, null to use {@code _:id}
     * @return the rendered term
     * @throws SerializationException
     *             if the term is malformed
     */
    public static String format(final Value value,
            @Nullable final Function<? super BNode, String> labeler)
            throws SerializationException {
        final StringBuilder builder = new StringBuilder();
        append(value, labeler, builder);
        return builder.toString();
    }

    /**
     * Renders a statement as a canonical N-Triples line, terminated by {@code " .\n"}.
     *
     * @param statement
     *            the statement; its context, if any, is ignored
     * @param labeler
     *            the blank node labeling function, null to use {@code _:id}
     * @return the rendered line
     * @throws SerializationException
     *             if some term is malformed
     */
    public static String formatLine(final Statement statement,
            @Nullable final Function<? super BNode, String> labeler)
            throws SerializationException {
        final StringBuilder builder = new StringBuilder();
        append(statement.getSubject(), labeler, builder);
        builder.append(' ');
        append(statement.getPredicate(), labeler, builder);
        builder.append(' ');
        append(statement.getObject(), labeler, builder);
        builder.append(" .\n");
        return builder.toString();
    }

    private static void append(final Value value,
            @Nullable final Function<? super BNode, String> labeler, final StringBuilder builder)
            throws SerializationException {

        if (value instanceof URI) {
            appendIRI(value.stringValue(), builder);

        } else if (value instanceof BNode) {
            final BNode bnode = (BNode) value;
            if (labeler != null) {
                builder.append(labeler.apply(bnode));
            } else {
                builder.append("_:").append(bnode.getID());
            }

        } else if (value instanceof Literal) {
            final Literal literal = (Literal) value;
            builder.append('"');
            appendEscaped(literal.getLabel(), builder);
            builder.append('"');
            final String language = literal.getLanguage();
            final URI datatype = literal.getDatatype();
            if (language != null) {
                if (!LANGUAGE_PATTERN.matcher(language).matches()) {
                    throw new SerializationException("Malformed language tag: " + language);
                }
                builder.append('@').append(language.toLowerCase());
            } else if (datatype != null && !XMLSchema.STRING.equals(datatype)) {
                builder.append("^^");
                appendIRI(datatype.stringValue(), builder);
            }

        } else {
            throw new SerializationException("Unsupported RDF term: " + value);
        }
    }

    private static void appendIRI(final String iri, final StringBuilder builder)
            throws SerializationException {
        if (!SCHEME_PATTERN.matcher(iri).find()) {
            throw new SerializationException("Relative or malformed IRI: " + iri);
        }
        for (int i = 0; i < iri.length(); ++i) {
            final char c = iri.charAt(i);
            if (c <= 0x20 || c == '<' || c == '>' || c == '"' || c == '{' || c == '}'
                    || c == '|' || c == '^' || c == '`' || c == '\\') {
                throw new SerializationException("Illegal character 0x"
                        + Integer.toHexString(c) + " in IRI: " + iri);
            }
        }
        builder.append('<').append(iri).append('>');
    }

    private static void appendEscaped(final String label, final StringBuilder builder) {
        for (int i = 0; i < label.length(); ++i) {
            final char c = label.charAt(i);
            switch (c) {
            case '"':
                builder.append("\\\"");
                break;
            case '\\':
                builder.append("\\\\");
                break;
            case '\n':
                builder.append("\\n");
                break;
            case '\r':
                builder.append("\\r");
                break;
            default:
                builder.append(c);
            }
        }
    }

    private CanonicalForm() {
    }

}
