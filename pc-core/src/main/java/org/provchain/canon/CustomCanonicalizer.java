package org.provchain.canon;

import java.util.Collections;
import java.util.List;
import java.util.Map;

import com.google.common.base.Function;
import com.google.common.base.Joiner;
import com.google.common.collect.HashMultimap;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.collect.SetMultimap;

import org.openrdf.model.BNode;
import org.openrdf.model.Statement;

import org.provchain.SerializationException;
import org.provchain.data.NamedGraph;

/**
 * Hash-folding canonicalization, linear in the number of statements.
 * <p>
 * Each statement is hashed over its canonical N-Triples terms, with a blank subject written as
 * {@code Magic_S} and a blank object as {@code Magic_O}. Statements with a blank subject
 * {@code b} then fold in the hashes of the other statements having {@code b} as object, and
 * statements with a blank object {@code b} fold in the hashes of the other statements having
 * {@code b} as subject. Folding concatenates the statement own hex hash with the sorted hex
 * hashes of its neighbors, and hashes the result. The graph hash is the SHA-256 of the sorted
 * concatenation of the folded statement hashes.
 * </p>
 * <p>
 * The result is invariant under blank node relabeling and statement order for every graph. It
 * tells apart non-isomorphic graphs only when no statement links two blank nodes; for other
 * graphs {@link StandardCanonicalizer} must be used.
 * </p>
 */
public final class CustomCanonicalizer {

    static final String MAGIC_SUBJECT = "Magic_S";

    static final String MAGIC_OBJECT = "Magic_O";

    private static final Function<BNode, String> SUBJECT_LABELER = new Function<BNode, String>() {

        @Override
        public String apply(final BNode bnode) {
            return MAGIC_SUBJECT;
        }

    };

    private static final Function<BNode, String> OBJECT_LABELER = new Function<BNode, String>() {

        @Override
        public String apply(final BNode bnode) {
            return MAGIC_OBJECT;
        }

    };

    public CanonicalHash canonicalize(final NamedGraph graph) throws SerializationException {

        final Map<Statement, String> tripleHashes = Maps.newHashMap();
        final SetMultimap<BNode, Statement> bySubject = HashMultimap.create();
        final SetMultimap<BNode, Statement> byObject = HashMultimap.create();

        for (final Statement statement : graph) {
            tripleHashes.put(statement, hashTriple(statement));
            if (statement.getSubject() instanceof BNode) {
                bySubject.put((BNode) statement.getSubject(), statement);
            }
            if (statement.getObject() instanceof BNode) {
                byObject.put((BNode) statement.getObject(), statement);
            }
        }

        final List<String> folded = Lists.newArrayListWithCapacity(tripleHashes.size());
        for (final Map.Entry<Statement, String> entry : tripleHashes.entrySet()) {
            final Statement statement = entry.getKey();
            final List<String> neighbors = Lists.newArrayList();
            if (statement.getSubject() instanceof BNode) {
                for (final Statement other : byObject.get((BNode) statement.getSubject())) {
                    if (!other.equals(statement)) {
                        neighbors.add(tripleHashes.get(other));
                    }
                }
            }
            if (statement.getObject() instanceof BNode) {
                for (final Statement other : bySubject.get((BNode) statement.getObject())) {
                    if (!other.equals(statement)) {
                        neighbors.add(tripleHashes.get(other));
                    }
                }
            }
            folded.add(fold(entry.getValue(), neighbors));
        }

        Collections.sort(folded);
        return CanonicalHash.sha256(Joiner.on("").join(folded));
    }

    static String hashTriple(final Statement statement) throws SerializationException {
        final StringBuilder builder = new StringBuilder();
        builder.append(CanonicalForm.format(statement.getSubject(), SUBJECT_LABELER));
        builder.append(CanonicalForm.format(statement.getPredicate()));
        builder.append(CanonicalForm.format(statement.getObject(), OBJECT_LABELER));
        return CanonicalHash.sha256Hex(builder);
    }

    static String fold(final String ownHash, final List<String> neighborHashes) {
        if (neighborHashes.isEmpty()) {
            return ownHash;
        }
        final List<String> sorted = Lists.newArrayList(neighborHashes);
        Collections.sort(sorted);
        final StringBuilder builder = new StringBuilder(ownHash);
        for (final String hash : sorted) {
            builder.append(hash);
        }
        return CanonicalHash.sha256Hex(builder);
    }

}
