package org.provchain.data;

import java.io.Serializable;
import java.util.Iterator;
import java.util.Set;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSet;

import org.openrdf.model.BNode;
import org.openrdf.model.Statement;
import org.openrdf.model.URI;

/**
 * An immutable set of context-free statements, scoped to a named graph.
 * <p>
 * Statements are stored without context: the named graph they belong to is given by
 * {@link #getID()}. Statement order carries no meaning and duplicates collapse, so two
 * {@code NamedGraph}s are equal if they have the same ID and the same statements. Use
 * {@link #hasSameContent(NamedGraph)} to compare the statements only.
 * </p>
 */
public final class NamedGraph implements Iterable<Statement>, Serializable {

    private static final long serialVersionUID = 1L;

    private final URI id;

    private final ImmutableSet<Statement> statements;

    @Nullable
    private transient ImmutableSet<BNode> blankNodes;

    private NamedGraph(final URI id, final ImmutableSet<Statement> statements) {
        this.id = id;
        this.statements = statements;
    }

    /**
     * Creates a new graph with the ID and statements specified. Contexts of supplied statements
     * are dropped.
     *
     * @param id
     *            the graph URI
     * @param statements
     *            the statements
     * @return the created graph
     */
    public static NamedGraph create(final URI id, final Iterable<? extends Statement> statements) {
        Preconditions.checkNotNull(id);
        final ImmutableSet.Builder<Statement> builder = ImmutableSet.builder();
        for (final Statement statement : statements) {
            builder.add(Data.withoutContext(statement));
        }
        return new NamedGraph(id, builder.build());
    }

    /**
     * Creates a new graph with the ID and statements specified.
     *
     * @param id
     *            the graph URI
     * @param statements
     *            the statements
     * @return the created graph
     */
    public static NamedGraph create(final URI id, final Statement... statements) {
        return create(id, ImmutableSet.copyOf(statements));
    }

    public URI getID() {
        return this.id;
    }

    public Set<Statement> getStatements() {
        return this.statements;
    }

    public int size() {
        return this.statements.size();
    }

    public boolean isEmpty() {
        return this.statements.isEmpty();
    }

    /**
     * Returns the blank nodes occurring as subject or object of some statement.
     *
     * @return an immutable set of blank nodes, in order of first occurrence
     */
    public Set<BNode> getBlankNodes() {
        if (this.blankNodes == null) {
            final ImmutableSet.Builder<BNode> builder = ImmutableSet.builder();
            for (final Statement statement : this.statements) {
                if (statement.getSubject() instanceof BNode) {
                    builder.add((BNode) statement.getSubject());
                }
                if (statement.getObject() instanceof BNode) {
                    builder.add((BNode) statement.getObject());
                }
            }
            this.blankNodes = builder.build();
        }
        return this.blankNodes;
    }

    /**
     * Returns a graph with the same statements scoped to a different named graph.
     *
     * @param newID
     *            the new graph URI
     * @return the resulting graph, possibly this graph if the ID did not change
     */
    public NamedGraph withID(final URI newID) {
        Preconditions.checkNotNull(newID);
        return newID.equals(this.id) ? this : new NamedGraph(newID, this.statements);
    }

    public boolean hasSameContent(final NamedGraph other) {
        return this.statements.equals(other.statements);
    }

    @Override
    public Iterator<Statement> iterator() {
        return this.statements.iterator();
    }

    @Override
    public boolean equals(final Object object) {
        if (object == this) {
            return true;
        }
        if (!(object instanceof NamedGraph)) {
            return false;
        }
        final NamedGraph other = (NamedGraph) object;
        return this.id.equals(other.id) && this.statements.equals(other.statements);
    }

    @Override
    public int hashCode() {
        return this.id.hashCode() * 37 + this.statements.hashCode();
    }

    @Override
    public String toString() {
        return Data.toString(this.id) + " (" + this.statements.size() + " statements)";
    }

}
