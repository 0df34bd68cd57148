package org.provchain.triplestore;

import java.io.IOException;
import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;

import org.openrdf.model.Statement;
import org.openrdf.model.URI;
import org.openrdf.model.ValueFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import info.aduna.iteration.CloseableIteration;

import org.provchain.StoreException;
import org.provchain.data.Data;
import org.provchain.data.NamedGraph;

/**
 * Named graph access on top of a {@link TripleStore}.
 * <p>
 * Each operation runs in its own {@link TripleTransaction}: read-only for retrieval, read-write
 * (committed on success, rolled back otherwise) for modification. {@code IOException}s raised by
 * the store are reported as {@link StoreException}s.
 * </p>
 */
public final class GraphStore {

    private static final Logger LOGGER = LoggerFactory.getLogger(GraphStore.class);

    private final TripleStore store;

    public GraphStore(final TripleStore store) {
        this.store = Preconditions.checkNotNull(store);
    }

    public TripleStore getTripleStore() {
        return this.store;
    }

    /**
     * Replaces the content of a named graph with the statements specified. Contexts of supplied
     * statements are ignored.
     *
     * @param graphID
     *            the graph URI
     * @param statements
     *            the new graph content, possibly empty
     * @throws StoreException
     *             if the store fails; no change is made in that case
     */
    public void storeGraph(final URI graphID, final Iterable<? extends Statement> statements)
            throws StoreException {
        Preconditions.checkNotNull(graphID);
        Preconditions.checkNotNull(statements);
        try {
            final TripleTransaction tx = this.store.begin(false);
            boolean committed = false;
            try {
                final List<Statement> old = drain(tx.get(null, null, null, graphID));
                if (!old.isEmpty()) {
                    tx.remove(old);
                }
                tx.add(inContext(graphID, statements));
                tx.end(true);
                committed = true;
                LOGGER.debug("Graph {} stored, {} statements replaced", Data.toString(graphID),
                        old.size());
            } finally {
                if (!committed) {
                    tx.end(false);
                }
            }
        } catch (final IOException ex) {
            throw new StoreException("Could not store graph " + Data.toString(graphID), ex);
        }
    }

    /**
     * Adds statements to a named graph, keeping its current content.
     *
     * @param graphID
     *            the graph URI
     * @param statements
     *            the statements to add
     * @throws StoreException
     *             if the store fails; no change is made in that case
     */
    public void addToGraph(final URI graphID, final Iterable<? extends Statement> statements)
            throws StoreException {
        Preconditions.checkNotNull(graphID);
        try {
            final TripleTransaction tx = this.store.begin(false);
            boolean committed = false;
            try {
                tx.add(inContext(graphID, statements));
                tx.end(true);
                committed = true;
            } finally {
                if (!committed) {
                    tx.end(false);
                }
            }
        } catch (final IOException ex) {
            throw new StoreException("Could not update graph " + Data.toString(graphID), ex);
        }
    }

    /**
     * Returns the current content of a named graph.
     *
     * @param graphID
     *            the graph URI
     * @return the graph, empty if the store holds no statement for it
     * @throws StoreException
     *             if the store fails
     */
    public NamedGraph getGraph(final URI graphID) throws StoreException {
        Preconditions.checkNotNull(graphID);
        try {
            final TripleTransaction tx = this.store.begin(true);
            try {
                return NamedGraph.create(graphID, drain(tx.get(null, null, null, graphID)));
            } finally {
                tx.end(false);
            }
        } catch (final IOException ex) {
            throw new StoreException("Could not retrieve graph " + Data.toString(graphID), ex);
        }
    }

    private static List<Statement> inContext(final URI graphID,
            final Iterable<? extends Statement> statements) {
        final ValueFactory factory = Data.getValueFactory();
        final List<Statement> result = Lists.newArrayList();
        for (final Statement statement : statements) {
            result.add(factory.createStatement(statement.getSubject(), statement.getPredicate(),
                    statement.getObject(), graphID));
        }
        return result;
    }

    private static List<Statement> drain(
            final CloseableIteration<? extends Statement, ? extends Exception> iteration)
            throws IOException {
        try {
            final List<Statement> result = Lists.newArrayList();
            while (iteration.hasNext()) {
                result.add(iteration.next());
            }
            return result;
        } catch (final RuntimeException ex) {
            throw ex;
        } catch (final Exception ex) {
            throw new IOException("Error while iterating statements", ex);
        } finally {
            try {
                iteration.close();
            } catch (final Exception ex) {
                LOGGER.error("Error closing iteration", ex);
            }
        }
    }

}
