package org.provchain.triplestore;

import java.io.IOException;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;

import org.openrdf.model.Resource;
import org.openrdf.model.Statement;
import org.openrdf.model.URI;
import org.openrdf.model.Value;
import org.openrdf.repository.Repository;
import org.openrdf.repository.RepositoryConnection;
import org.openrdf.repository.RepositoryException;
import org.openrdf.repository.sail.SailRepository;
import org.openrdf.sail.Sail;
import org.openrdf.sail.memory.MemoryStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import info.aduna.iteration.CloseableIteration;
import info.aduna.iteration.IterationWrapper;

import org.provchain.runtime.DataCorruptedException;

/**
 * A {@code TripleStore} backed by a Sesame {@code Repository}.
 * <p>
 * Each {@code TripleTransaction} maps to a repository connection with an explicit transaction.
 * The no-argument constructor creates a volatile in-memory store, suited to tests and to ledgers
 * whose chain is reloaded from elsewhere.
 * </p>
 */
public final class RepositoryTripleStore implements TripleStore {

    private static final Logger LOGGER = LoggerFactory.getLogger(RepositoryTripleStore.class);

    private final Repository repository;

    public RepositoryTripleStore() {
        this(new MemoryStore());
    }

    public RepositoryTripleStore(final Sail sail) {
        this(new SailRepository(sail));
    }

    public RepositoryTripleStore(final Repository repository) {
        this.repository = Preconditions.checkNotNull(repository);
        LOGGER.info("RepositoryTripleStore configured, backend={}", repository.getClass()
                .getSimpleName());
    }

    @Override
    public void init() throws IOException {
        try {
            this.repository.initialize();
        } catch (final RepositoryException ex) {
            throw new IOException("Could not initialize Sesame repository", ex);
        }
    }

    @Override
    public TripleTransaction begin(final boolean readOnly) throws IOException {
        return new RepositoryTripleTransaction(readOnly);
    }

    @Override
    public void reset() throws IOException {
        RepositoryConnection connection = null;
        try {
            connection = this.repository.getConnection();
            connection.clear();
            connection.clearNamespaces();
            LOGGER.info("Sesame repository successfully reset");
        } catch (final RepositoryException ex) {
            throw new IOException("Could not reset Sesame repository", ex);
        } finally {
            closeQuietly(connection);
        }
    }

    @Override
    public void close() {
        try {
            this.repository.shutDown();
        } catch (final RepositoryException ex) {
            LOGGER.error("Failed to shutdown Sesame repository", ex);
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName();
    }

    private static void closeQuietly(@Nullable final RepositoryConnection connection) {
        if (connection != null) {
            try {
                connection.close();
            } catch (final RepositoryException ex) {
                LOGGER.error("Failed to close connection", ex);
            }
        }
    }

    private class RepositoryTripleTransaction implements TripleTransaction {

        private final RepositoryConnection connection;

        private final boolean readOnly;

        private final long ts;

        private boolean dirty;

        RepositoryTripleTransaction(final boolean readOnly) throws IOException {

            final long ts = System.currentTimeMillis();
            final RepositoryConnection connection;
            try {
                connection = RepositoryTripleStore.this.repository.getConnection();
            } catch (final RepositoryException ex) {
                throw new IOException("Could not connect to Sesame repository", ex);
            }

            try {
                connection.begin();
            } catch (final RepositoryException ex) {
                closeQuietly(connection);
                throw new IOException("Could not begin Sesame transaction", ex);
            }

            this.connection = connection;
            this.readOnly = readOnly;
            this.ts = ts;
            this.dirty = false;

            if (LOGGER.isDebugEnabled()) {
                LOGGER.debug(this + " started in " + (readOnly ? "read-only" : "read-write")
                        + " mode, " + (System.currentTimeMillis() - ts) + " ms");
            }
        }

        private void checkWritable() {
            if (this.readOnly) {
                throw new IllegalStateException(
                        "Write operation not allowed on read-only transaction");
            }
        }

        @Override
        public CloseableIteration<? extends Statement, ? extends Exception> get(
                @Nullable final Resource subject, @Nullable final URI predicate,
                @Nullable final Value object, @Nullable final Resource context)
                throws IOException, IllegalStateException {

            try {
                final long ts = System.currentTimeMillis();
                final CloseableIteration<Statement, RepositoryException> result;
                if (context == null) {
                    result = this.connection.getStatements(subject, predicate, object, false);
                } else {
                    result = this.connection.getStatements(subject, predicate, object, false,
                            context);
                }
                LOGGER.debug("getStatements() iteration obtained in {} ms",
                        System.currentTimeMillis() - ts);
                return logClose(result);

            } catch (final RepositoryException ex) {
                throw new IOException("Error while retrieving matching statements", ex);
            }
        }

        private <T, E extends Exception> CloseableIteration<T, E> logClose(
                final CloseableIteration<T, E> iteration) {
            if (!LOGGER.isDebugEnabled()) {
                return iteration;
            }
            final long ts = System.currentTimeMillis();
            return new IterationWrapper<T, E>(iteration) {

                @Override
                protected void handleClose() throws E {
                    try {
                        super.handleClose();
                    } finally {
                        LOGGER.debug("Repository iteration closed after {} ms",
                                System.currentTimeMillis() - ts);
                    }
                }

            };
        }

        @Override
        public void add(final Iterable<? extends Statement> statements) throws IOException,
                IllegalStateException {

            Preconditions.checkNotNull(statements);
            checkWritable();

            try {
                this.dirty = true;
                this.connection.add(statements);
            } catch (final RepositoryException ex) {
                throw new DataCorruptedException("Error while adding statements", ex);
            }
        }

        @Override
        public void remove(final Iterable<? extends Statement> statements) throws IOException,
                IllegalStateException {

            Preconditions.checkNotNull(statements);
            checkWritable();

            try {
                this.dirty = true;
                this.connection.remove(statements);
            } catch (final RepositoryException ex) {
                throw new DataCorruptedException("Error while removing statements", ex);
            }
        }

        @Override
        public void end(final boolean commit) throws DataCorruptedException, IOException,
                IllegalStateException {

            final long ts = System.currentTimeMillis();
            boolean committed = false;

            try {
                if (this.dirty && commit) {
                    try {
                        this.connection.commit();
                        committed = true;

                    } catch (final RepositoryException ex) {
                        try {
                            this.connection.rollback();
                            LOGGER.debug("{} rolled back after commit failure", this);

                        } catch (final RepositoryException ex2) {
                            throw new DataCorruptedException(
                                    "Failed to rollback transaction after commit failure", ex);
                        }
                        throw new IOException("Failed to commit transaction (rollback forced)",
                                ex);
                    }
                } else {
                    try {
                        this.connection.rollback();
                    } catch (final RepositoryException ex) {
                        if (this.dirty) {
                            throw new DataCorruptedException("Failed to rollback transaction",
                                    ex);
                        }
                        LOGGER.warn("Failed to end read-only transaction", ex);
                    }
                }
            } finally {
                try {
                    this.connection.close();
                } catch (final RepositoryException ex) {
                    LOGGER.error("Failed to close connection", ex);
                } finally {
                    if (LOGGER.isDebugEnabled()) {
                        final long now = System.currentTimeMillis();
                        LOGGER.debug("{} {} and closed in {} ms, tx duration {} ms", this,
                                committed ? "committed" : "rolled back", now - ts, now - this.ts);
                    }
                }
            }
        }

        @Override
        public String toString() {
            return getClass().getSimpleName();
        }

    }

}
