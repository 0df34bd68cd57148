package org.provchain.triplestore;

import java.io.IOException;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;
import com.google.common.collect.ForwardingObject;
import com.google.common.collect.Iterables;

import org.openrdf.model.Resource;
import org.openrdf.model.Statement;
import org.openrdf.model.URI;
import org.openrdf.model.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import info.aduna.iteration.CloseableIteration;
import info.aduna.iteration.IterationWrapper;

import org.provchain.data.Data;

/**
 * A {@code TripleStore} wrapper that logs calls to the operations of a wrapped
 * {@code TripleStore} and their execution times.
 * <p>
 * Request information and execution times are logged via SLF4J (level DEBUG, logger named after
 * this class). The overhead introduced by this wrapper when logging is disabled is negligible.
 * </p>
 */
public final class LoggingTripleStore extends ForwardingObject implements TripleStore {

    private static final Logger LOGGER = LoggerFactory.getLogger(LoggingTripleStore.class);

    private final TripleStore delegate;

    public LoggingTripleStore(final TripleStore delegate) {
        this.delegate = Preconditions.checkNotNull(delegate);
        LOGGER.debug("{} configured", getClass().getSimpleName());
    }

    @Override
    protected TripleStore delegate() {
        return this.delegate;
    }

    @Override
    public void init() throws IOException {
        if (LOGGER.isDebugEnabled()) {
            final long ts = System.currentTimeMillis();
            delegate().init();
            LOGGER.debug("{} - initialized in {} ms", this, System.currentTimeMillis() - ts);
        } else {
            delegate().init();
        }
    }

    @Override
    public TripleTransaction begin(final boolean readOnly) throws IOException {
        if (LOGGER.isDebugEnabled()) {
            final long ts = System.currentTimeMillis();
            final TripleTransaction transaction = new LoggingTripleTransaction(
                    delegate().begin(readOnly));
            LOGGER.debug("{} - started in {} mode in {} ms", transaction, readOnly ? "read-only"
                    : "read-write", System.currentTimeMillis() - ts);
            return transaction;
        } else {
            return delegate().begin(readOnly);
        }
    }

    @Override
    public void reset() throws IOException {
        if (LOGGER.isDebugEnabled()) {
            final long ts = System.currentTimeMillis();
            delegate().reset();
            LOGGER.debug("{} - reset done in {} ms", this, System.currentTimeMillis() - ts);
        } else {
            delegate().reset();
        }
    }

    @Override
    public void close() {
        if (LOGGER.isDebugEnabled()) {
            final long ts = System.currentTimeMillis();
            delegate().close();
            LOGGER.debug("{} - closed in {} ms", this, System.currentTimeMillis() - ts);
        } else {
            delegate().close();
        }
    }

    private static final class LoggingTripleTransaction extends ForwardingTripleTransaction {

        private final TripleTransaction delegate;

        LoggingTripleTransaction(final TripleTransaction delegate) {
            this.delegate = Preconditions.checkNotNull(delegate);
        }

        @Override
        protected TripleTransaction delegate() {
            return this.delegate;
        }

        private String format(@Nullable final Value value) {
            return value == null ? "*" : Data.toString(value);
        }

        @Override
        public CloseableIteration<? extends Statement, ? extends Exception> get(
                @Nullable final Resource subject, @Nullable final URI predicate,
                @Nullable final Value object, @Nullable final Resource context)
                throws IOException, IllegalStateException {

            if (LOGGER.isDebugEnabled()) {
                final String name = "get() statement iteration for <" + format(subject) + ", "
                        + format(predicate) + ", " + format(object) + ", " + format(context) + ">";
                final long ts = System.currentTimeMillis();
                final CloseableIteration<? extends Statement, ? extends Exception> result;
                result = logClose(super.get(subject, predicate, object, context), name, ts);
                LOGGER.debug("{} - {} obtained in {} ms", this, name, System.currentTimeMillis()
                        - ts);
                return result;
            } else {
                return super.get(subject, predicate, object, context);
            }
        }

        private <T, E extends Exception> CloseableIteration<T, E> logClose(
                final CloseableIteration<T, E> iteration, final String name, final long ts) {
            return new IterationWrapper<T, E>(iteration) {

                @Override
                protected void handleClose() throws E {
                    try {
                        super.handleClose();
                    } finally {
                        LOGGER.debug("{} - {} closed after {} ms", LoggingTripleTransaction.this,
                                name, System.currentTimeMillis() - ts);
                    }
                }

            };
        }

        @Override
        public void add(final Iterable<? extends Statement> statements) throws IOException,
                IllegalStateException {

            if (LOGGER.isDebugEnabled()) {
                final long ts = System.currentTimeMillis();
                super.add(statements);
                LOGGER.debug("{} - {} statements added in {} ms", this,
                        Iterables.size(statements), System.currentTimeMillis() - ts);
            } else {
                super.add(statements);
            }
        }

        @Override
        public void remove(final Iterable<? extends Statement> statements) throws IOException,
                IllegalStateException {

            if (LOGGER.isDebugEnabled()) {
                final long ts = System.currentTimeMillis();
                super.remove(statements);
                LOGGER.debug("{} - {} statements removed in {} ms", this,
                        Iterables.size(statements), System.currentTimeMillis() - ts);
            } else {
                super.remove(statements);
            }
        }

        @Override
        public void end(final boolean commit) throws IOException {

            if (LOGGER.isDebugEnabled()) {
                final long ts = System.currentTimeMillis();
                super.end(commit);
                LOGGER.debug("{} - {} done in {} ms", this, commit ? "commit" : "rollback",
                        System.currentTimeMillis() - ts);
            } else {
                super.end(commit);
            }
        }

        @Override
        public String toString() {
            return "LoggingTripleTransaction[" + this.delegate + "]";
        }

    }

}
