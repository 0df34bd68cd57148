package org.provchain.triplestore;

import java.io.IOException;
import java.lang.ref.WeakReference;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;
import com.google.common.collect.ForwardingObject;
import com.google.common.collect.Lists;

import org.openrdf.model.Resource;
import org.openrdf.model.Statement;
import org.openrdf.model.URI;
import org.openrdf.model.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import info.aduna.iteration.CloseableIteration;

import org.provchain.runtime.Synchronizer;

/**
 * A {@code TripleStore} wrapper that synchronizes and enforces a proper access to a wrapped
 * {@code TripleStore}.
 * <p>
 * This wrapper provides the following guarantees with respect to external access to the wrapped
 * {@link TripleStore}:
 * <ul>
 * <li>transactions are started according to the strategy enforced by a supplied
 * {@link Synchronizer} (for the ledger, parallel readers or a single writer);</li>
 * <li>each {@code TripleTransaction} is accessed by one thread at a time, with the exception of
 * {@link TripleTransaction#end(boolean)} which may be called concurrently;</li>
 * <li>the {@code init()} / {@code close()} lifecycle is enforced, raising
 * {@code IllegalStateException} otherwise;</li>
 * <li>{@link #reset()} is called on the wrapped store with no transaction active;</li>
 * <li>iterations still open when their transaction ends are forcedly closed;</li>
 * <li>pending transactions are rolled back when the store is closed.</li>
 * </ul>
 * </p>
 */
public final class SynchronizedTripleStore extends ForwardingObject implements TripleStore {

    public static final String DEFAULT_SYNCHRONIZER_SPEC = "8:WX";

    private static final Logger LOGGER = LoggerFactory.getLogger(SynchronizedTripleStore.class);

    private static final int NEW = 0;

    private static final int INITIALIZED = 1;

    private static final int CLOSED = 2;

    private final TripleStore delegate;

    private final Synchronizer synchronizer;

    private final List<TripleTransaction> transactions;

    private final AtomicInteger state;

    /**
     * Creates a new instance using the default {@code 8:WX} synchronizer.
     *
     * @param delegate
     *            the wrapped {@code TripleStore}
     */
    public SynchronizedTripleStore(final TripleStore delegate) {
        this(delegate, DEFAULT_SYNCHRONIZER_SPEC);
    }

    /**
     * Creates a new instance for the wrapped {@code TripleStore} and the {@code Synchronizer}
     * specification string supplied.
     *
     * @param delegate
     *            the wrapped {@code TripleStore}
     * @param synchronizerSpec
     *            the synchronizer specification string (see {@link Synchronizer})
     */
    public SynchronizedTripleStore(final TripleStore delegate, final String synchronizerSpec) {
        this(delegate, Synchronizer.create(synchronizerSpec));
    }

    public SynchronizedTripleStore(final TripleStore delegate, final Synchronizer synchronizer) {
        this.delegate = Preconditions.checkNotNull(delegate);
        this.synchronizer = Preconditions.checkNotNull(synchronizer);
        this.transactions = Lists.newArrayList();
        this.state = new AtomicInteger(NEW);
        LOGGER.debug("{} configured, synchronizer={}", getClass().getSimpleName(), synchronizer);
    }

    @Override
    protected TripleStore delegate() {
        return this.delegate;
    }

    private void checkState(final int expected) {
        final int state = this.state.get();
        if (state != expected) {
            throw new IllegalStateException("TripleStore "
                    + (state == NEW ? "not initialized"
                            : state == INITIALIZED ? "already initialized" : "already closed"));
        }
    }

    @Override
    public synchronized void init() throws IOException {
        checkState(NEW);
        delegate().init();
        this.state.set(INITIALIZED);
    }

    @Override
    public TripleTransaction begin(final boolean readOnly) throws IOException {
        checkState(INITIALIZED);
        this.synchronizer.beginTransaction(readOnly);
        TripleTransaction transaction = null;
        try {
            synchronized (this) {
                checkState(INITIALIZED);
                final TripleTransaction delegateTransaction = delegate().begin(readOnly);
                if (Thread.currentThread().isInterrupted()) {
                    delegateTransaction.end(false);
                    throw new IllegalStateException("Interrupted");
                }
                transaction = new SynchronizedTripleTransaction(delegateTransaction, readOnly);
                synchronized (this.transactions) {
                    this.transactions.add(transaction);
                }
            }
        } finally {
            if (transaction == null) {
                this.synchronizer.endTransaction(readOnly);
            }
        }
        return transaction;
    }

    @Override
    public void reset() throws IOException {
        checkState(INITIALIZED);
        this.synchronizer.beginExclusive();
        try {
            synchronized (this) {
                checkState(INITIALIZED);
                delegate().reset();
            }
        } finally {
            this.synchronizer.endExclusive();
        }
    }

    @Override
    public void close() {
        if (!this.state.compareAndSet(INITIALIZED, CLOSED)
                && !this.state.compareAndSet(NEW, CLOSED)) {
            return;
        }
        List<TripleTransaction> transactionsToEnd;
        synchronized (this.transactions) {
            transactionsToEnd = Lists.newArrayList(this.transactions);
        }
        try {
            for (final TripleTransaction transaction : transactionsToEnd) {
                try {
                    LOGGER.warn("Forcing rollback of tx {} due to closure of TripleStore",
                            transaction);
                    transaction.end(false);
                } catch (final Throwable ex) {
                    LOGGER.error("Exception caught while ending tx " + transaction
                            + " (rollback assumed): " + ex.getMessage(), ex);
                }
            }
        } finally {
            delegate().close();
        }
    }

    int getActiveTransactionCount() {
        synchronized (this.transactions) {
            return this.transactions.size();
        }
    }

    private final class SynchronizedTripleTransaction extends ForwardingTripleTransaction {

        private final TripleTransaction delegate;

        private final List<WeakReference<CloseableIteration<?, ?>>> iterations;

        private final boolean readOnly;

        private final AtomicBoolean ended;

        SynchronizedTripleTransaction(final TripleTransaction delegate, final boolean readOnly) {
            this.delegate = delegate;
            this.iterations = Lists.newArrayList();
            this.readOnly = readOnly;
            this.ended = new AtomicBoolean(false);
        }

        @Override
        protected TripleTransaction delegate() {
            return this.delegate;
        }

        private <T extends CloseableIteration<?, ?>> T registerIteration(final T iteration) {
            synchronized (this.iterations) {
                if (this.ended.get()) {
                    closeQuietly(iteration);
                    throw new IllegalStateException("Transaction already ended");
                }
                for (int i = this.iterations.size() - 1; i >= 0; --i) {
                    if (this.iterations.get(i).get() == null) {
                        this.iterations.remove(i);
                    }
                }
                this.iterations.add(new WeakReference<CloseableIteration<?, ?>>(iteration));
            }
            return iteration;
        }

        private void closeIterations() {
            synchronized (this.iterations) {
                for (int i = this.iterations.size() - 1; i >= 0; --i) {
                    closeQuietly(this.iterations.remove(i).get());
                }
            }
        }

        private void checkState() {
            if (this.ended.get()) {
                throw new IllegalStateException("Transaction already ended");
            }
        }

        @Override
        public synchronized CloseableIteration<? extends Statement, ? extends Exception> get(
                @Nullable final Resource subject, @Nullable final URI predicate,
                @Nullable final Value object, @Nullable final Resource context)
                throws IOException, IllegalStateException {
            checkState();
            return registerIteration(super.get(subject, predicate, object, context));
        }

        @Override
        public synchronized void add(final Iterable<? extends Statement> statements)
                throws IOException, IllegalStateException {
            checkState();
            super.add(statements);
        }

        @Override
        public synchronized void remove(final Iterable<? extends Statement> statements)
                throws IOException, IllegalStateException {
            checkState();
            super.remove(statements);
        }

        @Override
        public void end(final boolean commit) throws IOException {
            if (!this.ended.compareAndSet(false, true)) {
                return;
            }
            closeIterations();
            try {
                super.end(commit);
            } finally {
                SynchronizedTripleStore.this.synchronizer.endTransaction(this.readOnly);
                synchronized (SynchronizedTripleStore.this.transactions) {
                    SynchronizedTripleStore.this.transactions.remove(this);
                }
            }
        }

        private void closeQuietly(@Nullable final CloseableIteration<?, ?> iteration) {
            if (iteration != null) {
                try {
                    iteration.close();
                } catch (final Throwable ex) {
                    LOGGER.error("Error closing iteration of " + this, ex);
                }
            }
        }

        @Override
        public String toString() {
            return "SynchronizedTripleTransaction[" + this.delegate + "]";
        }

    }

}
