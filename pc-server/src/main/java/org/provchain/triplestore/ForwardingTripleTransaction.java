package org.provchain.triplestore;

import java.io.IOException;

import javax.annotation.Nullable;

import com.google.common.collect.ForwardingObject;

import org.openrdf.model.Resource;
import org.openrdf.model.Statement;
import org.openrdf.model.URI;
import org.openrdf.model.Value;

import info.aduna.iteration.CloseableIteration;

/**
 * A {@code TripleTransaction} that forwards all its method calls to another
 * {@code TripleTransaction}. Subclasses implement {@link #delegate()} and override the methods
 * they decorate.
 */
public abstract class ForwardingTripleTransaction extends ForwardingObject implements
        TripleTransaction {

    @Override
    protected abstract TripleTransaction delegate();

    @Override
    public CloseableIteration<? extends Statement, ? extends Exception> get(
            @Nullable final Resource subject, @Nullable final URI predicate,
            @Nullable final Value object, @Nullable final Resource context) throws IOException,
            IllegalStateException {
        return delegate().get(subject, predicate, object, context);
    }

    @Override
    public void add(final Iterable<? extends Statement> statements) throws IOException,
            IllegalStateException {
        delegate().add(statements);
    }

    @Override
    public void remove(final Iterable<? extends Statement> statements) throws IOException,
            IllegalStateException {
        delegate().remove(statements);
    }

    @Override
    public void end(final boolean commit) throws IOException {
        delegate().end(commit);
    }

}
