package org.provchain.triplestore;

import java.io.IOException;

import javax.annotation.Nullable;

import org.openrdf.model.Resource;
import org.openrdf.model.Statement;
import org.openrdf.model.URI;
import org.openrdf.model.Value;

import info.aduna.iteration.CloseableIteration;

import org.provchain.runtime.DataCorruptedException;

/**
 * A triple store transaction.
 * <p>
 * A {@code TripleTransaction} is a unit of work over the contents of a {@link TripleStore}
 * supporting <b>statement retrieval</b>, via {@link #get(Resource, URI, Value, Resource)}, and
 * <b>statement modification</b>, via bulk methods {@link #add(Iterable)} and
 * {@link #remove(Iterable)}. Modification is not available for read-only transactions (an
 * {@link IllegalStateException} is thrown in that case).
 * </p>
 * <p>
 * Transactions are terminated via {@link #end(boolean)}, whose parameter specifies whether
 * changes should be committed. If {@code end()} throws an {@code IOException} a rollback must be
 * assumed, even if a commit was asked; if it throws a {@code DataCorruptedException}, neither
 * commit nor rollback were possible and the store is left in an unpredictable state.
 * </p>
 * <p>
 * {@code TripleTransaction} objects are not required to be thread safe, with the only exception
 * of method {@link #end(boolean)} that can be called at any moment by any thread to roll back the
 * transaction.
 * </p>
 */
public interface TripleTransaction {

    /**
     * Returns an iteration over all the statements matching the optional subject, predicate,
     * object and context supplied. Null values are used as wildcards. Returned statements carry
     * their context.
     *
     * @param subject
     *            the subject to match, null to match any subject
     * @param predicate
     *            the predicate to match, null to match any predicate
     * @param object
     *            the object to match, null to match any object
     * @param context
     *            the context to match, null to match any context
     * @return an iteration over matching statements, to be closed after use
     * @throws IOException
     *             in case some IO error occurs
     * @throws IllegalStateException
     *             if the {@code TripleTransaction} has been already ended
     */
    CloseableIteration<? extends Statement, ? extends Exception> get(@Nullable Resource subject,
            @Nullable URI predicate, @Nullable Value object, @Nullable Resource context)
            throws IOException, IllegalStateException;

    /**
     * Adds all the statements in the {@code Iterable} specified to the store, each one in the
     * named graph given by its context.
     *
     * @param statements
     *            the statements to add
     * @throws IOException
     *             in case some IO error occurs, with no guarantee that the store is left in the
     *             same state it was when the method was called
     * @throws IllegalStateException
     *             if the {@code TripleTransaction} has been already ended, or if it is read-only
     */
    void add(Iterable<? extends Statement> statements) throws IOException, IllegalStateException;

    /**
     * Removes all the statements in the {@code Iterable} specified from the store.
     *
     * @param statements
     *            the statements to remove
     * @throws IOException
     *             in case some IO error occurs, with no guarantee that the store is left in the
     *             same state it was when the method was called
     * @throws IllegalStateException
     *             if the {@code TripleTransaction} has been already ended, or if it is read-only
     */
    void remove(Iterable<? extends Statement> statements) throws IOException,
            IllegalStateException;

    /**
     * Ends the transaction, either committing or rolling back its changes (if any). If commit is
     * requested but fails, a rollback is forced and an {@code IOException} is thrown.
     *
     * @param commit
     *            true in case changes made by the transaction should be committed
     * @throws IOException
     *             in case the commit request cannot be satisfied; a forced rollback has been
     *             performed
     * @throws DataCorruptedException
     *             in case it was not possible either to commit or rollback
     * @throws IllegalStateException
     *             if the {@code TripleTransaction} has been already ended
     */
    void end(boolean commit) throws DataCorruptedException, IOException, IllegalStateException;

}
