package org.provchain.runtime;

import java.io.Closeable;
import java.io.IOException;

/**
 * A ledger component with an explicit lifecycle.
 * <p>
 * A {@code Component} is first configured by its constructor or builder, without allocating
 * resources or touching persistent data. Method {@link #init()} makes it operational, possibly
 * allocating resources and modifying persisted data (e.g., creating the genesis block of an empty
 * chain). Method {@link #close()} disposes it and can be called at any time after creation, also
 * before initialization or while another thread is using the component.
 * </p>
 * <p>
 * Components access storage, hence their methods may throw {@link IOException}s; a
 * {@link DataCorruptedException} signals that persistent data has been found missing or
 * corrupted.
 * </p>
 */
public interface Component extends Closeable {

    /**
     * Initializes the {@code Component}. This method is called after instantiation and before
     * any other instance method.
     *
     * @throws IOException
     *             in case initialization fails
     * @throws IllegalStateException
     *             in case the component has already been initialized or closed
     */
    void init() throws IOException, IllegalStateException;

    /**
     * Closes this {@code Component}, freeing allocated resources and aborting any ongoing
     * transaction. Calling this method on a closed or never initialized component has no effect.
     * Stored data is not affected.
     */
    @Override
    void close();

}
