package org.provchain.triplestore;

import java.io.IOException;

import org.provchain.runtime.Component;
import org.provchain.runtime.DataCorruptedException;

/**
 * A storage for triples organized in named graphs, accessed through transactions.
 * <p>
 * The ledger keeps one named graph per block plus the chain metadata graph in a
 * {@code TripleStore}. Access to the store contents occurs only in the scope of a
 * {@link TripleTransaction}, either read-only or read/write, which provides atomicity, isolation
 * and durability guarantees. A {@code TripleStore} obeys the general contract and lifecycle of
 * {@link Component}.
 * </p>
 * <p>
 * Implementations may throw a {@link DataCorruptedException} when store files or external
 * resources are found missing or damaged; {@link #reset()} then wipes the store so that it can be
 * re-populated.
 * </p>
 */
public interface TripleStore extends Component {

    /**
     * Begins a new read-only or read-write transaction, which must be ended as soon as possible.
     *
     * @param readOnly
     *            true if the transaction is not allowed to modify the store contents
     * @return the created transaction
     * @throws DataCorruptedException
     *             in case a transaction cannot be started due to store files being damaged or
     *             missing
     * @throws IOException
     *             if another IO error occurs while starting the transaction
     */
    TripleTransaction begin(boolean readOnly) throws DataCorruptedException, IOException;

    /**
     * Wipes the store contents, leaving it empty.
     *
     * @throws IOException
     *             if an IO error occurs while resetting the store
     */
    void reset() throws IOException;

}
