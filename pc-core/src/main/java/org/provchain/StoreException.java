package org.provchain;

import java.io.IOException;

/**
 * Signals a failure of the RDF store the ledger persists graphs into.
 * <p>
 * The cause is the {@link IOException} raised by the store (possibly a
 * {@code DataCorruptedException}); the operation is aborted and not retried.
 * </p>
 */
public class StoreException extends LedgerException {

    private static final long serialVersionUID = 1L;

    public StoreException(final String message, final IOException cause) {
        super(message, cause);
    }

    @Override
    public synchronized IOException getCause() {
        return (IOException) super.getCause();
    }

}
