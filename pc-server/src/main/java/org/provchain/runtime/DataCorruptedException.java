package org.provchain.runtime;

import java.io.IOException;

/**
 * Signals that persistent data has been found missing or corrupted, e.g., a partially applied
 * modification of a graph or an unreadable chain metadata graph.
 * <p>
 * Differently from other {@code IOException}s, retrying the operation is pointless: the
 * affected data must be restored by an external recovery procedure.
 * </p>
 */
public class DataCorruptedException extends IOException {

    private static final long serialVersionUID = 1L;

    public DataCorruptedException(final String message) {
        this(message, null);
    }

    public DataCorruptedException(final String message, final Throwable cause) {
        super(message, cause);
    }

}
