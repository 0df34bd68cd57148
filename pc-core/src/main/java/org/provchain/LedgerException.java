package org.provchain;

/**
 * Signals the failure of a ledger operation.
 * <p>
 * This is the root of the checked exceptions thrown by the canonicalization subsystem and by the
 * block / chain manager. Subclasses identify the kind of failure: malformed RDF terms or payloads
 * ({@link SerializationException}), exhausted canonicalization budget
 * ({@link CanonicalizationTimeoutException}), broken previous-hash linkage
 * ({@link ChainLinkException}), hash mismatches detected during validation
 * ({@link IntegrityException}) and failures of the underlying RDF store
 * ({@link StoreException}).
 * </p>
 */
public class LedgerException extends Exception {

    private static final long serialVersionUID = 1L;

    /**
     * Creates a new instance with the error message specified.
     *
     * @param message
     *            the error message
     */
    public LedgerException(final String message) {
        super(message);
    }

    /**
     * Creates a new instance with the error message and cause specified.
     *
     * @param message
     *            the error message
     * @param cause
     *            the optional cause of this exception
     */
    public LedgerException(final String message, final Throwable cause) {
        super(message, cause);
    }

}
