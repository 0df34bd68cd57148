package org.provchain;

/**
 * Signals that an RDF term or payload cannot be rendered in (or parsed from) its canonical
 * lexical form.
 */
public class SerializationException extends LedgerException {

    private static final long serialVersionUID = 1L;

    public SerializationException(final String message) {
        super(message);
    }

    public SerializationException(final String message, final Throwable cause) {
        super(message, cause);
    }

}
