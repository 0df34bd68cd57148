package org.provchain.canon;

import org.openrdf.model.Literal;
import org.openrdf.model.Value;

import org.provchain.data.Data;

/**
 * The canonicalization algorithms a ledger can apply to a block graph. The algorithm used for a
 * block is recorded with it, so that validation repeats the same computation.
 */
public enum CanonicalizationAlgorithm {

    /** Hash-folding algorithm, exact for graphs without blank node to blank node statements. */
    CUSTOM,

    /** RDFC-1.0 style canonical labeling, exact for any graph within its budget. */
    STANDARD;

    /**
     * Returns the algorithm appropriate for graphs of the complexity tier specified.
     *
     * @param tier
     *            the complexity tier
     * @return {@code CUSTOM} for simple and moderate graphs, {@code STANDARD} otherwise
     */
    public static CanonicalizationAlgorithm forTier(final ComplexityTier tier) {
        switch (tier) {
        case SIMPLE:
        case MODERATE:
            return CUSTOM;
        case COMPLEX:
        case PATHOLOGICAL:
            return STANDARD;
        default:
            throw new Error("Unexpected tier " + tier);
        }
    }

    /**
     * Returns the algorithm with the name specified, as stored in chain metadata.
     *
     * @param value
     *            a literal or string with the algorithm name
     * @return the algorithm
     * @throws IllegalArgumentException
     *             if the name does not denote any algorithm
     */
    public static CanonicalizationAlgorithm valueOf(final Value value) {
        final String name = value instanceof Literal ? ((Literal) value).getLabel() : value
                .stringValue();
        return valueOf(name.trim().toUpperCase());
    }

    public Literal toLiteral() {
        return Data.getValueFactory().createLiteral(name());
    }

}
