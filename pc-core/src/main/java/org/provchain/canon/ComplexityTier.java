package org.provchain.canon;

/**
 * Structural complexity of a graph with respect to blank node canonicalization, as computed by
 * {@link GraphClassifier}.
 */
public enum ComplexityTier {

    /** No blank nodes. */
    SIMPLE,

    /** Blank nodes, but no statement linking two blank nodes. */
    MODERATE,

    /** Blank node chains or trees whose nodes are all structurally distinguishable. */
    COMPLEX,

    /** Blank node cycles, or blank nodes with identical structural signatures. */
    PATHOLOGICAL

}
