/**
 * Canonical hashing of RDF graphs.
 * <p>
 * The package provides:
 * </p>
 * <ul>
 * <li>a complexity classifier ({@link org.provchain.canon.GraphClassifier}) assigning each graph
 * a {@link org.provchain.canon.ComplexityTier} based on its blank node structure;</li>
 * <li>two canonicalization algorithms: a fast hash-folding one
 * ({@link org.provchain.canon.CustomCanonicalizer}), exact for graphs without blank node to blank
 * node statements, and an RDFC-1.0 style one ({@link org.provchain.canon.StandardCanonicalizer})
 * running under an iteration and time budget;</li>
 * <li>the adaptive entry point ({@link org.provchain.canon.Canonicalizer}) selecting the
 * algorithm by tier, with result caching and asynchronous variants.</li>
 * </ul>
 * <p>
 * Canonical hashes do not depend on blank node identifiers or statement order.
 * </p>
 */
@javax.annotation.ParametersAreNonnullByDefault
package org.provchain.canon;

