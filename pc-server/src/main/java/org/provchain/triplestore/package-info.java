/**
 * {@code TripleStore} component API ({@code pc-server}).
 * <p>
 * This package defines the lightweight storage API used by the ledger to keep block graphs and
 * chain metadata as named graphs, and provides:
 * </p>
 * <ul>
 * <li>the {@code TripleStore} API ({@link org.provchain.triplestore.TripleStore},
 * {@link org.provchain.triplestore.TripleTransaction});</li>
 * <li>an implementation over any Sesame repository
 * ({@link org.provchain.triplestore.RepositoryTripleStore});</li>
 * <li>store decorators built on
 * {@link org.provchain.triplestore.ForwardingTripleTransaction}, with logging ({@link org.provchain.triplestore.LoggingTripleStore}) and
 * synchronization ({@link org.provchain.triplestore.SynchronizedTripleStore}) decorators;</li>
 * <li>named graph access on top of the API ({@link org.provchain.triplestore.GraphStore}).</li>
 * </ul>
 */
@javax.annotation.ParametersAreNonnullByDefault
package org.provchain.triplestore;

