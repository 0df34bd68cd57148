package org.provchain;

import javax.annotation.Nullable;

import org.openrdf.model.URI;

/**
 * Signals that the standards canonicalization algorithm exhausted its iteration or time budget.
 * <p>
 * The exception aborts only the canonicalization call that raised it. Callers are expected to
 * reject the graph or resubmit a simplified version of it; falling back to the custom algorithm
 * is never done automatically, as that algorithm gives no correctness guarantee on the graphs
 * that reach the standards algorithm.
 * </p>
 */
public class CanonicalizationTimeoutException extends LedgerException {

    private static final long serialVersionUID = 1L;

    @Nullable
    private final URI graphID;

    private final long iterations;

    private final long elapsedMillis;

    /**
     * Creates a new instance.
     *
     * @param graphID
     *            the ID of the graph being canonicalized, if known
     * @param iterations
     *            the number of iterations performed before aborting
     * @param elapsedMillis
     *            the time spent before aborting, in milliseconds
     */
    public CanonicalizationTimeoutException(@Nullable final URI graphID, final long iterations,
            final long elapsedMillis) {
        super("Canonicalization of graph " + (graphID == null ? "(anonymous)" : "<" + graphID
                + ">") + " aborted after " + iterations + " iterations, " + elapsedMillis
                + " ms");
        this.graphID = graphID;
        this.iterations = iterations;
        this.elapsedMillis = elapsedMillis;
    }

    @Nullable
    public URI getGraphID() {
        return this.graphID;
    }

    public long getIterations() {
        return this.iterations;
    }

    public long getElapsedMillis() {
        return this.elapsedMillis;
    }

}
