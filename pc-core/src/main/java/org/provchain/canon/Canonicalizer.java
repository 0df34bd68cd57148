package org.provchain.canon;

import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;

import javax.annotation.Nullable;

import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;
import com.google.common.base.Preconditions;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.google.common.cache.CacheStats;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.ListeningExecutorService;

import org.openrdf.model.Statement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.provchain.CanonicalizationTimeoutException;
import org.provchain.SerializationException;
import org.provchain.data.Data;
import org.provchain.data.NamedGraph;
import org.provchain.internal.Util;

/**
 * Adaptive canonicalization: classifies each graph and dispatches it to the algorithm suited to
 * its complexity tier.
 * <p>
 * Simple and moderate graphs go to the {@link CustomCanonicalizer}, complex and pathological
 * graphs to the {@link StandardCanonicalizer}. A {@link CanonicalizationTimeoutException} raised
 * by the latter is propagated to the caller: the custom algorithm is never used in its place.
 * Method {@link #canonicalize(NamedGraph, CanonicalizationAlgorithm)} forces a given algorithm,
 * as needed to re-validate a block with the algorithm it was created with.
 * </p>
 * <p>
 * Results are cached by graph content and algorithm in a bounded cache (the graph ID is not part
 * of the key). Asynchronous variants run on a {@code ListeningExecutorService}, by default the
 * shared one returned by {@link Data#getExecutor()}. Instances are thread safe.
 * </p>
 */
public final class Canonicalizer {

    private static final Logger LOGGER = LoggerFactory.getLogger(Canonicalizer.class);

    /** Default number of cached canonicalization results. */
    public static final int DEFAULT_CACHE_SIZE = 1024;

    private final CustomCanonicalizer customCanonicalizer;

    private final StandardCanonicalizer standardCanonicalizer;

    @Nullable
    private final Cache<CacheKey, CanonicalizationResult> cache;

    @Nullable
    private final ListeningExecutorService executor;

    private Canonicalizer(final Builder builder) {
        final long maxIterations = MoreObjects.firstNonNull(builder.maxIterations,
                StandardCanonicalizer.DEFAULT_MAX_ITERATIONS);
        final long timeoutMillis = MoreObjects.firstNonNull(builder.timeoutMillis, 0L);
        final int cacheSize = MoreObjects.firstNonNull(builder.cacheSize, DEFAULT_CACHE_SIZE);
        Preconditions.checkArgument(cacheSize >= 0, "Invalid cache size %s", cacheSize);

        this.customCanonicalizer = new CustomCanonicalizer();
        this.standardCanonicalizer = new StandardCanonicalizer(maxIterations, timeoutMillis);
        this.cache = cacheSize == 0 ? null : CacheBuilder.newBuilder().maximumSize(cacheSize)
                .recordStats().<CacheKey, CanonicalizationResult>build();
        this.executor = builder.executor == null ? null : Util.decorate(builder.executor);

        LOGGER.debug("{} configured: maxIterations={}, timeoutMillis={}, cacheSize={}",
                getClass().getSimpleName(), maxIterations, timeoutMillis, cacheSize);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Canonicalizes a graph with the algorithm selected by its complexity tier.
     *
     * @param graph
     *            the graph
     * @return the canonicalization result
     * @throws SerializationException
     *             if some term of the graph is malformed
     * @throws CanonicalizationTimeoutException
     *             if the standards algorithm exhausts its budget
     */
    public CanonicalizationResult canonicalize(final NamedGraph graph)
            throws SerializationException, CanonicalizationTimeoutException {
        final ComplexityTier tier = GraphClassifier.classify(graph);
        return canonicalize(graph, CanonicalizationAlgorithm.forTier(tier), tier, true);
    }

    /**
     * Canonicalizes a graph with the algorithm specified, regardless of its complexity tier.
     *
     * @param graph
     *            the graph
     * @param algorithm
     *            the algorithm to apply
     * @return the canonicalization result
     * @throws SerializationException
     *             if some term of the graph is malformed
     * @throws CanonicalizationTimeoutException
     *             if the standards algorithm exhausts its budget
     */
    public CanonicalizationResult canonicalize(final NamedGraph graph,
            final CanonicalizationAlgorithm algorithm) throws SerializationException,
            CanonicalizationTimeoutException {
        Preconditions.checkNotNull(algorithm);
        return canonicalize(graph, algorithm, GraphClassifier.classify(graph), true);
    }

    public ListenableFuture<CanonicalizationResult> canonicalizeAsync(final NamedGraph graph) {
        Preconditions.checkNotNull(graph);
        return getExecutor().submit(new Callable<CanonicalizationResult>() {

            @Override
            public CanonicalizationResult call() throws Exception {
                return canonicalize(graph);
            }

        });
    }

    public ListenableFuture<CanonicalizationResult> canonicalizeAsync(final NamedGraph graph,
            final CanonicalizationAlgorithm algorithm) {
        Preconditions.checkNotNull(graph);
        Preconditions.checkNotNull(algorithm);
        return getExecutor().submit(new Callable<CanonicalizationResult>() {

            @Override
            public CanonicalizationResult call() throws Exception {
                return canonicalize(graph, algorithm);
            }

        });
    }

    /**
     * Canonicalizes a graph repeatedly, bypassing the cache, and returns the number of distinct
     * hashes obtained. A deterministic canonicalization always yields 1.
     *
     * @param graph
     *            the graph
     * @param runs
     *            the number of runs, greater than zero
     * @return the number of distinct hashes
     * @throws SerializationException
     *             if some term of the graph is malformed
     * @throws CanonicalizationTimeoutException
     *             if the standards algorithm exhausts its budget
     */
    public int checkConsistency(final NamedGraph graph, final int runs)
            throws SerializationException, CanonicalizationTimeoutException {
        Preconditions.checkArgument(runs > 0, "Invalid number of runs %s", runs);
        final ComplexityTier tier = GraphClassifier.classify(graph);
        final CanonicalizationAlgorithm algorithm = CanonicalizationAlgorithm.forTier(tier);
        final Set<CanonicalHash> hashes = Sets.newHashSet();
        for (int i = 0; i < runs; ++i) {
            hashes.add(canonicalize(graph, algorithm, tier, false).getHash());
        }
        if (hashes.size() > 1) {
            LOGGER.warn("Inconsistent {} canonicalization of {}: {} distinct hashes in {} runs",
                    algorithm, graph, hashes.size(), runs);
        }
        return hashes.size();
    }

    /**
     * Returns the statistics of the result cache.
     *
     * @return the cache statistics, all zero if caching is disabled
     */
    public CacheStats getCacheStats() {
        return this.cache == null ? new CacheStats(0, 0, 0, 0, 0, 0) : this.cache.stats();
    }

    public void invalidateCache() {
        if (this.cache != null) {
            this.cache.invalidateAll();
        }
    }

    private ListeningExecutorService getExecutor() {
        return this.executor != null ? this.executor : Data.getExecutor();
    }

    private CanonicalizationResult canonicalize(final NamedGraph graph,
            final CanonicalizationAlgorithm algorithm, final ComplexityTier tier,
            final boolean useCache) throws SerializationException,
            CanonicalizationTimeoutException {

        final CacheKey key = useCache && this.cache != null ? new CacheKey(graph, algorithm)
                : null;
        if (key != null) {
            final CanonicalizationResult cached = this.cache.getIfPresent(key);
            if (cached != null) {
                return cached;
            }
        }

        final long ts = System.currentTimeMillis();
        final CanonicalHash hash;
        switch (algorithm) {
        case CUSTOM:
            hash = this.customCanonicalizer.canonicalize(graph);
            break;
        case STANDARD:
            hash = this.standardCanonicalizer.canonicalize(graph);
            break;
        default:
            throw new Error("Unexpected algorithm " + algorithm);
        }
        final CanonicalizationResult result = new CanonicalizationResult(hash, algorithm, tier);

        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("Canonicalized {} ({}, {}) in {} ms: {}", graph, tier, algorithm,
                    System.currentTimeMillis() - ts, hash);
        }

        if (key != null) {
            this.cache.put(key, result);
        }
        return result;
    }

    private static final class CacheKey {

        private final ImmutableSet<Statement> statements;

        private final CanonicalizationAlgorithm algorithm;

        CacheKey(final NamedGraph graph, final CanonicalizationAlgorithm algorithm) {
            this.statements = ImmutableSet.copyOf(graph.getStatements());
            this.algorithm = algorithm;
        }

        @Override
        public boolean equals(final Object object) {
            if (object == this) {
                return true;
            }
            if (!(object instanceof CacheKey)) {
                return false;
            }
            final CacheKey other = (CacheKey) object;
            return this.algorithm == other.algorithm && this.statements.equals(other.statements);
        }

        @Override
        public int hashCode() {
            return Objects.hashCode(this.statements, this.algorithm);
        }

    }

    public static class Builder {

        @Nullable
        private Long maxIterations;

        @Nullable
        private Long timeoutMillis;

        @Nullable
        private Integer cacheSize;

        @Nullable
        private ExecutorService executor;

        Builder() {
        }

        public Builder maxIterations(@Nullable final Long maxIterations) {
            this.maxIterations = maxIterations;
            return this;
        }

        public Builder timeoutMillis(@Nullable final Long timeoutMillis) {
            this.timeoutMillis = timeoutMillis;
            return this;
        }

        public Builder cacheSize(@Nullable final Integer cacheSize) {
            this.cacheSize = cacheSize;
            return this;
        }

        public Builder executor(@Nullable final ExecutorService executor) {
            this.executor = executor;
            return this;
        }

        public Canonicalizer build() {
            return new Canonicalizer(this);
        }

    }

}
