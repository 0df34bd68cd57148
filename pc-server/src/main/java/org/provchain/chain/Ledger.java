package org.provchain.chain;

import java.io.Closeable;
import java.io.IOException;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

import javax.annotation.Nullable;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.util.concurrent.ListeningExecutorService;

import org.openrdf.model.Statement;
import org.openrdf.model.URI;
import org.openrdf.model.ValueFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.provchain.CanonicalizationTimeoutException;
import org.provchain.ChainLinkException;
import org.provchain.IntegrityException;
import org.provchain.LedgerException;
import org.provchain.SerializationException;
import org.provchain.StoreException;
import org.provchain.canon.CanonicalHash;
import org.provchain.canon.CanonicalizationResult;
import org.provchain.canon.Canonicalizer;
import org.provchain.data.Data;
import org.provchain.data.NamedGraph;
import org.provchain.internal.Util;
import org.provchain.internal.rdf.RDFUtil;
import org.provchain.triplestore.GraphStore;
import org.provchain.triplestore.LoggingTripleStore;
import org.provchain.triplestore.SynchronizedTripleStore;
import org.provchain.triplestore.TripleStore;
import org.provchain.vocabulary.PC;

/**
 * The block and chain manager.
 * <p>
 * A {@code Ledger} stores the data of each block as a named graph of a {@link TripleStore}
 * ({@code http://provchain.org/block/{index}}) and describes the blocks of the chain in the
 * metadata graph {@code http://provchain.org/blockchain}. The block hash covers the canonical
 * hash of the block graph, so validation detects changes to stored graphs that alter their
 * canonical hash. Relabeling blank nodes never does. Graphs hashed with
 * {@link org.provchain.canon.CanonicalizationAlgorithm#CUSTOM} are compared through the multiset
 * of their folded triple hashes, so some non-isomorphic variants of the same graph are not told
 * apart: in particular, swapping literal values between two blank nodes that carry the same
 * properties goes undetected.
 * </p>
 * <p>
 * Blocks are created by {@link #createBlock(long, String, String)} without touching the store;
 * their graph is written together with their metadata only when {@link #appendBlock(Block)}
 * accepts them, so a rejected or abandoned candidate never replaces the data of an appended
 * block.
 * </p>
 * <p>
 * The supplied store is wrapped for logging and synchronization (by default parallel readers or a
 * single writer, see {@link SynchronizedTripleStore}); it is initialized by {@link #init()} and
 * closed by {@link #close()}. Mutation of the chain is serialized by a single append lock, while
 * {@link #getChain()} readers and validation work on immutable snapshots. Validation
 * re-canonicalizes blocks in parallel on a worker pool, by default the shared one returned by
 * {@link Data#getExecutor()}.
 * </p>
 */
public final class Ledger implements Closeable {

    private static final Logger LOGGER = LoggerFactory.getLogger(Ledger.class);

    private static final int NEW = 0;

    private static final int INITIALIZED = 1;

    private static final int CLOSED = 2;

    private final TripleStore tripleStore;

    private final GraphStore graphStore;

    private final Canonicalizer canonicalizer;

    @Nullable
    private final ListeningExecutorService executor;

    private final ValidationMode defaultValidationMode;

    private final Chain chain;

    private final Cache<Block, NamedGraph> candidates;

    private final AtomicInteger state;

    private Ledger(final Builder builder) {
        final String synchronizerSpec = MoreObjects.firstNonNull(builder.synchronizerSpec,
                SynchronizedTripleStore.DEFAULT_SYNCHRONIZER_SPEC);
        this.tripleStore = new SynchronizedTripleStore(new LoggingTripleStore(
                builder.tripleStore), synchronizerSpec);
        this.graphStore = new GraphStore(this.tripleStore);
        this.executor = builder.executor == null ? null : Util.decorate(builder.executor);
        this.canonicalizer = builder.canonicalizer != null ? builder.canonicalizer
                : Canonicalizer.builder().maxIterations(builder.maxIterations)
                        .timeoutMillis(builder.timeoutMillis).cacheSize(builder.cacheSize)
                        .executor(builder.executor).build();
        this.defaultValidationMode = MoreObjects.firstNonNull(builder.validationMode,
                ValidationMode.COLLECT_ALL);
        this.chain = new Chain();
        this.candidates = CacheBuilder.newBuilder().weakKeys().build();
        this.state = new AtomicInteger(NEW);
        LOGGER.info("Ledger configured, synchronizer={}, validationMode={}", synchronizerSpec,
                this.defaultValidationMode);
    }

    public static Builder builder(final TripleStore tripleStore) {
        return new Builder(tripleStore);
    }

    /**
     * Initializes the store and loads the chain described in the metadata graph. If the store
     * holds no chain, the genesis block is created and appended.
     *
     * @throws LedgerException
     *             if the store cannot be initialized or its chain metadata is unreadable
     *             ({@link StoreException}), or the genesis block cannot be created
     */
    public void init() throws LedgerException {
        Preconditions.checkState(this.state.compareAndSet(NEW, INITIALIZED),
                "Ledger already initialized or closed");
        final long ts = System.currentTimeMillis();
        try {
            this.tripleStore.init();
        } catch (final IOException ex) {
            throw new StoreException("Could not initialize triple store", ex);
        }

        final List<Block> blocks;
        try {
            blocks = BlockMetadata.parse(this.graphStore.getGraph(PC.BLOCKCHAIN));
        } catch (final IOException ex) {
            throw new StoreException("Could not read chain metadata", ex);
        }

        final ReentrantLock lock = this.chain.getLock();
        lock.lock();
        try {
            if (blocks.isEmpty()) {
                appendBlock(createBlock(0, genesisStatements(), Block.GENESIS_PREVIOUS_HASH));
                LOGGER.info("Genesis block created in {} ms", System.currentTimeMillis() - ts);
            } else {
                this.chain.load(blocks);
                LOGGER.info("Chain loaded, {} blocks, in {} ms", blocks.size(),
                        System.currentTimeMillis() - ts);
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Creates a block from a Turtle payload. Nothing is stored until the block is appended.
     *
     * @param index
     *            the block index
     * @param rdfPayload
     *            the block data, as Turtle text
     * @param previousHash
     *            the hash of the block the new block will follow
     * @return the created block
     * @throws SerializationException
     *             if the payload cannot be parsed, or contains a malformed term
     * @throws CanonicalizationTimeoutException
     *             if the canonicalization budget is exhausted
     */
    public Block createBlock(final long index, final String rdfPayload,
            final String previousHash) throws SerializationException,
            CanonicalizationTimeoutException {
        return createBlock(index, RDFUtil.parseTurtle(rdfPayload), previousHash);
    }

    /**
     * Creates a block from already parsed statements. Nothing is stored until the block is
     * appended with {@link #appendBlock(Block)}, which must be called on this ledger. Contexts of
     * supplied statements are ignored.
     *
     * @param index
     *            the block index
     * @param statements
     *            the block data
     * @param previousHash
     *            the hash of the block the new block will follow
     * @return the created block
     * @throws SerializationException
     *             if some term is malformed
     * @throws CanonicalizationTimeoutException
     *             if the canonicalization budget is exhausted
     */
    public Block createBlock(final long index, final Iterable<? extends Statement> statements,
            final String previousHash) throws SerializationException,
            CanonicalizationTimeoutException {
        Preconditions.checkArgument(index >= 0, "Invalid block index %s", index);
        Preconditions.checkNotNull(previousHash);
        checkState();

        final NamedGraph graph = NamedGraph.create(PC.blockGraph(index), statements);
        final CanonicalizationResult result = this.canonicalizer.canonicalize(graph);
        final Block block = Block.create(index, Data.newTimestamp(), graph.getID(),
                previousHash, result.getHash(), result.getAlgorithm());
        this.candidates.put(block, graph);
        LOGGER.debug("Created {} ({} statements, {})", block, graph.size(), result.getTier());
        return block;
    }

    /**
     * Appends a block to the chain, storing its graph and recording it in the metadata graph.
     *
     * @param block
     *            a block returned by {@code createBlock} on this ledger and not yet appended,
     *            whose index must follow the last one and whose previous hash must be the last
     *            block hash
     * @throws IllegalArgumentException
     *             if the block was not created by this ledger, or was already appended
     * @throws ChainLinkException
     *             if the block does not extend the chain; the chain and the store are unchanged
     * @throws StoreException
     *             if the block graph or metadata cannot be stored; the chain is unchanged
     */
    public void appendBlock(final Block block) throws ChainLinkException, StoreException {
        Preconditions.checkNotNull(block);
        checkState();
        final ReentrantLock lock = this.chain.getLock();
        lock.lock();
        try {
            this.chain.checkNext(block);
            final NamedGraph graph = this.candidates.getIfPresent(block);
            Preconditions.checkArgument(graph != null, "Block %s not created by this ledger "
                    + "or already appended", block.getIndex());
            this.graphStore.storeGraph(block.getGraphRef(), graph);
            this.graphStore.addToGraph(PC.BLOCKCHAIN, BlockMetadata.describe(block));
            this.chain.append(block);
            this.candidates.invalidate(block);
            LOGGER.info("Appended block {}, hash {}", block.getIndex(), block.getBlockHash());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Creates a block from a Turtle payload and appends it to the chain, as one step.
     *
     * @param rdfPayload
     *            the block data, as Turtle text
     * @return the appended block
     * @throws LedgerException
     *             if the block cannot be created or appended
     */
    public Block addBlock(final String rdfPayload) throws LedgerException {
        return addBlock(RDFUtil.parseTurtle(rdfPayload));
    }

    /**
     * Creates a block from already parsed statements and appends it to the chain, as one step.
     *
     * @param statements
     *            the block data
     * @return the appended block
     * @throws LedgerException
     *             if the block cannot be created or appended
     */
    public Block addBlock(final Iterable<? extends Statement> statements) throws LedgerException {
        checkState();
        final ReentrantLock lock = this.chain.getLock();
        lock.lock();
        try {
            final Block last = this.chain.getLast();
            final Block block = createBlock(last.getIndex() + 1, statements, last.getBlockHash());
            appendBlock(block);
            return block;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Validates the chain with the default validation mode.
     *
     * @return the validation report
     * @throws StoreException
     *             if the store fails while retrieving block graphs
     */
    public ValidationReport validateChain() throws StoreException {
        return validateChain(this.defaultValidationMode);
    }

    /**
     * Validates the chain. For every block, in index order, the block graph is re-fetched and
     * re-canonicalized with the recorded algorithm, and the block hash is recomputed from the
     * recorded fields. Diverging hashes are reported as {@link IntegrityException}s, broken links
     * to the previous block as {@link ChainLinkException}s. Blocks whose graph cannot be
     * canonicalized are reported with the corresponding exception. Nothing is repaired.
     *
     * @param mode
     *            whether to stop at the first finding
     * @return the validation report
     * @throws StoreException
     *             if the store fails while retrieving block graphs
     */
    public ValidationReport validateChain(final ValidationMode mode) throws StoreException {
        Preconditions.checkNotNull(mode);
        checkState();

        final long ts = System.currentTimeMillis();
        final ImmutableList<Block> blocks = this.chain.getBlocks();
        final ListeningExecutorService executor = this.executor != null ? this.executor : Data
                .getExecutor();

        final List<Future<CanonicalizationResult>> futures = Lists.newArrayList();
        for (final Block block : blocks) {
            futures.add(executor.submit(new Callable<CanonicalizationResult>() {

                @Override
                public CanonicalizationResult call() throws Exception {
                    final NamedGraph graph = Ledger.this.graphStore.getGraph(block
                            .getGraphRef());
                    return Ledger.this.canonicalizer.canonicalize(graph, block.getAlgorithm());
                }

            }));
        }

        final List<ValidationReport.Finding> findings = Lists.newArrayList();
        int checked = 0;
        try {
            for (int i = 0; i < blocks.size(); ++i) {
                final Block block = blocks.get(i);
                final Block previous = i == 0 ? null : blocks.get(i - 1);
                ++checked;
                final List<LedgerException> problems = check(block, previous, futures.get(i));
                for (final LedgerException problem : problems) {
                    LOGGER.warn("Validation finding on block {}: {}", block.getIndex(),
                            problem.getMessage());
                    findings.add(new ValidationReport.Finding(block.getIndex(), problem));
                }
                if (mode == ValidationMode.FAIL_FAST && !findings.isEmpty()) {
                    break;
                }
            }
        } finally {
            for (final Future<?> future : futures) {
                future.cancel(false);
            }
        }

        final ValidationReport report = new ValidationReport(mode, checked, findings);
        if (report.isValid()) {
            LOGGER.info("Chain valid, {} blocks checked in {} ms", checked,
                    System.currentTimeMillis() - ts);
        } else {
            LOGGER.warn("Chain invalid, {} findings over {} blocks checked in {} ms",
                    findings.size(), checked, System.currentTimeMillis() - ts);
        }
        return report;
    }

    private List<LedgerException> check(final Block block, @Nullable final Block previous,
            final Future<CanonicalizationResult> future) throws StoreException {

        final List<LedgerException> problems = Lists.newArrayList();

        final long expectedIndex = previous == null ? 0 : previous.getIndex() + 1;
        final String expectedPreviousHash = previous == null ? Block.GENESIS_PREVIOUS_HASH
                : previous.getBlockHash();
        if (block.getIndex() != expectedIndex) {
            problems.add(new ChainLinkException(block.getIndex(), expectedPreviousHash, block
                    .getPreviousHash(), "expected index " + expectedIndex));
        } else if (!expectedPreviousHash.equals(block.getPreviousHash())) {
            problems.add(new ChainLinkException(block.getIndex(), expectedPreviousHash, block
                    .getPreviousHash(), "previous hash does not match hash of block "
                    + (block.getIndex() - 1)));
        }

        final String blockHash = Block.computeHash(block.getIndex(), block.getTimestamp(),
                block.getCanonicalHash(), block.getPreviousHash());
        if (!blockHash.equals(block.getBlockHash())) {
            problems.add(new IntegrityException(block.getIndex(),
                    IntegrityException.Kind.BLOCK_HASH, block.getBlockHash(), blockHash));
        }

        try {
            final CanonicalHash canonicalHash = future.get().getHash();
            if (!canonicalHash.equals(block.getCanonicalHash())) {
                problems.add(new IntegrityException(block.getIndex(),
                        IntegrityException.Kind.CANONICAL_HASH, block.getCanonicalHash()
                                .toHex(), canonicalHash.toHex()));
            }
        } catch (final InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted", ex);
        } catch (final ExecutionException ex) {
            final Throwable cause = ex.getCause();
            if (cause instanceof StoreException) {
                throw (StoreException) cause;
            } else if (cause instanceof LedgerException) {
                problems.add((LedgerException) cause);
            } else if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            } else if (cause instanceof Error) {
                throw (Error) cause;
            } else {
                throw new IllegalStateException("Unexpected exception", cause);
            }
        }

        return problems;
    }

    /**
     * Fetches a graph from the store and canonicalizes it with the algorithm selected by its
     * complexity tier.
     *
     * @param graphID
     *            the graph URI
     * @return the canonical hash of the graph (an empty graph is hashed as well)
     * @throws StoreException
     *             if the graph cannot be retrieved
     * @throws SerializationException
     *             if some term of the graph is malformed
     * @throws CanonicalizationTimeoutException
     *             if the canonicalization budget is exhausted
     */
    public CanonicalHash canonicalHashOf(final URI graphID) throws StoreException,
            SerializationException, CanonicalizationTimeoutException {
        checkState();
        return this.canonicalizer.canonicalize(this.graphStore.getGraph(graphID)).getHash();
    }

    /**
     * Returns the chain. Its snapshot methods never block, also while blocks are appended.
     *
     * @return the chain
     */
    public Chain getChain() {
        return this.chain;
    }

    public GraphStore getGraphStore() {
        return this.graphStore;
    }

    public Canonicalizer getCanonicalizer() {
        return this.canonicalizer;
    }

    /**
     * Closes the ledger and its store, rolling back pending store transactions. Calling this
     * method more than once has no effect.
     */
    @Override
    public void close() {
        if (this.state.getAndSet(CLOSED) != CLOSED) {
            this.tripleStore.close();
            LOGGER.info("Ledger closed, {} blocks", this.chain.size());
        }
    }

    @Override
    public String toString() {
        return "Ledger[" + this.chain + "]";
    }

    private void checkState() {
        Preconditions.checkState(this.state.get() == INITIALIZED,
                "Ledger not initialized or already closed");
    }

    private static List<Statement> genesisStatements() {
        final ValueFactory vf = Data.getValueFactory();
        return ImmutableList.of(vf.createStatement(vf.createURI("http://example.org/genesis"),
                vf.createURI("http://example.org/type"), vf.createLiteral("Genesis Block")));
    }

    public static final class Builder {

        private final TripleStore tripleStore;

        @Nullable
        private Canonicalizer canonicalizer;

        @Nullable
        private Long maxIterations;

        @Nullable
        private Long timeoutMillis;

        @Nullable
        private Integer cacheSize;

        @Nullable
        private ExecutorService executor;

        @Nullable
        private ValidationMode validationMode;

        @Nullable
        private String synchronizerSpec;

        Builder(final TripleStore tripleStore) {
            this.tripleStore = Preconditions.checkNotNull(tripleStore);
        }

        /**
         * Sets the canonicalizer to use; if set, the budget and cache settings of this builder
         * are ignored.
         */
        public Builder canonicalizer(@Nullable final Canonicalizer canonicalizer) {
            this.canonicalizer = canonicalizer;
            return this;
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

        public Builder validationMode(@Nullable final ValidationMode validationMode) {
            this.validationMode = validationMode;
            return this;
        }

        public Builder synchronizer(@Nullable final String synchronizerSpec) {
            this.synchronizerSpec = synchronizerSpec;
            return this;
        }

        public Ledger build() {
            return new Ledger(this);
        }

    }

}
