package org.provchain.canon;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Map;

import javax.annotation.Nullable;

import com.google.common.base.Function;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ListMultimap;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.collect.MultimapBuilder;

import org.openrdf.model.BNode;
import org.openrdf.model.Statement;

import org.provchain.CanonicalizationTimeoutException;
import org.provchain.SerializationException;
import org.provchain.data.NamedGraph;

/**
 * RDFC-1.0 style canonicalization, exact for any graph that can be processed within the
 * configured budget.
 * <p>
 * Blank nodes first receive a hash of the statements touching them (first-degree hash); nodes
 * with a unique hash get canonical identifiers {@code c14n0}, {@code c14n1}, ... in hash order,
 * and the step is repeated until no further unique hash appears. Remaining groups of nodes
 * sharing a hash are ordered with the N-degree hash, which explores the related blank nodes of a
 * candidate under all permutations and keeps the lexicographically smallest path. The statements
 * are finally written as canonical N-Triples with the canonical identifiers, sorted, and hashed.
 * </p>
 * <p>
 * The N-degree exploration runs on an explicit stack of frames instead of the call stack. Each
 * step consumes one unit of an iteration budget and is checked against an optional wall-clock
 * budget and the interruption status of the current thread; any of these conditions aborts the
 * call with a {@link CanonicalizationTimeoutException}. Instances are stateless and thread safe.
 * </p>
 */
public final class StandardCanonicalizer {

    /** Default maximum number of steps per canonicalization. */
    public static final long DEFAULT_MAX_ITERATIONS = 100000;

    private static final String CANONICAL_PREFIX = "c14n";

    private static final String TEMPORARY_PREFIX = "b";

    private final long maxIterations;

    private final long timeoutMillis;

    public StandardCanonicalizer() {
        this(DEFAULT_MAX_ITERATIONS, 0L);
    }

    /**
     * Creates a new instance with the budget specified.
     *
     * @param maxIterations
     *            the maximum number of steps per call, greater than zero
     * @param timeoutMillis
     *            the maximum duration of a call in milliseconds, 0 for no limit
     */
    public StandardCanonicalizer(final long maxIterations, final long timeoutMillis) {
        Preconditions.checkArgument(maxIterations > 0, "Invalid iteration budget %s",
                maxIterations);
        Preconditions.checkArgument(timeoutMillis >= 0, "Invalid timeout %s", timeoutMillis);
        this.maxIterations = maxIterations;
        this.timeoutMillis = timeoutMillis;
    }

    public long getMaxIterations() {
        return this.maxIterations;
    }

    public long getTimeoutMillis() {
        return this.timeoutMillis;
    }

    public CanonicalHash canonicalize(final NamedGraph graph) throws SerializationException,
            CanonicalizationTimeoutException {
        return CanonicalHash.sha256(serialize(graph));
    }

    /**
     * Returns the canonical N-Triples document of the graph, i.e., its sorted statement lines
     * with blank nodes relabeled canonically.
     *
     * @param graph
     *            the graph
     * @return the canonical document
     * @throws SerializationException
     *             if some term is malformed
     * @throws CanonicalizationTimeoutException
     *             if the budget is exhausted or the thread is interrupted
     */
    public String serialize(final NamedGraph graph) throws SerializationException,
            CanonicalizationTimeoutException {
        final Run run = new Run(graph);
        final Map<BNode, String> labels = run.label();
        final Function<BNode, String> labeler = new Function<BNode, String>() {

            @Override
            public String apply(final BNode bnode) {
                return "_:" + labels.get(bnode);
            }

        };
        final List<String> lines = Lists.newArrayListWithCapacity(graph.size());
        for (final Statement statement : graph) {
            lines.add(CanonicalForm.formatLine(statement, labeler));
        }
        Collections.sort(lines);
        final StringBuilder builder = new StringBuilder();
        for (final String line : lines) {
            builder.append(line);
        }
        return builder.toString();
    }

    /**
     * Returns the canonical identifiers ({@code c14n0}, {@code c14n1}, ...) assigned to the blank
     * nodes of the graph.
     *
     * @param graph
     *            the graph
     * @return an immutable map from blank nodes to canonical identifiers
     * @throws SerializationException
     *             if some term is malformed
     * @throws CanonicalizationTimeoutException
     *             if the budget is exhausted or the thread is interrupted
     */
    public Map<BNode, String> label(final NamedGraph graph) throws SerializationException,
            CanonicalizationTimeoutException {
        return ImmutableMap.copyOf(new Run(graph).label());
    }

    private static final class Result {

        final String hash;

        final IdentifierIssuer issuer;

        Result(final String hash, final IdentifierIssuer issuer) {
            this.hash = hash;
            this.issuer = issuer;
        }

    }

    private final class Run {

        private final NamedGraph graph;

        private final ListMultimap<BNode, Statement> statements;

        private final Map<BNode, String> firstDegreeHashes;

        private final IdentifierIssuer canonicalIssuer;

        private final long startTime;

        private long iterations;

        Run(final NamedGraph graph) {
            this.graph = graph;
            this.statements = MultimapBuilder.linkedHashKeys().arrayListValues().build();
            this.firstDegreeHashes = Maps.newHashMap();
            this.canonicalIssuer = new IdentifierIssuer(CANONICAL_PREFIX);
            this.startTime = System.currentTimeMillis();
            for (final Statement statement : graph) {
                if (statement.getSubject() instanceof BNode) {
                    this.statements.put((BNode) statement.getSubject(), statement);
                }
                if (statement.getObject() instanceof BNode
                        && !statement.getObject().equals(statement.getSubject())) {
                    this.statements.put((BNode) statement.getObject(), statement);
                }
            }
        }

        Map<BNode, String> label() throws SerializationException,
                CanonicalizationTimeoutException {

            // Issue canonical identifiers to blank nodes with unique first-degree hashes
            final List<BNode> nonNormalized = Lists.newArrayList(this.statements.keySet());
            ListMultimap<String, BNode> hashToBlankNodes;
            boolean simple;
            do {
                simple = false;
                hashToBlankNodes = MultimapBuilder.treeKeys().arrayListValues().build();
                for (final BNode bnode : nonNormalized) {
                    tick();
                    hashToBlankNodes.put(hashFirstDegree(bnode), bnode);
                }
                for (final String hash : Lists.newArrayList(hashToBlankNodes.keySet())) {
                    final List<BNode> bnodes = hashToBlankNodes.get(hash);
                    if (bnodes.size() == 1) {
                        final BNode bnode = bnodes.get(0);
                        this.canonicalIssuer.issue(bnode);
                        nonNormalized.remove(bnode);
                        hashToBlankNodes.removeAll(hash);
                        simple = true;
                    }
                }
            } while (simple);

            // Order the remaining groups using N-degree hashes
            for (final String hash : hashToBlankNodes.keySet()) {
                final List<Result> results = Lists.newArrayList();
                for (final BNode bnode : hashToBlankNodes.get(hash)) {
                    if (this.canonicalIssuer.has(bnode)) {
                        continue;
                    }
                    final IdentifierIssuer issuer = new IdentifierIssuer(TEMPORARY_PREFIX);
                    issuer.issue(bnode);
                    results.add(hashNDegree(bnode, issuer));
                }
                Collections.sort(results, new Comparator<Result>() {

                    @Override
                    public int compare(final Result first, final Result second) {
                        return first.hash.compareTo(second.hash);
                    }

                });
                for (final Result result : results) {
                    for (final BNode bnode : result.issuer.issueOrder()) {
                        this.canonicalIssuer.issue(bnode);
                    }
                }
            }

            final Map<BNode, String> labels = Maps.newHashMap();
            for (final BNode bnode : this.statements.keySet()) {
                labels.put(bnode, this.canonicalIssuer.get(bnode));
            }
            return labels;
        }

        private void tick() throws CanonicalizationTimeoutException {
            ++this.iterations;
            final long elapsed = System.currentTimeMillis() - this.startTime;
            if (this.iterations > StandardCanonicalizer.this.maxIterations
                    || StandardCanonicalizer.this.timeoutMillis > 0
                    && elapsed > StandardCanonicalizer.this.timeoutMillis
                    || Thread.currentThread().isInterrupted()) {
                throw new CanonicalizationTimeoutException(this.graph.getID(), this.iterations,
                        elapsed);
            }
        }

        private String hashFirstDegree(final BNode reference) throws SerializationException {
            String hash = this.firstDegreeHashes.get(reference);
            if (hash == null) {
                final Function<BNode, String> labeler = new Function<BNode, String>() {

                    @Override
                    public String apply(final BNode bnode) {
                        return bnode.equals(reference) ? "_:a" : "_:z";
                    }

                };
                final List<String> lines = Lists.newArrayList();
                for (final Statement statement : this.statements.get(reference)) {
                    lines.add(CanonicalForm.formatLine(statement, labeler));
                }
                Collections.sort(lines);
                final StringBuilder builder = new StringBuilder();
                for (final String line : lines) {
                    builder.append(line);
                }
                hash = CanonicalHash.sha256Hex(builder);
                this.firstDegreeHashes.put(reference, hash);
            }
            return hash;
        }

        private String hashRelated(final BNode related, final Statement statement,
                final IdentifierIssuer issuer, final char position)
                throws SerializationException {
            final String id;
            if (this.canonicalIssuer.has(related)) {
                id = "_:" + this.canonicalIssuer.get(related);
            } else if (issuer.has(related)) {
                id = "_:" + issuer.get(related);
            } else {
                id = hashFirstDegree(related);
            }
            return CanonicalHash.sha256Hex(position
                    + CanonicalForm.format(statement.getPredicate()) + id);
        }

        private Result hashNDegree(final BNode bnode, final IdentifierIssuer issuer)
                throws SerializationException, CanonicalizationTimeoutException {
            final Deque<Frame> stack = new ArrayDeque<Frame>();
            stack.push(new Frame(bnode, issuer));
            while (true) {
                tick();
                final Frame frame = stack.peek();
                final Frame child = frame.step();
                if (child != null) {
                    stack.push(child);
                } else if (frame.result != null) {
                    stack.pop();
                    if (stack.isEmpty()) {
                        return frame.result;
                    }
                    stack.peek().accept(frame.result);
                }
            }
        }

        /**
         * The state of one (formerly recursive) N-degree hash computation. Each call to
         * {@link #step()} performs a bounded amount of work and either returns a child frame to
         * be computed first, or returns null, possibly after setting {@link #result}.
         */
        private final class Frame {

            private final BNode id;

            private IdentifierIssuer issuer;

            private final ListMultimap<String, BNode> hashToRelated;

            private final List<String> relatedHashes;

            private int hashIndex;

            private final StringBuilder data;

            @Nullable
            private Permutator permutator;

            @Nullable
            private String chosenPath;

            @Nullable
            private IdentifierIssuer chosenIssuer;

            @Nullable
            private IdentifierIssuer issuerCopy;

            @Nullable
            private StringBuilder path;

            @Nullable
            private List<BNode> recursion;

            private int recursionIndex;

            private boolean inPermutation;

            @Nullable
            Result result;

            Frame(final BNode id, final IdentifierIssuer issuer) throws SerializationException {
                this.id = id;
                this.issuer = issuer;
                this.hashToRelated = MultimapBuilder.treeKeys().arrayListValues().build();
                for (final Statement statement : Run.this.statements.get(id)) {
                    if (statement.getSubject() instanceof BNode
                            && !statement.getSubject().equals(id)) {
                        final BNode related = (BNode) statement.getSubject();
                        this.hashToRelated.put(hashRelated(related, statement, issuer, 's'),
                                related);
                    }
                    if (statement.getObject() instanceof BNode
                            && !statement.getObject().equals(id)) {
                        final BNode related = (BNode) statement.getObject();
                        this.hashToRelated.put(hashRelated(related, statement, issuer, 'o'),
                                related);
                    }
                }
                this.relatedHashes = Lists.newArrayList(this.hashToRelated.keySet());
                this.hashIndex = -1;
                this.data = new StringBuilder();
            }

            @Nullable
            Frame step() throws SerializationException {

                // Continue the recursion list of the current permutation
                if (this.inPermutation) {
                    if (this.recursionIndex < this.recursion.size()) {
                        return new Frame(this.recursion.get(this.recursionIndex),
                                this.issuerCopy);
                    }
                    this.inPermutation = false;
                    if (this.chosenPath == null || this.path.toString().compareTo(
                            this.chosenPath) < 0) {
                        this.chosenPath = this.path.toString();
                        this.chosenIssuer = this.issuerCopy;
                    }
                    return null;
                }

                // Start the next permutation of the current group
                if (this.permutator != null && this.permutator.hasNext()) {
                    startPermutation(this.permutator.next());
                    return null;
                }

                // Close the current group
                if (this.permutator != null) {
                    this.data.append(this.chosenPath);
                    this.issuer = this.chosenIssuer;
                    this.permutator = null;
                }

                // Open the next group or complete
                ++this.hashIndex;
                if (this.hashIndex >= this.relatedHashes.size()) {
                    this.result = new Result(CanonicalHash.sha256Hex(this.data), this.issuer);
                    return null;
                }
                final String hash = this.relatedHashes.get(this.hashIndex);
                this.data.append(hash);
                this.chosenPath = null;
                this.chosenIssuer = null;
                this.permutator = new Permutator(this.hashToRelated.get(hash));
                return null;
            }

            void accept(final Result childResult) {
                final BNode related = this.recursion.get(this.recursionIndex);
                this.path.append("_:").append(this.issuerCopy.issue(related));
                this.path.append('<').append(childResult.hash).append('>');
                this.issuerCopy = childResult.issuer;
                ++this.recursionIndex;
                if (exceedsChosenPath()) {
                    this.inPermutation = false;
                }
            }

            private void startPermutation(final List<BNode> permutation) {
                this.issuerCopy = this.issuer.copy();
                this.path = new StringBuilder();
                this.recursion = Lists.newArrayList();
                for (final BNode related : permutation) {
                    if (Run.this.canonicalIssuer.has(related)) {
                        this.path.append("_:").append(Run.this.canonicalIssuer.get(related));
                    } else {
                        if (!this.issuerCopy.has(related)) {
                            this.recursion.add(related);
                        }
                        this.path.append("_:").append(this.issuerCopy.issue(related));
                    }
                    if (exceedsChosenPath()) {
                        return;
                    }
                }
                this.recursionIndex = 0;
                this.inPermutation = true;
            }

            private boolean exceedsChosenPath() {
                return this.chosenPath != null && this.path.length() >= this.chosenPath.length()
                        && this.path.toString().compareTo(this.chosenPath) > 0;
            }

            @Override
            public String toString() {
                return "frame for _:" + this.id.getID() + " (group " + this.hashIndex + "/"
                        + this.relatedHashes.size() + ")";
            }

        }

    }

}
