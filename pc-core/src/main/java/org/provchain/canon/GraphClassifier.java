package org.provchain.canon;

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.google.common.collect.HashMultimap;
import com.google.common.collect.ListMultimap;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.collect.MultimapBuilder;
import com.google.common.collect.Sets;
import com.google.common.hash.HashFunction;
import com.google.common.hash.Hasher;
import com.google.common.hash.Hashing;

import org.openrdf.model.BNode;
import org.openrdf.model.Statement;
import org.openrdf.model.Value;

import org.provchain.data.Data;
import org.provchain.data.NamedGraph;

/**
 * Classifies graphs in {@link ComplexityTier}s, based on the way blank nodes are connected.
 * <p>
 * Graphs without blank nodes are {@code SIMPLE}; graphs where no statement links two blank
 * nodes are {@code MODERATE}. Otherwise the undirected multigraph of blank node to blank node
 * statements is examined: any cycle (self loops and parallel edges included) makes the graph
 * {@code PATHOLOGICAL}. Acyclic structures are colored by iterative refinement, starting from
 * the statements touching each blank node and then mixing in the colors of linked blank nodes
 * until the color partition stops splitting; two blank nodes sharing a final color make the
 * graph {@code PATHOLOGICAL}, otherwise it is {@code COMPLEX}.
 * </p>
 * <p>
 * Classification is a pure function of the graph content and never fails.
 * </p>
 */
public final class GraphClassifier {

    private static final HashFunction COLOR_FUNCTION = Hashing.sha256();

    private GraphClassifier() {
    }

    public static ComplexityTier classify(final NamedGraph graph) {

        final Set<BNode> bnodes = graph.getBlankNodes();
        if (bnodes.isEmpty()) {
            return ComplexityTier.SIMPLE;
        }

        final List<Statement> links = Lists.newArrayList();
        for (final Statement statement : graph) {
            if (statement.getSubject() instanceof BNode && statement.getObject() instanceof BNode) {
                links.add(statement);
            }
        }
        if (links.isEmpty()) {
            return ComplexityTier.MODERATE;
        }

        if (hasCycle(links)) {
            return ComplexityTier.PATHOLOGICAL;
        }

        final Map<BNode, String> colors = refineColors(graph, bnodes, links);
        final Set<String> distinct = Sets.newHashSet(colors.values());
        return distinct.size() < bnodes.size() ? ComplexityTier.PATHOLOGICAL
                : ComplexityTier.COMPLEX;
    }

    private static boolean hasCycle(final List<Statement> links) {
        final Map<BNode, BNode> parents = Maps.newHashMap();
        for (final Statement link : links) {
            final BNode subject = (BNode) link.getSubject();
            final BNode object = (BNode) link.getObject();
            if (subject.equals(object)) {
                return true;
            }
            final BNode subjectRoot = find(parents, subject);
            final BNode objectRoot = find(parents, object);
            if (subjectRoot.equals(objectRoot)) {
                return true;
            }
            parents.put(subjectRoot, objectRoot);
        }
        return false;
    }

    private static BNode find(final Map<BNode, BNode> parents, final BNode node) {
        BNode root = node;
        for (BNode parent = parents.get(root); parent != null; parent = parents.get(root)) {
            root = parent;
        }
        // path compression
        BNode current = node;
        while (!current.equals(root)) {
            final BNode next = parents.get(current);
            parents.put(current, root);
            current = next;
        }
        return root;
    }

    private static Map<BNode, String> refineColors(final NamedGraph graph,
            final Set<BNode> bnodes, final List<Statement> links) {

        // Initial colors from the statements touching each blank node, with blank nodes masked
        final ListMultimap<BNode, String> signatures = MultimapBuilder.hashKeys()
                .arrayListValues().build();
        for (final Statement statement : graph) {
            final Value subject = statement.getSubject();
            final Value object = statement.getObject();
            if (subject instanceof BNode) {
                signatures.put((BNode) subject, mask(statement, (BNode) subject));
            }
            if (object instanceof BNode && !object.equals(subject)) {
                signatures.put((BNode) object, mask(statement, (BNode) object));
            }
        }
        Map<BNode, String> colors = Maps.newHashMap();
        for (final BNode bnode : bnodes) {
            colors.put(bnode, hash("", signatures.get(bnode)));
        }

        // Neighbors along blank node links, with direction and predicate
        final HashMultimap<BNode, Statement> incident = HashMultimap.create();
        for (final Statement link : links) {
            incident.put((BNode) link.getSubject(), link);
            incident.put((BNode) link.getObject(), link);
        }

        int numColors = Sets.newHashSet(colors.values()).size();
        for (int round = 0; round < bnodes.size() && numColors < bnodes.size(); ++round) {
            final Map<BNode, String> refined = Maps.newHashMap();
            for (final BNode bnode : bnodes) {
                final List<String> neighbors = Lists.newArrayList();
                for (final Statement link : incident.get(bnode)) {
                    final boolean outgoing = link.getSubject().equals(bnode);
                    final BNode other = (BNode) (outgoing ? link.getObject() : link.getSubject());
                    neighbors.add((outgoing ? "+" : "-") + link.getPredicate().stringValue()
                            + " " + colors.get(other));
                }
                refined.put(bnode, hash(colors.get(bnode), neighbors));
            }
            final int numRefined = Sets.newHashSet(refined.values()).size();
            colors = refined;
            if (numRefined == numColors) {
                break;
            }
            numColors = numRefined;
        }
        return colors;
    }

    private static String mask(final Statement statement, final BNode reference) {
        return render(statement.getSubject(), reference) + " " + statement.getPredicate() + " "
                + render(statement.getObject(), reference);
    }

    private static String render(final Value value, final BNode reference) {
        if (value instanceof BNode) {
            return value.equals(reference) ? "_:a" : "_:z";
        }
        return Data.toString(value);
    }

    private static String hash(final String seed, final List<String> items) {
        final List<String> sorted = Lists.newArrayList(items);
        Collections.sort(sorted);
        final Hasher hasher = COLOR_FUNCTION.newHasher();
        hasher.putString(seed, StandardCharsets.UTF_8);
        for (final String item : sorted) {
            hasher.putChar('\n').putString(item, StandardCharsets.UTF_8);
        }
        return hasher.hash().toString();
    }

}
