package org.provchain.vocabulary;

import org.openrdf.model.Namespace;
import org.openrdf.model.URI;
import org.openrdf.model.impl.NamespaceImpl;
import org.openrdf.model.impl.ValueFactoryImpl;

/**
 * Constants for the ledger vocabulary, used to name block graphs and to describe blocks in the
 * chain metadata graph.
 */
public final class PC {

    /** Recommended prefix for the vocabulary namespace: "pc". */
    public static final String PREFIX = "pc";

    /** Vocabulary namespace: "http://provchain.org/". */
    public static final String NAMESPACE = "http://provchain.org/";

    /** Immutable {@link Namespace} constant for the vocabulary namespace. */
    public static final Namespace NS = new NamespaceImpl(PREFIX, NAMESPACE);

    /** Namespace of block data graphs: "http://provchain.org/block/". */
    public static final String BLOCK_NAMESPACE = NAMESPACE + "block/";

    // GRAPHS

    /** Named graph pc:blockchain, holding the description of every block of the chain. */
    public static final URI BLOCKCHAIN = createURI("blockchain");

    // CLASSES

    /** Class pc:Block. */
    public static final URI BLOCK = createURI("Block");

    /** Class pc:GenesisBlock, the type of the block with index 0. */
    public static final URI GENESIS_BLOCK = createURI("GenesisBlock");

    // PROPERTIES

    /** Property pc:hasIndex. */
    public static final URI HAS_INDEX = createURI("hasIndex");

    /** Property pc:hasTimestamp. */
    public static final URI HAS_TIMESTAMP = createURI("hasTimestamp");

    /** Property pc:hasHash. */
    public static final URI HAS_HASH = createURI("hasHash");

    /** Property pc:hasPreviousHash. */
    public static final URI HAS_PREVIOUS_HASH = createURI("hasPreviousHash");

    /** Property pc:hasDataGraphIRI. */
    public static final URI HAS_DATA_GRAPH_IRI = createURI("hasDataGraphIRI");

    /** Property pc:hasCanonicalHash. */
    public static final URI HAS_CANONICAL_HASH = createURI("hasCanonicalHash");

    /** Property pc:hasAlgorithm. */
    public static final URI HAS_ALGORITHM = createURI("hasAlgorithm");

    // HELPER METHODS

    /**
     * Returns the URI of the data graph of the block with the index specified.
     *
     * @param index
     *            the block index
     * @return the graph URI, {@code http://provchain.org/block/{index}}
     */
    public static URI blockGraph(final long index) {
        return ValueFactoryImpl.getInstance().createURI(BLOCK_NAMESPACE + index);
    }

    private static URI createURI(final String localName) {
        return ValueFactoryImpl.getInstance().createURI(NAMESPACE, localName);
    }

    private PC() {
    }

}
