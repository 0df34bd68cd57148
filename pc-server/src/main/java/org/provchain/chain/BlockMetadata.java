package org.provchain.chain;

import java.util.Collection;
import java.util.List;
import java.util.Map;

import javax.annotation.Nullable;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ListMultimap;
import com.google.common.collect.Maps;
import com.google.common.collect.MultimapBuilder;

import org.openrdf.model.Literal;
import org.openrdf.model.Resource;
import org.openrdf.model.Statement;
import org.openrdf.model.URI;
import org.openrdf.model.Value;
import org.openrdf.model.ValueFactory;
import org.openrdf.model.vocabulary.RDF;
import org.openrdf.model.vocabulary.XMLSchema;

import org.provchain.canon.CanonicalHash;
import org.provchain.canon.CanonicalizationAlgorithm;
import org.provchain.data.Data;
import org.provchain.runtime.DataCorruptedException;
import org.provchain.vocabulary.PC;

/**
 * Conversion of blocks to and from their RDF description in the chain metadata graph
 * {@code pc:blockchain}.
 */
final class BlockMetadata {

    static List<Statement> describe(final Block block) {
        final ValueFactory vf = Data.getValueFactory();
        final URI subject = PC.blockGraph(block.getIndex());
        return ImmutableList.of(
                vf.createStatement(subject, RDF.TYPE, block.isGenesis() ? PC.GENESIS_BLOCK
                        : PC.BLOCK),
                vf.createStatement(subject, PC.HAS_INDEX,
                        vf.createLiteral(Long.toString(block.getIndex()), XMLSchema.INTEGER)),
                vf.createStatement(subject, PC.HAS_TIMESTAMP,
                        vf.createLiteral(block.getTimestamp(), XMLSchema.DATETIME)),
                vf.createStatement(subject, PC.HAS_HASH, vf.createLiteral(block.getBlockHash())),
                vf.createStatement(subject, PC.HAS_PREVIOUS_HASH,
                        vf.createLiteral(block.getPreviousHash())),
                vf.createStatement(subject, PC.HAS_DATA_GRAPH_IRI, block.getGraphRef()),
                vf.createStatement(subject, PC.HAS_CANONICAL_HASH,
                        vf.createLiteral(block.getCanonicalHash().toHex())),
                vf.createStatement(subject, PC.HAS_ALGORITHM, block.getAlgorithm().toLiteral()));
    }

    /**
     * Rebuilds the blocks described by the statements of the metadata graph.
     *
     * @param statements
     *            the content of the metadata graph
     * @return the blocks, sorted by index
     * @throws DataCorruptedException
     *             if a block description is incomplete or malformed, or two descriptions share
     *             the same index
     */
    static List<Block> parse(final Iterable<? extends Statement> statements)
            throws DataCorruptedException {

        final ListMultimap<Resource, Statement> bySubject = MultimapBuilder.linkedHashKeys()
                .arrayListValues().build();
        for (final Statement statement : statements) {
            bySubject.put(statement.getSubject(), statement);
        }

        final Map<Long, Block> blocks = Maps.newTreeMap();
        for (final Map.Entry<Resource, Collection<Statement>> entry : bySubject.asMap()
                .entrySet()) {
            final Collection<Statement> description = entry.getValue();
            final Value indexValue = get(description, PC.HAS_INDEX);
            if (indexValue == null) {
                continue; // not a block description
            }
            final Block block;
            try {
                final long index = ((Literal) indexValue).longValue();
                final String timestamp = require(description, PC.HAS_TIMESTAMP).stringValue();
                final URI graphRef = (URI) require(description, PC.HAS_DATA_GRAPH_IRI);
                final String previousHash = require(description, PC.HAS_PREVIOUS_HASH)
                        .stringValue();
                final CanonicalHash canonicalHash = CanonicalHash.fromHex(require(description,
                        PC.HAS_CANONICAL_HASH).stringValue());
                final CanonicalizationAlgorithm algorithm = CanonicalizationAlgorithm
                        .valueOf(require(description, PC.HAS_ALGORITHM));
                final String blockHash = require(description, PC.HAS_HASH).stringValue();
                block = Block.restore(index, timestamp, graphRef, previousHash, canonicalHash,
                        algorithm, blockHash);
            } catch (final DataCorruptedException ex) {
                throw ex;
            } catch (final RuntimeException ex) {
                throw new DataCorruptedException("Malformed description of block "
                        + Data.toString(entry.getKey()) + ": " + ex.getMessage(), ex);
            }
            if (blocks.put(block.getIndex(), block) != null) {
                throw new DataCorruptedException("Multiple descriptions of block "
                        + block.getIndex());
            }
        }
        return ImmutableList.copyOf(blocks.values());
    }

    @Nullable
    private static Value get(final Iterable<Statement> description, final URI property) {
        for (final Statement statement : description) {
            if (statement.getPredicate().equals(property)) {
                return statement.getObject();
            }
        }
        return null;
    }

    private static Value require(final Iterable<Statement> description, final URI property)
            throws DataCorruptedException {
        final Value value = get(description, property);
        if (value == null) {
            throw new DataCorruptedException("Missing " + Data.toString(property)
                    + " in block description");
        }
        return value;
    }

    private BlockMetadata() {
    }

}
