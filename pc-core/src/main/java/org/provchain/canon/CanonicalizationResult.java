package org.provchain.canon;

import java.io.Serializable;

import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;
import com.google.common.base.Preconditions;

/**
 * The outcome of canonicalizing a graph: its canonical hash, the algorithm that produced it and
 * the complexity tier of the graph.
 */
public final class CanonicalizationResult implements Serializable {

    private static final long serialVersionUID = 1L;

    private final CanonicalHash hash;

    private final CanonicalizationAlgorithm algorithm;

    private final ComplexityTier tier;

    public CanonicalizationResult(final CanonicalHash hash,
            final CanonicalizationAlgorithm algorithm, final ComplexityTier tier) {
        this.hash = Preconditions.checkNotNull(hash);
        this.algorithm = Preconditions.checkNotNull(algorithm);
        this.tier = Preconditions.checkNotNull(tier);
    }

    public CanonicalHash getHash() {
        return this.hash;
    }

    public CanonicalizationAlgorithm getAlgorithm() {
        return this.algorithm;
    }

    public ComplexityTier getTier() {
        return this.tier;
    }

    @Override
    public boolean equals(final Object object) {
        if (object == this) {
            return true;
        }
        if (!(object instanceof CanonicalizationResult)) {
            return false;
        }
        final CanonicalizationResult other = (CanonicalizationResult) object;
        return this.hash.equals(other.hash) && this.algorithm == other.algorithm
                && this.tier == other.tier;
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(this.hash, this.algorithm, this.tier);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).add("hash", this.hash)
                .add("algorithm", this.algorithm).add("tier", this.tier).toString();
    }

}
