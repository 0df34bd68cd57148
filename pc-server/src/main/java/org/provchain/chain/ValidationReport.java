package org.provchain.chain;

import java.io.Serializable;
import java.util.List;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import org.provchain.ChainLinkException;
import org.provchain.IntegrityException;
import org.provchain.LedgerException;

/**
 * The outcome of a chain validation: the number of blocks checked and the findings, in block
 * index order. A chain is valid if there are no findings.
 */
public final class ValidationReport implements Serializable {

    private static final long serialVersionUID = 1L;

    private final ValidationMode mode;

    private final int checkedBlocks;

    private final ImmutableList<Finding> findings;

    ValidationReport(final ValidationMode mode, final int checkedBlocks,
            final Iterable<Finding> findings) {
        this.mode = Preconditions.checkNotNull(mode);
        this.checkedBlocks = checkedBlocks;
        this.findings = ImmutableList.copyOf(findings);
    }

    public ValidationMode getMode() {
        return this.mode;
    }

    public int getCheckedBlocks() {
        return this.checkedBlocks;
    }

    public List<Finding> getFindings() {
        return this.findings;
    }

    public boolean isValid() {
        return this.findings.isEmpty();
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).add("mode", this.mode)
                .add("checkedBlocks", this.checkedBlocks).add("findings", this.findings)
                .toString();
    }

    /**
     * A problem detected on a block: an {@link IntegrityException}, a
     * {@link ChainLinkException}, or the error that prevented the block from being checked.
     */
    public static final class Finding implements Serializable {

        private static final long serialVersionUID = 1L;

        private final long index;

        private final LedgerException exception;

        Finding(final long index, final LedgerException exception) {
            this.index = index;
            this.exception = Preconditions.checkNotNull(exception);
        }

        public long getIndex() {
            return this.index;
        }

        public LedgerException getException() {
            return this.exception;
        }

        @Override
        public String toString() {
            return this.index + ": " + this.exception.getMessage();
        }

    }

}
