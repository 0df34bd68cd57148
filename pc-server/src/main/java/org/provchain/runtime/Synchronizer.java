package org.provchain.runtime;

import java.util.concurrent.Semaphore;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;

/**
 * Regulates the number of concurrent read and write transactions on a store.
 * <p>
 * A synchronizer is created from a specification string {@code N[:W]}, where {@code N} is the
 * maximum number of concurrent transactions and {@code W} is either the maximum number of
 * concurrent write transactions (0 disables writes, the default) or {@code WX}, meaning that a
 * write transaction excludes any other transaction. The ledger store uses {@code 8:WX}: up to
 * eight parallel readers, or a single writer.
 * </p>
 */
public final class Synchronizer {

    public static final int WX = -1;

    private final int maxConcurrentTx;

    private final int maxWriteTx; // can assume special values 0 or WX

    private final Semaphore mainSemaphore;

    @Nullable
    private final Semaphore writeSemaphore;

    private Synchronizer(final int maxConcurrentTx, final int maxWriteTx) {

        Preconditions.checkArgument(maxConcurrentTx > 0, "Invalid max concurrent tx %s",
                maxConcurrentTx);
        Preconditions.checkArgument(maxWriteTx >= 0 && maxWriteTx <= maxConcurrentTx
                || maxWriteTx == WX, "Invalid max write tx %s", maxWriteTx);

        this.maxConcurrentTx = maxConcurrentTx;
        this.maxWriteTx = maxWriteTx;
        this.mainSemaphore = new Semaphore(maxConcurrentTx, true);
        this.writeSemaphore = maxWriteTx != 0 ? new Semaphore(Math.max(maxWriteTx, 1), true)
                : null;
    }

    public static Synchronizer create(final String spec) {

        final int index = spec.indexOf(':');
        final String first = (index <= 0 ? spec : spec.substring(0, index)).trim();
        final String second = index <= 0 ? null : spec.substring(index + 1).trim().toUpperCase();

        try {
            final int maxConcurrentTx = Integer.parseInt(first);
            final int maxWriteTx = second == null ? 0 : second.equals("WX") ? WX : Integer
                    .parseInt(second);
            return new Synchronizer(maxConcurrentTx, maxWriteTx);
        } catch (final RuntimeException ex) {
            throw new IllegalArgumentException("Illegal synchronizer specification '" + spec
                    + "'", ex);
        }
    }

    public static Synchronizer create(final int maxConcurrentTx, final int maxWriteTx) {
        return new Synchronizer(maxConcurrentTx, maxWriteTx);
    }

    public void beginExclusive() {
        try {
            this.mainSemaphore.acquire(this.maxConcurrentTx);
        } catch (final InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted", ex);
        }
    }

    public void endExclusive() {
        this.mainSemaphore.release(this.maxConcurrentTx);
    }

    public void beginTransaction(final boolean readOnly) {
        if (readOnly) {
            try {
                this.mainSemaphore.acquire();
            } catch (final InterruptedException ex) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Interrupted", ex);
            }
            return;
        }
        if (this.writeSemaphore == null) {
            throw new IllegalStateException("Write transactions have been disabled");
        }
        boolean writeAcquired = false;
        try {
            this.writeSemaphore.acquire();
            writeAcquired = true;
            this.mainSemaphore.acquire(this.maxWriteTx == WX ? this.maxConcurrentTx : 1);
        } catch (final InterruptedException ex) {
            if (writeAcquired) {
                this.writeSemaphore.release();
            }
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted", ex);
        }
    }

    public void endTransaction(final boolean readOnly) {
        if (readOnly) {
            this.mainSemaphore.release(1);
        } else {
            this.mainSemaphore.release(this.maxWriteTx == WX ? this.maxConcurrentTx : 1);
            this.writeSemaphore.release();
        }
    }

    @Override
    public String toString() {
        return this.maxConcurrentTx + ":" + (this.maxWriteTx == WX ? "WX" : this.maxWriteTx);
    }

}
