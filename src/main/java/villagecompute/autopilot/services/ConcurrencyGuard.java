/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.autopilot.services;

import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

/**
 * Process-wide mutual exclusion for product generation.
 *
 * <p>
 * Two kinds of lock are held here:
 * <ul>
 * <li><b>Item locks</b> - at most one generation per product id at any instant</li>
 * <li><b>Batch lock</b> - at most one bulk run per process</li>
 * </ul>
 *
 * <p>
 * Acquisition never blocks or queues. A contended acquire returns {@code false} (or an empty lease) and the caller
 * reports the item as skipped, not failed. Prefer the lease methods with try-with-resources so release happens on
 * every exit path.
 *
 * <p>
 * This class is the single owner of lock state. {@link #generatingIds()} hands out a read-only copy for status views.
 */
@ApplicationScoped
public class ConcurrencyGuard {

    private static final Logger LOG = Logger.getLogger(ConcurrencyGuard.class);

    private final Set<UUID> lockedItems = ConcurrentHashMap.newKeySet();

    private final AtomicBoolean batchLock = new AtomicBoolean(false);

    /**
     * Attempts to lock a product for generation.
     *
     * @param itemId
     *            product id
     * @return true if the caller now owns the lock, false if another generation already holds it
     */
    public boolean tryAcquireItem(UUID itemId) {
        boolean acquired = lockedItems.add(itemId);
        if (!acquired) {
            LOG.debugf("Item lock contended: %s", itemId);
        }
        return acquired;
    }

    public void releaseItem(UUID itemId) {
        lockedItems.remove(itemId);
    }

    public boolean isItemLocked(UUID itemId) {
        return lockedItems.contains(itemId);
    }

    /**
     * Attempts to take the process-wide bulk lock.
     *
     * @return true if the caller now owns the lock
     */
    public boolean tryAcquireBatch() {
        return batchLock.compareAndSet(false, true);
    }

    public void releaseBatch() {
        batchLock.set(false);
    }

    public boolean isBatchRunning() {
        return batchLock.get();
    }

    /**
     * Scoped variant of {@link #tryAcquireItem(UUID)}.
     *
     * @param itemId
     *            product id
     * @return a lease to close when done, or empty when contended
     */
    public Optional<ItemLease> acquireItem(UUID itemId) {
        return tryAcquireItem(itemId) ? Optional.of(new ItemLease(itemId)) : Optional.empty();
    }

    /**
     * Scoped variant of {@link #tryAcquireBatch()}.
     *
     * @return a lease to close when done, or empty when a bulk run is already active
     */
    public Optional<BatchLease> acquireBatch() {
        return tryAcquireBatch() ? Optional.of(new BatchLease()) : Optional.empty();
    }

    /**
     * Snapshot of products currently being generated. Not backed by the lock set.
     */
    public Set<UUID> generatingIds() {
        return Set.copyOf(lockedItems);
    }

    /**
     * Held item lock. Closing releases it; closing twice is harmless.
     */
    public final class ItemLease implements AutoCloseable {

        private final UUID itemId;
        private final AtomicBoolean open = new AtomicBoolean(true);

        private ItemLease(UUID itemId) {
            this.itemId = itemId;
        }

        public UUID itemId() {
            return itemId;
        }

        @Override
        public void close() {
            if (open.compareAndSet(true, false)) {
                releaseItem(itemId);
            }
        }
    }

    /**
     * Held batch lock. Closing releases it; closing twice is harmless.
     */
    public final class BatchLease implements AutoCloseable {

        private final AtomicBoolean open = new AtomicBoolean(true);

        private BatchLease() {
        }

        @Override
        public void close() {
            if (open.compareAndSet(true, false)) {
                releaseBatch();
            }
        }
    }
}
