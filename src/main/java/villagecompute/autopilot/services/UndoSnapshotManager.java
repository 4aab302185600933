/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.autopilot.services;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

import com.google.common.util.concurrent.ThreadFactoryBuilder;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import villagecompute.autopilot.api.types.ImagePlacementType;
import villagecompute.autopilot.api.types.UndoResultType;
import villagecompute.autopilot.config.EnrichmentConfig;
import villagecompute.autopilot.data.models.Product;
import villagecompute.autopilot.data.models.ProductField;
import villagecompute.autopilot.observability.EnrichmentMetrics;

/**
 * Time-boxed, single-level undo for generation passes and image regrouping.
 *
 * <p>
 * <b>Scopes:</b>
 * <ul>
 * <li><b>single</b> - one snapshot per product, captured before that product is generated; {@link #undoSingle}
 * restores the captured fields and clears the product's enriched membership</li>
 * <li><b>bulk</b> - one snapshot covering every product of the latest bulk run; {@link #undoBulk} restores them in
 * parallel and reports restored/failed counts</li>
 * <li><b>structural</b> - one snapshot of image parent/position tuples captured before a grouping operation;
 * {@link #undoStructural} writes them back in parallel</li>
 * </ul>
 *
 * <p>
 * Every snapshot lives in a {@link SnapshotSlot}: capturing replaces the previous one, and the TTL
 * ({@code autopilot.undo.ttl-seconds}) is enforced by a timer. Undo after the TTL returns an EXPIRED result.
 */
@ApplicationScoped
public class UndoSnapshotManager {

    private static final Logger LOG = Logger.getLogger(UndoSnapshotManager.class);

    static final String SCOPE_SINGLE = "single";
    static final String SCOPE_BULK = "bulk";
    static final String SCOPE_STRUCTURAL = "structural";

    private static final int RESTORE_THREADS = 4;

    @Inject
    ProductStore productStore;

    @Inject
    ImagePlacementStore placementStore;

    @Inject
    EnrichmentRegistry enrichmentRegistry;

    @Inject
    EnrichmentConfig config;

    @Inject
    EnrichmentMetrics metrics;

    @Inject
    Clock clock;

    private final Map<UUID, SnapshotSlot<Map<ProductField, Object>>> singleSlots = new ConcurrentHashMap<>();

    private ScheduledExecutorService expiryTimer;
    private ExecutorService restorePool;
    private SnapshotSlot<Map<UUID, Map<ProductField, Object>>> bulkSlot;
    private SnapshotSlot<List<ImagePlacementType>> structuralSlot;

    @PostConstruct
    void init() {
        expiryTimer = Executors.newSingleThreadScheduledExecutor(
                new ThreadFactoryBuilder().setNameFormat("undo-expiry-%d").setDaemon(true).build());
        restorePool = Executors.newFixedThreadPool(RESTORE_THREADS,
                new ThreadFactoryBuilder().setNameFormat("undo-restore-%d").setDaemon(true).build());
        bulkSlot = new SnapshotSlot<>(SCOPE_BULK, clock, config.getUndoTtl(), expiryTimer);
        structuralSlot = new SnapshotSlot<>(SCOPE_STRUCTURAL, clock, config.getUndoTtl(), expiryTimer);
    }

    @PreDestroy
    void shutdown() {
        expiryTimer.shutdownNow();
        restorePool.shutdown();
    }

    /**
     * Captures a product's enrichable fields before it is generated.
     */
    public void captureSingle(Product product) {
        captureSingleSlot(product.id, "AI generation", ProductField.capture(product, ProductField.UNDO_FIELDS));
    }

    /**
     * Captures every product about to be processed by a bulk run as one snapshot. Also refreshes each product's single
     * snapshot, so one product can be undone on its own afterwards.
     *
     * @param label
     *            action label shown to the user
     * @param products
     *            products about to be mutated
     */
    public void captureBulk(String label, Collection<Product> products) {
        Map<UUID, Map<ProductField, Object>> states = new LinkedHashMap<>();
        for (Product product : products) {
            Map<ProductField, Object> state = ProductField.capture(product, ProductField.UNDO_FIELDS);
            states.put(product.id, state);
            captureSingleSlot(product.id, label, state);
        }
        bulkSlot.capture(label, states);
        LOG.debugf("Captured bulk undo snapshot '%s' for %d products", label, states.size());
    }

    /**
     * Captures the current parent and position of images about to be moved by a grouping operation.
     *
     * @param action
     *            the grouping operation
     * @param imageIds
     *            every image the operation will touch
     * @return number of placements captured
     */
    public int captureStructural(StructuralAction action, Collection<UUID> imageIds) {
        List<ImagePlacementType> placements = placementStore.findPlacements(imageIds);
        structuralSlot.capture(action.label(), List.copyOf(placements));
        LOG.debugf("Captured structural undo snapshot '%s' for %d images", action.label(), placements.size());
        return placements.size();
    }

    /**
     * Restores one product to its state before its latest generation.
     */
    public UndoResultType undoSingle(UUID productId) {
        SnapshotSlot<Map<ProductField, Object>> slot = singleSlots.get(productId);
        if (slot == null) {
            return record(SCOPE_SINGLE, UndoResultType.none());
        }
        SnapshotSlot.Taken<Map<ProductField, Object>> taken = slot.take();
        if (taken.state() != SnapshotSlot.State.READY) {
            singleSlots.remove(productId, slot);
            return record(SCOPE_SINGLE, stateResult(taken.state()));
        }
        singleSlots.remove(productId, slot);

        boolean restored = restoreProduct(productId, taken.snapshot().payload());
        return record(SCOPE_SINGLE, UndoResultType.of(restored ? 1 : 0, restored ? 0 : 1, "AI generation"));
    }

    /**
     * Restores every product captured by the latest bulk snapshot, in parallel, then discards the snapshot.
     */
    public UndoResultType undoBulk() {
        SnapshotSlot.Taken<Map<UUID, Map<ProductField, Object>>> taken = bulkSlot.take();
        if (taken.state() != SnapshotSlot.State.READY) {
            return record(SCOPE_BULK, stateResult(taken.state()));
        }

        Map<UUID, Map<ProductField, Object>> states = taken.snapshot().payload();
        Map<UUID, CompletableFuture<Boolean>> restores = new LinkedHashMap<>();
        states.forEach((id, fields) -> restores.put(id, restoreAsync(() -> restoreProduct(id, fields))));

        List<UUID> restoredIds = new ArrayList<>();
        restores.forEach((id, future) -> {
            if (future.join()) {
                restoredIds.add(id);
            }
        });
        restoredIds.forEach(singleSlots::remove);

        int failed = states.size() - restoredIds.size();
        LOG.infof("Bulk undo '%s': restored=%d failed=%d", taken.snapshot().label(), restoredIds.size(), failed);
        return record(SCOPE_BULK, UndoResultType.of(restoredIds.size(), failed, taken.snapshot().label()));
    }

    /**
     * Writes every captured image placement back, in parallel, then discards the snapshot.
     */
    public UndoResultType undoStructural() {
        SnapshotSlot.Taken<List<ImagePlacementType>> taken = structuralSlot.take();
        if (taken.state() != SnapshotSlot.State.READY) {
            return record(SCOPE_STRUCTURAL, stateResult(taken.state()));
        }

        List<CompletableFuture<Boolean>> restores = new ArrayList<>();
        for (ImagePlacementType placement : taken.snapshot().payload()) {
            restores.add(restoreAsync(() -> placementStore.restorePlacement(placement)));
        }
        int restored = (int) restores.stream().filter(CompletableFuture::join).count();
        int failed = restores.size() - restored;
        LOG.infof("Structural undo '%s': restored=%d failed=%d", taken.snapshot().label(), restored, failed);
        return record(SCOPE_STRUCTURAL, UndoResultType.of(restored, failed, taken.snapshot().label()));
    }

    public boolean canUndoSingle(UUID productId) {
        SnapshotSlot<Map<ProductField, Object>> slot = singleSlots.get(productId);
        return slot != null && slot.isAvailable();
    }

    /**
     * The pending bulk snapshot, for showing the undo affordance with its label, size and deadline.
     */
    public Optional<SnapshotSlot.Snapshot<Map<UUID, Map<ProductField, Object>>>> pendingBulk() {
        return bulkSlot.peek();
    }

    public Optional<SnapshotSlot.Snapshot<List<ImagePlacementType>>> pendingStructural() {
        return structuralSlot.peek();
    }

    /**
     * Stores a fresh per-product slot. Once expired, the slot stays one more TTL as an EXPIRED tombstone and is then
     * removed, and only while it is still the mapped one, so a newer capture for the same product is never dropped.
     */
    private void captureSingleSlot(UUID productId, String label, Map<ProductField, Object> state) {
        SnapshotSlot<Map<ProductField, Object>> slot = new SnapshotSlot<>(SCOPE_SINGLE, clock, config.getUndoTtl(),
                expiryTimer, expired -> retireSingleSlot(productId, expired));
        slot.capture(label, state);
        SnapshotSlot<Map<ProductField, Object>> previous = singleSlots.put(productId, slot);
        if (previous != null) {
            previous.clear();
        }
    }

    private void retireSingleSlot(UUID productId, SnapshotSlot<Map<ProductField, Object>> expired) {
        try {
            expiryTimer.schedule(() -> singleSlots.remove(productId, expired), config.getUndoTtl().toMillis(),
                    TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            LOG.debugf("Expiry timer stopped, dropping undo tombstone for product %s now", productId);
            singleSlots.remove(productId, expired);
        }
    }

    /**
     * Products with a per-product snapshot or tombstone still held.
     */
    int trackedSingleSnapshots() {
        return singleSlots.size();
    }

    private boolean restoreProduct(UUID productId, Map<ProductField, Object> fields) {
        try {
            if (!productStore.update(productId, fields)) {
                LOG.warnf("Undo could not restore product %s (missing or deleted)", productId);
                return false;
            }
            enrichmentRegistry.clear(productId);
            return true;
        } catch (RuntimeException e) {
            LOG.errorf(e, "Undo failed to restore product %s", productId);
            return false;
        }
    }

    private CompletableFuture<Boolean> restoreAsync(Supplier<Boolean> restore) {
        return CompletableFuture.supplyAsync(restore, restorePool).exceptionally(e -> {
            LOG.errorf(e, "Undo restore task failed");
            return false;
        });
    }

    private static UndoResultType stateResult(SnapshotSlot.State state) {
        return state == SnapshotSlot.State.EXPIRED ? UndoResultType.expired() : UndoResultType.none();
    }

    private UndoResultType record(String scope, UndoResultType result) {
        metrics.recordUndo(scope, result.outcome());
        return result;
    }
}
