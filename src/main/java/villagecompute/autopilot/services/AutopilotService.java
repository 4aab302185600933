/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.autopilot.services;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import villagecompute.autopilot.config.EnrichmentConfig;
import villagecompute.autopilot.data.models.AutopilotRun;
import villagecompute.autopilot.data.models.Product;
import villagecompute.autopilot.data.models.ProductField;
import villagecompute.autopilot.data.models.QcStatus;
import villagecompute.autopilot.data.models.RunStatus;
import villagecompute.autopilot.exceptions.IllegalTransitionException;
import villagecompute.autopilot.exceptions.ResourceNotFoundException;
import villagecompute.autopilot.exceptions.ValidationException;
import villagecompute.autopilot.observability.EnrichmentMetrics;
import villagecompute.autopilot.observability.LoggingConfig;

/**
 * Lifecycle of autopilot runs: start/resume, stop, the QC hand-off and bulk QC decisions.
 *
 * <p>
 * Product processing itself happens in the worker reached through {@link WorkerDispatch}; this service only creates
 * the run record, binds products to it and kicks the worker. Progress is observed through {@link AutopilotRunPoller}.
 *
 * <p>
 * <b>Run lifecycle:</b> RUNNING &rarr; AWAITING_QC &rarr; PUBLISHING &rarr; COMPLETED, with FAILED reachable from any
 * non-terminal state (stop or worker failure).
 */
@ApplicationScoped
public class AutopilotService {

    private static final Logger LOG = Logger.getLogger(AutopilotService.class);

    static final String STOPPED_BY_USER = "Stopped by user";

    private static final int MAX_STOP_ATTEMPTS = 3;

    @Inject
    RunStore runStore;

    @Inject
    ProductStore productStore;

    @Inject
    WorkerDispatch workerDispatch;

    @Inject
    AutopilotRunPoller poller;

    @Inject
    EnrichmentConfig config;

    @Inject
    EnrichmentMetrics metrics;

    @Inject
    Clock clock;

    /**
     * Starts autopilot for a capture batch, or resumes the run already in progress for it.
     *
     * @param batchId
     *            capture batch
     * @return the running run
     * @throws ValidationException
     *             if the batch has no products
     */
    public AutopilotRun start(UUID batchId) {
        Optional<AutopilotRun> existing = runStore.findRunningForBatch(batchId);
        if (existing.isPresent()) {
            AutopilotRun run = existing.get();
            LOG.infof("Resuming autopilot run %s for batch %s (%d/%d processed)", run.id, batchId, run.processedCards,
                    run.totalCards);
            poller.watch(run.id);
            return run;
        }

        List<Product> products = productStore.findActiveByBatch(batchId);
        if (products.isEmpty()) {
            throw new ValidationException("No products found in batch");
        }

        AutopilotRun run = new AutopilotRun();
        run.batchId = batchId;
        run.status = RunStatus.RUNNING;
        run.totalCards = products.size();
        run.processedCards = 0;
        run.currentBatch = 0;
        run.batchSize = config.getRunBatchSize();
        run.startedAt = Instant.now(clock);
        run = runStore.create(run);

        try {
            LoggingConfig.setRunId(run.id);
            LoggingConfig.setBatchId(batchId);

            Map<ProductField, Object> binding = new EnumMap<>(ProductField.class);
            binding.put(ProductField.RUN_ID, run.id);
            binding.put(ProductField.QC_STATUS, QcStatus.DRAFT);
            binding.put(ProductField.CONFIDENCE, null);
            binding.put(ProductField.FLAGS, null);
            binding.put(ProductField.BATCH_NUMBER, null);
            binding.put(ProductField.GENERATED_AT, null);
            int bound = productStore.updateAll(products.stream().map(p -> p.id).toList(), binding);

            metrics.recordRunTransition(RunStatus.RUNNING);
            LOG.infof("Started autopilot run %s for batch %s: %d products bound (batch size %d)", run.id, batchId,
                    bound, run.batchSize);

            dispatch(run.id);
            poller.watch(run.id);
            return run;
        } finally {
            LoggingConfig.clearMDC();
        }
    }

    /**
     * Stops a run. Products still marked GENERATING go back to DRAFT so a later run can pick them up.
     *
     * @throws ResourceNotFoundException
     *             if the run does not exist
     * @throws IllegalTransitionException
     *             if the run already ended
     */
    public AutopilotRun stop(UUID runId) {
        AutopilotRun run = requireRun(runId);
        Instant now = Instant.now(clock);
        for (int attempt = 1;; attempt++) {
            if (run.status.isTerminal()) {
                throw new IllegalTransitionException("Run " + runId + " already ended with status " + run.status);
            }
            if (runStore.transition(runId, run.status, RunStatus.FAILED, STOPPED_BY_USER, now)) {
                break;
            }
            if (attempt >= MAX_STOP_ATTEMPTS) {
                throw new IllegalTransitionException("Run " + runId + " kept changing status, stop not applied");
            }
            // the worker moved the run on between the read and the write
            run = requireRun(runId);
        }

        run.status = RunStatus.FAILED;
        run.lastError = STOPPED_BY_USER;
        run.completedAt = now;
        metrics.recordRunTransition(RunStatus.FAILED);

        List<UUID> generating = productStore.findByRun(runId, Set.of(QcStatus.GENERATING), Integer.MAX_VALUE).stream()
                .map(p -> p.id).toList();
        if (!generating.isEmpty()) {
            Map<ProductField, Object> revert = new EnumMap<>(ProductField.class);
            revert.put(ProductField.QC_STATUS, QcStatus.DRAFT);
            productStore.updateAll(generating, revert);
        }
        LOG.infof("Stopped autopilot run %s, %d generating products reverted to draft", runId, generating.size());
        return run;
    }

    public AutopilotRun markAwaitingQc(UUID runId) {
        return transition(runId, RunStatus.AWAITING_QC);
    }

    public AutopilotRun beginPublishing(UUID runId) {
        return transition(runId, RunStatus.PUBLISHING);
    }

    public AutopilotRun complete(UUID runId) {
        return transition(runId, RunStatus.COMPLETED);
    }

    /**
     * Approves products for publishing. Products whose QC stage cannot move to APPROVED (still generating, already
     * published, ...) are left untouched.
     *
     * @return number of products approved
     */
    public int approveProducts(Collection<UUID> productIds) {
        List<UUID> approvable = productStore.findByIds(productIds).stream()
                .filter(p -> p.qcStatus != null && p.qcStatus.canTransitionTo(QcStatus.APPROVED)).map(p -> p.id)
                .toList();
        if (approvable.size() < productIds.size()) {
            LOG.warnf("Skipping %d of %d products that cannot be approved from their current QC stage",
                    productIds.size() - approvable.size(), productIds.size());
        }
        if (approvable.isEmpty()) {
            return 0;
        }
        Map<ProductField, Object> fields = new EnumMap<>(ProductField.class);
        fields.put(ProductField.QC_STATUS, QcStatus.APPROVED);
        return productStore.updateAll(approvable, fields);
    }

    /**
     * Sends products back to DRAFT and clears their QC verdict.
     *
     * @return number of products written
     */
    public int sendToDraft(Collection<UUID> productIds) {
        if (productIds.isEmpty()) {
            return 0;
        }
        Map<ProductField, Object> fields = new EnumMap<>(ProductField.class);
        fields.put(ProductField.QC_STATUS, QcStatus.DRAFT);
        fields.put(ProductField.CONFIDENCE, null);
        fields.put(ProductField.FLAGS, null);
        return productStore.updateAll(productIds, fields);
    }

    /**
     * Product count per QC stage for a run. Products without a QC stage are not counted.
     */
    public Map<QcStatus, Long> qcCounts(UUID runId) {
        Map<QcStatus, Long> counts = new EnumMap<>(QcStatus.class);
        for (Product product : productStore.findByRun(runId)) {
            if (product.qcStatus != null && !product.isDeleted()) {
                counts.merge(product.qcStatus, 1L, Long::sum);
            }
        }
        return counts;
    }

    public AutopilotRun getRun(UUID runId) {
        return requireRun(runId);
    }

    private AutopilotRun transition(UUID runId, RunStatus target) {
        AutopilotRun run = requireRun(runId);
        if (!run.status.canTransitionTo(target)) {
            throw new IllegalTransitionException(
                    "Run " + runId + " cannot move from " + run.status + " to " + target);
        }
        Instant now = Instant.now(clock);
        if (!runStore.transition(runId, run.status, target, null, now)) {
            throw new IllegalTransitionException(
                    "Run " + runId + " changed status while moving from " + run.status + " to " + target);
        }
        run.status = target;
        if (target.isTerminal()) {
            run.completedAt = now;
        }
        metrics.recordRunTransition(target);
        LOG.infof("Autopilot run %s is now %s", runId, target);
        return run;
    }

    private AutopilotRun requireRun(UUID runId) {
        return runStore.findById(runId)
                .orElseThrow(() -> new ResourceNotFoundException("Autopilot run not found: " + runId));
    }

    private void dispatch(UUID runId) {
        try {
            workerDispatch.advanceRun(runId);
        } catch (RuntimeException e) {
            LOG.errorf(e, "Failed to dispatch autopilot worker for run %s", runId);
        }
    }
}
