/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.autopilot.jobs;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import villagecompute.autopilot.api.types.ItemResultType;
import villagecompute.autopilot.api.types.QcEvaluationType;
import villagecompute.autopilot.data.models.AutopilotRun;
import villagecompute.autopilot.data.models.Product;
import villagecompute.autopilot.data.models.ProductField;
import villagecompute.autopilot.data.models.QcStatus;
import villagecompute.autopilot.data.models.RunStatus;
import villagecompute.autopilot.observability.EnrichmentMetrics;
import villagecompute.autopilot.observability.LoggingConfig;
import villagecompute.autopilot.services.AutoQcEvaluator;
import villagecompute.autopilot.services.ConcurrencyGuard;
import villagecompute.autopilot.services.ListingGenerationService;
import villagecompute.autopilot.services.ProductStore;
import villagecompute.autopilot.services.RunStore;
import villagecompute.autopilot.services.WorkerDispatch;

/**
 * Autopilot worker: advances a run by one batch of products per execution, then re-dispatches itself.
 *
 * <p>
 * <b>Execution Flow:</b>
 * <ol>
 * <li>Load the run; do nothing unless it is RUNNING</li>
 * <li>Claim up to {@code batchSize} DRAFT or FAILED products of the run, oldest first</li>
 * <li>None left: move the run to AWAITING_QC and stop</li>
 * <li>Mark the claimed products GENERATING with the new batch number</li>
 * <li>Generate each product sequentially; successes are scored by {@link AutoQcEvaluator}, failures become FAILED</li>
 * <li>Advance {@code processedCards} by the successes and record a failure summary in {@code lastError}</li>
 * <li>Dispatch the next batch while the stored run is still RUNNING</li>
 * </ol>
 *
 * <p>
 * A batch in which nothing succeeds ends the pass (AWAITING_QC) instead of re-dispatching, so persistently failing
 * products cannot keep the worker spinning. A fatal provider error fails the run and returns the claimed products that
 * were not reached to DRAFT. The handler never writes the run status back from its own copy: progress is recorded as
 * counters only and every status change is conditional on the run still being RUNNING, so a user stop during a batch
 * sticks.
 *
 * @see JobType#AUTOPILOT_BATCH
 */
@ApplicationScoped
public class AutopilotBatchJobHandler implements JobHandler {

    private static final Logger LOG = Logger.getLogger(AutopilotBatchJobHandler.class);

    public static final String PAYLOAD_RUN_ID = "runId";

    private static final Set<QcStatus> CLAIMABLE = Set.of(QcStatus.DRAFT, QcStatus.FAILED);

    @Inject
    RunStore runStore;

    @Inject
    ProductStore productStore;

    @Inject
    ListingGenerationService listingGenerationService;

    @Inject
    AutoQcEvaluator qcEvaluator;

    @Inject
    ConcurrencyGuard concurrencyGuard;

    @Inject
    WorkerDispatch workerDispatch;

    @Inject
    EnrichmentMetrics metrics;

    @Inject
    Tracer tracer;

    @Inject
    Clock clock;

    @Override
    public JobType handlesType() {
        return JobType.AUTOPILOT_BATCH;
    }

    @Override
    public void execute(Long jobId, Map<String, Object> payload) {
        UUID runId = UUID.fromString(String.valueOf(payload.get(PAYLOAD_RUN_ID)));

        LoggingConfig.enrichWithTraceContext();
        LoggingConfig.setJobId(jobId);
        LoggingConfig.setRunId(runId);

        Span span = tracer.spanBuilder("job.autopilot_batch").setAttribute("job.id", String.valueOf(jobId))
                .setAttribute("run.id", runId.toString()).startSpan();
        try {
            Optional<AutopilotRun> found = runStore.findById(runId);
            if (found.isEmpty()) {
                LOG.warnf("Autopilot run %s not found, nothing to do", runId);
                return;
            }
            AutopilotRun run = found.get();
            if (run.status != RunStatus.RUNNING) {
                LOG.infof("Autopilot run %s is %s, not processing", runId, run.status);
                return;
            }
            LoggingConfig.setBatchId(run.batchId);

            List<Product> products = productStore.findByRun(runId, CLAIMABLE, run.batchSize);
            if (products.isEmpty()) {
                LOG.infof("Autopilot run %s has no products left, awaiting QC", runId);
                finish(runId, RunStatus.AWAITING_QC, null);
                return;
            }

            int batchNumber = run.currentBatch + 1;
            span.setAttribute("batch.number", batchNumber);
            span.setAttribute("batch.size", products.size());
            LOG.infof("Autopilot run %s: processing batch %d with %d products", runId, batchNumber, products.size());

            Map<ProductField, Object> claim = new EnumMap<>(ProductField.class);
            claim.put(ProductField.QC_STATUS, QcStatus.GENERATING);
            claim.put(ProductField.BATCH_NUMBER, batchNumber);
            productStore.updateAll(products.stream().map(p -> p.id).toList(), claim);
            runStore.recordProgress(runId, 0, batchNumber, null);

            BatchOutcome outcome = processBatch(products);

            String failureSummary = outcome.failed > 0
                    ? String.format("Batch %d: %d products failed", batchNumber, outcome.failed)
                    : null;
            Optional<RunStatus> stored = runStore.recordProgress(runId, outcome.succeeded, batchNumber,
                    failureSummary);
            run.advanceProcessed(outcome.succeeded);
            span.setAttribute("items.success", outcome.succeeded);
            span.setAttribute("items.failed", outcome.failed);
            LOG.infof("Autopilot run %s batch %d complete: %d generated, %d failed, %d/%d processed", runId,
                    batchNumber, outcome.succeeded, outcome.failed, run.processedCards, run.totalCards);

            if (outcome.fatalReason != null) {
                finish(runId, RunStatus.FAILED, outcome.fatalReason);
                return;
            }
            if (stored.isEmpty() || stored.get() != RunStatus.RUNNING) {
                LOG.infof("Autopilot run %s is now %s, not dispatching another batch", runId,
                        stored.map(Enum::name).orElse("gone"));
                return;
            }
            if (outcome.succeeded == 0 && outcome.failed > 0) {
                LOG.warnf("Autopilot run %s: no product in batch %d succeeded, ending generation pass", runId,
                        batchNumber);
                finish(runId, RunStatus.AWAITING_QC, null);
                return;
            }

            try {
                workerDispatch.advanceRun(runId);
            } catch (RuntimeException e) {
                LOG.errorf(e, "Failed to dispatch next batch for autopilot run %s", runId);
            }

        } catch (RuntimeException e) {
            span.recordException(e);
            span.setStatus(StatusCode.ERROR, e.getMessage());
            throw e;
        } finally {
            span.end();
            LoggingConfig.clearMDC();
        }
    }

    private BatchOutcome processBatch(List<Product> products) {
        BatchOutcome outcome = new BatchOutcome();
        for (int i = 0; i < products.size(); i++) {
            Product product = products.get(i);
            if (outcome.fatalReason != null) {
                revertToDraft(products.subList(i, products.size()));
                break;
            }

            Optional<ConcurrencyGuard.ItemLease> lease = concurrencyGuard.acquireItem(product.id);
            if (lease.isEmpty()) {
                LOG.debugf("Product %s is being generated elsewhere, returning it to draft", product.id);
                revertToDraft(List.of(product));
                continue;
            }

            ItemResultType result;
            try (ConcurrencyGuard.ItemLease held = lease.get()) {
                result = listingGenerationService.process(product);
            }

            Map<ProductField, Object> fields = new EnumMap<>(ProductField.class);
            if (result.isSuccess()) {
                QcEvaluationType qc = qcEvaluator.evaluate(product);
                fields.put(ProductField.QC_STATUS, qc.status());
                fields.put(ProductField.CONFIDENCE, qc.confidence());
                fields.put(ProductField.FLAGS, qc.flags());
                outcome.succeeded++;
                LOG.debugf("Product %s: %s (%d%%)", product.id, qc.status(), qc.confidence());
            } else {
                fields.put(ProductField.QC_STATUS, QcStatus.FAILED);
                outcome.failed++;
                if (result.fatal()) {
                    outcome.fatalReason = result.errorReason();
                    metrics.recordFatalHalt();
                }
                LOG.warnf("Product %s failed: %s", product.id, result.errorReason());
            }
            productStore.update(product.id, fields);
        }
        return outcome;
    }

    private void revertToDraft(List<Product> products) {
        Map<ProductField, Object> revert = new EnumMap<>(ProductField.class);
        revert.put(ProductField.QC_STATUS, QcStatus.DRAFT);
        productStore.updateAll(products.stream().map(p -> p.id).toList(), revert);
    }

    /**
     * Moves the run out of RUNNING unless something else (a user stop) already did.
     */
    private void finish(UUID runId, RunStatus status, String reason) {
        if (runStore.transition(runId, RunStatus.RUNNING, status, reason, Instant.now(clock))) {
            metrics.recordRunTransition(status);
        } else {
            LOG.infof("Autopilot run %s already left RUNNING, not moving it to %s", runId, status);
        }
    }

    private static final class BatchOutcome {

        private int succeeded;
        private int failed;
        private String fatalReason;
    }
}
