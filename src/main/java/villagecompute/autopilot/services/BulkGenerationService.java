/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.autopilot.services;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;
import java.util.stream.Collectors;

import com.google.common.collect.Lists;
import com.google.common.util.concurrent.ThreadFactoryBuilder;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import villagecompute.autopilot.api.types.BulkGenerationResultType;
import villagecompute.autopilot.api.types.ChunkProgressType;
import villagecompute.autopilot.api.types.FailureRecordType;
import villagecompute.autopilot.api.types.ItemResultType;
import villagecompute.autopilot.config.EnrichmentConfig;
import villagecompute.autopilot.data.models.Product;
import villagecompute.autopilot.data.models.ProductImage;
import villagecompute.autopilot.exceptions.ResourceNotFoundException;
import villagecompute.autopilot.exceptions.ValidationException;
import villagecompute.autopilot.observability.EnrichmentMetrics;
import villagecompute.autopilot.observability.LoggingConfig;

/**
 * Chunked, bounded-concurrency driver for bulk listing generation.
 *
 * <p>
 * <b>Execution Flow ({@link #generateBulk}):</b>
 * <ol>
 * <li>Take the process-wide batch lock; a concurrent call is rejected with ALREADY_RUNNING, not queued</li>
 * <li>Clear the failure tracker and select eligible products via {@link EligibilityFilter}</li>
 * <li>Fetch images for the whole eligible set; products without images are recorded as {@code noImages}</li>
 * <li>Slice to at most {@code batchSize} products (bounded mode; the rest is reported as remaining)</li>
 * <li>Capture the bulk undo snapshot</li>
 * <li>Partition into chunks of {@code concurrencyWidth}; for each chunk lock every product, fan out one generation
 * per product, wait for all of them to settle, release the locks, record outcomes and publish one progress
 * update</li>
 * <li>Pause {@code chunkDelay} between chunks</li>
 * </ol>
 *
 * <p>
 * A failed product never cancels its siblings. A fatal provider error (credits exhausted) stops scheduling further
 * chunks; products already in flight finish normally.
 *
 * <p>
 * At most {@code concurrencyWidth} provider calls are ever in flight: chunks are that wide and run on a pool of that
 * size, and chunk N+1 starts only after chunk N has settled.
 */
@ApplicationScoped
public class BulkGenerationService {

    private static final Logger LOG = Logger.getLogger(BulkGenerationService.class);

    static final String ALL_ENRICHED_MESSAGE = "All %d products already generated. Select specific products to re-generate.";
    static final String NOTHING_TO_DO_MESSAGE = "No valid products to generate";

    @Inject
    ConcurrencyGuard concurrencyGuard;

    @Inject
    EligibilityFilter eligibilityFilter;

    @Inject
    ListingGenerationService listingGenerationService;

    @Inject
    FailureTracker failureTracker;

    @Inject
    UndoSnapshotManager undoSnapshotManager;

    @Inject
    EnrichmentRegistry enrichmentRegistry;

    @Inject
    ProductStore productStore;

    @Inject
    EnrichmentConfig config;

    @Inject
    EnrichmentMetrics metrics;

    @Inject
    Tracer tracer;

    private final AtomicReference<ChunkProgressType> progress = new AtomicReference<>(ChunkProgressType.idle());

    private ExecutorService generationPool;

    @PostConstruct
    void init() {
        generationPool = Executors.newFixedThreadPool(config.getConcurrencyWidth(),
                new ThreadFactoryBuilder().setNameFormat("generation-%d").setDaemon(true).build());
    }

    @PreDestroy
    void shutdown() {
        generationPool.shutdown();
        try {
            if (!generationPool.awaitTermination(30, TimeUnit.SECONDS)) {
                LOG.warn("Generation pool did not drain within 30s, forcing shutdown");
                generationPool.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            generationPool.shutdownNow();
        }
    }

    /**
     * Generates listings for one bounded slice of a capture batch.
     *
     * @param batchId
     *            capture batch
     * @param selection
     *            explicitly selected product ids (forces regeneration), or null/empty for new products only
     * @param batchSize
     *            maximum products processed by this call, one of the configured options; null for the default
     * @return aggregated summary
     * @throws ValidationException
     *             if {@code batchSize} is not one of the configured options
     */
    public BulkGenerationResultType generateBulk(UUID batchId, Set<UUID> selection, Integer batchSize) {
        int size = batchSize == null ? config.getDefaultBatchSize() : batchSize;
        if (!config.getBatchSizeOptions().contains(size)) {
            throw new ValidationException(
                    "Unsupported batch size " + size + ", expected one of " + config.getBatchSizeOptions());
        }

        Optional<ConcurrencyGuard.BatchLease> lease = concurrencyGuard.acquireBatch();
        if (lease.isEmpty()) {
            LOG.warnf("Bulk generation already in progress, rejecting request for batch %s", batchId);
            return BulkGenerationResultType.alreadyRunning();
        }

        Span span = tracer.spanBuilder("generation.bulk").setAttribute("batch.id", String.valueOf(batchId))
                .setAttribute("batch.size", size).startSpan();
        try (ConcurrencyGuard.BatchLease held = lease.get()) {
            LoggingConfig.enrichWithTraceContext();
            LoggingConfig.setBatchId(batchId);
            LoggingConfig.setRequestOrigin("generation.bulk");

            failureTracker.clear();
            List<Product> products = productStore.findActiveByBatch(batchId);
            enrichmentRegistry.seedFromStatuses(products);

            EligibilityFilter.Eligibility eligibility = eligibilityFilter.select(products, selection);
            if (eligibility.eligible().isEmpty()) {
                return noEligibleProducts(eligibility);
            }

            EligibilityFilter.ImagePartition partition = eligibilityFilter
                    .partitionByImages(eligibility.eligible(), generationPool);
            partition.noImages().forEach(product -> {
                failureTracker.recordFailure(product.id, product.displayLabel(), "No images");
                metrics.recordItemOutcome(ItemResultType.Outcome.NO_IMAGES);
            });
            Map<UUID, Product> byId = eligibility.eligible().stream()
                    .collect(Collectors.toMap(p -> p.id, Function.identity(), (a, b) -> a));
            partition.fetchFailures().forEach((id, reason) -> failureTracker.recordFailure(id,
                    byId.get(id).displayLabel(), reason));

            List<Product> candidates = partition.withImages();
            int noImagesCount = partition.noImages().size();
            if (candidates.isEmpty()) {
                return BulkGenerationResultType.nothingToDo(BulkGenerationResultType.Outcome.NOTHING_TO_DO,
                        noImagesCount, "No products with images to generate");
            }

            List<Product> slice = List.copyOf(candidates.subList(0, Math.min(size, candidates.size())));
            span.setAttribute("items.eligible", candidates.size());
            span.setAttribute("items.selected", slice.size());
            LOG.infof("Starting bulk generation: batch=%s eligible=%d selected=%d noImages=%d", batchId,
                    candidates.size(), slice.size(), noImagesCount);

            undoSnapshotManager.captureBulk(String.format("AI generation of %d products", slice.size()), slice);
            ChunkTotals totals = runChunks(slice, partition.images());

            int remaining = candidates.size() - totals.attempted();
            BulkGenerationResultType result = summarize(totals, noImagesCount, remaining);
            span.setAttribute("items.success", result.successCount());
            span.setAttribute("items.failed", result.errorCount());
            LOG.infof("Bulk generation finished: batch=%s %s", batchId, result.message());
            return result;

        } catch (RuntimeException e) {
            span.recordException(e);
            span.setStatus(StatusCode.ERROR, e.getMessage());
            LOG.errorf(e, "Bulk generation failed for batch %s", batchId);
            throw e;
        } finally {
            progress.updateAndGet(p -> new ChunkProgressType(false, p.completedItems(), p.totalItems(),
                    p.successCount(), p.errorCount(), p.chunkIndex(), p.chunkCount()));
            span.end();
            LoggingConfig.clearMDC();
        }
    }

    /**
     * Re-runs exactly the products held in the failure tracker through the chunked algorithm. Already-enriched
     * products are not excluded and the slice is not capped: these are known failures.
     *
     * @return aggregated summary
     */
    public BulkGenerationResultType retryFailed() {
        List<UUID> ids = failureTracker.failedIds();
        if (ids.isEmpty()) {
            return BulkGenerationResultType.nothingToDo(BulkGenerationResultType.Outcome.NOTHING_TO_DO, 0,
                    "No failed products to retry");
        }

        Optional<ConcurrencyGuard.BatchLease> lease = concurrencyGuard.acquireBatch();
        if (lease.isEmpty()) {
            LOG.warn("Bulk generation already in progress, rejecting retry");
            return BulkGenerationResultType.alreadyRunning();
        }

        Span span = tracer.spanBuilder("generation.retry").setAttribute("items.tracked", ids.size()).startSpan();
        try (ConcurrencyGuard.BatchLease held = lease.get()) {
            LoggingConfig.enrichWithTraceContext();
            LoggingConfig.setRequestOrigin("generation.retry");

            Map<UUID, Product> found = new LinkedHashMap<>();
            productStore.findByIds(ids).stream().filter(p -> !p.isDeleted()).forEach(p -> found.put(p.id, p));
            List<Product> products = new ArrayList<>();
            for (UUID id : ids) {
                Product product = found.get(id);
                if (product == null) {
                    LOG.debugf("Dropping failed product %s from retry list (no longer exists)", id);
                    failureTracker.remove(id);
                } else {
                    products.add(product);
                }
            }
            if (products.isEmpty()) {
                return BulkGenerationResultType.nothingToDo(BulkGenerationResultType.Outcome.NOTHING_TO_DO, 0,
                        "No failed products to retry");
            }

            LOG.infof("Retrying %d failed products", products.size());
            undoSnapshotManager.captureBulk(String.format("Retry of %d failed products", products.size()), products);
            ChunkTotals totals = runChunks(products, null);
            return summarize(totals, totals.noImages(), 0);
        } finally {
            progress.updateAndGet(p -> new ChunkProgressType(false, p.completedItems(), p.totalItems(),
                    p.successCount(), p.errorCount(), p.chunkIndex(), p.chunkCount()));
            span.end();
            LoggingConfig.clearMDC();
        }
    }

    /**
     * Generates one product on demand, forcing regeneration. Does not take the batch lock.
     *
     * @param productId
     *            product to generate
     * @return the item outcome; SKIPPED when the product is already being generated
     * @throws ResourceNotFoundException
     *             if the product does not exist
     */
    public ItemResultType generateSingle(UUID productId) {
        Product product = productStore.findById(productId).filter(p -> !p.isDeleted())
                .orElseThrow(() -> new ResourceNotFoundException("Product not found: " + productId));

        Optional<ConcurrencyGuard.ItemLease> lease = concurrencyGuard.acquireItem(productId);
        if (lease.isEmpty()) {
            metrics.recordItemOutcome(ItemResultType.Outcome.SKIPPED);
            return ItemResultType.skipped(productId);
        }
        try (ConcurrencyGuard.ItemLease held = lease.get()) {
            undoSnapshotManager.captureSingle(product);
            ItemResultType result = listingGenerationService.process(product);
            track(product, result);
            return result;
        }
    }

    /**
     * Read-only progress of the current (or last) bulk run.
     */
    public ChunkProgressType currentProgress() {
        return progress.get();
    }

    public List<FailureRecordType> failures() {
        return failureTracker.failures();
    }

    private ChunkTotals runChunks(List<Product> items, Map<UUID, List<ProductImage>> images) {
        int width = config.getConcurrencyWidth();
        List<List<Product>> chunks = Lists.partition(items, width);
        ChunkTotals totals = new ChunkTotals();
        progress.set(new ChunkProgressType(true, 0, items.size(), 0, 0, 0, chunks.size()));

        for (int i = 0; i < chunks.size(); i++) {
            if (totals.halted) {
                LOG.warnf("Halting bulk generation after fatal provider error, %d chunks not scheduled",
                        chunks.size() - i);
                metrics.recordFatalHalt();
                break;
            }
            if (i > 0 && !pauseBetweenChunks()) {
                LOG.warn("Bulk generation interrupted, remaining chunks not scheduled");
                break;
            }

            List<Product> chunk = chunks.get(i);
            Map<Product, CompletableFuture<ItemResultType>> inFlight = new LinkedHashMap<>();
            for (Product product : chunk) {
                Optional<ConcurrencyGuard.ItemLease> lease = concurrencyGuard.acquireItem(product.id);
                if (lease.isEmpty()) {
                    metrics.recordItemOutcome(ItemResultType.Outcome.SKIPPED);
                    inFlight.put(product, CompletableFuture.completedFuture(ItemResultType.skipped(product.id)));
                    continue;
                }
                inFlight.put(product, submit(product, lease.get(), images));
            }

            // Settle all: every future completes normally (submit converts exceptions to failed results)
            CompletableFuture.allOf(inFlight.values().toArray(CompletableFuture[]::new)).join();

            inFlight.forEach((product, future) -> {
                ItemResultType result = future.join();
                totals.add(result);
                if (result.outcome() != ItemResultType.Outcome.SKIPPED) {
                    track(product, result);
                }
            });

            progress.set(new ChunkProgressType(true, totals.settled(), items.size(), totals.success, totals.failed,
                    i + 1, chunks.size()));
            LOG.debugf("Chunk %d/%d settled: success=%d failed=%d skipped=%d", i + 1, chunks.size(), totals.success,
                    totals.failed, totals.skipped);
        }
        return totals;
    }

    private CompletableFuture<ItemResultType> submit(Product product, ConcurrencyGuard.ItemLease lease,
            Map<UUID, List<ProductImage>> images) {
        try {
            return CompletableFuture.supplyAsync(() -> {
                try (lease) {
                    return images == null ? listingGenerationService.process(product)
                            : listingGenerationService.process(product, images.get(product.id));
                }
            }, generationPool).exceptionally(e -> {
                LOG.errorf(e, "Unexpected failure generating product %s", product.id);
                return ItemResultType.failed(product.id, "Unexpected error: " + e.getMessage(), false);
            });
        } catch (RejectedExecutionException e) {
            lease.close();
            LOG.errorf(e, "Generation pool rejected product %s", product.id);
            return CompletableFuture.completedFuture(ItemResultType.failed(product.id, "Generation pool unavailable",
                    false));
        }
    }

    private void track(Product product, ItemResultType result) {
        if (result.isSuccess()) {
            failureTracker.recordSuccess(product.id);
        } else if (result.outcome() != ItemResultType.Outcome.SKIPPED) {
            failureTracker.recordFailure(product.id, product.displayLabel(), result.errorReason());
        }
    }

    private boolean pauseBetweenChunks() {
        long delayMs = config.getChunkDelay().toMillis();
        if (delayMs <= 0) {
            return true;
        }
        try {
            Thread.sleep(delayMs);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private BulkGenerationResultType noEligibleProducts(EligibilityFilter.Eligibility eligibility) {
        if (!eligibility.explicitSelection() && eligibility.excludedAsEnriched() > 0) {
            return BulkGenerationResultType.nothingToDo(BulkGenerationResultType.Outcome.ALL_ALREADY_ENRICHED, 0,
                    String.format(ALL_ENRICHED_MESSAGE, eligibility.excludedAsEnriched()));
        }
        return BulkGenerationResultType.nothingToDo(BulkGenerationResultType.Outcome.NOTHING_TO_DO, 0,
                NOTHING_TO_DO_MESSAGE);
    }

    private BulkGenerationResultType summarize(ChunkTotals totals, int noImagesCount, int remaining) {
        StringBuilder message = new StringBuilder(
                String.format("Generated %d products, %d failed", totals.success, totals.failed));
        if (totals.skipped > 0) {
            message.append(String.format(", %d skipped (already generating)", totals.skipped));
        }
        if (noImagesCount > 0) {
            message.append(String.format(", %d without images", noImagesCount));
        }
        if (remaining > 0) {
            message.append(String.format(", %d remaining", remaining));
        }
        if (totals.halted) {
            message.append(". Stopped early: generation provider refused further work");
        }
        return new BulkGenerationResultType(BulkGenerationResultType.Outcome.COMPLETED, totals.success, totals.failed,
                totals.skipped, noImagesCount, List.copyOf(totals.processedIds), remaining, totals.halted,
                message.toString());
    }

    /**
     * Running counts for one bulk call. Only touched by the calling thread, after each chunk settles.
     */
    private static final class ChunkTotals {

        private int success;
        private int failed;
        private int skipped;
        private int noImages;
        private boolean halted;
        private final List<UUID> processedIds = new ArrayList<>();
        private final Set<UUID> seen = new HashSet<>();

        void add(ItemResultType result) {
            seen.add(result.itemId());
            switch (result.outcome()) {
                case SUCCESS -> {
                    success++;
                    processedIds.add(result.itemId());
                }
                case FAILED -> {
                    failed++;
                    processedIds.add(result.itemId());
                    halted |= result.fatal();
                }
                case NO_IMAGES -> noImages++;
                case SKIPPED -> skipped++;
            }
        }

        int settled() {
            return success + failed + skipped + noImages;
        }

        int attempted() {
            return seen.size();
        }

        int noImages() {
            return noImages;
        }
    }
}
