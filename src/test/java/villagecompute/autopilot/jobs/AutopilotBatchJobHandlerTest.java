/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.autopilot.jobs;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.api.trace.TracerProvider;
import villagecompute.autopilot.api.types.ItemResultType;
import villagecompute.autopilot.data.models.AutopilotRun;
import villagecompute.autopilot.data.models.Product;
import villagecompute.autopilot.data.models.ProductField;
import villagecompute.autopilot.data.models.QcStatus;
import villagecompute.autopilot.data.models.RunStatus;
import villagecompute.autopilot.observability.EnrichmentMetrics;
import villagecompute.autopilot.services.AutoQcEvaluator;
import villagecompute.autopilot.services.ConcurrencyGuard;
import villagecompute.autopilot.services.ListingGenerationService;
import villagecompute.autopilot.services.ProductStore;
import villagecompute.autopilot.services.WorkerDispatch;
import villagecompute.autopilot.testing.InMemoryRunStore;

/**
 * Unit tests for {@link AutopilotBatchJobHandler}.
 */
class AutopilotBatchJobHandlerTest {

    private static final Instant NOW = Instant.parse("2025-03-01T10:00:00Z");

    @Mock
    ProductStore productStore;

    @Mock
    ListingGenerationService listingGenerationService;

    @Mock
    WorkerDispatch workerDispatch;

    @Mock
    Tracer tracer;

    private AutopilotBatchJobHandler handler;
    private InMemoryRunStore runStore;
    private AutopilotRun run;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        when(tracer.spanBuilder(anyString())).thenReturn(TracerProvider.noop().get("test").spanBuilder("test"));

        runStore = new InMemoryRunStore();
        handler = new AutopilotBatchJobHandler();
        handler.runStore = runStore;
        handler.productStore = productStore;
        handler.listingGenerationService = listingGenerationService;
        handler.qcEvaluator = new AutoQcEvaluator();
        handler.concurrencyGuard = new ConcurrencyGuard();
        handler.workerDispatch = workerDispatch;
        handler.metrics = new EnrichmentMetrics(new SimpleMeterRegistry());
        handler.tracer = tracer;
        handler.clock = Clock.fixed(NOW, ZoneOffset.UTC);

        run = new AutopilotRun();
        run.id = UUID.randomUUID();
        run.batchId = UUID.randomUUID();
        run.status = RunStatus.RUNNING;
        run.totalCards = 4;
        run.batchSize = 30;
        runStore.put(run);
    }

    private AutopilotRun stored() {
        return runStore.stored(run.id);
    }

    private Map<String, Object> payload() {
        return Map.of(AutopilotBatchJobHandler.PAYLOAD_RUN_ID, run.id.toString());
    }

    private List<Product> claimable(int count) {
        List<Product> products = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            Product product = new Product();
            product.id = UUID.randomUUID();
            product.runId = run.id;
            product.qcStatus = QcStatus.DRAFT;
            products.add(product);
        }
        when(productStore.findByRun(run.id, Set.of(QcStatus.DRAFT, QcStatus.FAILED), 30)).thenReturn(products);
        return products;
    }

    private static void fillComplete(Product product) {
        product.title = "Vintage Levi's Denim Jacket";
        product.descriptionStyleA = "Classic trucker.";
        product.garmentType = "Jacket";
        product.condition = "Excellent";
        product.sizeLabel = "M";
        product.pitToPit = "22in";
        product.era = "90s";
        product.brand = "Levi's";
        product.price = new BigDecimal("65");
    }

    @Test
    void testHandlesType() {
        assertEquals(JobType.AUTOPILOT_BATCH, handler.handlesType());
    }

    @Test
    void testExecute_scoresSuccessesAndRedispatches() {
        List<Product> products = claimable(2);
        Product good = products.get(0);
        Product bad = products.get(1);
        when(listingGenerationService.process(good)).thenAnswer(inv -> {
            fillComplete(good);
            return ItemResultType.success(good.id);
        });
        when(listingGenerationService.process(bad)).thenReturn(ItemResultType.failed(bad.id, "Timeout", false));

        handler.execute(1L, payload());

        verify(productStore).updateAll(List.of(good.id, bad.id),
                Map.of(ProductField.QC_STATUS, QcStatus.GENERATING, ProductField.BATCH_NUMBER, 1));

        @SuppressWarnings("unchecked")
        ArgumentCaptor<Map<ProductField, Object>> scored = ArgumentCaptor.forClass(Map.class);
        verify(productStore).update(eq(good.id), scored.capture());
        assertEquals(QcStatus.READY, scored.getValue().get(ProductField.QC_STATUS));
        assertEquals(100, scored.getValue().get(ProductField.CONFIDENCE));
        verify(productStore).update(bad.id, Map.of(ProductField.QC_STATUS, QcStatus.FAILED));

        assertEquals(1, stored().currentBatch);
        assertEquals(1, stored().processedCards);
        assertEquals("Batch 1: 1 products failed", stored().lastError);
        assertEquals(RunStatus.RUNNING, stored().status);
        verify(workerDispatch).advanceRun(run.id);
    }

    @Test
    void testExecute_noProductsLeftAwaitsQc() {
        claimable(0);

        handler.execute(2L, payload());

        assertEquals(RunStatus.AWAITING_QC, stored().status);
        assertNull(stored().completedAt);
        verify(workerDispatch, never()).advanceRun(any());
    }

    @Test
    void testExecute_stoppedRunIgnored() {
        stored().status = RunStatus.FAILED;

        handler.execute(3L, payload());

        verify(productStore, never()).findByRun(any(), any(), anyInt());
        verify(workerDispatch, never()).advanceRun(any());
    }

    @Test
    void testExecute_fatalErrorFailsRunAndReleasesRest() {
        List<Product> products = claimable(3);
        when(listingGenerationService.process(products.get(0)))
                .thenReturn(ItemResultType.failed(products.get(0).id, "AI credits exhausted: top up", true));

        handler.execute(4L, payload());

        assertEquals(RunStatus.FAILED, stored().status);
        assertEquals("AI credits exhausted: top up", stored().lastError);
        assertEquals(NOW, stored().completedAt);
        verify(listingGenerationService, never()).process(products.get(1));
        verify(productStore).updateAll(List.of(products.get(1).id, products.get(2).id),
                Map.of(ProductField.QC_STATUS, QcStatus.DRAFT));
        verify(workerDispatch, never()).advanceRun(any());
    }

    @Test
    void testExecute_batchWithNoSuccessEndsPass() {
        List<Product> products = claimable(2);
        products.forEach(p -> when(listingGenerationService.process(p))
                .thenReturn(ItemResultType.failed(p.id, "No images", false)));

        handler.execute(5L, payload());

        assertEquals(RunStatus.AWAITING_QC, stored().status);
        assertEquals(0, stored().processedCards);
        verify(workerDispatch, never()).advanceRun(any());
    }

    @Test
    void testExecute_processedNeverExceedsTotal() {
        stored().processedCards = 4;
        List<Product> products = claimable(1);
        when(listingGenerationService.process(products.get(0))).thenReturn(ItemResultType.success(products.get(0).id));

        handler.execute(6L, payload());

        assertEquals(4, stored().processedCards);
        verify(workerDispatch).advanceRun(run.id);
    }

    @Test
    void testExecute_stopDuringBatchSticks() {
        List<Product> products = claimable(2);
        when(listingGenerationService.process(products.get(0))).thenAnswer(inv -> {
            stored().status = RunStatus.FAILED;
            stored().lastError = "Stopped by user";
            stored().completedAt = NOW;
            return ItemResultType.success(products.get(0).id);
        });
        when(listingGenerationService.process(products.get(1))).thenReturn(ItemResultType.success(products.get(1).id));

        handler.execute(7L, payload());

        assertEquals(RunStatus.FAILED, stored().status);
        assertEquals("Stopped by user", stored().lastError);
        assertEquals(2, stored().processedCards);
        verify(workerDispatch, never()).advanceRun(any());
    }

    @Test
    void testExecute_stopDuringFailedBatchKeepsStopReason() {
        List<Product> products = claimable(1);
        when(listingGenerationService.process(products.get(0))).thenAnswer(inv -> {
            stored().status = RunStatus.FAILED;
            stored().lastError = "Stopped by user";
            return ItemResultType.failed(products.get(0).id, "Timeout", false);
        });

        handler.execute(8L, payload());

        assertEquals(RunStatus.FAILED, stored().status);
        assertEquals("Stopped by user", stored().lastError);
        verify(workerDispatch, never()).advanceRun(any());
    }
}
