/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.autopilot.services;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.when;

import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import villagecompute.autopilot.data.models.Product;
import villagecompute.autopilot.data.models.ProductImage;
import villagecompute.autopilot.data.models.ProductStatus;

/**
 * Unit tests for {@link EligibilityFilter}.
 */
class EligibilityFilterTest {

    @Mock
    ImageStore imageStore;

    private EligibilityFilter filter;
    private ConcurrencyGuard guard;
    private EnrichmentRegistry registry;
    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        guard = new ConcurrencyGuard();
        registry = new EnrichmentRegistry();
        executor = Executors.newFixedThreadPool(2);

        filter = new EligibilityFilter();
        filter.concurrencyGuard = guard;
        filter.enrichmentRegistry = registry;
        filter.imageStore = imageStore;
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private static Product product(ProductStatus status) {
        Product product = new Product();
        product.id = UUID.randomUUID();
        product.status = status;
        return product;
    }

    private static ProductImage image(Product product) {
        ProductImage image = new ProductImage();
        image.id = UUID.randomUUID();
        image.productId = product.id;
        image.url = "https://cdn.example.com/" + product.id + ".jpg";
        return image;
    }

    @Test
    void testSelect_defaultModeOnlyNewUnlockedProducts() {
        Product fresh = product(ProductStatus.NEW);
        Product generated = product(ProductStatus.GENERATED);
        Product locked = product(ProductStatus.NEW);
        Product deleted = product(ProductStatus.NEW);
        deleted.deletedAt = Instant.now();
        Product errored = product(ProductStatus.ERROR);
        List<Product> products = List.of(fresh, generated, locked, deleted, errored);
        registry.seedFromStatuses(products);
        guard.tryAcquireItem(locked.id);

        EligibilityFilter.Eligibility result = filter.select(products, null);

        assertEquals(List.of(fresh), result.eligible());
        assertEquals(1, result.excludedAsEnriched());
        assertFalse(result.explicitSelection());
    }

    @Test
    void testSelect_explicitSelectionIncludesEnriched() {
        Product generated = product(ProductStatus.GENERATED);
        Product other = product(ProductStatus.NEW);
        List<Product> products = List.of(generated, other);
        registry.seedFromStatuses(products);

        EligibilityFilter.Eligibility result = filter.select(products, Set.of(generated.id));

        assertEquals(List.of(generated), result.eligible());
        assertTrue(result.explicitSelection());
    }

    @Test
    void testSelect_allEnriched() {
        List<Product> products = List.of(product(ProductStatus.GENERATED), product(ProductStatus.CREATED_IN_SHOPIFY));
        registry.seedFromStatuses(products);

        EligibilityFilter.Eligibility result = filter.select(products, Set.of());

        assertTrue(result.eligible().isEmpty());
        assertEquals(2, result.excludedAsEnriched());
    }

    @Test
    void testPartitionByImages() {
        Product withImages = product(ProductStatus.NEW);
        Product withoutImages = product(ProductStatus.NEW);
        Product unreachable = product(ProductStatus.NEW);
        when(imageStore.fetchImages(withImages.id)).thenReturn(List.of(image(withImages)));
        when(imageStore.fetchImages(withoutImages.id)).thenReturn(List.of());
        when(imageStore.fetchImages(unreachable.id)).thenThrow(new IllegalStateException("db down"));

        EligibilityFilter.ImagePartition partition = filter
                .partitionByImages(List.of(withImages, withoutImages, unreachable), executor);

        assertEquals(List.of(withImages), partition.withImages());
        assertEquals(List.of(withoutImages), partition.noImages());
        assertEquals(1, partition.images().get(withImages.id).size());
        assertTrue(partition.fetchFailures().get(unreachable.id).contains("db down"));
    }
}
