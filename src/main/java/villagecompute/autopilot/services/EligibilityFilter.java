/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.autopilot.services;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import villagecompute.autopilot.data.models.Product;
import villagecompute.autopilot.data.models.ProductImage;
import villagecompute.autopilot.data.models.ProductStatus;

/**
 * Decides which products are candidates for (re)generation.
 *
 * <p>
 * <b>Rules:</b>
 * <ul>
 * <li>With an explicit selection, every selected non-deleted product is eligible, whatever its enrichment state (this
 * is how a user forces regeneration)</li>
 * <li>Without a selection, a product is eligible when its status is NEW, it is not already enriched and it is not
 * locked by another generation</li>
 * </ul>
 *
 * <p>
 * A second pass ({@link #partitionByImages}) fetches images for the whole eligible set concurrently and splits off
 * products without images, so they are reported as {@code noImages} without ever reaching the provider.
 */
@ApplicationScoped
public class EligibilityFilter {

    private static final Logger LOG = Logger.getLogger(EligibilityFilter.class);

    @Inject
    ConcurrencyGuard concurrencyGuard;

    @Inject
    EnrichmentRegistry enrichmentRegistry;

    @Inject
    ImageStore imageStore;

    /**
     * Applies the eligibility rules.
     *
     * @param products
     *            every product of the batch, in processing order
     * @param selection
     *            explicitly selected ids, or null/empty for the implicit "new products" mode
     * @return eligible products in input order plus exclusion counts
     */
    public Eligibility select(List<Product> products, Set<UUID> selection) {
        boolean explicit = selection != null && !selection.isEmpty();
        List<Product> eligible = new ArrayList<>();
        int excludedAsEnriched = 0;

        for (Product product : products) {
            if (product.isDeleted()) {
                continue;
            }
            if (explicit) {
                if (selection.contains(product.id)) {
                    eligible.add(product);
                }
                continue;
            }
            if (enrichmentRegistry.isEnriched(product.id)) {
                excludedAsEnriched++;
            } else if (product.status == ProductStatus.NEW && !concurrencyGuard.isItemLocked(product.id)) {
                eligible.add(product);
            }
        }

        LOG.debugf("Eligibility: %d of %d products eligible (explicit=%s, excludedAsEnriched=%d)", eligible.size(),
                products.size(), explicit, excludedAsEnriched);
        return new Eligibility(eligible, excludedAsEnriched, explicit);
    }

    /**
     * Fetches images for every product concurrently and splits the set by whether images exist.
     *
     * @param products
     *            eligible products
     * @param executor
     *            executor for the concurrent fetches
     * @return products with images (with their images) and products without
     */
    public ImagePartition partitionByImages(List<Product> products, Executor executor) {
        Map<Product, CompletableFuture<List<ProductImage>>> fetches = new LinkedHashMap<>();
        for (Product product : products) {
            fetches.put(product, CompletableFuture.supplyAsync(() -> imageStore.fetchImages(product.id), executor));
        }
        CompletableFuture.allOf(fetches.values().toArray(CompletableFuture[]::new)).exceptionally(e -> null).join();

        List<Product> withImages = new ArrayList<>();
        List<Product> noImages = new ArrayList<>();
        Map<UUID, List<ProductImage>> images = new LinkedHashMap<>();
        Map<UUID, String> fetchFailures = new LinkedHashMap<>();

        fetches.forEach((product, future) -> {
            try {
                List<ProductImage> found = future.join();
                if (found == null || found.isEmpty()) {
                    noImages.add(product);
                } else {
                    withImages.add(product);
                    images.put(product.id, found);
                }
            } catch (CompletionException e) {
                Throwable cause = e.getCause() == null ? e : e.getCause();
                LOG.warnf(cause, "Could not fetch images for product %s", product.id);
                fetchFailures.put(product.id, "Could not fetch images: " + cause.getMessage());
            }
        });

        return new ImagePartition(withImages, images, noImages, fetchFailures);
    }

    /**
     * Output of {@link #select}.
     *
     * @param eligible
     *            eligible products in input order
     * @param excludedAsEnriched
     *            products skipped because they were already enriched (implicit mode only)
     * @param explicitSelection
     *            whether an explicit selection drove the result
     */
    public record Eligibility(List<Product> eligible, int excludedAsEnriched, boolean explicitSelection) {
    }

    /**
     * Output of {@link #partitionByImages}.
     *
     * @param withImages
     *            products that have at least one image, in input order
     * @param images
     *            images per product in {@code withImages}
     * @param noImages
     *            products with zero images
     * @param fetchFailures
     *            products whose image lookup failed, with the reason
     */
    public record ImagePartition(List<Product> withImages, Map<UUID, List<ProductImage>> images,
            List<Product> noImages, Map<UUID, String> fetchFailures) {
    }
}
