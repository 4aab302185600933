/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.autopilot.services;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import villagecompute.autopilot.api.types.GeneratedListingType;
import villagecompute.autopilot.api.types.GenerationRequestType;
import villagecompute.autopilot.api.types.ItemResultType;
import villagecompute.autopilot.config.EnrichmentConfig;
import villagecompute.autopilot.data.models.Product;
import villagecompute.autopilot.data.models.ProductField;
import villagecompute.autopilot.data.models.ProductImage;
import villagecompute.autopilot.data.models.ProductStatus;
import villagecompute.autopilot.exceptions.FatalProviderException;
import villagecompute.autopilot.exceptions.GenerationException;
import villagecompute.autopilot.exceptions.ValidationException;
import villagecompute.autopilot.integration.generation.GenerationService;
import villagecompute.autopilot.integration.generation.HttpGenerationClient;
import villagecompute.autopilot.observability.EnrichmentMetrics;
import villagecompute.autopilot.observability.LoggingConfig;

/**
 * Runs one product through the generation pipeline: images, provider call, merge, save.
 *
 * <p>
 * The caller must already hold the product's item lock. Every failure is converted into an {@link ItemResultType}
 * here; nothing is thrown past the item boundary.
 *
 * <p>
 * <b>Failure classes:</b>
 * <ul>
 * <li>no images or no usable image URLs - recorded before any network call</li>
 * <li>transient provider failure (after retries) - item failed</li>
 * <li>fatal provider failure - item failed and flagged {@code fatal} so bulk callers stop scheduling</li>
 * <li>save failure - logged, product marked {@link ProductStatus#ERROR}, item failed</li>
 * </ul>
 */
@ApplicationScoped
public class ListingGenerationService {

    private static final Logger LOG = Logger.getLogger(ListingGenerationService.class);

    @Inject
    GenerationService generationService;

    @Inject
    FieldMergeEngine mergeEngine;

    @Inject
    ProductStore productStore;

    @Inject
    ImageStore imageStore;

    @Inject
    EnrichmentRegistry enrichmentRegistry;

    @Inject
    EnrichmentConfig config;

    @Inject
    EnrichmentMetrics metrics;

    @Inject
    Tracer tracer;

    @Inject
    Clock clock;

    /**
     * Fetches the product's images and runs the pipeline.
     */
    public ItemResultType process(Product product) {
        return process(product, imageStore.fetchImages(product.id));
    }

    /**
     * Runs the pipeline with images fetched by the caller.
     *
     * @param product
     *            product to enrich; updated in memory on success
     * @param images
     *            the product's images in display order
     * @return the item outcome
     */
    public ItemResultType process(Product product, List<ProductImage> images) {
        Span span = tracer.spanBuilder("generation.item").setAttribute("item.id", String.valueOf(product.id))
                .startSpan();
        LoggingConfig.setItemId(product.id);
        try {
            ItemResultType result = runPipeline(product, images);
            span.setAttribute("item.outcome", result.outcome().name());
            if (!result.isSuccess()) {
                span.setStatus(StatusCode.ERROR, result.errorReason());
            }
            metrics.recordItemOutcome(result.outcome());
            return result;
        } finally {
            span.end();
            LoggingConfig.clearItemId();
        }
    }

    private ItemResultType runPipeline(Product product, List<ProductImage> images) {
        if (images == null || images.isEmpty()) {
            LOG.debugf("Product %s has no images, skipping generation", product.id);
            return ItemResultType.noImages(product.id);
        }

        GeneratedListingType generated;
        try {
            List<String> urls = HttpGenerationClient.filterImageUrls(images.stream().map(image -> image.url).toList(),
                    config.getMaxImageUrls(), config.getMaxUrlLength());
            if (urls.isEmpty()) {
                throw new ValidationException("No valid image URLs");
            }
            generated = generationService.generate(new GenerationRequestType(product.id, attributesOf(product), urls));
        } catch (FatalProviderException e) {
            LOG.errorf("Fatal provider error for product %s: %s", product.id, e.getMessage());
            return ItemResultType.failed(product.id, e.getMessage(), true);
        } catch (GenerationException | ValidationException e) {
            LOG.warnf("Generation failed for product %s: %s", product.id, e.getMessage());
            return ItemResultType.failed(product.id, e.getMessage(), false);
        }

        Map<ProductField, Object> updates;
        try {
            updates = mergeEngine.merge(product, generated);
        } catch (RuntimeException e) {
            LOG.errorf(e, "Could not merge generated fields for product %s", product.id);
            return ItemResultType.failed(product.id, "Could not merge generated fields: " + e.getMessage(), false);
        }
        updates.put(ProductField.STATUS, ProductStatus.GENERATED);
        updates.put(ProductField.GENERATED_AT, Instant.now(clock));

        if (!save(product, updates)) {
            markError(product);
            return ItemResultType.failed(product.id, "Failed to save generated listing", false);
        }

        ProductField.applyTo(product, updates);
        enrichmentRegistry.markEnriched(product.id);
        LOG.debugf("Generated listing for product %s (%d fields)", product.id, updates.size());
        return ItemResultType.success(product.id);
    }

    private boolean save(Product product, Map<ProductField, Object> updates) {
        try {
            boolean saved = productStore.update(product.id, updates);
            if (!saved) {
                LOG.errorf("Product %s was not updated (missing or deleted)", product.id);
            }
            return saved;
        } catch (RuntimeException e) {
            LOG.errorf(e, "Failed to save generated listing for product %s", product.id);
            return false;
        }
    }

    private void markError(Product product) {
        try {
            if (productStore.update(product.id, Map.of(ProductField.STATUS, ProductStatus.ERROR))) {
                product.status = ProductStatus.ERROR;
            }
        } catch (RuntimeException e) {
            LOG.errorf(e, "Could not mark product %s as error", product.id);
        }
    }

    /**
     * Non-empty product attributes sent to the provider, keyed by column name.
     */
    static Map<String, Object> attributesOf(Product product) {
        Map<String, Object> attributes = new LinkedHashMap<>();
        put(attributes, "garment_type", product.garmentType);
        put(attributes, "brand", product.brand);
        put(attributes, "colour_main", product.colourMain);
        put(attributes, "colour_secondary", product.colourSecondary);
        put(attributes, "pattern", product.pattern);
        put(attributes, "size_label", product.sizeLabel);
        put(attributes, "size_recommended", product.sizeRecommended);
        put(attributes, "pit_to_pit", product.pitToPit);
        put(attributes, "fit", product.fit);
        put(attributes, "material", product.material);
        put(attributes, "made_in", product.madeIn);
        put(attributes, "era", product.era);
        put(attributes, "condition", product.condition);
        put(attributes, "flaws", product.flaws);
        put(attributes, "department", product.department);
        put(attributes, "raw_input_text", product.notes);
        if (product.price != null && product.price.signum() > 0) {
            attributes.put("price", product.price);
        }
        return attributes;
    }

    private static void put(Map<String, Object> attributes, String key, String value) {
        if (FieldMergeEngine.hasValue(value)) {
            attributes.put(key, value.trim());
        }
    }
}
