/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.autopilot.data.models;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

/**
 * A reseller product listing subject to AI enrichment.
 *
 * <p>
 * Products are created by the upstream capture flow and only mutated by this service while holding the item lock in
 * {@link villagecompute.autopilot.services.ConcurrencyGuard}. Enrichable fields are addressed generically through
 * {@link ProductField} so that partial updates and undo snapshots share one field catalog.
 *
 * <p>
 * <b>Lifecycles:</b>
 * <ul>
 * <li>{@code status} - listing lifecycle (new, generated, ready_for_shopify, created_in_shopify, error)</li>
 * <li>{@code qcStatus} - autopilot QC stage, only meaningful while {@code runId} is set</li>
 * </ul>
 *
 * <p>
 * A product belongs to at most one autopilot run at a time via {@code runId}.
 */
@Entity
@Table(
        name = "products")
public class Product extends PanacheEntityBase {

    @Id
    @GeneratedValue
    public UUID id;

    @Column(
            name = "batch_id",
            nullable = false)
    public UUID batchId;

    public String sku;

    @Column(
            nullable = false)
    @Enumerated(EnumType.STRING)
    public ProductStatus status = ProductStatus.NEW;

    public String title;

    public String description;

    @Column(
            name = "description_style_a")
    public String descriptionStyleA;

    @Column(
            name = "description_style_b")
    public String descriptionStyleB;

    public BigDecimal price;

    public String currency;

    public String era;

    @Column(
            name = "garment_type")
    public String garmentType;

    public String department;

    public String brand;

    @Column(
            name = "colour_main")
    public String colourMain;

    @Column(
            name = "colour_secondary")
    public String colourSecondary;

    public String pattern;

    @Column(
            name = "size_label")
    public String sizeLabel;

    @Column(
            name = "size_recommended")
    public String sizeRecommended;

    @Column(
            name = "pit_to_pit")
    public String pitToPit;

    public String fit;

    public String material;

    @Column(
            name = "condition")
    public String condition;

    public String flaws;

    @Column(
            name = "made_in")
    public String madeIn;

    public String notes;

    @Column(
            name = "shopify_tags")
    public String shopifyTags;

    @Column(
            name = "etsy_tags")
    public String etsyTags;

    @Column(
            name = "collections_tags")
    public String collectionsTags;

    @Column(
            name = "run_id")
    public UUID runId;

    @Column(
            name = "qc_status")
    @Enumerated(EnumType.STRING)
    public QcStatus qcStatus;

    public Integer confidence;

    @Column(
            columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    public Map<String, Object> flags;

    @Column(
            name = "batch_number")
    public Integer batchNumber;

    @Column(
            name = "generated_at")
    public Instant generatedAt;

    @Column(
            name = "deleted_at")
    public Instant deletedAt;

    @Column(
            name = "created_at",
            nullable = false)
    public Instant createdAt;

    @Column(
            name = "updated_at")
    public Instant updatedAt;

    public boolean isDeleted() {
        return deletedAt != null;
    }

    /**
     * Human label used in failure reports: title when present, otherwise SKU, otherwise the id.
     */
    public String displayLabel() {
        if (title != null && !title.isBlank()) {
            return title;
        }
        if (sku != null && !sku.isBlank()) {
            return sku;
        }
        return String.valueOf(id);
    }

    // Static finders (Panache ActiveRecord pattern)

    /**
     * Find all non-deleted products in a capture batch, oldest first.
     *
     * @param batchId
     *            the capture batch UUID
     * @return products ordered by created_at ASC
     */
    public static List<Product> findActiveByBatch(UUID batchId) {
        return find("batchId = ?1 AND deletedAt IS NULL ORDER BY createdAt ASC", batchId).list();
    }

    /**
     * Find products of a run in any of the given QC stages, oldest first.
     *
     * @param runId
     *            the autopilot run UUID
     * @param statuses
     *            QC stages to include
     * @param limit
     *            maximum rows returned
     * @return matching products
     */
    public static List<Product> findByRunAndQcStatus(UUID runId, List<QcStatus> statuses, int limit) {
        return find("runId = ?1 AND qcStatus IN ?2 AND deletedAt IS NULL ORDER BY createdAt ASC", runId, statuses)
                .page(0, limit).list();
    }

    public static List<Product> findByRun(UUID runId) {
        return find("runId = ?1 AND deletedAt IS NULL", runId).list();
    }
}
