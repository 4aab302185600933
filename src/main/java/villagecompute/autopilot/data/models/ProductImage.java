/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.autopilot.data.models;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

/**
 * Product photo entity.
 *
 * Images are uploaded by the capture flow and grouped into products. Grouping operations (auto group, regroup, move)
 * re-parent images by changing {@code productId} and {@code position}, which is what structural undo restores.
 */
@Entity
@Table(
        name = "product_images")
public class ProductImage extends PanacheEntityBase {

    @Id
    @GeneratedValue
    public UUID id;

    @Column(
            name = "product_id")
    public UUID productId;

    @Column(
            nullable = false)
    public int position;

    @Column(
            nullable = false)
    public String url;

    @Column(
            name = "created_at",
            nullable = false)
    public Instant createdAt;

    /**
     * Find all images attached to a product in display order.
     *
     * @param productId
     *            the product UUID
     * @return images ordered by position ASC
     */
    public static List<ProductImage> findByProductId(UUID productId) {
        return find("productId = ?1 ORDER BY position ASC", productId).list();
    }

    public static List<ProductImage> findByIds(Collection<UUID> ids) {
        return find("id IN ?1", ids).list();
    }
}
