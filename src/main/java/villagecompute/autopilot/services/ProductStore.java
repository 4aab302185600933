/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.autopilot.services;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import villagecompute.autopilot.data.models.Product;
import villagecompute.autopilot.data.models.ProductField;
import villagecompute.autopilot.data.models.QcStatus;

/**
 * Persistence port for products. Used uniformly for business fields and status/QC transitions.
 *
 * @see PanacheProductStore
 */
public interface ProductStore {

    Optional<Product> findById(UUID id);

    List<Product> findByIds(Collection<UUID> ids);

    /**
     * Non-deleted products of a capture batch, oldest first.
     */
    List<Product> findActiveByBatch(UUID batchId);

    /**
     * Products bound to a run whose QC stage is one of {@code statuses}, oldest first.
     */
    List<Product> findByRun(UUID runId, Set<QcStatus> statuses, int limit);

    List<Product> findByRun(UUID runId);

    /**
     * Applies a partial update.
     *
     * @param id
     *            product id
     * @param fields
     *            fields to write; null values clear the column
     * @return true if the product existed and was written
     */
    boolean update(UUID id, Map<ProductField, Object> fields);

    /**
     * Applies the same partial update to several products.
     *
     * @return number of products written
     */
    int updateAll(Collection<UUID> ids, Map<ProductField, Object> fields);
}
