/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.autopilot.services;

import java.util.Collection;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

import jakarta.enterprise.context.ApplicationScoped;
import villagecompute.autopilot.data.models.Product;

/**
 * Tracks which products already carry generated content in this process.
 *
 * <p>
 * Seeded from product statuses when a batch is first seen, updated on each successful generation, and cleared by undo.
 * The eligibility filter excludes members unless the user selects them explicitly.
 */
@ApplicationScoped
public class EnrichmentRegistry {

    private final Set<UUID> enriched = ConcurrentHashMap.newKeySet();

    /**
     * Adds every product whose status already counts as enriched.
     *
     * @param products
     *            products to inspect
     * @return number of products added
     */
    public int seedFromStatuses(Collection<Product> products) {
        int added = 0;
        for (Product product : products) {
            if (product.status != null && product.status.isEnriched() && enriched.add(product.id)) {
                added++;
            }
        }
        return added;
    }

    public void markEnriched(UUID itemId) {
        enriched.add(itemId);
    }

    public void clear(UUID itemId) {
        enriched.remove(itemId);
    }

    public boolean isEnriched(UUID itemId) {
        return enriched.contains(itemId);
    }
}
