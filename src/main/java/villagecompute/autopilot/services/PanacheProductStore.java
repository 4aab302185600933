/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.autopilot.services;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import org.jboss.logging.Logger;
import villagecompute.autopilot.data.models.Product;
import villagecompute.autopilot.data.models.ProductField;
import villagecompute.autopilot.data.models.QcStatus;
import villagecompute.autopilot.exceptions.PersistenceException;

/**
 * {@link ProductStore} backed by the {@link Product} Panache entity. Each write runs in its own transaction.
 */
@ApplicationScoped
public class PanacheProductStore implements ProductStore {

    private static final Logger LOG = Logger.getLogger(PanacheProductStore.class);

    @Inject
    Clock clock;

    @Override
    public Optional<Product> findById(UUID id) {
        return Product.findByIdOptional(id);
    }

    @Override
    public List<Product> findByIds(Collection<UUID> ids) {
        if (ids.isEmpty()) {
            return List.of();
        }
        return Product.list("id IN ?1", new ArrayList<>(ids));
    }

    @Override
    public List<Product> findActiveByBatch(UUID batchId) {
        return Product.findActiveByBatch(batchId);
    }

    @Override
    public List<Product> findByRun(UUID runId, Set<QcStatus> statuses, int limit) {
        return Product.findByRunAndQcStatus(runId, new ArrayList<>(statuses), limit);
    }

    @Override
    public List<Product> findByRun(UUID runId) {
        return Product.findByRun(runId);
    }

    @Override
    @Transactional
    public boolean update(UUID id, Map<ProductField, Object> fields) {
        try {
            Optional<Product> found = Product.findByIdOptional(id);
            if (found.isEmpty()) {
                LOG.debugf("Product %s not found, update skipped", id);
                return false;
            }
            Product product = found.get();
            ProductField.applyTo(product, fields);
            product.updatedAt = Instant.now(clock);
            return true;
        } catch (RuntimeException e) {
            throw new PersistenceException("Failed to update product " + id, e);
        }
    }

    @Override
    @Transactional
    public int updateAll(Collection<UUID> ids, Map<ProductField, Object> fields) {
        int written = 0;
        Instant now = Instant.now(clock);
        try {
            for (Product product : findByIds(ids)) {
                ProductField.applyTo(product, fields);
                product.updatedAt = now;
                written++;
            }
        } catch (RuntimeException e) {
            throw new PersistenceException("Failed to update " + ids.size() + " products", e);
        }
        return written;
    }
}
