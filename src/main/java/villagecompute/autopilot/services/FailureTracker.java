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
import java.util.UUID;

import jakarta.enterprise.context.ApplicationScoped;
import villagecompute.autopilot.api.types.FailureRecordType;

/**
 * Products that failed their latest generation attempt, keyed by product id, in first-failure order.
 *
 * <p>
 * Cleared at the start of each fresh bulk run. A success removes the product; a repeated failure replaces its record
 * in place. {@link BulkGenerationService#retryFailed()} replays exactly the tracked ids.
 */
@ApplicationScoped
public class FailureTracker {

    private final Map<UUID, FailureRecordType> failures = new LinkedHashMap<>();

    public synchronized void recordFailure(UUID itemId, String humanLabel, String errorReason) {
        failures.put(itemId, new FailureRecordType(itemId, humanLabel, errorReason));
    }

    public synchronized void recordSuccess(UUID itemId) {
        failures.remove(itemId);
    }

    /**
     * Drops a product without recording an outcome, e.g. when it was deleted before a retry.
     */
    public synchronized void remove(UUID itemId) {
        failures.remove(itemId);
    }

    public synchronized void clear() {
        failures.clear();
    }

    public synchronized List<FailureRecordType> failures() {
        return List.copyOf(failures.values());
    }

    public synchronized List<UUID> failedIds() {
        return new ArrayList<>(failures.keySet());
    }

    public synchronized boolean contains(UUID itemId) {
        return failures.containsKey(itemId);
    }

    public synchronized int size() {
        return failures.size();
    }
}
