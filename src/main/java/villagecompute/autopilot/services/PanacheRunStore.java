/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.autopilot.services;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.persistence.LockModeType;
import jakarta.transaction.Transactional;
import org.jboss.logging.Logger;
import villagecompute.autopilot.data.models.AutopilotRun;
import villagecompute.autopilot.data.models.RunStatus;

/**
 * {@link RunStore} backed by the {@link AutopilotRun} Panache entity. Writes lock the run row so a worker tick and a
 * user stop cannot interleave.
 */
@ApplicationScoped
public class PanacheRunStore implements RunStore {

    private static final Logger LOG = Logger.getLogger(PanacheRunStore.class);

    @Override
    public Optional<AutopilotRun> findById(UUID runId) {
        return AutopilotRun.findByIdOptional(runId);
    }

    @Override
    public Optional<AutopilotRun> findRunningForBatch(UUID batchId) {
        return AutopilotRun.findRunningForBatch(batchId);
    }

    @Override
    @Transactional
    public AutopilotRun create(AutopilotRun run) {
        run.persist();
        return run;
    }

    @Override
    @Transactional
    public Optional<RunStatus> recordProgress(UUID runId, int processedDelta, int currentBatch, String lastError) {
        Optional<AutopilotRun> found = AutopilotRun.findByIdOptional(runId, LockModeType.PESSIMISTIC_WRITE);
        if (found.isEmpty()) {
            return Optional.empty();
        }
        AutopilotRun stored = found.get();
        stored.advanceProcessed(processedDelta);
        stored.currentBatch = Math.max(stored.currentBatch, currentBatch);
        if (lastError != null && stored.status == RunStatus.RUNNING) {
            stored.lastError = lastError;
        }
        return Optional.of(stored.status);
    }

    @Override
    @Transactional
    public boolean transition(UUID runId, RunStatus from, RunStatus to, String lastError, Instant at) {
        Optional<AutopilotRun> found = AutopilotRun.findByIdOptional(runId, LockModeType.PESSIMISTIC_WRITE);
        if (found.isEmpty()) {
            return false;
        }
        AutopilotRun stored = found.get();
        if (stored.status != from) {
            LOG.debugf("Run %s is %s, not %s; transition to %s skipped", runId, stored.status, from, to);
            return false;
        }
        stored.status = to;
        if (lastError != null) {
            stored.lastError = lastError;
        }
        if (to.isTerminal()) {
            stored.completedAt = at;
        }
        return true;
    }
}
