/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.autopilot.services;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

import villagecompute.autopilot.data.models.AutopilotRun;
import villagecompute.autopilot.data.models.RunStatus;

/**
 * Persistence port for autopilot runs.
 *
 * @see PanacheRunStore
 */
public interface RunStore {

    Optional<AutopilotRun> findById(UUID runId);

    Optional<AutopilotRun> findRunningForBatch(UUID batchId);

    /**
     * Persists a new run and returns it with its id assigned.
     */
    AutopilotRun create(AutopilotRun run);

    /**
     * Records worker progress. Never touches the run status, so a concurrent stop or transition is preserved.
     *
     * @param processedDelta
     *            cards newly processed; the stored count never decreases or exceeds {@code totalCards}
     * @param currentBatch
     *            batch counter to store
     * @param lastError
     *            failure summary to store, or null to keep the stored value; ignored once the run has left RUNNING so a
     *            stop reason is not overwritten
     * @return the stored status after the write, empty if the run does not exist
     */
    Optional<RunStatus> recordProgress(UUID runId, int processedDelta, int currentBatch, String lastError);

    /**
     * Moves a run to {@code to} only while its stored status is still {@code from}. A terminal target also stamps
     * {@code completedAt}.
     *
     * @param lastError
     *            reason to store, or null to keep the stored value
     * @param at
     *            time of the transition
     * @return true if the transition was written, false if the run is missing or its status changed
     */
    boolean transition(UUID runId, RunStatus from, RunStatus to, String lastError, Instant at);
}
