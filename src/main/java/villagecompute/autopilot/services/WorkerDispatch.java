/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.autopilot.services;

import java.util.UUID;

/**
 * Fire-and-forget request asking the autopilot worker to advance a run.
 *
 * <p>
 * Implementations return once the request is handed off. Completion is never reported back; run progress is observed
 * by polling the run record.
 */
public interface WorkerDispatch {

    /**
     * @param runId
     *            run to advance
     * @throws RuntimeException
     *             if the request could not be handed off
     */
    void advanceRun(UUID runId);
}
