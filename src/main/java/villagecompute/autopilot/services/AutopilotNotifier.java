/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.autopilot.services;

import villagecompute.autopilot.data.models.AutopilotRun;

/**
 * Receives user-facing autopilot notifications raised by {@link AutopilotRunPoller}.
 */
public interface AutopilotNotifier {

    /**
     * Called once when a watched run leaves RUNNING for AWAITING_QC.
     */
    void awaitingQc(AutopilotRun run);

    /**
     * Called once when a watched run leaves RUNNING for any other state.
     */
    void runEnded(AutopilotRun run);
}
