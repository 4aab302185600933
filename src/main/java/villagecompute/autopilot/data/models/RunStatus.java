/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.autopilot.data.models;

/**
 * Lifecycle of an {@link AutopilotRun}.
 *
 * <p>
 * RUNNING → AWAITING_QC → PUBLISHING → COMPLETED. Any non-terminal state may move to FAILED (worker failure or explicit
 * stop). COMPLETED and FAILED are terminal.
 */
public enum RunStatus {
    RUNNING, AWAITING_QC, PUBLISHING, COMPLETED, FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    /**
     * Checks whether moving from this state to {@code target} follows a legal edge.
     *
     * @param target
     *            the requested state
     * @return true if the edge exists
     */
    public boolean canTransitionTo(RunStatus target) {
        if (target == null || isTerminal()) {
            return false;
        }
        if (target == FAILED) {
            return true;
        }
        return switch (this) {
            case RUNNING -> target == AWAITING_QC;
            case AWAITING_QC -> target == PUBLISHING;
            case PUBLISHING -> target == COMPLETED;
            default -> false;
        };
    }
}
