/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.autopilot.data.models;

/**
 * Per-product quality-control stage while the product is bound to an {@link AutopilotRun}.
 *
 * <p>
 * <b>Legal edges:</b>
 * <ul>
 * <li>DRAFT → GENERATING</li>
 * <li>GENERATING → READY | NEEDS_REVIEW | BLOCKED | FAILED</li>
 * <li>READY | NEEDS_REVIEW | BLOCKED → APPROVED</li>
 * <li>APPROVED → PUBLISHED</li>
 * <li>FAILED → GENERATING (worker retry)</li>
 * <li>any non-published stage → DRAFT (send to draft, stop compensation)</li>
 * </ul>
 */
public enum QcStatus {
    DRAFT, GENERATING, READY, NEEDS_REVIEW, BLOCKED, FAILED, APPROVED, PUBLISHED;

    /**
     * Checks whether moving from this stage to {@code target} follows a legal edge.
     *
     * @param target
     *            the requested stage
     * @return true if the edge exists
     */
    public boolean canTransitionTo(QcStatus target) {
        if (target == null || target == this) {
            return false;
        }
        if (target == DRAFT) {
            return this != PUBLISHED;
        }
        return switch (this) {
            case DRAFT -> target == GENERATING;
            case GENERATING -> target == READY || target == NEEDS_REVIEW || target == BLOCKED || target == FAILED;
            case READY, NEEDS_REVIEW, BLOCKED -> target == APPROVED;
            case FAILED -> target == GENERATING;
            case APPROVED -> target == PUBLISHED;
            case PUBLISHED -> false;
        };
    }
}
