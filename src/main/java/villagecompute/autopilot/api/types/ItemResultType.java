/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.autopilot.api.types;

import java.util.UUID;

/**
 * Outcome of running one product through the generation pipeline.
 *
 * @param itemId
 *            product id
 * @param outcome
 *            what happened
 * @param errorReason
 *            failure message, null on success
 * @param fatal
 *            true when the provider reported an account-level failure
 */
public record ItemResultType(UUID itemId, Outcome outcome, String errorReason, boolean fatal) {

    public enum Outcome {
        SUCCESS, FAILED, SKIPPED, NO_IMAGES
    }

    public static ItemResultType success(UUID itemId) {
        return new ItemResultType(itemId, Outcome.SUCCESS, null, false);
    }

    public static ItemResultType failed(UUID itemId, String reason, boolean fatal) {
        return new ItemResultType(itemId, Outcome.FAILED, reason, fatal);
    }

    public static ItemResultType skipped(UUID itemId) {
        return new ItemResultType(itemId, Outcome.SKIPPED, "Already generating", false);
    }

    public static ItemResultType noImages(UUID itemId) {
        return new ItemResultType(itemId, Outcome.NO_IMAGES, "No images", false);
    }

    public boolean isSuccess() {
        return outcome == Outcome.SUCCESS;
    }
}
