/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.autopilot.api.types;

import java.util.UUID;

/**
 * A product that failed its most recent generation attempt.
 *
 * @param itemId
 *            product id
 * @param humanLabel
 *            title or SKU shown in retry prompts
 * @param errorReason
 *            message from the latest failure
 */
public record FailureRecordType(UUID itemId, String humanLabel, String errorReason) {
}
