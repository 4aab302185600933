/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.autopilot.api.types;

import java.util.Map;

import villagecompute.autopilot.data.models.QcStatus;

/**
 * Automatic QC verdict for a freshly generated product.
 *
 * @param confidence
 *            0 to 100
 * @param status
 *            READY, NEEDS_REVIEW or BLOCKED
 * @param flags
 *            issue name to detail (true, or a list of missing field names)
 */
public record QcEvaluationType(int confidence, QcStatus status, Map<String, Object> flags) {
}
