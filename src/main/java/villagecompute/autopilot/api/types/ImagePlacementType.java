/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.autopilot.api.types;

import java.util.UUID;

/**
 * Where an image sat before a grouping operation moved it.
 *
 * @param imageId
 *            the image
 * @param previousProductId
 *            parent product before the move, null when the image was unassigned
 * @param previousPosition
 *            display position before the move
 */
public record ImagePlacementType(UUID imageId, UUID previousProductId, int previousPosition) {
}
