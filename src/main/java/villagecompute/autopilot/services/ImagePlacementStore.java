/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.autopilot.services;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

import villagecompute.autopilot.api.types.ImagePlacementType;

/**
 * Reads and restores image-to-product assignments for structural undo.
 */
public interface ImagePlacementStore {

    /**
     * Current parent and position of each image. Unknown ids are omitted.
     */
    List<ImagePlacementType> findPlacements(Collection<UUID> imageIds);

    /**
     * Puts an image back under its previous parent at its previous position.
     *
     * @return true if the image existed and was written
     */
    boolean restorePlacement(ImagePlacementType placement);
}
