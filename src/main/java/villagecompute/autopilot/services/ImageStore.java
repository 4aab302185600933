/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.autopilot.services;

import java.util.List;
import java.util.UUID;

import villagecompute.autopilot.data.models.ProductImage;

/**
 * Read-only access to product photos.
 */
public interface ImageStore {

    /**
     * Images attached to a product in display order. Never null.
     */
    List<ProductImage> fetchImages(UUID productId);
}
