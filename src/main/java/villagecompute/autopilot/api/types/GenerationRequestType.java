/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.autopilot.api.types;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request body sent to the generation provider.
 *
 * @param itemId
 *            product being enriched
 * @param product
 *            structured attributes keyed by column name (only non-empty values)
 * @param imageUrls
 *            http(s) image URLs, already filtered and capped
 */
public record GenerationRequestType(@JsonProperty("item_id") UUID itemId, Map<String, Object> product,
        @JsonProperty("image_urls") List<String> imageUrls) {
}
