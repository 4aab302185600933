/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.autopilot.api.types;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Raw listing fields returned by the generation provider.
 *
 * <p>
 * Every field is untrusted and may be null, blank, the literal string "null", or outside the allowed value set.
 * {@link villagecompute.autopilot.services.FieldMergeEngine} decides what actually reaches the product.
 *
 * <p>
 * All JSON-marshalled types in this project use the Type suffix and record classes.
 */
@JsonIgnoreProperties(
        ignoreUnknown = true)
public record GeneratedListingType(String title, String description,
        @JsonProperty("description_style_a") String descriptionStyleA,
        @JsonProperty("description_style_b") String descriptionStyleB,
        @JsonProperty("shopify_tags") String shopifyTags, @JsonProperty("etsy_tags") String etsyTags,
        @JsonProperty("collections_tags") String collectionsTags, String era, String department,
        @JsonProperty("garment_type") String garmentType, String brand,
        @JsonProperty("colour_main") String colourMain, @JsonProperty("colour_secondary") String colourSecondary,
        String pattern, @JsonProperty("size_label") String sizeLabel,
        @JsonProperty("size_recommended") String sizeRecommended, String fit, String material, String condition,
        @JsonProperty("made_in") String madeIn) {
}
