/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.autopilot.api.types;

/**
 * Attributes handed to the pricing policy, taken from the product after the current generation pass has been merged.
 *
 * @param brand
 *            merged brand
 * @param material
 *            merged material
 * @param condition
 *            normalized condition label
 * @param tags
 *            merged collection tags
 * @param title
 *            merged title
 * @param style
 *            merged era label, used as the style hint
 */
public record PricingAttributesType(String brand, String material, String condition, String tags, String title,
        String style) {
}
