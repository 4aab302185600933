/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.autopilot.services;

import java.math.BigDecimal;

import villagecompute.autopilot.api.types.PricingAttributesType;

/**
 * Suggests a list price for a product. The pricing algorithm lives outside this service.
 */
public interface PricingPolicy {

    /**
     * @param garmentType
     *            merged garment type
     * @param attributes
     *            merged attributes from the same generation pass
     * @return suggested price, or null when no suggestion can be made
     */
    BigDecimal suggestPrice(String garmentType, PricingAttributesType attributes);
}
