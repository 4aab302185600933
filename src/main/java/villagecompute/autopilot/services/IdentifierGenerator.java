/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.autopilot.services;

import villagecompute.autopilot.api.types.SkuResultType;

/**
 * Produces a SKU once a product has been categorized. The SKU scheme lives outside this service.
 */
public interface IdentifierGenerator {

    /**
     * @param category
     *            garment type
     * @param size
     *            recommended size, may be null
     * @param era
     *            era label, may be null
     * @param labelSize
     *            size printed on the label, may be null
     * @return the SKU or an error describing what is missing
     */
    SkuResultType generate(String category, String size, String era, String labelSize);
}
