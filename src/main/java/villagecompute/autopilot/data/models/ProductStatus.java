/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.autopilot.data.models;

/**
 * Listing lifecycle of a product, independent of the autopilot QC stages.
 */
public enum ProductStatus {
    NEW, GENERATED, READY_FOR_SHOPIFY, CREATED_IN_SHOPIFY, ERROR;

    /**
     * Returns true when a product in this status already carries generated content. Used to seed the enriched
     * membership at startup.
     */
    public boolean isEnriched() {
        return this == GENERATED || this == READY_FOR_SHOPIFY || this == CREATED_IN_SHOPIFY;
    }
}
