/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.autopilot.api.types;

/**
 * Result of an identifier generator call: either a SKU or an error message, never both.
 */
public record SkuResultType(String sku, String error) {

    public static SkuResultType success(String sku) {
        return new SkuResultType(sku, null);
    }

    public static SkuResultType failure(String error) {
        return new SkuResultType(null, error);
    }

    public boolean isSuccess() {
        return sku != null && !sku.isBlank() && error == null;
    }
}
