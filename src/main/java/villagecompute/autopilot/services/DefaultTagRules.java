/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.autopilot.services;

import java.util.List;

/**
 * Category and default tags applied to every generated listing, merged with the AI tags.
 */
public interface DefaultTagRules {

    /**
     * @return tags matching the product attributes, never null
     */
    List<String> tagsFor(String garmentType, String department, String title, String description, String notes);
}
