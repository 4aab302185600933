/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.autopilot.data.models;

import java.util.Arrays;
import java.util.Optional;

/**
 * Allowed values for the {@code era} field.
 */
public enum Era {
    EIGHTIES("80s"), NINETIES("90s"), Y2K("Y2K"), MODERN("Modern");

    private final String label;

    Era(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * Finds the era whose label matches {@code value} ignoring case.
     */
    public static Optional<Era> fromLabel(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return Arrays.stream(values()).filter(e -> e.label.equalsIgnoreCase(value.trim())).findFirst();
    }
}
