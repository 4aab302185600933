/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.autopilot.data.models;

import java.util.Arrays;
import java.util.Optional;

/**
 * Allowed values for the {@code condition} field. Declared longest label first so that contains-matching picks
 * "Very good" before "Good".
 */
public enum Condition {
    EXCELLENT("Excellent"), VERY_GOOD("Very good"), GOOD("Good"), FAIR("Fair");

    private final String label;

    Condition(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static Optional<Condition> fromLabel(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return Arrays.stream(values()).filter(c -> c.label.equalsIgnoreCase(value.trim())).findFirst();
    }
}
