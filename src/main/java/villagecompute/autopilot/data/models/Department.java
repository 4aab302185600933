/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.autopilot.data.models;

import java.util.Arrays;
import java.util.Optional;

/**
 * Allowed values for the {@code department} field.
 */
public enum Department {
    WOMEN("Women"), MEN("Men"), UNISEX("Unisex"), KIDS("Kids");

    private final String label;

    Department(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static Optional<Department> fromLabel(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return Arrays.stream(values()).filter(d -> d.label.equalsIgnoreCase(value.trim())).findFirst();
    }
}
