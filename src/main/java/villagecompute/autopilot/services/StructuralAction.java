/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.autopilot.services;

/**
 * Grouping operations that re-parent images and can be undone structurally.
 */
public enum StructuralAction {
    AUTO_GROUP("Auto-group"), REGROUP("Regroup"), MOVE_IMAGES("Move images"), BULK_CREATE("Bulk create"),
    CONFIRM_GROUPING("Confirm grouping");

    private final String label;

    StructuralAction(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
