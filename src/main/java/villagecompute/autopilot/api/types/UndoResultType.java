/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.autopilot.api.types;

/**
 * Result of an undo request.
 *
 * @param outcome
 *            RESTORED when every entry was written back, PARTIAL when some failed, EXPIRED when the window has passed,
 *            NONE when nothing was captured
 * @param restored
 *            entries written back
 * @param failed
 *            entries whose write-back failed
 * @param message
 *            human summary
 */
public record UndoResultType(Outcome outcome, int restored, int failed, String message) {

    public enum Outcome {
        RESTORED, PARTIAL, EXPIRED, NONE
    }

    public static UndoResultType expired() {
        return new UndoResultType(Outcome.EXPIRED, 0, 0, "Undo expired");
    }

    public static UndoResultType none() {
        return new UndoResultType(Outcome.NONE, 0, 0, "Nothing to undo");
    }

    public static UndoResultType of(int restored, int failed, String label) {
        if (failed == 0) {
            return new UndoResultType(Outcome.RESTORED, restored, 0, "Undid " + label);
        }
        return new UndoResultType(Outcome.PARTIAL, restored, failed,
                String.format("Partially undid %s: %d restored, %d failed", label, restored, failed));
    }
}
