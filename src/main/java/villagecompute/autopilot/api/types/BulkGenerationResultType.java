/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.autopilot.api.types;

import java.util.List;
import java.util.UUID;

/**
 * Aggregated summary of one bulk generation call.
 *
 * @param outcome
 *            overall result class
 * @param successCount
 *            products generated and saved
 * @param errorCount
 *            products whose generation or save failed
 * @param skippedCount
 *            products skipped because another call held their lock
 * @param noImagesCount
 *            products rejected before any provider call because they have no images
 * @param processedIds
 *            ids of products that went through the pipeline (success or failure)
 * @param remainingCount
 *            eligible products left for a later call
 * @param haltedByFatalError
 *            true when scheduling stopped early on an account-level provider failure
 * @param message
 *            human summary
 */
public record BulkGenerationResultType(Outcome outcome, int successCount, int errorCount, int skippedCount,
        int noImagesCount, List<UUID> processedIds, int remainingCount, boolean haltedByFatalError, String message) {

    public enum Outcome {
        COMPLETED, ALREADY_RUNNING, NOTHING_TO_DO, ALL_ALREADY_ENRICHED
    }

    public static BulkGenerationResultType alreadyRunning() {
        return new BulkGenerationResultType(Outcome.ALREADY_RUNNING, 0, 0, 0, 0, List.of(), 0, false,
                "Generation already in progress");
    }

    public static BulkGenerationResultType nothingToDo(Outcome outcome, int noImagesCount, String message) {
        return new BulkGenerationResultType(outcome, 0, 0, 0, noImagesCount, List.of(), 0, false, message);
    }
}
