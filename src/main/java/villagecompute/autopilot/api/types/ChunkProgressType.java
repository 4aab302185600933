/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.autopilot.api.types;

/**
 * Read-only view of the bulk run in progress, replaced once per settled chunk.
 *
 * @param running
 *            whether a bulk run currently holds the batch lock
 * @param completedItems
 *            items settled so far
 * @param totalItems
 *            items selected for this run
 * @param successCount
 *            items generated successfully so far
 * @param errorCount
 *            items failed so far
 * @param chunkIndex
 *            1-based index of the last settled chunk
 * @param chunkCount
 *            total chunks in this run
 */
public record ChunkProgressType(boolean running, int completedItems, int totalItems, int successCount,
        int errorCount, int chunkIndex, int chunkCount) {

    public static ChunkProgressType idle() {
        return new ChunkProgressType(false, 0, 0, 0, 0, 0, 0);
    }
}
