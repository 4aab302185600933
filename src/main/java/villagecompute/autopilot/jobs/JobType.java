/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.autopilot.jobs;

/**
 * Async job types with their queue assignments.
 *
 * <p>
 * Each job type maps to exactly one {@link JobQueue} family. Handler implementations register themselves for the
 * corresponding job type.
 *
 * @see JobHandler for handler contract
 */
public enum JobType {

    /**
     * Advances an autopilot run by one worker batch and re-dispatches itself until the run leaves RUNNING.
     * <p>
     * <b>Payload:</b> {@code runId} (UUID string)
     * <p>
     * <b>Handler:</b> AutopilotBatchJobHandler
     */
    AUTOPILOT_BATCH(JobQueue.BULK);

    private final JobQueue queue;

    JobType(JobQueue queue) {
        this.queue = queue;
    }

    public JobQueue getQueue() {
        return queue;
    }
}
