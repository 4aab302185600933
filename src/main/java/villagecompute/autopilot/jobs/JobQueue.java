/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.autopilot.jobs;

/**
 * Queue families for in-process async job processing.
 *
 * @see JobType for job-to-queue assignments
 */
public enum JobQueue {

    /**
     * BULK queue - provider-bound batch work (AI generation). Concurrency inside a job is bounded by the job itself.
     */
    BULK
}
