/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.autopilot.jobs;

import java.util.Map;

/**
 * Contract for async job handler implementations.
 *
 * <p>
 * Handlers are CDI beans annotated with {@code @ApplicationScoped}. {@link villagecompute.autopilot.services.DelayedJobService}
 * discovers them at startup and routes each job to the handler registered for its {@link JobType}.
 *
 * <p>
 * <b>Execution Model:</b>
 * <ul>
 * <li>Handlers execute on the job worker pool, never on the caller's thread</li>
 * <li>A thrown exception schedules a retry with exponential backoff until the attempt limit is reached</li>
 * <li>An OpenTelemetry span wraps every execution</li>
 * </ul>
 *
 * @see JobType for supported job types
 */
public interface JobHandler {

    /**
     * Returns the job type this handler processes.
     */
    JobType handlesType();

    /**
     * Executes the job with the given payload.
     *
     * <p>
     * <b>Thread Safety:</b> This method may be called concurrently by multiple worker threads.
     *
     * @param jobId
     *            id assigned at enqueue time
     * @param payload
     *            job parameters
     * @throws Exception
     *             any error during execution; triggers retry logic
     */
    void execute(Long jobId, Map<String, Object> payload) throws Exception;
}
