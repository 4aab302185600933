/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.autopilot.services;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import com.google.common.util.concurrent.ThreadFactoryBuilder;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import villagecompute.autopilot.jobs.JobHandler;
import villagecompute.autopilot.jobs.JobType;
import villagecompute.autopilot.observability.LoggingConfig;

/**
 * In-process orchestrator for async jobs.
 *
 * <p>
 * Jobs are handed to a small scheduled worker pool and run on it, so {@link #enqueue} returns as soon as the job is
 * accepted. Nothing is persisted: jobs still queued when the process stops are lost, and the work they represent is
 * picked up again by the next explicit request (an autopilot run resumes on the next start).
 *
 * <p>
 * <b>Retry Strategy:</b> A job whose handler throws is retried up to {@link #DEFAULT_MAX_ATTEMPTS} times with
 * exponential backoff: {@code delay = (2^attempt) * BASE_DELAY_SECONDS} with random jitter (&plusmn;25%).
 *
 * @see JobHandler for handler contract
 * @see JobType for job-to-queue mappings
 */
@ApplicationScoped
public class DelayedJobService {

    private static final Logger LOG = Logger.getLogger(DelayedJobService.class);

    static final int BASE_DELAY_SECONDS = 5;

    static final int DEFAULT_MAX_ATTEMPTS = 3;

    private static final int WORKER_THREADS = 4;

    /**
     * Registry mapping JobType to JobHandler, built once at startup.
     */
    private final Map<JobType, JobHandler> handlerRegistry;

    private final AtomicLong jobIds = new AtomicLong();

    private final ScheduledExecutorService workers = Executors.newScheduledThreadPool(WORKER_THREADS,
            new ThreadFactoryBuilder().setNameFormat("job-worker-%d").setDaemon(true).build());

    @Inject
    Tracer tracer;

    @Inject
    public DelayedJobService(Instance<JobHandler> handlers) {
        this.handlerRegistry = buildHandlerRegistry(handlers);
        LOG.infof("Initialized DelayedJobService with %d registered handlers", handlerRegistry.size());
    }

    /**
     * @throws IllegalStateException
     *             if two handlers register for the same JobType
     */
    private Map<JobType, JobHandler> buildHandlerRegistry(Iterable<JobHandler> handlers) {
        Map<JobType, JobHandler> registry = new EnumMap<>(JobType.class);
        for (JobHandler handler : handlers) {
            JobType type = handler.handlesType();
            if (registry.containsKey(type)) {
                throw new IllegalStateException("Duplicate handlers registered for JobType." + type + ": "
                        + registry.get(type).getClass().getName() + " and " + handler.getClass().getName());
            }
            registry.put(type, handler);
            LOG.debugf("Registered handler %s for JobType.%s (queue: %s)", handler.getClass().getSimpleName(), type,
                    type.getQueue());
        }
        return registry;
    }

    /**
     * Enqueues a job for async execution and returns without waiting for it.
     *
     * @param jobType
     *            the type of job to enqueue
     * @param payload
     *            job parameters
     * @return id assigned to the job
     * @throws IllegalStateException
     *             if no handler is registered for the type or the worker pool is shut down
     */
    public long enqueue(JobType jobType, Map<String, Object> payload) {
        if (!handlerRegistry.containsKey(jobType)) {
            throw new IllegalStateException("No handler registered for JobType." + jobType);
        }
        long jobId = jobIds.incrementAndGet();
        Map<String, Object> frozen = Map.copyOf(payload);
        try {
            workers.execute(() -> runAttempt(jobType, jobId, frozen, 1));
        } catch (RejectedExecutionException e) {
            throw new IllegalStateException("Job workers unavailable, JobType." + jobType + " not enqueued", e);
        }
        LOG.debugf("Enqueued job %d (type: %s, queue: %s)", jobId, jobType, jobType.getQueue());
        return jobId;
    }

    private void runAttempt(JobType jobType, long jobId, Map<String, Object> payload, int attempt) {
        if (executeJob(jobType, jobId, payload, attempt) || attempt >= DEFAULT_MAX_ATTEMPTS) {
            return;
        }
        long delay = calculateBackoffDelay(attempt);
        try {
            workers.schedule(() -> runAttempt(jobType, jobId, payload, attempt + 1), delay, TimeUnit.SECONDS);
            LOG.infof("Job %d (type: %s) scheduled for retry in %ds (attempt %d of %d)", jobId, jobType, delay,
                    attempt + 1, DEFAULT_MAX_ATTEMPTS);
        } catch (RejectedExecutionException e) {
            LOG.warnf(e, "Job %d (type: %s) not retried, workers shutting down", jobId, jobType);
        }
    }

    /**
     * Executes a single job attempt on the calling thread.
     *
     * @return true if the handler completed, false if it failed and may be retried
     * @throws IllegalStateException
     *             if no handler registered for jobType
     */
    public boolean executeJob(JobType jobType, Long jobId, Map<String, Object> payload, int attempt) {
        JobHandler handler = handlerRegistry.get(jobType);
        if (handler == null) {
            throw new IllegalStateException("No handler registered for JobType." + jobType);
        }

        Span span = tracer.spanBuilder("job.execute").setAttribute("job.id", jobId)
                .setAttribute("job.type", jobType.name()).setAttribute("job.queue", jobType.getQueue().name())
                .setAttribute("job.attempt", attempt).startSpan();

        try (Scope scope = span.makeCurrent()) {
            LoggingConfig.setJobId(jobId);
            handler.execute(jobId, payload);
            span.addEvent("job.completed");
            LOG.debugf("Job %d (type: %s) completed on attempt %d", jobId, jobType, Integer.valueOf(attempt));
            return true;

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            span.recordException(e);
            span.addEvent("job.interrupted");
            LOG.warnf(e, "Job %d (type: %s) interrupted during execution", jobId, jobType);
            return true;

        } catch (Exception e) {
            span.recordException(e);
            span.setStatus(StatusCode.ERROR, e.getMessage());
            span.addEvent("job.failed");
            LOG.errorf(e, "Job %d (type: %s) failed on attempt %d", jobId, jobType, attempt);
            return false;

        } finally {
            span.end();
            LoggingConfig.clearMDC();
        }
    }

    /**
     * Next retry delay using exponential backoff with &plusmn;25% jitter.
     *
     * @param attempt
     *            attempt that just failed (1-indexed)
     * @return delay in seconds before the next attempt
     */
    public long calculateBackoffDelay(int attempt) {
        double baseDelay = Math.pow(2, attempt) * BASE_DELAY_SECONDS;
        double jitter = 0.75 + (ThreadLocalRandom.current().nextDouble() * 0.5);
        return (long) (baseDelay * jitter);
    }

    @PreDestroy
    void shutdown() {
        workers.shutdown();
        try {
            if (!workers.awaitTermination(10, TimeUnit.SECONDS)) {
                LOG.warn("Job workers did not finish within 10s, forcing shutdown");
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            workers.shutdownNow();
        }
    }
}
