/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.autopilot.observability;

import java.util.UUID;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanContext;
import org.jboss.logging.MDC;

/**
 * Standard MDC field names and helpers for enriching log lines with enrichment context.
 *
 * <p>
 * <b>Standard Log Fields:</b>
 * <ul>
 * <li>{@code trace_id} - OpenTelemetry trace identifier</li>
 * <li>{@code span_id} - current span identifier within the trace</li>
 * <li>{@code batch_id} - capture batch being enriched</li>
 * <li>{@code run_id} - autopilot run, when the work belongs to one</li>
 * <li>{@code item_id} - product currently being generated</li>
 * <li>{@code job_id} - delayed job key (only for async job execution)</li>
 * <li>{@code request_origin} - operation or job type identifier</li>
 * </ul>
 *
 * <p>
 * <b>Usage in Job Handlers:</b>
 *
 * <pre>
 * LoggingConfig.enrichWithTraceContext();
 * LoggingConfig.setJobId(jobId);
 * LoggingConfig.setRunId(runId);
 * </pre>
 *
 * <p>
 * <b>Thread Safety:</b> {@link MDC} is thread-local. Bulk runs fan out onto pool threads, so per-item fields are set
 * and cleared on the worker thread that runs the item. Callers clear MDC in {@code finally}.
 */
public final class LoggingConfig {

    public static final String MDC_TRACE_ID = "trace_id";

    public static final String MDC_SPAN_ID = "span_id";

    public static final String MDC_BATCH_ID = "batch_id";

    public static final String MDC_RUN_ID = "run_id";

    public static final String MDC_ITEM_ID = "item_id";

    public static final String MDC_JOB_ID = "job_id";

    /**
     * Operation name (e.g., "generation.bulk") or job type identifier (e.g., "JobType.AUTOPILOT_BATCH").
     */
    public static final String MDC_REQUEST_ORIGIN = "request_origin";

    private LoggingConfig() {
        // Utility class, no instantiation
    }

    /**
     * Copies trace_id and span_id from the current OpenTelemetry span into MDC. Empty strings are written when no span
     * is active to keep the log schema stable.
     */
    public static void enrichWithTraceContext() {
        SpanContext spanContext = Span.current().getSpanContext();

        if (spanContext.isValid()) {
            MDC.put(MDC_TRACE_ID, spanContext.getTraceId());
            MDC.put(MDC_SPAN_ID, spanContext.getSpanId());
        } else {
            MDC.put(MDC_TRACE_ID, "");
            MDC.put(MDC_SPAN_ID, "");
        }
    }

    public static void setBatchId(UUID batchId) {
        if (batchId != null) {
            MDC.put(MDC_BATCH_ID, batchId.toString());
        }
    }

    public static void setRunId(UUID runId) {
        if (runId != null) {
            MDC.put(MDC_RUN_ID, runId.toString());
        }
    }

    public static void setItemId(UUID itemId) {
        if (itemId != null) {
            MDC.put(MDC_ITEM_ID, itemId.toString());
        }
    }

    /**
     * Removes the per-item field only, leaving run and trace context in place.
     */
    public static void clearItemId() {
        MDC.remove(MDC_ITEM_ID);
    }

    public static void setJobId(Long jobId) {
        if (jobId != null) {
            MDC.put(MDC_JOB_ID, jobId.toString());
        }
    }

    public static void setRequestOrigin(String requestOrigin) {
        if (requestOrigin != null) {
            MDC.put(MDC_REQUEST_ORIGIN, requestOrigin);
        }
    }

    /**
     * Clears every field set by this class. Must run at the end of each bulk call and job to prevent context leaking
     * across pooled threads.
     */
    public static void clearMDC() {
        MDC.remove(MDC_TRACE_ID);
        MDC.remove(MDC_SPAN_ID);
        MDC.remove(MDC_BATCH_ID);
        MDC.remove(MDC_RUN_ID);
        MDC.remove(MDC_ITEM_ID);
        MDC.remove(MDC_JOB_ID);
        MDC.remove(MDC_REQUEST_ORIGIN);
    }
}
