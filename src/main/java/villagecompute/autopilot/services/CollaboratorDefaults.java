/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.autopilot.services;

import java.util.List;
import java.util.Map;

import io.quarkus.arc.DefaultBean;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import org.jboss.logging.Logger;
import villagecompute.autopilot.api.types.SkuResultType;
import villagecompute.autopilot.config.EnrichmentConfig;
import villagecompute.autopilot.data.models.AutopilotRun;
import villagecompute.autopilot.jobs.AutopilotBatchJobHandler;
import villagecompute.autopilot.jobs.JobType;

/**
 * Fallback implementations of the collaborator ports. A hosting application replaces any of them by declaring its own
 * bean of the port type.
 */
@ApplicationScoped
public class CollaboratorDefaults {

    private static final Logger LOG = Logger.getLogger(CollaboratorDefaults.class);

    static final String NO_SKU_GENERATOR = "No identifier generator configured";

    /**
     * Never suggests a price; merged products keep whatever price they had.
     */
    @Produces
    @DefaultBean
    @ApplicationScoped
    PricingPolicy noPricing() {
        return (garmentType, attributes) -> null;
    }

    /**
     * Reports every product as needing a SKU, which surfaces the attention marker in its notes.
     */
    @Produces
    @DefaultBean
    @ApplicationScoped
    IdentifierGenerator noIdentifiers() {
        return (category, size, era, labelSize) -> SkuResultType.failure(NO_SKU_GENERATOR);
    }

    /**
     * Applies {@code autopilot.tags.defaults} to every product regardless of its attributes.
     */
    @Produces
    @DefaultBean
    @ApplicationScoped
    DefaultTagRules configuredTags(EnrichmentConfig config) {
        List<String> tags = List.copyOf(config.getDefaultTags());
        return (garmentType, department, title, description, notes) -> tags;
    }

    /**
     * Runs the autopilot worker on the in-process job pool.
     */
    @Produces
    @DefaultBean
    @ApplicationScoped
    WorkerDispatch jobQueueDispatch(DelayedJobService jobs) {
        return runId -> jobs.enqueue(JobType.AUTOPILOT_BATCH,
                Map.of(AutopilotBatchJobHandler.PAYLOAD_RUN_ID, runId.toString()));
    }

    @Produces
    @DefaultBean
    @ApplicationScoped
    AutopilotNotifier loggingNotifier() {
        return new AutopilotNotifier() {

            @Override
            public void awaitingQc(AutopilotRun run) {
                LOG.infof("Autopilot run %s is ready for QC: %d/%d products generated", run.id, run.processedCards,
                        run.totalCards);
            }

            @Override
            public void runEnded(AutopilotRun run) {
                LOG.infof("Autopilot run %s ended with status %s%s", run.id, run.status,
                        run.lastError == null ? "" : " (" + run.lastError + ")");
            }
        };
    }
}
