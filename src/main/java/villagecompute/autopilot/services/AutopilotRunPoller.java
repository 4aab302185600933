/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.autopilot.services;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import villagecompute.autopilot.data.models.AutopilotRun;
import villagecompute.autopilot.data.models.RunStatus;

/**
 * Polls watched autopilot runs while they are RUNNING and raises a notification when they leave that state.
 *
 * <p>
 * Runs are watched from {@link AutopilotService#start(UUID)} until their status is no longer RUNNING; a run is
 * dropped from the watch set on the first tick that observes the change, so each run is notified at most once.
 *
 * <p>
 * <b>Schedule:</b> {@code autopilot.poll-interval} (default 3s). Overlapping ticks are skipped.
 */
@ApplicationScoped
public class AutopilotRunPoller {

    private static final Logger LOG = Logger.getLogger(AutopilotRunPoller.class);

    @Inject
    RunStore runStore;

    @Inject
    AutopilotNotifier notifier;

    private final Set<UUID> watched = ConcurrentHashMap.newKeySet();

    /** Last processed count logged per run. */
    private final Map<UUID, Integer> lastProcessed = new ConcurrentHashMap<>();

    public void watch(UUID runId) {
        if (watched.add(runId)) {
            LOG.debugf("Watching autopilot run %s", runId);
        }
    }

    public boolean isWatching(UUID runId) {
        return watched.contains(runId);
    }

    @Scheduled(
            every = "{autopilot.poll-interval}",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    void pollScheduled() {
        pollWatchedRuns();
    }

    /**
     * Reloads every watched run once.
     *
     * @return number of runs still being watched
     */
    public int pollWatchedRuns() {
        for (UUID runId : Set.copyOf(watched)) {
            try {
                poll(runId);
            } catch (RuntimeException e) {
                // Keep watching; the next tick retries.
                LOG.errorf(e, "Failed to poll autopilot run %s", runId);
            }
        }
        return watched.size();
    }

    private void poll(UUID runId) {
        Optional<AutopilotRun> found = runStore.findById(runId);
        if (found.isEmpty()) {
            LOG.warnf("Autopilot run %s disappeared, no longer watching", runId);
            unwatch(runId);
            return;
        }

        AutopilotRun run = found.get();
        if (run.status == RunStatus.RUNNING) {
            Integer previous = lastProcessed.put(runId, run.processedCards);
            if (previous == null || previous != run.processedCards) {
                LOG.infof("Autopilot run %s: %d/%d processed, batch %d", runId, run.processedCards, run.totalCards,
                        run.currentBatch);
            }
            return;
        }

        unwatch(runId);
        if (run.status == RunStatus.AWAITING_QC) {
            LOG.infof("Autopilot run %s finished generating %d/%d products, awaiting QC", runId, run.processedCards,
                    run.totalCards);
            notifier.awaitingQc(run);
        } else {
            LOG.infof("Autopilot run %s left RUNNING with status %s", runId, run.status);
            notifier.runEnded(run);
        }
    }

    private void unwatch(UUID runId) {
        watched.remove(runId);
        lastProcessed.remove(runId);
    }
}
