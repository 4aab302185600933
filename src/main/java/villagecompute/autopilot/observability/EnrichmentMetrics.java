/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.autopilot.observability;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.context.Initialized;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import villagecompute.autopilot.api.types.ItemResultType;
import villagecompute.autopilot.api.types.UndoResultType;
import villagecompute.autopilot.data.models.RunStatus;
import villagecompute.autopilot.services.ConcurrencyGuard;
import villagecompute.autopilot.services.FailureTracker;

/**
 * Registers and records the enrichment metrics.
 *
 * <p>
 * <b>Metrics Catalog:</b>
 * <ul>
 * <li><b>Counters:</b> {@code autopilot.generation.items.total{status}} - per-item outcomes (success, failed, skipped,
 * no_images)</li>
 * <li><b>Counters:</b> {@code autopilot.generation.fatal_halts} - bulk runs stopped early by a fatal provider
 * error</li>
 * <li><b>Counters:</b> {@code autopilot.undo.total{scope,outcome}} - undo requests by scope and result</li>
 * <li><b>Counters:</b> {@code autopilot.runs.transitions{to}} - autopilot run state changes</li>
 * <li><b>Gauges:</b> {@code autopilot.generation.items.in_flight} - products currently holding an item lock</li>
 * <li><b>Gauges:</b> {@code autopilot.generation.failures.tracked} - products waiting in the retry list</li>
 * </ul>
 */
@ApplicationScoped
public class EnrichmentMetrics {

    private static final Logger LOG = Logger.getLogger(EnrichmentMetrics.class);

    private final MeterRegistry registry;

    /**
     * Counters keyed by metric name plus tag values, created on first use.
     */
    private final Map<String, Counter> counters = new ConcurrentHashMap<>();

    @Inject
    ConcurrencyGuard concurrencyGuard;

    @Inject
    FailureTracker failureTracker;

    @Inject
    public EnrichmentMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Registers the state gauges once the application scope is up.
     */
    void registerGauges(@Observes @Initialized(ApplicationScoped.class) Object init) {
        Gauge.builder("autopilot.generation.items.in_flight", concurrencyGuard, g -> g.generatingIds().size())
                .description("Products currently holding an item lock").register(registry);
        Gauge.builder("autopilot.generation.failures.tracked", failureTracker, FailureTracker::size)
                .description("Products waiting in the retry list").register(registry);
        LOG.debug("Registered enrichment gauges");
    }

    public void recordItemOutcome(ItemResultType.Outcome outcome) {
        counter("autopilot.generation.items.total", "Products processed by outcome",
                List.of(Tag.of("status", outcome.name().toLowerCase()))).increment();
    }

    public void recordFatalHalt() {
        counter("autopilot.generation.fatal_halts", "Bulk runs halted by a fatal provider error", List.of())
                .increment();
    }

    public void recordUndo(String scope, UndoResultType.Outcome outcome) {
        counter("autopilot.undo.total", "Undo requests by scope and result",
                List.of(Tag.of("scope", scope), Tag.of("outcome", outcome.name().toLowerCase()))).increment();
    }

    public void recordRunTransition(RunStatus to) {
        counter("autopilot.runs.transitions", "Autopilot run state changes",
                List.of(Tag.of("to", to.name().toLowerCase()))).increment();
    }

    private Counter counter(String name, String description, List<Tag> tags) {
        String key = name + tags;
        return counters.computeIfAbsent(key,
                k -> Counter.builder(name).tags(tags).description(description).register(registry));
    }
}
