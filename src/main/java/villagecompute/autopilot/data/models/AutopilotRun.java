/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.autopilot.data.models;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

/**
 * Panache entity tracking one autopilot pass over a capture batch.
 *
 * <p>
 * <b>Schema Mapping:</b>
 * <ul>
 * <li>{@code status} (TEXT) - {@link RunStatus}</li>
 * <li>{@code total_cards} (INT) - product count snapshotted at start, never changes</li>
 * <li>{@code processed_cards} (INT) - monotonically non-decreasing, never above total_cards</li>
 * <li>{@code current_batch} (INT) - worker batch counter</li>
 * <li>{@code batch_size} (INT) - products claimed per worker tick</li>
 * <li>{@code last_error} (TEXT) - last failure summary or stop reason</li>
 * </ul>
 *
 * Runs are never deleted by this service; retention is handled externally.
 */
@Entity
@Table(
        name = "autopilot_runs")
public class AutopilotRun extends PanacheEntityBase {

    @Id
    @GeneratedValue
    public UUID id;

    @Column(
            name = "batch_id",
            nullable = false)
    public UUID batchId;

    @Column(
            nullable = false)
    @Enumerated(EnumType.STRING)
    public RunStatus status;

    @Column(
            name = "total_cards",
            nullable = false)
    public int totalCards;

    @Column(
            name = "processed_cards",
            nullable = false)
    public int processedCards;

    @Column(
            name = "current_batch",
            nullable = false)
    public int currentBatch;

    @Column(
            name = "batch_size",
            nullable = false)
    public int batchSize;

    @Column(
            name = "last_error")
    public String lastError;

    @Column(
            name = "started_at",
            nullable = false)
    public Instant startedAt;

    @Column(
            name = "completed_at")
    public Instant completedAt;

    /**
     * Adds to {@code processedCards} without ever decreasing it or exceeding {@code totalCards}.
     *
     * @param delta
     *            number of newly processed cards (negative values are ignored)
     */
    public void advanceProcessed(int delta) {
        if (delta <= 0) {
            return;
        }
        processedCards = Math.min(totalCards, processedCards + delta);
    }

    /**
     * Find the running run for a capture batch, if any.
     */
    public static Optional<AutopilotRun> findRunningForBatch(UUID batchId) {
        return find("batchId = ?1 AND status = ?2 ORDER BY startedAt DESC", batchId, RunStatus.RUNNING)
                .firstResultOptional();
    }
}
