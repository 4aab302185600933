/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.autopilot.services;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

import org.jboss.logging.Logger;

/**
 * Holds at most one undo snapshot with a fixed time-to-live.
 *
 * <p>
 * Capturing replaces any previous snapshot and cancels its expiry timer. When the TTL elapses the timer drops the
 * payload and leaves an expired marker, so a later {@link #take()} reports {@link State#EXPIRED} instead of
 * {@link State#EMPTY}. The clock is also checked on {@link #take()}, so expiry holds even if the timer has not fired
 * yet. An optional listener is told whenever a snapshot expires, timer-driven or not, so owners holding many slots can
 * drop the dead ones.
 *
 * @param <T>
 *            captured payload
 */
public final class SnapshotSlot<T> {

    private static final Logger LOG = Logger.getLogger(SnapshotSlot.class);

    private final String scope;
    private final Clock clock;
    private final Duration ttl;
    private final ScheduledExecutorService timer;
    private final Consumer<SnapshotSlot<T>> onExpired;

    private Snapshot<T> current;
    private boolean expired;
    private ScheduledFuture<?> expiryTask;

    public SnapshotSlot(String scope, Clock clock, Duration ttl, ScheduledExecutorService timer) {
        this(scope, clock, ttl, timer, slot -> {
        });
    }

    /**
     * @param onExpired
     *            called with this slot, while it is locked, each time a snapshot expires
     */
    public SnapshotSlot(String scope, Clock clock, Duration ttl, ScheduledExecutorService timer,
            Consumer<SnapshotSlot<T>> onExpired) {
        this.scope = scope;
        this.clock = clock;
        this.ttl = ttl;
        this.timer = timer;
        this.onExpired = onExpired;
    }

    /**
     * Stores a new snapshot, discarding the previous one.
     *
     * @param label
     *            action label shown to the user
     * @param payload
     *            pre-mutation state
     * @return the stored snapshot
     */
    public synchronized Snapshot<T> capture(String label, T payload) {
        cancelTimer();
        Instant now = clock.instant();
        Snapshot<T> captured = new Snapshot<>(label, payload, now, now.plus(ttl));
        current = captured;
        expired = false;
        expiryTask = timer.schedule(() -> expire(captured), ttl.toMillis(), TimeUnit.MILLISECONDS);
        return captured;
    }

    /**
     * Removes the snapshot for use by an undo.
     *
     * @return the slot state and, when READY, the snapshot
     */
    public synchronized Taken<T> take() {
        if (current != null && !clock.instant().isBefore(current.expiresAt())) {
            markExpired();
        }
        if (current == null) {
            boolean wasExpired = expired;
            expired = false;
            return new Taken<>(wasExpired ? State.EXPIRED : State.EMPTY, null);
        }
        Snapshot<T> taken = current;
        current = null;
        cancelTimer();
        return new Taken<>(State.READY, taken);
    }

    /**
     * Current snapshot without consuming it, empty when none is usable.
     */
    public synchronized Optional<Snapshot<T>> peek() {
        if (current != null && !clock.instant().isBefore(current.expiresAt())) {
            markExpired();
        }
        return Optional.ofNullable(current);
    }

    public synchronized boolean isAvailable() {
        return peek().isPresent();
    }

    /**
     * Drops the snapshot without leaving an expired marker.
     */
    public synchronized void clear() {
        cancelTimer();
        current = null;
        expired = false;
    }

    /**
     * Timer callback. Ignores a snapshot that was already taken or replaced.
     */
    private synchronized void expire(Snapshot<T> scheduled) {
        if (current == scheduled) {
            markExpired();
        }
    }

    private void markExpired() {
        LOG.debugf("Undo snapshot expired: scope=%s label=%s", scope, current.label());
        current = null;
        expired = true;
        cancelTimer();
        onExpired.accept(this);
    }

    private void cancelTimer() {
        if (expiryTask != null) {
            expiryTask.cancel(false);
            expiryTask = null;
        }
    }

    public enum State {
        READY, EXPIRED, EMPTY
    }

    /**
     * A captured pre-mutation state.
     *
     * @param label
     *            action label
     * @param payload
     *            captured state
     * @param createdAt
     *            capture time
     * @param expiresAt
     *            end of the undo window
     */
    public record Snapshot<T>(String label, T payload, Instant createdAt, Instant expiresAt) {
    }

    /**
     * Result of {@link SnapshotSlot#take()}.
     */
    public record Taken<T>(State state, Snapshot<T> snapshot) {
    }
}
