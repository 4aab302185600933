/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.autopilot.services;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for {@link SnapshotSlot}.
 */
class SnapshotSlotTest {

    private MutableClock clock;
    private ScheduledExecutorService timer;
    private SnapshotSlot<String> slot;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2025-03-01T10:00:00Z"));
        timer = Executors.newSingleThreadScheduledExecutor();
        slot = new SnapshotSlot<>("test", clock, Duration.ofSeconds(300), timer);
    }

    @AfterEach
    void tearDown() {
        timer.shutdownNow();
    }

    @Test
    void testTake_returnsSnapshotOnce() {
        slot.capture("Auto-group", "state");

        SnapshotSlot.Taken<String> taken = slot.take();
        assertEquals(SnapshotSlot.State.READY, taken.state());
        assertEquals("state", taken.snapshot().payload());
        assertEquals(Instant.parse("2025-03-01T10:05:00Z"), taken.snapshot().expiresAt());

        assertEquals(SnapshotSlot.State.EMPTY, slot.take().state());
    }

    @Test
    void testCapture_replacesPreviousSnapshot() {
        slot.capture("first", "a");
        slot.capture("second", "b");

        SnapshotSlot.Taken<String> taken = slot.take();
        assertEquals("second", taken.snapshot().label());
        assertEquals("b", taken.snapshot().payload());
    }

    @Test
    void testTake_afterTtlReportsExpiredOnce() {
        slot.capture("Bulk generation", "state");
        clock.advance(Duration.ofSeconds(301));

        assertFalse(slot.isAvailable());
        SnapshotSlot.Taken<String> taken = slot.take();
        assertEquals(SnapshotSlot.State.EXPIRED, taken.state());
        assertNull(taken.snapshot());

        assertEquals(SnapshotSlot.State.EMPTY, slot.take().state());
    }

    @Test
    void testTake_justBeforeTtlStillReady() {
        slot.capture("Bulk generation", "state");
        clock.advance(Duration.ofSeconds(299));

        assertTrue(slot.isAvailable());
        assertEquals(SnapshotSlot.State.READY, slot.take().state());
    }

    @Test
    void testExpire_timerFiredDropsSnapshotAndNotifies() throws InterruptedException {
        CountDownLatch notified = new CountDownLatch(1);
        SnapshotSlot<String> shortLived = new SnapshotSlot<>("test", clock, Duration.ofMillis(20), timer,
                expired -> notified.countDown());
        shortLived.capture("Regroup", "state");

        assertTrue(notified.await(2, TimeUnit.SECONDS));
        assertTrue(shortLived.peek().isEmpty());
        assertEquals(SnapshotSlot.State.EXPIRED, shortLived.take().state());
    }

    @Test
    void testTake_afterTtlNotifiesListener() {
        AtomicInteger notifications = new AtomicInteger();
        SnapshotSlot<String> watched = new SnapshotSlot<>("test", clock, Duration.ofSeconds(300), timer,
                expired -> notifications.incrementAndGet());
        watched.capture("Bulk generation", "state");
        clock.advance(Duration.ofSeconds(301));

        assertEquals(SnapshotSlot.State.EXPIRED, watched.take().state());
        assertEquals(1, notifications.get());
    }

    @Test
    void testClear_leavesNoExpiredMarker() {
        slot.capture("Regroup", "state");

        slot.clear();

        assertEquals(SnapshotSlot.State.EMPTY, slot.take().state());
    }
}
