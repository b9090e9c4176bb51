package com.printmonitor.core;

import com.printmonitor.models.ConnectionStatus;

import com.printmonitor.models.PrintStatus;

import com.printmonitor.models.StateFragment;

import io.vertx.core.Vertx;

import io.vertx.junit5.VertxExtension;

import io.vertx.junit5.VertxTestContext;

import org.junit.jupiter.api.BeforeEach;

import org.junit.jupiter.api.Test;

import org.junit.jupiter.api.extension.ExtendWith;

import java.time.Duration;

import java.time.Instant;

import java.util.ArrayList;

import java.util.List;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;

import static org.junit.jupiter.api.Assertions.assertTrue;

@ExtendWith(VertxExtension.class)
class StalenessWatchdogTest
{

    private static final Instant T0 = Instant.parse("2026-05-01T08:00:00Z");

    private MutableClock clock;

    private SnapshotPublisher publisher;

    private StalenessWatchdog watchdog;

    private List<Set<String>> notifications;

    @BeforeEach
    void setUp(Vertx vertx)
    {
        clock = new MutableClock(T0);

        publisher = new SnapshotPublisher(new StateMerger());

        var config = MonitoringConfig.builder()
            .stalenessWindowMs(60000)
            .watchdogIntervalMs(20)
            .build();

        watchdog = new StalenessWatchdog(vertx, publisher, config, clock);

        notifications = new ArrayList<>();
    }

    private void observeOnline(String deviceId, Instant at)
    {
        publisher.merge(deviceId, StateFragment.builder()
            .connectionStatus(ConnectionStatus.ONLINE, at)
            .printStatus(PrintStatus.PRINTING, at)
            .observedAt(at)
            .build());
    }

    @Test
    void silentDeviceIsForcedOffline()
    {
        observeOnline("p1", T0);

        publisher.subscribe("p1", (state, changed) -> notifications.add(changed));

        clock.advance(Duration.ofSeconds(30));

        assertEquals(0, watchdog.sweep());

        clock.advance(Duration.ofSeconds(31));

        assertEquals(1, watchdog.sweep());

        var state = publisher.getSnapshot("p1").orElseThrow();

        assertEquals(ConnectionStatus.OFFLINE, state.getConnectionStatus().getValue());

        assertEquals(T0, state.getConnectionStatus().getUpdatedAt());

        assertEquals(PrintStatus.PRINTING, state.getPrintStatus().getValue());

        assertEquals(List.of(Set.of("connectionStatus")), notifications);

        assertEquals(0, watchdog.sweep());
    }

    @Test
    void forcedOfflineYieldsToNewerObservation()
    {
        observeOnline("p1", T0);

        clock.advance(Duration.ofMinutes(2));

        watchdog.sweep();

        observeOnline("p1", clock.instant());

        assertEquals(ConnectionStatus.ONLINE, publisher.getSnapshot("p1").orElseThrow().getConnectionStatus().getValue());
    }

    @Test
    void forcedOfflineOverridesAFresherStoredTimestamp()
    {
        // connection status stamped by the device clock, ahead of the last observation
        publisher.merge("p1", StateFragment.builder()
            .connectionStatus(ConnectionStatus.ONLINE, T0.plusSeconds(120))
            .observedAt(T0)
            .build());

        clock.advance(Duration.ofSeconds(61));

        assertEquals(1, watchdog.sweep());

        assertEquals(ConnectionStatus.OFFLINE, publisher.getSnapshot("p1").orElseThrow().getConnectionStatus().getValue());
    }

    @Test
    void neverObservedDevicesAreLeftAlone()
    {
        publisher.merge("p1", StateFragment.builder()
            .monitoringError(true, T0)
            .build());

        clock.advance(Duration.ofHours(1));

        assertEquals(0, watchdog.sweep());

        assertEquals(ConnectionStatus.UNKNOWN, publisher.getSnapshot("p1").orElseThrow().getConnectionStatus().getValue());
    }

    @Test
    void periodicSweepRunsOnTimer(VertxTestContext testContext)
    {
        observeOnline("p1", T0);

        observeOnline("p2", T0.plusSeconds(50));

        publisher.subscribeAll((state, changed) ->
        {
            if (state.getConnectionStatus().getValue() == ConnectionStatus.OFFLINE)
            {
                testContext.verify(() ->
                {
                    assertEquals("p1", state.getDeviceId());

                    assertTrue(publisher.getSnapshot("p2").orElseThrow().getConnectionStatus().getValue() == ConnectionStatus.ONLINE);
                });

                watchdog.stop();

                testContext.completeNow();
            }
        });

        clock.advance(Duration.ofSeconds(70));

        watchdog.start();
    }

}
