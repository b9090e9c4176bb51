package com.printmonitor.core;

import com.printmonitor.models.ConnectionStatus;

import com.printmonitor.models.DeviceState;

import com.printmonitor.models.JobProgress;

import com.printmonitor.models.PrintStatus;

import com.printmonitor.models.StateFragment;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import java.util.ArrayList;

import java.util.Collections;

import java.util.List;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertEquals;

import static org.junit.jupiter.api.Assertions.assertFalse;

import static org.junit.jupiter.api.Assertions.assertNull;

import static org.junit.jupiter.api.Assertions.assertSame;

import static org.junit.jupiter.api.Assertions.assertTrue;

class StateMergerTest
{

    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    private final StateMerger merger = new StateMerger();

    private static Instant t(long seconds)
    {
        return T0.plusSeconds(seconds);
    }

    @Test
    void olderPushIsIgnoredAndNewerPollWins()
    {
        var state = merger.merge(DeviceState.initial("p1"), StateFragment.builder()
            .temperature("nozzle", 210.0, 215.0, t(10))
            .build());

        var afterPush = merger.merge(state, StateFragment.builder()
            .temperature("nozzle", 180.0, 215.0, t(5))
            .build());

        assertEquals(210.0, afterPush.getTemperature("nozzle").getCurrent());

        assertEquals(t(10), afterPush.getTemperature("nozzle").getUpdatedAt());

        var afterPoll = merger.merge(afterPush, StateFragment.builder()
            .temperature("nozzle", 214.5, 215.0, t(15))
            .build());

        assertEquals(214.5, afterPoll.getTemperature("nozzle").getCurrent());

        assertEquals(t(15), afterPoll.getTemperature("nozzle").getUpdatedAt());
    }

    @Test
    void absentLeavesAreCarriedOver()
    {
        var state = merger.merge(DeviceState.initial("p1"), StateFragment.builder()
            .connectionStatus(ConnectionStatus.ONLINE, t(1))
            .printStatus(PrintStatus.PRINTING, t(1))
            .temperature("bed", 60.0, 60.0, t(1))
            .currentJob(new JobProgress("benchy.gcode", 12.5, 3600L), t(1))
            .build());

        var next = merger.merge(state, StateFragment.builder()
            .temperature("nozzle", 200.0, null, t(2))
            .build());

        assertSame(state.getConnectionStatus(), next.getConnectionStatus());

        assertSame(state.getPrintStatus(), next.getPrintStatus());

        assertSame(state.getCurrentJob(), next.getCurrentJob());

        assertEquals(60.0, next.getTemperature("bed").getCurrent());

        assertEquals(200.0, next.getTemperature("nozzle").getCurrent());

        assertNull(next.getTemperature("nozzle").getTarget());
    }

    @Test
    void equalTimestampAcceptsIncoming()
    {
        var state = merger.merge(DeviceState.initial("p1"), StateFragment.builder()
            .printStatus(PrintStatus.PRINTING, t(3))
            .build());

        var next = merger.merge(state, StateFragment.builder()
            .printStatus(PrintStatus.PAUSED, t(3))
            .build());

        assertEquals(PrintStatus.PAUSED, next.getPrintStatus().getValue());
    }

    @Test
    void clearedJobIsALeafLikeAnyOther()
    {
        var printing = merger.merge(DeviceState.initial("p1"), StateFragment.builder()
            .currentJob(new JobProgress("part.gcode", 90.0, 60L), t(10))
            .build());

        var staleClear = merger.merge(printing, StateFragment.builder()
            .currentJob(null, t(9))
            .build());

        assertTrue(staleClear.hasCurrentJob());

        var clear = merger.merge(staleClear, StateFragment.builder()
            .currentJob(null, t(11))
            .build());

        assertFalse(clear.hasCurrentJob());
    }

    @Test
    void lastSeenTracksNewestObservation()
    {
        var initial = DeviceState.initial("p1");

        assertNull(initial.getLastSeen());

        var seen = merger.merge(initial, StateFragment.builder()
            .connectionStatus(ConnectionStatus.ONLINE, t(20))
            .observedAt(t(20))
            .build());

        assertEquals(t(20), seen.getLastSeen());

        var late = merger.merge(seen, StateFragment.builder()
            .printStatus(PrintStatus.IDLE, t(5))
            .observedAt(t(5))
            .build());

        assertEquals(t(20), late.getLastSeen());

        var synthetic = merger.merge(late, StateFragment.builder()
            .monitoringError(true, t(30))
            .build());

        assertEquals(t(20), synthetic.getLastSeen());
    }

    @Test
    void resultDoesNotDependOnArrivalOrder()
    {
        var fragments = new ArrayList<StateFragment>();

        for (var i = 0; i < 12; i++)
        {
            fragments.add(StateFragment.builder()
                .printStatus(PrintStatus.values()[i % PrintStatus.values().length], t(i))
                .temperature("nozzle", 190.0 + i, 215.0, t(12 - i))
                .temperature("bed", 50.0 + i, 60.0, t(i * 7 % 12))
                .currentJob(new JobProgress("job", i * 5.0, null), t(i))
                .observedAt(t(i))
                .build());
        }

        var expected = mergeAll(fragments);

        var random = new Random(42);

        for (var round = 0; round < 20; round++)
        {
            var shuffled = new ArrayList<>(fragments);

            Collections.shuffle(shuffled, random);

            assertEquals(expected, mergeAll(shuffled));
        }

        assertEquals(PrintStatus.values()[11 % PrintStatus.values().length], expected.getPrintStatus().getValue());

        assertEquals(190.0, expected.getTemperature("nozzle").getCurrent());

        assertEquals(55.0, expected.getTemperature("bed").getCurrent());
    }

    private DeviceState mergeAll(List<StateFragment> fragments)
    {
        var state = DeviceState.initial("p1");

        for (var fragment : fragments)
        {
            state = merger.merge(state, fragment);
        }

        return state;
    }

}
