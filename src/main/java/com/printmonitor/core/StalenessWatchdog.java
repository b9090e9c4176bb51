package com.printmonitor.core;

import com.printmonitor.models.ConnectionStatus;

import com.printmonitor.models.DeviceState;

import com.printmonitor.models.Stamped;

import io.vertx.core.Vertx;

import org.slf4j.Logger;

import org.slf4j.LoggerFactory;

import java.time.Clock;

import java.time.Duration;

import java.time.Instant;

/**
 * StalenessWatchdog - periodic sweep forcing silent devices OFFLINE

 * A device whose lastSeen is older than the staleness window is published with
 * connectionStatus=OFFLINE, whatever the recency of the stored value. This is the
 * only path allowed to bypass timestamp arbitration: silence cannot be expressed
 * as a timestamped fragment.

 * The forced leaf keeps the stored updatedAt, so any genuinely newer observation
 * of the connection status wins again through the normal merge.

 * Devices never observed (lastSeen null) and devices already OFFLINE are skipped.
 */
public class StalenessWatchdog
{

    private static final Logger logger = LoggerFactory.getLogger(StalenessWatchdog.class);

    private static final long NO_TIMER = -1;

    private final Vertx vertx;

    private final SnapshotPublisher publisher;

    private final Duration stalenessWindow;

    private final long sweepIntervalMs;

    private final Clock clock;

    private long timerId = NO_TIMER;

    public StalenessWatchdog(Vertx vertx, SnapshotPublisher publisher, MonitoringConfig config, Clock clock)
    {
        this.vertx = vertx;

        this.publisher = publisher;

        this.stalenessWindow = Duration.ofMillis(config.getStalenessWindowMs());

        this.sweepIntervalMs = config.getWatchdogIntervalMs();

        this.clock = clock;
    }

    /**
     * Schedule the periodic sweep on the calling context.
     */
    public void start()
    {
        if (timerId != NO_TIMER)
        {
            return;
        }

        timerId = vertx.setPeriodic(sweepIntervalMs, id -> sweep());

        logger.info("Staleness watchdog started: window {}ms, sweep every {}ms", stalenessWindow.toMillis(), sweepIntervalMs);
    }

    public void stop()
    {
        if (timerId != NO_TIMER)
        {
            vertx.cancelTimer(timerId);

            timerId = NO_TIMER;

            logger.info("Staleness watchdog stopped");
        }
    }

    /**
     * Run one sweep over every tracked device.
     *
     * @return number of devices forced OFFLINE
     */
    public int sweep()
    {
        var forced = 0;

        try
        {
            var cutoff = clock.instant().minus(stalenessWindow);

            for (var deviceId : publisher.trackedDevices())
            {
                var changed = publisher.update(deviceId, current -> isStale(current, cutoff) ? forceOffline(current) : current);

                if (changed)
                {
                    forced++;

                    logger.warn("Device {} silent for more than {}ms, forced OFFLINE", deviceId, stalenessWindow.toMillis());
                }
            }
        }
        catch (Exception exception)
        {
            logger.error("Error in staleness sweep: {}", exception.getMessage(), exception);
        }

        return forced;
    }

    private static boolean isStale(DeviceState state, Instant cutoff)
    {
        var lastSeen = state.getLastSeen();

        return lastSeen != null
            && lastSeen.isBefore(cutoff)
            && state.getConnectionStatus().getValue() != ConnectionStatus.OFFLINE;
    }

    private static DeviceState forceOffline(DeviceState state)
    {
        return state.toBuilder()
            .connectionStatus(Stamped.of(ConnectionStatus.OFFLINE, state.getConnectionStatus().getUpdatedAt()))
            .build();
    }

}
