package com.printmonitor.core;

import com.printmonitor.models.DeviceState;

import com.printmonitor.models.Stamped;

import com.printmonitor.models.StateFragment;

import org.slf4j.Logger;

import org.slf4j.LoggerFactory;

import java.time.Instant;

/**
 * StateMerger - field-level merge by recency

 * For every leaf present in the fragment the incoming value is accepted iff its
 * updatedAt is not older than the stored one. Older leaves are discarded silently.
 * Leaves absent from the fragment are carried over. No source has priority:
 * polling and push fragments go through the same rule.

 * lastSeen advances to the fragment's observedAt when that is newer.

 * Stateless and side-effect free; the result is always a new immutable value.
 */
public class StateMerger
{

    private static final Logger logger = LoggerFactory.getLogger(StateMerger.class);

    /**
     * Merge a fragment into the current snapshot.
     *
     * @param current stored snapshot (never null)
     * @param fragment incoming partial update
     * @return new snapshot
     */
    public DeviceState merge(DeviceState current, StateFragment fragment)
    {
        var deviceId = current.getDeviceId();

        var builder = current.toBuilder()
            .connectionStatus(pick(deviceId, "connectionStatus", current.getConnectionStatus(), fragment.getConnectionStatus()))
            .printStatus(pick(deviceId, "printStatus", current.getPrintStatus(), fragment.getPrintStatus()))
            .currentJob(pick(deviceId, "currentJob", current.getCurrentJob(), fragment.getCurrentJob()))
            .monitoringError(pick(deviceId, "monitoringError", current.getMonitoringError(), fragment.getMonitoringError()))
            .lastSeen(latest(current.getLastSeen(), fragment.getObservedAt()));

        fragment.getTemperatures().forEach((sensorName, incoming) ->
        {
            var stored = current.getTemperature(sensorName);

            if (incoming.supersedes(stored))
            {
                builder.temperature(sensorName, incoming);
            }
            else if (logger.isTraceEnabled())
            {
                logger.trace("Discarded stale temperatures.{} for {}: incoming {} older than stored {}",
                    sensorName, deviceId, incoming.getUpdatedAt(), stored.getUpdatedAt());
            }
        });

        return builder.build();
    }

    private static <T> Stamped<T> pick(String deviceId, String field, Stamped<T> stored, Stamped<T> incoming)
    {
        if (incoming == null)
        {
            return stored;
        }

        if (incoming.supersedes(stored))
        {
            return incoming;
        }

        if (logger.isTraceEnabled())
        {
            logger.trace("Discarded stale {} for {}: incoming {} older than stored {}",
                field, deviceId, incoming.getUpdatedAt(), stored.getUpdatedAt());
        }

        return stored;
    }

    private static Instant latest(Instant stored, Instant observed)
    {
        if (observed == null)
        {
            return stored;
        }

        if (stored == null || observed.isAfter(stored))
        {
            return observed;
        }

        return stored;
    }

}
