package com.printmonitor.utils;

import com.printmonitor.exceptions.InvalidFragmentException;

import com.printmonitor.models.ConnectionStatus;

import com.printmonitor.models.DeviceState;

import com.printmonitor.models.JobProgress;

import com.printmonitor.models.PrintStatus;

import com.printmonitor.models.PushEvent;

import com.printmonitor.models.Stamped;

import com.printmonitor.models.StateFragment;

import com.printmonitor.models.TemperatureReading;

import io.vertx.core.json.JsonArray;

import io.vertx.core.json.JsonObject;

import java.time.Duration;

import java.time.Instant;

import java.time.format.DateTimeParseException;

import java.util.ArrayList;

import java.util.Collection;

import java.util.Locale;

/**
 * FragmentCodec - JSON mapping for fragments, push events and snapshots

 * Wire shape (fetch replies and push events):
 * {
 *   "device_id": "p1",                       // push events only
 *   "updated_at": "2026-01-01T10:00:00Z",    // ISO-8601 or epoch millis
 *   "fragment": {
 *     "connection_status": "ONLINE",         // or {"value": "ONLINE", "updated_at": ...}
 *     "print_status": "PRINTING",
 *     "monitoring_error": false,
 *     "temperatures": {"nozzle": {"current": 210.5, "target": 215.0}},
 *     "current_job": {"name": "benchy.3mf", "progress_percent": 42.0, "remaining_seconds": 1200}
 *   }
 * }

 * Leaves without their own updated_at inherit the envelope's.
 * "current_job": null clears the job. Anything malformed raises
 * InvalidFragmentException.
 */
public class FragmentCodec
{

    public static final Duration MAX_FUTURE_SKEW = Duration.ofMinutes(5);

    private FragmentCodec()
    {
    }

    /**
     * Decode a push event envelope.
     *
     * @param body event body
     * @param now current instant, used for the future-skew sanity check
     * @return decoded push event
     */
    public static PushEvent decodePushEvent(JsonObject body, Instant now)
    {
        if (body == null)
        {
            throw new InvalidFragmentException("Push event body is missing");
        }

        var deviceId = readString(body, "device_id");

        if (deviceId == null || deviceId.isBlank())
        {
            throw new InvalidFragmentException("Push event has no device_id");
        }

        var fragment = decodeFragment(body, now);

        return new PushEvent(deviceId, fragment, fragment.getObservedAt());
    }

    /**
     * Decode a fragment envelope (fetch reply or push event).
     *
     * @param body envelope holding updated_at and fragment
     * @param now current instant, used for the future-skew sanity check
     * @return decoded fragment, observedAt set to the envelope timestamp
     */
    public static StateFragment decodeFragment(JsonObject body, Instant now)
    {
        if (body == null)
        {
            throw new InvalidFragmentException("Fragment body is missing");
        }

        var envelopeTime = readInstant(body.getValue("updated_at"), "updated_at", now);

        if (envelopeTime == null)
        {
            throw new InvalidFragmentException("Fragment has no updated_at");
        }

        var leaves = readObject(body, "fragment");

        if (leaves == null)
        {
            throw new InvalidFragmentException("Fragment has no fragment object");
        }

        var builder = StateFragment.builder().observedAt(envelopeTime);

        if (leaves.containsKey("connection_status"))
        {
            builder.connectionStatus(decodeEnumLeaf(leaves.getValue("connection_status"), ConnectionStatus.class,
                "connection_status", envelopeTime, now));
        }

        if (leaves.containsKey("print_status"))
        {
            builder.printStatus(decodeEnumLeaf(leaves.getValue("print_status"), PrintStatus.class,
                "print_status", envelopeTime, now));
        }

        if (leaves.containsKey("monitoring_error"))
        {
            builder.monitoringError(decodeBooleanLeaf(leaves.getValue("monitoring_error"), envelopeTime, now));
        }

        if (leaves.containsKey("temperatures"))
        {
            var temperatures = readObject(leaves, "temperatures");

            if (temperatures == null)
            {
                throw new InvalidFragmentException("temperatures must be an object");
            }

            for (var sensorName : temperatures.fieldNames())
            {
                builder.temperature(sensorName, decodeTemperature(sensorName, temperatures.getValue(sensorName), envelopeTime, now));
            }
        }

        if (leaves.containsKey("current_job"))
        {
            builder.currentJob(decodeJob(leaves.getValue("current_job"), envelopeTime, now));
        }

        return builder.build();
    }

    /**
     * Timestamp sanity check for fragments built in code rather than decoded from JSON.
     * Every leaf timestamp and observedAt must lie within MAX_FUTURE_SKEW of now.
     *
     * @param fragment fragment to check
     * @param now current instant
     * @return the same fragment
     * @throws InvalidFragmentException if a timestamp is too far in the future
     */
    public static StateFragment validate(StateFragment fragment, Instant now)
    {
        if (fragment == null)
        {
            throw new InvalidFragmentException("Fragment is missing");
        }

        checkNotFuture(fragment.getObservedAt(), "observed_at", now);

        if (fragment.getConnectionStatus() != null)
        {
            checkNotFuture(fragment.getConnectionStatus().getUpdatedAt(), "connection_status.updated_at", now);
        }

        if (fragment.getPrintStatus() != null)
        {
            checkNotFuture(fragment.getPrintStatus().getUpdatedAt(), "print_status.updated_at", now);
        }

        if (fragment.getMonitoringError() != null)
        {
            checkNotFuture(fragment.getMonitoringError().getUpdatedAt(), "monitoring_error.updated_at", now);
        }

        if (fragment.getCurrentJob() != null)
        {
            checkNotFuture(fragment.getCurrentJob().getUpdatedAt(), "current_job.updated_at", now);
        }

        fragment.getTemperatures().forEach((sensorName, reading) ->
            checkNotFuture(reading.getUpdatedAt(), "temperatures." + sensorName + ".updated_at", now));

        return fragment;
    }

    /**
     * Same check for a push event, including its envelope timestamp.
     *
     * @param event event to check
     * @param now current instant
     * @return the same event
     * @throws InvalidFragmentException if the event is incomplete or a timestamp is too far in the future
     */
    public static PushEvent validate(PushEvent event, Instant now)
    {
        if (event == null || event.getDeviceId() == null || event.getDeviceId().isBlank())
        {
            throw new InvalidFragmentException("Push event has no device_id");
        }

        checkNotFuture(event.getUpdatedAt(), "updated_at", now);

        validate(event.getFragment(), now);

        return event;
    }

    /**
     * Encode a snapshot to the wire shape used on device.state.changed and snapshot replies.
     *
     * @param state snapshot to encode
     * @return JSON representation, timestamps as ISO-8601
     */
    public static JsonObject encodeState(DeviceState state)
    {
        var temperatures = new JsonObject();

        state.getTemperatures().forEach((sensorName, reading) ->
            temperatures.put(sensorName, new JsonObject()
                .put("current", reading.getCurrent())
                .put("target", reading.getTarget())
                .put("updated_at", reading.getUpdatedAt().toString())));

        var job = state.getCurrentJob();

        JsonObject jobJson = null;

        if (job.getValue() != null)
        {
            jobJson = new JsonObject()
                .put("name", job.getValue().getName())
                .put("progress_percent", job.getValue().getProgressPercent())
                .put("remaining_seconds", job.getValue().getRemainingSeconds());
        }

        return new JsonObject()
            .put("device_id", state.getDeviceId())
            .put("last_seen", state.getLastSeen() != null ? state.getLastSeen().toString() : null)
            .put("connection_status", encodeLeaf(state.getConnectionStatus().getValue().name(), state.getConnectionStatus()))
            .put("print_status", encodeLeaf(state.getPrintStatus().getValue().name(), state.getPrintStatus()))
            .put("monitoring_error", encodeLeaf(state.getMonitoringError().getValue(), state.getMonitoringError()))
            .put("temperatures", temperatures)
            .put("current_job", new JsonObject()
                .put("value", jobJson)
                .put("updated_at", job.getUpdatedAt().toString()));
    }

    /**
     * Encode a change notification.
     *
     * @param state new snapshot
     * @param changedPaths leaf paths whose value changed
     * @return notification body
     */
    public static JsonObject encodeChange(DeviceState state, Collection<String> changedPaths)
    {
        return new JsonObject()
            .put("device_id", state.getDeviceId())
            .put("changed", new JsonArray(new ArrayList<>(changedPaths)))
            .put("state", encodeState(state));
    }

    private static JsonObject encodeLeaf(Object value, Stamped<?> leaf)
    {
        return new JsonObject()
            .put("value", value)
            .put("updated_at", leaf.getUpdatedAt().toString());
    }

    private static <E extends Enum<E>> Stamped<E> decodeEnumLeaf(Object raw, Class<E> type, String field,
                                                                Instant envelopeTime, Instant now)
    {
        var updatedAt = envelopeTime;

        var value = raw;

        if (raw instanceof JsonObject)
        {
            var leaf = (JsonObject) raw;

            value = leaf.getValue("value");

            updatedAt = leafTime(leaf, field, envelopeTime, now);
        }

        if (!(value instanceof String))
        {
            throw new InvalidFragmentException(field + " must be a string");
        }

        try
        {
            return Stamped.of(Enum.valueOf(type, ((String) value).trim().toUpperCase(Locale.ROOT)), updatedAt);
        }
        catch (IllegalArgumentException exception)
        {
            throw new InvalidFragmentException("Unknown " + field + " value: " + value, exception);
        }
    }

    private static Stamped<Boolean> decodeBooleanLeaf(Object raw, Instant envelopeTime, Instant now)
    {
        var updatedAt = envelopeTime;

        var value = raw;

        if (raw instanceof JsonObject)
        {
            var leaf = (JsonObject) raw;

            value = leaf.getValue("value");

            updatedAt = leafTime(leaf, "monitoring_error", envelopeTime, now);
        }

        if (!(value instanceof Boolean))
        {
            throw new InvalidFragmentException("monitoring_error must be a boolean");
        }

        return Stamped.of((Boolean) value, updatedAt);
    }

    private static TemperatureReading decodeTemperature(String sensorName, Object raw, Instant envelopeTime, Instant now)
    {
        if (sensorName.isBlank())
        {
            throw new InvalidFragmentException("Temperature sensor name is blank");
        }

        if (!(raw instanceof JsonObject))
        {
            throw new InvalidFragmentException("Temperature " + sensorName + " must be an object");
        }

        var reading = (JsonObject) raw;

        var current = reading.getValue("current");

        if (!(current instanceof Number))
        {
            throw new InvalidFragmentException("Temperature " + sensorName + " has no numeric current value");
        }

        var target = reading.getValue("target");

        if (target != null && !(target instanceof Number))
        {
            throw new InvalidFragmentException("Temperature " + sensorName + " target must be numeric");
        }

        return new TemperatureReading(
            ((Number) current).doubleValue(),
            target != null ? ((Number) target).doubleValue() : null,
            leafTime(reading, "temperatures." + sensorName, envelopeTime, now));
    }

    private static Stamped<JobProgress> decodeJob(Object raw, Instant envelopeTime, Instant now)
    {
        if (raw == null)
        {
            return Stamped.of(null, envelopeTime);
        }

        if (!(raw instanceof JsonObject))
        {
            throw new InvalidFragmentException("current_job must be an object or null");
        }

        var job = (JsonObject) raw;

        var updatedAt = leafTime(job, "current_job", envelopeTime, now);

        var name = job.getValue("name");

        if (!(name instanceof String) || ((String) name).isBlank())
        {
            throw new InvalidFragmentException("current_job has no name");
        }

        var progress = job.containsKey("progress_percent") ? job.getValue("progress_percent") : Integer.valueOf(0);

        if (!(progress instanceof Number))
        {
            throw new InvalidFragmentException("current_job progress_percent must be numeric");
        }

        var progressPercent = ((Number) progress).doubleValue();

        if (progressPercent < 0 || progressPercent > 100 || Double.isNaN(progressPercent))
        {
            throw new InvalidFragmentException("current_job progress_percent out of range: " + progressPercent);
        }

        var remaining = job.getValue("remaining_seconds");

        if (remaining != null && !(remaining instanceof Number))
        {
            throw new InvalidFragmentException("current_job remaining_seconds must be numeric");
        }

        Long remainingSeconds = remaining != null ? ((Number) remaining).longValue() : null;

        if (remainingSeconds != null && remainingSeconds < 0)
        {
            throw new InvalidFragmentException("current_job remaining_seconds is negative: " + remainingSeconds);
        }

        return Stamped.of(new JobProgress((String) name, progressPercent, remainingSeconds), updatedAt);
    }

    private static Instant leafTime(JsonObject leaf, String field, Instant envelopeTime, Instant now)
    {
        var own = readInstant(leaf.getValue("updated_at"), field + ".updated_at", now);

        return own != null ? own : envelopeTime;
    }

    private static Instant readInstant(Object raw, String field, Instant now)
    {
        if (raw == null)
        {
            return null;
        }

        Instant instant;

        if (raw instanceof Instant)
        {
            instant = (Instant) raw;
        }
        else if (raw instanceof Number)
        {
            instant = Instant.ofEpochMilli(((Number) raw).longValue());
        }
        else if (raw instanceof String)
        {
            try
            {
                instant = Instant.parse((String) raw);
            }
            catch (DateTimeParseException exception)
            {
                throw new InvalidFragmentException("Unparseable " + field + ": " + raw, exception);
            }
        }
        else
        {
            throw new InvalidFragmentException(field + " must be an ISO-8601 string or epoch millis");
        }

        checkNotFuture(instant, field, now);

        return instant;
    }

    private static void checkNotFuture(Instant instant, String field, Instant now)
    {
        if (instant != null && instant.isAfter(now.plus(MAX_FUTURE_SKEW)))
        {
            throw new InvalidFragmentException(field + " is in the future: " + instant);
        }
    }

    private static String readString(JsonObject body, String key)
    {
        var value = body.getValue(key);

        return value instanceof String ? (String) value : null;
    }

    private static JsonObject readObject(JsonObject body, String key)
    {
        var value = body.getValue(key);

        return value instanceof JsonObject ? (JsonObject) value : null;
    }

}
