package com.printmonitor.handlers;

import com.printmonitor.core.SessionRegistry;

import com.printmonitor.core.SnapshotPublisher;

import com.printmonitor.models.SessionState;

import com.printmonitor.utils.ExceptionUtil;

import com.printmonitor.utils.FragmentCodec;

import io.vertx.core.eventbus.Message;

import io.vertx.core.json.JsonArray;

import io.vertx.core.json.JsonObject;

import org.slf4j.Logger;

import org.slf4j.LoggerFactory;

/**
 * MonitoringCommandHandler - Event Bus request handler for monitoring commands

 * Handles:
 * - device.monitoring.start    {device_id, poll_interval_ms?}
 * - device.monitoring.stop     {device_id}, answered once the session is STOPPED
 * - device.snapshot.get        {device_id}
 * - device.snapshot.forget     {device_id}, refused while a session is live
 * - device.monitoring.list     live sessions with their lifecycle state

 * Replies are {success: true, data, timestamp}; failures go through ExceptionUtil.
 */
public class MonitoringCommandHandler
{

    private static final Logger logger = LoggerFactory.getLogger(MonitoringCommandHandler.class);

    private final SessionRegistry registry;

    private final SnapshotPublisher publisher;

    /**
     * Constructor for MonitoringCommandHandler
     *
     * @param registry session registry
     * @param publisher snapshot publisher
     */
    public MonitoringCommandHandler(SessionRegistry registry, SnapshotPublisher publisher)
    {
        this.registry = registry;

        this.publisher = publisher;
    }

    /**
     * Start monitoring a device
     *
     * @param message request message
     */
    public void startMonitoring(Message<JsonObject> message)
    {
        try
        {
            var request = body(message);

            var deviceId = request.getString("device_id");

            var pollIntervalMs = request.getLong("poll_interval_ms");

            var started = pollIntervalMs != null
                ? registry.startMonitoring(deviceId, pollIntervalMs)
                : registry.startMonitoring(deviceId);

            started
                .onSuccess(v -> reply(message, new JsonObject()
                    .put("device_id", deviceId)
                    .put("session_state", registry.sessionState(deviceId).name())))
                .onFailure(cause -> ExceptionUtil.handleEventBus(message, cause, "Failed to start monitoring"));
        }
        catch (Exception exception)
        {
            logger.error("Error in startMonitoring handler: {}", exception.getMessage());

            ExceptionUtil.handleEventBus(message, exception, "Failed to start monitoring");
        }
    }

    /**
     * Stop monitoring a device
     *
     * @param message request message
     */
    public void stopMonitoring(Message<JsonObject> message)
    {
        try
        {
            var deviceId = body(message).getString("device_id");

            registry.stopMonitoring(deviceId)
                .onSuccess(v -> reply(message, new JsonObject()
                    .put("device_id", deviceId)
                    .put("session_state", registry.sessionState(deviceId).name())))
                .onFailure(cause -> ExceptionUtil.handleEventBus(message, cause, "Failed to stop monitoring"));
        }
        catch (Exception exception)
        {
            logger.error("Error in stopMonitoring handler: {}", exception.getMessage());

            ExceptionUtil.handleEventBus(message, exception, "Failed to stop monitoring");
        }
    }

    /**
     * Return the latest snapshot of a device
     *
     * @param message request message
     */
    public void getSnapshot(Message<JsonObject> message)
    {
        try
        {
            var deviceId = body(message).getString("device_id");

            if (deviceId == null || deviceId.isBlank())
            {
                throw new IllegalArgumentException("device_id is required");
            }

            var data = publisher.getSnapshot(deviceId)
                .map(state -> new JsonObject()
                    .put("known", true)
                    .put("state", FragmentCodec.encodeState(state)))
                .orElseGet(() -> new JsonObject()
                    .put("known", false)
                    .put("device_id", deviceId));

            reply(message, data);
        }
        catch (Exception exception)
        {
            logger.error("Error in getSnapshot handler: {}", exception.getMessage());

            ExceptionUtil.handleEventBus(message, exception, "Failed to retrieve snapshot");
        }
    }

    /**
     * Drop the stored snapshot of a device that is no longer monitored
     *
     * @param message request message
     */
    public void forgetSnapshot(Message<JsonObject> message)
    {
        try
        {
            var deviceId = body(message).getString("device_id");

            if (deviceId == null || deviceId.isBlank())
            {
                throw new IllegalArgumentException("device_id is required");
            }

            if (registry.sessionState(deviceId) != SessionState.STOPPED)
            {
                throw new IllegalStateException("Device " + deviceId + " is still monitored");
            }

            reply(message, new JsonObject()
                .put("device_id", deviceId)
                .put("forgotten", publisher.forget(deviceId)));
        }
        catch (Exception exception)
        {
            logger.error("Error in forgetSnapshot handler: {}", exception.getMessage());

            ExceptionUtil.handleEventBus(message, exception, "Failed to forget snapshot");
        }
    }

    /**
     * List live monitoring sessions
     *
     * @param message request message
     */
    public void listSessions(Message<JsonObject> message)
    {
        try
        {
            var sessions = new JsonArray();

            registry.monitoredDevices().forEach((deviceId, state) ->
                sessions.add(new JsonObject()
                    .put("device_id", deviceId)
                    .put("session_state", state.name())
                    .put("pending_restart", registry.hasPendingRestart(deviceId))));

            reply(message, new JsonObject()
                .put("count", sessions.size())
                .put("sessions", sessions));
        }
        catch (Exception exception)
        {
            logger.error("Error in listSessions handler: {}", exception.getMessage());

            ExceptionUtil.handleEventBus(message, exception, "Failed to list sessions");
        }
    }

    private static JsonObject body(Message<JsonObject> message)
    {
        return message.body() != null ? message.body() : new JsonObject();
    }

    private static void reply(Message<JsonObject> message, JsonObject data)
    {
        message.reply(new JsonObject()
            .put("success", true)
            .put("data", data)
            .put("timestamp", System.currentTimeMillis()));
    }

}
