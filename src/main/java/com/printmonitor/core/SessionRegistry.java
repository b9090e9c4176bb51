package com.printmonitor.core;

import com.printmonitor.models.SessionState;

import com.printmonitor.services.DeviceStatusFetcher;

import io.vertx.core.Context;

import io.vertx.core.Future;

import org.slf4j.Logger;

import org.slf4j.LoggerFactory;

import java.time.Clock;

import java.util.ArrayList;

import java.util.Collections;

import java.util.Map;

import java.util.Optional;

import java.util.TreeMap;

import java.util.concurrent.ConcurrentHashMap;

/**
 * SessionRegistry - sole owner of monitoring sessions

 * Invariant: at most one live (STARTING / ACTIVE / STOPPING) session per device.
 * Every transition of the device entry happens inside a per-key atomic compute,
 * so concurrent start/stop requests cannot create a second session.

 * Commands:
 * - startMonitoring: no-op while STARTING or ACTIVE; while STOPPING the request is kept
 *   as a pending restart and a fresh session starts once the old one has stopped
 * - stopMonitoring: no-op when absent; otherwise signals cancellation and cancels any
 *   pending restart. The returned Future completes once the session is STOPPED

 * A session that stops (on request or after exhausting retries) is removed from
 * the registry; it is only ever restarted by an explicit startMonitoring call.
 */
public class SessionRegistry
{

    private static final Logger logger = LoggerFactory.getLogger(SessionRegistry.class);

    private final Context context;

    private final DeviceStatusFetcher fetcher;

    private final SnapshotPublisher publisher;

    private final MonitoringConfig config;

    private final Clock clock;

    // Key: device_id, Value: the live session of that device
    private final Map<String, MonitoringSession> sessions = new ConcurrentHashMap<>();

    // Key: device_id, Value: poll interval requested while the previous session was stopping
    private final Map<String, Long> pendingRestarts = new ConcurrentHashMap<>();

    private volatile SessionLifecycleListener lifecycleListener = SessionLifecycleListener.NO_OP;

    private final SessionLifecycleListener forwardingListener = new SessionLifecycleListener()
    {
        @Override
        public void onActive(String deviceId)
        {
            lifecycleListener.onActive(deviceId);
        }

        @Override
        public void onStopped(String deviceId, boolean error)
        {
            lifecycleListener.onStopped(deviceId, error);
        }
    };

    /**
     * @param context event-loop context every session loop runs on
     * @param fetcher status fetch collaborator
     * @param publisher snapshot publisher fed by the sessions
     * @param config default session settings
     * @param clock clock used for synthetic fragment timestamps
     */
    public SessionRegistry(Context context, DeviceStatusFetcher fetcher, SnapshotPublisher publisher,
                           MonitoringConfig config, Clock clock)
    {
        this.context = context;

        this.fetcher = fetcher;

        this.publisher = publisher;

        this.config = config;

        this.clock = clock;
    }

    public void setLifecycleListener(SessionLifecycleListener lifecycleListener)
    {
        this.lifecycleListener = lifecycleListener != null ? lifecycleListener : SessionLifecycleListener.NO_OP;
    }

    /**
     * Start monitoring a device with the configured poll interval.
     *
     * @param deviceId device identifier
     * @return Future completed as soon as the request is registered (the loop runs asynchronously)
     */
    public Future<Void> startMonitoring(String deviceId)
    {
        return startMonitoring(deviceId, config.getPollIntervalMs());
    }

    /**
     * Start monitoring a device with its own poll interval.
     *
     * @param deviceId device identifier
     * @param pollIntervalMs poll interval for this device
     * @return Future completed as soon as the request is registered, failed for invalid arguments
     */
    public Future<Void> startMonitoring(String deviceId, long pollIntervalMs)
    {
        if (deviceId == null || deviceId.isBlank())
        {
            return Future.failedFuture(new IllegalArgumentException("deviceId must not be blank"));
        }

        MonitoringConfig sessionConfig;

        try
        {
            sessionConfig = pollIntervalMs == config.getPollIntervalMs() ? config : config.withPollInterval(pollIntervalMs);
        }
        catch (IllegalArgumentException exception)
        {
            return Future.failedFuture(exception);
        }

        sessions.compute(deviceId, (id, existing) ->
        {
            if (existing != null && existing.getState().isRunning())
            {
                logger.debug("Duplicate start for {} ignored (session {})", id, existing.getState());

                return existing;
            }

            if (existing != null && existing.getState() == SessionState.STOPPING)
            {
                pendingRestarts.put(id, pollIntervalMs);

                logger.info("Start for {} deferred until its stopping session terminates", id);

                return existing;
            }

            pendingRestarts.remove(id);

            return launch(id, sessionConfig);
        });

        return Future.succeededFuture();
    }

    /**
     * Stop monitoring a device.
     *
     * @param deviceId device identifier
     * @return Future completed once the device has no live session
     */
    public Future<Void> stopMonitoring(String deviceId)
    {
        if (deviceId == null)
        {
            return Future.succeededFuture();
        }

        var target = new MonitoringSession[1];

        sessions.computeIfPresent(deviceId, (id, session) ->
        {
            pendingRestarts.remove(id);

            target[0] = session;

            return session;
        });

        if (target[0] == null)
        {
            logger.debug("Stop for {} ignored: not monitored", deviceId);

            return Future.succeededFuture();
        }

        return target[0].requestStop();
    }

    /**
     * Stop every session, used on shutdown.
     *
     * @return Future completed once all sessions are STOPPED
     */
    public Future<Void> stopAll()
    {
        pendingRestarts.clear();

        var stops = new ArrayList<Future<Void>>();

        for (var session : new ArrayList<>(sessions.values()))
        {
            stops.add(session.requestStop());
        }

        logger.info("Stopping {} monitoring sessions", stops.size());

        return Future.join(stops).mapEmpty();
    }

    /**
     * @param deviceId device identifier
     * @return lifecycle state of the device's session, STOPPED when there is none
     */
    public SessionState sessionState(String deviceId)
    {
        var session = sessions.get(deviceId);

        return session != null ? session.getState() : SessionState.STOPPED;
    }

    /**
     * @return live sessions and their states, ordered by device id
     */
    public Map<String, SessionState> monitoredDevices()
    {
        var result = new TreeMap<String, SessionState>();

        sessions.forEach((deviceId, session) -> result.put(deviceId, session.getState()));

        return Collections.unmodifiableMap(result);
    }

    public int liveSessionCount()
    {
        return (int) sessions.values().stream()
            .filter(session -> session.getState().isLive())
            .count();
    }

    public boolean hasPendingRestart(String deviceId)
    {
        return pendingRestarts.containsKey(deviceId);
    }

    Optional<MonitoringSession> findSession(String deviceId)
    {
        return Optional.ofNullable(sessions.get(deviceId));
    }

    private MonitoringSession launch(String deviceId, MonitoringConfig sessionConfig)
    {
        var session = new MonitoringSession(context, deviceId, sessionConfig, fetcher, publisher, clock,
            forwardingListener, this::onSessionTerminated);

        session.start();

        return session;
    }

    private void onSessionTerminated(MonitoringSession session)
    {
        sessions.compute(session.getDeviceId(), (id, current) ->
        {
            if (current != session)
            {
                return current;
            }

            var restartInterval = pendingRestarts.remove(id);

            if (restartInterval == null)
            {
                return null;
            }

            logger.info("Restarting monitoring for {} after previous session stopped", id);

            var sessionConfig = restartInterval == config.getPollIntervalMs() ? config : config.withPollInterval(restartInterval);

            return launch(id, sessionConfig);
        });
    }

}
