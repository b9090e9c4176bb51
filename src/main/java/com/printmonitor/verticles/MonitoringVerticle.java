package com.printmonitor.verticles;

import com.printmonitor.core.MonitoringConfig;

import com.printmonitor.core.PushEventRouter;

import com.printmonitor.core.SessionLifecycleListener;

import com.printmonitor.core.SessionRegistry;

import com.printmonitor.core.SnapshotListener;

import com.printmonitor.core.SnapshotPublisher;

import com.printmonitor.core.StalenessWatchdog;

import com.printmonitor.core.StateMerger;

import com.printmonitor.handlers.MonitoringCommandHandler;

import com.printmonitor.services.DeviceStatusFetcher;

import com.printmonitor.services.impl.EventBusDeviceStatusFetcher;

import com.printmonitor.utils.FragmentCodec;

import io.vertx.core.AbstractVerticle;

import io.vertx.core.Future;

import io.vertx.core.Promise;

import io.vertx.core.eventbus.MessageConsumer;

import io.vertx.core.json.JsonObject;

import org.slf4j.Logger;

import org.slf4j.LoggerFactory;

import java.time.Clock;

import java.util.ArrayList;

import java.util.List;

/**
 * MonitoringVerticle - Real-time device monitoring core

 * Responsibilities:
 * - Own the session registry, snapshot publisher, push router and staleness watchdog
 * - Expose monitoring commands on the event bus
 * - Broadcast every snapshot change on device.state.changed
 * - Broadcast session lifecycle on device.monitoring.started / device.monitoring.stopped

 * Every session loop, push drain and watchdog sweep runs on this verticle's event-loop
 * context, which keeps per-device updates ordered.
 */
public class MonitoringVerticle extends AbstractVerticle
{

    private static final Logger logger = LoggerFactory.getLogger(MonitoringVerticle.class);

    public static final String ADDRESS_START = "device.monitoring.start";

    public static final String ADDRESS_STOP = "device.monitoring.stop";

    public static final String ADDRESS_SNAPSHOT = "device.snapshot.get";

    public static final String ADDRESS_LIST = "device.monitoring.list";

    public static final String ADDRESS_FORGET = "device.snapshot.forget";

    public static final String ADDRESS_PUSH = "device.push.event";

    public static final String ADDRESS_STATE_CHANGED = "device.state.changed";

    public static final String ADDRESS_STARTED = "device.monitoring.started";

    public static final String ADDRESS_STOPPED = "device.monitoring.stopped";

    private final Clock clock;

    private final DeviceStatusFetcher fetcherOverride;

    private MonitoringConfig monitoringConfig;

    private SnapshotPublisher publisher;

    private SessionRegistry registry;

    private PushEventRouter router;

    private StalenessWatchdog watchdog;

    private SnapshotListener broadcaster;

    private final List<MessageConsumer<JsonObject>> consumers = new ArrayList<>();

    public MonitoringVerticle()
    {
        this(Clock.systemUTC(), null);
    }

    /**
     * @param clock clock used for timestamps and staleness checks
     * @param fetcherOverride status fetcher to use instead of the event bus one, null for the default
     */
    MonitoringVerticle(Clock clock, DeviceStatusFetcher fetcherOverride)
    {
        this.clock = clock;

        this.fetcherOverride = fetcherOverride;
    }

    /**
     * Start the verticle: read configuration, wire the core components and register consumers.
     *
     * @param startPromise promise completed once the verticle is ready
     */
    @Override
    public void start(Promise<Void> startPromise)
    {
        try
        {
            logger.info("Starting MonitoringVerticle");

            monitoringConfig = MonitoringConfig.fromJson(config());

            publisher = new SnapshotPublisher(new StateMerger());

            var fetcher = fetcherOverride != null
                ? fetcherOverride
                : new EventBusDeviceStatusFetcher(vertx, monitoringConfig.getFetchAddress(), monitoringConfig.getFetchTimeoutMs(), clock);

            registry = new SessionRegistry(context, fetcher, publisher, monitoringConfig, clock);

            registry.setLifecycleListener(new LifecycleBroadcaster());

            broadcaster = (state, changedPaths) ->
                vertx.eventBus().publish(ADDRESS_STATE_CHANGED, FragmentCodec.encodeChange(state, changedPaths));

            publisher.subscribeAll(broadcaster);

            router = new PushEventRouter(context, publisher, monitoringConfig.getPushQueueCapacity(), clock);

            consumers.add(router.listen(vertx.eventBus(), ADDRESS_PUSH));

            setupCommandConsumers();

            watchdog = new StalenessWatchdog(vertx, publisher, monitoringConfig, clock);

            watchdog.start();

            logger.info("MonitoringVerticle started: poll {}ms, fetch timeout {}ms, failure threshold {}, fetch address {}",
                monitoringConfig.getPollIntervalMs(), monitoringConfig.getFetchTimeoutMs(),
                monitoringConfig.getFailureThreshold(), monitoringConfig.getFetchAddress());

            startPromise.complete();
        }
        catch (Exception exception)
        {
            logger.error("Error in start: {}", exception.getMessage());

            startPromise.fail(exception);
        }
    }

    /**
     * Stop the verticle: stop every session, then release consumers and timers.
     *
     * @param stopPromise promise completed once the verticle is stopped
     */
    @Override
    public void stop(Promise<Void> stopPromise)
    {
        try
        {
            logger.info("Stopping MonitoringVerticle");

            if (watchdog != null)
            {
                watchdog.stop();
            }

            var sessionsStopped = registry != null ? registry.stopAll() : Future.<Void>succeededFuture();

            sessionsStopped
                .compose(v ->
                {
                    var unregistrations = new ArrayList<Future<Void>>();

                    for (var consumer : consumers)
                    {
                        unregistrations.add(consumer.unregister());
                    }

                    return Future.join(unregistrations);
                })
                .onComplete(result ->
                {
                    consumers.clear();

                    if (publisher != null && broadcaster != null)
                    {
                        publisher.unsubscribeAll(broadcaster);
                    }

                    if (result.failed())
                    {
                        logger.error("Error while stopping MonitoringVerticle: {}", result.cause().getMessage());
                    }

                    stopPromise.complete();
                });
        }
        catch (Exception exception)
        {
            logger.error("Error in stop: {}", exception.getMessage());

            stopPromise.fail(exception);
        }
    }

    SessionRegistry getRegistry()
    {
        return registry;
    }

    SnapshotPublisher getPublisher()
    {
        return publisher;
    }

    PushEventRouter getRouter()
    {
        return router;
    }

    StalenessWatchdog getWatchdog()
    {
        return watchdog;
    }

    /**
     * Register the command consumers
     */
    private void setupCommandConsumers()
    {
        var handler = new MonitoringCommandHandler(registry, publisher);

        var eventBus = vertx.eventBus();

        consumers.add(eventBus.<JsonObject>consumer(ADDRESS_START, handler::startMonitoring));

        consumers.add(eventBus.<JsonObject>consumer(ADDRESS_STOP, handler::stopMonitoring));

        consumers.add(eventBus.<JsonObject>consumer(ADDRESS_SNAPSHOT, handler::getSnapshot));

        consumers.add(eventBus.<JsonObject>consumer(ADDRESS_LIST, handler::listSessions));

        consumers.add(eventBus.<JsonObject>consumer(ADDRESS_FORGET, handler::forgetSnapshot));

        logger.debug("Registered {} event bus consumers", consumers.size());
    }

    /**
     * Publishes session lifecycle notifications
     */
    private class LifecycleBroadcaster implements SessionLifecycleListener
    {

        @Override
        public void onActive(String deviceId)
        {
            vertx.eventBus().publish(ADDRESS_STARTED, new JsonObject()
                .put("device_id", deviceId)
                .put("error", false));
        }

        @Override
        public void onStopped(String deviceId, boolean error)
        {
            vertx.eventBus().publish(ADDRESS_STOPPED, new JsonObject()
                .put("device_id", deviceId)
                .put("error", error));
        }

    }

}
