package com.printmonitor.services.impl;

import com.printmonitor.exceptions.TransientFetchException;

import com.printmonitor.models.StateFragment;

import com.printmonitor.services.DeviceStatusFetcher;

import com.printmonitor.utils.ExceptionUtil;

import com.printmonitor.utils.FragmentCodec;

import io.vertx.core.Future;

import io.vertx.core.Vertx;

import io.vertx.core.eventbus.DeliveryOptions;

import io.vertx.core.json.JsonObject;

import org.slf4j.Logger;

import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * Fetches device status with an event bus request/reply.

 * Request body: {"device_id": "p1"}
 * Reply body: fragment envelope as described in {@link FragmentCodec}

 * The REST adapter that actually talks to the printer registers a consumer on the
 * fetch address; this class only owns the in-process leg.
 */
public class EventBusDeviceStatusFetcher implements DeviceStatusFetcher
{

    private static final Logger logger = LoggerFactory.getLogger(EventBusDeviceStatusFetcher.class);

    private final Vertx vertx;

    private final String address;

    private final long replyTimeoutMs;

    private final Clock clock;

    /**
     * @param vertx Vert.x instance
     * @param address fetch address (monitoring.fetch.address)
     * @param replyTimeoutMs event bus send timeout, normally the session fetch timeout
     * @param clock clock for timestamp sanity checks
     */
    public EventBusDeviceStatusFetcher(Vertx vertx, String address, long replyTimeoutMs, Clock clock)
    {
        this.vertx = vertx;

        this.address = address;

        this.replyTimeoutMs = replyTimeoutMs;

        this.clock = clock;
    }

    @Override
    public Future<StateFragment> fetchDeviceStatus(String deviceId)
    {
        var request = new JsonObject().put("device_id", deviceId);

        var options = new DeliveryOptions().setSendTimeout(replyTimeoutMs);

        return vertx.eventBus().<JsonObject>request(address, request, options)
            .recover(cause ->
            {
                logger.debug("Fetch request for {} failed: {}", deviceId, cause.getMessage());

                return Future.failedFuture(new TransientFetchException(
                    ExceptionUtil.getMessage(cause, "Status fetch failed for " + deviceId), cause));
            })
            .map(reply -> FragmentCodec.decodeFragment(reply.body(), clock.instant()));
    }

}
