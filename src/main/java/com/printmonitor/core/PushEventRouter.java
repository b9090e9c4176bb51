package com.printmonitor.core;

import com.printmonitor.exceptions.InvalidFragmentException;

import com.printmonitor.models.PushEvent;

import com.printmonitor.utils.ExceptionUtil;

import com.printmonitor.utils.FragmentCodec;

import io.vertx.core.Context;

import io.vertx.core.eventbus.EventBus;

import io.vertx.core.eventbus.MessageConsumer;

import io.vertx.core.json.JsonObject;

import org.slf4j.Logger;

import org.slf4j.LoggerFactory;

import java.time.Clock;

import java.util.ArrayDeque;

import java.util.ArrayList;

import java.util.Map;

import java.util.concurrent.ConcurrentHashMap;

import java.util.concurrent.atomic.AtomicLong;

/**
 * PushEventRouter - fan-out of the live push stream into per-device queues

 * Flow:
 * inbound event → decode → timestamp sanity check → per-device bounded queue → drain task
 * on the event loop → SnapshotPublisher.merge

 * Backpressure:
 * - Queue capacity is small (1..4); when full the oldest queued event is dropped,
 *   so the inbound stream never blocks and the most recent events win
 * - A device's queue exists only between its first pending event and the next
 *   drain, which takes every queued event and removes the queue atomically

 * Events for devices without a monitoring session are merged and published like
 * any other; routing never starts a poll loop.
 */
public class PushEventRouter
{

    private static final Logger logger = LoggerFactory.getLogger(PushEventRouter.class);

    private final Context context;

    private final SnapshotPublisher publisher;

    private final int capacity;

    private final Clock clock;

    // Key: device_id, Value: events waiting for the next drain (mutated only inside compute)
    private final Map<String, ArrayDeque<PushEvent>> queues = new ConcurrentHashMap<>();

    private final AtomicLong delivered = new AtomicLong();

    private final AtomicLong dropped = new AtomicLong();

    private final AtomicLong rejected = new AtomicLong();

    /**
     * @param context event-loop context the drain tasks run on
     * @param publisher merge/publish path
     * @param capacity per-device queue capacity (1..4)
     * @param clock clock for timestamp sanity checks
     */
    public PushEventRouter(Context context, SnapshotPublisher publisher, int capacity, Clock clock)
    {
        if (capacity < 1 || capacity > 4)
        {
            throw new IllegalArgumentException("Push queue capacity must be within 1..4: " + capacity);
        }

        this.context = context;

        this.publisher = publisher;

        this.capacity = capacity;

        this.clock = clock;
    }

    /**
     * Attach the router to the inbound push address.
     *
     * @param eventBus event bus
     * @param address push event address
     * @return the consumer, to be unregistered on shutdown
     */
    public MessageConsumer<JsonObject> listen(EventBus eventBus, String address)
    {
        logger.info("Push event router listening on {} (queue capacity {})", address, capacity);

        return eventBus.consumer(address, message -> route(message.body()));
    }

    /**
     * Decode and enqueue one raw push event. Invalid events are logged and dropped.
     *
     * @param body push event JSON
     */
    public void route(JsonObject body)
    {
        PushEvent event;

        try
        {
            event = FragmentCodec.decodePushEvent(body, clock.instant());
        }
        catch (Exception exception)
        {
            rejected.incrementAndGet();

            if (ExceptionUtil.isInvalidFragment(exception))
            {
                logger.warn("Dropped invalid push event: {}", exception.getMessage());
            }
            else
            {
                logger.error("Error decoding push event: {}", exception.getMessage(), exception);
            }

            return;
        }

        offer(event);
    }

    /**
     * Enqueue a decoded event, dropping the oldest queued one for that device if the queue is full.
     * Never blocks. Events stamped too far in the future are rejected like undecodable ones.
     *
     * @param event push event
     * @return false if the event was rejected
     */
    public boolean offer(PushEvent event)
    {
        try
        {
            FragmentCodec.validate(event, clock.instant());
        }
        catch (InvalidFragmentException exception)
        {
            rejected.incrementAndGet();

            logger.warn("Dropped invalid push event for {}: {}",
                event != null ? event.getDeviceId() : null, exception.getMessage());

            return false;
        }

        var deviceId = event.getDeviceId();

        var needsDrain = new boolean[1];

        queues.compute(deviceId, (id, queue) ->
        {
            if (queue == null)
            {
                queue = new ArrayDeque<>(capacity);

                needsDrain[0] = true;
            }

            if (queue.size() >= capacity)
            {
                var oldest = queue.pollFirst();

                dropped.incrementAndGet();

                logger.debug("Push queue full for {}, dropped event from {}", id, oldest != null ? oldest.getUpdatedAt() : null);
            }

            queue.addLast(event);

            return queue;
        });

        if (needsDrain[0])
        {
            context.runOnContext(v -> drain(deviceId));
        }

        return true;
    }

    public long getDeliveredCount()
    {
        return delivered.get();
    }

    public long getDroppedCount()
    {
        return dropped.get();
    }

    public long getRejectedCount()
    {
        return rejected.get();
    }

    /**
     * @return number of devices with events waiting to be drained
     */
    public int pendingDeviceCount()
    {
        return queues.size();
    }

    private void drain(String deviceId)
    {
        var batch = new ArrayList<PushEvent>(capacity);

        queues.computeIfPresent(deviceId, (id, queue) ->
        {
            batch.addAll(queue);

            return null;
        });

        for (var event : batch)
        {
            deliver(event);
        }
    }

    private void deliver(PushEvent event)
    {
        try
        {
            var fragment = event.getFragment();

            if (fragment.getObservedAt() == null)
            {
                fragment = fragment.toBuilder().observedAt(event.getUpdatedAt()).build();
            }

            publisher.merge(event.getDeviceId(), fragment);

            delivered.incrementAndGet();
        }
        catch (Exception exception)
        {
            logger.error("Error delivering push event for {}: {}", event.getDeviceId(), exception.getMessage(), exception);
        }
    }

}
