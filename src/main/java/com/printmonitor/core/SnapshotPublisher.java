package com.printmonitor.core;

import com.printmonitor.models.DeviceState;

import com.printmonitor.models.StateFragment;

import org.slf4j.Logger;

import org.slf4j.LoggerFactory;

import java.util.Collections;

import java.util.LinkedHashSet;

import java.util.List;

import java.util.Map;

import java.util.Optional;

import java.util.Set;

import java.util.TreeSet;

import java.util.concurrent.ConcurrentHashMap;

import java.util.concurrent.CopyOnWriteArrayList;

import java.util.function.UnaryOperator;

/**
 * SnapshotPublisher - owner of the canonical per-device snapshots

 * Responsibilities:
 * - Holds the last known DeviceState per device (the only place it is stored)
 * - Applies fragments through StateMerger atomically per device
 * - Diffs old and new snapshots leaf by leaf
 * - Notifies per-device and all-device subscribers with the changed leaf paths

 * Change detection compares leaf values. A merge that only advances timestamps
 * or lastSeen is stored (so recency arbitration stays correct) but not notified.
 * The first observation of a device is always notified with every leaf path.

 * Snapshots are kept until forget(deviceId); the map holds one entry per device
 * ever observed, polled or pushed.

 * Subscribers must unsubscribe on teardown; there is no liveness detection.
 * A subscriber that throws is logged and does not affect the others.
 */
public class SnapshotPublisher
{

    private static final Logger logger = LoggerFactory.getLogger(SnapshotPublisher.class);

    public static final String CONNECTION_STATUS = "connectionStatus";

    public static final String PRINT_STATUS = "printStatus";

    public static final String CURRENT_JOB = "currentJob";

    public static final String MONITORING_ERROR = "monitoringError";

    public static final String TEMPERATURES_PREFIX = "temperatures.";

    private final StateMerger merger;

    // Key: device_id, Value: current immutable snapshot
    private final Map<String, DeviceState> snapshots = new ConcurrentHashMap<>();

    private final Map<String, List<SnapshotListener>> listeners = new ConcurrentHashMap<>();

    private final List<SnapshotListener> globalListeners = new CopyOnWriteArrayList<>();

    public SnapshotPublisher(StateMerger merger)
    {
        this.merger = merger;
    }

    /**
     * Store a complete new snapshot for a device and notify if any leaf value changed.
     *
     * @param deviceId device identifier
     * @param newState new snapshot for that device
     * @return true if subscribers were notified
     */
    public boolean publish(String deviceId, DeviceState newState)
    {
        if (!deviceId.equals(newState.getDeviceId()))
        {
            throw new IllegalArgumentException("Snapshot for " + newState.getDeviceId() + " published under " + deviceId);
        }

        return update(deviceId, current -> newState);
    }

    /**
     * Merge a fragment into the stored snapshot and publish the result.
     *
     * @param deviceId device identifier
     * @param fragment partial update
     * @return true if subscribers were notified
     */
    public boolean merge(String deviceId, StateFragment fragment)
    {
        return update(deviceId, current -> merger.merge(current, fragment));
    }

    /**
     * Atomically derive a new snapshot from the stored one and publish it. The transform
     * runs while the device entry is held, so it must be pure and fast.
     *
     * @param deviceId device identifier
     * @param transform function from the current snapshot (initial if never observed) to the new one
     * @return true if subscribers were notified
     */
    public boolean update(String deviceId, UnaryOperator<DeviceState> transform)
    {
        var before = new DeviceState[1];

        var after = new DeviceState[1];

        snapshots.compute(deviceId, (id, stored) ->
        {
            before[0] = stored;

            after[0] = transform.apply(stored != null ? stored : DeviceState.initial(id));

            return after[0];
        });

        var changedPaths = before[0] == null ? allPaths(after[0]) : changedPaths(before[0], after[0]);

        if (changedPaths.isEmpty())
        {
            return false;
        }

        logger.debug("Snapshot changed for {}: {}", deviceId, changedPaths);

        notifyListeners(after[0], Collections.unmodifiableSet(changedPaths));

        return true;
    }

    /**
     * Synchronous point-in-time read.
     *
     * @param deviceId device identifier
     * @return current snapshot, empty if the device was never observed
     */
    public Optional<DeviceState> getSnapshot(String deviceId)
    {
        return Optional.ofNullable(snapshots.get(deviceId));
    }

    /**
     * Drop the stored snapshot of a device. Listeners stay registered; the next
     * observation is treated as a first one and notifies every path.
     *
     * @param deviceId device identifier
     * @return true if a snapshot was removed
     */
    public boolean forget(String deviceId)
    {
        var removed = snapshots.remove(deviceId) != null;

        if (removed)
        {
            logger.info("Forgot snapshot of {}", deviceId);
        }

        return removed;
    }

    /**
     * @return identifiers of every device with a snapshot
     */
    public Set<String> trackedDevices()
    {
        return Collections.unmodifiableSet(new TreeSet<>(snapshots.keySet()));
    }

    /**
     * Register a listener for one device. The add runs inside the map entry's compute so a
     * concurrent unsubscribe that empties the list cannot detach it.
     *
     * @param deviceId device identifier
     * @param listener listener to register
     */
    public void subscribe(String deviceId, SnapshotListener listener)
    {
        listeners.compute(deviceId, (id, registered) ->
        {
            var deviceListeners = registered != null ? registered : new CopyOnWriteArrayList<SnapshotListener>();

            deviceListeners.add(listener);

            return deviceListeners;
        });
    }

    public void unsubscribe(String deviceId, SnapshotListener listener)
    {
        listeners.computeIfPresent(deviceId, (id, registered) ->
        {
            registered.remove(listener);

            return registered.isEmpty() ? null : registered;
        });
    }

    public void subscribeAll(SnapshotListener listener)
    {
        globalListeners.add(listener);
    }

    public void unsubscribeAll(SnapshotListener listener)
    {
        globalListeners.remove(listener);
    }

    /**
     * Leaf paths whose value differs between two snapshots of the same device.
     *
     * @param previous older snapshot
     * @param next newer snapshot
     * @return changed paths in a stable order
     */
    static Set<String> changedPaths(DeviceState previous, DeviceState next)
    {
        var changed = new LinkedHashSet<String>();

        if (!next.getConnectionStatus().sameValue(previous.getConnectionStatus()))
        {
            changed.add(CONNECTION_STATUS);
        }

        if (!next.getPrintStatus().sameValue(previous.getPrintStatus()))
        {
            changed.add(PRINT_STATUS);
        }

        var sensors = new TreeSet<>(previous.getTemperatures().keySet());

        sensors.addAll(next.getTemperatures().keySet());

        for (var sensorName : sensors)
        {
            var reading = next.getTemperature(sensorName);

            if (reading == null || !reading.sameValue(previous.getTemperature(sensorName)))
            {
                changed.add(TEMPERATURES_PREFIX + sensorName);
            }
        }

        if (!next.getCurrentJob().sameValue(previous.getCurrentJob()))
        {
            changed.add(CURRENT_JOB);
        }

        if (!next.getMonitoringError().sameValue(previous.getMonitoringError()))
        {
            changed.add(MONITORING_ERROR);
        }

        return changed;
    }

    private static Set<String> allPaths(DeviceState state)
    {
        var paths = new LinkedHashSet<String>();

        paths.add(CONNECTION_STATUS);

        paths.add(PRINT_STATUS);

        state.getTemperatures().keySet().forEach(sensorName -> paths.add(TEMPERATURES_PREFIX + sensorName));

        paths.add(CURRENT_JOB);

        paths.add(MONITORING_ERROR);

        return paths;
    }

    private void notifyListeners(DeviceState state, Set<String> changedPaths)
    {
        var deviceListeners = listeners.get(state.getDeviceId());

        if (deviceListeners != null)
        {
            for (var listener : deviceListeners)
            {
                deliver(listener, state, changedPaths);
            }
        }

        for (var listener : globalListeners)
        {
            deliver(listener, state, changedPaths);
        }
    }

    private static void deliver(SnapshotListener listener, DeviceState state, Set<String> changedPaths)
    {
        try
        {
            listener.onChange(state, changedPaths);
        }
        catch (Exception exception)
        {
            logger.error("Snapshot listener failed for device {}: {}", state.getDeviceId(), exception.getMessage(), exception);
        }
    }

}
