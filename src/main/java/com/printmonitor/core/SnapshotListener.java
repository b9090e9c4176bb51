package com.printmonitor.core;

import com.printmonitor.models.DeviceState;

import java.util.Set;

/**
 * Callback registered with {@link SnapshotPublisher}.
 */
@FunctionalInterface
public interface SnapshotListener
{

    /**
     * Invoked after a snapshot changed.
     *
     * @param state the new immutable snapshot
     * @param changedPaths leaf paths whose value changed, e.g. "printStatus" or "temperatures.nozzle"
     */
    void onChange(DeviceState state, Set<String> changedPaths);

}
