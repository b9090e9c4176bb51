package com.printmonitor.services;

import com.printmonitor.models.StateFragment;

import io.vertx.core.Future;

/**
 * DeviceStatusFetcher - the status query a monitoring session issues every cycle

 * Implementations talk to the device (or to whatever adapter fronts it) and
 * answer with a partial state. They are expected to be bounded in latency,
 * but the session enforces its own hard timeout regardless.

 * Failure semantics:
 * - InvalidFragmentException: the device answered with data that failed sanity checks
 * - anything else: treated as a transient connectivity failure
 */
@FunctionalInterface
public interface DeviceStatusFetcher
{

    /**
     * Fetch the current status of a device.
     *
     * @param deviceId device identifier
     * @return Future with the fragment observed by this fetch
     */
    Future<StateFragment> fetchDeviceStatus(String deviceId);

}
