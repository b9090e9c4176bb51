package com.printmonitor.core;

/**
 * Observer of monitoring session lifecycle transitions.
 */
public interface SessionLifecycleListener
{

    SessionLifecycleListener NO_OP = new SessionLifecycleListener()
    {
    };

    /**
     * The session for a device completed its first successful fetch.
     *
     * @param deviceId device identifier
     */
    default void onActive(String deviceId)
    {
    }

    /**
     * The session for a device reached STOPPED.
     *
     * @param deviceId device identifier
     * @param error true if it stopped because the failure threshold was reached
     */
    default void onStopped(String deviceId, boolean error)
    {
    }

}
