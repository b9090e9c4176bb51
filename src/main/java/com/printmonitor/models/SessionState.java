package com.printmonitor.models;

/**
 * Lifecycle state of a monitoring session

 * State Machine:
 * STOPPED → STARTING (start requested)
 * STARTING → ACTIVE (first successful fetch)
 * STARTING / ACTIVE → STOPPING (stop requested)
 * STOPPING → STOPPED (loop observed the cancellation)
 * STARTING / ACTIVE → STOPPED (failure threshold reached, error recorded in the snapshot)
 */
public enum SessionState
{

    STOPPED,                 // Initial and terminal state

    STARTING,                // Created, waiting for the first successful fetch

    ACTIVE,                  // Polling on the regular interval

    STOPPING;                // Cancellation signalled, loop not yet terminated

    /**
     * Checks if a session in this state still counts as live for the one-session-per-device rule.
     *
     * @return true for STARTING, ACTIVE and STOPPING
     */
    public boolean isLive()
    {
        return this != STOPPED;
    }

    /**
     * Checks if a start request against a session in this state is a no-op.
     *
     * @return true for STARTING and ACTIVE
     */
    public boolean isRunning()
    {
        return this == STARTING || this == ACTIVE;
    }
}
