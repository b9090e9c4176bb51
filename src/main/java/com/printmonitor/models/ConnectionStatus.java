package com.printmonitor.models;

/**
 * Connectivity of a tracked device as seen by the monitoring core.

 * UNKNOWN is the initial value and the degraded value published after
 * polling gives up; OFFLINE is forced by the staleness watchdog.
 */
public enum ConnectionStatus
{

    ONLINE,

    OFFLINE,

    CONNECTING,

    UNKNOWN

}
