package com.printmonitor.models;

/**
 * Print activity reported by the device.
 */
public enum PrintStatus
{

    IDLE,

    PRINTING,

    PAUSED,

    ERROR

}
