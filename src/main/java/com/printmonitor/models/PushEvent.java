package com.printmonitor.models;

import java.time.Instant;

import java.util.Objects;

/**
 * Inbound push event: a fragment for one device plus the instant the source emitted it.
 */
public final class PushEvent
{

    private final String deviceId;

    private final StateFragment fragment;

    private final Instant updatedAt;

    public PushEvent(String deviceId, StateFragment fragment, Instant updatedAt)
    {
        this.deviceId = Objects.requireNonNull(deviceId, "deviceId");

        this.fragment = Objects.requireNonNull(fragment, "fragment");

        this.updatedAt = Objects.requireNonNull(updatedAt, "updatedAt");
    }

    public String getDeviceId()
    {
        return deviceId;
    }

    public StateFragment getFragment()
    {
        return fragment;
    }

    public Instant getUpdatedAt()
    {
        return updatedAt;
    }

    @Override
    public String toString()
    {
        return "PushEvent{deviceId='" + deviceId + "', updatedAt=" + updatedAt + ", fragment=" + fragment + '}';
    }
}
