package com.printmonitor.models;

import java.time.Instant;

import java.util.Objects;

/**
 * One temperature sensor leaf (nozzle, bed, chamber...).

 * target is null when the device does not report a setpoint for the sensor.
 */
public final class TemperatureReading
{

    private final double current;

    private final Double target;

    private final Instant updatedAt;

    public TemperatureReading(double current, Double target, Instant updatedAt)
    {
        this.current = current;

        this.target = target;

        this.updatedAt = Objects.requireNonNull(updatedAt, "updatedAt");
    }

    public double getCurrent()
    {
        return current;
    }

    public Double getTarget()
    {
        return target;
    }

    public Instant getUpdatedAt()
    {
        return updatedAt;
    }

    /**
     * @param stored reading currently held for the same sensor
     * @return true if this reading is not older than the stored one
     */
    public boolean supersedes(TemperatureReading stored)
    {
        return stored == null || !updatedAt.isBefore(stored.updatedAt);
    }

    /**
     * @param other other reading
     * @return true if current and target are equal, whatever the timestamps
     */
    public boolean sameValue(TemperatureReading other)
    {
        return other != null
            && Double.compare(current, other.current) == 0
            && Objects.equals(target, other.target);
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o)
        {
            return true;
        }

        if (!(o instanceof TemperatureReading))
        {
            return false;
        }

        var other = (TemperatureReading) o;

        return sameValue(other) && updatedAt.equals(other.updatedAt);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(current, target, updatedAt);
    }

    @Override
    public String toString()
    {
        return current + "/" + target + "@" + updatedAt;
    }
}
