package com.printmonitor.models;

import java.time.Instant;

import java.util.Collections;

import java.util.Map;

import java.util.Objects;

import java.util.TreeMap;

/**
 * Canonical snapshot of one device.

 * Every leaf carries its own updatedAt so fragments from polling and push
 * can be merged field by field. Instances are immutable: changes are made by
 * building a new value through {@link #toBuilder()}.

 * lastSeen is the most recent observation instant of any fragment and is
 * what the staleness watchdog inspects; it is null until something arrives.
 */
public final class DeviceState
{

    private final String deviceId;

    private final Stamped<ConnectionStatus> connectionStatus;

    private final Stamped<PrintStatus> printStatus;

    private final Map<String, TemperatureReading> temperatures;

    private final Stamped<JobProgress> currentJob;          // value null = no job

    private final Stamped<Boolean> monitoringError;

    private final Instant lastSeen;

    private DeviceState(Builder builder)
    {
        this.deviceId = Objects.requireNonNull(builder.deviceId, "deviceId");

        this.connectionStatus = Objects.requireNonNull(builder.connectionStatus, "connectionStatus");

        this.printStatus = Objects.requireNonNull(builder.printStatus, "printStatus");

        this.temperatures = Collections.unmodifiableMap(new TreeMap<>(builder.temperatures));

        this.currentJob = Objects.requireNonNull(builder.currentJob, "currentJob");

        this.monitoringError = Objects.requireNonNull(builder.monitoringError, "monitoringError");

        this.lastSeen = builder.lastSeen;
    }

    /**
     * Initial state for a device nothing is known about yet. All leaves are stamped
     * with the epoch so that any real observation supersedes them.
     *
     * @param deviceId device identifier
     * @return initial state
     */
    public static DeviceState initial(String deviceId)
    {
        return new Builder(deviceId)
            .connectionStatus(Stamped.of(ConnectionStatus.UNKNOWN, Instant.EPOCH))
            .printStatus(Stamped.of(PrintStatus.IDLE, Instant.EPOCH))
            .currentJob(Stamped.of(null, Instant.EPOCH))
            .monitoringError(Stamped.of(false, Instant.EPOCH))
            .build();
    }

    public static Builder builder(String deviceId)
    {
        return new Builder(deviceId);
    }

    public Builder toBuilder()
    {
        var builder = new Builder(deviceId)
            .connectionStatus(connectionStatus)
            .printStatus(printStatus)
            .currentJob(currentJob)
            .monitoringError(monitoringError)
            .lastSeen(lastSeen);

        builder.temperatures.putAll(temperatures);

        return builder;
    }

    public String getDeviceId()
    {
        return deviceId;
    }

    public Stamped<ConnectionStatus> getConnectionStatus()
    {
        return connectionStatus;
    }

    public Stamped<PrintStatus> getPrintStatus()
    {
        return printStatus;
    }

    public Map<String, TemperatureReading> getTemperatures()
    {
        return temperatures;
    }

    public TemperatureReading getTemperature(String sensorName)
    {
        return temperatures.get(sensorName);
    }

    public Stamped<JobProgress> getCurrentJob()
    {
        return currentJob;
    }

    public boolean hasCurrentJob()
    {
        return currentJob.getValue() != null;
    }

    public Stamped<Boolean> getMonitoringError()
    {
        return monitoringError;
    }

    public boolean isMonitoringError()
    {
        return Boolean.TRUE.equals(monitoringError.getValue());
    }

    public Instant getLastSeen()
    {
        return lastSeen;
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o)
        {
            return true;
        }

        if (!(o instanceof DeviceState))
        {
            return false;
        }

        var other = (DeviceState) o;

        return deviceId.equals(other.deviceId)
            && connectionStatus.equals(other.connectionStatus)
            && printStatus.equals(other.printStatus)
            && temperatures.equals(other.temperatures)
            && currentJob.equals(other.currentJob)
            && monitoringError.equals(other.monitoringError)
            && Objects.equals(lastSeen, other.lastSeen);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(deviceId, connectionStatus, printStatus, temperatures, currentJob, monitoringError, lastSeen);
    }

    @Override
    public String toString()
    {
        return "DeviceState{" +
            "deviceId='" + deviceId + '\'' +
            ", connectionStatus=" + connectionStatus +
            ", printStatus=" + printStatus +
            ", temperatures=" + temperatures +
            ", currentJob=" + currentJob +
            ", monitoringError=" + monitoringError +
            ", lastSeen=" + lastSeen +
            '}';
    }

    /**
     * Mutable builder used only while assembling a new snapshot.
     */
    public static final class Builder
    {

        private final String deviceId;

        private Stamped<ConnectionStatus> connectionStatus;

        private Stamped<PrintStatus> printStatus;

        private final Map<String, TemperatureReading> temperatures = new TreeMap<>();

        private Stamped<JobProgress> currentJob;

        private Stamped<Boolean> monitoringError;

        private Instant lastSeen;

        private Builder(String deviceId)
        {
            this.deviceId = deviceId;
        }

        public Builder connectionStatus(Stamped<ConnectionStatus> connectionStatus)
        {
            this.connectionStatus = connectionStatus;

            return this;
        }

        public Builder printStatus(Stamped<PrintStatus> printStatus)
        {
            this.printStatus = printStatus;

            return this;
        }

        public Builder temperature(String sensorName, TemperatureReading reading)
        {
            this.temperatures.put(sensorName, reading);

            return this;
        }

        public Builder currentJob(Stamped<JobProgress> currentJob)
        {
            this.currentJob = currentJob;

            return this;
        }

        public Builder monitoringError(Stamped<Boolean> monitoringError)
        {
            this.monitoringError = monitoringError;

            return this;
        }

        public Builder lastSeen(Instant lastSeen)
        {
            this.lastSeen = lastSeen;

            return this;
        }

        public DeviceState build()
        {
            return new DeviceState(this);
        }
    }
}
