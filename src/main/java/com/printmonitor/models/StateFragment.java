package com.printmonitor.models;

import java.time.Instant;

import java.util.Collections;

import java.util.Map;

import java.util.TreeMap;

/**
 * Partial device update touching a subset of the {@link DeviceState} leaves.

 * A null leaf means "not present in this fragment" and leaves the stored
 * value alone. A present currentJob leaf with a null value clears the job.

 * observedAt is the instant the source produced the fragment. It advances
 * lastSeen; it is null for synthetic fragments (the degraded marker published
 * when polling gives up) which carry no evidence that the device is alive.
 */
public final class StateFragment
{

    private final Stamped<ConnectionStatus> connectionStatus;

    private final Stamped<PrintStatus> printStatus;

    private final Map<String, TemperatureReading> temperatures;

    private final Stamped<JobProgress> currentJob;

    private final Stamped<Boolean> monitoringError;

    private final Instant observedAt;

    private StateFragment(Builder builder)
    {
        this.connectionStatus = builder.connectionStatus;

        this.printStatus = builder.printStatus;

        this.temperatures = Collections.unmodifiableMap(new TreeMap<>(builder.temperatures));

        this.currentJob = builder.currentJob;

        this.monitoringError = builder.monitoringError;

        this.observedAt = builder.observedAt;
    }

    public static Builder builder()
    {
        return new Builder();
    }

    /**
     * Copy of this fragment with additional leaves layered on top.
     *
     * @return builder pre-populated with this fragment's leaves
     */
    public Builder toBuilder()
    {
        var builder = new Builder()
            .connectionStatus(connectionStatus)
            .printStatus(printStatus)
            .currentJob(currentJob)
            .monitoringError(monitoringError)
            .observedAt(observedAt);

        builder.temperatures.putAll(temperatures);

        return builder;
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

    public Stamped<JobProgress> getCurrentJob()
    {
        return currentJob;
    }

    public Stamped<Boolean> getMonitoringError()
    {
        return monitoringError;
    }

    public Instant getObservedAt()
    {
        return observedAt;
    }

    /**
     * @return true if the fragment carries no leaf and no observation instant
     */
    public boolean isEmpty()
    {
        return connectionStatus == null
            && printStatus == null
            && temperatures.isEmpty()
            && currentJob == null
            && monitoringError == null
            && observedAt == null;
    }

    @Override
    public String toString()
    {
        return "StateFragment{" +
            "connectionStatus=" + connectionStatus +
            ", printStatus=" + printStatus +
            ", temperatures=" + temperatures +
            ", currentJob=" + currentJob +
            ", monitoringError=" + monitoringError +
            ", observedAt=" + observedAt +
            '}';
    }

    public static final class Builder
    {

        private Stamped<ConnectionStatus> connectionStatus;

        private Stamped<PrintStatus> printStatus;

        private final Map<String, TemperatureReading> temperatures = new TreeMap<>();

        private Stamped<JobProgress> currentJob;

        private Stamped<Boolean> monitoringError;

        private Instant observedAt;

        private Builder()
        {
        }

        public Builder connectionStatus(Stamped<ConnectionStatus> connectionStatus)
        {
            this.connectionStatus = connectionStatus;

            return this;
        }

        public Builder connectionStatus(ConnectionStatus status, Instant updatedAt)
        {
            return connectionStatus(Stamped.of(status, updatedAt));
        }

        public Builder printStatus(Stamped<PrintStatus> printStatus)
        {
            this.printStatus = printStatus;

            return this;
        }

        public Builder printStatus(PrintStatus status, Instant updatedAt)
        {
            return printStatus(Stamped.of(status, updatedAt));
        }

        public Builder temperature(String sensorName, TemperatureReading reading)
        {
            this.temperatures.put(sensorName, reading);

            return this;
        }

        public Builder temperature(String sensorName, double current, Double target, Instant updatedAt)
        {
            return temperature(sensorName, new TemperatureReading(current, target, updatedAt));
        }

        public Builder currentJob(Stamped<JobProgress> currentJob)
        {
            this.currentJob = currentJob;

            return this;
        }

        public Builder currentJob(JobProgress job, Instant updatedAt)
        {
            return currentJob(Stamped.of(job, updatedAt));
        }

        public Builder monitoringError(Stamped<Boolean> monitoringError)
        {
            this.monitoringError = monitoringError;

            return this;
        }

        public Builder monitoringError(boolean error, Instant updatedAt)
        {
            return monitoringError(Stamped.of(error, updatedAt));
        }

        public Builder observedAt(Instant observedAt)
        {
            this.observedAt = observedAt;

            return this;
        }

        public StateFragment build()
        {
            return new StateFragment(this);
        }
    }
}
