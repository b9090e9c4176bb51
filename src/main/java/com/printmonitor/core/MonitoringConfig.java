package com.printmonitor.core;

import io.vertx.core.json.JsonObject;

/**
 * Immutable monitoring settings read from the "monitoring" section of application.conf.

 * HOCON parses dotted keys as nested objects, so poll.interval.ms arrives as
 * poll -> interval -> ms.

 * Constraints enforced on construction:
 * - all durations positive
 * - fetch timeout strictly shorter than the poll interval
 * - backoff initial delay not larger than the backoff cap
 * - push queue capacity within 1..4
 */
public final class MonitoringConfig
{

    public static final long DEFAULT_POLL_INTERVAL_MS = 5000;

    public static final long DEFAULT_FETCH_TIMEOUT_MS = 4000;

    public static final int DEFAULT_FAILURE_THRESHOLD = 5;

    public static final long DEFAULT_BACKOFF_INITIAL_MS = 1000;

    public static final long DEFAULT_BACKOFF_MAX_MS = 30000;

    public static final long DEFAULT_STALENESS_WINDOW_MS = 60000;

    public static final long DEFAULT_WATCHDOG_INTERVAL_MS = 10000;

    public static final int DEFAULT_PUSH_QUEUE_CAPACITY = 2;

    public static final String DEFAULT_FETCH_ADDRESS = "device.status.fetch";

    private final long pollIntervalMs;

    private final long fetchTimeoutMs;

    private final int failureThreshold;

    private final long backoffInitialMs;

    private final long backoffMaxMs;

    private final long stalenessWindowMs;

    private final long watchdogIntervalMs;

    private final int pushQueueCapacity;

    private final String fetchAddress;

    private MonitoringConfig(Builder builder)
    {
        this.pollIntervalMs = builder.pollIntervalMs;

        this.fetchTimeoutMs = builder.fetchTimeoutMs;

        this.failureThreshold = builder.failureThreshold;

        this.backoffInitialMs = builder.backoffInitialMs;

        this.backoffMaxMs = builder.backoffMaxMs;

        this.stalenessWindowMs = builder.stalenessWindowMs;

        this.watchdogIntervalMs = builder.watchdogIntervalMs;

        this.pushQueueCapacity = builder.pushQueueCapacity;

        this.fetchAddress = builder.fetchAddress;

        validate();
    }

    public static MonitoringConfig defaults()
    {
        return builder().build();
    }

    public static Builder builder()
    {
        return new Builder();
    }

    /**
     * Build configuration from the application config root.
     *
     * @param config application configuration (the object containing "monitoring")
     * @return validated configuration
     * @throws IllegalArgumentException if any constraint is violated
     */
    public static MonitoringConfig fromJson(JsonObject config)
    {
        var monitoring = config.getJsonObject("monitoring", new JsonObject());

        return builder()
            .pollIntervalMs(nested(monitoring, DEFAULT_POLL_INTERVAL_MS, "poll", "interval", "ms"))
            .fetchTimeoutMs(nested(monitoring, DEFAULT_FETCH_TIMEOUT_MS, "fetch", "timeout", "ms"))
            .failureThreshold((int) nested(monitoring, DEFAULT_FAILURE_THRESHOLD, "failure", "threshold"))
            .backoffInitialMs(nested(monitoring, DEFAULT_BACKOFF_INITIAL_MS, "backoff", "initial", "ms"))
            .backoffMaxMs(nested(monitoring, DEFAULT_BACKOFF_MAX_MS, "backoff", "max", "ms"))
            .stalenessWindowMs(nested(monitoring, DEFAULT_STALENESS_WINDOW_MS, "staleness", "window", "ms"))
            .watchdogIntervalMs(nested(monitoring, DEFAULT_WATCHDOG_INTERVAL_MS, "watchdog", "interval", "ms"))
            .pushQueueCapacity((int) nested(monitoring, DEFAULT_PUSH_QUEUE_CAPACITY, "push", "queue", "capacity"))
            .fetchAddress(monitoring.getJsonObject("fetch", new JsonObject())
                .getString("address", DEFAULT_FETCH_ADDRESS))
            .build();
    }

    /**
     * Derive the settings for a session with its own poll interval. The fetch timeout is
     * capped at three quarters of that interval so it stays strictly shorter.
     *
     * @param overrideIntervalMs per-device poll interval
     * @return configuration for that session
     */
    public MonitoringConfig withPollInterval(long overrideIntervalMs)
    {
        if (overrideIntervalMs <= 0)
        {
            throw new IllegalArgumentException("pollIntervalMs must be positive: " + overrideIntervalMs);
        }

        var timeout = Math.min(fetchTimeoutMs, Math.max(1, overrideIntervalMs * 3 / 4));

        if (timeout >= overrideIntervalMs)
        {
            throw new IllegalArgumentException("pollIntervalMs too small to fit a fetch timeout: " + overrideIntervalMs);
        }

        return toBuilder()
            .pollIntervalMs(overrideIntervalMs)
            .fetchTimeoutMs(timeout)
            .build();
    }

    /**
     * Capped exponential backoff for the given number of consecutive failures.
     *
     * @param consecutiveFailures failures so far (1 for the first failure)
     * @return delay before the next attempt
     */
    public long backoffDelayMs(int consecutiveFailures)
    {
        var exponent = Math.max(0, Math.min(consecutiveFailures - 1, 30));

        var delay = backoffInitialMs << exponent;

        if (delay <= 0 || delay > backoffMaxMs)
        {
            return backoffMaxMs;
        }

        return delay;
    }

    public Builder toBuilder()
    {
        return builder()
            .pollIntervalMs(pollIntervalMs)
            .fetchTimeoutMs(fetchTimeoutMs)
            .failureThreshold(failureThreshold)
            .backoffInitialMs(backoffInitialMs)
            .backoffMaxMs(backoffMaxMs)
            .stalenessWindowMs(stalenessWindowMs)
            .watchdogIntervalMs(watchdogIntervalMs)
            .pushQueueCapacity(pushQueueCapacity)
            .fetchAddress(fetchAddress);
    }

    public long getPollIntervalMs()
    {
        return pollIntervalMs;
    }

    public long getFetchTimeoutMs()
    {
        return fetchTimeoutMs;
    }

    public int getFailureThreshold()
    {
        return failureThreshold;
    }

    public long getBackoffInitialMs()
    {
        return backoffInitialMs;
    }

    public long getBackoffMaxMs()
    {
        return backoffMaxMs;
    }

    public long getStalenessWindowMs()
    {
        return stalenessWindowMs;
    }

    public long getWatchdogIntervalMs()
    {
        return watchdogIntervalMs;
    }

    public int getPushQueueCapacity()
    {
        return pushQueueCapacity;
    }

    public String getFetchAddress()
    {
        return fetchAddress;
    }

    @Override
    public String toString()
    {
        return "MonitoringConfig{" +
            "pollIntervalMs=" + pollIntervalMs +
            ", fetchTimeoutMs=" + fetchTimeoutMs +
            ", failureThreshold=" + failureThreshold +
            ", backoffInitialMs=" + backoffInitialMs +
            ", backoffMaxMs=" + backoffMaxMs +
            ", stalenessWindowMs=" + stalenessWindowMs +
            ", watchdogIntervalMs=" + watchdogIntervalMs +
            ", pushQueueCapacity=" + pushQueueCapacity +
            ", fetchAddress='" + fetchAddress + '\'' +
            '}';
    }

    private void validate()
    {
        requirePositive("poll.interval.ms", pollIntervalMs);

        requirePositive("fetch.timeout.ms", fetchTimeoutMs);

        requirePositive("failure.threshold", failureThreshold);

        requirePositive("backoff.initial.ms", backoffInitialMs);

        requirePositive("backoff.max.ms", backoffMaxMs);

        requirePositive("staleness.window.ms", stalenessWindowMs);

        requirePositive("watchdog.interval.ms", watchdogIntervalMs);

        if (fetchTimeoutMs >= pollIntervalMs)
        {
            throw new IllegalArgumentException("fetch.timeout.ms (" + fetchTimeoutMs
                + ") must be strictly less than poll.interval.ms (" + pollIntervalMs + ")");
        }

        if (backoffInitialMs > backoffMaxMs)
        {
            throw new IllegalArgumentException("backoff.initial.ms (" + backoffInitialMs
                + ") must not exceed backoff.max.ms (" + backoffMaxMs + ")");
        }

        if (pushQueueCapacity < 1 || pushQueueCapacity > 4)
        {
            throw new IllegalArgumentException("push.queue.capacity must be within 1..4: " + pushQueueCapacity);
        }

        if (fetchAddress == null || fetchAddress.isBlank())
        {
            throw new IllegalArgumentException("fetch.address must not be blank");
        }
    }

    private static void requirePositive(String key, long value)
    {
        if (value <= 0)
        {
            throw new IllegalArgumentException(key + " must be positive: " + value);
        }
    }

    private static long nested(JsonObject root, long defaultValue, String... path)
    {
        var current = root;

        for (var i = 0; i < path.length - 1; i++)
        {
            current = current.getJsonObject(path[i], new JsonObject());
        }

        return current.getLong(path[path.length - 1], defaultValue);
    }

    public static final class Builder
    {

        private long pollIntervalMs = DEFAULT_POLL_INTERVAL_MS;

        private long fetchTimeoutMs = DEFAULT_FETCH_TIMEOUT_MS;

        private int failureThreshold = DEFAULT_FAILURE_THRESHOLD;

        private long backoffInitialMs = DEFAULT_BACKOFF_INITIAL_MS;

        private long backoffMaxMs = DEFAULT_BACKOFF_MAX_MS;

        private long stalenessWindowMs = DEFAULT_STALENESS_WINDOW_MS;

        private long watchdogIntervalMs = DEFAULT_WATCHDOG_INTERVAL_MS;

        private int pushQueueCapacity = DEFAULT_PUSH_QUEUE_CAPACITY;

        private String fetchAddress = DEFAULT_FETCH_ADDRESS;

        private Builder()
        {
        }

        public Builder pollIntervalMs(long pollIntervalMs)
        {
            this.pollIntervalMs = pollIntervalMs;

            return this;
        }

        public Builder fetchTimeoutMs(long fetchTimeoutMs)
        {
            this.fetchTimeoutMs = fetchTimeoutMs;

            return this;
        }

        public Builder failureThreshold(int failureThreshold)
        {
            this.failureThreshold = failureThreshold;

            return this;
        }

        public Builder backoffInitialMs(long backoffInitialMs)
        {
            this.backoffInitialMs = backoffInitialMs;

            return this;
        }

        public Builder backoffMaxMs(long backoffMaxMs)
        {
            this.backoffMaxMs = backoffMaxMs;

            return this;
        }

        public Builder stalenessWindowMs(long stalenessWindowMs)
        {
            this.stalenessWindowMs = stalenessWindowMs;

            return this;
        }

        public Builder watchdogIntervalMs(long watchdogIntervalMs)
        {
            this.watchdogIntervalMs = watchdogIntervalMs;

            return this;
        }

        public Builder pushQueueCapacity(int pushQueueCapacity)
        {
            this.pushQueueCapacity = pushQueueCapacity;

            return this;
        }

        public Builder fetchAddress(String fetchAddress)
        {
            this.fetchAddress = fetchAddress;

            return this;
        }

        public MonitoringConfig build()
        {
            return new MonitoringConfig(this);
        }
    }
}
