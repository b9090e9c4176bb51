package com.printmonitor.core;

import com.printmonitor.exceptions.InvalidFragmentException;

import com.printmonitor.exceptions.TransientFetchException;

import com.printmonitor.models.ConnectionStatus;

import com.printmonitor.models.SessionState;

import com.printmonitor.models.StateFragment;

import com.printmonitor.services.DeviceStatusFetcher;

import com.printmonitor.utils.ExceptionUtil;

import com.printmonitor.utils.FragmentCodec;

import io.vertx.core.AsyncResult;

import io.vertx.core.Context;

import io.vertx.core.Future;

import io.vertx.core.Promise;

import io.vertx.core.Vertx;

import org.slf4j.Logger;

import org.slf4j.LoggerFactory;

import java.time.Clock;

import java.util.concurrent.CancellationException;

import java.util.concurrent.TimeoutException;

import java.util.concurrent.atomic.AtomicReference;

import java.util.function.Consumer;

/**
 * MonitoringSession - poll loop of one device

 * Cycle:
 * 1. Check the cancellation signal
 * 2. Fetch status with a hard timeout (strictly shorter than the poll interval)
 * 3. Check the cancellation signal again
 * 4. Success: merge + publish, STARTING → ACTIVE, reset failures, sleep pollIntervalMs
 *    Failure: count it, sleep a capped exponential backoff
 *    Invalid fragment (undecodable or stamped in the future): drop it,
 *    counters untouched, sleep pollIntervalMs
 * 5. Reaching the failure threshold publishes connectionStatus=UNKNOWN with
 *    monitoringError=true and stops the session; it is never resurrected here

 * Threading:
 * - All loop state is confined to the owning event-loop context
 * - The lifecycle state is atomic so start/stop can be requested from any thread
 * - A stop request cancels the idle timer and abandons an in-flight fetch, so the
 *   session reaches STOPPED within one fetch-timeout interval at worst

 * Instances are created and destroyed by {@link SessionRegistry} only.
 */
public class MonitoringSession
{

    private static final Logger logger = LoggerFactory.getLogger(MonitoringSession.class);

    private static final long NO_TIMER = -1;

    private final Vertx vertx;

    private final Context context;

    private final String deviceId;

    private final MonitoringConfig config;

    private final DeviceStatusFetcher fetcher;

    private final SnapshotPublisher publisher;

    private final Clock clock;

    private final SessionLifecycleListener lifecycleListener;

    private final Consumer<MonitoringSession> onTerminated;

    private final AtomicReference<SessionState> state = new AtomicReference<>(SessionState.STOPPED);

    private final Promise<Void> terminated = Promise.promise();

    // Written on the event loop only, read from anywhere
    private volatile int consecutiveFailures;

    private volatile int fetchesIssued;

    private volatile boolean stoppedWithError;

    // Event-loop confined
    private long sleepTimerId = NO_TIMER;

    private long fetchTimerId = NO_TIMER;

    private Promise<StateFragment> inFlight;

    MonitoringSession(Context context, String deviceId, MonitoringConfig config, DeviceStatusFetcher fetcher,
                      SnapshotPublisher publisher, Clock clock, SessionLifecycleListener lifecycleListener,
                      Consumer<MonitoringSession> onTerminated)
    {
        this.vertx = context.owner();

        this.context = context;

        this.deviceId = deviceId;

        this.config = config;

        this.fetcher = fetcher;

        this.publisher = publisher;

        this.clock = clock;

        this.lifecycleListener = lifecycleListener;

        this.onTerminated = onTerminated;
    }

    /**
     * STOPPED → STARTING, then run the first cycle asynchronously on the session context.
     *
     * @return false if the session was already started
     */
    boolean start()
    {
        if (!state.compareAndSet(SessionState.STOPPED, SessionState.STARTING))
        {
            return false;
        }

        logger.info("Monitoring session starting for {} (interval {}ms, fetch timeout {}ms)",
            deviceId, config.getPollIntervalMs(), config.getFetchTimeoutMs());

        context.runOnContext(v -> runCycle());

        return true;
    }

    /**
     * Signal cancellation. Idempotent; callable from any thread, including while a fetch is in flight.
     *
     * @return Future completed once the session reaches STOPPED
     */
    Future<Void> requestStop()
    {
        while (true)
        {
            var current = state.get();

            if (current == SessionState.STOPPED)
            {
                return Future.succeededFuture();
            }

            if (current == SessionState.STOPPING)
            {
                return terminated.future();
            }

            if (state.compareAndSet(current, SessionState.STOPPING))
            {
                logger.info("Monitoring session stopping for {}", deviceId);

                context.runOnContext(v -> onStopRequested());

                return terminated.future();
            }
        }
    }

    public String getDeviceId()
    {
        return deviceId;
    }

    public SessionState getState()
    {
        return state.get();
    }

    public int getConsecutiveFailures()
    {
        return consecutiveFailures;
    }

    public int getFetchesIssued()
    {
        return fetchesIssued;
    }

    public long getPollIntervalMs()
    {
        return config.getPollIntervalMs();
    }

    public boolean isStoppedWithError()
    {
        return stoppedWithError;
    }

    /**
     * @return Future completed when the session reaches STOPPED, for any reason
     */
    public Future<Void> whenStopped()
    {
        return terminated.future();
    }

    /**
     * Failure raised when a fetch outlives its hard timeout. Counted like any transient
     * failure; the TimeoutException cause lets logs and callers tell it apart.
     */
    static TransientFetchException fetchTimeout(String deviceId, long timeoutMs)
    {
        return new TransientFetchException("Fetch timed out after " + timeoutMs + "ms",
            new TimeoutException("No status for " + deviceId + " within " + timeoutMs + "ms"));
    }

    // ========== LOOP (event-loop confined) ==========

    private void runCycle()
    {
        sleepTimerId = NO_TIMER;

        if (isCancelled())
        {
            finish(false);

            return;
        }

        if (state.get() == SessionState.STOPPED)
        {
            return;
        }

        fetchesIssued++;

        var attempt = Promise.<StateFragment>promise();

        inFlight = attempt;

        var timeoutMs = config.getFetchTimeoutMs();

        fetchTimerId = vertx.setTimer(timeoutMs, id -> attempt.tryFail(fetchTimeout(deviceId, timeoutMs)));

        attempt.future().onComplete(result -> context.runOnContext(v -> onFetchCompleted(attempt, result)));

        try
        {
            fetcher.fetchDeviceStatus(deviceId)
                .onComplete(result ->
                {
                    if (result.succeeded())
                    {
                        attempt.tryComplete(result.result());
                    }
                    else
                    {
                        attempt.tryFail(result.cause());
                    }
                });
        }
        catch (Exception exception)
        {
            attempt.tryFail(exception);
        }
    }

    private void onFetchCompleted(Promise<StateFragment> attempt, AsyncResult<StateFragment> result)
    {
        if (attempt != inFlight)
        {
            return;
        }

        inFlight = null;

        cancelFetchTimer();

        if (isCancelled())
        {
            finish(false);

            return;
        }

        if (state.get() == SessionState.STOPPED)
        {
            return;
        }

        if (result.succeeded())
        {
            onFetchSucceeded(result.result());
        }
        else
        {
            onFetchFailed(result.cause());
        }
    }

    private void onFetchSucceeded(StateFragment fragment)
    {
        if (fragment == null)
        {
            logger.warn("Dropped empty status reply for {}", deviceId);

            scheduleNext(config.getPollIntervalMs());

            return;
        }

        var now = clock.instant();

        try
        {
            FragmentCodec.validate(fragment, now);
        }
        catch (InvalidFragmentException exception)
        {
            onFetchFailed(exception);

            return;
        }

        var builder = fragment.toBuilder();

        if (fragment.getObservedAt() == null)
        {
            builder.observedAt(now);
        }

        var becameActive = state.compareAndSet(SessionState.STARTING, SessionState.ACTIVE);

        if (becameActive)
        {
            // clears the degraded marker left by a previous session
            builder.monitoringError(false, now);
        }

        publisher.merge(deviceId, builder.build());

        resetFailures();

        if (becameActive)
        {
            logger.info("Monitoring session active for {}", deviceId);

            notifyActive();
        }

        scheduleNext(config.getPollIntervalMs());
    }

    private void onFetchFailed(Throwable cause)
    {
        if (ExceptionUtil.isInvalidFragment(cause))
        {
            logger.warn("Dropped invalid status fragment for {}: {}", deviceId, cause.getMessage());

            scheduleNext(config.getPollIntervalMs());

            return;
        }

        incrementFailures();

        if (hasExhaustedRetries())
        {
            logger.error("Monitoring for {} gave up after {} consecutive failures, last: {}",
                deviceId, consecutiveFailures, ExceptionUtil.getMessage(cause, "fetch failed"));

            publishDegraded();

            finish(true);

            return;
        }

        var delayMs = config.backoffDelayMs(consecutiveFailures);

        logger.warn("Fetch failed for {} ({}/{}), retrying in {}ms: {}",
            deviceId, consecutiveFailures, config.getFailureThreshold(), delayMs,
            ExceptionUtil.getMessage(cause, ExceptionUtil.isTimeout(cause) ? "timeout" : "fetch failed"));

        scheduleNext(delayMs);
    }

    private void scheduleNext(long delayMs)
    {
        if (isCancelled())
        {
            finish(false);

            return;
        }

        sleepTimerId = vertx.setTimer(delayMs, id -> runCycle());
    }

    private void onStopRequested()
    {
        if (state.get() == SessionState.STOPPED)
        {
            return;
        }

        cancelSleepTimer();

        if (inFlight != null)
        {
            // completion path observes the cancellation and finishes the session
            inFlight.tryFail(new CancellationException("Monitoring stopped for " + deviceId));
        }
        else
        {
            finish(false);
        }
    }

    private void publishDegraded()
    {
        var now = clock.instant();

        publisher.merge(deviceId, StateFragment.builder()
            .connectionStatus(ConnectionStatus.UNKNOWN, now)
            .monitoringError(true, now)
            .build());
    }

    private void finish(boolean error)
    {
        var previous = state.getAndSet(SessionState.STOPPED);

        if (previous == SessionState.STOPPED)
        {
            return;
        }

        stoppedWithError = error;

        cancelSleepTimer();

        cancelFetchTimer();

        if (inFlight != null)
        {
            inFlight.tryFail(new CancellationException("Monitoring stopped for " + deviceId));

            inFlight = null;
        }

        logger.info("Monitoring session stopped for {} after {} fetches{}", deviceId, fetchesIssued, error ? " (error)" : "");

        try
        {
            onTerminated.accept(this);

            lifecycleListener.onStopped(deviceId, error);
        }
        catch (Exception exception)
        {
            logger.error("Error in session stop handling for {}: {}", deviceId, exception.getMessage(), exception);
        }

        terminated.tryComplete();
    }

    private void notifyActive()
    {
        try
        {
            lifecycleListener.onActive(deviceId);
        }
        catch (Exception exception)
        {
            logger.error("Lifecycle listener failed for {}: {}", deviceId, exception.getMessage(), exception);
        }
    }

    private boolean isCancelled()
    {
        return state.get() == SessionState.STOPPING;
    }

    private void cancelSleepTimer()
    {
        if (sleepTimerId != NO_TIMER)
        {
            vertx.cancelTimer(sleepTimerId);

            sleepTimerId = NO_TIMER;
        }
    }

    private void cancelFetchTimer()
    {
        if (fetchTimerId != NO_TIMER)
        {
            vertx.cancelTimer(fetchTimerId);

            fetchTimerId = NO_TIMER;
        }
    }

    private void resetFailures()
    {
        consecutiveFailures = 0;
    }

    private void incrementFailures()
    {
        consecutiveFailures++;
    }

    private boolean hasExhaustedRetries()
    {
        return consecutiveFailures >= config.getFailureThreshold();
    }

}
