package com.printmonitor.core;

import com.printmonitor.exceptions.InvalidFragmentException;

import com.printmonitor.exceptions.TransientFetchException;

import com.printmonitor.models.ConnectionStatus;

import com.printmonitor.models.JobProgress;

import com.printmonitor.models.SessionState;

import com.printmonitor.models.StateFragment;

import com.printmonitor.services.DeviceStatusFetcher;

import com.printmonitor.utils.ExceptionUtil;

import io.vertx.core.Context;

import io.vertx.core.Future;

import io.vertx.core.Promise;

import io.vertx.core.Vertx;

import io.vertx.junit5.VertxExtension;

import io.vertx.junit5.VertxTestContext;

import org.junit.jupiter.api.BeforeEach;

import org.junit.jupiter.api.Test;

import org.junit.jupiter.api.extension.ExtendWith;

import java.time.Clock;

import java.time.Instant;

import java.util.ArrayList;

import java.util.List;

import java.util.concurrent.CopyOnWriteArrayList;

import java.util.concurrent.CountDownLatch;

import java.util.concurrent.TimeUnit;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;

import static org.junit.jupiter.api.Assertions.assertFalse;

import static org.junit.jupiter.api.Assertions.assertNotSame;

import static org.junit.jupiter.api.Assertions.assertTrue;

@ExtendWith(VertxExtension.class)
class SessionRegistryTest
{

    private final Clock clock = Clock.systemUTC();

    private final AtomicInteger fetchCount = new AtomicInteger();

    private Context context;

    private SnapshotPublisher publisher;

    @BeforeEach
    void setUp(Vertx vertx)
    {
        context = vertx.getOrCreateContext();

        publisher = new SnapshotPublisher(new StateMerger());
    }

    private SessionRegistry registry(DeviceStatusFetcher fetcher, MonitoringConfig config)
    {
        return new SessionRegistry(context, fetcher, publisher, config, clock);
    }

    private DeviceStatusFetcher progressingFetcher()
    {
        return deviceId ->
        {
            var call = fetchCount.incrementAndGet();

            var now = clock.instant();

            return Future.succeededFuture(StateFragment.builder()
                .connectionStatus(ConnectionStatus.ONLINE, now)
                .currentJob(new JobProgress("benchy.gcode", call * 10.0, null), now)
                .build());
        };
    }

    private DeviceStatusFetcher hangingFetcher()
    {
        return deviceId ->
        {
            fetchCount.incrementAndGet();

            return Promise.<StateFragment>promise().future();
        };
    }

    @Test
    void pollingDeliversProgressInOrder(VertxTestContext testContext)
    {
        var config = MonitoringConfig.builder().pollIntervalMs(100).fetchTimeoutMs(50).build();

        var registry = registry(progressingFetcher(), config);

        var progress = new CopyOnWriteArrayList<Double>();

        publisher.subscribe("p1", (state, changed) ->
        {
            progress.add(state.getCurrentJob().getValue().getProgressPercent());

            if (progress.size() == 3)
            {
                registry.stopMonitoring("p1")
                    .onComplete(testContext.succeeding(v ->
                        context.owner().setTimer(350, id -> testContext.verify(() ->
                        {
                            assertEquals(List.of(10.0, 20.0, 30.0), progress);

                            assertEquals(3, fetchCount.get());

                            assertEquals(SessionState.STOPPED, registry.sessionState("p1"));

                            testContext.completeNow();
                        }))));
            }
        });

        registry.startMonitoring("p1");
    }

    @Test
    void stopAbandonsHangingFetchPromptly(VertxTestContext testContext)
    {
        var config = MonitoringConfig.builder().pollIntervalMs(10000).fetchTimeoutMs(5000).build();

        var registry = registry(hangingFetcher(), config);

        registry.startMonitoring("p1");

        context.owner().setTimer(100, id ->
        {
            var requestedAt = System.nanoTime();

            var session = registry.findSession("p1").orElseThrow();

            testContext.verify(() -> assertEquals(SessionState.STARTING, session.getState()));

            registry.stopMonitoring("p1").onComplete(testContext.succeeding(v -> testContext.verify(() ->
            {
                var elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - requestedAt);

                assertTrue(elapsedMs < config.getFetchTimeoutMs(), "stopped after " + elapsedMs + "ms");

                assertEquals(SessionState.STOPPED, session.getState());

                assertFalse(session.isStoppedWithError());

                assertEquals(1, fetchCount.get());

                assertEquals(0, registry.liveSessionCount());

                testContext.completeNow();
            })));
        });
    }

    @Test
    void fetchTimeoutCountsAsFailure(VertxTestContext testContext)
    {
        var config = MonitoringConfig.builder()
            .pollIntervalMs(200).fetchTimeoutMs(30)
            .failureThreshold(2).backoffInitialMs(10).backoffMaxMs(20)
            .build();

        var registry = registry(hangingFetcher(), config);

        registry.setLifecycleListener(new SessionLifecycleListener()
        {
            @Override
            public void onStopped(String deviceId, boolean error)
            {
                testContext.verify(() ->
                {
                    assertTrue(error);

                    assertEquals(2, fetchCount.get());

                    assertTrue(ExceptionUtil.isTimeout(MonitoringSession.fetchTimeout(deviceId, config.getFetchTimeoutMs())));

                    testContext.completeNow();
                });
            }
        });

        registry.startMonitoring("p1");
    }

    @Test
    void failuresBackOffThenGiveUp(VertxTestContext testContext)
    {
        var config = MonitoringConfig.builder()
            .pollIntervalMs(200).fetchTimeoutMs(100)
            .failureThreshold(5).backoffInitialMs(10).backoffMaxMs(40)
            .build();

        var attemptTimes = new CopyOnWriteArrayList<Long>();

        DeviceStatusFetcher failing = deviceId ->
        {
            fetchCount.incrementAndGet();

            attemptTimes.add(System.nanoTime());

            return Future.failedFuture(new TransientFetchException("connection refused"));
        };

        var registry = registry(failing, config);

        registry.setLifecycleListener(new SessionLifecycleListener()
        {
            @Override
            public void onStopped(String deviceId, boolean error)
            {
                context.owner().setTimer(300, id -> testContext.verify(() ->
                {
                    assertTrue(error);

                    assertEquals(5, fetchCount.get(), "no fetch after giving up");

                    var snapshot = publisher.getSnapshot("p1").orElseThrow();

                    assertEquals(ConnectionStatus.UNKNOWN, snapshot.getConnectionStatus().getValue());

                    assertTrue(snapshot.isMonitoringError());

                    assertEquals(SessionState.STOPPED, registry.sessionState("p1"));

                    var lastGapMs = TimeUnit.NANOSECONDS.toMillis(attemptTimes.get(4) - attemptTimes.get(3));

                    assertTrue(lastGapMs >= 35, "backoff capped at max, was " + lastGapMs + "ms");

                    testContext.completeNow();
                }));
            }
        });

        registry.startMonitoring("p1");
    }

    @Test
    void successfulRestartClearsMonitoringError(VertxTestContext testContext)
    {
        var config = MonitoringConfig.builder()
            .pollIntervalMs(100).fetchTimeoutMs(50)
            .failureThreshold(1).backoffInitialMs(10).backoffMaxMs(10)
            .build();

        var fail = new AtomicInteger(1);

        DeviceStatusFetcher fetcher = deviceId -> fail.getAndDecrement() > 0
            ? Future.failedFuture(new TransientFetchException("unreachable"))
            : progressingFetcher().fetchDeviceStatus(deviceId);

        var registry = registry(fetcher, config);

        registry.setLifecycleListener(new SessionLifecycleListener()
        {
            @Override
            public void onActive(String deviceId)
            {
                testContext.verify(() ->
                {
                    var snapshot = publisher.getSnapshot(deviceId).orElseThrow();

                    assertFalse(snapshot.isMonitoringError());

                    assertEquals(ConnectionStatus.ONLINE, snapshot.getConnectionStatus().getValue());
                });

                registry.stopMonitoring(deviceId).onComplete(testContext.succeedingThenComplete());
            }

            @Override
            public void onStopped(String deviceId, boolean error)
            {
                if (error)
                {
                    testContext.verify(() -> assertTrue(publisher.getSnapshot(deviceId).orElseThrow().isMonitoringError()));

                    registry.startMonitoring(deviceId);
                }
            }
        });

        registry.startMonitoring("p1");
    }

    @Test
    void invalidFragmentIsDroppedWithoutCountingAFailure(VertxTestContext testContext)
    {
        var config = MonitoringConfig.builder()
            .pollIntervalMs(50).fetchTimeoutMs(25)
            .failureThreshold(1)
            .build();

        DeviceStatusFetcher fetcher = deviceId -> fetchCount.incrementAndGet() <= 3
            ? Future.failedFuture(new InvalidFragmentException("progress_percent out of range"))
            : progressingFetcher().fetchDeviceStatus(deviceId);

        var registry = registry(fetcher, config);

        registry.setLifecycleListener(new SessionLifecycleListener()
        {
            @Override
            public void onActive(String deviceId)
            {
                testContext.verify(() ->
                {
                    assertEquals(0, registry.findSession(deviceId).orElseThrow().getConsecutiveFailures());

                    assertTrue(fetchCount.get() >= 4);
                });

                registry.stopMonitoring(deviceId).onComplete(testContext.succeedingThenComplete());
            }

            @Override
            public void onStopped(String deviceId, boolean error)
            {
                if (error)
                {
                    testContext.failNow("invalid data must not stop the session");
                }
            }
        });

        registry.startMonitoring("p1");
    }

    @Test
    void successResetsFailuresAndActiveSessionGivesUpAtThreshold(VertxTestContext testContext)
    {
        var config = MonitoringConfig.builder()
            .pollIntervalMs(30).fetchTimeoutMs(20)
            .failureThreshold(5).backoffInitialMs(5).backoffMaxMs(10)
            .build();

        // S F F S F F F F F: the second success must reset the count, so only the last five give up
        var script = List.of(true, false, false, true, false, false, false, false, false);

        var failuresAfterSecondSuccess = new AtomicInteger(-1);

        var activations = new AtomicInteger();

        var registryHolder = new SessionRegistry[1];

        DeviceStatusFetcher scripted = deviceId ->
        {
            var call = fetchCount.incrementAndGet();

            if (call == 5)
            {
                failuresAfterSecondSuccess.set(registryHolder[0].findSession(deviceId).orElseThrow().getConsecutiveFailures());
            }

            if (call <= script.size() && script.get(call - 1))
            {
                return Future.succeededFuture(StateFragment.builder()
                    .connectionStatus(ConnectionStatus.ONLINE, clock.instant())
                    .build());
            }

            return Future.failedFuture(new TransientFetchException("connection reset"));
        };

        var registry = registry(scripted, config);

        registryHolder[0] = registry;

        registry.setLifecycleListener(new SessionLifecycleListener()
        {
            @Override
            public void onActive(String deviceId)
            {
                activations.incrementAndGet();
            }

            @Override
            public void onStopped(String deviceId, boolean error)
            {
                context.owner().setTimer(100, id -> testContext.verify(() ->
                {
                    assertTrue(error);

                    assertEquals(1, activations.get(), "went ACTIVE once, then stopped from ACTIVE");

                    assertEquals(script.size(), fetchCount.get());

                    assertEquals(0, failuresAfterSecondSuccess.get());

                    var snapshot = publisher.getSnapshot("p1").orElseThrow();

                    assertEquals(ConnectionStatus.UNKNOWN, snapshot.getConnectionStatus().getValue());

                    assertTrue(snapshot.isMonitoringError());

                    assertEquals(SessionState.STOPPED, registry.sessionState("p1"));

                    testContext.completeNow();
                }));
            }
        });

        registry.startMonitoring("p1");
    }

    @Test
    void stopDuringIdleSleepIsPrompt(VertxTestContext testContext)
    {
        var config = MonitoringConfig.builder().pollIntervalMs(10000).fetchTimeoutMs(5000).build();

        var registry = registry(progressingFetcher(), config);

        registry.setLifecycleListener(new SessionLifecycleListener()
        {
            @Override
            public void onActive(String deviceId)
            {
                // well inside the 10s sleep
                context.owner().setTimer(50, id ->
                {
                    var session = registry.findSession(deviceId).orElseThrow();

                    testContext.verify(() -> assertEquals(SessionState.ACTIVE, session.getState()));

                    var requestedAt = System.nanoTime();

                    registry.stopMonitoring(deviceId).onComplete(testContext.succeeding(v -> testContext.verify(() ->
                    {
                        var elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - requestedAt);

                        assertTrue(elapsedMs < 500, "stopped after " + elapsedMs + "ms");

                        assertEquals(SessionState.STOPPED, session.getState());

                        assertFalse(session.isStoppedWithError());

                        assertEquals(1, fetchCount.get());

                        testContext.completeNow();
                    })));
                });
            }
        });

        registry.startMonitoring("p1");
    }

    @Test
    void concurrentStartsYieldOneActiveSession(VertxTestContext testContext) throws Exception
    {
        var config = MonitoringConfig.builder().pollIntervalMs(10000).fetchTimeoutMs(5000).build();

        var registry = registry(progressingFetcher(), config);

        var activations = new AtomicInteger();

        registry.setLifecycleListener(new SessionLifecycleListener()
        {
            @Override
            public void onActive(String deviceId)
            {
                activations.incrementAndGet();
            }
        });

        var ready = new CountDownLatch(1);

        var threads = new ArrayList<Thread>();

        for (var i = 0; i < 8; i++)
        {
            var thread = new Thread(() ->
            {
                try
                {
                    ready.await();

                    registry.startMonitoring("p1");
                }
                catch (InterruptedException exception)
                {
                    Thread.currentThread().interrupt();
                }
            });

            thread.start();

            threads.add(thread);
        }

        ready.countDown();

        for (var thread : threads)
        {
            thread.join();
        }

        context.owner().setTimer(200, id -> testContext.verify(() ->
        {
            assertEquals(1, activations.get());

            assertEquals(1, fetchCount.get());

            assertEquals(1, registry.liveSessionCount());

            assertEquals(SessionState.ACTIVE, registry.sessionState("p1"));

            registry.stopAll().onComplete(testContext.succeedingThenComplete());
        }));
    }

    @Test
    void futureStampedFetchIsDroppedWithoutCountingAFailure(VertxTestContext testContext)
    {
        var config = MonitoringConfig.builder()
            .pollIntervalMs(50).fetchTimeoutMs(25)
            .failureThreshold(1)
            .build();

        var farFuture = Instant.parse("2100-01-01T00:00:00Z");

        DeviceStatusFetcher fetcher = deviceId ->
        {
            var stampedAt = fetchCount.incrementAndGet() <= 2 ? farFuture : clock.instant();

            return Future.succeededFuture(StateFragment.builder()
                .connectionStatus(ConnectionStatus.ONLINE, stampedAt)
                .build());
        };

        var registry = registry(fetcher, config);

        registry.setLifecycleListener(new SessionLifecycleListener()
        {
            @Override
            public void onActive(String deviceId)
            {
                testContext.verify(() ->
                {
                    assertEquals(3, fetchCount.get());

                    var leaf = publisher.getSnapshot(deviceId).orElseThrow().getConnectionStatus();

                    assertTrue(leaf.getUpdatedAt().isBefore(farFuture));

                    assertEquals(0, registry.findSession(deviceId).orElseThrow().getConsecutiveFailures());
                });

                registry.stopMonitoring(deviceId).onComplete(testContext.succeedingThenComplete());
            }

            @Override
            public void onStopped(String deviceId, boolean error)
            {
                if (error)
                {
                    testContext.failNow("future-stamped data must not stop the session");
                }
            }
        });

        registry.startMonitoring("p1");
    }

    @Test
    void concurrentStartsCreateOneSession(VertxTestContext testContext) throws Exception
    {
        var registry = registry(hangingFetcher(), MonitoringConfig.defaults());

        var ready = new CountDownLatch(1);

        var threads = new ArrayList<Thread>();

        for (var i = 0; i < 8; i++)
        {
            var thread = new Thread(() ->
            {
                try
                {
                    ready.await();

                    registry.startMonitoring("p1");
                }
                catch (InterruptedException exception)
                {
                    Thread.currentThread().interrupt();
                }
            });

            thread.start();

            threads.add(thread);
        }

        ready.countDown();

        for (var thread : threads)
        {
            thread.join();
        }

        assertEquals(1, registry.liveSessionCount());

        context.owner().setTimer(100, id -> testContext.verify(() ->
        {
            assertEquals(1, fetchCount.get());

            registry.stopAll().onComplete(testContext.succeedingThenComplete());
        }));
    }

    @Test
    void stopIsIdempotent(VertxTestContext testContext)
    {
        var registry = registry(hangingFetcher(), MonitoringConfig.defaults());

        registry.stopMonitoring("never-started")
            .compose(v ->
            {
                registry.startMonitoring("p1");

                var first = registry.stopMonitoring("p1");

                var second = registry.stopMonitoring("p1");

                return Future.all(first, second);
            })
            .compose(v -> registry.stopMonitoring("p1"))
            .onComplete(testContext.succeeding(v -> testContext.verify(() ->
            {
                assertEquals(SessionState.STOPPED, registry.sessionState("p1"));

                assertTrue(registry.monitoredDevices().isEmpty());

                testContext.completeNow();
            })));
    }

    @Test
    void startWhileStoppingRestartsAfterStop(VertxTestContext testContext)
    {
        var registry = registry(hangingFetcher(), MonitoringConfig.defaults());

        registry.startMonitoring("p1");

        context.owner().setTimer(100, id ->
        {
            var original = registry.findSession("p1").orElseThrow();

            // same event loop: the stop cannot complete before the start is recorded
            context.runOnContext(v ->
            {
                var stopped = registry.stopMonitoring("p1");

                registry.startMonitoring("p1");

                testContext.verify(() ->
                {
                    assertEquals(SessionState.STOPPING, original.getState());

                    assertTrue(registry.hasPendingRestart("p1"));
                });

                stopped.onComplete(testContext.succeeding(done -> testContext.verify(() ->
                {
                    var restarted = registry.findSession("p1").orElseThrow();

                    assertNotSame(original, restarted);

                    assertEquals(SessionState.STOPPED, original.getState());

                    assertTrue(restarted.getState().isRunning());

                    assertFalse(registry.hasPendingRestart("p1"));

                    assertEquals(1, registry.liveSessionCount());

                    registry.stopAll().onComplete(testContext.succeedingThenComplete());
                })));
            });
        });
    }

    @Test
    void stopCancelsPendingRestart(VertxTestContext testContext)
    {
        var registry = registry(hangingFetcher(), MonitoringConfig.defaults());

        registry.startMonitoring("p1");

        context.owner().setTimer(100, id -> context.runOnContext(v ->
        {
            registry.stopMonitoring("p1");

            registry.startMonitoring("p1");

            registry.stopMonitoring("p1").onComplete(testContext.succeeding(done -> testContext.verify(() ->
            {
                assertFalse(registry.hasPendingRestart("p1"));

                assertTrue(registry.findSession("p1").isEmpty());

                testContext.completeNow();
            })));
        }));
    }

    @Test
    void rejectsInvalidStartArguments(VertxTestContext testContext)
    {
        var registry = registry(hangingFetcher(), MonitoringConfig.defaults());

        registry.startMonitoring(" ")
            .onComplete(testContext.failing(blank -> registry.startMonitoring("p1", -1)
                .onComplete(testContext.failing(negative -> testContext.verify(() ->
                {
                    assertTrue(negative instanceof IllegalArgumentException);

                    assertEquals(0, registry.liveSessionCount());

                    testContext.completeNow();
                })))));
    }

}
