package io.runcoord.internal;

import io.runcoord.Coordinator;
import io.runcoord.CredentialProvider;
import io.runcoord.ExecutionApi;
import io.runcoord.FailureNotifier;
import io.runcoord.RunHistory;
import io.runcoord.ScheduleStore;
import io.runcoord.core.CoordinatorSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Coordinator runtime: a poller thread, a recovery thread, a bounded worker pool and a retry timer.
 *
 * <p>Typical usage:
 * <pre>{@code
 * Coordinator coordinator = new ScheduleCoordinator(settings, store, history, credentials, api,
 *         FailureNotifier.logging(), Clock.systemUTC());
 * coordinator.start();
 * ...
 * coordinator.stop();
 * }</pre>
 *
 * <p>Stopping does not wait for pending retries: occurrences left in a live claim are released by the
 * recovery monitor of any instance once the recovery timeout has passed.
 */
public class ScheduleCoordinator implements Coordinator {
    private static final Logger log = LoggerFactory.getLogger(ScheduleCoordinator.class);

    private static final int MAX_CONSECUTIVE_POLL_FAILURES = 30;

    private final CoordinatorSettings settings;
    private final ScheduleStore store;
    private final Clock clock;
    private final String workerId;

    private final ClaimCoordinator claims;
    private final RecoveryMonitor recovery;
    private final RetryController retryController;
    private final ExecutionDispatcherFactory dispatcherFactory;
    private final RunHistory history;
    private final FailureNotifier notifier;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private Semaphore capacity;

    private ExecutorService workerPool;
    private ExecutorService callExecutor;
    private ScheduledExecutorService retryTimer;
    private volatile PollLoop pollLoop;

    private Thread pollerThread;
    private Thread recoveryThread;

    private int systemErrorCount = 0;

    @FunctionalInterface
    private interface ExecutionDispatcherFactory {
        ExecutionDispatcher create(ExecutorService callExecutor);
    }

    public ScheduleCoordinator(
            CoordinatorSettings settings,
            ScheduleStore store,
            RunHistory history,
            CredentialProvider credentials,
            ExecutionApi api,
            FailureNotifier notifier,
            Clock clock
    ) {
        this(settings, store, history, credentials, api, new ExecutionRequestFactory(), new RetryController(), notifier, clock);
    }

    public ScheduleCoordinator(
            CoordinatorSettings settings,
            ScheduleStore store,
            RunHistory history,
            CredentialProvider credentials,
            ExecutionApi api,
            ExecutionRequestFactory requestFactory,
            RetryController retryController,
            FailureNotifier notifier,
            Clock clock
    ) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.history = Objects.requireNonNull(history, "history must not be null");
        Objects.requireNonNull(credentials, "credentials must not be null");
        Objects.requireNonNull(api, "api must not be null");
        Objects.requireNonNull(requestFactory, "requestFactory must not be null");
        this.retryController = Objects.requireNonNull(retryController, "retryController must not be null");
        this.notifier = Objects.requireNonNull(notifier, "notifier must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");

        // the heartbeat is renewed once per attempt, so one attempt plus one backoff must fit the timeout
        Duration longestSilence = settings.dispatchTimeout().plus(retryController.maxDelay());
        if (settings.recoveryTimeout().compareTo(longestSilence) <= 0) {
            throw new IllegalArgumentException("recoveryTimeout " + settings.recoveryTimeout()
                    + " must exceed dispatchTimeout plus the maximum retry delay (" + longestSilence + ")");
        }

        this.workerId = resolveWorkerId(settings.workerId());
        this.claims = new ClaimCoordinator(store, history, settings.dueBuffer());
        this.recovery = new RecoveryMonitor(store, history, settings.recoveryTimeout(), settings.repeatedRecoveryThreshold());
        this.dispatcherFactory = executor -> new ExecutionDispatcher(
                credentials, api, requestFactory, history, settings.dispatchTimeout(), executor);
    }

    /**
     * Starts polling and recovery. Idempotent.
     */
    @Override
    public synchronized void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }

        log.info("runcoord starting workerId={} pollEvery={} dueBuffer={} recoveryEvery={} recoveryTimeout={} maxConcurrency={} dispatchTimeout={}",
                workerId,
                settings.pollEvery(),
                settings.dueBuffer(),
                settings.recoveryEvery(),
                settings.recoveryTimeout(),
                settings.maxConcurrency(),
                settings.dispatchTimeout());

        systemErrorCount = 0;
        capacity = new Semaphore(settings.maxConcurrency());
        workerPool = Executors.newFixedThreadPool(settings.maxConcurrency(), daemonThreads("runcoord.worker"));
        callExecutor = Executors.newCachedThreadPool(daemonThreads("runcoord.api-call"));
        retryTimer = Executors.newSingleThreadScheduledExecutor(daemonThreads("runcoord.retry-timer"));

        ExecutorService workers = workerPool;
        ScheduledExecutorService timer = retryTimer;
        OccurrenceExecutor.RetryScheduler retryScheduler = (task, delay) -> timer.schedule(() -> {
            try {
                workers.execute(task);
            } catch (RejectedExecutionException e) {
                log.warn("runcoord retry dropped, coordinator stopping; the claim is left to recovery");
            }
        }, delay.toMillis(), TimeUnit.MILLISECONDS);

        OccurrenceExecutor occurrences = new OccurrenceExecutor(
                store,
                history,
                dispatcherFactory.create(callExecutor),
                retryController,
                notifier,
                retryScheduler,
                clock
        );
        pollLoop = new PollLoop(store, claims, occurrences, workerPool, capacity, settings.dueBuffer());

        pollerThread = new Thread(this::pollerLoop);
        pollerThread.setName("runcoord.poller");
        pollerThread.setDaemon(true);
        pollerThread.start();

        recoveryThread = new Thread(this::recoveryLoop);
        recoveryThread.setName("runcoord.recovery");
        recoveryThread.setDaemon(true);
        recoveryThread.start();

        log.info("runcoord started workerId={}", workerId);
    }

    /**
     * Stops polling and recovery and waits up to the dispatch timeout for running attempts. Idempotent.
     */
    @Override
    public synchronized void stop() {
        if (!started.compareAndSet(true, false)) {
            return;
        }

        log.info("runcoord stopping workerId={}", workerId);

        if (pollerThread != null) {
            pollerThread.interrupt();
            pollerThread = null;
        }
        if (recoveryThread != null) {
            recoveryThread.interrupt();
            recoveryThread = null;
        }
        if (retryTimer != null) {
            retryTimer.shutdownNow();
            retryTimer = null;
        }

        if (workerPool != null) {
            workerPool.shutdown();
            try {
                if (!workerPool.awaitTermination(settings.dispatchTimeout().toSeconds() + 1, TimeUnit.SECONDS)) {
                    workerPool.shutdownNow();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                workerPool.shutdownNow();
            } finally {
                workerPool = null;
            }
        }

        if (callExecutor != null) {
            callExecutor.shutdownNow();
            callExecutor = null;
        }

        pollLoop = null;

        log.info("runcoord stopped workerId={}", workerId);
    }

    @Override
    public boolean isRunning() {
        return started.get();
    }

    @Override
    public int pollNow(Instant now) {
        PollLoop loop = this.pollLoop;
        if (loop == null) {
            throw new IllegalStateException("coordinator is not running");
        }
        return loop.pollOnce(now).claimed();
    }

    @Override
    public int recoverNow(Instant now) {
        return recovery.recoverOnce(now);
    }

    public String workerId() {
        return workerId;
    }

    private void pollerLoop() {
        while (started.get()) {
            try {
                PollLoop loop = this.pollLoop;
                if (loop != null) {
                    loop.pollOnce(clock.instant());
                }
                systemErrorCount = 0;
            } catch (Exception e) {
                systemErrorCount++;
                log.error("runcoord pollOnce failed failures={} msg={}", systemErrorCount, e.getMessage(), e);
                if (systemErrorCount >= MAX_CONSECUTIVE_POLL_FAILURES) {
                    log.error("runcoord stopping after repeated poll failures workerId={}", workerId);
                    Thread stopper = new Thread(this::stop, "runcoord.stopper");
                    stopper.setDaemon(true);
                    stopper.start();
                    break;
                }

                try {
                    Thread.sleep(backoff(systemErrorCount).toMillis());
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    break;
                }
                continue;
            }

            try {
                Thread.sleep(settings.pollEvery().toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
    }

    private void recoveryLoop() {
        while (started.get()) {
            try {
                recovery.recoverOnce(clock.instant());
            } catch (Exception e) {
                log.error("runcoord recovery scan failed msg={}", e.getMessage(), e);
            }

            try {
                Thread.sleep(settings.recoveryEvery().toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
    }

    // Exponential backoff for repeated poll failures, capped at one minute.
    static Duration backoff(int failCount) {
        if (failCount >= 10) {
            return Duration.ofSeconds(60);
        }
        int exp = Math.max(0, Math.min(failCount, 15));
        long ms = Math.min(1000L * (1L << exp), 60_000L);
        return Duration.ofMillis(ms);
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger seq = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r);
            t.setName(prefix + "-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    /**
     * Returns the configured worker id, or a host/pid/random id when none is configured.
     */
    public static String resolveWorkerId(String configuredWorkerId) {
        if (configuredWorkerId != null && !configuredWorkerId.isBlank()) {
            return configuredWorkerId;
        }

        String host = "runcoord";
        try {
            host = java.net.InetAddress.getLocalHost().getHostName();
        } catch (Exception e) {
            log.debug("runcoord could not resolve host name msg={}", e.getMessage());
        }

        String pid = String.valueOf(ProcessHandle.current().pid());

        String generated = host + "-" + pid + "-" + java.util.UUID.randomUUID();
        if (generated.length() > 128) {
            return generated.substring(0, 128);
        }
        return generated;
    }
}
