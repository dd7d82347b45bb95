package com.groundwave.zettelkasten.domain;

import com.groundwave.zettelkasten.config.ZettelkastenProperties;
import com.groundwave.zettelkasten.error.BuildException;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Background loop that rebuilds the zettelkasten caches.
 *
 * Waits the startup delay, refreshes, then waits the interval and repeats. Each refresh
 * runs on its own thread and is cancelled when it exceeds the deadline.
 */
@Component
@Slf4j
public class CacheRefreshWorker {

    private static final Duration STOP_TIMEOUT = Duration.ofSeconds(30);

    private final ZettelkastenCache cache;
    private final boolean enabled;
    private final Duration startupDelay;
    private final Duration interval;
    private final Duration deadline;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition wakeUp = lock.newCondition();
    private final AtomicInteger completedRefreshes = new AtomicInteger();

    private ExecutorService loopExecutor;
    private ExecutorService refreshExecutor;
    private Future<?> inFlight;
    private boolean stopping;
    private boolean refreshRequested;

    @Autowired
    public CacheRefreshWorker(ZettelkastenCache cache, ZettelkastenProperties properties) {
        this(cache,
            properties.getRefresh().isEnabled(),
            properties.getRefresh().getStartupDelay(),
            properties.getRefresh().getInterval(),
            properties.getRefresh().getDeadline());
    }

    public CacheRefreshWorker(ZettelkastenCache cache, boolean enabled,
                              Duration startupDelay, Duration interval, Duration deadline) {
        this.cache = cache;
        this.enabled = enabled;
        this.startupDelay = startupDelay;
        this.interval = interval;
        this.deadline = deadline;
    }

    @PostConstruct
    public void init() {
        if (!enabled) {
            log.info("Zettelkasten cache refresh disabled");
            return;
        }
        start();
    }

    @PreDestroy
    public void shutdown() {
        stop();
    }

    /**
     * Start the refresh loop. Calling it while running has no effect.
     */
    public void start() {
        lock.lock();
        try {
            if (loopExecutor != null) {
                return;
            }
            stopping = false;
            refreshRequested = false;
            loopExecutor = Executors.newSingleThreadExecutor(daemon("zk-cache-refresh"));
            refreshExecutor = Executors.newSingleThreadExecutor(daemon("zk-cache-build"));
            loopExecutor.submit(this::runLoop);
        } finally {
            lock.unlock();
        }
        log.info("Zettelkasten cache refresh started (startup delay {}s, interval {}s)",
            startupDelay.toSeconds(), interval.toSeconds());
    }

    /**
     * Stop the loop, cancel an in-flight refresh and wait for both threads to exit.
     */
    public void stop() {
        ExecutorService loop;
        ExecutorService refresh;
        lock.lock();
        try {
            if (loopExecutor == null) {
                return;
            }
            stopping = true;
            if (inFlight != null) {
                inFlight.cancel(true);
            }
            wakeUp.signalAll();
            loop = loopExecutor;
            refresh = refreshExecutor;
            loopExecutor = null;
            refreshExecutor = null;
        } finally {
            lock.unlock();
        }

        loop.shutdownNow();
        refresh.shutdownNow();
        try {
            if (!loop.awaitTermination(STOP_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)
                || !refresh.awaitTermination(STOP_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Zettelkasten cache refresh did not stop within {}s", STOP_TIMEOUT.toSeconds());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("Zettelkasten cache refresh stopped");
    }

    /**
     * Wake the loop so it refreshes without waiting for the rest of the current delay.
     */
    public void refreshNow() {
        lock.lock();
        try {
            refreshRequested = true;
            wakeUp.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public boolean isRunning() {
        lock.lock();
        try {
            return loopExecutor != null;
        } finally {
            lock.unlock();
        }
    }

    public int getCompletedRefreshes() {
        return completedRefreshes.get();
    }

    private void runLoop() {
        Duration wait = startupDelay;
        while (awaitNextRun(wait)) {
            refreshOnce();
            wait = interval;
        }
    }

    /**
     * Wait up to {@code wait}, returning early on {@link #refreshNow()}.
     *
     * @return false once the worker is stopping
     */
    private boolean awaitNextRun(Duration wait) {
        lock.lock();
        try {
            long remaining = wait.toNanos();
            while (!stopping && !refreshRequested && remaining > 0) {
                remaining = wakeUp.awaitNanos(remaining);
            }
            refreshRequested = false;
            return !stopping;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } finally {
            lock.unlock();
        }
    }

    private void refreshOnce() {
        Future<?> refresh;
        lock.lock();
        try {
            if (stopping) {
                return;
            }
            refresh = refreshExecutor.submit(() -> {
                cache.refreshAll();
                return null;
            });
            inFlight = refresh;
        } finally {
            lock.unlock();
        }

        try {
            refresh.get(deadline.toMillis(), TimeUnit.MILLISECONDS);
            completedRefreshes.incrementAndGet();
        } catch (TimeoutException e) {
            log.error("Zettelkasten cache refresh exceeded {}s, cancelling", deadline.toSeconds());
            refresh.cancel(true);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof BuildException) {
                log.error("Failed to refresh zettelkasten caches: {}", cause.getMessage());
            } else {
                log.error("Unexpected error refreshing zettelkasten caches", cause);
            }
        } catch (CancellationException e) {
            log.info("Zettelkasten cache refresh cancelled");
        } catch (InterruptedException e) {
            refresh.cancel(true);
            Thread.currentThread().interrupt();
        } finally {
            lock.lock();
            try {
                inFlight = null;
            } finally {
                lock.unlock();
            }
        }
    }

    private static ThreadFactory daemon(String name) {
        return runnable -> {
            Thread thread = new Thread(runnable, name);
            thread.setDaemon(true);
            return thread;
        };
    }
}
