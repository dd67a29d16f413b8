package dev.miniocpp.protocol.session;

import java.io.Closeable;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a beat immediately, then again after each interval. The interval is read when the next beat is
 * scheduled, so a configuration change applies from the following cycle; a sleep in progress is not cut short.
 */
public final class LivenessScheduler implements Closeable {

    private static final Logger LOGGER = LoggerFactory.getLogger(LivenessScheduler.class);

    private final ScheduledExecutorService executor;
    private final Supplier<Duration> interval;
    private final Runnable beat;

    private boolean running;
    private ScheduledFuture<?> next;

    public LivenessScheduler(ScheduledExecutorService executor, Supplier<Duration> interval, Runnable beat) {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.interval = Objects.requireNonNull(interval, "interval");
        this.beat = Objects.requireNonNull(beat, "beat");
    }

    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        next = executor.schedule(this::cycle, 0, TimeUnit.NANOSECONDS);
    }

    public synchronized boolean isRunning() {
        return running;
    }

    private void cycle() {
        if (!isRunning()) {
            return;
        }
        try {
            beat.run();
        } catch (RuntimeException e) {
            LOGGER.warn("Liveness beat failed", e);
        }
        scheduleNext();
    }

    private synchronized void scheduleNext() {
        if (!running) {
            return;
        }
        Duration delay = interval.get();
        LOGGER.debug("Next liveness beat in {}", delay);
        next = executor.schedule(this::cycle, delay.toNanos(), TimeUnit.NANOSECONDS);
    }

    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        if (next != null) {
            next.cancel(false);
        }
        LOGGER.debug("Liveness scheduler stopped");
    }

    @Override
    public void close() {
        stop();
    }
}
