package dev.miniocpp.protocol.session;

import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Channel that records sent frames for inspection. An optional send delay widens the window in which two
 * unsynchronized senders would overlap; the highest number of concurrent sends seen is kept.
 */
public final class InMemoryFrameChannel implements FrameChannel {

    private final String id;
    private final Duration sendDelay;
    private final BlockingQueue<String> sent = new LinkedBlockingQueue<>();
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicInteger maxInFlight = new AtomicInteger();
    private final AtomicInteger closeCount = new AtomicInteger();
    private volatile boolean open = true;

    public InMemoryFrameChannel(String id) {
        this(id, Duration.ZERO);
    }

    public InMemoryFrameChannel(String id, Duration sendDelay) {
        this.id = id;
        this.sendDelay = sendDelay;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    @Override
    public void send(String frame) {
        int concurrent = inFlight.incrementAndGet();
        maxInFlight.accumulateAndGet(concurrent, Math::max);
        try {
            if (!sendDelay.isZero()) {
                Thread.sleep(sendDelay.toMillis());
            }
            sent.add(frame);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            inFlight.decrementAndGet();
        }
    }

    @Override
    public void close() {
        open = false;
        closeCount.incrementAndGet();
    }

    public String nextFrame() throws InterruptedException {
        String frame = sent.poll(2, TimeUnit.SECONDS);
        if (frame == null) {
            throw new AssertionError("No frame sent on " + id);
        }
        return frame;
    }

    public String pollFrame(long millis) throws InterruptedException {
        return sent.poll(millis, TimeUnit.MILLISECONDS);
    }

    public int sentCount() {
        return sent.size();
    }

    public int maxConcurrentSends() {
        return maxInFlight.get();
    }

    public int closeCount() {
        return closeCount.get();
    }
}
