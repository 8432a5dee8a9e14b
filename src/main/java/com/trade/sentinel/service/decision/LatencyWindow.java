package com.trade.sentinel.service.decision;

import java.time.Duration;
import java.util.Arrays;
import java.util.Optional;

/**
 * Ring buffer over the most recent decision latencies.
 * <p>
 * Percentiles use the nearest-rank method over whatever the window currently holds.
 */
public final class LatencyWindow {

    private final long[] nanos;
    private int next;
    private int size;

    public LatencyWindow(int capacity) {
        if (capacity < 1) throw new IllegalArgumentException("capacity must be >= 1, was " + capacity);
        this.nanos = new long[capacity];
    }

    public synchronized void record(Duration elapsed) {
        nanos[next] = (elapsed == null || elapsed.isNegative()) ? 0L : elapsed.toNanos();
        next = (next + 1) % nanos.length;
        if (size < nanos.length) size++;
    }

    /**
     * @param pct in (0, 100]
     * @return empty until something was recorded
     */
    public Optional<Duration> percentile(double pct) {
        if (!(pct > 0d && pct <= 100d)) throw new IllegalArgumentException("percentile must be in (0, 100], was " + pct);
        long[] copy;
        synchronized (this) {
            if (size == 0) return Optional.empty();
            copy = Arrays.copyOf(nanos, size);
        }
        Arrays.sort(copy);
        int rank = (int) Math.ceil(pct / 100d * copy.length);
        return Optional.of(Duration.ofNanos(copy[Math.max(rank, 1) - 1]));
    }

    public synchronized int size() {
        return size;
    }
}
