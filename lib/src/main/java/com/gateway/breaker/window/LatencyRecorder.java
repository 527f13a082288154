package com.gateway.breaker.window;

/**
 * Bounded ring buffer of the most recent successful call latencies.
 */
public class LatencyRecorder {

    public static final int DEFAULT_CAPACITY = 100;

    private final long[] samples;
    private int next;
    private int size;

    public LatencyRecorder() {
        this(DEFAULT_CAPACITY);
    }

    public LatencyRecorder(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Capacity must be at least 1");
        }
        this.samples = new long[capacity];
    }

    public synchronized void record(long latencyMs) {
        samples[next] = latencyMs;
        next = (next + 1) % samples.length;
        if (size < samples.length) {
            size++;
        }
    }

    /**
     * Gets the mean of the retained samples.
     *
     * @return average latency in milliseconds, 0.0 without samples
     */
    public synchronized double getAverageMs() {
        if (size == 0) {
            return 0.0;
        }
        long sum = 0;
        for (int i = 0; i < size; i++) {
            sum += samples[i];
        }
        return (double) sum / size;
    }

    public synchronized int getSampleCount() {
        return size;
    }

    public synchronized void clear() {
        next = 0;
        size = 0;
    }
}
