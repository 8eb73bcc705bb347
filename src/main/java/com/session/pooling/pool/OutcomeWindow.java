package com.session.pooling.pool;

/**
 * Fixed-size sliding window over the most recent release outcomes.
 * Not thread-safe; guarded by the owning pool's lock.
 */
class OutcomeWindow {

    private final boolean[] successes;
    private final double[] responseMs;
    private int next;
    private int size;

    OutcomeWindow(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0");
        }
        this.successes = new boolean[capacity];
        this.responseMs = new double[capacity];
    }

    void record(boolean success, double millis) {
        successes[next] = success;
        responseMs[next] = millis;
        next = (next + 1) % successes.length;
        if (size < successes.length) {
            size++;
        }
    }

    int size() {
        return size;
    }

    double successRate() {
        if (size == 0) {
            return 0.0;
        }
        int ok = 0;
        for (int i = 0; i < size; i++) {
            if (successes[i]) {
                ok++;
            }
        }
        return (double) ok / size;
    }

    double meanResponseMs() {
        if (size == 0) {
            return 0.0;
        }
        double sum = 0;
        for (int i = 0; i < size; i++) {
            sum += responseMs[i];
        }
        return sum / size;
    }

    /**
     * Standard deviation of response times divided by their mean; 0 when undefined.
     */
    double responseVariation() {
        double mean = meanResponseMs();
        if (size < 2 || mean <= 0) {
            return 0.0;
        }
        double squares = 0;
        for (int i = 0; i < size; i++) {
            double d = responseMs[i] - mean;
            squares += d * d;
        }
        return Math.sqrt(squares / size) / mean;
    }

    void clear() {
        next = 0;
        size = 0;
    }
}
