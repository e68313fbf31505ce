package com.tradeguard.anomaly;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;

/**
 * Fixed-size window of recent samples with population mean and standard deviation.
 * Not thread-safe; the detector serializes access.
 */
class RollingStats {

    private final int capacity;
    private final Deque<Double> samples;

    RollingStats(int capacity) {
        this.capacity = capacity;
        this.samples = new ArrayDeque<>(capacity);
    }

    void add(double value) {
        if (samples.size() == capacity) {
            samples.pollFirst();
        }
        samples.addLast(value);
    }

    int size() {
        return samples.size();
    }

    double mean() {
        double sum = 0;
        for (double v : samples) {
            sum += v;
        }
        return samples.isEmpty() ? 0 : sum / samples.size();
    }

    double stdDev() {
        if (samples.isEmpty()) {
            return 0;
        }
        double mean = mean();
        double squares = 0;
        for (double v : samples) {
            squares += (v - mean) * (v - mean);
        }
        return Math.sqrt(squares / samples.size());
    }

    /** |value − mean| / σ against the current window; 0 while σ is 0. */
    double zScore(double value) {
        double sd = stdDev();
        return sd == 0 ? 0 : Math.abs(value - mean()) / sd;
    }

    /** True when the last {@code n} samples all equal {@code value}. */
    boolean lastRepeats(double value, int n) {
        if (samples.size() < n) {
            return false;
        }
        Iterator<Double> newestFirst = samples.descendingIterator();
        for (int i = 0; i < n; i++) {
            if (newestFirst.next() != value) {
                return false;
            }
        }
        return true;
    }
}
