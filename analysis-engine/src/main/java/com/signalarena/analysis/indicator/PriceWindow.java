package com.signalarena.analysis.indicator;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Append-only rolling price history owned by a single indicator agent. Keeps the
 * most recent {@code capacity} observations, oldest-first.
 */
public final class PriceWindow {

    private final int capacity;
    private final Deque<Double> prices;

    public PriceWindow(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1 but was " + capacity);
        }
        this.capacity = capacity;
        this.prices = new ArrayDeque<>(capacity);
    }

    public void append(double price) {
        if (prices.size() == capacity) {
            prices.removeFirst();
        }
        prices.addLast(price);
    }

    public boolean hasAtLeast(int observations) {
        return prices.size() >= observations;
    }

    public List<Double> snapshot() {
        return new ArrayList<>(prices);
    }
}
