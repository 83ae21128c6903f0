package com.usageprofile.counter.aggregate;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Immutable occurrence counts per value signature.
 */
public final class Histogram {

    private static final Histogram EMPTY = new Histogram(Map.of());

    private final Map<ValueSignature, Long> counts;

    private Histogram(Map<ValueSignature, Long> counts) {
        this.counts = counts;
    }

    public static Histogram empty() {
        return EMPTY;
    }

    /**
     * @throws IllegalArgumentException if a count is missing or negative
     */
    public static Histogram of(Map<ValueSignature, Long> counts) {
        Map<ValueSignature, Long> copy = new HashMap<>();
        for (Map.Entry<ValueSignature, Long> e : counts.entrySet()) {
            if (e.getValue() == null) throw new IllegalArgumentException("Missing count for " + e.getKey());
            long n = e.getValue();
            if (n < 0) throw new IllegalArgumentException("Negative count for " + e.getKey() + ": " + n);
            if (n > 0) copy.put(e.getKey(), n);
        }
        return copy.isEmpty() ? EMPTY : new Histogram(Collections.unmodifiableMap(copy));
    }

    public Map<ValueSignature, Long> counts() { return counts; }

    public long count(ValueSignature signature) {
        return counts.getOrDefault(signature, 0L);
    }

    public long total() {
        long sum = 0;
        for (long n : counts.values()) sum += n;
        return sum;
    }

    public boolean isEmpty() { return counts.isEmpty(); }

    /** Entry-wise sum. */
    public Histogram plus(Histogram other) {
        if (other.isEmpty()) return this;
        if (isEmpty()) return other;
        Map<ValueSignature, Long> sum = new HashMap<>(counts);
        other.counts.forEach((sig, n) -> sum.merge(sig, n, Long::sum));
        return new Histogram(Collections.unmodifiableMap(sum));
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Histogram h && counts.equals(h.counts);
    }

    @Override
    public int hashCode() { return counts.hashCode(); }

    @Override
    public String toString() { return counts.toString(); }
}
