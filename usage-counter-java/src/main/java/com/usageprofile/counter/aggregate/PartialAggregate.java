package com.usageprofile.counter.aggregate;

import java.util.*;

/**
 * Usage counts of one file or batch: calls per element, a value histogram per
 * (element, parameter), where each resolved call was found, and the number of calls
 * that could not be resolved. Immutable once built; combine instances with {@link MergeEngine}.
 */
public final class PartialAggregate {

    private static final PartialAggregate EMPTY = new PartialAggregate(Map.of(), Map.of(), Map.of(), 0);

    private final Map<String, Long> callCounts;
    private final Map<ParameterKey, Histogram> parameterHistograms;
    private final Map<String, List<Occurrence>> occurrences;
    private final long unresolvedCalls;

    public PartialAggregate(Map<String, Long> callCounts,
                            Map<ParameterKey, Histogram> parameterHistograms,
                            long unresolvedCalls) {
        this(callCounts, parameterHistograms, Map.of(), unresolvedCalls);
    }

    /**
     * @param occurrences call locations per element; kept sorted, so two aggregates holding
     *                    the same locations are equal whatever order they were recorded in
     * @throws IllegalArgumentException on a missing or negative count, a missing location,
     *                                  or an element with more locations than calls
     */
    public PartialAggregate(Map<String, Long> callCounts,
                            Map<ParameterKey, Histogram> parameterHistograms,
                            Map<String, ? extends Collection<Occurrence>> occurrences,
                            long unresolvedCalls) {
        if (unresolvedCalls < 0) {
            throw new IllegalArgumentException("Negative unresolved count: " + unresolvedCalls);
        }
        Map<String, Long> calls = new HashMap<>();
        callCounts.forEach((element, n) -> {
            if (n == null) throw new IllegalArgumentException("Missing call count for " + element);
            if (n < 0) throw new IllegalArgumentException("Negative call count for " + element + ": " + n);
            if (n > 0) calls.put(element, n);
        });
        Map<ParameterKey, Histogram> histograms = new HashMap<>();
        parameterHistograms.forEach((key, h) -> {
            if (h == null) throw new IllegalArgumentException("Missing histogram for " + key);
            if (!h.isEmpty()) histograms.put(key, h);
        });
        Map<String, List<Occurrence>> located = new HashMap<>();
        occurrences.forEach((element, list) -> {
            if (list == null) throw new IllegalArgumentException("Missing locations for " + element);
            if (list.isEmpty()) return;
            if (list.size() > calls.getOrDefault(element, 0L)) {
                throw new IllegalArgumentException(list.size() + " locations for " + element
                        + " but " + calls.getOrDefault(element, 0L) + " calls");
            }
            List<Occurrence> sorted = new ArrayList<>(list);
            for (Occurrence o : sorted) {
                if (o == null) throw new IllegalArgumentException("Missing location for " + element);
            }
            Collections.sort(sorted);
            located.put(element, Collections.unmodifiableList(sorted));
        });
        this.callCounts = Collections.unmodifiableMap(calls);
        this.parameterHistograms = Collections.unmodifiableMap(histograms);
        this.occurrences = Collections.unmodifiableMap(located);
        this.unresolvedCalls = unresolvedCalls;
    }

    public static PartialAggregate empty() {
        return EMPTY;
    }

    public Map<String, Long> callCounts() { return callCounts; }

    public Map<ParameterKey, Histogram> parameterHistograms() { return parameterHistograms; }

    public Map<String, List<Occurrence>> occurrences() { return occurrences; }

    public long unresolvedCalls() { return unresolvedCalls; }

    /** Sorted locations of the calls of {@code element}; empty when none were recorded. */
    public List<Occurrence> occurrences(String element) {
        return occurrences.getOrDefault(element, List.of());
    }

    public long callCount(String element) {
        return callCounts.getOrDefault(element, 0L);
    }

    public Histogram histogram(String element, String parameter) {
        return parameterHistograms.getOrDefault(new ParameterKey(element, parameter), Histogram.empty());
    }

    public long resolvedCalls() {
        long sum = 0;
        for (long n : callCounts.values()) sum += n;
        return sum;
    }

    public boolean isEmpty() {
        return callCounts.isEmpty() && parameterHistograms.isEmpty() && unresolvedCalls == 0;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof PartialAggregate other
                && unresolvedCalls == other.unresolvedCalls
                && callCounts.equals(other.callCounts)
                && parameterHistograms.equals(other.parameterHistograms)
                && occurrences.equals(other.occurrences);
    }

    @Override
    public int hashCode() {
        return Objects.hash(callCounts, parameterHistograms, occurrences, unresolvedCalls);
    }

    @Override
    public String toString() {
        return "PartialAggregate{calls=" + callCounts
                + ", histograms=" + parameterHistograms
                + ", occurrences=" + occurrences
                + ", unresolved=" + unresolvedCalls + "}";
    }
}
