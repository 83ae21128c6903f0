package com.usageprofile.counter.aggregate;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Folds call observations of one file into a {@link PartialAggregate}.
 * Not thread-safe; each analysis task owns its own instance.
 */
public class UsageAggregator {

    private final Map<String, Long> callCounts = new HashMap<>();
    private final Map<ParameterKey, Map<ValueSignature, Long>> histograms = new HashMap<>();
    private final Map<String, List<Occurrence>> occurrences = new HashMap<>();
    private long unresolvedCalls;

    /**
     * Records one resolved call site.
     *
     * @param element  qualified name of the called element
     * @param bindings parameter (or variadic bucket) name to the value signature bound at this call
     */
    public void recordCall(String element, Map<String, ValueSignature> bindings) {
        recordCall(element, bindings, null);
    }

    /**
     * Records one resolved call site found at {@code where}.
     *
     * @param where location of the call, or null when it is not known
     */
    public void recordCall(String element, Map<String, ValueSignature> bindings, Occurrence where) {
        callCounts.merge(element, 1L, Long::sum);
        if (where != null) {
            occurrences.computeIfAbsent(element, k -> new ArrayList<>()).add(where);
        }
        for (Map.Entry<String, ValueSignature> b : bindings.entrySet()) {
            histograms.computeIfAbsent(new ParameterKey(element, b.getKey()), k -> new HashMap<>())
                      .merge(b.getValue(), 1L, Long::sum);
        }
    }

    public void recordUnresolved() {
        unresolvedCalls++;
    }

    public PartialAggregate toAggregate() {
        Map<ParameterKey, Histogram> built = new HashMap<>();
        histograms.forEach((key, counts) -> built.put(key, Histogram.of(counts)));
        return new PartialAggregate(callCounts, built, occurrences, unresolvedCalls);
    }
}
