package com.usageprofile.counter.aggregate;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Combines partial aggregates by summing every count over the union of keys. Call
 * locations are combined as a multiset union.
 *
 * The merge is associative and commutative with {@link PartialAggregate#empty()} as
 * identity, so per-file results may be combined in any order and in any grouping.
 */
public class MergeEngine {

    public PartialAggregate merge(Iterable<PartialAggregate> aggregates) {
        Map<String, Long> calls = new HashMap<>();
        Map<ParameterKey, Histogram> histograms = new HashMap<>();
        Map<String, List<Occurrence>> occurrences = new HashMap<>();
        long unresolved = 0;
        for (PartialAggregate a : aggregates) {
            a.callCounts().forEach((element, n) -> calls.merge(element, n, Long::sum));
            a.parameterHistograms().forEach((key, h) -> histograms.merge(key, h, Histogram::plus));
            a.occurrences().forEach((element, list) ->
                    occurrences.computeIfAbsent(element, k -> new ArrayList<>()).addAll(list));
            unresolved += a.unresolvedCalls();
        }
        return new PartialAggregate(calls, histograms, occurrences, unresolved);
    }

    public PartialAggregate merge(PartialAggregate... aggregates) {
        return merge(Arrays.asList(aggregates));
    }
}
