package com.usageprofile.counter.improve;

import com.usageprofile.counter.aggregate.Histogram;
import com.usageprofile.counter.aggregate.Occurrence;
import com.usageprofile.counter.aggregate.ParameterKey;
import com.usageprofile.counter.aggregate.PartialAggregate;
import com.usageprofile.counter.aggregate.ValueSignature;
import com.usageprofile.counter.api.ApiDescription;
import com.usageprofile.counter.api.ApiElement;
import com.usageprofile.counter.api.ApiParameter;

import java.util.*;

/**
 * Selects simplification candidates from a final aggregate using a minimum-usage threshold.
 *
 * An element or a (element, parameter, value) entry is flagged when its count is strictly
 * below the threshold; a count equal to the threshold is kept.
 */
public class ImprovementFilter {

    private final int minUsages;

    public ImprovementFilter(int minUsages) {
        if (minUsages < 0) {
            throw new IllegalArgumentException("Threshold must not be negative: " + minUsages);
        }
        this.minUsages = minUsages;
    }

    public boolean isRare(long count) {
        return count < minUsages;
    }

    /**
     * @param api public surface of the library, or null to report only what the usages contain
     */
    public ImprovementCandidates evaluate(PartialAggregate usages, ApiDescription api) {
        ImprovementCandidates result = new ImprovementCandidates();
        result.minUsages = minUsages;

        SortedMap<String, Long> calls = new TreeMap<>(usages.callCounts());
        if (api != null) {
            for (ApiElement callable : api.callables()) {
                calls.putIfAbsent(callable.qualifiedName(), 0L);
            }
        }
        calls.forEach((element, n) -> {
            if (isRare(n)) {
                ImprovementCandidates.RareElement rare = new ImprovementCandidates.RareElement();
                rare.element = element;
                rare.calls = n;
                SortedSet<String> files = new TreeSet<>();
                for (Occurrence o : usages.occurrences(element)) files.add(o.path());
                rare.affectedFiles.addAll(files);
                result.rarelyCalled.add(rare);
            }
        });

        SortedMap<ParameterKey, Histogram> histograms = new TreeMap<>(
                Comparator.comparing(ParameterKey::element).thenComparing(ParameterKey::parameter));
        histograms.putAll(usages.parameterHistograms());
        histograms.forEach((key, histogram) -> {
            SortedMap<String, Long> byValue = new TreeMap<>();
            histogram.counts().forEach((sig, n) -> byValue.put(sig.key(), n));
            byValue.forEach((value, n) -> {
                if (isRare(n)) {
                    ImprovementCandidates.RareValue rare = new ImprovementCandidates.RareValue();
                    rare.element = key.element();
                    rare.parameter = key.parameter();
                    rare.value = value;
                    rare.count = n;
                    result.rareValues.add(rare);
                }
            });
            if (!key.parameter().startsWith("*")) {
                result.parameterCustomization.add(customization(key, histogram, api));
            }
        });

        if (api != null) {
            for (ApiElement cls : api.classes()) {
                long n = classCalls(cls.qualifiedName(), usages.callCounts());
                if (n > 0) {
                    ImprovementCandidates.ClassUsage used = new ImprovementCandidates.ClassUsage();
                    used.className = cls.qualifiedName();
                    used.calls = n;
                    result.usedClasses.add(used);
                } else {
                    result.unusedClasses.add(cls.qualifiedName());
                }
            }
            result.usedClasses.sort(Comparator.comparing(c -> c.className));
            Collections.sort(result.unusedClasses);
        }
        return result;
    }

    /** Calls of all callables declared under {@code className}, constructors included. */
    static long classCalls(String className, Map<String, Long> callCounts) {
        String prefix = className + ".";
        long sum = 0;
        for (Map.Entry<String, Long> e : callCounts.entrySet()) {
            if (e.getKey().startsWith(prefix)) sum += e.getValue();
        }
        return sum;
    }

    private static ImprovementCandidates.ParameterCustomization customization(
            ParameterKey key, Histogram histogram, ApiDescription api) {
        ImprovementCandidates.ParameterCustomization c = new ImprovementCandidates.ParameterCustomization();
        c.element = key.element();
        c.parameter = key.parameter();
        c.calls = histogram.total();
        long customized = c.calls - histogram.count(ValueSignature.USES_DEFAULT);
        ApiParameter formal = api == null ? null
                : api.element(key.element()).map(e -> e.parameter(key.parameter())).orElse(null);
        if (formal != null && formal.hasDefault()) {
            c.declaredDefault = formal.defaultValue();
            customized -= histogram.count(defaultSignature(formal.defaultValue()));
        }
        c.customized = customized;
        return c;
    }

    /**
     * Signature a call records when it passes the declared default explicitly. String
     * defaults are re-quoted the way argument strings are.
     */
    public static ValueSignature defaultSignature(String declaredDefault) {
        String text = declaredDefault.trim();
        String prefix = "";
        if (text.length() > 1 && (text.charAt(0) == 'b' || text.charAt(0) == 'B')) {
            prefix = "b";
            text = text.substring(1);
        }
        for (String quote : List.of("\"\"\"", "'''", "\"", "'")) {
            if (text.length() >= 2 * quote.length() && text.startsWith(quote) && text.endsWith(quote)) {
                String content = text.substring(quote.length(), text.length() - quote.length());
                return ValueSignature.literal(prefix + "'" + content + "'");
            }
        }
        return ValueSignature.literal(declaredDefault.trim());
    }
}
