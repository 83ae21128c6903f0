package com.usageprofile.counter.aggregate;

import com.google.gson.annotations.SerializedName;
import java.util.List;
import java.util.Map;

/**
 * JSON shape of an aggregate, shared by usages.json and checkpoint records.
 * Field names use @SerializedName for JSON snake_case mapping.
 */
public final class AggregateModel {

    private AggregateModel() {}

    public static class UsageDocument {
        @SerializedName("call_counts")          public Map<String, Long> callCounts;
        /** qualified name -> parameter -> signature key -> count */
        @SerializedName("parameter_histograms") public Map<String, Map<String, Map<String, Long>>> parameterHistograms;
        /** qualified name -> locations of its calls */
        @SerializedName("occurrences")          public Map<String, List<Location>> occurrences;
        @SerializedName("unresolved_calls")     public long unresolvedCalls;
    }

    public static class Location {
        @SerializedName("path")   public String path;
        @SerializedName("line")   public int line;
        @SerializedName("column") public int column;
    }
}
