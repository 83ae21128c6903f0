package com.usageprofile.counter.improve;

import com.google.gson.annotations.SerializedName;

import java.util.ArrayList;
import java.util.List;

/**
 * Contents of improvement_candidates.json.
 * Field names use @SerializedName for JSON snake_case mapping.
 */
public class ImprovementCandidates {

    public static final String CANDIDATES_FILE = "improvement_candidates.json";

    @SerializedName("min_usages")              public int minUsages;
    @SerializedName("rarely_called")           public List<RareElement> rarelyCalled = new ArrayList<>();
    @SerializedName("rare_values")             public List<RareValue> rareValues = new ArrayList<>();
    @SerializedName("parameter_customization") public List<ParameterCustomization> parameterCustomization = new ArrayList<>();
    @SerializedName("used_classes")            public List<ClassUsage> usedClasses = new ArrayList<>();
    @SerializedName("unused_classes")          public List<String> unusedClasses = new ArrayList<>();

    public static class RareElement {
        @SerializedName("element") public String element;
        @SerializedName("calls")   public long calls;
        /** Sorted files that would be affected by removing the element. */
        @SerializedName("affected_files") public List<String> affectedFiles = new ArrayList<>();
    }

    public static class RareValue {
        @SerializedName("element")   public String element;
        @SerializedName("parameter") public String parameter;
        @SerializedName("value")     public String value;
        @SerializedName("count")     public long count;
    }

    public static class ParameterCustomization {
        @SerializedName("element")          public String element;
        @SerializedName("parameter")        public String parameter;
        @SerializedName("declared_default") public String declaredDefault;  // nullable
        @SerializedName("calls")            public long calls;
        /** Calls that passed a value other than the declared default. */
        @SerializedName("customized")       public long customized;
    }

    public static class ClassUsage {
        @SerializedName("class") public String className;
        @SerializedName("calls") public long calls;
    }
}
