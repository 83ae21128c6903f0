package com.usageprofile.counter.checkpoint;

import com.google.gson.annotations.SerializedName;
import com.usageprofile.counter.aggregate.AggregateModel;

/**
 * On-disk checkpoint of one source file.
 * Field names use @SerializedName for JSON snake_case mapping.
 */
public class CheckpointRecord {

    public static final int FORMAT_VERSION = 1;

    @SerializedName("format_version") public int formatVersion;
    @SerializedName("path")           public String path;
    @SerializedName("fingerprint")    public String fingerprint;
    @SerializedName("analysis_key")   public String analysisKey;
    @SerializedName("processed")      public boolean processed;
    @SerializedName("status")         public FileStatus status;
    @SerializedName("aggregate")      public AggregateModel.UsageDocument aggregate;
}
