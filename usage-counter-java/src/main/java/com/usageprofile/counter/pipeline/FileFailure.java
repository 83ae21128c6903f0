package com.usageprofile.counter.pipeline;

import com.google.gson.annotations.SerializedName;

/**
 * A per-file problem recorded in the run summary. None of them stops the run.
 */
public record FileFailure(Kind kind, String path, String message) {

    public enum Kind {
        /** The file could not be read or decoded; it is retried on the next run. */
        @SerializedName("read_error")       READ_ERROR,
        /** The file does not parse; it contributes nothing. */
        @SerializedName("parse_error")      PARSE_ERROR,
        /** The file was analyzed but its checkpoint could not be written. */
        @SerializedName("checkpoint_write") CHECKPOINT_WRITE_ERROR,
        /** Analysis failed unexpectedly; nothing is recorded and the file is retried on the next run. */
        @SerializedName("analysis_error")   ANALYSIS_ERROR
    }
}
