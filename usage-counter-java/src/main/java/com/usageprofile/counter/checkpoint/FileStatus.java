package com.usageprofile.counter.checkpoint;

import com.google.gson.annotations.SerializedName;

/** How the analysis of a checkpointed file ended. */
public enum FileStatus {
    @SerializedName("analyzed")    ANALYZED,
    @SerializedName("parse_error") PARSE_ERROR,
    /** Mentions none of the relevant packages; skipped without parsing. */
    @SerializedName("irrelevant")  IRRELEVANT
}
