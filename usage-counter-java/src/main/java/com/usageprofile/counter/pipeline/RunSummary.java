package com.usageprofile.counter.pipeline;

import com.google.gson.annotations.SerializedName;
import com.usageprofile.counter.aggregate.PartialAggregate;
import com.usageprofile.counter.checkpoint.FileStatus;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Counts of one run, written to run_summary.json and printed to stderr.
 */
public class RunSummary {

    public static final String SUMMARY_FILE = "run_summary.json";

    @SerializedName("files_total")               public int filesTotal;
    @SerializedName("files_analyzed")            public int filesAnalyzed;
    @SerializedName("files_resumed")             public int filesResumed;
    @SerializedName("files_irrelevant")          public int filesIrrelevant;
    @SerializedName("parse_failures")            public int parseFailures;
    @SerializedName("read_failures")             public int readFailures;
    @SerializedName("checkpoint_write_failures") public int checkpointWriteFailures;
    @SerializedName("analysis_failures")         public int analysisFailures;
    @SerializedName("resolved_calls")            public long resolvedCalls;
    @SerializedName("unresolved_calls")          public long unresolvedCalls;
    @SerializedName("elapsed_ms")                public long elapsedMs;
    @SerializedName("failures")                  public List<FileFailure> failures = new ArrayList<>();

    /** Adds one file's outcome. Resumed files are counted by their recorded status as well. */
    void add(FileOutcome outcome) {
        filesTotal++;
        if (outcome.resumed()) filesResumed++;
        if (outcome.status() == FileStatus.ANALYZED) filesAnalyzed++;
        else if (outcome.status() == FileStatus.IRRELEVANT) filesIrrelevant++;
        for (FileFailure f : outcome.failures()) {
            addFailure(f);
        }
    }

    void addFailure(FileFailure failure) {
        switch (failure.kind()) {
            case READ_ERROR -> readFailures++;
            case PARSE_ERROR -> parseFailures++;
            case CHECKPOINT_WRITE_ERROR -> checkpointWriteFailures++;
            case ANALYSIS_ERROR -> analysisFailures++;
        }
        failures.add(failure);
    }

    void complete(PartialAggregate total, long elapsedMs) {
        this.resolvedCalls = total.resolvedCalls();
        this.unresolvedCalls = total.unresolvedCalls();
        this.elapsedMs = elapsedMs;
        failures.sort(Comparator.comparing(FileFailure::path).thenComparing(f -> f.kind().ordinal()));
    }

    /** Failures of one kind. */
    public List<FileFailure> failures(FileFailure.Kind kind) {
        List<FileFailure> result = new ArrayList<>();
        for (FileFailure f : failures) {
            if (f.kind() == kind) result.add(f);
        }
        return result;
    }

    public void print() {
        System.err.println("[usage-counter] Files: " + filesTotal
                + " (analyzed " + filesAnalyzed
                + ", resumed " + filesResumed
                + ", irrelevant " + filesIrrelevant + ")");
        System.err.println("[usage-counter] Failures: parse " + parseFailures
                + ", read " + readFailures
                + ", checkpoint write " + checkpointWriteFailures
                + ", analysis " + analysisFailures);
        System.err.println("[usage-counter] Calls: resolved " + resolvedCalls
                + ", unresolved " + unresolvedCalls);
        for (FileFailure f : failures) {
            System.err.println("[usage-counter]   " + f.kind() + " " + f.path() + ": " + f.message());
        }
    }
}
