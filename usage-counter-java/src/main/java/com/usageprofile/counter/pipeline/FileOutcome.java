package com.usageprofile.counter.pipeline;

import com.usageprofile.counter.aggregate.PartialAggregate;
import com.usageprofile.counter.checkpoint.FileStatus;

import java.util.List;

/**
 * Result of processing one corpus file.
 *
 * @param status  how analysis ended, or null if the file could not be read or analyzed
 * @param resumed true if the result was taken from a checkpoint
 */
public record FileOutcome(String path, FileStatus status, boolean resumed,
                          PartialAggregate aggregate, List<FileFailure> failures) {

    public FileOutcome {
        failures = List.copyOf(failures);
    }

    static FileOutcome unreadable(String path, String message) {
        return new FileOutcome(path, null, false, PartialAggregate.empty(),
                List.of(new FileFailure(FileFailure.Kind.READ_ERROR, path, message)));
    }

    static FileOutcome failed(String path, String message) {
        return new FileOutcome(path, null, false, PartialAggregate.empty(),
                List.of(new FileFailure(FileFailure.Kind.ANALYSIS_ERROR, path, message)));
    }
}
