package com.usageprofile.counter.static_analysis;

import java.util.List;

/**
 * One call expression of a source file.
 *
 * @param line   1-based line of the call
 * @param column 1-based column of the call
 */
public record CallSite(String file, int line, int column, CallTarget target, List<CallArgument> arguments) {

    public CallSite {
        arguments = List.copyOf(arguments);
    }
}
