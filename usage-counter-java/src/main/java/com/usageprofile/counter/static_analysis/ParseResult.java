package com.usageprofile.counter.static_analysis;

/**
 * Outcome of parsing one file.
 */
public sealed interface ParseResult {

    record Parsed(ParsedSource source) implements ParseResult {}

    /** The file is not analyzable; line and column point at the first problem, or are 0. */
    record Failed(String path, int line, int column, String message) implements ParseResult {
        @Override
        public String toString() {
            return path + ":" + line + ":" + column + ": " + message;
        }
    }
}
