package com.usageprofile.counter.aggregate;

import java.util.Comparator;

/**
 * Where a resolved call was found.
 *
 * @param path   corpus-relative path of the source file
 * @param line   1-based line
 * @param column 1-based column
 */
public record Occurrence(String path, int line, int column) implements Comparable<Occurrence> {

    private static final Comparator<Occurrence> ORDER = Comparator.comparing(Occurrence::path)
            .thenComparingInt(Occurrence::line)
            .thenComparingInt(Occurrence::column);

    public Occurrence {
        if (path == null) throw new IllegalArgumentException("Occurrence without a path");
        if (line < 1 || column < 1) {
            throw new IllegalArgumentException("Invalid position " + path + ":" + line + ":" + column);
        }
    }

    @Override
    public int compareTo(Occurrence other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return path + ":" + line + ":" + column;
    }
}
