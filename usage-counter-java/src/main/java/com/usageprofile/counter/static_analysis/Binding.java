package com.usageprofile.counter.static_analysis;

import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * What a local name refers to at a point of the program.
 */
public sealed interface Binding {

    /** The name refers to a module or module member, e.g. {@code np -> numpy}. */
    record Origin(String qualifiedName) implements Binding {}

    /** The name holds an object constructed from the given class. */
    record Instance(String className) implements Binding {}

    /** The name was rebound to something the analysis does not follow. */
    record Shadowed() implements Binding {}

    /** Different control-flow paths bind the name to different origins. */
    record Ambiguous(SortedSet<String> origins) implements Binding {
        public Ambiguous {
            origins = Collections.unmodifiableSortedSet(new TreeSet<>(origins));
        }
    }

    Binding SHADOWED = new Shadowed();

    /** Binding that extends this one by an attribute path such as {@code linalg.norm}. */
    default Binding member(String attributePath) {
        if (this instanceof Origin o) {
            return new Origin(o.qualifiedName() + "." + attributePath);
        }
        if (this instanceof Instance i) {
            return new Origin(i.className() + "." + attributePath);
        }
        if (this instanceof Ambiguous a) {
            SortedSet<String> extended = new TreeSet<>();
            for (String origin : a.origins()) extended.add(origin + "." + attributePath);
            return new Ambiguous(extended);
        }
        return SHADOWED;
    }
}
