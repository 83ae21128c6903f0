package com.usageprofile.counter.api;

import java.util.List;

/**
 * A named element of the analyzed library's public surface.
 * Parameter lists are empty for modules and classes.
 */
public record ApiElement(String qualifiedName, Kind kind, List<ApiParameter> parameters) {

    public enum Kind { MODULE, CLASS, FUNCTION, METHOD, PARAMETER }

    public ApiElement {
        parameters = parameters == null ? List.of() : List.copyOf(parameters);
    }

    public boolean isCallable() {
        return kind == Kind.FUNCTION || kind == Kind.METHOD;
    }

    /** Last segment of the qualified name. */
    public String simpleName() {
        int dot = qualifiedName.lastIndexOf('.');
        return dot >= 0 ? qualifiedName.substring(dot + 1) : qualifiedName;
    }

    public ApiParameter parameter(String name) {
        for (ApiParameter p : parameters) {
            if (p.name().equals(name)) return p;
        }
        return null;
    }
}
