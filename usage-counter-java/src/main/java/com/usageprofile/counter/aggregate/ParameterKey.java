package com.usageprofile.counter.aggregate;

/** Identifies one parameter histogram: the owning element and the parameter (or bucket) name. */
public record ParameterKey(String element, String parameter) {}
