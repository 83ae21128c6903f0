package com.usageprofile.counter.static_analysis;

import com.usageprofile.counter.aggregate.ValueSignature;

/**
 * One argument as written at a call site.
 *
 * @param keyword parameter name for {@link Kind#KEYWORD} arguments, otherwise null
 */
public record CallArgument(Kind kind, String keyword, ValueSignature value) {

    public enum Kind { POSITIONAL, KEYWORD, LIST_SPLAT, DICT_SPLAT }

    public static CallArgument positional(ValueSignature value) {
        return new CallArgument(Kind.POSITIONAL, null, value);
    }

    public static CallArgument keyword(String name, ValueSignature value) {
        return new CallArgument(Kind.KEYWORD, name, value);
    }

    /** {@code *xs} */
    public static CallArgument listSplat() {
        return new CallArgument(Kind.LIST_SPLAT, null, ValueSignature.UNKNOWN);
    }

    /** {@code **kw} */
    public static CallArgument dictSplat() {
        return new CallArgument(Kind.DICT_SPLAT, null, ValueSignature.UNKNOWN);
    }
}
