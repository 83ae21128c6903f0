package com.usageprofile.counter.static_analysis;

/**
 * The API element a call site refers to, or why none could be determined.
 */
public sealed interface CallTarget {

    enum Reason {
        /** The callee's root name is bound nowhere in sight. */
        UNBOUND_NAME,
        /** The callee's root name was rebound by a non-import expression. */
        SHADOWED_NAME,
        /** Control-flow paths bind the callee's root name to different origins. */
        AMBIGUOUS_BINDING,
        /** Several wildcard imports could provide the name. */
        AMBIGUOUS_WILDCARD,
        /** The composed name is not a callable of the API description. */
        NOT_IN_API,
        /** The callee is not a name or an attribute chain rooted at a name. */
        DYNAMIC_CALLEE,
        /** A class is called but the API description lists no constructor for it. */
        NO_CONSTRUCTOR
    }

    record Resolved(String element) implements CallTarget {}

    record Unresolved(Reason reason) implements CallTarget {}

    default boolean isResolved() {
        return this instanceof Resolved;
    }
}
