package com.usageprofile.counter.api;

/**
 * One formal parameter of a callable API element.
 *
 * @param name         parameter name as declared
 * @param kind         binding category of the parameter
 * @param defaultValue source text of the declared default, or null if the parameter has none
 */
public record ApiParameter(String name, Kind kind, String defaultValue) {

    public enum Kind {
        POSITIONAL_ONLY,
        POSITIONAL_OR_KEYWORD,
        KEYWORD_ONLY,
        VAR_POSITIONAL,
        VAR_KEYWORD;

        public static Kind fromJson(String value) {
            if (value == null) return POSITIONAL_OR_KEYWORD;
            return switch (value) {
                case "positional_only" -> POSITIONAL_ONLY;
                case "positional_or_keyword" -> POSITIONAL_OR_KEYWORD;
                case "keyword_only" -> KEYWORD_ONLY;
                case "var_positional" -> VAR_POSITIONAL;
                case "var_keyword" -> VAR_KEYWORD;
                default -> throw new IllegalArgumentException("Unknown parameter kind: " + value);
            };
        }
    }

    public boolean hasDefault() {
        return defaultValue != null;
    }

    public boolean isVariadic() {
        return kind == Kind.VAR_POSITIONAL || kind == Kind.VAR_KEYWORD;
    }

    /** True if a positional argument can bind to this parameter. */
    public boolean acceptsPositional() {
        return kind == Kind.POSITIONAL_ONLY || kind == Kind.POSITIONAL_OR_KEYWORD;
    }

    /** True if a keyword argument with this parameter's name can bind to it. */
    public boolean acceptsKeyword() {
        return kind == Kind.POSITIONAL_OR_KEYWORD || kind == Kind.KEYWORD_ONLY;
    }
}
