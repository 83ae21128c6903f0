package com.usageprofile.counter.aggregate;

import java.util.Objects;

/**
 * Coarse classification of the value bound to a parameter at one call site.
 *
 * Serialized form ({@link #key()}): {@code literal:<text>}, {@code kind:<shape>},
 * {@code default} or {@code unknown}.
 */
public record ValueSignature(Type type, String detail) {

    public enum Type {
        /** Hashable simple literal, recorded with its value. */
        LITERAL,
        /** Container or other literal-like expression, recorded by shape only. */
        LITERAL_KIND,
        /** Argument omitted and the parameter declares a default. */
        USES_DEFAULT,
        /** Non-literal expression, or a value that could not be determined. */
        UNKNOWN
    }

    private static final String LITERAL_PREFIX = "literal:";
    private static final String KIND_PREFIX = "kind:";

    public static final ValueSignature USES_DEFAULT = new ValueSignature(Type.USES_DEFAULT, null);
    public static final ValueSignature UNKNOWN = new ValueSignature(Type.UNKNOWN, null);

    public ValueSignature {
        Objects.requireNonNull(type, "type");
        if ((type == Type.LITERAL || type == Type.LITERAL_KIND) && detail == null) {
            throw new IllegalArgumentException(type + " signature requires a detail");
        }
        if (type == Type.USES_DEFAULT || type == Type.UNKNOWN) {
            detail = null;
        }
    }

    public static ValueSignature literal(String text) {
        return new ValueSignature(Type.LITERAL, text);
    }

    public static ValueSignature kind(String shape) {
        return new ValueSignature(Type.LITERAL_KIND, shape);
    }

    public String key() {
        return switch (type) {
            case LITERAL -> LITERAL_PREFIX + detail;
            case LITERAL_KIND -> KIND_PREFIX + detail;
            case USES_DEFAULT -> "default";
            case UNKNOWN -> "unknown";
        };
    }

    /** Inverse of {@link #key()}. */
    public static ValueSignature parse(String key) {
        if (key.startsWith(LITERAL_PREFIX)) return literal(key.substring(LITERAL_PREFIX.length()));
        if (key.startsWith(KIND_PREFIX)) return kind(key.substring(KIND_PREFIX.length()));
        if (key.equals("default")) return USES_DEFAULT;
        if (key.equals("unknown")) return UNKNOWN;
        throw new IllegalArgumentException("Not a value signature: " + key);
    }

    @Override
    public String toString() {
        return key();
    }
}
