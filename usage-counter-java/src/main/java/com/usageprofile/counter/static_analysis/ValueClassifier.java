package com.usageprofile.counter.static_analysis;

import com.usageprofile.counter.aggregate.ValueSignature;
import org.treesitter.TSNode;

import java.nio.charset.StandardCharsets;
import java.util.Locale;

import static com.usageprofile.counter.static_analysis.PythonNodeTypes.*;

/**
 * Maps an argument expression to its {@link ValueSignature}.
 *
 * Strings are recorded with their source content between the quotes, re-quoted with
 * single quotes so that {@code "a"} and {@code 'a'} count as the same value. Bytes keep
 * their {@code b} prefix. Escape sequences are not interpreted.
 */
public final class ValueClassifier {

    private ValueClassifier() {}

    public static ValueSignature classify(TSNode node, ParsedSource src) {
        switch (node.getType()) {
            case INTEGER:
            case FLOAT:
                return ValueSignature.literal(src.text(node));
            case TRUE:
                return ValueSignature.literal("True");
            case FALSE:
                return ValueSignature.literal("False");
            case NONE:
                return ValueSignature.literal("None");
            case ELLIPSIS:
                return ValueSignature.literal("...");
            case STRING:
                return classifyString(node, src);
            case CONCATENATED_STRING:
                return classifyConcatenation(node, src);
            case UNARY_OPERATOR:
                return classifySigned(node, src);
            case PARENTHESIZED: {
                TSNode inner = firstNamed(node);
                return inner == null ? ValueSignature.kind("tuple") : classify(inner, src);
            }
            case LIST:
                return ValueSignature.kind("list");
            case TUPLE:
                return ValueSignature.kind("tuple");
            case DICTIONARY:
                return ValueSignature.kind("dict");
            case SET:
                return ValueSignature.kind("set");
            case LIST_COMPREHENSION:
                return ValueSignature.kind("list_comprehension");
            case DICTIONARY_COMPREHENSION:
                return ValueSignature.kind("dict_comprehension");
            case SET_COMPREHENSION:
                return ValueSignature.kind("set_comprehension");
            case GENERATOR_EXPRESSION:
                return ValueSignature.kind("generator");
            case LAMBDA:
                return ValueSignature.kind("lambda");
            default:
                return ValueSignature.UNKNOWN;
        }
    }

    private static ValueSignature classifySigned(TSNode node, ParsedSource src) {
        TSNode operator = node.getChildByFieldName("operator");
        TSNode argument = node.getChildByFieldName("argument");
        if (operator.isNull() || argument.isNull()) return ValueSignature.UNKNOWN;
        String op = src.text(operator);
        String type = argument.getType();
        if ((op.equals("-") || op.equals("+")) && (type.equals(INTEGER) || type.equals(FLOAT))) {
            String digits = src.text(argument);
            return ValueSignature.literal(op.equals("-") ? "-" + digits : digits);
        }
        return ValueSignature.UNKNOWN;
    }

    private static ValueSignature classifyString(TSNode node, ParsedSource src) {
        StringPart part = stringPart(node, src);
        if (part == null) return ValueSignature.UNKNOWN;
        if (part.formatted) return ValueSignature.kind("f-string");
        return ValueSignature.literal((part.bytes ? "b'" : "'") + part.content + "'");
    }

    private static ValueSignature classifyConcatenation(TSNode node, ParsedSource src) {
        StringBuilder joined = new StringBuilder();
        Boolean bytes = null;
        for (int i = 0; i < node.getNamedChildCount(); i++) {
            TSNode child = node.getNamedChild(i);
            if (!STRING.equals(child.getType())) continue;
            StringPart part = stringPart(child, src);
            if (part == null) return ValueSignature.UNKNOWN;
            if (part.formatted) return ValueSignature.kind("f-string");
            if (bytes == null) bytes = part.bytes;
            joined.append(part.content);
        }
        if (bytes == null) return ValueSignature.UNKNOWN;
        return ValueSignature.literal((bytes ? "b'" : "'") + joined + "'");
    }

    private record StringPart(String content, boolean bytes, boolean formatted) {}

    private static StringPart stringPart(TSNode string, ParsedSource src) {
        TSNode start = null;
        TSNode end = null;
        boolean interpolated = false;
        for (int i = 0; i < string.getChildCount(); i++) {
            TSNode child = string.getChild(i);
            String type = child.getType();
            if (STRING_START.equals(type)) start = child;
            else if (STRING_END.equals(type)) end = child;
            else if (INTERPOLATION.equals(type)) interpolated = true;
        }
        if (start == null || end == null) return null;
        String opening = src.text(start);
        String prefix = opening.replace("\"", "").replace("'", "").toLowerCase(Locale.ROOT);
        String all = src.text(string);
        int from = start.getEndByte() - string.getStartByte();
        int to = end.getStartByte() - string.getStartByte();
        String content = byteSlice(all, from, to);
        return new StringPart(content, prefix.contains("b"), interpolated || prefix.contains("f"));
    }

    /** Substring of {@code text} between UTF-8 byte offsets. */
    private static String byteSlice(String text, int fromByte, int toByte) {
        byte[] utf8 = text.getBytes(StandardCharsets.UTF_8);
        if (fromByte < 0 || toByte > utf8.length || fromByte > toByte) return "";
        return new String(utf8, fromByte, toByte - fromByte, StandardCharsets.UTF_8);
    }

    private static TSNode firstNamed(TSNode node) {
        for (int i = 0; i < node.getNamedChildCount(); i++) {
            TSNode child = node.getNamedChild(i);
            if (!"comment".equals(child.getType())) return child;
        }
        return null;
    }
}
