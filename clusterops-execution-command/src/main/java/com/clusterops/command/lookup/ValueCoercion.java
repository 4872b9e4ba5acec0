package com.clusterops.command.lookup;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Typed views of a raw lookup. Absent stays absent; a present value that does not fit becomes
 * {@link LookupResult.Status#WRONG_TYPE} (or {@link LookupResult.Status#OUT_OF_RANGE} for integers too large for
 * an int). Callers decide whether that raises or falls back to a default.
 */
public final class ValueCoercion {

    static final String TEXT = "string";
    static final String INTEGER = "integer";
    static final String BOOLEAN = "boolean";
    static final String STRING_LIST = "list of strings";

    private static final Pattern INTEGER_TEXT = Pattern.compile("[+-]?\\d+");

    private ValueCoercion() {
    }

    /** Any scalar renders as its text ({@code 8080} → "8080", {@code true} → "true"). Objects and arrays do not. */
    public static LookupResult<String> toText(LookupResult<JsonNode> raw) {
        if (!raw.isFound()) return passThrough(raw);
        JsonNode node = raw.orElse(null);
        if (!node.isValueNode()) {
            return LookupResult.wrongType(raw.getPath(), node, TEXT);
        }
        return LookupResult.found(raw.getPath(), node.asText());
    }

    /**
     * Any JSON number in int range, truncated toward zero ({@code 8.0} → 8, {@code 1.5} → 1); text holding a
     * decimal integer (surrounding whitespace ignored); booleans as 1 and 0.
     * Numbers and integer text beyond int range are {@link LookupResult.Status#OUT_OF_RANGE}. Other text
     * (including {@code "8.0"}), objects and arrays are the wrong type.
     */
    public static LookupResult<Integer> toInteger(LookupResult<JsonNode> raw) {
        if (!raw.isFound()) return passThrough(raw);
        JsonNode node = raw.orElse(null);
        if (node.isBoolean()) {
            return LookupResult.found(raw.getPath(), node.booleanValue() ? 1 : 0);
        }
        if (node.isNumber()) {
            if (node.isFloatingPointNumber() && !Double.isFinite(node.doubleValue())) {
                return LookupResult.wrongType(raw.getPath(), node, INTEGER);
            }
            if (node.canConvertToInt()) {
                return LookupResult.found(raw.getPath(), node.intValue());
            }
            return LookupResult.outOfRange(raw.getPath(), node, INTEGER);
        }
        if (node.isTextual()) {
            String s = node.textValue().trim();
            try {
                return LookupResult.found(raw.getPath(), Integer.parseInt(s));
            } catch (NumberFormatException e) {
                if (INTEGER_TEXT.matcher(s).matches()) {
                    return LookupResult.outOfRange(raw.getPath(), node, INTEGER);
                }
                return LookupResult.wrongType(raw.getPath(), node, INTEGER);
            }
        }
        return LookupResult.wrongType(raw.getPath(), node, INTEGER);
    }

    /** JSON booleans, text "true"/"false"/"1"/"0" (case-insensitive), or the numbers 1 and 0. */
    public static LookupResult<Boolean> toBoolean(LookupResult<JsonNode> raw) {
        if (!raw.isFound()) return passThrough(raw);
        JsonNode node = raw.orElse(null);
        if (node.isBoolean()) {
            return LookupResult.found(raw.getPath(), node.booleanValue());
        }
        if (node.isTextual()) {
            String s = node.textValue().trim().toLowerCase();
            if ("true".equals(s) || "1".equals(s)) return LookupResult.found(raw.getPath(), true);
            if ("false".equals(s) || "0".equals(s)) return LookupResult.found(raw.getPath(), false);
        }
        if (node.isIntegralNumber() && node.canConvertToInt()) {
            int n = node.intValue();
            if (n == 1) return LookupResult.found(raw.getPath(), true);
            if (n == 0) return LookupResult.found(raw.getPath(), false);
        }
        return LookupResult.wrongType(raw.getPath(), node, BOOLEAN);
    }

    /** A JSON array of scalars; each element rendered as text. */
    public static LookupResult<List<String>> toStringList(LookupResult<JsonNode> raw) {
        if (!raw.isFound()) return passThrough(raw);
        JsonNode node = raw.orElse(null);
        if (!node.isArray()) {
            return LookupResult.wrongType(raw.getPath(), node, STRING_LIST);
        }
        List<String> values = new ArrayList<>(node.size());
        for (JsonNode element : node) {
            if (!element.isValueNode() || element.isNull()) {
                return LookupResult.wrongType(raw.getPath(), node, STRING_LIST);
            }
            values.add(element.asText());
        }
        return LookupResult.found(raw.getPath(), Collections.unmodifiableList(values));
    }

    private static <T> LookupResult<T> passThrough(LookupResult<JsonNode> raw) {
        if (raw.isOutOfRange()) {
            return LookupResult.outOfRange(raw.getPath(), raw.getRawValue(), raw.getExpectedType());
        }
        if (raw.isWrongType()) {
            return LookupResult.wrongType(raw.getPath(), raw.getRawValue(), raw.getExpectedType());
        }
        return LookupResult.absent(raw.getPath());
    }
}
