package com.clusterops.command.consumer;

import com.clusterops.command.lookup.ValueCoercionException;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Optional;

/**
 * Consumer contract: read-only access to command document values by slash-delimited path
 * (e.g. {@code commandParams/upgrade_type}).
 * <p>
 * Absent fields and malformed intermediates (a scalar where a mapping is expected) are never errors:
 * they yield empty or the supplied default. The one exception is {@link #getIntValue(String)}, which
 * raises {@link ValueCoercionException} when the value is present but not an integer.
 */
public interface CommandValues {

    /**
     * Raw value at the path, or empty if absent or null.
     */
    Optional<JsonNode> getValue(String path);

    /**
     * Raw value at the path, or {@code defaultValue} if any segment is missing. An explicit null along the
     * way is replaced by the default.
     */
    JsonNode getValue(String path, JsonNode defaultValue);

    /**
     * Scalar value as text ({@code 8080} reads as "8080"), or empty if absent or not a scalar.
     */
    Optional<String> getStringValue(String path);

    String getStringValue(String path, String defaultValue);

    /**
     * Integer value; text such as {@code "8"} is parsed, JSON numbers are truncated ({@code 8.0} → 8) and
     * booleans read as 1 or 0.
     *
     * @return the value, or empty if absent
     * @throws ValueCoercionException if present but not an integer
     * @throws com.clusterops.command.lookup.ValueOutOfRangeException if present but beyond int range
     */
    Optional<Integer> getIntValue(String path);

    /**
     * Integer value, or {@code defaultValue} if absent, not an integer or beyond int range.
     */
    int getIntValue(String path, int defaultValue);

    /**
     * Boolean value; accepts JSON booleans and "true"/"false"/"1"/"0". Empty if absent or not a boolean.
     */
    Optional<Boolean> getBooleanValue(String path);

    boolean getBooleanValue(String path, boolean defaultValue);

    /**
     * Array of scalars as strings, or an empty list if absent or not such an array.
     */
    List<String> getStringList(String path);
}
