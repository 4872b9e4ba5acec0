package com.clusterops.command.lookup;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Thrown when a field is present in the command document but its value cannot be coerced to the type the
 * caller asked for (e.g. {@code "java_version": "eight"} read as an integer). Absent fields never raise this.
 */
public class ValueCoercionException extends RuntimeException {

    private final String path;
    private final transient JsonNode rawValue;
    private final String expectedType;

    public ValueCoercionException(String path, JsonNode rawValue, String expectedType) {
        this(String.format("Value at '%s' is not a valid %s: %s", path, expectedType, rawValue),
                path, rawValue, expectedType);
    }

    protected ValueCoercionException(String message, String path, JsonNode rawValue, String expectedType) {
        super(message);
        this.path = path;
        this.rawValue = rawValue;
        this.expectedType = expectedType;
    }

    /** Path of the offending field, e.g. {@code ambariLevelParams/java_version}. */
    public String getPath() {
        return path;
    }

    /** The value as found in the document. */
    public JsonNode getRawValue() {
        return rawValue;
    }

    public String getExpectedType() {
        return expectedType;
    }
}
