package com.clusterops.command.lookup;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Thrown when a field holds a number of the requested kind that does not fit the target type,
 * e.g. {@code 12345678901} read as an integer.
 */
public final class ValueOutOfRangeException extends ValueCoercionException {

    public ValueOutOfRangeException(String path, JsonNode rawValue, String expectedType) {
        super(String.format("Value at '%s' is out of %s range: %s", path, expectedType, rawValue),
                path, rawValue, expectedType);
    }
}
