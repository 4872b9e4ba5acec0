package com.clusterops.command.lookup;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of looking up and coercing one field: found, absent, present with a value that does not
 * coerce to the requested type, or present with a value of the right type that does not fit in it.
 *
 * @param <T> value type after coercion
 */
public final class LookupResult<T> {

    public enum Status {
        FOUND,
        ABSENT,
        WRONG_TYPE,
        OUT_OF_RANGE
    }

    private final FieldPath path;
    private final Status status;
    private final T value;
    private final JsonNode rawValue;
    private final String expectedType;

    private LookupResult(FieldPath path, Status status, T value, JsonNode rawValue, String expectedType) {
        this.path = Objects.requireNonNull(path, "path");
        this.status = status;
        this.value = value;
        this.rawValue = rawValue;
        this.expectedType = expectedType;
    }

    public static <T> LookupResult<T> found(FieldPath path, T value) {
        return new LookupResult<>(path, Status.FOUND, Objects.requireNonNull(value, "value"), null, null);
    }

    public static <T> LookupResult<T> absent(FieldPath path) {
        return new LookupResult<>(path, Status.ABSENT, null, null, null);
    }

    public static <T> LookupResult<T> wrongType(FieldPath path, JsonNode rawValue, String expectedType) {
        return new LookupResult<>(path, Status.WRONG_TYPE, null, rawValue, expectedType);
    }

    public static <T> LookupResult<T> outOfRange(FieldPath path, JsonNode rawValue, String expectedType) {
        return new LookupResult<>(path, Status.OUT_OF_RANGE, null, rawValue, expectedType);
    }

    public FieldPath getPath() {
        return path;
    }

    public Status getStatus() {
        return status;
    }

    public boolean isFound() {
        return status == Status.FOUND;
    }

    public boolean isAbsent() {
        return status == Status.ABSENT;
    }

    public boolean isWrongType() {
        return status == Status.WRONG_TYPE;
    }

    public boolean isOutOfRange() {
        return status == Status.OUT_OF_RANGE;
    }

    /** The value as stored in the document when it failed to coerce; null otherwise. */
    public JsonNode getRawValue() {
        return rawValue;
    }

    /** Type name the value failed to coerce to; null when found or absent. */
    public String getExpectedType() {
        return expectedType;
    }

    /** Coerced value, or {@code defaultValue} when absent or not coercible. */
    public T orElse(T defaultValue) {
        return status == Status.FOUND ? value : defaultValue;
    }

    /** Coerced value if found; empty when absent or not coercible. */
    public Optional<T> asOptional() {
        return Optional.ofNullable(status == Status.FOUND ? value : null);
    }

    /**
     * Coerced value if found, empty when absent.
     *
     * @throws ValueCoercionException when the value is present but of the wrong type
     * @throws ValueOutOfRangeException when the value is present but does not fit the type
     */
    public Optional<T> optionalOrThrow() {
        if (status == Status.WRONG_TYPE) {
            throw new ValueCoercionException(path.toString(), rawValue, expectedType);
        }
        if (status == Status.OUT_OF_RANGE) {
            throw new ValueOutOfRangeException(path.toString(), rawValue, expectedType);
        }
        return asOptional();
    }

    @Override
    public String toString() {
        switch (status) {
            case FOUND:
                return "LookupResult{" + path + " = " + value + "}";
            case WRONG_TYPE:
                return "LookupResult{" + path + " not a " + expectedType + ": " + rawValue + "}";
            case OUT_OF_RANGE:
                return "LookupResult{" + path + " out of " + expectedType + " range: " + rawValue + "}";
            default:
                return "LookupResult{" + path + " absent}";
        }
    }
}
