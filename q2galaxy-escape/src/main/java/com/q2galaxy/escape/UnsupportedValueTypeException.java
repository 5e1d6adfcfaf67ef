package com.q2galaxy.escape;

/**
 * Thrown when the escape codec receives a value that is neither text nor one of the three sentinels
 * (absent, true, false). Numbers are not coerced to text.
 */
public final class UnsupportedValueTypeException extends IllegalArgumentException {

    private final String valueType;

    public UnsupportedValueTypeException(Object value) {
        super("Unsupported value type for escaping: " + value.getClass().getName() + " (value: " + value + ")");
        this.valueType = value.getClass().getName();
    }

    /** Fully qualified class name of the rejected value. */
    public String getValueType() {
        return valueType;
    }
}
