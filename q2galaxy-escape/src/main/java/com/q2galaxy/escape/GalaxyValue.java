package com.q2galaxy.escape;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;

import java.util.Objects;

/**
 * Scalar value handed to the escape codec: one of the three sentinels (absent, true, false) or a text value.
 * The sentinels are singletons, so {@code ==} and {@link #equals(Object)} agree for them; text values compare by content.
 * A text value spelled "True" or "None" is never a sentinel.
 */
@JsonSerialize(using = GalaxyValueSerializer.class)
@JsonDeserialize(using = GalaxyValueDeserializer.class)
public final class GalaxyValue {

    /** Kind of scalar. */
    public enum Kind {
        ABSENT,
        TRUE,
        FALSE,
        TEXT
    }

    public static final GalaxyValue ABSENT = new GalaxyValue(Kind.ABSENT, null);
    public static final GalaxyValue TRUE = new GalaxyValue(Kind.TRUE, null);
    public static final GalaxyValue FALSE = new GalaxyValue(Kind.FALSE, null);

    private final Kind kind;
    private final String text;

    private GalaxyValue(Kind kind, String text) {
        this.kind = kind;
        this.text = text;
    }

    /** Text value; {@code text} must not be null (use {@link #ABSENT} for no value). */
    public static GalaxyValue text(String text) {
        return new GalaxyValue(Kind.TEXT, Objects.requireNonNull(text, "text"));
    }

    /** Returns {@link #TRUE} or {@link #FALSE}. */
    public static GalaxyValue of(boolean value) {
        return value ? TRUE : FALSE;
    }

    /**
     * Converts a loosely-typed scalar: {@code null} → {@link #ABSENT}, {@link Boolean} → TRUE/FALSE,
     * {@link String} → text, {@link GalaxyValue} → itself.
     *
     * @throws UnsupportedValueTypeException for any other type (numbers included)
     */
    public static GalaxyValue from(Object value) {
        if (value == null) return ABSENT;
        if (value instanceof GalaxyValue) return (GalaxyValue) value;
        if (value instanceof String) return text((String) value);
        if (value instanceof Boolean) return of((Boolean) value);
        throw new UnsupportedValueTypeException(value);
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isText() {
        return kind == Kind.TEXT;
    }

    public boolean isSentinel() {
        return kind != Kind.TEXT;
    }

    /**
     * Text content of a TEXT value.
     *
     * @throws IllegalStateException if this value is a sentinel
     */
    public String asText() {
        if (kind != Kind.TEXT) {
            throw new IllegalStateException("Not a text value: " + kind);
        }
        return text;
    }

    /** Loosely-typed form: {@code null}, {@link Boolean#TRUE}, {@link Boolean#FALSE} or the text. */
    public Object toObject() {
        switch (kind) {
            case ABSENT:
                return null;
            case TRUE:
                return Boolean.TRUE;
            case FALSE:
                return Boolean.FALSE;
            default:
                return text;
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        GalaxyValue that = (GalaxyValue) o;
        return kind == that.kind && Objects.equals(text, that.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, text);
    }

    @Override
    public String toString() {
        return kind == Kind.TEXT ? "GalaxyValue{text='" + text + "'}" : "GalaxyValue{" + kind + "}";
    }
}
