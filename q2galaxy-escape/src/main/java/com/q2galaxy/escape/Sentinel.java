package com.q2galaxy.escape;

/**
 * Fixed tokens for the non-string scalar values. Decoding matches a whole string against these tokens
 * before any character unescaping.
 */
public enum Sentinel {
    ABSENT("__q2galaxy__::literal::None", GalaxyValue.ABSENT),
    TRUE("__q2galaxy__::literal::True", GalaxyValue.TRUE),
    FALSE("__q2galaxy__::literal::False", GalaxyValue.FALSE);

    private final String token;
    private final GalaxyValue value;

    Sentinel(String token, GalaxyValue value) {
        this.token = token;
        this.value = value;
    }

    public String getToken() {
        return token;
    }

    public GalaxyValue getValue() {
        return value;
    }

    /** Sentinel for the given value, or null when the value is text. */
    public static Sentinel forValue(GalaxyValue value) {
        for (Sentinel s : values()) {
            if (s.value == value) return s;
        }
        return null;
    }

    /** Sentinel whose token equals the whole input, or null. */
    public static Sentinel forToken(String token) {
        for (Sentinel s : values()) {
            if (s.token.equals(token)) return s;
        }
        return null;
    }
}
