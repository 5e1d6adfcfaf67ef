package com.q2galaxy.escape;

import java.util.List;
import java.util.Objects;

/**
 * Reversible escaping of tool parameter values into the character set Galaxy passes through unmangled.
 * <p>
 * The table mirrors Galaxy's own {@code mapped_chars} plus {@code ','} so that a test parameter never reads as
 * multiple values. Rules are applied in list order when encoding and in the same order when decoding. Sentinels
 * ({@link Sentinel}) bypass the table entirely.
 * <p>
 * Decoding inverts encoding only for text that contains no token and has no {@code '_'} next to an escaped
 * character. Underscores can otherwise merge with a token: {@code "__ob["} encodes to {@code "__ob__ob__"}, which
 * decodes to {@code "[ob__"}. Galaxy's own mapping has the same limit.
 */
public final class GalaxyEscape {

    /** Ordered table; the order is part of the format. */
    public static final List<EscapeRule> ESCAPE_TABLE = List.of(
            new EscapeRule('[', "__ob__"),
            new EscapeRule(']', "__cb__"),
            new EscapeRule('>', "__gt__"),
            new EscapeRule('<', "__lt__"),
            new EscapeRule('\'', "__sq__"),
            new EscapeRule('"', "__dq__"),
            new EscapeRule('{', "__oc__"),
            new EscapeRule('}', "__cc__"),
            new EscapeRule('@', "__at__"),
            new EscapeRule('\n', "__cn__"),
            new EscapeRule('\r', "__cr__"),
            new EscapeRule('\t', "__tc__"),
            new EscapeRule('#', "__pd__"),
            new EscapeRule(',', "__comma__")
    );

    private GalaxyEscape() {
    }

    /**
     * Encodes a value: sentinels map to their fixed token, text runs through {@link #ESCAPE_TABLE}.
     *
     * @param value value to encode; must not be null (use {@link GalaxyValue#ABSENT})
     * @return escaped text or sentinel token
     */
    public static String encode(GalaxyValue value) {
        Objects.requireNonNull(value, "value");
        Sentinel sentinel = Sentinel.forValue(value);
        if (sentinel != null) {
            return sentinel.getToken();
        }
        String s = value.asText();
        for (EscapeRule rule : ESCAPE_TABLE) {
            s = rule.escape(s);
        }
        return s;
    }

    /**
     * Encodes a loosely-typed value ({@code null}, {@link Boolean}, {@link String} or {@link GalaxyValue}).
     *
     * @throws UnsupportedValueTypeException for any other type
     */
    public static String encode(Object value) {
        return encode(GalaxyValue.from(value));
    }

    /** Convenience for text; same as {@code encode(GalaxyValue.text(text))}. */
    public static String escape(String text) {
        return encode(GalaxyValue.text(text));
    }

    /**
     * Decodes a token or escaped text. A whole-string sentinel match wins; otherwise each rule is reversed in
     * table order.
     */
    public static GalaxyValue decode(String encoded) {
        Objects.requireNonNull(encoded, "encoded");
        Sentinel sentinel = Sentinel.forToken(encoded);
        if (sentinel != null) {
            return sentinel.getValue();
        }
        String s = encoded;
        for (EscapeRule rule : ESCAPE_TABLE) {
            s = rule.unescape(s);
        }
        return GalaxyValue.text(s);
    }

    /** Decodes to {@code null}, {@link Boolean#TRUE}, {@link Boolean#FALSE} or a {@link String}. */
    public static Object unescape(String encoded) {
        return decode(encoded).toObject();
    }
}
