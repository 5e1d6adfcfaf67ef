package com.q2galaxy.escape;

/**
 * One row of the escape table: every occurrence of {@code character} is replaced by {@code token}.
 */
public record EscapeRule(char character, String token) {

    public EscapeRule {
        if (token == null || token.isEmpty()) {
            throw new IllegalArgumentException("token must be non-empty");
        }
    }

    String escape(String s) {
        return s.replace(String.valueOf(character), token);
    }

    String unescape(String s) {
        return s.replace(token, String.valueOf(character));
    }
}
