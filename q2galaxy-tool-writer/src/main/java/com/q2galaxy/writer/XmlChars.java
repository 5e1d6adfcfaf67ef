package com.q2galaxy.writer;

/**
 * Checks that text is representable in an XML 1.0 document. The StAX writer escapes markup characters but passes
 * control characters, unpaired surrogates and {@code --} inside comments through, which would yield a file no
 * parser accepts.
 */
final class XmlChars {

    private XmlChars() {
    }

    /**
     * @throws ToolWriteException if {@code value} holds a character outside the XML 1.0 {@code Char} production
     */
    static String requireText(String value, String where) {
        int i = 0;
        while (i < value.length()) {
            char c = value.charAt(i);
            if (Character.isHighSurrogate(c) && i + 1 < value.length() && Character.isLowSurrogate(value.charAt(i + 1))) {
                i += 2;
                continue;
            }
            if (!isXmlChar(c)) {
                throw new ToolWriteException(String.format(
                        "Character U+%04X at index %d of %s is not allowed in XML", (int) c, i, where));
            }
            i++;
        }
        return value;
    }

    /**
     * @throws ToolWriteException if {@code body} contains {@code --}, ends with {@code -} or holds a non-XML character
     */
    static String requireComment(String body, String where) {
        requireText(body, where);
        if (body.contains("--") || body.endsWith("-")) {
            throw new ToolWriteException("Comment body of " + where + " must not contain '--' or end with '-'");
        }
        return body;
    }

    private static boolean isXmlChar(char c) {
        return c == '\t' || c == '\n' || c == '\r'
                || (c >= 0x20 && c <= 0xD7FF)
                || (c >= 0xE000 && c <= 0xFFFD);
    }
}
