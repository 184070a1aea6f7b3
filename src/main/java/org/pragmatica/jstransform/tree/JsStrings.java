package org.pragmatica.jstransform.tree;

/**
 * Encoding and decoding of JavaScript string literal source text.
 */
public final class JsStrings {
    private static final int DEFAULT_CAPACITY = 32;

    private JsStrings() {}

    /**
     * Produce double-quoted source text which decodes back to {@code value}.
     */
    public static String quote(String value) {
        var sb = new StringBuilder(value.length() + 2);
        sb.append('"');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                case '\b' -> sb.append("\\b");
                case '\f' -> sb.append("\\f");
                case '\u000B' -> sb.append("\\v");
                case '\u2028', '\u2029' -> sb.append(String.format("\\u%04x", (int) c));
                default -> {
                    if (c < 0x20) {
                        sb.append(String.format("\\x%02x", (int) c));
                    } else {
                        sb.append(c);
                    }
                }
            }
        }
        return sb.append('"').toString();
    }

    /**
     * Decode quoted source text (single or double quotes) into the string it denotes.
     *
     * @throws IllegalArgumentException if {@code raw} is not a well-formed string literal
     */
    public static String unquote(String raw) {
        if (raw.length() < 2) {
            throw new IllegalArgumentException("String literal is too short: " + raw);
        }
        char quote = raw.charAt(0);
        if ((quote != '"' && quote != '\'') || raw.charAt(raw.length() - 1) != quote) {
            throw new IllegalArgumentException("String literal is not quoted: " + raw);
        }
        var sb = new StringBuilder(DEFAULT_CAPACITY);
        int end = raw.length() - 1;
        int pos = 1;
        while (pos < end) {
            char c = raw.charAt(pos++);
            if (c == quote) {
                throw new IllegalArgumentException("Unescaped quote inside string literal: " + raw);
            }
            if (c == '\n' || c == '\r') {
                throw new IllegalArgumentException("Line terminator inside string literal: " + raw);
            }
            if (c != '\\') {
                sb.append(c);
                continue;
            }
            if (pos >= end) {
                throw new IllegalArgumentException("Dangling escape in string literal: " + raw);
            }
            char escaped = raw.charAt(pos++);
            switch (escaped) {
                case 'n' -> sb.append('\n');
                case 'r' -> sb.append('\r');
                case 't' -> sb.append('\t');
                case 'b' -> sb.append('\b');
                case 'f' -> sb.append('\f');
                case 'v' -> sb.append('\u000B');
                case '0' -> sb.append('\0');
                case 'x' -> {
                    sb.append((char) parseHex(raw, pos, pos + 2, end));
                    pos += 2;
                }
                case 'u' -> {
                    if (pos < end && raw.charAt(pos) == '{') {
                        int close = raw.indexOf('}', pos);
                        if (close < 0 || close >= end) {
                            throw new IllegalArgumentException("Unterminated code point escape: " + raw);
                        }
                        sb.appendCodePoint(parseHex(raw, pos + 1, close, end));
                        pos = close + 1;
                    } else {
                        sb.append((char) parseHex(raw, pos, pos + 4, end));
                        pos += 4;
                    }
                }
                // Line continuation
                case '\n' -> {}
                case '\r' -> {
                    if (pos < end && raw.charAt(pos) == '\n') {
                        pos++;
                    }
                }
                default -> sb.append(escaped);
            }
        }
        return sb.toString();
    }

    private static int parseHex(String raw, int from, int to, int limit) {
        if (to > limit || from >= to) {
            throw new IllegalArgumentException("Truncated hex escape in string literal: " + raw);
        }
        try {
            int value = Integer.parseInt(raw.substring(from, to), 16);
            if (value < 0 || value > Character.MAX_CODE_POINT) {
                throw new IllegalArgumentException("Code point out of range in string literal: " + raw);
            }
            return value;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid hex escape in string literal: " + raw, e);
        }
    }
}
