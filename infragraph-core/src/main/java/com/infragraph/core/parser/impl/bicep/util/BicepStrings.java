package com.infragraph.core.parser.impl.bicep.util;

/**
 * Decodes Bicep string literals.
 */
final class BicepStrings {

    private BicepStrings() {
    }

    /**
     * Decodes a single-quoted string token including its quotes. Interpolations are
     * copied verbatim.
     */
    static String unquote(String token) {
        String raw = token.substring(1, token.length() - 1);
        if (raw.indexOf('\\') < 0) {
            return raw;
        }
        StringBuilder out = new StringBuilder(raw.length());
        int i = 0;
        while (i < raw.length()) {
            char c = raw.charAt(i);
            if (c == '$' && i + 1 < raw.length() && raw.charAt(i + 1) == '{') {
                int end = interpolationEnd(raw, i + 2);
                out.append(raw, i, end);
                i = end;
            } else if (c == '\\' && i + 1 < raw.length()) {
                i = escape(raw, i + 1, out);
            } else {
                out.append(c);
                i++;
            }
        }
        return out.toString();
    }

    /**
     * Returns the body of a {@code '''} string; a newline right after the opening
     * quotes is not part of the value.
     */
    static String multiline(String token) {
        String content = token.substring(3, token.length() - 3);
        if (content.startsWith("\r\n")) {
            return content.substring(2);
        }
        return content.startsWith("\n") ? content.substring(1) : content;
    }

    private static int escape(String raw, int at, StringBuilder out) {
        char c = raw.charAt(at);
        switch (c) {
            case 'n' -> out.append('\n');
            case 't' -> out.append('\t');
            case 'r' -> out.append('\r');
            case 'u' -> {
                int close = raw.indexOf('}', at);
                if (at + 1 < raw.length() && raw.charAt(at + 1) == '{' && close > at + 2) {
                    try {
                        out.appendCodePoint(Integer.parseInt(raw.substring(at + 2, close), 16));
                        return close + 1;
                    } catch (IllegalArgumentException e) {
                        // not a code point escape, keep the text as written
                        out.append('\\').append(c);
                        return at + 1;
                    }
                }
                out.append('\\').append(c);
            }
            default -> out.append(c);
        }
        return at + 1;
    }

    private static int interpolationEnd(String raw, int from) {
        int depth = 1;
        int i = from;
        boolean quoted = false;
        while (i < raw.length() && depth > 0) {
            char c = raw.charAt(i);
            if (c == '\\') {
                i += 2;
                continue;
            }
            if (c == '\'') {
                quoted = !quoted;
            } else if (!quoted && c == '{') {
                depth++;
            } else if (!quoted && c == '}') {
                depth--;
            }
            i++;
        }
        return i;
    }
}
