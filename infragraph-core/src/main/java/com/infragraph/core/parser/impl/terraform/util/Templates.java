package com.infragraph.core.parser.impl.terraform.util;

/**
 * Decodes HCL quoted templates and heredocs into their literal text.
 *
 * <p>Backslash escapes are decoded outside template sequences. {@code ${...}} and
 * {@code %{...}} sequences are copied verbatim, as are the {@code $$} and {@code %%}
 * escapes.
 */
final class Templates {

    private Templates() {
    }

    /**
     * Decodes a quoted template token including its quotes.
     */
    static String unquote(String token) {
        String raw = token.substring(1, token.length() - 1);
        StringBuilder out = new StringBuilder(raw.length());
        int i = 0;
        while (i < raw.length()) {
            char c = raw.charAt(i);
            char next = i + 1 < raw.length() ? raw.charAt(i + 1) : '\0';
            if (c == '\\' && i + 1 < raw.length()) {
                i = escape(raw, i + 1, out);
            } else if ((c == '$' || c == '%') && next == c) {
                out.append(c).append(next);
                i += 2;
            } else if ((c == '$' || c == '%') && next == '{') {
                int end = templateEnd(raw, i + 2);
                out.append(raw, i, end);
                i = end;
            } else {
                out.append(c);
                i++;
            }
        }
        return out.toString();
    }

    /**
     * Extracts the body of a heredoc token. {@code <<-} heredocs lose their common
     * indentation; every line ends with a newline.
     */
    static String heredoc(String token) {
        int firstNewline = token.indexOf('\n');
        boolean indented = token.startsWith("<<-");
        String[] lines = token.substring(firstNewline + 1).split("\n", -1);
        // the last line holds the closing marker
        int count = lines.length - 1;

        int strip = 0;
        if (indented) {
            strip = Integer.MAX_VALUE;
            for (int i = 0; i < count; i++) {
                String line = stripCarriageReturn(lines[i]);
                if (!line.isBlank()) {
                    strip = Math.min(strip, indentation(line));
                }
            }
            if (strip == Integer.MAX_VALUE) {
                strip = 0;
            }
        }

        StringBuilder joined = new StringBuilder();
        for (int i = 0; i < count; i++) {
            String line = stripCarriageReturn(lines[i]);
            joined.append(line.length() >= strip ? line.substring(strip) : line.strip()).append('\n');
        }
        return joined.toString();
    }

    private static int escape(String raw, int at, StringBuilder out) {
        char c = raw.charAt(at);
        switch (c) {
            case 'n' -> out.append('\n');
            case 't' -> out.append('\t');
            case 'r' -> out.append('\r');
            case 'u', 'U' -> {
                int digits = c == 'u' ? 4 : 8;
                if (isHex(raw, at + 1, digits)) {
                    out.appendCodePoint(Integer.parseInt(raw.substring(at + 1, at + 1 + digits), 16));
                    return at + 1 + digits;
                }
                out.append('\\').append(c);
            }
            default -> out.append(c);
        }
        return at + 1;
    }

    private static boolean isHex(String raw, int from, int digits) {
        if (from + digits > raw.length()) {
            return false;
        }
        for (int i = from; i < from + digits; i++) {
            if (Character.digit(raw.charAt(i), 16) < 0) {
                return false;
            }
        }
        return true;
    }

    /**
     * Returns the index after the brace closing a template sequence whose body starts
     * at {@code from}. Nested quoted strings are skipped.
     */
    private static int templateEnd(String raw, int from) {
        int depth = 1;
        int i = from;
        while (i < raw.length() && depth > 0) {
            char c = raw.charAt(i);
            if (c == '"') {
                i = stringEnd(raw, i + 1);
                continue;
            }
            if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
            }
            i++;
        }
        return i;
    }

    private static int stringEnd(String raw, int from) {
        int i = from;
        while (i < raw.length()) {
            char c = raw.charAt(i);
            if (c == '\\') {
                i += 2;
            } else if ((c == '$' || c == '%') && i + 1 < raw.length() && raw.charAt(i + 1) == '{') {
                i = templateEnd(raw, i + 2);
            } else if (c == '"') {
                return i + 1;
            } else {
                i++;
            }
        }
        return raw.length();
    }

    private static int indentation(String line) {
        int indent = 0;
        while (indent < line.length() && Character.isWhitespace(line.charAt(indent))) {
            indent++;
        }
        return indent;
    }

    private static String stripCarriageReturn(String line) {
        return line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
    }
}
