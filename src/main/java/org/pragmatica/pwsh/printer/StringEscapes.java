package org.pragmatica.pwsh.printer;

import java.util.Locale;

/**
 * Quoting rules for string literals.
 */
public final class StringEscapes {
    private StringEscapes() {}

    /**
     * Content of a single-quoted literal: every quote character is doubled. The typographic
     * single quotes count as quotes too.
     */
    public static String singleQuoted(String value) {
        var sb = new StringBuilder(value.length() + 2);
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            sb.append(c);
            if (isSingleQuote(c)) {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    /**
     * Content of a double-quoted literal with control characters, backticks, quotes and
     * dollar signs escaped, and everything outside ASCII written as {@code `u{HEX}}.
     */
    public static String doubleQuoted(String value) {
        var sb = new StringBuilder(value.length() + 8);
        value.codePoints()
             .forEach(codePoint -> appendEscaped(sb, codePoint));
        return sb.toString();
    }

    /**
     * Body of a double-quoted here-string. Line breaks and other characters stay as they
     * are; backticks and dollar signs are escaped, and so is a quote opening a line, which
     * would otherwise end the here-string.
     */
    public static String doubleQuotedHereString(String value) {
        var sb = new StringBuilder(value.length() + 8);
        boolean lineStart = true;
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == '`' || c == '$' || (c == '"' && lineStart)) {
                sb.append('`');
            }
            sb.append(c);
            lineStart = c == '\n';
        }
        return sb.toString();
    }

    private static void appendEscaped(StringBuilder sb, int codePoint) {
        switch (codePoint) {
            case 0x00 -> sb.append("`0");
            case 0x07 -> sb.append("`a");
            case '\b' -> sb.append("`b");
            case '\f' -> sb.append("`f");
            case '\n' -> sb.append("`n");
            case '\r' -> sb.append("`r");
            case '\t' -> sb.append("`t");
            case 0x0B -> sb.append("`v");
            case '`' -> sb.append("``");
            case '"' -> sb.append("`\"");
            case '$' -> sb.append("`$");
            case 0x1B -> sb.append("`e");
            default -> {
                if (codePoint < 128) {
                    sb.append((char) codePoint);
                } else {
                    sb.append("`u{")
                      .append(Integer.toHexString(codePoint).toUpperCase(Locale.ROOT))
                      .append('}');
                }
            }
        }
    }

    private static boolean isSingleQuote(char c) {
        return c == '\'' || c == '\u2018' || c == '\u2019' || c == '\u201A' || c == '\u201B';
    }
}
