package com.treewalk.convert;

import java.math.BigInteger;
import java.util.Locale;

/**
 * Literal decoding: string escapes and numeric literal values.
 */
final class JsStrings {

    private JsStrings() {
    }

    /**
     * Removes the surrounding quotes of a string literal and decodes its escapes.
     */
    static String cookString(String raw) {
        if (raw.length() >= 2) {
            char quote = raw.charAt(0);
            if ((quote == '"' || quote == '\'') && raw.charAt(raw.length() - 1) == quote) {
                return unescape(raw.substring(1, raw.length() - 1));
            }
        }
        return unescape(raw);
    }

    /**
     * Decodes JavaScript escape sequences. Malformed escapes keep the escaped character.
     */
    static String unescape(String s) {
        if (s.indexOf('\\') < 0) {
            return s;
        }
        StringBuilder sb = new StringBuilder(s.length());
        int i = 0;
        while (i < s.length()) {
            char c = s.charAt(i);
            if (c != '\\' || i + 1 >= s.length()) {
                sb.append(c);
                i++;
                continue;
            }
            char next = s.charAt(i + 1);
            i += 2;
            switch (next) {
                case 'n' -> sb.append('\n');
                case 't' -> sb.append('\t');
                case 'r' -> sb.append('\r');
                case 'b' -> sb.append('\b');
                case 'f' -> sb.append('\f');
                case 'v' -> sb.append('\u000B');
                case '0' -> sb.append('\0');
                case '\r' -> {
                    // line continuation
                    if (i < s.length() && s.charAt(i) == '\n') {
                        i++;
                    }
                }
                case '\n', '\u2028', '\u2029' -> {
                    // line continuation
                }
                case 'x' -> {
                    if (i + 2 <= s.length() && isHex(s, i, i + 2)) {
                        sb.append((char) Integer.parseInt(s.substring(i, i + 2), 16));
                        i += 2;
                    } else {
                        sb.append('x');
                    }
                }
                case 'u' -> {
                    if (i < s.length() && s.charAt(i) == '{') {
                        int close = s.indexOf('}', i);
                        if (close > i + 1 && isHex(s, i + 1, close)) {
                            sb.appendCodePoint(Integer.parseInt(s.substring(i + 1, close), 16));
                            i = close + 1;
                        } else {
                            sb.append('u');
                        }
                    } else if (i + 4 <= s.length() && isHex(s, i, i + 4)) {
                        sb.append((char) Integer.parseInt(s.substring(i, i + 4), 16));
                        i += 4;
                    } else {
                        sb.append('u');
                    }
                }
                default -> sb.append(next);
            }
        }
        return sb.toString();
    }

    private static boolean isHex(String s, int from, int to) {
        if (to - from > 6) {
            return false;
        }
        for (int i = from; i < to; i++) {
            if (Character.digit(s.charAt(i), 16) < 0) {
                return false;
            }
        }
        return true;
    }

    /**
     * Numeric value of a number literal (decimal, hex, octal, binary, legacy octal, separators).
     */
    static double parseNumber(String raw) {
        String s = raw.replace("_", "").toLowerCase(Locale.ROOT);
        if (s.startsWith("0x")) {
            return new BigInteger(s.substring(2), 16).doubleValue();
        }
        if (s.startsWith("0o")) {
            return new BigInteger(s.substring(2), 8).doubleValue();
        }
        if (s.startsWith("0b")) {
            return new BigInteger(s.substring(2), 2).doubleValue();
        }
        if (s.length() > 1 && s.charAt(0) == '0' && s.chars().allMatch(ch -> ch >= '0' && ch <= '7')) {
            return new BigInteger(s.substring(1), 8).doubleValue();
        }
        return Double.parseDouble(s);
    }

    /**
     * Value of a bigint literal such as {@code 0xFFn}.
     */
    static BigInteger parseBigInt(String raw) {
        String s = raw.replace("_", "").toLowerCase(Locale.ROOT);
        if (s.endsWith("n")) {
            s = s.substring(0, s.length() - 1);
        }
        if (s.startsWith("0x")) {
            return new BigInteger(s.substring(2), 16);
        }
        if (s.startsWith("0o")) {
            return new BigInteger(s.substring(2), 8);
        }
        if (s.startsWith("0b")) {
            return new BigInteger(s.substring(2), 2);
        }
        return new BigInteger(s);
    }
}
