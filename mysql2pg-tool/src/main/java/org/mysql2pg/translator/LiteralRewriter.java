/*
 * Copyright (c) 2025-2025 Huawei Technologies Co.,Ltd.
 *
 * openGauss is licensed under Mulan PSL v2.
 * You can use this software according to the terms and conditions of the Mulan PSL v2.
 * You may obtain a copy of Mulan PSL v2 at:
 *
 *           http://license.coscl.org.cn/MulanPSL2
 *
 * THIS SOFTWARE IS PROVIDED ON AN "AS IS" BASIS, WITHOUT WARRANTIES OF ANY KIND,
 * EITHER EXPRESS OR IMPLIED, INCLUDING BUT NOT LIMITED TO NON-INFRINGEMENT,
 * MERCHANTABILITY OR FIT FOR A PARTICULAR PURPOSE.
 * See the Mulan PSL v2 for more details.
 */

package org.mysql2pg.translator;

import org.apache.commons.lang3.StringUtils;

import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * LiteralRewriter, rewrites MySQL literals and identifiers into their PostgreSQL spelling
 *
 * @since 2025-04-18
 */
public final class LiteralRewriter {
    private static final String BINARY_INTRODUCER = "_binary";
    private static final String NULL_MARKER = "\\N";
    private static final Pattern PLAIN_IDENTIFIER = Pattern.compile("^[a-z_][a-z0-9_$]*$");

    private LiteralRewriter() {
    }

    /**
     * quoteIdentifier
     *
     * @param name name
     * @return "name" with embedded double quotes doubled
     */
    public static String quoteIdentifier(String name) {
        return "\"" + name.replace("\"", "\"\"") + "\"";
    }

    /**
     * quoteIdentifierIfNeeded, names that survive case folding stay bare
     *
     * @param name name
     * @return name or "name"
     */
    public static String quoteIdentifierIfNeeded(String name) {
        return PLAIN_IDENTIFIER.matcher(name).matches() ? name : quoteIdentifier(name);
    }

    /**
     * quoteString
     *
     * @param value value
     * @return standard conforming string literal
     */
    public static String quoteString(String value) {
        return "'" + value.replace("'", "''") + "'";
    }

    /**
     * Strip the quotes of a MySQL single or double quoted string and decode its escapes.
     *
     * @param literal literal including its quotes
     * @return decoded value
     */
    public static String unquoteMySqlString(String literal) {
        return decodeMySqlString(literal, false);
    }

    /**
     * Decode the payload of a {@code _binary '...'} literal into its bytes. Unlike text, \0 stays a NUL byte.
     *
     * @param literal literal including its quotes
     * @return bytes, UTF-8 encoded where the dump carried non ASCII characters
     */
    public static byte[] unquoteMySqlBinary(String literal) {
        return decodeMySqlString(literal, true).getBytes(StandardCharsets.UTF_8);
    }

    private static String decodeMySqlString(String literal, boolean isBinary) {
        char quote = literal.charAt(0);
        StringBuilder builder = new StringBuilder(literal.length());
        int end = literal.length() - 1;
        for (int i = 1; i < end; i++) {
            char ch = literal.charAt(i);
            if (ch == '\\' && i + 1 < end) {
                i++;
                appendEscape(builder, literal.charAt(i), isBinary);
            } else if (ch == quote && i + 1 < end && literal.charAt(i + 1) == quote) {
                builder.append(quote);
                i++;
            } else {
                builder.append(ch);
            }
        }
        return builder.toString();
    }

    private static void appendEscape(StringBuilder builder, char escaped, boolean isBinary) {
        switch (escaped) {
            case '0':
                if (isBinary) {
                    builder.append('\0');
                }
                break;
            case 'b':
                builder.append('\b');
                break;
            case 'n':
                builder.append('\n');
                break;
            case 'r':
                builder.append('\r');
                break;
            case 't':
                builder.append('\t');
                break;
            case 'Z':
                builder.append('\u001A');
                break;
            case '%':
            case '_':
                // kept escaped, MySQL does the same outside LIKE patterns
                builder.append('\\').append(escaped);
                break;
            default:
                builder.append(escaped);
        }
    }

    /**
     * Strip backticks or double quotes around an identifier.
     *
     * @param identifier identifier
     * @return bare name
     */
    public static String unquoteIdentifier(String identifier) {
        String trimmed = identifier.trim();
        if (trimmed.length() >= 2) {
            char first = trimmed.charAt(0);
            char last = trimmed.charAt(trimmed.length() - 1);
            if ((first == '`' || first == '"') && first == last) {
                String quote = String.valueOf(first);
                return trimmed.substring(1, trimmed.length() - 1).replace(quote + quote, quote);
            }
        }
        return trimmed;
    }

    /**
     * rewriteBitLiteral
     *
     * @param bits the digits between the quotes of b'...'
     * @return '0', '1' or B'...'
     */
    public static String rewriteBitLiteral(String bits) {
        if ("0".equals(bits) || "1".equals(bits)) {
            return "'" + bits + "'";
        }
        return "B'" + bits + "'";
    }

    /**
     * rewriteHexLiteral
     *
     * @param hexDigits hex digits without prefix
     * @return bytea hex input literal
     */
    public static String rewriteHexLiteral(String hexDigits) {
        return "'\\x" + hexDigits.toUpperCase(Locale.ROOT) + "'";
    }

    /**
     * Rewrite one MySQL statement into PostgreSQL syntax in a single left to right pass:
     * backtick identifiers, MySQL strings, \N, bit and hex literals, _binary introducers
     * and carriage returns outside literals.
     *
     * @param sql statement text
     * @return rewritten text
     */
    public static String rewrite(String sql) {
        StringBuilder out = new StringBuilder(sql.length() + 16);
        int length = sql.length();
        int i = 0;
        while (i < length) {
            char ch = sql.charAt(i);
            if (ch == '`') {
                int end = SqlScanner.skipLiteral(sql, i, SqlDialect.MYSQL);
                end = end < 0 ? length : end;
                out.append(quoteIdentifier(unquoteIdentifier(sql.substring(i, end))));
                i = end;
                continue;
            }
            if (ch == '\'' || ch == '"') {
                int end = SqlScanner.skipLiteral(sql, i, SqlDialect.MYSQL);
                end = end < 0 ? length : end;
                out.append(quoteString(unquoteMySqlString(sql.substring(i, end))));
                i = end;
                continue;
            }
            if (ch == '\r') {
                i++;
                continue;
            }
            if (ch == '\\' && sql.startsWith(NULL_MARKER, i)) {
                out.append("NULL");
                i += NULL_MARKER.length();
                continue;
            }
            if (isWordStart(sql, i)) {
                int consumed = rewritePrefixedLiteral(sql, i, out);
                if (consumed > 0) {
                    i += consumed;
                    continue;
                }
                int wordEnd = wordEnd(sql, i);
                out.append(sql, i, wordEnd);
                i = wordEnd;
                continue;
            }
            out.append(ch);
            i++;
        }
        return out.toString();
    }

    private static int rewritePrefixedLiteral(String sql, int start, StringBuilder out) {
        char ch = Character.toLowerCase(sql.charAt(start));
        if ((ch == 'b' || ch == 'x') && start + 1 < sql.length() && sql.charAt(start + 1) == '\'') {
            int close = sql.indexOf('\'', start + 2);
            if (close > 0) {
                String digits = sql.substring(start + 2, close);
                out.append(ch == 'b' ? rewriteBitLiteral(digits) : rewriteHexLiteral(digits));
                return close + 1 - start;
            }
            return 0;
        }
        if (ch == '0' && start + 1 < sql.length() && Character.toLowerCase(sql.charAt(start + 1)) == 'x') {
            int end = wordEnd(sql, start);
            String digits = sql.substring(start + 2, end);
            if (!digits.isEmpty() && isHexDigits(digits)) {
                out.append(rewriteHexLiteral(digits));
                return end - start;
            }
            return 0;
        }
        if (ch == '_' && sql.regionMatches(true, start, BINARY_INTRODUCER, 0, BINARY_INTRODUCER.length())
            && wordEnd(sql, start) == start + BINARY_INTRODUCER.length()) {
            int next = start + BINARY_INTRODUCER.length();
            while (next < sql.length() && sql.charAt(next) == ' ') {
                next++;
            }
            if (next < sql.length() && (sql.charAt(next) == '\'' || sql.charAt(next) == '"')) {
                int end = SqlScanner.skipLiteral(sql, next, SqlDialect.MYSQL);
                if (end > 0) {
                    out.append(rewriteHexLiteral(toHex(unquoteMySqlBinary(sql.substring(next, end)))));
                    return end - start;
                }
            }
            return next - start;
        }
        return 0;
    }

    private static String toHex(byte[] bytes) {
        StringBuilder hex = new StringBuilder(bytes.length * 2);
        for (byte value : bytes) {
            hex.append(Character.forDigit((value >> 4) & 0xF, 16)).append(Character.forDigit(value & 0xF, 16));
        }
        return hex.toString();
    }

    private static boolean isHexDigits(String digits) {
        return StringUtils.containsOnly(digits.toLowerCase(Locale.ROOT), "0123456789abcdef");
    }

    private static boolean isWordStart(String sql, int index) {
        return isWordChar(sql.charAt(index)) && (index == 0 || !isWordChar(sql.charAt(index - 1)));
    }

    private static int wordEnd(String sql, int start) {
        int end = start;
        while (end < sql.length() && isWordChar(sql.charAt(end))) {
            end++;
        }
        return end;
    }

    private static boolean isWordChar(char ch) {
        return Character.isLetterOrDigit(ch) || ch == '_' || ch == '$';
    }
}
