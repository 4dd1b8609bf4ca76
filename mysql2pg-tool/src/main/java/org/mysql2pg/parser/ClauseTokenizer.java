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

package org.mysql2pg.parser;

import org.mysql2pg.parser.ClauseToken.TokenType;
import org.mysql2pg.translator.LiteralRewriter;
import org.mysql2pg.translator.SqlDialect;
import org.mysql2pg.translator.SqlScanner;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Splits one DDL clause into tokens. A parenthesised part becomes a single GROUP token; quoted
 * parts use the MySQL literal grammar of the scanner. Unterminated quotes or parentheses extend
 * to the end of the text.
 *
 * @since 2025-04-18
 */
public final class ClauseTokenizer {
    private static final Pattern HEX_NUMBER = Pattern.compile("(?i)^0x[0-9a-f]+$");

    private ClauseTokenizer() {
    }

    /**
     * tokenize
     *
     * @param text text
     * @return tokens
     */
    public static List<ClauseToken> tokenize(String text) {
        List<ClauseToken> tokens = new ArrayList<>();
        int length = text.length();
        int i = 0;
        while (i < length) {
            char ch = text.charAt(i);
            if (Character.isWhitespace(ch)) {
                i++;
            } else if (ch == '`') {
                int end = literalEnd(text, i);
                String raw = text.substring(i, end);
                tokens.add(new ClauseToken(TokenType.QUOTED_IDENTIFIER, raw, LiteralRewriter.unquoteIdentifier(raw),
                    i, end));
                i = end;
            } else if (ch == '\'' || ch == '"') {
                int end = literalEnd(text, i);
                String raw = text.substring(i, end);
                tokens.add(new ClauseToken(TokenType.STRING, raw, LiteralRewriter.unquoteMySqlString(raw), i, end));
                i = end;
            } else if (ch == '(') {
                int close = SqlScanner.findClosingParen(text, i, SqlDialect.MYSQL);
                int end = close < 0 ? length : close + 1;
                String inner = text.substring(i + 1, close < 0 ? length : close);
                tokens.add(new ClauseToken(TokenType.GROUP, text.substring(i, end), inner, i, end));
                i = end;
            } else if (isWordChar(ch)) {
                i = readWord(text, i, tokens);
            } else {
                tokens.add(new ClauseToken(TokenType.SYMBOL, String.valueOf(ch), String.valueOf(ch), i, i + 1));
                i++;
            }
        }
        return tokens;
    }

    private static int readWord(String text, int start, List<ClauseToken> tokens) {
        int end = start;
        if (Character.isDigit(text.charAt(start))) {
            while (end < text.length() && (Character.isLetterOrDigit(text.charAt(end)) || text.charAt(end) == '.')) {
                end++;
            }
        } else {
            while (end < text.length() && isWordChar(text.charAt(end))) {
                end++;
            }
        }
        String word = text.substring(start, end);
        boolean isQuoteNext = end < text.length() && text.charAt(end) == '\'';
        if (isQuoteNext && ("b".equalsIgnoreCase(word) || "x".equalsIgnoreCase(word))) {
            int literalEnd = literalEnd(text, end);
            String digits = text.substring(end + 1, Math.max(end + 1, literalEnd - 1));
            TokenType type = "b".equalsIgnoreCase(word) ? TokenType.BIT_STRING : TokenType.HEX_STRING;
            tokens.add(new ClauseToken(type, text.substring(start, literalEnd), digits, start, literalEnd));
            return literalEnd;
        }
        if (isQuoteNext && word.startsWith("_")) {
            // character set introducer such as _utf8mb4'abc'
            return end;
        }
        if (HEX_NUMBER.matcher(word).matches()) {
            tokens.add(new ClauseToken(TokenType.HEX_STRING, word, word.substring(2).toUpperCase(Locale.ROOT), start,
                end));
        } else if (Character.isDigit(word.charAt(0))) {
            tokens.add(new ClauseToken(TokenType.NUMBER, word, word, start, end));
        } else {
            tokens.add(new ClauseToken(TokenType.WORD, word, word, start, end));
        }
        return end;
    }

    private static int literalEnd(String text, int start) {
        int end = SqlScanner.skipLiteral(text, start, SqlDialect.MYSQL);
        return end < 0 ? text.length() : end;
    }

    private static boolean isWordChar(char ch) {
        return Character.isLetterOrDigit(ch) || ch == '_' || ch == '$';
    }
}
