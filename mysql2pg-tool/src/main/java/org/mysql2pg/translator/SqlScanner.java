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

import java.util.ArrayList;
import java.util.List;

/**
 * Character level state machine shared by every stage that needs statement or literal boundaries.
 * Feed characters in order together with the following character; the scanner reports whether each
 * character is code, part of a quoted literal (delimiters included) or part of a comment.
 *
 * @since 2025-04-18
 */
public class SqlScanner {
    /**
     * NO_CHAR, used as look-ahead at end of input
     */
    public static final int NO_CHAR = -1;

    /**
     * CharKind
     */
    public enum CharKind {
        CODE,
        LITERAL,
        COMMENT
    }

    private enum State {
        CODE,
        SINGLE_QUOTE,
        DOUBLE_QUOTE,
        BACKTICK,
        LINE_COMMENT,
        BLOCK_COMMENT
    }

    private final SqlDialect dialect;
    private State state = State.CODE;
    private boolean isEscaped;
    private boolean isQuoteDoubled;
    private boolean isCommentOpening;
    private boolean isCommentClosing;
    private int depth;

    /**
     * Constructor
     *
     * @param dialect dialect
     */
    public SqlScanner(SqlDialect dialect) {
        this.dialect = dialect;
    }

    /**
     * feed
     *
     * @param ch current character
     * @param next following character, or NO_CHAR at end of input
     * @return kind of the current character
     */
    public CharKind feed(char ch, int next) {
        switch (state) {
            case CODE:
                return feedCode(ch, next);
            case LINE_COMMENT:
                if (ch == '\n') {
                    state = State.CODE;
                }
                return CharKind.COMMENT;
            case BLOCK_COMMENT:
                return feedBlockComment(ch, next);
            default:
                return feedQuoted(ch, next);
        }
    }

    private CharKind feedCode(char ch, int next) {
        switch (ch) {
            case '\'':
                state = State.SINGLE_QUOTE;
                return CharKind.LITERAL;
            case '"':
                state = State.DOUBLE_QUOTE;
                return CharKind.LITERAL;
            case '`':
                if (dialect.isBacktickQuote()) {
                    state = State.BACKTICK;
                    return CharKind.LITERAL;
                }
                return CharKind.CODE;
            case '(':
                depth++;
                return CharKind.CODE;
            case ')':
                if (depth > 0) {
                    depth--;
                }
                return CharKind.CODE;
            case '#':
                if (dialect.isHashComment()) {
                    state = State.LINE_COMMENT;
                    return CharKind.COMMENT;
                }
                return CharKind.CODE;
            case '-':
                if (next == '-') {
                    state = State.LINE_COMMENT;
                    return CharKind.COMMENT;
                }
                return CharKind.CODE;
            case '/':
                if (next == '*') {
                    state = State.BLOCK_COMMENT;
                    isCommentOpening = true;
                    return CharKind.COMMENT;
                }
                return CharKind.CODE;
            default:
                return CharKind.CODE;
        }
    }

    private CharKind feedBlockComment(char ch, int next) {
        if (isCommentOpening) {
            isCommentOpening = false;
            return CharKind.COMMENT;
        }
        if (isCommentClosing) {
            isCommentClosing = false;
            state = State.CODE;
            return CharKind.COMMENT;
        }
        if (ch == '*' && next == '/') {
            isCommentClosing = true;
        }
        return CharKind.COMMENT;
    }

    private CharKind feedQuoted(char ch, int next) {
        if (isQuoteDoubled) {
            isQuoteDoubled = false;
            return CharKind.LITERAL;
        }
        if (isEscaped) {
            isEscaped = false;
            return CharKind.LITERAL;
        }
        if (ch == '\\' && dialect.isBackslashEscape() && state != State.BACKTICK) {
            isEscaped = true;
            return CharKind.LITERAL;
        }
        char quote = quoteChar();
        if (ch == quote) {
            if (next == quote) {
                isQuoteDoubled = true;
            } else {
                state = State.CODE;
            }
        }
        return CharKind.LITERAL;
    }

    private char quoteChar() {
        switch (state) {
            case SINGLE_QUOTE:
                return '\'';
            case DOUBLE_QUOTE:
                return '"';
            default:
                return '`';
        }
    }

    /**
     * isStatementEnd
     *
     * @param ch character just fed
     * @param kind kind returned for it
     * @return true when the character is a statement terminating semicolon
     */
    public boolean isStatementEnd(char ch, CharKind kind) {
        return ch == ';' && kind == CharKind.CODE && depth == 0;
    }

    /**
     * isBalanced, no open literal, block comment or parenthesis
     *
     * @return isBalanced
     */
    public boolean isBalanced() {
        return (state == State.CODE || state == State.LINE_COMMENT) && depth == 0;
    }

    /**
     * isInCode
     *
     * @return true when the next character would be read in code state
     */
    public boolean isInCode() {
        return state == State.CODE;
    }

    /**
     * getDepth
     *
     * @return parenthesis depth
     */
    public int getDepth() {
        return depth;
    }

    /**
     * Find the parenthesis closing the one at openIndex.
     *
     * @param text text
     * @param openIndex index of an opening parenthesis
     * @param dialect dialect
     * @return index of the closing parenthesis or -1
     */
    public static int findClosingParen(String text, int openIndex, SqlDialect dialect) {
        SqlScanner scanner = new SqlScanner(dialect);
        for (int i = openIndex; i < text.length(); i++) {
            char ch = text.charAt(i);
            CharKind kind = scanner.feed(ch, lookAhead(text, i));
            if (ch == ')' && kind == CharKind.CODE && scanner.getDepth() == 0) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Skip a quoted literal or identifier starting at start.
     *
     * @param text text
     * @param start index of the opening quote
     * @param dialect dialect
     * @return index just after the closing quote or -1 when unterminated
     */
    public static int skipLiteral(String text, int start, SqlDialect dialect) {
        SqlScanner scanner = new SqlScanner(dialect);
        scanner.feed(text.charAt(start), lookAhead(text, start));
        for (int i = start + 1; i < text.length(); i++) {
            scanner.feed(text.charAt(i), lookAhead(text, i));
            if (scanner.isInCode()) {
                return i + 1;
            }
        }
        return -1;
    }

    /**
     * Split text at separators that are in code state at parenthesis depth zero.
     *
     * @param text text
     * @param separator separator
     * @param dialect dialect
     * @return trimmed, non-empty parts
     */
    public static List<String> splitTopLevel(String text, char separator, SqlDialect dialect) {
        List<String> parts = new ArrayList<>();
        SqlScanner scanner = new SqlScanner(dialect);
        int partStart = 0;
        for (int i = 0; i < text.length(); i++) {
            char ch = text.charAt(i);
            CharKind kind = scanner.feed(ch, lookAhead(text, i));
            if (ch == separator && kind == CharKind.CODE && scanner.getDepth() == 0) {
                addPart(parts, text.substring(partStart, i));
                partStart = i + 1;
            }
        }
        addPart(parts, text.substring(partStart));
        return parts;
    }

    private static void addPart(List<String> parts, String part) {
        String trimmed = part.trim();
        if (!trimmed.isEmpty()) {
            parts.add(trimmed);
        }
    }

    private static int lookAhead(String text, int index) {
        return index + 1 < text.length() ? text.charAt(index + 1) : NO_CHAR;
    }
}
