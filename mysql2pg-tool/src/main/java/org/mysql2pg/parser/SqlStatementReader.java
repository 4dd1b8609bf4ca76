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

import org.mysql2pg.model.data.RawStatement;
import org.mysql2pg.translator.SqlDialect;
import org.mysql2pg.translator.SqlScanner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.Closeable;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.util.Iterator;
import java.util.Locale;
import java.util.NoSuchElementException;
import java.util.function.Predicate;

/**
 * Pull based splitter of a character stream into statements. Comments are dropped, a statement ends
 * at a semicolon in code position outside parentheses. Statements whose leading keyword is rejected
 * by the filter are scanned to their end without being buffered, so huge INSERT spans cost nothing
 * during the DDL pass.
 *
 * @since 2025-04-18
 */
public class SqlStatementReader implements Iterator<RawStatement>, Closeable {
    private static final Logger LOGGER = LoggerFactory.getLogger(SqlStatementReader.class);
    private static final int NONE = -2;
    private static final int EOF = -1;
    private static final int PROBE_LIMIT = 32;

    private final Reader reader;
    private final SqlDialect dialect;
    private final Predicate<String> keywordFilter;
    private int lookAhead = NONE;
    private long line = 1;
    private long statementCount;
    private RawStatement nextStatement;
    private boolean isExhausted;

    /**
     * Constructor
     *
     * @param reader reader
     * @param dialect dialect
     * @param keywordFilter tested against the upper case leading keyword of each statement
     */
    public SqlStatementReader(Reader reader, SqlDialect dialect, Predicate<String> keywordFilter) {
        this.reader = reader instanceof BufferedReader ? reader : new BufferedReader(reader);
        this.dialect = dialect;
        this.keywordFilter = keywordFilter;
    }

    /**
     * Constructor keeping every statement
     *
     * @param reader reader
     * @param dialect dialect
     */
    public SqlStatementReader(Reader reader, SqlDialect dialect) {
        this(reader, dialect, keyword -> true);
    }

    @Override
    public boolean hasNext() {
        if (nextStatement == null && !isExhausted) {
            nextStatement = readStatement();
            isExhausted = nextStatement == null;
        }
        return nextStatement != null;
    }

    @Override
    public RawStatement next() {
        if (!hasNext()) {
            throw new NoSuchElementException("no more statements");
        }
        RawStatement statement = nextStatement;
        nextStatement = null;
        return statement;
    }

    @Override
    public void close() throws IOException {
        reader.close();
    }

    private RawStatement readStatement() {
        SqlScanner scanner = new SqlScanner(dialect);
        StringBuilder text = new StringBuilder();
        StringBuilder probe = new StringBuilder();
        Boolean isKept = null;
        boolean isStarted = false;
        boolean isSpacePending = false;
        long startLine = line;
        int ch;
        while ((ch = read()) != EOF) {
            char current = (char) ch;
            SqlScanner.CharKind kind = scanner.feed(current, peek());
            if (kind == SqlScanner.CharKind.COMMENT) {
                if (isStarted) {
                    isSpacePending = true;
                    if (isKept == null) {
                        isKept = accept(probe);
                    }
                }
                continue;
            }
            if (scanner.isStatementEnd(current, kind)) {
                if (!isStarted) {
                    continue;
                }
                if (isKept == null) {
                    isKept = accept(probe);
                }
                if (isKept) {
                    return new RawStatement(++statementCount, trimTrailing(text).append(';').toString(),
                        startLine, true, true);
                }
                scanner = new SqlScanner(dialect);
                text.setLength(0);
                probe.setLength(0);
                isKept = null;
                isStarted = false;
                isSpacePending = false;
                continue;
            }
            if (!isStarted) {
                if (Character.isWhitespace(current)) {
                    continue;
                }
                isStarted = true;
                startLine = line;
            }
            if (isKept == null) {
                if (Character.isLetter(current) && probe.length() < PROBE_LIMIT && !isSpacePending) {
                    probe.append(current);
                } else {
                    isKept = accept(probe);
                }
            }
            if (!Boolean.FALSE.equals(isKept)) {
                if (isSpacePending) {
                    text.append(' ');
                }
                text.append(current);
            }
            isSpacePending = false;
        }
        return finishAtEndOfInput(scanner, text, probe, isKept, isStarted, startLine);
    }

    private RawStatement finishAtEndOfInput(SqlScanner scanner, StringBuilder text, StringBuilder probe,
        Boolean isKept, boolean isStarted, long startLine) {
        if (!isStarted) {
            return null;
        }
        boolean isFinalKept = isKept == null ? accept(probe) : isKept;
        if (isFinalKept) {
            return new RawStatement(++statementCount, trimTrailing(text).toString(), startLine,
                scanner.isBalanced(), false);
        }
        if (!scanner.isBalanced()) {
            LOGGER.warn("unterminated statement starting at line {} is discarded at end of input.", startLine);
        }
        return null;
    }

    private boolean accept(StringBuilder probe) {
        return keywordFilter.test(probe.toString().toUpperCase(Locale.ROOT));
    }

    private static StringBuilder trimTrailing(StringBuilder text) {
        int length = text.length();
        while (length > 0 && Character.isWhitespace(text.charAt(length - 1))) {
            length--;
        }
        text.setLength(length);
        return text;
    }

    private int read() {
        int ch;
        if (lookAhead != NONE) {
            ch = lookAhead;
            lookAhead = NONE;
        } else {
            ch = readFromSource();
        }
        if (ch == '\n') {
            line++;
        }
        return ch;
    }

    private int peek() {
        if (lookAhead == NONE) {
            lookAhead = readFromSource();
        }
        return lookAhead;
    }

    private int readFromSource() {
        try {
            return reader.read();
        } catch (IOException e) {
            throw new UncheckedIOException("fail to read sql input", e);
        }
    }
}
