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

import org.mysql2pg.exception.StatementExtractException;
import org.mysql2pg.model.data.InsertStatement;
import org.mysql2pg.model.data.RawStatement;
import org.mysql2pg.translator.LiteralRewriter;
import org.mysql2pg.translator.SqlDialect;
import org.mysql2pg.translator.warning.ConversionWarnings;
import org.mysql2pg.translator.warning.WarningKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.io.Reader;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Lazy iterator over the INSERT statements of a MySQL dump, each rewritten for PostgreSQL.
 * Statements of any other kind are skipped without being buffered.
 *
 * @since 2025-04-18
 */
public class StatementExtractor implements Iterator<InsertStatement>, Closeable {
    private static final Logger LOGGER = LoggerFactory.getLogger(StatementExtractor.class);
    private static final String INSERT_KEYWORD = "INSERT";

    private final SqlStatementReader reader;
    private final ConversionWarnings warnings;
    private boolean isFailed;

    /**
     * Constructor
     *
     * @param reader dump reader
     * @param warnings warnings
     */
    public StatementExtractor(Reader reader, ConversionWarnings warnings) {
        this.reader = new SqlStatementReader(reader, SqlDialect.MYSQL, INSERT_KEYWORD::equals);
        this.warnings = warnings;
    }

    @Override
    public boolean hasNext() {
        return !isFailed && reader.hasNext();
    }

    /**
     * next
     *
     * @return rewritten statement
     * @throws StatementExtractException when the statement is not terminated before end of input
     */
    @Override
    public InsertStatement next() {
        if (!hasNext()) {
            throw new NoSuchElementException("no more insert statements");
        }
        RawStatement statement = reader.next();
        if (!statement.isBalanced()) {
            isFailed = true;
            throw new StatementExtractException(statement.getIndex(), statement.getLine(),
                "unterminated quote or parenthesis at end of input");
        }
        String text = LiteralRewriter.rewrite(statement.getText());
        if (!statement.isSemicolonEnded()) {
            warnings.warn(WarningKind.MISSING_TERMINATOR, "statement " + statement.getIndex(),
                "last statement has no terminating semicolon, one is appended");
            text = text + ";";
        }
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("extracted statement {} from line {}", statement.getIndex(), statement.getLine());
        }
        return new InsertStatement(statement.getIndex(), text);
    }

    @Override
    public void close() throws IOException {
        reader.close();
    }
}
