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

package org.mysql2pg.target;

import org.mysql2pg.enums.ErrorCode;
import org.mysql2pg.jdbc.JdbcConnection;
import org.mysql2pg.model.config.DatabaseConfig;
import org.mysql2pg.model.load.ExecutionResult;
import org.mysql2pg.parser.SqlStatementReader;
import org.mysql2pg.translator.SqlDialect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Runs a file through the PostgreSQL JDBC driver inside one transaction, so a failed attempt
 * leaves nothing behind and can be repeated.
 *
 * @since 2025-04-18
 */
public class JdbcLoadExecutor implements LoadExecutor {
    private static final Logger LOGGER = LoggerFactory.getLogger(JdbcLoadExecutor.class);

    private final JdbcConnection jdbcConnection;
    private final DatabaseConfig dbConfig;

    /**
     * Constructor
     *
     * @param jdbcConnection jdbcConnection
     * @param dbConfig dbConfig
     */
    public JdbcLoadExecutor(JdbcConnection jdbcConnection, DatabaseConfig dbConfig) {
        this.jdbcConnection = jdbcConnection;
        this.dbConfig = dbConfig;
    }

    @Override
    public ExecutionResult execute(Path file) {
        try (Connection connection = jdbcConnection.getConnection(dbConfig)) {
            connection.setAutoCommit(false);
            try {
                long count = executeStatements(connection, file);
                connection.commit();
                LOGGER.info("loaded {} statements from {}.", count, file.getFileName());
                return ExecutionResult.success();
            } catch (SQLException | IOException | UncheckedIOException e) {
                rollback(connection, file);
                LOGGER.error("{}fail to load {}, error message:{}", ErrorCode.SQL_EXCEPTION, file.getFileName(),
                    e.getMessage());
                return ExecutionResult.failure(e.getMessage());
            }
        } catch (SQLException e) {
            LOGGER.error("{}fail to connect for {}, error message:{}", ErrorCode.DB_CONNECTION_EXCEPTION,
                file.getFileName(), e.getMessage());
            return ExecutionResult.failure(e.getMessage());
        }
    }

    private long executeStatements(Connection connection, Path file) throws SQLException, IOException {
        long count = 0;
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8);
            SqlStatementReader statements = new SqlStatementReader(reader, SqlDialect.POSTGRES);
            Statement statement = connection.createStatement()) {
            while (statements.hasNext()) {
                statement.execute(statements.next().getText());
                count++;
            }
        }
        return count;
    }

    private void rollback(Connection connection, Path file) {
        try {
            connection.rollback();
        } catch (SQLException e) {
            LOGGER.error("{}fail to rollback {}, error message:{}", ErrorCode.SQL_EXCEPTION, file.getFileName(),
                e.getMessage());
        }
    }
}
