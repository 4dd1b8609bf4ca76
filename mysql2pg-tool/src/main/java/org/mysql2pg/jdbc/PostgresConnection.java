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

package org.mysql2pg.jdbc;

import org.apache.commons.lang3.StringUtils;
import org.mysql2pg.enums.ErrorCode;
import org.mysql2pg.model.config.DatabaseConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Locale;
import java.util.Properties;

/**
 * PostgresConnection
 *
 * @since 2025-05-12
 */
public class PostgresConnection implements JdbcConnection {
    private static final Logger LOGGER = LoggerFactory.getLogger(PostgresConnection.class);
    private static final String POSTGRES_URL = "jdbc:postgresql://%s:%d/%s";
    private static final String DEFAULT_HOST = "localhost";

    @Override
    public Connection getConnection(DatabaseConfig dbConfig) throws SQLException {
        String host = StringUtils.defaultIfEmpty(dbConfig.getHost(), DEFAULT_HOST);
        String url = String.format(Locale.ROOT, POSTGRES_URL, host, dbConfig.getPort(), dbConfig.getDatabase());
        try {
            Class.forName("org.postgresql.Driver");
            return DriverManager.getConnection(url, buildProperties(dbConfig));
        } catch (SQLException | ClassNotFoundException e) {
            LOGGER.error("{}fail to create postgres connection, host:{}, port:{}, please check.",
                ErrorCode.DB_CONNECTION_EXCEPTION, host, dbConfig.getPort());
            throw new SQLException(e.getMessage(), e);
        }
    }

    /**
     * buildProperties
     *
     * @param dbConfig dbConfig
     * @return connection properties
     */
    static Properties buildProperties(DatabaseConfig dbConfig) {
        Properties properties = new Properties();
        if (dbConfig.getParams() != null) {
            properties.putAll(dbConfig.getParams());
        }
        properties.setProperty("user", dbConfig.getUser());
        if (dbConfig.getPassword() != null) {
            properties.setProperty("password", dbConfig.getPassword());
        }
        if (StringUtils.isNotEmpty(dbConfig.getSchema())) {
            properties.setProperty("currentSchema", dbConfig.getSchema());
        }
        if (dbConfig.getConnectTimeout() != null) {
            properties.setProperty("connectTimeout", String.valueOf(dbConfig.getConnectTimeout()));
        }
        return properties;
    }
}
