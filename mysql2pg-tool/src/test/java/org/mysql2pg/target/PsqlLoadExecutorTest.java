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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.junit.Test;
import org.mysql2pg.model.config.DatabaseConfig;

import java.nio.file.Paths;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * PsqlLoadExecutorTest
 *
 * @since 2025-04-18
 */
public class PsqlLoadExecutorTest {
    @Test
    public void testBuildCommand() {
        PsqlLoadExecutor executor = new PsqlLoadExecutor("/usr/bin/psql", dbConfig());

        List<String> command = executor.buildCommand(Paths.get("out", "pg_inserts_part_001.sql"));

        assertEquals(Arrays.asList("/usr/bin/psql", "-h", "10.0.0.5", "-p", "5433", "-U", "loader", "-d", "target",
            "-v", "ON_ERROR_STOP=1", "--single-transaction", "-q", "-f",
            Paths.get("out", "pg_inserts_part_001.sql").toString()), command);
        assertFalse(command.contains("secret"));
    }

    @Test
    public void testBuildCommandWithoutHost() {
        DatabaseConfig dbConfig = dbConfig();
        dbConfig.setHost(null);

        List<String> command = new PsqlLoadExecutor("psql", dbConfig).buildCommand(Paths.get("a.sql"));

        assertFalse(command.contains("-h"));
        assertEquals("-p", command.get(1));
    }

    @Test
    public void testBuildEnvironment() {
        Map<String, String> environment = new HashMap<>();

        new PsqlLoadExecutor("psql", dbConfig()).buildEnvironment(environment);

        assertEquals("secret", environment.get("PGPASSWORD"));
        assertEquals("-c search_path=app", environment.get("PGOPTIONS"));
        assertEquals("7", environment.get("PGCONNECT_TIMEOUT"));
    }

    @Test
    public void testMissingExecutableIsFailure() {
        PsqlLoadExecutor executor = new PsqlLoadExecutor("/nonexistent/bin/psql-missing", dbConfig());

        assertTrue(!executor.execute(Paths.get("a.sql")).isSuccess());
    }

    static DatabaseConfig dbConfig() {
        DatabaseConfig dbConfig = new DatabaseConfig();
        dbConfig.setHost("10.0.0.5");
        dbConfig.setPort(5433);
        dbConfig.setUser("loader");
        dbConfig.setPassword("secret");
        dbConfig.setDatabase("target");
        dbConfig.setSchema("app");
        dbConfig.setConnectTimeout(7);
        return dbConfig;
    }
}
