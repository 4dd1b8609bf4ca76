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

package org.mysql2pg.coordinator;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.mysql2pg.model.config.DumpConfig;
import org.mysql2pg.model.config.GlobalConfig;
import org.mysql2pg.model.load.ExecutionResult;
import org.mysql2pg.target.LoadExecutor;
import org.mysql2pg.utils.FileUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * MigrationEngineTest
 *
 * @since 2025-04-18
 */
public class MigrationEngineTest {
    private static final String DUMP = "CREATE TABLE `t` (`id` int NOT NULL AUTO_INCREMENT, PRIMARY KEY (`id`));\n"
        + "INSERT INTO `t` VALUES (1),(2);\n";

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private GlobalConfig globalConfig;
    private Path input;
    private Path outDir;

    @Before
    public void setUp() throws IOException {
        input = folder.newFile("dump.sql").toPath();
        Files.write(input, DUMP.getBytes(StandardCharsets.UTF_8));
        outDir = folder.getRoot().toPath().resolve("out");
        DumpConfig dumpConfig = new DumpConfig();
        dumpConfig.setInputFile(input.toString());
        dumpConfig.setOutDir(outDir.toString());
        globalConfig = new GlobalConfig();
        globalConfig.setIsDumpJson(false);
        globalConfig.setDumpConfig(dumpConfig);
    }

    @Test
    public void testDispatchSingleTasks() throws IOException {
        assertTrue(new MigrationEngine("DDL", null).dispatch(globalConfig));
        assertTrue(Files.exists(outDir.resolve("schema.sql")));
        assertTrue(new MigrationEngine("data", null).dispatch(globalConfig));
        assertEquals(1, FileUtils.listChunkFiles(outDir, "pg_inserts").size());
    }

    @Test
    public void testAllRunsConversionsBeforeFailingLoad() throws IOException {
        assertFalse(new MigrationEngine("all", null).dispatch(globalConfig));

        assertTrue(Files.exists(outDir.resolve("schema.sql")));
        assertEquals(1, FileUtils.listChunkFiles(outDir, "pg_inserts").size());
    }

    @Test
    public void testAllLoadsAfterBothConversions() {
        globalConfig.getLoadConfig().setIsApplySchema(true);
        globalConfig.getLoadConfig().setIsResetSequences(false);
        List<String> loaded = Collections.synchronizedList(new ArrayList<>());
        LoadExecutor executor = file -> {
            loaded.add(file.getFileName().toString());
            return ExecutionResult.success();
        };

        assertTrue(new MigrationEngine("all", null, executor).dispatch(globalConfig));

        assertEquals(2, loaded.size());
        assertEquals("schema.sql", loaded.get(0));
        assertEquals("pg_inserts_part_001.sql", loaded.get(1));
    }

    @Test
    public void testAllSkipsLoadWhenDdlFails() throws IOException {
        Files.createDirectories(outDir.resolve("schema.sql").resolve("occupied"));
        List<Path> loaded = Collections.synchronizedList(new ArrayList<>());
        LoadExecutor executor = file -> {
            loaded.add(file);
            return ExecutionResult.success();
        };

        assertFalse(new MigrationEngine("all", null, executor).dispatch(globalConfig));

        assertEquals(1, FileUtils.listChunkFiles(outDir, "pg_inserts").size());
        assertTrue(loaded.isEmpty());
    }

    @Test
    public void testFailedDdlRemovesScriptsOfEarlierRun() throws IOException {
        Files.createDirectories(outDir);
        Files.write(outDir.resolve("schema.sql"), "CREATE TABLE old (id int);".getBytes(StandardCharsets.UTF_8));
        Files.write(outDir.resolve("sequence_reset.sql"), "SELECT 1;".getBytes(StandardCharsets.UTF_8));
        Files.write(input, "CREATE TABLE `broken` (\n  `id` int".getBytes(StandardCharsets.UTF_8));

        assertFalse(new MigrationEngine("ddl", null).dispatch(globalConfig));

        assertFalse(Files.exists(outDir.resolve("schema.sql")));
        assertFalse(Files.exists(outDir.resolve("sequence_reset.sql")));
    }

    @Test
    public void testUnknownTaskType() {
        assertFalse(new MigrationEngine("copy", null).dispatch(globalConfig));
        assertFalse(Files.exists(outDir));
    }

    @Test
    public void testMissingConfigFile() {
        assertFalse(new MigrationEngine("ddl", folder.getRoot().toPath().resolve("none.yml").toString()).dispatch());
    }
}
