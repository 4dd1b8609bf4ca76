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

package org.mysql2pg.utils;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * FileUtilsTest
 *
 * @since 2025-04-18
 */
public class FileUtilsTest {
    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    @Test
    public void testListChunkFilesOrderedByPartNumber() throws IOException {
        Path dir = folder.getRoot().toPath();
        for (String name : Arrays.asList("data_part_010.sql", "data_part_002.sql", "data_part_001.sql",
            "other_part_003.sql", "data_part_x.sql", "schema.sql", "data_part_1000.sql")) {
            Files.createFile(dir.resolve(name));
        }

        List<String> names = new ArrayList<>();
        FileUtils.listChunkFiles(dir, "data").forEach(path -> names.add(path.getFileName().toString()));

        assertEquals(Arrays.asList("data_part_001.sql", "data_part_002.sql", "data_part_010.sql",
            "data_part_1000.sql"), names);
    }

    @Test
    public void testDeleteChunkFilesKeepsOtherFiles() throws IOException {
        Path dir = folder.getRoot().toPath();
        Files.createFile(FileUtils.getChunkFilePath(dir, "data", 1));
        Files.createFile(dir.resolve("schema.sql"));

        FileUtils.deleteChunkFiles(dir, "data");

        assertFalse(Files.exists(dir.resolve("data_part_001.sql")));
        assertTrue(Files.exists(dir.resolve("schema.sql")));
    }

    @Test
    public void testCreateDir() {
        Path nested = folder.getRoot().toPath().resolve("a").resolve("b");

        assertTrue(FileUtils.createDir(nested.toString()));
        assertTrue(Files.isDirectory(nested));
        assertTrue(FileUtils.createDir(nested.toString()));
    }
}
