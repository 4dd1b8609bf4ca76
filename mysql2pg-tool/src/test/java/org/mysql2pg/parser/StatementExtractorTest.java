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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.junit.Test;
import org.mysql2pg.exception.StatementExtractException;
import org.mysql2pg.model.data.InsertStatement;
import org.mysql2pg.translator.warning.ConversionWarnings;
import org.mysql2pg.translator.warning.WarningKind;

import java.io.StringReader;

/**
 * StatementExtractorTest
 *
 * @since 2025-04-18
 */
public class StatementExtractorTest {
    @Test
    public void testExtractsAndRewritesInserts() {
        String dump = "-- MySQL dump\n"
            + "SET NAMES utf8mb4;\n"
            + "DROP TABLE IF EXISTS `t`;\n"
            + "CREATE TABLE `t` (`id` int, `s` text);\n"
            + "LOCK TABLES `t` WRITE;\n"
            + "INSERT INTO `t` VALUES (1,'a;b\\'c'),(2,\\N);\n"
            + "INSERT INTO `t` VALUES (3,'multi\nline');\n"
            + "UNLOCK TABLES;\n";
        ConversionWarnings warnings = new ConversionWarnings();
        StatementExtractor extractor = new StatementExtractor(new StringReader(dump), warnings);

        InsertStatement first = extractor.next();
        assertEquals(1, first.getIndex());
        assertEquals("INSERT INTO \"t\" VALUES (1,'a;b''c'),(2,NULL);", first.getText());
        InsertStatement second = extractor.next();
        assertEquals(2, second.getIndex());
        assertEquals("INSERT INTO \"t\" VALUES (3,'multi\nline');", second.getText());
        assertFalse(extractor.hasNext());
        assertEquals(0, warnings.size());
    }

    @Test
    public void testInsertAcrossThreeLinesWithTwoRowGroups() {
        String dump = "INSERT INTO `t` (`id`,`s`) VALUES (1,'x);y'),(2,b'1'),\n"
            + "(3,'(;'),\n"
            + "(4,\\N);\n"
            + "INSERT INTO `t` (`id`,`s`) VALUES (5,'a'),(6,'b');\n";
        ConversionWarnings warnings = new ConversionWarnings();
        StatementExtractor extractor = new StatementExtractor(new StringReader(dump), warnings);

        InsertStatement first = extractor.next();
        assertEquals(1, first.getIndex());
        assertEquals("INSERT INTO \"t\" (\"id\",\"s\") VALUES (1,'x);y'),(2,'1'),\n"
            + "(3,'(;'),\n"
            + "(4,NULL);", first.getText());
        InsertStatement second = extractor.next();
        assertEquals(2, second.getIndex());
        assertEquals("INSERT INTO \"t\" (\"id\",\"s\") VALUES (5,'a'),(6,'b');", second.getText());
        assertFalse(extractor.hasNext());
        assertEquals(0, warnings.size());
    }

    @Test
    public void testMissingTerminatorIsAppended() {
        ConversionWarnings warnings = new ConversionWarnings();
        StatementExtractor extractor = new StatementExtractor(new StringReader("INSERT INTO t VALUES (1)"),
            warnings);

        assertEquals("INSERT INTO t VALUES (1);", extractor.next().getText());
        assertEquals(1, warnings.count(WarningKind.MISSING_TERMINATOR));
    }

    @Test
    public void testUnterminatedStatementStopsExtraction() {
        StatementExtractor extractor = new StatementExtractor(
            new StringReader("INSERT INTO t VALUES (1);\nINSERT INTO t VALUES ('oops);\nINSERT INTO t VALUES (3);"),
            new ConversionWarnings());

        assertTrue(extractor.hasNext());
        extractor.next();
        try {
            extractor.next();
            fail("expected StatementExtractException");
        } catch (StatementExtractException e) {
            assertEquals(2, e.getStatementIndex());
        }
        assertFalse(extractor.hasNext());
    }
}
