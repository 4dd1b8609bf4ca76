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
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.junit.Before;
import org.junit.Test;
import org.mysql2pg.exception.DdlParseException;
import org.mysql2pg.model.table.Column;
import org.mysql2pg.model.table.CommentEntry;
import org.mysql2pg.model.table.SchemaModel;
import org.mysql2pg.model.table.Table;
import org.mysql2pg.model.table.TableForeignKey;
import org.mysql2pg.model.table.TableIndex;
import org.mysql2pg.model.table.TableSequence;
import org.mysql2pg.translator.warning.ConversionWarnings;
import org.mysql2pg.translator.warning.WarningKind;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * DdlParserTest
 *
 * @since 2025-04-18
 */
public class DdlParserTest {
    static final String USERS_DDL = "DROP TABLE IF EXISTS `users`;\n"
        + "/*!40101 SET character_set_client = utf8 */;\n"
        + "CREATE TABLE `users` (\n"
        + "  `id` int(11) NOT NULL AUTO_INCREMENT,\n"
        + "  `name` varchar(64) NOT NULL DEFAULT '' COMMENT 'user\\'s name',\n"
        + "  `status` enum('active','banned') DEFAULT 'active',\n"
        + "  `flag` bit(1) DEFAULT b'0',\n"
        + "  `created_at` datetime DEFAULT CURRENT_TIMESTAMP ON UPDATE CURRENT_TIMESTAMP,\n"
        + "  PRIMARY KEY (`id`),\n"
        + "  UNIQUE KEY `uk_name` (`name`),\n"
        + "  KEY `idx_status` (`status`,`created_at`)\n"
        + ") ENGINE=InnoDB AUTO_INCREMENT=5 DEFAULT CHARSET=utf8mb4 COMMENT='app users';\n"
        + "LOCK TABLES `users` WRITE;\n"
        + "INSERT INTO `users` VALUES (1,'a','active',b'0','2024-01-01 00:00:00');\n"
        + "UNLOCK TABLES;\n";

    private ConversionWarnings warnings;
    private DdlParser parser;

    @Before
    public void setUp() {
        warnings = new ConversionWarnings();
        parser = new DdlParser(warnings);
    }

    @Test
    public void testCreateTable() {
        SchemaModel model = parser.parse(USERS_DDL);

        Table users = model.getTable("users").get();
        List<String> names = new ArrayList<>();
        users.getColumns().forEach(column -> names.add(column.getName()));
        assertEquals(Arrays.asList("id", "name", "status", "flag", "created_at"), names);
        assertEquals(Arrays.asList("id"), users.getPrimaryKeyColumns());
        assertEquals("app users", users.getComment());

        Column id = users.getColumn("id").get();
        assertEquals("integer", id.getTargetType());
        assertTrue(id.isAutoIncremented());
        assertFalse(id.isNullable());
        assertEquals("nextval('users_id_seq')", id.getTargetDefault());

        Column name = users.getColumn("name").get();
        assertEquals("varchar(64)", name.getTargetType());
        assertEquals("''", name.getTargetDefault());
        assertEquals("user's name", name.getComment());

        Column status = users.getColumn("status").get();
        assertEquals("varchar(255)", status.getTargetType());
        assertEquals("CHECK (\"status\" IN ('active', 'banned'))", status.getCheckConstraint());

        assertEquals("boolean", users.getColumn("flag").get().getTargetType());
        assertEquals("'0'", users.getColumn("flag").get().getTargetDefault());
        assertEquals("CURRENT_TIMESTAMP", users.getColumn("created_at").get().getTargetDefault());
        assertEquals(1, warnings.count(WarningKind.UNSUPPORTED_CLAUSE));
    }

    @Test
    public void testSequencesIndexesAndComments() {
        SchemaModel model = parser.parse(USERS_DDL);

        List<TableSequence> sequences = new ArrayList<>(model.getSequences());
        assertEquals(1, sequences.size());
        assertEquals("users_id_seq", sequences.get(0).getSequenceName());
        assertEquals("id", sequences.get(0).getColumnName());

        List<TableIndex> indexes = model.getTable("users").get().getIndexes();
        assertEquals(2, indexes.size());
        assertEquals("uk_name", indexes.get(0).getIndexName());
        assertTrue(indexes.get(0).isUnique());
        assertEquals(Arrays.asList("status", "created_at"), indexes.get(1).getColumns());
        assertFalse(indexes.get(1).isUnique());

        List<CommentEntry> comments = new ArrayList<>(model.getComments());
        assertEquals(2, comments.size());
        assertEquals("users.name", comments.get(0).getKey());
        assertEquals("users", comments.get(1).getKey());
    }

    @Test
    public void testForeignKeysArePending() {
        String sql = "CREATE TABLE `a` (`id` int NOT NULL, `b_id` int DEFAULT NULL, PRIMARY KEY (`id`),\n"
            + "  CONSTRAINT `fk_a_b` FOREIGN KEY (`b_id`) REFERENCES `b` (`id`) ON DELETE CASCADE);\n"
            + "CREATE TABLE `b` (`id` int NOT NULL, `a_id` int, PRIMARY KEY (`id`),\n"
            + "  FOREIGN KEY (`a_id`) REFERENCES `a` (`id`) ON UPDATE SET NULL);\n";

        SchemaModel model = parser.parse(sql);

        assertEquals(2, model.getForeignKeys().size());
        TableForeignKey first = model.getForeignKeys().get(0);
        assertEquals("fk_a_b", first.getFkName());
        assertEquals("a", first.getTableName());
        assertEquals("b", first.getReferencedTable());
        assertEquals("CASCADE", first.getOnDelete());
        assertNull(first.getOnUpdate());
        TableForeignKey second = model.getForeignKeys().get(1);
        assertEquals("b_a_id_fkey", second.getFkName());
        assertEquals("SET NULL", second.getOnUpdate());
        assertTrue(model.getTable("a").get().getColumn("b_id").get().isExplicitNullDefault());
    }

    @Test
    public void testInlineKeysAndCreateIndex() {
        String sql = "CREATE TABLE IF NOT EXISTS k (code varchar(8) PRIMARY KEY, email varchar(100) UNIQUE,\n"
            + "  note text CHECK (note <> ''));\n"
            + "CREATE INDEX idx_note ON k (note(10));\n";

        SchemaModel model = parser.parse(sql);

        Table table = model.getTable("k").get();
        assertEquals(Arrays.asList("code"), table.getPrimaryKeyColumns());
        assertEquals("k_email_key", table.getIndexes().get(0).getIndexName());
        assertEquals("idx_note", table.getIndexes().get(1).getIndexName());
        assertEquals(Arrays.asList("note"), table.getIndexes().get(1).getColumns());
        assertEquals(Arrays.asList("CHECK (note <> '')"), table.getCheckConstraints());
    }

    @Test
    public void testIndexNameCollisionAcrossTables() {
        String sql = "CREATE TABLE t1 (name int, KEY idx_name (name));\n"
            + "CREATE TABLE t2 (name int, KEY idx_name (name));\n";

        SchemaModel model = parser.parse(sql);

        assertEquals("idx_name", model.getTable("t1").get().getIndexes().get(0).getIndexName());
        assertEquals("t2_idx_name", model.getTable("t2").get().getIndexes().get(0).getIndexName());
    }

    @Test
    public void testIndexNamedLikeItsTableIsRenamed() {
        String sql = "CREATE TABLE `tag` (`id` int NOT NULL, `tag` varchar(20), PRIMARY KEY (`id`),"
            + " UNIQUE KEY `tag` (`tag`));\n";

        SchemaModel model = parser.parse(sql);

        assertEquals("tag_tag", model.getTable("tag").get().getIndexes().get(0).getIndexName());
    }

    @Test
    public void testLaterTableTakesNameFromIndexAndSequence() {
        String sql = "CREATE TABLE x (id int AUTO_INCREMENT, PRIMARY KEY (id), KEY y (id));\n"
            + "CREATE TABLE y (id int);\n"
            + "CREATE TABLE x_id_seq (v int);\n";

        SchemaModel model = parser.parse(sql);

        Table x = model.getTable("x").get();
        assertEquals("x_y", x.getIndexes().get(0).getIndexName());
        assertEquals("x_id_seq_2", x.getColumn("id").get().getSequenceName());
        assertEquals("nextval('x_id_seq_2')", x.getColumn("id").get().getTargetDefault());
        List<String> sequenceNames = new ArrayList<>();
        for (TableSequence sequence : model.getSequences()) {
            sequenceNames.add(sequence.getSequenceName());
        }
        assertEquals(Arrays.asList("x_id_seq_2"), sequenceNames);
    }

    @Test
    public void testSequenceNameCollisionGetsSuffix() {
        String sql = "CREATE TABLE `a_b` (`c` int NOT NULL AUTO_INCREMENT, PRIMARY KEY (`c`));\n"
            + "CREATE TABLE `a` (`b_c` int NOT NULL AUTO_INCREMENT, PRIMARY KEY (`b_c`));\n";

        SchemaModel model = parser.parse(sql);

        List<String> sequenceNames = new ArrayList<>();
        for (TableSequence sequence : model.getSequences()) {
            sequenceNames.add(sequence.getSequenceName() + "->" + sequence.getTableName());
        }
        assertEquals(Arrays.asList("a_b_c_seq->a_b", "a_b_c_seq_2->a"), sequenceNames);
        assertEquals("nextval('a_b_c_seq_2')", model.getTable("a").get().getColumn("b_c").get().getTargetDefault());
    }

    @Test
    public void testAlterTable() {
        String sql = "CREATE TABLE `orgs` (`id` int NOT NULL, PRIMARY KEY (`id`));\n"
            + "CREATE TABLE `users` (`id` int NOT NULL, `org_id` int);\n"
            + "ALTER TABLE `users` DISABLE KEYS;\n"
            + "ALTER TABLE `users` ADD CONSTRAINT `fk_org` FOREIGN KEY (`org_id`) REFERENCES `orgs` (`id`),"
            + " ADD KEY `idx_org` (`org_id`);\n"
            + "ALTER TABLE `users` COMMENT = 'people';\n"
            + "ALTER TABLE `missing` ADD KEY `k` (`x`);\n";

        SchemaModel model = parser.parse(sql);

        Table users = model.getTable("users").get();
        assertEquals("fk_org", model.getForeignKeys().get(0).getFkName());
        assertEquals("idx_org", users.getIndexes().get(0).getIndexName());
        assertEquals("people", users.getComment());
        assertEquals(1, warnings.count(WarningKind.SKIPPED_STATEMENT));
    }

    @Test
    public void testUnclassifiedClausesAreSkipped() {
        String sql = "CREATE TABLE t (id int, FULLTEXT KEY ft (id), KEY bad (nope), body text) "
            + "PARTITION BY HASH (id);\n"
            + "CREATE TABLE t (other int);\n"
            + "CREATE TABLE t3 LIKE t;\n"
            + "CREATE ALGORITHM=UNDEFINED DEFINER=`root`@`%` VIEW `v` AS select 1;\n";

        SchemaModel model = parser.parse(sql);

        Table table = model.getTable("t").get();
        assertEquals(2, table.getColumns().size());
        assertTrue(table.getIndexes().isEmpty());
        assertFalse(model.hasTable("t3"));
        assertEquals(1, warnings.count(WarningKind.UNKNOWN_COLUMN));
        assertEquals(2, warnings.count(WarningKind.UNSUPPORTED_CLAUSE));
        assertEquals(1, warnings.count(WarningKind.DUPLICATE_OBJECT));
        assertEquals(2, warnings.count(WarningKind.SKIPPED_STATEMENT));
    }

    @Test
    public void testUnterminatedCreateTableIsFatal() {
        try {
            parser.parse("CREATE TABLE ok (id int);\n\nCREATE TABLE `broken` (\n  `id` int,\n  `s` varchar(10)");
            fail("expected DdlParseException");
        } catch (DdlParseException e) {
            assertEquals("broken", e.getTableName());
            assertEquals(3, e.getLine());
        }
    }
}
