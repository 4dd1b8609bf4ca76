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

package org.mysql2pg.emitter;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.junit.Before;
import org.junit.Test;
import org.mysql2pg.model.table.SchemaModel;
import org.mysql2pg.model.table.TableForeignKey;
import org.mysql2pg.parser.DdlParser;
import org.mysql2pg.translator.warning.ConversionWarnings;
import org.mysql2pg.translator.warning.WarningKind;

import java.util.Arrays;

/**
 * DdlEmitterTest
 *
 * @since 2025-04-18
 */
public class DdlEmitterTest {
    private ConversionWarnings warnings;
    private DdlEmitter emitter;

    @Before
    public void setUp() {
        warnings = new ConversionWarnings();
        emitter = new DdlEmitter(warnings);
    }

    @Test
    public void testSequenceBeforeTable() {
        SchemaModel model = parse("CREATE TABLE `t` (`id` int NOT NULL AUTO_INCREMENT, PRIMARY KEY (`id`));");

        String expected = "-- ===== SEQUENCES =====\n"
            + "CREATE SEQUENCE t_id_seq;\n"
            + "\n"
            + "-- ===== TABLES =====\n"
            + "CREATE TABLE \"t\" (\"id\" integer DEFAULT nextval('t_id_seq') NOT NULL, PRIMARY KEY (\"id\"));\n"
            + "ALTER SEQUENCE t_id_seq OWNED BY \"t\".\"id\";\n"
            + "\n"
            + "-- ===== INDEXES =====\n"
            + "\n"
            + "-- ===== FOREIGN KEYS =====\n"
            + "\n"
            + "-- ===== COMMENTS =====\n";
        assertEquals(expected, emitter.emit(model));
        assertEquals("SELECT setval('t_id_seq', COALESCE((SELECT MAX(\"id\") FROM \"t\"), 0) + 1, false);\n",
            emitter.emitSequenceResets(model));
    }

    @Test
    public void testFullTable() {
        String ddl = emitter.emit(parse(
            "CREATE TABLE `users` (\n"
            + "  `id` int(11) NOT NULL,\n"
            + "  `name` varchar(64) NOT NULL DEFAULT '' COMMENT 'user\\'s name',\n"
            + "  `status` enum('active','banned') DEFAULT 'active',\n"
            + "  `email` varchar(100) DEFAULT NULL,\n"
            + "  PRIMARY KEY (`id`),\n"
            + "  UNIQUE KEY `uk_name` (`name`),\n"
            + "  KEY `idx_status` (`status`)\n"
            + ") ENGINE=InnoDB DEFAULT CHARSET=utf8mb4 COMMENT='app users';"));

        assertTrue(ddl.contains("CREATE TABLE \"users\" (\"id\" integer NOT NULL, "
            + "\"name\" varchar(64) DEFAULT '' NOT NULL, "
            + "\"status\" varchar(255) DEFAULT 'active' CHECK (\"status\" IN ('active', 'banned')), "
            + "\"email\" varchar(100) DEFAULT NULL, PRIMARY KEY (\"id\"));\n"));
        assertTrue(ddl.contains("CREATE UNIQUE INDEX \"uk_name\" ON \"users\" (\"name\");\n"));
        assertTrue(ddl.contains("CREATE INDEX \"idx_status\" ON \"users\" (\"status\");\n"));
        assertTrue(ddl.contains("COMMENT ON COLUMN \"users\".\"name\" IS 'user''s name';\n"));
        assertTrue(ddl.contains("COMMENT ON TABLE \"users\" IS 'app users';\n"));
        assertFalse(ddl.contains("ENGINE"));
        assertFalse(ddl.contains("CHARSET"));
        assertEquals("", emitter.emitSequenceResets(parse("CREATE TABLE plain (id int);")));
    }

    @Test
    public void testIndexNeverReusesTableName() {
        String ddl = emitter.emit(parse("CREATE TABLE `tag` (`id` int NOT NULL, `tag` varchar(20), "
            + "PRIMARY KEY (`id`), UNIQUE KEY `tag` (`tag`));"));

        assertTrue(ddl.contains("CREATE UNIQUE INDEX \"tag_tag\" ON \"tag\" (\"tag\");\n"));
        assertFalse(ddl.contains("INDEX \"tag\" ON"));
    }

    @Test
    public void testMutualForeignKeysAfterAllTables() {
        SchemaModel model = parse("CREATE TABLE a (id int NOT NULL, b_id int, PRIMARY KEY (id),\n"
            + "  CONSTRAINT fk_a_b FOREIGN KEY (b_id) REFERENCES b (id));\n"
            + "CREATE TABLE b (id int NOT NULL, a_id int, PRIMARY KEY (id),\n"
            + "  CONSTRAINT fk_b_a FOREIGN KEY (a_id) REFERENCES a (id) ON DELETE SET NULL);\n");

        String ddl = emitter.emit(model);

        int lastTable = ddl.indexOf("CREATE TABLE \"b\"");
        int fkPhase = ddl.indexOf("-- ===== FOREIGN KEYS =====");
        int fkA = ddl.indexOf("ALTER TABLE \"a\" ADD CONSTRAINT \"fk_a_b\" FOREIGN KEY (\"b_id\") REFERENCES \"b\" "
            + "(\"id\");");
        int fkB = ddl.indexOf("ALTER TABLE \"b\" ADD CONSTRAINT \"fk_b_a\" FOREIGN KEY (\"a_id\") REFERENCES \"a\" "
            + "(\"id\") ON DELETE SET NULL;");
        assertTrue(ddl.indexOf("CREATE TABLE \"a\"") < lastTable);
        assertTrue(lastTable < fkPhase);
        assertTrue(fkPhase < fkA);
        assertTrue(fkA < fkB);
        assertTrue(fkB < ddl.indexOf("-- ===== COMMENTS ====="));
        assertFalse(ddl.substring(0, fkPhase).contains("FOREIGN KEY"));
    }

    @Test
    public void testEmitIsIdempotent() {
        SchemaModel model = parse(
            "CREATE TABLE p (id int NOT NULL AUTO_INCREMENT, PRIMARY KEY (id)) COMMENT 'parent';\n"
            + "CREATE TABLE c (id int, p_id int, KEY (p_id), FOREIGN KEY (p_id) REFERENCES p (id));");

        assertEquals(emitter.emit(model), emitter.emit(model));
        assertEquals(emitter.emitSequenceResets(model), emitter.emitSequenceResets(model));
    }

    @Test
    public void testForeignKeyToUndefinedTableIsDropped() {
        SchemaModel model = parse("CREATE TABLE c (id int, x_id int, "
            + "CONSTRAINT fk_x FOREIGN KEY (x_id) REFERENCES missing (id));");
        model.addForeignKey(TableForeignKey.builder().fkName("fk_bad").tableName("c")
            .columns(Arrays.asList("id", "x_id")).referencedTable("c").referencedColumns(Arrays.asList("id"))
            .build());

        String ddl = emitter.emit(model);

        assertFalse(ddl.contains("fk_x"));
        assertFalse(ddl.contains("fk_bad"));
        assertEquals(2, warnings.count(WarningKind.DROPPED_FOREIGN_KEY));
    }

    @Test
    public void testQuotedSequenceName() {
        SchemaModel model = parse("CREATE TABLE `Order` (`Id` int AUTO_INCREMENT PRIMARY KEY);");

        String ddl = emitter.emit(model);

        assertTrue(ddl.contains("CREATE SEQUENCE \"Order_Id_seq\";\n"));
        assertTrue(ddl.contains("\"Id\" integer DEFAULT nextval('\"Order_Id_seq\"') NOT NULL"));
        assertTrue(emitter.emitSequenceResets(model).startsWith("SELECT setval('\"Order_Id_seq\"', "));
    }

    private SchemaModel parse(String sql) {
        return new DdlParser(warnings).parse(sql);
    }
}
