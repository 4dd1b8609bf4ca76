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

package org.mysql2pg.translator;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import org.junit.Test;
import org.mysql2pg.translator.warning.WarningKind;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * TypeMapperTest
 *
 * @since 2025-04-18
 */
public class TypeMapperTest {
    private static final List<String> NO_ARGS = Collections.emptyList();

    @Test
    public void testMappingTable() {
        assertEquals("smallint", type("tinyint", "4"));
        assertEquals("integer", type("int", "11"));
        assertEquals("integer", type("INTEGER"));
        assertEquals("bigint", type("bigint", "20"));
        assertEquals("real", type("float"));
        assertEquals("double precision", type("double"));
        assertEquals("numeric(10,2)", type("decimal", "10", "2"));
        assertEquals("numeric(8,3)", type("numeric", "8", "3"));
        assertEquals("varchar(255)", type("varchar", "255"));
        assertEquals("char(2)", type("char", "2"));
        assertEquals("text", type("longtext"));
        assertEquals("text", type("mediumtext"));
        assertEquals("bytea", type("longblob"));
        assertEquals("timestamp", type("datetime"));
        assertEquals("timestamp(6)", type("timestamp", "6"));
        assertEquals("date", type("date"));
        assertEquals("jsonb", type("json"));
        assertEquals("boolean", type("bit", "1"));
        assertEquals("bit(8)", type("bit", "8"));
    }

    @Test
    public void testEnumGetsCheckConstraint() {
        MappedType mapped = TypeMapper.map("status", "enum", Arrays.asList("'new'", "'it''s'"), "'new'");

        assertEquals("varchar(255)", mapped.getTargetType());
        assertEquals("CHECK (\"status\" IN ('new', 'it''s'))", mapped.getCheckConstraint());
        assertEquals("'new'", mapped.getDefaultValue());
        assertTrue(mapped.getWarnings().isEmpty());
    }

    @Test
    public void testUnknownTypePassesThroughWithWarning() {
        MappedType mapped = TypeMapper.map("shape", "geometry", Arrays.asList("4326"), null);

        assertEquals("geometry(4326)", mapped.getTargetType());
        assertEquals(1, mapped.getWarnings().size());
        assertEquals(WarningKind.UNKNOWN_TYPE, mapped.getWarnings().get(0).getKind());
    }

    @Test
    public void testDefaultRewrite() {
        assertEquals("'0'", defaultOf("bit", "b'0'"));
        assertEquals("'1'", defaultOf("bit", "b'1'"));
        assertEquals("CURRENT_TIMESTAMP", defaultOf("timestamp", "CURRENT_TIMESTAMP"));
        assertEquals("CURRENT_TIMESTAMP", defaultOf("datetime", "current_timestamp(3)"));
        assertEquals("'O''Neil'", defaultOf("varchar", "'O\\'Neil'"));
        assertEquals("'1'", defaultOf("tinyint", "'1'"));
        assertEquals("0", defaultOf("int", "0"));
        assertEquals("'1'", defaultOf("boolean", "1"));
        assertEquals("'\\xFF'", defaultOf("blob", "0xff"));
        assertNull(defaultOf("int", null));
    }

    @Test
    public void testNullDefaultIsMarked() {
        MappedType mapped = TypeMapper.map("c", "varchar", Arrays.asList("10"), "NULL");

        assertTrue(mapped.isNullDefault());
        assertEquals("NULL", mapped.getDefaultValue());
    }

    @Test
    public void testZeroDateDefaultIsDropped() {
        MappedType mapped = TypeMapper.map("created", "datetime", NO_ARGS, "'0000-00-00 00:00:00'");

        assertNull(mapped.getDefaultValue());
        assertFalse(mapped.isNullDefault());
        assertEquals(WarningKind.DROPPED_DEFAULT, mapped.getWarnings().get(0).getKind());
    }

    private static String type(String name, String... args) {
        return TypeMapper.map("c", name, Arrays.asList(args), null).getTargetType();
    }

    private static String defaultOf(String name, String defaultLiteral) {
        return TypeMapper.map("c", name, NO_ARGS, defaultLiteral).getDefaultValue();
    }
}
