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

import lombok.Getter;

import java.util.Locale;
import java.util.Set;

/**
 * MySqlColumnType
 *
 * @since 2025-04-18
 */
@Getter
public enum MySqlColumnType {
    MY_TINYINT("tinyint", "smallint"),
    MY_SMALLINT("smallint", "smallint"),
    MY_MEDIUMINT("mediumint", "integer"),
    MY_INT("int", "integer"),
    MY_INTEGER("integer", "integer"),
    MY_BIGINT("bigint", "bigint"),
    MY_FLOAT("float", "real"),
    MY_REAL("real", "real"),
    MY_DOUBLE("double", "double precision"),
    MY_DOUBLE_PRECISION("double precision", "double precision"),
    MY_DECIMAL("decimal", "numeric"),
    MY_DEC("dec", "numeric"),
    MY_NUMERIC("numeric", "numeric"),
    MY_CHAR("char", "char"),
    MY_VARCHAR("varchar", "varchar"),
    MY_TINYTEXT("tinytext", "text"),
    MY_TEXT("text", "text"),
    MY_MEDIUMTEXT("mediumtext", "text"),
    MY_LONGTEXT("longtext", "text"),
    MY_TINYBLOB("tinyblob", "bytea"),
    MY_BLOB("blob", "bytea"),
    MY_MEDIUMBLOB("mediumblob", "bytea"),
    MY_LONGBLOB("longblob", "bytea"),
    MY_BINARY("binary", "bytea"),
    MY_VARBINARY("varbinary", "bytea"),
    MY_DATETIME("datetime", "timestamp"),
    MY_TIMESTAMP("timestamp", "timestamp"),
    MY_DATE("date", "date"),
    MY_TIME("time", "time"),
    MY_YEAR("year", "smallint"),
    MY_JSON("json", "jsonb"),
    MY_BIT("bit", "boolean"),
    MY_BOOL("bool", "boolean"),
    MY_BOOLEAN("boolean", "boolean"),
    MY_ENUM("enum", "varchar(255)"),
    MY_SET("set", "text");

    static final Set<MySqlColumnType> LENGTH_TYPE_SET = Set.of(MY_CHAR, MY_VARCHAR);
    static final Set<MySqlColumnType> NUMERICS_SET = Set.of(MY_DECIMAL, MY_DEC, MY_NUMERIC);
    static final Set<MySqlColumnType> FRACTION_TYPE_SET = Set.of(MY_DATETIME, MY_TIMESTAMP, MY_TIME);

    private final String myType;
    private final String pgType;

    MySqlColumnType(String myType, String pgType) {
        this.myType = myType;
        this.pgType = pgType;
    }

    /**
     * getColumnType
     *
     * @param typeName typeName
     * @return column type or null when the name is unknown
     */
    public static MySqlColumnType getColumnType(String typeName) {
        String name = typeName.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");
        for (MySqlColumnType columnType : values()) {
            if (columnType.getMyType().equals(name)) {
                return columnType;
            }
        }
        return null;
    }
}
