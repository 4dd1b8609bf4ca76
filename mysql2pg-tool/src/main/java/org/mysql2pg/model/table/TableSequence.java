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

package org.mysql2pg.model.table;

import lombok.AllArgsConstructor;
import lombok.Data;

import org.mysql2pg.translator.LiteralRewriter;

/**
 * TableSequence, backs one auto increment column
 *
 * @since 2025-04-18
 */
@Data
@AllArgsConstructor
public class TableSequence {
    private String sequenceName;
    private String tableName;
    private String columnName;

    /**
     * nextvalDefault
     *
     * @param sequenceName sequenceName
     * @return column default drawing from the sequence
     */
    public static String nextvalDefault(String sequenceName) {
        return "nextval(" + LiteralRewriter.quoteString(LiteralRewriter.quoteIdentifierIfNeeded(sequenceName)) + ")";
    }
}
