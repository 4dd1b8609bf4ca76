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

/**
 * CommentEntry
 *
 * @since 2025-04-18
 */
@Data
@AllArgsConstructor
public class CommentEntry {
    private CommentTarget target;
    private String tableName;
    private String columnName;
    private String text;

    /**
     * tableComment
     *
     * @param tableName tableName
     * @param text text
     * @return CommentEntry
     */
    public static CommentEntry tableComment(String tableName, String text) {
        return new CommentEntry(CommentTarget.TABLE, tableName, null, text);
    }

    /**
     * columnComment
     *
     * @param tableName tableName
     * @param columnName columnName
     * @param text text
     * @return CommentEntry
     */
    public static CommentEntry columnComment(String tableName, String columnName, String text) {
        return new CommentEntry(CommentTarget.COLUMN, tableName, columnName, text);
    }

    /**
     * getKey
     *
     * @return table or table.column
     */
    public String getKey() {
        return target == CommentTarget.TABLE ? tableName : tableName + "." + columnName;
    }
}
