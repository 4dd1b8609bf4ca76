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

import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Table
 *
 * @since 2025-04-18
 */
@Data
@NoArgsConstructor
public class Table {
    private String name;
    private List<Column> columns = new ArrayList<>();
    private List<String> primaryKeyColumns = new ArrayList<>();
    private List<TableIndex> indexes = new ArrayList<>();
    private List<String> checkConstraints = new ArrayList<>();
    private String comment;

    /**
     * Constructor
     *
     * @param name name
     */
    public Table(String name) {
        this.name = name;
    }

    /**
     * addColumn
     *
     * @param column column
     * @return false when a column with the same name already exists
     */
    public boolean addColumn(Column column) {
        if (getColumn(column.getName()).isPresent()) {
            return false;
        }
        column.setPosition(columns.size() + 1);
        columns.add(column);
        return true;
    }

    /**
     * getColumn, MySQL column names are case insensitive
     *
     * @param columnName columnName
     * @return column
     */
    public Optional<Column> getColumn(String columnName) {
        return columns.stream().filter(column -> column.getName().equalsIgnoreCase(columnName)).findFirst();
    }

    /**
     * hasIndex
     *
     * @param indexName indexName
     * @return hasIndex
     */
    public boolean hasIndex(String indexName) {
        return indexes.stream().anyMatch(index -> index.getSourceName().equalsIgnoreCase(indexName));
    }
}
