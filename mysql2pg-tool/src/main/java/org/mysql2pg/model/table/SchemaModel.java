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

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * SchemaModel, owner of every table, sequence, foreign key and comment parsed from one dump.
 * Collections keep declaration order.
 *
 * @since 2025-04-18
 */
public class SchemaModel {
    private final Map<String, Table> tables = new LinkedHashMap<>();
    private final Map<String, TableSequence> sequences = new LinkedHashMap<>();
    private final Map<String, CommentEntry> comments = new LinkedHashMap<>();
    @Getter
    private final List<TableForeignKey> foreignKeys = new ArrayList<>();
    private final Map<String, TableIndex> indexes = new HashMap<>();

    /**
     * addTable
     *
     * @param table table
     * @return false when a table with the same name already exists
     */
    public boolean addTable(Table table) {
        if (tables.putIfAbsent(table.getName(), table) != null) {
            return false;
        }
        String key = key(table.getName());
        TableIndex index = indexes.remove(key);
        if (index != null) {
            String name = uniqueRelationName(index.getTableName() + "_" + index.getSourceName());
            index.setIndexName(name);
            indexes.put(key(name), index);
        }
        Optional<TableSequence> sequence = sequences.values().stream()
            .filter(candidate -> key(candidate.getSequenceName()).equals(key))
            .findFirst();
        sequence.ifPresent(this::renameSequence);
        return true;
    }

    /**
     * getTable
     *
     * @param tableName tableName
     * @return table
     */
    public Optional<Table> getTable(String tableName) {
        return Optional.ofNullable(tables.get(tableName));
    }

    /**
     * hasTable
     *
     * @param tableName tableName
     * @return hasTable
     */
    public boolean hasTable(String tableName) {
        return tables.containsKey(tableName);
    }

    /**
     * getTables
     *
     * @return tables in declaration order
     */
    public Collection<Table> getTables() {
        return Collections.unmodifiableCollection(tables.values());
    }

    /**
     * uniqueSequenceName, first free relation name starting from the given one
     *
     * @param name preferred name, usually {@code <table>_<column>_seq}
     * @return name, or name with a numeric suffix when it is taken
     */
    public String uniqueSequenceName(String name) {
        return uniqueRelationName(name);
    }

    /**
     * addSequence, the name must come from {@link #uniqueSequenceName(String)}
     *
     * @param sequence sequence
     */
    public void addSequence(TableSequence sequence) {
        sequences.put(sequence.getSequenceName(), sequence);
    }

    private void renameSequence(TableSequence sequence) {
        String name = uniqueRelationName(sequence.getSequenceName());
        Map<String, TableSequence> renamed = new LinkedHashMap<>();
        sequences.forEach((sequenceName, candidate) -> renamed.put(candidate == sequence ? name : sequenceName,
            candidate));
        sequences.clear();
        sequences.putAll(renamed);
        sequence.setSequenceName(name);
        getTable(sequence.getTableName())
            .flatMap(table -> table.getColumn(sequence.getColumnName()))
            .ifPresent(column -> {
                column.setSequenceName(name);
                column.setTargetDefault(TableSequence.nextvalDefault(name));
            });
    }

    /**
     * getSequences
     *
     * @return sequences in declaration order
     */
    public Collection<TableSequence> getSequences() {
        return Collections.unmodifiableCollection(sequences.values());
    }

    /**
     * addForeignKey
     *
     * @param foreignKey foreignKey
     */
    public void addForeignKey(TableForeignKey foreignKey) {
        foreignKeys.add(foreignKey);
    }

    /**
     * addComment, a later comment on the same object replaces the earlier text
     *
     * @param entry entry
     */
    public void addComment(CommentEntry entry) {
        comments.put(entry.getKey(), entry);
    }

    /**
     * getComments
     *
     * @return comments in declaration order
     */
    public Collection<CommentEntry> getComments() {
        return Collections.unmodifiableCollection(comments.values());
    }

    /**
     * Attach an index to its table. PostgreSQL indexes share one namespace with tables and sequences,
     * so a name already taken by any of them is prefixed with the table name.
     *
     * @param table owning table
     * @param index index
     * @return false when the table already has an index with this name
     */
    public boolean addIndex(Table table, TableIndex index) {
        if (table.hasIndex(index.getSourceName())) {
            return false;
        }
        String name = index.getSourceName();
        if (isRelationNameTaken(name)) {
            name = uniqueRelationName(table.getName() + "_" + index.getSourceName());
        }
        index.setIndexName(name);
        indexes.put(key(name), index);
        table.getIndexes().add(index);
        return true;
    }

    private String uniqueRelationName(String name) {
        String candidate = name;
        int suffix = 2;
        while (isRelationNameTaken(candidate)) {
            candidate = name + "_" + suffix++;
        }
        return candidate;
    }

    private boolean isRelationNameTaken(String name) {
        String key = key(name);
        return indexes.containsKey(key)
            || tables.keySet().stream().anyMatch(tableName -> key(tableName).equals(key))
            || sequences.keySet().stream().anyMatch(sequenceName -> key(sequenceName).equals(key));
    }

    private static String key(String name) {
        return name.toLowerCase(Locale.ROOT);
    }
}
