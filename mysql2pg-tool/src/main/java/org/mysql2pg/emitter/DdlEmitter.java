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

import org.apache.commons.collections4.CollectionUtils;
import org.apache.commons.lang3.StringUtils;
import org.mysql2pg.model.table.Column;
import org.mysql2pg.model.table.CommentEntry;
import org.mysql2pg.model.table.CommentTarget;
import org.mysql2pg.model.table.SchemaModel;
import org.mysql2pg.model.table.Table;
import org.mysql2pg.model.table.TableForeignKey;
import org.mysql2pg.model.table.TableIndex;
import org.mysql2pg.model.table.TableSequence;
import org.mysql2pg.translator.LiteralRewriter;
import org.mysql2pg.translator.warning.ConversionWarnings;
import org.mysql2pg.translator.warning.WarningKind;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Writes a schema model as PostgreSQL DDL in five phases: sequences, tables, indexes, foreign keys
 * and comments. Every phase is complete before the next starts, so a foreign key always finds both
 * of its tables. The model is only read.
 *
 * @since 2025-04-18
 */
public class DdlEmitter {
    /**
     * phase marker format
     */
    public static final String PHASE_MARKER = "-- ===== %s =====";

    private static final String LINE_SEPARATOR = "\n";

    private final ConversionWarnings warnings;

    /**
     * Constructor
     *
     * @param warnings warnings
     */
    public DdlEmitter(ConversionWarnings warnings) {
        this.warnings = warnings;
    }

    /**
     * emit
     *
     * @param model model
     * @return DDL script
     */
    public String emit(SchemaModel model) {
        StringWriter writer = new StringWriter();
        try {
            emit(model, writer);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return writer.toString();
    }

    /**
     * emit
     *
     * @param model model
     * @param writer writer
     * @throws IOException IOException
     */
    public void emit(SchemaModel model, Writer writer) throws IOException {
        writePhase(writer, "SEQUENCES", emitSequences(model), false);
        writePhase(writer, "TABLES", emitTables(model), true);
        writePhase(writer, "INDEXES", emitIndexes(model), true);
        writePhase(writer, "FOREIGN KEYS", emitForeignKeys(model), true);
        writePhase(writer, "COMMENTS", emitComments(model), true);
        writer.flush();
    }

    /**
     * Statements moving every sequence past the highest value loaded into its column.
     *
     * @param model model
     * @return reset script
     */
    public String emitSequenceResets(SchemaModel model) {
        StringBuilder builder = new StringBuilder();
        for (TableSequence sequence : model.getSequences()) {
            builder.append(String.format(Locale.ROOT, "SELECT setval(%s, COALESCE((SELECT MAX(%s) FROM %s), 0) + 1, "
                    + "false);",
                LiteralRewriter.quoteString(LiteralRewriter.quoteIdentifierIfNeeded(sequence.getSequenceName())),
                LiteralRewriter.quoteIdentifier(sequence.getColumnName()),
                LiteralRewriter.quoteIdentifier(sequence.getTableName())))
                .append(LINE_SEPARATOR);
        }
        return builder.toString();
    }

    private void writePhase(Writer writer, String phase, List<String> statements, boolean isSeparated)
        throws IOException {
        if (isSeparated) {
            writer.write(LINE_SEPARATOR);
        }
        writer.write(String.format(Locale.ROOT, PHASE_MARKER, phase));
        writer.write(LINE_SEPARATOR);
        for (String statement : statements) {
            writer.write(statement);
            writer.write(LINE_SEPARATOR);
        }
    }

    private List<String> emitSequences(SchemaModel model) {
        return model.getSequences().stream()
            .map(sequence -> "CREATE SEQUENCE " + LiteralRewriter.quoteIdentifierIfNeeded(sequence.getSequenceName())
                + ";")
            .collect(Collectors.toList());
    }

    private List<String> emitTables(SchemaModel model) {
        List<String> statements = new ArrayList<>();
        for (Table table : model.getTables()) {
            statements.add(buildCreateTable(table));
            for (Column column : table.getColumns()) {
                if (column.isAutoIncremented()) {
                    statements.add("ALTER SEQUENCE " + LiteralRewriter.quoteIdentifierIfNeeded(column.getSequenceName())
                        + " OWNED BY " + LiteralRewriter.quoteIdentifier(table.getName()) + "."
                        + LiteralRewriter.quoteIdentifier(column.getName()) + ";");
                }
            }
        }
        return statements;
    }

    private String buildCreateTable(Table table) {
        List<String> definitions = new ArrayList<>();
        for (Column column : table.getColumns()) {
            definitions.add(buildColumn(column));
        }
        if (CollectionUtils.isNotEmpty(table.getPrimaryKeyColumns())) {
            definitions.add("PRIMARY KEY (" + quoteColumns(table.getPrimaryKeyColumns()) + ")");
        }
        definitions.addAll(table.getCheckConstraints());
        return "CREATE TABLE " + LiteralRewriter.quoteIdentifier(table.getName()) + " ("
            + String.join(", ", definitions) + ");";
    }

    private String buildColumn(Column column) {
        StringBuilder builder = new StringBuilder(LiteralRewriter.quoteIdentifier(column.getName()))
            .append(' ').append(column.getTargetType());
        if (StringUtils.isNotEmpty(column.getTargetDefault())) {
            builder.append(" DEFAULT ").append(column.getTargetDefault());
        }
        if (!column.isNullable()) {
            builder.append(" NOT NULL");
        }
        if (StringUtils.isNotEmpty(column.getCheckConstraint())) {
            builder.append(' ').append(column.getCheckConstraint());
        }
        return builder.toString();
    }

    private List<String> emitIndexes(SchemaModel model) {
        List<String> statements = new ArrayList<>();
        for (Table table : model.getTables()) {
            for (TableIndex index : table.getIndexes()) {
                statements.add("CREATE " + (index.isUnique() ? "UNIQUE " : "") + "INDEX "
                    + LiteralRewriter.quoteIdentifier(index.getIndexName()) + " ON "
                    + LiteralRewriter.quoteIdentifier(table.getName()) + " (" + quoteColumns(index.getColumns())
                    + ");");
            }
        }
        return statements;
    }

    private List<String> emitForeignKeys(SchemaModel model) {
        List<String> statements = new ArrayList<>();
        for (TableForeignKey foreignKey : model.getForeignKeys()) {
            if (!model.hasTable(foreignKey.getTableName()) || !model.hasTable(foreignKey.getReferencedTable())) {
                warnings.warn(WarningKind.DROPPED_FOREIGN_KEY, foreignKey.getFkName(), String.format(Locale.ROOT,
                    "foreign key from %s to %s skipped, both tables must be defined", foreignKey.getTableName(),
                    foreignKey.getReferencedTable()));
                continue;
            }
            if (CollectionUtils.isEmpty(foreignKey.getColumns())
                || foreignKey.getColumns().size() != foreignKey.getReferencedColumns().size()) {
                warnings.warn(WarningKind.DROPPED_FOREIGN_KEY, foreignKey.getFkName(),
                    "foreign key skipped, column lists do not match");
                continue;
            }
            StringBuilder builder = new StringBuilder("ALTER TABLE ")
                .append(LiteralRewriter.quoteIdentifier(foreignKey.getTableName()))
                .append(" ADD CONSTRAINT ").append(LiteralRewriter.quoteIdentifier(foreignKey.getFkName()))
                .append(" FOREIGN KEY (").append(quoteColumns(foreignKey.getColumns())).append(") REFERENCES ")
                .append(LiteralRewriter.quoteIdentifier(foreignKey.getReferencedTable()))
                .append(" (").append(quoteColumns(foreignKey.getReferencedColumns())).append(')');
            if (foreignKey.getOnDelete() != null) {
                builder.append(" ON DELETE ").append(foreignKey.getOnDelete());
            }
            if (foreignKey.getOnUpdate() != null) {
                builder.append(" ON UPDATE ").append(foreignKey.getOnUpdate());
            }
            statements.add(builder.append(';').toString());
        }
        return statements;
    }

    private List<String> emitComments(SchemaModel model) {
        List<String> statements = new ArrayList<>();
        for (CommentEntry comment : model.getComments()) {
            if (!model.hasTable(comment.getTableName())) {
                continue;
            }
            String target = LiteralRewriter.quoteIdentifier(comment.getTableName());
            if (comment.getTarget() == CommentTarget.COLUMN) {
                statements.add("COMMENT ON COLUMN " + target + "." + LiteralRewriter.quoteIdentifier(
                    comment.getColumnName()) + " IS " + LiteralRewriter.quoteString(comment.getText()) + ";");
            } else {
                statements.add("COMMENT ON TABLE " + target + " IS " + LiteralRewriter.quoteString(comment.getText())
                    + ";");
            }
        }
        return statements;
    }

    private static String quoteColumns(List<String> columns) {
        return columns.stream().map(LiteralRewriter::quoteIdentifier).collect(Collectors.joining(", "));
    }
}
