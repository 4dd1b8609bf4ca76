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

import org.apache.commons.lang3.StringUtils;
import org.mysql2pg.exception.DdlParseException;
import org.mysql2pg.model.data.RawStatement;
import org.mysql2pg.model.table.Column;
import org.mysql2pg.model.table.CommentEntry;
import org.mysql2pg.model.table.SchemaModel;
import org.mysql2pg.model.table.Table;
import org.mysql2pg.model.table.TableForeignKey;
import org.mysql2pg.model.table.TableIndex;
import org.mysql2pg.model.table.TableSequence;
import org.mysql2pg.parser.ClauseToken.TokenType;
import org.mysql2pg.translator.LiteralRewriter;
import org.mysql2pg.translator.MappedType;
import org.mysql2pg.translator.SqlDialect;
import org.mysql2pg.translator.SqlScanner;
import org.mysql2pg.translator.TypeMapper;
import org.mysql2pg.translator.warning.ConversionWarnings;
import org.mysql2pg.translator.warning.WarningKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * DdlParser, rebuilds the schema model from the CREATE and ALTER statements of a MySQL dump
 *
 * @since 2025-04-18
 */
public class DdlParser {
    private static final Logger LOGGER = LoggerFactory.getLogger(DdlParser.class);
    private static final Set<String> KEPT_KEYWORDS = Set.of("CREATE", "ALTER");
    private static final Set<String> OBJECT_KINDS = Set.of("TABLE", "INDEX", "DATABASE", "SCHEMA", "VIEW",
        "TRIGGER", "PROCEDURE", "FUNCTION", "EVENT");
    private static final Set<String> VALUE_MODIFIERS = Set.of("COLLATE", "CHARSET", "COLUMN_FORMAT", "STORAGE",
        "SRID");
    private static final Set<String> IGNORED_MODIFIERS = Set.of("UNSIGNED", "SIGNED", "ZEROFILL", "VISIBLE",
        "INVISIBLE", "BINARY", "ASCII", "UNICODE", "SERIAL");

    private final ConversionWarnings warnings;
    private SchemaModel model;

    /**
     * Constructor
     *
     * @param warnings warnings
     */
    public DdlParser(ConversionWarnings warnings) {
        this.warnings = warnings;
    }

    /**
     * parse
     *
     * @param sql dump text
     * @return SchemaModel
     */
    public SchemaModel parse(String sql) {
        return parse(new StringReader(sql));
    }

    /**
     * parse, statements other than CREATE and ALTER are skipped without being buffered
     *
     * @param reader dump reader
     * @return SchemaModel
     */
    public SchemaModel parse(Reader reader) {
        model = new SchemaModel();
        try (SqlStatementReader statements = new SqlStatementReader(reader, SqlDialect.MYSQL,
            KEPT_KEYWORDS::contains)) {
            while (statements.hasNext()) {
                parseStatement(statements.next());
            }
        } catch (IOException e) {
            throw new UncheckedIOException("fail to close dump reader", e);
        }
        LOGGER.info("parsed {} tables, {} sequences, {} foreign keys and {} comments.", model.getTables().size(),
            model.getSequences().size(), model.getForeignKeys().size(), model.getComments().size());
        return model;
    }

    private void parseStatement(RawStatement statement) {
        String text = stripTerminator(statement.getText());
        TokenCursor cursor = new TokenCursor(ClauseTokenizer.tokenize(text));
        if (cursor.acceptWords("ALTER")) {
            parseAlter(cursor, text, statement);
            return;
        }
        cursor.next();
        String kind = findObjectKind(cursor);
        if (kind == null) {
            warnings.warn(WarningKind.SKIPPED_STATEMENT, abbreviate(text), "unrecognised CREATE statement skipped");
            return;
        }
        switch (kind) {
            case "TABLE":
                parseCreateTable(cursor, statement);
                break;
            case "INDEX":
                parseCreateIndex(cursor, text);
                break;
            case "DATABASE":
            case "SCHEMA":
                LOGGER.debug("ignore statement: {}", text);
                break;
            default:
                warnings.warn(WarningKind.SKIPPED_STATEMENT, "CREATE " + kind, "object kind is not converted");
        }
    }

    private String findObjectKind(TokenCursor cursor) {
        ClauseToken token;
        while ((token = cursor.next()) != null) {
            if (token.getType() == TokenType.WORD) {
                String word = token.getText().toUpperCase(Locale.ROOT);
                if (OBJECT_KINDS.contains(word)) {
                    return word;
                }
            }
            if (token.getType() == TokenType.GROUP) {
                return null;
            }
        }
        return null;
    }

    private void parseCreateTable(TokenCursor cursor, RawStatement statement) {
        cursor.acceptWords("IF", "NOT", "EXISTS");
        String tableName = cursor.readName();
        if (tableName == null) {
            warnings.warn(WarningKind.SKIPPED_STATEMENT, "CREATE TABLE", "table name is missing");
            return;
        }
        if (!statement.isBalanced()) {
            throw new DdlParseException(tableName, statement.getLine(),
                "statement is not terminated before end of input");
        }
        ClauseToken body = cursor.next();
        if (body == null || body.getType() != TokenType.GROUP) {
            warnings.warn(WarningKind.SKIPPED_STATEMENT, tableName, "CREATE TABLE without column list (LIKE or "
                + "AS SELECT) is not converted");
            return;
        }
        Table table = new Table(tableName);
        if (!model.addTable(table)) {
            warnings.warn(WarningKind.DUPLICATE_OBJECT, tableName, "table is declared twice, later one skipped");
            return;
        }
        for (String item : SqlScanner.splitTopLevel(body.getValue(), ',', SqlDialect.MYSQL)) {
            parseBodyItem(table, item, false);
        }
        parseTableOptions(table, cursor);
    }

    private void parseBodyItem(Table table, String item, boolean isAlter) {
        TokenCursor cursor = new TokenCursor(ClauseTokenizer.tokenize(item));
        String constraintName = null;
        boolean hasConstraintKeyword = cursor.acceptWords("CONSTRAINT");
        if (hasConstraintKeyword && !isConstraintStart(cursor)) {
            constraintName = cursor.readName();
        }
        if (cursor.acceptWords("PRIMARY", "KEY")) {
            parsePrimaryKey(table, cursor);
        } else if (cursor.acceptWords("UNIQUE")) {
            if (!cursor.acceptWords("KEY")) {
                cursor.acceptWords("INDEX");
            }
            parseIndex(table, cursor, constraintName, true);
        } else if (!hasConstraintKeyword && (cursor.acceptWords("KEY") || cursor.acceptWords("INDEX"))) {
            parseIndex(table, cursor, null, false);
        } else if (!hasConstraintKeyword && (cursor.isWord("FULLTEXT") || cursor.isWord("SPATIAL"))) {
            warnings.warn(WarningKind.UNSUPPORTED_CLAUSE, table.getName(), "index skipped: " + abbreviate(item));
        } else if (cursor.acceptWords("FOREIGN", "KEY")) {
            parseForeignKey(table, cursor, constraintName);
        } else if (cursor.acceptWords("CHECK")) {
            parseTableCheck(table, cursor, constraintName);
        } else if (!hasConstraintKeyword && !isAlter && cursor.peek() != null && cursor.peek().isName()) {
            parseColumn(table, cursor);
        } else {
            warnings.warn(WarningKind.UNSUPPORTED_CLAUSE, table.getName(), "clause skipped: " + abbreviate(item));
        }
    }

    private boolean isConstraintStart(TokenCursor cursor) {
        return cursor.isWord("PRIMARY") || cursor.isWord("UNIQUE") || cursor.isWord("FOREIGN")
            || cursor.isWord("CHECK");
    }

    private void parsePrimaryKey(Table table, TokenCursor cursor) {
        skipIndexType(cursor);
        ClauseToken group = cursor.next();
        if (group == null || group.getType() != TokenType.GROUP) {
            warnings.warn(WarningKind.UNSUPPORTED_CLAUSE, table.getName(), "primary key without column list");
            return;
        }
        setPrimaryKey(table, parseKeyColumns(group.getValue()));
    }

    private void setPrimaryKey(Table table, List<String> keyColumns) {
        if (!table.getPrimaryKeyColumns().isEmpty()) {
            warnings.warn(WarningKind.DUPLICATE_OBJECT, table.getName(), "second primary key skipped");
            return;
        }
        for (String keyColumn : keyColumns) {
            Optional<Column> column = table.getColumn(keyColumn);
            if (column.isPresent()) {
                table.getPrimaryKeyColumns().add(column.get().getName());
            } else {
                warnings.warn(WarningKind.UNKNOWN_COLUMN, table.getName(),
                    "primary key column " + keyColumn + " does not exist and is dropped from the key");
            }
        }
    }

    private void parseIndex(Table table, TokenCursor cursor, String constraintName, boolean isUnique) {
        String indexName = constraintName;
        ClauseToken token = cursor.peek();
        if (token != null && token.getType() != TokenType.GROUP && !token.isWord("USING")) {
            String declared = cursor.readName();
            indexName = declared != null ? declared : indexName;
        }
        skipIndexType(cursor);
        ClauseToken group = cursor.next();
        if (group == null || group.getType() != TokenType.GROUP) {
            warnings.warn(WarningKind.UNSUPPORTED_CLAUSE, table.getName(), "index without column list skipped");
            return;
        }
        addIndex(table, indexName, parseKeyColumns(group.getValue()), isUnique);
    }

    private void addIndex(Table table, String declaredName, List<String> keyColumns, boolean isUnique) {
        if (keyColumns.isEmpty()) {
            warnings.warn(WarningKind.UNSUPPORTED_CLAUSE, table.getName(),
                "index on expressions is not converted: " + declaredName);
            return;
        }
        List<String> columns = new ArrayList<>();
        for (String keyColumn : keyColumns) {
            Optional<Column> column = table.getColumn(keyColumn);
            if (!column.isPresent()) {
                warnings.warn(WarningKind.UNKNOWN_COLUMN, table.getName(),
                    "index column " + keyColumn + " does not exist, index skipped");
                return;
            }
            columns.add(column.get().getName());
        }
        String indexName = declaredName != null ? declaredName
            : table.getName() + "_" + String.join("_", columns) + (isUnique ? "_key" : "_idx");
        if (!model.addIndex(table, new TableIndex(indexName, table.getName(), columns, isUnique))) {
            warnings.warn(WarningKind.DUPLICATE_OBJECT, table.getName(), "index " + indexName + " declared twice");
        }
    }

    private void skipIndexType(TokenCursor cursor) {
        if (cursor.acceptWords("USING")) {
            cursor.next();
        }
    }

    /**
     * Column names of an index key list, prefix lengths and sort order dropped.
     * Empty when any key part is an expression.
     *
     * @param keyList text between the parentheses
     * @return column names
     */
    private List<String> parseKeyColumns(String keyList) {
        List<String> columns = new ArrayList<>();
        for (String part : SqlScanner.splitTopLevel(keyList, ',', SqlDialect.MYSQL)) {
            ClauseToken first = ClauseTokenizer.tokenize(part).get(0);
            if (first.getType() != TokenType.WORD && first.getType() != TokenType.QUOTED_IDENTIFIER) {
                return Collections.emptyList();
            }
            columns.add(first.getValue());
        }
        return columns;
    }

    private void parseForeignKey(Table table, TokenCursor cursor, String constraintName) {
        String fkName = constraintName;
        ClauseToken token = cursor.peek();
        if (token != null && token.getType() != TokenType.GROUP) {
            String declared = cursor.readName();
            fkName = fkName != null ? fkName : declared;
        }
        ClauseToken localGroup = cursor.next();
        if (localGroup == null || localGroup.getType() != TokenType.GROUP || !cursor.acceptWords("REFERENCES")) {
            warnings.warn(WarningKind.UNSUPPORTED_CLAUSE, table.getName(), "malformed foreign key skipped");
            return;
        }
        String referencedTable = cursor.readName();
        ClauseToken referencedGroup = cursor.next();
        if (referencedTable == null || referencedGroup == null || referencedGroup.getType() != TokenType.GROUP) {
            warnings.warn(WarningKind.UNSUPPORTED_CLAUSE, table.getName(), "malformed foreign key skipped");
            return;
        }
        List<String> columns = parseKeyColumns(localGroup.getValue());
        TableForeignKey.TableForeignKeyBuilder builder = TableForeignKey.builder()
            .tableName(table.getName())
            .columns(columns)
            .referencedTable(referencedTable)
            .referencedColumns(parseKeyColumns(referencedGroup.getValue()))
            .fkName(fkName != null ? fkName : table.getName() + "_" + String.join("_", columns) + "_fkey");
        while (cursor.hasNext()) {
            if (cursor.acceptWords("ON", "DELETE")) {
                builder.onDelete(readReferenceAction(cursor));
            } else if (cursor.acceptWords("ON", "UPDATE")) {
                builder.onUpdate(readReferenceAction(cursor));
            } else if (cursor.acceptWords("MATCH")) {
                cursor.next();
            } else {
                warnings.warn(WarningKind.UNSUPPORTED_CLAUSE, table.getName(),
                    "foreign key option skipped: " + cursor.next().getText());
            }
        }
        model.addForeignKey(builder.build());
    }

    private String readReferenceAction(TokenCursor cursor) {
        if (cursor.acceptWords("SET", "NULL")) {
            return "SET NULL";
        }
        if (cursor.acceptWords("SET", "DEFAULT")) {
            return "SET DEFAULT";
        }
        if (cursor.acceptWords("NO", "ACTION")) {
            return "NO ACTION";
        }
        ClauseToken action = cursor.next();
        return action == null ? null : action.getText().toUpperCase(Locale.ROOT);
    }

    private void parseTableCheck(Table table, TokenCursor cursor, String constraintName) {
        ClauseToken group = cursor.next();
        if (group == null || group.getType() != TokenType.GROUP) {
            warnings.warn(WarningKind.UNSUPPORTED_CLAUSE, table.getName(), "check without expression skipped");
            return;
        }
        String check = "CHECK (" + LiteralRewriter.rewrite(group.getValue()) + ")";
        if (constraintName != null) {
            check = "CONSTRAINT " + LiteralRewriter.quoteIdentifier(constraintName) + " " + check;
        }
        table.getCheckConstraints().add(check);
    }

    private void parseColumn(Table table, TokenCursor cursor) {
        String columnName = cursor.next().getValue();
        ClauseToken typeToken = cursor.next();
        if (typeToken == null || typeToken.getType() != TokenType.WORD) {
            warnings.warn(WarningKind.UNSUPPORTED_CLAUSE, table.getName(),
                "column " + columnName + " has no type and is skipped");
            return;
        }
        String typeName = typeToken.getText();
        if (typeToken.isWord("DOUBLE") && cursor.acceptWords("PRECISION")) {
            typeName = "double precision";
        }
        List<String> typeArgs = new ArrayList<>();
        if (cursor.peek() != null && cursor.peek().getType() == TokenType.GROUP) {
            typeArgs.addAll(SqlScanner.splitTopLevel(cursor.next().getValue(), ',', SqlDialect.MYSQL));
        }
        ColumnDefinition definition = new ColumnDefinition();
        while (cursor.hasNext()) {
            parseColumnModifier(table, columnName, cursor, definition);
        }
        Column column = buildColumn(table, columnName, typeName, typeArgs, definition);
        if (!table.addColumn(column)) {
            warnings.warn(WarningKind.DUPLICATE_OBJECT, table.getName(),
                "column " + columnName + " declared twice, later one skipped");
            return;
        }
        if (column.isAutoIncremented()) {
            model.addSequence(new TableSequence(column.getSequenceName(), table.getName(), columnName));
        }
        if (definition.comment != null) {
            model.addComment(CommentEntry.columnComment(table.getName(), columnName, definition.comment));
        }
        if (definition.check != null) {
            table.getCheckConstraints().add(definition.check);
        }
        if (definition.isPrimaryKey) {
            setPrimaryKey(table, Collections.singletonList(columnName));
        }
        if (definition.isUnique) {
            addIndex(table, null, Collections.singletonList(columnName), true);
        }
    }

    private Column buildColumn(Table table, String columnName, String typeName, List<String> typeArgs,
        ColumnDefinition definition) {
        MappedType mapped = TypeMapper.map(columnName, typeName, typeArgs, definition.defaultExpression);
        warnings.addAll(mapped.getWarnings());
        Column column = Column.builder()
            .name(columnName)
            .typeName(typeName)
            .typeArgs(typeArgs)
            .targetType(mapped.getTargetType())
            .nullable(definition.isNullable)
            .defaultValueExpression(definition.defaultExpression)
            .targetDefault(mapped.getDefaultValue())
            .isExplicitNullDefault(mapped.isNullDefault())
            .checkConstraint(mapped.getCheckConstraint())
            .comment(definition.comment)
            .build();
        if (definition.isAutoIncrement) {
            String sequenceName = model.uniqueSequenceName(table.getName() + "_" + columnName + "_seq");
            column.setAutoIncremented(true);
            column.setSequenceName(sequenceName);
            column.setTargetDefault(TableSequence.nextvalDefault(sequenceName));
            column.setExplicitNullDefault(false);
            column.setNullable(false);
        } else if (column.isExplicitNullDefault() && !column.isNullable()) {
            warnings.warn(WarningKind.DROPPED_DEFAULT, table.getName() + "." + columnName,
                "DEFAULT NULL on a NOT NULL column is dropped");
            column.setTargetDefault(null);
            column.setExplicitNullDefault(false);
        }
        return column;
    }

    private void parseColumnModifier(Table table, String columnName, TokenCursor cursor,
        ColumnDefinition definition) {
        String construct = table.getName() + "." + columnName;
        ClauseToken token = cursor.peek();
        String word = token.getType() == TokenType.WORD ? token.getText().toUpperCase(Locale.ROOT) : "";
        if (IGNORED_MODIFIERS.contains(word)) {
            cursor.next();
        } else if (cursor.acceptWords("NOT", "NULL")) {
            definition.isNullable = false;
        } else if (cursor.acceptWords("NULL")) {
            definition.isNullable = true;
        } else if (cursor.acceptWords("DEFAULT")) {
            definition.defaultExpression = readExpression(cursor);
        } else if (cursor.acceptWords("AUTO_INCREMENT")) {
            definition.isAutoIncrement = true;
        } else if (cursor.acceptWords("COMMENT")) {
            ClauseToken comment = cursor.next();
            definition.comment = comment == null ? null : comment.getValue();
        } else if (cursor.acceptWords("PRIMARY", "KEY") || cursor.acceptWords("KEY")) {
            definition.isPrimaryKey = true;
        } else if (cursor.acceptWords("UNIQUE")) {
            cursor.acceptWords("KEY");
            definition.isUnique = true;
        } else if (cursor.acceptWords("CHARACTER", "SET") || VALUE_MODIFIERS.contains(word)) {
            if (VALUE_MODIFIERS.contains(word)) {
                cursor.next();
            }
            cursor.acceptSymbol('=');
            cursor.next();
        } else if (cursor.acceptWords("ON", "UPDATE")) {
            String expression = readExpression(cursor);
            warnings.warn(WarningKind.UNSUPPORTED_CLAUSE, construct, "ON UPDATE " + expression + " is dropped");
        } else if (cursor.acceptWords("CHECK")) {
            ClauseToken group = cursor.next();
            if (group != null && group.getType() == TokenType.GROUP) {
                definition.check = "CHECK (" + LiteralRewriter.rewrite(group.getValue()) + ")";
            }
        } else if (cursor.acceptWords("REFERENCES")) {
            skipInlineReference(cursor);
        } else if (cursor.acceptWords("GENERATED", "ALWAYS", "AS") || cursor.acceptWords("AS")) {
            ClauseToken expression = cursor.next();
            if (!cursor.acceptWords("VIRTUAL")) {
                cursor.acceptWords("STORED");
            }
            warnings.warn(WarningKind.UNSUPPORTED_CLAUSE, construct, "generated column expression "
                + (expression == null ? "" : expression.getText()) + " is dropped, column kept as a plain column");
        } else {
            warnings.warn(WarningKind.UNSUPPORTED_CLAUSE, construct, "unknown column modifier skipped: "
                + cursor.next().getText());
        }
    }

    private void skipInlineReference(TokenCursor cursor) {
        cursor.readName();
        if (cursor.peek() != null && cursor.peek().getType() == TokenType.GROUP) {
            cursor.next();
        }
        while (true) {
            if (cursor.acceptWords("ON", "DELETE") || cursor.acceptWords("ON", "UPDATE")) {
                readReferenceAction(cursor);
            } else if (cursor.acceptWords("MATCH")) {
                cursor.next();
            } else {
                return;
            }
        }
    }

    /**
     * Raw text of a default or ON UPDATE expression: a literal, a signed number, a word with an
     * optional argument group such as CURRENT_TIMESTAMP(6), or a parenthesised expression.
     *
     * @param cursor cursor
     * @return expression text, null when missing
     */
    private String readExpression(TokenCursor cursor) {
        ClauseToken token = cursor.next();
        if (token == null) {
            return null;
        }
        if ((token.isSymbol('-') || token.isSymbol('+')) && cursor.peek() != null
            && cursor.peek().getType() == TokenType.NUMBER) {
            return token.getText() + cursor.next().getText();
        }
        if (token.getType() == TokenType.WORD && cursor.peek() != null
            && cursor.peek().getType() == TokenType.GROUP) {
            return token.getText() + cursor.next().getText();
        }
        return token.getText();
    }

    private void parseTableOptions(Table table, TokenCursor cursor) {
        while (cursor.hasNext()) {
            if (cursor.acceptWords("COMMENT")) {
                cursor.acceptSymbol('=');
                ClauseToken comment = cursor.next();
                if (comment != null && comment.getType() == TokenType.STRING) {
                    table.setComment(comment.getValue());
                    model.addComment(CommentEntry.tableComment(table.getName(), comment.getValue()));
                }
            } else if (cursor.isWord("PARTITION")) {
                warnings.warn(WarningKind.UNSUPPORTED_CLAUSE, table.getName(), "partitioning is dropped");
                return;
            } else {
                cursor.next();
            }
        }
    }

    private void parseCreateIndex(TokenCursor cursor, String text) {
        TokenCursor header = new TokenCursor(ClauseTokenizer.tokenize(text));
        header.next();
        boolean isUnique = header.acceptWords("UNIQUE");
        if (header.isWord("FULLTEXT") || header.isWord("SPATIAL")) {
            warnings.warn(WarningKind.UNSUPPORTED_CLAUSE, abbreviate(text), "index skipped");
            return;
        }
        String indexName = cursor.readName();
        skipIndexType(cursor);
        if (indexName == null || !cursor.acceptWords("ON")) {
            warnings.warn(WarningKind.SKIPPED_STATEMENT, abbreviate(text), "malformed CREATE INDEX skipped");
            return;
        }
        String tableName = cursor.readName();
        ClauseToken group = cursor.next();
        Optional<Table> table = tableName == null ? Optional.empty() : model.getTable(tableName);
        if (!table.isPresent() || group == null || group.getType() != TokenType.GROUP) {
            warnings.warn(WarningKind.SKIPPED_STATEMENT, abbreviate(text), "index on unknown table skipped");
            return;
        }
        addIndex(table.get(), indexName, parseKeyColumns(group.getValue()), isUnique);
    }

    private void parseAlter(TokenCursor cursor, String text, RawStatement statement) {
        cursor.acceptWords("ONLINE");
        cursor.acceptWords("IGNORE");
        if (!cursor.acceptWords("TABLE")) {
            warnings.warn(WarningKind.SKIPPED_STATEMENT, abbreviate(text), "ALTER statement skipped");
            return;
        }
        String tableName = cursor.readName();
        Optional<Table> table = tableName == null ? Optional.empty() : model.getTable(tableName);
        if (!table.isPresent()) {
            warnings.warn(WarningKind.SKIPPED_STATEMENT, abbreviate(text), "ALTER TABLE on unknown table skipped");
            return;
        }
        ClauseToken firstAction = cursor.peek();
        if (firstAction == null) {
            return;
        }
        String actions = text.substring(firstAction.getStart());
        for (String item : SqlScanner.splitTopLevel(actions, ',', SqlDialect.MYSQL)) {
            parseAlterItem(table.get(), item, statement);
        }
    }

    private void parseAlterItem(Table table, String item, RawStatement statement) {
        TokenCursor cursor = new TokenCursor(ClauseTokenizer.tokenize(item));
        if (cursor.acceptWords("DISABLE", "KEYS") || cursor.acceptWords("ENABLE", "KEYS")) {
            return;
        }
        if (cursor.acceptWords("COMMENT")) {
            cursor.acceptSymbol('=');
            ClauseToken comment = cursor.next();
            if (comment != null && comment.getType() == TokenType.STRING) {
                table.setComment(comment.getValue());
                model.addComment(CommentEntry.tableComment(table.getName(), comment.getValue()));
            }
            return;
        }
        if (cursor.acceptWords("ADD")) {
            ClauseToken first = cursor.peek();
            if (first != null) {
                parseBodyItem(table, item.substring(first.getStart()), true);
                return;
            }
        }
        warnings.warn(WarningKind.UNSUPPORTED_CLAUSE, table.getName(),
            "ALTER TABLE action at line " + statement.getLine() + " skipped: " + abbreviate(item));
    }

    private static String stripTerminator(String text) {
        String trimmed = text.trim();
        return trimmed.endsWith(";") ? trimmed.substring(0, trimmed.length() - 1).trim() : trimmed;
    }

    private static String abbreviate(String text) {
        return StringUtils.abbreviate(text.replaceAll("\\s+", " "), 80);
    }

    private static class ColumnDefinition {
        private boolean isNullable = true;
        private String defaultExpression;
        private boolean isAutoIncrement;
        private String comment;
        private String check;
        private boolean isPrimaryKey;
        private boolean isUnique;
    }
}
