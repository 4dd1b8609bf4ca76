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

import org.apache.commons.collections4.CollectionUtils;
import org.apache.commons.lang3.StringUtils;
import org.mysql2pg.translator.warning.ConversionWarning;
import org.mysql2pg.translator.warning.WarningKind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * TypeMapper, maps a MySQL column type and its default to PostgreSQL. Stateless.
 *
 * @since 2025-04-18
 */
public final class TypeMapper {
    private static final String CURRENT_TIMESTAMP = "CURRENT_TIMESTAMP";
    private static final Pattern CURRENT_TIME_PATTERN = Pattern.compile(
        "(?i)^(CURRENT_TIMESTAMP|LOCALTIMESTAMP|LOCALTIME|NOW)\\s*(\\(\\s*\\d*\\s*\\))?$");
    private static final Pattern BIT_LITERAL_PATTERN = Pattern.compile("(?i)^b'([01]*)'$");
    private static final Pattern HEX_LITERAL_PATTERN = Pattern.compile("(?i)^(?:x'([0-9a-f]*)'|0x([0-9a-f]+))$");
    private static final String ZERO_DATE_PREFIX = "0000-00-00";

    private TypeMapper() {
    }

    /**
     * map
     *
     * @param columnName column name, used for the enum check constraint
     * @param typeName MySQL type name without arguments
     * @param typeArgs raw argument list, may be empty
     * @param defaultLiteral raw default expression or null when the column has none
     * @return MappedType
     */
    public static MappedType map(String columnName, String typeName, List<String> typeArgs,
        String defaultLiteral) {
        List<String> args = typeArgs == null ? Collections.emptyList() : typeArgs;
        List<ConversionWarning> warnings = new ArrayList<>();
        MappedType.MappedTypeBuilder builder = MappedType.builder().warnings(warnings);
        MySqlColumnType columnType = MySqlColumnType.getColumnType(typeName);
        String targetType;
        if (columnType == null) {
            targetType = args.isEmpty() ? typeName : typeName + "(" + String.join(",", args) + ")";
            warnings.add(new ConversionWarning(WarningKind.UNKNOWN_TYPE, typeName,
                String.format(Locale.ROOT, "unknown type of column %s is kept unchanged", columnName)));
        } else {
            targetType = mapKnownType(columnType, args);
            if (columnType == MySqlColumnType.MY_ENUM) {
                builder.checkConstraint(buildEnumCheck(columnName, args));
            }
        }
        builder.targetType(targetType);
        rewriteDefault(columnName, targetType, defaultLiteral, builder, warnings);
        return builder.build();
    }

    private static String mapKnownType(MySqlColumnType columnType, List<String> args) {
        if (CollectionUtils.isEmpty(args)) {
            return columnType.getPgType();
        }
        if (MySqlColumnType.LENGTH_TYPE_SET.contains(columnType)
            || MySqlColumnType.NUMERICS_SET.contains(columnType)
            || MySqlColumnType.FRACTION_TYPE_SET.contains(columnType)) {
            return columnType.getPgType() + "(" + String.join(",", args) + ")";
        }
        if (columnType == MySqlColumnType.MY_BIT && !"1".equals(args.get(0).trim())) {
            return "bit(" + args.get(0).trim() + ")";
        }
        return columnType.getPgType();
    }

    private static String buildEnumCheck(String columnName, List<String> values) {
        String valueList = values.stream()
            .map(value -> LiteralRewriter.quoteString(unquoteValue(value)))
            .collect(Collectors.joining(", "));
        return "CHECK (" + LiteralRewriter.quoteIdentifier(columnName) + " IN (" + valueList + "))";
    }

    private static String unquoteValue(String value) {
        String trimmed = value.trim();
        if (trimmed.startsWith("'") || trimmed.startsWith("\"")) {
            return LiteralRewriter.unquoteMySqlString(trimmed);
        }
        return trimmed;
    }

    private static void rewriteDefault(String columnName, String targetType, String defaultLiteral,
        MappedType.MappedTypeBuilder builder, List<ConversionWarning> warnings) {
        if (StringUtils.isBlank(defaultLiteral)) {
            return;
        }
        String literal = defaultLiteral.trim();
        if ("NULL".equalsIgnoreCase(literal)) {
            builder.isNullDefault(true).defaultValue("NULL");
            return;
        }
        if (CURRENT_TIME_PATTERN.matcher(literal).matches()) {
            builder.defaultValue(CURRENT_TIMESTAMP);
            return;
        }
        Matcher bitMatcher = BIT_LITERAL_PATTERN.matcher(literal);
        if (bitMatcher.matches()) {
            builder.defaultValue(LiteralRewriter.rewriteBitLiteral(bitMatcher.group(1)));
            return;
        }
        Matcher hexMatcher = HEX_LITERAL_PATTERN.matcher(literal);
        if (hexMatcher.matches()) {
            String digits = hexMatcher.group(1) != null ? hexMatcher.group(1) : hexMatcher.group(2);
            builder.defaultValue(LiteralRewriter.rewriteHexLiteral(digits));
            return;
        }
        if (literal.startsWith("'") || literal.startsWith("\"")) {
            String value = LiteralRewriter.unquoteMySqlString(literal);
            if (value.startsWith(ZERO_DATE_PREFIX)) {
                warnings.add(new ConversionWarning(WarningKind.DROPPED_DEFAULT, columnName,
                    "zero date default " + literal + " has no PostgreSQL equivalent and is dropped"));
                return;
            }
            builder.defaultValue(LiteralRewriter.quoteString(value));
            return;
        }
        if ("boolean".equals(targetType) && ("0".equals(literal) || "1".equals(literal))) {
            builder.defaultValue("'" + literal + "'");
            return;
        }
        builder.defaultValue(literal);
    }
}
