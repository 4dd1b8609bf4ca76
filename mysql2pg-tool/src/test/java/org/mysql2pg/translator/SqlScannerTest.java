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
import static org.junit.Assert.assertTrue;

import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * SqlScannerTest
 *
 * @since 2025-04-18
 */
public class SqlScannerTest {
    @Test
    public void testSplitTopLevelSkipsQuotedAndNestedSeparators() {
        List<String> parts = SqlScanner.splitTopLevel("a, 'x,y', (b, c), `d,e`, \"f,g\"", ',', SqlDialect.MYSQL);

        assertEquals(Arrays.asList("a", "'x,y'", "(b, c)", "`d,e`", "\"f,g\""), parts);
    }

    @Test
    public void testSplitTopLevelDropsEmptyParts() {
        assertEquals(Arrays.asList("a", "b"), SqlScanner.splitTopLevel(" a , , b ,", ',', SqlDialect.MYSQL));
    }

    @Test
    public void testFindClosingParenIgnoresParenInString() {
        assertEquals(10, SqlScanner.findClosingParen("(a ')' (b))x", 0, SqlDialect.MYSQL));
        assertEquals(-1, SqlScanner.findClosingParen("(a (b)", 0, SqlDialect.MYSQL));
    }

    @Test
    public void testSkipLiteralHonoursDialectEscapes() {
        assertEquals(7, SqlScanner.skipLiteral("'it\\'s' rest", 0, SqlDialect.MYSQL));
        assertEquals(5, SqlScanner.skipLiteral("'it\\'s' rest", 0, SqlDialect.POSTGRES));
        assertEquals(6, SqlScanner.skipLiteral("'a''b'x", 0, SqlDialect.MYSQL));
        assertEquals(-1, SqlScanner.skipLiteral("'never closed", 0, SqlDialect.MYSQL));
    }

    @Test
    public void testStatementEndOnlyInCodeAtDepthZero() {
        assertEquals(Arrays.asList(21), statementEnds("INSERT ('a;b', (1;2));", SqlDialect.MYSQL));
    }

    @Test
    public void testCommentsHideSemicolons() {
        assertEquals(Arrays.asList(18), statementEnds("-- a;\n# b;\n/* ; */;", SqlDialect.MYSQL));
        assertEquals(Arrays.asList(9, 18), statementEnds("-- a;\n# b;\n/* ; */;", SqlDialect.POSTGRES));
    }

    @Test
    public void testBalance() {
        assertFalse(scanAll("INSERT 'open", SqlDialect.MYSQL).isBalanced());
        assertFalse(scanAll("INSERT (1, 2", SqlDialect.MYSQL).isBalanced());
        assertFalse(scanAll("SELECT /* open", SqlDialect.MYSQL).isBalanced());
        assertTrue(scanAll("SELECT 1 -- trailing", SqlDialect.MYSQL).isBalanced());
        assertTrue(scanAll("SELECT 'a\\'b'", SqlDialect.MYSQL).isBalanced());
    }

    private static SqlScanner scanAll(String text, SqlDialect dialect) {
        SqlScanner scanner = new SqlScanner(dialect);
        for (int i = 0; i < text.length(); i++) {
            scanner.feed(text.charAt(i), i + 1 < text.length() ? text.charAt(i + 1) : SqlScanner.NO_CHAR);
        }
        return scanner;
    }

    private static List<Integer> statementEnds(String text, SqlDialect dialect) {
        List<Integer> ends = new ArrayList<>();
        SqlScanner scanner = new SqlScanner(dialect);
        for (int i = 0; i < text.length(); i++) {
            char ch = text.charAt(i);
            SqlScanner.CharKind kind = scanner.feed(ch, i + 1 < text.length() ? text.charAt(i + 1)
                : SqlScanner.NO_CHAR);
            if (scanner.isStatementEnd(ch, kind)) {
                ends.add(i);
            }
        }
        return ends;
    }
}
