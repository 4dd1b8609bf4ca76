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

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * ClauseToken
 *
 * @since 2025-04-18
 */
@Getter
@ToString
@AllArgsConstructor
public class ClauseToken {
    /**
     * TokenType
     */
    public enum TokenType {
        WORD,
        QUOTED_IDENTIFIER,
        STRING,
        BIT_STRING,
        HEX_STRING,
        NUMBER,
        GROUP,
        SYMBOL
    }

    private final TokenType type;

    /**
     * raw text as written
     */
    private final String text;

    /**
     * unquoted identifier, decoded string, inner text of a group, otherwise the raw text
     */
    private final String value;
    private final int start;
    private final int end;

    /**
     * isWord
     *
     * @param keyword keyword
     * @return true when this is an unquoted word equal to keyword ignoring case
     */
    public boolean isWord(String keyword) {
        return type == TokenType.WORD && text.equalsIgnoreCase(keyword);
    }

    /**
     * isSymbol
     *
     * @param symbol symbol
     * @return isSymbol
     */
    public boolean isSymbol(char symbol) {
        return type == TokenType.SYMBOL && text.charAt(0) == symbol;
    }

    /**
     * isName, a token that can stand for an object name
     *
     * @return isName
     */
    public boolean isName() {
        return type == TokenType.WORD || type == TokenType.QUOTED_IDENTIFIER || type == TokenType.STRING;
    }
}
