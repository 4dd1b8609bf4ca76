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

import java.util.List;

/**
 * TokenCursor
 *
 * @since 2025-04-18
 */
public class TokenCursor {
    private final List<ClauseToken> tokens;
    private int position;

    /**
     * Constructor
     *
     * @param tokens tokens
     */
    public TokenCursor(List<ClauseToken> tokens) {
        this.tokens = tokens;
    }

    /**
     * hasNext
     *
     * @return hasNext
     */
    public boolean hasNext() {
        return position < tokens.size();
    }

    /**
     * peek
     *
     * @return current token or null at the end
     */
    public ClauseToken peek() {
        return peek(0);
    }

    /**
     * peek
     *
     * @param offset offset from the current token
     * @return token or null past the end
     */
    public ClauseToken peek(int offset) {
        int index = position + offset;
        return index < tokens.size() ? tokens.get(index) : null;
    }

    /**
     * next
     *
     * @return current token, the cursor moves on; null at the end
     */
    public ClauseToken next() {
        return hasNext() ? tokens.get(position++) : null;
    }

    /**
     * isWord
     *
     * @param keyword keyword
     * @return true when the current token is the keyword
     */
    public boolean isWord(String keyword) {
        ClauseToken token = peek();
        return token != null && token.isWord(keyword);
    }

    /**
     * Consume the keywords when the upcoming tokens match all of them.
     *
     * @param keywords keywords
     * @return true when consumed
     */
    public boolean acceptWords(String... keywords) {
        for (int i = 0; i < keywords.length; i++) {
            ClauseToken token = peek(i);
            if (token == null || !token.isWord(keywords[i])) {
                return false;
            }
        }
        position += keywords.length;
        return true;
    }

    /**
     * acceptSymbol
     *
     * @param symbol symbol
     * @return true when consumed
     */
    public boolean acceptSymbol(char symbol) {
        ClauseToken token = peek();
        if (token != null && token.isSymbol(symbol)) {
            position++;
            return true;
        }
        return false;
    }

    /**
     * Read an optionally qualified object name, db.name gives name.
     *
     * @return name or null when the current token is no name
     */
    public String readName() {
        ClauseToken token = peek();
        if (token == null || !token.isName()) {
            return null;
        }
        position++;
        String name = token.getValue();
        while (acceptSymbol('.')) {
            ClauseToken part = next();
            if (part == null) {
                break;
            }
            name = part.getValue();
        }
        return name;
    }
}
