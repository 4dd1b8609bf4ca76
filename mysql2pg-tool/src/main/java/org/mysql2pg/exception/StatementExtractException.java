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

package org.mysql2pg.exception;

import lombok.Getter;

import java.util.Locale;

/**
 * StatementExtractException, raised for malformed data statements
 *
 * @since 2025-04-18
 */
@Getter
public class StatementExtractException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private final long statementIndex;

    /**
     * Constructor
     *
     * @param statementIndex source order index of the statement
     * @param line line the statement starts at
     * @param reason reason
     */
    public StatementExtractException(long statementIndex, long line, String reason) {
        super(String.format(Locale.ROOT, "fail to extract statement %d starting at line %d: %s", statementIndex,
            line, reason));
        this.statementIndex = statementIndex;
    }
}
