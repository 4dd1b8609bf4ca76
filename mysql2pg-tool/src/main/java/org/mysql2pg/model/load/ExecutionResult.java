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

package org.mysql2pg.model.load;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * ExecutionResult, outcome of running one file once
 *
 * @since 2025-04-18
 */
@Getter
@AllArgsConstructor
public class ExecutionResult {
    private static final ExecutionResult SUCCESS = new ExecutionResult(true, null);

    private final boolean success;
    private final String message;

    /**
     * success
     *
     * @return ExecutionResult
     */
    public static ExecutionResult success() {
        return SUCCESS;
    }

    /**
     * failure
     *
     * @param message message
     * @return ExecutionResult
     */
    public static ExecutionResult failure(String message) {
        return new ExecutionResult(false, message);
    }
}
