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

package org.mysql2pg.target;

import org.mysql2pg.model.load.ExecutionResult;

import java.nio.file.Path;

/**
 * LoadExecutor, runs one SQL file against the target database. Implementations are called
 * concurrently from several load workers.
 *
 * @since 2025-04-18
 */
public interface LoadExecutor {
    /**
     * execute
     *
     * @param file sql file
     * @return success, or failure with a message
     */
    ExecutionResult execute(Path file);
}
