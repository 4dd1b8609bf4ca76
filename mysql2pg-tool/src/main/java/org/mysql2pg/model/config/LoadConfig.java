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

package org.mysql2pg.model.config;

import lombok.Data;

import org.mysql2pg.validator.ValidLoadMode;

import javax.validation.constraints.Min;
import javax.validation.constraints.NotNull;

/**
 * LoadConfig
 *
 * @since 2025-04-18
 */
@Data
public class LoadConfig {
    /**
     * load through the PostgreSQL JDBC driver
     */
    public static final String JDBC_MODE = "jdbc";

    /**
     * load by running psql
     */
    public static final String PSQL_MODE = "psql";

    @NotNull(message = "This parameter is required")
    @Min(value = 1, message = "number must larger than 0")
    private Integer workerNum = 4;
    @NotNull(message = "This parameter is required")
    @Min(value = 1, message = "number must larger than 0")
    private Integer retryNum = 3;
    @ValidLoadMode
    private String loadMode = JDBC_MODE;
    private String psqlPath = "psql";
    private Boolean isApplySchema = false;
    private Boolean isResetSequences = true;
}
