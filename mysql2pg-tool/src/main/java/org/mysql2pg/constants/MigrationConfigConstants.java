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

package org.mysql2pg.constants;

/**
 * MigrationConfigConstants
 *
 * @since 2025-09-18
 */
public class MigrationConfigConstants {
    /**
     * ENABLE_ENV_PASSWORD
     */
    public static final String ENABLE_ENV_PASSWORD = "enable.env.password";

    /**
     * PostgreSQL password key name
     */
    public static final String POSTGRES_PASSWORD = "pgConn.password";
}
