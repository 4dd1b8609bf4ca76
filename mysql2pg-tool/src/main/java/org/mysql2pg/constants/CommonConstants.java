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
 * CommonConstants
 *
 * @since 2025-04-18
 */
public class CommonConstants {
    /**
     * TASK_TYPE
     */
    public static final String TASK_TYPE = "--start";

    /**
     * CONFIG_PATH
     */
    public static final String CONFIG_PATH = "--config";

    /**
     * name of the load report written under statusDir
     */
    public static final String LOAD_REPORT_FILE = "load.json";

    /**
     * thread name prefix of the load workers
     */
    public static final String LOADER_THREAD_PREFIX = "Loader-";
}
