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

package org.mysql2pg;

import org.mysql2pg.constants.CommonConstants;
import org.mysql2pg.coordinator.MigrationEngine;
import org.mysql2pg.enums.ErrorCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;

/**
 * Starter
 *
 * @since 2025-04-18
 */
public class Starter {
    private static final Logger LOGGER = LoggerFactory.getLogger(Starter.class);

    /**
     * main
     *
     * @param args --start ddl|data|load|all --config path
     */
    public static void main(String[] args) {
        System.exit(run(args) ? 0 : 1);
    }

    /**
     * run
     *
     * @param args args
     * @return true when the task succeeded
     */
    public static boolean run(String[] args) {
        if (args.length % 2 != 0) {
            LOGGER.error("{}usage: --start ddl|data|load|all --config <path>", ErrorCode.INCORRECT_CONFIGURATION);
            return false;
        }
        Map<String, String> commandMap = new HashMap<>();
        for (int i = 0; i < args.length; i += 2) {
            commandMap.put(args[i], args[i + 1]);
        }
        String taskType = commandMap.get(CommonConstants.TASK_TYPE);
        String configPath = commandMap.get(CommonConstants.CONFIG_PATH);
        if (taskType == null) {
            LOGGER.error("{}--start parameter is required, please modify and retry",
                ErrorCode.INCORRECT_CONFIGURATION);
            return false;
        }
        MigrationEngine dispatcher = new MigrationEngine(taskType, configPath);
        return dispatcher.dispatch();
    }
}
