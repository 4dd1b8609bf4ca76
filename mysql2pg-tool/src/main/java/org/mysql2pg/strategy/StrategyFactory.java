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

package org.mysql2pg.strategy;

import org.mysql2pg.model.TaskTypeEnum;
import org.mysql2pg.model.config.GlobalConfig;
import org.mysql2pg.target.LoadExecutor;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * StrategyFactory
 *
 * @since 2025-04-18
 */
public class StrategyFactory {
    private static final Map<String, MigrationStrategy> strategyMap = new HashMap<>();

    /**
     * buildStrategyMap
     *
     * @param globalConfig globalConfig
     * @param loadExecutor executor of the load task, null to build it from the configuration
     */
    public static void buildStrategyMap(GlobalConfig globalConfig, LoadExecutor loadExecutor) {
        strategyMap.put(TaskTypeEnum.DDL.getTaskType(), new DdlConversion(globalConfig));
        strategyMap.put(TaskTypeEnum.DATA.getTaskType(), new DataConversion(globalConfig));
        strategyMap.put(TaskTypeEnum.LOAD.getTaskType(), new ParallelLoad(globalConfig, loadExecutor));
    }

    /**
     * getMigrationStrategy
     *
     * @param migrationType migrationType
     * @return MigrationStrategy
     */
    public static MigrationStrategy getMigrationStrategy(String migrationType) {
        return strategyMap.get(migrationType.toLowerCase(Locale.ROOT));
    }
}
