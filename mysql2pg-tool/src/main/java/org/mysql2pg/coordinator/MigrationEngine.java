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

package org.mysql2pg.coordinator;

import org.mysql2pg.YAMLLoader;
import org.mysql2pg.constants.MigrationConfigConstants;
import org.mysql2pg.enums.ErrorCode;
import org.mysql2pg.model.TaskTypeEnum;
import org.mysql2pg.model.config.GlobalConfig;
import org.mysql2pg.strategy.MigrationStrategy;
import org.mysql2pg.strategy.StrategyFactory;
import org.mysql2pg.target.LoadExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Optional;

/**
 * MigrationEngine
 *
 * @since 2025-04-18
 */
public class MigrationEngine {
    private static final Logger LOGGER = LoggerFactory.getLogger(MigrationEngine.class);

    private final String taskType;
    private final String configPath;
    private final LoadExecutor loadExecutor;

    /**
     * MigrationEngine
     *
     * @param taskType taskType
     * @param configPath configPath
     */
    public MigrationEngine(String taskType, String configPath) {
        this(taskType, configPath, null);
    }

    /**
     * MigrationEngine
     *
     * @param taskType taskType
     * @param configPath configPath
     * @param loadExecutor executor for the load task, null to build it from the configuration
     */
    public MigrationEngine(String taskType, String configPath, LoadExecutor loadExecutor) {
        this.taskType = taskType.toLowerCase(Locale.ROOT);
        this.configPath = configPath;
        this.loadExecutor = loadExecutor;
    }

    /**
     * dispatch
     *
     * @return true when the task succeeded
     */
    public boolean dispatch() {
        Optional<GlobalConfig> globalConfigOptional = YAMLLoader.loadYamlConfig(configPath);
        if (!globalConfigOptional.isPresent()) {
            return false;
        }
        return dispatch(globalConfigOptional.get());
    }

    /**
     * dispatch
     *
     * @param globalConfig globalConfig
     * @return true when the task succeeded
     */
    public boolean dispatch(GlobalConfig globalConfig) {
        TaskTypeEnum taskTypeEnum = TaskTypeEnum.getTaskTypeEnum(taskType);
        if (taskTypeEnum == TaskTypeEnum.UNKNOWN) {
            LOGGER.error("{}--start parameter is invalid, please modify and retry", ErrorCode.INCORRECT_CONFIGURATION);
            return false;
        }
        getDatabasePasswordFromEnv(globalConfig);
        StrategyFactory.buildStrategyMap(globalConfig, loadExecutor);
        if (taskTypeEnum != TaskTypeEnum.ALL) {
            return runTask(taskTypeEnum);
        }
        boolean isDdlSuccess = runTask(TaskTypeEnum.DDL);
        boolean isDataSuccess = runTask(TaskTypeEnum.DATA);
        if (!isDdlSuccess || !isDataSuccess) {
            LOGGER.error("{}{} conversion failed, load task is skipped.", ErrorCode.UNKNOWN,
                isDdlSuccess ? "data" : "ddl");
            return false;
        }
        return runTask(TaskTypeEnum.LOAD);
    }

    private boolean runTask(TaskTypeEnum taskTypeEnum) {
        MigrationStrategy strategy = StrategyFactory.getMigrationStrategy(taskTypeEnum.getTaskType());
        LOGGER.info("start {} task.", taskTypeEnum.getTaskType());
        boolean isSuccess = strategy.migration();
        LOGGER.info("{} task {}.", taskTypeEnum.getTaskType(), isSuccess ? "succeeded" : "failed");
        return isSuccess;
    }

    private void getDatabasePasswordFromEnv(GlobalConfig globalConfig) {
        String isEnableEnvPassword = System.getenv(MigrationConfigConstants.ENABLE_ENV_PASSWORD);
        if ("true".equals(isEnableEnvPassword) && globalConfig.getPgConn() != null) {
            String postgresPassword = System.getenv(MigrationConfigConstants.POSTGRES_PASSWORD);
            if (postgresPassword != null) {
                globalConfig.getPgConn().setPassword(postgresPassword);
            }
        }
    }
}
