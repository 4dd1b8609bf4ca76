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

import org.mysql2pg.coordinator.LoadOrchestrator;
import org.mysql2pg.coordinator.LoadReporter;
import org.mysql2pg.enums.ErrorCode;
import org.mysql2pg.jdbc.PostgresConnection;
import org.mysql2pg.model.config.DatabaseConfig;
import org.mysql2pg.model.config.DumpConfig;
import org.mysql2pg.model.config.GlobalConfig;
import org.mysql2pg.model.config.LoadConfig;
import org.mysql2pg.model.load.ExecutionResult;
import org.mysql2pg.model.load.LoadResult;
import org.mysql2pg.model.load.LoadSummary;
import org.mysql2pg.target.JdbcLoadExecutor;
import org.mysql2pg.target.LoadExecutor;
import org.mysql2pg.target.PsqlLoadExecutor;
import org.mysql2pg.utils.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * ParallelLoad, loads the chunk files into PostgreSQL, optionally preceded by the schema script and
 * followed by the sequence reset script
 *
 * @since 2025-04-18
 */
public class ParallelLoad extends MigrationStrategy {
    private static final Logger LOGGER = LoggerFactory.getLogger(ParallelLoad.class);

    private final LoadExecutor loadExecutor;

    /**
     * ParallelLoad
     *
     * @param globalConfig globalConfig
     */
    public ParallelLoad(GlobalConfig globalConfig) {
        this(globalConfig, null);
    }

    /**
     * ParallelLoad
     *
     * @param globalConfig globalConfig
     * @param loadExecutor executor to use instead of the configured one
     */
    public ParallelLoad(GlobalConfig globalConfig, LoadExecutor loadExecutor) {
        super(globalConfig);
        this.loadExecutor = loadExecutor;
    }

    @Override
    public boolean migration() {
        LoadConfig loadConfig = globalConfig.getLoadConfig();
        DumpConfig dumpConfig = globalConfig.getDumpConfig();
        LoadExecutor executor = loadExecutor != null ? loadExecutor : createExecutor(loadConfig);
        if (executor == null) {
            return false;
        }
        if (Boolean.TRUE.equals(loadConfig.getIsApplySchema())
            && !executeScript(executor, getOutDir().resolve(dumpConfig.getDdlFileName()), true)) {
            return false;
        }
        List<Path> chunkFiles;
        try {
            chunkFiles = FileUtils.listChunkFiles(getOutDir(), dumpConfig.getChunkPrefix());
        } catch (IOException e) {
            LOGGER.error("{}fail to list chunk files in {}, error message:{}", ErrorCode.IO_EXCEPTION,
                getOutDir(), e.getMessage());
            return false;
        }
        if (chunkFiles.isEmpty()) {
            LOGGER.warn("no chunk file named {}_part_*.sql is found in {}.", dumpConfig.getChunkPrefix(), getOutDir());
        }
        LoadSummary summary = new LoadOrchestrator(executor, loadConfig.getWorkerNum(), loadConfig.getRetryNum())
            .run(chunkFiles);
        if (Boolean.TRUE.equals(globalConfig.getIsDumpJson()) && globalConfig.getStatusDir() != null) {
            LoadReporter.report(summary, globalConfig.getStatusDir());
        }
        if (!summary.isAllSuccess()) {
            for (LoadResult result : summary.getFailedResults()) {
                LOGGER.error("{}file {} is not loaded, last error: {}", ErrorCode.LOAD_EXCEPTION, result.getFile(),
                    result.getLastError());
            }
            return false;
        }
        if (Boolean.TRUE.equals(loadConfig.getIsResetSequences())) {
            return executeScript(executor, getOutDir().resolve(dumpConfig.getSequenceResetFileName()), false);
        }
        return true;
    }

    private boolean executeScript(LoadExecutor executor, Path script, boolean isRequired) {
        if (!Files.isRegularFile(script)) {
            if (isRequired) {
                LOGGER.error("{}script {} does not exist, please run the ddl task first.",
                    ErrorCode.INCORRECT_CONFIGURATION, script);
                return false;
            }
            LOGGER.info("script {} does not exist, skip it.", script);
            return true;
        }
        ExecutionResult result = executor.execute(script);
        if (!result.isSuccess()) {
            LOGGER.error("{}fail to execute {}, error message:{}", ErrorCode.SQL_EXCEPTION, script,
                result.getMessage());
            return false;
        }
        LOGGER.info("script {} is executed.", script);
        return true;
    }

    private LoadExecutor createExecutor(LoadConfig loadConfig) {
        DatabaseConfig pgConn = globalConfig.getPgConn();
        if (pgConn == null) {
            LOGGER.error("{}the param 'pgConn' is required by the load task, please check and retry.",
                ErrorCode.INCORRECT_CONFIGURATION);
            return null;
        }
        if (LoadConfig.PSQL_MODE.equalsIgnoreCase(loadConfig.getLoadMode())) {
            return new PsqlLoadExecutor(loadConfig.getPsqlPath(), pgConn);
        }
        return new JdbcLoadExecutor(new PostgresConnection(), pgConn);
    }
}
