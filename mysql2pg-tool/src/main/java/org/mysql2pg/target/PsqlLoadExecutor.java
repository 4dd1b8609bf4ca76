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

import org.apache.commons.lang3.StringUtils;
import org.mysql2pg.enums.ErrorCode;
import org.mysql2pg.model.config.DatabaseConfig;
import org.mysql2pg.model.load.ExecutionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Runs a file with the psql client, stopping at the first error and wrapping the file in one
 * transaction.
 *
 * @since 2025-04-18
 */
public class PsqlLoadExecutor implements LoadExecutor {
    private static final Logger LOGGER = LoggerFactory.getLogger(PsqlLoadExecutor.class);
    private static final int MAX_MESSAGE_LENGTH = 2000;

    private final String psqlPath;
    private final DatabaseConfig dbConfig;

    /**
     * Constructor
     *
     * @param psqlPath psql executable
     * @param dbConfig dbConfig
     */
    public PsqlLoadExecutor(String psqlPath, DatabaseConfig dbConfig) {
        this.psqlPath = psqlPath;
        this.dbConfig = dbConfig;
    }

    @Override
    public ExecutionResult execute(Path file) {
        ProcessBuilder builder = new ProcessBuilder(buildCommand(file)).redirectErrorStream(true);
        buildEnvironment(builder.environment());
        try {
            Process process = builder.start();
            String output;
            try (InputStream stream = process.getInputStream()) {
                output = new String(stream.readAllBytes(), StandardCharsets.UTF_8);
            }
            int exitCode = process.waitFor();
            if (exitCode == 0) {
                LOGGER.info("loaded {} with psql.", file.getFileName());
                return ExecutionResult.success();
            }
            String message = "psql exited with code " + exitCode + ": " + StringUtils.right(output.trim(),
                MAX_MESSAGE_LENGTH);
            LOGGER.error("{}fail to load {}, error message:{}", ErrorCode.LOAD_EXCEPTION, file.getFileName(), message);
            return ExecutionResult.failure(message);
        } catch (IOException e) {
            LOGGER.error("{}fail to run psql for {}, error message:{}", ErrorCode.IO_EXCEPTION, file.getFileName(),
                e.getMessage());
            return ExecutionResult.failure(e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOGGER.error("{}interrupted while loading {}", ErrorCode.THREAD_INTERRUPTED_EXCEPTION,
                file.getFileName());
            return ExecutionResult.failure("interrupted");
        }
    }

    /**
     * buildCommand
     *
     * @param file file
     * @return psql command line
     */
    public List<String> buildCommand(Path file) {
        List<String> command = new ArrayList<>();
        command.add(psqlPath);
        if (StringUtils.isNotEmpty(dbConfig.getHost())) {
            command.add("-h");
            command.add(dbConfig.getHost());
        }
        command.add("-p");
        command.add(String.valueOf(dbConfig.getPort()));
        command.add("-U");
        command.add(dbConfig.getUser());
        command.add("-d");
        command.add(dbConfig.getDatabase());
        command.add("-v");
        command.add("ON_ERROR_STOP=1");
        command.add("--single-transaction");
        command.add("-q");
        command.add("-f");
        command.add(file.toString());
        return command;
    }

    /**
     * buildEnvironment, the password never appears on the command line
     *
     * @param environment environment of the psql process
     */
    void buildEnvironment(Map<String, String> environment) {
        if (dbConfig.getPassword() != null) {
            environment.put("PGPASSWORD", dbConfig.getPassword());
        }
        if (StringUtils.isNotEmpty(dbConfig.getSchema())) {
            environment.put("PGOPTIONS", "-c search_path=" + dbConfig.getSchema());
        }
        if (dbConfig.getConnectTimeout() != null) {
            environment.put("PGCONNECT_TIMEOUT", String.valueOf(dbConfig.getConnectTimeout()));
        }
    }
}
