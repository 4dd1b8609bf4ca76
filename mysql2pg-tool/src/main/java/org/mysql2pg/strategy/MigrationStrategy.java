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

import org.mysql2pg.enums.ErrorCode;
import org.mysql2pg.model.config.DumpConfig;
import org.mysql2pg.model.config.GlobalConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.UnsupportedCharsetException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;

/**
 * MigrationStrategy
 *
 * @since 2025-04-18
 */
public abstract class MigrationStrategy {
    private static final Logger LOGGER = LoggerFactory.getLogger(MigrationStrategy.class);

    /**
     * globalConfig
     */
    protected final GlobalConfig globalConfig;

    /**
     * MigrationStrategy
     *
     * @param globalConfig globalConfig
     */
    public MigrationStrategy(GlobalConfig globalConfig) {
        this.globalConfig = globalConfig;
    }

    /**
     * migration
     *
     * @return true when the task succeeded
     */
    public abstract boolean migration();

    /**
     * getOutDir
     *
     * @return directory of the generated files
     */
    protected Path getOutDir() {
        return Paths.get(globalConfig.getDumpConfig().getOutDir());
    }

    /**
     * getInputCharset
     *
     * @return charset of the dump file, empty when the configured name is unknown
     */
    protected Optional<Charset> getInputCharset() {
        DumpConfig dumpConfig = globalConfig.getDumpConfig();
        try {
            return Optional.of(Charset.forName(dumpConfig.getCharset()));
        } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
            LOGGER.error("{}the param 'dumpConfig.charset' is error, reason: unsupported charset {}, please check "
                + "and retry.", ErrorCode.INCORRECT_CONFIGURATION, dumpConfig.getCharset());
            return Optional.empty();
        }
    }
}
