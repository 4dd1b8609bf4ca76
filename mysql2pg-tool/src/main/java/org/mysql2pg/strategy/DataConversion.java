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
import org.mysql2pg.exception.StatementExtractException;
import org.mysql2pg.model.config.DumpConfig;
import org.mysql2pg.model.config.GlobalConfig;
import org.mysql2pg.model.data.ChunkFile;
import org.mysql2pg.parser.StatementExtractor;
import org.mysql2pg.splitter.ChunkSplitter;
import org.mysql2pg.translator.warning.ConversionWarnings;
import org.mysql2pg.utils.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.List;
import java.util.Optional;

/**
 * DataConversion, rewrites the INSERT statements of the dump into chunk files
 *
 * @since 2025-04-18
 */
public class DataConversion extends MigrationStrategy {
    private static final Logger LOGGER = LoggerFactory.getLogger(DataConversion.class);

    /**
     * DataConversion
     *
     * @param globalConfig globalConfig
     */
    public DataConversion(GlobalConfig globalConfig) {
        super(globalConfig);
    }

    @Override
    public boolean migration() {
        DumpConfig dumpConfig = globalConfig.getDumpConfig();
        Optional<Charset> charset = getInputCharset();
        if (!charset.isPresent() || !FileUtils.createDir(dumpConfig.getOutDir())) {
            return false;
        }
        long startTime = System.currentTimeMillis();
        ConversionWarnings warnings = new ConversionWarnings();
        ChunkSplitter splitter = new ChunkSplitter(getOutDir(), dumpConfig.getChunkPrefix(),
            dumpConfig.convertChunkSize(), Boolean.TRUE.equals(dumpConfig.getIsDisableTriggers()), warnings);
        List<ChunkFile> chunks;
        try {
            FileUtils.deleteChunkFiles(getOutDir(), dumpConfig.getChunkPrefix());
            try (Reader reader = Files.newBufferedReader(Paths.get(dumpConfig.getInputFile()), charset.get());
                StatementExtractor extractor = new StatementExtractor(reader, warnings)) {
                chunks = splitter.split(extractor);
            }
        } catch (StatementExtractException e) {
            LOGGER.error("{}{}", ErrorCode.STATEMENT_EXTRACT_EXCEPTION, e.getMessage());
            return false;
        } catch (IOException | UncheckedIOException e) {
            LOGGER.error("{}fail to convert data of {}, error message:{}", ErrorCode.IO_EXCEPTION,
                dumpConfig.getInputFile(), e.getMessage());
            return false;
        }
        long statementCount = chunks.stream().mapToLong(ChunkFile::getStatementCount).sum();
        warnings.logSummary("data conversion");
        LOGGER.info("data conversion finished, {} statements in {} chunks, cost {} ms.", statementCount,
            chunks.size(), System.currentTimeMillis() - startTime);
        return true;
    }
}
