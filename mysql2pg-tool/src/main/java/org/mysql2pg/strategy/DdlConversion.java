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

import org.mysql2pg.emitter.DdlEmitter;
import org.mysql2pg.enums.ErrorCode;
import org.mysql2pg.exception.DdlParseException;
import org.mysql2pg.model.config.DumpConfig;
import org.mysql2pg.model.config.GlobalConfig;
import org.mysql2pg.model.table.SchemaModel;
import org.mysql2pg.parser.DdlParser;
import org.mysql2pg.translator.warning.ConversionWarnings;
import org.mysql2pg.utils.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;

/**
 * DdlConversion, writes the PostgreSQL schema script and the sequence reset script
 *
 * @since 2025-04-18
 */
public class DdlConversion extends MigrationStrategy {
    private static final Logger LOGGER = LoggerFactory.getLogger(DdlConversion.class);

    /**
     * DdlConversion
     *
     * @param globalConfig globalConfig
     */
    public DdlConversion(GlobalConfig globalConfig) {
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
        Path ddlPath = getOutDir().resolve(dumpConfig.getDdlFileName());
        Path resetPath = getOutDir().resolve(dumpConfig.getSequenceResetFileName());
        if (!deleteScripts(ddlPath, resetPath)) {
            return false;
        }
        try (Reader reader = Files.newBufferedReader(Paths.get(dumpConfig.getInputFile()), charset.get())) {
            SchemaModel model = new DdlParser(warnings).parse(reader);
            DdlEmitter emitter = new DdlEmitter(warnings);
            try (Writer writer = Files.newBufferedWriter(ddlPath, StandardCharsets.UTF_8)) {
                emitter.emit(model, writer);
            }
            Files.write(resetPath, emitter.emitSequenceResets(model).getBytes(StandardCharsets.UTF_8));
            FileUtils.modifyFilePermission(ddlPath);
            FileUtils.modifyFilePermission(resetPath);
        } catch (DdlParseException e) {
            LOGGER.error("{}{}", ErrorCode.DDL_PARSE_EXCEPTION, e.getMessage());
            deleteScripts(ddlPath, resetPath);
            return false;
        } catch (IOException | UncheckedIOException e) {
            LOGGER.error("{}fail to convert ddl of {}, error message:{}", ErrorCode.IO_EXCEPTION,
                dumpConfig.getInputFile(), e.getMessage());
            deleteScripts(ddlPath, resetPath);
            return false;
        }
        warnings.logSummary("ddl conversion");
        LOGGER.info("ddl conversion finished, schema is written to {}, cost {} ms.", ddlPath,
            System.currentTimeMillis() - startTime);
        return true;
    }

    // a failed run leaves no schema or reset script behind
    private boolean deleteScripts(Path... scripts) {
        for (Path script : scripts) {
            try {
                Files.deleteIfExists(script);
            } catch (IOException e) {
                LOGGER.error("{}fail to delete {}, error message:{}", ErrorCode.IO_EXCEPTION, script,
                    e.getMessage());
                return false;
            }
        }
        return true;
    }
}
