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

package org.mysql2pg.model.config;

import lombok.Data;

import org.apache.commons.lang3.StringUtils;
import org.mysql2pg.constants.Unit;
import org.mysql2pg.enums.ErrorCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.Locale;
import java.util.regex.Pattern;

import javax.validation.constraints.NotNull;

/**
 * DumpConfig, input dump and generated files
 *
 * @since 2025-04-18
 */
@Data
public class DumpConfig {
    private static final Logger LOGGER = LoggerFactory.getLogger(DumpConfig.class);
    private static final BigInteger DEFAULT_CHUNK_SIZE = Unit.calculateSize(BigInteger.valueOf(200), Unit.M);
    private static final BigInteger MAX_CHUNK_SIZE = BigInteger.valueOf(Long.MAX_VALUE);
    private static final Pattern SIZE_PATTERN = Pattern.compile("^\\d+[bBkKmMgG]?$");

    @NotNull(message = "This parameter is required")
    private String inputFile;
    private String charset = "UTF-8";
    @NotNull(message = "This parameter is required")
    private String outDir;
    private String ddlFileName = "schema.sql";
    private String sequenceResetFileName = "sequence_reset.sql";
    private String chunkPrefix = "pg_inserts";
    private String chunkSize = "200M";
    private Boolean isDisableTriggers = true;

    /**
     * convertChunkSize
     *
     * @return chunk budget in bytes
     */
    public long convertChunkSize() {
        if (StringUtils.isEmpty(chunkSize)) {
            LOGGER.warn("chunkSize is empty. Default value: {} byte", DEFAULT_CHUNK_SIZE);
            return DEFAULT_CHUNK_SIZE.longValue();
        }
        if (!SIZE_PATTERN.matcher(chunkSize).matches()) {
            LOGGER.warn("Invalid chunkSize format: {}. Default value: {} byte", chunkSize, DEFAULT_CHUNK_SIZE);
            return DEFAULT_CHUNK_SIZE.longValue();
        }
        if (StringUtils.isNumeric(chunkSize)) {
            return checkRange(Unit.calculateSize(new BigInteger(chunkSize), Unit.B)).longValue();
        }
        return initStoreSize(chunkSize).longValue();
    }

    /**
     * initStoreSize
     *
     * @param sizeStr sizeStr
     * @return BigInteger
     */
    public BigInteger initStoreSize(String sizeStr) {
        char unitChar = sizeStr.toUpperCase(Locale.ROOT).charAt(sizeStr.length() - 1);
        BigInteger size = new BigInteger(sizeStr.substring(0, sizeStr.length() - 1));
        Unit unit = Unit.valueOf(String.valueOf(unitChar));
        return checkRange(Unit.calculateSize(size, unit));
    }

    private BigInteger checkRange(BigInteger bytes) {
        if (bytes.signum() <= 0) {
            LOGGER.warn("chunkSize must be positive: {}. Default value: {} byte", chunkSize, DEFAULT_CHUNK_SIZE);
            return DEFAULT_CHUNK_SIZE;
        }
        if (bytes.compareTo(MAX_CHUNK_SIZE) > 0) {
            LOGGER.warn("{}chunkSize is too large: {}. Maximum value: {} byte", ErrorCode.INCORRECT_CONFIGURATION,
                chunkSize, MAX_CHUNK_SIZE);
            return MAX_CHUNK_SIZE;
        }
        return bytes;
    }
}
