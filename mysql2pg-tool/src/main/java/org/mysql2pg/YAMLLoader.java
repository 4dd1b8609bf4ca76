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

import org.mysql2pg.enums.ErrorCode;
import org.mysql2pg.model.config.GlobalConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.Optional;
import java.util.Set;

import javax.validation.ConstraintViolation;
import javax.validation.Validation;
import javax.validation.Validator;

/**
 * YAMLLoader
 *
 * @since 2025-04-18
 */
public class YAMLLoader {
    private static final Logger LOGGER = LoggerFactory.getLogger(YAMLLoader.class);

    /**
     * loadYamlConfig
     *
     * @param path path
     * @return GlobalConfig
     */
    public static Optional<GlobalConfig> loadYamlConfig(String path) {
        if (path == null) {
            LOGGER.error("{}--config parameter is required, please modify and retry",
                ErrorCode.INCORRECT_CONFIGURATION);
            return Optional.empty();
        }
        try (InputStream stream = Files.newInputStream(Paths.get(path))) {
            return loadYamlConfig(stream);
        } catch (IOException e) {
            LOGGER.error("{}fail to read yml config {}, error message: {}", ErrorCode.IO_EXCEPTION, path,
                e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * loadYamlConfig
     *
     * @param stream stream
     * @return GlobalConfig
     */
    public static Optional<GlobalConfig> loadYamlConfig(InputStream stream) {
        GlobalConfig globalConfig;
        try {
            Yaml yaml = new Yaml();
            globalConfig = yaml.loadAs(stream, GlobalConfig.class);
        } catch (YAMLException e) {
            LOGGER.error("{}fail to parse yml config, error message: {}", ErrorCode.INCORRECT_CONFIGURATION,
                e.getMessage());
            return Optional.empty();
        }
        if (globalConfig == null) {
            LOGGER.error("{}yml config is empty, please check and retry.", ErrorCode.INCORRECT_CONFIGURATION);
            return Optional.empty();
        }
        Validator validator = Validation.buildDefaultValidatorFactory().getValidator();
        Set<ConstraintViolation<GlobalConfig>> violations = validator.validate(globalConfig);
        if (!violations.isEmpty()) {
            violations.forEach(v -> LOGGER.error("{}the param '{}' is error, reason: {}, please check and retry.",
                ErrorCode.INCORRECT_CONFIGURATION, v.getPropertyPath(), v.getMessage()));
            return Optional.empty();
        }
        return Optional.of(globalConfig);
    }
}
