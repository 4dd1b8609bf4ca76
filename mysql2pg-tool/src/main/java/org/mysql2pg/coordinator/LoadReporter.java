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

import com.alibaba.fastjson.JSON;
import com.alibaba.fastjson.serializer.SerializerFeature;

import org.mysql2pg.constants.CommonConstants;
import org.mysql2pg.model.load.LoadSummary;
import org.mysql2pg.utils.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * LoadReporter, writes the load summary as json
 *
 * @since 2025-04-18
 */
public class LoadReporter {
    private static final Logger LOGGER = LoggerFactory.getLogger(LoadReporter.class);

    /**
     * report
     *
     * @param summary summary
     * @param statusDir statusDir, ~ stands for the user home
     * @return written file, or null when the directory cannot be created
     */
    public static File report(LoadSummary summary, String statusDir) {
        String dir = statusDir.replace("~", System.getProperty("user.home"));
        if (!FileUtils.createDir(dir)) {
            return null;
        }
        File file = FileUtils.initFile(dir + File.separator + CommonConstants.LOAD_REPORT_FILE);
        FileUtils.writeToFile(file, JSON.toJSONString(summary, SerializerFeature.PrettyFormat));
        LOGGER.info("load report is written to {}", file.getAbsolutePath());
        return file;
    }
}
