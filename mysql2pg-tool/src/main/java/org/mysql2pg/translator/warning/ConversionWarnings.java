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

package org.mysql2pg.translator.warning;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Collects non fatal conversion warnings of one run and logs each of them.
 *
 * @since 2025-04-18
 */
public class ConversionWarnings {
    private static final Logger LOGGER = LoggerFactory.getLogger(ConversionWarnings.class);

    private final List<ConversionWarning> warnings = new ArrayList<>();

    /**
     * warn
     *
     * @param kind kind
     * @param construct table, clause or type name the warning is about
     * @param message message
     */
    public void warn(WarningKind kind, String construct, String message) {
        add(new ConversionWarning(kind, construct, message));
    }

    /**
     * add
     *
     * @param warning warning
     */
    public synchronized void add(ConversionWarning warning) {
        LOGGER.warn("{}", warning);
        warnings.add(warning);
    }

    /**
     * addAll
     *
     * @param newWarnings newWarnings
     */
    public void addAll(List<ConversionWarning> newWarnings) {
        newWarnings.forEach(this::add);
    }

    /**
     * getWarnings
     *
     * @return copy of the collected warnings
     */
    public synchronized List<ConversionWarning> getWarnings() {
        return Collections.unmodifiableList(new ArrayList<>(warnings));
    }

    /**
     * count
     *
     * @param kind kind
     * @return number of warnings of the given kind
     */
    public synchronized long count(WarningKind kind) {
        return warnings.stream().filter(warning -> warning.getKind() == kind).count();
    }

    /**
     * size
     *
     * @return number of warnings
     */
    public synchronized int size() {
        return warnings.size();
    }

    /**
     * logSummary
     *
     * @param phase phase name
     */
    public synchronized void logSummary(String phase) {
        if (warnings.isEmpty()) {
            LOGGER.info("{} finished without conversion warnings.", phase);
            return;
        }
        Map<WarningKind, Integer> counts = new EnumMap<>(WarningKind.class);
        for (ConversionWarning warning : warnings) {
            counts.merge(warning.getKind(), 1, Integer::sum);
        }
        LOGGER.info("{} finished with {} conversion warnings: {}", phase, warnings.size(), counts);
    }
}
