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

package org.mysql2pg.model.load;

import lombok.Data;

import java.util.List;
import java.util.stream.Collectors;

/**
 * LoadSummary
 *
 * @since 2025-04-18
 */
@Data
public class LoadSummary {
    private int total;
    private int succeeded;
    private int failed;
    private long costTime;
    private List<LoadResult> results;

    /**
     * Constructor
     *
     * @param results results in input order
     * @param costTime costTime in milliseconds
     */
    public LoadSummary(List<LoadResult> results, long costTime) {
        this.results = results;
        this.costTime = costTime;
        this.total = results.size();
        this.succeeded = (int) results.stream().filter(LoadResult::isSuccess).count();
        this.failed = total - succeeded;
    }

    /**
     * getFailedResults
     *
     * @return permanently failed files with their last error
     */
    public List<LoadResult> getFailedResults() {
        return results.stream().filter(result -> !result.isSuccess()).collect(Collectors.toList());
    }

    /**
     * isAllSuccess
     *
     * @return true when no task failed permanently
     */
    public boolean isAllSuccess() {
        return failed == 0;
    }
}
