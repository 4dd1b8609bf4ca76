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

package org.mysql2pg.enums;

import java.util.Locale;

/**
 * ErrorCode, prefix of every error log line
 *
 * @since 2025-04-18
 */
public enum ErrorCode {
    UNKNOWN(5000, "未知异常", "Unknown error"),
    INCORRECT_CONFIGURATION(5100, "参数配置错误", "There is an error in the parameter configuration"),
    IO_EXCEPTION(5200, "文件读写异常", "IO exception"),
    SQL_EXCEPTION(5300, "SQL执行失败", "SQL execution failed"),
    DB_CONNECTION_EXCEPTION(5400, "数据库连接异常", "Database exception"),
    DDL_PARSE_EXCEPTION(5500, "DDL解析异常", "DDL parse exception"),
    STATEMENT_EXTRACT_EXCEPTION(5600, "数据语句提取异常", "Statement extract exception"),
    LOAD_EXCEPTION(5700, "数据加载失败", "Data load failed"),
    THREAD_INTERRUPTED_EXCEPTION(5900, "线程中断异常", "Thread interrupted exception");

    private final int code;
    private final String causeCn;
    private final String causeEn;

    ErrorCode(int code, String causeCn, String causeEn) {
        this.code = code;
        this.causeCn = causeCn;
        this.causeEn = causeEn;
    }

    public int getCode() {
        return code;
    }

    public String getCauseCn() {
        return causeCn;
    }

    public String getCauseEn() {
        return causeEn;
    }

    @Override
    public String toString() {
        return getErrorPrefix();
    }

    /**
     * get error prefix
     *
     * @return String error prefix
     */
    public String getErrorPrefix() {
        return String.format(Locale.ENGLISH, "<CODE:%d> ", code);
    }
}
