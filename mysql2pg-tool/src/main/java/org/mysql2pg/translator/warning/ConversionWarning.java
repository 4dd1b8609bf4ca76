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

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * ConversionWarning
 *
 * @since 2025-04-18
 */
@Data
@AllArgsConstructor
public class ConversionWarning {
    private WarningKind kind;
    private String construct;
    private String message;

    @Override
    public String toString() {
        return kind + " [" + construct + "]: " + message;
    }
}
