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

package org.mysql2pg.model.data;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * RawStatement, one statement as read from the dump with comments stripped
 *
 * @since 2025-04-18
 */
@Getter
@AllArgsConstructor
public class RawStatement {
    private final long index;
    private final String text;
    private final long line;
    private final boolean isBalanced;
    private final boolean isSemicolonEnded;
}
