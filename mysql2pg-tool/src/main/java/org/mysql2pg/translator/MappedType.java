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

package org.mysql2pg.translator;

import lombok.Builder;
import lombok.Data;

import org.mysql2pg.translator.warning.ConversionWarning;

import java.util.List;

/**
 * MappedType, the result of mapping one MySQL column type and default
 *
 * @since 2025-04-18
 */
@Data
@Builder
public class MappedType {
    private String targetType;
    private String checkConstraint;
    private String defaultValue;
    private boolean isNullDefault;
    private List<ConversionWarning> warnings;
}
