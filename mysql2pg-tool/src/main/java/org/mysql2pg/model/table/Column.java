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

package org.mysql2pg.model.table;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Column
 *
 * @since 2025-04-18
 */
@Data
@Builder
public class Column {
    private String name;
    private int position;
    private String typeName;
    private List<String> typeArgs;
    private String targetType;
    @Builder.Default
    private boolean nullable = true;
    private String defaultValueExpression;
    private String targetDefault;
    private boolean isExplicitNullDefault;
    private boolean autoIncremented;
    private String sequenceName;
    private String comment;
    private String checkConstraint;
}
