/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.tessera.ingest;

import org.tessera.table.TableColumn;

import static org.tessera.utils.Preconditions.checkArgument;

/**
 * 缺失值的标记方式。初次加载时缺失的行被 {@link #CLEAR 清除},更新时被 {@link #UNSET 撤销},
 * 后者让下游能够区分"从未有值"和"由有值变为缺失"。
 */
enum NullMarking {
    CLEAR {
        @Override
        void mark(TableColumn column, int row) {
            column.clear(row);
        }
    },
    UNSET {
        @Override
        void mark(TableColumn column, int row) {
            column.unset(row);
        }
    };

    abstract void mark(TableColumn column, int row);

    /** 依次标记一组行偏移;超出列长度的偏移不属于这张表,直接跳过。 */
    void markAll(TableColumn column, int[] rows) {
        for (int row : rows) {
            checkArgument(row >= 0, "Null position must not be negative: %s", row);
            if (row < column.size()) {
                mark(column, row);
            }
        }
    }

    static NullMarking of(boolean isUpdate) {
        return isUpdate ? UNSET : CLEAR;
    }
}
