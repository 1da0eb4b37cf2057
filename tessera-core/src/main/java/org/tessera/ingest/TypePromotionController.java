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

import org.tessera.table.ColumnarTable;
import org.tessera.table.TableColumn;
import org.tessera.types.DataTypeRoot;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static org.tessera.utils.Preconditions.checkState;

/**
 * 一次列填充过程中的类型提升状态。
 *
 * <p>每次填充最多提升一次,只允许 {@code INT32 -> FLOAT64}、{@code INT64 -> STRING} 和 {@code
 * FLOAT64 -> STRING}。提升为 FLOAT64 时总会保留已写入的行;提升为 STRING 时由 {@link
 * IngestOptions#REHYDRATE_PRIOR_ROWS} 决定已写入的行是转为文本还是变为缺失。
 */
final class TypePromotionController {

    private static final Logger LOG = LoggerFactory.getLogger(TypePromotionController.class);

    private final ColumnarTable table;

    private final String sourceName;

    private final boolean rehydrateForString;

    private TableColumn column;

    private boolean promoted;

    TypePromotionController(
            ColumnarTable table,
            TableColumn column,
            String sourceName,
            boolean rehydrateForString) {
        this.table = table;
        this.column = column;
        this.sourceName = sourceName;
        this.rehydrateForString = rehydrateForString;
    }

    TableColumn column() {
        return column;
    }

    DataTypeRoot currentType() {
        return column.type();
    }

    boolean hasPromoted() {
        return promoted;
    }

    boolean canPromoteTo(DataTypeRoot target) {
        return !promoted && column.type().canPromoteTo(target);
    }

    /**
     * 将当前列提升为 {@code target},并返回新列。{@code row} 及之后的行由调用方按新类型写入。
     */
    TableColumn promote(DataTypeRoot target, int row) {
        checkState(
                canPromoteTo(target),
                "Column %s cannot be promoted from %s to %s.",
                column.name(),
                column.type(),
                target);
        boolean copyExisting = target == DataTypeRoot.FLOAT64 || rehydrateForString;
        LOG.warn(
                "Promoting column {} from {} to {} at row {} while reading source column {}.",
                column.name(),
                column.type(),
                target,
                row,
                sourceName);
        column = table.promoteColumn(column.name(), target, row, copyExisting);
        promoted = true;
        return column;
    }
}
