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

import javax.annotation.Nullable;

import static org.tessera.utils.Preconditions.checkArgument;
import static org.tessera.utils.StringUtils.isNullOrWhitespaceOnly;

/**
 * 在填充完所有列之后生成主键列和排序键列。
 *
 * <p>给出索引列名时,两者都是该列的副本;否则两者都是 INT32 列,第 {@code r} 行的值为 {@code (r +
 * offset) % limit}。
 */
class IndexSynthesizer {

    private static final Logger LOG = LoggerFactory.getLogger(IndexSynthesizer.class);

    private final String primaryKeyColumn;

    private final String orderKeyColumn;

    IndexSynthesizer(IngestOptions options) {
        this.primaryKeyColumn = options.primaryKeyColumn();
        this.orderKeyColumn = options.orderKeyColumn();
    }

    void synthesize(ColumnarTable table, @Nullable String index, int offset, int limit) {
        if (!isNullOrWhitespaceOnly(index)) {
            if (!table.hasColumn(index)) {
                throw new UnknownColumnException(index);
            }
            table.cloneColumn(index, primaryKeyColumn);
            table.cloneColumn(index, orderKeyColumn);
            return;
        }

        if (limit <= 0) {
            throw new InvalidLimitException(limit);
        }
        checkArgument(offset >= 0, "Index offset must not be negative, but is %s.", offset);
        LOG.debug(
                "Generating {} and {} for {} rows with offset {} and limit {}.",
                primaryKeyColumn,
                orderKeyColumn,
                table.size(),
                offset,
                limit);

        TableColumn primaryKey = table.addColumn(primaryKeyColumn, DataTypeRoot.INT32, true);
        TableColumn orderKey = table.addColumn(orderKeyColumn, DataTypeRoot.INT32, true);
        for (int row = 0; row < table.size(); row++) {
            int value = (int) ((row + (long) offset) % limit);
            primaryKey.setInt(row, value);
            orderKey.setInt(row, value);
        }
    }

    /** 把已经填好的主键列复制为排序键列。 */
    void copyPrimaryKeyToOrderKey(ColumnarTable table) {
        table.cloneColumn(primaryKeyColumn, orderKeyColumn);
    }

    String primaryKeyColumn() {
        return primaryKeyColumn;
    }
}
