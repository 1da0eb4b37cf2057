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

import org.tessera.ingest.source.ElementBuffer;
import org.tessera.ingest.source.NumericCell;
import org.tessera.ingest.source.SourceAccessor;
import org.tessera.ingest.source.SourceColumn;
import org.tessera.table.ColumnarTable;
import org.tessera.table.TableColumn;
import org.tessera.types.DataTypeRoot;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.BitSet;

import static org.tessera.utils.Preconditions.checkArgument;
import static org.tessera.utils.Preconditions.checkState;

/**
 * 逐单元格把源列转换为目标列类型。
 *
 * <p>按目标列类型分派:
 *
 * <ul>
 *   <li>数值类型:按 {@link NumericCell} 读取并显式窄化。INT32 列遇到越界值时提升为 FLOAT64;INT64 或
 *       FLOAT64 列遇到非数值单元格时提升为 STRING,并从该行起改走字符串路径。
 *   <li>TIMESTAMP:源值乘以 {@link IngestOptions#DATETIME_UNIT_MULTIPLIER} 得到 epoch 毫秒。
 *   <li>DATE、STRING、BOOLEAN:通过 {@link SourceAccessor#marshalCell} 逐个转换。
 * </ul>
 *
 * <p>null、NaN、源缓冲区之外的行以及无法转换的单元格都按 {@link NullMarking} 标记为缺失。
 */
final class IterativeFiller {

    private static final Logger LOG = LoggerFactory.getLogger(IterativeFiller.class);

    /** 源时间列中表示"无值"的哨兵。 */
    static final long TIMESTAMP_SENTINEL = Long.MIN_VALUE;

    private final SourceAccessor accessor;

    private final IngestOptions options;

    IterativeFiller(SourceAccessor accessor, IngestOptions options) {
        this.accessor = accessor;
        this.options = options;
    }

    /**
     * 填充整列。
     *
     * @param sourceIndex 源列在 {@link SourceAccessor#columnNames()} 中的位置
     */
    void fill(
            ColumnarTable table,
            TableColumn column,
            String sourceName,
            int sourceIndex,
            SourceColumn source,
            NullMarking marking) {
        switch (column.type()) {
            case TIMESTAMP:
                fillDatetime(column, source, marking);
                break;
            case DATE:
                fillDate(column, sourceIndex, marking);
                break;
            case STRING:
                fillString(column, sourceIndex, 0, marking);
                break;
            case BOOLEAN:
                fillBool(column, sourceIndex, marking);
                break;
            default:
                fillNumeric(table, column, sourceName, sourceIndex, source, marking);
                break;
        }
    }

    private void fillNumeric(
            ColumnarTable table,
            TableColumn column,
            String sourceName,
            int sourceIndex,
            SourceColumn source,
            NullMarking marking) {
        ElementBuffer buffer = source.buffer();
        BitSet nulls = toBitSet(source.nullPositions());
        TypePromotionController promotion =
                new TypePromotionController(
                        table, column, sourceName, options.rehydratePriorRows());

        for (int row = 0; row < column.size(); row++) {
            TableColumn current = promotion.column();
            NumericCell cell = nulls.get(row) ? NumericCell.absent() : buffer.readNumeric(row);
            if (cell.isAbsent()) {
                marking.mark(current, row);
                continue;
            }

            if (cell.isInvalid()) {
                if (promotion.canPromoteTo(DataTypeRoot.STRING)) {
                    TableColumn promoted = promotion.promote(DataTypeRoot.STRING, row);
                    fillString(promoted, sourceIndex, row, marking);
                    return;
                }
                LOG.debug(
                        "Cell {} of source column {} is not numeric, marking it absent in {} {}.",
                        row,
                        sourceName,
                        current.type(),
                        current.name());
                marking.mark(current, row);
                continue;
            }

            if (current.type() == DataTypeRoot.INT32
                    && !cell.fitsInt32()
                    && promotion.canPromoteTo(DataTypeRoot.FLOAT64)) {
                current = promotion.promote(DataTypeRoot.FLOAT64, row);
            }
            writeNumeric(current, row, cell);
        }
    }

    /** 按目标列的存储宽度显式窄化后写入。 */
    private static void writeNumeric(TableColumn column, int row, NumericCell cell) {
        switch (column.type()) {
            case UINT8:
            case INT8:
                column.setByte(row, (byte) cell.longValue());
                break;
            case UINT16:
            case INT16:
                column.setShort(row, (short) cell.longValue());
                break;
            case UINT32:
            case INT32:
                column.setInt(row, (int) cell.longValue());
                break;
            case UINT64:
            case INT64:
                column.setLong(row, cell.longValue());
                break;
            case FLOAT32:
                column.setFloat(row, (float) cell.doubleValue());
                break;
            case FLOAT64:
                column.setDouble(row, cell.doubleValue());
                break;
            default:
                throw new IllegalStateException(
                        String.format(
                                "Column %s of type %s is not numeric.",
                                column.name(), column.type()));
        }
    }

    private void fillDatetime(TableColumn column, SourceColumn source, NullMarking marking) {
        ElementBuffer buffer = source.buffer();
        BitSet nulls = toBitSet(source.nullPositions());
        long multiplier = options.datetimeUnitMultiplier();

        for (int row = 0; row < column.size(); row++) {
            NumericCell cell = nulls.get(row) ? NumericCell.absent() : buffer.readNumeric(row);
            if (cell.isAbsent()
                    || cell.isInvalid()
                    || (cell.isIntegral() && cell.longValue() == TIMESTAMP_SENTINEL)) {
                marking.mark(column, row);
                continue;
            }

            if (cell.isIntegral()) {
                long value = cell.longValue();
                if (value > Long.MAX_VALUE / multiplier || value < Long.MIN_VALUE / multiplier) {
                    LOG.debug(
                            "Datetime {} at row {} of column {} overflows epoch milliseconds.",
                            value,
                            row,
                            column.name());
                    marking.mark(column, row);
                } else {
                    column.setTimestamp(row, value * multiplier);
                }
            } else {
                double scaled = cell.doubleValue() * multiplier;
                if (scaled >= 0x1p63 || scaled < -0x1p63) {
                    marking.mark(column, row);
                } else {
                    column.setTimestamp(row, (long) scaled);
                }
            }
        }
    }

    private void fillDate(TableColumn column, int sourceIndex, NullMarking marking) {
        for (int row = 0; row < column.size(); row++) {
            Object item = accessor.marshalCell(sourceIndex, row, DataTypeRoot.DATE);
            if (item == null) {
                marking.mark(column, row);
                continue;
            }
            checkState(
                    item instanceof LocalDate,
                    "Expected a LocalDate for column %s at row %s, but got %s.",
                    column.name(),
                    row,
                    item.getClass().getName());
            column.setDate(row, (LocalDate) item);
        }
    }

    /** 从 {@code fromRow} 开始写入文本,也是提升为 STRING 之后的续写路径。 */
    private void fillString(TableColumn column, int sourceIndex, int fromRow, NullMarking marking) {
        for (int row = fromRow; row < column.size(); row++) {
            Object item = accessor.marshalCell(sourceIndex, row, DataTypeRoot.STRING);
            if (item == null) {
                marking.mark(column, row);
            } else {
                column.setString(row, item.toString());
            }
        }
    }

    private void fillBool(TableColumn column, int sourceIndex, NullMarking marking) {
        for (int row = 0; row < column.size(); row++) {
            Object item = accessor.marshalCell(sourceIndex, row, DataTypeRoot.BOOLEAN);
            if (item == null) {
                marking.mark(column, row);
                continue;
            }
            checkState(
                    item instanceof Boolean,
                    "Expected a Boolean for column %s at row %s, but got %s.",
                    column.name(),
                    row,
                    item.getClass().getName());
            column.setBoolean(row, (Boolean) item);
        }
    }

    private static BitSet toBitSet(int[] positions) {
        BitSet bits = new BitSet();
        for (int position : positions) {
            checkArgument(position >= 0, "Null position must not be negative: %s", position);
            bits.set(position);
        }
        return bits;
    }
}
