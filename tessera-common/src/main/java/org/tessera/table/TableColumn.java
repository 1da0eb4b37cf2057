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

package org.tessera.table;

import org.tessera.data.columnar.BytesColumnVector.Bytes;
import org.tessera.data.columnar.heap.AbstractHeapVector;
import org.tessera.data.columnar.heap.HeapBooleanVector;
import org.tessera.data.columnar.heap.HeapByteVector;
import org.tessera.data.columnar.heap.HeapBytesVector;
import org.tessera.data.columnar.heap.HeapDoubleVector;
import org.tessera.data.columnar.heap.HeapFloatVector;
import org.tessera.data.columnar.heap.HeapIntVector;
import org.tessera.data.columnar.heap.HeapLongVector;
import org.tessera.data.columnar.heap.HeapShortVector;
import org.tessera.types.DataTypeRoot;
import org.tessera.utils.DateTimeUtils;

import javax.annotation.Nullable;

import java.nio.charset.StandardCharsets;
import java.time.LocalDate;

import static org.tessera.utils.Preconditions.checkNotNull;
import static org.tessera.utils.Preconditions.checkState;

/**
 * 列存表中的一列:列名、声明类型、定容的类型化存储以及并行的有效性位图。
 *
 * <p>列由 {@link ColumnarTable} 创建和持有,调用方拿到的只是一个句柄。列的类型不可变,
 * 类型提升由 {@link ColumnarTable#promoteColumn} 构造一个新的列对象并替换旧列完成,
 * 因此提升之后调用方必须使用返回的新句柄。
 *
 * <h2>存储映射</h2>
 *
 * <pre>
 * UINT8, INT8        -> HeapByteVector
 * UINT16, INT16      -> HeapShortVector
 * UINT32, INT32     -> HeapIntVector
 * DATE               -> HeapIntVector
 * UINT64, INT64      -> HeapLongVector
 * TIMESTAMP          -> HeapLongVector
 * FLOAT32            -> HeapFloatVector
 * FLOAT64            -> HeapDoubleVector
 * BOOLEAN            -> HeapBooleanVector
 * STRING             -> HeapBytesVector (UTF-8)
 * </pre>
 *
 * <p>所有 {@code setXxx} 方法在写入值的同时把该行标记为有值;类型与存储不符时抛出
 * {@link IllegalStateException}。无符号类型与同宽度的有符号类型共用存储,读取时按无符号解读。
 */
public class TableColumn {

    private final String name;

    private final DataTypeRoot type;

    private final boolean withValidity;

    private final AbstractHeapVector vector;

    private int size;

    TableColumn(String name, DataTypeRoot type, int size, boolean withValidity) {
        this.name = checkNotNull(name);
        this.type = checkNotNull(type);
        this.size = size;
        this.withValidity = withValidity;
        this.vector = createVector(type, size);
    }

    public String name() {
        return name;
    }

    public DataTypeRoot type() {
        return type;
    }

    public int size() {
        return size;
    }

    /** 是否维护有效性位图;不维护时 {@link #clear}/{@link #unset} 不生效,所有行都视为有值。 */
    public boolean withValidity() {
        return withValidity;
    }

    /** 返回底层的向量,供批量写入使用。 */
    public AbstractHeapVector vector() {
        return vector;
    }

    void resize(int newSize) {
        vector.reserve(newSize);
        this.size = newSize;
    }

    // ------------------------------------------------------------------------
    //  Validity
    // ------------------------------------------------------------------------

    /** 将某行标记为缺失(初次加载语义)。 */
    public void clear(int row) {
        if (withValidity) {
            vector.setNullAt(row);
        }
    }

    /** 将某行由有值变为缺失(更新语义)。 */
    public void unset(int row) {
        if (withValidity) {
            vector.unsetAt(row);
        }
    }

    /** 将整列标记为有值。 */
    public void fillValidityAllPresent() {
        vector.setAllNotNull();
    }

    public boolean isNullAt(int row) {
        return withValidity && vector.isNullAt(row);
    }

    public boolean isUnsetAt(int row) {
        return withValidity && vector.isUnsetAt(row);
    }

    private void markPresent(int row) {
        vector.setNotNullAt(row);
    }

    // ------------------------------------------------------------------------
    //  Writers
    // ------------------------------------------------------------------------

    public void setByte(int row, byte value) {
        as(HeapByteVector.class).setByte(row, value);
        markPresent(row);
    }

    public void setShort(int row, short value) {
        as(HeapShortVector.class).setShort(row, value);
        markPresent(row);
    }

    public void setInt(int row, int value) {
        as(HeapIntVector.class).setInt(row, value);
        markPresent(row);
    }

    public void setLong(int row, long value) {
        as(HeapLongVector.class).setLong(row, value);
        markPresent(row);
    }

    public void setFloat(int row, float value) {
        as(HeapFloatVector.class).setFloat(row, value);
        markPresent(row);
    }

    public void setDouble(int row, double value) {
        as(HeapDoubleVector.class).setDouble(row, value);
        markPresent(row);
    }

    public void setBoolean(int row, boolean value) {
        as(HeapBooleanVector.class).setBoolean(row, value);
        markPresent(row);
    }

    /** 写入字符串,按 UTF-8 编码保存。 */
    public void setString(int row, String value) {
        byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
        as(HeapBytesVector.class).putByteArray(row, bytes, 0, bytes.length);
        markPresent(row);
    }

    public void setDate(int row, LocalDate date) {
        checkState(
                type == DataTypeRoot.DATE,
                "Column %s of type %s is not a DATE column.",
                name,
                type);
        setInt(row, DateTimeUtils.toInternal(date));
    }

    /** 写入 epoch 毫秒时间戳。 */
    public void setTimestamp(int row, long epochMillis) {
        checkState(
                type == DataTypeRoot.TIMESTAMP,
                "Column %s of type %s is not a TIMESTAMP column.",
                name,
                type);
        setLong(row, epochMillis);
    }

    // ------------------------------------------------------------------------
    //  Readers
    // ------------------------------------------------------------------------

    public byte getByte(int row) {
        return as(HeapByteVector.class).getByte(row);
    }

    public short getShort(int row) {
        return as(HeapShortVector.class).getShort(row);
    }

    public int getInt(int row) {
        return as(HeapIntVector.class).getInt(row);
    }

    public long getLong(int row) {
        return as(HeapLongVector.class).getLong(row);
    }

    public float getFloat(int row) {
        return as(HeapFloatVector.class).getFloat(row);
    }

    public double getDouble(int row) {
        return as(HeapDoubleVector.class).getDouble(row);
    }

    public boolean getBoolean(int row) {
        return as(HeapBooleanVector.class).getBoolean(row);
    }

    public String getString(int row) {
        return as(HeapBytesVector.class).getBytes(row).toUtf8String();
    }

    public LocalDate getDate(int row) {
        return DateTimeUtils.toLocalDate(getInt(row));
    }

    /** 以 double 读取数值列的某一行,无符号类型按无符号解读。 */
    public double getNumericAsDouble(int row) {
        switch (type) {
            case UINT8:
                return Byte.toUnsignedInt(getByte(row));
            case UINT16:
                return Short.toUnsignedInt(getShort(row));
            case UINT32:
                return Integer.toUnsignedLong(getInt(row));
            case UINT64:
                return unsignedToDouble(getLong(row));
            case INT8:
                return getByte(row);
            case INT16:
                return getShort(row);
            case INT32:
                return getInt(row);
            case INT64:
                return getLong(row);
            case FLOAT32:
                return getFloat(row);
            case FLOAT64:
                return getDouble(row);
            case BOOLEAN:
            case DATE:
            case TIMESTAMP:
            case STRING:
            default:
                throw new IllegalStateException(
                        String.format("Column %s of type %s is not numeric.", name, type));
        }
    }

    /**
     * 以装箱对象读取某一行,缺失的行返回 null。
     *
     * <p>UINT8/UINT16 返回 Integer,UINT32 返回 Long,UINT64 返回原始位模式的 Long;
     * DATE 返回 {@link LocalDate},TIMESTAMP 返回 epoch 毫秒。
     */
    @Nullable
    public Object getValue(int row) {
        if (isNullAt(row)) {
            return null;
        }
        switch (type) {
            case UINT8:
                return Byte.toUnsignedInt(getByte(row));
            case UINT16:
                return Short.toUnsignedInt(getShort(row));
            case UINT32:
                return Integer.toUnsignedLong(getInt(row));
            case UINT64:
                return getLong(row);
            case INT8:
                return getByte(row);
            case INT16:
                return getShort(row);
            case INT32:
                return getInt(row);
            case INT64:
                return getLong(row);
            case FLOAT32:
                return getFloat(row);
            case FLOAT64:
                return getDouble(row);
            case BOOLEAN:
                return getBoolean(row);
            case DATE:
                return getDate(row);
            case TIMESTAMP:
                return getLong(row);
            case STRING:
                return getString(row);
            default:
                throw new UnsupportedOperationException("Unsupported type: " + type);
        }
    }

    /** 某一行的规范文本表示,用于提升为 STRING 时重新编码已有的行。缺失的行返回 null。 */
    @Nullable
    public String getText(int row) {
        if (isNullAt(row)) {
            return null;
        }
        switch (type) {
            case UINT64:
                return Long.toUnsignedString(getLong(row));
            case DATE:
                return getDate(row).toString();
            default:
                return String.valueOf(getValue(row));
        }
    }

    // ------------------------------------------------------------------------
    //  Copy
    // ------------------------------------------------------------------------

    /** 复制出一个同类型、同内容、同有效性的新列。 */
    TableColumn copy(String newName) {
        TableColumn target = new TableColumn(newName, type, size, withValidity);
        for (int row = 0; row < size; row++) {
            copyRowTo(target, row);
        }
        return target;
    }

    /** 将本列某一行的值和有效性复制到同类型的目标列。 */
    void copyRowTo(TableColumn target, int row) {
        checkState(target.type == type, "Cannot copy %s into %s.", type, target.type);
        switch (type) {
            case UINT8:
            case INT8:
                target.setByte(row, getByte(row));
                break;
            case UINT16:
            case INT16:
                target.setShort(row, getShort(row));
                break;
            case UINT32:
            case INT32:
            case DATE:
                target.setInt(row, getInt(row));
                break;
            case UINT64:
            case INT64:
            case TIMESTAMP:
                target.setLong(row, getLong(row));
                break;
            case FLOAT32:
                target.setFloat(row, getFloat(row));
                break;
            case FLOAT64:
                target.setDouble(row, getDouble(row));
                break;
            case BOOLEAN:
                target.setBoolean(row, getBoolean(row));
                break;
            case STRING:
                Bytes bytes = as(HeapBytesVector.class).getBytes(row);
                target.as(HeapBytesVector.class)
                        .putByteArray(row, bytes.data, bytes.offset, bytes.len);
                break;
            default:
                throw new UnsupportedOperationException("Unsupported type: " + type);
        }
        copyValidityTo(target, row);
    }

    /** 将某一行的有效性状态同步到目标列。 */
    void copyValidityTo(TableColumn target, int row) {
        if (isUnsetAt(row)) {
            target.unset(row);
        } else if (isNullAt(row)) {
            target.clear(row);
        } else {
            target.markPresent(row);
        }
    }

    // ------------------------------------------------------------------------

    private <V> V as(Class<V> clazz) {
        checkState(
                clazz.isInstance(vector),
                "Column %s of type %s is not backed by %s.",
                name,
                type,
                clazz.getSimpleName());
        return clazz.cast(vector);
    }

    private static double unsignedToDouble(long bits) {
        double value = (double) (bits >>> 1) * 2.0;
        return value + (bits & 1L);
    }

    private static AbstractHeapVector createVector(DataTypeRoot type, int capacity) {
        switch (type) {
            case UINT8:
            case INT8:
                return new HeapByteVector(capacity);
            case UINT16:
            case INT16:
                return new HeapShortVector(capacity);
            case UINT32:
            case INT32:
            case DATE:
                return new HeapIntVector(capacity);
            case UINT64:
            case INT64:
            case TIMESTAMP:
                return new HeapLongVector(capacity);
            case FLOAT32:
                return new HeapFloatVector(capacity);
            case FLOAT64:
                return new HeapDoubleVector(capacity);
            case BOOLEAN:
                return new HeapBooleanVector(capacity);
            case STRING:
                return new HeapBytesVector(capacity);
            default:
                throw new UnsupportedOperationException("Unsupported type: " + type);
        }
    }

    @Override
    public String toString() {
        return "TableColumn{" + "name='" + name + '\'' + ", type=" + type + ", size=" + size + '}';
    }
}
