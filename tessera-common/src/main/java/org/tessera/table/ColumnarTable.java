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

import org.tessera.schema.TableSchema;
import org.tessera.types.DataField;
import org.tessera.types.DataTypeRoot;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.tessera.utils.Preconditions.checkArgument;
import static org.tessera.utils.Preconditions.checkNotNull;

/**
 * 列存内存表,持有一组按名称索引的 {@link TableColumn}。
 *
 * <p>表有一个统一的行数 {@link #size()},所有列的元素个数都等于它。列的增删、复制和类型提升
 * 都通过表完成。
 *
 * <h2>类型提升</h2>
 *
 * <p>{@link #promoteColumn} 不会在原列上原地修改类型,而是构造一个目标类型的新列,
 * 按需把提升点之前的行重新编码到新列中,再用新列替换同名的旧列。旧的句柄在提升后不再属于表。
 *
 * <h2>线程安全性</h2>
 * 该类<b>不是线程安全的</b>,填充期间表被调用方独占。
 */
public class ColumnarTable {

    private final Map<String, TableColumn> columns = new LinkedHashMap<>();

    private int size;

    public ColumnarTable(int size) {
        checkArgument(size >= 0, "Table size must not be negative: %s", size);
        this.size = size;
    }

    /** 按表结构创建每一列;重复的列名只创建第一次出现的那一列。 */
    public static ColumnarTable fromSchema(TableSchema schema, int size) {
        ColumnarTable table = new ColumnarTable(size);
        for (DataField field : schema.fields()) {
            if (!table.hasColumn(field.name())) {
                table.addColumn(field.name(), field.type(), true);
            }
        }
        return table;
    }

    public int size() {
        return size;
    }

    /** 扩大表的行数,已有列的存储随之扩容。 */
    public void extend(int newSize) {
        checkArgument(newSize >= size, "Cannot shrink table from %s to %s rows.", size, newSize);
        for (TableColumn column : columns.values()) {
            column.resize(newSize);
        }
        this.size = newSize;
    }

    public int numColumns() {
        return columns.size();
    }

    public List<String> columnNames() {
        return new ArrayList<>(columns.keySet());
    }

    public boolean hasColumn(String name) {
        return columns.containsKey(name);
    }

    /**
     * 添加一列。同名的列已经存在时会被替换。
     *
     * @param name 列名
     * @param type 列类型
     * @param withValidity 是否维护有效性位图
     * @return 新列的句柄
     */
    public TableColumn addColumn(String name, DataTypeRoot type, boolean withValidity) {
        TableColumn column = new TableColumn(name, type, size, withValidity);
        columns.put(name, column);
        return column;
    }

    /**
     * 按名称获取列。
     *
     * @throws IllegalArgumentException 如果列不存在
     */
    public TableColumn getColumn(String name) {
        TableColumn column = columns.get(checkNotNull(name));
        checkArgument(column != null, "Column '%s' does not exist in the table.", name);
        return column;
    }

    /** 将源列完整复制为一个新列(同名的目标列会被替换)。 */
    public TableColumn cloneColumn(String sourceName, String targetName) {
        TableColumn copy = getColumn(sourceName).copy(targetName);
        columns.put(targetName, copy);
        return copy;
    }

    /**
     * 将列提升为更宽的类型。
     *
     * <p>只接受 {@link DataTypeRoot#canPromoteTo} 允许的转换。{@code copyExisting} 为 true 时,
     * {@code [0, fromRow)} 内的行按新类型重新编码(数值转为 double,或转为规范文本),并保留其有效性;
     * 为 false 时这些行在新列中被标记为缺失。{@code fromRow} 及之后的行留给调用方写入。
     *
     * @param name 列名
     * @param newType 目标类型
     * @param fromRow 触发提升的行
     * @param copyExisting 是否重新编码提升点之前的行
     * @return 替换后的新列句柄
     */
    public TableColumn promoteColumn(
            String name, DataTypeRoot newType, int fromRow, boolean copyExisting) {
        TableColumn current = getColumn(name);
        checkArgument(
                current.type().canPromoteTo(newType),
                "Cannot promote column '%s' from %s to %s.",
                name,
                current.type(),
                newType);
        checkArgument(
                fromRow >= 0 && fromRow <= size,
                "Promotion row %s is out of range [0, %s].",
                fromRow,
                size);

        TableColumn promoted = new TableColumn(name, newType, size, current.withValidity());
        for (int row = 0; row < fromRow; row++) {
            if (!copyExisting) {
                promoted.clear(row);
            } else if (current.isNullAt(row)) {
                current.copyValidityTo(promoted, row);
            } else if (newType == DataTypeRoot.FLOAT64) {
                promoted.setDouble(row, current.getNumericAsDouble(row));
            } else {
                promoted.setString(row, current.getText(row));
            }
        }
        columns.put(name, promoted);
        return promoted;
    }

    @Override
    public String toString() {
        return "ColumnarTable{" + "size=" + size + ", columns=" + columns.values() + '}';
    }
}
