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

package org.tessera.schema;

import org.tessera.annotation.Public;
import org.tessera.types.DataField;
import org.tessera.types.DataTypeRoot;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

import static org.tessera.utils.Preconditions.checkNotNull;

/**
 * 目标表的结构定义:从列名到声明类型的有序映射。
 *
 * <p>字段的插入顺序就是填充顺序。与普通的 Map 不同,这里允许出现重复的列名,
 * 按名称查找时返回第一个匹配的字段。
 *
 * <h2>使用示例</h2>
 *
 * <pre>{@code
 * TableSchema schema =
 *         TableSchema.newBuilder()
 *                 .column("id", DataTypeRoot.INT64)
 *                 .column("price", DataTypeRoot.FLOAT64)
 *                 .column("name", DataTypeRoot.STRING)
 *                 .build();
 * }</pre>
 */
@Public
public final class TableSchema implements Serializable {

    private static final long serialVersionUID = 1L;

    private final List<DataField> fields;

    public TableSchema(List<DataField> fields) {
        this.fields = Collections.unmodifiableList(new ArrayList<>(checkNotNull(fields)));
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    public List<DataField> fields() {
        return fields;
    }

    public List<String> columnNames() {
        return fields.stream().map(DataField::name).collect(Collectors.toList());
    }

    public List<DataTypeRoot> columnTypes() {
        return fields.stream().map(DataField::type).collect(Collectors.toList());
    }

    public int size() {
        return fields.size();
    }

    /** 返回第一个名称匹配的字段下标,不存在时返回 -1。 */
    public int indexOf(String name) {
        for (int i = 0; i < fields.size(); i++) {
            if (fields.get(i).name().equals(name)) {
                return i;
            }
        }
        return -1;
    }

    public boolean contains(String name) {
        return indexOf(name) >= 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return fields.equals(((TableSchema) o).fields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fields);
    }

    @Override
    public String toString() {
        return "TableSchema{" + "fields=" + fields + '}';
    }

    /** {@link TableSchema} 的构建器。 */
    public static final class Builder {

        private final List<DataField> fields = new ArrayList<>();

        private Builder() {}

        public Builder column(String name, DataTypeRoot type) {
            fields.add(new DataField(name, type));
            return this;
        }

        public Builder field(DataField field) {
            fields.add(checkNotNull(field));
            return this;
        }

        public TableSchema build() {
            return new TableSchema(fields);
        }
    }
}
