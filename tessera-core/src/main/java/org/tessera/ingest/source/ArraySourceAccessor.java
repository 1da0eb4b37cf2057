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

package org.tessera.ingest.source;

import org.tessera.types.DataTypeRoot;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.TreeSet;

import static org.tessera.utils.Preconditions.checkArgument;
import static org.tessera.utils.Preconditions.checkNotNull;

/**
 * 基于内存数组的 {@link SourceAccessor}。
 *
 * <p>缺失值有三个来源:构建时显式给出的行偏移、浮点列中的 NaN,以及对象列中的 null 或 NaN。
 *
 * <pre>{@code
 * SourceAccessor source =
 *         ArraySourceAccessor.builder()
 *                 .column("price", ElementBuffer.ofDoubles(1.5, Double.NaN, 3.0))
 *                 .column("qty", ElementBuffer.ofInts(1, 2, 3), 1)
 *                 .build();
 * }</pre>
 */
public class ArraySourceAccessor implements SourceAccessor {

    private static final Logger LOG = LoggerFactory.getLogger(ArraySourceAccessor.class);

    private final List<String> names;

    private final List<Object> data;

    private final List<int[]> masks;

    private final int rowCount;

    private ArraySourceAccessor(
            List<String> names, List<Object> data, List<int[]> masks, int rowCount) {
        this.names = Collections.unmodifiableList(names);
        this.data = data;
        this.masks = masks;
        this.rowCount = rowCount;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public int rowCount() {
        return rowCount;
    }

    @Override
    public List<String> columnNames() {
        return names;
    }

    @Nullable
    @Override
    public Object columnData(int columnIndex) {
        return data.get(columnIndex);
    }

    @Override
    public SourceColumn columnBuffer(String name, DataTypeRoot destType) {
        int index = indexOf(name);
        checkArgument(index >= 0, "Unknown source column '%s'.", name);
        Object raw = data.get(index);
        if (!(raw instanceof ElementBuffer)) {
            return new SourceColumn(null, null);
        }
        ElementBuffer buffer = (ElementBuffer) raw;
        return new SourceColumn(buffer, nullPositions(buffer, masks.get(index)));
    }

    @Nullable
    @Override
    public Object marshalCell(int columnIndex, int rowIndex, DataTypeRoot destType) {
        Object raw = data.get(columnIndex);
        if (!(raw instanceof ElementBuffer)) {
            return null;
        }
        ElementBuffer buffer = (ElementBuffer) raw;
        if (rowIndex >= buffer.length()
                || Arrays.binarySearch(masks.get(columnIndex), rowIndex) >= 0) {
            return null;
        }
        Object value = buffer.getBoxed(rowIndex);
        if (value == null || isNaN(value)) {
            return null;
        }

        switch (destType) {
            case STRING:
                if (buffer.kind() == ElementKind.UINT64) {
                    return Long.toUnsignedString((Long) value);
                }
                return value instanceof CharSequence ? value : String.valueOf(value);
            case BOOLEAN:
                return toBoolean(value);
            case DATE:
                return toDate(value);
            default:
                return value;
        }
    }

    private int indexOf(String name) {
        return names.indexOf(name);
    }

    private static int[] nullPositions(ElementBuffer buffer, int[] explicit) {
        ElementKind kind = buffer.kind();
        if (!kind.isFloating() && kind != ElementKind.OBJECT) {
            return explicit;
        }
        TreeSet<Integer> positions = new TreeSet<>();
        for (int row : explicit) {
            positions.add(row);
        }
        for (int row = 0; row < buffer.length(); row++) {
            Object value = buffer.getBoxed(row);
            if (value == null || isNaN(value)) {
                positions.add(row);
            }
        }
        return positions.stream().mapToInt(Integer::intValue).toArray();
    }

    private static boolean isNaN(Object value) {
        return (value instanceof Double && ((Double) value).isNaN())
                || (value instanceof Float && ((Float) value).isNaN());
    }

    @Nullable
    private static Boolean toBoolean(Object value) {
        if (value instanceof Boolean) {
            return (Boolean) value;
        } else if (value instanceof Number) {
            return ((Number) value).doubleValue() != 0d;
        } else if (value instanceof CharSequence) {
            String text = value.toString().trim();
            if ("true".equalsIgnoreCase(text)) {
                return Boolean.TRUE;
            } else if ("false".equalsIgnoreCase(text)) {
                return Boolean.FALSE;
            }
        }
        return null;
    }

    @Nullable
    private static LocalDate toDate(Object value) {
        if (value instanceof LocalDate) {
            return (LocalDate) value;
        } else if (value instanceof LocalDateTime) {
            return ((LocalDateTime) value).toLocalDate();
        } else if (value instanceof CharSequence) {
            try {
                return LocalDate.parse((CharSequence) value);
            } catch (DateTimeParseException e) {
                LOG.debug("Cannot parse '{}' as a date, treating the cell as absent.", value, e);
                return null;
            }
        }
        return null;
    }

    // ------------------------------------------------------------------------

    /** {@link ArraySourceAccessor} 的构建器。 */
    public static final class Builder {

        private final List<String> names = new ArrayList<>();

        private final List<Object> data = new ArrayList<>();

        private final List<int[]> masks = new ArrayList<>();

        @Nullable private Integer rowCount;

        private Builder() {}

        /**
         * 添加一列。
         *
         * @param nullPositions 显式标记为缺失的行偏移
         */
        public Builder column(String name, ElementBuffer buffer, int... nullPositions) {
            checkNotNull(buffer, "Buffer of column '%s' must not be null.", name);
            return add(name, buffer, nullPositions);
        }

        /** 添加一列没有统一元素类型的原始数据,例如混合类型的 {@link List}。 */
        public Builder rawColumn(String name, @Nullable Object raw) {
            return add(name, raw, new int[0]);
        }

        /** 覆盖行数;默认取各列长度的最大值。 */
        public Builder rowCount(int rowCount) {
            checkArgument(rowCount >= 0, "Row count must not be negative: %s", rowCount);
            this.rowCount = rowCount;
            return this;
        }

        private Builder add(String name, @Nullable Object raw, int[] nullPositions) {
            checkNotNull(name, "Column name must not be null.");
            int[] sorted = nullPositions.clone();
            Arrays.sort(sorted);
            names.add(name);
            data.add(raw);
            masks.add(sorted);
            return this;
        }

        public ArraySourceAccessor build() {
            int rows = 0;
            for (Object raw : data) {
                if (raw instanceof ElementBuffer) {
                    rows = Math.max(rows, ((ElementBuffer) raw).length());
                } else if (raw instanceof List) {
                    rows = Math.max(rows, ((List<?>) raw).size());
                }
            }
            return new ArraySourceAccessor(
                    new ArrayList<>(names),
                    new ArrayList<>(data),
                    new ArrayList<>(masks),
                    rowCount == null ? rows : rowCount);
        }
    }
}
