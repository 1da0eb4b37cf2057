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

package org.tessera.types;

import org.tessera.annotation.Public;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * 列类型根的枚举,是列存表中每一列可以声明的全部类型。
 *
 * <p>这是一个封闭集合:引擎对类型的分派都通过对该枚举的 switch 完成,
 * 不依赖运行时的类型检查。每个类型根关联一组 {@link DataTypeFamily} 以及其定长元素的字节宽度
 * (变长类型的宽度为 0)。
 *
 * <p>类型分类:
 *
 * <ul>
 *   <li><b>无符号整数</b>: UINT8, UINT16, UINT32, UINT64
 *   <li><b>有符号整数</b>: INT8, INT16, INT32, INT64
 *   <li><b>浮点数</b>: FLOAT32, FLOAT64
 *   <li><b>布尔类型</b>: BOOLEAN
 *   <li><b>日期时间</b>: DATE(自 epoch 起的天数), TIMESTAMP(epoch 毫秒)
 *   <li><b>字符串</b>: STRING(UTF-8 编码)
 * </ul>
 *
 * <h2>类型提升</h2>
 *
 * <p>列的类型在写入过程中可以被单向地提升(见 {@link #canPromoteTo}),提升一旦发生就不会回退:
 *
 * <pre>
 * INT32   -> FLOAT64
 * INT64   -> STRING
 * FLOAT64 -> STRING
 * </pre>
 */
@Public
public enum DataTypeRoot {
    /** 1 字节无符号整数,范围 0 到 255。 */
    UINT8(
            1,
            DataTypeFamily.PREDEFINED,
            DataTypeFamily.NUMERIC,
            DataTypeFamily.INTEGER_NUMERIC,
            DataTypeFamily.UNSIGNED_NUMERIC),

    /** 2 字节无符号整数,范围 0 到 65,535。 */
    UINT16(
            2,
            DataTypeFamily.PREDEFINED,
            DataTypeFamily.NUMERIC,
            DataTypeFamily.INTEGER_NUMERIC,
            DataTypeFamily.UNSIGNED_NUMERIC),

    /** 4 字节无符号整数,范围 0 到 4,294,967,295。 */
    UINT32(
            4,
            DataTypeFamily.PREDEFINED,
            DataTypeFamily.NUMERIC,
            DataTypeFamily.INTEGER_NUMERIC,
            DataTypeFamily.UNSIGNED_NUMERIC),

    /** 8 字节无符号整数。 */
    UINT64(
            8,
            DataTypeFamily.PREDEFINED,
            DataTypeFamily.NUMERIC,
            DataTypeFamily.INTEGER_NUMERIC,
            DataTypeFamily.UNSIGNED_NUMERIC),

    /** 1 字节有符号整数,范围 -128 到 127。 */
    INT8(1, DataTypeFamily.PREDEFINED, DataTypeFamily.NUMERIC, DataTypeFamily.INTEGER_NUMERIC),

    /** 2 字节有符号整数,范围 -32,768 到 32,767。 */
    INT16(2, DataTypeFamily.PREDEFINED, DataTypeFamily.NUMERIC, DataTypeFamily.INTEGER_NUMERIC),

    /** 4 字节有符号整数,范围 -2,147,483,648 到 2,147,483,647。 */
    INT32(4, DataTypeFamily.PREDEFINED, DataTypeFamily.NUMERIC, DataTypeFamily.INTEGER_NUMERIC),

    /** 8 字节有符号整数。 */
    INT64(8, DataTypeFamily.PREDEFINED, DataTypeFamily.NUMERIC, DataTypeFamily.INTEGER_NUMERIC),

    /** 单精度浮点数(4 字节,IEEE 754)。 */
    FLOAT32(
            4,
            DataTypeFamily.PREDEFINED,
            DataTypeFamily.NUMERIC,
            DataTypeFamily.APPROXIMATE_NUMERIC),

    /** 双精度浮点数(8 字节,IEEE 754)。 */
    FLOAT64(
            8,
            DataTypeFamily.PREDEFINED,
            DataTypeFamily.NUMERIC,
            DataTypeFamily.APPROXIMATE_NUMERIC),

    /** 布尔类型。 */
    BOOLEAN(1, DataTypeFamily.PREDEFINED),

    /** 日期类型,存储为自 1970-01-01 起的天数。 */
    DATE(4, DataTypeFamily.PREDEFINED, DataTypeFamily.DATETIME),

    /** 时间戳类型,存储为 epoch 毫秒。 */
    TIMESTAMP(8, DataTypeFamily.PREDEFINED, DataTypeFamily.DATETIME),

    /** 变长字符串类型,存储为 UTF-8 字节。 */
    STRING(0, DataTypeFamily.CHARACTER_STRING);

    /** 定长元素的字节宽度,变长类型为 0 */
    private final int byteWidth;

    /** 该类型根所属的类型族集合,不可变 */
    private final Set<DataTypeFamily> families;

    DataTypeRoot(int byteWidth, DataTypeFamily firstFamily, DataTypeFamily... otherFamilies) {
        this.byteWidth = byteWidth;
        this.families = Collections.unmodifiableSet(EnumSet.of(firstFamily, otherFamilies));
    }

    /** 获取该类型根所属的所有类型族。 */
    public Set<DataTypeFamily> getFamilies() {
        return families;
    }

    /** 定长元素的字节宽度,变长类型返回 0。 */
    public int byteWidth() {
        return byteWidth;
    }

    public boolean is(DataTypeFamily family) {
        return families.contains(family);
    }

    public boolean isIntegral() {
        return is(DataTypeFamily.INTEGER_NUMERIC);
    }

    public boolean isUnsigned() {
        return is(DataTypeFamily.UNSIGNED_NUMERIC);
    }

    /**
     * 判断该类型能否被提升为目标类型。
     *
     * <p>只允许 {@code INT32 -> FLOAT64}、{@code INT64 -> STRING} 和 {@code FLOAT64 -> STRING}
     * 三种单向转换,其余组合(包括相同类型)都返回 false。
     *
     * @param target 目标类型
     * @return 是否允许提升
     */
    public boolean canPromoteTo(DataTypeRoot target) {
        switch (this) {
            case INT32:
                return target == FLOAT64;
            case INT64:
            case FLOAT64:
                return target == STRING;
            default:
                return false;
        }
    }
}
