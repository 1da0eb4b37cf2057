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

import org.tessera.annotation.Public;
import org.tessera.types.DataTypeRoot;

import javax.annotation.Nullable;

import java.util.List;

/**
 * 摄取引擎读取外部列式数据的唯一入口。
 *
 * <p>实现方负责把宿主数据(数组、数据帧、记录批次等)暴露为带名字的列。引擎只通过这里的方法访问源数据,
 * 不假设具体的存储方式。
 */
@Public
public interface SourceAccessor {

    /** 源数据的行数。 */
    int rowCount();

    /** 源列名,按源中的顺序;允许重名,按名查找时取第一个。 */
    List<String> columnNames();

    /**
     * 返回某列的原始数据,供类型推断检查。按位置读取,重名的列各自可见。
     *
     * <p>元素类型统一的列返回 {@link ElementBuffer};其它任何对象都表示该列的元素类型无法确定。
     *
     * @param columnIndex 源列在 {@link #columnNames()} 中的位置
     */
    @Nullable
    Object columnData(int columnIndex);

    /**
     * 取出某列的缓冲区和缺失值位置。
     *
     * @param name 源列名
     * @param destType 目标列的类型,实现可以据此调整读取方式
     */
    SourceColumn columnBuffer(String name, DataTypeRoot destType);

    /**
     * 将单个单元格转换为目标类型的宿主值。
     *
     * <p>返回值约定:{@code STRING} 返回 {@link CharSequence},{@code BOOLEAN} 返回 {@link Boolean},
     * {@code DATE} 返回 {@link java.time.LocalDate},数值类型返回 {@link Number}。单元格缺失时返回
     * null。
     *
     * @param columnIndex 源列在 {@link #columnNames()} 中的位置
     * @param rowIndex 行号
     * @param destType 目标类型
     */
    @Nullable
    Object marshalCell(int columnIndex, int rowIndex, DataTypeRoot destType);
}
