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

package org.tessera.data.columnar.writable;

import org.tessera.data.columnar.ColumnVector;

/**
 * 可写列向量的基础接口。
 *
 * <p>除了写入具体值的方法(由类型子接口提供)外,还负责维护每一行的有效性。
 * 一行有三种状态:
 *
 * <ul>
 *   <li><b>有值</b>: 通过 {@link #setNotNullAt} 或 {@link #setAllNotNull} 标记
 *   <li><b>缺失</b>: 通过 {@link #setNullAt} 标记,表示该行从一开始就没有值(初次加载)
 *   <li><b>被取消</b>: 通过 {@link #unsetAt} 标记,表示该行由有值变为缺失(更新)
 * </ul>
 *
 * <p>后两种状态对 {@link #isNullAt} 来说都是 NULL,{@link #isUnsetAt} 可以区分它们。
 *
 * <h2>线程安全性</h2>
 * 该接口的实现<b>不是线程安全的</b>,需要调用方保证同一时刻只有一个线程写入。
 */
public interface WritableColumnVector extends ColumnVector {

    /**
     * 将指定行标记为缺失(初次加载语义)。
     *
     * @param rowId 行ID,范围 [0, capacity)
     */
    void setNullAt(int rowId);

    /**
     * 将指定行由有值转为缺失(更新语义)。
     *
     * @param rowId 行ID,范围 [0, capacity)
     */
    void unsetAt(int rowId);

    /** 指定行是否是通过 {@link #unsetAt} 变为缺失的。 */
    boolean isUnsetAt(int rowId);

    /** 将指定行标记为有值。 */
    void setNotNullAt(int rowId);

    /** 将所有行标记为有值。 */
    void setAllNotNull();

    /**
     * 预留指定容量的空间。
     *
     * @param capacity 需要的容量
     * @throws IllegalArgumentException 如果capacity为负数
     */
    void reserve(int capacity);
}
