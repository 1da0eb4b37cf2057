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

package org.tessera.data.columnar;

/**
 * 列向量的只读接口,是所有具体列向量类型的根。
 *
 * <p>列向量按行下标访问,每一行要么有值,要么为 NULL。具体的取值方法由各类型子接口提供,
 * 例如 {@link IntColumnVector#getInt(int)}。
 */
public interface ColumnVector {

    /**
     * 检查指定位置的值是否为 NULL。
     *
     * @param i 行索引(从0开始)
     * @return 如果该位置的值为 NULL 返回 true,否则返回 false
     */
    boolean isNullAt(int i);

    /** 获取此列向量的容量(最大行数)。 */
    default int getCapacity() {
        return Integer.MAX_VALUE;
    }
}
