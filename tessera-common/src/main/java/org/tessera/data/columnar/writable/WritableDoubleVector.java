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

import org.tessera.data.columnar.DoubleColumnVector;

/** 可写的 {@link DoubleColumnVector}。 */
public interface WritableDoubleVector extends WritableColumnVector, DoubleColumnVector {

    void setDouble(int rowId, double value);

    /**
     * 从小端序的二进制数据批量设置值。
     *
     * @param rowId 起始行ID
     * @param count 元素数量,字节大小为 count * 8
     * @param src 源字节数组
     * @param srcIndex 源数组的字节索引(不是元素索引)
     */
    void setDoublesFromBinary(int rowId, int count, byte[] src, int srcIndex);
}
