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

/**
 * 源列缓冲区的元素类型,是一个封闭的枚举。
 *
 * <p>十种定长数值类型按小端序紧密排列,{@code BOOL} 每个元素占一个字节,
 * {@code OBJECT} 表示元素是任意 Java 对象(包括混合类型的容器),没有定长的内存布局。
 *
 * <p>{@link #toDataType()} 给出类型推断时的一一映射,{@code OBJECT} 映射为 STRING。
 */
public enum ElementKind {
    UINT8(1, DataTypeRoot.UINT8),
    UINT16(2, DataTypeRoot.UINT16),
    UINT32(4, DataTypeRoot.UINT32),
    UINT64(8, DataTypeRoot.UINT64),
    INT8(1, DataTypeRoot.INT8),
    INT16(2, DataTypeRoot.INT16),
    INT32(4, DataTypeRoot.INT32),
    INT64(8, DataTypeRoot.INT64),
    FLOAT32(4, DataTypeRoot.FLOAT32),
    FLOAT64(8, DataTypeRoot.FLOAT64),
    BOOL(1, DataTypeRoot.BOOLEAN),
    OBJECT(0, DataTypeRoot.STRING);

    private final int byteWidth;

    private final DataTypeRoot dataType;

    ElementKind(int byteWidth, DataTypeRoot dataType) {
        this.byteWidth = byteWidth;
        this.dataType = dataType;
    }

    /** 每个元素的字节宽度,{@code OBJECT} 为 0。 */
    public int byteWidth() {
        return byteWidth;
    }

    /** 类型推断时该元素类型对应的列类型。 */
    public DataTypeRoot toDataType() {
        return dataType;
    }

    /** 是否是十种定长数值类型之一,只有它们可以走整块复制。 */
    public boolean isNumeric() {
        return dataType.isIntegral() || isFloating();
    }

    public boolean isIntegral() {
        return dataType.isIntegral();
    }

    public boolean isFloating() {
        return this == FLOAT32 || this == FLOAT64;
    }
}
