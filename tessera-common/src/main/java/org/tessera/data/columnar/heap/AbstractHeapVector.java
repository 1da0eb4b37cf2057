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

package org.tessera.data.columnar.heap;

import org.tessera.data.columnar.writable.AbstractWritableVector;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Arrays;

/**
 * 堆向量抽象基类,为所有堆内存实现的列向量提供通用功能。
 *
 * <h2>NULL 值处理</h2>
 *
 * <ul>
 *   <li>noNulls=true: 该列没有 NULL 值,可跳过 NULL 检查
 *   <li>isNull[i]=true: 第 i 个位置是 NULL
 *   <li>unset[i]=true: 第 i 个位置是 NULL,且是由有值变为缺失的(更新语义)
 * </ul>
 *
 * <h2>批量导入</h2>
 *
 * <p>子类的 {@code setXxxFromBinary} 方法假定源数据是小端序、紧密排列的定长元素,
 * 通过 {@link #littleEndian} 包装后用 NIO 视图整块复制。
 */
public abstract class AbstractHeapVector extends AbstractWritableVector {

    /*
     * If hasNulls is true, then this array contains true if the value
     * is null, otherwise false. The array is always allocated, so a batch can be re-used
     * later and nulls added.
     */
    protected boolean[] isNull;

    /** 标记由有值变为缺失的行,它们同时也在 isNull 中被标记。 */
    protected boolean[] unset;

    public AbstractHeapVector(int capacity) {
        super(capacity);
        isNull = new boolean[capacity];
        unset = new boolean[capacity];
    }

    @Override
    public void setNullAt(int i) {
        isNull[i] = true;
        unset[i] = false;
        noNulls = false;
    }

    @Override
    public void unsetAt(int i) {
        isNull[i] = true;
        unset[i] = true;
        noNulls = false;
    }

    @Override
    public boolean isUnsetAt(int i) {
        return !noNulls && unset[i];
    }

    @Override
    public void setNotNullAt(int i) {
        isNull[i] = false;
        unset[i] = false;
    }

    @Override
    public void setAllNotNull() {
        Arrays.fill(isNull, false);
        Arrays.fill(unset, false);
        noNulls = true;
    }

    @Override
    public boolean isNullAt(int i) {
        return !noNulls && isNull[i];
    }

    @Override
    protected void reserveInternal(int newCapacity) {
        if (isNull.length < newCapacity) {
            isNull = Arrays.copyOf(isNull, newCapacity);
            unset = Arrays.copyOf(unset, newCapacity);
        }
        reserveForHeapVector(newCapacity);
    }

    abstract void reserveForHeapVector(int newCapacity);

    /** 检查批量导入的边界,越界时抛出 {@link IndexOutOfBoundsException}。 */
    static void checkBinaryBounds(
            String typeName, int rowId, int count, int width, byte[] src, int srcIndex, int len) {
        if (rowId < 0
                || count < 0
                || rowId + count > len
                || srcIndex < 0
                || srcIndex + (long) count * width > src.length) {
            throw new IndexOutOfBoundsException(
                    String.format(
                            "Index out of bounds, row id is %s, count is %s, binary src index is %s, binary"
                                    + " length is %s, %s array length is %s.",
                            rowId, count, srcIndex, src.length, typeName, len));
        }
    }

    /** 将源字节数组的一段包装为小端序的 {@link ByteBuffer}。 */
    static ByteBuffer littleEndian(byte[] src, int srcIndex, int length) {
        return ByteBuffer.wrap(src, srcIndex, length).slice().order(ByteOrder.LITTLE_ENDIAN);
    }
}
