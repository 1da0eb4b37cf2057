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

import org.tessera.data.columnar.writable.WritableBytesVector;

import java.util.Arrays;

/**
 * 堆字节数组列向量实现类,字符串列的存储。
 *
 * <p>所有行的字节连续存放在同一个 {@code buffer} 中,{@code start} 和 {@code length}
 * 记录每一行在缓冲区中的位置。重写某一行时,新值不长于旧值则原地覆盖,否则追加到缓冲区末尾,
 * 旧的字节不再被引用也不会被回收。
 */
public class HeapBytesVector extends AbstractHeapVector implements WritableBytesVector {

    /** 数组长度上限,部分 JVM 会在数组头部保留几个字。 */
    static final int MAX_ARRAY_SIZE = Integer.MAX_VALUE - 8;

    /** 初始缓冲区的上限,更大的需求交给按需扩容。 */
    static final int MAX_INITIAL_BYTES = 1 << 26;

    /** 每个字段的起始偏移量。 */
    public int[] start;

    /** 每个字段的长度。 */
    public int[] length;

    /** 实际复制数据时使用的缓冲区。 */
    public byte[] buffer;

    /** 已追加的字节数。 */
    private int bytesAppended;

    /**
     * 构造一个堆字节数组列向量。
     *
     * <p>初始缓冲区大小为 capacity * 16 字节,最多 {@link #MAX_INITIAL_BYTES}。
     *
     * @param capacity 向量的容量(可以存储的字节数组数量)
     */
    public HeapBytesVector(int capacity) {
        super(capacity);
        buffer = new byte[(int) Math.min(capacity * 16L, MAX_INITIAL_BYTES)];
        start = new int[capacity];
        length = new int[capacity];
    }

    @Override
    public void putByteArray(int elementNum, byte[] sourceBuf, int start, int length) {
        if (length <= this.length[elementNum]) {
            System.arraycopy(sourceBuf, start, buffer, this.start[elementNum], length);
            this.length[elementNum] = length;
            return;
        }
        reserveBytes((long) bytesAppended + length);
        System.arraycopy(sourceBuf, start, buffer, bytesAppended, length);
        this.start[elementNum] = bytesAppended;
        this.length[elementNum] = length;
        bytesAppended += length;
    }

    /** 已追加到缓冲区的字节数,包括不再被引用的旧值。 */
    public int bytesAppended() {
        return bytesAppended;
    }

    private void reserveBytes(long required) {
        if (required <= buffer.length) {
            return;
        }
        if (required > MAX_ARRAY_SIZE) {
            throw new UnsupportedOperationException(
                    String.format(
                            "Cannot hold %s bytes in a single bytes vector, the limit is %s.",
                            required, MAX_ARRAY_SIZE));
        }
        int newBytesCapacity = (int) Math.min(required * 2, MAX_ARRAY_SIZE);
        try {
            buffer = Arrays.copyOf(buffer, newBytesCapacity);
        } catch (OutOfMemoryError e) {
            throw new RuntimeException(
                    "Failed to allocate " + newBytesCapacity + " bytes for vector", e);
        }
    }

    @Override
    void reserveForHeapVector(int newCapacity) {
        if (newCapacity > start.length) {
            start = Arrays.copyOf(start, newCapacity);
            length = Arrays.copyOf(length, newCapacity);
        }
    }

    @Override
    public Bytes getBytes(int i) {
        return new Bytes(buffer, start[i], length[i]);
    }
}
