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

import org.tessera.data.columnar.writable.WritableLongVector;

import java.util.Arrays;

/**
 * 堆长整数列向量实现类。
 *
 * <p>底层为 long 数组,承载 INT64、UINT64 以及 TIMESTAMP(epoch 毫秒)列。
 */
public class HeapLongVector extends AbstractHeapVector implements WritableLongVector {

    public long[] vector;

    /**
     * 构造一个堆列向量。
     *
     * @param len 向量的容量
     */
    public HeapLongVector(int len) {
        super(len);
        vector = new long[len];
    }

    @Override
    void reserveForHeapVector(int newCapacity) {
        if (vector.length < newCapacity) {
            vector = Arrays.copyOf(vector, newCapacity);
        }
    }

    @Override
    public long getLong(int i) {
        return vector[i];
    }

    @Override
    public void setLong(int i, long value) {
        vector[i] = value;
    }

    @Override
    public void setLongsFromBinary(int rowId, int count, byte[] src, int srcIndex) {
        checkBinaryBounds("long", rowId, count, 8, src, srcIndex, vector.length);
        littleEndian(src, srcIndex, count * 8).asLongBuffer().get(vector, rowId, count);
    }
}
