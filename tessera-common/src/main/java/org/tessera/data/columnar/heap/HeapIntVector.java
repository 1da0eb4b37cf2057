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

import org.tessera.data.columnar.writable.WritableIntVector;

import java.util.Arrays;

/**
 * 堆整数列向量实现类。
 *
 * <p>使用 32 位 int 数组作为底层存储,同时承载 INT32、UINT32(按无符号重新解读)以及
 * DATE(自 epoch 起的天数)三种列类型。
 *
 * <h2>使用示例</h2>
 *
 * <pre>{@code
 * HeapIntVector vector = new HeapIntVector(1000);
 * vector.setInt(0, 42);
 * vector.setIntsFromBinary(10, 5, littleEndianBytes, 0);
 * int value = vector.getInt(0);
 * }</pre>
 */
public class HeapIntVector extends AbstractHeapVector implements WritableIntVector {

    public int[] vector;

    /**
     * 构造一个堆列向量。
     *
     * @param len 向量的容量
     */
    public HeapIntVector(int len) {
        super(len);
        vector = new int[len];
    }

    @Override
    void reserveForHeapVector(int newCapacity) {
        if (vector.length < newCapacity) {
            vector = Arrays.copyOf(vector, newCapacity);
        }
    }

    @Override
    public int getInt(int i) {
        return vector[i];
    }

    @Override
    public void setInt(int i, int value) {
        vector[i] = value;
    }

    @Override
    public void setIntsFromBinary(int rowId, int count, byte[] src, int srcIndex) {
        checkBinaryBounds("int", rowId, count, 4, src, srcIndex, vector.length);
        littleEndian(src, srcIndex, count * 4).asIntBuffer().get(vector, rowId, count);
    }
}
