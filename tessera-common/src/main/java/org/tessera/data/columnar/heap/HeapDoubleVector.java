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

import org.tessera.data.columnar.writable.WritableDoubleVector;

import java.util.Arrays;

/**
 * 堆双精度浮点列向量。
 *
 * <p>INT32 列在遇到超出 32 位范围的值时会被提升为 FLOAT64,提升后的数据存放在此类向量中。
 */
public class HeapDoubleVector extends AbstractHeapVector implements WritableDoubleVector {

    public double[] vector;

    /**
     * 构造一个堆列向量。
     *
     * @param len 向量的容量
     */
    public HeapDoubleVector(int len) {
        super(len);
        vector = new double[len];
    }

    @Override
    void reserveForHeapVector(int newCapacity) {
        if (vector.length < newCapacity) {
            vector = Arrays.copyOf(vector, newCapacity);
        }
    }

    @Override
    public double getDouble(int i) {
        return vector[i];
    }

    @Override
    public void setDouble(int i, double value) {
        vector[i] = value;
    }

    @Override
    public void setDoublesFromBinary(int rowId, int count, byte[] src, int srcIndex) {
        checkBinaryBounds("double", rowId, count, 8, src, srcIndex, vector.length);
        littleEndian(src, srcIndex, count * 8).asDoubleBuffer().get(vector, rowId, count);
    }
}
