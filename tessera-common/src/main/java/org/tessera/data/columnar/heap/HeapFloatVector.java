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

import org.tessera.data.columnar.writable.WritableFloatVector;

import java.util.Arrays;

/** 堆单精度浮点列向量。 */
public class HeapFloatVector extends AbstractHeapVector implements WritableFloatVector {

    public float[] vector;

    /**
     * 构造一个堆列向量。
     *
     * @param len 向量的容量
     */
    public HeapFloatVector(int len) {
        super(len);
        vector = new float[len];
    }

    @Override
    void reserveForHeapVector(int newCapacity) {
        if (vector.length < newCapacity) {
            vector = Arrays.copyOf(vector, newCapacity);
        }
    }

    @Override
    public float getFloat(int i) {
        return vector[i];
    }

    @Override
    public void setFloat(int i, float value) {
        vector[i] = value;
    }

    @Override
    public void setFloatsFromBinary(int rowId, int count, byte[] src, int srcIndex) {
        checkBinaryBounds("float", rowId, count, 4, src, srcIndex, vector.length);
        littleEndian(src, srcIndex, count * 4).asFloatBuffer().get(vector, rowId, count);
    }
}
