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
 * 可写列向量的抽象基类。
 *
 * <p>包含所有 {@link ColumnVector} 实现共享的容量管理和 NULL 标志位。
 *
 * <h2>内存管理策略</h2>
 *
 * <ul>
 *   <li>初始容量由子类在构造时指定
 *   <li>扩容时采用2倍增长策略(newCapacity = requiredCapacity * 2)
 * </ul>
 */
public abstract class AbstractWritableVector implements WritableColumnVector {

    /** 如果整个列向量没有NULL值,此标志为true,否则为false。 */
    protected boolean noNulls = true;

    /** 向量的当前容量。 */
    protected int capacity;

    public AbstractWritableVector(int capacity) {
        this.capacity = capacity;
    }

    @Override
    public int getCapacity() {
        return this.capacity;
    }

    @Override
    public void reserve(int requiredCapacity) {
        if (requiredCapacity < 0) {
            throw new IllegalArgumentException("Invalid capacity: " + requiredCapacity);
        } else if (requiredCapacity > capacity) {
            int newCapacity = (int) Math.min(Integer.MAX_VALUE, requiredCapacity * 2L);
            if (requiredCapacity <= newCapacity) {
                try {
                    reserveInternal(newCapacity);
                } catch (OutOfMemoryError outOfMemoryError) {
                    throw new RuntimeException(
                            "Failed to allocate memory for vector", outOfMemoryError);
                }
            } else {
                throw new UnsupportedOperationException(
                        "Cannot allocate :" + newCapacity + " elements");
            }
            capacity = newCapacity;
        }
    }

    /**
     * 执行实际的内存扩容操作。
     *
     * <p>子类需要实现此方法,完成底层数组的扩容和数据复制。
     *
     * @param newCapacity 新的容量大小
     */
    protected abstract void reserveInternal(int newCapacity);
}
