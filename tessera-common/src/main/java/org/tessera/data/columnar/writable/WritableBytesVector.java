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

import org.tessera.data.columnar.BytesColumnVector;

/**
 * 可写的 {@link BytesColumnVector}。
 *
 * <p>写入的字节会被复制到向量内部的缓冲区中,调用方之后可以复用源数组。
 */
public interface WritableBytesVector extends WritableColumnVector, BytesColumnVector {

    /**
     * 将字节数组的一段复制到指定行。
     *
     * @param rowId 行ID
     * @param value 源字节数组
     * @param offset 源数组中的起始位置
     * @param length 要复制的长度
     */
    void putByteArray(int rowId, byte[] value, int offset, int length);
}
