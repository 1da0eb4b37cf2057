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

package org.tessera.ingest;

import org.tessera.data.columnar.heap.AbstractHeapVector;
import org.tessera.data.columnar.heap.HeapByteVector;
import org.tessera.data.columnar.heap.HeapDoubleVector;
import org.tessera.data.columnar.heap.HeapFloatVector;
import org.tessera.data.columnar.heap.HeapIntVector;
import org.tessera.data.columnar.heap.HeapLongVector;
import org.tessera.data.columnar.heap.HeapShortVector;
import org.tessera.ingest.source.ElementBuffer;
import org.tessera.ingest.source.ElementKind;
import org.tessera.table.TableColumn;

/**
 * 将源缓冲区整块复制到目标列。
 *
 * <p>只有元素类型与目标列类型完全一致的十种数值类型可以整块复制,其余情况返回 {@link FillStatus#FAIL},
 * 且不会写入任何数据。复制本身不处理有效性,由调用方负责。
 */
final class BulkCopier {

    private BulkCopier() {}

    /**
     * 从 {@code writeOffset} 开始写满目标列。
     *
     * @param source 源缓冲区,至少要有 {@code column.size() - writeOffset} 个元素
     * @param column 目标列
     * @param kind 源的元素类型
     * @param writeOffset 目标列中的起始行
     */
    static FillStatus copyArray(
            ElementBuffer source, TableColumn column, ElementKind kind, int writeOffset) {
        if (!kind.isNumeric() || !source.hasRawBytes() || kind.toDataType() != column.type()) {
            return FillStatus.FAIL;
        }
        int count = column.size() - writeOffset;
        if (writeOffset < 0 || count < 0 || source.length() < count) {
            return FillStatus.FAIL;
        }

        byte[] raw = source.rawBytes();
        AbstractHeapVector vector = column.vector();
        switch (kind) {
            case UINT8:
            case INT8:
                ((HeapByteVector) vector).setBytesFromBinary(writeOffset, count, raw, 0);
                break;
            case UINT16:
            case INT16:
                ((HeapShortVector) vector).setShortsFromBinary(writeOffset, count, raw, 0);
                break;
            case UINT32:
            case INT32:
                ((HeapIntVector) vector).setIntsFromBinary(writeOffset, count, raw, 0);
                break;
            case UINT64:
            case INT64:
                ((HeapLongVector) vector).setLongsFromBinary(writeOffset, count, raw, 0);
                break;
            case FLOAT32:
                ((HeapFloatVector) vector).setFloatsFromBinary(writeOffset, count, raw, 0);
                break;
            case FLOAT64:
                ((HeapDoubleVector) vector).setDoublesFromBinary(writeOffset, count, raw, 0);
                break;
            default:
                return FillStatus.FAIL;
        }
        return FillStatus.SUCCEED;
    }
}
