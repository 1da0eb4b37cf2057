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

import org.tessera.ingest.source.ElementBuffer;
import org.tessera.ingest.source.ElementKind;
import org.tessera.table.ColumnarTable;
import org.tessera.table.TableColumn;
import org.tessera.types.DataTypeRoot;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/** Tests for {@link BulkCopier}. */
class BulkCopierTest {

    @Test
    void testCopyEachNumericKind() {
        ColumnarTable table = new ColumnarTable(2);

        assertThat(copy(table, ElementBuffer.ofBytes((byte) -1, (byte) 2), DataTypeRoot.INT8))
                .isEqualTo(FillStatus.SUCCEED);
        assertThat(table.getColumn("INT8").getByte(0)).isEqualTo((byte) -1);

        assertThat(copy(table, ElementBuffer.ofUnsignedInts(-1, 2), DataTypeRoot.UINT32))
                .isEqualTo(FillStatus.SUCCEED);
        assertThat(table.getColumn("UINT32").getValue(0)).isEqualTo(4294967295L);

        assertThat(copy(table, ElementBuffer.ofLongs(Long.MAX_VALUE, 0L), DataTypeRoot.INT64))
                .isEqualTo(FillStatus.SUCCEED);
        assertThat(table.getColumn("INT64").getLong(0)).isEqualTo(Long.MAX_VALUE);

        assertThat(copy(table, ElementBuffer.ofFloats(1.5f, 2.5f), DataTypeRoot.FLOAT32))
                .isEqualTo(FillStatus.SUCCEED);
        assertThat(table.getColumn("FLOAT32").getFloat(1)).isEqualTo(2.5f);

        assertThat(copy(table, ElementBuffer.ofShorts((short) 3, (short) 4), DataTypeRoot.INT16))
                .isEqualTo(FillStatus.SUCCEED);
        assertThat(table.getColumn("INT16").getShort(1)).isEqualTo((short) 4);
    }

    @Test
    void testMismatchedKindFailsWithoutWriting() {
        ColumnarTable table = new ColumnarTable(2);
        TableColumn column = table.addColumn("x", DataTypeRoot.INT64, true);
        column.setLong(0, 42L);

        ElementBuffer ints = ElementBuffer.ofInts(1, 2);
        assertThat(BulkCopier.copyArray(ints, column, ints.kind(), 0)).isEqualTo(FillStatus.FAIL);
        assertThat(column.getLong(0)).isEqualTo(42L);

        ElementBuffer flags = ElementBuffer.ofBooleans(true, false);
        TableColumn bools = table.addColumn("b", DataTypeRoot.BOOLEAN, true);
        assertThat(BulkCopier.copyArray(flags, bools, ElementKind.BOOL, 0))
                .isEqualTo(FillStatus.FAIL);

        ElementBuffer objects = ElementBuffer.ofObjects("a", "b");
        TableColumn strings = table.addColumn("s", DataTypeRoot.STRING, true);
        assertThat(BulkCopier.copyArray(objects, strings, ElementKind.OBJECT, 0))
                .isEqualTo(FillStatus.FAIL);
    }

    @Test
    void testShortBufferFails() {
        ColumnarTable table = new ColumnarTable(3);
        TableColumn column = table.addColumn("x", DataTypeRoot.FLOAT64, true);
        ElementBuffer doubles = ElementBuffer.ofDoubles(1.0, 2.0);

        assertThat(BulkCopier.copyArray(doubles, column, ElementKind.FLOAT64, 0))
                .isEqualTo(FillStatus.FAIL);
        assertThat(BulkCopier.copyArray(doubles, column, ElementKind.FLOAT64, 4))
                .isEqualTo(FillStatus.FAIL);
    }

    @Test
    void testWriteOffset() {
        ColumnarTable table = new ColumnarTable(4);
        TableColumn column = table.addColumn("x", DataTypeRoot.UINT16, true);
        ElementBuffer values = ElementBuffer.ofUnsignedShorts((short) 7, (short) -1);

        assertThat(BulkCopier.copyArray(values, column, ElementKind.UINT16, 2))
                .isEqualTo(FillStatus.SUCCEED);
        assertThat(column.getShort(0)).isEqualTo((short) 0);
        assertThat(column.getValue(2)).isEqualTo(7);
        assertThat(column.getValue(3)).isEqualTo(65535);
    }

    private static FillStatus copy(ColumnarTable table, ElementBuffer buffer, DataTypeRoot type) {
        TableColumn column = table.addColumn(type.name(), type, true);
        return BulkCopier.copyArray(buffer, column, buffer.kind(), 0);
    }
}
