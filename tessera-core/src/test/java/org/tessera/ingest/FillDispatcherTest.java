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

import org.tessera.ingest.source.ArraySourceAccessor;
import org.tessera.ingest.source.ElementBuffer;
import org.tessera.ingest.source.ElementKind;
import org.tessera.options.Options;
import org.tessera.table.ColumnarTable;
import org.tessera.table.TableColumn;
import org.tessera.types.DataTypeRoot;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Tests for {@link FillDispatcher}. */
class FillDispatcherTest {

    @Test
    void testWideningMismatch() {
        assertThat(FillDispatcher.isWideningMismatch(ElementKind.INT64, DataTypeRoot.INT32))
                .isTrue();
        assertThat(FillDispatcher.isWideningMismatch(ElementKind.INT64, DataTypeRoot.FLOAT64))
                .isTrue();
        assertThat(FillDispatcher.isWideningMismatch(ElementKind.UINT64, DataTypeRoot.INT8))
                .isTrue();
        assertThat(FillDispatcher.isWideningMismatch(ElementKind.INT32, DataTypeRoot.FLOAT32))
                .isTrue();

        assertThat(FillDispatcher.isWideningMismatch(ElementKind.INT32, DataTypeRoot.FLOAT64))
                .isFalse();
        assertThat(FillDispatcher.isWideningMismatch(ElementKind.INT64, DataTypeRoot.INT64))
                .isFalse();
        assertThat(FillDispatcher.isWideningMismatch(ElementKind.FLOAT64, DataTypeRoot.INT32))
                .isFalse();
        assertThat(FillDispatcher.isWideningMismatch(ElementKind.INT64, DataTypeRoot.STRING))
                .isFalse();
        assertThat(FillDispatcher.isWideningMismatch(ElementKind.INT64, DataTypeRoot.TIMESTAMP))
                .isFalse();
    }

    @Test
    void testBulkCopyMarksNullPositions() {
        ArraySourceAccessor source =
                ArraySourceAccessor.builder()
                        .column("x", ElementBuffer.ofLongs(1L, 2L, 3L), 0, 2)
                        .build();
        FillDispatcher dispatcher =
                new FillDispatcher(source, source.columnNames(), new IngestOptions());
        ColumnarTable table = new ColumnarTable(3);
        TableColumn column = table.addColumn("x", DataTypeRoot.INT64, true);
        column.clear(1);

        dispatcher.fillColumn(table, column, "x", true);

        assertThat(column.isUnsetAt(0)).isTrue();
        assertThat(column.isNullAt(1)).isFalse();
        assertThat(column.getLong(1)).isEqualTo(2L);
        assertThat(column.isUnsetAt(2)).isTrue();
    }

    @Test
    void testNullPositionsBeyondTableAreIgnoredOnEveryPath() {
        ArraySourceAccessor source =
                ArraySourceAccessor.builder()
                        .column("v", ElementBuffer.ofInts(1, 2, 3, 4), 1, 3)
                        .build();
        Options disabled = new Options();
        disabled.set(IngestOptions.BULK_COPY_ENABLED, false);

        for (IngestOptions options :
                new IngestOptions[] {new IngestOptions(), new IngestOptions(disabled)}) {
            FillDispatcher dispatcher =
                    new FillDispatcher(source, source.columnNames(), options);
            ColumnarTable table = new ColumnarTable(2);
            TableColumn column = table.addColumn("v", DataTypeRoot.INT32, true);

            dispatcher.fillColumn(table, column, "v", false);

            assertThat(column.getInt(0)).isEqualTo(1);
            assertThat(column.isNullAt(0)).isFalse();
            assertThat(column.isNullAt(1)).isTrue();
        }
    }

    @Test
    void testFillsUnderDifferentSourceName() {
        ArraySourceAccessor source =
                ArraySourceAccessor.builder()
                        .column("a", ElementBuffer.ofInts(1, 2))
                        .column("b", ElementBuffer.ofObjects("p", "q"))
                        .build();
        FillDispatcher dispatcher =
                new FillDispatcher(source, source.columnNames(), new IngestOptions());
        ColumnarTable table = new ColumnarTable(2);
        TableColumn column = table.addColumn("target", DataTypeRoot.STRING, true);

        dispatcher.fillColumn(table, column, "b", false);

        assertThat(column.getString(0)).isEqualTo("p");
        assertThat(column.getString(1)).isEqualTo("q");
        assertThatThrownBy(() -> dispatcher.fillColumn(table, column, "c", false))
                .isInstanceOf(UnknownColumnException.class);
    }
}
