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

import org.tessera.table.ColumnarTable;
import org.tessera.table.TableColumn;
import org.tessera.types.DataTypeRoot;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Tests for {@link IndexSynthesizer}. */
class IndexSynthesizerTest {

    private final IndexSynthesizer synthesizer = new IndexSynthesizer(new IngestOptions());

    @Test
    void testModuloIndex() {
        ColumnarTable table = new ColumnarTable(8);
        synthesizer.synthesize(table, null, 5, 10);

        TableColumn primaryKey = table.getColumn("__pkey");
        int[] expected = {5, 6, 7, 8, 9, 0, 1, 2};
        for (int row = 0; row < expected.length; row++) {
            assertThat(primaryKey.getInt(row)).isEqualTo(expected[row]);
            assertThat(table.getColumn("__okey").getInt(row)).isEqualTo(expected[row]);
        }
    }

    @Test
    void testOffsetNearIntegerMaxDoesNotOverflow() {
        ColumnarTable table = new ColumnarTable(3);
        synthesizer.synthesize(table, "", Integer.MAX_VALUE, Integer.MAX_VALUE);

        TableColumn primaryKey = table.getColumn("__pkey");
        assertThat(primaryKey.getInt(0)).isEqualTo(0);
        assertThat(primaryKey.getInt(1)).isEqualTo(1);
        assertThat(primaryKey.getInt(2)).isEqualTo(2);
    }

    @Test
    void testCloneIndexColumn() {
        ColumnarTable table = new ColumnarTable(2);
        TableColumn id = table.addColumn("id", DataTypeRoot.FLOAT32, true);
        id.setFloat(0, 0.5f);
        id.clear(1);

        synthesizer.synthesize(table, "id", 0, 0);

        assertThat(table.getColumn("__pkey").getFloat(0)).isEqualTo(0.5f);
        assertThat(table.getColumn("__okey").isNullAt(1)).isTrue();
        assertThat(table.getColumn("__pkey")).isNotSameAs(table.getColumn("__okey"));
    }

    @Test
    void testInvalidArguments() {
        ColumnarTable table = new ColumnarTable(1);
        assertThatThrownBy(() -> synthesizer.synthesize(table, null, 0, -1))
                .isInstanceOf(InvalidLimitException.class);
        assertThatThrownBy(() -> synthesizer.synthesize(table, null, -1, 1))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> synthesizer.synthesize(table, "missing", 0, 1))
                .isInstanceOf(UnknownColumnException.class);
    }
}
