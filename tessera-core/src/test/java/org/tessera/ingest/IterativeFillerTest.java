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
import org.tessera.ingest.source.SourceAccessor;
import org.tessera.options.Options;
import org.tessera.schema.TableSchema;
import org.tessera.table.ColumnarTable;
import org.tessera.table.TableColumn;
import org.tessera.types.DataTypeRoot;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Tests for the per-cell conversions and type promotions of {@link IterativeFiller}. */
class IterativeFillerTest {

    @Test
    void testInt32PromotesToFloat64OnOverflow() {
        TableColumn column =
                fill(ElementBuffer.ofLongs(1L, -2L, 5_000_000_000L, 4L), DataTypeRoot.INT32);

        assertThat(column.type()).isEqualTo(DataTypeRoot.FLOAT64);
        assertThat(column.getDouble(0)).isEqualTo(1.0);
        assertThat(column.getDouble(1)).isEqualTo(-2.0);
        assertThat(column.getDouble(2)).isEqualTo(5.0e9);
        assertThat(column.getDouble(3)).isEqualTo(4.0);
    }

    @Test
    void testInt32WithinRangeStaysInt32() {
        ElementBuffer bounds = ElementBuffer.ofLongs(Integer.MIN_VALUE, Integer.MAX_VALUE);
        TableColumn column = fill(bounds, DataTypeRoot.INT32);

        assertThat(column.type()).isEqualTo(DataTypeRoot.INT32);
        assertThat(column.getInt(0)).isEqualTo(Integer.MIN_VALUE);
        assertThat(column.getInt(1)).isEqualTo(Integer.MAX_VALUE);
    }

    @Test
    void testInt64PromotesToStringOnNonNumericCell() {
        TableColumn column =
                fill(ElementBuffer.ofObjects(1L, 2, "abc", 4L, null), DataTypeRoot.INT64);

        assertThat(column.type()).isEqualTo(DataTypeRoot.STRING);
        assertThat(column.getString(0)).isEqualTo("1");
        assertThat(column.getString(1)).isEqualTo("2");
        assertThat(column.getString(2)).isEqualTo("abc");
        assertThat(column.getString(3)).isEqualTo("4");
        assertThat(column.isNullAt(4)).isTrue();
    }

    @Test
    void testFloat64PromotesToString() {
        TableColumn column =
                fill(ElementBuffer.ofObjects(1.5, null, "n/a", 2.25), DataTypeRoot.FLOAT64);

        assertThat(column.type()).isEqualTo(DataTypeRoot.STRING);
        assertThat(column.getString(0)).isEqualTo("1.5");
        assertThat(column.isNullAt(1)).isTrue();
        assertThat(column.getString(2)).isEqualTo("n/a");
        assertThat(column.getString(3)).isEqualTo("2.25");
    }

    @Test
    void testStringPromotionWithoutRehydration() {
        Options options = new Options().set(IngestOptions.REHYDRATE_PRIOR_ROWS, false);
        TableColumn column =
                fill(ElementBuffer.ofObjects(1L, 2L, "x", 3L), DataTypeRoot.INT64, options, false);

        assertThat(column.type()).isEqualTo(DataTypeRoot.STRING);
        assertThat(column.isNullAt(0)).isTrue();
        assertThat(column.isNullAt(1)).isTrue();
        assertThat(column.getString(2)).isEqualTo("x");
        assertThat(column.getString(3)).isEqualTo("3");
    }

    @Test
    void testAtMostOnePromotionPerFill() {
        TableColumn column =
                fill(ElementBuffer.ofObjects(1, 1.0e12, "abc", 2), DataTypeRoot.INT32);

        assertThat(column.type()).isEqualTo(DataTypeRoot.FLOAT64);
        assertThat(column.getDouble(0)).isEqualTo(1.0);
        assertThat(column.getDouble(1)).isEqualTo(1.0e12);
        assertThat(column.isNullAt(2)).isTrue();
        assertThat(column.getDouble(3)).isEqualTo(2.0);
    }

    @Test
    void testNonPromotingTypeMarksInvalidCellsAbsent() {
        TableColumn int32 = fill(ElementBuffer.ofObjects(1, "x", 3), DataTypeRoot.INT32);
        assertThat(int32.type()).isEqualTo(DataTypeRoot.INT32);
        assertThat(int32.isNullAt(1)).isTrue();
        assertThat(int32.getInt(2)).isEqualTo(3);

        TableColumn float32 = fill(ElementBuffer.ofObjects("x", 0.5), DataTypeRoot.FLOAT32);
        assertThat(float32.isNullAt(0)).isTrue();
        assertThat(float32.getFloat(1)).isEqualTo(0.5f);
    }

    @Test
    void testNarrowingConversions() {
        TableColumn int8 = fill(ElementBuffer.ofInts(127, 128, -129), DataTypeRoot.INT8);
        assertThat(int8.getByte(0)).isEqualTo((byte) 127);
        assertThat(int8.getByte(1)).isEqualTo((byte) -128);
        assertThat(int8.getByte(2)).isEqualTo((byte) 127);

        TableColumn truncated =
                fill(ElementBuffer.ofDoubles(1.9, -1.9, Double.NaN), DataTypeRoot.INT32);
        assertThat(truncated.type()).isEqualTo(DataTypeRoot.INT32);
        assertThat(truncated.getInt(0)).isEqualTo(1);
        assertThat(truncated.getInt(1)).isEqualTo(-1);
        assertThat(truncated.isNullAt(2)).isTrue();
    }

    @Test
    void testWiderIntegerSourceHonorsExplicitNulls() {
        ArraySourceAccessor source =
                ArraySourceAccessor.builder()
                        .column("v", ElementBuffer.ofLongs(1L, 2L, 3L), 1)
                        .build();
        TableColumn column = fill(source, DataTypeRoot.INT32, new Options(), true);

        assertThat(column.getInt(0)).isEqualTo(1);
        assertThat(column.isUnsetAt(1)).isTrue();
        assertThat(column.getInt(2)).isEqualTo(3);
    }

    @Test
    void testDatetimeScaledToMillis() {
        ElementBuffer seconds =
                ElementBuffer.ofLongs(1_700_000_000L, Long.MIN_VALUE, Long.MAX_VALUE / 10, -1L);
        TableColumn column = fill(seconds, DataTypeRoot.TIMESTAMP);

        assertThat(column.getLong(0)).isEqualTo(1_700_000_000_000L);
        assertThat(column.isNullAt(1)).isTrue();
        assertThat(column.isNullAt(2)).isTrue();
        assertThat(column.getLong(3)).isEqualTo(-1000L);
    }

    @Test
    void testDatetimeMultiplierOption() {
        Options options = new Options().set(IngestOptions.DATETIME_UNIT_MULTIPLIER, 1L);
        TableColumn column =
                fill(ElementBuffer.ofObjects(5L, 2.5, "x"), DataTypeRoot.TIMESTAMP, options, false);

        assertThat(column.getLong(0)).isEqualTo(5L);
        assertThat(column.getLong(1)).isEqualTo(2L);
        assertThat(column.isNullAt(2)).isTrue();

        assertThatThrownBy(
                        () ->
                                new IngestOptions(
                                        new Options()
                                                .set(IngestOptions.DATETIME_UNIT_MULTIPLIER, 0L)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testStringFromNumericSource() {
        TableColumn column = fill(ElementBuffer.ofUnsignedLongs(-1L, 7L), DataTypeRoot.STRING);
        assertThat(column.getString(0)).isEqualTo("18446744073709551615");
        assertThat(column.getString(1)).isEqualTo("7");
    }

    @Test
    void testBooleans() {
        ElementBuffer flags = ElementBuffer.ofObjects(true, "false", 0, null, "maybe");
        TableColumn column = fill(flags, DataTypeRoot.BOOLEAN);

        assertThat(column.getBoolean(0)).isTrue();
        assertThat(column.getBoolean(1)).isFalse();
        assertThat(column.getBoolean(2)).isFalse();
        assertThat(column.isNullAt(3)).isTrue();
        assertThat(column.isNullAt(4)).isTrue();
    }

    @Test
    void testPrimaryKeyPromotionUsesDestinationName() {
        SourceAccessor source =
                ArraySourceAccessor.builder()
                        .column("__INDEX__", ElementBuffer.ofObjects(1L, "b"))
                        .build();
        TableSchema schema =
                TableSchema.newBuilder().column("__INDEX__", DataTypeRoot.INT64).build();
        IngestionEngine engine = new IngestionEngine(source);
        engine.initialize();
        ColumnarTable table = new ColumnarTable(2);

        engine.fillTable(table, schema, null, 0, 1, false);

        assertThat(table.getColumn("__pkey").type()).isEqualTo(DataTypeRoot.STRING);
        assertThat(table.getColumn("__pkey").getString(0)).isEqualTo("1");
        assertThat(table.getColumn("__okey").getString(1)).isEqualTo("b");
    }

    private static TableColumn fill(ElementBuffer buffer, DataTypeRoot type) {
        return fill(buffer, type, new Options(), false);
    }

    private static TableColumn fill(
            ElementBuffer buffer, DataTypeRoot type, Options options, boolean isUpdate) {
        SourceAccessor source = ArraySourceAccessor.builder().column("v", buffer).build();
        return fill(source, type, options, isUpdate);
    }

    private static TableColumn fill(
            SourceAccessor source, DataTypeRoot type, Options options, boolean isUpdate) {
        TableSchema schema = TableSchema.newBuilder().column("v", type).build();
        IngestionEngine engine = new IngestionEngine(source, options);
        engine.initialize();
        ColumnarTable table = ColumnarTable.fromSchema(schema, source.rowCount());
        engine.fillTable(table, schema, null, 0, 1, isUpdate);
        return table.getColumn("v");
    }
}
