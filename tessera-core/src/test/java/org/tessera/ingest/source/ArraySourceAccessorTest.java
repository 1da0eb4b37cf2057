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

package org.tessera.ingest.source;

import org.tessera.types.DataTypeRoot;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Tests for {@link ArraySourceAccessor}. */
class ArraySourceAccessorTest {

    @Test
    void testNullPositions() {
        ArraySourceAccessor source =
                ArraySourceAccessor.builder()
                        .column("ints", ElementBuffer.ofInts(1, 2, 3, 4), 3, 1)
                        .column("doubles", ElementBuffer.ofDoubles(Double.NaN, 1.0, 2.0), 2)
                        .column("objects", ElementBuffer.ofObjects("a", null, Float.NaN))
                        .build();

        assertThat(source.rowCount()).isEqualTo(4);
        assertThat(source.columnBuffer("ints", DataTypeRoot.INT32).nullPositions())
                .containsExactly(1, 3);
        assertThat(source.columnBuffer("doubles", DataTypeRoot.FLOAT64).nullPositions())
                .containsExactly(0, 2);
        assertThat(source.columnBuffer("objects", DataTypeRoot.STRING).nullPositions())
                .containsExactly(1, 2);
    }

    @Test
    void testDuplicateNamesResolveToFirst() {
        ArraySourceAccessor source =
                ArraySourceAccessor.builder()
                        .column("a", ElementBuffer.ofInts(1))
                        .column("a", ElementBuffer.ofLongs(2L))
                        .build();

        assertThat(source.columnNames()).containsExactly("a", "a");
        assertThat(source.columnBuffer("a", DataTypeRoot.INT32).buffer().kind())
                .isEqualTo(ElementKind.INT32);
        assertThatThrownBy(() -> source.columnBuffer("b", DataTypeRoot.INT32))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testRawColumnHasNoBuffer() {
        ArraySourceAccessor source =
                ArraySourceAccessor.builder()
                        .rawColumn("mixed", Arrays.asList(1, "a", 2.0))
                        .build();

        assertThat(source.rowCount()).isEqualTo(3);
        assertThat(source.columnData(0)).isInstanceOf(List.class);
        assertThat(source.columnBuffer("mixed", DataTypeRoot.STRING).buffer()).isNull();
        assertThat(source.marshalCell(0, 0, DataTypeRoot.STRING)).isNull();
    }

    @Test
    void testMarshalStrings() {
        ArraySourceAccessor source =
                ArraySourceAccessor.builder()
                        .column("u64", ElementBuffer.ofUnsignedLongs(-1L, 5L))
                        .column("f", ElementBuffer.ofDoubles(1.5, Double.NaN))
                        .column("o", ElementBuffer.ofObjects("x", 3), 1)
                        .build();

        assertThat(source.marshalCell(0, 0, DataTypeRoot.STRING))
                .isEqualTo("18446744073709551615");
        assertThat(source.marshalCell(0, 1, DataTypeRoot.STRING)).isEqualTo("5");
        assertThat(source.marshalCell(1, 0, DataTypeRoot.STRING)).isEqualTo("1.5");
        assertThat(source.marshalCell(1, 1, DataTypeRoot.STRING)).isNull();
        assertThat(source.marshalCell(2, 0, DataTypeRoot.STRING)).isEqualTo("x");
        assertThat(source.marshalCell(2, 1, DataTypeRoot.STRING)).isNull();
        assertThat(source.marshalCell(2, 5, DataTypeRoot.STRING)).isNull();
    }

    @Test
    void testMarshalBooleansAndDates() {
        ArraySourceAccessor source =
                ArraySourceAccessor.builder()
                        .column("b", ElementBuffer.ofObjects(true, "FALSE", 2, "maybe"))
                        .column(
                                "d",
                                ElementBuffer.ofObjects(
                                        LocalDate.of(2020, 1, 31),
                                        LocalDateTime.of(2021, 6, 1, 12, 30),
                                        "2022-12-25",
                                        "not a date"))
                        .build();

        assertThat(source.marshalCell(0, 0, DataTypeRoot.BOOLEAN)).isEqualTo(true);
        assertThat(source.marshalCell(0, 1, DataTypeRoot.BOOLEAN)).isEqualTo(false);
        assertThat(source.marshalCell(0, 2, DataTypeRoot.BOOLEAN)).isEqualTo(true);
        assertThat(source.marshalCell(0, 3, DataTypeRoot.BOOLEAN)).isNull();

        assertThat(source.marshalCell(1, 0, DataTypeRoot.DATE))
                .isEqualTo(LocalDate.of(2020, 1, 31));
        assertThat(source.marshalCell(1, 1, DataTypeRoot.DATE))
                .isEqualTo(LocalDate.of(2021, 6, 1));
        assertThat(source.marshalCell(1, 2, DataTypeRoot.DATE))
                .isEqualTo(LocalDate.of(2022, 12, 25));
        assertThat(source.marshalCell(1, 3, DataTypeRoot.DATE)).isNull();
    }

    @Test
    void testExplicitRowCount() {
        ArraySourceAccessor source =
                ArraySourceAccessor.builder()
                        .column("a", ElementBuffer.ofInts(1, 2, 3))
                        .rowCount(2)
                        .build();
        assertThat(source.rowCount()).isEqualTo(2);
        assertThatThrownBy(() -> ArraySourceAccessor.builder().rowCount(-1))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
