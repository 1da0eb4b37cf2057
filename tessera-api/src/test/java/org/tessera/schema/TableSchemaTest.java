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

package org.tessera.schema;

import org.tessera.types.DataField;
import org.tessera.types.DataTypeRoot;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/** Tests for {@link TableSchema}. */
class TableSchemaTest {

    @Test
    void testFieldOrderIsPreserved() {
        TableSchema schema =
                TableSchema.newBuilder()
                        .column("b", DataTypeRoot.INT64)
                        .column("a", DataTypeRoot.STRING)
                        .field(new DataField("c", DataTypeRoot.DATE))
                        .build();

        assertThat(schema.size()).isEqualTo(3);
        assertThat(schema.columnNames()).containsExactly("b", "a", "c");
        assertThat(schema.columnTypes())
                .containsExactly(DataTypeRoot.INT64, DataTypeRoot.STRING, DataTypeRoot.DATE);
    }

    @Test
    void testDuplicateNamesResolveToFirst() {
        TableSchema schema =
                TableSchema.newBuilder()
                        .column("x", DataTypeRoot.INT32)
                        .column("y", DataTypeRoot.FLOAT64)
                        .column("x", DataTypeRoot.STRING)
                        .build();

        assertThat(schema.size()).isEqualTo(3);
        assertThat(schema.indexOf("x")).isEqualTo(0);
        assertThat(schema.fields().get(schema.indexOf("x")).type()).isEqualTo(DataTypeRoot.INT32);
        assertThat(schema.contains("z")).isFalse();
        assertThat(schema.indexOf("z")).isEqualTo(-1);
    }

    @Test
    void testEquality() {
        TableSchema left = TableSchema.newBuilder().column("x", DataTypeRoot.INT32).build();
        TableSchema right = TableSchema.newBuilder().column("x", DataTypeRoot.INT32).build();
        TableSchema other = TableSchema.newBuilder().column("x", DataTypeRoot.INT64).build();

        assertThat(left).isEqualTo(right).hasSameHashCodeAs(right);
        assertThat(left).isNotEqualTo(other);
        assertThat(new DataField("x", DataTypeRoot.INT32).newType(DataTypeRoot.INT64))
                .isEqualTo(other.fields().get(0));
    }
}
