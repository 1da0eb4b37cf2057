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

package org.tessera.types;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/** Tests for {@link DataTypeRoot}. */
class DataTypeRootTest {

    @Test
    void testPromotionLattice() {
        assertThat(DataTypeRoot.INT32.canPromoteTo(DataTypeRoot.FLOAT64)).isTrue();
        assertThat(DataTypeRoot.INT64.canPromoteTo(DataTypeRoot.STRING)).isTrue();
        assertThat(DataTypeRoot.FLOAT64.canPromoteTo(DataTypeRoot.STRING)).isTrue();

        assertThat(DataTypeRoot.INT32.canPromoteTo(DataTypeRoot.STRING)).isFalse();
        assertThat(DataTypeRoot.INT32.canPromoteTo(DataTypeRoot.INT64)).isFalse();
        assertThat(DataTypeRoot.FLOAT64.canPromoteTo(DataTypeRoot.INT32)).isFalse();
        assertThat(DataTypeRoot.STRING.canPromoteTo(DataTypeRoot.FLOAT64)).isFalse();
        for (DataTypeRoot root : DataTypeRoot.values()) {
            assertThat(root.canPromoteTo(root)).as(root.name()).isFalse();
        }
    }

    @Test
    void testFamilies() {
        assertThat(DataTypeRoot.UINT32.isIntegral()).isTrue();
        assertThat(DataTypeRoot.UINT32.isUnsigned()).isTrue();
        assertThat(DataTypeRoot.INT32.isUnsigned()).isFalse();
        assertThat(DataTypeRoot.FLOAT32.isIntegral()).isFalse();
        assertThat(DataTypeRoot.FLOAT32.is(DataTypeFamily.NUMERIC)).isTrue();
        assertThat(DataTypeRoot.BOOLEAN.is(DataTypeFamily.NUMERIC)).isFalse();
        assertThat(DataTypeRoot.TIMESTAMP.is(DataTypeFamily.DATETIME)).isTrue();
        assertThat(DataTypeRoot.STRING.is(DataTypeFamily.CHARACTER_STRING)).isTrue();
    }

    @Test
    void testByteWidth() {
        assertThat(DataTypeRoot.UINT8.byteWidth()).isEqualTo(1);
        assertThat(DataTypeRoot.INT16.byteWidth()).isEqualTo(2);
        assertThat(DataTypeRoot.FLOAT32.byteWidth()).isEqualTo(4);
        assertThat(DataTypeRoot.UINT64.byteWidth()).isEqualTo(8);
        assertThat(DataTypeRoot.STRING.byteWidth()).isEqualTo(0);
    }
}
