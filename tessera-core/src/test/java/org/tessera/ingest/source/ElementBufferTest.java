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

import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Tests for {@link ElementBuffer} and {@link NumericCell}. */
class ElementBufferTest {

    @Test
    void testUnsignedReads() {
        assertThat(ElementBuffer.ofUnsignedBytes((byte) -1).readNumeric(0).longValue())
                .isEqualTo(255L);
        assertThat(ElementBuffer.ofUnsignedShorts((short) -1).readNumeric(0).longValue())
                .isEqualTo(65535L);
        assertThat(ElementBuffer.ofUnsignedInts(-1).readNumeric(0).longValue())
                .isEqualTo(4294967295L);

        NumericCell max = ElementBuffer.ofUnsignedLongs(-1L).readNumeric(0);
        assertThat(max.isIntegral()).isTrue();
        assertThat(max.longValue()).isEqualTo(-1L);
        assertThat(max.doubleValue()).isEqualTo(1.8446744073709552E19);
        assertThat(max.fitsInt32()).isFalse();
        assertThat(max).hasToString("18446744073709551615");
    }

    @Test
    void testAbsentCells() {
        ElementBuffer doubles = ElementBuffer.ofDoubles(1.0, Double.NaN);
        assertThat(doubles.readNumeric(0).doubleValue()).isEqualTo(1.0);
        assertThat(doubles.readNumeric(1).isAbsent()).isTrue();
        assertThat(doubles.readNumeric(2).isAbsent()).isTrue();
        assertThat(ElementBuffer.ofFloats(Float.NaN).readNumeric(0).isAbsent()).isTrue();
        assertThat(ElementBuffer.ofObjects((Object) null).readNumeric(0).isAbsent()).isTrue();
    }

    @Test
    void testObjectCells() {
        ElementBuffer objects =
                ElementBuffer.ofObjects(7, 2.5, "text", true, new BigInteger("123"), Double.NaN);

        assertThat(objects.kind()).isEqualTo(ElementKind.OBJECT);
        assertThat(objects.hasRawBytes()).isFalse();
        assertThat(objects.readNumeric(0).longValue()).isEqualTo(7L);
        assertThat(objects.readNumeric(1).isIntegral()).isFalse();
        assertThat(objects.readNumeric(1).doubleValue()).isEqualTo(2.5);
        assertThat(objects.readNumeric(2).isInvalid()).isTrue();
        assertThat(objects.readNumeric(3).longValue()).isEqualTo(1L);
        assertThat(objects.readNumeric(4).longValue()).isEqualTo(123L);
        assertThat(objects.readNumeric(5).isAbsent()).isTrue();
        assertThat(objects.getBoxed(2)).isEqualTo("text");
        assertThatThrownBy(objects::rawBytes).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void testFitsInt32() {
        assertThat(NumericCell.ofLong(Integer.MAX_VALUE).fitsInt32()).isTrue();
        assertThat(NumericCell.ofLong(Integer.MAX_VALUE + 1L).fitsInt32()).isFalse();
        assertThat(NumericCell.ofLong(Integer.MIN_VALUE).fitsInt32()).isTrue();
        assertThat(NumericCell.ofDouble(-2147483649.0).fitsInt32()).isFalse();
        assertThat(NumericCell.ofDouble(1.9).fitsInt32()).isTrue();
        assertThat(NumericCell.invalid().fitsInt32()).isFalse();
    }

    @Test
    void testWrapLittleEndianBytes() {
        byte[] raw =
                ByteBuffer.allocate(8)
                        .order(ByteOrder.LITTLE_ENDIAN)
                        .putInt(3)
                        .putInt(-4)
                        .array();
        ElementBuffer buffer = ElementBuffer.wrap(ElementKind.INT32, raw);

        assertThat(buffer.length()).isEqualTo(2);
        assertThat(buffer.rawBytes()).isSameAs(raw);
        assertThat(buffer.getBoxed(1)).isEqualTo(-4);
        assertThatThrownBy(() -> ElementBuffer.wrap(ElementKind.INT64, raw).getBoxed(1))
                .isInstanceOf(IndexOutOfBoundsException.class);
        assertThatThrownBy(() -> ElementBuffer.wrap(ElementKind.INT64, new byte[12]))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ElementBuffer.wrap(ElementKind.OBJECT, new byte[0]))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testFactoriesCopyInput() {
        int[] values = {1, 2};
        ElementBuffer buffer = ElementBuffer.ofInts(values);
        values[0] = 9;
        assertThat(buffer.getBoxed(0)).isEqualTo(1);
        assertThat(ElementBuffer.ofBooleans(true, false).getBoxed(0)).isEqualTo(true);
        assertThat(ElementBuffer.ofShorts((short) -3).readNumeric(0).longValue()).isEqualTo(-3L);
    }
}
