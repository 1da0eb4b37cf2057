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

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * 从源缓冲区读出的一个数值单元格。
 *
 * <p>读取结果是显式的状态而不是对内存的重新解读:
 *
 * <ul>
 *   <li>{@code ABSENT}: 没有值(null 或 NaN)
 *   <li>{@code INVALID}: 单元格存在,但不是数值(例如对象列中的字符串)
 *   <li>{@code INTEGRAL}: 精确的整数值,无符号 64 位整数以原始位模式保存
 *   <li>{@code FLOATING}: 浮点值,不会是 NaN
 * </ul>
 */
public final class NumericCell {

    private static final NumericCell ABSENT = new NumericCell(State.ABSENT, 0L, 0d, false);

    private static final NumericCell INVALID = new NumericCell(State.INVALID, 0L, 0d, false);

    private static final double INT32_MAX = Integer.MAX_VALUE;

    private static final double INT32_MIN = Integer.MIN_VALUE;

    /** 单元格状态。 */
    public enum State {
        ABSENT,
        INVALID,
        INTEGRAL,
        FLOATING
    }

    private final State state;

    private final long longValue;

    private final double doubleValue;

    private final boolean unsigned;

    private NumericCell(State state, long longValue, double doubleValue, boolean unsigned) {
        this.state = state;
        this.longValue = longValue;
        this.doubleValue = doubleValue;
        this.unsigned = unsigned;
    }

    public static NumericCell absent() {
        return ABSENT;
    }

    public static NumericCell invalid() {
        return INVALID;
    }

    public static NumericCell ofLong(long value) {
        return new NumericCell(State.INTEGRAL, value, value, false);
    }

    /** 以原始位模式保存一个无符号 64 位整数。 */
    public static NumericCell ofUnsignedLong(long bits) {
        if (bits >= 0) {
            return ofLong(bits);
        }
        double value = (double) (bits >>> 1) * 2.0 + (bits & 1L);
        return new NumericCell(State.INTEGRAL, bits, value, true);
    }

    /** NaN 被视为没有值。 */
    public static NumericCell ofDouble(double value) {
        if (Double.isNaN(value)) {
            return ABSENT;
        }
        return new NumericCell(State.FLOATING, (long) value, value, false);
    }

    /** 将一个装箱对象转换为数值单元格,非数值对象返回 {@link #invalid()}。 */
    public static NumericCell fromObject(Object value) {
        if (value == null) {
            return ABSENT;
        } else if (value instanceof Double || value instanceof Float) {
            return ofDouble(((Number) value).doubleValue());
        } else if (value instanceof Long
                || value instanceof Integer
                || value instanceof Short
                || value instanceof Byte) {
            return ofLong(((Number) value).longValue());
        } else if (value instanceof BigInteger) {
            BigInteger big = (BigInteger) value;
            return big.bitLength() < 64 ? ofLong(big.longValue()) : ofDouble(big.doubleValue());
        } else if (value instanceof BigDecimal) {
            return ofDouble(((BigDecimal) value).doubleValue());
        } else if (value instanceof Number) {
            return ofDouble(((Number) value).doubleValue());
        } else if (value instanceof Boolean) {
            return ofLong((Boolean) value ? 1L : 0L);
        }
        return INVALID;
    }

    public State state() {
        return state;
    }

    public boolean isAbsent() {
        return state == State.ABSENT;
    }

    public boolean isInvalid() {
        return state == State.INVALID;
    }

    public boolean isIntegral() {
        return state == State.INTEGRAL;
    }

    /** 整数返回精确值(无符号时为原始位模式),浮点数按 Java 的窄化规则截断。 */
    public long longValue() {
        return longValue;
    }

    public double doubleValue() {
        return doubleValue;
    }

    /** 值是否落在 32 位有符号整数的范围内。 */
    public boolean fitsInt32() {
        if (state == State.INTEGRAL) {
            return !unsigned && longValue >= Integer.MIN_VALUE && longValue <= Integer.MAX_VALUE;
        }
        return state == State.FLOATING && doubleValue <= INT32_MAX && doubleValue >= INT32_MIN;
    }

    @Override
    public String toString() {
        switch (state) {
            case INTEGRAL:
                return unsigned ? Long.toUnsignedString(longValue) : Long.toString(longValue);
            case FLOATING:
                return Double.toString(doubleValue);
            default:
                return state.name();
        }
    }
}
