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

import org.tessera.annotation.Public;

import javax.annotation.Nullable;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Arrays;

import static org.tessera.utils.Preconditions.checkArgument;
import static org.tessera.utils.Preconditions.checkElementIndex;
import static org.tessera.utils.Preconditions.checkNotNull;
import static org.tessera.utils.Preconditions.checkState;

/**
 * 一个源列的连续缓冲区,带有封闭的元素类型和元素个数。
 *
 * <p>定长元素以小端序紧密存放在 {@code byte[]} 中,可直接整块复制到目标列;{@link ElementKind#OBJECT}
 * 类型的元素存放在 {@code Object[]} 中,只能逐个单元格读取。缓冲区在构造后不可变。
 */
@Public
public final class ElementBuffer {

    private final ElementKind kind;

    private final int length;

    @Nullable private final byte[] data;

    @Nullable private final Object[] objects;

    @Nullable private final ByteBuffer view;

    private ElementBuffer(
            ElementKind kind, int length, @Nullable byte[] data, @Nullable Object[] objects) {
        this.kind = kind;
        this.length = length;
        this.data = data;
        this.objects = objects;
        this.view = data == null ? null : ByteBuffer.wrap(data).order(ByteOrder.LITTLE_ENDIAN);
    }

    /**
     * 包装一段已经按小端序编码的字节,不做拷贝。
     *
     * @param kind 元素类型,不能是 {@link ElementKind#OBJECT}
     * @param data 原始字节,长度必须是元素宽度的整数倍
     */
    public static ElementBuffer wrap(ElementKind kind, byte[] data) {
        checkNotNull(kind);
        checkNotNull(data);
        checkArgument(kind != ElementKind.OBJECT, "OBJECT buffers hold references, not bytes.");
        checkArgument(
                data.length % kind.byteWidth() == 0,
                "Buffer of %s bytes is not a multiple of the %s element width %s.",
                data.length,
                kind,
                kind.byteWidth());
        return new ElementBuffer(kind, data.length / kind.byteWidth(), data, null);
    }

    public static ElementBuffer ofBytes(byte... values) {
        return new ElementBuffer(ElementKind.INT8, values.length, values.clone(), null);
    }

    public static ElementBuffer ofUnsignedBytes(byte... values) {
        return new ElementBuffer(ElementKind.UINT8, values.length, values.clone(), null);
    }

    public static ElementBuffer ofShorts(short... values) {
        return encodeShorts(ElementKind.INT16, values);
    }

    public static ElementBuffer ofUnsignedShorts(short... values) {
        return encodeShorts(ElementKind.UINT16, values);
    }

    public static ElementBuffer ofInts(int... values) {
        return encodeInts(ElementKind.INT32, values);
    }

    public static ElementBuffer ofUnsignedInts(int... values) {
        return encodeInts(ElementKind.UINT32, values);
    }

    public static ElementBuffer ofLongs(long... values) {
        return encodeLongs(ElementKind.INT64, values);
    }

    public static ElementBuffer ofUnsignedLongs(long... values) {
        return encodeLongs(ElementKind.UINT64, values);
    }

    public static ElementBuffer ofFloats(float... values) {
        ByteBuffer buffer = allocate(ElementKind.FLOAT32, values.length);
        buffer.asFloatBuffer().put(values);
        return new ElementBuffer(ElementKind.FLOAT32, values.length, buffer.array(), null);
    }

    public static ElementBuffer ofDoubles(double... values) {
        ByteBuffer buffer = allocate(ElementKind.FLOAT64, values.length);
        buffer.asDoubleBuffer().put(values);
        return new ElementBuffer(ElementKind.FLOAT64, values.length, buffer.array(), null);
    }

    public static ElementBuffer ofBooleans(boolean... values) {
        byte[] bytes = new byte[values.length];
        for (int i = 0; i < values.length; i++) {
            bytes[i] = (byte) (values[i] ? 1 : 0);
        }
        return new ElementBuffer(ElementKind.BOOL, values.length, bytes, null);
    }

    /** 对象缓冲区,元素可以是任意类型,包括 null。 */
    public static ElementBuffer ofObjects(Object... values) {
        return new ElementBuffer(ElementKind.OBJECT, values.length, null, values.clone());
    }

    private static ElementBuffer encodeShorts(ElementKind kind, short[] values) {
        ByteBuffer buffer = allocate(kind, values.length);
        buffer.asShortBuffer().put(values);
        return new ElementBuffer(kind, values.length, buffer.array(), null);
    }

    private static ElementBuffer encodeInts(ElementKind kind, int[] values) {
        ByteBuffer buffer = allocate(kind, values.length);
        buffer.asIntBuffer().put(values);
        return new ElementBuffer(kind, values.length, buffer.array(), null);
    }

    private static ElementBuffer encodeLongs(ElementKind kind, long[] values) {
        ByteBuffer buffer = allocate(kind, values.length);
        buffer.asLongBuffer().put(values);
        return new ElementBuffer(kind, values.length, buffer.array(), null);
    }

    private static ByteBuffer allocate(ElementKind kind, int length) {
        return ByteBuffer.allocate(length * kind.byteWidth()).order(ByteOrder.LITTLE_ENDIAN);
    }

    // ------------------------------------------------------------------------

    public ElementKind kind() {
        return kind;
    }

    /** 元素个数。 */
    public int length() {
        return length;
    }

    /** 是否有可整块复制的字节表示。 */
    public boolean hasRawBytes() {
        return data != null;
    }

    /** 小端序的原始字节,供整块复制使用;调用方不得修改。 */
    public byte[] rawBytes() {
        checkState(data != null, "%s buffer has no raw byte representation.", kind);
        return data;
    }

    /**
     * 以数值方式读取第 {@code i} 个元素。越界的下标、null 和 NaN 都返回 {@link NumericCell#absent()}。
     */
    public NumericCell readNumeric(int i) {
        if (i < 0 || i >= length) {
            return NumericCell.absent();
        }
        switch (kind) {
            case INT8:
                return NumericCell.ofLong(view.get(i));
            case UINT8:
                return NumericCell.ofLong(view.get(i) & 0xFFL);
            case INT16:
                return NumericCell.ofLong(view.getShort(i * 2));
            case UINT16:
                return NumericCell.ofLong(view.getShort(i * 2) & 0xFFFFL);
            case INT32:
                return NumericCell.ofLong(view.getInt(i * 4));
            case UINT32:
                return NumericCell.ofLong(Integer.toUnsignedLong(view.getInt(i * 4)));
            case INT64:
                return NumericCell.ofLong(view.getLong(i * 8));
            case UINT64:
                return NumericCell.ofUnsignedLong(view.getLong(i * 8));
            case FLOAT32:
                return NumericCell.ofDouble(view.getFloat(i * 4));
            case FLOAT64:
                return NumericCell.ofDouble(view.getDouble(i * 8));
            case BOOL:
                return NumericCell.ofLong(view.get(i) != 0 ? 1L : 0L);
            case OBJECT:
                return NumericCell.fromObject(objects[i]);
            default:
                throw new UnsupportedOperationException("Unsupported element kind: " + kind);
        }
    }

    /**
     * 以装箱对象读取第 {@code i} 个元素。无符号类型按值域装箱为更宽的类型,{@code UINT64} 保留原始位模式的
     * {@link Long}。
     */
    @Nullable
    public Object getBoxed(int i) {
        checkElementIndex(i, length);
        switch (kind) {
            case INT8:
                return view.get(i);
            case UINT8:
                return view.get(i) & 0xFF;
            case INT16:
                return view.getShort(i * 2);
            case UINT16:
                return view.getShort(i * 2) & 0xFFFF;
            case INT32:
                return view.getInt(i * 4);
            case UINT32:
                return Integer.toUnsignedLong(view.getInt(i * 4));
            case INT64:
            case UINT64:
                return view.getLong(i * 8);
            case FLOAT32:
                return view.getFloat(i * 4);
            case FLOAT64:
                return view.getDouble(i * 8);
            case BOOL:
                return view.get(i) != 0;
            case OBJECT:
                return objects[i];
            default:
                throw new UnsupportedOperationException("Unsupported element kind: " + kind);
        }
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("ElementBuffer{kind=").append(kind);
        sb.append(", length=").append(length);
        if (objects != null) {
            sb.append(", values=").append(Arrays.toString(objects));
        }
        return sb.append('}').toString();
    }
}
