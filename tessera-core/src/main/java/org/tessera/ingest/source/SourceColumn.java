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

import javax.annotation.Nullable;

import java.util.Arrays;

/** 一次取列的结果:列的缓冲区,以及该列中缺失值所在的行偏移(升序)。 */
public final class SourceColumn {

    private static final int[] NO_NULLS = new int[0];

    @Nullable private final ElementBuffer buffer;

    private final int[] nullPositions;

    public SourceColumn(@Nullable ElementBuffer buffer, @Nullable int[] nullPositions) {
        this.buffer = buffer;
        this.nullPositions = nullPositions == null ? NO_NULLS : nullPositions;
    }

    /** 源列的缓冲区;源无法提供可识别的缓冲区时为 null。 */
    @Nullable
    public ElementBuffer buffer() {
        return buffer;
    }

    public int[] nullPositions() {
        return nullPositions;
    }

    @Override
    public String toString() {
        return "SourceColumn{"
                + "buffer="
                + buffer
                + ", nullPositions="
                + Arrays.toString(nullPositions)
                + '}';
    }
}
