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

import org.tessera.annotation.VisibleForTesting;
import org.tessera.ingest.source.ElementBuffer;
import org.tessera.ingest.source.ElementKind;
import org.tessera.ingest.source.SourceAccessor;
import org.tessera.ingest.source.SourceColumn;
import org.tessera.table.ColumnarTable;
import org.tessera.table.TableColumn;
import org.tessera.types.DataTypeFamily;
import org.tessera.types.DataTypeRoot;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * 为单个目标列选择填充路径。
 *
 * <p>先尝试整块复制;元素类型与目标类型不一致、整块复制被禁用或源是比目标更宽的整数时,改走
 * {@link IterativeFiller}。整块复制成功后整列先标记为有值,再按源的缺失位置逐行标记。
 */
class FillDispatcher {

    private static final Logger LOG = LoggerFactory.getLogger(FillDispatcher.class);

    private final SourceAccessor accessor;

    private final List<String> names;

    private final IngestOptions options;

    private final IterativeFiller iterativeFiller;

    FillDispatcher(SourceAccessor accessor, List<String> names, IngestOptions options) {
        this.accessor = accessor;
        this.names = names;
        this.options = options;
        this.iterativeFiller = new IterativeFiller(accessor, options);
    }

    /**
     * 用名为 {@code sourceName} 的源列填充 {@code column}。
     *
     * @param table 目标表,类型提升时会替换其中的列
     * @param column 目标列
     * @param sourceName 源列名,重名时取第一个
     * @param isUpdate 为 true 时缺失值按更新语义撤销,否则清除
     * @throws UnknownColumnException 源中没有该列
     * @throws UnsupportedSourceBufferException 源无法提供该列的缓冲区,且目标类型需要从缓冲区读取
     */
    void fillColumn(ColumnarTable table, TableColumn column, String sourceName, boolean isUpdate) {
        int sourceIndex = names.indexOf(sourceName);
        if (sourceIndex < 0) {
            throw new UnknownColumnException(sourceName);
        }

        DataTypeRoot destType = column.type();
        SourceColumn source = accessor.columnBuffer(sourceName, destType);
        ElementBuffer buffer = source.buffer();
        NullMarking marking = NullMarking.of(isUpdate);
        if (buffer == null) {
            if (!isMarshalled(destType)) {
                throw new UnsupportedSourceBufferException(sourceName);
            }
            LOG.debug(
                    "Source column {} has no buffer, marshalling {} cells one by one.",
                    sourceName,
                    destType);
            iterativeFiller.fill(table, column, sourceName, sourceIndex, source, marking);
            return;
        }
        ElementKind kind = buffer.kind();

        if (isWideningMismatch(kind, destType)) {
            LOG.debug(
                    "Source column {} ({}) is wider than {} column {}, converting cell by cell.",
                    sourceName,
                    kind,
                    destType,
                    column.name());
        } else if (options.bulkCopyEnabled()
                && BulkCopier.copyArray(buffer, column, kind, 0) == FillStatus.SUCCEED) {
            column.fillValidityAllPresent();
            marking.markAll(column, source.nullPositions());
            return;
        } else {
            LOG.debug(
                    "Bulk copy of source column {} ({}) into {} column {} is not possible.",
                    sourceName,
                    kind,
                    destType,
                    column.name());
        }
        iterativeFiller.fill(table, column, sourceName, sourceIndex, source, marking);
    }

    /** 这些类型的值只通过 {@link SourceAccessor#marshalCell} 读取,不需要源缓冲区。 */
    static boolean isMarshalled(DataTypeRoot destType) {
        return destType == DataTypeRoot.STRING
                || destType == DataTypeRoot.DATE
                || destType == DataTypeRoot.BOOLEAN;
    }

    /**
     * 源是整数,目标是数值,且目标无法精确容纳源的值域:整数目标更窄,或浮点目标的宽度不大于源。
     */
    @VisibleForTesting
    static boolean isWideningMismatch(ElementKind kind, DataTypeRoot destType) {
        if (!kind.isIntegral() || !destType.is(DataTypeFamily.NUMERIC)) {
            return false;
        }
        if (destType.isIntegral()) {
            return kind.byteWidth() > destType.byteWidth();
        }
        return kind.byteWidth() >= destType.byteWidth();
    }
}
