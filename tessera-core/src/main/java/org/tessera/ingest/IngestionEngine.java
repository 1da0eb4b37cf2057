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

import org.tessera.annotation.Public;
import org.tessera.ingest.source.SourceAccessor;
import org.tessera.options.Options;
import org.tessera.schema.TableSchema;
import org.tessera.table.ColumnarTable;
import org.tessera.table.TableColumn;
import org.tessera.types.DataField;
import org.tessera.types.DataTypeRoot;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.tessera.utils.Preconditions.checkNotNull;

/**
 * 把外部列式数据填充进 {@link ColumnarTable} 的入口。
 *
 * <p>使用流程:
 *
 * <pre>{@code
 * IngestionEngine engine = new IngestionEngine(source);
 * engine.initialize();
 * ColumnarTable table = engine.createTable();
 * engine.fillTable(table, engine.inferSchema(), null, 0, Integer.MAX_VALUE, false);
 * }</pre>
 *
 * <p>{@link #initialize()} 读取源列名并推断每列的类型,之后这些元数据不再变化。{@link #fillTable}
 * 按 schema 的顺序填充每一列,最后生成主键列和排序键列。
 *
 * <p>该类不是线程安全的。
 */
@Public
public class IngestionEngine {

    private static final Logger LOG = LoggerFactory.getLogger(IngestionEngine.class);

    private final SourceAccessor accessor;

    private final IngestOptions options;

    private final IndexSynthesizer indexSynthesizer;

    @Nullable private List<String> names;

    @Nullable private List<DataTypeRoot> types;

    @Nullable private FillDispatcher dispatcher;

    public IngestionEngine(SourceAccessor accessor) {
        this(accessor, new Options());
    }

    public IngestionEngine(SourceAccessor accessor, Options options) {
        this(accessor, new IngestOptions(options));
    }

    public IngestionEngine(SourceAccessor accessor, IngestOptions options) {
        this.accessor = checkNotNull(accessor, "Source accessor must not be null.");
        this.options = checkNotNull(options);
        this.indexSynthesizer = new IndexSynthesizer(options);
    }

    /**
     * 读取源列名并推断类型。
     *
     * @throws MixedColumnKindsException 某列没有统一的元素类型
     */
    public void initialize() {
        List<String> sourceNames =
                Collections.unmodifiableList(new ArrayList<>(accessor.columnNames()));
        List<DataTypeRoot> inferred = TypeInference.inferTypes(accessor, sourceNames);
        this.names = sourceNames;
        this.types = inferred;
        this.dispatcher = new FillDispatcher(accessor, sourceNames, options);
        LOG.info(
                "Initialized ingestion of {} rows with columns {} typed {}.",
                accessor.rowCount(),
                names,
                types);
    }

    public boolean isInitialized() {
        return dispatcher != null;
    }

    /** 源列名,与 {@link #types()} 一一对应。 */
    public List<String> names() {
        checkInitialized("names()");
        return names;
    }

    /** 推断出的列类型。 */
    public List<DataTypeRoot> types() {
        checkInitialized("types()");
        return types;
    }

    public int rowCount() {
        checkInitialized("rowCount()");
        return accessor.rowCount();
    }

    /** 由推断结果组成的 schema,重名的列只保留第一个。 */
    public TableSchema inferSchema() {
        checkInitialized("inferSchema()");
        TableSchema.Builder builder = TableSchema.newBuilder();
        List<String> seen = new ArrayList<>();
        for (int i = 0; i < names.size(); i++) {
            String name = names.get(i);
            if (!seen.contains(name)) {
                seen.add(name);
                builder.column(name, types.get(i));
            }
        }
        return builder.build();
    }

    /** 按推断的 schema 创建一张行数与源相同的空表。 */
    public ColumnarTable createTable() {
        return ColumnarTable.fromSchema(inferSchema(), rowCount());
    }

    /**
     * 按 {@code schema} 填充 {@code table},然后生成主键列和排序键列。
     *
     * <p>名为 {@link IngestOptions#INDEX_SENTINEL_COLUMN} 的列不写入同名列,而是以该 schema 类型创建主键列并
     * 直接用同名源列填充,排序键列是它的副本,此时忽略 {@code index}、{@code offset} 和 {@code limit}。
     *
     * @param table 目标表,schema 中的普通列必须已经存在
     * @param schema 要填充的列及其目标类型
     * @param index 用作索引的已填充列名;为空时按 {@code offset} 和 {@code limit} 生成
     * @param offset 生成索引时的起始偏移
     * @param limit 生成索引时的取模上限,必须为正数
     * @param isUpdate 为 true 时缺失值按更新语义撤销,否则清除
     * @throws NotInitializedException 尚未调用 {@link #initialize()}
     * @throws UnknownColumnException schema 中的列在源中不存在
     * @throws InvalidLimitException 需要生成索引但 {@code limit} 不是正数
     */
    public void fillTable(
            ColumnarTable table,
            TableSchema schema,
            @Nullable String index,
            int offset,
            int limit,
            boolean isUpdate) {
        checkInitialized("fillTable()");
        checkNotNull(table, "Table must not be null.");
        checkNotNull(schema, "Schema must not be null.");

        String sentinel = options.indexSentinelColumn();
        boolean implicitIndex = false;
        for (DataField field : schema.fields()) {
            if (field.name().equals(sentinel)) {
                implicitIndex = true;
                TableColumn primaryKey =
                        table.addColumn(indexSynthesizer.primaryKeyColumn(), field.type(), true);
                dispatcher.fillColumn(table, primaryKey, sentinel, isUpdate);
                indexSynthesizer.copyPrimaryKeyToOrderKey(table);
                continue;
            }
            dispatcher.fillColumn(table, table.getColumn(field.name()), field.name(), isUpdate);
        }

        if (!implicitIndex) {
            indexSynthesizer.synthesize(table, index, offset, limit);
        }
        LOG.debug("Filled {} columns into a table of {} rows.", schema.size(), table.size());
    }

    private void checkInitialized(String operation) {
        if (dispatcher == null) {
            throw new NotInitializedException(operation);
        }
    }
}
