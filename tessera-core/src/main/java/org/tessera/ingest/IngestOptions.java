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
import org.tessera.options.ConfigOption;
import org.tessera.options.Options;

import java.util.Map;

import static org.tessera.options.ConfigOptions.key;
import static org.tessera.utils.Preconditions.checkArgument;

/** 摄取引擎的配置项。 */
@Public
public class IngestOptions {

    public static final ConfigOption<String> INDEX_SENTINEL_COLUMN =
            key("index.sentinel-column")
                    .stringType()
                    .defaultValue("__INDEX__")
                    .withDescription(
                            "Schema column name which asks the engine to fill the primary key "
                                    + "column directly from the source column of the same name.");

    public static final ConfigOption<String> PRIMARY_KEY_COLUMN =
            key("index.primary-key-column")
                    .stringType()
                    .defaultValue("__pkey")
                    .withDescription("Name of the synthesized primary key column.");

    public static final ConfigOption<String> ORDER_KEY_COLUMN =
            key("index.order-key-column")
                    .stringType()
                    .defaultValue("__okey")
                    .withDescription("Name of the synthesized order key column.");

    public static final ConfigOption<Long> DATETIME_UNIT_MULTIPLIER =
            key("datetime.unit-multiplier")
                    .longType()
                    .defaultValue(1000L)
                    .withDescription(
                            "Multiplier applied to source datetime values to obtain epoch "
                                    + "milliseconds. The default converts epoch seconds.");

    public static final ConfigOption<Boolean> BULK_COPY_ENABLED =
            key("fill.bulk-copy.enabled")
                    .booleanType()
                    .defaultValue(true)
                    .withDescription(
                            "Whether numeric columns whose element kind matches the destination "
                                    + "type are copied as a single block. When disabled every "
                                    + "column goes through the per-cell conversion path.");

    public static final ConfigOption<Boolean> REHYDRATE_PRIOR_ROWS =
            key("promotion.rehydrate-prior-rows")
                    .booleanType()
                    .defaultValue(true)
                    .withDescription(
                            "Whether rows written before a promotion to STRING are re-encoded as "
                                    + "text. When false those rows become absent.");

    private final Options options;

    public IngestOptions() {
        this(new Options());
    }

    public IngestOptions(Map<String, String> options) {
        this(Options.fromMap(options));
    }

    public IngestOptions(Options options) {
        this.options = options;
        checkArgument(
                datetimeUnitMultiplier() > 0,
                "%s must be positive, but is %s.",
                DATETIME_UNIT_MULTIPLIER.key(),
                datetimeUnitMultiplier());
    }

    public Options toConfiguration() {
        return options;
    }

    public String indexSentinelColumn() {
        return options.get(INDEX_SENTINEL_COLUMN);
    }

    public String primaryKeyColumn() {
        return options.get(PRIMARY_KEY_COLUMN);
    }

    public String orderKeyColumn() {
        return options.get(ORDER_KEY_COLUMN);
    }

    public long datetimeUnitMultiplier() {
        return options.get(DATETIME_UNIT_MULTIPLIER);
    }

    public boolean bulkCopyEnabled() {
        return options.get(BULK_COPY_ENABLED);
    }

    public boolean rehydratePriorRows() {
        return options.get(REHYDRATE_PRIOR_ROWS);
    }
}
