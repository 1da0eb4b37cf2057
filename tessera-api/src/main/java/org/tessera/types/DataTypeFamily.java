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

import org.tessera.annotation.Public;

/**
 * 数据类型族的枚举,用于将 {@link DataTypeRoot} 分类到各个类别中。
 *
 * <p>类型族层次结构:
 *
 * <pre>
 * NUMERIC (数值类型)
 * ├── INTEGER_NUMERIC (整数类型): UINT8 ~ UINT64, INT8 ~ INT64
 * │   └── UNSIGNED_NUMERIC (无符号整数): UINT8, UINT16, UINT32, UINT64
 * └── APPROXIMATE_NUMERIC (近似数值类型): FLOAT32, FLOAT64
 * DATETIME (日期时间类型): DATE, TIMESTAMP
 * CHARACTER_STRING (字符串类型): STRING
 * (其他): BOOLEAN
 * </pre>
 *
 * @see DataTypeRoot 数据类型根枚举
 */
@Public
public enum DataTypeFamily {
    /** 所有定长类型(除字符串外)。 */
    PREDEFINED,

    /** 字符串类型族。 */
    CHARACTER_STRING,

    /** 数值类型族,包含所有整数和浮点数类型。 */
    NUMERIC,

    /** 整数数值类型族。 */
    INTEGER_NUMERIC,

    /** 无符号整数类型族。 */
    UNSIGNED_NUMERIC,

    /** 近似数值类型族,包含 FLOAT32 和 FLOAT64。 */
    APPROXIMATE_NUMERIC,

    /** 日期时间类型族,包含 DATE 和 TIMESTAMP。 */
    DATETIME
}
