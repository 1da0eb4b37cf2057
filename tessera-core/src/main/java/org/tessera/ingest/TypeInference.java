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

import org.tessera.ingest.source.ElementBuffer;
import org.tessera.ingest.source.SourceAccessor;
import org.tessera.types.DataTypeRoot;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** 根据源列缓冲区的元素类型推断目标列类型。 */
public final class TypeInference {

    private TypeInference() {}

    /**
     * 按位置推断每个源列的类型,{@code names} 与 {@link SourceAccessor#columnNames()} 一一对应。
     *
     * @throws MixedColumnKindsException 某列不是统一元素类型的缓冲区
     */
    public static List<DataTypeRoot> inferTypes(SourceAccessor accessor, List<String> names) {
        List<DataTypeRoot> types = new ArrayList<>(names.size());
        for (int i = 0; i < names.size(); i++) {
            types.add(inferType(names.get(i), accessor.columnData(i)));
        }
        return Collections.unmodifiableList(types);
    }

    public static DataTypeRoot inferType(String name, Object data) {
        if (!(data instanceof ElementBuffer)) {
            throw new MixedColumnKindsException(name, data);
        }
        return ((ElementBuffer) data).kind().toDataType();
    }
}
