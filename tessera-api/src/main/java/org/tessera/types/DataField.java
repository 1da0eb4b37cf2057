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

import java.io.Serializable;
import java.util.Objects;

import static org.tessera.utils.Preconditions.checkNotNull;

/**
 * 表结构中的一个字段,由字段名和声明的列类型组成。
 *
 * <p>字段是不可变的。字段名在一个 {@code TableSchema} 中允许重复,此时按插入顺序先出现者优先。
 */
@Public
public final class DataField implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String name;

    private final DataTypeRoot type;

    public DataField(String name, DataTypeRoot type) {
        this.name = checkNotNull(name, "Field name must not be null.");
        this.type = checkNotNull(type, "Field type must not be null.");
    }

    public String name() {
        return name;
    }

    public DataTypeRoot type() {
        return type;
    }

    public DataField newType(DataTypeRoot newType) {
        return new DataField(name, newType);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        DataField that = (DataField) o;
        return name.equals(that.name) && type == that.type;
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type);
    }

    @Override
    public String toString() {
        return String.format("`%s` %s", name, type);
    }
}
