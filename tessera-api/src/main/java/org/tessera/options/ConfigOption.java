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

package org.tessera.options;

import org.tessera.annotation.Public;

import static org.tessera.utils.Preconditions.checkNotNull;

/**
 * 配置项描述对象。
 *
 * <p>一个 {@code ConfigOption} 描述了配置的键、值的类型、默认值以及说明文字。
 * 实例通过 {@link ConfigOptions#key(String)} 构建,本身不可变,{@link #withDescription}
 * 会返回一个新的对象。
 *
 * <pre>{@code
 * ConfigOption<Long> multiplier =
 *         ConfigOptions.key("datetime.unit-multiplier")
 *                 .longType()
 *                 .defaultValue(1000L)
 *                 .withDescription("Multiplier from the source timestamp unit to milliseconds.");
 * }</pre>
 *
 * @param <T> 配置值的类型
 */
@Public
public class ConfigOption<T> {

    private final String key;

    private final T defaultValue;

    private final String description;

    private final Class<?> clazz;

    // ------------------------------------------------------------------------

    Class<?> getClazz() {
        return clazz;
    }

    ConfigOption(String key, Class<?> clazz, String description, T defaultValue) {
        this.key = checkNotNull(key);
        this.description = description;
        this.defaultValue = defaultValue;
        this.clazz = checkNotNull(clazz);
    }

    // ------------------------------------------------------------------------

    public ConfigOption<T> withDescription(final String description) {
        return new ConfigOption<>(key, clazz, description, defaultValue);
    }

    // ------------------------------------------------------------------------

    public String key() {
        return key;
    }

    public boolean hasDefaultValue() {
        return defaultValue != null;
    }

    public T defaultValue() {
        return defaultValue;
    }

    public String description() {
        return description;
    }

    // ------------------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        } else if (o != null && o.getClass() == ConfigOption.class) {
            ConfigOption<?> that = (ConfigOption<?>) o;
            return this.key.equals(that.key)
                    && (this.defaultValue == null
                            ? that.defaultValue == null
                            : (that.defaultValue != null
                                    && this.defaultValue.equals(that.defaultValue)));
        } else {
            return false;
        }
    }

    @Override
    public int hashCode() {
        return 31 * key.hashCode() + (defaultValue != null ? defaultValue.hashCode() : 0);
    }

    @Override
    public String toString() {
        return String.format("Key: '%s' , default: %s", key, defaultValue);
    }
}
