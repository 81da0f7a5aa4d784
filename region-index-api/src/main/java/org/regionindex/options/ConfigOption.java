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

package org.regionindex.options;

import org.regionindex.annotation.Public;

import java.util.Objects;

import static org.regionindex.utils.Preconditions.checkNotNull;

/**
 * 一个类型化的配置项:键、默认值、描述以及值类型。
 *
 * <p>通过 {@link ConfigOptions} 构建,创建后不可变。索引构建与检索的可调参数(n-gram 长度、
 * 压缩算法、评分权重、模糊匹配阈值等)都以这种方式声明,参见 {@code RegionIndexOptions}。
 *
 * <pre>{@code
 * ConfigOption<Integer> ngramSize = ConfigOptions
 *     .key("index.ngram.size")
 *     .intType()
 *     .defaultValue(2)
 *     .withDescription("字符 n-gram 窗口长度");
 * }</pre>
 *
 * @param <T> 配置值的类型
 */
@Public
public class ConfigOption<T> {

    private final String key;

    private final T defaultValue;

    private final String description;

    /** 值的原子类型,例如 {@code Integer.class} 或某个枚举类。 */
    private final Class<T> clazz;

    ConfigOption(String key, Class<T> clazz, String description, T defaultValue) {
        this.key = checkNotNull(key);
        this.clazz = checkNotNull(clazz);
        this.description = description;
        this.defaultValue = defaultValue;
    }

    Class<T> getClazz() {
        return clazz;
    }

    /** 返回带有给定描述的新配置项。 */
    public ConfigOption<T> withDescription(String description) {
        return new ConfigOption<>(key, clazz, description, defaultValue);
    }

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

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ConfigOption<?> that = (ConfigOption<?>) o;
        return key.equals(that.key)
                && clazz.equals(that.clazz)
                && Objects.equals(defaultValue, that.defaultValue);
    }

    @Override
    public int hashCode() {
        return Objects.hash(key, clazz, defaultValue);
    }

    @Override
    public String toString() {
        return String.format(
                "Key: '%s', type: %s, default: %s", key, clazz.getSimpleName(), defaultValue);
    }
}
