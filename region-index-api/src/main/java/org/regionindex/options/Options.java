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

import javax.annotation.concurrent.ThreadSafe;

import java.io.Serializable;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * 线程安全的字符串键值配置,配合 {@link ConfigOption} 做类型化读取。
 *
 * <pre>{@code
 * Options options = new Options();
 * options.setString("search.parallelism", "4");
 * options.set(RegionIndexOptions.NGRAM_SIZE, 3);
 * int parallelism = options.get(RegionIndexOptions.SEARCH_PARALLELISM); // 4
 * }</pre>
 */
@Public
@ThreadSafe
public class Options implements Serializable {

    private static final long serialVersionUID = 1L;

    private final HashMap<String, String> data = new HashMap<>();

    public Options() {}

    public Options(Map<String, String> map) {
        map.forEach(this::setString);
    }

    public static Options fromMap(Map<String, String> map) {
        return new Options(map);
    }

    public synchronized void setString(String key, String value) {
        data.put(key, value);
    }

    /** 类型化写入,值按 {@link OptionsUtils#convertToString(Object)} 转为字符串存储。 */
    public synchronized <T> Options set(ConfigOption<T> option, T value) {
        if (value == null) {
            throw new NullPointerException("Value of " + option.key() + " must not be null.");
        }
        data.put(option.key(), OptionsUtils.convertToString(value));
        return this;
    }

    /** 读取配置值,未设置时返回默认值。 */
    public synchronized <T> T get(ConfigOption<T> option) {
        return getOptional(option).orElseGet(option::defaultValue);
    }

    public synchronized String get(String key) {
        return data.get(key);
    }

    /**
     * 读取配置值,未设置时返回空。
     *
     * @throws IllegalArgumentException 配置值无法转换为选项类型时抛出
     */
    public synchronized <T> Optional<T> getOptional(ConfigOption<T> option) {
        String raw = data.get(option.key());
        if (raw == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(OptionsUtils.convertValue(raw, option.getClazz()));
        } catch (Exception e) {
            throw new IllegalArgumentException(
                    String.format("Could not parse value '%s' for key '%s'.", raw, option.key()),
                    e);
        }
    }

    public synchronized boolean contains(ConfigOption<?> option) {
        return data.containsKey(option.key());
    }

    public synchronized Map<String, String> toMap() {
        return new HashMap<>(data);
    }

    @Override
    public synchronized boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return data.equals(((Options) o).toMap());
    }

    @Override
    public synchronized int hashCode() {
        return data.hashCode();
    }

    @Override
    public synchronized String toString() {
        return data.toString();
    }
}
