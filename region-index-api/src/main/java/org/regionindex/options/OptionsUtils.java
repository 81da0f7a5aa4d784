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

import org.regionindex.utils.TimeUtils;

import java.time.Duration;
import java.util.Arrays;
import java.util.Locale;

/** {@link Options} 的值转换工具。配置值统一以字符串存储,读取时按选项类型转换。 */
public class OptionsUtils {

    /**
     * 将字符串形式的配置值转换为指定类型。
     *
     * @throws IllegalArgumentException 类型不受支持或无法转换时抛出
     */
    @SuppressWarnings("unchecked")
    public static <T> T convertValue(String raw, Class<T> clazz) {
        String value = raw.trim();
        if (Integer.class.equals(clazz)) {
            return (T) Integer.valueOf(value);
        } else if (Long.class.equals(clazz)) {
            return (T) Long.valueOf(value);
        } else if (Double.class.equals(clazz)) {
            return (T) Double.valueOf(value);
        } else if (Duration.class.equals(clazz)) {
            return (T) TimeUtils.parseDuration(value);
        } else if (clazz.isEnum()) {
            return (T) convertToEnum(value, (Class<? extends Enum<?>>) clazz);
        }
        throw new IllegalArgumentException("Unsupported type: " + clazz);
    }

    /** 按名称匹配枚举常量,忽略大小写。 */
    public static <E extends Enum<?>> E convertToEnum(String value, Class<E> clazz) {
        String upper = value.toUpperCase(Locale.ROOT);
        for (E constant : clazz.getEnumConstants()) {
            if (constant.name().equals(upper)) {
                return constant;
            }
        }
        throw new IllegalArgumentException(
                String.format(
                        "Could not parse value '%s' for enum %s. Expected one of: %s",
                        value, clazz.getSimpleName(), Arrays.toString(clazz.getEnumConstants())));
    }

    static String convertToString(Object value) {
        if (value instanceof Duration) {
            return TimeUtils.formatWithHighestUnit((Duration) value);
        } else if (value instanceof Enum) {
            return ((Enum<?>) value).name();
        }
        return value.toString();
    }

    private OptionsUtils() {}
}
