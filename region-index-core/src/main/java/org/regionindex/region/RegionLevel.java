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

package org.regionindex.region;

import java.util.Locale;

/**
 * 行政区划级别。
 *
 * <p>区和县属于同一层级,{@link #rank()} 相同。
 */
public enum RegionLevel {
    COUNTRY(0, "国家级"),
    PROVINCE(1, "省级"),
    CITY(2, "市级"),
    DISTRICT(3, "区县级"),
    COUNTY(3, "区县级"),
    SUBDISTRICT(4, "街道级"),
    VILLAGE(5, "村级");

    private final int rank;

    private final String label;

    RegionLevel(int rank, String label) {
        this.rank = rank;
        this.label = label;
    }

    public int rank() {
        return rank;
    }

    public String label() {
        return label;
    }

    /**
     * 解析级别。接受枚举名(不区分大小写)、中文标签或级别数字。标签和数字有歧义时取先声明的级别,
     * 例如 {@code 区县级} 和 {@code 3} 都解析为 {@link #DISTRICT}。
     *
     * @throws DataIntegrityException 无法识别时抛出
     */
    public static RegionLevel parse(String text) {
        if (text == null || text.trim().isEmpty()) {
            throw new DataIntegrityException("Region level must not be blank.");
        }
        String trimmed = text.trim();
        for (RegionLevel level : values()) {
            if (level.name().equals(trimmed.toUpperCase(Locale.ROOT))
                    || level.label.equals(trimmed)
                    || String.valueOf(level.rank).equals(trimmed)) {
                return level;
            }
        }
        throw new DataIntegrityException("Unknown region level '" + text + "'.");
    }
}
