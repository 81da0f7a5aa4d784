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

package org.regionindex.build;

import javax.annotation.Nullable;

/**
 * 行政区划名称后缀及其拼音音节。
 *
 * <p>按长度降序声明,匹配时先试长后缀,因此 {@code 新疆维吾尔自治区} 匹配 {@link #AUTONOMOUS_REGION}
 * 而不是 {@link #DISTRICT}。
 */
public enum AdministrativeSuffix {
    SPECIAL_ADMINISTRATIVE_REGION("特别行政区", "tebiexingzhengqu"),
    AUTONOMOUS_REGION("自治区", "zizhiqu"),
    AUTONOMOUS_PREFECTURE("自治州", "zizhizhou"),
    AUTONOMOUS_COUNTY("自治县", "zizhixian"),
    AUTONOMOUS_BANNER("自治旗", "zizhiqi"),
    PREFECTURE("地区", "diqu"),
    PROVINCE("省", "sheng"),
    CITY("市", "shi"),
    DISTRICT("区", "qu"),
    COUNTY("县", "xian"),
    LEAGUE("盟", "meng"),
    BANNER("旗", "qi"),
    STATE("州", "zhou");

    /** 去掉后缀后至少要保留的字符数。 */
    public static final int MIN_REMAINING_CHARS = 2;

    private final String suffix;

    private final String pinyin;

    AdministrativeSuffix(String suffix, String pinyin) {
        this.suffix = suffix;
        this.pinyin = pinyin;
    }

    public String suffix() {
        return suffix;
    }

    public String pinyin() {
        return pinyin;
    }

    public int length() {
        return suffix.length();
    }

    /** 返回名称末尾匹配的后缀;去掉后不足两个字符时返回 null。 */
    @Nullable
    public static AdministrativeSuffix match(String name) {
        for (AdministrativeSuffix candidate : values()) {
            if (name.endsWith(candidate.suffix)
                    && name.length() - candidate.length() >= MIN_REMAINING_CHARS) {
                return candidate;
            }
        }
        return null;
    }

    /** 是否为单字后缀,例如 {@code 省}、{@code 市}。 */
    public static boolean isSuffixChar(char c) {
        for (AdministrativeSuffix candidate : values()) {
            if (candidate.length() == 1 && candidate.suffix.charAt(0) == c) {
                return true;
            }
        }
        return false;
    }
}
