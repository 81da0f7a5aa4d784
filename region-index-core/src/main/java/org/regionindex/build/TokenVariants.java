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

import org.regionindex.index.TokenField;
import org.regionindex.region.Region;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * 从区域属性派生各字段的词项。构建和检索使用同一套规则,检索时据此计算前缀与模糊匹配的质量。
 *
 * <ul>
 *   <li>NAME: 名称、去掉行政后缀的名称、中文别名
 *   <li>PINYIN: 全拼、去掉后缀音节的全拼、拉丁字母别名
 *   <li>SHORT_PINYIN: 首字母缩写,每个汉字对应一个首字母时再派生去掉后缀首字母的形式
 *   <li>PATH: 祖先名称直接拼接,以及用 {@code >} 连接
 * </ul>
 *
 * <p>所有词项均为小写,拉丁字母词项去掉空格和撇号。
 */
public final class TokenVariants {

    public static final String PATH_SEPARATOR = ">";

    public static List<String> tokens(Region region, TokenField field) {
        switch (field) {
            case NAME:
                return nameTokens(region.name(), region.aliases());
            case PINYIN:
                return pinyinTokens(region.name(), region.pinyinFull(), region.aliases());
            case SHORT_PINYIN:
                return shortPinyinTokens(region.name(), region.pinyinShort());
            case PATH:
                return pathTokens(region.path());
            default:
                throw new IllegalArgumentException("Unknown token field " + field);
        }
    }

    public static List<String> nameTokens(String name, List<String> aliases) {
        Set<String> tokens = new LinkedHashSet<>();
        String lower = lowerCase(name);
        addIfNotEmpty(tokens, lower);
        AdministrativeSuffix suffix = AdministrativeSuffix.match(lower);
        if (suffix != null) {
            tokens.add(lower.substring(0, lower.length() - suffix.length()));
        }
        for (String alias : aliases) {
            if (containsCjk(alias)) {
                addIfNotEmpty(tokens, lowerCase(alias));
            }
        }
        return new ArrayList<>(tokens);
    }

    public static List<String> pinyinTokens(String name, String pinyin, List<String> aliases) {
        Set<String> tokens = new LinkedHashSet<>();
        String normalized = normalizeLatin(pinyin);
        addIfNotEmpty(tokens, normalized);
        AdministrativeSuffix suffix = AdministrativeSuffix.match(name.trim());
        if (suffix != null
                && normalized.endsWith(suffix.pinyin())
                && normalized.length() > suffix.pinyin().length()) {
            tokens.add(normalized.substring(0, normalized.length() - suffix.pinyin().length()));
        }
        for (String alias : aliases) {
            if (!containsCjk(alias)) {
                addIfNotEmpty(tokens, normalizeLatin(alias));
            }
        }
        return new ArrayList<>(tokens);
    }

    public static List<String> shortPinyinTokens(String name, String pinyinShort) {
        Set<String> tokens = new LinkedHashSet<>();
        String normalized = normalizeLatin(pinyinShort);
        addIfNotEmpty(tokens, normalized);
        String trimmedName = name.trim();
        AdministrativeSuffix suffix = AdministrativeSuffix.match(trimmedName);
        if (suffix != null && normalized.length() == trimmedName.length()) {
            tokens.add(normalized.substring(0, normalized.length() - suffix.length()));
        }
        return new ArrayList<>(tokens);
    }

    public static List<String> pathTokens(List<String> path) {
        if (path.size() < 2) {
            return Collections.emptyList();
        }
        List<String> lower = new ArrayList<>(path.size());
        for (String name : path) {
            lower.add(lowerCase(name));
        }
        List<String> tokens = new ArrayList<>(2);
        tokens.add(String.join("", lower));
        tokens.add(String.join(PATH_SEPARATOR, lower));
        return tokens;
    }

    /** 小写并去掉空格与撇号。 */
    public static String normalizeLatin(String text) {
        if (text == null) {
            return "";
        }
        StringBuilder builder = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (!Character.isWhitespace(c) && c != '\'' && c != '’') {
                builder.append(Character.toLowerCase(c));
            }
        }
        return builder.toString();
    }

    public static boolean isCjk(char c) {
        return Character.UnicodeScript.of(c) == Character.UnicodeScript.HAN;
    }

    public static boolean containsCjk(String text) {
        for (int i = 0; i < text.length(); i++) {
            if (isCjk(text.charAt(i))) {
                return true;
            }
        }
        return false;
    }

    private static String lowerCase(String text) {
        return text.trim().toLowerCase(Locale.ROOT);
    }

    private static void addIfNotEmpty(Set<String> tokens, String token) {
        if (!token.isEmpty()) {
            tokens.add(token);
        }
    }

    private TokenVariants() {}
}
