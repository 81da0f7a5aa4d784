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

package org.regionindex.search;

import org.regionindex.build.AdministrativeSuffix;
import org.regionindex.build.TokenVariants;
import org.regionindex.index.InvertedIndex;
import org.regionindex.index.RegionIndex;
import org.regionindex.index.TokenField;
import org.regionindex.options.RegionIndexOptions;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import static org.regionindex.utils.Preconditions.checkNotNull;

/**
 * 查询规范化与分类。
 *
 * <p>规则按顺序判断:
 *
 * <ol>
 *   <li>含显式分隔符({@code > / | , -}),或汉字查询中含空白,或一个行政后缀字把两段汉字名称连在一起
 *       (如 {@code 广东省佛山市}):{@link QueryType#HIERARCHY_PATH}
 *   <li>含汉字:{@link QueryType#CHINESE_NAME}
 *   <li>纯字母(去掉空格与撇号后):长度不超过 2 为 {@link QueryType#SHORT_PINYIN};前 1 到 3 个字母
 *       是已索引的首字母缩写,且能切分成逐级下属的若干片段为 {@link QueryType#COMBO_PINYIN};形如拼音为
 *       {@link QueryType#FULL_PINYIN};长度不超过简拼上限为 {@link QueryType#SHORT_PINYIN}
 *   <li>其它:{@link QueryType#UNKNOWN}
 * </ol>
 */
public class QueryClassifier {

    private static final String SEPARATORS = ">/|,-";

    /** 韵母 ng 后接声母 zh/ch/sh 时最多出现 4 个连续辅音。 */
    private static final int MAX_CONSONANT_RUN = 4;

    private static final int MAX_COMBO_HEAD = 3;

    private final RegionIndexOptions options;

    public QueryClassifier(RegionIndexOptions options) {
        this.options = checkNotNull(options);
    }

    /** 去掉首尾空白、转小写、全角分隔符转半角,连续空白合并为一个空格。 */
    public static String normalize(String query) {
        StringBuilder builder = new StringBuilder(query.length());
        boolean pendingSpace = false;
        for (int i = 0; i < query.length(); i++) {
            char c = toHalfWidth(query.charAt(i));
            if (Character.isWhitespace(c)) {
                pendingSpace = builder.length() > 0;
                continue;
            }
            if (pendingSpace) {
                builder.append(' ');
                pendingSpace = false;
            }
            builder.append(c);
        }
        return builder.toString().toLowerCase(Locale.ROOT);
    }

    public ParsedQuery parse(String normalized, RegionIndex index) {
        List<String> pieces = split(normalized);
        boolean cjk = TokenVariants.containsCjk(normalized);
        String text = String.join("", pieces);
        if (!cjk) {
            text = TokenVariants.normalizeLatin(text);
        }

        QueryType type;
        if (pieces.size() >= 2 && (cjk || hasExplicitSeparator(normalized))) {
            type = QueryType.HIERARCHY_PATH;
        } else if (cjk) {
            type =
                    isSuffixChained(text)
                            ? QueryType.HIERARCHY_PATH
                            : QueryType.CHINESE_NAME;
        } else {
            type = classifyLatin(text, index);
        }
        return new ParsedQuery(normalized, text, pieces, type);
    }

    public QueryType classify(String query, RegionIndex index) {
        return parse(normalize(query), index).type();
    }

    private QueryType classifyLatin(String text, RegionIndex index) {
        if (text.isEmpty() || !isAsciiLetters(text)) {
            return QueryType.UNKNOWN;
        }
        if (text.length() <= 2) {
            return QueryType.SHORT_PINYIN;
        }
        if (isCombo(text, index)) {
            return QueryType.COMBO_PINYIN;
        }
        if (text.length() >= options.fullPinyinMinLength() && isPinyinShaped(text)) {
            return QueryType.FULL_PINYIN;
        }
        if (text.length() <= options.shortPinyinMaxLength()) {
            return QueryType.SHORT_PINYIN;
        }
        return QueryType.UNKNOWN;
    }

    /** 首段是已索引的简拼,且至少有一种切分能逐级解析到区域。 */
    private boolean isCombo(String text, RegionIndex index) {
        return text.length() <= options.comboMaxQueryLength()
                && hasIndexedHead(text, index)
                && !ComboStrategy.resolve(text, index, options.comboMaxFragments()).isEmpty();
    }

    private static boolean hasIndexedHead(String text, RegionIndex index) {
        InvertedIndex shortPinyin = index.inverted(TokenField.SHORT_PINYIN);
        for (int length = 1; length <= MAX_COMBO_HEAD && length < text.length(); length++) {
            if (shortPinyin.containsToken(text.substring(0, length))) {
                return true;
            }
        }
        return false;
    }

    /** 含元音,且连续辅音不超过 {@link #MAX_CONSONANT_RUN} 个。 */
    static boolean isPinyinShaped(String text) {
        boolean hasVowel = false;
        int run = 0;
        for (int i = 0; i < text.length(); i++) {
            if (isVowel(text.charAt(i))) {
                hasVowel = true;
                run = 0;
            } else if (++run > MAX_CONSONANT_RUN) {
                return false;
            }
        }
        return hasVowel;
    }

    /** 某个单字行政后缀前后都还有汉字名称,例如 {@code 广东省佛山市} 中的 {@code 省}。 */
    static boolean isSuffixChained(String text) {
        int min = AdministrativeSuffix.MIN_REMAINING_CHARS;
        for (int i = min; i < text.length() - min; i++) {
            if (AdministrativeSuffix.isSuffixChar(text.charAt(i))
                    && TokenVariants.isCjk(text.charAt(i + 1))) {
                return true;
            }
        }
        return false;
    }

    /** 按分隔符与空白切分,丢弃空片段。 */
    static List<String> split(String normalized) {
        List<String> pieces = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        for (int i = 0; i < normalized.length(); i++) {
            char c = normalized.charAt(i);
            if (SEPARATORS.indexOf(c) >= 0 || c == ' ') {
                addPiece(pieces, current);
            } else {
                current.append(c);
            }
        }
        addPiece(pieces, current);
        return pieces;
    }

    private static void addPiece(List<String> pieces, StringBuilder current) {
        if (current.length() > 0) {
            pieces.add(current.toString());
            current.setLength(0);
        }
    }

    private static boolean hasExplicitSeparator(String normalized) {
        for (int i = 0; i < normalized.length(); i++) {
            if (SEPARATORS.indexOf(normalized.charAt(i)) >= 0) {
                return true;
            }
        }
        return false;
    }

    private static boolean isAsciiLetters(String text) {
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c < 'a' || c > 'z') {
                return false;
            }
        }
        return true;
    }

    private static boolean isVowel(char c) {
        return c == 'a' || c == 'e' || c == 'i' || c == 'o' || c == 'u' || c == 'v';
    }

    private static char toHalfWidth(char c) {
        switch (c) {
            case '　':
                return ' ';
            case '＞':
            case '》':
                return '>';
            case '／':
                return '/';
            case '｜':
                return '|';
            case '，':
            case '、':
                return ',';
            case '－':
                return '-';
            default:
                return c;
        }
    }
}
