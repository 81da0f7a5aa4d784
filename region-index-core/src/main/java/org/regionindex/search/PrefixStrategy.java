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

import org.regionindex.bitmap.BitmapIndex;
import org.regionindex.build.TokenVariants;
import org.regionindex.index.RegionIndex;
import org.regionindex.index.TokenField;
import org.regionindex.region.Region;

import java.util.ArrayList;
import java.util.List;

/**
 * 前缀树前缀查找。汉字查询查名称树,字母查询查全拼与简拼树。
 *
 * <p>匹配质量为查询长度除以该区域中以查询开头的最短词项长度,输入越完整得分越高。
 */
class PrefixStrategy implements SearchStrategy {

    private static final TokenField[] CJK_FIELDS = {TokenField.NAME};

    private static final TokenField[] LATIN_FIELDS = {TokenField.PINYIN, TokenField.SHORT_PINYIN};

    @Override
    public StrategyKind kind() {
        return StrategyKind.PREFIX;
    }

    @Override
    public List<MatchSignal> search(ParsedQuery query, RegionIndex index) {
        String prefix = query.text();
        List<MatchSignal> signals = new ArrayList<>();
        for (TokenField field : query.isCjk() ? CJK_FIELDS : LATIN_FIELDS) {
            BitmapIndex ids = index.trie(field).prefixSearch(prefix);
            ids.forEach(
                    id -> {
                        Region region = index.region(id);
                        int shortest = shortestTokenWithPrefix(region, field, prefix);
                        if (shortest > 0) {
                            signals.add(
                                    new MatchSignal(
                                            id,
                                            MatchType.PREFIX,
                                            StrategyKind.PREFIX,
                                            (double) prefix.length() / shortest,
                                            0,
                                            shortest,
                                            0.0));
                        }
                    });
        }
        return signals;
    }

    private static int shortestTokenWithPrefix(Region region, TokenField field, String prefix) {
        int shortest = 0;
        for (String token : TokenVariants.tokens(region, field)) {
            if (token.startsWith(prefix) && (shortest == 0 || token.length() < shortest)) {
                shortest = token.length();
            }
        }
        return shortest;
    }
}
