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
import org.regionindex.options.RegionIndexOptions;
import org.regionindex.region.Region;
import org.regionindex.utils.EditDistance;

import java.util.ArrayList;
import java.util.List;

import static org.regionindex.utils.Preconditions.checkNotNull;

/**
 * 模糊匹配。先用 n-gram 表取出至少共享一个窗口的候选,再逐个比较候选的词项:
 *
 * <ul>
 *   <li>查询是词项的子串时,质量为查询长度与词项长度之比,位置为子串起点
 *   <li>否则计算有界编辑距离,上限为 {@code min(max-edit-distance, ceil(查询长度 × distance-ratio))},
 *       质量为 {@code 1 - 距离 / 较长一方的长度}
 * </ul>
 *
 * <p>汉字查询比较名称,字母查询比较全拼。
 */
class FuzzyStrategy implements SearchStrategy {

    private final RegionIndexOptions options;

    FuzzyStrategy(RegionIndexOptions options) {
        this.options = checkNotNull(options);
    }

    @Override
    public StrategyKind kind() {
        return StrategyKind.FUZZY;
    }

    @Override
    public List<MatchSignal> search(ParsedQuery query, RegionIndex index) {
        String text = query.text();
        List<MatchSignal> signals = new ArrayList<>();
        if (text.isEmpty()) {
            return signals;
        }
        TokenField field = query.isCjk() ? TokenField.NAME : TokenField.PINYIN;
        int bound = threshold(text.length());

        BitmapIndex candidates = index.ngram(field).candidates(text);
        candidates.forEach(
                id -> {
                    MatchSignal best = null;
                    Region region = index.region(id);
                    for (String token : TokenVariants.tokens(region, field)) {
                        MatchSignal signal = compare(id, text, token, bound);
                        if (signal != null && (best == null || signal.quality() > best.quality())) {
                            best = signal;
                        }
                    }
                    if (best != null) {
                        signals.add(best);
                    }
                });
        return signals;
    }

    int threshold(int length) {
        int byRatio = (int) Math.ceil(length * options.fuzzyDistanceRatio());
        return Math.min(options.fuzzyMaxEditDistance(), byRatio);
    }

    private static MatchSignal compare(int id, String query, String token, int bound) {
        int position = token.indexOf(query);
        if (position >= 0) {
            return new MatchSignal(
                    id,
                    MatchType.FUZZY,
                    StrategyKind.FUZZY,
                    (double) query.length() / token.length(),
                    position,
                    token.length(),
                    0.0);
        }
        int distance = EditDistance.bounded(query, token, bound);
        if (distance < 0) {
            return null;
        }
        double quality = 1.0 - (double) distance / Math.max(query.length(), token.length());
        return new MatchSignal(
                id, MatchType.FUZZY, StrategyKind.FUZZY, quality, 0, token.length(), 0.0);
    }
}
