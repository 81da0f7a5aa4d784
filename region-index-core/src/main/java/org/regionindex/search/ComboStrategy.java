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
import org.regionindex.index.RegionIndex;
import org.regionindex.index.TokenField;
import org.regionindex.options.RegionIndexOptions;
import org.regionindex.region.Region;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.regionindex.utils.Preconditions.checkNotNull;

/**
 * 组合拼音,如 {@code gdfs} 切成 {@code gd} 与 {@code fs}。
 *
 * <p>从 2 个片段开始逐个尝试片段数,直到上限。每个片段解析为简拼或全拼精确匹配的区域,后一个片段的
 * 区域必须是前一个片段区域的下级。采用第一个能成功切分的片段数,并保留该片段数下的全部切分。命中区域
 * 的直接下级以较低质量一并返回。
 */
class ComboStrategy implements SearchStrategy {

    static final double CHILD_QUALITY = 0.7;

    private static final TokenField[] FRAGMENT_FIELDS = {
        TokenField.SHORT_PINYIN, TokenField.PINYIN
    };

    private final RegionIndexOptions options;

    ComboStrategy(RegionIndexOptions options) {
        this.options = checkNotNull(options);
    }

    @Override
    public StrategyKind kind() {
        return StrategyKind.COMBO;
    }

    @Override
    public List<MatchSignal> search(ParsedQuery query, RegionIndex index) {
        String text = query.text();
        List<MatchSignal> signals = new ArrayList<>();
        if (query.isCjk() || text.length() > options.comboMaxQueryLength()) {
            return signals;
        }

        Map<Integer, Integer> matched = resolve(text, index, options.comboMaxFragments());
        for (Map.Entry<Integer, Integer> entry : matched.entrySet()) {
            Region region = index.region(entry.getKey());
            signals.add(signal(region, entry.getValue(), 1.0));
            for (Region child : index.children(region.id())) {
                if (!matched.containsKey(child.id())) {
                    signals.add(signal(child, entry.getValue(), CHILD_QUALITY));
                }
            }
        }
        return signals;
    }

    /**
     * 从 2 段开始逐步增加片段数,返回第一个能解析成功的片段数下所有切分命中的区域 id 及其片段数。
     * 没有任何切分能解析时返回空映射。
     */
    static Map<Integer, Integer> resolve(String text, RegionIndex index, int maxFragments) {
        Map<String, BitmapIndex> memo = new HashMap<>();
        int limit = Math.min(maxFragments, text.length());
        for (int fragments = 2; fragments <= limit; fragments++) {
            Map<Integer, Integer> matched = new LinkedHashMap<>();
            int[] cuts = new int[fragments - 1];
            for (int i = 0; i < cuts.length; i++) {
                cuts[i] = i + 1;
            }
            do {
                BitmapIndex regions = resolveChain(text, cuts, index, memo);
                regions.forEach(id -> matched.put(id, cuts.length + 1));
            } while (nextCuts(cuts, text.length()));

            if (!matched.isEmpty()) {
                return matched;
            }
        }
        return Collections.emptyMap();
    }

    private static MatchSignal signal(Region region, int fragments, double quality) {
        double completeness = Math.min(1.0, (double) fragments / region.path().size());
        return new MatchSignal(
                region.id(),
                MatchType.COMBO,
                StrategyKind.COMBO,
                quality,
                0,
                0,
                completeness);
    }

    /** 按切分点解析各片段,逐级限定为前一片段区域的下级。任何一级为空即返回空集合。 */
    private static BitmapIndex resolveChain(
            String text, int[] cuts, RegionIndex index, Map<String, BitmapIndex> memo) {
        BitmapIndex current = null;
        int start = 0;
        for (int i = 0; i <= cuts.length; i++) {
            int end = i < cuts.length ? cuts[i] : text.length();
            BitmapIndex ids = lookup(text.substring(start, end), index, memo);
            if (current == null) {
                current = ids;
            } else {
                current = descendantsOf(ids, current, index);
            }
            if (current.isEmpty()) {
                return current;
            }
            start = end;
        }
        return current;
    }

    private static BitmapIndex descendantsOf(
            BitmapIndex candidates, BitmapIndex ancestors, RegionIndex index) {
        BitmapIndex result = new BitmapIndex();
        candidates.forEach(
                id -> {
                    List<Integer> pathIds = index.region(id).pathIds();
                    for (int i = 0; i < pathIds.size() - 1; i++) {
                        if (ancestors.contains(pathIds.get(i))) {
                            result.add(id);
                            return;
                        }
                    }
                });
        return result;
    }

    private static BitmapIndex lookup(
            String fragment, RegionIndex index, Map<String, BitmapIndex> memo) {
        return memo.computeIfAbsent(
                fragment,
                f -> {
                    BitmapIndex ids = new BitmapIndex();
                    for (TokenField field : FRAGMENT_FIELDS) {
                        ids = ids.union(index.inverted(field).lookup(f));
                    }
                    return ids;
                });
    }

    /** 按字典序枚举下一组严格递增的切分点,取值在 [1, length - 1]。 */
    static boolean nextCuts(int[] cuts, int length) {
        int k = cuts.length;
        for (int i = k - 1; i >= 0; i--) {
            if (cuts[i] < length - (k - i)) {
                cuts[i]++;
                for (int j = i + 1; j < k; j++) {
                    cuts[j] = cuts[j - 1] + 1;
                }
                return true;
            }
        }
        return false;
    }
}
