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
import org.regionindex.index.Trie;
import org.regionindex.region.Region;

import java.util.ArrayList;
import java.util.List;

/**
 * 层级路径匹配。
 *
 * <p>查询先切成片段:按分隔符切开后,不是完整名称的汉字片段再用名称前缀树做最长匹配切分。每个片段
 * 解析为名称、全拼或简拼精确匹配的区域集合。候选区域的得分取片段序列与其祖先链的最长有序匹配,
 * 且匹配必须落在区域自身上;完整度为匹配片段数除以片段总数。片段顺序与层级顺序相反时完整度下降。
 *
 * <p>少于两个片段时不产生结果,单个名称交给精确与前缀策略。
 */
class PathStrategy implements SearchStrategy {

    private static final TokenField[] SEGMENT_FIELDS = {
        TokenField.NAME, TokenField.PINYIN, TokenField.SHORT_PINYIN
    };

    @Override
    public StrategyKind kind() {
        return StrategyKind.PATH;
    }

    @Override
    public List<MatchSignal> search(ParsedQuery query, RegionIndex index) {
        List<String> segments = segment(query.pieces(), index);
        if (segments.size() < 2) {
            return new ArrayList<>();
        }

        List<BitmapIndex> matches = new ArrayList<>(segments.size());
        BitmapIndex candidates = new BitmapIndex();
        for (String segment : segments) {
            BitmapIndex ids = resolve(segment, index);
            matches.add(ids);
            candidates = candidates.union(ids);
        }

        List<MatchSignal> signals = new ArrayList<>(candidates.cardinality());
        candidates.forEach(
                id -> {
                    int matched = longestOrderedMatch(matches, index.region(id));
                    if (matched > 0) {
                        double completeness = (double) matched / segments.size();
                        signals.add(
                                new MatchSignal(
                                        id,
                                        MatchType.EXACT,
                                        StrategyKind.PATH,
                                        completeness,
                                        0,
                                        0,
                                        completeness));
                    }
                });
        return signals;
    }

    static List<String> segment(List<String> pieces, RegionIndex index) {
        Trie names = index.trie(TokenField.NAME);
        List<String> segments = new ArrayList<>();
        for (String piece : pieces) {
            if (isKnownToken(piece, index) || !TokenVariants.containsCjk(piece)) {
                segments.add(piece);
                continue;
            }
            int pos = 0;
            while (pos < piece.length()) {
                int length = names.longestTerminalPrefix(piece, pos);
                if (length == 0) {
                    pos++;
                } else {
                    segments.add(piece.substring(pos, pos + length));
                    pos += length;
                }
            }
        }
        return segments;
    }

    private static boolean isKnownToken(String piece, RegionIndex index) {
        for (TokenField field : SEGMENT_FIELDS) {
            if (index.inverted(field).containsToken(piece)) {
                return true;
            }
        }
        return false;
    }

    private static BitmapIndex resolve(String segment, RegionIndex index) {
        BitmapIndex ids = new BitmapIndex();
        for (TokenField field : SEGMENT_FIELDS) {
            ids = ids.union(index.inverted(field).lookup(segment));
        }
        return ids;
    }

    /**
     * 片段序列与祖先链的最长有序匹配长度,要求最后一个匹配落在链尾(区域自身)。
     *
     * <p>{@code best[j][t]} 表示以片段 j 匹配链上位置 t 结尾时的最长匹配数。
     */
    static int longestOrderedMatch(List<BitmapIndex> matches, Region region) {
        List<Integer> chain = region.pathIds();
        int segments = matches.size();
        int depth = chain.size();
        int[][] best = new int[segments][depth];
        int result = 0;
        for (int j = 0; j < segments; j++) {
            for (int t = 0; t < depth; t++) {
                if (!matches.get(j).contains(chain.get(t))) {
                    continue;
                }
                int length = 1;
                for (int pj = 0; pj < j; pj++) {
                    for (int pt = 0; pt < t; pt++) {
                        length = Math.max(length, best[pj][pt] + 1);
                    }
                }
                best[j][t] = length;
                if (t == depth - 1) {
                    result = Math.max(result, length);
                }
            }
        }
        return result;
    }
}
