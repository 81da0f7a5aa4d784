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

import org.regionindex.index.RegionIndex;
import org.regionindex.options.RegionIndexOptions;
import org.regionindex.region.Region;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.regionindex.utils.Preconditions.checkArgument;
import static org.regionindex.utils.Preconditions.checkNotNull;

/**
 * 合并匹配证据并打分。
 *
 * <pre>
 * score = weight(matchType) × quality
 *       + positionWeight × (1 - position / span)
 *       + levelBonus(level)
 *       + completenessWeight × completeness
 * </pre>
 *
 * <p>路径完整度加成只计入 {@link StrategyKind#PATH} 与 {@link StrategyKind#COMBO} 的证据。
 *
 * <p>每个区域只保留得分最高的证据。结果按得分降序,同分按 id 升序。匹配方式权重必须满足
 * exact &gt; prefix &gt; combo &gt; fuzzy。
 */
public class RegionScorer {

    private final Map<MatchType, Double> weights = new EnumMap<>(MatchType.class);
    private final RegionIndexOptions options;

    public RegionScorer(RegionIndexOptions options) {
        this.options = checkNotNull(options);
        weights.put(MatchType.EXACT, options.exactWeight());
        weights.put(MatchType.PREFIX, options.prefixWeight());
        weights.put(MatchType.COMBO, options.comboWeight());
        weights.put(MatchType.FUZZY, options.fuzzyWeight());
        checkArgument(
                options.exactWeight() > options.prefixWeight()
                        && options.prefixWeight() > options.comboWeight()
                        && options.comboWeight() > options.fuzzyWeight(),
                "Match weights must be strictly ordered exact > prefix > combo > fuzzy, but are %s",
                weights);
    }

    public double weight(MatchType type) {
        return weights.get(type);
    }

    public double score(MatchSignal signal, Region region) {
        return weight(signal.matchType()) * signal.quality()
                + options.positionWeight() * signal.positionFactor()
                + options.levelBonus(region.level())
                + options.pathCompletenessWeight() * pathCompleteness(signal);
    }

    private static double pathCompleteness(MatchSignal signal) {
        StrategyKind strategy = signal.strategy();
        return strategy == StrategyKind.PATH || strategy == StrategyKind.COMBO
                ? signal.completeness()
                : 0.0;
    }

    /**
     * 合并、排序并截断。
     *
     * @param limit 最多返回的结果数
     * @param minScore 低于该分数的结果被丢弃
     */
    public List<SearchResult> rank(
            Collection<MatchSignal> signals, RegionIndex index, int limit, double minScore) {
        Map<Integer, Scored> best = new HashMap<>();
        for (MatchSignal signal : signals) {
            Region region = index.findRegion(signal.regionId());
            if (region == null) {
                continue;
            }
            double score = score(signal, region);
            Scored current = best.get(region.id());
            if (current == null || score > current.score) {
                best.put(region.id(), new Scored(region, signal, score));
            }
        }

        List<Scored> sorted = new ArrayList<>(best.values());
        sorted.sort(
                Comparator.comparingDouble((Scored s) -> s.score)
                        .reversed()
                        .thenComparingInt(s -> s.region.id()));

        List<SearchResult> results = new ArrayList<>(Math.min(limit, sorted.size()));
        for (Scored scored : sorted) {
            if (results.size() >= limit) {
                break;
            }
            if (scored.score < minScore) {
                continue;
            }
            results.add(SearchResult.create(index, scored.region, scored.signal, scored.score));
        }
        return results;
    }

    private static class Scored {
        private final Region region;
        private final MatchSignal signal;
        private final double score;

        private Scored(Region region, MatchSignal signal, double score) {
            this.region = region;
            this.signal = signal;
            this.score = score;
        }
    }
}
