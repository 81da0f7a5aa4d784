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
import org.regionindex.region.Region;
import org.regionindex.region.RegionLevel;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** 一条检索结果,携带区域快照、得分、匹配方式和各级祖先(含自身)。 */
public final class SearchResult {

    private final Region region;
    private final double score;
    private final MatchType matchType;
    private final StrategyKind strategy;
    private final double completeness;
    private final Map<RegionLevel, Region> hierarchy;

    public SearchResult(
            Region region,
            double score,
            MatchType matchType,
            StrategyKind strategy,
            double completeness,
            Map<RegionLevel, Region> hierarchy) {
        this.region = region;
        this.score = score;
        this.matchType = matchType;
        this.strategy = strategy;
        this.completeness = completeness;
        this.hierarchy = Collections.unmodifiableMap(new EnumMap<>(hierarchy));
    }

    static SearchResult create(RegionIndex index, Region region, MatchSignal signal, double score) {
        Map<RegionLevel, Region> hierarchy = new EnumMap<>(RegionLevel.class);
        for (int id : region.pathIds()) {
            Region ancestor = index.region(id);
            hierarchy.put(ancestor.level(), ancestor);
        }
        return new SearchResult(
                region,
                score,
                signal.matchType(),
                signal.strategy(),
                signal.completeness(),
                hierarchy);
    }

    public Region region() {
        return region;
    }

    public double score() {
        return score;
    }

    public MatchType matchType() {
        return matchType;
    }

    public StrategyKind strategy() {
        return strategy;
    }

    public List<String> path() {
        return region.path();
    }

    /** 如 {@code 广东省 > 佛山市}。 */
    public String displayPath() {
        return region.displayPath();
    }

    public RegionLevel level() {
        return region.level();
    }

    /** 查询覆盖完整路径的比例。 */
    public double completeness() {
        return completeness;
    }

    public Map<RegionLevel, Region> hierarchy() {
        return hierarchy;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        SearchResult that = (SearchResult) o;
        return Double.compare(that.score, score) == 0
                && Double.compare(that.completeness, completeness) == 0
                && region.equals(that.region)
                && matchType == that.matchType
                && strategy == that.strategy;
    }

    @Override
    public int hashCode() {
        return Objects.hash(region, score, matchType, strategy, completeness);
    }

    @Override
    public String toString() {
        return String.format(
                "SearchResult{%s (%s), score=%.4f, %s/%s}",
                region.name(), displayPath(), score, matchType, strategy);
    }
}
