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

import java.util.Objects;

import static org.regionindex.utils.Preconditions.checkNotNull;

/**
 * 一个策略对一个区域给出的匹配证据。
 *
 * <p>{@code quality} 与 {@code completeness} 取值在 [0, 1]。{@code completeness} 是层级路径中被命中的
 * 比例,只有路径与组合拼音策略给出,其它策略为 0。{@code position} 为查询在匹配词项中的起始位置,
 * {@code span} 为该词项长度,二者用于计算位置得分。
 */
public final class MatchSignal {

    private final int regionId;
    private final MatchType matchType;
    private final StrategyKind strategy;
    private final double quality;
    private final int position;
    private final int span;
    private final double completeness;

    public MatchSignal(
            int regionId,
            MatchType matchType,
            StrategyKind strategy,
            double quality,
            int position,
            int span,
            double completeness) {
        this.regionId = regionId;
        this.matchType = checkNotNull(matchType);
        this.strategy = checkNotNull(strategy);
        this.quality = clamp(quality);
        this.position = Math.max(0, position);
        this.span = Math.max(0, span);
        this.completeness = clamp(completeness);
    }

    public static MatchSignal exact(int regionId, StrategyKind strategy) {
        return new MatchSignal(regionId, MatchType.EXACT, strategy, 1.0, 0, 0, 0.0);
    }

    public int regionId() {
        return regionId;
    }

    public MatchType matchType() {
        return matchType;
    }

    public StrategyKind strategy() {
        return strategy;
    }

    public double quality() {
        return quality;
    }

    public int position() {
        return position;
    }

    public int span() {
        return span;
    }

    public double completeness() {
        return completeness;
    }

    /** 位置因子 {@code 1 - position / span},span 为 0 时视为从头匹配。 */
    public double positionFactor() {
        return span == 0 ? 1.0 : Math.max(0.0, 1.0 - (double) position / span);
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        MatchSignal that = (MatchSignal) o;
        return regionId == that.regionId
                && Double.compare(that.quality, quality) == 0
                && position == that.position
                && span == that.span
                && Double.compare(that.completeness, completeness) == 0
                && matchType == that.matchType
                && strategy == that.strategy;
    }

    @Override
    public int hashCode() {
        return Objects.hash(regionId, matchType, strategy, quality, position, span, completeness);
    }

    @Override
    public String toString() {
        return "MatchSignal{"
                + "regionId="
                + regionId
                + ", matchType="
                + matchType
                + ", strategy="
                + strategy
                + ", quality="
                + quality
                + ", completeness="
                + completeness
                + '}';
    }
}
