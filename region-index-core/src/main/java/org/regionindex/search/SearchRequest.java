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

import javax.annotation.Nullable;

import java.time.Duration;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * 不可变的检索请求。未设置的项使用引擎配置:数量上限取 {@code search.default-limit},最低分取
 * {@code search.min-score},超时取 {@code search.timeout},策略默认全部启用。
 *
 * <p>请求实现了 {@link #equals} 与 {@link #hashCode},可直接作为结果缓存的键。
 */
public final class SearchRequest {

    private final String query;
    @Nullable private final Integer limit;
    @Nullable private final Double minScore;
    private final Set<StrategyKind> strategies;
    @Nullable private final Duration timeout;

    private SearchRequest(Builder builder) {
        this.query = builder.query;
        this.limit = builder.limit;
        this.minScore = builder.minScore;
        this.strategies = Collections.unmodifiableSet(EnumSet.copyOf(builder.strategies));
        this.timeout = builder.timeout;
    }

    public static SearchRequest of(String query) {
        return builder(query).build();
    }

    public static Builder builder(String query) {
        return new Builder(query);
    }

    public String query() {
        return query;
    }

    @Nullable
    public Integer limit() {
        return limit;
    }

    @Nullable
    public Double minScore() {
        return minScore;
    }

    public Set<StrategyKind> strategies() {
        return strategies;
    }

    @Nullable
    public Duration timeout() {
        return timeout;
    }

    /** 相同条件下换一个查询文本。 */
    SearchRequest withQuery(String newQuery) {
        Builder builder = new Builder(newQuery).strategies(strategies);
        builder.limit = limit;
        builder.minScore = minScore;
        builder.timeout = timeout;
        return builder.build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        SearchRequest that = (SearchRequest) o;
        return Objects.equals(query, that.query)
                && Objects.equals(limit, that.limit)
                && Objects.equals(minScore, that.minScore)
                && strategies.equals(that.strategies)
                && Objects.equals(timeout, that.timeout);
    }

    @Override
    public int hashCode() {
        return Objects.hash(query, limit, minScore, strategies, timeout);
    }

    @Override
    public String toString() {
        return "SearchRequest{"
                + "query='"
                + query
                + '\''
                + ", limit="
                + limit
                + ", minScore="
                + minScore
                + ", strategies="
                + strategies
                + ", timeout="
                + timeout
                + '}';
    }

    /** {@link SearchRequest} 的构建器。参数合法性在检索时校验。 */
    public static final class Builder {

        private final String query;
        @Nullable private Integer limit;
        @Nullable private Double minScore;
        private Set<StrategyKind> strategies = EnumSet.allOf(StrategyKind.class);
        @Nullable private Duration timeout;

        private Builder(String query) {
            this.query = query;
        }

        public Builder limit(int limit) {
            this.limit = limit;
            return this;
        }

        public Builder minScore(double minScore) {
            this.minScore = minScore;
            return this;
        }

        /** 只启用给定的策略。 */
        public Builder strategies(Collection<StrategyKind> strategies) {
            this.strategies =
                    strategies.isEmpty()
                            ? EnumSet.noneOf(StrategyKind.class)
                            : EnumSet.copyOf(strategies);
            return this;
        }

        public Builder strategies(StrategyKind first, StrategyKind... rest) {
            this.strategies = EnumSet.of(first, rest);
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public SearchRequest build() {
            return new SearchRequest(this);
        }
    }
}
