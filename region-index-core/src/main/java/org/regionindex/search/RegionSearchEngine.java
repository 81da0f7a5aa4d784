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

import org.regionindex.annotation.VisibleForTesting;
import org.regionindex.bitmap.BitmapIndex;
import org.regionindex.index.RegionIndex;
import org.regionindex.options.RegionIndexOptions;
import org.regionindex.region.Region;
import org.regionindex.region.RegionLevel;
import org.regionindex.storage.RegionIndexStorage;
import org.regionindex.utils.ThreadPoolUtils;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import javax.annotation.concurrent.ThreadSafe;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

import static org.regionindex.utils.Preconditions.checkNotNull;

/**
 * 区域检索引擎。
 *
 * <p>一次检索依次完成:规范化并分类查询,按分类执行主策略,候选不足
 * {@code search.fuzzy.min-candidates} 时追加模糊匹配,最后合并打分并截断。
 *
 * <p>引擎持有一个不可变的状态(索引加结果缓存),{@link #reload} 原子地替换它,加载失败时旧状态保持
 * 不变。正在执行的检索总是完整地使用检索开始时的状态。{@code search.parallelism} 大于 1 时主策略
 * 在守护线程池中并行执行;设置了截止时间时,超时的策略被取消,其结果被丢弃,这样的部分结果不进入
 * 缓存。
 */
@ThreadSafe
public class RegionSearchEngine implements Closeable {

    private static final Logger LOG = LoggerFactory.getLogger(RegionSearchEngine.class);

    private static final Duration SHUTDOWN_TIMEOUT = Duration.ofSeconds(5);

    private static final String THREAD_NAME_PREFIX = "region-search";

    private final RegionIndexOptions options;
    private final RegionIndexStorage storage;
    private final QueryClassifier classifier;
    private final RegionScorer scorer;
    private final Map<StrategyKind, SearchStrategy> strategies;
    private final AtomicReference<EngineState> state;

    @Nullable private final ThreadPoolExecutor executor;

    public RegionSearchEngine(RegionIndex index) {
        this(index, new RegionIndexOptions());
    }

    public RegionSearchEngine(RegionIndex index, RegionIndexOptions options) {
        this.options = checkNotNull(options);
        this.storage = new RegionIndexStorage(options);
        this.classifier = new QueryClassifier(options);
        this.scorer = new RegionScorer(options);
        this.strategies = createStrategies(options);
        this.state = new AtomicReference<>(new EngineState(checkNotNull(index), options));
        int parallelism = options.searchParallelism();
        this.executor =
                parallelism > 1
                        ? ThreadPoolUtils.createCachedThreadPool(parallelism, THREAD_NAME_PREFIX)
                        : null;
    }

    /** 加载索引文件并创建引擎。 */
    public static RegionSearchEngine open(Path path, RegionIndexOptions options)
            throws IOException {
        RegionIndex index = new RegionIndexStorage(options).load(path);
        return new RegionSearchEngine(index, options);
    }

    private static Map<StrategyKind, SearchStrategy> createStrategies(
            RegionIndexOptions options) {
        Map<StrategyKind, SearchStrategy> strategies = new EnumMap<>(StrategyKind.class);
        strategies.put(StrategyKind.EXACT, new ExactStrategy());
        strategies.put(StrategyKind.PREFIX, new PrefixStrategy());
        strategies.put(StrategyKind.PATH, new PathStrategy());
        strategies.put(StrategyKind.COMBO, new ComboStrategy(options));
        strategies.put(StrategyKind.FUZZY, new FuzzyStrategy(options));
        return strategies;
    }

    // ------------------------------------------------------------------------
    //  Search
    // ------------------------------------------------------------------------

    public List<SearchResult> search(String query) {
        return search(SearchRequest.of(query));
    }

    /**
     * 执行检索。
     *
     * @throws InvalidQueryException 查询为空或数量上限不是正数时抛出
     */
    public List<SearchResult> search(SearchRequest request) {
        checkNotNull(request, "request");
        if (request.query() == null || request.query().trim().isEmpty()) {
            throw new InvalidQueryException("Query must not be null or blank.");
        }
        int limit = request.limit() == null ? options.defaultLimit() : request.limit();
        if (limit <= 0) {
            throw new InvalidQueryException("Limit must be positive, but is " + limit + ".");
        }
        double minScore = request.minScore() == null ? options.minScore() : request.minScore();

        String normalized = QueryClassifier.normalize(request.query());
        SearchRequest key = request.withQuery(normalized);
        EngineState current = state.get();
        if (current.cache != null) {
            List<SearchResult> cached = current.cache.getIfPresent(key);
            if (cached != null) {
                return cached;
            }
        }

        RegionIndex index = current.index;
        ParsedQuery parsed = classifier.parse(normalized, index);
        LOG.debug("Query '{}' classified as {}.", normalized, parsed.type());

        Duration timeout = request.timeout() == null ? options.searchTimeout() : request.timeout();
        long deadline = timeout == null ? Long.MAX_VALUE : System.nanoTime() + timeout.toNanos();

        List<SearchStrategy> toRun = new ArrayList<>();
        for (StrategyKind kind : parsed.type().primaryStrategies()) {
            if (request.strategies().contains(kind)) {
                toRun.add(strategies.get(kind));
            }
        }

        Execution execution = execute(toRun, parsed, index, deadline);
        if (request.strategies().contains(StrategyKind.FUZZY)
                && countCandidates(execution.signals) < options.fuzzyMinCandidates()) {
            execution.merge(
                    execute(
                            Collections.singletonList(strategies.get(StrategyKind.FUZZY)),
                            parsed,
                            index,
                            deadline));
        }

        List<SearchResult> results =
                Collections.unmodifiableList(
                        scorer.rank(execution.signals, index, limit, minScore));
        if (current.cache != null && !execution.timedOut) {
            current.cache.put(key, results);
        }
        return results;
    }

    /** 对查询分类,不执行检索。 */
    public QueryType classify(String query) {
        if (query == null || query.trim().isEmpty()) {
            throw new InvalidQueryException("Query must not be null or blank.");
        }
        return classifier.classify(query, state.get().index);
    }

    /**
     * 执行给定策略。有线程池时,多个策略或带截止时间的单个策略都提交到线程池,超时的策略被取消,
     * 其结果丢弃;否则在调用线程上依次执行,截止时间只在两个策略之间检查。
     */
    @VisibleForTesting
    Execution execute(
            List<SearchStrategy> toRun, ParsedQuery query, RegionIndex index, long deadline) {
        Execution execution = new Execution();
        if (executor == null || (toRun.size() <= 1 && deadline == Long.MAX_VALUE)) {
            for (SearchStrategy strategy : toRun) {
                if (System.nanoTime() >= deadline) {
                    LOG.warn(
                            "Deadline passed before strategy {} ran for query '{}', skipping it.",
                            strategy.kind(),
                            query.normalized());
                    execution.timedOut = true;
                    continue;
                }
                execution.signals.addAll(run(strategy, query, index));
            }
            return execution;
        }

        Map<SearchStrategy, Future<List<MatchSignal>>> futures = new LinkedHashMap<>();
        for (SearchStrategy strategy : toRun) {
            futures.put(strategy, executor.submit(() -> run(strategy, query, index)));
        }
        for (Map.Entry<SearchStrategy, Future<List<MatchSignal>>> entry : futures.entrySet()) {
            Future<List<MatchSignal>> future = entry.getValue();
            try {
                if (deadline == Long.MAX_VALUE) {
                    execution.signals.addAll(future.get());
                } else {
                    long remaining = Math.max(0, deadline - System.nanoTime());
                    execution.signals.addAll(future.get(remaining, TimeUnit.NANOSECONDS));
                }
            } catch (TimeoutException e) {
                future.cancel(true);
                execution.timedOut = true;
                LOG.warn(
                        "Strategy {} timed out for query '{}', discarding its results.",
                        entry.getKey().kind(),
                        query.normalized());
            } catch (InterruptedException e) {
                futures.values().forEach(f -> f.cancel(true));
                Thread.currentThread().interrupt();
                throw new RuntimeException("Interrupted while searching.", e);
            } catch (ExecutionException e) {
                futures.values().forEach(f -> f.cancel(true));
                Throwable cause = e.getCause();
                if (cause instanceof RuntimeException) {
                    throw (RuntimeException) cause;
                }
                if (cause instanceof Error) {
                    throw (Error) cause;
                }
                throw new RuntimeException(cause);
            }
        }
        return execution;
    }

    private static List<MatchSignal> run(
            SearchStrategy strategy, ParsedQuery query, RegionIndex index) {
        long start = System.nanoTime();
        List<MatchSignal> signals = strategy.search(query, index);
        if (LOG.isDebugEnabled()) {
            LOG.debug(
                    "Strategy {} produced {} signals in {} us.",
                    strategy.kind(),
                    signals.size(),
                    (System.nanoTime() - start) / 1000);
        }
        return signals;
    }

    private static int countCandidates(List<MatchSignal> signals) {
        BitmapIndex ids = new BitmapIndex();
        for (MatchSignal signal : signals) {
            ids.add(signal.regionId());
        }
        return ids.cardinality();
    }

    // ------------------------------------------------------------------------
    //  Lookups
    // ------------------------------------------------------------------------

    public Optional<Region> findByCode(String code) {
        return state.get().index.regionByCode(code);
    }

    public Region region(int id) {
        return state.get().index.region(id);
    }

    public List<Region> children(int id) {
        return state.get().index.children(id);
    }

    public List<Region> regionsByLevel(RegionLevel level) {
        RegionIndex index = state.get().index;
        List<Region> regions = new ArrayList<>();
        index.regionsByLevel(level).forEach(id -> regions.add(index.region(id)));
        return regions;
    }

    /** 当前服务中的索引。 */
    public RegionIndex index() {
        return state.get().index;
    }

    // ------------------------------------------------------------------------
    //  Reload
    // ------------------------------------------------------------------------

    /**
     * 从文件重新加载索引并原子替换。加载失败时抛出异常,当前索引继续服务。
     */
    public void reload(Path path) throws IOException {
        RegionIndex index;
        try {
            index = storage.load(path);
        } catch (IOException | RuntimeException e) {
            LOG.warn("Failed to reload region index from {}, keeping the current one.", path, e);
            throw e;
        }
        reload(index);
    }

    public void reload(RegionIndex index) {
        state.set(new EngineState(checkNotNull(index), options));
        LOG.info("Switched to region index with {} regions.", index.regionCount());
    }

    @Override
    public void close() {
        if (executor != null) {
            ThreadPoolUtils.shutdownGracefully(executor, SHUTDOWN_TIMEOUT);
        }
    }

    // ------------------------------------------------------------------------

    /** 索引与其结果缓存,一起替换。 */
    private static final class EngineState {

        private final RegionIndex index;

        @Nullable private final Cache<SearchRequest, List<SearchResult>> cache;

        private EngineState(RegionIndex index, RegionIndexOptions options) {
            this.index = index;
            long maxSize = options.cacheMaxSize();
            if (maxSize > 0) {
                this.cache =
                        Caffeine.newBuilder()
                                .maximumSize(maxSize)
                                .executor(Runnable::run)
                                .build();
            } else {
                this.cache = null;
            }
        }
    }

    static final class Execution {

        private final List<MatchSignal> signals = new ArrayList<>();

        private boolean timedOut;

        List<MatchSignal> signals() {
            return signals;
        }

        boolean timedOut() {
            return timedOut;
        }

        private void merge(Execution other) {
            signals.addAll(other.signals);
            timedOut |= other.timedOut;
        }
    }
}
