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

package org.regionindex.options;

import org.regionindex.compression.BlockCompressionType;
import org.regionindex.region.RegionLevel;

import javax.annotation.Nullable;

import java.io.Serializable;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;

import static org.regionindex.options.ConfigOptions.key;

/** 索引构建与检索的全部配置项。 */
public class RegionIndexOptions implements Serializable {

    private static final long serialVersionUID = 1L;

    // ------------------------------------------------------------------------
    //  Index
    // ------------------------------------------------------------------------

    public static final ConfigOption<Integer> NGRAM_SIZE =
            key("index.ngram.size")
                    .intType()
                    .defaultValue(2)
                    .withDescription("字符 n-gram 窗口长度,用于模糊匹配的候选预过滤。");

    public static final ConfigOption<BlockCompressionType> COMPRESSION =
            key("index.compression")
                    .enumType(BlockCompressionType.class)
                    .defaultValue(BlockCompressionType.ZSTD)
                    .withDescription("索引文件分段的压缩算法。");

    public static final ConfigOption<Integer> ZSTD_LEVEL =
            key("index.compression.zstd-level")
                    .intType()
                    .defaultValue(1)
                    .withDescription("zstd 压缩级别,级别越高压缩率越高、速度越慢。");

    // ------------------------------------------------------------------------
    //  Search
    // ------------------------------------------------------------------------

    public static final ConfigOption<Integer> DEFAULT_LIMIT =
            key("search.default-limit")
                    .intType()
                    .defaultValue(10)
                    .withDescription("请求未指定数量时返回的最大结果数。");

    public static final ConfigOption<Double> MIN_SCORE =
            key("search.min-score")
                    .doubleType()
                    .defaultValue(0.0)
                    .withDescription("低于该分数的结果被丢弃。");

    public static final ConfigOption<Integer> FULL_PINYIN_MIN_LENGTH =
            key("search.full-pinyin.min-length")
                    .intType()
                    .defaultValue(3)
                    .withDescription("被识别为全拼的最短查询长度。");

    public static final ConfigOption<Integer> SHORT_PINYIN_MAX_LENGTH =
            key("search.short-pinyin.max-length")
                    .intType()
                    .defaultValue(6)
                    .withDescription("被识别为首字母缩写的最长查询长度。");

    public static final ConfigOption<Integer> COMBO_MAX_FRAGMENTS =
            key("search.combo.max-fragments")
                    .intType()
                    .defaultValue(4)
                    .withDescription("组合拼音最多切分的片段数。");

    public static final ConfigOption<Integer> COMBO_MAX_QUERY_LENGTH =
            key("search.combo.max-query-length")
                    .intType()
                    .defaultValue(12)
                    .withDescription("按组合拼音处理的最长查询长度。");

    public static final ConfigOption<Integer> FUZZY_MAX_EDIT_DISTANCE =
            key("search.fuzzy.max-edit-distance")
                    .intType()
                    .defaultValue(2)
                    .withDescription("模糊匹配允许的最大编辑距离。");

    public static final ConfigOption<Double> FUZZY_DISTANCE_RATIO =
            key("search.fuzzy.distance-ratio")
                    .doubleType()
                    .defaultValue(0.34)
                    .withDescription(
                            "模糊匹配的编辑距离上限按查询长度的比例计算,"
                                    + "实际上限为 min(max-edit-distance, ceil(长度 × 比例))。");

    public static final ConfigOption<Integer> FUZZY_MIN_CANDIDATES =
            key("search.fuzzy.min-candidates")
                    .intType()
                    .defaultValue(5)
                    .withDescription("主策略的候选数少于该值时启用模糊匹配。");

    public static final ConfigOption<Double> WEIGHT_EXACT =
            key("search.weight.exact").doubleType().defaultValue(1.0);

    public static final ConfigOption<Double> WEIGHT_PREFIX =
            key("search.weight.prefix").doubleType().defaultValue(0.75);

    public static final ConfigOption<Double> WEIGHT_COMBO =
            key("search.weight.combo").doubleType().defaultValue(0.6);

    public static final ConfigOption<Double> WEIGHT_FUZZY =
            key("search.weight.fuzzy").doubleType().defaultValue(0.4);

    public static final ConfigOption<Double> WEIGHT_POSITION =
            key("search.weight.position")
                    .doubleType()
                    .defaultValue(0.1)
                    .withDescription("匹配位置越靠前加分越多,该值为最大加分。");

    public static final ConfigOption<Double> WEIGHT_PATH_COMPLETENESS =
            key("search.weight.path-completeness")
                    .doubleType()
                    .defaultValue(0.5)
                    .withDescription("查询覆盖区域完整路径的比例乘以该权重计入得分。");

    public static final String LEVEL_BONUS_PREFIX = "search.level-bonus.";

    public static final ConfigOption<Integer> SEARCH_PARALLELISM =
            key("search.parallelism")
                    .intType()
                    .defaultValue(1)
                    .withDescription("并行执行检索策略的线程数,1 表示在调用线程上顺序执行。");

    public static final ConfigOption<Duration> SEARCH_TIMEOUT =
            key("search.timeout")
                    .durationType()
                    .noDefaultValue()
                    .withDescription("单次检索的截止时间,超时的策略被取消,其结果被丢弃。");

    public static final ConfigOption<Long> CACHE_MAX_SIZE =
            key("search.cache.max-size")
                    .longType()
                    .defaultValue(1024L)
                    .withDescription("检索结果缓存的最大条目数,0 表示关闭缓存。");

    private final Options options;

    public RegionIndexOptions() {
        this(new Options());
    }

    public RegionIndexOptions(Map<String, String> options) {
        this(Options.fromMap(options));
    }

    public RegionIndexOptions(Options options) {
        this.options = options;
    }

    public static RegionIndexOptions fromMap(Map<String, String> options) {
        return new RegionIndexOptions(options);
    }

    public Options toConfiguration() {
        return options;
    }

    public Map<String, String> toMap() {
        return options.toMap();
    }

    /** 某一级别的得分加成配置项,键为 {@code search.level-bonus.<级别小写>}。 */
    public static ConfigOption<Double> levelBonusOption(RegionLevel level) {
        double defaultValue;
        switch (level) {
            case PROVINCE:
                defaultValue = 0.15;
                break;
            case CITY:
                defaultValue = 0.1;
                break;
            case DISTRICT:
            case COUNTY:
                defaultValue = 0.05;
                break;
            default:
                defaultValue = 0.0;
        }
        return key(LEVEL_BONUS_PREFIX + level.name().toLowerCase(Locale.ROOT))
                .doubleType()
                .defaultValue(defaultValue);
    }

    public int ngramSize() {
        return options.get(NGRAM_SIZE);
    }

    public BlockCompressionType compression() {
        return options.get(COMPRESSION);
    }

    public int zstdLevel() {
        return options.get(ZSTD_LEVEL);
    }

    public int defaultLimit() {
        return options.get(DEFAULT_LIMIT);
    }

    public double minScore() {
        return options.get(MIN_SCORE);
    }

    public int fullPinyinMinLength() {
        return options.get(FULL_PINYIN_MIN_LENGTH);
    }

    public int shortPinyinMaxLength() {
        return options.get(SHORT_PINYIN_MAX_LENGTH);
    }

    public int comboMaxFragments() {
        return options.get(COMBO_MAX_FRAGMENTS);
    }

    public int comboMaxQueryLength() {
        return options.get(COMBO_MAX_QUERY_LENGTH);
    }

    public int fuzzyMaxEditDistance() {
        return options.get(FUZZY_MAX_EDIT_DISTANCE);
    }

    public double fuzzyDistanceRatio() {
        return options.get(FUZZY_DISTANCE_RATIO);
    }

    public int fuzzyMinCandidates() {
        return options.get(FUZZY_MIN_CANDIDATES);
    }

    public double exactWeight() {
        return options.get(WEIGHT_EXACT);
    }

    public double prefixWeight() {
        return options.get(WEIGHT_PREFIX);
    }

    public double comboWeight() {
        return options.get(WEIGHT_COMBO);
    }

    public double fuzzyWeight() {
        return options.get(WEIGHT_FUZZY);
    }

    public double positionWeight() {
        return options.get(WEIGHT_POSITION);
    }

    public double pathCompletenessWeight() {
        return options.get(WEIGHT_PATH_COMPLETENESS);
    }

    public double levelBonus(RegionLevel level) {
        return options.get(levelBonusOption(level));
    }

    public int searchParallelism() {
        return options.get(SEARCH_PARALLELISM);
    }

    @Nullable
    public Duration searchTimeout() {
        return options.get(SEARCH_TIMEOUT);
    }

    public long cacheMaxSize() {
        return options.get(CACHE_MAX_SIZE);
    }
}
