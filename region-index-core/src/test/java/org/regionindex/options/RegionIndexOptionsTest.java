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

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Tests for {@link RegionIndexOptions}. */
public class RegionIndexOptionsTest {

    @Test
    public void testDefaults() {
        RegionIndexOptions options = new RegionIndexOptions();

        assertThat(options.ngramSize()).isEqualTo(2);
        assertThat(options.compression()).isEqualTo(BlockCompressionType.ZSTD);
        assertThat(options.defaultLimit()).isEqualTo(10);
        assertThat(options.comboMaxFragments()).isEqualTo(4);
        assertThat(options.searchParallelism()).isEqualTo(1);
        assertThat(options.searchTimeout()).isNull();
        assertThat(options.cacheMaxSize()).isEqualTo(1024L);
        assertThat(options.exactWeight()).isGreaterThan(options.prefixWeight());
        assertThat(options.prefixWeight()).isGreaterThan(options.comboWeight());
        assertThat(options.comboWeight()).isGreaterThan(options.fuzzyWeight());
    }

    @Test
    public void testLevelBonus() {
        RegionIndexOptions options = new RegionIndexOptions();
        assertThat(options.levelBonus(RegionLevel.PROVINCE))
                .isGreaterThan(options.levelBonus(RegionLevel.CITY));
        assertThat(options.levelBonus(RegionLevel.CITY))
                .isGreaterThan(options.levelBonus(RegionLevel.DISTRICT));
        assertThat(options.levelBonus(RegionLevel.VILLAGE)).isEqualTo(0.0);

        Map<String, String> map = new HashMap<>();
        map.put("search.level-bonus.village", "0.3");
        assertThat(RegionIndexOptions.fromMap(map).levelBonus(RegionLevel.VILLAGE))
                .isEqualTo(0.3);
    }

    @Test
    public void testFromMap() {
        Map<String, String> map = new HashMap<>();
        map.put("index.compression", "lz4");
        map.put("index.ngram.size", "3");
        map.put("search.timeout", "200 ms");
        map.put("search.cache.max-size", "0");

        RegionIndexOptions options = new RegionIndexOptions(map);

        assertThat(options.compression()).isEqualTo(BlockCompressionType.LZ4);
        assertThat(options.ngramSize()).isEqualTo(3);
        assertThat(options.searchTimeout()).isEqualTo(Duration.ofMillis(200));
        assertThat(options.cacheMaxSize()).isZero();
        assertThat(options.toMap()).containsEntry("index.ngram.size", "3");
    }

    @Test
    public void testTypedSet() {
        Options conf = new Options();
        conf.set(RegionIndexOptions.SEARCH_PARALLELISM, 4)
                .set(RegionIndexOptions.COMPRESSION, BlockCompressionType.NONE);

        RegionIndexOptions options = new RegionIndexOptions(conf);

        assertThat(options.searchParallelism()).isEqualTo(4);
        assertThat(options.compression()).isEqualTo(BlockCompressionType.NONE);
        assertThat(options.toConfiguration()).isSameAs(conf);
    }

    @Test
    public void testInvalidValue() {
        Map<String, String> map = new HashMap<>();
        map.put("index.compression", "brotli");

        assertThatThrownBy(() -> new RegionIndexOptions(map).compression())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("index.compression");
    }
}
