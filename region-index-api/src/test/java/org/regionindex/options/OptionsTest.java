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

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Tests for {@link Options}. */
public class OptionsTest {

    private enum Codec {
        NONE,
        ZSTD
    }

    private static final ConfigOption<Integer> SIZE =
            ConfigOptions.key("index.size").intType().defaultValue(2).withDescription("size");

    private static final ConfigOption<Double> WEIGHT =
            ConfigOptions.key("search.weight").doubleType().defaultValue(0.5);

    private static final ConfigOption<Codec> CODEC =
            ConfigOptions.key("index.codec").enumType(Codec.class).defaultValue(Codec.ZSTD);

    private static final ConfigOption<Duration> TIMEOUT =
            ConfigOptions.key("search.timeout").durationType().noDefaultValue();

    private static final ConfigOption<Long> CACHE_SIZE =
            ConfigOptions.key("search.cache.max-size").longType().defaultValue(16L);

    @Test
    public void testDefaults() {
        Options options = new Options();
        assertThat(options.get(SIZE)).isEqualTo(2);
        assertThat(options.get(WEIGHT)).isEqualTo(0.5);
        assertThat(options.get(CODEC)).isEqualTo(Codec.ZSTD);
        assertThat(options.get(TIMEOUT)).isNull();
        assertThat(options.getOptional(TIMEOUT)).isEmpty();
        assertThat(options.contains(SIZE)).isFalse();
        assertThat(SIZE.description()).isEqualTo("size");
    }

    @Test
    public void testStringValuesAreConverted() {
        Map<String, String> map = new HashMap<>();
        map.put("index.size", " 3 ");
        map.put("search.weight", "0.25");
        map.put("index.codec", "none");
        map.put("search.timeout", "250 ms");
        map.put("search.cache.max-size", "0");
        Options options = Options.fromMap(map);

        assertThat(options.get(SIZE)).isEqualTo(3);
        assertThat(options.get(WEIGHT)).isEqualTo(0.25);
        assertThat(options.get(CODEC)).isEqualTo(Codec.NONE);
        assertThat(options.get(TIMEOUT)).isEqualTo(Duration.ofMillis(250));
        assertThat(options.get(CACHE_SIZE)).isZero();
    }

    @Test
    public void testTypedSetStoresStrings() {
        Options options = new Options();
        options.set(SIZE, 4).set(TIMEOUT, Duration.ofSeconds(2)).set(CODEC, Codec.NONE);

        assertThat(options.get("index.size")).isEqualTo("4");
        assertThat(options.get("search.timeout")).isEqualTo("2 s");
        assertThat(options.get(TIMEOUT)).isEqualTo(Duration.ofSeconds(2));
        assertThat(options.toMap()).containsEntry("index.codec", "NONE");
    }

    @Test
    public void testUnparsableValue() {
        Options options = new Options();
        options.setString("index.size", "two");
        assertThatThrownBy(() -> options.get(SIZE))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("index.size");

        options.setString("index.codec", "snappy");
        assertThatThrownBy(() -> options.get(CODEC)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    public void testOptionIdentity() {
        assertThat(SIZE.withDescription("other")).isEqualTo(SIZE);
        assertThat(SIZE.hasDefaultValue()).isTrue();
        assertThat(TIMEOUT.hasDefaultValue()).isFalse();
        assertThat(ConfigOptions.key("index.size").longType().defaultValue(2L)).isNotEqualTo(SIZE);

        Options options = new Options().set(SIZE, 1);
        assertThat(Options.fromMap(options.toMap())).isEqualTo(options);
    }
}
