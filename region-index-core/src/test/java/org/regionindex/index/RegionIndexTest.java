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

package org.regionindex.index;

import org.regionindex.bitmap.RegionIdOutOfRangeException;
import org.regionindex.region.Region;
import org.regionindex.region.RegionLevel;
import org.regionindex.testutils.TestRegions;

import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Tests for {@link RegionIndex}. */
public class RegionIndexTest {

    @Test
    public void testLookups() {
        RegionIndex index = TestRegions.build();

        assertThat(index.contains(TestRegions.FUZHOU)).isTrue();
        assertThat(index.contains(100)).isFalse();
        assertThat(index.findRegion(100)).isNull();
        assertThat(index.regionByCode("000000")).isEmpty();
        assertThat(index.children(TestRegions.BEIJING))
                .extracting(Region::name)
                .containsExactly("朝阳区");
        assertThat(index.regionsByLevel(RegionLevel.PROVINCE).toArray())
                .containsExactly(TestRegions.GUANGDONG, TestRegions.BEIJING, TestRegions.FUJIAN);
        assertThat(index.regionsByLevel(RegionLevel.VILLAGE).isEmpty()).isTrue();
        assertThat(index.allIds().cardinality()).isEqualTo(9);
    }

    @Test
    public void testUnknownIdAccess() {
        RegionIndex index = TestRegions.build();

        assertThatThrownBy(() -> index.region(100))
                .isInstanceOf(RegionIdOutOfRangeException.class);
        assertThatThrownBy(() -> index.region(-1))
                .isInstanceOf(RegionIdOutOfRangeException.class);
    }

    @Test
    public void testStructuresAreFrozen() {
        RegionIndex index = TestRegions.build();

        assertThatThrownBy(() -> index.trie(TokenField.NAME).insert("新区", 1))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> index.inverted(TokenField.PINYIN).insert("xin", 1))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    public void testEveryIndexedIdExists() {
        RegionIndex index = TestRegions.build();
        index.verifyConsistency();

        for (InvertedIndex inverted : index.invertedIndexes().values()) {
            inverted.postings()
                    .values()
                    .forEach(ids -> ids.forEach(id -> assertThat(index.contains(id)).isTrue()));
        }
    }

    @Test
    public void testInconsistentIndexIsRejected() {
        RegionIndex built = TestRegions.build();
        Map<TokenField, InvertedIndex> inverted = new EnumMap<>(TokenField.class);
        inverted.putAll(built.invertedIndexes());
        InvertedIndex names = new InvertedIndex();
        names.insert("鬼城", 99);
        inverted.put(TokenField.NAME, names);

        RegionIndex broken =
                new RegionIndex(
                        built.regions(),
                        built.tries(),
                        inverted,
                        built.ngramIndexes(),
                        built.metadata());

        assertThatThrownBy(broken::verifyConsistency)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("鬼城");
    }

    @Test
    public void testMissingStructureIsRejected() {
        RegionIndex built = TestRegions.build();
        RegionIndex broken =
                new RegionIndex(
                        built.regions(),
                        Collections.emptyMap(),
                        built.invertedIndexes(),
                        built.ngramIndexes(),
                        built.metadata());

        assertThatThrownBy(broken::verifyConsistency)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Missing trie");
    }
}
