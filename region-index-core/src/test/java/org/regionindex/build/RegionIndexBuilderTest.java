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

package org.regionindex.build;

import org.regionindex.index.RegionIndex;
import org.regionindex.index.TokenField;
import org.regionindex.options.RegionIndexOptions;
import org.regionindex.region.DataIntegrityException;
import org.regionindex.region.Region;
import org.regionindex.region.RegionLevel;
import org.regionindex.region.RegionRecord;
import org.regionindex.testutils.TestRegions;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.regionindex.testutils.TestRegions.FOSHAN;
import static org.regionindex.testutils.TestRegions.GUANGDONG;
import static org.regionindex.testutils.TestRegions.SHUNDE;

/** Tests for {@link RegionIndexBuilder}. */
public class RegionIndexBuilderTest {

    @Test
    public void testBuildHierarchy() {
        RegionIndex index = TestRegions.build();

        assertThat(index.regionCount()).isEqualTo(9);
        Region shunde = index.region(SHUNDE);
        assertThat(shunde.path()).containsExactly("广东省", "佛山市", "顺德区");
        assertThat(shunde.pathIds()).containsExactly(GUANGDONG, FOSHAN, SHUNDE);
        assertThat(shunde.level()).isEqualTo(RegionLevel.DISTRICT);
        assertThat(shunde.displayPath()).isEqualTo("广东省 > 佛山市 > 顺德区");
        assertThat(index.region(GUANGDONG).children()).containsExactly(1, 2, 3);
        assertThat(index.region(GUANGDONG).isRoot()).isTrue();
        assertThat(index.regionByCode("440606")).contains(shunde);

        assertThat(index.metadata().regionCount()).isEqualTo(9);
        assertThat(index.metadata().ngramSize()).isEqualTo(2);
        assertThat(index.metadata().tokenCount()).isPositive();
    }

    @Test
    public void testTokensAreIndexed() {
        RegionIndex index = TestRegions.build();

        assertThat(index.inverted(TokenField.NAME).lookup("广东").toArray())
                .containsExactly(GUANGDONG);
        assertThat(index.inverted(TokenField.PINYIN).lookup("foshan").toArray())
                .containsExactly(FOSHAN);
        assertThat(index.inverted(TokenField.SHORT_PINYIN).lookup("sd").toArray())
                .containsExactly(SHUNDE);
        assertThat(index.inverted(TokenField.PATH).lookup("广东省>佛山市>顺德区").toArray())
                .containsExactly(SHUNDE);
        assertThat(index.trie(TokenField.NAME).prefixSearch("广").toArray())
                .containsExactly(GUANGDONG, TestRegions.GUANGZHOU);
        assertThat(index.ngram(TokenField.NAME).lookup("佛山").toArray())
                .containsExactly(FOSHAN);
    }

    @Test
    public void testAssignsIdsAndResolvesParentCodes() {
        RegionIndex index =
                new RegionIndexBuilder()
                        .addRecord(RegionRecord.builder("福建省", "省级").id(1).code("35").build())
                        .addRecord(
                                RegionRecord.builder("福州市", "市级")
                                        .code("3501")
                                        .parentCode("35")
                                        .build())
                        .addRecord(
                                RegionRecord.builder("鼓楼区", "区县级")
                                        .parentCode("3501")
                                        .build())
                        .build();

        assertThat(index.region(1).name()).isEqualTo("福建省");
        assertThat(index.region(0).name()).isEqualTo("福州市");
        assertThat(index.region(0).parentId()).isEqualTo(1);
        assertThat(index.region(2).pathIds()).containsExactly(1, 0, 2);
    }

    @Test
    public void testBuildTwiceGivesSameIndex() {
        RegionIndex first = TestRegions.build();
        RegionIndex second = TestRegions.build();

        assertThat(new ArrayList<>(second.regions())).isEqualTo(new ArrayList<>(first.regions()));
        for (TokenField field : TokenField.values()) {
            assertThat(second.inverted(field).postings())
                    .isEqualTo(first.inverted(field).postings());
        }
    }

    @Test
    public void testUnknownParent() {
        List<RegionRecord> records = new ArrayList<>(TestRegions.records());
        records.add(RegionRecord.builder("南海区", "区县级").parentId(42).build());

        assertThatThrownBy(() -> new RegionIndexBuilder().addRecords(records).build())
                .isInstanceOf(DataIntegrityException.class)
                .hasMessageContaining("unknown parent id 42");

        assertThatThrownBy(
                        () ->
                                new RegionIndexBuilder()
                                        .addRecord(
                                                RegionRecord.builder("南海区", "区县级")
                                                        .parentCode("999")
                                                        .build())
                                        .build())
                .isInstanceOf(DataIntegrityException.class)
                .hasMessageContaining("unknown parent code 999");
    }

    @Test
    public void testCycle() {
        List<RegionRecord> records =
                Arrays.asList(
                        RegionRecord.builder("甲市", "市级").id(0).parentId(1).build(),
                        RegionRecord.builder("乙区", "区县级").id(1).parentId(0).build());

        assertThatThrownBy(() -> new RegionIndexBuilder().addRecords(records).build())
                .isInstanceOf(DataIntegrityException.class)
                .hasMessageContaining("cycle");

        assertThatThrownBy(
                        () ->
                                new RegionIndexBuilder()
                                        .addRecord(
                                                RegionRecord.builder("甲市", "市级")
                                                        .id(3)
                                                        .parentId(3)
                                                        .build())
                                        .build())
                .isInstanceOf(DataIntegrityException.class)
                .hasMessageContaining("cycle");
    }

    @Test
    public void testDuplicateIdAndCode() {
        assertThatThrownBy(
                        () ->
                                new RegionIndexBuilder()
                                        .addRecord(RegionRecord.builder("甲市", "市级").id(0).build())
                                        .addRecord(RegionRecord.builder("乙市", "市级").id(0).build())
                                        .build())
                .isInstanceOf(DataIntegrityException.class)
                .hasMessageContaining("Duplicate region id 0");

        assertThatThrownBy(
                        () ->
                                new RegionIndexBuilder()
                                        .addRecord(RegionRecord.builder("甲市", "市级").code("1").build())
                                        .addRecord(RegionRecord.builder("乙市", "市级").code("1").build())
                                        .build())
                .isInstanceOf(DataIntegrityException.class)
                .hasMessageContaining("Duplicate region code 1");
    }

    @Test
    public void testInvalidRecords() {
        assertThatThrownBy(
                        () ->
                                new RegionIndexBuilder()
                                        .addRecord(RegionRecord.builder(" ", "市级").build())
                                        .build())
                .isInstanceOf(DataIntegrityException.class)
                .hasMessageContaining("blank name");

        assertThatThrownBy(
                        () ->
                                new RegionIndexBuilder()
                                        .addRecord(RegionRecord.builder("甲市", "未知").build())
                                        .build())
                .isInstanceOf(DataIntegrityException.class);
    }

    @Test
    public void testBuildOnlyOnce() {
        RegionIndexBuilder builder =
                new RegionIndexBuilder(new RegionIndexOptions()).addRecords(TestRegions.records());
        builder.build();

        assertThatThrownBy(builder::build).isInstanceOf(IllegalStateException.class);
    }
}
