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

package org.regionindex.region;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Tests for {@link RegionRecordReader}. */
public class RegionRecordReaderTest {

    private final RegionRecordReader reader = new RegionRecordReader();

    private List<RegionRecord> read(String json) throws IOException {
        return reader.read(new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    public void testReadRecords() throws IOException {
        List<RegionRecord> records =
                read(
                        "[{\"code\":\"440000\",\"name\":\"广东省\",\"level\":\"省级\","
                                + "\"pinyin\":\"guang dong\",\"pinyin_short\":\"gd\","
                                + "\"unknown_field\":42},"
                                + "{\"id\":7,\"name\":\"佛山市\",\"level\":\"市级\","
                                + "\"parent_code\":\"440000\",\"alias\":\"禅城\","
                                + "\"short_name\":\"佛山\"}]");

        assertThat(records).hasSize(2);
        RegionRecord guangdong = records.get(0);
        assertThat(guangdong.id()).isNull();
        assertThat(guangdong.code()).isEqualTo("440000");
        assertThat(guangdong.name()).isEqualTo("广东省");
        assertThat(guangdong.level()).isEqualTo("省级");
        assertThat(guangdong.pinyin()).isEqualTo("guang dong");
        assertThat(guangdong.pinyinShort()).isEqualTo("gd");
        assertThat(guangdong.aliases()).isEmpty();

        RegionRecord foshan = records.get(1);
        assertThat(foshan.id()).isEqualTo(7);
        assertThat(foshan.parentCode()).isEqualTo("440000");
        assertThat(foshan.aliases()).containsExactly("禅城", "佛山");
    }

    @Test
    public void testWriteThenRead(@TempDir Path tempDir) throws IOException {
        List<RegionRecord> records =
                Arrays.asList(
                        RegionRecord.builder("北京市", "省级")
                                .id(0)
                                .code("110000")
                                .pinyin("beijing", "bj")
                                .build(),
                        RegionRecord.builder("朝阳区", "区县级")
                                .id(1)
                                .parentId(0)
                                .aliases("朝外")
                                .build());

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        reader.write(records, out);
        Path file = tempDir.resolve("regions.json");
        Files.write(file, out.toByteArray());

        assertThat(reader.read(file)).isEqualTo(records);
    }

    @Test
    public void testMalformedJson() {
        assertThatThrownBy(() -> read("[{\"name\": ")).isInstanceOf(IOException.class);
        assertThatThrownBy(() -> read("null"))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("null");
    }
}
