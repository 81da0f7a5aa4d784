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

package org.regionindex.storage;

import org.regionindex.compression.BlockCompressionFactory;
import org.regionindex.compression.BlockCompressionType;
import org.regionindex.format.CorruptIndexException;
import org.regionindex.format.IndexDecompressionException;
import org.regionindex.format.IndexFormatVersionException;
import org.regionindex.format.IndexLoadException;
import org.regionindex.format.RegionIndexFormat;
import org.regionindex.format.SectionKind;
import org.regionindex.index.RegionIndex;
import org.regionindex.index.TokenField;
import org.regionindex.options.Options;
import org.regionindex.options.RegionIndexOptions;
import org.regionindex.search.RegionSearchEngine;
import org.regionindex.search.SearchResult;
import org.regionindex.testutils.TestRegions;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Tests for {@link RegionIndexStorage}. */
public class RegionIndexStorageTest {

    private static final List<String> QUERIES =
            Arrays.asList(
                    "广东", "佛山市", "广东省>佛山市", "广东省佛山市", "foshan", "guang", "gdfs",
                    "bj", "fozan", "福");

    private static RegionIndexOptions options(BlockCompressionType compression) {
        return new RegionIndexOptions(
                new Options().set(RegionIndexOptions.COMPRESSION, compression));
    }

    @ParameterizedTest
    @EnumSource(BlockCompressionType.class)
    public void testSaveThenLoadAnswersIdentically(
            BlockCompressionType compression, @TempDir Path tempDir) throws IOException {
        RegionIndexOptions options = options(compression);
        RegionIndex index = TestRegions.build(options);
        RegionIndexStorage storage = new RegionIndexStorage(options);
        Path file = tempDir.resolve("regions.ridx");

        long length = storage.save(index, file);
        assertThat(Files.size(file)).isEqualTo(length);

        RegionIndex loaded = storage.load(file);
        assertThat(new ArrayList<>(loaded.regions())).isEqualTo(new ArrayList<>(index.regions()));
        assertThat(loaded.metadata()).isEqualTo(index.metadata());
        for (TokenField field : TokenField.values()) {
            assertThat(loaded.inverted(field).postings())
                    .isEqualTo(index.inverted(field).postings());
        }

        try (RegionSearchEngine before = new RegionSearchEngine(index, options);
                RegionSearchEngine after = new RegionSearchEngine(loaded, options)) {
            for (String query : QUERIES) {
                assertThat(summarize(after.search(query)))
                        .as("results of '%s'", query)
                        .isEqualTo(summarize(before.search(query)));
            }
        }
    }

    @Test
    public void testEveryFlippedByteIsDetected() throws IOException {
        RegionIndexStorage storage = new RegionIndexStorage();
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        storage.write(TestRegions.build(), out);
        byte[] bytes = out.toByteArray();

        // bytes 4..7 hold the version and are checked before the checksum
        for (int i = 8; i < bytes.length; i++) {
            byte[] copy = bytes.clone();
            copy[i] ^= 0x5A;
            assertThatThrownBy(() -> storage.read(copy))
                    .as("flipped byte %s", i)
                    .isInstanceOf(CorruptIndexException.class);
        }
    }

    @Test
    public void testUnsupportedVersion() throws IOException {
        RegionIndexStorage storage = new RegionIndexStorage();
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        storage.write(TestRegions.build(), out);
        byte[] bytes = out.toByteArray();
        ByteBuffer.wrap(bytes).putInt(4, 7);

        assertThatThrownBy(() -> storage.read(bytes))
                .isInstanceOf(IndexFormatVersionException.class);
    }

    @Test
    public void testMalformedCompressedSection() throws IOException {
        byte[] garbage = new byte[64];
        Arrays.fill(garbage, (byte) 0x7F);
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        RegionIndexFormat.createWriter(BlockCompressionFactory.create(BlockCompressionType.ZSTD))
                .addEncodedSection(SectionKind.REGION_TABLE, garbage, 128)
                .writeTo(out);

        assertThatThrownBy(() -> new RegionIndexStorage().read(out.toByteArray()))
                .isInstanceOf(IndexDecompressionException.class);
    }

    @Test
    public void testMissingSection() throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        RegionIndexFormat.createWriter(BlockCompressionFactory.create(BlockCompressionType.NONE))
                .addSection(SectionKind.REGION_TABLE, new byte[] {0, 0, 0, 0})
                .writeTo(out);

        assertThatThrownBy(() -> new RegionIndexStorage().read(out.toByteArray()))
                .isInstanceOf(CorruptIndexException.class)
                .hasMessageContaining("TRIE");
    }

    @Test
    public void testMalformedSectionContent() throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        RegionIndexFormat.createWriter(BlockCompressionFactory.create(BlockCompressionType.NONE))
                .addSection(SectionKind.REGION_TABLE, new byte[] {0, 0, 0, 5, 1})
                .writeTo(out);

        assertThatThrownBy(() -> new RegionIndexStorage().read(out.toByteArray()))
                .isInstanceOf(CorruptIndexException.class);
    }

    @Test
    public void testLoadFromStream() throws IOException {
        RegionIndexStorage storage = new RegionIndexStorage();
        RegionIndex index = TestRegions.build();
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        storage.write(index, out);

        RegionIndex loaded = storage.read(new ByteArrayInputStream(out.toByteArray()));

        assertThat(loaded.regionCount()).isEqualTo(index.regionCount());
    }

    @Test
    public void testSaveReplacesAtomically(@TempDir Path tempDir) throws IOException {
        RegionIndexStorage storage = new RegionIndexStorage();
        Path file = tempDir.resolve("nested").resolve("regions.ridx");

        storage.save(TestRegions.build(), file);
        storage.save(TestRegions.build(), file);

        try (Stream<Path> files = Files.list(file.getParent())) {
            assertThat(files.map(p -> p.getFileName().toString()).collect(Collectors.toList()))
                    .containsExactly("regions.ridx");
        }
        assertThat(storage.load(file).regionCount()).isEqualTo(9);
    }

    @Test
    public void testLoadMissingOrTruncatedFile(@TempDir Path tempDir) throws IOException {
        RegionIndexStorage storage = new RegionIndexStorage();
        assertThatThrownBy(() -> storage.load(tempDir.resolve("missing.ridx")))
                .isInstanceOf(NoSuchFileException.class);

        Path file = tempDir.resolve("regions.ridx");
        storage.save(TestRegions.build(), file);
        byte[] bytes = Files.readAllBytes(file);
        Files.write(file, Arrays.copyOf(bytes, bytes.length / 2));

        assertThatThrownBy(() -> storage.load(file)).isInstanceOf(IndexLoadException.class);
    }

    private static List<String> summarize(List<SearchResult> results) {
        return results.stream()
                .map(r -> r.region().id() + ":" + r.score())
                .collect(Collectors.toList());
    }
}
