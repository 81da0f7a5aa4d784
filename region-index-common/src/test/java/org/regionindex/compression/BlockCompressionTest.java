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

package org.regionindex.compression;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.nio.charset.StandardCharsets;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Tests for {@link BlockCompressionFactory} and the block codecs it creates. */
public class BlockCompressionTest {

    private static byte[] sampleData() {
        StringBuilder builder = new StringBuilder();
        for (int i = 0; i < 500; i++) {
            builder.append("广东省>佛山市>顺德区|guangdong|foshan|shunde|").append(i % 17);
        }
        return builder.toString().getBytes(StandardCharsets.UTF_8);
    }

    @ParameterizedTest
    @EnumSource(BlockCompressionType.class)
    public void testCompressAndDecompress(BlockCompressionType type) {
        BlockCompressionFactory factory = BlockCompressionFactory.create(type, 3);
        assertThat(factory.getCompressionType()).isEqualTo(type);

        byte[] data = sampleData();
        byte[] compressed = CompressorUtils.compress(factory.getCompressor(), data);
        if (type != BlockCompressionType.NONE) {
            assertThat(compressed.length).isLessThan(data.length);
        }

        byte[] restored =
                CompressorUtils.decompress(factory.getDecompressor(), compressed, data.length);
        assertThat(restored).isEqualTo(data);
    }

    @ParameterizedTest
    @EnumSource(BlockCompressionType.class)
    public void testEmptyBlock(BlockCompressionType type) {
        BlockCompressionFactory factory = BlockCompressionFactory.create(type);
        byte[] compressed = CompressorUtils.compress(factory.getCompressor(), new byte[0]);
        assertThat(CompressorUtils.decompress(factory.getDecompressor(), compressed, 0)).isEmpty();
    }

    @ParameterizedTest
    @EnumSource(
            value = BlockCompressionType.class,
            names = {"ZSTD", "LZ4", "LZO"})
    public void testGarbageInputFails(BlockCompressionType type) {
        BlockCompressionFactory factory = BlockCompressionFactory.create(type);
        byte[] garbage = new byte[64];
        new Random(42).nextBytes(garbage);

        assertThatThrownBy(
                        () ->
                                CompressorUtils.decompress(
                                        factory.getDecompressor(), garbage, 1024))
                .isInstanceOf(BufferDecompressionException.class);
    }

    @ParameterizedTest
    @EnumSource(
            value = BlockCompressionType.class,
            names = {"ZSTD", "LZ4", "LZO"})
    public void testTruncatedInputFails(BlockCompressionType type) {
        BlockCompressionFactory factory = BlockCompressionFactory.create(type);
        byte[] data = sampleData();
        byte[] compressed = CompressorUtils.compress(factory.getCompressor(), data);
        byte[] truncated = new byte[compressed.length / 2];
        System.arraycopy(compressed, 0, truncated, 0, truncated.length);

        assertThatThrownBy(
                        () ->
                                CompressorUtils.decompress(
                                        factory.getDecompressor(), truncated, data.length))
                .isInstanceOf(BufferDecompressionException.class);
    }

    @ParameterizedTest
    @EnumSource(BlockCompressionType.class)
    public void testPersistentId(BlockCompressionType type) {
        assertThat(BlockCompressionType.getCompressionTypeByPersistentId(type.persistentId()))
                .isEqualTo(type);
    }
}
