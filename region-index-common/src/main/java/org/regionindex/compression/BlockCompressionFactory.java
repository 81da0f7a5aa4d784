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

import io.airlift.compress.lzo.LzoCompressor;
import io.airlift.compress.lzo.LzoDecompressor;

/** 创建 {@link BlockCompressor} 与 {@link BlockDecompressor} 的工厂。 */
public interface BlockCompressionFactory {

    BlockCompressionType getCompressionType();

    BlockCompressor getCompressor();

    BlockDecompressor getDecompressor();

    /**
     * 根据压缩类型创建工厂。
     *
     * @param compression 压缩类型
     * @param zstdLevel zstd 压缩级别,其它算法忽略
     */
    static BlockCompressionFactory create(BlockCompressionType compression, int zstdLevel) {
        switch (compression) {
            case NONE:
                return NoCompressionFactory.INSTANCE;
            case ZSTD:
                return new ZstdBlockCompressionFactory(zstdLevel);
            case LZ4:
                return new Lz4BlockCompressionFactory();
            case LZO:
                return new AirCompressorFactory(
                        BlockCompressionType.LZO, new LzoCompressor(), new LzoDecompressor());
            default:
                throw new IllegalStateException("Unknown CompressionMethod " + compression);
        }
    }

    static BlockCompressionFactory create(BlockCompressionType compression) {
        return create(compression, ZstdBlockCompressionFactory.DEFAULT_LEVEL);
    }
}
