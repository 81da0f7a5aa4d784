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

/** 不压缩,原样拷贝。 */
public class NoCompressionFactory implements BlockCompressionFactory {

    public static final NoCompressionFactory INSTANCE = new NoCompressionFactory();

    private static final BlockCompressor COMPRESSOR =
            new BlockCompressor() {
                @Override
                public int getMaxCompressedSize(int srcSize) {
                    return srcSize;
                }

                @Override
                public int compress(byte[] src, int srcOff, int srcLen, byte[] dst, int dstOff) {
                    if (dst.length - dstOff < srcLen) {
                        throw new BufferCompressionException("Buffer length too small");
                    }
                    System.arraycopy(src, srcOff, dst, dstOff, srcLen);
                    return srcLen;
                }
            };

    private static final BlockDecompressor DECOMPRESSOR =
            (src, srcOff, srcLen, dst, dstOff) -> {
                if (dst.length - dstOff < srcLen) {
                    throw new BufferDecompressionException("Buffer length too small");
                }
                System.arraycopy(src, srcOff, dst, dstOff, srcLen);
                return srcLen;
            };

    private NoCompressionFactory() {}

    @Override
    public BlockCompressionType getCompressionType() {
        return BlockCompressionType.NONE;
    }

    @Override
    public BlockCompressor getCompressor() {
        return COMPRESSOR;
    }

    @Override
    public BlockDecompressor getDecompressor() {
        return DECOMPRESSOR;
    }
}
