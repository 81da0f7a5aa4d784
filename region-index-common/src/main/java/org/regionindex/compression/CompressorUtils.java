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

import java.util.Arrays;

/**
 * 块压缩的公共工具。
 *
 * <p>除 {@link BlockCompressionType#NONE} 以外,每个压缩块前都有 8 字节块头:
 *
 * <pre>
 *   压缩后长度 (int, 小端序)
 *   原始长度   (int, 小端序)
 * </pre>
 */
public class CompressorUtils {

    public static final int HEADER_LENGTH = 8;

    public static void writeIntLE(int i, byte[] buf, int offset) {
        buf[offset++] = (byte) i;
        buf[offset++] = (byte) (i >>> 8);
        buf[offset++] = (byte) (i >>> 16);
        buf[offset] = (byte) (i >>> 24);
    }

    public static int readIntLE(byte[] buf, int i) {
        return (buf[i] & 0xFF)
                | ((buf[i + 1] & 0xFF) << 8)
                | ((buf[i + 2] & 0xFF) << 16)
                | ((buf[i + 3] & 0xFF) << 24);
    }

    public static void validateLength(int compressedLen, int originalLen)
            throws BufferDecompressionException {
        if (originalLen < 0
                || compressedLen < 0
                || (originalLen == 0 && compressedLen != 0)
                || (originalLen != 0 && compressedLen == 0)) {
            throw new BufferDecompressionException("Input is corrupted, invalid length.");
        }
    }

    /** 读取并校验块头,返回块头记录的原始长度。 */
    static int checkHeader(byte[] src, int srcOff, int srcLen, byte[] dst, int dstOff) {
        if (srcLen < HEADER_LENGTH) {
            throw new BufferDecompressionException("Input is corrupted, missing block header.");
        }
        int compressedLen = readIntLE(src, srcOff);
        int originalLen = readIntLE(src, srcOff + 4);
        validateLength(compressedLen, originalLen);

        if (dst.length - dstOff < originalLen) {
            throw new BufferDecompressionException("Buffer length too small");
        }
        if (srcLen - HEADER_LENGTH < compressedLen) {
            throw new BufferDecompressionException(
                    "Source data is not integral for decompression.");
        }
        return originalLen;
    }

    /** 压缩整个数组,返回恰好等长的结果。 */
    public static byte[] compress(BlockCompressor compressor, byte[] src) {
        byte[] dst = new byte[compressor.getMaxCompressedSize(src.length)];
        int length = compressor.compress(src, 0, src.length, dst, 0);
        return length == dst.length ? dst : Arrays.copyOf(dst, length);
    }

    /**
     * 解压整个数组。
     *
     * @throws BufferDecompressionException 解压结果长度与 {@code originalLength} 不一致时抛出
     */
    public static byte[] decompress(
            BlockDecompressor decompressor, byte[] src, int originalLength) {
        if (originalLength < 0) {
            throw new BufferDecompressionException("Negative original length " + originalLength);
        }
        byte[] dst = new byte[originalLength];
        int length = decompressor.decompress(src, 0, src.length, dst, 0);
        if (length != originalLength) {
            throw new BufferDecompressionException(
                    String.format(
                            "Expected %s decompressed bytes, but got %s.",
                            originalLength, length));
        }
        return dst;
    }

    private CompressorUtils() {}
}
