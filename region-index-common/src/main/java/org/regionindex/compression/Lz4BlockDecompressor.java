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

import net.jpountz.lz4.LZ4Exception;
import net.jpountz.lz4.LZ4Factory;
import net.jpountz.lz4.LZ4SafeDecompressor;

import static org.regionindex.compression.CompressorUtils.HEADER_LENGTH;
import static org.regionindex.compression.CompressorUtils.checkHeader;
import static org.regionindex.compression.CompressorUtils.readIntLE;

/** LZ4 块解压器,使用带边界检查的 safe 解压实现。 */
public class Lz4BlockDecompressor implements BlockDecompressor {

    private final LZ4SafeDecompressor decompressor;

    public Lz4BlockDecompressor() {
        this.decompressor = LZ4Factory.fastestInstance().safeDecompressor();
    }

    @Override
    public int decompress(byte[] src, int srcOff, int srcLen, byte[] dst, int dstOff)
            throws BufferDecompressionException {
        int originalLen = checkHeader(src, srcOff, srcLen, dst, dstOff);
        if (originalLen == 0) {
            return 0;
        }
        int compressedLen = readIntLE(src, srcOff);

        try {
            final int originalLenByLz4 =
                    decompressor.decompress(
                            src,
                            srcOff + HEADER_LENGTH,
                            compressedLen,
                            dst,
                            dstOff,
                            originalLen);
            if (originalLen != originalLenByLz4) {
                throw new BufferDecompressionException("Input is corrupted");
            }
        } catch (LZ4Exception e) {
            throw new BufferDecompressionException("Input is corrupted", e);
        }

        return originalLen;
    }
}
