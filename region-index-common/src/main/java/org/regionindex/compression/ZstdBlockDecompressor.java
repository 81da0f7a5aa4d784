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

import com.github.luben.zstd.RecyclingBufferPool;
import com.github.luben.zstd.ZstdInputStream;

import java.io.ByteArrayInputStream;
import java.io.IOException;

import static org.regionindex.compression.CompressorUtils.HEADER_LENGTH;
import static org.regionindex.compression.CompressorUtils.checkHeader;
import static org.regionindex.compression.CompressorUtils.readIntLE;

/** {@link ZstdBlockCompressor} 对应的解压器。 */
public class ZstdBlockDecompressor implements BlockDecompressor {

    @Override
    public int decompress(byte[] src, int srcOff, int srcLen, byte[] dst, int dstOff)
            throws BufferDecompressionException {
        int originalLen = checkHeader(src, srcOff, srcLen, dst, dstOff);
        if (originalLen == 0) {
            return 0;
        }
        int compressedLen = readIntLE(src, srcOff);

        try (ZstdInputStream in =
                new ZstdInputStream(
                        new ByteArrayInputStream(src, srcOff + HEADER_LENGTH, compressedLen),
                        RecyclingBufferPool.INSTANCE)) {
            int read = 0;
            while (read < originalLen) {
                int n = in.read(dst, dstOff + read, originalLen - read);
                if (n < 0) {
                    break;
                }
                read += n;
            }
            if (read != originalLen || in.read() != -1) {
                throw new BufferDecompressionException("Input is corrupted");
            }
            return read;
        } catch (IOException e) {
            throw new BufferDecompressionException("Input is corrupted", e);
        }
    }
}
