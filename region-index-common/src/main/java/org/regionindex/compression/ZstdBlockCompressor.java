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
import com.github.luben.zstd.Zstd;
import com.github.luben.zstd.ZstdOutputStream;

import java.io.IOException;
import java.io.OutputStream;

import static org.regionindex.compression.CompressorUtils.HEADER_LENGTH;
import static org.regionindex.compression.CompressorUtils.writeIntLE;

/** 基于 zstd-jni 流式 API 的压缩器,单线程压缩。 */
public class ZstdBlockCompressor implements BlockCompressor {

    private final int level;

    public ZstdBlockCompressor(int level) {
        this.level = level;
    }

    @Override
    public int getMaxCompressedSize(int srcSize) {
        // 流式帧比单次压缩多出帧头和块头,预留少量余量
        return HEADER_LENGTH + (int) Zstd.compressBound(srcSize) + 64;
    }

    @Override
    public int compress(byte[] src, int srcOff, int srcLen, byte[] dst, int dstOff)
            throws BufferCompressionException {
        if (srcLen == 0) {
            writeIntLE(0, dst, dstOff);
            writeIntLE(0, dst, dstOff + 4);
            return HEADER_LENGTH;
        }
        BoundedOutputStream stream = new BoundedOutputStream(dst, dstOff + HEADER_LENGTH);
        try (ZstdOutputStream zstdStream =
                new ZstdOutputStream(stream, RecyclingBufferPool.INSTANCE)) {
            zstdStream.setLevel(level);
            zstdStream.setWorkers(0);
            zstdStream.write(src, srcOff, srcLen);
        } catch (IOException e) {
            throw new BufferCompressionException(e);
        }
        int compressedLength = stream.position() - dstOff - HEADER_LENGTH;
        writeIntLE(compressedLength, dst, dstOff);
        writeIntLE(srcLen, dst, dstOff + 4);
        return HEADER_LENGTH + compressedLength;
    }

    /** 直接写入调用方数组的输出流,越界时报 IOException。 */
    private static class BoundedOutputStream extends OutputStream {

        private final byte[] buf;
        private int position;

        BoundedOutputStream(byte[] buf, int position) {
            this.buf = buf;
            this.position = position;
        }

        @Override
        public void write(int b) throws IOException {
            if (position >= buf.length) {
                throw new IOException("Buffer length too small");
            }
            buf[position] = (byte) b;
            position += 1;
        }

        @Override
        public void write(byte[] b, int off, int len) throws IOException {
            if (len == 0) {
                return;
            }
            if (buf.length - position < len) {
                throw new IOException("Buffer length too small");
            }
            System.arraycopy(b, off, buf, position, len);
            position += len;
        }

        int position() {
            return position;
        }
    }
}
