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

/** 块压缩器。每次压缩一个完整的块,读写调用方提供的字节数组。 */
public interface BlockCompressor {

    /** 压缩 {@code srcSize} 字节可能产生的最大输出长度,包含块头。 */
    int getMaxCompressedSize(int srcSize);

    /**
     * 压缩 src 中的数据并写入 dst。
     *
     * @return 写入 dst 的字节数
     * @throws BufferCompressionException dst 空间不足或压缩失败时抛出
     */
    int compress(byte[] src, int srcOff, int srcLen, byte[] dst, int dstOff)
            throws BufferCompressionException;
}
