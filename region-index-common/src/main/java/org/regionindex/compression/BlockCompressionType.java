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

/**
 * 索引分段使用的块压缩算法。
 *
 * <p>{@link #persistentId()} 会写入 RIDX 文件头,一经发布不可修改。
 */
public enum BlockCompressionType {
    NONE(0),
    ZSTD(1),
    LZ4(2),
    LZO(3);

    private final int persistentId;

    BlockCompressionType(int persistentId) {
        this.persistentId = persistentId;
    }

    public int persistentId() {
        return persistentId;
    }

    public static BlockCompressionType getCompressionTypeByPersistentId(int persistentId) {
        for (BlockCompressionType type : values()) {
            if (type.persistentId == persistentId) {
                return type;
            }
        }

        throw new IllegalArgumentException("Unknown compression persistentId " + persistentId);
    }
}
