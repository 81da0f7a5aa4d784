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

package org.regionindex.format;

/** RIDX 文件中的分段类型,{@link #id()} 会写入分段表。 */
public enum SectionKind {
    REGION_TABLE(1),
    TRIE(2),
    INVERTED_INDEX(3),
    NGRAM_INDEX(4),
    BUILD_METADATA(5);

    private final int id;

    SectionKind(int id) {
        this.id = id;
    }

    public int id() {
        return id;
    }

    /** 未知 id 返回 null。 */
    public static SectionKind fromId(int id) {
        for (SectionKind kind : values()) {
            if (kind.id == id) {
                return kind;
            }
        }
        return null;
    }
}
