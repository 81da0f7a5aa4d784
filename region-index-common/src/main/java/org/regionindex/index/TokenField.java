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

package org.regionindex.index;

/** 索引的词项空间。同一个区域的不同写法分别进入不同的空间,互不混淆。 */
public enum TokenField {
    /** 中文名称、去掉行政后缀的名称以及中文别名。 */
    NAME(1),
    /** 全拼、去掉后缀音节的全拼以及拉丁字母别名。 */
    PINYIN(2),
    /** 拼音首字母缩写。 */
    SHORT_PINYIN(3),
    /** 由祖先名称拼接成的完整路径。 */
    PATH(4);

    private final int id;

    TokenField(int id) {
        this.id = id;
    }

    public int id() {
        return id;
    }

    public static TokenField fromId(int id) {
        for (TokenField field : values()) {
            if (field.id == id) {
                return field;
            }
        }
        throw new IllegalArgumentException("Unknown token field id: " + id);
    }
}
