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

package org.regionindex.search;

import org.regionindex.build.TokenVariants;

import java.util.Collections;
import java.util.List;

/**
 * 分类后的查询。
 *
 * <p>{@link #normalized()} 是规范化后的完整查询;{@link #text()} 是去掉分隔符后的紧凑文本,
 * 供精确、前缀、组合和模糊策略使用;{@link #pieces()} 是按分隔符切开的片段,供路径策略使用。
 */
public final class ParsedQuery {

    private final String normalized;
    private final String text;
    private final List<String> pieces;
    private final QueryType type;

    ParsedQuery(String normalized, String text, List<String> pieces, QueryType type) {
        this.normalized = normalized;
        this.text = text;
        this.pieces = Collections.unmodifiableList(pieces);
        this.type = type;
    }

    public String normalized() {
        return normalized;
    }

    public String text() {
        return text;
    }

    public List<String> pieces() {
        return pieces;
    }

    public QueryType type() {
        return type;
    }

    /** 查询是否包含汉字。 */
    public boolean isCjk() {
        return TokenVariants.containsCjk(text);
    }

    @Override
    public String toString() {
        return "ParsedQuery{" + "text='" + text + "', pieces=" + pieces + ", type=" + type + '}';
    }
}
