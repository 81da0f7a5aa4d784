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

import org.regionindex.bitmap.BitmapIndex;

import java.io.DataInput;
import java.io.DataOutput;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.regionindex.utils.Preconditions.checkArgument;
import static org.regionindex.utils.Preconditions.checkNotNull;
import static org.regionindex.utils.Preconditions.checkState;

/**
 * 定长字符 n-gram 索引。
 *
 * <p>文本的每个长度为 n 的连续窗口都映射到该文本所属的区域 id;长度不足 n 的文本整体作为一个窗口。
 * 查询返回各窗口命中集合的并集,只用作模糊匹配的候选预过滤,不参与打分。
 */
public class NgramIndex {

    private final int n;

    private final Map<String, BitmapIndex> grams;

    private boolean frozen;

    public NgramIndex(int n) {
        checkArgument(n > 0, "n-gram size must be positive, but is %s", n);
        this.n = n;
        this.grams = new HashMap<>();
    }

    public int n() {
        return n;
    }

    public void insert(String text, int id) {
        checkNotNull(text, "text");
        checkState(!frozen, "N-gram index is frozen.");
        for (String gram : windows(text, n)) {
            grams.computeIfAbsent(gram, g -> new BitmapIndex()).add(id);
        }
    }

    /** 返回与 {@code text} 至少共享一个窗口的全部区域 id。 */
    public BitmapIndex candidates(String text) {
        BitmapIndex result = new BitmapIndex();
        for (String gram : windows(text, n)) {
            BitmapIndex ids = grams.get(gram);
            if (ids != null) {
                result = result.union(ids);
            }
        }
        return result;
    }

    public BitmapIndex lookup(String gram) {
        BitmapIndex ids = grams.get(gram);
        return ids == null ? new BitmapIndex() : ids;
    }

    public int gramCount() {
        return grams.size();
    }

    public Map<String, BitmapIndex> grams() {
        return Collections.unmodifiableMap(grams);
    }

    /** 文本的全部 n 字符窗口,去重并保持出现顺序。 */
    public static List<String> windows(String text, int n) {
        if (text.isEmpty()) {
            return Collections.emptyList();
        }
        if (text.length() < n) {
            return Collections.singletonList(text);
        }
        Set<String> result = new LinkedHashSet<>();
        for (int i = 0; i + n <= text.length(); i++) {
            result.add(text.substring(i, i + n));
        }
        return new ArrayList<>(result);
    }

    public NgramIndex freeze() {
        if (!frozen) {
            grams.values().forEach(BitmapIndex::freeze);
            frozen = true;
        }
        return this;
    }

    public void serialize(DataOutput out) throws IOException {
        out.writeInt(n);
        InvertedIndex.writePostings(grams, out);
    }

    public static NgramIndex deserialize(DataInput in) throws IOException {
        int n = in.readInt();
        if (n <= 0) {
            throw new IOException("Invalid n-gram size: " + n);
        }
        NgramIndex index = new NgramIndex(n);
        InvertedIndex.readPostings(index.grams, in);
        index.frozen = true;
        return index;
    }
}
