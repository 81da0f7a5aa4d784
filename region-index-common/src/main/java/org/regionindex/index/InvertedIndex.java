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
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.regionindex.utils.Preconditions.checkNotNull;
import static org.regionindex.utils.Preconditions.checkState;

/** 词项到区域 id 集合的精确映射。 */
public class InvertedIndex {

    private final Map<String, BitmapIndex> postings;

    private boolean frozen;

    public InvertedIndex() {
        this.postings = new HashMap<>();
    }

    public void insert(String token, int id) {
        checkNotNull(token, "token");
        checkState(!frozen, "Inverted index is frozen.");
        postings.computeIfAbsent(token, t -> new BitmapIndex()).add(id);
    }

    /** 查询词项,不存在时返回空集合。 */
    public BitmapIndex lookup(String token) {
        BitmapIndex ids = postings.get(token);
        return ids == null ? new BitmapIndex() : ids;
    }

    public boolean containsToken(String token) {
        return postings.containsKey(token);
    }

    public int tokenCount() {
        return postings.size();
    }

    public Set<String> tokens() {
        return Collections.unmodifiableSet(postings.keySet());
    }

    public Map<String, BitmapIndex> postings() {
        return Collections.unmodifiableMap(postings);
    }

    public InvertedIndex freeze() {
        if (!frozen) {
            postings.values().forEach(BitmapIndex::freeze);
            frozen = true;
        }
        return this;
    }

    public void serialize(DataOutput out) throws IOException {
        writePostings(postings, out);
    }

    public static InvertedIndex deserialize(DataInput in) throws IOException {
        InvertedIndex index = new InvertedIndex();
        readPostings(index.postings, in);
        index.frozen = true;
        return index;
    }

    /** 按词项升序写出映射,保证相同内容得到相同字节。 */
    static void writePostings(Map<String, BitmapIndex> postings, DataOutput out)
            throws IOException {
        List<String> tokens = new ArrayList<>(postings.keySet());
        Collections.sort(tokens);
        out.writeInt(tokens.size());
        for (String token : tokens) {
            out.writeUTF(token);
            postings.get(token).serialize(out);
        }
    }

    static void readPostings(Map<String, BitmapIndex> postings, DataInput in) throws IOException {
        int size = in.readInt();
        if (size < 0) {
            throw new IOException("Negative posting count: " + size);
        }
        for (int i = 0; i < size; i++) {
            String token = in.readUTF();
            postings.put(token, BitmapIndex.deserialize(in));
        }
    }
}
