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

import javax.annotation.Nullable;

import java.io.DataInput;
import java.io.DataOutput;
import java.io.IOException;
import java.util.Map;
import java.util.TreeMap;

import static org.regionindex.utils.Preconditions.checkArgument;
import static org.regionindex.utils.Preconditions.checkNotNull;
import static org.regionindex.utils.Preconditions.checkState;

/**
 * 字符前缀树。
 *
 * <p>每个节点保存一个 {@link BitmapIndex},记录所有经过该节点的词项所属的区域 id;以该节点结尾的
 * 词项额外记录在节点的终止集合中。因此前缀查询只需沿查询字符下行,耗时与查询长度成正比,并且对
 * 任意词项 t 及其前缀 p 都有 {@code prefixSearch(p) ⊇ prefixSearch(t)}。
 *
 * <p>序列化格式为先序遍历:节点集合、终止标记(及终止集合)、子节点数量,随后按字符升序逐个写出
 * 子节点的字符和子树。
 */
public class Trie {

    private final Node root = new Node();

    private int tokenCount;

    private boolean frozen;

    /**
     * 插入一个词项。重复插入同一 (token, id) 不会改变结果。
     *
     * @param token 非空词项
     * @param id 区域 id
     */
    public void insert(String token, int id) {
        checkNotNull(token, "token");
        checkArgument(!token.isEmpty(), "Cannot insert an empty token.");
        checkState(!frozen, "Trie is frozen.");

        Node node = root;
        node.ids.add(id);
        for (int i = 0; i < token.length(); i++) {
            node = node.children.computeIfAbsent(token.charAt(i), c -> new Node());
            node.ids.add(id);
        }
        if (node.terminal == null) {
            node.terminal = new BitmapIndex();
            tokenCount++;
        }
        node.terminal.add(id);
    }

    /** 返回所有以 {@code prefix} 开头的词项的 id 并集;路径不存在时返回空集合。 */
    public BitmapIndex prefixSearch(String prefix) {
        Node node = find(prefix);
        return node == null ? new BitmapIndex() : node.ids;
    }

    /** 返回与 {@code token} 完全相同的词项的 id。 */
    public BitmapIndex exactSearch(String token) {
        Node node = find(token);
        return node == null || node.terminal == null ? new BitmapIndex() : node.terminal;
    }

    /**
     * 从 {@code text} 的 {@code from} 位置开始,找出最长的完整词项。
     *
     * @return 该词项的长度,没有任何词项匹配时返回 0
     */
    public int longestTerminalPrefix(String text, int from) {
        Node node = root;
        int longest = 0;
        for (int i = from; i < text.length(); i++) {
            node = node.children.get(text.charAt(i));
            if (node == null) {
                break;
            }
            if (node.terminal != null) {
                longest = i - from + 1;
            }
        }
        return longest;
    }

    /** 不同词项的数量。 */
    public int tokenCount() {
        return tokenCount;
    }

    /** 遍历全部词项及其 id 集合,按字典序。 */
    public void forEachToken(TokenVisitor visitor) {
        visit(root, new StringBuilder(), visitor);
    }

    public Trie freeze() {
        if (!frozen) {
            freeze(root);
            frozen = true;
        }
        return this;
    }

    public void serialize(DataOutput out) throws IOException {
        out.writeInt(tokenCount);
        write(root, out);
    }

    public static Trie deserialize(DataInput in) throws IOException {
        Trie trie = new Trie();
        trie.tokenCount = in.readInt();
        read(trie.root, in);
        trie.frozen = true;
        return trie;
    }

    // ------------------------------------------------------------------------

    @Nullable
    private Node find(String key) {
        Node node = root;
        for (int i = 0; i < key.length() && node != null; i++) {
            node = node.children.get(key.charAt(i));
        }
        return node;
    }

    private static void visit(Node node, StringBuilder prefix, TokenVisitor visitor) {
        if (node.terminal != null) {
            visitor.visit(prefix.toString(), node.terminal);
        }
        for (Map.Entry<Character, Node> child : node.children.entrySet()) {
            prefix.append(child.getKey());
            visit(child.getValue(), prefix, visitor);
            prefix.setLength(prefix.length() - 1);
        }
    }

    private static void freeze(Node node) {
        node.ids.freeze();
        if (node.terminal != null) {
            node.terminal.freeze();
        }
        for (Node child : node.children.values()) {
            freeze(child);
        }
    }

    private static void write(Node node, DataOutput out) throws IOException {
        node.ids.serialize(out);
        out.writeBoolean(node.terminal != null);
        if (node.terminal != null) {
            node.terminal.serialize(out);
        }
        out.writeInt(node.children.size());
        for (Map.Entry<Character, Node> child : node.children.entrySet()) {
            out.writeChar(child.getKey());
            write(child.getValue(), out);
        }
    }

    private static void read(Node node, DataInput in) throws IOException {
        node.ids = BitmapIndex.deserialize(in);
        if (in.readBoolean()) {
            node.terminal = BitmapIndex.deserialize(in);
        }
        int childCount = in.readInt();
        if (childCount < 0) {
            throw new IOException("Negative trie child count: " + childCount);
        }
        for (int i = 0; i < childCount; i++) {
            char c = in.readChar();
            Node child = new Node();
            read(child, in);
            node.children.put(c, child);
        }
    }

    /** 词项遍历回调。 */
    public interface TokenVisitor {
        void visit(String token, BitmapIndex ids);
    }

    private static class Node {
        private final TreeMap<Character, Node> children = new TreeMap<>();
        private BitmapIndex ids = new BitmapIndex();
        @Nullable private BitmapIndex terminal;
    }
}
