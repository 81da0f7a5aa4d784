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

package org.regionindex.build;

import org.regionindex.format.RegionIndexFormat;
import org.regionindex.index.BuildMetadata;
import org.regionindex.index.InvertedIndex;
import org.regionindex.index.NgramIndex;
import org.regionindex.index.RegionIndex;
import org.regionindex.index.TokenField;
import org.regionindex.index.Trie;
import org.regionindex.options.RegionIndexOptions;
import org.regionindex.region.DataIntegrityException;
import org.regionindex.region.Region;
import org.regionindex.region.RegionLevel;
import org.regionindex.region.RegionRecord;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import static org.regionindex.utils.Preconditions.checkNotNull;
import static org.regionindex.utils.Preconditions.checkState;

/**
 * 由区域记录构建 {@link RegionIndex}。
 *
 * <p>构建流程:
 *
 * <ol>
 *   <li>校验记录:名称非空、级别可识别、显式 id 与代码唯一
 *   <li>为缺少 id 的记录按输入顺序分配最小的空闲 id,解析父节点(先 {@code parent_id} 后
 *       {@code parent_code}),拒绝未知父节点和环
 *   <li>计算路径、祖先 id 链与子节点列表
 *   <li>按 {@link TokenVariants} 派生词项并写入前缀树、倒排表和 n-gram 表
 *   <li>冻结全部结构并校验一致性
 * </ol>
 *
 * <p>任何一步失败都抛出 {@link DataIntegrityException},不会产生部分可用的索引。相同输入总是得到
 * 相同的检索结果。构建器不是线程安全的,一个实例只能 {@link #build()} 一次。
 */
public class RegionIndexBuilder {

    private static final Logger LOG = LoggerFactory.getLogger(RegionIndexBuilder.class);

    private final RegionIndexOptions options;

    private final Clock clock;

    private final List<RegionRecord> records = new ArrayList<>();

    private boolean built;

    public RegionIndexBuilder() {
        this(new RegionIndexOptions());
    }

    public RegionIndexBuilder(RegionIndexOptions options) {
        this(options, Clock.systemUTC());
    }

    RegionIndexBuilder(RegionIndexOptions options, Clock clock) {
        this.options = checkNotNull(options);
        this.clock = checkNotNull(clock);
    }

    public RegionIndexBuilder addRecord(RegionRecord record) {
        checkState(!built, "The index has already been built.");
        records.add(checkNotNull(record, "record"));
        return this;
    }

    public RegionIndexBuilder addRecords(Collection<RegionRecord> records) {
        records.forEach(this::addRecord);
        return this;
    }

    /**
     * 构建并冻结索引。
     *
     * @throws DataIntegrityException 输入数据不完整或不一致时抛出
     */
    public RegionIndex build() {
        checkState(!built, "The index has already been built.");
        built = true;
        long start = System.nanoTime();

        List<Node> nodes = validate();
        assignIds(nodes);
        resolveParents(nodes);
        List<Region> regions = deriveHierarchy(nodes);

        Map<TokenField, Trie> tries = new EnumMap<>(TokenField.class);
        for (TokenField field : RegionIndex.TRIE_FIELDS) {
            tries.put(field, new Trie());
        }
        Map<TokenField, InvertedIndex> inverted = new EnumMap<>(TokenField.class);
        for (TokenField field : TokenField.values()) {
            inverted.put(field, new InvertedIndex());
        }
        int ngramSize = options.ngramSize();
        Map<TokenField, NgramIndex> ngrams = new EnumMap<>(TokenField.class);
        for (TokenField field : RegionIndex.NGRAM_FIELDS) {
            ngrams.put(field, new NgramIndex(ngramSize));
        }

        for (Region region : regions) {
            for (TokenField field : TokenField.values()) {
                Trie trie = tries.get(field);
                InvertedIndex invertedIndex = inverted.get(field);
                NgramIndex ngram = ngrams.get(field);
                for (String token : TokenVariants.tokens(region, field)) {
                    invertedIndex.insert(token, region.id());
                    if (trie != null) {
                        trie.insert(token, region.id());
                    }
                    if (ngram != null) {
                        ngram.insert(token, region.id());
                    }
                }
            }
        }

        long tokenCount = 0;
        for (Trie trie : tries.values()) {
            tokenCount += trie.tokenCount();
        }
        for (InvertedIndex index : inverted.values()) {
            tokenCount += index.tokenCount();
        }
        for (NgramIndex ngram : ngrams.values()) {
            tokenCount += ngram.gramCount();
        }

        BuildMetadata metadata =
                new BuildMetadata(
                        RegionIndexFormat.CURRENT_VERSION.version(),
                        clock.millis(),
                        regions.size(),
                        tokenCount,
                        ngramSize);
        RegionIndex index = new RegionIndex(regions, tries, inverted, ngrams, metadata);
        try {
            index.verifyConsistency();
        } catch (IllegalStateException e) {
            throw new DataIntegrityException("Built index is inconsistent: " + e.getMessage(), e);
        }

        LOG.info(
                "Built region index with {} regions and {} tokens in {} ms.",
                regions.size(),
                tokenCount,
                (System.nanoTime() - start) / 1_000_000);
        return index;
    }

    // ------------------------------------------------------------------------

    private List<Node> validate() {
        List<Node> nodes = new ArrayList<>(records.size());
        Set<Integer> ids = new HashSet<>();
        Set<String> codes = new HashSet<>();
        for (int i = 0; i < records.size(); i++) {
            RegionRecord record = records.get(i);
            String name = record.name();
            if (name == null || name.trim().isEmpty()) {
                throw new DataIntegrityException("Record #" + i + " has a blank name: " + record);
            }
            if (record.level() == null) {
                throw new DataIntegrityException("Record #" + i + " has no level: " + record);
            }
            RegionLevel level = RegionLevel.parse(record.level());

            Integer id = record.id();
            if (id != null) {
                if (id < 0) {
                    throw new DataIntegrityException(
                            "Record #" + i + " has a negative id: " + record);
                }
                if (!ids.add(id)) {
                    throw new DataIntegrityException("Duplicate region id " + id + ".");
                }
            }
            if (record.code() != null && !codes.add(record.code())) {
                throw new DataIntegrityException("Duplicate region code " + record.code() + ".");
            }
            nodes.add(new Node(record, name.trim(), level));
        }
        return nodes;
    }

    private static void assignIds(List<Node> nodes) {
        Set<Integer> taken = new HashSet<>();
        for (Node node : nodes) {
            if (node.record.id() != null) {
                node.id = node.record.id();
                taken.add(node.id);
            }
        }
        int next = 0;
        for (Node node : nodes) {
            if (node.record.id() == null) {
                while (taken.contains(next)) {
                    next++;
                }
                node.id = next;
                taken.add(next);
            }
        }
    }

    private static void resolveParents(List<Node> nodes) {
        Map<Integer, Node> byId = new HashMap<>();
        Map<String, Node> byCode = new HashMap<>();
        for (Node node : nodes) {
            byId.put(node.id, node);
            if (node.record.code() != null) {
                byCode.put(node.record.code(), node);
            }
        }

        for (Node node : nodes) {
            Integer parentId = node.record.parentId();
            String parentCode = node.record.parentCode();
            if (parentId != null) {
                if (!byId.containsKey(parentId)) {
                    throw new DataIntegrityException(
                            String.format(
                                    "Region %s (%s) references unknown parent id %s.",
                                    node.id, node.name, parentId));
                }
                node.parentId = parentId;
            } else if (parentCode != null) {
                Node parent = byCode.get(parentCode);
                if (parent == null) {
                    throw new DataIntegrityException(
                            String.format(
                                    "Region %s (%s) references unknown parent code %s.",
                                    node.id, node.name, parentCode));
                }
                node.parentId = parent.id;
            }
        }
    }

    /** 计算路径与子节点。沿父链上行时,步数超过节点总数即说明存在环。 */
    private static List<Region> deriveHierarchy(List<Node> nodes) {
        Map<Integer, Node> byId = new TreeMap<>();
        for (Node node : nodes) {
            byId.put(node.id, node);
        }

        Map<Integer, List<Integer>> children = new HashMap<>();
        for (Node node : byId.values()) {
            if (node.parentId != null) {
                children.computeIfAbsent(node.parentId, k -> new ArrayList<>()).add(node.id);
            }
        }

        List<Region> regions = new ArrayList<>(byId.size());
        for (Node node : byId.values()) {
            List<Integer> pathIds = new ArrayList<>();
            List<String> path = new ArrayList<>();
            Node current = node;
            while (current != null) {
                if (pathIds.size() > byId.size()) {
                    throw new DataIntegrityException(
                            String.format(
                                    "Parent chain of region %s (%s) contains a cycle.",
                                    node.id, node.name));
                }
                pathIds.add(current.id);
                path.add(current.name);
                current = current.parentId == null ? null : byId.get(current.parentId);
            }
            Collections.reverse(pathIds);
            Collections.reverse(path);

            List<Integer> childIds = children.getOrDefault(node.id, Collections.emptyList());
            Collections.sort(childIds);

            regions.add(
                    new Region(
                            node.id,
                            node.record.code(),
                            node.name,
                            node.level,
                            TokenVariants.normalizeLatin(node.record.pinyin()),
                            TokenVariants.normalizeLatin(node.record.pinyinShort()),
                            node.parentId,
                            childIds,
                            path,
                            pathIds,
                            node.record.aliases()));
        }
        return regions;
    }

    /** 构建过程中的可变中间状态。 */
    private static class Node {
        private final RegionRecord record;
        private final String name;
        private final RegionLevel level;
        private int id;
        @Nullable private Integer parentId;

        private Node(RegionRecord record, String name, RegionLevel level) {
            this.record = record;
            this.name = name;
            this.level = level;
        }
    }
}
