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
import org.regionindex.bitmap.RegionIdOutOfRangeException;
import org.regionindex.region.Region;
import org.regionindex.region.RegionLevel;

import javax.annotation.Nullable;
import javax.annotation.concurrent.ThreadSafe;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

import static org.regionindex.utils.Preconditions.checkArgument;
import static org.regionindex.utils.Preconditions.checkState;

/**
 * 冻结后的索引包:区域表、各字段的前缀树、倒排表、n-gram 表以及构建信息。
 *
 * <p>所有结构在构造时冻结,之后只读,可被任意多个检索线程无锁共享。级别位图和代码映射在构造时
 * 由区域表推导,不单独持久化。
 */
@ThreadSafe
public class RegionIndex {

    /** 建有前缀树的字段。 */
    public static final TokenField[] TRIE_FIELDS = {
        TokenField.NAME, TokenField.PINYIN, TokenField.SHORT_PINYIN
    };

    /** 建有 n-gram 表的字段。 */
    public static final TokenField[] NGRAM_FIELDS = {TokenField.NAME, TokenField.PINYIN};

    private final Map<Integer, Region> regions;
    private final Map<String, Region> regionsByCode;
    private final Map<RegionLevel, BitmapIndex> levels;
    private final BitmapIndex allIds;
    private final Map<TokenField, Trie> tries;
    private final Map<TokenField, InvertedIndex> inverted;
    private final Map<TokenField, NgramIndex> ngrams;
    private final BuildMetadata metadata;

    public RegionIndex(
            Collection<Region> regions,
            Map<TokenField, Trie> tries,
            Map<TokenField, InvertedIndex> inverted,
            Map<TokenField, NgramIndex> ngrams,
            BuildMetadata metadata) {
        TreeMap<Integer, Region> table = new TreeMap<>();
        Map<String, Region> byCode = new HashMap<>();
        Map<RegionLevel, BitmapIndex> byLevel = new EnumMap<>(RegionLevel.class);
        BitmapIndex ids = new BitmapIndex();
        for (Region region : regions) {
            checkArgument(
                    table.put(region.id(), region) == null, "Duplicate region id %s", region.id());
            if (region.code() != null) {
                checkArgument(
                        byCode.put(region.code(), region) == null,
                        "Duplicate region code %s",
                        region.code());
            }
            byLevel.computeIfAbsent(region.level(), l -> new BitmapIndex()).add(region.id());
            ids.add(region.id());
        }
        byLevel.values().forEach(BitmapIndex::freeze);

        this.regions = Collections.unmodifiableMap(table);
        this.regionsByCode = Collections.unmodifiableMap(byCode);
        this.levels = Collections.unmodifiableMap(byLevel);
        this.allIds = ids.freeze();
        this.tries = Collections.unmodifiableMap(copyOf(tries));
        this.inverted = Collections.unmodifiableMap(copyOf(inverted));
        this.ngrams = Collections.unmodifiableMap(copyOf(ngrams));
        this.metadata = metadata;

        this.tries.values().forEach(Trie::freeze);
        this.inverted.values().forEach(InvertedIndex::freeze);
        this.ngrams.values().forEach(NgramIndex::freeze);
    }

    /** 区域表,按 id 升序。 */
    public Collection<Region> regions() {
        return regions.values();
    }

    public int regionCount() {
        return regions.size();
    }

    public BitmapIndex allIds() {
        return allIds;
    }

    public boolean contains(int id) {
        return regions.containsKey(id);
    }

    /**
     * 按 id 取区域。
     *
     * @throws RegionIdOutOfRangeException id 不存在时抛出
     */
    public Region region(int id) {
        Region region = regions.get(id);
        if (region == null) {
            throw new RegionIdOutOfRangeException(id);
        }
        return region;
    }

    @Nullable
    public Region findRegion(int id) {
        return regions.get(id);
    }

    public Optional<Region> regionByCode(String code) {
        return Optional.ofNullable(regionsByCode.get(code));
    }

    public List<Region> children(int id) {
        List<Region> result = new ArrayList<>();
        for (int child : region(id).children()) {
            result.add(regions.get(child));
        }
        return result;
    }

    public BitmapIndex regionsByLevel(RegionLevel level) {
        BitmapIndex ids = levels.get(level);
        return ids == null ? new BitmapIndex().freeze() : ids;
    }

    public Trie trie(TokenField field) {
        return required(tries, field, "trie");
    }

    public InvertedIndex inverted(TokenField field) {
        return required(inverted, field, "inverted index");
    }

    public NgramIndex ngram(TokenField field) {
        return required(ngrams, field, "n-gram index");
    }

    public Map<TokenField, Trie> tries() {
        return tries;
    }

    public Map<TokenField, InvertedIndex> invertedIndexes() {
        return inverted;
    }

    public Map<TokenField, NgramIndex> ngramIndexes() {
        return ngrams;
    }

    public BuildMetadata metadata() {
        return metadata;
    }

    /**
     * 校验区域表与各索引结构的一致性:父子关系互相对应、路径与祖先链一致、所有索引中的 id 都在
     * 区域表中存在、必需的结构齐全。
     *
     * @throws IllegalStateException 发现不一致时抛出
     */
    public void verifyConsistency() {
        checkState(
                metadata.regionCount() == regions.size(),
                "Metadata declares %s regions, but the table holds %s.",
                metadata.regionCount(),
                regions.size());

        for (Region region : regions.values()) {
            verifyRegion(region);
        }

        for (TokenField field : TRIE_FIELDS) {
            checkState(tries.containsKey(field), "Missing trie for field %s.", field);
        }
        for (TokenField field : TokenField.values()) {
            checkState(inverted.containsKey(field), "Missing inverted index for field %s.", field);
        }
        for (TokenField field : NGRAM_FIELDS) {
            NgramIndex ngram = ngrams.get(field);
            checkState(ngram != null, "Missing n-gram index for field %s.", field);
            checkState(
                    ngram.n() == metadata.ngramSize(),
                    "N-gram index of field %s has size %s, metadata declares %s.",
                    field,
                    ngram.n(),
                    metadata.ngramSize());
        }

        for (Map.Entry<TokenField, Trie> entry : tries.entrySet()) {
            entry.getValue()
                    .forEachToken(
                            (token, ids) -> verifyIds(ids, entry.getKey() + " trie", token));
        }
        for (Map.Entry<TokenField, InvertedIndex> entry : inverted.entrySet()) {
            for (Map.Entry<String, BitmapIndex> posting : entry.getValue().postings().entrySet()) {
                verifyIds(posting.getValue(), entry.getKey() + " inverted index", posting.getKey());
            }
        }
        for (Map.Entry<TokenField, NgramIndex> entry : ngrams.entrySet()) {
            for (Map.Entry<String, BitmapIndex> gram : entry.getValue().grams().entrySet()) {
                verifyIds(gram.getValue(), entry.getKey() + " n-gram index", gram.getKey());
            }
        }
    }

    private void verifyRegion(Region region) {
        List<Integer> pathIds = region.pathIds();
        checkState(
                pathIds.get(pathIds.size() - 1) == region.id(),
                "Path of region %s does not end with itself.",
                region.id());
        for (int i = 0; i < pathIds.size(); i++) {
            Region ancestor = regions.get(pathIds.get(i));
            checkState(
                    ancestor != null,
                    "Region %s references unknown ancestor %s.",
                    region.id(),
                    pathIds.get(i));
            checkState(
                    ancestor.name().equals(region.path().get(i)),
                    "Path name mismatch for region %s at depth %s.",
                    region.id(),
                    i);
        }

        Integer parentId = region.parentId();
        if (parentId == null) {
            checkState(pathIds.size() == 1, "Root region %s has ancestors.", region.id());
        } else {
            Region parent = regions.get(parentId);
            checkState(
                    parent != null,
                    "Region %s references unknown parent %s.",
                    region.id(),
                    parentId);
            checkState(
                    parent.children().contains(region.id()),
                    "Parent %s does not list child %s.",
                    parentId,
                    region.id());
            checkState(
                    pathIds.size() == parent.pathIds().size() + 1,
                    "Depth of region %s does not follow its parent.",
                    region.id());
        }

        for (int child : region.children()) {
            Region childRegion = regions.get(child);
            checkState(
                    childRegion != null && Integer.valueOf(region.id()).equals(childRegion.parentId()),
                    "Region %s lists %s as child, but the child does not point back.",
                    region.id(),
                    child);
        }
    }

    private void verifyIds(BitmapIndex ids, String structure, String token) {
        checkState(
                ids.intersect(allIds).cardinality() == ids.cardinality(),
                "Token '%s' of %s references region ids missing from the region table.",
                token,
                structure);
    }

    private static <T> T required(Map<TokenField, T> structures, TokenField field, String kind) {
        T structure = structures.get(field);
        checkArgument(structure != null, "No %s for field %s.", kind, field);
        return structure;
    }

    private static <T> Map<TokenField, T> copyOf(Map<TokenField, T> structures) {
        Map<TokenField, T> copy = new EnumMap<>(TokenField.class);
        copy.putAll(structures);
        return copy;
    }
}
