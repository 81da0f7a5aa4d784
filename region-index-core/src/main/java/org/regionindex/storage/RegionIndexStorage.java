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

package org.regionindex.storage;

import org.regionindex.compression.BlockCompressionFactory;
import org.regionindex.format.CorruptIndexException;
import org.regionindex.format.IndexLoadException;
import org.regionindex.format.RegionIndexFormat;
import org.regionindex.format.SectionKind;
import org.regionindex.index.BuildMetadata;
import org.regionindex.index.InvertedIndex;
import org.regionindex.index.NgramIndex;
import org.regionindex.index.RegionIndex;
import org.regionindex.index.TokenField;
import org.regionindex.index.Trie;
import org.regionindex.options.RegionIndexOptions;
import org.regionindex.region.Region;
import org.regionindex.utils.IOUtils;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.regionindex.utils.Preconditions.checkNotNull;

/**
 * 将 {@link RegionIndex} 保存为 RIDX 文件并从中加载。
 *
 * <p>每类结构写成一个分段,分段按 {@link RegionIndexOptions#COMPRESSION} 压缩。保存先写入同目录下
 * 的临时文件再原子替换目标文件,读者不会看到写了一半的文件。加载时任何校验或解析失败都抛出
 * {@link IndexLoadException} 的子类,不会返回部分索引。
 */
public class RegionIndexStorage {

    private static final Logger LOG = LoggerFactory.getLogger(RegionIndexStorage.class);

    private static final String TEMP_SUFFIX = ".tmp";

    private final RegionIndexOptions options;

    public RegionIndexStorage() {
        this(new RegionIndexOptions());
    }

    public RegionIndexStorage(RegionIndexOptions options) {
        this.options = checkNotNull(options);
    }

    /** 原子地保存索引,返回写入的字节数。 */
    public long save(RegionIndex index, Path path) throws IOException {
        checkNotNull(index, "index");
        Path target = path.toAbsolutePath();
        Path parent = target.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path temp =
                target.resolveSibling(
                        "." + target.getFileName() + "." + UUID.randomUUID() + TEMP_SUFFIX);

        long length;
        boolean success = false;
        try {
            try (OutputStream out = Files.newOutputStream(temp)) {
                length = write(index, out);
            }
            moveAtomically(temp, target);
            success = true;
        } finally {
            if (!success) {
                try {
                    Files.deleteIfExists(temp);
                } catch (IOException e) {
                    LOG.warn("Failed to delete temporary file {}.", temp, e);
                }
            }
        }

        LOG.info(
                "Saved region index with {} regions to {} ({} bytes, {}).",
                index.regionCount(),
                target,
                length,
                options.compression());
        return length;
    }

    /** 将索引编码写入输出流,不关闭流。 */
    public long write(RegionIndex index, OutputStream out) throws IOException {
        RegionIndexFormat.Writer writer =
                RegionIndexFormat.createWriter(
                        BlockCompressionFactory.create(
                                options.compression(), options.zstdLevel()));

        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        DataOutputStream data = new DataOutputStream(bytes);
        RegionTableCodec.write(index.regions(), data);
        writer.addSection(SectionKind.REGION_TABLE, flush(data, bytes));

        data.writeInt(index.tries().size());
        for (Map.Entry<TokenField, Trie> entry : index.tries().entrySet()) {
            data.writeInt(entry.getKey().id());
            entry.getValue().serialize(data);
        }
        writer.addSection(SectionKind.TRIE, flush(data, bytes));

        data.writeInt(index.invertedIndexes().size());
        for (Map.Entry<TokenField, InvertedIndex> entry : index.invertedIndexes().entrySet()) {
            data.writeInt(entry.getKey().id());
            entry.getValue().serialize(data);
        }
        writer.addSection(SectionKind.INVERTED_INDEX, flush(data, bytes));

        data.writeInt(index.ngramIndexes().size());
        for (Map.Entry<TokenField, NgramIndex> entry : index.ngramIndexes().entrySet()) {
            data.writeInt(entry.getKey().id());
            entry.getValue().serialize(data);
        }
        writer.addSection(SectionKind.NGRAM_INDEX, flush(data, bytes));

        index.metadata().serialize(data);
        writer.addSection(SectionKind.BUILD_METADATA, flush(data, bytes));

        return writer.writeTo(out);
    }

    /**
     * 加载索引文件。
     *
     * @throws java.nio.file.NoSuchFileException 文件不存在时抛出
     * @throws IndexLoadException 文件损坏、版本不支持或解压失败时抛出
     */
    public RegionIndex load(Path path) throws IOException {
        long start = System.nanoTime();
        byte[] bytes = Files.readAllBytes(path);
        RegionIndex index;
        try {
            index = read(bytes);
        } catch (IndexLoadException e) {
            LOG.warn("Failed to load region index from {}: {}", path, e.getMessage());
            throw e;
        }
        LOG.info(
                "Loaded region index with {} regions from {} in {} ms.",
                index.regionCount(),
                path,
                (System.nanoTime() - start) / 1_000_000);
        return index;
    }

    public RegionIndex read(InputStream in) throws IOException {
        return read(IOUtils.readFully(in));
    }

    public RegionIndex read(byte[] bytes) throws IndexLoadException {
        RegionIndexFormat.Reader reader = RegionIndexFormat.createReader(bytes);

        List<Region> regions;
        Map<TokenField, Trie> tries = new EnumMap<>(TokenField.class);
        Map<TokenField, InvertedIndex> inverted = new EnumMap<>(TokenField.class);
        Map<TokenField, NgramIndex> ngrams = new EnumMap<>(TokenField.class);
        BuildMetadata metadata;
        try {
            DataInputStream in = open(reader, SectionKind.REGION_TABLE);
            regions = RegionTableCodec.read(in);
            checkFullyConsumed(in, SectionKind.REGION_TABLE);

            in = open(reader, SectionKind.TRIE);
            int count = RegionTableCodec.readCount(in);
            for (int i = 0; i < count; i++) {
                tries.put(field(in.readInt()), Trie.deserialize(in));
            }
            checkFullyConsumed(in, SectionKind.TRIE);

            in = open(reader, SectionKind.INVERTED_INDEX);
            count = RegionTableCodec.readCount(in);
            for (int i = 0; i < count; i++) {
                inverted.put(field(in.readInt()), InvertedIndex.deserialize(in));
            }
            checkFullyConsumed(in, SectionKind.INVERTED_INDEX);

            in = open(reader, SectionKind.NGRAM_INDEX);
            count = RegionTableCodec.readCount(in);
            for (int i = 0; i < count; i++) {
                ngrams.put(field(in.readInt()), NgramIndex.deserialize(in));
            }
            checkFullyConsumed(in, SectionKind.NGRAM_INDEX);

            in = open(reader, SectionKind.BUILD_METADATA);
            metadata = BuildMetadata.deserialize(in);
            checkFullyConsumed(in, SectionKind.BUILD_METADATA);
        } catch (IndexLoadException e) {
            throw e;
        } catch (EOFException e) {
            throw new CorruptIndexException("Section ends unexpectedly.", e);
        } catch (IOException | RuntimeException e) {
            throw new CorruptIndexException("Malformed section: " + e.getMessage(), e);
        }

        RegionIndex index;
        try {
            index = new RegionIndex(regions, tries, inverted, ngrams, metadata);
            index.verifyConsistency();
        } catch (RuntimeException e) {
            throw new CorruptIndexException("Inconsistent index: " + e.getMessage(), e);
        }
        return index;
    }

    // ------------------------------------------------------------------------

    private static byte[] flush(DataOutputStream data, ByteArrayOutputStream bytes)
            throws IOException {
        data.flush();
        byte[] result = bytes.toByteArray();
        bytes.reset();
        return result;
    }

    private static DataInputStream open(RegionIndexFormat.Reader reader, SectionKind kind)
            throws IndexLoadException {
        return new DataInputStream(new ByteArrayInputStream(reader.readSection(kind)));
    }

    private static void checkFullyConsumed(DataInputStream in, SectionKind kind)
            throws IOException {
        if (in.available() > 0) {
            throw new CorruptIndexException(
                    "Section " + kind + " has " + in.available() + " trailing bytes.");
        }
    }

    private static TokenField field(int id) throws CorruptIndexException {
        try {
            return TokenField.fromId(id);
        } catch (IllegalArgumentException e) {
            throw new CorruptIndexException(e.getMessage(), e);
        }
    }

    private static void moveAtomically(Path source, Path target) throws IOException {
        try {
            Files.move(
                    source,
                    target,
                    StandardCopyOption.ATOMIC_MOVE,
                    StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            LOG.debug("Atomic move is not supported for {}, falling back to replace.", target);
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
