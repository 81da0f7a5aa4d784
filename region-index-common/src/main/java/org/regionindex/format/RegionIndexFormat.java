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

import org.regionindex.annotation.VisibleForTesting;
import org.regionindex.compression.BlockCompressionFactory;
import org.regionindex.compression.BlockCompressionType;
import org.regionindex.compression.BufferDecompressionException;
import org.regionindex.compression.CompressorUtils;

import java.io.DataOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.DigestOutputStream;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.regionindex.utils.Preconditions.checkArgument;
import static org.regionindex.utils.Preconditions.checkNotNull;

/**
 * RIDX 索引文件格式。
 *
 * <p>文件结构(大端序):
 *
 * <pre>
 * _____________________________________________________________
 * |  magic("RIDX") | version | compression id | section count  |
 * |________________|_________|________________|________________|
 * |  section table: count × {kind, offset, stored len,         |
 * |                          raw len, sha256}                  |
 * |____________________________________________________________|
 * |  section payloads (按分段表顺序)                             |
 * |____________________________________________________________|
 * |  trailer: sha256(之前的全部字节)                             |
 * |____________________________________________________________|
 *
 * magic:          4 字节, "RIDX"
 * version:        4 字节 int
 * compression id: 4 字节 int, {@link BlockCompressionType#persistentId()}
 * section count:  4 字节 int
 * kind:           4 字节 int, {@link SectionKind#id()}
 * offset:         8 字节 long, 分段数据在文件中的绝对位置
 * stored len:     4 字节 int, 压缩后长度
 * raw len:        4 字节 int, 压缩前长度
 * sha256:         32 字节, 压缩后分段数据的摘要
 * </pre>
 *
 * <p>每个分段独立压缩、独立校验。读取顺序为:魔数、版本、整体校验和、分段表、分段校验和、解压。
 */
public final class RegionIndexFormat {

    public static final byte[] MAGIC = "RIDX".getBytes(StandardCharsets.US_ASCII);

    public static final int DIGEST_LENGTH = 32;

    /** magic + version + compression + section count */
    static final int HEADER_LENGTH = 16;

    /** kind + offset + stored length + raw length + sha256 */
    static final int SECTION_ENTRY_LENGTH = 4 + 8 + 4 + 4 + DIGEST_LENGTH;

    /** 文件格式版本。 */
    public enum Version {
        V_1(1);

        private final int version;

        Version(int version) {
            this.version = version;
        }

        public int version() {
            return version;
        }
    }

    public static final Version CURRENT_VERSION = Version.V_1;

    public static Writer createWriter(BlockCompressionFactory compressionFactory) {
        return new Writer(compressionFactory);
    }

    /**
     * 解析文件头、校验整个文件并读出分段表。
     *
     * @param bytes 完整的文件内容
     * @throws IndexLoadException 文件不可用时抛出
     */
    public static Reader createReader(byte[] bytes) throws IndexLoadException {
        return new Reader(bytes);
    }

    static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available.", e);
        }
    }

    /**
     * 分段写入器。
     *
     * <p>每个分段在加入分段表之前就完成了编码、压缩和摘要计算,分段表只包含完整的分段。
     */
    public static class Writer {

        private final BlockCompressionFactory compressionFactory;

        private final Map<SectionKind, EncodedSection> sections = new LinkedHashMap<>();

        private Writer(BlockCompressionFactory compressionFactory) {
            this.compressionFactory = checkNotNull(compressionFactory);
        }

        /** 压缩并登记一个分段。 */
        public Writer addSection(SectionKind kind, byte[] raw) {
            byte[] stored = CompressorUtils.compress(compressionFactory.getCompressor(), raw);
            return addEncodedSection(kind, stored, raw.length);
        }

        /** 直接登记已经压缩好的分段数据。 */
        @VisibleForTesting
        public Writer addEncodedSection(SectionKind kind, byte[] stored, int rawLength) {
            checkArgument(
                    !sections.containsKey(kind), "Section %s has already been added.", kind);
            sections.put(kind, new EncodedSection(kind, stored, rawLength, sha256().digest(stored)));
            return this;
        }

        /**
         * 写出完整文件,返回写出的字节数。
         *
         * @throws IOException 写入失败时抛出
         */
        public long writeTo(OutputStream outputStream) throws IOException {
            MessageDigest trailer = sha256();
            DataOutputStream out =
                    new DataOutputStream(new DigestOutputStream(outputStream, trailer));

            out.write(MAGIC);
            out.writeInt(CURRENT_VERSION.version());
            out.writeInt(compressionFactory.getCompressionType().persistentId());
            out.writeInt(sections.size());

            long offset = HEADER_LENGTH + (long) SECTION_ENTRY_LENGTH * sections.size();
            for (EncodedSection section : sections.values()) {
                out.writeInt(section.kind.id());
                out.writeLong(offset);
                out.writeInt(section.stored.length);
                out.writeInt(section.rawLength);
                out.write(section.digest);
                offset += section.stored.length;
            }
            for (EncodedSection section : sections.values()) {
                out.write(section.stored);
            }
            out.flush();

            byte[] digest = trailer.digest();
            outputStream.write(digest);
            outputStream.flush();
            return offset + digest.length;
        }
    }

    /** 分段读取器。构造时已完成整体校验;分段数据在 {@link #readSection} 时才解压。 */
    public static class Reader {

        private final byte[] bytes;

        private final BlockCompressionType compressionType;

        private final Map<SectionKind, SectionEntry> entries = new EnumMap<>(SectionKind.class);

        private Reader(byte[] bytes) throws IndexLoadException {
            this.bytes = checkNotNull(bytes);
            if (bytes.length < HEADER_LENGTH + DIGEST_LENGTH) {
                throw new CorruptIndexException(
                        "File is truncated, length " + bytes.length + " is below the minimum.");
            }

            ByteBuffer buffer = ByteBuffer.wrap(bytes);
            byte[] magic = new byte[MAGIC.length];
            buffer.get(magic);
            if (!Arrays.equals(magic, MAGIC)) {
                throw new CorruptIndexException("Bad magic, this is not a RIDX file.");
            }

            int version = buffer.getInt();
            if (version != CURRENT_VERSION.version()) {
                throw new IndexFormatVersionException(version, CURRENT_VERSION.version());
            }

            int bodyLength = bytes.length - DIGEST_LENGTH;
            MessageDigest digest = sha256();
            digest.update(bytes, 0, bodyLength);
            if (!MessageDigest.isEqual(
                    digest.digest(), Arrays.copyOfRange(bytes, bodyLength, bytes.length))) {
                throw new CorruptIndexException("File checksum mismatch.");
            }

            int compressionId = buffer.getInt();
            try {
                this.compressionType =
                        BlockCompressionType.getCompressionTypeByPersistentId(compressionId);
            } catch (IllegalArgumentException e) {
                throw new CorruptIndexException("Unknown compression id " + compressionId, e);
            }

            int sectionCount = buffer.getInt();
            if (sectionCount < 0
                    || HEADER_LENGTH + (long) SECTION_ENTRY_LENGTH * sectionCount > bodyLength) {
                throw new CorruptIndexException("Invalid section count " + sectionCount);
            }

            for (int i = 0; i < sectionCount; i++) {
                int kindId = buffer.getInt();
                long offset = buffer.getLong();
                int storedLength = buffer.getInt();
                int rawLength = buffer.getInt();
                byte[] sha = new byte[DIGEST_LENGTH];
                buffer.get(sha);

                SectionKind kind = SectionKind.fromId(kindId);
                if (kind == null) {
                    throw new CorruptIndexException("Unknown section kind " + kindId);
                }
                if (offset < 0
                        || storedLength < 0
                        || rawLength < 0
                        || offset + storedLength > bodyLength) {
                    throw new CorruptIndexException(
                            String.format(
                                    "Section %s is out of bounds, offset %s, length %s.",
                                    kind, offset, storedLength));
                }
                if (entries.containsKey(kind)) {
                    throw new CorruptIndexException("Duplicate section " + kind);
                }

                MessageDigest sectionDigest = sha256();
                sectionDigest.update(bytes, (int) offset, storedLength);
                if (!MessageDigest.isEqual(sectionDigest.digest(), sha)) {
                    throw new CorruptIndexException("Checksum mismatch in section " + kind);
                }
                entries.put(kind, new SectionEntry((int) offset, storedLength, rawLength));
            }
        }

        public BlockCompressionType compressionType() {
            return compressionType;
        }

        public boolean hasSection(SectionKind kind) {
            return entries.containsKey(kind);
        }

        /**
         * 解压并返回分段原始数据。
         *
         * @throws CorruptIndexException 分段不存在时抛出
         * @throws IndexDecompressionException 分段无法解压时抛出
         */
        public byte[] readSection(SectionKind kind) throws IndexLoadException {
            SectionEntry entry = entries.get(kind);
            if (entry == null) {
                throw new CorruptIndexException("Missing section " + kind);
            }
            byte[] stored = Arrays.copyOfRange(bytes, entry.offset, entry.offset + entry.length);
            try {
                return CompressorUtils.decompress(
                        BlockCompressionFactory.create(compressionType).getDecompressor(),
                        stored,
                        entry.rawLength);
            } catch (BufferDecompressionException e) {
                throw new IndexDecompressionException(
                        "Failed to decompress section " + kind + " with " + compressionType, e);
            }
        }
    }

    private static class EncodedSection {
        private final SectionKind kind;
        private final byte[] stored;
        private final int rawLength;
        private final byte[] digest;

        private EncodedSection(SectionKind kind, byte[] stored, int rawLength, byte[] digest) {
            this.kind = kind;
            this.stored = stored;
            this.rawLength = rawLength;
            this.digest = digest;
        }
    }

    private static class SectionEntry {
        private final int offset;
        private final int length;
        private final int rawLength;

        private SectionEntry(int offset, int length, int rawLength) {
            this.offset = offset;
            this.length = length;
            this.rawLength = rawLength;
        }
    }

    private RegionIndexFormat() {}
}
