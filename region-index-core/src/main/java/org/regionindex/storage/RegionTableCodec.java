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

import org.regionindex.region.Region;
import org.regionindex.region.RegionLevel;

import java.io.DataInput;
import java.io.DataOutput;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * 区域表的二进制编码。
 *
 * <p>格式为区域数量加逐条记录,每条记录依次是 id、代码标志与代码、名称、级别、全拼、简拼、父 id
 * (无父节点时为 -1)、子节点 id 列表、路径名称列表、路径 id 列表和别名列表。字符串使用
 * {@link DataOutput#writeUTF}。
 */
final class RegionTableCodec {

    private static final int NO_PARENT = -1;

    private RegionTableCodec() {}

    static void write(Collection<Region> regions, DataOutput out) throws IOException {
        out.writeInt(regions.size());
        for (Region region : regions) {
            out.writeInt(region.id());
            out.writeBoolean(region.code() != null);
            if (region.code() != null) {
                out.writeUTF(region.code());
            }
            out.writeUTF(region.name());
            out.writeUTF(region.level().name());
            out.writeUTF(region.pinyinFull());
            out.writeUTF(region.pinyinShort());
            out.writeInt(region.parentId() == null ? NO_PARENT : region.parentId());
            writeInts(region.children(), out);
            writeStrings(region.path(), out);
            writeInts(region.pathIds(), out);
            writeStrings(region.aliases(), out);
        }
    }

    static List<Region> read(DataInput in) throws IOException {
        int count = readCount(in);
        List<Region> regions = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            int id = in.readInt();
            String code = in.readBoolean() ? in.readUTF() : null;
            String name = in.readUTF();
            RegionLevel level = RegionLevel.valueOf(in.readUTF());
            String pinyin = in.readUTF();
            String pinyinShort = in.readUTF();
            int parent = in.readInt();
            List<Integer> children = readInts(in);
            List<String> path = readStrings(in);
            List<Integer> pathIds = readInts(in);
            List<String> aliases = readStrings(in);
            regions.add(
                    new Region(
                            id,
                            code,
                            name,
                            level,
                            pinyin,
                            pinyinShort,
                            parent == NO_PARENT ? null : parent,
                            children,
                            path,
                            pathIds,
                            aliases));
        }
        return regions;
    }

    private static void writeInts(List<Integer> values, DataOutput out) throws IOException {
        out.writeInt(values.size());
        for (int value : values) {
            out.writeInt(value);
        }
    }

    private static List<Integer> readInts(DataInput in) throws IOException {
        int size = readCount(in);
        List<Integer> values = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            values.add(in.readInt());
        }
        return values;
    }

    private static void writeStrings(List<String> values, DataOutput out) throws IOException {
        out.writeInt(values.size());
        for (String value : values) {
            out.writeUTF(value);
        }
    }

    private static List<String> readStrings(DataInput in) throws IOException {
        int size = readCount(in);
        List<String> values = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            values.add(in.readUTF());
        }
        return values;
    }

    static int readCount(DataInput in) throws IOException {
        int count = in.readInt();
        if (count < 0) {
            throw new IOException("Negative element count " + count);
        }
        return count;
    }
}
