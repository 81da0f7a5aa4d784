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

import java.io.DataInput;
import java.io.DataOutput;
import java.io.IOException;
import java.time.Instant;
import java.util.Objects;

/** 构建信息:格式版本、构建时间、区域数、词项数与 n-gram 长度。 */
public final class BuildMetadata {

    private final int formatVersion;
    private final long buildTimestamp;
    private final int regionCount;
    private final long tokenCount;
    private final int ngramSize;

    public BuildMetadata(
            int formatVersion, long buildTimestamp, int regionCount, long tokenCount, int ngramSize) {
        this.formatVersion = formatVersion;
        this.buildTimestamp = buildTimestamp;
        this.regionCount = regionCount;
        this.tokenCount = tokenCount;
        this.ngramSize = ngramSize;
    }

    public int formatVersion() {
        return formatVersion;
    }

    /** 构建完成时间,epoch 毫秒。 */
    public long buildTimestamp() {
        return buildTimestamp;
    }

    public int regionCount() {
        return regionCount;
    }

    /** 所有前缀树、倒排表和 n-gram 表中不同词项数之和。 */
    public long tokenCount() {
        return tokenCount;
    }

    public int ngramSize() {
        return ngramSize;
    }

    public void serialize(DataOutput out) throws IOException {
        out.writeInt(formatVersion);
        out.writeLong(buildTimestamp);
        out.writeInt(regionCount);
        out.writeLong(tokenCount);
        out.writeInt(ngramSize);
    }

    public static BuildMetadata deserialize(DataInput in) throws IOException {
        return new BuildMetadata(
                in.readInt(), in.readLong(), in.readInt(), in.readLong(), in.readInt());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        BuildMetadata that = (BuildMetadata) o;
        return formatVersion == that.formatVersion
                && buildTimestamp == that.buildTimestamp
                && regionCount == that.regionCount
                && tokenCount == that.tokenCount
                && ngramSize == that.ngramSize;
    }

    @Override
    public int hashCode() {
        return Objects.hash(formatVersion, buildTimestamp, regionCount, tokenCount, ngramSize);
    }

    @Override
    public String toString() {
        return "BuildMetadata{formatVersion="
                + formatVersion
                + ", buildTime="
                + Instant.ofEpochMilli(buildTimestamp)
                + ", regionCount="
                + regionCount
                + ", tokenCount="
                + tokenCount
                + ", ngramSize="
                + ngramSize
                + "}";
    }
}
