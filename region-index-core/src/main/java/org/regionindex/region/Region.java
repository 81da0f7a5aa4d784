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

package org.regionindex.region;

import javax.annotation.Nullable;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import static org.regionindex.utils.Preconditions.checkArgument;
import static org.regionindex.utils.Preconditions.checkNotNull;

/**
 * 一个行政区划。
 *
 * <p>区域由 {@code RegionIndexBuilder} 批量创建,创建后不可变。父节点只以 id 引用,不持有对象;
 * {@link #path()} 与 {@link #pathIds()} 从根到自身排列,长度等于深度加一。
 */
public final class Region implements Serializable {

    private static final long serialVersionUID = 1L;

    /** 路径展示时使用的分隔符。 */
    public static final String DISPLAY_SEPARATOR = " > ";

    private final int id;
    @Nullable private final String code;
    private final String name;
    private final RegionLevel level;
    private final String pinyinFull;
    private final String pinyinShort;
    @Nullable private final Integer parentId;
    private final List<Integer> children;
    private final List<String> path;
    private final List<Integer> pathIds;
    private final List<String> aliases;

    public Region(
            int id,
            @Nullable String code,
            String name,
            RegionLevel level,
            String pinyinFull,
            String pinyinShort,
            @Nullable Integer parentId,
            List<Integer> children,
            List<String> path,
            List<Integer> pathIds,
            List<String> aliases) {
        checkArgument(id >= 0, "Region id must not be negative, but is %s", id);
        checkArgument(
                path.size() == pathIds.size() && !path.isEmpty(),
                "Path of region %s does not match its path ids.",
                id);
        this.id = id;
        this.code = code;
        this.name = checkNotNull(name);
        this.level = checkNotNull(level);
        this.pinyinFull = pinyinFull == null ? "" : pinyinFull;
        this.pinyinShort = pinyinShort == null ? "" : pinyinShort;
        this.parentId = parentId;
        this.children = Collections.unmodifiableList(new ArrayList<>(children));
        this.path = Collections.unmodifiableList(new ArrayList<>(path));
        this.pathIds = Collections.unmodifiableList(new ArrayList<>(pathIds));
        this.aliases = Collections.unmodifiableList(new ArrayList<>(aliases));
    }

    public int id() {
        return id;
    }

    @Nullable
    public String code() {
        return code;
    }

    public String name() {
        return name;
    }

    public RegionLevel level() {
        return level;
    }

    public String pinyinFull() {
        return pinyinFull;
    }

    public String pinyinShort() {
        return pinyinShort;
    }

    @Nullable
    public Integer parentId() {
        return parentId;
    }

    public boolean isRoot() {
        return parentId == null;
    }

    /** 子区域 id,升序。 */
    public List<Integer> children() {
        return children;
    }

    /** 从根到自身的名称。 */
    public List<String> path() {
        return path;
    }

    /** 从根到自身的 id。 */
    public List<Integer> pathIds() {
        return pathIds;
    }

    public List<String> aliases() {
        return aliases;
    }

    public int depth() {
        return path.size() - 1;
    }

    /** 例如 {@code 广东省 > 佛山市}。 */
    public String displayPath() {
        return String.join(DISPLAY_SEPARATOR, path);
    }

    /** 是否为 {@code ancestorId} 的后代(不含自身)。 */
    public boolean isDescendantOf(int ancestorId) {
        for (int i = 0; i < pathIds.size() - 1; i++) {
            if (pathIds.get(i) == ancestorId) {
                return true;
            }
        }
        return false;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Region that = (Region) o;
        return id == that.id
                && Objects.equals(code, that.code)
                && name.equals(that.name)
                && level == that.level
                && pinyinFull.equals(that.pinyinFull)
                && pinyinShort.equals(that.pinyinShort)
                && Objects.equals(parentId, that.parentId)
                && children.equals(that.children)
                && path.equals(that.path)
                && pathIds.equals(that.pathIds)
                && aliases.equals(that.aliases);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, code, name, level, parentId);
    }

    @Override
    public String toString() {
        return "Region{id="
                + id
                + ", code="
                + code
                + ", name="
                + name
                + ", level="
                + level
                + ", path="
                + displayPath()
                + "}";
    }
}
