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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonGetter;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import javax.annotation.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 构建输入中的一条区域记录,对应 ETL 输出 JSON 数组中的一个对象。
 *
 * <pre>{@code
 * {
 *   "code": "440600",
 *   "name": "佛山市",
 *   "level": "市级",
 *   "parent_code": "440000",
 *   "pinyin": "foshan",
 *   "pinyin_short": "fs",
 *   "alias": ["禅城"]
 * }
 * }</pre>
 *
 * <p>{@code id} 可省略,由构建器分配。父节点优先按 {@code parent_id} 解析,其次按 {@code parent_code}。
 * 未知字段被忽略。
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RegionRecord {

    private static final String FIELD_ID = "id";
    private static final String FIELD_CODE = "code";
    private static final String FIELD_NAME = "name";
    private static final String FIELD_LEVEL = "level";
    private static final String FIELD_PARENT_ID = "parent_id";
    private static final String FIELD_PARENT_CODE = "parent_code";
    private static final String FIELD_PINYIN = "pinyin";
    private static final String FIELD_PINYIN_SHORT = "pinyin_short";
    private static final String FIELD_ALIAS = "alias";
    private static final String FIELD_SHORT_NAME = "short_name";

    @Nullable private final Integer id;
    @Nullable private final String code;
    @Nullable private final String name;
    @Nullable private final String level;
    @Nullable private final Integer parentId;
    @Nullable private final String parentCode;
    @Nullable private final String pinyin;
    @Nullable private final String pinyinShort;
    private final List<String> aliases;

    @JsonCreator
    public RegionRecord(
            @JsonProperty(FIELD_ID) @Nullable Integer id,
            @JsonProperty(FIELD_CODE) @Nullable String code,
            @JsonProperty(FIELD_NAME) @Nullable String name,
            @JsonProperty(FIELD_LEVEL) @Nullable String level,
            @JsonProperty(FIELD_PARENT_ID) @Nullable Integer parentId,
            @JsonProperty(FIELD_PARENT_CODE) @Nullable String parentCode,
            @JsonProperty(FIELD_PINYIN) @Nullable String pinyin,
            @JsonProperty(FIELD_PINYIN_SHORT) @Nullable String pinyinShort,
            @JsonProperty(FIELD_ALIAS)
                    @JsonFormat(with = JsonFormat.Feature.ACCEPT_SINGLE_VALUE_AS_ARRAY)
                    @Nullable
                    List<String> aliases,
            @JsonProperty(FIELD_SHORT_NAME) @Nullable String shortName) {
        this.id = id;
        this.code = emptyToNull(code);
        this.name = name;
        this.level = level;
        this.parentId = parentId;
        this.parentCode = emptyToNull(parentCode);
        this.pinyin = pinyin;
        this.pinyinShort = pinyinShort;
        List<String> allAliases = new ArrayList<>();
        if (aliases != null) {
            for (String alias : aliases) {
                if (alias != null && !alias.trim().isEmpty()) {
                    allAliases.add(alias.trim());
                }
            }
        }
        if (shortName != null && !shortName.trim().isEmpty()) {
            allAliases.add(shortName.trim());
        }
        this.aliases = Collections.unmodifiableList(allAliases);
    }

    public static Builder builder(String name, String level) {
        return new Builder(name, level);
    }

    @JsonGetter(FIELD_ID)
    @Nullable
    public Integer id() {
        return id;
    }

    @JsonGetter(FIELD_CODE)
    @Nullable
    public String code() {
        return code;
    }

    @JsonGetter(FIELD_NAME)
    @Nullable
    public String name() {
        return name;
    }

    @JsonGetter(FIELD_LEVEL)
    @Nullable
    public String level() {
        return level;
    }

    @JsonGetter(FIELD_PARENT_ID)
    @Nullable
    public Integer parentId() {
        return parentId;
    }

    @JsonGetter(FIELD_PARENT_CODE)
    @Nullable
    public String parentCode() {
        return parentCode;
    }

    @JsonGetter(FIELD_PINYIN)
    @Nullable
    public String pinyin() {
        return pinyin;
    }

    @JsonGetter(FIELD_PINYIN_SHORT)
    @Nullable
    public String pinyinShort() {
        return pinyinShort;
    }

    @JsonGetter(FIELD_ALIAS)
    public List<String> aliases() {
        return aliases;
    }

    @Nullable
    private static String emptyToNull(@Nullable String value) {
        return value == null || value.trim().isEmpty() ? null : value.trim();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        RegionRecord that = (RegionRecord) o;
        return Objects.equals(id, that.id)
                && Objects.equals(code, that.code)
                && Objects.equals(name, that.name)
                && Objects.equals(level, that.level)
                && Objects.equals(parentId, that.parentId)
                && Objects.equals(parentCode, that.parentCode)
                && Objects.equals(pinyin, that.pinyin)
                && Objects.equals(pinyinShort, that.pinyinShort)
                && aliases.equals(that.aliases);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, code, name, level, parentId, parentCode, pinyin, pinyinShort);
    }

    @Override
    public String toString() {
        return "RegionRecord{id="
                + id
                + ", code="
                + code
                + ", name="
                + name
                + ", level="
                + level
                + ", parentId="
                + parentId
                + ", parentCode="
                + parentCode
                + "}";
    }

    /** 在代码中构造记录,主要用于测试和嵌入式场景。 */
    public static final class Builder {

        private final String name;
        private final String level;
        @Nullable private Integer id;
        @Nullable private String code;
        @Nullable private Integer parentId;
        @Nullable private String parentCode;
        @Nullable private String pinyin;
        @Nullable private String pinyinShort;
        private final List<String> aliases = new ArrayList<>();

        private Builder(String name, String level) {
            this.name = name;
            this.level = level;
        }

        public Builder id(int id) {
            this.id = id;
            return this;
        }

        public Builder code(String code) {
            this.code = code;
            return this;
        }

        public Builder parentId(int parentId) {
            this.parentId = parentId;
            return this;
        }

        public Builder parentCode(String parentCode) {
            this.parentCode = parentCode;
            return this;
        }

        public Builder pinyin(String pinyin, String pinyinShort) {
            this.pinyin = pinyin;
            this.pinyinShort = pinyinShort;
            return this;
        }

        public Builder aliases(String... aliases) {
            this.aliases.addAll(Arrays.asList(aliases));
            return this;
        }

        public RegionRecord build() {
            return new RegionRecord(
                    id, code, name, level, parentId, parentCode, pinyin, pinyinShort, aliases, null);
        }
    }
}
