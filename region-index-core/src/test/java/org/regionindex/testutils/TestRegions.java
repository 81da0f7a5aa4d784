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

package org.regionindex.testutils;

import org.regionindex.build.RegionIndexBuilder;
import org.regionindex.index.RegionIndex;
import org.regionindex.options.RegionIndexOptions;
import org.regionindex.region.RegionRecord;

import java.util.ArrayList;
import java.util.List;

/** 测试用的小型区划数据集。 */
public final class TestRegions {

    public static final int GUANGDONG = 0;
    public static final int FOSHAN = 1;
    public static final int GUANGZHOU = 2;
    public static final int SHENZHEN = 3;
    public static final int SHUNDE = 4;
    public static final int BEIJING = 5;
    public static final int CHAOYANG = 6;
    public static final int FUJIAN = 7;
    public static final int FUZHOU = 8;

    private TestRegions() {}

    public static List<RegionRecord> records() {
        List<RegionRecord> records = new ArrayList<>();
        records.add(province(GUANGDONG, "440000", "广东省", "guangdong", "gd"));
        records.add(city(FOSHAN, "440600", "佛山市", "foshan", "fs", GUANGDONG));
        records.add(city(GUANGZHOU, "440100", "广州市", "guangzhou", "gz", GUANGDONG));
        records.add(city(SHENZHEN, "440300", "深圳市", "shenzhen", "sz", GUANGDONG));
        records.add(district(SHUNDE, "440606", "顺德区", "shunde", "sd", FOSHAN));
        records.add(province(BEIJING, "110000", "北京市", "beijing", "bj"));
        records.add(district(CHAOYANG, "110105", "朝阳区", "chaoyang", "cy", BEIJING));
        records.add(province(FUJIAN, "350000", "福建省", "fujian", "fj"));
        records.add(city(FUZHOU, "350100", "福州市", "fuzhou", "fz", FUJIAN));
        return records;
    }

    public static RegionIndex build() {
        return build(new RegionIndexOptions());
    }

    public static RegionIndex build(RegionIndexOptions options) {
        return new RegionIndexBuilder(options).addRecords(records()).build();
    }

    /** 安徽省及其下辖的合肥市、芜湖市,省份简拼以元音开头。 */
    public static RegionIndex buildAnhui() {
        return new RegionIndexBuilder()
                .addRecord(province(0, "340000", "安徽省", "anhui", "ah"))
                .addRecord(city(1, "340100", "合肥市", "hefei", "hf", 0))
                .addRecord(city(2, "340200", "芜湖市", "wuhu", "wh", 0))
                .build();
    }

    private static RegionRecord province(
            int id, String code, String name, String pinyin, String pinyinShort) {
        return RegionRecord.builder(name, "省级")
                .id(id)
                .code(code)
                .pinyin(pinyin, pinyinShort)
                .build();
    }

    private static RegionRecord city(
            int id, String code, String name, String pinyin, String pinyinShort, int parent) {
        return RegionRecord.builder(name, "市级")
                .id(id)
                .code(code)
                .parentId(parent)
                .pinyin(pinyin, pinyinShort)
                .build();
    }

    private static RegionRecord district(
            int id, String code, String name, String pinyin, String pinyinShort, int parent) {
        return RegionRecord.builder(name, "区县级")
                .id(id)
                .code(code)
                .parentId(parent)
                .pinyin(pinyin, pinyinShort)
                .build();
    }
}
