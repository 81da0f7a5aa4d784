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

package org.regionindex.search;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/** 查询分类,每类对应一组主策略。{@link StrategyKind#FUZZY} 不在其中,由引擎按候选数量决定。 */
public enum QueryType {
    CHINESE_NAME(EnumSet.of(StrategyKind.EXACT, StrategyKind.PREFIX, StrategyKind.PATH)),
    HIERARCHY_PATH(EnumSet.of(StrategyKind.PATH, StrategyKind.EXACT)),
    FULL_PINYIN(EnumSet.of(StrategyKind.EXACT, StrategyKind.PREFIX)),
    SHORT_PINYIN(EnumSet.of(StrategyKind.EXACT, StrategyKind.PREFIX)),
    COMBO_PINYIN(EnumSet.of(StrategyKind.COMBO, StrategyKind.EXACT, StrategyKind.PREFIX)),
    UNKNOWN(EnumSet.of(StrategyKind.EXACT, StrategyKind.PREFIX));

    private final Set<StrategyKind> primaryStrategies;

    QueryType(EnumSet<StrategyKind> primaryStrategies) {
        this.primaryStrategies = Collections.unmodifiableSet(primaryStrategies);
    }

    public Set<StrategyKind> primaryStrategies() {
        return primaryStrategies;
    }
}
