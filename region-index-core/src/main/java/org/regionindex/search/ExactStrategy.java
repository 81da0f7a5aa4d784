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

import org.regionindex.bitmap.BitmapIndex;
import org.regionindex.build.TokenVariants;
import org.regionindex.index.RegionIndex;
import org.regionindex.index.TokenField;

import java.util.ArrayList;
import java.util.List;

/** 在全部倒排表中精确查找紧凑查询文本;路径查询额外查找以 {@code >} 连接的规范形式。 */
class ExactStrategy implements SearchStrategy {

    @Override
    public StrategyKind kind() {
        return StrategyKind.EXACT;
    }

    @Override
    public List<MatchSignal> search(ParsedQuery query, RegionIndex index) {
        BitmapIndex ids = new BitmapIndex();
        for (TokenField field : TokenField.values()) {
            ids = ids.union(index.inverted(field).lookup(query.text()));
        }
        if (query.pieces().size() >= 2) {
            String canonical = String.join(TokenVariants.PATH_SEPARATOR, query.pieces());
            ids = ids.union(index.inverted(TokenField.PATH).lookup(canonical));
        }

        List<MatchSignal> signals = new ArrayList<>(ids.cardinality());
        ids.forEach(id -> signals.add(MatchSignal.exact(id, StrategyKind.EXACT)));
        return signals;
    }
}
