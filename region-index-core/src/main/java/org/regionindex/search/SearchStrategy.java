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

import org.regionindex.index.RegionIndex;

import java.util.List;

/** 一种检索策略。实现必须无状态,可在多个线程上对同一个冻结索引并发执行。 */
public interface SearchStrategy {

    StrategyKind kind();

    /** 返回匹配证据,没有匹配时返回空列表。同一区域可以出现多次,由评分器取最优。 */
    List<MatchSignal> search(ParsedQuery query, RegionIndex index);
}
