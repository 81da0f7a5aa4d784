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

/** 检索策略。 */
public enum StrategyKind {
    /** 在全部倒排表中精确查找。 */
    EXACT,
    /** 前缀树前缀查找。 */
    PREFIX,
    /** 按层级路径有序匹配。 */
    PATH,
    /** 拼音片段组合,逐级限定到下级区域。 */
    COMBO,
    /** n-gram 预过滤后按编辑距离或包含关系匹配,仅作为兜底。 */
    FUZZY
}
