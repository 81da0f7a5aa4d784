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

package org.regionindex.utils;

/** 编辑距离计算。 */
public final class EditDistance {

    /**
     * 计算两个字符串的 Levenshtein 距离,超过 {@code bound} 时提前结束。
     *
     * <p>使用两行滚动数组;某一行的最小值已经超过上限时,最终距离必然超过上限。
     *
     * @return 距离,超过上限时返回 -1
     */
    public static int bounded(String a, String b, int bound) {
        int n = a.length();
        int m = b.length();
        if (Math.abs(n - m) > bound) {
            return -1;
        }
        int[] prev = new int[m + 1];
        int[] curr = new int[m + 1];
        for (int j = 0; j <= m; j++) {
            prev[j] = j;
        }
        for (int i = 1; i <= n; i++) {
            curr[0] = i;
            int rowMin = curr[0];
            char ca = a.charAt(i - 1);
            for (int j = 1; j <= m; j++) {
                int cost = ca == b.charAt(j - 1) ? 0 : 1;
                int v = Math.min(Math.min(curr[j - 1] + 1, prev[j] + 1), prev[j - 1] + cost);
                curr[j] = v;
                if (v < rowMin) {
                    rowMin = v;
                }
            }
            if (rowMin > bound) {
                return -1;
            }
            int[] t = prev;
            prev = curr;
            curr = t;
        }
        return prev[m] <= bound ? prev[m] : -1;
    }

    /** 不设上限的 Levenshtein 距离。 */
    public static int distance(String a, String b) {
        return bounded(a, b, Math.max(a.length(), b.length()));
    }

    private EditDistance() {}
}
