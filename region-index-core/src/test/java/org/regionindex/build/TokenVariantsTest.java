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

package org.regionindex.build;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.assertj.core.api.Assertions.assertThat;

/** Tests for {@link TokenVariants}. */
public class TokenVariantsTest {

    @Test
    public void testNameTokensStripSuffix() {
        assertThat(TokenVariants.nameTokens("广东省", Collections.emptyList()))
                .containsExactly("广东省", "广东");
        assertThat(TokenVariants.nameTokens("广西壮族自治区", Collections.singletonList("桂")))
                .containsExactly("广西壮族自治区", "广西壮族", "桂");
        // too short to strip
        assertThat(TokenVariants.nameTokens("沙市", Collections.emptyList())).containsExactly("沙市");
    }

    @Test
    public void testPinyinTokens() {
        assertThat(
                        TokenVariants.pinyinTokens(
                                "广东省", "Guang Dong Sheng", Arrays.asList("Canton", "粤")))
                .containsExactly("guangdongsheng", "guangdong", "canton");
        assertThat(TokenVariants.pinyinTokens("西安市", "xi'an", Collections.emptyList()))
                .containsExactly("xian");
    }

    @Test
    public void testShortPinyinTokens() {
        assertThat(TokenVariants.shortPinyinTokens("广东省", "gds")).containsExactly("gds", "gd");
        assertThat(TokenVariants.shortPinyinTokens("广东省", "gd")).containsExactly("gd");
        assertThat(TokenVariants.shortPinyinTokens("广东省", "")).isEmpty();
    }

    @Test
    public void testPathTokens() {
        assertThat(TokenVariants.pathTokens(Collections.singletonList("广东省"))).isEmpty();
        assertThat(TokenVariants.pathTokens(Arrays.asList("广东省", "佛山市")))
                .containsExactly("广东省佛山市", "广东省>佛山市");
    }

    @Test
    public void testCjkDetection() {
        assertThat(TokenVariants.containsCjk("abc佛")).isTrue();
        assertThat(TokenVariants.containsCjk("foshan")).isFalse();
        assertThat(TokenVariants.normalizeLatin(" Xi'An ")).isEqualTo("xian");
    }
}
