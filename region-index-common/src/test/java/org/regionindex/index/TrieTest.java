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

import org.regionindex.bitmap.BitmapIndex;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Tests for {@link Trie}. */
public class TrieTest {

    private static Trie sampleTrie() {
        Trie trie = new Trie();
        trie.insert("广东省", 0);
        trie.insert("广东", 0);
        trie.insert("广州市", 2);
        trie.insert("广州", 2);
        trie.insert("佛山市", 1);
        trie.insert("佛山", 1);
        return trie;
    }

    @Test
    public void testPrefixAndExactSearch() {
        Trie trie = sampleTrie();

        assertThat(trie.prefixSearch("广").toArray()).containsExactly(0, 2);
        assertThat(trie.prefixSearch("广东").toArray()).containsExactly(0);
        assertThat(trie.prefixSearch("深").isEmpty()).isTrue();
        assertThat(trie.prefixSearch("广东省佛山").isEmpty()).isTrue();

        assertThat(trie.exactSearch("佛山").toArray()).containsExactly(1);
        assertThat(trie.exactSearch("佛").isEmpty()).isTrue();
        assertThat(trie.tokenCount()).isEqualTo(6);
    }

    @Test
    public void testPrefixMonotonicity() {
        Trie trie = sampleTrie();
        String token = "广东省";
        for (int i = 1; i <= token.length(); i++) {
            BitmapIndex shorter = trie.prefixSearch(token.substring(0, i - 1));
            BitmapIndex longer = trie.prefixSearch(token.substring(0, i));
            assertThat(shorter.intersect(longer)).isEqualTo(longer);
        }
    }

    @Test
    public void testRepeatedInsertIsIdempotent() {
        Trie trie = new Trie();
        trie.insert("foshan", 1);
        trie.insert("foshan", 1);

        assertThat(trie.tokenCount()).isEqualTo(1);
        assertThat(trie.exactSearch("foshan").toArray()).containsExactly(1);
        assertThat(trie.prefixSearch("fo").toArray()).containsExactly(1);
    }

    @Test
    public void testLongestTerminalPrefix() {
        Trie trie = sampleTrie();

        assertThat(trie.longestTerminalPrefix("广东省佛山市", 0)).isEqualTo(3);
        assertThat(trie.longestTerminalPrefix("广东佛山", 0)).isEqualTo(2);
        assertThat(trie.longestTerminalPrefix("广东佛山", 2)).isEqualTo(2);
        assertThat(trie.longestTerminalPrefix("深圳", 0)).isEqualTo(0);
    }

    @Test
    public void testFreeze() {
        Trie trie = sampleTrie().freeze();
        assertThatThrownBy(() -> trie.insert("深圳", 3)).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> new Trie().insert("", 3))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    public void testSerialization() throws IOException {
        Trie trie = sampleTrie().freeze();

        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        trie.serialize(new DataOutputStream(bytes));
        Trie restored =
                Trie.deserialize(new DataInputStream(new ByteArrayInputStream(bytes.toByteArray())));

        assertThat(restored.tokenCount()).isEqualTo(trie.tokenCount());
        Map<String, BitmapIndex> expected = new LinkedHashMap<>();
        trie.forEachToken(expected::put);
        Map<String, BitmapIndex> actual = new LinkedHashMap<>();
        restored.forEachToken(actual::put);
        assertThat(actual).containsExactlyEntriesOf(expected);
        assertThat(restored.prefixSearch("广").toArray()).containsExactly(0, 2);
    }
}
