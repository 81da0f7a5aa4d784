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

import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Tests for {@link NgramIndex}. */
public class NgramIndexTest {

    @Test
    public void testWindows() {
        assertThat(NgramIndex.windows("foshan", 2)).containsExactly("fo", "os", "sh", "ha", "an");
        assertThat(NgramIndex.windows("aaa", 2)).containsExactly("aa");
        assertThat(NgramIndex.windows("佛", 2)).containsExactly("佛");
        assertThat(NgramIndex.windows("", 2)).isEmpty();
    }

    @Test
    public void testCandidates() {
        NgramIndex index = new NgramIndex(2);
        index.insert("foshan", 1);
        index.insert("fuzhou", 8);
        index.insert("shenzhen", 3);

        // fozan 与 foshan 共享 fo、an
        assertThat(index.candidates("fozan").toArray()).containsExactly(1);
        assertThat(index.candidates("zh").toArray()).containsExactly(3, 8);
        assertThat(index.candidates("qq").isEmpty()).isTrue();
        assertThat(index.lookup("sh").toArray()).containsExactly(1, 3);
    }

    @Test
    public void testShortTextIsOneWindow() {
        NgramIndex index = new NgramIndex(3);
        index.insert("佛山", 1);
        assertThat(index.candidates("佛山").toArray()).containsExactly(1);
        assertThat(index.gramCount()).isEqualTo(1);
    }

    @Test
    public void testInvalidSize() {
        assertThatThrownBy(() -> new NgramIndex(0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    public void testSerialization() throws IOException {
        NgramIndex index = new NgramIndex(2);
        index.insert("广东省", 0);
        index.insert("广州市", 2);
        index.freeze();

        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        index.serialize(new DataOutputStream(bytes));
        NgramIndex restored =
                NgramIndex.deserialize(
                        new DataInputStream(new ByteArrayInputStream(bytes.toByteArray())));

        assertThat(restored.n()).isEqualTo(2);
        assertThat(restored.grams()).isEqualTo(index.grams());
    }
}
