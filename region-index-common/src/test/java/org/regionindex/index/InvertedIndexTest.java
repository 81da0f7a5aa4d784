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

/** Tests for {@link InvertedIndex}. */
public class InvertedIndexTest {

    @Test
    public void testLookup() {
        InvertedIndex index = new InvertedIndex();
        index.insert("gd", 0);
        index.insert("gd", 7);
        index.insert("fs", 1);

        assertThat(index.lookup("gd").toArray()).containsExactly(0, 7);
        assertThat(index.lookup("xx").isEmpty()).isTrue();
        assertThat(index.containsToken("fs")).isTrue();
        assertThat(index.tokenCount()).isEqualTo(2);
        assertThat(index.tokens()).containsExactlyInAnyOrder("gd", "fs");
    }

    @Test
    public void testSerializationIsDeterministic() throws IOException {
        InvertedIndex first = new InvertedIndex();
        first.insert("b", 2);
        first.insert("a", 1);
        InvertedIndex second = new InvertedIndex();
        second.insert("a", 1);
        second.insert("b", 2);

        byte[] firstBytes = serialize(first);
        assertThat(firstBytes).isEqualTo(serialize(second));

        InvertedIndex restored =
                InvertedIndex.deserialize(
                        new DataInputStream(new ByteArrayInputStream(firstBytes)));
        assertThat(restored.postings()).isEqualTo(first.postings());
    }

    private static byte[] serialize(InvertedIndex index) throws IOException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        index.freeze().serialize(new DataOutputStream(bytes));
        return bytes.toByteArray();
    }
}
