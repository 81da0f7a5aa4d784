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

package org.regionindex.bitmap;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Tests for {@link BitmapIndex}. */
public class BitmapIndexTest {

    @Test
    public void testBasicOperations() {
        BitmapIndex bitmap = new BitmapIndex();
        assertThat(bitmap.isEmpty()).isTrue();

        bitmap.add(5);
        bitmap.add(1);
        bitmap.add(5);
        bitmap.add(100_000);

        assertThat(bitmap.cardinality()).isEqualTo(3);
        assertThat(bitmap.contains(1)).isTrue();
        assertThat(bitmap.contains(2)).isFalse();
        assertThat(bitmap.contains(-1)).isFalse();
        assertThat(bitmap.toArray()).containsExactly(1, 5, 100_000);

        List<Integer> visited = new ArrayList<>();
        bitmap.forEach(visited::add);
        assertThat(visited).containsExactly(1, 5, 100_000);
    }

    @Test
    public void testUnionAndIntersectDoNotMutateOperands() {
        BitmapIndex a = BitmapIndex.of(1, 2, 3);
        BitmapIndex b = BitmapIndex.of(3, 4);

        assertThat(a.union(b).toArray()).containsExactly(1, 2, 3, 4);
        assertThat(a.intersect(b).toArray()).containsExactly(3);
        assertThat(a.union(b)).isEqualTo(b.union(a));
        assertThat(a.intersect(b)).isEqualTo(b.intersect(a));

        assertThat(a.toArray()).containsExactly(1, 2, 3);
        assertThat(b.toArray()).containsExactly(3, 4);
    }

    @Test
    public void testAssociativity() {
        BitmapIndex a = BitmapIndex.of(1, 7);
        BitmapIndex b = BitmapIndex.of(2, 7, 9);
        BitmapIndex c = BitmapIndex.of(7, 9, 11);

        assertThat(a.union(b).union(c)).isEqualTo(a.union(b.union(c)));
        assertThat(a.intersect(b).intersect(c)).isEqualTo(a.intersect(b.intersect(c)));
    }

    @Test
    public void testNegativeIdIsRejected() {
        BitmapIndex bitmap = new BitmapIndex();
        assertThatThrownBy(() -> bitmap.add(-3))
                .isInstanceOf(RegionIdOutOfRangeException.class)
                .isInstanceOf(IndexOutOfBoundsException.class);
    }

    @Test
    public void testFrozenBitmapRejectsAdd() {
        BitmapIndex bitmap = BitmapIndex.of(1).freeze();
        assertThat(bitmap.isFrozen()).isTrue();
        assertThatThrownBy(() -> bitmap.add(2)).isInstanceOf(IllegalStateException.class);
        // 冻结后的集合仍可参与集合运算
        assertThat(bitmap.union(BitmapIndex.of(2)).cardinality()).isEqualTo(2);
    }

    @Test
    public void testSerialization() throws IOException {
        BitmapIndex bitmap = new BitmapIndex();
        for (int i = 0; i < 10_000; i += 3) {
            bitmap.add(i);
        }

        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        bitmap.serialize(new DataOutputStream(bytes));
        BitmapIndex restored =
                BitmapIndex.deserialize(
                        new DataInputStream(new ByteArrayInputStream(bytes.toByteArray())));

        assertThat(restored).isEqualTo(bitmap);
        assertThat(restored.isFrozen()).isTrue();
    }
}
