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

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/** Tests for {@link EditDistance}. */
public class EditDistanceTest {

    @Test
    public void testDistance() {
        assertThat(EditDistance.distance("foshan", "foshan")).isEqualTo(0);
        assertThat(EditDistance.distance("fozan", "foshan")).isEqualTo(2);
        assertThat(EditDistance.distance("kitten", "sitting")).isEqualTo(3);
        assertThat(EditDistance.distance("", "abc")).isEqualTo(3);
        assertThat(EditDistance.distance("佛山", "佛山市")).isEqualTo(1);
    }

    @Test
    public void testBoundedDistance() {
        assertThat(EditDistance.bounded("fozan", "foshan", 2)).isEqualTo(2);
        assertThat(EditDistance.bounded("fozan", "foshan", 1)).isEqualTo(-1);
        assertThat(EditDistance.bounded("gz", "guangzhou", 2)).isEqualTo(-1);
        assertThat(EditDistance.bounded("shenzen", "shenzhen", 1)).isEqualTo(1);
    }
}
