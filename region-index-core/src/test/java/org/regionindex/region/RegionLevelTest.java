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

package org.regionindex.region;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Tests for {@link RegionLevel}. */
public class RegionLevelTest {

    @Test
    public void testParseLabelNameAndRank() {
        assertThat(RegionLevel.parse("省级")).isEqualTo(RegionLevel.PROVINCE);
        assertThat(RegionLevel.parse("市级")).isEqualTo(RegionLevel.CITY);
        assertThat(RegionLevel.parse(" city ")).isEqualTo(RegionLevel.CITY);
        assertThat(RegionLevel.parse("County")).isEqualTo(RegionLevel.COUNTY);
        assertThat(RegionLevel.parse("4")).isEqualTo(RegionLevel.SUBDISTRICT);
    }

    @Test
    public void testAmbiguousLabelResolvesToDistrict() {
        assertThat(RegionLevel.parse("区县级")).isEqualTo(RegionLevel.DISTRICT);
        assertThat(RegionLevel.parse("3")).isEqualTo(RegionLevel.DISTRICT);
    }

    @Test
    public void testUnknownLevel() {
        assertThatThrownBy(() -> RegionLevel.parse("乡级"))
                .isInstanceOf(DataIntegrityException.class)
                .hasMessageContaining("乡级");
        assertThatThrownBy(() -> RegionLevel.parse("  "))
                .isInstanceOf(DataIntegrityException.class);
        assertThatThrownBy(() -> RegionLevel.parse(null))
                .isInstanceOf(DataIntegrityException.class);
    }
}
