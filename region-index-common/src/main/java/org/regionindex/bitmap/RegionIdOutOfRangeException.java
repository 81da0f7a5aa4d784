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

/** 访问了负数或不存在的区域 id。出现该异常通常说明调用方存在缺陷。 */
public class RegionIdOutOfRangeException extends IndexOutOfBoundsException {

    private static final long serialVersionUID = 1L;

    public RegionIdOutOfRangeException(int id) {
        super("Region id out of range: " + id);
    }

    public RegionIdOutOfRangeException(String message) {
        super(message);
    }
}
