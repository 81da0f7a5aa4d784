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

import org.roaringbitmap.RoaringBitmap;

import java.io.DataInput;
import java.io.DataOutput;
import java.io.IOException;
import java.util.Objects;
import java.util.function.IntConsumer;

/**
 * 区域 id 的压缩集合,是各索引结构之间传递候选集的基本单位。
 *
 * <p>底层使用 {@link RoaringBitmap},按密度自动选择数组、位图或游程容器。{@link #union} 与
 * {@link #intersect} 总是返回新对象,不修改任何一个操作数,因此满足交换律和结合律。
 *
 * <p>调用 {@link #freeze()} 后集合不可再修改,可以在多个线程间无锁共享。
 */
public class BitmapIndex {

    private final RoaringBitmap bitmap;

    private volatile boolean frozen;

    public BitmapIndex() {
        this(new RoaringBitmap());
    }

    private BitmapIndex(RoaringBitmap bitmap) {
        this.bitmap = bitmap;
    }

    public static BitmapIndex of(int... ids) {
        BitmapIndex index = new BitmapIndex();
        for (int id : ids) {
            index.add(id);
        }
        return index;
    }

    /**
     * 添加一个区域 id。
     *
     * @throws RegionIdOutOfRangeException id 为负数时抛出
     * @throws IllegalStateException 集合已冻结时抛出
     */
    public void add(int id) {
        if (id < 0) {
            throw new RegionIdOutOfRangeException(id);
        }
        if (frozen) {
            throw new IllegalStateException("Cannot add id " + id + " to a frozen bitmap.");
        }
        bitmap.add(id);
    }

    public BitmapIndex union(BitmapIndex other) {
        return new BitmapIndex(RoaringBitmap.or(bitmap, other.bitmap));
    }

    public BitmapIndex intersect(BitmapIndex other) {
        return new BitmapIndex(RoaringBitmap.and(bitmap, other.bitmap));
    }

    public boolean contains(int id) {
        return id >= 0 && bitmap.contains(id);
    }

    public int cardinality() {
        return bitmap.getCardinality();
    }

    public boolean isEmpty() {
        return bitmap.isEmpty();
    }

    /** 按升序返回全部 id。 */
    public int[] toArray() {
        return bitmap.toArray();
    }

    public void forEach(IntConsumer consumer) {
        bitmap.forEach((org.roaringbitmap.IntConsumer) consumer::accept);
    }

    /** 冻结集合,之后的 {@link #add} 会失败。 */
    public BitmapIndex freeze() {
        if (!frozen) {
            bitmap.runOptimize();
            frozen = true;
        }
        return this;
    }

    public boolean isFrozen() {
        return frozen;
    }

    public void serialize(DataOutput out) throws IOException {
        if (!frozen) {
            bitmap.runOptimize();
        }
        bitmap.serialize(out);
    }

    /** 反序列化一个集合,结果已冻结。 */
    public static BitmapIndex deserialize(DataInput in) throws IOException {
        RoaringBitmap bitmap = new RoaringBitmap();
        bitmap.deserialize(in);
        return new BitmapIndex(bitmap).freeze();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        BitmapIndex that = (BitmapIndex) o;
        return Objects.equals(this.bitmap, that.bitmap);
    }

    @Override
    public int hashCode() {
        return bitmap.hashCode();
    }

    @Override
    public String toString() {
        return bitmap.toString();
    }
}
