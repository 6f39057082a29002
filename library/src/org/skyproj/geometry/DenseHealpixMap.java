/*
 * Copyright 2026 The Skyproj Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.skyproj.geometry;

import it.unimi.dsi.fastutil.longs.LongArrayList;

/**
 * A full-sky HEALPix map stored as an array indexed by pixel id. The resolution is implied by the
 * array length, which must be 12 * nside^2. Pixels holding {@link Healpix#UNSEEN} or NaN have no
 * data.
 */
public final class DenseHealpixMap extends PixelSource {
  private final double[] values;

  /** Wraps {@code values}, which is not copied and must not be modified afterwards. */
  public DenseHealpixMap(double[] values, HealpixOrdering ordering) {
    this(values, ordering, ValueType.FLOAT64);
  }

  /** As above, tagging the values with the given type. */
  public DenseHealpixMap(double[] values, HealpixOrdering ordering, ValueType valueType) {
    super(Healpix.INSTANCE.npixelToNside(values.length), ordering, valueType);
    this.values = values;
  }

  @Override
  public Kind kind() {
    return Kind.DENSE;
  }

  /** Returns the number of pixels in the map. */
  public int size() {
    return values.length;
  }

  /** Returns the value stored for {@code pixel}. */
  public double get(long pixel) {
    return values[(int) pixel];
  }

  /** Returns true if {@code value} marks a pixel without data. */
  public static boolean isUnseen(double value) {
    return Double.isNaN(value) || SkyMath.isClose(value, Healpix.UNSEEN);
  }

  @Override
  public long[] validPixels() {
    LongArrayList pixels = new LongArrayList();
    for (int i = 0; i < values.length; i++) {
      if (!isUnseen(values[i])) {
        pixels.add(i);
      }
    }
    return pixels.toLongArray();
  }
}
