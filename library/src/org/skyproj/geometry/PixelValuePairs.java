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

import java.util.Arrays;

/**
 * Parallel arrays of HEALPix pixel ids and their values, in no particular order. The pixel ids
 * must be unique; this is checked by {@link #findValidationError(SkyError)} when the pairs are
 * rasterized, not at construction.
 */
public final class PixelValuePairs extends PixelSource {
  private final long[] pixels;
  private final double[] values;

  /** Wraps the given arrays, which are not copied and must not be modified afterwards. */
  public PixelValuePairs(int nside, HealpixOrdering ordering, long[] pixels, double[] values) {
    this(nside, ordering, pixels, values, ValueType.FLOAT64);
  }

  /** As above, tagging the values with the given type. */
  public PixelValuePairs(
      int nside, HealpixOrdering ordering, long[] pixels, double[] values, ValueType valueType) {
    super(nside, ordering, valueType);
    this.pixels = pixels;
    this.values = values;
  }

  @Override
  public Kind kind() {
    return Kind.EXPLICIT_PAIRS;
  }

  /** Returns the number of pairs. */
  public int size() {
    return pixels.length;
  }

  /** Returns the pixel id of pair {@code i}. */
  public long pixel(int i) {
    return pixels[i];
  }

  /** Returns the value of pair {@code i}. */
  public double value(int i) {
    return values[i];
  }

  /** Returns the pixel ids. The array must not be modified. */
  long[] pixels() {
    return pixels;
  }

  @Override
  public long[] validPixels() {
    long[] sorted = pixels.clone();
    Arrays.sort(sorted);
    return sorted;
  }

  /**
   * Returns true if the pairs are invalid, in which case {@code error} describes the first problem
   * found: arrays of different lengths or a repeated pixel id.
   */
  public boolean findValidationError(SkyError error) {
    if (pixels.length != values.length) {
      error.init(
          SkyError.Code.LENGTH_MISMATCH,
          "pixels and values have different lengths: %s != %s",
          pixels.length,
          values.length);
      return true;
    }
    long[] sorted = validPixels();
    for (int i = 1; i < sorted.length; i++) {
      if (sorted[i] == sorted[i - 1]) {
        error.init(
            SkyError.Code.DUPLICATE_PIXELS, "The pixels array must be unique: %s", sorted[i]);
        return true;
      }
    }
    return false;
  }

  /** Returns true if the pairs pass {@link #findValidationError(SkyError)}. */
  public boolean isValid() {
    return !findValidationError(new SkyError());
  }
}
