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

import com.google.common.base.Preconditions;

/**
 * HEALPix-indexed data that can be rasterized. There are exactly three kinds, each resampled by its
 * own strategy in {@link HealpixRasterizer}; {@link #kind()} identifies which subclass an instance
 * is. Sources are read-only once handed to the rasterizer.
 */
public abstract class PixelSource {
  /** The kinds of pixel source. */
  public enum Kind {
    /** A {@link SparseHealpixMap}. */
    SPARSE,
    /** A {@link DenseHealpixMap}. */
    DENSE,
    /** A {@link PixelValuePairs}. */
    EXPLICIT_PAIRS
  }

  private final int nside;
  private final HealpixOrdering ordering;
  private final ValueType valueType;

  PixelSource(int nside, HealpixOrdering ordering, ValueType valueType) {
    Preconditions.checkArgument(nside > 0, "Invalid nside: %s", nside);
    this.nside = nside;
    this.ordering = Preconditions.checkNotNull(ordering);
    this.valueType = Preconditions.checkNotNull(valueType);
  }

  /** Returns which kind of source this is. */
  public abstract Kind kind();

  /** Returns the ids of the pixels that hold data, in increasing order. */
  public abstract long[] validPixels();

  /** Returns the resolution parameter the pixel ids are valid under. */
  public final int nside() {
    return nside;
  }

  /** Returns the ordering scheme of the pixel ids. */
  public final HealpixOrdering ordering() {
    return ordering;
  }

  /** Returns the type of the stored values. */
  public final ValueType valueType() {
    return valueType;
  }
}
