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
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import it.unimi.dsi.fastutil.longs.Long2ObjectOpenHashMap;
import java.util.Arrays;
import org.jspecify.annotations.Nullable;

/**
 * A HEALPix map that stores values only for the pixels that have data. Every stored pixel holds
 * {@link #width()} components: one for ordinary maps, one per bit for wide masks. Pixels not stored
 * read as the sentinel.
 *
 * <p>How the components become a rasterized value is decided by a {@link ValueReduction}; each map
 * carries a default one, {@link ValueReduction#SCALAR} for ordinary and boolean maps and {@link
 * ValueReduction#ANY_BIT} for wide masks.
 */
public final class SparseHealpixMap extends PixelSource {
  private final int width;
  private final double sentinel;
  private final ValueReduction defaultReduction;
  private final Long2ObjectOpenHashMap<double[]> values = new Long2ObjectOpenHashMap<>();
  private final double[] sentinelComponents;

  private SparseHealpixMap(
      int nside,
      HealpixOrdering ordering,
      ValueType valueType,
      int width,
      double sentinel,
      ValueReduction defaultReduction) {
    super(nside, ordering, valueType);
    Preconditions.checkArgument(width > 0, "Invalid width: %s", width);
    this.width = width;
    this.sentinel = sentinel;
    this.defaultReduction = defaultReduction;
    this.sentinelComponents = new double[width];
    Arrays.fill(sentinelComponents, sentinel);
  }

  /** Returns an empty floating point map whose sentinel is {@link Healpix#UNSEEN}. */
  public static SparseHealpixMap create(int nside, HealpixOrdering ordering) {
    return new SparseHealpixMap(
        nside, ordering, ValueType.FLOAT64, 1, Healpix.UNSEEN, ValueReduction.SCALAR);
  }

  /** Returns an empty integer map with the given sentinel. */
  public static SparseHealpixMap createInt(int nside, HealpixOrdering ordering, int sentinel) {
    return new SparseHealpixMap(
        nside, ordering, ValueType.INT32, 1, sentinel, ValueReduction.SCALAR);
  }

  /** Returns an empty boolean map. Pixels not stored read as false. */
  public static SparseHealpixMap createBoolean(int nside, HealpixOrdering ordering) {
    return new SparseHealpixMap(nside, ordering, ValueType.BOOLEAN, 1, 0, ValueReduction.SCALAR);
  }

  /** Returns an empty wide mask holding {@code numBits} bits per pixel. */
  public static SparseHealpixMap createWideMask(int nside, HealpixOrdering ordering, int numBits) {
    return new SparseHealpixMap(
        nside, ordering, ValueType.BOOLEAN, numBits, 0, ValueReduction.ANY_BIT);
  }

  @Override
  public Kind kind() {
    return Kind.SPARSE;
  }

  /** Returns the number of components stored per pixel. */
  public int width() {
    return width;
  }

  /** Returns the value that pixels without data read as. */
  public double sentinel() {
    return sentinel;
  }

  /** Returns true if this map is a wide mask, i.e. stores several bits per pixel. */
  public boolean isWideMask() {
    return defaultReduction == ValueReduction.ANY_BIT;
  }

  /** Returns the reduction used when the rasterizer is not given one explicitly. */
  public ValueReduction defaultReduction() {
    return defaultReduction;
  }

  /** Stores a single value for {@code pixel}. Only valid for maps of width 1. */
  @CanIgnoreReturnValue
  public SparseHealpixMap set(long pixel, double value) {
    Preconditions.checkState(width == 1, "Map has %s components per pixel", width);
    return setComponents(pixel, value);
  }

  /** Stores a boolean value for {@code pixel}. */
  @CanIgnoreReturnValue
  public SparseHealpixMap set(long pixel, boolean value) {
    return set(pixel, value ? 1 : 0);
  }

  /** Stores all the components for {@code pixel}. */
  @CanIgnoreReturnValue
  public SparseHealpixMap setComponents(long pixel, double... components) {
    checkPixel(pixel);
    Preconditions.checkArgument(
        components.length == width, "Expected %s components, got %s", width, components.length);
    values.put(pixel, components.clone());
    return this;
  }

  /** Sets the given bits of a wide mask pixel, keeping any bits already set. */
  @CanIgnoreReturnValue
  public SparseHealpixMap setBits(long pixel, int... bits) {
    checkPixel(pixel);
    double[] row = values.get(pixel);
    if (row == null) {
      row = new double[width];
      values.put(pixel, row);
    }
    for (int bit : bits) {
      Preconditions.checkElementIndex(bit, width, "bit");
      row[bit] = 1;
    }
    return this;
  }

  /** Returns the value for {@code pixel}, or the sentinel. Only valid for maps of width 1. */
  public double get(long pixel) {
    Preconditions.checkState(width == 1, "Map has %s components per pixel", width);
    return getComponents(pixel)[0];
  }

  /**
   * Returns the components stored for {@code pixel}, or components all equal to the sentinel when
   * the pixel holds no data. The returned array must not be modified.
   */
  double[] getComponents(long pixel) {
    double[] row = values.get(pixel);
    return row == null ? sentinelComponents : row;
  }

  /** Returns the stored components of {@code pixel}, or null if it holds no data. */
  public double @Nullable [] getStoredComponents(long pixel) {
    double[] row = values.get(pixel);
    return row == null ? null : row.clone();
  }

  /** Returns true if {@code pixel} holds data. */
  public boolean isValid(long pixel) {
    return values.containsKey(pixel);
  }

  /** Returns the number of pixels holding data. */
  public int numValidPixels() {
    return values.size();
  }

  @Override
  public long[] validPixels() {
    long[] pixels = values.keySet().toLongArray();
    Arrays.sort(pixels);
    return pixels;
  }

  private void checkPixel(long pixel) {
    Preconditions.checkArgument(
        pixel >= 0 && pixel < Healpix.INSTANCE.nsideToNpixel(nside()),
        "Pixel %s out of range for nside %s",
        pixel,
        nside());
  }
}
