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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import it.unimi.dsi.fastutil.ints.IntArrays;
import java.util.Arrays;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Resamples HEALPix data onto a regular (longitude, latitude) raster.
 *
 * <p>A mesh of {@code xsize} longitude nodes by {@code round(aspect * xsize)} latitude nodes is
 * laid over the requested ranges. The midpoint of each mesh cell is converted to a pixel id, and
 * the source is looked up by the strategy for its {@link PixelSource.Kind}:
 *
 * <ul>
 *   <li>{@link SparseHealpixMap}: the stored components are reduced to one value by a {@link
 *       ValueReduction}, by default the map's own.
 *   <li>{@link DenseHealpixMap}: the array is indexed directly.
 *   <li>{@link PixelValuePairs}: the pixel ids are sorted once and each cell's pixel is binary
 *       searched among them.
 * </ul>
 *
 * Cells whose pixel has no data are masked in the result.
 */
public final class HealpixRasterizer {
  private static final Logger log = Platform.getLoggerForClass(HealpixRasterizer.class);

  /** Options for a HealpixRasterizer. */
  public static class Options {
    public static final int DEFAULT_XSIZE = 1000;
    public static final double DEFAULT_ASPECT = 1.0;

    private int xsize = DEFAULT_XSIZE;
    private double aspect = DEFAULT_ASPECT;
    private @Nullable ValueReduction reduction = null;
    private boolean validMask = false;

    /** Constructor that sets default options. */
    public Options() {}

    /** Options copy constructor. */
    public Options(Options other) {
      this.xsize = other.xsize;
      this.aspect = other.aspect;
      this.reduction = other.reduction;
      this.validMask = other.validMask;
    }

    /** Returns the number of mesh nodes in longitude. */
    public int xsize() {
      return xsize;
    }

    /**
     * Sets the number of mesh nodes in longitude. The raster has one fewer column of values.
     *
     * <p>DEFAULT: 1000
     */
    public void setXsize(int xsize) {
      Preconditions.checkArgument(xsize > 0, "xsize must be positive: %s", xsize);
      this.xsize = xsize;
    }

    /** Returns the ratio of latitude nodes to longitude nodes. */
    public double aspect() {
      return aspect;
    }

    /**
     * Sets the ratio of latitude nodes to longitude nodes; the mesh has {@code round(aspect *
     * xsize)} latitude nodes.
     *
     * <p>DEFAULT: 1.0
     */
    public void setAspect(double aspect) {
      Preconditions.checkArgument(aspect > 0, "aspect must be positive: %s", aspect);
      this.aspect = aspect;
    }

    /** Returns the explicit reduction for sparse maps, or null to use each map's default. */
    public @Nullable ValueReduction reduction() {
      return reduction;
    }

    /**
     * Overrides the reduction applied to sparse map components.
     *
     * <p>DEFAULT: null, meaning {@link SparseHealpixMap#defaultReduction()}
     */
    public void setReduction(@Nullable ValueReduction reduction) {
      this.reduction = reduction;
    }

    /** Returns true if sparse maps are rasterized as their coverage. */
    public boolean validMask() {
      return validMask;
    }

    /**
     * If true, sparse maps are rasterized as their coverage instead of their values: 1 where the
     * pixel holds data, masked elsewhere, as UINT8. Ignored for other kinds of source.
     *
     * <p>DEFAULT: false
     */
    public void setValidMask(boolean validMask) {
      this.validMask = validMask;
    }

    /** Returns the number of latitude mesh nodes implied by xsize and aspect. */
    public int ysize() {
      return (int) Math.round(aspect * xsize);
    }
  }

  private final PixelScheme scheme;
  private final Options options;

  /** Creates a rasterizer with default options over the HEALPix scheme. */
  public HealpixRasterizer() {
    this(Healpix.INSTANCE, new Options());
  }

  /** Creates a rasterizer with the given options over the HEALPix scheme. */
  public HealpixRasterizer(Options options) {
    this(Healpix.INSTANCE, options);
  }

  public HealpixRasterizer(PixelScheme scheme, Options options) {
    this.scheme = Preconditions.checkNotNull(scheme);
    this.options = new Options(options);
  }

  /** Returns a copy of the options of this rasterizer. */
  public Options options() {
    return new Options(options);
  }

  /**
   * Rasterizes {@code source} over the given longitude and latitude ranges, in degrees. The ranges
   * are not validated; latitudes must lie within [-90, 90].
   *
   * @throws SkyException with {@link SkyError.Code#DUPLICATE_PIXELS} or {@link
   *     SkyError.Code#LENGTH_MISMATCH} if the source is a {@link PixelValuePairs} that fails
   *     validation. Nothing is computed in that case.
   */
  public RasterGrid rasterize(PixelSource source, R1Interval lonRange, R1Interval latRange) {
    if (source.kind() == PixelSource.Kind.EXPLICIT_PAIRS) {
      SkyError error = new SkyError();
      if (((PixelValuePairs) source).findValidationError(error)) {
        throw new SkyException(error);
      }
    }

    double[] lonEdges = SkyMath.linspace(lonRange.lo(), lonRange.hi(), options.xsize());
    double[] latEdges = SkyMath.linspace(latRange.lo(), latRange.hi(), options.ysize());
    long[] cellPixels = cellPixels(source, lonEdges, latEdges);
    double[] values = new double[cellPixels.length];
    boolean[] mask = new boolean[cellPixels.length];

    ValueType valueType;
    switch (source.kind()) {
      case SPARSE:
        valueType = lookupSparse((SparseHealpixMap) source, cellPixels, values, mask);
        break;
      case DENSE:
        valueType = lookupDense((DenseHealpixMap) source, cellPixels, values, mask);
        break;
      case EXPLICIT_PAIRS:
        valueType = lookupPairs((PixelValuePairs) source, cellPixels, values, mask);
        break;
      default:
        throw new IllegalArgumentException("Unknown source kind: " + source.kind());
    }

    RasterGrid raster = new RasterGrid(lonEdges, latEdges, values, mask, valueType.promoted());
    if (log.isLoggable(Level.FINE)) {
      log.fine("Rasterized " + source.kind() + " source: " + raster);
    }
    return raster;
  }

  /** Rasterizes {@code source} over the given window. */
  public RasterGrid rasterize(PixelSource source, LonLatWindow window) {
    return rasterize(source, window.lon(), window.lat());
  }

  /**
   * Returns the pixel id under the center of every cell of the mesh, in row-major order (latitude
   * rows, longitude columns).
   */
  @VisibleForTesting
  long[] cellPixels(PixelSource source, double[] lonEdges, double[] latEdges) {
    int cols = Math.max(0, lonEdges.length - 1);
    int rows = Math.max(0, latEdges.length - 1);
    long[] pixels = new long[rows * cols];
    for (int row = 0; row < rows; row++) {
      double lat = 0.5 * (latEdges[row] + latEdges[row + 1]);
      for (int col = 0; col < cols; col++) {
        double lon = 0.5 * (lonEdges[col] + lonEdges[col + 1]);
        pixels[row * cols + col] =
            scheme.angleToPixel(source.nside(), lon, lat, source.ordering());
      }
    }
    return pixels;
  }

  private ValueType lookupSparse(
      SparseHealpixMap map, long[] cellPixels, double[] values, boolean[] mask) {
    if (options.validMask()) {
      for (int i = 0; i < cellPixels.length; i++) {
        boolean valid = map.isValid(cellPixels[i]);
        values[i] = valid ? 1 : 0;
        mask[i] = !valid;
      }
      return ValueType.UINT8;
    }
    ValueReduction reduction =
        options.reduction() != null ? options.reduction() : map.defaultReduction();
    for (int i = 0; i < cellPixels.length; i++) {
      double value = reduction.reduce(map.getComponents(cellPixels[i]));
      values[i] = value;
      mask[i] = reduction.isMasked(value, map.sentinel());
    }
    return reduction.outputType(map.valueType());
  }

  private static ValueType lookupDense(
      DenseHealpixMap map, long[] cellPixels, double[] values, boolean[] mask) {
    for (int i = 0; i < cellPixels.length; i++) {
      double value = map.get(cellPixels[i]);
      values[i] = value;
      mask[i] = DenseHealpixMap.isUnseen(value);
    }
    return map.valueType();
  }

  /** Resolves every cell against the pairs, which must already have been validated. */
  private static ValueType lookupPairs(
      PixelValuePairs pairs, long[] cellPixels, double[] values, boolean[] mask) {
    int n = pairs.size();
    if (n == 0) {
      Arrays.fill(mask, true);
      return pairs.valueType();
    }
    int[] order = argsort(pairs.pixels());
    long[] sorted = new long[n];
    for (int i = 0; i < n; i++) {
      sorted[i] = pairs.pixel(order[i]);
    }
    for (int i = 0; i < cellPixels.length; i++) {
      int index = searchSorted(sorted, cellPixels[i]);
      // Only a guard against indexing past the end; the equality test rejects the match.
      if (index == n) {
        index = n - 1;
      }
      if (sorted[index] == cellPixels[i]) {
        values[i] = pairs.value(order[index]);
        mask[i] = false;
      } else {
        values[i] = 0;
        mask[i] = true;
      }
    }
    return pairs.valueType();
  }

  /** Returns the permutation that sorts {@code keys} in increasing order. */
  @VisibleForTesting
  static int[] argsort(long[] keys) {
    int[] order = new int[keys.length];
    for (int i = 0; i < order.length; i++) {
      order[i] = i;
    }
    IntArrays.quickSort(order, (a, b) -> Long.compare(keys[a], keys[b]));
    return order;
  }

  /**
   * Returns the first index in {@code sorted} whose value is not less than {@code key}, which is
   * {@code sorted.length} if every value is less.
   */
  @VisibleForTesting
  static int searchSorted(long[] sorted, long key) {
    int lo = 0;
    int hi = sorted.length;
    while (lo < hi) {
      int mid = (lo + hi) >>> 1;
      if (sorted[mid] < key) {
        lo = mid + 1;
      } else {
        hi = mid;
      }
    }
    return lo;
  }
}
