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
import org.jspecify.annotations.Nullable;

/**
 * Bins scattered (longitude, latitude) samples into a dense HEALPix map.
 *
 * <p>Without values, each pixel of the result holds the number of samples that fell in it. With
 * values, each pixel holds the mean value of its samples. Pixels without samples hold {@link
 * Healpix#UNSEEN} either way.
 */
public final class HealpixBinner {
  /** The default resolution of binned maps. */
  public static final int DEFAULT_NSIDE = 256;

  private final PixelScheme scheme;

  /** Creates a binner over the HEALPix scheme. */
  public HealpixBinner() {
    this(Healpix.INSTANCE);
  }

  public HealpixBinner(PixelScheme scheme) {
    this.scheme = Preconditions.checkNotNull(scheme);
  }

  /**
   * Returns the dense map binning the given samples at the given resolution.
   *
   * @param lon sample longitudes in degrees
   * @param lat sample latitudes in degrees, paired with {@code lon}
   * @param values per-sample values to average, or null to count samples
   * @throws SkyException with {@link SkyError.Code#LENGTH_MISMATCH} if the arrays differ in length
   */
  public double[] bin(
      double[] lon, double[] lat, double @Nullable [] values, int nside, HealpixOrdering ordering) {
    if (values != null && values.length != lon.length) {
      throw new SkyException(
          SkyError.Code.LENGTH_MISMATCH,
          "values and lon have different lengths: " + values.length + " != " + lon.length);
    }
    long[] pixels = scheme.angleToPixel(nside, lon, lat, ordering);
    long npix = scheme.nsideToNpixel(nside);
    Preconditions.checkArgument(npix <= Integer.MAX_VALUE, "nside %s too large to bin", nside);

    // Every sample is accumulated, including repeats of the same pixel.
    int[] count = new int[(int) npix];
    for (long pixel : pixels) {
      count[(int) pixel]++;
    }
    double[] map = new double[(int) npix];
    if (values != null) {
      for (int i = 0; i < pixels.length; i++) {
        map[(int) pixels[i]] += values[i];
      }
    }
    for (int p = 0; p < map.length; p++) {
      if (count[p] == 0) {
        map[p] = Healpix.UNSEEN;
      } else if (values != null) {
        map[p] /= count[p];
      } else {
        map[p] = count[p];
      }
    }
    return map;
  }

  /** As {@link #bin}, wrapping the result as a map. */
  public DenseHealpixMap binToMap(
      double[] lon, double[] lat, double @Nullable [] values, int nside, HealpixOrdering ordering) {
    return new DenseHealpixMap(bin(lon, lat, values, nside, ordering), ordering);
  }
}
