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

/**
 * A pixelization of the sphere at a chosen resolution ("nside") and ordering. Positions are
 * (longitude, latitude) in degrees.
 */
public interface PixelScheme {
  /** Returns the pixel containing the given position. */
  long angleToPixel(int nside, double lon, double lat, HealpixOrdering ordering);

  /** Returns the center of the given pixel. */
  LonLat pixelToAngle(int nside, long pixel, HealpixOrdering ordering);

  /**
   * Returns the maximum angular distance, in degrees, between any pixel center and its boundary at
   * the given resolution.
   */
  double maxPixelRadius(int nside);

  /** Returns the number of pixels covering the sphere at the given resolution. */
  long nsideToNpixel(int nside);

  /** Returns the resolution whose pixel count is {@code npixel}. */
  int npixelToNside(long npixel);

  /** Vectorized {@link #angleToPixel(int, double, double, HealpixOrdering)}. */
  default long[] angleToPixel(int nside, double[] lon, double[] lat, HealpixOrdering ordering) {
    if (lon.length != lat.length) {
      throw new SkyException(
          SkyError.Code.LENGTH_MISMATCH,
          "lon and lat have different lengths: " + lon.length + " != " + lat.length);
    }
    long[] pixels = new long[lon.length];
    for (int i = 0; i < lon.length; i++) {
      pixels[i] = angleToPixel(nside, lon[i], lat[i], ordering);
    }
    return pixels;
  }
}
