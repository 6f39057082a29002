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

import static java.lang.Math.max;
import static java.lang.Math.min;

import com.google.common.base.Preconditions;
import com.google.common.math.Quantiles;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Estimates the (longitude, latitude) window that encloses a set of HEALPix pixels, for zooming a
 * plot onto the region where a map has data.
 *
 * <p>The window is the bounding box of the pixel centers padded by the maximum pixel radius, with
 * longitudes taken relative to a wrap angle. If the padded longitude range runs across a wrap seam,
 * or spans 359 degrees or more, the pixels are treated as covering the full sky and the longitude
 * range becomes a full 360 degree circle.
 */
public final class PixelRangeEstimator {
  private static final Logger log = Platform.getLoggerForClass(PixelRangeEstimator.class);

  /** Latitude bounds are kept this far inside the poles. */
  public static final double POLE_EPSILON = 1e-5;

  /** The full sky longitude range stops this far short of 360 degrees. */
  public static final double SEAM_EPSILON = 1e-5;

  /** Longitude spans at least this wide collapse to the full sky. */
  public static final double FULL_SKY_SPAN = 359.0;

  private final PixelScheme scheme;

  /** Creates an estimator over the HEALPix scheme. */
  public PixelRangeEstimator() {
    this(Healpix.INSTANCE);
  }

  public PixelRangeEstimator(PixelScheme scheme) {
    this.scheme = Preconditions.checkNotNull(scheme);
  }

  /**
   * Returns the window enclosing the pixels that hold data in {@code source}.
   *
   * @throws SkyException with {@link SkyError.Code#NO_VALID_PIXELS} if the source holds no data
   */
  public LonLatWindow estimate(PixelSource source, double wrap) {
    return estimate(source.nside(), source.ordering(), source.validPixels(), wrap);
  }

  /**
   * Returns the window enclosing the given pixels.
   *
   * @param wrap the wrap angle in degrees
   * @throws SkyException with {@link SkyError.Code#NO_VALID_PIXELS} if {@code pixels} is empty
   */
  public LonLatWindow estimate(int nside, HealpixOrdering ordering, long[] pixels, double wrap) {
    if (pixels.length == 0) {
      throw new SkyException(
          SkyError.Code.NO_VALID_PIXELS, "No valid pixels; zoom is not available.");
    }
    double[] lon = new double[pixels.length];
    double[] lat = new double[pixels.length];
    for (int i = 0; i < pixels.length; i++) {
      LonLat center = scheme.pixelToAngle(nside, pixels[i], ordering);
      lon[i] = center.lon();
      lat[i] = center.lat();
    }

    double eps = scheme.maxPixelRadius(nside);
    double epsLon = eps / Math.cos(Math.toRadians(Quantiles.median().compute(lat)));

    double latLo = Double.POSITIVE_INFINITY;
    double latHi = Double.NEGATIVE_INFINITY;
    double lonLo = Double.POSITIVE_INFINITY;
    double lonHi = Double.NEGATIVE_INFINITY;
    for (int i = 0; i < pixels.length; i++) {
      latLo = min(latLo, lat[i]);
      latHi = max(latHi, lat[i]);
      double lonWrapped = Platform.floorMod(lon[i] + wrap, 360.0) - wrap;
      lonLo = min(lonLo, lonWrapped);
      lonHi = max(lonHi, lonWrapped);
    }
    R1Interval latRange =
        new R1Interval(
            max(latLo - eps, -90.0 + POLE_EPSILON), min(latHi + eps, 90.0 - POLE_EPSILON));
    R1Interval lonRange = new R1Interval(lonLo - epsLon, lonHi + epsLon);

    if (overrunsSeam(lonRange, wrap)) {
      double lon0 = SkyMath.wrapValue(Platform.floorMod(wrap + 180.0, 360.0), 180.0);
      if (log.isLoggable(Level.FINE)) {
        log.fine("Pixel range " + lonRange + " overruns the seam at " + wrap + "; using full sky");
      }
      lonRange = new R1Interval(lon0 - 180.0, lon0 + 180.0 - SEAM_EPSILON);
    }
    return new LonLatWindow(lonRange, latRange);
  }

  /**
   * Returns true if {@code lonRange} straddles one of the seams at {@code wrap - 360} or {@code
   * wrap + 360}, or is at least {@link #FULL_SKY_SPAN} wide.
   */
  static boolean overrunsSeam(R1Interval lonRange, double wrap) {
    double lowSeam = wrap - 360.0;
    double highSeam = wrap + 360.0;
    if (lonRange.lo() < lowSeam && lonRange.hi() > lowSeam) {
      return true;
    }
    if (lonRange.lo() < highSeam && lonRange.hi() > highSeam) {
      return true;
    }
    return lonRange.getLength() >= FULL_SKY_SPAN;
  }
}
