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

import static java.lang.Math.abs;

import com.google.common.base.Preconditions;

/** Numeric helpers shared by the rasterization and graticule code. All angles are in degrees. */
public final class SkyMath {
  /** Relative tolerance used by {@link #isClose(double, double)}. */
  public static final double CLOSE_RELATIVE_TOLERANCE = 1e-5;

  /** Absolute tolerance used by {@link #isClose(double, double)}. */
  public static final double CLOSE_ABSOLUTE_TOLERANCE = 1e-8;

  private SkyMath() {}

  /**
   * Returns {@code n} evenly spaced values over the closed interval [start, stop]. The first and
   * last values are exactly {@code start} and {@code stop}.
   */
  public static double[] linspace(double start, double stop, int n) {
    Preconditions.checkArgument(n >= 0, "Negative sample count: %s", n);
    double[] result = new double[n];
    if (n == 0) {
      return result;
    }
    if (n == 1) {
      result[0] = start;
      return result;
    }
    double step = (stop - start) / (n - 1);
    for (int i = 0; i < n; i++) {
      result[i] = start + i * step;
    }
    result[n - 1] = stop;
    return result;
  }

  /**
   * Returns true if {@code a} is within {@link #CLOSE_ABSOLUTE_TOLERANCE} plus {@link
   * #CLOSE_RELATIVE_TOLERANCE} times {@code |b|} of {@code b}. NaN is never close to anything.
   */
  public static boolean isClose(double a, double b) {
    if (a == b) {
      return true;
    }
    return abs(a - b) <= CLOSE_ABSOLUTE_TOLERANCE + CLOSE_RELATIVE_TOLERANCE * abs(b);
  }

  /**
   * Wraps a longitude so that the result lies in [wrap - 360, wrap). With the default wrap of 180
   * this maps any longitude into [-180, 180).
   */
  public static double wrapValue(double lon, double wrap) {
    return Platform.floorMod(lon + (360.0 - wrap), 360.0) - (360.0 - wrap);
  }

  /**
   * Re-wraps a longitude into the closed interval [wrap - 360, wrap]. Values already inside the
   * interval are returned unchanged, so both seam longitudes survive. NaN is returned unchanged.
   */
  public static double rewrapClosed(double lon, double wrap) {
    if (Double.isNaN(lon) || (lon >= wrap - 360.0 && lon <= wrap)) {
      return lon;
    }
    return wrapValue(lon, wrap);
  }

  /** Clamps {@code value} into [lo, hi]. NaN is returned unchanged. */
  public static double clamp(double value, double lo, double hi) {
    if (value < lo) {
      return lo;
    }
    if (value > hi) {
      return hi;
    }
    return value;
  }
}
