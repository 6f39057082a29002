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

/**
 * Finds the range of longitudes and latitudes visible in a viewport by inverse projecting an {@code
 * nx} by {@code ny} grid of sample points spread over it.
 *
 * <p>Samples outside the projected sphere are ignored. Longitudes are taken in the closed range
 * [wrap - 360, wrap], the bounds are padded by one sample spacing, and the result is clamped to
 * [wrap - 360, wrap] x [-90, 90]. If no sample lands on the sphere, the whole sky is returned.
 */
public final class ExtremeFinder {
  public static final int DEFAULT_SAMPLES = 20;

  private final int nx;
  private final int ny;
  private final double wrap;

  public ExtremeFinder(double wrap) {
    this(DEFAULT_SAMPLES, DEFAULT_SAMPLES, wrap);
  }

  public ExtremeFinder(int nx, int ny, double wrap) {
    Preconditions.checkArgument(nx >= 2 && ny >= 2, "Need at least 2x2 samples: %sx%s", nx, ny);
    this.nx = nx;
    this.ny = ny;
    this.wrap = wrap;
  }

  public double wrap() {
    return wrap;
  }

  /** Returns the padded extremes of the sky that {@code projection} shows in {@code viewport}. */
  public LonLatWindow find(Projection projection, Viewport viewport) {
    double[] xs = SkyMath.linspace(viewport.x1(), viewport.x2(), nx);
    double[] ys = SkyMath.linspace(viewport.y1(), viewport.y2(), ny);

    double lonMin = Double.POSITIVE_INFINITY;
    double lonMax = Double.NEGATIVE_INFINITY;
    double latMin = Double.POSITIVE_INFINITY;
    double latMax = Double.NEGATIVE_INFINITY;
    for (double y : ys) {
      for (double x : xs) {
        LonLat ll = projection.toLonLat(x, y);
        if (ll.isNaN()) {
          continue;
        }
        double lon = SkyMath.rewrapClosed(ll.lon(), wrap);
        lonMin = min(lonMin, lon);
        lonMax = max(lonMax, lon);
        latMin = min(latMin, ll.lat());
        latMax = max(latMax, ll.lat());
      }
    }
    if (lonMin > lonMax) {
      return LonLatWindow.of(wrap - 360.0, wrap, -90.0, 90.0);
    }

    double dLon = (lonMax - lonMin) / nx;
    double dLat = (latMax - latMin) / ny;
    return LonLatWindow.of(
        max(lonMin - dLon, wrap - 360.0),
        min(lonMax + dLon, wrap),
        max(latMin - dLat, -90.0),
        min(latMax + dLat, 90.0));
  }

  @Override
  public String toString() {
    return "ExtremeFinder(" + nx + "x" + ny + ", wrap=" + wrap + ")";
  }
}
