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

import static java.lang.Math.PI;
import static java.lang.Math.abs;
import static java.lang.Math.asin;
import static java.lang.Math.cos;
import static java.lang.Math.sin;
import static java.lang.Math.sqrt;
import static java.lang.Math.toDegrees;
import static java.lang.Math.toRadians;

import com.google.common.base.Preconditions;
import jsinterop.annotations.JsIgnore;
import jsinterop.annotations.JsType;

/**
 * A projection maps (longitude, latitude) positions in degrees to planar (x, y) plot coordinates
 * and back. Projections are centered on a longitude {@code lon0}; the meridian opposite it is the
 * seam where the projected plane wraps.
 */
@JsType
public interface Projection {
  /** Converts a point on the sphere to a projected 2D point. */
  R2Vector fromLonLat(double lon, double lat);

  /**
   * Converts a projected 2D point to a point on the sphere. Points outside the projected domain
   * give a LonLat with NaN coordinates. Longitudes are returned within 180 degrees of {@code lon0}
   * and are not normalized further, so both seam meridians can be represented.
   */
  LonLat toLonLat(double x, double y);

  /** Returns the short name of the projection, e.g. "cyl". */
  String name();

  /** Returns the characteristic radius of the projection, in plot units. */
  double radius();

  /** Returns the central longitude. */
  double lon0();

  /** Returns the smallest rectangle containing the projected sphere. */
  R2Rect bounds();

  /**
   * Converts a point on the sphere to a projected 2D point, taking {@code lon} as a member of the
   * longitude window [wrap - 360, wrap]. When the seam of the projection falls on {@code wrap},
   * the two ends of the window go to opposite edges of the plane: {@code wrap} to the right edge
   * and {@code wrap - 360} to the left.
   */
  @JsIgnore
  default R2Vector fromLonLat(double lon, double lat, double wrap) {
    return fromLonLat(windowLon(lon, lon0(), wrap), lat);
  }

  /** Projects the given positions, writing the results to {@code xs} and {@code ys}. */
  default void forward(double[] lon, double[] lat, double[] xs, double[] ys) {
    Preconditions.checkArgument(
        lon.length == lat.length && xs.length == lon.length && ys.length == lon.length);
    for (int i = 0; i < lon.length; i++) {
      R2Vector p = fromLonLat(lon[i], lat[i]);
      xs[i] = p.x();
      ys[i] = p.y();
    }
  }

  /** Unprojects the given points, writing the results to {@code lon} and {@code lat}. */
  default void inverse(double[] xs, double[] ys, double[] lon, double[] lat) {
    Preconditions.checkArgument(
        xs.length == ys.length && lon.length == xs.length && lat.length == xs.length);
    for (int i = 0; i < xs.length; i++) {
      LonLat ll = toLonLat(xs[i], ys[i]);
      lon[i] = ll.lon();
      lat[i] = ll.lat();
    }
  }

  /**
   * Returns the longitude relative to {@code lon0}, in [-180, 180]. Longitudes already within 180
   * degrees of {@code lon0} are kept, so the two sides of the seam stay apart; others are wrapped
   * into [-180, 180).
   */
  static double relativeLon(double lon, double lon0) {
    return SkyMath.rewrapClosed(lon - lon0, 180.0);
  }

  /**
   * Returns {@code lon} rewrapped into [wrap - 360, wrap] and then shifted by a multiple of 360
   * so that the window lies as nearly as possible within 180 degrees of {@code lon0}.
   */
  static double windowLon(double lon, double lon0, double wrap) {
    double shift = 360.0 * Math.round((wrap - lon0 - 180.0) / 360.0);
    return SkyMath.rewrapClosed(lon, wrap) - shift;
  }

  /**
   * CylindricalProjection is the plate carree projection in degrees: x is the longitude relative
   * to {@code lon0} and y is the latitude, so the projected sphere is [-180, 180] x [-90, 90].
   */
  @JsType
  final class CylindricalProjection implements Projection {
    public static final String NAME = "cyl";

    private final double lon0;

    public CylindricalProjection(double lon0) {
      this.lon0 = lon0;
    }

    @Override
    public R2Vector fromLonLat(double lon, double lat) {
      if (Double.isNaN(lon) || Double.isNaN(lat) || abs(lat) > 90) {
        return new R2Vector(Double.NaN, Double.NaN);
      }
      return new R2Vector(relativeLon(lon, lon0), lat);
    }

    @Override
    public LonLat toLonLat(double x, double y) {
      if (!(abs(x) <= 180 && abs(y) <= 90)) {
        return new LonLat(Double.NaN, Double.NaN);
      }
      return new LonLat(lon0 + x, y);
    }

    @Override
    public String name() {
      return NAME;
    }

    /** Returns the radius that makes one plot unit one degree. */
    @Override
    public double radius() {
      return 180.0 / PI;
    }

    @Override
    public double lon0() {
      return lon0;
    }

    @Override
    public R2Rect bounds() {
      return R2Rect.fromExtents(-180, -90, 180, 90);
    }

    @Override
    public String toString() {
      return "CylindricalProjection(lon0=" + lon0 + ")";
    }
  }

  /**
   * MollweideProjection is the equal-area pseudocylindrical projection of the sphere of the given
   * radius onto an ellipse of semi-axes 2 * sqrt(2) * radius and sqrt(2) * radius.
   */
  @JsType
  final class MollweideProjection implements Projection {
    public static final String NAME = "moll";

    private static final int MAX_ITERATIONS = 50;
    private static final double TOLERANCE = 1e-12;

    private final double lon0;
    private final double radius;

    @JsIgnore
    public MollweideProjection(double lon0) {
      this(lon0, 1.0);
    }

    public MollweideProjection(double lon0, double radius) {
      Preconditions.checkArgument(radius > 0, "radius must be positive: %s", radius);
      this.lon0 = lon0;
      this.radius = radius;
    }

    @Override
    public R2Vector fromLonLat(double lon, double lat) {
      if (Double.isNaN(lon) || Double.isNaN(lat) || abs(lat) > 90) {
        return new R2Vector(Double.NaN, Double.NaN);
      }
      double lambda = toRadians(relativeLon(lon, lon0));
      double theta = auxiliaryAngle(toRadians(lat));
      double x = radius * 2 * sqrt(2) / PI * lambda * cos(theta);
      double y = radius * sqrt(2) * sin(theta);
      return new R2Vector(x, y);
    }

    @Override
    public LonLat toLonLat(double x, double y) {
      double s = y / (radius * sqrt(2));
      if (!(abs(s) <= 1)) {
        return new LonLat(Double.NaN, Double.NaN);
      }
      double theta = asin(s);
      double phi = asin(SkyMath.clamp((2 * theta + sin(2 * theta)) / PI, -1, 1));
      double c = cos(theta);
      double lambda = c == 0 ? 0 : PI * x / (2 * sqrt(2) * radius * c);
      if (!(abs(lambda) <= PI)) {
        return new LonLat(Double.NaN, Double.NaN);
      }
      return new LonLat(lon0 + toDegrees(lambda), toDegrees(phi));
    }

    /** Solves 2 * theta + sin(2 * theta) = pi * sin(phi) for theta by Newton's method. */
    private static double auxiliaryAngle(double phi) {
      if (abs(abs(phi) - PI / 2) < TOLERANCE) {
        return Math.copySign(PI / 2, phi);
      }
      double target = PI * sin(phi);
      double aux = phi;
      for (int i = 0; i < MAX_ITERATIONS; i++) {
        double delta = (aux + sin(aux) - target) / (1 + cos(aux));
        aux -= delta;
        if (abs(delta) < TOLERANCE) {
          break;
        }
      }
      return aux / 2;
    }

    @Override
    public String name() {
      return NAME;
    }

    @Override
    public double radius() {
      return radius;
    }

    @Override
    public double lon0() {
      return lon0;
    }

    @Override
    public R2Rect bounds() {
      double a = 2 * sqrt(2) * radius;
      double b = sqrt(2) * radius;
      return R2Rect.fromExtents(-a, -b, a, b);
    }

    @Override
    public String toString() {
      return "MollweideProjection(lon0=" + lon0 + ", radius=" + radius + ")";
    }
  }
}
