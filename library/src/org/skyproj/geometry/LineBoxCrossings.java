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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import jsinterop.annotations.JsType;

/**
 * Finds where a polyline crosses the sides of an axis-aligned box, and the direction of the
 * polyline at each crossing.
 *
 * <p>For each side, every segment whose endpoints lie on opposite sides of that side's line is
 * linearly interpolated at the line. Crossings that fall outside the box's extent along the side
 * are discarded, as are segments with a NaN endpoint, which mark gaps in the polyline.
 */
public final class LineBoxCrossings {
  private LineBoxCrossings() {}

  /** The four sides of a box. */
  @JsType
  public enum Side {
    LEFT,
    RIGHT,
    BOTTOM,
    TOP
  }

  /** A point where a polyline crosses a side of a box. */
  @JsType
  public static final class Crossing {
    private final R2Vector position;
    private final double angle;

    public Crossing(R2Vector position, double angle) {
      this.position = position;
      this.angle = angle;
    }

    /** Returns the crossing point. */
    public R2Vector position() {
      return position;
    }

    /**
     * Returns the counterclockwise angle in degrees of the polyline's direction at the crossing,
     * in (-180, 180]. An angle of 0 means that the polyline is moving in the +x direction.
     */
    public double angle() {
      return angle;
    }

    @Override
    public String toString() {
      return "Crossing(" + position + ", " + angle + ")";
    }
  }

  /**
   * Returns the crossings of the polyline with vertices (xs[i], ys[i]) through the sides of {@code
   * box}, keyed by side. Within a side, crossings are in polyline order. A polyline with fewer than
   * two vertices has no crossings.
   */
  public static ImmutableListMultimap<Side, Crossing> find(double[] xs, double[] ys, R2Rect box) {
    ImmutableListMultimap.Builder<Side, Crossing> result = ImmutableListMultimap.builder();
    if (xs.length < 2 || ys.length != xs.length) {
      return result.build();
    }
    // Axis 0 ("u" = x) yields the left and right sides, axis 1 ("u" = y) the bottom and top.
    addCrossings(xs, ys, box.x(), box.y(), Side.LEFT, Side.RIGHT, false, result);
    addCrossings(ys, xs, box.y(), box.x(), Side.BOTTOM, Side.TOP, true, result);
    return result.build();
  }

  /** Convenience overload taking the polyline as a list of points. */
  public static ImmutableListMultimap<Side, Crossing> find(
      ImmutableList<R2Vector> polyline, R2Rect box) {
    double[] xs = new double[polyline.size()];
    double[] ys = new double[polyline.size()];
    for (int i = 0; i < xs.length; i++) {
      xs[i] = polyline.get(i).x();
      ys[i] = polyline.get(i).y();
    }
    return find(xs, ys, box);
  }

  /**
   * Adds the crossings of the lines u = uRange.lo() and u = uRange.hi(), where u is the coordinate
   * along {@code us} and v the coordinate along {@code vs}. If {@code swapped}, u is y.
   */
  private static void addCrossings(
      double[] us,
      double[] vs,
      R1Interval uRange,
      R1Interval vRange,
      Side loSide,
      Side hiSide,
      boolean swapped,
      ImmutableListMultimap.Builder<Side, Crossing> result) {
    for (int pass = 0; pass < 2; pass++) {
      boolean lo = pass == 0;
      double u0 = lo ? uRange.lo() : uRange.hi();
      Side side = lo ? loSide : hiSide;
      for (int i = 0; i + 1 < us.length; i++) {
        if (isGap(us[i], vs[i]) || isGap(us[i + 1], vs[i + 1])) {
          continue;
        }
        boolean inside0 = lo ? us[i] > u0 : us[i] < u0;
        boolean inside1 = lo ? us[i + 1] > u0 : us[i + 1] < u0;
        if (inside0 == inside1) {
          continue;
        }
        double du = us[i + 1] - us[i];
        double dv = vs[i + 1] - vs[i];
        double v = vs[i] + (u0 - us[i]) * dv / du;
        if (!(vRange.lo() <= v && v <= vRange.hi())) {
          continue;
        }
        double dx = swapped ? dv : du;
        double dy = swapped ? du : dv;
        R2Vector position = swapped ? new R2Vector(v, u0) : new R2Vector(u0, v);
        result.put(side, new Crossing(position, Math.toDegrees(Math.atan2(dy, dx))));
      }
    }
  }

  private static boolean isGap(double u, double v) {
    return Double.isNaN(u) || Double.isNaN(v);
  }
}
