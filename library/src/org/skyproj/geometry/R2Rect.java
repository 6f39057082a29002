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

import jsinterop.annotations.JsType;

/** An R2Rect represents a closed axis-aligned rectangle in the (x,y) plane. Immutable. */
@JsType
public final class R2Rect {
  private final R1Interval x;
  private final R1Interval y;

  /** Constructs a rectangle from the given intervals in x and y. */
  public R2Rect(R1Interval x, R1Interval y) {
    this.x = x;
    this.y = y;
  }

  /**
   * Returns the rectangle spanned by the two corners (x1, y1) and (x2, y2). The corners may be
   * given in any order, so inverted axis limits produce the same rectangle as normal ones.
   */
  public static R2Rect fromExtents(double x1, double y1, double x2, double y2) {
    return new R2Rect(R1Interval.fromPointPair(x1, x2), R1Interval.fromPointPair(y1, y2));
  }

  /** Returns the interval along the x-axis. */
  public R1Interval x() {
    return x;
  }

  /** Returns the interval along the y-axis. */
  public R1Interval y() {
    return y;
  }

  /** Returns the interval along the given axis, x for 0 and y for 1. */
  public R1Interval getInterval(int axis) {
    return axis == 0 ? x : y;
  }

  /** Returns the point in this rectangle with the minimum x and y values. */
  public R2Vector lo() {
    return new R2Vector(x.lo(), y.lo());
  }

  /** Returns the point in this rectangle with the maximum x and y values. */
  public R2Vector hi() {
    return new R2Vector(x.hi(), y.hi());
  }

  /** Return true if this rectangle is empty, i.e. it contains no points at all. */
  public boolean isEmpty() {
    return x.isEmpty() || y.isEmpty();
  }

  /** Returns true if the rectangle contains the given point. */
  public boolean contains(R2Vector p) {
    return x.contains(p.x()) && y.contains(p.y());
  }

  /**
   * Returns a rectangle with the same center, with its width scaled by {@code sx} and its height
   * scaled by {@code sy}.
   */
  public R2Rect expanded(double sx, double sy) {
    return new R2Rect(x.scaled(sx), y.scaled(sy));
  }

  @Override
  public boolean equals(Object other) {
    if (!(other instanceof R2Rect)) {
      return false;
    }
    R2Rect that = (R2Rect) other;
    return x.equals(that.x) && y.equals(that.y);
  }

  @Override
  public int hashCode() {
    return x.hashCode() * 31 + y.hashCode();
  }

  @Override
  public String toString() {
    return "[Lo" + lo() + ", Hi" + hi() + "]";
  }
}
