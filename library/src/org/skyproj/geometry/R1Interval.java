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

import java.io.Serializable;
import jsinterop.annotations.JsType;

/**
 * An R1Interval represents a closed, bounded interval on the real line. Any interval where lo > hi
 * is empty. Instances are immutable; longitude and latitude ranges in degrees are both represented
 * this way.
 */
@JsType
public final class R1Interval implements Serializable {
  private final double lo;
  private final double hi;

  /** Interval constructor. If lo > hi, the interval is empty. */
  public R1Interval(double lo, double hi) {
    this.lo = lo;
    this.hi = hi;
  }

  /** Returns the minimal interval containing the two given points, in either order. */
  public static R1Interval fromPointPair(double p1, double p2) {
    return p1 <= p2 ? new R1Interval(p1, p2) : new R1Interval(p2, p1);
  }

  public double lo() {
    return lo;
  }

  public double hi() {
    return hi;
  }

  /** Returns true if the interval is empty, i.e. it contains no points. */
  public boolean isEmpty() {
    return lo() > hi();
  }

  /** Returns the center of the interval. For empty intervals, the result is arbitrary. */
  public double getCenter() {
    return 0.5 * (lo() + hi());
  }

  /** Returns hi - lo. Negative for empty intervals. */
  public double getLength() {
    return hi() - lo();
  }

  /** Returns true if the given point is in the closed interval [lo, hi]. */
  public boolean contains(double p) {
    return p >= lo() && p <= hi();
  }

  /** Returns true if this interval contains the interval {@code y}. */
  public boolean contains(R1Interval y) {
    if (y.isEmpty()) {
      return true;
    }
    return y.lo() >= lo() && y.hi() <= hi();
  }

  /**
   * Returns an interval with the same center whose length is scaled by {@code factor}. Empty
   * intervals are returned unchanged.
   */
  public R1Interval scaled(double factor) {
    if (isEmpty()) {
      return this;
    }
    double half = 0.5 * getLength() * factor;
    double center = getCenter();
    return new R1Interval(center - half, center + half);
  }

  @Override
  public boolean equals(Object that) {
    if (that instanceof R1Interval) {
      R1Interval y = (R1Interval) that;
      // Return true if two intervals contain the same set of points.
      return (lo() == y.lo() && hi() == y.hi()) || (isEmpty() && y.isEmpty());
    }
    return false;
  }

  @Override
  public int hashCode() {
    if (isEmpty()) {
      return 17;
    }
    long value = 17;
    value = 37 * value + Double.doubleToLongBits(lo);
    value = 37 * value + Double.doubleToLongBits(hi);
    return (int) (value ^ (value >>> 32));
  }

  @Override
  public String toString() {
    return "[" + lo() + ", " + hi() + "]";
  }
}
