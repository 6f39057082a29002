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
import com.google.common.collect.ImmutableList;
import jsinterop.annotations.JsType;

/**
 * A gridline in projected coordinates: the curve of constant longitude or latitude {@link
 * #value()}. Vertices where either coordinate is NaN are gap markers; the line is not drawn across
 * them.
 */
@JsType
public final class GridLine {
  private final GridAxis axis;
  private final double value;
  private final double[] xs;
  private final double[] ys;

  /** Creates a gridline that takes ownership of the given vertex arrays. */
  GridLine(GridAxis axis, double value, double[] xs, double[] ys) {
    Preconditions.checkArgument(axis != GridAxis.BOTH, "A gridline is on a single axis");
    Preconditions.checkArgument(
        xs.length == ys.length, "Vertex arrays differ in length: %s vs %s", xs.length, ys.length);
    this.axis = axis;
    this.value = value;
    this.xs = xs;
    this.ys = ys;
  }

  /** Returns a gridline with copies of the given vertex arrays. */
  public static GridLine of(GridAxis axis, double value, double[] xs, double[] ys) {
    return new GridLine(axis, value, xs.clone(), ys.clone());
  }

  /** Returns {@link GridAxis#LON} for a meridian and {@link GridAxis#LAT} for a parallel. */
  public GridAxis axis() {
    return axis;
  }

  /** Returns the constant longitude or latitude of the line, in degrees. */
  public double value() {
    return value;
  }

  /** Returns the number of vertices, including gap markers. */
  public int size() {
    return xs.length;
  }

  public double x(int i) {
    return xs[i];
  }

  public double y(int i) {
    return ys[i];
  }

  public R2Vector vertex(int i) {
    return new R2Vector(xs[i], ys[i]);
  }

  /** Returns a copy of the x coordinates. */
  public double[] xs() {
    return xs.clone();
  }

  /** Returns a copy of the y coordinates. */
  public double[] ys() {
    return ys.clone();
  }

  /** Package-private access to the x coordinates; callers must not modify the array. */
  double[] xsArray() {
    return xs;
  }

  /** Package-private access to the y coordinates; callers must not modify the array. */
  double[] ysArray() {
    return ys;
  }

  /** Returns the number of gap markers in the line. */
  public int numGaps() {
    int n = 0;
    for (int i = 0; i < xs.length; i++) {
      if (isGap(i)) {
        n++;
      }
    }
    return n;
  }

  /**
   * Returns the pieces of the line between gap markers, in order. Empty pieces (from leading,
   * trailing or repeated gap markers) are omitted.
   */
  public ImmutableList<ImmutableList<R2Vector>> segments() {
    ImmutableList.Builder<ImmutableList<R2Vector>> segments = ImmutableList.builder();
    ImmutableList.Builder<R2Vector> current = ImmutableList.builder();
    int currentSize = 0;
    for (int i = 0; i < xs.length; i++) {
      if (isGap(i)) {
        if (currentSize > 0) {
          segments.add(current.build());
          current = ImmutableList.builder();
          currentSize = 0;
        }
        continue;
      }
      current.add(vertex(i));
      currentSize++;
    }
    if (currentSize > 0) {
      segments.add(current.build());
    }
    return segments.build();
  }

  private boolean isGap(int i) {
    return Double.isNaN(xs[i]) || Double.isNaN(ys[i]);
  }

  @Override
  public String toString() {
    return "GridLine(" + axis + "=" + value + ", " + xs.length + " vertices)";
  }
}
