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
import org.jspecify.annotations.Nullable;

/**
 * The visible limits of a plot in projected coordinates. The limits are kept as given, so {@code
 * x1} may exceed {@code x2} for an axis that runs backwards.
 */
@JsType
public final class Viewport {
  private final double x1;
  private final double x2;
  private final double y1;
  private final double y2;

  public Viewport(double x1, double x2, double y1, double y2) {
    this.x1 = x1;
    this.x2 = x2;
    this.y1 = y1;
    this.y2 = y2;
  }

  /** Returns a viewport showing exactly {@code rect}. */
  public static Viewport fromRect(R2Rect rect) {
    return new Viewport(rect.x().lo(), rect.x().hi(), rect.y().lo(), rect.y().hi());
  }

  public double x1() {
    return x1;
  }

  public double x2() {
    return x2;
  }

  public double y1() {
    return y1;
  }

  public double y2() {
    return y2;
  }

  /** Returns the viewport as a rectangle. */
  public R2Rect toRect() {
    return R2Rect.fromExtents(x1, y1, x2, y2);
  }

  /**
   * Returns true if {@code other} has exactly the same four limits as this viewport. A null
   * viewport never matches.
   */
  public boolean sameLimits(@Nullable Viewport other) {
    return other != null && x1 == other.x1 && x2 == other.x2 && y1 == other.y1 && y2 == other.y2;
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof Viewport && sameLimits((Viewport) other);
  }

  @Override
  public int hashCode() {
    long value = 17;
    value = 37 * value + hashBits(x1);
    value = 37 * value + hashBits(x2);
    value = 37 * value + hashBits(y1);
    value = 37 * value + hashBits(y2);
    return (int) (value ^ (value >>> 32));
  }

  /** Returns the bits of {@code v} with -0.0 folded into 0.0, which it equals. */
  private static long hashBits(double v) {
    return Double.doubleToLongBits(v == 0 ? 0.0 : v);
  }

  @Override
  public String toString() {
    return "Viewport(x=[" + x1 + ", " + x2 + "], y=[" + y1 + ", " + y2 + "])";
  }
}
