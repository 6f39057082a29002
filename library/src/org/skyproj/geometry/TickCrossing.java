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

/**
 * A place where a gridline leaves or enters the viewport, where a tick and its label go. The
 * label key is the line's level: {@link #level()} in units of 1 / {@link #factor()} degrees.
 */
@JsType
public final class TickCrossing {
  private final GridAxis axis;
  private final double level;
  private final double factor;
  private final LineBoxCrossings.Side side;
  private final LineBoxCrossings.Crossing crossing;

  public TickCrossing(
      GridAxis axis,
      double level,
      double factor,
      LineBoxCrossings.Side side,
      LineBoxCrossings.Crossing crossing) {
    this.axis = axis;
    this.level = level;
    this.factor = factor;
    this.side = side;
    this.crossing = crossing;
  }

  public GridAxis axis() {
    return axis;
  }

  /** Returns the level of the gridline, scaled by {@link #factor()}. */
  public double level() {
    return level;
  }

  public double factor() {
    return factor;
  }

  /** Returns the longitude or latitude of the gridline, in degrees. */
  public double value() {
    return level / factor;
  }

  /** Returns the side of the viewport that is crossed. */
  public LineBoxCrossings.Side side() {
    return side;
  }

  public R2Vector position() {
    return crossing.position();
  }

  /** Returns the direction of the gridline at the crossing, in degrees counterclockwise from +x. */
  public double angle() {
    return crossing.angle();
  }

  @Override
  public String toString() {
    return "TickCrossing(" + axis + "=" + value() + ", " + side + ", " + crossing + ")";
  }
}
