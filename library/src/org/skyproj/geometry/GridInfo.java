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
 * The graticule computed for one viewport: the visible extremes, the gridlines of each axis, and
 * the ticks where they cross the sides of the viewport.
 */
@JsType
public final class GridInfo {
  private final Viewport viewport;
  private final LonLatWindow extremes;
  private final LevelLocator.Levels lonLevels;
  private final LevelLocator.Levels latLevels;
  private final ImmutableList<GridLine> lonLines;
  private final ImmutableList<GridLine> latLines;
  private final ImmutableListMultimap<LineBoxCrossings.Side, TickCrossing> lonTicks;
  private final ImmutableListMultimap<LineBoxCrossings.Side, TickCrossing> latTicks;

  GridInfo(
      Viewport viewport,
      LonLatWindow extremes,
      LevelLocator.Levels lonLevels,
      LevelLocator.Levels latLevels,
      ImmutableList<GridLine> lonLines,
      ImmutableList<GridLine> latLines,
      ImmutableListMultimap<LineBoxCrossings.Side, TickCrossing> lonTicks,
      ImmutableListMultimap<LineBoxCrossings.Side, TickCrossing> latTicks) {
    this.viewport = viewport;
    this.extremes = extremes;
    this.lonLevels = lonLevels;
    this.latLevels = latLevels;
    this.lonLines = lonLines;
    this.latLines = latLines;
    this.lonTicks = lonTicks;
    this.latTicks = latTicks;
  }

  public Viewport viewport() {
    return viewport;
  }

  /** Returns the padded range of longitudes and latitudes visible in the viewport. */
  public LonLatWindow extremes() {
    return extremes;
  }

  public LevelLocator.Levels levels(GridAxis axis) {
    switch (axis) {
      case LON:
        return lonLevels;
      case LAT:
        return latLevels;
      default:
        throw new IllegalArgumentException("Levels are per axis: " + axis);
    }
  }

  /** Returns the gridlines of the selected axis; for {@link GridAxis#BOTH}, meridians first. */
  public ImmutableList<GridLine> lines(GridAxis axis) {
    switch (axis) {
      case LON:
        return lonLines;
      case LAT:
        return latLines;
      default:
        return ImmutableList.<GridLine>builder().addAll(lonLines).addAll(latLines).build();
    }
  }

  /** Returns the ticks of the selected axis keyed by the side of the viewport they lie on. */
  public ImmutableListMultimap<LineBoxCrossings.Side, TickCrossing> ticks(GridAxis axis) {
    switch (axis) {
      case LON:
        return lonTicks;
      case LAT:
        return latTicks;
      default:
        return ImmutableListMultimap.<LineBoxCrossings.Side, TickCrossing>builder()
            .putAll(lonTicks)
            .putAll(latTicks)
            .build();
    }
  }

  @Override
  public String toString() {
    return "GridInfo("
        + extremes
        + ", "
        + lonLines.size()
        + " meridians, "
        + latLines.size()
        + " parallels, "
        + (lonTicks.size() + latTicks.size())
        + " ticks)";
  }
}
