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
import jsinterop.annotations.JsType;

/**
 * A rectangular window in (longitude, latitude), in degrees. The latitude range lies within [-90,
 * 90] and the longitude range spans at most 360 degrees; a span of exactly 360 is the full sky.
 * Longitudes are not normalized, so a window may run from e.g. -360 to 0.
 */
@JsType
public final class LonLatWindow {
  private final R1Interval lon;
  private final R1Interval lat;

  public LonLatWindow(R1Interval lon, R1Interval lat) {
    Preconditions.checkArgument(lat.lo() >= -90.0 && lat.hi() <= 90.0, "Bad latitudes: %s", lat);
    Preconditions.checkArgument(lon.getLength() <= 360.0, "Longitude span > 360: %s", lon);
    this.lon = lon;
    this.lat = lat;
  }

  /** Returns the window for the given longitude and latitude bounds. */
  public static LonLatWindow of(double lonMin, double lonMax, double latMin, double latMax) {
    return new LonLatWindow(new R1Interval(lonMin, lonMax), new R1Interval(latMin, latMax));
  }

  /** Returns the longitude range (lon_min, lon_max). */
  public R1Interval lon() {
    return lon;
  }

  /** Returns the latitude range (lat_min, lat_max). */
  public R1Interval lat() {
    return lat;
  }

  /** Returns the longitude span in degrees. */
  public double lonWidth() {
    return lon.getLength();
  }

  @Override
  public boolean equals(Object other) {
    if (!(other instanceof LonLatWindow)) {
      return false;
    }
    LonLatWindow that = (LonLatWindow) other;
    return lon.equals(that.lon) && lat.equals(that.lat);
  }

  @Override
  public int hashCode() {
    return lon.hashCode() * 31 + lat.hashCode();
  }

  @Override
  public String toString() {
    return "LonLatWindow(lon=" + lon + ", lat=" + lat + ")";
  }
}
