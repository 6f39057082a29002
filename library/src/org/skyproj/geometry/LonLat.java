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

import static java.lang.Math.toRadians;

import java.io.Serializable;
import jsinterop.annotations.JsType;

/**
 * A (longitude, latitude) position on the sphere, in degrees. Longitudes are not normalized;
 * either coordinate may be NaN for positions returned by an inverse projection outside its domain.
 */
@JsType
public final class LonLat implements Serializable {
  private final double lon;
  private final double lat;

  public LonLat(double lon, double lat) {
    this.lon = lon;
    this.lat = lat;
  }

  /** Returns the longitude in degrees. */
  public double lon() {
    return lon;
  }

  /** Returns the latitude in degrees. */
  public double lat() {
    return lat;
  }

  /** Returns true if either coordinate is NaN. */
  public boolean isNaN() {
    return Double.isNaN(lon) || Double.isNaN(lat);
  }

  /** Returns the great circle distance to {@code other}, in degrees. */
  public double getDistance(LonLat other) {
    double lat1 = toRadians(lat);
    double lat2 = toRadians(other.lat);
    double dLat = Math.sin(0.5 * (lat2 - lat1));
    double dLon = Math.sin(0.5 * toRadians(other.lon - lon));
    double x = dLat * dLat + dLon * dLon * Math.cos(lat1) * Math.cos(lat2);
    return Math.toDegrees(2 * Math.asin(Math.sqrt(Math.min(1.0, x))));
  }

  @Override
  public boolean equals(Object that) {
    if (!(that instanceof LonLat)) {
      return false;
    }
    LonLat o = (LonLat) that;
    return lon == o.lon && lat == o.lat;
  }

  @Override
  public int hashCode() {
    long value = 17;
    value += 37 * value + Double.doubleToLongBits(lon);
    value += 37 * value + Double.doubleToLongBits(lat);
    return (int) (value ^ (value >>> 32));
  }

  @Override
  public String toString() {
    return "(" + lon + ", " + lat + ")";
  }
}
