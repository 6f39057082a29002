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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Random;
import org.junit.Before;

/** Common code for sky projection tests. */
public class SkyTestCase {
  private static final long SEED = 123455;

  protected Random rand;

  @Before
  public final void setUp() {
    rand = new Random(SEED);
  }

  /** Returns a randomly selected value between a and b. */
  public double uniform(double a, double b) {
    return a + (b - a) * rand.nextDouble();
  }

  /** Returns a random longitude in [0, 360) and latitude in [-90, 90], uniform on the sphere. */
  public LonLat randomLonLat() {
    double lon = uniform(0, 360);
    double lat = Math.toDegrees(Math.asin(uniform(-1, 1)));
    return new LonLat(lon, lat);
  }

  /** Succeeds if and only if 'x' is between 'lo' and 'hi' inclusive. */
  public static <T extends Comparable<T>> void assertBetween(T x, T lo, T hi) {
    assertTrue("Expected " + x + " >= " + lo + " but it is not.", x.compareTo(lo) >= 0);
    assertTrue("Expected " + x + " <= " + hi + " but it is not.", x.compareTo(hi) <= 0);
  }

  /** Assert that {@code val1} and {@code val2} are within the given {@code absError}. */
  public static void assertDoubleNear(double val1, double val2, double absError) {
    assertDoubleNear("", val1, val2, absError);
  }

  /** As above but with a custom error message. */
  public static void assertDoubleNear(String message, double val1, double val2, double absError) {
    double diff = Math.abs(val1 - val2);
    if (diff <= absError) {
      return;
    }
    if (!message.isEmpty()) {
      message = message + "\n";
    }
    fail(
        Platform.formatString(
            "%sThe difference between %s and %s is %s, which exceeds %s by %s.",
            message, val1, val2, diff, absError, diff - absError));
  }

  /** Assert that {@code a} and {@code b} are within 1e-9 of each other. */
  public static void assertDoubleNear(double a, double b) {
    assertDoubleNear(a, b, 1e-9);
  }

  /** Checks that two doubles are exactly equal; 0.0 equals -0.0. */
  public static void assertExactly(double expected, double actual) {
    assertEquals(expected, actual, 0.0);
  }
}
