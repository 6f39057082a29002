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
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.skyproj.geometry.Projection.CylindricalProjection;
import org.skyproj.geometry.Projection.MollweideProjection;

/** Verifies the Projection implementations. */
@RunWith(JUnit4.class)
public class ProjectionTest extends SkyTestCase {
  private static final double SQRT2 = Math.sqrt(2);

  @Test
  public void testRelativeLon() {
    assertExactly(30, Projection.relativeLon(30, 0));
    assertExactly(180, Projection.relativeLon(180, 0));
    assertExactly(-180, Projection.relativeLon(-180, 0));
    assertExactly(-90, Projection.relativeLon(270, 0));
    assertExactly(10, Projection.relativeLon(-350, 0));
    assertExactly(0, Projection.relativeLon(-180, -180));
  }

  @Test
  public void testCylindricalForward() {
    CylindricalProjection cyl = new CylindricalProjection(100);
    assertEquals("cyl", cyl.name());
    assertEquals(new R2Vector(30, 10), cyl.fromLonLat(130, 10));
    assertEquals(new R2Vector(-180, -5), cyl.fromLonLat(-80, -5));
    assertEquals(new R2Vector(180, -5), cyl.fromLonLat(280, -5));
    assertTrue(cyl.fromLonLat(0, 95).isNaN());
    assertDoubleNear(180 / Math.PI, cyl.radius());
  }

  @Test
  public void testFromLonLatInWindow() {
    // The seam of a map centered on 180 falls on a wrap of 0.
    CylindricalProjection cyl = new CylindricalProjection(180);
    assertEquals(new R2Vector(180, 0), cyl.fromLonLat(0, 0, 0.0));
    assertEquals(new R2Vector(-180, 0), cyl.fromLonLat(-360, 0, 0.0));
    assertEquals(new R2Vector(-180, 0), cyl.fromLonLat(0, 0));
    assertEquals(new R2Vector(-90, 0), cyl.fromLonLat(90, 0, 0.0));
    assertEquals(new R2Vector(-90, 0), cyl.fromLonLat(-270, 0, 0.0));

    // When the seam is elsewhere the window changes nothing.
    CylindricalProjection centered = new CylindricalProjection(0);
    assertEquals(new R2Vector(-90, 5), centered.fromLonLat(-90, 5, 0.0));
    assertEquals(new R2Vector(0, 5), centered.fromLonLat(-360, 5, 0.0));
    assertEquals(new R2Vector(179, 5), centered.fromLonLat(-181, 5, 0.0));
    assertEquals(new R2Vector(180, 5), centered.fromLonLat(180, 5, 180.0));
    assertEquals(new R2Vector(-180, 5), centered.fromLonLat(-180, 5, 180.0));

    MollweideProjection moll = new MollweideProjection(180);
    assertDoubleNear(2 * SQRT2, moll.fromLonLat(0, 0, 0.0).x());
    assertDoubleNear(-2 * SQRT2, moll.fromLonLat(-360, 0, 0.0).x());
  }

  @Test
  public void testCylindricalInverse() {
    CylindricalProjection cyl = new CylindricalProjection(-180);
    assertEquals(new LonLat(-360, 0), cyl.toLonLat(-180, 0));
    assertEquals(new LonLat(0, 45), cyl.toLonLat(180, 45));
    assertTrue(cyl.toLonLat(181, 0).isNaN());
    assertTrue(cyl.toLonLat(0, -91).isNaN());
    assertTrue(cyl.toLonLat(Double.NaN, 0).isNaN());
  }

  @Test
  public void testMollweideKnownPoints() {
    MollweideProjection moll = new MollweideProjection(0);
    assertEquals("moll", moll.name());
    R2Vector pole = moll.fromLonLat(0, 90);
    assertDoubleNear(0, pole.x());
    assertDoubleNear(SQRT2, pole.y());
    R2Vector edge = moll.fromLonLat(180, 0);
    assertDoubleNear(2 * SQRT2, edge.x());
    assertDoubleNear(0, edge.y());
    R2Vector scaled = new MollweideProjection(0, 2.0).fromLonLat(180, 0);
    assertDoubleNear(4 * SQRT2, scaled.x());
    assertEquals(R2Rect.fromExtents(-2 * SQRT2, -SQRT2, 2 * SQRT2, SQRT2), moll.bounds());
  }

  @Test
  public void testMollweideOutsideEllipse() {
    MollweideProjection moll = new MollweideProjection(0);
    assertTrue(moll.toLonLat(2.9, 0).isNaN());
    assertTrue(moll.toLonLat(0, 1.5).isNaN());
    assertTrue(moll.toLonLat(2.5, 1.2).isNaN());
  }

  @Test
  public void testMollweideRoundTrip() {
    for (double lon0 : new double[] {0, 180, -45}) {
      MollweideProjection moll = new MollweideProjection(lon0);
      for (int i = 0; i < 1000; i++) {
        double lon = uniform(lon0 - 179, lon0 + 179);
        double lat = Math.toDegrees(Math.asin(uniform(-0.99, 0.99)));
        R2Vector p = moll.fromLonLat(lon, lat);
        LonLat back = moll.toLonLat(p.x(), p.y());
        assertDoubleNear(lon, back.lon(), 1e-8);
        assertDoubleNear(lat, back.lat(), 1e-8);
      }
    }
  }

  @Test
  public void testVectorized() {
    Projection cyl = new CylindricalProjection(0);
    double[] lon = {10, 20, 30};
    double[] lat = {-10, 0, 10};
    double[] xs = new double[3];
    double[] ys = new double[3];
    cyl.forward(lon, lat, xs, ys);
    double[] lonBack = new double[3];
    double[] latBack = new double[3];
    cyl.inverse(xs, ys, lonBack, latBack);
    for (int i = 0; i < 3; i++) {
      assertExactly(lon[i], lonBack[i]);
      assertExactly(lat[i], latBack[i]);
    }
    assertThrows(
        IllegalArgumentException.class,
        () -> cyl.forward(lon, new double[2], xs, ys));
  }

  @Test
  public void testInvalidRadius() {
    assertThrows(IllegalArgumentException.class, () -> new MollweideProjection(0, 0));
  }
}
