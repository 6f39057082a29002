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

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.skyproj.geometry.LineBoxCrossings.Side;
import org.skyproj.geometry.Projection.CylindricalProjection;
import org.skyproj.geometry.Projection.MollweideProjection;

/** Verifies SkyGridHelper. */
@RunWith(JUnit4.class)
public class SkyGridHelperTest extends SkyTestCase {
  private static final Viewport FULL_CYL = new Viewport(-180, 180, -90, 90);
  private static final Viewport ZOOMED_CYL = new Viewport(-100, 100, -50, 50);

  private static SkyGridHelper.Options wrapAt(double wrap) {
    SkyGridHelper.Options options = new SkyGridHelper.Options();
    options.setWrap(wrap);
    return options;
  }

  @Test
  public void testNotInitialized() {
    SkyGridHelper helper = new SkyGridHelper(new CylindricalProjection(-180));
    assertFalse(helper.isInitialized());
    SkyException e =
        assertThrows(SkyException.class, () -> helper.getGridlines(GridAxis.BOTH));
    assertEquals(SkyError.Code.FAILED_PRECONDITION, e.code());
    e = assertThrows(SkyException.class, helper::gridInfo);
    assertEquals(SkyError.Code.FAILED_PRECONDITION, e.code());
  }

  @Test
  public void testUpdateIsMemoized() {
    SkyGridHelper helper = new SkyGridHelper(new CylindricalProjection(-180));
    assertTrue(helper.isStale(ZOOMED_CYL));
    assertTrue(helper.update(ZOOMED_CYL));
    GridInfo info = helper.gridInfo();
    assertFalse(helper.isStale(new Viewport(-100, 100, -50, 50)));
    assertFalse(helper.update(new Viewport(-100, 100, -50, 50)));
    assertSame(info, helper.gridInfo());

    assertTrue(helper.update(FULL_CYL));
    assertFalse(info == helper.gridInfo());
    assertEquals(FULL_CYL, helper.gridInfo().viewport());
  }

  @Test
  public void testDefaultDeltaCut() {
    assertExactly(80, new SkyGridHelper(new CylindricalProjection(0)).deltaCut());
    assertExactly(0.5, new SkyGridHelper(new MollweideProjection(0)).deltaCut());
    assertExactly(1.5, new SkyGridHelper(new MollweideProjection(0, 3.0)).deltaCut());
    SkyGridHelper.Options options = new SkyGridHelper.Options();
    options.setDeltaCut(12.0);
    assertExactly(12, new SkyGridHelper(new CylindricalProjection(0), options).deltaCut());
  }

  @Test
  public void testIncludeLastLon() {
    assertFalse(new SkyGridHelper(new CylindricalProjection(0), wrapAt(0.0)).includeLastLon());
    assertTrue(new SkyGridHelper(new CylindricalProjection(0), wrapAt(180.0)).includeLastLon());
    SkyGridHelper.Options options = wrapAt(180.0);
    options.setFullCircle(true);
    assertFalse(new SkyGridHelper(new CylindricalProjection(0), options).includeLastLon());
  }

  @Test
  public void testCutGridLineJumps() {
    GridLine line =
        GridLine.of(
            GridAxis.LAT, 0.0, new double[] {0, 1, 2, 100, 101}, new double[] {0, 0, 0, 0, 0});
    GridLine cut = SkyGridHelper.cutGridLineJumps(line, 80);
    assertEquals(6, cut.size());
    assertEquals(1, cut.numGaps());
    assertTrue(Double.isNaN(cut.x(3)));
    assertTrue(Double.isNaN(cut.y(3)));
    assertExactly(100, cut.x(4));
    ImmutableList<ImmutableList<R2Vector>> segments = cut.segments();
    assertEquals(2, segments.size());
    assertEquals(3, segments.get(0).size());
    assertEquals(2, segments.get(1).size());
    assertEquals(GridAxis.LAT, cut.axis());
  }

  @Test
  public void testCutWithoutJumpsReturnsSameLine() {
    GridLine line =
        GridLine.of(GridAxis.LON, 30.0, new double[] {0, 0, 0}, new double[] {-50, 0, 50});
    assertSame(line, SkyGridHelper.cutGridLineJumps(line, 80));
    // Exactly at the threshold is not a jump.
    assertSame(line, SkyGridHelper.cutGridLineJumps(line, 50));
    assertEquals(2, SkyGridHelper.cutGridLineJumps(line, 49).numGaps());
  }

  @Test
  public void testComputeNumGridLines() {
    assertArrayEquals(
        new int[] {10, 6},
        SkyGridHelper.computeNumGridLines(LonLatWindow.of(-360, 0, -90, 90), null, null));
    assertArrayEquals(
        new int[] {4, 6},
        SkyGridHelper.computeNumGridLines(LonLatWindow.of(0, 60, 60, 90), null, null));
    assertArrayEquals(
        new int[] {4, 3},
        SkyGridHelper.computeNumGridLines(LonLatWindow.of(0, 360, -90, 90), 4, 3));
    assertArrayEquals(
        new int[] {5, 3},
        SkyGridHelper.computeNumGridLines(LonLatWindow.of(0, 360, -90, 90), null, 3));
    // A window with no height gets the most longitude lines; an empty one gets as many as
    // latitude lines.
    assertArrayEquals(
        new int[] {10, 6},
        SkyGridHelper.computeNumGridLines(LonLatWindow.of(0, 10, 5, 5), null, null));
    assertArrayEquals(
        new int[] {6, 6},
        SkyGridHelper.computeNumGridLines(LonLatWindow.of(5, 5, 5, 5), null, null));
  }

  @Test
  public void testFullSkyCylindrical() {
    SkyGridHelper helper = new SkyGridHelper(new CylindricalProjection(-180), wrapAt(0.0));
    helper.update(FULL_CYL);
    GridInfo info = helper.gridInfo();
    assertEquals(LonLatWindow.of(-360, 0, -90, 90), info.extremes());

    ImmutableList<GridLine> meridians = helper.getGridlines(GridAxis.LON);
    assertEquals(12, meridians.size());
    assertExactly(-360, meridians.get(0).value());
    assertExactly(-30, meridians.get(11).value());
    for (GridLine line : meridians) {
      assertEquals(SkyGridHelper.Options.DEFAULT_RESOLUTION, line.size());
      assertEquals(0, line.numGaps());
      assertExactly(line.value() + 180, line.x(0));
    }

    ImmutableList<GridLine> parallels = helper.getGridlines(GridAxis.LAT);
    assertEquals(7, parallels.size());
    assertExactly(-90, parallels.get(0).value());
    assertExactly(90, parallels.get(6).value());
    for (GridLine line : parallels) {
      assertEquals(0, line.numGaps());
      assertExactly(-180, line.x(0));
      assertExactly(180, line.x(line.size() - 1));
    }
    assertEquals(19, helper.getGridlines(GridAxis.BOTH).size());
  }

  @Test
  public void testFullSkyWrap180IncludesClosingMeridian() {
    SkyGridHelper helper = new SkyGridHelper(new CylindricalProjection(0), wrapAt(180.0));
    helper.update(FULL_CYL);
    ImmutableList<GridLine> meridians = helper.getGridlines(GridAxis.LON);
    assertEquals(13, meridians.size());
    assertExactly(-180, meridians.get(0).value());
    assertExactly(180, meridians.get(12).value());
    assertExactly(-180, meridians.get(0).x(0));
    assertExactly(180, meridians.get(12).x(0));

    SkyGridHelper.Options options = wrapAt(180.0);
    options.setFullCircle(true);
    SkyGridHelper fullCircle = new SkyGridHelper(new CylindricalProjection(0), options);
    fullCircle.update(FULL_CYL);
    assertEquals(12, fullCircle.getGridlines(GridAxis.LON).size());
  }

  @Test
  public void testFullSkyCenteredOnSeamOfWrap() {
    SkyGridHelper helper = new SkyGridHelper(new CylindricalProjection(180), wrapAt(0.0));
    helper.update(FULL_CYL);
    assertEquals(LonLatWindow.of(-360, 0, -90, 90), helper.gridInfo().extremes());

    ImmutableList<GridLine> meridians = helper.getGridlines(GridAxis.LON);
    assertEquals(12, meridians.size());
    assertExactly(-180, meridians.get(0).x(0));
    assertExactly(150, meridians.get(11).x(0));
    for (GridLine line : helper.getGridlines(GridAxis.LAT)) {
      assertEquals(0, line.numGaps());
      assertExactly(-180, line.x(0));
      assertExactly(180, line.x(line.size() - 1));
    }

    // The same map described with a center of -180 gives the same lines.
    SkyGridHelper same = new SkyGridHelper(new CylindricalProjection(-180), wrapAt(0.0));
    same.update(FULL_CYL);
    ImmutableList<GridLine> expected = same.getGridlines(GridAxis.BOTH);
    ImmutableList<GridLine> actual = helper.getGridlines(GridAxis.BOTH);
    assertEquals(expected.size(), actual.size());
    for (int i = 0; i < expected.size(); i++) {
      assertEquals(expected.get(i).size(), actual.get(i).size());
      for (int j = 0; j < expected.get(i).size(); j++) {
        assertDoubleNear(expected.get(i).x(j), actual.get(i).x(j));
        assertDoubleNear(expected.get(i).y(j), actual.get(i).y(j));
      }
    }
  }

  @Test
  public void testMollweideCenteredOnSeamOfWrap() {
    SkyGridHelper helper = new SkyGridHelper(new MollweideProjection(180), wrapAt(0.0));
    helper.update(new Viewport(-2.9, 2.9, -1.45, 1.45));
    GridLine equator = null;
    for (GridLine line : helper.getGridlines(GridAxis.LAT)) {
      assertEquals(0, line.numGaps());
      if (line.value() == 0) {
        equator = line;
      }
    }
    assertTrue(equator != null);
    assertDoubleNear(-2 * Math.sqrt(2), equator.x(0));
    assertDoubleNear(2 * Math.sqrt(2), equator.x(equator.size() - 1));
  }

  @Test
  public void testZoomedCylindricalTicks() {
    SkyGridHelper helper = new SkyGridHelper(new CylindricalProjection(-180), wrapAt(0.0));
    helper.update(ZOOMED_CYL);
    GridInfo info = helper.gridInfo();
    assertEquals(9, info.lines(GridAxis.LON).size());
    assertEquals(9, info.lines(GridAxis.LAT).size());

    ImmutableListMultimap<Side, TickCrossing> lonTicks = info.ticks(GridAxis.LON);
    assertEquals(7, lonTicks.get(Side.BOTTOM).size());
    assertEquals(7, lonTicks.get(Side.TOP).size());
    assertTrue(lonTicks.get(Side.LEFT).isEmpty());
    assertTrue(lonTicks.get(Side.RIGHT).isEmpty());
    TickCrossing first = lonTicks.get(Side.BOTTOM).get(0);
    assertEquals(GridAxis.LON, first.axis());
    assertEquals(Side.BOTTOM, first.side());
    assertExactly(-270, first.value());
    assertExactly(1, first.factor());
    assertDoubleNear(-90, first.position().x());
    assertDoubleNear(-50, first.position().y(), 1e-6);
    assertDoubleNear(90, first.angle());

    ImmutableListMultimap<Side, TickCrossing> latTicks = info.ticks(GridAxis.LAT);
    assertEquals(7, latTicks.get(Side.LEFT).size());
    assertEquals(7, latTicks.get(Side.RIGHT).size());
    assertTrue(latTicks.get(Side.BOTTOM).isEmpty());
    assertTrue(latTicks.get(Side.TOP).isEmpty());
    TickCrossing left = latTicks.get(Side.LEFT).get(0);
    assertExactly(-45, left.value());
    assertDoubleNear(0, left.angle());

    assertEquals(28, info.ticks(GridAxis.BOTH).size());
  }

  @Test
  public void testFixedLineCounts() {
    SkyGridHelper.Options options = wrapAt(0.0);
    options.setNGridLat(2);
    options.setNGridLon(4);
    SkyGridHelper helper = new SkyGridHelper(new CylindricalProjection(-180), options);
    helper.update(FULL_CYL);
    // Four 90 degree steps around the circle and two 90 degree steps pole to pole.
    assertEquals(4, helper.getGridlines(GridAxis.LON).size());
    assertEquals(3, helper.getGridlines(GridAxis.LAT).size());
  }

  @Test
  public void testMollweide() {
    SkyGridHelper helper = new SkyGridHelper(new MollweideProjection(0), wrapAt(180.0));
    helper.update(new Viewport(-2.9, 2.9, -1.45, 1.45));
    ImmutableList<GridLine> lines = helper.getGridlines(GridAxis.BOTH);
    assertFalse(helper.getGridlines(GridAxis.LON).isEmpty());
    assertFalse(helper.getGridlines(GridAxis.LAT).isEmpty());
    for (GridLine line : lines) {
      assertEquals(0, line.numGaps());
      for (int i = 0; i < line.size(); i++) {
        assertTrue(Math.abs(line.x(i)) <= 2 * Math.sqrt(2) + 1e-12);
        assertTrue(Math.abs(line.y(i)) <= Math.sqrt(2) + 1e-12);
      }
    }
  }

  @Test
  public void testSmallDeltaCutSplitsLines() {
    SkyGridHelper.Options options = wrapAt(0.0);
    options.setDeltaCut(1.0);
    SkyGridHelper helper = new SkyGridHelper(new CylindricalProjection(-180), options);
    helper.update(FULL_CYL);
    for (GridLine line : helper.getGridlines(GridAxis.LAT)) {
      // Steps along a parallel are 360 / 99 plot units.
      assertEquals(99, line.numGaps());
      assertEquals(100, line.segments().size());
    }
  }

  @Test
  public void testTickIteratorUnsupported() {
    SkyGridHelper helper = new SkyGridHelper(new CylindricalProjection(-180));
    helper.update(FULL_CYL);
    assertThrows(UnsupportedOperationException.class, helper::getTickIterator);
  }

  @Test
  public void testOptionsValidation() {
    SkyGridHelper.Options options = new SkyGridHelper.Options();
    assertThrows(IllegalArgumentException.class, () -> options.setNGridLon(0));
    assertThrows(IllegalArgumentException.class, () -> options.setResolution(1));
    assertThrows(IllegalArgumentException.class, () -> options.setDeltaCut(-1.0));
    assertThrows(IllegalArgumentException.class, () -> options.setExtremeSamples(1, 1));
  }

  @Test
  public void testViewportSameLimits() {
    Viewport v = new Viewport(1, 2, 3, 4);
    assertTrue(v.sameLimits(new Viewport(1, 2, 3, 4)));
    assertFalse(v.sameLimits(new Viewport(2, 1, 3, 4)));
    assertFalse(v.sameLimits(null));
    assertEquals(R2Rect.fromExtents(1, 3, 2, 4), v.toRect());
    assertEquals(v, Viewport.fromRect(v.toRect()));
  }

  @Test
  public void testViewportSignedZeroHashesAlike() {
    Viewport positive = new Viewport(0.0, 1, 0.0, 1);
    Viewport negative = new Viewport(-0.0, 1, -0.0, 1);
    assertEquals(positive, negative);
    assertEquals(positive.hashCode(), negative.hashCode());
  }
}
