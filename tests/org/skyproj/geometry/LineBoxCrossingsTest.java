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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.skyproj.geometry.LineBoxCrossings.Crossing;
import org.skyproj.geometry.LineBoxCrossings.Side;

/** Verifies LineBoxCrossings. */
@RunWith(JUnit4.class)
public class LineBoxCrossingsTest extends SkyTestCase {
  private static final R2Rect UNIT_BOX = R2Rect.fromExtents(-1, -1, 1, 1);

  @Test
  public void testHorizontalLine() {
    ImmutableListMultimap<Side, Crossing> crossings =
        LineBoxCrossings.find(new double[] {-2, 2}, new double[] {0, 0}, UNIT_BOX);
    assertEquals(1, crossings.get(Side.LEFT).size());
    assertEquals(1, crossings.get(Side.RIGHT).size());
    assertTrue(crossings.get(Side.BOTTOM).isEmpty());
    assertTrue(crossings.get(Side.TOP).isEmpty());

    Crossing left = crossings.get(Side.LEFT).get(0);
    assertEquals(new R2Vector(-1, 0), left.position());
    assertExactly(0, left.angle());
    Crossing right = crossings.get(Side.RIGHT).get(0);
    assertEquals(new R2Vector(1, 0), right.position());
    assertExactly(0, right.angle());
  }

  @Test
  public void testReversedLine() {
    ImmutableListMultimap<Side, Crossing> crossings =
        LineBoxCrossings.find(new double[] {2, -2}, new double[] {0, 0}, UNIT_BOX);
    assertExactly(180, crossings.get(Side.LEFT).get(0).angle());
    assertExactly(180, crossings.get(Side.RIGHT).get(0).angle());
  }

  @Test
  public void testVerticalLine() {
    ImmutableListMultimap<Side, Crossing> crossings =
        LineBoxCrossings.find(new double[] {0.5, 0.5}, new double[] {-3, 3}, UNIT_BOX);
    assertEquals(0, crossings.get(Side.LEFT).size() + crossings.get(Side.RIGHT).size());
    Crossing bottom = crossings.get(Side.BOTTOM).get(0);
    assertEquals(new R2Vector(0.5, -1), bottom.position());
    assertExactly(90, bottom.angle());
    Crossing top = crossings.get(Side.TOP).get(0);
    assertEquals(new R2Vector(0.5, 1), top.position());
    assertExactly(90, top.angle());
  }

  @Test
  public void testDiagonalLine() {
    ImmutableListMultimap<Side, Crossing> crossings =
        LineBoxCrossings.find(
            ImmutableList.of(new R2Vector(-0.5, -2), new R2Vector(2, 0.5)), UNIT_BOX);
    // The line y = x - 1.5 enters through the bottom and leaves through the right side.
    assertTrue(crossings.get(Side.LEFT).isEmpty());
    assertTrue(crossings.get(Side.TOP).isEmpty());
    Crossing bottom = crossings.get(Side.BOTTOM).get(0);
    assertEquals(new R2Vector(0.5, -1), bottom.position());
    assertDoubleNear(45.0, bottom.angle());
    Crossing right = crossings.get(Side.RIGHT).get(0);
    assertEquals(new R2Vector(1, -0.5), right.position());
    assertDoubleNear(45.0, right.angle());
  }

  @Test
  public void testCrossingsOutsideSideAreIgnored() {
    // Crosses the line x = -1 at y = 5, beyond the box.
    ImmutableListMultimap<Side, Crossing> crossings =
        LineBoxCrossings.find(new double[] {-2, 0}, new double[] {5, 5}, UNIT_BOX);
    assertTrue(crossings.isEmpty());
  }

  @Test
  public void testGapsAreNotCrossed() {
    double nan = Double.NaN;
    ImmutableListMultimap<Side, Crossing> crossings =
        LineBoxCrossings.find(
            new double[] {-2, nan, 2, 3}, new double[] {0, nan, 0, 0}, UNIT_BOX);
    assertTrue(crossings.isEmpty());

    crossings =
        LineBoxCrossings.find(
            new double[] {-2, 0, nan, 0, 2}, new double[] {0, 0, nan, 0, 0}, UNIT_BOX);
    assertEquals(1, crossings.get(Side.LEFT).size());
    assertEquals(1, crossings.get(Side.RIGHT).size());
  }

  @Test
  public void testMultipleCrossingsInOrder() {
    ImmutableListMultimap<Side, Crossing> crossings =
        LineBoxCrossings.find(
            new double[] {-2, 0, -2, 0}, new double[] {-0.5, -0.5, 0.5, 0.5}, UNIT_BOX);
    assertEquals(3, crossings.get(Side.LEFT).size());
    assertExactly(-0.5, crossings.get(Side.LEFT).get(0).position().y());
    assertExactly(0.0, crossings.get(Side.LEFT).get(1).position().y());
    assertExactly(0.5, crossings.get(Side.LEFT).get(2).position().y());
  }

  @Test
  public void testDegenerateInput() {
    assertTrue(LineBoxCrossings.find(new double[] {0}, new double[] {0}, UNIT_BOX).isEmpty());
    assertTrue(LineBoxCrossings.find(new double[0], new double[0], UNIT_BOX).isEmpty());
  }
}
