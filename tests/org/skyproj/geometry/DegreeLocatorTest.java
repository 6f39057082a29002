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
import static org.junit.Assert.assertThrows;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Verifies DegreeLocator. */
@RunWith(JUnit4.class)
public class DegreeLocatorTest extends SkyTestCase {
  @Test
  public void testLatitudeLevels() {
    LevelLocator.Levels levels = new DegreeLocator(6, true).locate(-90, 90);
    assertEquals(7, levels.count());
    assertExactly(1, levels.factor());
    assertArrayEquals(new double[] {-90, -60, -30, 0, 30, 60, 90}, levels.values(), 0.0);
  }

  @Test
  public void testArgumentOrderDoesNotMatter() {
    DegreeLocator locator = new DegreeLocator(5, true);
    assertArrayEquals(
        locator.locate(12.5, 47.0).values(), locator.locate(47.0, 12.5).values(), 0.0);
  }

  @Test
  public void testLevelsCoverRange() {
    LevelLocator.Levels levels = new DegreeLocator(4, true).locate(-17, 23);
    double[] values = levels.values();
    assertExactly(10, values[1] - values[0]);
    assertArrayEquals(new double[] {-20, -10, 0, 10, 20, 30}, values, 0.0);
  }

  @Test
  public void testFullCircleTruncation() {
    LevelLocator.Levels withoutLast = new DegreeLocator(10, false).locate(-360, 0);
    assertEquals(12, withoutLast.count());
    assertExactly(-360, withoutLast.values()[0]);
    assertExactly(-30, withoutLast.values()[11]);

    LevelLocator.Levels withLast = new DegreeLocator(10, true).locate(-180, 180);
    assertEquals(13, withLast.count());
    assertExactly(-180, withLast.values()[0]);
    assertExactly(180, withLast.values()[12]);
  }

  @Test
  public void testArcminuteLevels() {
    LevelLocator.Levels levels = new DegreeLocator(6, true).locate(10, 10.5);
    assertExactly(60, levels.factor());
    assertEquals(7, levels.count());
    assertExactly(600, levels.levels().get(0));
    assertExactly(630, levels.levels().get(6));
    assertDoubleNear(10 + 5.0 / 60, levels.values()[1], 1e-12);
  }

  @Test
  public void testArcsecondLevels() {
    LevelLocator.Levels levels = new DegreeLocator(4, true).locate(0, 0.01);
    assertExactly(3600, levels.factor());
    assertExactly(10, levels.levels().get(1) - levels.levels().get(0));
  }

  @Test
  public void testSubArcsecondLevels() {
    LevelLocator.Levels levels = new DegreeLocator(5, true).locate(0, 1e-4);
    assertExactly(36000, levels.factor());
    assertEquals(5, levels.count());
    assertDoubleNear(1.0 / 36000, levels.values()[1], 1e-15);
  }

  @Test
  public void testSelectStepDegree() {
    assertArrayEquals(new double[] {1, 1}, DegreeLocator.selectStepDegree(1.0), 0.0);
    assertArrayEquals(new double[] {30, 1}, DegreeLocator.selectStepDegree(36), 0.0);
    assertArrayEquals(new double[] {360, 1}, DegreeLocator.selectStepDegree(1000), 0.0);
    assertArrayEquals(new double[] {15, 60}, DegreeLocator.selectStepDegree(0.25), 0.0);
  }

  @Test
  public void testSelectStepSub() {
    assertArrayEquals(new double[] {1, 10}, DegreeLocator.selectStepSub(0.072), 1e-9);
    assertArrayEquals(new double[] {2, 10}, DegreeLocator.selectStepSub(0.25), 1e-9);
  }

  @Test
  public void testInvalidBins() {
    assertThrows(IllegalArgumentException.class, () -> new DegreeLocator(0, true));
  }
}
