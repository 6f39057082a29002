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
import com.google.common.primitives.ImmutableDoubleArray;

/** Chooses the coordinate values at which gridlines are drawn within a range. */
public interface LevelLocator {
  /** Returns the levels to use for the range between {@code v1} and {@code v2}, in degrees. */
  Levels locate(double v1, double v2);

  /**
   * The result of a {@link LevelLocator}. The levels are scaled by {@link #factor()}, so a level
   * of 30 with factor 60 is 30 arcminutes; only the first {@link #count()} of them are used.
   */
  final class Levels {
    private final ImmutableDoubleArray levels;
    private final int count;
    private final double factor;

    public Levels(ImmutableDoubleArray levels, int count, double factor) {
      Preconditions.checkArgument(count >= 0 && count <= levels.length());
      Preconditions.checkArgument(factor > 0, "factor must be positive: %s", factor);
      this.levels = levels;
      this.count = count;
      this.factor = factor;
    }

    /** Returns the scaled levels. */
    public ImmutableDoubleArray levels() {
      return levels;
    }

    /** Returns the number of leading levels in use. */
    public int count() {
      return count;
    }

    /** Returns the scale of the levels relative to degrees. */
    public double factor() {
      return factor;
    }

    /** Returns the first {@link #count()} levels converted to degrees. */
    public double[] values() {
      double[] values = new double[count];
      for (int i = 0; i < count; i++) {
        values[i] = levels.get(i) / factor;
      }
      return values;
    }

    @Override
    public String toString() {
      return "Levels(" + levels + ", n=" + count + ", factor=" + factor + ")";
    }
  }
}
