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

/**
 * Collapses the components stored for one pixel of a {@link SparseHealpixMap} into the single value
 * that is rasterized, and decides whether that value is masked. Ordinary maps store one component
 * per pixel; wide masks store one component per bit.
 */
public interface ValueReduction {
  /** Returns the value to rasterize for a pixel with the given components. */
  double reduce(double[] components);

  /** Returns true if the reduced value marks missing data for a map with the given sentinel. */
  boolean isMasked(double reduced, double sentinel);

  /** Returns the type of the reduced values for a map whose components have the given type. */
  ValueType outputType(ValueType componentType);

  /** Passes the first component through, masking values close to the sentinel and NaN. */
  ValueReduction SCALAR = new ScalarReduction();

  /** Reduces a wide mask to 1 where any bit is set and 0 otherwise, masking the zeros. */
  ValueReduction ANY_BIT = new AnyBitReduction();

  /** The reduction for single-valued maps. */
  final class ScalarReduction implements ValueReduction {
    private ScalarReduction() {}

    @Override
    public double reduce(double[] components) {
      return components[0];
    }

    @Override
    public boolean isMasked(double reduced, double sentinel) {
      return Double.isNaN(reduced) || SkyMath.isClose(reduced, sentinel);
    }

    @Override
    public ValueType outputType(ValueType componentType) {
      return componentType;
    }

    @Override
    public String toString() {
      return "SCALAR";
    }
  }

  /** The reduction for wide bit masks. */
  final class AnyBitReduction implements ValueReduction {
    private AnyBitReduction() {}

    @Override
    public double reduce(double[] components) {
      for (double bit : components) {
        if (bit != 0) {
          return 1;
        }
      }
      return 0;
    }

    @Override
    public boolean isMasked(double reduced, double sentinel) {
      return reduced == 0;
    }

    @Override
    public ValueType outputType(ValueType componentType) {
      return ValueType.INT32;
    }

    @Override
    public String toString() {
      return "ANY_BIT";
    }
  }
}
