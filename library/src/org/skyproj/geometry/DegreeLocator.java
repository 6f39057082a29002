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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.primitives.ImmutableDoubleArray;

/**
 * A {@link LevelLocator} that picks round angular steps: whole degrees (1, 2, 5, 10, 15, 30, 45,
 * 90, 180, 360), arcminutes or arcseconds (1, 2, 3, 5, 10, 15, 20, 30), or decimal fractions of an
 * arcsecond, aiming for about {@code nbins} intervals over the range.
 *
 * <p>When whole degree levels span a full circle, the levels are rebuilt as exactly one cycle from
 * the first level, with or without the level that closes the circle.
 */
public final class DegreeLocator implements LevelLocator {
  /** Ranges per bin below this many degrees use decimal sub-arcsecond steps. */
  private static final double THRESHOLD_FACTOR = 3600.0;

  private static final double CYCLE = 360.0;

  private static final double[] MINSEC_LIMITS = {1.5, 2.5, 3.5, 8, 11, 18, 25, 45};
  private static final int[] MINSEC_STEPS = {1, 2, 3, 5, 10, 15, 20, 30};
  private static final double[] DEGREE_LIMITS = {1.5, 3, 7, 13, 20, 40, 70, 120, 270, 520};
  private static final int[] DEGREE_STEPS = {1, 2, 5, 10, 15, 30, 45, 90, 180, 360};

  /** Upper limits of the bin size (in degrees) for each step, in increasing order. */
  private static final double[] LIMITS;

  private static final int[] STEPS;
  private static final double[] FACTORS;

  static {
    int n = 2 * MINSEC_LIMITS.length + DEGREE_LIMITS.length;
    LIMITS = new double[n];
    STEPS = new int[n];
    FACTORS = new double[n];
    int i = 0;
    for (double factor : new double[] {3600.0, 60.0}) {
      for (int j = 0; j < MINSEC_LIMITS.length; j++, i++) {
        LIMITS[i] = MINSEC_LIMITS[j] / factor;
        STEPS[i] = MINSEC_STEPS[j];
        FACTORS[i] = factor;
      }
    }
    for (int j = 0; j < DEGREE_LIMITS.length; j++, i++) {
      LIMITS[i] = DEGREE_LIMITS[j];
      STEPS[i] = DEGREE_STEPS[j];
      FACTORS[i] = 1.0;
    }
  }

  private final int nbins;
  private final boolean includeLast;

  /**
   * @param nbins the desired number of intervals
   * @param includeLast whether a full circle of levels keeps the level that closes it
   */
  public DegreeLocator(int nbins, boolean includeLast) {
    Preconditions.checkArgument(nbins > 0, "nbins must be positive: %s", nbins);
    this.nbins = nbins;
    this.includeLast = includeLast;
  }

  public int nbins() {
    return nbins;
  }

  public boolean includeLast() {
    return includeLast;
  }

  @Override
  public Levels locate(double v1, double v2) {
    if (v1 > v2) {
      double t = v1;
      v1 = v2;
      v2 = t;
    }
    double dv = (v2 - v1) / nbins;
    double step;
    double factor;
    if (dv > 1 / THRESHOLD_FACTOR) {
      double[] stepAndFactor = selectStepDegree(dv);
      step = stepAndFactor[0];
      factor = stepAndFactor[1];
    } else {
      double[] stepAndFactor = selectStepSub(dv * THRESHOLD_FACTOR);
      step = stepAndFactor[0];
      factor = stepAndFactor[1] * THRESHOLD_FACTOR;
    }

    long first = (long) Math.floor(v1 * factor / step);
    long last = (long) Math.ceil(v2 * factor / step);
    ImmutableDoubleArray.Builder levels = ImmutableDoubleArray.builder();
    for (long k = first; k <= last; k++) {
      levels.add(k * step);
    }
    double lo = first * step;
    double hi = last * step;
    if (factor == 1.0 && hi >= lo + CYCLE) {
      int perCycle = (int) (CYCLE / step);
      int n = includeLast ? perCycle + 1 : perCycle;
      levels = ImmutableDoubleArray.builder();
      for (int k = 0; k < n; k++) {
        levels.add(lo + k * step);
      }
    }
    ImmutableDoubleArray result = levels.build();
    return new Levels(result, result.length(), factor);
  }

  /** Returns {step, factor} for a bin size of at least one arcsecond, in degrees. */
  @VisibleForTesting
  static double[] selectStepDegree(double dv) {
    int n = 0;
    while (n < LIMITS.length && LIMITS[n] < dv) {
      n++;
    }
    n = Math.min(n, LIMITS.length - 1);
    return new double[] {STEPS[n], FACTORS[n]};
  }

  /** Returns {step, factor} for a bin size given in units where 1 is the smallest step. */
  @VisibleForTesting
  static double[] selectStepSub(double dv) {
    double tmp = Math.pow(10.0, (int) Math.log10(dv) - 1.0);
    double factor = 1.0 / tmp;
    if (1.5 * tmp >= dv) {
      return new double[] {1, factor};
    } else if (3.0 * tmp >= dv) {
      return new double[] {2, factor};
    } else if (7.0 * tmp >= dv) {
      return new double[] {5, factor};
    }
    return new double[] {1, 0.1 * factor};
  }

  @Override
  public String toString() {
    return "DegreeLocator(nbins=" + nbins + ", includeLast=" + includeLast + ")";
  }
}
