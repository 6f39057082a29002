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
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.Iterator;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Computes the graticule of a projected sky map: gridlines of constant longitude and latitude,
 * cut where they jump across a projection seam, and the ticks where they cross the sides of the
 * viewport.
 *
 * <p>Call {@link #update} whenever the plot limits may have changed; the graticule is only
 * recomputed when they did. A helper is not thread-safe and is meant to be owned by a single
 * rendering thread.
 *
 * <p>Example:
 *
 * <pre>{@code
 * SkyGridHelper.Options options = new SkyGridHelper.Options();
 * options.setWrap(180.0);
 * SkyGridHelper helper = new SkyGridHelper(new MollweideProjection(0.0), options);
 * helper.update(new Viewport(-2.8, 2.8, -1.4, 1.4));
 * for (GridLine line : helper.getGridlines(GridAxis.BOTH)) {
 *   ...
 * }
 * }</pre>
 */
public final class SkyGridHelper {
  private static final Logger log = Platform.getLoggerForClass(SkyGridHelper.class);

  /** The number of latitude lines asked for unless overridden. */
  public static final int DEFAULT_N_GRID_LAT = 6;

  /** The jump threshold for cylindrical projections, in plot units. */
  public static final double CYLINDRICAL_DELTA_CUT = 80.0;

  /** The viewport is grown by this factor so that crossings on its sides are not missed. */
  static final double BOX_EXPANSION = 1 + 2e-10;

  private static final double MIN_LON_RATIO = 1.0 / 3.0;
  private static final double MAX_LON_RATIO = 5.0 / 3.0;

  /** Options for a {@link SkyGridHelper}. */
  public static class Options {
    public static final int DEFAULT_RESOLUTION = 100;

    private double wrap = 0.0;
    private @Nullable Integer nGridLon = null;
    private @Nullable Integer nGridLat = null;
    private boolean fullCircle = false;
    private @Nullable Double deltaCut = null;
    private int extremeSamplesX = ExtremeFinder.DEFAULT_SAMPLES;
    private int extremeSamplesY = ExtremeFinder.DEFAULT_SAMPLES;
    private int resolution = DEFAULT_RESOLUTION;

    /** Constructor that sets default options. */
    public Options() {}

    /** Options copy constructor. */
    public Options(Options other) {
      this.wrap = other.wrap;
      this.nGridLon = other.nGridLon;
      this.nGridLat = other.nGridLat;
      this.fullCircle = other.fullCircle;
      this.deltaCut = other.deltaCut;
      this.extremeSamplesX = other.extremeSamplesX;
      this.extremeSamplesY = other.extremeSamplesY;
      this.resolution = other.resolution;
    }

    public double wrap() {
      return wrap;
    }

    /**
     * Sets the wrap angle: visible longitudes are taken in [wrap - 360, wrap].
     *
     * <p>DEFAULT: 0.0
     */
    public void setWrap(double wrap) {
      this.wrap = wrap;
    }

    public @Nullable Integer nGridLon() {
      return nGridLon;
    }

    /**
     * Fixes the number of longitude lines asked of the level locator.
     *
     * <p>DEFAULT: null, meaning it follows the shape of the visible region
     */
    public void setNGridLon(@Nullable Integer nGridLon) {
      Preconditions.checkArgument(nGridLon == null || nGridLon > 0, "Bad nGridLon: %s", nGridLon);
      this.nGridLon = nGridLon;
    }

    public @Nullable Integer nGridLat() {
      return nGridLat;
    }

    /**
     * Fixes the number of latitude lines asked of the level locator.
     *
     * <p>DEFAULT: null, meaning {@link SkyGridHelper#DEFAULT_N_GRID_LAT}
     */
    public void setNGridLat(@Nullable Integer nGridLat) {
      Preconditions.checkArgument(nGridLat == null || nGridLat > 0, "Bad nGridLat: %s", nGridLat);
      this.nGridLat = nGridLat;
    }

    public boolean fullCircle() {
      return fullCircle;
    }

    /**
     * Set to true when the map shows the full circle of longitudes with both seams visible, so the
     * closing meridian is drawn even with a wrap of 180.
     *
     * <p>DEFAULT: false
     */
    public void setFullCircle(boolean fullCircle) {
      this.fullCircle = fullCircle;
    }

    public @Nullable Double deltaCut() {
      return deltaCut;
    }

    /**
     * Sets the distance between consecutive vertices, in plot units, above which a gridline is cut.
     *
     * <p>DEFAULT: null, meaning {@link SkyGridHelper#CYLINDRICAL_DELTA_CUT} for the "cyl"
     * projection and half the projection radius otherwise
     */
    public void setDeltaCut(@Nullable Double deltaCut) {
      Preconditions.checkArgument(deltaCut == null || deltaCut > 0, "Bad deltaCut: %s", deltaCut);
      this.deltaCut = deltaCut;
    }

    public int extremeSamplesX() {
      return extremeSamplesX;
    }

    public int extremeSamplesY() {
      return extremeSamplesY;
    }

    /**
     * Sets the size of the grid of points sampled to find the visible extremes.
     *
     * <p>DEFAULT: 20 x 20
     */
    public void setExtremeSamples(int nx, int ny) {
      Preconditions.checkArgument(nx >= 2 && ny >= 2, "Need at least 2x2 samples: %sx%s", nx, ny);
      this.extremeSamplesX = nx;
      this.extremeSamplesY = ny;
    }

    public int resolution() {
      return resolution;
    }

    /**
     * Sets the number of vertices of each gridline before cutting.
     *
     * <p>DEFAULT: 100
     */
    public void setResolution(int resolution) {
      Preconditions.checkArgument(resolution >= 2, "Need at least 2 vertices: %s", resolution);
      this.resolution = resolution;
    }
  }

  private final Projection projection;
  private final Options options;
  private final ExtremeFinder extremeFinder;
  private final double deltaCut;
  private final boolean includeLastLon;

  private @Nullable Viewport lastViewport = null;
  private @Nullable GridInfo gridInfo = null;

  public SkyGridHelper(Projection projection) {
    this(projection, new Options());
  }

  public SkyGridHelper(Projection projection, Options options) {
    this.projection = Preconditions.checkNotNull(projection);
    this.options = new Options(options);
    this.extremeFinder =
        new ExtremeFinder(options.extremeSamplesX(), options.extremeSamplesY(), options.wrap());
    Double cut = options.deltaCut();
    this.deltaCut = cut != null ? cut : defaultDeltaCut(projection);
    this.includeLastLon = options.wrap() == 180.0 && !options.fullCircle();
  }

  /** Returns the jump threshold used for {@code projection} when none is configured. */
  public static double defaultDeltaCut(Projection projection) {
    if (projection.name().equals(Projection.CylindricalProjection.NAME)) {
      return CYLINDRICAL_DELTA_CUT;
    }
    return 0.5 * projection.radius();
  }

  public Projection projection() {
    return projection;
  }

  /** Returns a copy of the options. */
  public Options options() {
    return new Options(options);
  }

  public double deltaCut() {
    return deltaCut;
  }

  /** Returns true if the longitude levels keep the meridian that closes a full circle. */
  public boolean includeLastLon() {
    return includeLastLon;
  }

  /** Returns true once {@link #update} has succeeded. */
  public boolean isInitialized() {
    return gridInfo != null;
  }

  /** Returns true if the graticule was computed for limits other than those of {@code viewport}. */
  public boolean isStale(Viewport viewport) {
    return !viewport.sameLimits(lastViewport);
  }

  /**
   * Brings the graticule up to date with {@code viewport}. Does nothing if the viewport has the
   * same limits as the last successful update.
   *
   * @return true if the graticule was recomputed
   */
  @CanIgnoreReturnValue
  public boolean update(Viewport viewport) {
    if (!isStale(viewport)) {
      return false;
    }
    gridInfo = computeGridInfo(viewport);
    lastViewport = viewport;
    return true;
  }

  /**
   * Returns the gridlines of the selected axis, already cut at jumps.
   *
   * @throws SkyException with {@link SkyError.Code#FAILED_PRECONDITION} before the first update
   */
  public ImmutableList<GridLine> getGridlines(GridAxis axis) {
    return gridInfo().lines(axis);
  }

  /**
   * Returns the current graticule.
   *
   * @throws SkyException with {@link SkyError.Code#FAILED_PRECONDITION} before the first update
   */
  public GridInfo gridInfo() {
    GridInfo info = gridInfo;
    if (info == null) {
      throw new SkyException(
          SkyError.Code.FAILED_PRECONDITION, "Must first call update(viewport)");
    }
    return info;
  }

  /** Iterating over labelled ticks is not supported; use {@link GridInfo#ticks} instead. */
  public Iterator<TickCrossing> getTickIterator() {
    throw new UnsupportedOperationException("Tick iteration is not implemented");
  }

  private GridInfo computeGridInfo(Viewport viewport) {
    LonLatWindow extremes = extremeFinder.find(projection, viewport);
    int[] counts = computeNumGridLines(extremes, options.nGridLon(), options.nGridLat());
    if (log.isLoggable(Level.FINE)) {
      log.fine(Platform.formatString("Making %d/%d lines", counts[0], counts[1]));
    }
    LevelLocator lonLocator = new DegreeLocator(counts[0], includeLastLon);
    LevelLocator latLocator = new DegreeLocator(counts[1], true);
    LevelLocator.Levels lonLevels = lonLocator.locate(extremes.lon().lo(), extremes.lon().hi());
    LevelLocator.Levels latLevels = latLocator.locate(extremes.lat().lo(), extremes.lat().hi());

    R2Rect box = viewport.toRect().expanded(BOX_EXPANSION, BOX_EXPANSION);
    ImmutableList.Builder<GridLine> lonLines = ImmutableList.builder();
    ImmutableListMultimap.Builder<LineBoxCrossings.Side, TickCrossing> lonTicks =
        ImmutableListMultimap.builder();
    addLines(GridAxis.LON, lonLevels, extremes, box, lonLines, lonTicks);
    ImmutableList.Builder<GridLine> latLines = ImmutableList.builder();
    ImmutableListMultimap.Builder<LineBoxCrossings.Side, TickCrossing> latTicks =
        ImmutableListMultimap.builder();
    addLines(GridAxis.LAT, latLevels, extremes, box, latLines, latTicks);

    return new GridInfo(
        viewport,
        extremes,
        lonLevels,
        latLevels,
        lonLines.build(),
        latLines.build(),
        lonTicks.build(),
        latTicks.build());
  }

  /**
   * Adds one gridline per level of {@code axis}, sweeping the other coordinate across the
   * extremes, and the crossings of each line with {@code box}. Latitude levels beyond the poles
   * are skipped.
   */
  private void addLines(
      GridAxis axis,
      LevelLocator.Levels levels,
      LonLatWindow extremes,
      R2Rect box,
      ImmutableList.Builder<GridLine> lines,
      ImmutableListMultimap.Builder<LineBoxCrossings.Side, TickCrossing> ticks) {
    int n = options.resolution();
    double[] sweep =
        axis == GridAxis.LON
            ? SkyMath.linspace(extremes.lat().lo(), extremes.lat().hi(), n)
            : SkyMath.linspace(extremes.lon().lo(), extremes.lon().hi(), n);
    double[] values = levels.values();
    for (int i = 0; i < values.length; i++) {
      double value = values[i];
      if (axis == GridAxis.LAT && Math.abs(value) > 90.0) {
        continue;
      }
      double[] xs = new double[n];
      double[] ys = new double[n];
      for (int j = 0; j < n; j++) {
        R2Vector p =
            axis == GridAxis.LON
                ? projection.fromLonLat(value, sweep[j], options.wrap())
                : projection.fromLonLat(sweep[j], value, options.wrap());
        xs[j] = p.x();
        ys[j] = p.y();
      }
      GridLine line = cutGridLineJumps(new GridLine(axis, value, xs, ys), deltaCut);
      lines.add(line);

      double level = levels.levels().get(i);
      for (Map.Entry<LineBoxCrossings.Side, LineBoxCrossings.Crossing> entry :
          LineBoxCrossings.find(line.xsArray(), line.ysArray(), box).entries()) {
        ticks.put(
            entry.getKey(),
            new TickCrossing(axis, level, levels.factor(), entry.getKey(), entry.getValue()));
      }
    }
  }

  /**
   * Returns {@code line} with a gap marker inserted between every pair of consecutive vertices
   * more than {@code deltaCut} apart. Returns {@code line} itself if there is no such pair.
   */
  @VisibleForTesting
  static GridLine cutGridLineJumps(GridLine line, double deltaCut) {
    double[] xs = line.xsArray();
    double[] ys = line.ysArray();
    int jumps = 0;
    for (int i = 0; i + 1 < xs.length; i++) {
      if (isJump(xs, ys, i, deltaCut)) {
        jumps++;
      }
    }
    if (jumps == 0) {
      return line;
    }
    double[] cutXs = new double[xs.length + jumps];
    double[] cutYs = new double[ys.length + jumps];
    int k = 0;
    for (int i = 0; i < xs.length; i++) {
      cutXs[k] = xs[i];
      cutYs[k] = ys[i];
      k++;
      if (i + 1 < xs.length && isJump(xs, ys, i, deltaCut)) {
        cutXs[k] = Double.NaN;
        cutYs[k] = Double.NaN;
        k++;
      }
    }
    return new GridLine(line.axis(), line.value(), cutXs, cutYs);
  }

  private static boolean isJump(double[] xs, double[] ys, int i, double deltaCut) {
    return Math.hypot(xs[i + 1] - xs[i], ys[i + 1] - ys[i]) > deltaCut;
  }

  /**
   * Returns {nLon, nLat}, the numbers of gridlines to ask for over {@code extent}. Unless fixed,
   * the latitude count is {@link #DEFAULT_N_GRID_LAT} and the longitude count grows with the width
   * of the region relative to its height, measured at its mean latitude, by a factor of 1/3 to 5/3.
   */
  @VisibleForTesting
  static int[] computeNumGridLines(
      LonLatWindow extent, @Nullable Integer nGridLon, @Nullable Integer nGridLat) {
    int nLat = nGridLat != null ? nGridLat : DEFAULT_N_GRID_LAT;
    int nLon;
    if (nGridLon != null) {
      nLon = nGridLon;
    } else {
      double latScale = Math.cos(Math.toRadians(extent.lat().getCenter()));
      double ratio =
          Math.abs(extent.lon().getLength()) * latScale / Math.abs(extent.lat().getLength());
      ratio = Double.isNaN(ratio) ? 1.0 : SkyMath.clamp(ratio, MIN_LON_RATIO, MAX_LON_RATIO);
      nLon = (int) Math.ceil(ratio * nLat);
    }
    return new int[] {nLon, nLat};
  }

  @Override
  public String toString() {
    return "SkyGridHelper(" + projection + ", wrap=" + options.wrap() + ")";
  }
}
