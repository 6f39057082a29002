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

/**
 * A regular (longitude, latitude) raster produced by {@link HealpixRasterizer}.
 *
 * <p>The raster is described by a mesh of {@link #meshWidth()} longitude nodes by {@link
 * #meshHeight()} latitude nodes. Values live in the cells between adjacent nodes, so there are
 * {@code meshHeight() - 1} rows and {@code meshWidth() - 1} columns of values; edge-aligned
 * renderers draw the cells from the node positions. Each cell has a mask flag, true where the
 * source had no data for that cell.
 */
public final class RasterGrid {
  private final double[] lonEdges;
  private final double[] latEdges;
  private final double[] values;
  private final boolean[] mask;
  private final ValueType valueType;

  RasterGrid(
      double[] lonEdges, double[] latEdges, double[] values, boolean[] mask, ValueType valueType) {
    int cells = Math.max(0, lonEdges.length - 1) * Math.max(0, latEdges.length - 1);
    Preconditions.checkArgument(values.length == cells && mask.length == cells);
    this.lonEdges = lonEdges;
    this.latEdges = latEdges;
    this.values = values;
    this.mask = mask;
    this.valueType = valueType;
  }

  /** Returns the number of longitude nodes of the mesh. */
  public int meshWidth() {
    return lonEdges.length;
  }

  /** Returns the number of latitude nodes of the mesh. */
  public int meshHeight() {
    return latEdges.length;
  }

  /** Returns the number of value columns, one fewer than the mesh width. */
  public int cols() {
    return Math.max(0, lonEdges.length - 1);
  }

  /** Returns the number of value rows, one fewer than the mesh height. */
  public int rows() {
    return Math.max(0, latEdges.length - 1);
  }

  /** Returns the longitude of mesh node {@code i}. */
  public double lonEdge(int i) {
    return lonEdges[i];
  }

  /** Returns the latitude of mesh node {@code j}. */
  public double latEdge(int j) {
    return latEdges[j];
  }

  /** Returns a copy of the longitude mesh nodes. */
  public double[] lonEdges() {
    return lonEdges.clone();
  }

  /** Returns a copy of the latitude mesh nodes. */
  public double[] latEdges() {
    return latEdges.clone();
  }

  /** Returns the longitude at the center of column {@code col}. */
  public double lonCenter(int col) {
    return 0.5 * (lonEdges[col] + lonEdges[col + 1]);
  }

  /** Returns the latitude at the center of row {@code row}. */
  public double latCenter(int row) {
    return 0.5 * (latEdges[row] + latEdges[row + 1]);
  }

  /** Returns the value of the given cell. Masked cells hold an arbitrary value. */
  public double value(int row, int col) {
    return values[index(row, col)];
  }

  /** Returns true if the given cell has no data. */
  public boolean isMasked(int row, int col) {
    return mask[index(row, col)];
  }

  /** Returns the number of masked cells. */
  public int numMasked() {
    int n = 0;
    for (boolean m : mask) {
      if (m) {
        n++;
      }
    }
    return n;
  }

  /** Returns the type of the values. Booleans have already been promoted to UINT8. */
  public ValueType valueType() {
    return valueType;
  }

  private int index(int row, int col) {
    Preconditions.checkElementIndex(row, rows(), "row");
    Preconditions.checkElementIndex(col, cols(), "col");
    return row * cols() + col;
  }

  @Override
  public String toString() {
    return Platform.formatString(
        "RasterGrid(%d x %d cells, lon [%s, %s], lat [%s, %s], %s, %d masked)",
        rows(),
        cols(),
        lonEdges.length > 0 ? lonEdges[0] : Double.NaN,
        lonEdges.length > 0 ? lonEdges[lonEdges.length - 1] : Double.NaN,
        latEdges.length > 0 ? latEdges[0] : Double.NaN,
        latEdges.length > 0 ? latEdges[latEdges.length - 1] : Double.NaN,
        valueType,
        numMasked());
  }
}
