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
 * The logical type of the values held by a pixel source or raster. Values are always stored as
 * doubles; the type tells consumers how to interpret them.
 */
public enum ValueType {
  FLOAT64,
  INT32,
  UINT8,
  /** Values are 0 (false) or 1 (true). Never exposed by a raster, see {@link #promoted()}. */
  BOOLEAN;

  /**
   * Returns the type that rasters expose for values of this type. Display layers do not handle
   * booleans, so BOOLEAN is promoted to UINT8; every other type is returned unchanged.
   */
  public ValueType promoted() {
    return this == BOOLEAN ? UINT8 : this;
  }
}
