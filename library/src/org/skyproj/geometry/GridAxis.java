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

import jsinterop.annotations.JsType;

/** Selects the gridlines of constant longitude, constant latitude, or both. */
@JsType
public enum GridAxis {
  LON,
  LAT,
  BOTH;

  /** Returns true if this selector includes the lines of {@code axis}. */
  public boolean includes(GridAxis axis) {
    return this == BOTH || this == axis;
  }
}
