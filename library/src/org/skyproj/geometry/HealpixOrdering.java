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

/** The two HEALPix pixel numbering schemes. */
public enum HealpixOrdering {
  /** Pixels numbered along iso-latitude rings, from the north pole to the south pole. */
  RING,
  /** Pixels numbered hierarchically within each of the 12 base pixels. Needs a power of 2 nside. */
  NESTED;

  /** Returns NESTED if {@code nest} is true, otherwise RING. */
  public static HealpixOrdering fromNest(boolean nest) {
    return nest ? NESTED : RING;
  }
}
