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

import java.util.logging.Logger;

/** Contains utility methods that isolate the library from the runtime it is hosted in. */
final class Platform {

  private Platform() {}

  /**
   * Returns the {@link Logger} for the class.
   *
   * @see Logger#getLogger(String)
   */
  static Logger getLoggerForClass(Class<?> clazz) {
    return Logger.getLogger(clazz.getCanonicalName());
  }

  /** Returns {@code String.format} with the arguments. */
  static String formatString(String format, Object... params) {
    return String.format(format, params);
  }

  /** @see Math#floorMod(int, int), applied to doubles: the result has the sign of {@code y}. */
  static double floorMod(double x, double y) {
    double r = x % y;
    if (r != 0 && ((r < 0) != (y < 0))) {
      r += y;
    }
    return r;
  }
}
