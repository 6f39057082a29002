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
 * An unchecked exception wrapping a {@link SkyError}. Validation methods that accept a SkyError
 * parameter report problems there; the operations built on them throw SkyException instead, and
 * callers can distinguish failures by {@link #code()}.
 */
public class SkyException extends RuntimeException {

  private final SkyError error;

  /** Creates a new SkyException wrapping the given SkyError. */
  public SkyException(SkyError error) {
    this.error = error;
  }

  /** Convenience constructor creating the wrapped SkyError from a code and message. */
  public SkyException(SkyError.Code code, String text) {
    this(new SkyError(code, text));
  }

  /** Returns the code of the SkyError wrapped by this SkyException. */
  public SkyError.Code code() {
    return error.code();
  }

  @Override
  public String getMessage() {
    return error.text();
  }
}
