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

import com.google.common.base.Strings;
import jsinterop.annotations.JsType;

/** An error code and text string describing the first error encountered during validation. */
@JsType
public class SkyError {
  /** Numeric values for errors. */
  @JsType
  public enum Code {
    /** No problems detected. */
    NO_ERROR(0),

    ////////////////////////////////////////////////////////////////////
    // Generic errors:

    /** Unknown error. */
    UNKNOWN(1000),
    /** Invalid argument (other than a range error). */
    INVALID_ARGUMENT(1003),
    /** Object is not in the required state. */
    FAILED_PRECONDITION(1004),

    ////////////////////////////////////////////////////////////////////
    // Pixel input errors:

    /** No valid pixels were supplied where a non-empty set is required. */
    NO_VALID_PIXELS(100),
    /** A pixel id array that must be unique contains the same id more than once. */
    DUPLICATE_PIXELS(101),
    /** Paired arrays have different lengths. */
    LENGTH_MISMATCH(102);

    private final int code;

    Code(int code) {
      this.code = code;
    }

    public int code() {
      return code;
    }
  }

  private Code code;
  private String text;

  public SkyError() {
    clear();
  }

  public SkyError(Code code, String text) {
    this.code = code;
    this.text = text;
  }

  /** Sets the error code and text, formatting the text with the given arguments. */
  public void init(Code code, String format, Object... args) {
    this.code = code;
    this.text = Strings.lenientFormat(format, args);
  }

  /** Resets this error to {@link Code#NO_ERROR} with no text. */
  public void clear() {
    code = Code.NO_ERROR;
    text = "";
  }

  /** Returns true if no error has been recorded. */
  public boolean ok() {
    return code == Code.NO_ERROR;
  }

  public Code code() {
    return code;
  }

  public String text() {
    return text;
  }

  @Override
  public String toString() {
    return code + ": " + text;
  }
}
