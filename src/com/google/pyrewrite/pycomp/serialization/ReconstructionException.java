/*
 * Copyright 2026 The Closure Compiler Authors.
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

package com.google.pyrewrite.pycomp.serialization;

import com.google.errorprone.annotations.FormatMethod;

/**
 * Thrown when a mapping cannot be decoded into a tree. The message names the path to the
 * offending value, e.g. {@code $.body[0].value}.
 */
public final class ReconstructionException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final String path;

  @FormatMethod
  ReconstructionException(String path, String message, Object... args) {
    super(path + ": " + String.format(message, args));
    this.path = path;
  }

  /** Returns the path to the value that could not be decoded. */
  public String getPath() {
    return path;
  }
}
