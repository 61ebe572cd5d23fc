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

package com.google.pyrewrite.pycomp;

import com.google.auto.value.AutoValue;
import com.google.errorprone.annotations.Immutable;

/**
 * A rule for {@link CallMigrationPass}: calls to the bare name {@link #getSourceName()} become
 * calls to {@link #getTargetName()}, and the keyword argument {@link #getKeyword()} is moved into
 * a one-entry dict passed as the keyword {@link #getWrapperKey()}.
 *
 * <p>For example {@code log_warning(msg, timestamp=ts)} migrates to {@code logging.warning(msg,
 * extra={'timestamp': ts})} with source {@code log_warning}, target {@code logging.warning},
 * keyword {@code timestamp} and wrapper key {@code extra}.
 */
@AutoValue
@Immutable
public abstract class CallMigration {

  public static CallMigration create(
      String sourceName, String targetName, String keyword, String wrapperKey) {
    return new AutoValue_CallMigration(sourceName, targetName, keyword, wrapperKey);
  }

  /** Returns the bare name of the deprecated function. */
  public abstract String getSourceName();

  /** Returns the dotted name of the replacement function. */
  public abstract String getTargetName();

  /** Returns the keyword argument that is carried over. */
  public abstract String getKeyword();

  /** Returns the keyword under which the carried-over argument is wrapped. */
  public abstract String getWrapperKey();
}
