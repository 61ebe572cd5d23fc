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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;
import com.google.pyrewrite.ast.IR;
import com.google.pyrewrite.ast.Node;
import org.jspecify.annotations.Nullable;

/**
 * An entry of the {@link GuardInjectionPass} registry: a call that may fail at runtime, the
 * exception it fails with and the value a guarded assignment falls back to.
 */
@AutoValue
public abstract class RiskyCall {

  /**
   * @param calleeName the dotted name of the function, e.g. {@code json.loads}
   * @param exceptionName the dotted name of the exception to catch
   * @param fallback an expression used as a template; it is copied for every guard
   */
  public static RiskyCall create(String calleeName, String exceptionName, Node fallback) {
    checkArgument(fallback.isExpression(), "fallback must be an expression: %s", fallback);
    return new AutoValue_RiskyCall(calleeName, exceptionName, fallback.cloneTree());
  }

  /** Creates an entry whose fallback is a literal: None, a string, a number or a boolean. */
  public static RiskyCall withConstantFallback(
      String calleeName, String exceptionName, @Nullable Object fallback) {
    return create(calleeName, exceptionName, IR.constant(fallback));
  }

  public abstract String getCalleeName();

  public abstract String getExceptionName();

  abstract Node getFallbackTemplate();

  /** Returns a fresh copy of the fallback expression. */
  public Node newFallback() {
    return getFallbackTemplate().cloneTree();
  }
}
