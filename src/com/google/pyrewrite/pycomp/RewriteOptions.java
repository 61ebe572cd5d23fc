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

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Sets;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/** Options for {@link Rewriter}: which passes run and the tables that drive them. */
public class RewriteOptions {

  /** The rewrite passes, in the order {@link Rewriter} runs them. */
  public enum Pass {
    MIGRATE_CALLS("migrate_calls"),
    INJECT_GUARDS("inject_guards"),
    UNROLL_LOOPS("unroll_loops");

    private final String flagName;

    Pass(String flagName) {
      this.flagName = flagName;
    }

    public String getFlagName() {
      return flagName;
    }

    /** Looks up a pass by its flag name, e.g. {@code unroll_loops}. */
    public static Pass fromFlagName(String flagName) {
      for (Pass pass : values()) {
        if (pass.flagName.equals(flagName)) {
          return pass;
        }
      }
      throw new InvalidOptionsException("Unknown pass '%s'", flagName);
    }
  }

  static final int DEFAULT_UNROLL_FACTOR = 4;
  static final int MAX_UNROLL_FACTOR = 64;

  private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

  private final Set<Pass> enabledPasses = EnumSet.allOf(Pass.class);
  private final List<CallMigration> callMigrations = new ArrayList<>();
  private final Map<String, RiskyCall> riskyCalls = new LinkedHashMap<>();

  private int unrollFactor = DEFAULT_UNROLL_FACTOR;
  private String rangeFunctionName = "range";
  private String diagnosticFunctionName = "print";
  private String handlerVariableName = "e";

  /**
   * Returns options with the stock rules: {@code log_warning(msg, timestamp=ts)} migrates to
   * {@code logging.warning(msg, extra={'timestamp': ts})}, and {@code json.loads} and
   * {@code requests.get} are guarded with a None fallback.
   */
  public static RewriteOptions createDefault() {
    RewriteOptions options = new RewriteOptions();
    options.addCallMigration(
        CallMigration.create("log_warning", "logging.warning", "timestamp", "extra"));
    options.addRiskyCall(
        RiskyCall.withConstantFallback("json.loads", "json.JSONDecodeError", null));
    options.addRiskyCall(
        RiskyCall.withConstantFallback("requests.get", "requests.RequestException", null));
    return options;
  }

  public boolean isEnabled(Pass pass) {
    return enabledPasses.contains(pass);
  }

  /** Runs exactly the given passes. */
  public void setEnabledPasses(Set<Pass> passes) {
    enabledPasses.clear();
    enabledPasses.addAll(passes);
  }

  public void setPassEnabled(Pass pass, boolean enabled) {
    if (enabled) {
      enabledPasses.add(pass);
    } else {
      enabledPasses.remove(pass);
    }
  }

  public ImmutableList<CallMigration> getCallMigrations() {
    return ImmutableList.copyOf(callMigrations);
  }

  public void addCallMigration(CallMigration migration) {
    callMigrations.add(migration);
  }

  public void clearCallMigrations() {
    callMigrations.clear();
  }

  /** Returns the risky-call registry keyed by dotted callee name. */
  public ImmutableMap<String, RiskyCall> getRiskyCalls() {
    return ImmutableMap.copyOf(riskyCalls);
  }

  /** Registers a risky call, replacing any earlier entry for the same callee. */
  public void addRiskyCall(RiskyCall riskyCall) {
    riskyCalls.put(riskyCall.getCalleeName(), riskyCall);
  }

  public void clearRiskyCalls() {
    riskyCalls.clear();
  }

  public int getUnrollFactor() {
    return unrollFactor;
  }

  public void setUnrollFactor(int unrollFactor) {
    this.unrollFactor = unrollFactor;
  }

  public String getRangeFunctionName() {
    return rangeFunctionName;
  }

  public void setRangeFunctionName(String rangeFunctionName) {
    this.rangeFunctionName = rangeFunctionName;
  }

  public String getDiagnosticFunctionName() {
    return diagnosticFunctionName;
  }

  public void setDiagnosticFunctionName(String diagnosticFunctionName) {
    this.diagnosticFunctionName = diagnosticFunctionName;
  }

  public String getHandlerVariableName() {
    return handlerVariableName;
  }

  public void setHandlerVariableName(String handlerVariableName) {
    this.handlerVariableName = handlerVariableName;
  }

  /**
   * Checks that the options are usable.
   *
   * @throws InvalidOptionsException on the first problem found
   */
  public void validate() {
    if (unrollFactor < 1 || unrollFactor > MAX_UNROLL_FACTOR) {
      throw new InvalidOptionsException(
          "unroll factor must be between 1 and %s, was %s", MAX_UNROLL_FACTOR, unrollFactor);
    }
    checkIdentifier("range function name", rangeFunctionName);
    checkIdentifier("handler variable name", handlerVariableName);
    checkDottedName("diagnostic function name", diagnosticFunctionName);

    Set<String> sourceNames = Sets.newHashSet();
    for (CallMigration migration : callMigrations) {
      checkIdentifier("migration source name", migration.getSourceName());
      checkDottedName("migration target name", migration.getTargetName());
      checkIdentifier("migration keyword", migration.getKeyword());
      checkIdentifier("migration wrapper key", migration.getWrapperKey());
      if (!sourceNames.add(migration.getSourceName())) {
        throw new InvalidOptionsException(
            "more than one migration for '%s'", migration.getSourceName());
      }
    }
    for (RiskyCall riskyCall : riskyCalls.values()) {
      checkDottedName("risky call name", riskyCall.getCalleeName());
      checkDottedName("exception name", riskyCall.getExceptionName());
    }
  }

  private static void checkIdentifier(String what, String value) {
    if (value == null || !IDENTIFIER.matcher(value).matches()) {
      throw new InvalidOptionsException("%s must be an identifier, was '%s'", what, value);
    }
  }

  private static void checkDottedName(String what, String value) {
    if (value == null || value.isEmpty()) {
      throw new InvalidOptionsException("%s must not be empty", what);
    }
    for (String part : Splitter.on('.').split(value)) {
      if (!IDENTIFIER.matcher(part).matches()) {
        throw new InvalidOptionsException("%s must be a dotted name, was '%s'", what, value);
      }
    }
  }
}
