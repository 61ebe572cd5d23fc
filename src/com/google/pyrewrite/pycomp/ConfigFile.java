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

import com.google.gson.FieldNamingPolicy;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonParseException;
import com.google.gson.JsonPrimitive;
import com.google.pyrewrite.ast.IR;
import com.google.pyrewrite.ast.Node;
import com.google.pyrewrite.pycomp.serialization.JsonMappings;
import com.google.pyrewrite.pycomp.serialization.NodeCodec;
import com.google.pyrewrite.pycomp.serialization.ReconstructionException;
import java.io.Reader;
import java.util.EnumSet;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * A JSON file of {@link RewriteOptions}. Keys that are present override the options they are
 * applied to; a present list replaces the whole table. For example:
 *
 * <pre>{@code
 * {
 *   "unroll_factor": 8,
 *   "passes": ["migrate_calls", "unroll_loops"],
 *   "call_migrations": [
 *     {"source": "log_warning", "target": "logging.warning",
 *      "keyword": "timestamp", "wrapper_key": "extra"}
 *   ],
 *   "risky_calls": [
 *     {"callee": "json.loads", "exception": "json.JSONDecodeError", "fallback": null}
 *   ]
 * }
 * }</pre>
 *
 * A fallback is either a literal or the mapping form of an expression.
 */
final class ConfigFile {

  private static final Gson gson =
      new GsonBuilder()
          .setFieldNamingPolicy(FieldNamingPolicy.LOWER_CASE_WITH_UNDERSCORES)
          .create();

  // Populated by Gson.
  private @Nullable Integer unrollFactor;
  private @Nullable String rangeFunction;
  private @Nullable String diagnosticFunction;
  private @Nullable String handlerVariable;
  private @Nullable List<String> passes;
  private @Nullable List<MigrationSpec> callMigrations;
  private @Nullable List<RiskyCallSpec> riskyCalls;

  private static final class MigrationSpec {
    private @Nullable String source;
    private @Nullable String target;
    private @Nullable String keyword;
    private @Nullable String wrapperKey;
  }

  private static final class RiskyCallSpec {
    private @Nullable String callee;
    private @Nullable String exception;
    private @Nullable JsonElement fallback;
  }

  /**
   * Reads a config file and applies it to {@code options}.
   *
   * @throws InvalidOptionsException if the file is not a valid config
   */
  static void apply(Reader in, RewriteOptions options) {
    ConfigFile config;
    try {
      config = gson.fromJson(in, ConfigFile.class);
    } catch (JsonParseException e) {
      throw new InvalidOptionsException("Malformed config file: %s", e.getMessage());
    }
    if (config == null) {
      throw new InvalidOptionsException("The config file is empty");
    }
    config.applyTo(options);
  }

  private void applyTo(RewriteOptions options) {
    if (unrollFactor != null) {
      options.setUnrollFactor(unrollFactor);
    }
    if (rangeFunction != null) {
      options.setRangeFunctionName(rangeFunction);
    }
    if (diagnosticFunction != null) {
      options.setDiagnosticFunctionName(diagnosticFunction);
    }
    if (handlerVariable != null) {
      options.setHandlerVariableName(handlerVariable);
    }
    if (passes != null) {
      EnumSet<RewriteOptions.Pass> enabled = EnumSet.noneOf(RewriteOptions.Pass.class);
      for (String pass : passes) {
        enabled.add(RewriteOptions.Pass.fromFlagName(pass));
      }
      options.setEnabledPasses(enabled);
    }
    if (callMigrations != null) {
      options.clearCallMigrations();
      for (MigrationSpec spec : callMigrations) {
        options.addCallMigration(
            CallMigration.create(
                required(spec.source, "source"),
                required(spec.target, "target"),
                required(spec.keyword, "keyword"),
                required(spec.wrapperKey, "wrapper_key")));
      }
    }
    if (riskyCalls != null) {
      options.clearRiskyCalls();
      for (RiskyCallSpec spec : riskyCalls) {
        options.addRiskyCall(
            RiskyCall.create(
                required(spec.callee, "callee"),
                required(spec.exception, "exception"),
                fallback(spec.fallback)));
      }
    }
  }

  private static String required(@Nullable String value, String key) {
    if (value == null) {
      throw new InvalidOptionsException("Missing '%s' in config entry", key);
    }
    return value;
  }

  private static Node fallback(@Nullable JsonElement fallback) {
    if (fallback == null || fallback.isJsonNull()) {
      return IR.none();
    }
    if (fallback.isJsonPrimitive()) {
      JsonPrimitive primitive = fallback.getAsJsonPrimitive();
      if (primitive.isBoolean()) {
        return IR.constant(primitive.getAsBoolean());
      } else if (primitive.isString()) {
        return IR.string(primitive.getAsString());
      }
      String number = primitive.getAsString();
      try {
        return number.matches("-?\\d+")
            ? IR.number(Long.parseLong(number))
            : IR.constant(Double.parseDouble(number));
      } catch (NumberFormatException e) {
        throw new InvalidOptionsException("Bad fallback number %s", number);
      }
    }
    Node expression;
    try {
      expression = NodeCodec.decode(JsonMappings.fromJson(fallback.toString()));
    } catch (ReconstructionException | JsonParseException e) {
      throw new InvalidOptionsException("Bad fallback: %s", e.getMessage());
    }
    if (!expression.isExpression()) {
      throw new InvalidOptionsException("A fallback must be an expression, not %s", expression);
    }
    return expression;
  }
}
