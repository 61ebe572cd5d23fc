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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableSet;
import com.google.pyrewrite.ast.IR;
import com.google.pyrewrite.pycomp.RewriteOptions.Pass;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class RewriteOptionsTest {

  private static String validationError(RewriteOptions options) {
    return assertThrows(InvalidOptionsException.class, options::validate).getMessage();
  }

  @Test
  public void testDefaults() {
    RewriteOptions options = RewriteOptions.createDefault();
    options.validate();

    assertThat(options.getUnrollFactor()).isEqualTo(4);
    assertThat(options.getRangeFunctionName()).isEqualTo("range");
    assertThat(options.getDiagnosticFunctionName()).isEqualTo("print");
    assertThat(options.getHandlerVariableName()).isEqualTo("e");
    for (Pass pass : Pass.values()) {
      assertThat(options.isEnabled(pass)).isTrue();
    }
    assertThat(options.getCallMigrations())
        .containsExactly(
            CallMigration.create("log_warning", "logging.warning", "timestamp", "extra"));
    assertThat(options.getRiskyCalls().keySet())
        .containsExactly("json.loads", "requests.get")
        .inOrder();
    assertThat(options.getRiskyCalls().get("json.loads").getExceptionName())
        .isEqualTo("json.JSONDecodeError");
    assertThat(options.getRiskyCalls().get("json.loads").newFallback().isEquivalentTo(IR.none()))
        .isTrue();
  }

  @Test
  public void testEmptyOptionsHaveNoRules() {
    RewriteOptions options = new RewriteOptions();
    assertThat(options.getCallMigrations()).isEmpty();
    assertThat(options.getRiskyCalls()).isEmpty();
    options.validate();
  }

  @Test
  public void testPassSelection() {
    RewriteOptions options = new RewriteOptions();
    options.setEnabledPasses(ImmutableSet.of(Pass.UNROLL_LOOPS));
    assertThat(options.isEnabled(Pass.UNROLL_LOOPS)).isTrue();
    assertThat(options.isEnabled(Pass.MIGRATE_CALLS)).isFalse();

    options.setPassEnabled(Pass.INJECT_GUARDS, true);
    options.setPassEnabled(Pass.UNROLL_LOOPS, false);
    assertThat(options.isEnabled(Pass.INJECT_GUARDS)).isTrue();
    assertThat(options.isEnabled(Pass.UNROLL_LOOPS)).isFalse();
  }

  @Test
  public void testPassFlagNames() {
    assertThat(Pass.fromFlagName("unroll_loops")).isEqualTo(Pass.UNROLL_LOOPS);
    assertThat(Pass.MIGRATE_CALLS.getFlagName()).isEqualTo("migrate_calls");
    InvalidOptionsException e =
        assertThrows(InvalidOptionsException.class, () -> Pass.fromFlagName("inline"));
    assertThat(e).hasMessageThat().isEqualTo("Unknown pass 'inline'");
  }

  @Test
  public void testLaterRiskyCallReplacesEarlier() {
    RewriteOptions options = RewriteOptions.createDefault();
    options.addRiskyCall(RiskyCall.withConstantFallback("json.loads", "ValueError", "{}"));
    assertThat(options.getRiskyCalls()).hasSize(2);
    assertThat(options.getRiskyCalls().get("json.loads").getExceptionName())
        .isEqualTo("ValueError");
  }

  @Test
  public void testUnrollFactorRange() {
    RewriteOptions options = new RewriteOptions();
    options.setUnrollFactor(0);
    assertThat(validationError(options))
        .isEqualTo("unroll factor must be between 1 and 64, was 0");
    options.setUnrollFactor(65);
    assertThat(validationError(options))
        .isEqualTo("unroll factor must be between 1 and 64, was 65");
    options.setUnrollFactor(64);
    options.validate();
  }

  @Test
  public void testNamesMustBeIdentifiers() {
    RewriteOptions options = new RewriteOptions();
    options.setRangeFunctionName("my.range");
    assertThat(validationError(options))
        .isEqualTo("range function name must be an identifier, was 'my.range'");

    options = new RewriteOptions();
    options.setHandlerVariableName("");
    assertThat(validationError(options))
        .isEqualTo("handler variable name must be an identifier, was ''");
  }

  @Test
  public void testDottedNames() {
    RewriteOptions options = new RewriteOptions();
    options.setDiagnosticFunctionName("logger.error");
    options.validate();

    options.setDiagnosticFunctionName("");
    assertThat(validationError(options)).isEqualTo("diagnostic function name must not be empty");

    options.setDiagnosticFunctionName("logger..error");
    assertThat(validationError(options))
        .isEqualTo("diagnostic function name must be a dotted name, was 'logger..error'");

    options = new RewriteOptions();
    options.addRiskyCall(RiskyCall.withConstantFallback("json.loads", "json.", null));
    assertThat(validationError(options))
        .isEqualTo("exception name must be a dotted name, was 'json.'");
  }

  @Test
  public void testMigrationRules() {
    RewriteOptions options = new RewriteOptions();
    options.addCallMigration(CallMigration.create("log", "logging.info", "when", "extra"));
    options.validate();

    options.addCallMigration(CallMigration.create("log", "logging.debug", "when", "extra"));
    assertThat(validationError(options)).isEqualTo("more than one migration for 'log'");

    options.clearCallMigrations();
    options.addCallMigration(CallMigration.create("log", "logging.info", "when", "extra-key"));
    assertThat(validationError(options))
        .isEqualTo("migration wrapper key must be an identifier, was 'extra-key'");
  }
}
