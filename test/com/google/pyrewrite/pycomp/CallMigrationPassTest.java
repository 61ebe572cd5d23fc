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

import com.google.common.collect.ImmutableList;
import com.google.pyrewrite.ast.IR;
import com.google.pyrewrite.ast.Node;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class CallMigrationPassTest {

  private CallMigrationPass pass;

  @Before
  public void setUp() {
    pass =
        new CallMigrationPass(
            ImmutableList.of(
                CallMigration.create("log_warning", "logging.warning", "timestamp", "extra")));
  }

  private String migrate(Node call) {
    Node module = IR.module(IR.exprResult(call));
    pass.process(module);
    return CodePrinter.print(module);
  }

  private static Node logWarning(Node... args) {
    return IR.call(IR.name("log_warning"), args);
  }

  @Test
  public void testMigratesMessage() {
    assertThat(migrate(logWarning(IR.string("msg")))).isEqualTo("logging.warning('msg')\n");
    assertThat(pass.getMigratedCalls()).isEqualTo(1);
  }

  @Test
  public void testWrapsKeywordInDict() {
    Node call =
        IR.call(
            IR.name("log_warning"),
            ImmutableList.of(IR.string("msg")),
            ImmutableList.of(IR.keyword("timestamp", IR.name("ts"))));
    assertThat(migrate(call)).isEqualTo("logging.warning('msg', extra={'timestamp': ts})\n");
  }

  @Test
  public void testDropsOtherArguments() {
    Node call =
        IR.call(
            IR.name("log_warning"),
            ImmutableList.of(IR.string("msg"), IR.name("extra_arg")),
            ImmutableList.of(
                IR.keyword("level", IR.number(3)), IR.keyword("timestamp", IR.name("ts"))));
    assertThat(migrate(call)).isEqualTo("logging.warning('msg', extra={'timestamp': ts})\n");
  }

  @Test
  public void testCallWithoutArguments() {
    assertThat(migrate(logWarning())).isEqualTo("logging.warning()\n");
  }

  @Test
  public void testUnrelatedCallsUntouched() {
    assertThat(migrate(IR.call(IR.name("log_error"), IR.string("msg"))))
        .isEqualTo("log_error('msg')\n");
    assertThat(migrate(IR.call(IR.qualifiedName("util.log_warning"), IR.string("msg"))))
        .isEqualTo("util.log_warning('msg')\n");
    assertThat(pass.getMigratedCalls()).isEqualTo(0);
  }

  @Test
  public void testReferenceWithoutCallUntouched() {
    assertThat(migrate(IR.call(IR.name("register"), IR.name("log_warning"))))
        .isEqualTo("register(log_warning)\n");
  }

  @Test
  public void testNestedCallsMigrate() {
    assertThat(migrate(logWarning(logWarning(IR.string("inner")))))
        .isEqualTo("logging.warning(logging.warning('inner'))\n");
    assertThat(pass.getMigratedCalls()).isEqualTo(2);
  }

  @Test
  public void testMigratesInsideNestedStatements() {
    Node function =
        IR.functionDef(
            "f",
            IR.arguments(),
            ImmutableList.of(IR.assign(IR.storeName("x"), logWarning(IR.string("msg")))));
    Node module = IR.module(function);
    pass.process(module);
    assertThat(CodePrinter.print(module))
        .isEqualTo("def f():\n    x = logging.warning('msg')\n");
  }

  @Test
  public void testReplacementTakesCallPosition() {
    Node message = IR.string("msg").setLinenoCharno(3, 16);
    Node call = logWarning(message).setLinenoCharno(3, 4);
    Node module = IR.module(IR.exprResult(call));
    pass.process(module);

    Node migrated = module.getChildren("body").get(0).getNode("value");
    assertThat(migrated.getLineno()).isEqualTo(3);
    assertThat(migrated.getCharno()).isEqualTo(4);
    assertThat(migrated.getNode("func").getLineno()).isEqualTo(3);
    assertThat(migrated.getChildren("args").get(0).getCharno()).isEqualTo(16);
  }

  @Test
  public void testCountResetsBetweenRuns() {
    migrate(logWarning(IR.string("a")));
    migrate(IR.call(IR.name("other")));
    assertThat(pass.getMigratedCalls()).isEqualTo(0);
  }
}
