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

import com.google.common.collect.ImmutableList;
import com.google.pyrewrite.ast.IR;
import com.google.pyrewrite.ast.Node;
import com.google.pyrewrite.ast.Token;
import java.util.ArrayList;
import java.util.List;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class AstValidatorTest {

  private List<String> lastCheckViolationMessages;
  private AstValidator validator;

  @Before
  public void setUp() {
    lastCheckViolationMessages = new ArrayList<>();
    validator = new AstValidator((message, n) -> lastCheckViolationMessages.add(message));
  }

  private void expectValid(Node root) {
    validator.validateRoot(root);
    assertThat(lastCheckViolationMessages).isEmpty();
  }

  private void expectInvalid(Node root, String messageFragment) {
    validator.validateRoot(root);
    assertThat(lastCheckViolationMessages).isNotEmpty();
    assertThat(lastCheckViolationMessages.get(0)).contains(messageFragment);
  }

  @Test
  public void testValidModule() {
    expectValid(
        IR.module(
            IR.importNode(IR.alias("json")),
            IR.assign(IR.storeName("x"), IR.call(IR.qualifiedName("json.loads"), IR.name("s"))),
            IR.forNode(
                IR.storeName("i"),
                IR.call(IR.name("range"), IR.number(3)),
                ImmutableList.of(IR.exprResult(IR.call(IR.name("print"), IR.name("i")))))));
  }

  @Test
  public void testRootMustBeModule() {
    expectInvalid(IR.pass(), "Expected Module");
  }

  @Test
  public void testMissingField() {
    Node name = new Node(Token.NAME).setNode("ctx", IR.context(Token.LOAD));
    expectInvalid(IR.module(IR.exprResult(name)), "missing the required field 'id'");
  }

  @Test
  public void testAssignmentTargetMustBeStore() {
    Node assign =
        new Node(Token.ASSIGN)
            .setChildren("targets", ImmutableList.of(IR.name("x")))
            .setNode("value", IR.number(1));
    expectInvalid(IR.module(assign), "should be in Store context");
  }

  @Test
  public void testReadMustBeLoad() {
    expectInvalid(IR.module(IR.exprResult(IR.storeName("x"))), "should be in Load context");
  }

  @Test
  public void testTupleTargetElementsAreStores() {
    Node target = IR.tuple(Token.STORE, IR.storeName("a"), IR.storeName("b"));
    expectValid(IR.module(IR.assign(target, IR.name("pair"))));
  }

  @Test
  public void testTupleTargetWithLoadElement() {
    Node target = IR.tuple(Token.STORE, IR.storeName("a"), IR.name("b"));
    expectInvalid(IR.module(IR.assign(target, IR.name("pair"))), "should be in Store context");
  }

  @Test
  public void testConstantCannotBeAssigned() {
    Node assign =
        new Node(Token.ASSIGN)
            .setChildren("targets", ImmutableList.of(IR.number(1)))
            .setNode("value", IR.number(2));
    expectInvalid(IR.module(assign), "cannot be assigned to");
  }

  @Test
  public void testAttributeTargetIsValid() {
    Node target = IR.qualifiedName("self.x");
    target.setNode("ctx", IR.context(Token.STORE));
    expectValid(IR.module(IR.assign(target, IR.number(1))));
  }

  @Test
  public void testTryNeedsHandlerOrFinally() {
    Node tryNode = new Node(Token.TRY).setChildren("body", ImmutableList.of(IR.pass()));
    expectInvalid(IR.module(tryNode), "handler or a finally");
  }

  @Test
  public void testDictSizes() {
    Node dict =
        new Node(Token.DICT)
            .setChildren("keys", ImmutableList.of(IR.string("a")))
            .setChildren("values", ImmutableList.of());
    expectInvalid(IR.module(IR.exprResult(dict)), "one value per key");
  }

  @Test
  public void testCompareNeedsComparators() {
    Node compare =
        new Node(Token.COMPARE)
            .setNode("left", IR.name("a"))
            .setChildren("ops", ImmutableList.of(IR.operator(Token.LT)));
    expectInvalid(IR.module(IR.exprResult(compare)), "one comparator per operator");
  }

  @Test
  public void testBoolOpNeedsTwoValues() {
    Node boolOp =
        new Node(Token.BOOL_OP)
            .setNode("op", IR.operator(Token.AND))
            .setChildren("values", ImmutableList.of(IR.name("a")));
    expectInvalid(IR.module(IR.exprResult(boolOp)), "at least two values");
  }

  @Test
  public void testUnknownConversion() {
    Node value = IR.formattedValue(IR.name("e")).setValue("conversion", 120L);
    expectInvalid(IR.module(IR.exprResult(IR.joinedStr(value))), "Unknown conversion 120");
  }

  @Test
  public void testPositionValidation() {
    Node root = IR.module(IR.pass());
    validator.setPositionValidationEnabled(true).validateRoot(root);
    assertThat(lastCheckViolationMessages).containsExactly("Pass has no source position");

    lastCheckViolationMessages.clear();
    root.getChildren("body").get(0).setLinenoCharno(1, 0);
    validator.validateRoot(root);
    assertThat(lastCheckViolationMessages).isEmpty();
  }

  @Test
  public void testDefaultHandlerThrows() {
    Exception e =
        assertThrows(
            IllegalStateException.class,
            () -> new AstValidator().validateRoot(IR.module(IR.exprResult(IR.storeName("x")))));
    assertThat(e).hasMessageThat().contains("Reference node:");
  }
}
