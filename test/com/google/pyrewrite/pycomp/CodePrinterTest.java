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
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class CodePrinterTest {

  private static void assertPrintExpr(Node expr, String expected) {
    assertThat(CodePrinter.print(IR.module(IR.exprResult(expr)))).isEqualTo(expected + "\n");
  }

  private static void assertPrint(Node stmt, String expected) {
    assertThat(CodePrinter.print(IR.module(stmt))).isEqualTo(expected);
  }

  @Test
  public void testEmptyModule() {
    assertThat(CodePrinter.print(IR.module())).isEmpty();
  }

  @Test
  public void testConstants() {
    assertPrintExpr(IR.none(), "None");
    assertPrintExpr(IR.constant(true), "True");
    assertPrintExpr(IR.constant(false), "False");
    assertPrintExpr(IR.number(42), "42");
    assertPrintExpr(IR.constant(2.5), "2.5");
    assertPrintExpr(IR.constant(1.0), "1.0");
  }

  @Test
  public void testStringRepr() {
    assertPrintExpr(IR.string("hi"), "'hi'");
    assertPrintExpr(IR.string("it's"), "\"it's\"");
    assertPrintExpr(IR.string("a'b\"c"), "'a\\'b\"c'");
    assertPrintExpr(IR.string("line\nbreak\\"), "'line\\nbreak\\\\'");
    assertPrintExpr(IR.string("\u0001"), "'\\x01'");
  }

  @Test
  public void testArithmeticPrecedence() {
    Node sum = IR.binOp(IR.name("a"), Token.ADD, IR.name("b"));
    assertPrintExpr(IR.binOp(sum, Token.MULT, IR.name("c")), "(a + b) * c");
    assertPrintExpr(
        IR.binOp(IR.name("c"), Token.MULT, IR.binOp(IR.name("a"), Token.MULT, IR.name("b"))),
        "c * (a * b)");
    assertPrintExpr(
        IR.binOp(IR.binOp(IR.name("a"), Token.SUB, IR.name("b")), Token.SUB, IR.name("c")),
        "a - b - c");
    assertPrintExpr(
        IR.binOp(IR.name("a"), Token.SUB, IR.binOp(IR.name("b"), Token.SUB, IR.name("c"))),
        "a - (b - c)");
  }

  @Test
  public void testPowerGroupsRight() {
    Node inner = IR.binOp(IR.name("b"), Token.POW, IR.name("c"));
    assertPrintExpr(IR.binOp(IR.name("a"), Token.POW, inner), "a ** b ** c");
    Node left = IR.binOp(IR.name("a"), Token.POW, IR.name("b"));
    assertPrintExpr(IR.binOp(left, Token.POW, IR.name("c")), "(a ** b) ** c");
    assertPrintExpr(
        IR.binOp(IR.unaryOp(Token.USUB, IR.name("x")), Token.POW, IR.number(2)), "(-x) ** 2");
  }

  @Test
  public void testUnaryOperators() {
    assertPrintExpr(IR.unaryOp(Token.NOT, IR.name("x")), "not x");
    assertPrintExpr(
        IR.unaryOp(Token.USUB, IR.binOp(IR.name("a"), Token.ADD, IR.name("b"))), "-(a + b)");
    assertPrintExpr(IR.binOp(IR.name("a"), Token.MULT, IR.number(-1)), "a * -1");
  }

  @Test
  public void testBooleanAndComparison() {
    Node or = IR.boolOp(Token.OR, IR.name("a"), IR.name("b"));
    assertPrintExpr(IR.boolOp(Token.AND, or, IR.name("c")), "(a or b) and c");
    assertPrintExpr(
        IR.compare(IR.name("x"), Token.NOT_IN, IR.list(IR.number(1), IR.number(2))),
        "x not in [1, 2]");
    assertPrintExpr(
        IR.unaryOp(Token.NOT, IR.compare(IR.name("a"), Token.EQ, IR.name("b"))), "not a == b");
  }

  @Test
  public void testCallsAndAttributes() {
    Node call =
        IR.call(
            IR.qualifiedName("logging.warning"),
            ImmutableList.of(IR.string("msg")),
            ImmutableList.of(
                IR.keyword(
                    "extra",
                    IR.dict(
                        ImmutableList.of(IR.string("timestamp")),
                        ImmutableList.of(IR.name("ts"))))));
    assertPrintExpr(call, "logging.warning('msg', extra={'timestamp': ts})");
    assertPrintExpr(IR.attribute(IR.number(1), "real"), "(1).real");
    assertPrintExpr(
        IR.call(
            IR.name("f"), ImmutableList.of(), ImmutableList.of(IR.keyword(null, IR.name("kw")))),
        "f(**kw)");
  }

  @Test
  public void testTuplesAndSubscripts() {
    assertPrintExpr(IR.tuple(Token.LOAD, IR.name("a")), "(a,)");
    assertPrintExpr(IR.tuple(Token.LOAD), "()");
    assertPrintExpr(IR.subscript(IR.name("xs"), IR.number(0)), "xs[0]");
  }

  @Test
  public void testFString() {
    Node message =
        IR.joinedStr(IR.string("Error in {json}: "), IR.formattedValue(IR.name("e")));
    assertPrintExpr(IR.call(IR.name("print"), message), "print(f\"Error in {{json}}: {e}\")");
    Node repr = IR.formattedValue(IR.name("x")).setValue("conversion", (long) 'r');
    assertPrintExpr(IR.joinedStr(repr), "f\"{x!r}\"");
  }

  @Test
  public void testAssignments() {
    assertPrint(IR.assign(IR.storeName("x"), IR.number(1)), "x = 1\n");
    assertPrint(IR.augAssign(IR.storeName("x"), Token.ADD, IR.number(1)), "x += 1\n");
    assertPrint(
        IR.assign(
            IR.tuple(Token.STORE, IR.storeName("a"), IR.storeName("b")),
            IR.tuple(Token.LOAD, IR.name("b"), IR.name("a"))),
        "(a, b) = (b, a)\n");
  }

  @Test
  public void testFunctionDef() {
    Node args = IR.arguments(IR.arg("a"), IR.arg("b"));
    args.setChildren("defaults", ImmutableList.of(IR.number(2)));
    args.setNode("vararg", IR.arg("rest"));
    Node function =
        IR.functionDef("f", args, ImmutableList.of(IR.returnNode(IR.name("a"))));
    function.setChildren("decorator_list", ImmutableList.of(IR.name("cached")));
    assertPrint(function, "@cached\ndef f(a, b=2, *rest):\n    return a\n");
  }

  @Test
  public void testPrintSignature() {
    Node timeout = IR.arg("timeout");
    timeout.setNode("annotation", IR.name("float"));
    Node args = IR.arguments(IR.arg("url"), timeout);
    args.setChildren("defaults", ImmutableList.of(IR.constant(1.5)));
    args.setNode("kwarg", IR.arg("options"));
    Node function = IR.functionDef("fetch", args, ImmutableList.of(IR.pass()));
    function.setChildren("decorator_list", ImmutableList.of(IR.name("cached")));
    function.setNode("returns", IR.qualifiedName("http.Response"));
    assertThat(CodePrinter.printSignature(function))
        .isEqualTo("def fetch(url, timeout: float=1.5, **options) -> http.Response");

    assertThrows(IllegalArgumentException.class, () -> CodePrinter.printSignature(IR.pass()));
  }

  @Test
  public void testIfElifElse() {
    Node inner =
        IR.ifNode(
            IR.name("b"),
            ImmutableList.of(IR.exprResult(IR.number(2))),
            ImmutableList.of(IR.exprResult(IR.number(3))));
    Node outer =
        IR.ifNode(
            IR.name("a"),
            ImmutableList.of(IR.exprResult(IR.number(1))),
            ImmutableList.of(inner));
    assertPrint(outer, "if a:\n    1\nelif b:\n    2\nelse:\n    3\n");
  }

  @Test
  public void testForElse() {
    Node loop =
        IR.forNode(
            IR.storeName("i"),
            IR.call(IR.name("range"), IR.number(3)),
            ImmutableList.of(IR.exprResult(IR.call(IR.name("print"), IR.name("i")))),
            ImmutableList.of(IR.pass()));
    assertPrint(loop, "for i in range(3):\n    print(i)\nelse:\n    pass\n");
  }

  @Test
  public void testEmptyBlockPrintsPass() {
    Node function = IR.functionDef("f", IR.arguments(), ImmutableList.of(IR.pass()));
    function.setChildren("body", ImmutableList.of());
    assertPrint(function, "def f():\n    pass\n");
  }

  @Test
  public void testTry() {
    Node handler =
        IR.exceptHandler(
            IR.qualifiedName("json.JSONDecodeError"),
            "e",
            ImmutableList.of(IR.assign(IR.storeName("x"), IR.none())));
    Node tryNode =
        IR.tryNode(
            ImmutableList.of(
                IR.assign(
                    IR.storeName("x"), IR.call(IR.qualifiedName("json.loads"), IR.name("s")))),
            ImmutableList.of(handler));
    tryNode.setChildren("finalbody", ImmutableList.of(IR.exprResult(IR.name("done"))));
    assertPrint(
        tryNode,
        "try:\n"
            + "    x = json.loads(s)\n"
            + "except json.JSONDecodeError as e:\n"
            + "    x = None\n"
            + "finally:\n"
            + "    done\n");
  }

  @Test
  public void testImports() {
    Node alias = IR.alias("numpy").setValue("asname", "np");
    assertPrint(IR.importNode(IR.alias("json"), alias), "import json, numpy as np\n");
    Node importFrom =
        new Node(Token.IMPORT_FROM)
            .setValue("module", "pkg")
            .setChildren("names", ImmutableList.of(IR.alias("mod")))
            .setValue("level", 1L);
    assertPrint(importFrom, "from .pkg import mod\n");
  }

  @Test
  public void testNestedIndentation() {
    Node loop =
        IR.whileNode(
            IR.constant(true),
            ImmutableList.of(IR.ifNode(IR.name("done"), ImmutableList.of(IR.breakNode()))));
    assertThat(new CodePrinter.Builder(IR.module(loop)).setIndentWidth(2).build())
        .isEqualTo("while True:\n  if done:\n    break\n");
  }

  @Test
  public void testRejectsInvalidTree() {
    assertThrows(
        IllegalStateException.class,
        () -> CodePrinter.print(IR.module(IR.exprResult(IR.storeName("x")))));
  }
}
