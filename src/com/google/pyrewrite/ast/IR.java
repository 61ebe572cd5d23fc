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

package com.google.pyrewrite.ast;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/** An AST construction helper class. */
public class IR {

  private IR() {}

  public static Node module(Node... stmts) {
    return module(ImmutableList.copyOf(stmts));
  }

  public static Node module(List<Node> stmts) {
    for (Node stmt : stmts) {
      checkState(stmt.isStatement(), "Module cannot contain %s", stmt.getToken());
    }
    return new Node(Token.MODULE).setChildren("body", stmts);
  }

  // ==========================================================================
  // Statements

  public static Node functionDef(String name, Node args, List<Node> body) {
    checkState(args.getToken() == Token.ARGUMENTS, args);
    checkArgument(!body.isEmpty(), "function body cannot be empty");
    return new Node(Token.FUNCTION_DEF)
        .setValue("name", name)
        .setNode("args", args)
        .setChildren("body", body);
  }

  public static Node arguments(Node... args) {
    return new Node(Token.ARGUMENTS).setChildren("args", ImmutableList.copyOf(args));
  }

  public static Node arg(String name) {
    return new Node(Token.ARG).setValue("arg", name);
  }

  public static Node returnNode() {
    return new Node(Token.RETURN);
  }

  public static Node returnNode(Node value) {
    checkState(value.isExpression(), value);
    return new Node(Token.RETURN).setNode("value", value);
  }

  /** Builds {@code target = value}. The target must already be in store context. */
  public static Node assign(Node target, Node value) {
    checkState(target.isStore(), "assignment target must be in store context: %s", target);
    checkState(value.isExpression(), value);
    return new Node(Token.ASSIGN)
        .setChildren("targets", ImmutableList.of(target))
        .setNode("value", value);
  }

  public static Node augAssign(Node target, Token op, Node value) {
    checkState(target.isStore(), "assignment target must be in store context: %s", target);
    return new Node(Token.AUG_ASSIGN)
        .setNode("target", target)
        .setNode("op", operator(op))
        .setNode("value", value);
  }

  public static Node forNode(Node target, Node iter, List<Node> body) {
    return forNode(target, iter, body, ImmutableList.of());
  }

  public static Node forNode(Node target, Node iter, List<Node> body, List<Node> orelse) {
    checkState(target.isStore(), "loop target must be in store context: %s", target);
    checkState(iter.isExpression(), iter);
    checkArgument(!body.isEmpty(), "loop body cannot be empty");
    return new Node(Token.FOR)
        .setNode("target", target)
        .setNode("iter", iter)
        .setChildren("body", body)
        .setChildren("orelse", orelse);
  }

  public static Node whileNode(Node test, List<Node> body) {
    checkArgument(!body.isEmpty(), "loop body cannot be empty");
    return new Node(Token.WHILE).setNode("test", test).setChildren("body", body);
  }

  public static Node ifNode(Node test, List<Node> body) {
    return ifNode(test, body, ImmutableList.of());
  }

  public static Node ifNode(Node test, List<Node> body, List<Node> orelse) {
    checkArgument(!body.isEmpty(), "if body cannot be empty");
    return new Node(Token.IF)
        .setNode("test", test)
        .setChildren("body", body)
        .setChildren("orelse", orelse);
  }

  public static Node tryNode(List<Node> body, List<Node> handlers) {
    checkArgument(!body.isEmpty(), "try body cannot be empty");
    checkArgument(!handlers.isEmpty(), "try needs at least one handler");
    return new Node(Token.TRY).setChildren("body", body).setChildren("handlers", handlers);
  }

  public static Node exceptHandler(@Nullable Node type, @Nullable String name, List<Node> body) {
    checkArgument(!body.isEmpty(), "handler body cannot be empty");
    return new Node(Token.EXCEPT_HANDLER)
        .setNode("type", type)
        .setValue("name", name)
        .setChildren("body", body);
  }

  public static Node importNode(Node... names) {
    return new Node(Token.IMPORT).setChildren("names", ImmutableList.copyOf(names));
  }

  public static Node alias(String name) {
    return new Node(Token.ALIAS).setValue("name", name);
  }

  public static Node exprResult(Node value) {
    checkState(value.isExpression(), value);
    return new Node(Token.EXPR).setNode("value", value);
  }

  public static Node pass() {
    return new Node(Token.PASS);
  }

  public static Node breakNode() {
    return new Node(Token.BREAK);
  }

  public static Node continueNode() {
    return new Node(Token.CONTINUE);
  }

  // ==========================================================================
  // Expressions

  public static Node name(String id) {
    return name(id, Token.LOAD);
  }

  public static Node name(String id, Token ctx) {
    return new Node(Token.NAME).setValue("id", id).setNode("ctx", context(ctx));
  }

  public static Node storeName(String id) {
    return name(id, Token.STORE);
  }

  public static Node attribute(Node value, String attr) {
    return new Node(Token.ATTRIBUTE)
        .setNode("value", value)
        .setValue("attr", attr)
        .setNode("ctx", context(Token.LOAD));
  }

  /**
   * Builds a load of a dotted name: {@code "a"} becomes a {@link Token#NAME}, {@code "a.b.c"} an
   * {@link Token#ATTRIBUTE} chain.
   */
  public static Node qualifiedName(String dottedName) {
    List<String> parts = Splitter.on('.').splitToList(dottedName);
    for (String part : parts) {
      checkArgument(!part.isEmpty(), "malformed qualified name '%s'", dottedName);
    }
    Node result = name(parts.get(0));
    for (String part : parts.subList(1, parts.size())) {
      result = attribute(result, part);
    }
    return result;
  }

  public static Node constant(@Nullable Object value) {
    return new Node(Token.CONSTANT).setValue("value", value);
  }

  public static Node number(long value) {
    return constant(value);
  }

  public static Node string(String value) {
    return constant(value);
  }

  public static Node none() {
    return constant(null);
  }

  public static Node call(Node func, Node... args) {
    return call(func, ImmutableList.copyOf(args), ImmutableList.of());
  }

  public static Node call(Node func, List<Node> args, List<Node> keywords) {
    checkState(func.isExpression(), func);
    return new Node(Token.CALL)
        .setNode("func", func)
        .setChildren("args", args)
        .setChildren("keywords", keywords);
  }

  public static Node keyword(@Nullable String arg, Node value) {
    checkState(value.isExpression(), value);
    return new Node(Token.KEYWORD).setValue("arg", arg).setNode("value", value);
  }

  public static Node dict(List<Node> keys, List<Node> values) {
    checkArgument(keys.size() == values.size(), "dict needs one value per key");
    return new Node(Token.DICT).setChildren("keys", keys).setChildren("values", values);
  }

  public static Node binOp(Node left, Token op, Node right) {
    return new Node(Token.BIN_OP)
        .setNode("left", left)
        .setNode("op", operator(op))
        .setNode("right", right);
  }

  public static Node unaryOp(Token op, Node operand) {
    return new Node(Token.UNARY_OP).setNode("op", operator(op)).setNode("operand", operand);
  }

  public static Node compare(Node left, Token op, Node right) {
    return new Node(Token.COMPARE)
        .setNode("left", left)
        .setChildren("ops", ImmutableList.of(operator(op)))
        .setChildren("comparators", ImmutableList.of(right));
  }

  public static Node boolOp(Token op, Node... values) {
    checkArgument(values.length >= 2, "a boolean operation needs at least two operands");
    return new Node(Token.BOOL_OP)
        .setNode("op", operator(op))
        .setChildren("values", ImmutableList.copyOf(values));
  }

  public static Node joinedStr(Node... values) {
    return new Node(Token.JOINED_STR).setChildren("values", ImmutableList.copyOf(values));
  }

  /** Builds an f-string replacement field without conversion or format spec. */
  public static Node formattedValue(Node value) {
    return new Node(Token.FORMATTED_VALUE).setNode("value", value).setValue("conversion", -1L);
  }

  public static Node list(Node... elts) {
    return new Node(Token.LIST)
        .setChildren("elts", ImmutableList.copyOf(elts))
        .setNode("ctx", context(Token.LOAD));
  }

  public static Node tuple(Token ctx, Node... elts) {
    return new Node(Token.TUPLE)
        .setChildren("elts", ImmutableList.copyOf(elts))
        .setNode("ctx", context(ctx));
  }

  public static Node subscript(Node value, Node slice) {
    return new Node(Token.SUBSCRIPT)
        .setNode("value", value)
        .setNode("slice", slice)
        .setNode("ctx", context(Token.LOAD));
  }

  // ==========================================================================
  // Contexts and operators

  public static Node context(Token ctx) {
    checkArgument(ctx.getCategory() == Token.Category.EXPR_CONTEXT, "%s is not a context", ctx);
    return new Node(ctx);
  }

  public static Node operator(Token op) {
    switch (op.getCategory()) {
      case OPERATOR:
      case BOOL_OPERATOR:
      case UNARY_OPERATOR:
      case COMPARE_OPERATOR:
        return new Node(op);
      default:
        throw new IllegalArgumentException(op + " is not an operator");
    }
  }
}
