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

import static com.google.pyrewrite.ast.FieldSpec.constant;
import static com.google.pyrewrite.ast.FieldSpec.ctx;
import static com.google.pyrewrite.ast.FieldSpec.expr;
import static com.google.pyrewrite.ast.FieldSpec.exprs;
import static com.google.pyrewrite.ast.FieldSpec.identifier;
import static com.google.pyrewrite.ast.FieldSpec.integer;
import static com.google.pyrewrite.ast.FieldSpec.list;
import static com.google.pyrewrite.ast.FieldSpec.node;
import static com.google.pyrewrite.ast.FieldSpec.optionalExpr;
import static com.google.pyrewrite.ast.FieldSpec.optionalIdentifier;
import static com.google.pyrewrite.ast.FieldSpec.optionalNode;
import static com.google.pyrewrite.ast.FieldSpec.stmts;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.jspecify.annotations.Nullable;

/**
 * The kinds of nodes in a Python syntax tree, each with the exact set of fields a node of that kind
 * carries. The schema is the single source of truth for validation, traversal order and
 * reconstruction from the mapping form.
 */
public enum Token {
  MODULE(Category.MODULE, "Module", stmts("body")),

  // Statements
  FUNCTION_DEF(
      Category.STATEMENT,
      "FunctionDef",
      identifier("name"),
      node("args", Category.ARGUMENTS),
      stmts("body"),
      exprs("decorator_list"),
      optionalExpr("returns")),
  CLASS_DEF(
      Category.STATEMENT,
      "ClassDef",
      identifier("name"),
      exprs("bases"),
      list("keywords", Category.KEYWORD),
      stmts("body"),
      exprs("decorator_list")),
  RETURN(Category.STATEMENT, "Return", optionalExpr("value")),
  ASSIGN(Category.STATEMENT, "Assign", exprs("targets"), expr("value")),
  AUG_ASSIGN(
      Category.STATEMENT,
      "AugAssign",
      expr("target"),
      node("op", Category.OPERATOR),
      expr("value")),
  FOR(Category.STATEMENT, "For", expr("target"), expr("iter"), stmts("body"), stmts("orelse")),
  WHILE(Category.STATEMENT, "While", expr("test"), stmts("body"), stmts("orelse")),
  IF(Category.STATEMENT, "If", expr("test"), stmts("body"), stmts("orelse")),
  TRY(
      Category.STATEMENT,
      "Try",
      stmts("body"),
      list("handlers", Category.EXCEPT_HANDLER),
      stmts("orelse"),
      stmts("finalbody")),
  RAISE(Category.STATEMENT, "Raise", optionalExpr("exc"), optionalExpr("cause")),
  IMPORT(Category.STATEMENT, "Import", list("names", Category.ALIAS)),
  IMPORT_FROM(
      Category.STATEMENT,
      "ImportFrom",
      optionalIdentifier("module"),
      list("names", Category.ALIAS),
      integer("level")),
  EXPR(Category.STATEMENT, "Expr", expr("value")),
  PASS(Category.STATEMENT, "Pass"),
  BREAK(Category.STATEMENT, "Break"),
  CONTINUE(Category.STATEMENT, "Continue"),

  // Expressions
  BOOL_OP(Category.EXPRESSION, "BoolOp", node("op", Category.BOOL_OPERATOR), exprs("values")),
  BIN_OP(
      Category.EXPRESSION, "BinOp", expr("left"), node("op", Category.OPERATOR), expr("right")),
  UNARY_OP(
      Category.EXPRESSION, "UnaryOp", node("op", Category.UNARY_OPERATOR), expr("operand")),
  IF_EXP(Category.EXPRESSION, "IfExp", expr("test"), expr("body"), expr("orelse")),
  DICT(Category.EXPRESSION, "Dict", exprs("keys"), exprs("values")),
  LIST_COMP(
      Category.EXPRESSION, "ListComp", expr("elt"), list("generators", Category.COMPREHENSION)),
  COMPARE(
      Category.EXPRESSION,
      "Compare",
      expr("left"),
      list("ops", Category.COMPARE_OPERATOR),
      exprs("comparators")),
  CALL(
      Category.EXPRESSION,
      "Call",
      expr("func"),
      exprs("args"),
      list("keywords", Category.KEYWORD)),
  FORMATTED_VALUE(
      Category.EXPRESSION,
      "FormattedValue",
      expr("value"),
      integer("conversion"),
      optionalExpr("format_spec")),
  JOINED_STR(Category.EXPRESSION, "JoinedStr", exprs("values")),
  CONSTANT(Category.EXPRESSION, "Constant", constant("value")),
  ATTRIBUTE(Category.EXPRESSION, "Attribute", expr("value"), identifier("attr"), ctx()),
  SUBSCRIPT(Category.EXPRESSION, "Subscript", expr("value"), expr("slice"), ctx()),
  STARRED(Category.EXPRESSION, "Starred", expr("value"), ctx()),
  NAME(Category.EXPRESSION, "Name", identifier("id"), ctx()),
  LIST(Category.EXPRESSION, "List", exprs("elts"), ctx()),
  TUPLE(Category.EXPRESSION, "Tuple", exprs("elts"), ctx()),
  SLICE(
      Category.EXPRESSION,
      "Slice",
      optionalExpr("lower"),
      optionalExpr("upper"),
      optionalExpr("step")),

  // Auxiliary kinds
  ARGUMENTS(
      Category.ARGUMENTS,
      "arguments",
      list("posonlyargs", Category.ARG),
      list("args", Category.ARG),
      optionalNode("vararg", Category.ARG),
      optionalNode("kwarg", Category.ARG),
      exprs("defaults")),
  ARG(Category.ARG, "arg", identifier("arg"), optionalExpr("annotation")),
  KEYWORD(Category.KEYWORD, "keyword", optionalIdentifier("arg"), expr("value")),
  ALIAS(Category.ALIAS, "alias", identifier("name"), optionalIdentifier("asname")),
  EXCEPT_HANDLER(
      Category.EXCEPT_HANDLER,
      "ExceptHandler",
      optionalExpr("type"),
      optionalIdentifier("name"),
      stmts("body")),
  COMPREHENSION(
      Category.COMPREHENSION,
      "comprehension",
      expr("target"),
      expr("iter"),
      exprs("ifs"),
      integer("is_async")),

  // Expression contexts
  LOAD(Category.EXPR_CONTEXT, "Load"),
  STORE(Category.EXPR_CONTEXT, "Store"),
  DEL(Category.EXPR_CONTEXT, "Del"),

  // Operators
  AND(Category.BOOL_OPERATOR, "And"),
  OR(Category.BOOL_OPERATOR, "Or"),
  ADD(Category.OPERATOR, "Add"),
  SUB(Category.OPERATOR, "Sub"),
  MULT(Category.OPERATOR, "Mult"),
  DIV(Category.OPERATOR, "Div"),
  FLOOR_DIV(Category.OPERATOR, "FloorDiv"),
  MOD(Category.OPERATOR, "Mod"),
  POW(Category.OPERATOR, "Pow"),
  NOT(Category.UNARY_OPERATOR, "Not"),
  USUB(Category.UNARY_OPERATOR, "USub"),
  UADD(Category.UNARY_OPERATOR, "UAdd"),
  EQ(Category.COMPARE_OPERATOR, "Eq"),
  NOT_EQ(Category.COMPARE_OPERATOR, "NotEq"),
  LT(Category.COMPARE_OPERATOR, "Lt"),
  LT_E(Category.COMPARE_OPERATOR, "LtE"),
  GT(Category.COMPARE_OPERATOR, "Gt"),
  GT_E(Category.COMPARE_OPERATOR, "GtE"),
  IS(Category.COMPARE_OPERATOR, "Is"),
  IS_NOT(Category.COMPARE_OPERATOR, "IsNot"),
  IN(Category.COMPARE_OPERATOR, "In"),
  NOT_IN(Category.COMPARE_OPERATOR, "NotIn");

  /** The grammatical category of a kind; child fields accept exactly one category. */
  public enum Category {
    MODULE,
    STATEMENT,
    EXPRESSION,
    EXPR_CONTEXT,
    BOOL_OPERATOR,
    OPERATOR,
    UNARY_OPERATOR,
    COMPARE_OPERATOR,
    ARGUMENTS,
    ARG,
    KEYWORD,
    ALIAS,
    EXCEPT_HANDLER,
    COMPREHENSION
  }

  private final Category category;
  private final String typeName;
  private final ImmutableList<FieldSpec> fields;
  private final ImmutableMap<String, FieldSpec> fieldsByName;

  Token(Category category, String typeName, FieldSpec... fields) {
    this.category = category;
    this.typeName = typeName;
    this.fields = ImmutableList.copyOf(fields);
    ImmutableMap.Builder<String, FieldSpec> byName = ImmutableMap.builder();
    for (FieldSpec field : fields) {
      byName.put(field.getName(), field);
    }
    this.fieldsByName = byName.buildOrThrow();
  }

  private static final ImmutableMap<String, Token> BY_TYPE_NAME;

  static {
    ImmutableMap.Builder<String, Token> byTypeName = ImmutableMap.builder();
    for (Token token : values()) {
      byTypeName.put(token.typeName, token);
    }
    BY_TYPE_NAME = byTypeName.buildOrThrow();
  }

  public Category getCategory() {
    return category;
  }

  /** The kind tag used in the mapping form, e.g. {@code "FunctionDef"}. */
  public String getTypeName() {
    return typeName;
  }

  /** The fields of this kind in declaration order. */
  public ImmutableList<FieldSpec> getFields() {
    return fields;
  }

  public boolean hasField(String name) {
    return fieldsByName.containsKey(name);
  }

  /** Whether nodes of this kind carry a source position. */
  public boolean hasPosition() {
    switch (category) {
      case STATEMENT:
      case EXPRESSION:
      case ARG:
      case KEYWORD:
      case ALIAS:
      case EXCEPT_HANDLER:
        return true;
      default:
        return false;
    }
  }

  /** Returns the kind with the given mapping-form tag, or null if there is none. */
  public static @Nullable Token fromTypeName(String typeName) {
    return BY_TYPE_NAME.get(typeName);
  }

  @Override
  public String toString() {
    return typeName;
  }
}
