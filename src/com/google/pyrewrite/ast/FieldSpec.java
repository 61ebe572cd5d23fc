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

import static com.google.common.base.Preconditions.checkNotNull;

import org.jspecify.annotations.Nullable;

/**
 * Declares one field of a node kind: its name, the shape of its value and, for child fields, the
 * category of nodes it accepts.
 */
public final class FieldSpec {

  /** The shape of a field value. */
  public enum Shape {
    /** Exactly one child node. */
    NODE,
    /** A child node or nothing. */
    OPTIONAL_NODE,
    /** An ordered list of child nodes. */
    NODE_LIST,
    /** A non-null identifier string. */
    IDENTIFIER,
    /** An identifier string or nothing. */
    OPTIONAL_IDENTIFIER,
    /** An integer scalar. */
    INT,
    /** A literal value: string, integer, floating point, boolean or nothing. */
    CONSTANT;

    public boolean holdsNodes() {
      return this == NODE || this == OPTIONAL_NODE || this == NODE_LIST;
    }
  }

  private final String name;
  private final Shape shape;
  private final Token.@Nullable Category category;

  private FieldSpec(String name, Shape shape, Token.@Nullable Category category) {
    this.name = checkNotNull(name);
    this.shape = checkNotNull(shape);
    this.category = category;
  }

  static FieldSpec node(String name, Token.Category category) {
    return new FieldSpec(name, Shape.NODE, category);
  }

  static FieldSpec optionalNode(String name, Token.Category category) {
    return new FieldSpec(name, Shape.OPTIONAL_NODE, category);
  }

  static FieldSpec list(String name, Token.Category category) {
    return new FieldSpec(name, Shape.NODE_LIST, category);
  }

  static FieldSpec expr(String name) {
    return node(name, Token.Category.EXPRESSION);
  }

  static FieldSpec optionalExpr(String name) {
    return optionalNode(name, Token.Category.EXPRESSION);
  }

  static FieldSpec exprs(String name) {
    return list(name, Token.Category.EXPRESSION);
  }

  static FieldSpec stmts(String name) {
    return list(name, Token.Category.STATEMENT);
  }

  static FieldSpec ctx() {
    return node("ctx", Token.Category.EXPR_CONTEXT);
  }

  static FieldSpec identifier(String name) {
    return new FieldSpec(name, Shape.IDENTIFIER, null);
  }

  static FieldSpec optionalIdentifier(String name) {
    return new FieldSpec(name, Shape.OPTIONAL_IDENTIFIER, null);
  }

  static FieldSpec integer(String name) {
    return new FieldSpec(name, Shape.INT, null);
  }

  static FieldSpec constant(String name) {
    return new FieldSpec(name, Shape.CONSTANT, null);
  }

  public String getName() {
    return name;
  }

  public Shape getShape() {
    return shape;
  }

  /** The category accepted by a child field, or null for scalar fields. */
  public Token.@Nullable Category getCategory() {
    return category;
  }

  /** Whether this field holds a statement sequence, where a node may expand into many. */
  public boolean isStatementList() {
    return shape == Shape.NODE_LIST && category == Token.Category.STATEMENT;
  }

  /** Whether {@code child} is a legal value for an element of this child field. */
  public boolean accepts(Node child) {
    return category != null && child.getToken().getCategory() == category;
  }

  /**
   * Whether {@code value}, already passed through {@link #normalizeScalar}, is a legal value for
   * this scalar field.
   */
  public boolean acceptsScalar(@Nullable Object value) {
    switch (shape) {
      case IDENTIFIER:
        return value instanceof String;
      case OPTIONAL_IDENTIFIER:
        return value == null || value instanceof String;
      case INT:
        return value instanceof Long;
      case CONSTANT:
        return value == null
            || value instanceof String
            || value instanceof Long
            || value instanceof Double
            || value instanceof Boolean;
      default:
        return false;
    }
  }

  /** Widens the smaller numeric boxes so integers are stored as Long and reals as Double. */
  public static @Nullable Object normalizeScalar(@Nullable Object value) {
    if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
      return ((Number) value).longValue();
    }
    if (value instanceof Float) {
      return ((Float) value).doubleValue();
    }
    return value;
  }

  @Override
  public String toString() {
    return name + ":" + shape + (category == null ? "" : "<" + category + ">");
  }
}
