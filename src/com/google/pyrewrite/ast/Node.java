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
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.errorprone.annotations.CheckReturnValue;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * A node in a Python syntax tree.
 *
 * <p>A node has a {@link Token kind} and one value for every field its kind declares. A field value
 * is a scalar, a single child node, or an ordered list of child nodes. Nodes own their children
 * exclusively: there are no parent pointers, and a node must never be reachable from two places
 * in a tree. Use {@link #cloneTree()} to duplicate a subtree.
 */
public final class Node {

  /** Marks a required field that has not been assigned yet. */
  private static final Object UNSET =
      new Object() {
        @Override
        public String toString() {
          return "<unset>";
        }
      };

  private final Token token;

  /** Field values, indexed like {@link Token#getFields()}. */
  private final Object[] values;

  /** 1-based line number, or -1 when the node has no position. */
  private int lineno = -1;

  /** 0-based column number, or -1 when the node has no position. */
  private int charno = -1;

  public Node(Token token) {
    this.token = checkNotNull(token);
    ImmutableList<FieldSpec> fields = token.getFields();
    this.values = new Object[fields.size()];
    for (int i = 0; i < values.length; i++) {
      switch (fields.get(i).getShape()) {
        case NODE_LIST:
          values[i] = new ArrayList<Node>();
          break;
        case OPTIONAL_NODE:
        case OPTIONAL_IDENTIFIER:
          values[i] = null;
          break;
        default:
          values[i] = UNSET;
      }
    }
  }

  public Token getToken() {
    return token;
  }

  // ==========================================================================
  // Field access

  private int indexOf(String field) {
    ImmutableList<FieldSpec> fields = token.getFields();
    for (int i = 0; i < fields.size(); i++) {
      if (fields.get(i).getName().equals(field)) {
        return i;
      }
    }
    throw new IllegalArgumentException(token + " has no field '" + field + "'");
  }

  private FieldSpec specAt(int index) {
    return token.getFields().get(index);
  }

  /** Returns the child of a single-node field, or null for an absent optional child. */
  public @Nullable Node getNode(String field) {
    int i = indexOf(field);
    FieldSpec spec = specAt(i);
    checkArgument(
        spec.getShape() == FieldSpec.Shape.NODE || spec.getShape() == FieldSpec.Shape.OPTIONAL_NODE,
        "%s.%s is not a single-node field",
        token,
        field);
    checkState(values[i] != UNSET, "%s.%s is not set", token, field);
    return (Node) values[i];
  }

  /** Returns a snapshot of the children of a list field. */
  @SuppressWarnings("unchecked")
  public ImmutableList<Node> getChildren(String field) {
    int i = indexOf(field);
    checkArgument(
        specAt(i).getShape() == FieldSpec.Shape.NODE_LIST,
        "%s.%s is not a list field",
        token,
        field);
    return ImmutableList.copyOf((List<Node>) values[i]);
  }

  /** Returns the value of a scalar field. */
  public @Nullable Object getValue(String field) {
    int i = indexOf(field);
    checkArgument(!specAt(i).getShape().holdsNodes(), "%s.%s is not a scalar field", token, field);
    checkState(values[i] != UNSET, "%s.%s is not set", token, field);
    return values[i];
  }

  /** Returns the value of an identifier field, which may be null for an optional identifier. */
  public @Nullable String getString(String field) {
    Object value = getValue(field);
    checkState(value == null || value instanceof String, "%s.%s is not a string", token, field);
    return (String) value;
  }

  public long getLong(String field) {
    Object value = getValue(field);
    checkState(value instanceof Long, "%s.%s is not an integer", token, field);
    return (Long) value;
  }

  @CanIgnoreReturnValue
  public Node setNode(String field, @Nullable Node child) {
    int i = indexOf(field);
    FieldSpec spec = specAt(i);
    if (spec.getShape() == FieldSpec.Shape.NODE) {
      checkNotNull(child, "%s.%s requires a node", token, field);
    } else {
      checkArgument(
          spec.getShape() == FieldSpec.Shape.OPTIONAL_NODE,
          "%s.%s is not a single-node field",
          token,
          field);
    }
    if (child != null) {
      checkArgument(spec.accepts(child), "%s.%s cannot hold %s", token, field, child.getToken());
    }
    values[i] = child;
    return this;
  }

  @CanIgnoreReturnValue
  public Node setChildren(String field, List<Node> children) {
    List<Node> list = mutableList(field);
    FieldSpec spec = specAt(indexOf(field));
    for (Node child : children) {
      checkArgument(spec.accepts(child), "%s.%s cannot hold %s", token, field, child.getToken());
    }
    list.clear();
    list.addAll(children);
    return this;
  }

  @CanIgnoreReturnValue
  public Node addChildToBack(String field, Node child) {
    checkArgument(
        specAt(indexOf(field)).accepts(child),
        "%s.%s cannot hold %s",
        token,
        field,
        child.getToken());
    mutableList(field).add(child);
    return this;
  }

  @CanIgnoreReturnValue
  public Node setValue(String field, @Nullable Object value) {
    int i = indexOf(field);
    FieldSpec spec = specAt(i);
    Object normalized = FieldSpec.normalizeScalar(value);
    checkArgument(
        spec.acceptsScalar(normalized), "%s.%s cannot hold the value %s", token, field, value);
    values[i] = normalized;
    return this;
  }

  @SuppressWarnings("unchecked")
  private List<Node> mutableList(String field) {
    int i = indexOf(field);
    checkArgument(
        specAt(i).getShape() == FieldSpec.Shape.NODE_LIST,
        "%s.%s is not a list field",
        token,
        field);
    return (List<Node>) values[i];
  }

  /**
   * Replaces the element at {@code index} of a list field with {@code replacements}. Used by the
   * traversal code to splice rewrites into their parent.
   */
  public void replaceChildren(String field, int index, List<Node> replacements) {
    List<Node> list = mutableList(field);
    FieldSpec spec = specAt(indexOf(field));
    for (Node replacement : replacements) {
      checkArgument(
          spec.accepts(replacement), "%s.%s cannot hold %s", token, field, replacement.getToken());
    }
    list.remove(index);
    list.addAll(index, replacements);
  }

  /** Returns the names of required fields that have not been assigned. */
  public ImmutableList<String> getUnsetFields() {
    ImmutableList.Builder<String> unset = ImmutableList.builder();
    for (int i = 0; i < values.length; i++) {
      if (values[i] == UNSET) {
        unset.add(specAt(i).getName());
      }
    }
    return unset.build();
  }

  /** Returns all child nodes, field by field in declaration order, lists in index order. */
  @SuppressWarnings("unchecked")
  public ImmutableList<Node> getChildNodes() {
    ImmutableList.Builder<Node> children = ImmutableList.builder();
    for (int i = 0; i < values.length; i++) {
      Object value = values[i];
      if (value instanceof Node) {
        children.add((Node) value);
      } else if (value instanceof List) {
        children.addAll((List<Node>) value);
      }
    }
    return children.build();
  }

  // ==========================================================================
  // Kind tests

  public boolean isModule() {
    return token == Token.MODULE;
  }

  public boolean isFunctionDef() {
    return token == Token.FUNCTION_DEF;
  }

  public boolean isAssign() {
    return token == Token.ASSIGN;
  }

  public boolean isExpr() {
    return token == Token.EXPR;
  }

  public boolean isFor() {
    return token == Token.FOR;
  }

  public boolean isTry() {
    return token == Token.TRY;
  }

  public boolean isBreak() {
    return token == Token.BREAK;
  }

  public boolean isContinue() {
    return token == Token.CONTINUE;
  }

  public boolean isCall() {
    return token == Token.CALL;
  }

  public boolean isName() {
    return token == Token.NAME;
  }


  public boolean isConstant() {
    return token == Token.CONSTANT;
  }


  public boolean isStatement() {
    return token.getCategory() == Token.Category.STATEMENT;
  }

  public boolean isExpression() {
    return token.getCategory() == Token.Category.EXPRESSION;
  }

  /** Whether this is a name, attribute or subscript read in load context. */
  public boolean isLoad() {
    return token.hasField("ctx") && getNode("ctx").getToken() == Token.LOAD;
  }

  /** Whether this is a name, attribute or subscript in store context (a write target). */
  public boolean isStore() {
    return token.hasField("ctx") && getNode("ctx").getToken() == Token.STORE;
  }

  /** Whether this is an integer literal, excluding booleans. */
  public boolean isIntegerConstant() {
    return isConstant() && getValue("value") instanceof Long;
  }

  // ==========================================================================
  // Names

  /**
   * Returns the dotted name for a chain of {@link Token#ATTRIBUTE} nodes ending in a {@link
   * Token#NAME}, e.g. {@code "json.loads"}, or null if this is not such a chain.
   */
  public @Nullable String getQualifiedName() {
    switch (token) {
      case NAME:
        return getString("id");
      case ATTRIBUTE:
        String left = getNode("value").getQualifiedName();
        return left == null ? null : left + "." + getString("attr");
      default:
        return null;
    }
  }

  /** Whether this is a bare {@link Token#NAME} with the given identifier. */
  public boolean matchesName(String name) {
    return isName() && name.equals(getString("id"));
  }

  public boolean matchesQualifiedName(String name) {
    return name.equals(getQualifiedName());
  }

  // ==========================================================================
  // Source positions

  public int getLineno() {
    return lineno;
  }

  public int getCharno() {
    return charno;
  }

  public boolean hasPosition() {
    return lineno >= 0 && charno >= 0;
  }

  /** Sets the position; a negative line or column clears it. */
  @CanIgnoreReturnValue
  public Node setLinenoCharno(int lineno, int charno) {
    if (lineno < 0 || charno < 0) {
      this.lineno = -1;
      this.charno = -1;
    } else {
      this.lineno = lineno;
      this.charno = charno;
    }
    return this;
  }

  /** Copies the position of {@code other} onto this node. */
  @CanIgnoreReturnValue
  public Node srcref(Node other) {
    this.lineno = other.lineno;
    this.charno = other.charno;
    return this;
  }

  @CanIgnoreReturnValue
  public Node srcrefTree(Node other) {
    srcref(other);
    for (Node child : getChildNodes()) {
      child.srcrefTree(other);
    }
    return this;
  }

  /** Copies the position of {@code other} onto this node if this node has none. */
  @CanIgnoreReturnValue
  public Node srcrefIfMissing(Node other) {
    if (!hasPosition()) {
      srcref(other);
    }
    return this;
  }

  @CanIgnoreReturnValue
  public Node srcrefTreeIfMissing(Node other) {
    srcrefIfMissing(other);
    for (Node child : getChildNodes()) {
      child.srcrefTreeIfMissing(other);
    }
    return this;
  }

  // ==========================================================================
  // Copying and comparison

  /** Returns a deep copy of this subtree, positions included, sharing no node with it. */
  @CheckReturnValue
  @SuppressWarnings("unchecked")
  public Node cloneTree() {
    Node copy = new Node(token);
    copy.lineno = lineno;
    copy.charno = charno;
    for (int i = 0; i < values.length; i++) {
      Object value = values[i];
      if (value instanceof Node) {
        copy.values[i] = ((Node) value).cloneTree();
      } else if (value instanceof List) {
        List<Node> copies = (List<Node>) copy.values[i];
        for (Node child : (List<Node>) value) {
          copies.add(child.cloneTree());
        }
      } else {
        copy.values[i] = value;
      }
    }
    return copy;
  }

  /** Returns true if this subtree is structurally equal to {@code node}, ignoring positions. */
  @SuppressWarnings("unchecked")
  public boolean isEquivalentTo(Node node) {
    if (token != node.token) {
      return false;
    }
    for (int i = 0; i < values.length; i++) {
      Object mine = values[i];
      Object theirs = node.values[i];
      if (mine instanceof Node) {
        if (!(theirs instanceof Node) || !((Node) mine).isEquivalentTo((Node) theirs)) {
          return false;
        }
      } else if (mine instanceof List) {
        List<Node> myList = (List<Node>) mine;
        List<Node> theirList = (List<Node>) theirs;
        if (myList.size() != theirList.size()) {
          return false;
        }
        for (int j = 0; j < myList.size(); j++) {
          if (!myList.get(j).isEquivalentTo(theirList.get(j))) {
            return false;
          }
        }
      } else if (!Objects.equals(mine, theirs)) {
        return false;
      }
    }
    return true;
  }

  // ==========================================================================
  // Debug output

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(token.getTypeName());
    for (int i = 0; i < values.length; i++) {
      FieldSpec spec = specAt(i);
      if (!spec.getShape().holdsNodes()) {
        sb.append(' ').append(spec.getName()).append('=').append(formatScalar(values[i]));
      }
    }
    if (hasPosition()) {
      sb.append(' ').append(lineno).append(':').append(charno);
    }
    return sb.toString();
  }

  private static String formatScalar(@Nullable Object value) {
    return value instanceof String ? "'" + value + "'" : String.valueOf(value);
  }

  @CheckReturnValue
  public String toStringTree() {
    try {
      StringBuilder s = new StringBuilder();
      toStringTreeHelper(this, null, 0, s);
      return s.toString();
    } catch (IOException e) {
      throw new RuntimeException("Should not happen\n" + e);
    }
  }

  @SuppressWarnings("unchecked")
  private static void toStringTreeHelper(
      Node n, @Nullable String field, int level, Appendable sb) throws IOException {
    for (int i = 0; i != level; ++i) {
      sb.append("    ");
    }
    if (field != null) {
      sb.append(field).append(": ");
    }
    sb.append(n.toString());
    sb.append('\n');
    for (int i = 0; i < n.values.length; i++) {
      Object value = n.values[i];
      String name = n.specAt(i).getName();
      if (value instanceof Node) {
        toStringTreeHelper((Node) value, name, level + 1, sb);
      } else if (value instanceof List) {
        for (Node child : (List<Node>) value) {
          toStringTreeHelper(child, name, level + 1, sb);
        }
      }
    }
  }
}
