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

package com.google.pyrewrite.pycomp.serialization;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.pyrewrite.ast.Token;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * Structural edits applied directly to the mapping form of a tree, before it is decoded.
 *
 * <p>Every edit walks the whole mapping in pre-order, matches nodes on their {@value
 * NodeCodec#NODE_TYPE} entry, and descends into every nested mapping and list whether or not the
 * node matched, so edits reach every depth and compose. Each edit returns a changed deep copy and
 * leaves its argument untouched.
 */
public final class MappingRewrites {

  static final String DEFAULT_LOG_MESSAGE = "Function called";

  private static final ImmutableList<String> STATEMENT_LISTS =
      ImmutableList.of("body", "orelse", "finalbody");

  private MappingRewrites() {}

  /** Visits one node of a mapping-form tree. The visitor may change the node in place. */
  private interface NodeVisitor {
    void visit(Map<String, Object> node);
  }

  /**
   * Renames the function {@code oldName}: its definitions, bare-name calls of it and every other
   * bare-name reference.
   */
  public static Map<String, Object> renameFunction(
      Map<String, ?> tree, String oldName, String newName) {
    return rewrite(
        tree,
        node -> {
          String type = nodeType(node);
          if (type.equals("FunctionDef") && oldName.equals(node.get("name"))) {
            node.put("name", newName);
          } else if (type.equals("Name") && oldName.equals(node.get("id"))) {
            node.put("id", newName);
          }
        });
  }

  /**
   * Inserts {@code print("<message>: <function name>")} as the first statement of every function
   * body.
   */
  public static Map<String, Object> addLogging(Map<String, ?> tree, String message) {
    return rewrite(
        tree,
        node -> {
          if (nodeType(node).equals("FunctionDef") && node.get("body") instanceof List) {
            @SuppressWarnings("unchecked")
            List<Object> body = (List<Object>) node.get("body");
            body.add(0, logStatement(message + ": " + node.get("name")));
          }
        });
  }

  public static Map<String, Object> addLogging(Map<String, ?> tree) {
    return addLogging(tree, DEFAULT_LOG_MESSAGE);
  }

  /**
   * Replaces the value of every constant equal to {@code oldValue}. Integers and floats compare by
   * numeric value; booleans only equal booleans.
   */
  public static Map<String, Object> replaceConstant(
      Map<String, ?> tree, @Nullable Object oldValue, @Nullable Object newValue) {
    return rewrite(
        tree,
        node -> {
          if (nodeType(node).equals("Constant")
              && node.containsKey("value")
              && constantEquals(node.get("value"), oldValue)) {
            node.put("value", newValue);
          }
        });
  }

  /**
   * Removes the statements of kind {@code statementType}, e.g. {@code "Pass"}, from every {@code
   * body}, {@code orelse} and {@code finalbody} list.
   *
   * @throws IllegalArgumentException if {@code statementType} is not a statement kind
   */
  public static Map<String, Object> removeStatements(Map<String, ?> tree, String statementType) {
    Token token = Token.fromTypeName(statementType);
    checkArgument(
        token != null && token.getCategory() == Token.Category.STATEMENT,
        "'%s' is not a statement type",
        statementType);
    return rewrite(
        tree,
        node -> {
          for (String key : STATEMENT_LISTS) {
            if (node.get(key) instanceof List) {
              List<?> statements = (List<?>) node.get(key);
              List<Object> kept = new ArrayList<>();
              for (Object statement : statements) {
                if (!(statement instanceof Map
                    && statementType.equals(((Map<?, ?>) statement).get(NodeCodec.NODE_TYPE)))) {
                  kept.add(statement);
                }
              }
              node.put(key, kept);
            }
          }
        });
  }

  /** Returns the names of the statement kinds {@link #removeStatements} accepts. */
  public static ImmutableSet<String> getStatementTypes() {
    ImmutableSet.Builder<String> types = ImmutableSet.builder();
    for (Token token : Token.values()) {
      if (token.getCategory() == Token.Category.STATEMENT) {
        types.add(token.getTypeName());
      }
    }
    return types.build();
  }

  // ==========================================================================
  // Walking

  @SuppressWarnings("unchecked")
  private static Map<String, Object> rewrite(Map<String, ?> tree, NodeVisitor visitor) {
    Map<String, Object> copy = (Map<String, Object>) deepCopy(tree);
    walk(copy, visitor);
    return copy;
  }

  @SuppressWarnings("unchecked")
  private static void walk(@Nullable Object value, NodeVisitor visitor) {
    if (value instanceof Map) {
      Map<String, Object> node = (Map<String, Object>) value;
      if (node.get(NodeCodec.NODE_TYPE) instanceof String) {
        visitor.visit(node);
      }
      for (Object child : node.values()) {
        walk(child, visitor);
      }
    } else if (value instanceof List) {
      for (Object element : (List<Object>) value) {
        walk(element, visitor);
      }
    }
  }

  private static @Nullable Object deepCopy(@Nullable Object value) {
    if (value instanceof Map) {
      Map<String, Object> copy = new LinkedHashMap<>();
      for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
        copy.put(String.valueOf(entry.getKey()), deepCopy(entry.getValue()));
      }
      return copy;
    } else if (value instanceof List) {
      List<Object> copy = new ArrayList<>();
      for (Object element : (List<?>) value) {
        copy.add(deepCopy(element));
      }
      return copy;
    }
    return value;
  }

  private static String nodeType(Map<String, Object> node) {
    return (String) node.get(NodeCodec.NODE_TYPE);
  }

  private static Map<String, Object> logStatement(String text) {
    Map<String, Object> func = node("Name");
    func.put("id", "print");
    func.put("ctx", node("Load"));

    Map<String, Object> argument = node("Constant");
    argument.put("value", text);

    Map<String, Object> call = node("Call");
    call.put("func", func);
    call.put("args", new ArrayList<>(ImmutableList.of(argument)));
    call.put("keywords", new ArrayList<>());

    Map<String, Object> statement = node("Expr");
    statement.put("value", call);
    return statement;
  }

  private static Map<String, Object> node(String type) {
    Map<String, Object> node = new LinkedHashMap<>();
    node.put(NodeCodec.NODE_TYPE, type);
    return node;
  }

  private static boolean constantEquals(@Nullable Object value, @Nullable Object expected) {
    if (value instanceof Boolean || expected instanceof Boolean) {
      return Objects.equals(value, expected);
    }
    if (value instanceof Number && expected instanceof Number) {
      if (isIntegral(value) && isIntegral(expected)) {
        return ((Number) value).longValue() == ((Number) expected).longValue();
      }
      return ((Number) value).doubleValue() == ((Number) expected).doubleValue();
    }
    return Objects.equals(value, expected);
  }

  private static boolean isIntegral(Object number) {
    return number instanceof Long || number instanceof Integer;
  }
}
