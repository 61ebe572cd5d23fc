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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.pyrewrite.ast.FieldSpec;
import com.google.pyrewrite.ast.Node;
import com.google.pyrewrite.ast.Token;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * Converts trees to and from their mapping form.
 *
 * <p>A node becomes a {@code Map<String, Object>} whose {@value #NODE_TYPE} entry holds the kind
 * name ({@code "FunctionDef"}, {@code "Name"}, ...), followed by {@value #LINENO} and {@value
 * #COL_OFFSET} when the node has a position, then one entry per field in declaration order. Child
 * nodes become nested maps, child lists become lists, and scalars are {@code String}, {@code
 * Long}, {@code Double}, {@code Boolean} or null.
 *
 * <p>Decoding is strict: every key must be a field of the node's kind or a reserved key, every
 * required field must be present, and every value must fit its field. The optional fields and the
 * list fields of a kind may be omitted; they decode as absent and empty.
 */
public final class NodeCodec {

  public static final String NODE_TYPE = "node_type";
  public static final String LINENO = "lineno";
  public static final String COL_OFFSET = "col_offset";

  /** Keys written by other producers of the mapping form; accepted and discarded. */
  private static final ImmutableSet<String> IGNORED_KEYS =
      ImmutableSet.of("end_lineno", "end_col_offset", "type_comment", "kind");

  /** List fields of the full grammar this tree model leaves out; accepted only when empty. */
  private static final ImmutableSet<String> UNSUPPORTED_LIST_KEYS =
      ImmutableSet.of("type_ignores", "type_params", "kwonlyargs", "kw_defaults");

  private NodeCodec() {}

  // ==========================================================================
  // Encoding

  /** Returns the mapping form of the tree rooted at {@code n}. Never fails. */
  public static Map<String, Object> encode(Node n) {
    Map<String, Object> result = new LinkedHashMap<>();
    Token token = n.getToken();
    result.put(NODE_TYPE, token.getTypeName());
    if (n.hasPosition()) {
      result.put(LINENO, (long) n.getLineno());
      result.put(COL_OFFSET, (long) n.getCharno());
    }
    for (FieldSpec field : token.getFields()) {
      String name = field.getName();
      switch (field.getShape()) {
        case NODE:
        case OPTIONAL_NODE:
          Node child = n.getNode(name);
          result.put(name, child == null ? null : encode(child));
          break;
        case NODE_LIST:
          List<Object> children = new ArrayList<>();
          for (Node element : n.getChildren(name)) {
            children.add(encode(element));
          }
          result.put(name, children);
          break;
        default:
          result.put(name, n.getValue(name));
      }
    }
    return result;
  }

  // ==========================================================================
  // Decoding

  /**
   * Rebuilds a tree from its mapping form.
   *
   * @throws ReconstructionException if the mapping does not describe a well-formed node
   */
  public static Node decode(Map<String, ?> mapping) {
    return decodeNode(mapping, "$");
  }

  private static Node decodeNode(Map<String, ?> mapping, String path) {
    Object typeName = mapping.get(NODE_TYPE);
    if (typeName == null) {
      throw new ReconstructionException(path, "missing '%s'", NODE_TYPE);
    }
    if (!(typeName instanceof String)) {
      throw new ReconstructionException(path, "'%s' must be a string", NODE_TYPE);
    }
    Token token = Token.fromTypeName((String) typeName);
    if (token == null) {
      throw new ReconstructionException(path, "unknown node type '%s'", typeName);
    }

    for (Map.Entry<String, ?> entry : mapping.entrySet()) {
      String key = entry.getKey();
      if (token.hasField(key) || isReservedKey(key)) {
        continue;
      }
      if (UNSUPPORTED_LIST_KEYS.contains(key)) {
        Object value = entry.getValue();
        if (value instanceof List && ((List<?>) value).isEmpty()) {
          continue;
        }
        throw new ReconstructionException(path, "%s.%s is not supported", token, key);
      }
      throw new ReconstructionException(path, "unexpected field '%s' for %s", key, token);
    }

    Node n = new Node(token);
    for (FieldSpec field : token.getFields()) {
      String name = field.getName();
      String fieldPath = path + "." + name;
      if (!mapping.containsKey(name)) {
        if (isRequired(field)) {
          throw new ReconstructionException(path, "%s is missing the field '%s'", token, name);
        }
        continue;
      }
      Object value = mapping.get(name);
      switch (field.getShape()) {
        case NODE:
        case OPTIONAL_NODE:
          if (value == null) {
            if (field.getShape() == FieldSpec.Shape.NODE) {
              throw new ReconstructionException(fieldPath, "must not be null");
            }
          } else {
            n.setNode(name, decodeChild(token, field, value, fieldPath));
          }
          break;
        case NODE_LIST:
          if (!(value instanceof List)) {
            throw new ReconstructionException(fieldPath, "expected a list");
          }
          List<?> elements = (List<?>) value;
          ImmutableList.Builder<Node> children = ImmutableList.builder();
          for (int i = 0; i < elements.size(); i++) {
            children.add(decodeChild(token, field, elements.get(i), fieldPath + "[" + i + "]"));
          }
          n.setChildren(name, children.build());
          break;
        default:
          Object scalar = FieldSpec.normalizeScalar(value);
          if (!field.acceptsScalar(scalar)) {
            throw new ReconstructionException(
                fieldPath, "%s.%s cannot hold %s", token, name, describe(value));
          }
          n.setValue(name, scalar);
      }
    }

    decodePosition(n, mapping, path);
    return n;
  }

  private static Node decodeChild(
      Token parent, FieldSpec field, @Nullable Object value, String path) {
    if (!(value instanceof Map)) {
      throw new ReconstructionException(path, "expected a node but found %s", describe(value));
    }
    @SuppressWarnings("unchecked")
    Node child = decodeNode((Map<String, ?>) value, path);
    if (!field.accepts(child)) {
      throw new ReconstructionException(
          path, "%s.%s cannot hold %s", parent, field.getName(), child.getToken());
    }
    return child;
  }

  private static void decodePosition(Node n, Map<String, ?> mapping, String path) {
    Long lineno = positionValue(mapping, LINENO, path);
    Long colOffset = positionValue(mapping, COL_OFFSET, path);
    if (lineno != null) {
      n.setLinenoCharno(lineno.intValue(), colOffset == null ? 0 : colOffset.intValue());
    }
  }

  private static @Nullable Long positionValue(Map<String, ?> mapping, String key, String path) {
    Object value = FieldSpec.normalizeScalar(mapping.get(key));
    if (value == null) {
      return null;
    }
    if (!(value instanceof Long) || (Long) value < 0 || (Long) value > Integer.MAX_VALUE) {
      throw new ReconstructionException(
          path + "." + key, "expected a non-negative integer but found %s", describe(value));
    }
    return (Long) value;
  }

  private static boolean isReservedKey(String key) {
    return key.equals(NODE_TYPE)
        || key.equals(LINENO)
        || key.equals(COL_OFFSET)
        || IGNORED_KEYS.contains(key);
  }

  private static boolean isRequired(FieldSpec field) {
    switch (field.getShape()) {
      case OPTIONAL_NODE:
      case OPTIONAL_IDENTIFIER:
      case NODE_LIST:
        return false;
      default:
        return true;
    }
  }

  private static String describe(@Nullable Object value) {
    if (value == null) {
      return "null";
    } else if (value instanceof Map) {
      return "a mapping";
    } else if (value instanceof List) {
      return "a list";
    }
    return value.getClass().getSimpleName() + " " + value;
  }
}
