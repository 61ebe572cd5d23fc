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

import com.google.common.collect.ImmutableSet;
import com.google.pyrewrite.ast.FieldSpec;
import com.google.pyrewrite.ast.Node;
import com.google.pyrewrite.ast.Token;

/**
 * This class walks the AST and validates that the structure is correct: every node has exactly the
 * fields of its kind, every child belongs to the category its field accepts, and names, attributes
 * and subscripts carry a store context exactly where they are written to.
 */
public final class AstValidator implements CompilerPass {

  // Possible enhancements:
  // * verify identifiers are valid Python identifiers.

  /** Violation handler */
  public interface ViolationHandler {
    void handleViolation(String message, Node n);
  }

  /** Conversions allowed on an f-string replacement field: none, !s, !r and !a. */
  private static final ImmutableSet<Long> CONVERSIONS = ImmutableSet.of(-1L, 115L, 114L, 97L);

  private final ViolationHandler violationHandler;
  private boolean isPositionValidationEnabled = false;

  public AstValidator(ViolationHandler handler) {
    this.violationHandler = handler;
  }

  public AstValidator() {
    this(
        new ViolationHandler() {
          @Override
          public void handleViolation(String message, Node n) {
            throw new IllegalStateException(
                message + ". Reference node:\n" + n.toStringTree());
          }
        });
  }

  /** Also require a position on every node whose kind carries one. */
  public AstValidator setPositionValidationEnabled(boolean isEnabled) {
    isPositionValidationEnabled = isEnabled;
    return this;
  }

  @Override
  public void process(Node root) {
    validateRoot(root);
  }

  public void validateRoot(Node n) {
    if (!n.isModule()) {
      violation("Expected Module but was " + n.getToken(), n);
      return;
    }
    validateNode(n, false);
  }

  /**
   * Validates the subtree rooted at {@code n}.
   *
   * @param isTarget whether {@code n} is written to rather than read
   */
  private void validateNode(Node n, boolean isTarget) {
    Token token = n.getToken();
    for (String field : n.getUnsetFields()) {
      violation(token + " is missing the required field '" + field + "'", n);
    }
    if (!n.getUnsetFields().isEmpty()) {
      return;
    }
    if (isPositionValidationEnabled && token.hasPosition() && !n.hasPosition()) {
      violation(token + " has no source position", n);
    }

    if (token.hasField("ctx")) {
      Token ctx = n.getNode("ctx").getToken();
      Token expected = isTarget ? Token.STORE : Token.LOAD;
      if (ctx != expected) {
        violation(token + " should be in " + expected + " context but is in " + ctx, n);
      }
    } else if (isTarget) {
      violation(token + " cannot be assigned to", n);
    }

    validateKindSpecificConstraints(n);

    for (FieldSpec field : token.getFields()) {
      if (!field.getShape().holdsNodes()) {
        continue;
      }
      boolean childIsTarget = isTargetField(token, field.getName(), isTarget);
      if (field.getShape() == FieldSpec.Shape.NODE_LIST) {
        for (Node child : n.getChildren(field.getName())) {
          validateChild(n, field, child, childIsTarget);
        }
      } else {
        Node child = n.getNode(field.getName());
        if (child != null) {
          validateChild(n, field, child, childIsTarget);
        }
      }
    }
  }

  private void validateChild(Node parent, FieldSpec field, Node child, boolean isTarget) {
    if (!field.accepts(child)) {
      violation(
          parent.getToken() + "." + field.getName() + " cannot hold " + child.getToken(), child);
      return;
    }
    validateNode(child, isTarget);
  }

  /** Whether the child in {@code field} of a {@code parent} node is a write target. */
  private static boolean isTargetField(Token parent, String field, boolean parentIsTarget) {
    switch (parent) {
      case ASSIGN:
        return field.equals("targets");
      case AUG_ASSIGN:
      case FOR:
      case COMPREHENSION:
        return field.equals("target");
      case TUPLE:
      case LIST:
        return parentIsTarget && field.equals("elts");
      case STARRED:
        return parentIsTarget && field.equals("value");
      default:
        return false;
    }
  }

  private void validateKindSpecificConstraints(Node n) {
    switch (n.getToken()) {
      case ASSIGN:
        if (n.getChildren("targets").isEmpty()) {
          violation("Assign needs at least one target", n);
        }
        break;
      case TRY:
        if (n.getChildren("handlers").isEmpty() && n.getChildren("finalbody").isEmpty()) {
          violation("Try needs a handler or a finally block", n);
        }
        break;
      case IMPORT_FROM:
        if (n.getLong("level") < 0) {
          violation("ImportFrom level cannot be negative", n);
        }
        break;
      case BOOL_OP:
        if (n.getChildren("values").size() < 2) {
          violation("BoolOp needs at least two values", n);
        }
        break;
      case DICT:
        if (n.getChildren("keys").size() != n.getChildren("values").size()) {
          violation("Dict needs one value per key", n);
        }
        break;
      case COMPARE:
        int ops = n.getChildren("ops").size();
        if (ops == 0 || ops != n.getChildren("comparators").size()) {
          violation("Compare needs one comparator per operator", n);
        }
        break;
      case FORMATTED_VALUE:
        if (!CONVERSIONS.contains(n.getLong("conversion"))) {
          violation("Unknown conversion " + n.getLong("conversion"), n);
        }
        break;
      case LIST_COMP:
        if (n.getChildren("generators").isEmpty()) {
          violation("ListComp needs at least one generator", n);
        }
        break;
      default:
        break;
    }
  }

  private void violation(String message, Node n) {
    violationHandler.handleViolation(message, n);
  }
}
