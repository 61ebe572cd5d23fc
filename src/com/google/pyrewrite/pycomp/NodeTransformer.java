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

import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.google.pyrewrite.ast.FieldSpec;
import com.google.pyrewrite.ast.Node;
import java.util.List;

/**
 * A depth-first rewrite of a tree. {@link #rewrite} is called once for every node reached and
 * returns what should stand in the node's place:
 *
 * <ul>
 *   <li>the node itself ({@link #keep}), possibly mutated,
 *   <li>a single replacement node, or
 *   <li>inside a statement list only, zero or more replacement statements ({@link #remove},
 *       {@link #replaceWith(List)}).
 * </ul>
 *
 * <p>The default rewrite recurses into the children and keeps the node. An override decides
 * whether and when to recurse by calling {@link #transformChildren}. Nodes returned by a rewrite
 * are spliced into the parent and are not visited again by the same walk.
 */
public abstract class NodeTransformer {

  /**
   * Rewrites the tree rooted at {@code root} and returns the new root. The root must be replaced
   * by exactly one node.
   */
  public final Node transform(Node root) {
    ImmutableList<Node> result = rewrite(root);
    checkState(result.size() == 1, "the root %s was rewritten to %s nodes", root, result.size());
    return result.get(0);
  }

  /** Rewrites the tree under {@code root} in place; the root itself must survive. */
  protected final void transformInPlace(Node root) {
    Node result = transform(root);
    checkState(result == root, "the root %s cannot be replaced", root.getToken());
  }

  /** Rewrites {@code n}. The default implementation rewrites the children of {@code n}. */
  protected ImmutableList<Node> rewrite(Node n) {
    transformChildren(n);
    return keep(n);
  }

  /** Rewrites every child of {@code n}, splicing the results into {@code n}. */
  protected final void transformChildren(Node n) {
    for (FieldSpec field : n.getToken().getFields()) {
      String name = field.getName();
      switch (field.getShape()) {
        case NODE:
        case OPTIONAL_NODE:
          Node child = n.getNode(name);
          if (child != null) {
            ImmutableList<Node> result = rewrite(child);
            checkState(
                result.size() == 1,
                "%s.%s holds a single node but was rewritten to %s",
                n.getToken(),
                name,
                result.size());
            if (result.get(0) != child) {
              n.setNode(name, result.get(0));
            }
          }
          break;
        case NODE_LIST:
          int index = 0;
          for (Node element : n.getChildren(name)) {
            ImmutableList<Node> result = rewrite(element);
            if (result.size() != 1 || result.get(0) != element) {
              checkState(
                  field.isStatementList() || result.size() == 1,
                  "only statements can expand: %s.%s was rewritten to %s nodes",
                  n.getToken(),
                  name,
                  result.size());
              n.replaceChildren(name, index, result);
            }
            index += result.size();
          }
          break;
        default:
          break;
      }
    }
  }

  protected static ImmutableList<Node> keep(Node n) {
    return ImmutableList.of(n);
  }

  protected static ImmutableList<Node> replaceWith(Node replacement) {
    return ImmutableList.of(replacement);
  }

  protected static ImmutableList<Node> replaceWith(List<Node> replacements) {
    return ImmutableList.copyOf(replacements);
  }

  protected static ImmutableList<Node> remove() {
    return ImmutableList.of();
  }
}
