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

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.pyrewrite.ast.Node;
import com.google.pyrewrite.ast.Token;
import java.util.ArrayDeque;
import java.util.Deque;
import org.jspecify.annotations.Nullable;

/**
 * NodeTraversal allows an iteration through the nodes in the parse tree.
 *
 * <p>The walk is depth first. Each node is offered to {@link Callback#shouldTraverse} before its
 * children and to {@link Callback#visit} after them. Children are visited field by field in the
 * order the node's kind declares its fields, and list fields in index order. Kinds a callback does
 * not care about simply fall through its dispatch; there is no error for them.
 */
public class NodeTraversal {
  private final Callback callback;

  /** The ancestors of the node being visited, innermost first. */
  private final Deque<Node> ancestors = new ArrayDeque<>();

  /** Contains the current node */
  private @Nullable Node currentNode;

  /** Callback for tree-based traversals */
  public interface Callback {
    /**
     * Visits a node in preorder (before its children) and decides whether its children should be
     * traversed.
     *
     * <p>If this method returns false, neither {@link #visit} nor the children of {@code n} are
     * visited.
     *
     * @param t The current traversal.
     * @param n The current node.
     * @param parent The parent of the current node, or null for the root.
     * @return whether the children of this node should be visited
     */
    boolean shouldTraverse(NodeTraversal t, Node n, @Nullable Node parent);

    /**
     * Visits a node in postorder (after its children). A node is visited in postorder iff {@link
     * #shouldTraverse} returned true for it.
     *
     * <p>Implementations must not modify siblings or ancestors of {@code n}.
     *
     * @param t The current traversal.
     * @param n The current node.
     * @param parent The parent of the current node, or null for the root.
     */
    void visit(NodeTraversal t, Node n, @Nullable Node parent);
  }

  /** Abstract callback to visit all nodes in postorder. */
  public abstract static class AbstractPostOrderCallback implements Callback {
    @Override
    public final boolean shouldTraverse(NodeTraversal t, Node n, @Nullable Node parent) {
      return true;
    }
  }

  /** Abstract callback to visit all nodes in preorder. */
  public abstract static class AbstractPreOrderCallback implements Callback {
    @Override
    public final void visit(NodeTraversal t, Node n, @Nullable Node parent) {}
  }

  /**
   * Abstract callback to visit all nodes in postorder, skipping nested function and class
   * definitions along with everything inside them.
   */
  public abstract static class AbstractShallowCallback implements Callback {
    @Override
    public final boolean shouldTraverse(NodeTraversal t, Node n, @Nullable Node parent) {
      return parent == null || !(n.isFunctionDef() || n.getToken() == Token.CLASS_DEF);
    }
  }

  /** Abstract callback to visit all nodes in postorder. */
  @FunctionalInterface
  public interface AbstractPostOrderCallbackInterface {
    void visit(NodeTraversal t, Node n, @Nullable Node parent);
  }

  public NodeTraversal(Callback cb) {
    this.callback = checkNotNull(cb);
  }

  /** Traverses the subtree rooted at {@code root}. */
  public static void traverse(Node root, Callback cb) {
    new NodeTraversal(cb).traverse(root);
  }

  /** Traverses the subtree rooted at {@code root} in postorder. */
  public static void traversePostOrder(Node root, AbstractPostOrderCallbackInterface cb) {
    traverse(
        root,
        new AbstractPostOrderCallback() {
          @Override
          public void visit(NodeTraversal t, Node n, @Nullable Node parent) {
            cb.visit(t, n, parent);
          }
        });
  }

  public void traverse(Node root) {
    checkState(ancestors.isEmpty(), "traversal is already in progress");
    traverseBranch(root, null);
  }

  private void traverseBranch(Node n, @Nullable Node parent) {
    currentNode = n;
    if (!callback.shouldTraverse(this, n, parent)) {
      return;
    }
    ancestors.push(n);
    for (Node child : n.getChildNodes()) {
      traverseBranch(child, n);
    }
    ancestors.pop();
    currentNode = n;
    callback.visit(this, n, parent);
  }

  /** Returns the node currently being visited. */
  public Node getCurrentNode() {
    return checkNotNull(currentNode);
  }
}
