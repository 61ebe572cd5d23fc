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

import com.google.pyrewrite.ast.Node;
import java.util.ArrayDeque;
import java.util.Deque;
import org.jspecify.annotations.Nullable;

/**
 * Gives a position to every node that should carry one but does not. A node without a position
 * takes the position of its closest positioned ancestor; when there is none, line 1, column 0.
 *
 * <p>Run this after any pass that synthesizes nodes and before printing or encoding the tree.
 */
public final class FillMissingPositions implements CompilerPass, NodeTraversal.Callback {

  static final int DEFAULT_LINENO = 1;
  static final int DEFAULT_CHARNO = 0;

  /** The position source for each open node; holds the closest positioned ancestor. */
  private final Deque<Node> positionSources = new ArrayDeque<>();

  @Override
  public void process(Node root) {
    positionSources.clear();
    NodeTraversal.traverse(root, this);
  }

  @Override
  public boolean shouldTraverse(NodeTraversal t, Node n, @Nullable Node parent) {
    Node source = positionSources.peek();
    if (n.getToken().hasPosition()) {
      if (!n.hasPosition()) {
        if (source != null && source.hasPosition()) {
          n.srcref(source);
        } else {
          n.setLinenoCharno(DEFAULT_LINENO, DEFAULT_CHARNO);
        }
      }
      source = n;
    }
    positionSources.push(source != null ? source : n);
    return true;
  }

  @Override
  public void visit(NodeTraversal t, Node n, @Nullable Node parent) {
    positionSources.pop();
  }
}
