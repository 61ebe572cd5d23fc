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

/**
 * Interface for classes that rewrite or check a Python tree.
 *
 * <p>Class has single function "process", which is passed the root node of the tree and may modify
 * it in place. A pass that does not recognize a shape leaves it alone; passes do not throw on a
 * tree that {@link AstValidator} accepts.
 */
public interface CompilerPass {

  /**
   * Process the tree with root node root. Can modify the contents of the tree.
   *
   * @param root Top of the tree
   */
  void process(Node root);

  /**
   * Runs this pass on a deep copy of {@code tree} and returns the copy, with missing positions
   * filled in. The caller's tree is never modified.
   */
  default Node apply(Node tree) {
    Node copy = tree.cloneTree();
    process(copy);
    new FillMissingPositions().process(copy);
    return copy;
  }
}
