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

import com.google.pyrewrite.ast.Node;
import java.util.logging.Logger;

/**
 * Runs the enabled rewrite passes over a tree, in the order call migration, guard injection, loop
 * unrolling. The caller's tree is never modified.
 */
public final class Rewriter {

  private static final Logger logger = Logger.getLogger(Rewriter.class.getName());

  private final RewriteOptions options;

  public Rewriter(RewriteOptions options) {
    this.options = checkNotNull(options);
  }

  /**
   * Returns a rewritten copy of {@code tree}, with every position filled in.
   *
   * @throws InvalidOptionsException if the options do not validate
   * @throws IllegalStateException if {@code tree} is not a valid module
   */
  public Node rewrite(Node tree) {
    options.validate();
    new AstValidator().validateRoot(tree);

    Node root = tree.cloneTree();
    int migrated = 0;
    int guarded = 0;
    int unrolled = 0;
    if (options.isEnabled(RewriteOptions.Pass.MIGRATE_CALLS)) {
      CallMigrationPass pass = new CallMigrationPass(options.getCallMigrations());
      pass.process(root);
      migrated = pass.getMigratedCalls();
    }
    if (options.isEnabled(RewriteOptions.Pass.INJECT_GUARDS)) {
      GuardInjectionPass pass = new GuardInjectionPass(options);
      pass.process(root);
      guarded = pass.getGuardedStatements();
    }
    if (options.isEnabled(RewriteOptions.Pass.UNROLL_LOOPS)) {
      LoopUnrollingPass pass = new LoopUnrollingPass(options);
      pass.process(root);
      unrolled = pass.getUnrolledLoops();
    }
    new FillMissingPositions().process(root);
    new AstValidator().setPositionValidationEnabled(true).validateRoot(root);

    logger.info(
        String.format(
            "Rewrote module: %s call(s) migrated, %s statement(s) guarded, %s loop(s) unrolled",
            migrated, guarded, unrolled));
    return root;
  }
}
