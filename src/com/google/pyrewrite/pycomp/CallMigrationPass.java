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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.pyrewrite.ast.IR;
import com.google.pyrewrite.ast.Node;
import java.util.List;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Migrates calls of deprecated functions to their replacements.
 *
 * <p>For every {@link CallMigration} rule, a call whose callee is the bare name of the rule's
 * source is replaced by a call of the rule's dotted target. The first positional argument is kept.
 * If the call passes the rule's keyword, its value is wrapped in a one-entry dict that becomes the
 * only keyword argument of the new call. All other arguments are dropped and a warning is logged.
 *
 * <p>Arguments are migrated before the call that holds them, so nested deprecated calls are
 * migrated too.
 */
public final class CallMigrationPass extends NodeTransformer implements CompilerPass {

  private static final Logger logger = Logger.getLogger(CallMigrationPass.class.getName());

  private final ImmutableMap<String, CallMigration> migrationsBySource;
  private int migratedCalls;

  public CallMigrationPass(List<CallMigration> migrations) {
    ImmutableMap.Builder<String, CallMigration> bySource = ImmutableMap.builder();
    for (CallMigration migration : migrations) {
      bySource.put(migration.getSourceName(), migration);
    }
    this.migrationsBySource = bySource.buildOrThrow();
  }

  @Override
  public void process(Node root) {
    migratedCalls = 0;
    transformInPlace(root);
  }

  /** Returns the number of calls migrated by the last {@link #process} run. */
  public int getMigratedCalls() {
    return migratedCalls;
  }

  @Override
  protected ImmutableList<Node> rewrite(Node n) {
    transformChildren(n);
    if (!n.isCall()) {
      return keep(n);
    }
    Node callee = n.getNode("func");
    if (!callee.isName()) {
      return keep(n);
    }
    CallMigration migration = migrationsBySource.get(callee.getString("id"));
    if (migration == null) {
      return keep(n);
    }
    return replaceWith(migrate(n, migration));
  }

  private Node migrate(Node call, CallMigration migration) {
    ImmutableList<Node> args = call.getChildren("args");
    ImmutableList<Node> keywords = call.getChildren("keywords");

    ImmutableList<Node> newArgs =
        args.isEmpty() ? ImmutableList.of() : ImmutableList.of(args.get(0).cloneTree());
    Node carried = findKeyword(keywords, migration.getKeyword());
    ImmutableList<Node> newKeywords = ImmutableList.of();
    if (carried != null) {
      Node wrapper =
          IR.dict(
              ImmutableList.of(IR.string(migration.getKeyword()).srcref(carried)),
              ImmutableList.of(carried.getNode("value").cloneTree()));
      Node keyword = IR.keyword(migration.getWrapperKey(), wrapper).srcref(carried);
      newKeywords = ImmutableList.of(keyword);
    }

    Node replacement =
        IR.call(IR.qualifiedName(migration.getTargetName()), newArgs, newKeywords);
    replacement.srcrefTreeIfMissing(call);

    int dropped =
        args.size() - newArgs.size() + keywords.size() - (carried == null ? 0 : 1);
    if (dropped > 0) {
      logger.warning(
          String.format(
              "Migrating %s to %s at line %s dropped %s argument(s)",
              migration.getSourceName(),
              migration.getTargetName(),
              call.getLineno(),
              dropped));
    }
    logger.fine(
        () ->
            String.format(
                "Migrated call %s to %s at line %s",
                migration.getSourceName(),
                migration.getTargetName(),
                call.getLineno()));
    migratedCalls++;
    return replacement;
  }

  private static @Nullable Node findKeyword(List<Node> keywords, String name) {
    for (Node keyword : keywords) {
      if (name.equals(keyword.getString("arg"))) {
        return keyword;
      }
    }
    return null;
  }
}
