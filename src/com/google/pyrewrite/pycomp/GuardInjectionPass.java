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
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Wraps statements that call a registered risky function in a {@code try} block.
 *
 * <p>Given the registry entry {@code json.loads -> (json.JSONDecodeError, None)}, the statement
 * {@code data = json.loads(raw)} becomes:
 *
 * <pre>
 * try:
 *     data = json.loads(raw)
 * except json.JSONDecodeError as e:
 *     print(f"Error in json.loads: {e}")
 *     data = None
 * </pre>
 *
 * <p>Only a statement whose whole value is the call is guarded: an expression statement, or an
 * assignment to a single bare name. Other assignment targets are left alone, as is every statement
 * whose callee is not registered.
 */
public final class GuardInjectionPass extends NodeTransformer implements CompilerPass {

  private static final Logger logger = Logger.getLogger(GuardInjectionPass.class.getName());

  private final ImmutableMap<String, RiskyCall> riskyCalls;
  private final String diagnosticFunctionName;
  private final String handlerVariableName;
  private int guardedStatements;

  public GuardInjectionPass(
      ImmutableMap<String, RiskyCall> riskyCalls,
      String diagnosticFunctionName,
      String handlerVariableName) {
    this.riskyCalls = riskyCalls;
    this.diagnosticFunctionName = diagnosticFunctionName;
    this.handlerVariableName = handlerVariableName;
  }

  public GuardInjectionPass(RewriteOptions options) {
    this(
        options.getRiskyCalls(),
        options.getDiagnosticFunctionName(),
        options.getHandlerVariableName());
  }

  @Override
  public void process(Node root) {
    guardedStatements = 0;
    transformInPlace(root);
  }

  /** Returns the number of statements guarded by the last {@link #process} run. */
  public int getGuardedStatements() {
    return guardedStatements;
  }

  @Override
  protected ImmutableList<Node> rewrite(Node n) {
    switch (n.getToken()) {
      case ASSIGN:
        ImmutableList<Node> targets = n.getChildren("targets");
        if (targets.size() != 1 || !targets.get(0).isName()) {
          return keep(n);
        }
        // fall through
      case EXPR:
        RiskyCall riskyCall = findRiskyCall(n.getNode("value"));
        return riskyCall == null ? keep(n) : replaceWith(guard(n, riskyCall));
      default:
        transformChildren(n);
        return keep(n);
    }
  }

  private @Nullable RiskyCall findRiskyCall(Node value) {
    if (!value.isCall()) {
      return null;
    }
    String calleeName = value.getNode("func").getQualifiedName();
    return calleeName == null ? null : riskyCalls.get(calleeName);
  }

  private Node guard(Node statement, RiskyCall riskyCall) {
    String calleeName = riskyCall.getCalleeName();
    Node message =
        IR.joinedStr(
            IR.string("Error in " + calleeName + ": "),
            IR.formattedValue(IR.name(handlerVariableName)));
    ImmutableList.Builder<Node> handlerBody = ImmutableList.builder();
    handlerBody.add(
        IR.exprResult(IR.call(IR.qualifiedName(diagnosticFunctionName), message)));
    if (statement.isAssign()) {
      String target = statement.getChildren("targets").get(0).getString("id");
      handlerBody.add(IR.assign(IR.storeName(target), riskyCall.newFallback()));
    }
    Node handler =
        IR.exceptHandler(
            IR.qualifiedName(riskyCall.getExceptionName()),
            handlerVariableName,
            handlerBody.build());
    handler.srcrefTreeIfMissing(statement);

    Node tryNode = IR.tryNode(ImmutableList.of(statement), ImmutableList.of(handler));
    tryNode.srcref(statement);

    logger.fine(
        () -> String.format("Guarded call %s at line %s", calleeName, statement.getLineno()));
    guardedStatements++;
    return tryNode;
  }
}
