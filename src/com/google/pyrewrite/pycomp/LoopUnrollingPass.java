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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import com.google.pyrewrite.ast.IR;
import com.google.pyrewrite.ast.Node;
import com.google.pyrewrite.ast.Token;
import java.util.List;
import java.util.logging.Logger;

/**
 * Unrolls counting loops with a literal bound.
 *
 * <p>A loop {@code for v in range(N)} with an integer literal {@code N} and no {@code break} or
 * {@code continue} anywhere inside it is replaced, for an unroll factor {@code F <= N} and {@code M
 * = N - N % F}, by
 *
 * <ul>
 *   <li>a driving loop {@code for v in range(0, M, F)} whose body holds {@code F} copies of the
 *       original body, the copy for offset {@code i > 0} reading {@code v + i} wherever the
 *       original reads {@code v}, and
 *   <li>one copy of the body for each {@code v} in {@code M..N-1}, with {@code v} replaced by the
 *       literal value.
 * </ul>
 *
 * A non-empty {@code else} block follows the unrolled statements, after an assignment {@code v =
 * N - 1} so that it reads the value the original loop leaves in {@code v}. Loops with {@code N <
 * F} are left alone. Inner loops are unrolled before the loops that contain them.
 */
public final class LoopUnrollingPass extends NodeTransformer implements CompilerPass {

  private static final Logger logger = Logger.getLogger(LoopUnrollingPass.class.getName());

  private final int unrollFactor;
  private final String rangeFunctionName;
  private int unrolledLoops;

  public LoopUnrollingPass(int unrollFactor, String rangeFunctionName) {
    checkArgument(unrollFactor >= 1, "unroll factor must be positive: %s", unrollFactor);
    this.unrollFactor = unrollFactor;
    this.rangeFunctionName = rangeFunctionName;
  }

  public LoopUnrollingPass(RewriteOptions options) {
    this(options.getUnrollFactor(), options.getRangeFunctionName());
  }

  @Override
  public void process(Node root) {
    unrolledLoops = 0;
    transformInPlace(root);
  }

  /** Returns the number of loops unrolled by the last {@link #process} run. */
  public int getUnrolledLoops() {
    return unrolledLoops;
  }

  @Override
  protected ImmutableList<Node> rewrite(Node n) {
    transformChildren(n);
    return n.isFor() ? unroll(n) : keep(n);
  }

  private ImmutableList<Node> unroll(Node loop) {
    Node target = loop.getNode("target");
    if (!target.isName()) {
      return keep(loop);
    }
    Node iter = loop.getNode("iter");
    if (!iter.isCall() || !iter.getNode("func").matchesName(rangeFunctionName)) {
      return keep(loop);
    }
    ImmutableList<Node> rangeArgs = iter.getChildren("args");
    if (rangeArgs.size() != 1 || !iter.getChildren("keywords").isEmpty()) {
      return keep(loop);
    }
    Node bound = rangeArgs.get(0);
    if (!bound.isIntegerConstant()) {
      return keep(loop);
    }
    if (containsLoopExit(loop)) {
      return keep(loop);
    }

    ImmutableList<Node> body = loop.getChildren("body");
    long n = bound.getLong("value");
    if (n < unrollFactor || body.isEmpty()) {
      return keep(loop);
    }
    String variable = target.getString("id");
    long mainStop = (n / unrollFactor) * unrollFactor;
    ImmutableList.Builder<Node> result = ImmutableList.builder();

    if (mainStop > 0) {
      ImmutableList.Builder<Node> unrolledBody = ImmutableList.builder();
      for (int offset = 0; offset < unrollFactor; offset++) {
        appendCopies(unrolledBody, body, new OffsetReplacer(variable, offset));
      }
      Node range =
          IR.call(
              IR.name(rangeFunctionName),
              IR.number(0),
              IR.number(mainStop),
              IR.number(unrollFactor));
      range.srcrefTreeIfMissing(iter);
      Node drivingLoop =
          IR.forNode(target.cloneTree(), range, unrolledBody.build()).srcref(loop);
      result.add(drivingLoop);
    }
    for (long value = mainStop; value < n; value++) {
      appendCopies(result, body, new ConstantReplacer(variable, value));
    }
    ImmutableList<Node> orelse = loop.getChildren("orelse");
    if (!orelse.isEmpty()) {
      // The else block sees the value the loop variable has after the last iteration.
      result.add(
          IR.assign(IR.storeName(variable), IR.number(n - 1)).srcrefTreeIfMissing(target));
      result.addAll(orelse);
    }

    logger.fine(
        () ->
            String.format(
                "Unrolled loop over %s at line %s: bound %s, factor %s",
                variable, loop.getLineno(), n, unrollFactor));
    unrolledLoops++;
    return replaceWith(result.build());
  }

  private static void appendCopies(
      ImmutableList.Builder<Node> out, List<Node> body, NodeTransformer replacer) {
    for (Node statement : body) {
      out.add(replacer.transform(statement.cloneTree()));
    }
  }

  /** Whether a {@code break} or {@code continue} appears anywhere under {@code root}. */
  private static boolean containsLoopExit(Node root) {
    if (root.isBreak() || root.isContinue()) {
      return true;
    }
    for (Node child : root.getChildNodes()) {
      if (containsLoopExit(child)) {
        return true;
      }
    }
    return false;
  }

  /** Rewrites reads of a variable; writes are left as they are. */
  private abstract static class VariableReplacer extends NodeTransformer {
    private final String variable;

    VariableReplacer(String variable) {
      this.variable = variable;
    }

    @Override
    protected ImmutableList<Node> rewrite(Node n) {
      if (n.matchesName(variable) && n.isLoad()) {
        Node replacement = replace(n);
        return replacement == n ? keep(n) : replaceWith(replacement.srcrefTree(n));
      }
      return super.rewrite(n);
    }

    abstract Node replace(Node read);
  }

  /** Replaces {@code v} with {@code v + offset}. */
  private static final class OffsetReplacer extends VariableReplacer {
    private final int offset;

    OffsetReplacer(String variable, int offset) {
      super(variable);
      this.offset = offset;
    }

    @Override
    Node replace(Node read) {
      if (offset == 0) {
        return read;
      }
      return IR.binOp(read.cloneTree(), Token.ADD, IR.number(offset));
    }
  }

  /** Replaces {@code v} with a literal. */
  private static final class ConstantReplacer extends VariableReplacer {
    private final long value;

    ConstantReplacer(String variable, long value) {
      super(variable);
      this.value = value;
    }

    @Override
    Node replace(Node read) {
      return IR.number(value);
    }
  }
}
