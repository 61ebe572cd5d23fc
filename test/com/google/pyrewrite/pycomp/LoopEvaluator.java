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
import com.google.pyrewrite.ast.Node;
import com.google.pyrewrite.ast.Token;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs the integer subset of Python the loop tests build: assignments, augmented assignments,
 * {@code for} over {@code range}, {@code if}, {@code pass} and calls of {@code emit}. Each {@code
 * emit(a, b)} call is recorded as the effect {@code "a,b"}.
 */
final class LoopEvaluator {
  private final Map<String, Long> variables = new HashMap<>();
  private final List<String> effects = new ArrayList<>();

  private LoopEvaluator() {}

  /** Runs a module and returns the effects in the order they happened. */
  static ImmutableList<String> run(Node module) {
    checkState(module.isModule(), module);
    LoopEvaluator evaluator = new LoopEvaluator();
    evaluator.execute(module.getChildren("body"));
    return ImmutableList.copyOf(evaluator.effects);
  }

  private void execute(List<Node> statements) {
    for (Node statement : statements) {
      execute(statement);
    }
  }

  private void execute(Node n) {
    switch (n.getToken()) {
      case EXPR:
        evaluate(n.getNode("value"));
        break;
      case ASSIGN:
        variables.put(
            n.getChildren("targets").get(0).getString("id"), evaluate(n.getNode("value")));
        break;
      case AUG_ASSIGN:
        String name = n.getNode("target").getString("id");
        variables.put(
            name,
            apply(n.getNode("op").getToken(), variables.get(name), evaluate(n.getNode("value"))));
        break;
      case FOR:
        executeFor(n);
        break;
      case IF:
        execute(evaluate(n.getNode("test")) != 0 ? n.getChildren("body") : n.getChildren("orelse"));
        break;
      case PASS:
        break;
      default:
        throw new UnsupportedOperationException("cannot run " + n.getToken());
    }
  }

  private void executeFor(Node loop) {
    Node iter = loop.getNode("iter");
    checkState(iter.getNode("func").matchesName("range"), iter);
    ImmutableList<Node> args = iter.getChildren("args");
    long start = 0;
    long step = 1;
    long stop;
    if (args.size() == 1) {
      stop = evaluate(args.get(0));
    } else {
      start = evaluate(args.get(0));
      stop = evaluate(args.get(1));
      if (args.size() == 3) {
        step = evaluate(args.get(2));
      }
    }
    String variable = loop.getNode("target").getString("id");
    for (long value = start; value < stop; value += step) {
      variables.put(variable, value);
      execute(loop.getChildren("body"));
    }
    execute(loop.getChildren("orelse"));
  }

  private long evaluate(Node n) {
    switch (n.getToken()) {
      case CONSTANT:
        return n.getLong("value");
      case NAME:
        Long value = variables.get(n.getString("id"));
        checkState(value != null, "%s is not defined", n.getString("id"));
        return value;
      case BIN_OP:
        return apply(
            n.getNode("op").getToken(), evaluate(n.getNode("left")), evaluate(n.getNode("right")));
      case CALL:
        checkState(n.getNode("func").matchesName("emit"), n);
        List<String> values = new ArrayList<>();
        for (Node arg : n.getChildren("args")) {
          values.add(String.valueOf(evaluate(arg)));
        }
        effects.add(String.join(",", values));
        return 0;
      default:
        throw new UnsupportedOperationException("cannot evaluate " + n.getToken());
    }
  }

  private static long apply(Token op, long left, long right) {
    switch (op) {
      case ADD:
        return left + right;
      case SUB:
        return left - right;
      case MULT:
        return left * right;
      case MOD:
        return Math.floorMod(left, right);
      default:
        throw new UnsupportedOperationException("cannot apply " + op);
    }
  }
}
