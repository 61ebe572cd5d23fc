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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.pyrewrite.ast.Node;
import com.google.pyrewrite.pycomp.NodeTraversal.AbstractPreOrderCallback;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Builds Markdown documentation for the functions of a tree. Every {@code def}, including methods
 * and nested functions, gets a section in source order with its signature and, when it has one,
 * its cleaned docstring. The tree is not modified.
 */
public final class FunctionDocGenerator extends AbstractPreOrderCallback {

  static final String TITLE = "# Python Code Documentation\n";

  private static final int TAB_WIDTH = 8;

  private final List<String> lines = new ArrayList<>();
  private int documentedFunctions;

  public FunctionDocGenerator() {
    lines.add(TITLE);
  }

  /** Returns the documentation of every function under {@code root}. */
  public static String generate(Node root) {
    FunctionDocGenerator generator = new FunctionDocGenerator();
    NodeTraversal.traverse(root, generator);
    return generator.getMarkdown();
  }

  @Override
  public boolean shouldTraverse(NodeTraversal t, Node n, @Nullable Node parent) {
    if (n.isFunctionDef()) {
      document(n);
    }
    return true;
  }

  private void document(Node function) {
    lines.add("## Function: `" + function.getString("name") + "`\n");
    lines.add("**Signature:**");
    lines.add("```python\n" + CodePrinter.printSignature(function) + "\n```\n");
    String docstring = getDocstring(function);
    if (docstring != null) {
      String cleaned = cleanDocstring(docstring);
      if (!CharMatcher.whitespace().matchesAllOf(cleaned)) {
        lines.add("**Description:**");
        lines.add(cleaned + "\n");
      }
    }
    documentedFunctions++;
  }

  /** Returns the Markdown collected so far. */
  public String getMarkdown() {
    return String.join("\n", lines);
  }

  public int getDocumentedFunctions() {
    return documentedFunctions;
  }

  /**
   * Returns the docstring of a function: the text of a string constant that is the first statement
   * of its body, or null.
   */
  @VisibleForTesting
  static @Nullable String getDocstring(Node function) {
    ImmutableList<Node> body = function.getChildren("body");
    if (body.isEmpty() || !body.get(0).isExpr()) {
      return null;
    }
    Node value = body.get(0).getNode("value");
    if (!value.isConstant() || !(value.getValue("value") instanceof String)) {
      return null;
    }
    return value.getString("value");
  }

  /**
   * Removes docstring indentation. Tabs are expanded to 8 columns. The first line loses its
   * leading whitespace and the other lines lose the smallest indentation among their non-blank
   * lines. Blank lines at the start and end are dropped.
   */
  @VisibleForTesting
  static String cleanDocstring(String docstring) {
    List<String> docLines =
        new ArrayList<>(Splitter.on('\n').splitToList(expandTabs(docstring)));
    int margin = Integer.MAX_VALUE;
    for (String line : docLines.subList(1, docLines.size())) {
      String content = CharMatcher.whitespace().trimLeadingFrom(line);
      if (!content.isEmpty()) {
        margin = Math.min(margin, line.length() - content.length());
      }
    }
    docLines.set(0, CharMatcher.whitespace().trimLeadingFrom(docLines.get(0)));
    if (margin < Integer.MAX_VALUE) {
      for (int i = 1; i < docLines.size(); i++) {
        String line = docLines.get(i);
        docLines.set(i, line.substring(Math.min(margin, line.length())));
      }
    }
    while (!docLines.isEmpty() && docLines.get(docLines.size() - 1).isEmpty()) {
      docLines.remove(docLines.size() - 1);
    }
    while (!docLines.isEmpty() && docLines.get(0).isEmpty()) {
      docLines.remove(0);
    }
    return String.join("\n", docLines);
  }

  private static String expandTabs(String text) {
    StringBuilder sb = new StringBuilder(text.length());
    int column = 0;
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      if (c == '\t') {
        int spaces = TAB_WIDTH - column % TAB_WIDTH;
        sb.append(Strings.repeat(" ", spaces));
        column += spaces;
      } else {
        sb.append(c);
        column = (c == '\n' || c == '\r') ? 0 : column + 1;
      }
    }
    return sb.toString();
  }
}
