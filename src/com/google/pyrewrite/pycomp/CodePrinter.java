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

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.pyrewrite.ast.Node;
import com.google.pyrewrite.ast.Token;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * CodePrinter prints out Python source for a syntax tree. Output is deterministic: the same tree
 * always prints to the same text. Parentheses are added only where operator precedence needs them.
 */
public final class CodePrinter {

  /** Operator precedence levels, loosest first. */
  private static final int PREC_TUPLE = 0;
  private static final int PREC_TEST = 1;
  private static final int PREC_OR = 2;
  private static final int PREC_AND = 3;
  private static final int PREC_NOT = 4;
  private static final int PREC_CMP = 5;
  private static final int PREC_ARITH = 6;
  private static final int PREC_TERM = 7;
  private static final int PREC_FACTOR = 8;
  private static final int PREC_POWER = 9;
  private static final int PREC_ATOM = 10;

  private static final ImmutableMap<Token, String> OPERATORS =
      ImmutableMap.<Token, String>builder()
          .put(Token.AND, "and")
          .put(Token.OR, "or")
          .put(Token.ADD, "+")
          .put(Token.SUB, "-")
          .put(Token.MULT, "*")
          .put(Token.DIV, "/")
          .put(Token.FLOOR_DIV, "//")
          .put(Token.MOD, "%")
          .put(Token.POW, "**")
          .put(Token.NOT, "not ")
          .put(Token.USUB, "-")
          .put(Token.UADD, "+")
          .put(Token.EQ, "==")
          .put(Token.NOT_EQ, "!=")
          .put(Token.LT, "<")
          .put(Token.LT_E, "<=")
          .put(Token.GT, ">")
          .put(Token.GT_E, ">=")
          .put(Token.IS, "is")
          .put(Token.IS_NOT, "is not")
          .put(Token.IN, "in")
          .put(Token.NOT_IN, "not in")
          .buildOrThrow();

  private final Node root;
  private final String indentUnit;
  private final StringBuilder code = new StringBuilder(1024);
  private int indentLevel = 0;

  private CodePrinter(Builder builder) {
    this.root = builder.root;
    this.indentUnit = Strings.repeat(" ", builder.indentWidth);
  }

  /** Prints a module with the default settings. */
  public static String print(Node root) {
    return new Builder(root).build();
  }

  /**
   * Prints the {@code def} line of a function without its decorators, body or trailing colon, e.g.
   * {@code def f(x: int = 1) -> str}.
   */
  public static String printSignature(Node function) {
    checkArgument(function.isFunctionDef(), "not a function: %s", function);
    return new CodePrinter(new Builder(function)).signature(function);
  }

  /** Class that allows configuring the printer before printing. */
  public static final class Builder {
    private final Node root;
    private int indentWidth = 4;

    /**
     * Sets the root node from which to generate the source code.
     *
     * @param root The root node.
     */
    public Builder(Node root) {
      this.root = root;
    }

    /** Sets the number of spaces per indentation level. */
    public Builder setIndentWidth(int indentWidth) {
      checkArgument(indentWidth > 0, "indent width must be positive: %s", indentWidth);
      this.indentWidth = indentWidth;
      return this;
    }

    /**
     * Generates the source code and returns it. The tree must be valid.
     *
     * @throws IllegalStateException if the tree fails {@link AstValidator}
     */
    public String build() {
      new AstValidator().validateRoot(root);
      CodePrinter printer = new CodePrinter(this);
      printer.addStatements(root.getChildren("body"));
      return printer.code.toString();
    }
  }

  // ==========================================================================
  // Statements

  private void addStatements(List<Node> statements) {
    for (Node stmt : statements) {
      addStatement(stmt);
    }
  }

  private void addBlock(List<Node> body) {
    indentLevel++;
    if (body.isEmpty()) {
      line("pass");
    } else {
      addStatements(body);
    }
    indentLevel--;
  }

  private void addStatement(Node n) {
    switch (n.getToken()) {
      case FUNCTION_DEF:
        addDecorators(n);
        line(signature(n) + ":");
        addBlock(n.getChildren("body"));
        break;
      case CLASS_DEF:
        addDecorators(n);
        ImmutableList.Builder<String> bases = ImmutableList.builder();
        for (Node base : n.getChildren("bases")) {
          bases.add(expr(base, PREC_TEST));
        }
        for (Node keyword : n.getChildren("keywords")) {
          bases.add(keyword(keyword));
        }
        String baseList = String.join(", ", bases.build());
        line(
            "class "
                + n.getString("name")
                + (baseList.isEmpty() ? "" : "(" + baseList + ")")
                + ":");
        addBlock(n.getChildren("body"));
        break;
      case RETURN:
        Node value = n.getNode("value");
        line(value == null ? "return" : "return " + expr(value, PREC_TUPLE));
        break;
      case ASSIGN:
        StringBuilder assign = new StringBuilder();
        for (Node target : n.getChildren("targets")) {
          assign.append(expr(target, PREC_TUPLE)).append(" = ");
        }
        line(assign.append(expr(n.getNode("value"), PREC_TUPLE)).toString());
        break;
      case AUG_ASSIGN:
        line(
            expr(n.getNode("target"), PREC_TUPLE)
                + " "
                + OPERATORS.get(n.getNode("op").getToken())
                + "= "
                + expr(n.getNode("value"), PREC_TUPLE));
        break;
      case FOR:
        line(
            "for "
                + expr(n.getNode("target"), PREC_TUPLE)
                + " in "
                + expr(n.getNode("iter"), PREC_TEST)
                + ":");
        addBlock(n.getChildren("body"));
        addElse(n.getChildren("orelse"));
        break;
      case WHILE:
        line("while " + expr(n.getNode("test"), PREC_TEST) + ":");
        addBlock(n.getChildren("body"));
        addElse(n.getChildren("orelse"));
        break;
      case IF:
        addIf(n, "if ");
        break;
      case TRY:
        line("try:");
        addBlock(n.getChildren("body"));
        for (Node handler : n.getChildren("handlers")) {
          Node type = handler.getNode("type");
          String header = "except";
          if (type != null) {
            header += " " + expr(type, PREC_TEST);
            String name = handler.getString("name");
            if (name != null) {
              header += " as " + name;
            }
          }
          line(header + ":");
          addBlock(handler.getChildren("body"));
        }
        addElse(n.getChildren("orelse"));
        if (!n.getChildren("finalbody").isEmpty()) {
          line("finally:");
          addBlock(n.getChildren("finalbody"));
        }
        break;
      case RAISE:
        Node exc = n.getNode("exc");
        Node cause = n.getNode("cause");
        String raise = "raise";
        if (exc != null) {
          raise += " " + expr(exc, PREC_TEST);
          if (cause != null) {
            raise += " from " + expr(cause, PREC_TEST);
          }
        }
        line(raise);
        break;
      case IMPORT:
        line("import " + aliases(n.getChildren("names")));
        break;
      case IMPORT_FROM:
        String module = n.getString("module");
        line(
            "from "
                + Strings.repeat(".", (int) n.getLong("level"))
                + (module == null ? "" : module)
                + " import "
                + aliases(n.getChildren("names")));
        break;
      case EXPR:
        line(expr(n.getNode("value"), PREC_TUPLE));
        break;
      case PASS:
        line("pass");
        break;
      case BREAK:
        line("break");
        break;
      case CONTINUE:
        line("continue");
        break;
      default:
        throw new IllegalStateException("Unexpected statement " + n.getToken());
    }
  }

  private void addIf(Node n, String keyword) {
    line(keyword + expr(n.getNode("test"), PREC_TEST) + ":");
    addBlock(n.getChildren("body"));
    ImmutableList<Node> orelse = n.getChildren("orelse");
    if (orelse.size() == 1 && orelse.get(0).getToken() == Token.IF) {
      addIf(orelse.get(0), "elif ");
    } else {
      addElse(orelse);
    }
  }

  private void addElse(List<Node> orelse) {
    if (!orelse.isEmpty()) {
      line("else:");
      addBlock(orelse);
    }
  }

  private String signature(Node function) {
    StringBuilder def = new StringBuilder("def ").append(function.getString("name")).append('(');
    appendArguments(def, function.getNode("args"));
    def.append(')');
    Node returns = function.getNode("returns");
    if (returns != null) {
      def.append(" -> ").append(expr(returns, PREC_TEST));
    }
    return def.toString();
  }

  private void addDecorators(Node n) {
    for (Node decorator : n.getChildren("decorator_list")) {
      line("@" + expr(decorator, PREC_TEST));
    }
  }

  private void appendArguments(StringBuilder sb, Node arguments) {
    ImmutableList<Node> posonly = arguments.getChildren("posonlyargs");
    ImmutableList<Node> args = arguments.getChildren("args");
    ImmutableList<Node> defaults = arguments.getChildren("defaults");
    int positional = posonly.size() + args.size();
    int firstDefault = positional - defaults.size();
    ImmutableList.Builder<String> parts = ImmutableList.builder();
    for (int i = 0; i < positional; i++) {
      Node arg = i < posonly.size() ? posonly.get(i) : args.get(i - posonly.size());
      String part = arg(arg);
      if (i >= firstDefault) {
        part += "=" + expr(defaults.get(i - firstDefault), PREC_TEST);
      }
      parts.add(part);
      if (i == posonly.size() - 1) {
        parts.add("/");
      }
    }
    Node vararg = arguments.getNode("vararg");
    if (vararg != null) {
      parts.add("*" + arg(vararg));
    }
    Node kwarg = arguments.getNode("kwarg");
    if (kwarg != null) {
      parts.add("**" + arg(kwarg));
    }
    sb.append(String.join(", ", parts.build()));
  }

  private String arg(Node arg) {
    Node annotation = arg.getNode("annotation");
    return annotation == null
        ? arg.getString("arg")
        : arg.getString("arg") + ": " + expr(annotation, PREC_TEST);
  }

  private static String aliases(List<Node> names) {
    ImmutableList.Builder<String> parts = ImmutableList.builder();
    for (Node alias : names) {
      String asname = alias.getString("asname");
      String name = alias.getString("name");
      parts.add(asname == null ? name : name + " as " + asname);
    }
    return String.join(", ", parts.build());
  }

  private void line(String text) {
    for (int i = 0; i < indentLevel; i++) {
      code.append(indentUnit);
    }
    code.append(text).append('\n');
  }

  // ==========================================================================
  // Expressions

  /** Renders {@code n}, parenthesized if it binds looser than {@code minPrecedence}. */
  private String expr(Node n, int minPrecedence) {
    int precedence = precedence(n);
    String text = exprNoParens(n);
    return precedence < minPrecedence ? "(" + text + ")" : text;
  }

  private static int precedence(Node n) {
    switch (n.getToken()) {
      case IF_EXP:
        return PREC_TEST;
      case BOOL_OP:
        return n.getNode("op").getToken() == Token.OR ? PREC_OR : PREC_AND;
      case UNARY_OP:
        return n.getNode("op").getToken() == Token.NOT ? PREC_NOT : PREC_FACTOR;
      case COMPARE:
        return PREC_CMP;
      case BIN_OP:
        return binaryPrecedence(n.getNode("op").getToken());
      case STARRED:
        return PREC_ARITH;
      case CONSTANT:
        Object value = n.getValue("value");
        if ((value instanceof Long && (Long) value < 0)
            || (value instanceof Double && isNegative((Double) value))) {
          return PREC_FACTOR;
        }
        return PREC_ATOM;
      default:
        return PREC_ATOM;
    }
  }

  private static boolean isNegative(double value) {
    return value < 0 || (value == 0 && 1 / value < 0);
  }

  private static int binaryPrecedence(Token op) {
    switch (op) {
      case ADD:
      case SUB:
        return PREC_ARITH;
      case POW:
        return PREC_POWER;
      default:
        return PREC_TERM;
    }
  }

  private String exprNoParens(Node n) {
    switch (n.getToken()) {
      case BOOL_OP:
        {
          int prec = precedence(n);
          ImmutableList.Builder<String> parts = ImmutableList.builder();
          for (Node value : n.getChildren("values")) {
            parts.add(expr(value, prec + 1));
          }
          return String.join(" " + OPERATORS.get(n.getNode("op").getToken()) + " ", parts.build());
        }
      case BIN_OP:
        {
          Token op = n.getNode("op").getToken();
          int prec = binaryPrecedence(op);
          // ** groups to the right, everything else to the left.
          int leftPrec = op == Token.POW ? prec + 1 : prec;
          int rightPrec = op == Token.POW ? prec : prec + 1;
          return expr(n.getNode("left"), leftPrec)
              + " "
              + OPERATORS.get(op)
              + " "
              + expr(n.getNode("right"), rightPrec);
        }
      case UNARY_OP:
        return OPERATORS.get(n.getNode("op").getToken())
            + expr(n.getNode("operand"), precedence(n));
      case IF_EXP:
        return expr(n.getNode("body"), PREC_TEST + 1)
            + " if "
            + expr(n.getNode("test"), PREC_TEST + 1)
            + " else "
            + expr(n.getNode("orelse"), PREC_TEST);
      case DICT:
        {
          ImmutableList<Node> keys = n.getChildren("keys");
          ImmutableList<Node> values = n.getChildren("values");
          ImmutableList.Builder<String> entries = ImmutableList.builder();
          for (int i = 0; i < keys.size(); i++) {
            entries.add(expr(keys.get(i), PREC_TEST) + ": " + expr(values.get(i), PREC_TEST));
          }
          return "{" + String.join(", ", entries.build()) + "}";
        }
      case LIST_COMP:
        {
          StringBuilder sb = new StringBuilder("[").append(expr(n.getNode("elt"), PREC_TEST));
          for (Node generator : n.getChildren("generators")) {
            sb.append(generator.getLong("is_async") != 0 ? " async for " : " for ")
                .append(expr(generator.getNode("target"), PREC_TUPLE))
                .append(" in ")
                .append(expr(generator.getNode("iter"), PREC_TEST + 1));
            for (Node condition : generator.getChildren("ifs")) {
              sb.append(" if ").append(expr(condition, PREC_TEST + 1));
            }
          }
          return sb.append(']').toString();
        }
      case COMPARE:
        {
          StringBuilder sb = new StringBuilder(expr(n.getNode("left"), PREC_CMP + 1));
          ImmutableList<Node> ops = n.getChildren("ops");
          ImmutableList<Node> comparators = n.getChildren("comparators");
          for (int i = 0; i < ops.size(); i++) {
            sb.append(' ')
                .append(OPERATORS.get(ops.get(i).getToken()))
                .append(' ')
                .append(expr(comparators.get(i), PREC_CMP + 1));
          }
          return sb.toString();
        }
      case CALL:
        {
          ImmutableList.Builder<String> args = ImmutableList.builder();
          for (Node arg : n.getChildren("args")) {
            args.add(expr(arg, PREC_TEST));
          }
          for (Node keyword : n.getChildren("keywords")) {
            args.add(keyword(keyword));
          }
          return expr(n.getNode("func"), PREC_ATOM) + "(" + String.join(", ", args.build()) + ")";
        }
      case FORMATTED_VALUE:
      case JOINED_STR:
        return fString(n);
      case CONSTANT:
        return constant(n.getValue("value"));
      case ATTRIBUTE:
        {
          Node value = n.getNode("value");
          String object = expr(value, PREC_ATOM);
          if (value.isIntegerConstant() && !object.startsWith("(")) {
            // 1.real would lex as a float.
            object = "(" + object + ")";
          }
          return object + "." + n.getString("attr");
        }
      case SUBSCRIPT:
        return expr(n.getNode("value"), PREC_ATOM)
            + "["
            + expr(n.getNode("slice"), PREC_TUPLE)
            + "]";
      case STARRED:
        return "*" + expr(n.getNode("value"), PREC_ARITH);
      case NAME:
        return n.getString("id");
      case LIST:
        return "[" + joinElements(n.getChildren("elts")) + "]";
      case TUPLE:
        {
          ImmutableList<Node> elts = n.getChildren("elts");
          return elts.size() == 1
              ? "(" + expr(elts.get(0), PREC_TEST) + ",)"
              : "(" + joinElements(elts) + ")";
        }
      case SLICE:
        {
          Node lower = n.getNode("lower");
          Node upper = n.getNode("upper");
          Node step = n.getNode("step");
          String slice =
              (lower == null ? "" : expr(lower, PREC_TEST))
                  + ":"
                  + (upper == null ? "" : expr(upper, PREC_TEST));
          return step == null ? slice : slice + ":" + expr(step, PREC_TEST);
        }
      default:
        throw new IllegalStateException("Unexpected expression " + n.getToken());
    }
  }

  private String joinElements(List<Node> elts) {
    ImmutableList.Builder<String> parts = ImmutableList.builder();
    for (Node elt : elts) {
      parts.add(expr(elt, PREC_TEST));
    }
    return String.join(", ", parts.build());
  }

  private String keyword(Node keyword) {
    String arg = keyword.getString("arg");
    String value = expr(keyword.getNode("value"), PREC_TEST);
    return arg == null ? "**" + value : arg + "=" + value;
  }

  // ==========================================================================
  // Literals

  private String fString(Node n) {
    StringBuilder body = new StringBuilder();
    if (n.getToken() == Token.FORMATTED_VALUE) {
      appendReplacementField(body, n);
    } else {
      for (Node part : n.getChildren("values")) {
        if (part.getToken() == Token.FORMATTED_VALUE) {
          appendReplacementField(body, part);
        } else if (part.isConstant() && part.getValue("value") instanceof String) {
          body.append(
              escape((String) part.getValue("value"), '"').replace("{", "{{").replace("}", "}}"));
        } else {
          throw new IllegalStateException("Unexpected f-string part " + part);
        }
      }
    }
    return "f\"" + body + "\"";
  }

  private void appendReplacementField(StringBuilder sb, Node n) {
    String value = expr(n.getNode("value"), PREC_TEST + 1);
    sb.append('{');
    // A leading brace would read as an escaped one.
    if (value.startsWith("{")) {
      sb.append(' ');
    }
    sb.append(value);
    long conversion = n.getLong("conversion");
    if (conversion != -1) {
      sb.append('!').append((char) conversion);
    }
    Node formatSpec = n.getNode("format_spec");
    if (formatSpec != null) {
      String spec = fString(formatSpec);
      sb.append(':').append(spec, 2, spec.length() - 1);
    }
    sb.append('}');
  }

  private static String constant(@Nullable Object value) {
    if (value == null) {
      return "None";
    } else if (value instanceof Boolean) {
      return ((Boolean) value) ? "True" : "False";
    } else if (value instanceof String) {
      return stringRepr((String) value);
    } else if (value instanceof Double) {
      return floatRepr((Double) value);
    }
    return value.toString();
  }

  private static String floatRepr(double value) {
    if (Double.isNaN(value)) {
      return "(1e309 - 1e309)";
    } else if (Double.isInfinite(value)) {
      return value > 0 ? "1e309" : "-1e309";
    }
    return Double.toString(value).replace('E', 'e');
  }

  /** Quotes a string the way Python's repr() does. */
  static String stringRepr(String value) {
    char quote = value.indexOf('\'') >= 0 && value.indexOf('"') < 0 ? '"' : '\'';
    return quote + escape(value, quote) + quote;
  }

  private static String escape(String value, char quote) {
    StringBuilder sb = new StringBuilder(value.length() + 2);
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      switch (c) {
        case '\\':
          sb.append("\\\\");
          break;
        case '\n':
          sb.append("\\n");
          break;
        case '\r':
          sb.append("\\r");
          break;
        case '\t':
          sb.append("\\t");
          break;
        default:
          if (c == quote) {
            sb.append('\\').append(c);
          } else if (c < 0x20 || c == 0x7f) {
            sb.append(String.format("\\x%02x", (int) c));
          } else {
            sb.append(c);
          }
      }
    }
    return sb.toString();
  }
}
