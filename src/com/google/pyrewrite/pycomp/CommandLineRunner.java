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

import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Splitter;
import com.google.gson.JsonParseException;
import com.google.pyrewrite.ast.Node;
import com.google.pyrewrite.pycomp.serialization.JsonMappings;
import com.google.pyrewrite.pycomp.serialization.MappingRewrites;
import com.google.pyrewrite.pycomp.serialization.NodeCodec;
import com.google.pyrewrite.pycomp.serialization.ReconstructionException;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.Reader;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Pattern;
import org.jspecify.annotations.Nullable;
import org.kohsuke.args4j.CmdLineException;
import org.kohsuke.args4j.CmdLineParser;
import org.kohsuke.args4j.Option;
import org.kohsuke.args4j.spi.BooleanOptionHandler;

/**
 * CommandLineRunner reads the mapping form of a Python module as JSON, rewrites it and writes the
 * result as JSON, as Python source, or as Markdown documentation of its functions.
 *
 * <p>Mapping-form edits ({@code --rename_function}, {@code --add_logging}, {@code
 * --replace_constant}, {@code --remove_statements}) are applied first, in that order, then the tree
 * is decoded and run through {@link Rewriter}.
 *
 * <p>Exit status: 0 on success, 1 for bad flags or options, 2 for input that cannot be read or
 * decoded.
 */
public class CommandLineRunner {

  /** Held so the level set on it is not lost to garbage collection. */
  private static final Logger packageLogger = Logger.getLogger("com.google.pyrewrite");

  private static final String DIGITS = "[0-9](?:_?[0-9])*";
  private static final Pattern INTEGER_LITERAL = Pattern.compile("[+-]?" + DIGITS);
  private static final Pattern FLOAT_LITERAL =
      Pattern.compile(
          String.format("[+-]?(?:(?:%1$s)?\\.%1$s|%1$s\\.?)(?:[eE][+-]?%1$s)?", DIGITS));

  static final int EXIT_OK = 0;
  static final int EXIT_BAD_FLAGS = 1;
  static final int EXIT_BAD_INPUT = 2;

  /** The output formats of the rewritten tree. */
  enum OutputFormat {
    JSON,
    SOURCE,
    MARKDOWN
  }

  private static class Flags {
    @Option(
        name = "--help",
        handler = BooleanOptionHandler.class,
        usage = "Displays this message on stdout and exit")
    private boolean displayHelp = false;

    @Option(
        name = "--input",
        usage = "The JSON file holding the module to rewrite, or - for stdin")
    private String input = "-";

    @Option(
        name = "--config",
        usage = "A JSON file of rewrite options: passes, unroll factor, call migrations and"
            + " risky calls")
    private String config = "";

    @Option(
        name = "--pass",
        usage = "A rewrite pass to run: migrate_calls, inject_guards or unroll_loops. You may"
            + " specify multiple. Default: all of them")
    private List<String> passes = new ArrayList<>();

    @Option(
        name = "--unroll_factor",
        usage = "The number of body copies per step of an unrolled loop (1 to 64)")
    private @Nullable Integer unrollFactor = null;

    @Option(
        name = "--rename_function",
        usage = "Renames a function before rewriting, given as old:new. You may specify multiple")
    private List<String> renameFunction = new ArrayList<>();

    @Option(
        name = "--add_logging",
        usage = "Adds print(\"<message>: <name>\") at the start of every function")
    private @Nullable String addLogging = null;

    @Option(
        name = "--replace_constant",
        usage = "Replaces a constant before rewriting, given as old=new. Values are Python"
            + " literals: None, True, False, numbers, or text. You may specify multiple")
    private List<String> replaceConstant = new ArrayList<>();

    @Option(
        name = "--remove_statements",
        usage = "Removes statements of a kind (e.g. Pass, Expr, Import) before rewriting. You may"
            + " specify multiple")
    private List<String> removeStatements = new ArrayList<>();

    @Option(
        name = "--output_format",
        usage = "The output: JSON, SOURCE, or MARKDOWN documentation of the functions")
    private OutputFormat outputFormat = OutputFormat.JSON;

    @Option(
        name = "--logging_level",
        usage = "The logging level (standard java.util.logging.Level values) for rewrite"
            + " progress")
    private String loggingLevel = Level.WARNING.getName();
  }

  private final Flags flags = new Flags();
  private final CmdLineParser parser = new CmdLineParser(flags);
  private final String[] args;
  private final InputStream in;
  private final PrintStream out;
  private final PrintStream err;

  @VisibleForTesting
  CommandLineRunner(String[] args, InputStream in, PrintStream out, PrintStream err) {
    this.args = args.clone();
    this.in = in;
    this.out = out;
    this.err = err;
  }

  public static void main(String[] args) {
    CommandLineRunner runner = new CommandLineRunner(args, System.in, System.out, System.err);
    System.exit(runner.run());
  }

  /** Runs the rewrite and returns the exit status. */
  public int run() {
    RewriteOptions options;
    try {
      parser.parseArgument(args);
      if (flags.displayHelp) {
        printUsage(out);
        return EXIT_OK;
      }
      setLoggingLevel(Level.parse(flags.loggingLevel));
      options = createOptions();
      options.validate();
      for (String type : flags.removeStatements) {
        if (!MappingRewrites.getStatementTypes().contains(type)) {
          throw new InvalidOptionsException("'%s' is not a statement type", type);
        }
      }
    } catch (CmdLineException | InvalidOptionsException | IllegalArgumentException e) {
      err.println("ERROR - " + e.getMessage());
      printUsage(err);
      return EXIT_BAD_FLAGS;
    } catch (IOException e) {
      err.println("ERROR - cannot read " + flags.config + ": " + e.getMessage());
      return EXIT_BAD_FLAGS;
    }

    Node tree;
    try {
      Map<String, Object> mapping = readInput();
      mapping = applyMappingRewrites(mapping);
      tree = NodeCodec.decode(mapping);
      tree = new Rewriter(options).rewrite(tree);
    } catch (InvalidOptionsException e) {
      err.println("ERROR - " + e.getMessage());
      return EXIT_BAD_FLAGS;
    } catch (IOException | JsonParseException e) {
      err.println("ERROR - cannot read input: " + e.getMessage());
      return EXIT_BAD_INPUT;
    } catch (ReconstructionException e) {
      err.println("ERROR - malformed tree at " + e.getMessage());
      return EXIT_BAD_INPUT;
    } catch (IllegalStateException e) {
      err.println("ERROR - invalid tree: " + e.getMessage());
      return EXIT_BAD_INPUT;
    }

    try {
      writeOutput(tree);
    } catch (IOException e) {
      err.println("ERROR - cannot write output: " + e.getMessage());
      return EXIT_BAD_INPUT;
    }
    return EXIT_OK;
  }

  private RewriteOptions createOptions() throws IOException {
    RewriteOptions options = RewriteOptions.createDefault();
    if (!flags.config.isEmpty()) {
      try (Reader reader = Files.newBufferedReader(Paths.get(flags.config), UTF_8)) {
        ConfigFile.apply(reader, options);
      }
    }
    if (!flags.passes.isEmpty()) {
      EnumSet<RewriteOptions.Pass> enabled = EnumSet.noneOf(RewriteOptions.Pass.class);
      for (String pass : flags.passes) {
        enabled.add(RewriteOptions.Pass.fromFlagName(pass));
      }
      options.setEnabledPasses(enabled);
    }
    if (flags.unrollFactor != null) {
      options.setUnrollFactor(flags.unrollFactor);
    }
    return options;
  }

  private Map<String, Object> readInput() throws IOException {
    if (flags.input.equals("-")) {
      return JsonMappings.read(new InputStreamReader(in, UTF_8));
    }
    return JsonMappings.read(Files.newBufferedReader(Paths.get(flags.input), UTF_8));
  }

  private Map<String, Object> applyMappingRewrites(Map<String, Object> mapping) {
    Map<String, Object> result = mapping;
    for (String rename : flags.renameFunction) {
      List<String> names = Splitter.on(':').splitToList(rename);
      if (names.size() != 2 || names.get(0).isEmpty() || names.get(1).isEmpty()) {
        throw new InvalidOptionsException("Bad --rename_function value '%s'", rename);
      }
      result = MappingRewrites.renameFunction(result, names.get(0), names.get(1));
    }
    if (flags.addLogging != null) {
      result = MappingRewrites.addLogging(result, flags.addLogging);
    }
    for (String replacement : flags.replaceConstant) {
      int separator = replacement.indexOf('=');
      if (separator < 0) {
        throw new InvalidOptionsException("Bad --replace_constant value '%s'", replacement);
      }
      result =
          MappingRewrites.replaceConstant(
              result,
              parseLiteral(replacement.substring(0, separator)),
              parseLiteral(replacement.substring(separator + 1)));
    }
    for (String type : flags.removeStatements) {
      result = MappingRewrites.removeStatements(result, type);
    }
    return result;
  }

  /**
   * Parses a Python literal: None, True, False, a decimal integer, a float, or else plain text.
   * Numbers follow Python's syntax, with an optional sign and {@code _} between digits.
   */
  @VisibleForTesting
  static @Nullable Object parseLiteral(String text) {
    switch (text) {
      case "None":
        return null;
      case "True":
        return true;
      case "False":
        return false;
      default:
        break;
    }
    if (INTEGER_LITERAL.matcher(text).matches()) {
      try {
        return Long.parseLong(text.replace("_", ""));
      } catch (NumberFormatException e) {
        throw new InvalidOptionsException("Integer out of range: %s", text);
      }
    }
    if (FLOAT_LITERAL.matcher(text).matches()) {
      return Double.parseDouble(text.replace("_", ""));
    }
    if (text.length() >= 2
        && (text.charAt(0) == '"' || text.charAt(0) == '\'')
        && text.charAt(text.length() - 1) == text.charAt(0)) {
      return text.substring(1, text.length() - 1);
    }
    return text;
  }

  private void writeOutput(Node tree) throws IOException {
    Writer writer = new OutputStreamWriter(out, UTF_8);
    switch (flags.outputFormat) {
      case JSON:
        JsonMappings.write(NodeCodec.encode(tree), writer, true);
        writer.write('\n');
        break;
      case SOURCE:
        writer.write(CodePrinter.print(tree));
        break;
      case MARKDOWN:
        writer.write(FunctionDocGenerator.generate(tree));
        writer.write('\n');
        break;
    }
    writer.flush();
  }

  private static void setLoggingLevel(Level level) {
    packageLogger.setLevel(level);
    for (Handler handler : Logger.getLogger("").getHandlers()) {
      if (handler.getLevel().intValue() > level.intValue()) {
        handler.setLevel(level);
      }
    }
  }

  private void printUsage(PrintStream stream) {
    stream.println("Usage: java -jar pyrewrite.jar [options...]");
    parser.printUsage(stream);
    stream.flush();
  }
}
