package roptim;

import static org.jooq.lambda.Seq.seq;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;
import com.google.common.base.Joiner;
import com.google.common.io.ByteStreams;
import com.google.common.io.CharStreams;
import com.google.common.primitives.Booleans;
import com.google.common.util.concurrent.ListenableFuture;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.AccessDeniedException;
import java.nio.file.FileSystem;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.event.Level;
import org.slf4j.impl.SimpleLogger;
import roptim.ast.Program;
import roptim.lexer.Lexer;
import roptim.optimize.BatchOptimizer;
import roptim.optimize.NodeCounter;
import roptim.optimize.OptimizationResult;
import roptim.token.Token;

public class Cli {

  static final String usage =
      Joiner.on(System.lineSeparator())
          .join(
              new String[] {
                "Usage: roptim [--echo|--lextest|--parsetest|--print-ast|--print-dce-stats] [--jobs N] [--verbosity N] [--help] file...",
                "",
                "  --echo             write file's content to stdout",
                "  --lextest          run lexical analysis on each file and print tokens to stdout",
                "  --parsetest        run syntactical analysis on each file",
                "  --print-ast        pretty-print the unoptimized syntax tree to stdout",
                "  --print-dce-stats  print node counts before and after dead-code elimination",
                "  --jobs|-j          number of files optimized in parallel",
                "  --verbosity|-v     Crank this up for more debug output",
                "  --help             display this help and exit",
                "",
                "  If no flag is given, the files are optimized and printed to stdout."
              });

  private final PrintStream out;
  private final PrintStream err;
  private final FileSystem fileSystem;

  Cli(OutputStream out, OutputStream err, FileSystem fileSystem) {
    this.out = new PrintStream(out);
    this.err = new PrintStream(err);
    this.fileSystem = fileSystem;
  }

  int run(String... args) {
    Parameters params = Parameters.parse(args);
    setLogLevel(params.verbosity);
    if (!params.valid()) {
      err.println("Called as: " + String.join(" ", args));
      err.println(usage);
      return 1;
    }
    if (params.help) {
      out.println(usage);
      return 0;
    }
    List<Path> paths = seq(params.files).map(f -> fileSystem.getPath(f)).toList();
    if (params.isOptimizing()) {
      return optimize(paths, params.jobs);
    }
    for (Path path : paths) {
      printHeaderIfNeeded(paths, path);
      boolean succeeded;
      if (params.echo) {
        succeeded = process(path, this::echo);
      } else if (params.lextest) {
        succeeded = process(path, this::lextest);
      } else if (params.parsetest) {
        succeeded = process(path, this::parsetest);
      } else if (params.printAst) {
        succeeded = process(path, this::printAst);
      } else {
        succeeded = process(path, this::printDeadCodeStats);
      }
      if (!succeeded) {
        return 1;
      }
    }
    return 0;
  }

  private void setLogLevel(int verbosity) {
    verbosity = Math.max(0, verbosity);
    verbosity = Math.min(Level.values().length - 1, verbosity);
    // SimpleLogger reads its configuration once, when the first logger is created
    String level = Level.values()[verbosity].toString();
    System.setProperty(SimpleLogger.DEFAULT_LOG_LEVEL_KEY, level);
  }

  private void printHeaderIfNeeded(List<Path> paths, Path path) {
    if (paths.size() > 1) {
      out.println("# " + path);
    }
  }

  /**
   * Runs {@code action} on the content of {@code path} and reports any error to {@link #err}.
   *
   * @return false if an error was reported
   */
  private boolean process(Path path, FileAction action) {
    try (InputStream in = Files.newInputStream(path)) {
      action.run(in);
      return true;
    } catch (RoptimError e) {
      reportError(path, e);
    } catch (AccessDeniedException e) {
      err.println("error: access to file '" + path + "' was denied");
    } catch (NoSuchFileException e) {
      err.println("error: file '" + path + "' doesn't exist");
    } catch (Throwable t) {
      // print full stacktrace for any other error
      // if a better description becomes necessary,
      // add a another more specific catch block
      t.printStackTrace(err);
    }
    return false;
  }

  private void reportError(Path path, RoptimError e) {
    try {
      err.println("error: " + e.getSourceReferencingMessage(Files.readAllLines(path)));
    } catch (IOException io) {
      err.println("error: " + e.getMessage());
    }
  }

  private void echo(InputStream in) throws IOException {
    ByteStreams.copy(in, out);
  }

  private void lextest(InputStream in) {
    Lexer lexer = Compiler.lex(in);
    seq(lexer).map(Token::toString).forEach(out::println);
  }

  private void parsetest(InputStream in) {
    Compiler.lexAndParse(in);
  }

  private void printAst(InputStream in) {
    Program ast = Compiler.lexAndParse(in);
    out.print(Compiler.prettyPrint(ast));
  }

  private void printDeadCodeStats(InputStream in) {
    Program ast = Compiler.lexAndParse(in);
    OptimizationResult result = Compiler.eliminateDeadCode(ast);
    out.println(
        NodeCounter.count(ast)
            + " -> "
            + NodeCounter.count(result.program)
            + (result.changed ? " (changed)" : " (unchanged)"));
  }

  /**
   * Reads all files up front, then optimizes them in parallel. Results are printed in argument
   * order; the first file that fails stops the output.
   */
  private int optimize(List<Path> paths, int jobs) {
    List<String> sources = new ArrayList<>(paths.size());
    for (Path path : paths) {
      if (!process(path, in -> sources.add(readUtf8(in)))) {
        return 1;
      }
    }
    try (BatchOptimizer batch = new BatchOptimizer(Compiler.defaultFramework(), jobs)) {
      List<ListenableFuture<String>> results = batch.submitAll(sources);
      for (int i = 0; i < paths.size(); i++) {
        printHeaderIfNeeded(paths, paths.get(i));
        try {
          out.print(BatchOptimizer.await(results.get(i)));
        } catch (RoptimError e) {
          reportError(paths.get(i), e);
          return 1;
        }
      }
    }
    return 0;
  }

  private static String readUtf8(InputStream in) throws IOException {
    return CharStreams.toString(new InputStreamReader(in, StandardCharsets.UTF_8));
  }

  private interface FileAction {
    void run(InputStream in) throws IOException;
  }

  private static class Parameters {
    private Parameters() {}

    /** True if the --echo option was set */
    @Parameter(names = "--echo")
    boolean echo;

    /** True if the --lextest option was set */
    @Parameter(names = "--lextest")
    boolean lextest;

    /** True if the --parsetest option was set */
    @Parameter(names = "--parsetest")
    boolean parsetest;

    /** True if the --print-ast option was set */
    @Parameter(names = "--print-ast")
    boolean printAst;

    /** True if the --print-dce-stats option was set */
    @Parameter(names = "--print-dce-stats")
    boolean printDeadCodeStats;

    @Parameter(names = {"--jobs", "-j"})
    Integer jobs = Runtime.getRuntime().availableProcessors();

    @Parameter(names = {"--verbosity", "-v"})
    Integer verbosity = 0;

    /** True if the --help option was set */
    @Parameter(names = "--help")
    boolean help;

    /** The paths of the files to process, possibly relative to the current working directory */
    @Parameter List<String> files = new ArrayList<>();

    // set to true, if parsing arguments failed
    private boolean invalid;

    boolean isOptimizing() {
      return Booleans.countTrue(echo, lextest, parsetest, printAst, printDeadCodeStats) == 0;
    }

    /** Returns true if the parameter values represent a valid set */
    boolean valid() {
      return !invalid
          && (help
              || ((Booleans.countTrue(echo, lextest, parsetest, printAst, printDeadCodeStats)
                      <= 1)
                  && !files.isEmpty()
                  // unknown options end up here as well
                  && seq(files).noneMatch(f -> f.startsWith("-"))
                  && jobs > 0
                  && (!echo || files.size() == 1)));
    }

    static Parameters parse(String... args) {
      Parameters params = new Parameters();
      try {
        JCommander.newBuilder().addObject(params).build().parse(args);
      } catch (ParameterException e) {
        params.invalid = true;
      }
      return params;
    }
  }
}
