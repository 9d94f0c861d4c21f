package roptim;

import java.io.InputStream;
import java.util.Iterator;
import roptim.ast.Program;
import roptim.lexer.Lexer;
import roptim.optimize.DeadCodeElimination;
import roptim.optimize.OptimizationResult;
import roptim.optimize.Optimizer;
import roptim.optimize.OptimizerFramework;
import roptim.parser.Parser;
import roptim.token.Token;
import roptim.util.PrettyPrinter;

public class Compiler {

  public static Lexer lex(InputStream in) {
    return new Lexer(in);
  }

  public static Program parse(Iterator<Token> tokens) {
    return new Parser(tokens).parse();
  }

  public static Program lexAndParse(InputStream in) {
    return parse(lex(in));
  }

  /** A single, non-iterated run of dead-code elimination. */
  public static OptimizationResult eliminateDeadCode(Program program) {
    return new DeadCodeElimination().optimize(program);
  }

  public static OptimizerFramework defaultFramework() {
    Optimizer deadCodeElimination = new DeadCodeElimination();
    return new OptimizerFramework.Builder()
        .add(deadCodeElimination)
        .dependsOn(deadCodeElimination)
        .build();
  }

  public static Program optimize(Program program) {
    return defaultFramework().optimizeUntilFixedpoint(program);
  }

  public static CharSequence prettyPrint(Program ast) {
    return ast.acceptVisitor(new PrettyPrinter());
  }
}
