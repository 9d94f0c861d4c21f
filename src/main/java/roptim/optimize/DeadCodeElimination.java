package roptim.optimize;

import static org.jooq.lambda.Seq.seq;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import roptim.ast.Block;
import roptim.ast.Expression;
import roptim.ast.Program;
import roptim.ast.Statement;
import roptim.util.Either;

/**
 * Removes statically dead code from a program in a single post-order pass:
 *
 * <ul>
 *   <li>statements following a {@code return(...)}, {@code break} or {@code next} in the same
 *       block,
 *   <li>{@code if} statements with a literal {@code TRUE}/{@code FALSE} condition, which are
 *       replaced by the statements of the taken branch,
 *   <li>{@code while (FALSE)} loops.
 * </ul>
 *
 * <p>A collapsed {@code if} is spliced into the enclosing block rather than nested, so that a
 * terminator at the end of the taken branch also cuts off the rest of the enclosing block within
 * the same pass. Because of this the pass is idempotent.
 *
 * <p>Conditions are not evaluated beyond literal booleans (see {@link LiteralEvaluator}) and
 * {@code while (TRUE)} is left alone: whether it terminates depends on the {@code break}s in its
 * body. The pass assumes that {@code return}, {@code break} and {@code next} are never rebound by
 * the program.
 *
 * <p>Instances hold no state and may be shared between threads.
 */
public class DeadCodeElimination implements Optimizer {
  private static final Logger LOGGER = LoggerFactory.getLogger("DeadCodeElimination");

  private final StatementRewriter statementRewriter = new StatementRewriter();
  private final FunctionRewriter functionRewriter = new FunctionRewriter();

  /**
   * Rewrites every top-level statement of {@code program}. The top level is treated like a block,
   * so statements following a top-level terminator are dropped as well.
   *
   * @return the rewritten program; {@code changed} iff it has fewer nodes than {@code program}
   */
  @Override
  public OptimizationResult optimize(Program program) {
    int nodesBefore = NodeCounter.count(program);
    Program rewritten = new Program(rewriteStatements(program.statements), program.range());
    int nodesAfter = NodeCounter.count(rewritten);
    LOGGER.debug("Reduced node count from {} to {}", nodesBefore, nodesAfter);
    return new OptimizationResult(rewritten, nodesAfter < nodesBefore);
  }

  /**
   * Rewrites each statement of {@code block} in order, splicing in the statements of collapsed
   * conditionals and nested blocks, and stops right after the first terminator.
   */
  public Block rewriteBlock(Block block) {
    return new Block(rewriteStatements(block.statements), block.range());
  }

  private List<Statement> rewriteStatements(List<Statement> statements) {
    List<Statement> result = new ArrayList<>(statements.size());
    for (int i = 0; i < statements.size(); i++) {
      List<Statement> produced =
          rewriteStatement(statements.get(i))
              .<List<Statement>>fold(s -> ImmutableList.of(s), b -> b.statements);
      for (Statement statement : produced) {
        result.add(statement);
        if (statement instanceof Statement.Terminator) {
          logTruncation((Statement.Terminator) statement, statements.size() - i - 1);
          return result;
        }
      }
    }
    return result;
  }

  private static void logTruncation(Statement.Terminator terminator, int dropped) {
    if (dropped > 0) {
      LOGGER.debug(
          "Dropping {} unreachable statement(s) after {} at {}",
          dropped,
          terminator.kind.string,
          terminator.range());
    }
  }

  /**
   * Rewrites a single statement. The result is either a statement to be put in place of {@code
   * statement} or a block whose statements are to be spliced into the enclosing block instead.
   */
  public Either<Statement, Block> rewriteStatement(Statement statement) {
    return statement.acceptVisitor(statementRewriter);
  }

  private Expression rewriteExpression(Expression expression) {
    return expression.acceptVisitor(functionRewriter);
  }

  private class StatementRewriter implements Statement.Visitor<Either<Statement, Block>> {

    @Override
    public Either<Statement, Block> visitBlock(Block that) {
      return Either.right(rewriteBlock(that));
    }

    @Override
    public Either<Statement, Block> visitIf(Statement.If that) {
      Expression condition = rewriteExpression(that.condition);
      Block then = rewriteBlock(that.then);
      Optional<Block> else_ = that.else_.map(DeadCodeElimination.this::rewriteBlock);
      switch (LiteralEvaluator.evaluate(condition)) {
        case LITERAL_TRUE:
          LOGGER.debug("Replacing if (TRUE) at {} by its then branch", that.range());
          return Either.right(then);
        case LITERAL_FALSE:
          LOGGER.debug("Replacing if (FALSE) at {} by its else branch", that.range());
          return Either.right(else_.orElse(Block.empty(that.range())));
        default:
          return Either.left(new Statement.If(condition, then, else_.orElse(null), that.range()));
      }
    }

    @Override
    public Either<Statement, Block> visitWhile(Statement.While that) {
      Expression condition = rewriteExpression(that.condition);
      Block body = rewriteBlock(that.body);
      // while (TRUE) stays: the loop may still be left through a break in its body
      if (LiteralEvaluator.evaluate(condition) == LiteralEvaluator.Literal.LITERAL_FALSE) {
        LOGGER.debug("Removing while (FALSE) at {}", that.range());
        return Either.right(Block.empty(that.range()));
      }
      return Either.left(new Statement.While(condition, body, that.range()));
    }

    @Override
    public Either<Statement, Block> visitRepeat(Statement.Repeat that) {
      return Either.left(new Statement.Repeat(rewriteBlock(that.body), that.range()));
    }

    @Override
    public Either<Statement, Block> visitFor(Statement.For that) {
      return Either.left(
          new Statement.For(
              that.variable,
              rewriteExpression(that.sequence),
              rewriteBlock(that.body),
              that.range()));
    }

    @Override
    public Either<Statement, Block> visitTerminator(Statement.Terminator that) {
      if (!that.payload.isPresent()) {
        return Either.left(that);
      }
      Expression payload = rewriteExpression(that.payload.get());
      if (payload == that.payload.get()) {
        return Either.left(that);
      }
      return Either.left(new Statement.Terminator(that.kind, payload, that.range()));
    }

    @Override
    public Either<Statement, Block> visitExpressionStatement(Statement.ExpressionStatement that) {
      Expression expression = rewriteExpression(that.expression);
      if (expression == that.expression) {
        return Either.left(that);
      }
      return Either.left(new Statement.ExpressionStatement(expression, that.range()));
    }
  }

  /**
   * Finds the function definitions nested in an expression and rewrites their bodies. Returns
   * the very same instance for expressions that contain no function definition.
   */
  private class FunctionRewriter implements Expression.Visitor<Expression> {

    @Override
    public Expression visitBooleanLiteral(Expression.BooleanLiteral that) {
      return that;
    }

    @Override
    public Expression visitNumericLiteral(Expression.NumericLiteral that) {
      return that;
    }

    @Override
    public Expression visitStringLiteral(Expression.StringLiteral that) {
      return that;
    }

    @Override
    public Expression visitNullLiteral(Expression.NullLiteral that) {
      return that;
    }

    @Override
    public Expression visitVariable(Expression.Variable that) {
      return that;
    }

    @Override
    public Expression visitBinaryOperator(Expression.BinaryOperator that) {
      Expression left = that.left.acceptVisitor(this);
      Expression right = that.right.acceptVisitor(this);
      if (left == that.left && right == that.right) {
        return that;
      }
      return new Expression.BinaryOperator(that.op, left, right, that.range());
    }

    @Override
    public Expression visitUnaryOperator(Expression.UnaryOperator that) {
      Expression expression = that.expression.acceptVisitor(this);
      if (expression == that.expression) {
        return that;
      }
      return new Expression.UnaryOperator(that.op, expression, that.range());
    }

    @Override
    public Expression visitCall(Expression.Call that) {
      Expression function = that.function.acceptVisitor(this);
      List<Expression.Argument> arguments =
          seq(that.arguments).map(this::rewriteArgument).toList();
      boolean argumentsUnchanged =
          seq(arguments).zip(that.arguments).allMatch(t -> t.v1 == t.v2);
      if (function == that.function && argumentsUnchanged) {
        return that;
      }
      return new Expression.Call(function, arguments, that.range());
    }

    private Expression.Argument rewriteArgument(Expression.Argument argument) {
      Expression value = argument.value.acceptVisitor(this);
      if (value == argument.value) {
        return argument;
      }
      return new Expression.Argument(argument.name.orElse(null), value);
    }

    @Override
    public Expression visitFunction(Expression.Function that) {
      List<Expression.Parameter> parameters =
          seq(that.parameters).map(this::rewriteParameter).toList();
      return new Expression.Function(parameters, rewriteBlock(that.body), that.range());
    }

    private Expression.Parameter rewriteParameter(Expression.Parameter parameter) {
      if (!parameter.defaultValue.isPresent()) {
        return parameter;
      }
      Expression defaultValue = parameter.defaultValue.get().acceptVisitor(this);
      if (defaultValue == parameter.defaultValue.get()) {
        return parameter;
      }
      return new Expression.Parameter(parameter.name, defaultValue);
    }
  }
}
