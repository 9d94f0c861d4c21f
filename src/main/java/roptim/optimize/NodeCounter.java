package roptim.optimize;

import static org.jooq.lambda.Seq.seq;

import roptim.ast.Block;
import roptim.ast.Expression;
import roptim.ast.Program;
import roptim.ast.Statement;

/**
 * Counts the nodes of a tree: every program, statement, block, expression, call argument and
 * function parameter counts as one.
 */
public class NodeCounter
    implements Program.Visitor<Integer>,
        Statement.Visitor<Integer>,
        Expression.Visitor<Integer> {

  private static final NodeCounter INSTANCE = new NodeCounter();

  private NodeCounter() {}

  public static int count(Program program) {
    return program.acceptVisitor(INSTANCE);
  }

  @Override
  public Integer visitProgram(Program that) {
    return 1 + seq(that.statements).mapToInt(s -> s.acceptVisitor(this)).sum();
  }

  @Override
  public Integer visitBlock(Block that) {
    return 1 + seq(that.statements).mapToInt(s -> s.acceptVisitor(this)).sum();
  }

  @Override
  public Integer visitIf(Statement.If that) {
    return 1
        + that.condition.acceptVisitor(this)
        + that.then.acceptVisitor(this)
        + that.else_.map(e -> e.acceptVisitor(this)).orElse(0);
  }

  @Override
  public Integer visitWhile(Statement.While that) {
    return 1 + that.condition.acceptVisitor(this) + that.body.acceptVisitor(this);
  }

  @Override
  public Integer visitRepeat(Statement.Repeat that) {
    return 1 + that.body.acceptVisitor(this);
  }

  @Override
  public Integer visitFor(Statement.For that) {
    return 1 + that.sequence.acceptVisitor(this) + that.body.acceptVisitor(this);
  }

  @Override
  public Integer visitTerminator(Statement.Terminator that) {
    return 1 + that.payload.map(p -> p.acceptVisitor(this)).orElse(0);
  }

  @Override
  public Integer visitExpressionStatement(Statement.ExpressionStatement that) {
    return 1 + that.expression.acceptVisitor(this);
  }

  @Override
  public Integer visitBooleanLiteral(Expression.BooleanLiteral that) {
    return 1;
  }

  @Override
  public Integer visitNumericLiteral(Expression.NumericLiteral that) {
    return 1;
  }

  @Override
  public Integer visitStringLiteral(Expression.StringLiteral that) {
    return 1;
  }

  @Override
  public Integer visitNullLiteral(Expression.NullLiteral that) {
    return 1;
  }

  @Override
  public Integer visitVariable(Expression.Variable that) {
    return 1;
  }

  @Override
  public Integer visitBinaryOperator(Expression.BinaryOperator that) {
    return 1 + that.left.acceptVisitor(this) + that.right.acceptVisitor(this);
  }

  @Override
  public Integer visitUnaryOperator(Expression.UnaryOperator that) {
    return 1 + that.expression.acceptVisitor(this);
  }

  @Override
  public Integer visitCall(Expression.Call that) {
    return 1
        + that.function.acceptVisitor(this)
        + seq(that.arguments).mapToInt(a -> 1 + a.value.acceptVisitor(this)).sum();
  }

  @Override
  public Integer visitFunction(Expression.Function that) {
    return 1
        + seq(that.parameters)
            .mapToInt(p -> 1 + p.defaultValue.map(d -> d.acceptVisitor(this)).orElse(0))
            .sum()
        + that.body.acceptVisitor(this);
  }
}
