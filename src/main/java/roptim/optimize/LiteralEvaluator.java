package roptim.optimize;

import roptim.ast.Expression;

/**
 * Recognizes the literal conditions {@code TRUE} and {@code FALSE}. Nothing else is evaluated:
 * {@code !FALSE}, {@code a && TRUE} or a variable known to hold {@code TRUE} are all {@link
 * Literal#NOT_LITERAL}. Folding those is left to passes that run earlier in the pipeline.
 */
public class LiteralEvaluator implements Expression.Visitor<LiteralEvaluator.Literal> {

  private static final LiteralEvaluator INSTANCE = new LiteralEvaluator();

  private LiteralEvaluator() {}

  public static Literal evaluate(Expression expression) {
    return expression.acceptVisitor(INSTANCE);
  }

  public enum Literal {
    LITERAL_TRUE,
    LITERAL_FALSE,
    NOT_LITERAL
  }

  @Override
  public Literal visitBooleanLiteral(Expression.BooleanLiteral that) {
    return that.literal ? Literal.LITERAL_TRUE : Literal.LITERAL_FALSE;
  }

  @Override
  public Literal visitNumericLiteral(Expression.NumericLiteral that) {
    return Literal.NOT_LITERAL;
  }

  @Override
  public Literal visitStringLiteral(Expression.StringLiteral that) {
    return Literal.NOT_LITERAL;
  }

  @Override
  public Literal visitNullLiteral(Expression.NullLiteral that) {
    return Literal.NOT_LITERAL;
  }

  @Override
  public Literal visitVariable(Expression.Variable that) {
    return Literal.NOT_LITERAL;
  }

  @Override
  public Literal visitBinaryOperator(Expression.BinaryOperator that) {
    return Literal.NOT_LITERAL;
  }

  @Override
  public Literal visitUnaryOperator(Expression.UnaryOperator that) {
    return Literal.NOT_LITERAL;
  }

  @Override
  public Literal visitCall(Expression.Call that) {
    return Literal.NOT_LITERAL;
  }

  @Override
  public Literal visitFunction(Expression.Function that) {
    return Literal.NOT_LITERAL;
  }
}
